package io.github.goodees.esbus.store.jdbc;

/*-
 * #%L
 * esbus
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.esbus.CommandBusException;
import io.github.goodees.esbus.aggregate.AggregateType;
import io.github.goodees.esbus.store.AbstractEventStore;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.store.JacksonSerialization;
import io.github.goodees.esbus.store.Serialization;
import io.github.goodees.esbus.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Event store over a relational database. A commit is a single local transaction. Losing the race for the stream
 * position row to another process, be it by a stale position or by a key collision, repeats the whole transaction up to
 * {@code maxAttempts} times. An aggregate that was advanced by someone else is never retried, the commit fails with
 * {@code CONCURRENCY} fault.
 */
public class JdbcEventStore extends AbstractEventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<Map<String, Object>> payloads;
    private final TxHandler txHandler;
    private final int maxAttempts;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema) {
        this(dataSource, schema, true, Tracer.NONE);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, boolean snapshots, Tracer tracer) {
        super(snapshots, tracer);
        this.dataSource = dataSource;
        this.schema = schema;
        this.payloads = JacksonSerialization.payloads();
        this.txHandler = LOCAL_TRANSACTION;
        this.maxAttempts = DEFAULT_MAX_ATTEMPTS;
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, boolean snapshots, Tracer tracer,
            Supplier<String> idGenerator, Executor commitExecutor, int maxAttempts) {
        super(snapshots, tracer, idGenerator, commitExecutor);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is needed");
        }
        this.dataSource = dataSource;
        this.schema = schema;
        this.payloads = JacksonSerialization.payloads();
        this.txHandler = LOCAL_TRANSACTION;
        this.maxAttempts = maxAttempts;
    }

    @Override
    protected StoredSnapshot readSnapshot(String tenant, AggregateType<?> type, String aggregateId)
            throws CommandBusException {
        String path = snapshotPath(tenant, type, aggregateId);
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectSnapshot(connection, path);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readSnapshot(rs) : null;
        } catch (SQLException e) {
            throw CommandBusException.storeFailed("Reading snapshot " + path, e);
        }
    }

    @Override
    protected List<EventRecord> readEvents(String tenant, AggregateType<?> type, String aggregateId,
            String fromPaddedVersion) throws CommandBusException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectAggregateEvents(connection, tenant, type.getName(), aggregateId,
                    fromPaddedVersion);
                ResultSet rs = st.executeQuery()) {
            return readRecords(rs);
        } catch (SQLException e) {
            throw CommandBusException.storeFailed("Reading events of " + type.getName() + " " + aggregateId, e);
        }
    }

    private List<EventRecord> readRecords(ResultSet rs) throws SQLException {
        List<EventRecord> result = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> payload = payloads.deserialize(schema.readEventPayloadVersion(rs),
                schema.readEventPayload(rs), "event");
            result.add(schema.readEvent(rs, payload));
        }
        return result;
    }

    @Override
    protected List<EventRecord> commit(Commit commit) throws CommandBusException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            List<EventRecord> records = tryCommit(commit);
            if (records != null) {
                return records;
            }
            logger.debug("Commit of {} {} lost race for stream {} on attempt {}", commit.getAggregateType(),
                commit.getAggregateId(), commit.getStreamName(), attempt);
        }
        throw CommandBusException.contention("Commit of " + commit.getAggregateType() + " "
                + commit.getAggregateId(), maxAttempts);
    }

    /**
     * Run single transaction of a commit.
     * @return the records, or null when the transaction lost a race and should be repeated
     */
    private List<EventRecord> tryCommit(Commit commit) throws CommandBusException {
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                List<EventRecord> records = writeCommit(connection, commit);
                if (records == null) {
                    txHandler.rollback(connection);
                } else {
                    txHandler.commit(connection);
                }
                return records;
            } catch (SQLException e) {
                txHandler.rollback(connection);
                if (schema.isTransient(e)) {
                    logger.debug("Transient failure of commit of {} {}", commit.getAggregateType(),
                        commit.getAggregateId(), e);
                    return null;
                }
                throw e;
            } catch (CommandBusException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw CommandBusException.storeFailed("Commit of " + commit.getAggregateType() + " "
                    + commit.getAggregateId(), e);
        }
    }

    private List<EventRecord> writeCommit(Connection connection, Commit commit) throws SQLException,
            CommandBusException {
        long position = readOrCreateStreamPosition(connection, commit.getTenant(), commit.getStreamName());
        checkAggregateVersion(connection, commit);
        List<EventRecord> records = commit.toRecords(position);
        try (PreparedStatement insert = schema.insertEvent(connection)) {
            for (EventRecord record : records) {
                schema.prepareInsert(insert, commit.getTenant(), commit.getStreamName(), record,
                    payloads.payloadVersion(record.getPayload()), payloads.serialize(record.getPayload()));
                insert.addBatch();
            }
            insert.executeBatch();
        }
        try (PreparedStatement update = schema.updateStreamPosition(connection, commit.getTenant(),
            commit.getStreamName(), position, position + records.size())) {
            if (update.executeUpdate() != 1) {
                return null;
            }
        }
        if (commit.getSnapshot() != null) {
            storeSnapshot(connection, commit.getSnapshotPath(), commit.getSnapshot());
        }
        return records;
    }

    private long readOrCreateStreamPosition(Connection connection, String tenant, String stream)
            throws SQLException {
        try (PreparedStatement select = schema.selectStreamPosition(connection, tenant, stream);
                ResultSet rs = select.executeQuery()) {
            if (rs.next()) {
                return schema.readStreamPosition(rs);
            }
        }
        try (PreparedStatement create = schema.createStreamPosition(connection, tenant, stream, -1)) {
            create.executeUpdate();
        }
        return -1;
    }

    private void checkAggregateVersion(Connection connection, Commit commit) throws SQLException,
            CommandBusException {
        try (PreparedStatement select = schema.selectNewerEvents(connection, commit.getTenant(),
            commit.getAggregateType(), commit.getAggregateId(), commit.getPaddedExpectedVersion());
                ResultSet rs = select.executeQuery()) {
            if (rs.next()) {
                throw CommandBusException.concurrency(commit.getAggregateId(), commit.getExpectedVersion());
            }
        }
    }

    private void storeSnapshot(Connection connection, String path, StoredSnapshot snapshot) throws SQLException {
        try (PreparedStatement update = schema.updateSnapshot(connection, path, snapshot)) {
            if (update.executeUpdate() == 1) {
                return;
            }
        }
        try (PreparedStatement insert = schema.insertSnapshot(connection, path, snapshot)) {
            insert.executeUpdate();
        }
    }

    @Override
    public long streamPosition(String tenant, String stream) throws CommandBusException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectStreamPosition(connection, tenant, stream);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readStreamPosition(rs) : -1;
        } catch (SQLException e) {
            throw CommandBusException.storeFailed("Reading position of stream " + stream, e);
        }
    }

    @Override
    public List<EventRecord> readStream(String tenant, String stream, long afterPosition, int limit)
            throws CommandBusException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectStreamEvents(connection, tenant, stream, afterPosition, limit);
                ResultSet rs = st.executeQuery()) {
            return readRecords(rs);
        } catch (SQLException e) {
            throw CommandBusException.storeFailed("Reading stream " + stream, e);
        }
    }

    @Override
    public Map<String, Long> readCursors(String tenant, String stream) throws CommandBusException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = schema.selectCursors(connection, tenant, stream);
                ResultSet rs = st.executeQuery()) {
            Map<String, Long> result = new HashMap<>();
            while (rs.next()) {
                result.put(schema.readCursorHandler(rs), schema.readCursorPosition(rs));
            }
            return result;
        } catch (SQLException e) {
            throw CommandBusException.storeFailed("Reading cursors of stream " + stream, e);
        }
    }

    @Override
    public boolean commitCursor(String tenant, String stream, String handler, long expected, long position)
            throws CommandBusException {
        if (position < expected) {
            return false;
        }
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = expected < 0
                        ? schema.insertCursor(connection, tenant, stream, handler, position)
                        : schema.updateCursor(connection, tenant, stream, handler, expected, position)) {
            return st.executeUpdate() == 1;
        } catch (SQLException e) {
            if (expected < 0 && schema.isTransient(e)) {
                logger.debug("Cursor of {} on stream {} was created concurrently", handler, stream);
                return false;
            }
            throw CommandBusException.storeFailed("Storing cursor of " + handler, e);
        }
    }

    interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    private static final TxHandler LOCAL_TRANSACTION = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };
}
