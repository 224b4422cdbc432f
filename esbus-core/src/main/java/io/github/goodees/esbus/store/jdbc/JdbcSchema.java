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

import io.github.goodees.esbus.store.AbstractEventStore;
import io.github.goodees.esbus.store.EventRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

/**
 * SQL dialect of {@link JdbcEventStore}. Creates the statements the store executes and reads their results, so that
 * table layout can be adapted to existing databases.
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamPosition(Connection connection, String tenant, String stream)
            throws SQLException;

    protected abstract PreparedStatement createStreamPosition(Connection connection, String tenant, String stream,
            long position) throws SQLException;

    protected abstract long readStreamPosition(ResultSet rs) throws SQLException;

    /**
     * Move stream position, only if it still is at the position read earlier in the transaction.
     */
    protected abstract PreparedStatement updateStreamPosition(Connection connection, String tenant, String stream,
            long fromPosition, long toPosition) throws SQLException;

    /**
     * Select events of an aggregate with padded version strictly greater than given one.
     */
    protected abstract PreparedStatement selectNewerEvents(Connection connection, String tenant, String aggregateType,
            String aggregateId, String paddedVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, String tenant, String stream,
            EventRecord event, int payloadVersion, String payload) throws SQLException;

    /**
     * Select events of an aggregate with padded version greater or equal to given one, ordered by version.
     */
    protected abstract PreparedStatement selectAggregateEvents(Connection connection, String tenant,
            String aggregateType, String aggregateId, String fromPaddedVersion) throws SQLException;

    /**
     * Select at most {@code limit} events of a stream after given position, ordered by position.
     */
    protected abstract PreparedStatement selectStreamEvents(Connection connection, String tenant, String stream,
            long afterPosition, int limit) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    protected abstract EventRecord readEvent(ResultSet rs, Map<String, Object> payload) throws SQLException;

    protected abstract PreparedStatement selectSnapshot(Connection connection, String path) throws SQLException;

    protected abstract AbstractEventStore.StoredSnapshot readSnapshot(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateSnapshot(Connection connection, String path,
            AbstractEventStore.StoredSnapshot snapshot) throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, String path,
            AbstractEventStore.StoredSnapshot snapshot) throws SQLException;

    protected abstract PreparedStatement selectCursors(Connection connection, String tenant, String stream)
            throws SQLException;

    protected abstract String readCursorHandler(ResultSet rs) throws SQLException;

    protected abstract long readCursorPosition(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertCursor(Connection connection, String tenant, String stream,
            String handler, long position) throws SQLException;

    protected abstract PreparedStatement updateCursor(Connection connection, String tenant, String stream,
            String handler, long expected, long position) throws SQLException;

    /**
     * Whether the failure was caused by a concurrent transaction, so that the whole transaction may be repeated.
     * Integrity constraint violations and serialization failures are considered transient by default.
     * @param e the failure
     * @return true if worth retrying
     */
    protected boolean isTransient(SQLException e) {
        String state = e.getSQLState();
        return state != null && (state.startsWith("23") || state.startsWith("40"));
    }
}
