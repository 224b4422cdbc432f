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

import io.github.goodees.esbus.store.AbstractEventStore.StoredSnapshot;
import io.github.goodees.esbus.store.EventRecord;
import io.github.goodees.esbus.store.VersionPadder;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Map;

/**
 * JDBC schema with four tables shared by all tenants. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(TENANT, STREAM_NAME, EVENT_ID, STREAM_POSITION, AGGREGATE_TYPE, AGGREGATE_ID,
 * AGGREGATE_VERSION, COMMITTER, COMMAND, PAYLOAD_VERSION, PAYLOAD) primary key (TENANT, STREAM_NAME, EVENT_ID).
 * EVENT_ID is the padded stream position, AGGREGATE_VERSION the padded aggregate version, both character columns.</li>
 * <li><em>streamTable</em>(TENANT, STREAM_NAME, STREAM_POSITION) primary key (TENANT, STREAM_NAME)</li>
 * <li><em>snapshotTable</em>(PATH, AGGREGATE_VERSION, UPDATED, PAYLOAD_VERSION, PAYLOAD) primary key (PATH)</li>
 * <li><em>cursorTable</em>(TENANT, STREAM_NAME, HANDLER_NAME, STREAM_POSITION)
 * primary key (TENANT, STREAM_NAME, HANDLER_NAME)</li>
 * </ul>
 * A unique key on (TENANT, AGGREGATE_TYPE, AGGREGATE_ID, AGGREGATE_VERSION) of the event table is recommended.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String EVENT_COLUMNS = "TENANT, STREAM_NAME, EVENT_ID, STREAM_POSITION, AGGREGATE_TYPE, "
            + "AGGREGATE_ID, AGGREGATE_VERSION, COMMITTER, COMMAND, PAYLOAD_VERSION, PAYLOAD";

    private final String eventTable;
    private final String streamTable;
    private final String snapshotTable;
    private final String cursorTable;

    public DefaultJdbcSchema(String eventTable, String streamTable, String snapshotTable, String cursorTable) {
        this.eventTable = eventTable;
        this.streamTable = streamTable;
        this.snapshotTable = snapshotTable;
        this.cursorTable = cursorTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getStreamTable() {
        return streamTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    protected String getCursorTable() {
        return cursorTable;
    }

    @Override
    protected PreparedStatement selectStreamPosition(Connection connection, String tenant, String stream)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT STREAM_POSITION FROM " + getStreamTable()
                + " WHERE TENANT=? AND STREAM_NAME=?");
        st.setString(1, tenant);
        st.setString(2, stream);
        return st;
    }

    @Override
    protected PreparedStatement createStreamPosition(Connection connection, String tenant, String stream,
            long position) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getStreamTable()
                + " (TENANT, STREAM_NAME, STREAM_POSITION) VALUES (?, ?, ?)");
        st.setString(1, tenant);
        st.setString(2, stream);
        st.setLong(3, position);
        return st;
    }

    @Override
    protected long readStreamPosition(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateStreamPosition(Connection connection, String tenant, String stream,
            long fromPosition, long toPosition) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getStreamTable()
                + " SET STREAM_POSITION=? WHERE TENANT=? AND STREAM_NAME=? AND STREAM_POSITION=?");
        st.setLong(1, toPosition);
        st.setString(2, tenant);
        st.setString(3, stream);
        st.setLong(4, fromPosition);
        return st;
    }

    @Override
    protected PreparedStatement selectNewerEvents(Connection connection, String tenant, String aggregateType,
            String aggregateId, String paddedVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT AGGREGATE_VERSION FROM " + getEventTable()
                + " WHERE TENANT=? AND AGGREGATE_TYPE=? AND AGGREGATE_ID=? AND AGGREGATE_VERSION > ?");
        st.setString(1, tenant);
        st.setString(2, aggregateType);
        st.setString(3, aggregateId);
        st.setString(4, paddedVersion);
        st.setMaxRows(1);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable() + " (" + EVENT_COLUMNS
                + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, String tenant, String stream, EventRecord event,
            int payloadVersion, String payload) throws SQLException {
        insertEvent.setString(1, tenant);
        insertEvent.setString(2, stream);
        insertEvent.setString(3, VersionPadder.forStreams().pad(event.getStreamPosition()));
        insertEvent.setLong(4, event.getStreamPosition());
        insertEvent.setString(5, event.getAggregateType());
        insertEvent.setString(6, event.getAggregateId());
        insertEvent.setString(7, event.getPaddedAggregateVersion());
        insertEvent.setString(8, event.getCommitterId());
        insertEvent.setString(9, event.getCommand());
        insertEvent.setInt(10, payloadVersion);
        insertEvent.setString(11, payload);
    }

    @Override
    protected PreparedStatement selectAggregateEvents(Connection connection, String tenant, String aggregateType,
            String aggregateId, String fromPaddedVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE TENANT=? AND AGGREGATE_TYPE=? AND AGGREGATE_ID=? AND AGGREGATE_VERSION >= ?"
                + " ORDER BY AGGREGATE_VERSION");
        st.setString(1, tenant);
        st.setString(2, aggregateType);
        st.setString(3, aggregateId);
        st.setString(4, fromPaddedVersion);
        return st;
    }

    @Override
    protected PreparedStatement selectStreamEvents(Connection connection, String tenant, String stream,
            long afterPosition, int limit) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE TENANT=? AND STREAM_NAME=? AND STREAM_POSITION > ? ORDER BY STREAM_POSITION");
        st.setString(1, tenant);
        st.setString(2, stream);
        st.setLong(3, afterPosition);
        st.setMaxRows(limit);
        return st;
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(10);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(11);
    }

    @Override
    protected EventRecord readEvent(ResultSet rs, Map<String, Object> payload) throws SQLException {
        return new EventRecord(rs.getString(8), rs.getString(9), rs.getString(5), rs.getString(6), rs.getString(7),
                rs.getLong(4), payload);
    }

    @Override
    protected PreparedStatement selectSnapshot(Connection connection, String path) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT PATH, AGGREGATE_VERSION, PAYLOAD_VERSION, PAYLOAD"
                + " FROM " + getSnapshotTable() + " WHERE PATH = ?");
        ps.setString(1, path);
        return ps;
    }

    @Override
    protected StoredSnapshot readSnapshot(ResultSet rs) throws SQLException {
        return new StoredSnapshot(rs.getLong(2), rs.getInt(3), rs.getString(4));
    }

    @Override
    protected PreparedStatement updateSnapshot(Connection connection, String path, StoredSnapshot snapshot)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getSnapshotTable()
                + " SET AGGREGATE_VERSION=?, UPDATED=?, PAYLOAD_VERSION=?, PAYLOAD=? WHERE PATH = ?");
        ps.setLong(1, snapshot.getVersion());
        ps.setTimestamp(2, new Timestamp(System.currentTimeMillis()));
        ps.setInt(3, snapshot.getPayloadVersion());
        ps.setString(4, snapshot.getPayload());
        ps.setString(5, path);
        return ps;
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, String path, StoredSnapshot snapshot)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (PATH, AGGREGATE_VERSION, UPDATED, PAYLOAD_VERSION, PAYLOAD) VALUES (?, ?, ?, ?, ?)");
        ps.setString(1, path);
        ps.setLong(2, snapshot.getVersion());
        ps.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
        ps.setInt(4, snapshot.getPayloadVersion());
        ps.setString(5, snapshot.getPayload());
        return ps;
    }

    @Override
    protected PreparedStatement selectCursors(Connection connection, String tenant, String stream)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT HANDLER_NAME, STREAM_POSITION FROM "
                + getCursorTable() + " WHERE TENANT=? AND STREAM_NAME=?");
        ps.setString(1, tenant);
        ps.setString(2, stream);
        return ps;
    }

    @Override
    protected String readCursorHandler(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected long readCursorPosition(ResultSet rs) throws SQLException {
        return rs.getLong(2);
    }

    @Override
    protected PreparedStatement insertCursor(Connection connection, String tenant, String stream, String handler,
            long position) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getCursorTable()
                + " (TENANT, STREAM_NAME, HANDLER_NAME, STREAM_POSITION) VALUES (?, ?, ?, ?)");
        ps.setString(1, tenant);
        ps.setString(2, stream);
        ps.setString(3, handler);
        ps.setLong(4, position);
        return ps;
    }

    @Override
    protected PreparedStatement updateCursor(Connection connection, String tenant, String stream, String handler,
            long expected, long position) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getCursorTable()
                + " SET STREAM_POSITION=? WHERE TENANT=? AND STREAM_NAME=? AND HANDLER_NAME=? AND STREAM_POSITION=?");
        ps.setLong(1, position);
        ps.setString(2, tenant);
        ps.setString(3, stream);
        ps.setString(4, handler);
        ps.setLong(5, expected);
        return ps;
    }
}
