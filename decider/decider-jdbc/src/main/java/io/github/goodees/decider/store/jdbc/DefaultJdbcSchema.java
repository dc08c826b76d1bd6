package io.github.goodees.decider.store.jdbc;

/*-
 * #%L
 * decider-jdbc
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

import io.github.goodees.decider.core.store.StreamId;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * JDBC schema with single table for all streams. Following table is expected to exist:
 * <pre>
 * <em>eventTable</em> (
 *   ID bigint generated always as identity primary key,
 *   AGGREGATE_TYPE varchar not null,
 *   AGGREGATE_ID varchar not null,
 *   STREAM_VERSION bigint not null,
 *   EVENT_TYPE varchar not null,
 *   PAYLOAD_VERSION int not null,
 *   PAYLOAD clob not null,
 *   RECORDED_AT timestamp not null,
 *   unique (AGGREGATE_TYPE, AGGREGATE_ID, STREAM_VERSION))
 * </pre>
 * The identity column provides store-wide insertion order.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String COLUMNS = "ID, AGGREGATE_TYPE, AGGREGATE_ID, STREAM_VERSION, EVENT_TYPE, "
            + "PAYLOAD_VERSION, PAYLOAD, RECORDED_AT";

    private final String eventTable;

    public DefaultJdbcSchema(String eventTable) {
        this.eventTable = eventTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, StreamId streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT MAX(STREAM_VERSION) FROM " + getEventTable()
                + " WHERE AGGREGATE_TYPE=? AND AGGREGATE_ID=?");
        st.setString(1, streamId.getAggregateType());
        st.setString(2, streamId.getAggregateId());
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        // MAX over no rows is null, which reads as 0
        return rs.next() ? rs.getLong(1) : 0;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (AGGREGATE_TYPE, AGGREGATE_ID, STREAM_VERSION, EVENT_TYPE, PAYLOAD_VERSION, PAYLOAD, RECORDED_AT)"
                + " VALUES (?,?,?,?,?,?,?)", new String[] { "ID" });
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, StreamId streamId, long sequence, String eventType,
            Instant recordedAt, int payloadVersion, String payload) throws SQLException {
        insertEvent.setString(1, streamId.getAggregateType());
        insertEvent.setString(2, streamId.getAggregateId());
        insertEvent.setLong(3, sequence);
        insertEvent.setString(4, eventType);
        insertEvent.setInt(5, payloadVersion);
        insertEvent.setString(6, payload);
        insertEvent.setTimestamp(7, Timestamp.from(recordedAt));
    }

    @Override
    protected long readGeneratedPosition(PreparedStatement insertEvent) throws SQLException {
        try (ResultSet keys = insertEvent.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No key generated for inserted event");
            }
            return keys.getLong(1);
        }
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, StreamId streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + COLUMNS + " FROM " + getEventTable()
                + " WHERE AGGREGATE_TYPE=? AND AGGREGATE_ID=? ORDER BY STREAM_VERSION");
        st.setString(1, streamId.getAggregateType());
        st.setString(2, streamId.getAggregateId());
        return st;
    }

    @Override
    protected PreparedStatement selectEventsOfType(Connection connection, String aggregateType) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + COLUMNS + " FROM " + getEventTable()
                + " WHERE AGGREGATE_TYPE=? ORDER BY ID");
        st.setString(1, aggregateType);
        return st;
    }

    @Override
    protected long readPosition(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected StreamId readStreamId(ResultSet rs) throws SQLException {
        return StreamId.of(rs.getString(2), rs.getString(3));
    }

    @Override
    protected long readSequence(ResultSet rs) throws SQLException {
        return rs.getLong(4);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(6);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(7);
    }

    @Override
    protected Instant readRecordedAt(ResultSet rs) throws SQLException {
        return rs.getTimestamp(8).toInstant();
    }
}
