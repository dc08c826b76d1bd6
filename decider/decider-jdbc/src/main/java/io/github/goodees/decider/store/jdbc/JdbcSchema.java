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
import java.time.Instant;

/**
 * SQL dialect and table layout of {@link JdbcEventStore}. Statement factories return prepared statements with all
 * parameters set, readers extract single column of current row.
 * <p>The layout must guarantee that no two rows share aggregate type, aggregate id and sequence. The store relies on
 * the database to reject the second of two racing writes.</p>
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamVersion(Connection connection, StreamId streamId)
            throws SQLException;

    /**
     * Read result of {@link #selectStreamVersion(Connection, StreamId)}.
     * @return last sequence, 0 for empty stream
     */
    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, StreamId streamId, long sequence,
            String eventType, Instant recordedAt, int payloadVersion, String payload) throws SQLException;

    /**
     * Position assigned by the database to the row just inserted.
     */
    protected abstract long readGeneratedPosition(PreparedStatement insertEvent) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, StreamId streamId) throws SQLException;

    protected abstract PreparedStatement selectEventsOfType(Connection connection, String aggregateType)
            throws SQLException;

    protected abstract long readPosition(ResultSet rs) throws SQLException;

    protected abstract StreamId readStreamId(ResultSet rs) throws SQLException;

    protected abstract long readSequence(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    protected abstract Instant readRecordedAt(ResultSet rs) throws SQLException;
}
