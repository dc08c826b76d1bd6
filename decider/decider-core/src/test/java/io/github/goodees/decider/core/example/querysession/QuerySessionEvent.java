package io.github.goodees.decider.core.example.querysession;

/*-
 * #%L
 * decider-core
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

import io.github.goodees.decider.core.Event;

public abstract class QuerySessionEvent implements Event {
    private final String queryId;

    QuerySessionEvent(String queryId) {
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }

    @Override
    public String toString() {
        return getType() + "{" + queryId + "}";
    }

    public static final class QueryStartedEvent extends QuerySessionEvent {
        private final String sql;

        public QueryStartedEvent(String queryId, String sql) {
            super(queryId);
            this.sql = sql;
        }

        public String getSql() {
            return sql;
        }
    }

    public static final class ExecutionBeganEvent extends QuerySessionEvent {
        public ExecutionBeganEvent(String queryId) {
            super(queryId);
        }
    }

    public static final class QueryCompletedEvent extends QuerySessionEvent {
        private final long rowCount;
        private final long durationMs;

        public QueryCompletedEvent(String queryId, long rowCount, long durationMs) {
            super(queryId);
            this.rowCount = rowCount;
            this.durationMs = durationMs;
        }

        public long getRowCount() {
            return rowCount;
        }

        public long getDurationMs() {
            return durationMs;
        }
    }

    public static final class QueryFailedEvent extends QuerySessionEvent {
        private final String error;

        public QueryFailedEvent(String queryId, String error) {
            super(queryId);
            this.error = error;
        }

        public String getError() {
            return error;
        }
    }

    public static final class QueryCancelledEvent extends QuerySessionEvent {
        public QueryCancelledEvent(String queryId) {
            super(queryId);
        }
    }
}
