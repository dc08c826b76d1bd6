package io.github.goodees.decider.core.error;

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

/**
 * Error taxonomy surfaced to callers of the runtime.
 */
public enum ErrorCode {
    /** Command rejected by a decider. Safe to retry with corrected input. */
    VALIDATION_FAILED(400),
    /** Referenced aggregate or entity does not exist. */
    NOT_FOUND(404),
    /** Optimistic concurrency conflict. Safe to retry after refetching the stream. */
    CONFLICT(409),
    /** Serialization or storage malfunction. */
    INTERNAL_ERROR(500),
    /** Event bus or backing store unreachable. */
    SERVICE_UNAVAILABLE(503);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return this == VALIDATION_FAILED || this == CONFLICT || this == SERVICE_UNAVAILABLE;
    }
}
