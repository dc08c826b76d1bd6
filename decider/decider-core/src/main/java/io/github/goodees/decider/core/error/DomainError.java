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

import java.util.Objects;
import java.util.UUID;

/**
 * Business error returned by deciders. Every instance carries an id for correlation in logs and traces.
 * <p>Errors translated between layers via {@link #translate(String)} or {@link #withCode(ErrorCode)} keep the id
 * of the original, so that the identity of an error survives
 * {@link io.github.goodees.decider.core.Decider#mapError(java.util.function.Function)}.
 */
public class DomainError {
    private final UUID errorId;
    private final ErrorCode code;
    private final String message;
    private final DomainError origin;

    protected DomainError(UUID errorId, ErrorCode code, String message, DomainError origin) {
        this.errorId = Objects.requireNonNull(errorId, "Error id must be specified");
        this.code = Objects.requireNonNull(code, "Error code must be specified");
        this.message = Objects.requireNonNull(message, "Message must be specified");
        this.origin = origin;
    }

    protected DomainError(ErrorCode code, String message) {
        this(UUID.randomUUID(), code, message, null);
    }

    /**
     * Create error wrapping another one. Id of the result is the id of {@code origin}.
     * @param origin error being translated
     * @param code code of the new error
     * @param message message of the new error
     */
    protected DomainError(DomainError origin, ErrorCode code, String message) {
        this(origin.getErrorId(), code, message, origin);
    }

    public static DomainError of(ErrorCode code, String message) {
        return new DomainError(code, message);
    }

    public static DomainError validation(String message) {
        return of(ErrorCode.VALIDATION_FAILED, message);
    }

    public static DomainError notFound(String message) {
        return of(ErrorCode.NOT_FOUND, message);
    }

    public static DomainError conflict(String message) {
        return of(ErrorCode.CONFLICT, message);
    }

    public UUID getErrorId() {
        return errorId;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The error this one was translated from.
     * @return original error, null if this error was created directly
     */
    public DomainError getOrigin() {
        return origin;
    }

    /**
     * Translate the error into a new context, prefixing its message.
     * @param context description of the layer translating the error
     * @return new error with same id and code
     */
    public DomainError translate(String context) {
        return new DomainError(this, code, context + ": " + message);
    }

    public DomainError withCode(ErrorCode newCode) {
        return new DomainError(this, newCode, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        DomainError that = (DomainError) o;
        return errorId.equals(that.errorId) && code == that.code && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorId, code, message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + code + ", id=" + errorId + ", message='" + message + "'}";
    }
}
