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
 * Base of all exceptions surfaced by the runtime. Each one is classified by an {@link ErrorCode} and carries an
 * id that is logged together with it.
 */
public abstract class AggregateException extends Exception {
    private final ErrorCode code;
    private final UUID errorId;

    protected AggregateException(ErrorCode code, UUID errorId, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code);
        this.errorId = errorId != null ? errorId : UUID.randomUUID();
    }

    protected AggregateException(ErrorCode code, String message, Throwable cause) {
        this(code, inheritedId(cause), message, cause);
    }

    public ErrorCode getCode() {
        return code;
    }

    public UUID getErrorId() {
        return errorId;
    }

    private static UUID inheritedId(Throwable cause) {
        return cause instanceof AggregateException ? ((AggregateException) cause).getErrorId() : null;
    }

    @Override
    public String toString() {
        return super.toString() + " [" + code + ", id=" + errorId + "]";
    }
}
