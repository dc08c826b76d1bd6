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

import java.util.UUID;

/**
 * A decider rejected the command. Nothing was written. The decider's error is available unchanged via
 * {@link #getError()}; when it is a {@link DomainError}, its id and code become the id and code of this exception.
 */
public class CommandRejectedException extends AggregateException {
    private final transient Object error;

    public CommandRejectedException(String aggregateName, Object error) {
        super(codeOf(error), idOf(error), aggregateName + " rejected command: " + messageOf(error), null);
        this.error = error;
    }

    public Object getError() {
        return error;
    }

    /**
     * The decider error cast to expected type.
     * @param errorType expected class of the error
     * @param <R> error type
     * @return the error
     * @throws ClassCastException if the error is of different type
     */
    public <R> R getError(Class<R> errorType) {
        return errorType.cast(error);
    }

    private static ErrorCode codeOf(Object error) {
        return error instanceof DomainError ? ((DomainError) error).getCode() : ErrorCode.VALIDATION_FAILED;
    }

    private static UUID idOf(Object error) {
        return error instanceof DomainError ? ((DomainError) error).getErrorId() : null;
    }

    private static String messageOf(Object error) {
        return error instanceof DomainError ? ((DomainError) error).getMessage() : String.valueOf(error);
    }
}
