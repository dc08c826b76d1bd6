package io.github.goodees.decider.core.bus;

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

import io.github.goodees.decider.core.error.AggregateException;
import io.github.goodees.decider.core.error.ErrorCode;

/**
 * The bus is not able to take the request.
 */
public class EventBusException extends AggregateException {

    protected EventBusException(String message, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, cause);
    }

    public static EventBusException closed() {
        return new EventBusException("Event bus is closed", null);
    }

    public static EventBusException unavailable(String what, Throwable cause) {
        return new EventBusException("Event bus is unavailable: " + what, cause);
    }
}
