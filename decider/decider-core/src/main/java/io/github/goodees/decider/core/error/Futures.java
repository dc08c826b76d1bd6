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

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for exceptions coming out of asynchronous invocations.
 */
public class Futures {
    private Futures() {

    }

    /**
     * Strip wrappers added by {@code CompletableFuture}.
     * @param ex the exception as observed by a callback or {@code get()}
     * @return the exception thrown by the actual invocation
     */
    public static Throwable unwrap(Throwable ex) {
        while (ex != null && ex.getCause() != null
                && (ex instanceof CompletionException || ex instanceof ExecutionException)) {
            ex = ex.getCause();
        }
        return ex;
    }
}
