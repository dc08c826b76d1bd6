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

import io.github.goodees.decider.core.store.EventStoreException;
import io.github.goodees.decider.core.store.StreamId;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ErrorsTest {

    @Test
    public void codes_map_to_http_statuses() {
        assertEquals(400, ErrorCode.VALIDATION_FAILED.httpStatus());
        assertEquals(404, ErrorCode.NOT_FOUND.httpStatus());
        assertEquals(409, ErrorCode.CONFLICT.httpStatus());
        assertEquals(500, ErrorCode.INTERNAL_ERROR.httpStatus());
        assertEquals(503, ErrorCode.SERVICE_UNAVAILABLE.httpStatus());
    }

    @Test
    public void conflicts_and_unavailability_are_retryable() {
        assertTrue(ErrorCode.CONFLICT.isRetryable());
        assertTrue(ErrorCode.SERVICE_UNAVAILABLE.isRetryable());
        assertFalse(ErrorCode.NOT_FOUND.isRetryable());
    }

    @Test
    public void translated_error_keeps_id() {
        DomainError original = DomainError.notFound("Todo abc does not exist");
        DomainError translated = original.translate("dashboard").withCode(ErrorCode.VALIDATION_FAILED);
        assertEquals(original.getErrorId(), translated.getErrorId());
        assertEquals(ErrorCode.VALIDATION_FAILED, translated.getCode());
        assertEquals("dashboard: Todo abc does not exist", translated.getMessage());
        assertNotEquals(original.getErrorId(), DomainError.notFound("Todo abc does not exist").getErrorId());
    }

    @Test
    public void rejection_takes_identity_of_domain_error() {
        DomainError error = DomainError.conflict("exists");
        CommandRejectedException rejected = new CommandRejectedException("todo", error);
        assertEquals(error.getErrorId(), rejected.getErrorId());
        assertEquals(ErrorCode.CONFLICT, rejected.getCode());
        assertSame(error, rejected.getError(DomainError.class));
    }

    @Test
    public void store_exception_keeps_id_of_wrapped_exception() {
        StreamId stream = StreamId.of("Todo", "a");
        EventStoreException cause = EventStoreException.optimisticLock(stream, 1);
        EventStoreException wrapped = EventStoreException.storeFailed(stream, cause);
        assertEquals(cause.getErrorId(), wrapped.getErrorId());
        assertEquals(ErrorCode.INTERNAL_ERROR, wrapped.getCode());
    }

    @Test
    public void unwrap_strips_future_wrappers() throws Exception {
        IllegalStateException failure = new IllegalStateException("x");
        CompletableFuture<Object> future = new CompletableFuture<>();
        future.completeExceptionally(new CompletionException(failure));
        try {
            future.get();
            fail("Future should fail");
        } catch (ExecutionException e) {
            assertSame(failure, Futures.unwrap(e));
        }
        assertSame(failure, Futures.unwrap(failure));
    }
}
