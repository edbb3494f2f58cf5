/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.strand;

import com.strand.protocol.ProtocolException;
import com.strand.transport.TransportException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LogEventTests {
	@Test
	public void failure_kind_is_derived_from_the_throwable() {
		LogEvent transportEvent = LogEvent.with(LogEventType.WORKER_CLIENT_DIED, "died")
				.throwable(new TransportException(TransportException.Type.END_OF_FILE, "EOF"))
				.build();
		LogEvent protocolEvent = LogEvent.with(LogEventType.WORKER_PROCESSING_FAILED, "bad")
				.throwable(new ProtocolException(ProtocolException.Type.INVALID_DATA, "garbage"))
				.build();
		LogEvent plainEvent = LogEvent.with(LogEventType.SERVER_DRAIN_FAILED, "interrupted").build();

		Assertions.assertEquals(FailureKind.TRANSPORT, transportEvent.getFailureKind().orElse(null));
		Assertions.assertEquals(FailureKind.PROTOCOL, protocolEvent.getFailureKind().orElse(null));
		Assertions.assertTrue(plainEvent.getFailureKind().isEmpty());
		Assertions.assertTrue(plainEvent.getThrowable().isEmpty());
	}

	@Test
	public void explicit_failure_kind_wins() {
		LogEvent logEvent = LogEvent.with(LogEventType.WORKER_UNEXPECTED_ERROR, "odd")
				.throwable(new TransportException(TransportException.Type.UNKNOWN, "wrapped"))
				.failureKind(FailureKind.UNKNOWN)
				.build();

		Assertions.assertEquals(FailureKind.UNKNOWN, logEvent.getFailureKind().orElse(null));
	}

	@Test
	public void failure_kind_classification() {
		Assertions.assertEquals(FailureKind.TRANSPORT, FailureKind.forThrowable(new TransportException(TransportException.Type.TIMED_OUT, "slow")));
		Assertions.assertEquals(FailureKind.PROTOCOL, FailureKind.forThrowable(new ProtocolException(ProtocolException.Type.SIZE_LIMIT, "big")));
		Assertions.assertEquals(FailureKind.UNKNOWN, FailureKind.forThrowable(new IllegalStateException()));
		Assertions.assertEquals(FailureKind.UNKNOWN, FailureKind.forThrowable(new OutOfMemoryError()));
	}

	@Test
	public void equal_events_compare_equal() {
		IllegalStateException throwable = new IllegalStateException("boom");

		LogEvent first = LogEvent.with(LogEventType.SERVER_UNKNOWN_ERROR, "boom").throwable(throwable).build();
		LogEvent second = LogEvent.with(LogEventType.SERVER_UNKNOWN_ERROR, "boom").throwable(throwable).build();

		Assertions.assertEquals(first, second);
		Assertions.assertEquals(first.hashCode(), second.hashCode());
		Assertions.assertNotEquals(first, LogEvent.with(LogEventType.SERVER_UNKNOWN_ERROR, "other").build());
	}

	@Test
	public void describe_includes_type_and_message() {
		Assertions.assertEquals("IllegalStateException: boom", Utilities.describe(new IllegalStateException("boom")));
		Assertions.assertEquals("IllegalStateException", Utilities.describe(new IllegalStateException()));
		Assertions.assertEquals("(none)", Utilities.describe(null));
	}

	@Test
	public void failing_handler_is_contained() {
		Assertions.assertDoesNotThrow(() -> Utilities.safelyHandleLogEvent((logEvent) -> {
			throw new IllegalStateException("Handler is broken");
		}, LogEvent.with(LogEventType.SERVER_ACCEPT_FAILED, "test").build()));
	}

	@Test
	public void default_handler_accepts_events_with_and_without_throwables() {
		LogEventHandler logEventHandler = LogEventHandler.defaultInstance();

		Assertions.assertDoesNotThrow(() -> logEventHandler.handleLogEvent(LogEvent.with(LogEventType.SERVER_ACCEPT_FAILED, "plain").build()));
		Assertions.assertDoesNotThrow(() -> logEventHandler.handleLogEvent(LogEvent.with(LogEventType.SERVER_ACCEPT_FAILED, "with cause")
				.throwable(new IllegalStateException("cause"))
				.build()));
	}

	@Test
	public void nonvirtual_thread_factory_numbers_threads() {
		Utilities.NonvirtualThreadFactory threadFactory = new Utilities.NonvirtualThreadFactory("worker-", (thread, throwable) -> {});

		Assertions.assertEquals("worker-1", threadFactory.newThread(() -> {}).getName());
		Assertions.assertEquals("worker-2", threadFactory.newThread(() -> {}).getName());
	}
}
