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

import com.strand.protocol.Protocol;
import org.jspecify.annotations.NonNull;

/**
 * Read-only hook methods for observing server and connection lifecycle events.
 * <p>
 * Connection methods are invoked on worker threads, concurrently with one another, so implementations must be
 * threadsafe.  Exceptions thrown by these methods are caught and surfaced via
 * {@link LogEventType#LIFECYCLE_OBSERVER_FAILED}; they never affect serving.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called after the server starts listening, before the first connection is accepted.
	 */
	default void didStartServing(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server notices a stop request, before it closes its listening transport.
	 */
	default void willStopServing(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server has closed its listening transport and every in-flight worker has finished.
	 */
	default void didStopServing(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called on the worker thread before the first request on a connection is processed.
	 */
	default void didBeginConnection(@NonNull Protocol inputProtocol,
																	@NonNull Protocol outputProtocol) {
		// No-op by default
	}

	/**
	 * Called on the worker thread after the last request on a connection is processed, however processing ended, and
	 * before the connection is closed.
	 */
	default void didEndConnection(@NonNull Protocol inputProtocol,
																@NonNull Protocol outputProtocol) {
		// No-op by default
	}
}
