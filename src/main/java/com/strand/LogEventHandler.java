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

import org.jspecify.annotations.NonNull;

/**
 * Receives diagnostic {@link LogEvent} instances from a {@link Server} and its workers.
 * <p>
 * Implementations must be threadsafe and should return quickly - they are invoked directly from the accept loop and
 * from worker threads.  Exceptions thrown here are swallowed by the caller, so they can never affect request
 * processing.
 * <p>
 * A standard threadsafe implementation which writes to {@code System.err} can be acquired via the
 * {@link #defaultInstance()} factory method.  Applications typically bridge to their logging framework of choice.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface LogEventHandler {
	/**
	 * Called when Strand emits a log event.
	 *
	 * @param logEvent the event to handle
	 */
	void handleLogEvent(@NonNull LogEvent logEvent);

	/**
	 * Acquires a threadsafe {@link LogEventHandler} instance which writes to {@code System.err}.
	 *
	 * @return a {@code LogEventHandler} with default settings
	 */
	@NonNull
	static LogEventHandler defaultInstance() {
		return DefaultLogEventHandler.defaultInstance();
	}
}
