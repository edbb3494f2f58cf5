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

package com.strand.transport;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Signals that a {@link Transport} or {@link ServerTransport} operation failed.
 * <p>
 * The {@link Type} distinguishes an expected interruption (for example, a pending accept that was unblocked because the
 * server is shutting down) from a genuine failure.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TransportException extends IOException {
	@NonNull
	private final Type type;

	public TransportException(@NonNull Type type,
														@NonNull String message) {
		this(type, message, null);
	}

	public TransportException(@NonNull Type type,
														@NonNull String message,
														@Nullable Throwable cause) {
		super(requireNonNull(message), cause);
		requireNonNull(type);

		this.type = type;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{type=%s, message=%s}", getClass().getSimpleName(), getType().name(), getMessage());
	}

	/**
	 * What kind of transport failure this is.
	 *
	 * @return the failure type
	 */
	@NonNull
	public Type getType() {
		return this.type;
	}

	/**
	 * Kinds of {@link TransportException}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum Type {
		/**
		 * A failure that doesn't fall into any of the other categories.
		 */
		UNKNOWN,
		/**
		 * The transport is not open, or could not be opened.
		 */
		NOT_OPEN,
		/**
		 * The transport was asked to open but is already open.
		 */
		ALREADY_OPEN,
		/**
		 * A read or write did not complete before its timeout elapsed.
		 */
		TIMED_OUT,
		/**
		 * The peer closed the connection before an expected read completed.
		 */
		END_OF_FILE,
		/**
		 * A blocking call was deliberately unblocked, e.g. by {@link ServerTransport#interrupt()} or {@link ServerTransport#close()}.
		 */
		INTERRUPTED
	}
}
