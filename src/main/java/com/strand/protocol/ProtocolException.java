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

package com.strand.protocol;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Signals that data read from or written to a {@link Protocol} violated its encoding rules, or that a request could
 * not be processed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ProtocolException extends Exception {
	@NonNull
	private final Type type;

	public ProtocolException(@NonNull Type type,
													 @NonNull String message) {
		this(type, message, null);
	}

	public ProtocolException(@NonNull Type type,
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

	@NonNull
	public Type getType() {
		return this.type;
	}

	/**
	 * Kinds of {@link ProtocolException}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum Type {
		/**
		 * A failure that doesn't fall into any of the other categories, e.g. a processor rejecting a request.
		 */
		UNKNOWN,
		/**
		 * The data on the wire could not be decoded.
		 */
		INVALID_DATA,
		/**
		 * A message exceeded the protocol's size limit.
		 */
		SIZE_LIMIT
	}
}
