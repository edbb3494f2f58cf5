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
import org.jspecify.annotations.NonNull;

import static java.util.Objects.requireNonNull;

/**
 * How a failure caught at a worker or accept-loop boundary is classified.
 * <p>
 * The server decides whether to recover, skip a connection, or stop serving based on this classification rather than
 * on the open-ended exception hierarchy.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum FailureKind {
	/**
	 * The failure was a {@link TransportException}: a connection or listener died.
	 */
	TRANSPORT,
	/**
	 * The failure was a {@link ProtocolException}: a request was malformed or rejected.
	 */
	PROTOCOL,
	/**
	 * Anything else.
	 */
	UNKNOWN;

	/**
	 * Classifies the given throwable.
	 *
	 * @param throwable the throwable to classify
	 * @return the failure kind
	 */
	@NonNull
	public static FailureKind forThrowable(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		if (throwable instanceof TransportException)
			return TRANSPORT;

		if (throwable instanceof ProtocolException)
			return PROTOCOL;

		return UNKNOWN;
	}
}
