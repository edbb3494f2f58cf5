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

import static java.util.Objects.requireNonNull;

/**
 * Wraps a raw connection into the {@link Transport} a protocol reads from or writes to.
 * <p>
 * Implementations must be threadsafe; the accept loop invokes them for every accepted connection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface TransportFactory {
	/**
	 * Wraps the given transport.
	 *
	 * @param transport the transport to wrap
	 * @return the wrapped transport, which may be {@code transport} itself
	 * @throws TransportException if the transport could not be wrapped
	 */
	@NonNull
	Transport wrapTransport(@NonNull Transport transport) throws TransportException;

	/**
	 * Acquires a factory which hands back the transport it was given, unwrapped.
	 *
	 * @return the identity factory
	 */
	@NonNull
	static TransportFactory identity() {
		return (transport) -> requireNonNull(transport);
	}
}
