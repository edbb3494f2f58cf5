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

import java.io.Closeable;

/**
 * Listening transport which hands out a {@link Transport} per accepted connection.
 * <p>
 * {@link #accept()} is invoked from a single accept-loop thread, while {@link #interrupt()} and {@link #close()} may be
 * invoked from any thread, so implementations must be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ServerTransport extends Closeable {
	/**
	 * Starts listening for connections.
	 *
	 * @throws TransportException if the transport cannot listen, e.g. because its address is already bound
	 */
	void listen() throws TransportException;

	/**
	 * Blocks until a connection is available and returns it.
	 *
	 * @return the accepted connection
	 * @throws TransportException if accepting failed; a pending call unblocked by {@link #interrupt()} or {@link #close()}
	 *                            fails with {@link TransportException.Type#INTERRUPTED}
	 */
	@NonNull
	Transport accept() throws TransportException;

	/**
	 * Unblocks a pending {@link #accept()} without closing this transport.
	 * <p>
	 * The default does nothing; a server using such a transport notices a stop request only once the pending
	 * {@link #accept()} returns on its own.
	 */
	default void interrupt() {
		// No-op by default
	}

	/**
	 * Stops listening.  Closing an already-closed transport has no effect.
	 *
	 * @throws TransportException if the close fails
	 */
	@Override
	void close() throws TransportException;
}
