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
 * A bidirectional byte channel: either a raw connection handed out by {@link ServerTransport#accept()} or a wrapper
 * around one produced by a {@link TransportFactory}.
 * <p>
 * Implementations are generally not threadsafe - a transport is owned by the single worker servicing its connection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Transport extends Closeable {
	/**
	 * Is this transport open for reading and writing?
	 *
	 * @return {@code true} if open, {@code false} otherwise
	 */
	@NonNull
	Boolean isOpen();

	/**
	 * Is there input data immediately available?
	 * <p>
	 * This method must never block.
	 *
	 * @return {@code true} if a subsequent read would return data without waiting, {@code false} otherwise
	 * @throws TransportException if the transport is unable to determine readiness
	 */
	@NonNull
	Boolean peek() throws TransportException;

	/**
	 * Reads up to {@code length} bytes into {@code buffer}, blocking until at least one byte is available.
	 *
	 * @param buffer the destination buffer
	 * @param offset offset into {@code buffer} at which to start writing
	 * @param length maximum number of bytes to read
	 * @return the number of bytes read, or {@code -1} if the peer has closed its side of the connection
	 * @throws TransportException if the read fails
	 */
	int read(@NonNull byte[] buffer,
					 int offset,
					 int length) throws TransportException;

	/**
	 * Writes {@code length} bytes from {@code buffer}.
	 *
	 * @param buffer the source buffer
	 * @param offset offset into {@code buffer} at which to start reading
	 * @param length number of bytes to write
	 * @throws TransportException if the write fails
	 */
	void write(@NonNull byte[] buffer,
						 int offset,
						 int length) throws TransportException;

	/**
	 * Flushes any buffered output to the peer.
	 *
	 * @throws TransportException if the flush fails
	 */
	void flush() throws TransportException;

	/**
	 * Closes this transport.  Closing an already-closed transport has no effect.
	 *
	 * @throws TransportException if the close fails
	 */
	@Override
	void close() throws TransportException;
}
