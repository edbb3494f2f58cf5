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

import com.strand.transport.Transport;
import com.strand.transport.TransportException;
import org.jspecify.annotations.NonNull;

import java.util.Optional;

/**
 * Message framing and encoding on top of a {@link Transport}.
 * <p>
 * A server hands each connection an input protocol and an output protocol; the request processor reads requests from
 * the former and writes responses to the latter.  Each instance is owned by a single worker and need not be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Protocol {
	/**
	 * Reads the next message, blocking until one is available.
	 *
	 * @return the message, or {@link Optional#empty()} if the peer closed the connection cleanly between messages
	 * @throws TransportException if the underlying transport fails
	 * @throws ProtocolException  if the data on the wire is not a valid message
	 */
	@NonNull
	Optional<String> readMessage() throws TransportException, ProtocolException;

	/**
	 * Encodes and buffers a message.  Call {@link #flush()} to send it.
	 *
	 * @param message the message to write
	 * @throws TransportException if the underlying transport fails
	 * @throws ProtocolException  if the message cannot be encoded
	 */
	void writeMessage(@NonNull String message) throws TransportException, ProtocolException;

	/**
	 * Sends any buffered messages.
	 *
	 * @throws TransportException if the underlying transport fails
	 */
	void flush() throws TransportException;

	/**
	 * The transport this protocol reads from or writes to.
	 *
	 * @return the transport
	 */
	@NonNull
	Transport getTransport();
}
