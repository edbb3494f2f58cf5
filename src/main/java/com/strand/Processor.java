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
import com.strand.protocol.ProtocolException;
import com.strand.transport.TransportException;
import org.jspecify.annotations.NonNull;

/**
 * Executes request/response cycles for a connection.
 * <p>
 * A single instance is shared by every worker of a {@link Server}, so implementations must be threadsafe.
 * <p>
 * For example, an echo processor:
 * <pre>{@code  Processor processor = (inputProtocol, outputProtocol) -> {
 *   Optional<String> request = inputProtocol.readMessage();
 *
 *   if (request.isEmpty())
 *     return false;
 *
 *   outputProtocol.writeMessage(request.get());
 *   outputProtocol.flush();
 *   return true;
 * };}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Processor {
	/**
	 * Reads one request from {@code inputProtocol} and writes its response to {@code outputProtocol}.
	 *
	 * @param inputProtocol  the protocol to read the request from
	 * @param outputProtocol the protocol to write the response to
	 * @return {@code true} if another request may follow on this connection, {@code false} if the peer has no further
	 * requests (e.g. it closed the connection cleanly)
	 * @throws TransportException if the connection failed
	 * @throws ProtocolException  if the request was malformed or could not be processed
	 */
	@NonNull
	Boolean process(@NonNull Protocol inputProtocol,
									@NonNull Protocol outputProtocol) throws TransportException, ProtocolException;
}
