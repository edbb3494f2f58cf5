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

import com.strand.protocol.LineProtocol;
import com.strand.protocol.ProtocolFactory;
import com.strand.transport.ServerTransport;
import com.strand.transport.TransportFactory;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.concurrent.ThreadFactory;

import static java.util.Objects.requireNonNull;

/**
 * A server which services each accepted connection on its own dedicated thread.
 * <p>
 * For example:
 * <pre>{@code  Server server = Server.with(ServerSocketTransport.withPort(9090).build(), processor)
 *   .transportFactory(BufferedTransport.factory())
 *   .build();
 *
 * Thread serverThread = new Thread(server::serve);
 * serverThread.start();
 *
 * // Later...
 * server.stop();
 * serverThread.join();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server {
	/**
	 * Listens for and services connections until {@link #stop()} is called, then closes the listening transport and
	 * blocks until every in-flight worker has finished.
	 * <p>
	 * This method blocks the calling thread.  It may be invoked again after it returns.
	 * <p>
	 * Failures are never thrown from this method; they are reported to the configured {@link LogEventHandler}.  If the
	 * listening transport cannot be opened, this method returns immediately.
	 *
	 * @throws IllegalStateException if this server is already serving on another thread
	 */
	void serve();

	/**
	 * Requests that {@link #serve()} stop accepting connections, drain its workers, and return.
	 * <p>
	 * This method does not wait for shutdown to complete.  Calling it more than once has the same effect as calling
	 * it once.  If it is called while the server is not serving, the next call to {@link #serve()} returns without
	 * accepting any connections.
	 */
	void stop();

	/**
	 * Is {@link #serve()} currently running?
	 *
	 * @return {@code true} if serving, {@code false} otherwise
	 */
	@NonNull
	Boolean isServing();

	/**
	 * Has {@link #stop()} been called since {@link #serve()} last finished shutting down?
	 *
	 * @return {@code true} if a stop was requested, {@code false} otherwise
	 */
	@NonNull
	Boolean isStopRequested();

	/**
	 * Acquires a builder for a standard {@link Server} implementation.
	 *
	 * @param serverTransport the listening transport
	 * @param processor       the request processor shared by all workers
	 * @return the builder
	 */
	@NonNull
	static Builder with(@NonNull ServerTransport serverTransport,
											@NonNull Processor processor) {
		requireNonNull(serverTransport);
		requireNonNull(processor);

		return new Builder(serverTransport, processor);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * Unless otherwise specified, transports are used as accepted (no wrapping), messages are framed with
	 * {@link LineProtocol}, each connection gets a new virtual thread (or platform thread, if the runtime does not
	 * support virtual threads), and log events are written to {@code System.err}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		ServerTransport serverTransport;
		@NonNull
		Processor processor;
		@Nullable
		TransportFactory inputTransportFactory;
		@Nullable
		TransportFactory outputTransportFactory;
		@Nullable
		ProtocolFactory inputProtocolFactory;
		@Nullable
		ProtocolFactory outputProtocolFactory;
		@Nullable
		ThreadFactory threadFactory;
		@Nullable
		LifecycleObserver lifecycleObserver;
		@Nullable
		LogEventHandler logEventHandler;

		private Builder(@NonNull ServerTransport serverTransport,
										@NonNull Processor processor) {
			requireNonNull(serverTransport);
			requireNonNull(processor);

			this.serverTransport = serverTransport;
			this.processor = processor;
		}

		@NonNull
		public Builder serverTransport(@NonNull ServerTransport serverTransport) {
			requireNonNull(serverTransport);
			this.serverTransport = serverTransport;
			return this;
		}

		@NonNull
		public Builder processor(@NonNull Processor processor) {
			requireNonNull(processor);
			this.processor = processor;
			return this;
		}

		/**
		 * Uses the same factory for both the input and output sides of each connection.
		 * <p>
		 * The default is {@link TransportFactory#identity()}, which leaves connections unbuffered.  The default
		 * {@link LineProtocol} reads a byte at a time, so socket servers should pass
		 * {@link com.strand.transport.BufferedTransport#factory()} here.
		 */
		@NonNull
		public Builder transportFactory(@Nullable TransportFactory transportFactory) {
			this.inputTransportFactory = transportFactory;
			this.outputTransportFactory = transportFactory;
			return this;
		}

		@NonNull
		public Builder inputTransportFactory(@Nullable TransportFactory inputTransportFactory) {
			this.inputTransportFactory = inputTransportFactory;
			return this;
		}

		@NonNull
		public Builder outputTransportFactory(@Nullable TransportFactory outputTransportFactory) {
			this.outputTransportFactory = outputTransportFactory;
			return this;
		}

		/**
		 * Uses the same factory for both the input and output sides of each connection.
		 */
		@NonNull
		public Builder protocolFactory(@Nullable ProtocolFactory protocolFactory) {
			this.inputProtocolFactory = protocolFactory;
			this.outputProtocolFactory = protocolFactory;
			return this;
		}

		@NonNull
		public Builder inputProtocolFactory(@Nullable ProtocolFactory inputProtocolFactory) {
			this.inputProtocolFactory = inputProtocolFactory;
			return this;
		}

		@NonNull
		public Builder outputProtocolFactory(@Nullable ProtocolFactory outputProtocolFactory) {
			this.outputProtocolFactory = outputProtocolFactory;
			return this;
		}

		@NonNull
		public Builder threadFactory(@Nullable ThreadFactory threadFactory) {
			this.threadFactory = threadFactory;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder logEventHandler(@Nullable LogEventHandler logEventHandler) {
			this.logEventHandler = logEventHandler;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
