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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * TCP {@link ServerTransport} backed by a {@link ServerSocket}.
 * <p>
 * A blocked {@link #accept()} wakes up every {@code acceptPollInterval} to see whether it has been interrupted, so
 * {@link #interrupt()} unblocks it within one interval without closing the listening socket.
 * <p>
 * For example:
 * <pre>{@code  ServerTransport serverTransport = ServerSocketTransport.withPort(9090)
 *   .host("127.0.0.1")
 *   .socketTimeout(Duration.ofSeconds(30))
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerSocketTransport implements ServerTransport {
	@NonNull
	private static final Integer DEFAULT_BACKLOG;
	@NonNull
	private static final Duration DEFAULT_ACCEPT_POLL_INTERVAL;
	@NonNull
	private static final Boolean DEFAULT_REUSE_ADDRESS;
	@NonNull
	private static final Duration MAXIMUM_SOCKET_TIMEOUT;

	static {
		DEFAULT_BACKLOG = 0;
		DEFAULT_ACCEPT_POLL_INTERVAL = Duration.ofMillis(100);
		DEFAULT_REUSE_ADDRESS = true;
		// Socket timeouts are int milliseconds
		MAXIMUM_SOCKET_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);
	}

	@NonNull
	private final Integer port;
	@Nullable
	private final String host;
	@NonNull
	private final Integer backlog;
	@NonNull
	private final Duration acceptPollInterval;
	@Nullable
	private final Duration socketTimeout;
	@NonNull
	private final Boolean reuseAddress;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicBoolean interrupted;
	@Nullable
	private volatile ServerSocket serverSocket;

	@NonNull
	public static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	protected ServerSocketTransport(@NonNull Builder builder) {
		requireNonNull(builder);

		this.port = builder.port;
		this.host = builder.host;
		this.backlog = builder.backlog != null ? builder.backlog : DEFAULT_BACKLOG;
		this.acceptPollInterval = builder.acceptPollInterval != null ? builder.acceptPollInterval : DEFAULT_ACCEPT_POLL_INTERVAL;
		this.socketTimeout = builder.socketTimeout;
		this.reuseAddress = builder.reuseAddress != null ? builder.reuseAddress : DEFAULT_REUSE_ADDRESS;
		this.lock = new ReentrantLock();
		this.interrupted = new AtomicBoolean(false);

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port must be in the range [0, 65535], but was %d", this.port));

		if (this.backlog < 0)
			throw new IllegalArgumentException("Backlog must be >= 0");

		if (this.acceptPollInterval.isNegative() || this.acceptPollInterval.isZero())
			throw new IllegalArgumentException("Accept poll interval must be > 0");

		if (this.acceptPollInterval.compareTo(MAXIMUM_SOCKET_TIMEOUT) > 0)
			throw new IllegalArgumentException(format("Accept poll interval must be <= %d ms", MAXIMUM_SOCKET_TIMEOUT.toMillis()));

		if (this.socketTimeout != null && this.socketTimeout.isNegative())
			throw new IllegalArgumentException("Socket timeout must be >= 0");

		if (this.socketTimeout != null && this.socketTimeout.compareTo(MAXIMUM_SOCKET_TIMEOUT) > 0)
			throw new IllegalArgumentException(format("Socket timeout must be <= %d ms", MAXIMUM_SOCKET_TIMEOUT.toMillis()));
	}

	@Override
	public void listen() throws TransportException {
		getLock().lock();

		try {
			if (this.serverSocket != null)
				throw new TransportException(TransportException.Type.ALREADY_OPEN, "Server socket is already listening");

			InetSocketAddress address = getHost().isPresent()
					? new InetSocketAddress(getHost().get(), getPort())
					: new InetSocketAddress(getPort());

			ServerSocket serverSocket = null;

			try {
				serverSocket = new ServerSocket();
				serverSocket.setReuseAddress(getReuseAddress());
				serverSocket.setSoTimeout(Math.toIntExact(Math.max(1L, getAcceptPollInterval().toMillis())));
				serverSocket.bind(address, getBacklog());
			} catch (IOException e) {
				closeQuietly(serverSocket);
				throw new TransportException(TransportException.Type.NOT_OPEN, format("Unable to listen on %s: %s", address, e.getMessage()), e);
			}

			getInterrupted().set(false);
			this.serverSocket = serverSocket;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public Transport accept() throws TransportException {
		ServerSocket serverSocket = this.serverSocket;

		if (serverSocket == null)
			throw new TransportException(TransportException.Type.NOT_OPEN, "Server socket is not listening");

		while (true) {
			if (getInterrupted().get())
				throw new TransportException(TransportException.Type.INTERRUPTED, "Accept was interrupted");

			Socket socket;

			try {
				socket = serverSocket.accept();
			} catch (SocketTimeoutException e) {
				// Poll interval elapsed; re-check for interruption
				continue;
			} catch (IOException e) {
				if (serverSocket.isClosed() || getInterrupted().get())
					throw new TransportException(TransportException.Type.INTERRUPTED, "Server socket was closed during accept", e);

				throw new TransportException(TransportException.Type.UNKNOWN, format("Unable to accept connection: %s", e.getMessage()), e);
			}

			try {
				socket.setTcpNoDelay(true);

				if (getSocketTimeout().isPresent())
					socket.setSoTimeout(Math.toIntExact(getSocketTimeout().get().toMillis()));
			} catch (SocketException | RuntimeException e) {
				closeQuietly(socket);
				throw new TransportException(TransportException.Type.UNKNOWN, "Unable to configure accepted socket", e);
			}

			return new SocketTransport(socket);
		}
	}

	@Override
	public void interrupt() {
		getInterrupted().set(true);
	}

	@Override
	public void close() throws TransportException {
		getLock().lock();

		try {
			ServerSocket serverSocket = this.serverSocket;

			if (serverSocket == null)
				return;

			this.serverSocket = null;

			try {
				serverSocket.close();
			} catch (IOException e) {
				throw new TransportException(TransportException.Type.UNKNOWN, "Unable to close server socket", e);
			}
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * The port this transport is bound to, which is useful when it was configured with port {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if not listening
	 */
	@NonNull
	public Optional<Integer> getLocalPort() {
		ServerSocket serverSocket = this.serverSocket;
		return serverSocket == null ? Optional.empty() : Optional.of(serverSocket.getLocalPort());
	}

	@NonNull
	public Boolean isListening() {
		return this.serverSocket != null;
	}

	protected void closeQuietly(@Nullable AutoCloseable closeable) {
		if (closeable == null)
			return;

		try {
			closeable.close();
		} catch (Exception ignored) {
			// Already failing; the original exception is what gets reported
		}
	}

	@NonNull
	protected Integer getPort() {
		return this.port;
	}

	@NonNull
	protected Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	protected Integer getBacklog() {
		return this.backlog;
	}

	@NonNull
	protected Duration getAcceptPollInterval() {
		return this.acceptPollInterval;
	}

	@NonNull
	protected Optional<Duration> getSocketTimeout() {
		return Optional.ofNullable(this.socketTimeout);
	}

	@NonNull
	protected Boolean getReuseAddress() {
		return this.reuseAddress;
	}

	@NonNull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	protected AtomicBoolean getInterrupted() {
		return this.interrupted;
	}

	/**
	 * Builder used to construct instances of {@link ServerSocketTransport}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer port;
		@Nullable
		private String host;
		@Nullable
		private Integer backlog;
		@Nullable
		private Duration acceptPollInterval;
		@Nullable
		private Duration socketTimeout;
		@Nullable
		private Boolean reuseAddress;

		private Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder backlog(@Nullable Integer backlog) {
			this.backlog = backlog;
			return this;
		}

		@NonNull
		public Builder acceptPollInterval(@Nullable Duration acceptPollInterval) {
			this.acceptPollInterval = acceptPollInterval;
			return this;
		}

		@NonNull
		public Builder socketTimeout(@Nullable Duration socketTimeout) {
			this.socketTimeout = socketTimeout;
			return this;
		}

		@NonNull
		public Builder reuseAddress(@Nullable Boolean reuseAddress) {
			this.reuseAddress = reuseAddress;
			return this;
		}

		@NonNull
		public ServerSocketTransport build() {
			return new ServerSocketTransport(this);
		}
	}
}
