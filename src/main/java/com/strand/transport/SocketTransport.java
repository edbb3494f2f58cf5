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

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Transport} over a connected {@link Socket}.
 * <p>
 * {@link #close()} is safe to call more than once, which matters because the input and output sides of a connection
 * usually wrap the same socket.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class SocketTransport implements Transport {
	@NonNull
	private final Socket socket;
	@NonNull
	private final InputStream inputStream;
	@NonNull
	private final OutputStream outputStream;
	@NonNull
	private final AtomicBoolean closed;

	public SocketTransport(@NonNull Socket socket) throws TransportException {
		requireNonNull(socket);

		this.socket = socket;
		this.closed = new AtomicBoolean(false);

		try {
			this.inputStream = socket.getInputStream();
			this.outputStream = socket.getOutputStream();
		} catch (IOException e) {
			throw new TransportException(TransportException.Type.NOT_OPEN, "Unable to acquire socket streams", e);
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{remoteAddress=%s}", getClass().getSimpleName(), getRemoteAddress().orElse(null));
	}

	@Override
	@NonNull
	public Boolean isOpen() {
		return !getClosed().get() && getSocket().isConnected() && !getSocket().isClosed();
	}

	@Override
	@NonNull
	public Boolean peek() throws TransportException {
		if (!isOpen())
			return false;

		try {
			return getInputStream().available() > 0;
		} catch (IOException e) {
			throw new TransportException(TransportException.Type.UNKNOWN, "Unable to check socket for available input", e);
		}
	}

	@Override
	public int read(@NonNull byte[] buffer,
									int offset,
									int length) throws TransportException {
		requireNonNull(buffer);
		ensureOpen();

		try {
			return getInputStream().read(buffer, offset, length);
		} catch (SocketTimeoutException e) {
			throw new TransportException(TransportException.Type.TIMED_OUT, "Timed out reading from socket", e);
		} catch (IOException e) {
			throw new TransportException(TransportException.Type.UNKNOWN, format("Unable to read from socket: %s", e.getMessage()), e);
		}
	}

	@Override
	public void write(@NonNull byte[] buffer,
										int offset,
										int length) throws TransportException {
		requireNonNull(buffer);
		ensureOpen();

		try {
			getOutputStream().write(buffer, offset, length);
		} catch (IOException e) {
			throw new TransportException(TransportException.Type.UNKNOWN, format("Unable to write to socket: %s", e.getMessage()), e);
		}
	}

	@Override
	public void flush() throws TransportException {
		ensureOpen();

		try {
			getOutputStream().flush();
		} catch (IOException e) {
			throw new TransportException(TransportException.Type.UNKNOWN, format("Unable to flush socket: %s", e.getMessage()), e);
		}
	}

	@Override
	public void close() throws TransportException {
		if (!getClosed().compareAndSet(false, true))
			return;

		try {
			getSocket().close();
		} catch (IOException e) {
			throw new TransportException(TransportException.Type.UNKNOWN, "Unable to close socket", e);
		}
	}

	/**
	 * The address of the peer on the other end of this socket, if connected.
	 *
	 * @return the remote address, or {@link Optional#empty()} if not available
	 */
	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		SocketAddress socketAddress = getSocket().getRemoteSocketAddress();
		return socketAddress instanceof InetSocketAddress ? Optional.of((InetSocketAddress) socketAddress) : Optional.empty();
	}

	protected void ensureOpen() throws TransportException {
		if (!isOpen())
			throw new TransportException(TransportException.Type.NOT_OPEN, "Socket is not open");
	}

	@NonNull
	protected Socket getSocket() {
		return this.socket;
	}

	@NonNull
	protected InputStream getInputStream() {
		return this.inputStream;
	}

	@NonNull
	protected OutputStream getOutputStream() {
		return this.outputStream;
	}

	@NonNull
	protected AtomicBoolean getClosed() {
		return this.closed;
	}
}
