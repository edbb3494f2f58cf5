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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Transport} which buffers reads and writes against another transport.
 * <p>
 * Buffered output is only sent on {@link #flush()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class BufferedTransport implements Transport {
	@NonNull
	private static final Integer DEFAULT_BUFFER_SIZE_IN_BYTES;

	static {
		DEFAULT_BUFFER_SIZE_IN_BYTES = 1_024 * 8;
	}

	@NonNull
	private final Transport transport;
	@NonNull
	private final byte[] readBuffer;
	@NonNull
	private final byte[] writeBuffer;
	private int readPosition;
	private int readLimit;
	private int writeLength;

	/**
	 * Acquires a factory which wraps transports in a {@link BufferedTransport} with the default buffer size.
	 *
	 * @return the factory
	 */
	@NonNull
	public static TransportFactory factory() {
		return factory(DEFAULT_BUFFER_SIZE_IN_BYTES);
	}

	/**
	 * Acquires a factory which wraps transports in a {@link BufferedTransport}.
	 *
	 * @param bufferSizeInBytes size of each of the read and write buffers
	 * @return the factory
	 */
	@NonNull
	public static TransportFactory factory(@NonNull Integer bufferSizeInBytes) {
		requireNonNull(bufferSizeInBytes);

		if (bufferSizeInBytes <= 0)
			throw new IllegalArgumentException("Buffer size must be > 0");

		return (transport) -> new BufferedTransport(transport, bufferSizeInBytes);
	}

	public BufferedTransport(@NonNull Transport transport,
													 @NonNull Integer bufferSizeInBytes) {
		requireNonNull(transport);
		requireNonNull(bufferSizeInBytes);

		if (bufferSizeInBytes <= 0)
			throw new IllegalArgumentException("Buffer size must be > 0");

		this.transport = transport;
		this.readBuffer = new byte[bufferSizeInBytes];
		this.writeBuffer = new byte[bufferSizeInBytes];
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{transport=%s}", getClass().getSimpleName(), getTransport());
	}

	@Override
	@NonNull
	public Boolean isOpen() {
		return getTransport().isOpen();
	}

	@Override
	@NonNull
	public Boolean peek() throws TransportException {
		return this.readPosition < this.readLimit || getTransport().peek();
	}

	@Override
	public int read(@NonNull byte[] buffer,
									int offset,
									int length) throws TransportException {
		requireNonNull(buffer);

		if (length == 0)
			return 0;

		if (this.readPosition >= this.readLimit) {
			// Large reads skip the buffer entirely
			if (length >= this.readBuffer.length)
				return getTransport().read(buffer, offset, length);

			int bytesRead = getTransport().read(this.readBuffer, 0, this.readBuffer.length);

			if (bytesRead <= 0)
				return bytesRead;

			this.readPosition = 0;
			this.readLimit = bytesRead;
		}

		int bytesToCopy = Math.min(length, this.readLimit - this.readPosition);
		System.arraycopy(this.readBuffer, this.readPosition, buffer, offset, bytesToCopy);
		this.readPosition += bytesToCopy;

		return bytesToCopy;
	}

	@Override
	public void write(@NonNull byte[] buffer,
										int offset,
										int length) throws TransportException {
		requireNonNull(buffer);

		if (length > this.writeBuffer.length - this.writeLength)
			flushWriteBuffer();

		if (length >= this.writeBuffer.length) {
			getTransport().write(buffer, offset, length);
			return;
		}

		System.arraycopy(buffer, offset, this.writeBuffer, this.writeLength, length);
		this.writeLength += length;
	}

	@Override
	public void flush() throws TransportException {
		flushWriteBuffer();
		getTransport().flush();
	}

	@Override
	public void close() throws TransportException {
		getTransport().close();
	}

	protected void flushWriteBuffer() throws TransportException {
		if (this.writeLength == 0)
			return;

		int length = this.writeLength;
		this.writeLength = 0;
		getTransport().write(this.writeBuffer, 0, length);
	}

	@NonNull
	protected Transport getTransport() {
		return this.transport;
	}
}
