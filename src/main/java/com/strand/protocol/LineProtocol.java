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

import javax.annotation.concurrent.NotThreadSafe;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Protocol} where each message is a single line of UTF-8 text terminated by {@code \n}.
 * <p>
 * A trailing {@code \r} is stripped from incoming lines, so {@code \r\n}-terminated clients work too.  The maximum
 * line length counts neither terminator.
 * <p>
 * Bytes are read from the transport one at a time, so wrap socket transports in a
 * {@link com.strand.transport.BufferedTransport}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class LineProtocol implements Protocol {
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_LINE_LENGTH_IN_BYTES;
	@NonNull
	private static final Integer INITIAL_LINE_BUFFER_SIZE_IN_BYTES;

	static {
		DEFAULT_MAXIMUM_LINE_LENGTH_IN_BYTES = 1_024 * 64;
		INITIAL_LINE_BUFFER_SIZE_IN_BYTES = 1_024;
	}

	@NonNull
	private final Transport transport;
	@NonNull
	private final Integer maximumLineLengthInBytes;
	@NonNull
	private final CharsetDecoder charsetDecoder;
	@NonNull
	private final byte[] singleByte;
	@NonNull
	private byte[] lineBuffer;
	private int lineLength;

	@NonNull
	public static ProtocolFactory factory() {
		return factory(DEFAULT_MAXIMUM_LINE_LENGTH_IN_BYTES);
	}

	@NonNull
	public static ProtocolFactory factory(@NonNull Integer maximumLineLengthInBytes) {
		requireNonNull(maximumLineLengthInBytes);

		if (maximumLineLengthInBytes <= 0)
			throw new IllegalArgumentException("Maximum line length must be > 0");

		return (transport) -> new LineProtocol(transport, maximumLineLengthInBytes);
	}

	public LineProtocol(@NonNull Transport transport,
											@NonNull Integer maximumLineLengthInBytes) {
		requireNonNull(transport);
		requireNonNull(maximumLineLengthInBytes);

		if (maximumLineLengthInBytes <= 0)
			throw new IllegalArgumentException("Maximum line length must be > 0");

		this.transport = transport;
		this.maximumLineLengthInBytes = maximumLineLengthInBytes;
		this.charsetDecoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		this.singleByte = new byte[1];
		this.lineBuffer = new byte[Math.min(INITIAL_LINE_BUFFER_SIZE_IN_BYTES, maximumLineLengthInBytes)];
	}

	@Override
	@NonNull
	public Optional<String> readMessage() throws TransportException, ProtocolException {
		this.lineLength = 0;

		while (true) {
			int bytesRead = getTransport().read(this.singleByte, 0, 1);

			if (bytesRead < 0) {
				if (this.lineLength == 0)
					return Optional.empty();

				throw new ProtocolException(ProtocolException.Type.INVALID_DATA,
						format("Connection ended after %d bytes of an unterminated line", this.lineLength));
			}

			if (bytesRead == 0)
				continue;

			byte nextByte = this.singleByte[0];

			if (nextByte == '\n')
				return Optional.of(popLine());

			// A carriage return just past the limit is allowed since popLine() strips it
			if (this.lineLength > getMaximumLineLengthInBytes()
					|| (this.lineLength == getMaximumLineLengthInBytes() && nextByte != '\r'))
				throw new ProtocolException(ProtocolException.Type.SIZE_LIMIT,
						format("Line exceeds maximum length of %d bytes", getMaximumLineLengthInBytes()));

			pushByte(nextByte);
		}
	}

	@Override
	public void writeMessage(@NonNull String message) throws TransportException, ProtocolException {
		requireNonNull(message);

		if (message.indexOf('\n') >= 0)
			throw new ProtocolException(ProtocolException.Type.INVALID_DATA, "Messages may not contain a newline");

		byte[] bytes = (message + "\n").getBytes(StandardCharsets.UTF_8);
		getTransport().write(bytes, 0, bytes.length);
	}

	@Override
	public void flush() throws TransportException {
		getTransport().flush();
	}

	@Override
	@NonNull
	public Transport getTransport() {
		return this.transport;
	}

	@NonNull
	public Integer getMaximumLineLengthInBytes() {
		return this.maximumLineLengthInBytes;
	}

	protected void pushByte(byte nextByte) {
		if (this.lineLength >= this.lineBuffer.length)
			this.lineBuffer = Arrays.copyOf(this.lineBuffer, Math.min(this.lineLength * 2, getMaximumLineLengthInBytes() + 1));

		this.lineBuffer[this.lineLength++] = nextByte;
	}

	@NonNull
	protected String popLine() throws ProtocolException {
		int length = this.lineLength;

		if (length > 0 && this.lineBuffer[length - 1] == '\r')
			--length;

		this.lineLength = 0;

		try {
			return this.charsetDecoder.decode(ByteBuffer.wrap(this.lineBuffer, 0, length)).toString();
		} catch (CharacterCodingException e) {
			throw new ProtocolException(ProtocolException.Type.INVALID_DATA, "Line is not valid UTF-8", e);
		}
	}
}
