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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An informational "loggable" event that occurs during Strand's internal processing - for example, if a client
 * connection dies while a worker is servicing it.
 * <p>
 * These events are delivered to the server's {@link LogEventHandler}.
 * <p>
 * Instances can be acquired via the {@link #with(LogEventType, String)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LogEvent {
	@NonNull
	private final LogEventType logEventType;
	@NonNull
	private final String message;
	@Nullable
	private final Throwable throwable;
	@Nullable
	private final FailureKind failureKind;

	/**
	 * Acquires a builder for {@link LogEvent} instances.
	 *
	 * @param logEventType what kind of log event this is
	 * @param message      the message for this log event
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull LogEventType logEventType,
														 @NonNull String message) {
		requireNonNull(logEventType);
		requireNonNull(message);

		return new Builder(logEventType, message);
	}

	protected LogEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		this.logEventType = builder.logEventType;
		this.message = builder.message;
		this.throwable = builder.throwable;
		this.failureKind = builder.failureKind != null
				? builder.failureKind
				: (builder.throwable == null ? null : FailureKind.forThrowable(builder.throwable));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{logEventType=%s, message=%s, failureKind=%s, throwable=%s}", getClass().getSimpleName(),
				getLogEventType(), getMessage(), getFailureKind().orElse(null), getThrowable().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LogEvent logEvent))
			return false;

		return Objects.equals(getLogEventType(), logEvent.getLogEventType())
				&& Objects.equals(getMessage(), logEvent.getMessage())
				&& Objects.equals(getThrowable(), logEvent.getThrowable())
				&& Objects.equals(getFailureKind(), logEvent.getFailureKind());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLogEventType(), getMessage(), getThrowable(), getFailureKind());
	}

	/**
	 * The type of log event this is.
	 *
	 * @return the log event type
	 */
	@NonNull
	public LogEventType getLogEventType() {
		return this.logEventType;
	}

	/**
	 * The message for this log event.
	 *
	 * @return the message
	 */
	@NonNull
	public String getMessage() {
		return this.message;
	}

	/**
	 * The throwable for this log event, if available.
	 *
	 * @return the throwable, or {@link Optional#empty()} if not available
	 */
	@NonNull
	public Optional<Throwable> getThrowable() {
		return Optional.ofNullable(this.throwable);
	}

	/**
	 * How the failure behind this log event was classified, if this event describes a failure.
	 * <p>
	 * Unless explicitly specified, this is derived from the throwable via {@link FailureKind#forThrowable(Throwable)}.
	 *
	 * @return the failure kind, or {@link Optional#empty()} if not available
	 */
	@NonNull
	public Optional<FailureKind> getFailureKind() {
		return Optional.ofNullable(this.failureKind);
	}

	/**
	 * Builder used to construct instances of {@link LogEvent} via {@link LogEvent#with(LogEventType, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private LogEventType logEventType;
		@NonNull
		private String message;
		@Nullable
		private Throwable throwable;
		@Nullable
		private FailureKind failureKind;

		protected Builder(@NonNull LogEventType logEventType,
											@NonNull String message) {
			requireNonNull(logEventType);
			requireNonNull(message);

			this.logEventType = logEventType;
			this.message = message;
		}

		@NonNull
		public Builder logEventType(@NonNull LogEventType logEventType) {
			requireNonNull(logEventType);
			this.logEventType = logEventType;
			return this;
		}

		@NonNull
		public Builder message(@NonNull String message) {
			requireNonNull(message);
			this.message = message;
			return this;
		}

		@NonNull
		public Builder throwable(@Nullable Throwable throwable) {
			this.throwable = throwable;
			return this;
		}

		@NonNull
		public Builder failureKind(@Nullable FailureKind failureKind) {
			this.failureKind = failureKind;
			return this;
		}

		@NonNull
		public LogEvent build() {
			return new LogEvent(this);
		}
	}
}
