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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;
import java.util.function.Consumer;

import static com.strand.Utilities.describe;
import static com.strand.Utilities.safelyHandleLogEvent;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Services a single accepted connection on its own thread, then deregisters itself from the {@link WorkerRegistry}.
 * <p>
 * Requests are processed for as long as the {@link Processor} reports that another may follow <em>and</em> more input
 * is immediately available.  A client that does not pipeline its next request ends the connection after the current
 * response rather than holding a worker while idle.
 * <p>
 * Nothing that goes wrong here escapes {@link #run()}: failures are reported to the {@link LogEventHandler} and each
 * cleanup step runs regardless of whether the previous one failed.
 * <p>
 * Instances are run exactly once, by a single thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
final class ConnectionWorker implements Runnable {
	@NonNull
	private final WorkerRegistry workerRegistry;
	@NonNull
	private final Processor processor;
	@NonNull
	private final Protocol inputProtocol;
	@NonNull
	private final Protocol outputProtocol;
	@Nullable
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final LogEventHandler logEventHandler;

	ConnectionWorker(@NonNull WorkerRegistry workerRegistry,
									 @NonNull Processor processor,
									 @NonNull Protocol inputProtocol,
									 @NonNull Protocol outputProtocol,
									 @Nullable LifecycleObserver lifecycleObserver,
									 @NonNull LogEventHandler logEventHandler) {
		requireNonNull(workerRegistry);
		requireNonNull(processor);
		requireNonNull(inputProtocol);
		requireNonNull(outputProtocol);
		requireNonNull(logEventHandler);

		this.workerRegistry = workerRegistry;
		this.processor = processor;
		this.inputProtocol = inputProtocol;
		this.outputProtocol = outputProtocol;
		this.lifecycleObserver = lifecycleObserver;
		this.logEventHandler = logEventHandler;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{inputTransport=%s}", getClass().getSimpleName(), getInputProtocol().getTransport());
	}

	@Override
	public void run() {
		try {
			safelyNotifyLifecycleObserver("didBeginConnection",
					(lifecycleObserver) -> lifecycleObserver.didBeginConnection(getInputProtocol(), getOutputProtocol()));

			processRequests();

			safelyNotifyLifecycleObserver("didEndConnection",
					(lifecycleObserver) -> lifecycleObserver.didEndConnection(getInputProtocol(), getOutputProtocol()));

			try {
				getInputProtocol().getTransport().close();
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.WORKER_INPUT_CLOSE_FAILED, format("Input close failed: %s", describe(t)))
						.throwable(t)
						.build());
			}

			try {
				getOutputProtocol().getTransport().close();
			} catch (Throwable t) {
				safelyLog(LogEvent.with(LogEventType.WORKER_OUTPUT_CLOSE_FAILED, format("Output close failed: %s", describe(t)))
						.throwable(t)
						.build());
			}
		} finally {
			getWorkerRegistry().deregister(this);
		}
	}

	private void processRequests() {
		try {
			while (getProcessor().process(getInputProtocol(), getOutputProtocol())) {
				if (!getInputProtocol().getTransport().peek())
					break;
			}
		} catch (Throwable t) {
			FailureKind failureKind = FailureKind.forThrowable(t);

			if (failureKind == FailureKind.TRANSPORT) {
				safelyLog(LogEvent.with(LogEventType.WORKER_CLIENT_DIED, format("Client died: %s", describe(t)))
						.throwable(t)
						.build());
			} else if (failureKind == FailureKind.PROTOCOL) {
				safelyLog(LogEvent.with(LogEventType.WORKER_PROCESSING_FAILED, format("Request processing failed: %s", describe(t)))
						.throwable(t)
						.build());
			} else {
				safelyLog(LogEvent.with(LogEventType.WORKER_UNEXPECTED_ERROR, "Uncaught exception while servicing connection")
						.throwable(t)
						.build());
			}
		}
	}

	private void safelyNotifyLifecycleObserver(@NonNull String methodName,
																						 @NonNull Consumer<LifecycleObserver> lifecycleObserverConsumer) {
		requireNonNull(methodName);
		requireNonNull(lifecycleObserverConsumer);

		LifecycleObserver lifecycleObserver = getLifecycleObserver().orElse(null);

		if (lifecycleObserver == null)
			return;

		try {
			lifecycleObserverConsumer.accept(lifecycleObserver);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
							format("An exception occurred while invoking %s::%s", LifecycleObserver.class.getSimpleName(), methodName))
					.throwable(t)
					.build());
		}
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		safelyHandleLogEvent(getLogEventHandler(), logEvent);
	}

	@NonNull
	WorkerRegistry getWorkerRegistry() {
		return this.workerRegistry;
	}

	@NonNull
	Processor getProcessor() {
		return this.processor;
	}

	@NonNull
	Protocol getInputProtocol() {
		return this.inputProtocol;
	}

	@NonNull
	Protocol getOutputProtocol() {
		return this.outputProtocol;
	}

	@NonNull
	Optional<LifecycleObserver> getLifecycleObserver() {
		return Optional.ofNullable(this.lifecycleObserver);
	}

	@NonNull
	LogEventHandler getLogEventHandler() {
		return this.logEventHandler;
	}
}
