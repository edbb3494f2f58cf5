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
import com.strand.protocol.Protocol;
import com.strand.protocol.ProtocolException;
import com.strand.protocol.ProtocolFactory;
import com.strand.transport.ServerTransport;
import com.strand.transport.Transport;
import com.strand.transport.TransportException;
import com.strand.transport.TransportFactory;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static com.strand.Utilities.describe;
import static com.strand.Utilities.safelyHandleLogEvent;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer implements Server {
	@NonNull
	private static final String DEFAULT_WORKER_THREAD_NAME_PREFIX;

	static {
		DEFAULT_WORKER_THREAD_NAME_PREFIX = "connection-worker-";
	}

	@NonNull
	private final ServerTransport serverTransport;
	@NonNull
	private final Processor processor;
	@NonNull
	private final TransportFactory inputTransportFactory;
	@NonNull
	private final TransportFactory outputTransportFactory;
	@NonNull
	private final ProtocolFactory inputProtocolFactory;
	@NonNull
	private final ProtocolFactory outputProtocolFactory;
	@NonNull
	private final ThreadFactory threadFactory;
	@Nullable
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final LogEventHandler logEventHandler;
	@NonNull
	private final WorkerRegistry workerRegistry;
	@NonNull
	private final AtomicBoolean stopRequested;
	@NonNull
	private final AtomicBoolean serving;

	DefaultServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.serverTransport = builder.serverTransport;
		this.processor = builder.processor;
		this.inputTransportFactory = builder.inputTransportFactory != null ? builder.inputTransportFactory : TransportFactory.identity();
		this.outputTransportFactory = builder.outputTransportFactory != null ? builder.outputTransportFactory : TransportFactory.identity();
		this.inputProtocolFactory = builder.inputProtocolFactory != null ? builder.inputProtocolFactory : LineProtocol.factory();
		this.outputProtocolFactory = builder.outputProtocolFactory != null ? builder.outputProtocolFactory : LineProtocol.factory();
		this.lifecycleObserver = builder.lifecycleObserver;
		this.logEventHandler = builder.logEventHandler != null ? builder.logEventHandler : LogEventHandler.defaultInstance();
		this.threadFactory = builder.threadFactory != null ? builder.threadFactory : createDefaultThreadFactory();
		this.workerRegistry = new WorkerRegistry();
		this.stopRequested = new AtomicBoolean(false);
		this.serving = new AtomicBoolean(false);
	}

	@Override
	public void serve() {
		if (!getServing().compareAndSet(false, true))
			throw new IllegalStateException("This server is already serving");

		try {
			try {
				getServerTransport().listen();
			} catch (TransportException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_LISTEN_FAILED, format("Unable to listen: %s", describe(e)))
						.throwable(e)
						.build());
				return;
			}

			safelyNotifyLifecycleObserver("didStartServing", (lifecycleObserver) -> lifecycleObserver.didStartServing(this));

			acceptConnections();

			// An unknown accept-loop failure leaves without a stop request; only a requested stop drains
			if (getStopRequested().get())
				shutDown();
		} finally {
			getServing().set(false);
		}
	}

	@Override
	public void stop() {
		getStopRequested().set(true);

		try {
			getServerTransport().interrupt();
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SHUTDOWN_FAILED, format("Unable to interrupt listening transport: %s", describe(t)))
					.throwable(t)
					.build());
		}
	}

	@Override
	@NonNull
	public Boolean isServing() {
		return getServing().get();
	}

	@Override
	@NonNull
	public Boolean isStopRequested() {
		return getStopRequested().get();
	}

	protected void acceptConnections() {
		while (!getStopRequested().get()) {
			Transport client = null;
			Transport inputTransport = null;
			Transport outputTransport = null;

			try {
				client = getServerTransport().accept();

				inputTransport = getInputTransportFactory().wrapTransport(client);
				outputTransport = getOutputTransportFactory().wrapTransport(client);
				Protocol inputProtocol = getInputProtocolFactory().wrapProtocol(inputTransport);
				Protocol outputProtocol = getOutputProtocolFactory().wrapProtocol(outputTransport);

				ConnectionWorker connectionWorker = new ConnectionWorker(getWorkerRegistry(), getProcessor(),
						inputProtocol, outputProtocol, getLifecycleObserver().orElse(null), getLogEventHandler());

				launchWorker(connectionWorker);
			} catch (TransportException e) {
				closeQuietly(inputTransport, outputTransport, client);

				// An interrupted accept during shutdown is how stop() unblocks us - nothing to report
				if (!getStopRequested().get() || e.getType() != TransportException.Type.INTERRUPTED)
					safelyLog(LogEvent.with(LogEventType.SERVER_ACCEPT_FAILED, format("Listening transport died on accept: %s", describe(e)))
							.throwable(e)
							.build());
			} catch (ProtocolException e) {
				closeQuietly(inputTransport, outputTransport, client);
				safelyLog(LogEvent.with(LogEventType.SERVER_CONNECTION_SETUP_FAILED, format("Unable to set up connection: %s", describe(e)))
						.throwable(e)
						.build());
			} catch (RejectedExecutionException e) {
				closeQuietly(inputTransport, outputTransport, client);
				safelyLog(LogEvent.with(LogEventType.SERVER_WORKER_LAUNCH_FAILED, format("Unable to launch connection worker: %s", describe(e)))
						.throwable(e)
						.build());
			} catch (RuntimeException e) {
				closeQuietly(inputTransport, outputTransport, client);
				safelyLog(LogEvent.with(LogEventType.SERVER_UNKNOWN_ERROR, format("Unknown exception in accept loop, no longer serving: %s", describe(e)))
						.throwable(e)
						.build());
				break;
			}
		}
	}

	/**
	 * Registers the worker, then starts it on a new thread.
	 * <p>
	 * If the thread can't be started, the worker is deregistered so the registry never holds a worker that isn't
	 * running.
	 *
	 * @param connectionWorker the worker to launch
	 * @throws RejectedExecutionException if the worker thread could not be created or started
	 */
	protected void launchWorker(@NonNull ConnectionWorker connectionWorker) {
		requireNonNull(connectionWorker);

		getWorkerRegistry().register(connectionWorker);

		boolean launched = false;

		try {
			Thread thread = getThreadFactory().newThread(connectionWorker);

			if (thread == null)
				throw new RejectedExecutionException(format("%s declined to create a worker thread", ThreadFactory.class.getSimpleName()));

			thread.start();
			launched = true;
		} catch (RejectedExecutionException e) {
			throw e;
		} catch (RuntimeException | OutOfMemoryError e) {
			// The JVM reports native thread exhaustion as OutOfMemoryError
			throw new RejectedExecutionException("Unable to start worker thread", e);
		} finally {
			if (!launched)
				getWorkerRegistry().deregister(connectionWorker);
		}
	}

	protected void shutDown() {
		safelyNotifyLifecycleObserver("willStopServing", (lifecycleObserver) -> lifecycleObserver.willStopServing(this));

		try {
			getServerTransport().close();
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_SHUTDOWN_FAILED, format("Exception shutting down listening transport: %s", describe(t)))
					.throwable(t)
					.build());
		}

		boolean interrupted = false;

		try {
			getWorkerRegistry().awaitEmpty();
		} catch (InterruptedException e) {
			interrupted = true;
			safelyLog(LogEvent.with(LogEventType.SERVER_DRAIN_FAILED,
							format("Interrupted while waiting for %d connection worker[s] to finish", getWorkerRegistry().size()))
					.throwable(e)
					.build());
		} finally {
			if (interrupted)
				Thread.currentThread().interrupt();
		}

		getStopRequested().set(false);

		safelyNotifyLifecycleObserver("didStopServing", (lifecycleObserver) -> lifecycleObserver.didStopServing(this));
	}

	protected void closeQuietly(@Nullable Transport... transports) {
		if (transports == null)
			return;

		for (Transport transport : transports) {
			if (transport == null)
				continue;

			try {
				transport.close();
			} catch (Throwable ignored) {
				// The failure that got us here is the one worth reporting
			}
		}
	}

	protected void safelyNotifyLifecycleObserver(@NonNull String methodName,
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

	protected void safelyLog(@NonNull LogEvent logEvent) {
		safelyHandleLogEvent(getLogEventHandler(), logEvent);
	}

	@NonNull
	protected ThreadFactory createDefaultThreadFactory() {
		UncaughtExceptionHandler uncaughtExceptionHandler = (thread, throwable) ->
				safelyLog(LogEvent.with(LogEventType.WORKER_UNEXPECTED_ERROR, format("Uncaught exception on thread %s", thread.getName()))
						.throwable(throwable)
						.build());

		if (Utilities.virtualThreadsAvailable())
			return Utilities.createVirtualThreadFactory(DEFAULT_WORKER_THREAD_NAME_PREFIX, uncaughtExceptionHandler);

		return new Utilities.NonvirtualThreadFactory(DEFAULT_WORKER_THREAD_NAME_PREFIX, uncaughtExceptionHandler);
	}

	@NonNull
	protected ServerTransport getServerTransport() {
		return this.serverTransport;
	}

	@NonNull
	protected Processor getProcessor() {
		return this.processor;
	}

	@NonNull
	protected TransportFactory getInputTransportFactory() {
		return this.inputTransportFactory;
	}

	@NonNull
	protected TransportFactory getOutputTransportFactory() {
		return this.outputTransportFactory;
	}

	@NonNull
	protected ProtocolFactory getInputProtocolFactory() {
		return this.inputProtocolFactory;
	}

	@NonNull
	protected ProtocolFactory getOutputProtocolFactory() {
		return this.outputProtocolFactory;
	}

	@NonNull
	protected ThreadFactory getThreadFactory() {
		return this.threadFactory;
	}

	@NonNull
	protected Optional<LifecycleObserver> getLifecycleObserver() {
		return Optional.ofNullable(this.lifecycleObserver);
	}

	@NonNull
	protected LogEventHandler getLogEventHandler() {
		return this.logEventHandler;
	}

	@NonNull
	protected WorkerRegistry getWorkerRegistry() {
		return this.workerRegistry;
	}

	@NonNull
	protected AtomicBoolean getStopRequested() {
		return this.stopRequested;
	}

	@NonNull
	protected AtomicBoolean getServing() {
		return this.serving;
	}
}
