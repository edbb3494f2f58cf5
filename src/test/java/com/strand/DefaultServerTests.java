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
import com.strand.protocol.ProtocolException;
import com.strand.transport.InMemoryTransport;
import com.strand.transport.TransportException;
import com.strand.transport.TransportFactory;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.strand.TestSupport.awaitCondition;
import static com.strand.TestSupport.awaitQuietly;
import static com.strand.TestSupport.joinWithin;
import static com.strand.TestSupport.startServing;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DefaultServerTests {
	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	@Test
	public void concurrent_connections_are_drained_on_stop() throws Exception {
		int connectionCount = 10;
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		Queue<InMemoryTransport> wrappedTransports = new ConcurrentLinkedQueue<>();
		CountDownLatch processing = new CountDownLatch(connectionCount);
		CountDownLatch release = new CountDownLatch(1);

		DefaultServer server = (DefaultServer) Server.with(serverTransport, (in, out) -> {
					processing.countDown();
					awaitQuietly(release, Duration.ofSeconds(10));
					return false;
				})
				.transportFactory(recordingTransportFactory(wrappedTransports))
				.logEventHandler(logEventHandler)
				.build();

		for (int i = 0; i < connectionCount; ++i)
			serverTransport.enqueue(new InMemoryTransport());

		Thread serveThread = startServing(server);

		Assertions.assertTrue(processing.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS), "Not every connection reached the processor");
		Assertions.assertEquals(connectionCount, server.getWorkerRegistry().size());

		server.stop();

		// Workers are still blocked, so serve() must still be draining
		Thread.sleep(100);
		Assertions.assertTrue(serveThread.isAlive());
		Assertions.assertEquals(1, serverTransport.getCloseCount(), "Listener should close before the drain");

		release.countDown();

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT), "serve() did not return after the drain");
		Assertions.assertTrue(server.getWorkerRegistry().isEmpty());
		Assertions.assertEquals(connectionCount * 2, wrappedTransports.size());

		for (InMemoryTransport wrappedTransport : wrappedTransports)
			Assertions.assertEquals(1, wrappedTransport.getCloseCount());

		Assertions.assertEquals(0, logEventHandler.count(LogEventType.SERVER_ACCEPT_FAILED));
		Assertions.assertFalse(server.isServing());
		Assertions.assertFalse(server.isStopRequested());
	}

	@Test
	public void stop_without_connections_returns_promptly() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CountDownLatch started = new CountDownLatch(1);
		List<String> lifecycle = new CopyOnWriteArrayList<>();

		DefaultServer server = (DefaultServer) Server.with(serverTransport, (in, out) -> false)
				.lifecycleObserver(recordingLifecycleObserver(lifecycle, started))
				.logEventHandler(new CapturingLogEventHandler())
				.build();

		Thread serveThread = startServing(server);

		Assertions.assertTrue(started.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
		Assertions.assertTrue(server.isServing());

		server.stop();

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
		Assertions.assertTrue(server.getWorkerRegistry().isEmpty());
		Assertions.assertEquals(List.of("didStartServing", "willStopServing", "didStopServing"), lifecycle);
		Assertions.assertEquals(1, serverTransport.getCloseCount());
	}

	@Test
	public void stop_before_serve_makes_serve_return_without_accepting() {
		QueueServerTransport serverTransport = new QueueServerTransport();
		serverTransport.enqueue(new InMemoryTransport());
		AtomicInteger calls = new AtomicInteger(0);

		Server server = Server.with(serverTransport, (in, out) -> {
					calls.incrementAndGet();
					return false;
				})
				.logEventHandler(new CapturingLogEventHandler())
				.build();

		server.stop();
		Assertions.assertTrue(server.isStopRequested());

		server.serve();

		Assertions.assertEquals(0, calls.get());
		Assertions.assertEquals(0, serverTransport.getAcceptCount());
		Assertions.assertEquals(1, serverTransport.getCloseCount());
		Assertions.assertFalse(server.isStopRequested());
	}

	@Test
	public void repeated_stop_is_harmless_and_server_can_serve_again() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		AtomicInteger calls = new AtomicInteger(0);

		Server server = Server.with(serverTransport, (in, out) -> {
					calls.incrementAndGet();
					return false;
				})
				.logEventHandler(logEventHandler)
				.build();

		for (int cycle = 1; cycle <= 2; ++cycle) {
			Thread serveThread = startServing(server);
			serverTransport.enqueue(new InMemoryTransport());

			int expectedCalls = cycle;
			Assertions.assertTrue(awaitCondition(() -> calls.get() == expectedCalls, TIMEOUT));

			server.stop();
			server.stop();
			server.stop();

			Assertions.assertTrue(joinWithin(serveThread, TIMEOUT), "serve() did not return on cycle " + cycle);
			Assertions.assertFalse(server.isServing());
		}

		Assertions.assertEquals(2, serverTransport.getListenCount());
		Assertions.assertEquals(2, serverTransport.getCloseCount());
		Assertions.assertTrue(logEventHandler.getLogEvents().isEmpty());
	}

	@Test
	public void serving_twice_at_once_is_rejected() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CountDownLatch started = new CountDownLatch(1);

		Server server = Server.with(serverTransport, (in, out) -> false)
				.lifecycleObserver(recordingLifecycleObserver(new CopyOnWriteArrayList<>(), started))
				.logEventHandler(new CapturingLogEventHandler())
				.build();

		Thread serveThread = startServing(server);
		Assertions.assertTrue(started.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));

		Assertions.assertThrows(IllegalStateException.class, server::serve);

		server.stop();
		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
	}

	@Test
	public void listen_failure_returns_without_serving() {
		QueueServerTransport serverTransport = new QueueServerTransport()
				.listenFailure(new TransportException(TransportException.Type.NOT_OPEN, "Address in use"));
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		List<String> lifecycle = new CopyOnWriteArrayList<>();

		Server server = Server.with(serverTransport, (in, out) -> false)
				.lifecycleObserver(recordingLifecycleObserver(lifecycle, new CountDownLatch(1)))
				.logEventHandler(logEventHandler)
				.build();

		server.serve();

		Assertions.assertEquals(List.of(LogEventType.SERVER_LISTEN_FAILED), logEventHandler.getLogEventTypes());
		Assertions.assertTrue(lifecycle.isEmpty());
		Assertions.assertEquals(0, serverTransport.getCloseCount());
		Assertions.assertFalse(server.isServing());
	}

	@Test
	public void accept_failure_is_reported_and_serving_continues() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		AtomicInteger calls = new AtomicInteger(0);

		Server server = Server.with(serverTransport, (in, out) -> {
					calls.incrementAndGet();
					return false;
				})
				.logEventHandler(logEventHandler)
				.build();

		serverTransport.enqueueFailure(new TransportException(TransportException.Type.UNKNOWN, "Too many open files"));
		serverTransport.enqueue(new InMemoryTransport());

		Thread serveThread = startServing(server);

		Assertions.assertTrue(awaitCondition(() -> calls.get() == 1, TIMEOUT));

		server.stop();

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
		Assertions.assertEquals(List.of(LogEventType.SERVER_ACCEPT_FAILED), logEventHandler.getLogEventTypes());
	}

	@Test
	public void connection_setup_failure_closes_the_client_and_serving_continues() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		AtomicInteger calls = new AtomicInteger(0);
		AtomicInteger protocolsCreated = new AtomicInteger(0);
		InMemoryTransport doomedClient = new InMemoryTransport();
		InMemoryTransport healthyClient = new InMemoryTransport();

		Server server = Server.with(serverTransport, (in, out) -> {
					calls.incrementAndGet();
					return false;
				})
				.inputProtocolFactory((transport) -> {
					if (protocolsCreated.incrementAndGet() == 1)
						throw new ProtocolException(ProtocolException.Type.UNKNOWN, "Handshake failed");

					return new LineProtocol(transport, 1024);
				})
				.logEventHandler(logEventHandler)
				.build();

		serverTransport.enqueue(doomedClient);
		serverTransport.enqueue(healthyClient);

		Thread serveThread = startServing(server);

		Assertions.assertTrue(awaitCondition(() -> calls.get() == 1, TIMEOUT));

		server.stop();

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
		Assertions.assertTrue(doomedClient.getCloseCount() >= 1, "Client whose setup failed should be closed");
		Assertions.assertTrue(healthyClient.getCloseCount() >= 1);
		Assertions.assertEquals(List.of(LogEventType.SERVER_CONNECTION_SETUP_FAILED), logEventHandler.getLogEventTypes());
	}

	@Test
	public void unknown_accept_failure_ends_serving_without_draining() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		List<String> lifecycle = new CopyOnWriteArrayList<>();

		Server server = Server.with(serverTransport, (in, out) -> false)
				.lifecycleObserver(recordingLifecycleObserver(lifecycle, new CountDownLatch(1)))
				.logEventHandler(logEventHandler)
				.build();

		serverTransport.enqueueFailure(new IllegalStateException("Listener is corrupt"));

		Thread serveThread = startServing(server);

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT), "serve() should return on its own");
		Assertions.assertEquals(List.of(LogEventType.SERVER_UNKNOWN_ERROR), logEventHandler.getLogEventTypes());
		Assertions.assertEquals(List.of("didStartServing"), lifecycle);
		Assertions.assertEquals(0, serverTransport.getCloseCount());
		Assertions.assertFalse(server.isServing());
	}

	@Test
	public void worker_launch_failure_deregisters_and_serving_continues() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		Queue<InMemoryTransport> wrappedTransports = new ConcurrentLinkedQueue<>();
		AtomicInteger threadsRequested = new AtomicInteger(0);
		AtomicInteger calls = new AtomicInteger(0);

		DefaultServer server = (DefaultServer) Server.with(serverTransport, (in, out) -> {
					calls.incrementAndGet();
					return false;
				})
				.transportFactory(recordingTransportFactory(wrappedTransports))
				.threadFactory((runnable) -> threadsRequested.incrementAndGet() == 1 ? null : new Thread(runnable))
				.logEventHandler(logEventHandler)
				.build();

		serverTransport.enqueue(new InMemoryTransport());
		serverTransport.enqueue(new InMemoryTransport());

		Thread serveThread = startServing(server);

		Assertions.assertTrue(awaitCondition(() -> calls.get() == 1, TIMEOUT));

		server.stop();

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
		Assertions.assertEquals(List.of(LogEventType.SERVER_WORKER_LAUNCH_FAILED), logEventHandler.getLogEventTypes());
		Assertions.assertTrue(server.getWorkerRegistry().isEmpty());

		for (InMemoryTransport wrappedTransport : wrappedTransports)
			Assertions.assertEquals(1, wrappedTransport.getCloseCount());
	}

	@Test
	public void native_thread_exhaustion_is_reported_and_serving_continues() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		AtomicInteger threadsRequested = new AtomicInteger(0);
		AtomicInteger calls = new AtomicInteger(0);
		InMemoryTransport starvedClient = new InMemoryTransport();

		DefaultServer server = (DefaultServer) Server.with(serverTransport, (in, out) -> {
					calls.incrementAndGet();
					return false;
				})
				.threadFactory((runnable) -> {
					if (threadsRequested.incrementAndGet() > 1)
						return new Thread(runnable);

					return new Thread(runnable) {
						@Override
						public synchronized void start() {
							throw new OutOfMemoryError("unable to create native thread");
						}
					};
				})
				.logEventHandler(logEventHandler)
				.build();

		serverTransport.enqueue(starvedClient);
		serverTransport.enqueue(new InMemoryTransport());

		Thread serveThread = startServing(server);

		Assertions.assertTrue(awaitCondition(() -> calls.get() == 1, TIMEOUT), "Server should keep accepting after a failed launch");
		Assertions.assertTrue(serveThread.isAlive());

		server.stop();

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
		Assertions.assertTrue(starvedClient.getCloseCount() >= 1, "Client whose worker never started should be closed");
		Assertions.assertEquals(List.of(LogEventType.SERVER_WORKER_LAUNCH_FAILED), logEventHandler.getLogEventTypes());
		Assertions.assertTrue(logEventHandler.getLogEvents().get(0).getThrowable().get().getCause() instanceof OutOfMemoryError);
		Assertions.assertTrue(server.getWorkerRegistry().isEmpty());
	}

	@Test
	public void interrupted_drain_is_reported_and_serve_returns() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		CapturingLogEventHandler logEventHandler = new CapturingLogEventHandler();
		CountDownLatch processing = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);

		DefaultServer server = (DefaultServer) Server.with(serverTransport, (in, out) -> {
					processing.countDown();
					awaitQuietly(release, Duration.ofSeconds(10));
					return false;
				})
				.logEventHandler(logEventHandler)
				.build();

		serverTransport.enqueue(new InMemoryTransport());

		Thread serveThread = startServing(server);

		try {
			Assertions.assertTrue(processing.await(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));

			server.stop();
			Assertions.assertTrue(awaitCondition(() -> serverTransport.getCloseCount() == 1, TIMEOUT));

			serveThread.interrupt();

			Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
			Assertions.assertEquals(1, logEventHandler.count(LogEventType.SERVER_DRAIN_FAILED));
		} finally {
			release.countDown();
		}

		Assertions.assertTrue(server.getWorkerRegistry().awaitEmpty(TIMEOUT));
	}

	@Test
	public void default_thread_factory_names_worker_threads() throws Exception {
		QueueServerTransport serverTransport = new QueueServerTransport();
		Queue<String> threadNames = new ConcurrentLinkedQueue<>();

		Server server = Server.with(serverTransport, (in, out) -> {
					threadNames.add(Thread.currentThread().getName());
					return false;
				})
				.logEventHandler(new CapturingLogEventHandler())
				.build();

		serverTransport.enqueue(new InMemoryTransport());

		Thread serveThread = startServing(server);

		Assertions.assertTrue(awaitCondition(() -> !threadNames.isEmpty(), TIMEOUT));

		server.stop();

		Assertions.assertTrue(joinWithin(serveThread, TIMEOUT));
		Assertions.assertTrue(threadNames.peek().startsWith("connection-worker-"), threadNames.peek());
	}

	@NonNull
	private static TransportFactory recordingTransportFactory(@NonNull Queue<InMemoryTransport> wrappedTransports) {
		return (transport) -> {
			InMemoryTransport wrappedTransport = new InMemoryTransport();
			wrappedTransports.add(wrappedTransport);
			return wrappedTransport;
		};
	}

	@NonNull
	private static LifecycleObserver recordingLifecycleObserver(@NonNull List<String> lifecycle,
																															@NonNull CountDownLatch started) {
		return new LifecycleObserver() {
			@Override
			public void didStartServing(@NonNull Server server) {
				lifecycle.add("didStartServing");
				started.countDown();
			}

			@Override
			public void willStopServing(@NonNull Server server) {
				lifecycle.add("willStopServing");
			}

			@Override
			public void didStopServing(@NonNull Server server) {
				lifecycle.add("didStopServing");
			}
		};
	}
}
