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

import javax.annotation.concurrent.ThreadSafe;
import java.lang.Thread.UncaughtExceptionHandler;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Assorted utilities used internally by Strand.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class Utilities {
	@NonNull
	private static final Boolean VIRTUAL_THREADS_AVAILABLE;

	static {
		boolean virtualThreadsAvailable = false;

		try {
			// Detect if Virtual Threads are usable by feature testing via reflection.
			// Hat tip to https://github.com/javalin/javalin for this technique
			Class.forName("java.lang.Thread$Builder$OfVirtual");
			virtualThreadsAvailable = true;
		} catch (Exception ignored) {
			// We don't care why this failed, but if we're here we know JVM does not support virtual threads
		}

		VIRTUAL_THREADS_AVAILABLE = virtualThreadsAvailable;
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Does the platform runtime support virtual threads (Java 21+)?
	 *
	 * @return {@code true} if the runtime supports virtual threads, {@code false} otherwise
	 */
	@NonNull
	static Boolean virtualThreadsAvailable() {
		return VIRTUAL_THREADS_AVAILABLE;
	}

	/**
	 * Provides a virtual-thread factory if supported by the runtime.
	 * <p>
	 * Strand compiles against Java 17, so there are no hard references to virtual threads; the factory is created via
	 * {@link MethodHandle} references instead.
	 * <p>
	 * <strong>You should not call this method if {@link Utilities#virtualThreadsAvailable()} is {@code false}.</strong>
	 * <pre>{@code // This method is effectively equivalent to this code
	 * return Thread.ofVirtual()
	 *   .name(threadNamePrefix, 1)
	 *   .uncaughtExceptionHandler(uncaughtExceptionHandler)
	 *   .factory();}</pre>
	 *
	 * @param threadNamePrefix         thread name prefix for the virtual thread factory builder
	 * @param uncaughtExceptionHandler uncaught exception handler for the virtual thread factory builder
	 * @return a virtual-thread factory
	 * @throws IllegalStateException if the runtime environment does not support virtual threads
	 */
	@NonNull
	static ThreadFactory createVirtualThreadFactory(@NonNull String threadNamePrefix,
																									@NonNull UncaughtExceptionHandler uncaughtExceptionHandler) {
		requireNonNull(threadNamePrefix);
		requireNonNull(uncaughtExceptionHandler);

		if (!virtualThreadsAvailable())
			throw new IllegalStateException("Virtual threads are not available. Please confirm you are using Java 21+");

		Class<?> threadBuilderOfVirtualClass;

		try {
			threadBuilderOfVirtualClass = Class.forName("java.lang.Thread$Builder$OfVirtual");
		} catch (ClassNotFoundException e) {
			throw new IllegalStateException("Unable to load virtual thread builder class", e);
		}

		Lookup lookup = MethodHandles.publicLookup();

		MethodHandle methodHandleThreadOfVirtual;
		MethodHandle methodHandleThreadBuilderOfVirtualName;
		MethodHandle methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler;
		MethodHandle methodHandleThreadBuilderOfVirtualFactory;

		try {
			methodHandleThreadOfVirtual = lookup.findStatic(Thread.class, "ofVirtual", MethodType.methodType(threadBuilderOfVirtualClass));
			methodHandleThreadBuilderOfVirtualName = lookup.findVirtual(threadBuilderOfVirtualClass, "name", MethodType.methodType(threadBuilderOfVirtualClass, String.class, long.class));
			methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler = lookup.findVirtual(threadBuilderOfVirtualClass, "uncaughtExceptionHandler", MethodType.methodType(threadBuilderOfVirtualClass, UncaughtExceptionHandler.class));
			methodHandleThreadBuilderOfVirtualFactory = lookup.findVirtual(threadBuilderOfVirtualClass, "factory", MethodType.methodType(ThreadFactory.class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new IllegalStateException("Unable to load method handle for virtual thread factory", e);
		}

		try {
			// Thread.ofVirtual()
			Object virtualThreadBuilder = methodHandleThreadOfVirtual.invoke();
			// .name(threadNamePrefix, start)
			methodHandleThreadBuilderOfVirtualName.invoke(virtualThreadBuilder, threadNamePrefix, 1L);
			// .uncaughtExceptionHandler(uncaughtExceptionHandler)
			methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler.invoke(virtualThreadBuilder, uncaughtExceptionHandler);
			// .factory();
			return (ThreadFactory) methodHandleThreadBuilderOfVirtualFactory.invoke(virtualThreadBuilder);
		} catch (Throwable t) {
			throw new IllegalStateException("Unable to create virtual thread factory", t);
		}
	}

	/**
	 * Hands a log event to the given handler, making sure a misbehaving handler can never affect the caller.
	 *
	 * @param logEventHandler the handler to invoke
	 * @param logEvent        the event to handle
	 */
	static void safelyHandleLogEvent(@NonNull LogEventHandler logEventHandler,
																	 @NonNull LogEvent logEvent) {
		requireNonNull(logEventHandler);
		requireNonNull(logEvent);

		try {
			logEventHandler.handleLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LogEventHandler implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	/**
	 * Produces a short human-readable description of a throwable for inclusion in log messages.
	 *
	 * @param throwable the throwable to describe
	 * @return the description
	 */
	@NonNull
	static String describe(@Nullable Throwable throwable) {
		if (throwable == null)
			return "(none)";

		String message = throwable.getMessage();
		return message == null ? throwable.getClass().getSimpleName() : format("%s: %s", throwable.getClass().getSimpleName(), message);
	}

	/**
	 * Platform (non-virtual) thread factory which numbers the threads it creates.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	static class NonvirtualThreadFactory implements ThreadFactory {
		@NonNull
		private final String namePrefix;
		@NonNull
		private final UncaughtExceptionHandler uncaughtExceptionHandler;
		@NonNull
		private final AtomicInteger idGenerator;

		NonvirtualThreadFactory(@NonNull String namePrefix,
														@NonNull UncaughtExceptionHandler uncaughtExceptionHandler) {
			requireNonNull(namePrefix);
			requireNonNull(uncaughtExceptionHandler);

			this.namePrefix = namePrefix;
			this.uncaughtExceptionHandler = uncaughtExceptionHandler;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@NonNull
		public Thread newThread(@NonNull Runnable runnable) {
			requireNonNull(runnable);

			Thread thread = new Thread(runnable, format("%s%s", getNamePrefix(), getIdGenerator().incrementAndGet()));
			thread.setUncaughtExceptionHandler(getUncaughtExceptionHandler());
			return thread;
		}

		@NonNull
		protected String getNamePrefix() {
			return this.namePrefix;
		}

		@NonNull
		protected UncaughtExceptionHandler getUncaughtExceptionHandler() {
			return this.uncaughtExceptionHandler;
		}

		@NonNull
		protected AtomicInteger getIdGenerator() {
			return this.idGenerator;
		}
	}
}
