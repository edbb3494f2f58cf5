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

import com.strand.transport.ServerTransport;
import com.strand.transport.Transport;

/**
 * Kinds of {@link LogEvent} instances that Strand can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates {@link ServerTransport#listen()} failed, so the server never started serving.
	 */
	SERVER_LISTEN_FAILED,
	/**
	 * Indicates {@link ServerTransport#accept()} or a transport factory failed for a single connection attempt.
	 */
	SERVER_ACCEPT_FAILED,
	/**
	 * Indicates a protocol factory failed for a single connection attempt.
	 */
	SERVER_CONNECTION_SETUP_FAILED,
	/**
	 * Indicates a worker thread could not be created or started for an accepted connection.
	 */
	SERVER_WORKER_LAUNCH_FAILED,
	/**
	 * Indicates an unexpected error occurred in the accept loop; the server stopped serving without draining workers.
	 */
	SERVER_UNKNOWN_ERROR,
	/**
	 * Indicates the listening transport could not be interrupted or closed during shutdown.
	 */
	SERVER_SHUTDOWN_FAILED,
	/**
	 * Indicates waiting for in-flight workers to finish was itself interrupted.
	 */
	SERVER_DRAIN_FAILED,
	/**
	 * Indicates a client connection failed at the transport level while a worker was servicing it.
	 */
	WORKER_CLIENT_DIED,
	/**
	 * Indicates a {@link Processor} rejected a request or a protocol could not decode it.
	 */
	WORKER_PROCESSING_FAILED,
	/**
	 * Indicates an unexpected error occurred while a worker was servicing a connection.
	 */
	WORKER_UNEXPECTED_ERROR,
	/**
	 * Indicates {@link Transport#close()} failed for a worker's input channel.
	 */
	WORKER_INPUT_CLOSE_FAILED,
	/**
	 * Indicates {@link Transport#close()} failed for a worker's output channel.
	 */
	WORKER_OUTPUT_CLOSE_FAILED,
	/**
	 * Indicates a {@link LifecycleObserver} method threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED
}
