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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class CapturingLogEventHandler implements LogEventHandler {
	@NonNull
	private final List<LogEvent> logEvents;

	CapturingLogEventHandler() {
		this.logEvents = new CopyOnWriteArrayList<>();
	}

	@Override
	public void handleLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);
		this.logEvents.add(logEvent);
	}

	@NonNull
	List<LogEvent> getLogEvents() {
		return List.copyOf(this.logEvents);
	}

	@NonNull
	List<LogEventType> getLogEventTypes() {
		return this.logEvents.stream()
				.map(LogEvent::getLogEventType)
				.collect(Collectors.toList());
	}

	@NonNull
	Long count(@NonNull LogEventType logEventType) {
		requireNonNull(logEventType);

		return this.logEvents.stream()
				.filter(logEvent -> logEvent.getLogEventType() == logEventType)
				.count();
	}
}
