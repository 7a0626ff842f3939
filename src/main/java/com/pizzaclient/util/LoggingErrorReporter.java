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

package com.pizzaclient.util;

import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ErrorReporter} which writes each failure to the log at ERROR.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingErrorReporter implements ErrorReporter {
	@NonNull
	private final Logger logger;

	public LoggingErrorReporter() {
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Override
	public void reportError(@NonNull ApiFailure apiFailure) {
		requireNonNull(apiFailure);

		String message = switch (apiFailure.reason()) {
			case TRANSPORT_FAILED -> format("%s request to %s failed", apiFailure.endpoint().name(), apiFailure.uri());
			case MALFORMED_JSON -> format("Failed to parse JSON from %s (HTTP %d)", apiFailure.uri(), apiFailure.statusCode());
			case NOT_A_JSON_OBJECT -> format("Expected a JSON object from %s (HTTP %d)", apiFailure.uri(), apiFailure.statusCode());
		};

		if (apiFailure.cause() != null)
			getLogger().error(message, apiFailure.cause());
		else
			getLogger().error(message);
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
