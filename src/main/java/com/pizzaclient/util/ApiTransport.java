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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.net.URI;

import static java.util.Objects.requireNonNull;

/**
 * Contract for issuing GET requests against the upstream API.
 * <p>
 * A mock implementor might serve canned documents from the filesystem for local development,
 * while a real implementor talks HTTP.  Retries, caching and deadlines beyond a single request timeout are not its concern.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface ApiTransport {
	@NonNull
	ApiResponse get(@NonNull ApiRequest request) throws ApiTransportException;

	enum Type {
		MOCK,
		REAL
	}

	record ApiRequest(
			@NonNull ApiEndpoint endpoint,
			@NonNull URI uri
	) {
		public ApiRequest {
			requireNonNull(endpoint);
			requireNonNull(uri);
		}
	}

	record ApiResponse(
			@NonNull Integer statusCode,
			@NonNull String body
	) {
		public ApiResponse {
			requireNonNull(statusCode);
			requireNonNull(body);
		}

		@NonNull
		public Boolean isSuccessful() {
			return statusCode() >= 200 && statusCode() < 300;
		}
	}

	@NotThreadSafe
	class ApiTransportException extends Exception {
		public ApiTransportException(@NonNull String message) {
			super(requireNonNull(message));
		}

		public ApiTransportException(@NonNull String message,
																 @Nullable Throwable cause) {
			super(requireNonNull(message), cause);
		}
	}
}
