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

import java.net.URI;

import static java.util.Objects.requireNonNull;

/**
 * Contract for surfacing upstream API failures the client recovered from.
 * <p>
 * Nothing reported here is rethrown: callers see an empty result, so this is where failures become visible.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface ErrorReporter {
	void reportError(@NonNull ApiFailure apiFailure);

	enum ApiFailureReason {
		TRANSPORT_FAILED,
		MALFORMED_JSON,
		NOT_A_JSON_OBJECT
	}

	/**
	 * {@code statusCode} is absent when no response was received.
	 */
	record ApiFailure(
			@NonNull ApiEndpoint endpoint,
			@NonNull URI uri,
			@NonNull ApiFailureReason reason,
			@Nullable Integer statusCode,
			@Nullable Throwable cause
	) {
		public ApiFailure {
			requireNonNull(endpoint);
			requireNonNull(uri);
			requireNonNull(reason);
		}
	}
}
