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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.pizzaclient.Configuration;
import com.pizzaclient.util.ApiTransport.ApiRequest;
import com.pizzaclient.util.ApiTransport.ApiResponse;
import com.pizzaclient.util.ApiTransport.ApiTransportException;
import com.pizzaclient.util.ErrorReporter.ApiFailure;
import com.pizzaclient.util.ErrorReporter.ApiFailureReason;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.net.URI;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Fetches JSON documents from the upstream API.
 * <p>
 * Every failure (transport errors, bodies that are not a JSON object) is reported to the {@link ErrorReporter}
 * and comes back as an empty result.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class ApiClient {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final ApiTransport apiTransport;
	@NonNull
	private final ErrorReporter errorReporter;
	@NonNull
	private final Gson gson;
	@NonNull
	private final Logger logger;

	@Inject
	public ApiClient(@NonNull Configuration configuration,
									 @NonNull ApiTransport apiTransport,
									 @NonNull ErrorReporter errorReporter,
									 @NonNull Gson gson) {
		requireNonNull(configuration);
		requireNonNull(apiTransport);
		requireNonNull(errorReporter);
		requireNonNull(gson);

		this.configuration = configuration;
		this.apiTransport = apiTransport;
		this.errorReporter = errorReporter;
		this.gson = gson;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public Optional<JsonObject> fetchDocument(@NonNull ApiEndpoint endpoint,
																						@NonNull Map<@NonNull String, @NonNull Object> parameters) {
		requireNonNull(endpoint);
		requireNonNull(parameters);

		URI uri = endpoint.toUri(getConfiguration().getApiBaseUrl(), parameters);
		ApiResponse response;

		getLogger().debug("Performing GET {}", uri);

		try {
			response = getApiTransport().get(new ApiRequest(endpoint, uri));
		} catch (ApiTransportException e) {
			getErrorReporter().reportError(new ApiFailure(endpoint, uri, ApiFailureReason.TRANSPORT_FAILED, null, e));
			return Optional.empty();
		}

		// The upstream API sometimes explains errors in a JSON body, so non-2xx responses are still parsed
		if (response.isSuccessful())
			getLogger().debug("GET {} returned HTTP {}", uri, response.statusCode());
		else
			getLogger().warn("GET {} returned HTTP {}", uri, response.statusCode());

		JsonElement document;

		try {
			document = getGson().fromJson(response.body(), JsonElement.class);
		} catch (JsonParseException e) {
			getErrorReporter().reportError(new ApiFailure(endpoint, uri, ApiFailureReason.MALFORMED_JSON, response.statusCode(), e));
			return Optional.empty();
		}

		if (document == null || !document.isJsonObject()) {
			getErrorReporter().reportError(new ApiFailure(endpoint, uri, ApiFailureReason.NOT_A_JSON_OBJECT, response.statusCode(), null));
			return Optional.empty();
		}

		return Optional.of(document.getAsJsonObject());
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private ApiTransport getApiTransport() {
		return this.apiTransport;
	}

	@NonNull
	private ErrorReporter getErrorReporter() {
		return this.errorReporter;
	}

	@NonNull
	private Gson getGson() {
		return this.gson;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
