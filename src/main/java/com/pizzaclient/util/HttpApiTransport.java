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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ApiTransport} backed by the JDK's {@link HttpClient}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class HttpApiTransport implements ApiTransport {
	@NonNull
	private final HttpClient httpClient;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final String userAgent;

	public HttpApiTransport(@NonNull HttpClient httpClient,
													@NonNull Duration requestTimeout,
													@NonNull String userAgent) {
		requireNonNull(httpClient);
		requireNonNull(requestTimeout);
		requireNonNull(userAgent);

		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
		this.userAgent = userAgent;
	}

	@NonNull
	@Override
	public ApiResponse get(@NonNull ApiRequest request) throws ApiTransportException {
		requireNonNull(request);

		HttpRequest httpRequest = HttpRequest.newBuilder(request.uri())
				.timeout(getRequestTimeout())
				.header("User-Agent", getUserAgent())
				.header("Accept", "application/json")
				.GET()
				.build();

		try {
			HttpResponse<String> httpResponse = getHttpClient().send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
			String body = httpResponse.body();
			return new ApiResponse(httpResponse.statusCode(), body == null ? "" : body);
		} catch (IOException e) {
			throw new ApiTransportException(format("Unable to GET %s", request.uri()), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ApiTransportException(format("Interrupted while performing GET %s", request.uri()), e);
		}
	}

	@NonNull
	private HttpClient getHttpClient() {
		return this.httpClient;
	}

	@NonNull
	private Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	private String getUserAgent() {
		return this.userAgent;
	}
}
