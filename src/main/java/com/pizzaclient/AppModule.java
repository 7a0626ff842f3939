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

package com.pizzaclient;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.pizzaclient.mock.MockApiTransport;
import com.pizzaclient.parser.MalformedRecordPolicy;
import com.pizzaclient.util.ApiTransport;
import com.pizzaclient.util.ErrorReporter;
import com.pizzaclient.util.HttpApiTransport;
import com.pizzaclient.util.LoggingErrorReporter;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.net.http.HttpClient;

import static java.util.Objects.requireNonNull;

/**
 * Guice wiring for the client.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AppModule extends AbstractModule {
	@NonNull
	private final Configuration configuration;

	public AppModule(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@NonNull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	// Explicitly provide this so tests can exercise the non-default policy without a separate environment
	@NonNull
	@Provides
	@Singleton
	public MalformedRecordPolicy provideMalformedRecordPolicy(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		return configuration.getMalformedRecordPolicy();
	}

	@NonNull
	@Provides
	@Singleton
	public HttpClient provideHttpClient(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		return HttpClient.newBuilder()
				.connectTimeout(configuration.getRequestTimeout())
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build();
	}

	@NonNull
	@Provides
	@Singleton
	public ApiTransport provideApiTransport(@NonNull Configuration configuration,
																					@NonNull Provider<HttpClient> httpClientProvider) {
		requireNonNull(configuration);
		requireNonNull(httpClientProvider);

		ApiTransport apiTransport = null;

		switch (configuration.getApiTransportType()) {
			case MOCK -> apiTransport = new MockApiTransport(configuration.getFixturesDirectory().get());
			case REAL ->
					apiTransport = new HttpApiTransport(httpClientProvider.get(), configuration.getRequestTimeout(), configuration.getUserAgent());
		}

		return apiTransport;
	}

	@NonNull
	@Provides
	@Singleton
	public ErrorReporter provideErrorReporter() {
		return new LoggingErrorReporter();
	}

	@NonNull
	@Provides
	@Singleton
	public Gson provideGson() {
		return new GsonBuilder()
				.disableHtmlEscaping()
				.create();
	}

	@Override
	protected void configure() {
		// Everything else is bound just-in-time via @Inject constructors
	}
}
