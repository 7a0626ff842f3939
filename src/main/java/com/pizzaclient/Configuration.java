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
import com.pizzaclient.parser.MalformedRecordPolicy;
import com.pizzaclient.util.ApiTransport;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Currency;
import java.util.Locale;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates system-wide configuration.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Configuration {
	@NonNull
	private static final Gson GSON;

	static {
		GSON = new GsonBuilder().disableHtmlEscaping().create();
	}

	@NonNull
	private final String environment;
	@NonNull
	private final URI apiBaseUrl;
	@NonNull
	private final String menuLanguage;
	@NonNull
	private final Locale locale;
	@NonNull
	private final Currency currency;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final String userAgent;
	@NonNull
	private final MalformedRecordPolicy malformedRecordPolicy;
	private final ApiTransport.@NonNull Type apiTransportType;
	@Nullable
	private final Path fixturesDirectory;

	public Configuration(@NonNull String environment) {
		requireNonNull(environment);

		ConfigFile configFile = loadConfigFileForEnvironment(environment);

		this.environment = environment;
		this.apiBaseUrl = URI.create(configFile.apiBaseUrl());
		this.menuLanguage = configFile.menuLanguage() == null ? "en" : configFile.menuLanguage();
		this.locale = Locale.forLanguageTag(configFile.locale());
		this.currency = Currency.getInstance(configFile.currency());
		this.requestTimeout = Duration.ofSeconds(configFile.requestTimeoutInSeconds());
		this.userAgent = configFile.userAgent();
		this.malformedRecordPolicy = configFile.malformedRecordPolicy() == null
				? MalformedRecordPolicy.ABORT_SECTION : configFile.malformedRecordPolicy();
		this.apiTransportType = configFile.apiTransport().type();
		this.fixturesDirectory = configFile.apiTransport().fixturesDirectory() == null
				? null : Path.of(configFile.apiTransport().fixturesDirectory());

		if (this.apiTransportType == ApiTransport.Type.MOCK && this.fixturesDirectory == null)
			throw new IllegalArgumentException(format("A fixtures directory is required for the %s transport in the %s environment",
					this.apiTransportType.name(), environment));

		// Initialize Logback if not done already
		if (System.getProperty("logback.configurationFile") == null)
			System.setProperty("logback.configurationFile", format("config/%s/logback.xml", environment));
	}

	@NonNull
	private ConfigFile loadConfigFileForEnvironment(@NonNull String environment) {
		Path configFile = Path.of(format("config/%s/settings.json", environment));

		if (!Files.isRegularFile(configFile))
			throw new IllegalArgumentException(format("Config file not found at %s", configFile.toAbsolutePath()));

		try {
			return GSON.fromJson(Files.readString(configFile, StandardCharsets.UTF_8), ConfigFile.class);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", configFile.toAbsolutePath()), e);
		}
	}

	// Record that maps to the config/{environment}/settings.json file format
	private record ConfigFile(
			@NonNull String apiBaseUrl,
			@Nullable String menuLanguage,
			@NonNull String locale,
			@NonNull String currency,
			@NonNull Integer requestTimeoutInSeconds,
			@NonNull String userAgent,
			@Nullable MalformedRecordPolicy malformedRecordPolicy,
			@NonNull ConfigApiTransport apiTransport
	) {
		public ConfigFile {
			requireNonNull(apiBaseUrl);
			requireNonNull(locale);
			requireNonNull(currency);
			requireNonNull(requestTimeoutInSeconds);
			requireNonNull(userAgent);
			requireNonNull(apiTransport);
		}

		private record ConfigApiTransport(
				ApiTransport.@NonNull Type type,
				@Nullable String fixturesDirectory
		) {
			public ConfigApiTransport {
				requireNonNull(type);
			}
		}
	}

	@NonNull
	public String getEnvironment() {
		return this.environment;
	}

	@NonNull
	public URI getApiBaseUrl() {
		return this.apiBaseUrl;
	}

	@NonNull
	public String getMenuLanguage() {
		return this.menuLanguage;
	}

	@NonNull
	public Locale getLocale() {
		return this.locale;
	}

	@NonNull
	public Currency getCurrency() {
		return this.currency;
	}

	@NonNull
	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	public String getUserAgent() {
		return this.userAgent;
	}

	@NonNull
	public MalformedRecordPolicy getMalformedRecordPolicy() {
		return this.malformedRecordPolicy;
	}

	public ApiTransport.@NonNull Type getApiTransportType() {
		return this.apiTransportType;
	}

	@NonNull
	public Optional<Path> getFixturesDirectory() {
		return Optional.ofNullable(this.fixturesDirectory);
	}
}
