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

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Encapsulates the entire client in a single reusable type.
 * <p>
 * Ask the injector for {@link com.pizzaclient.service.StoreService} and {@link com.pizzaclient.service.MenuService}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class App {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Injector injector;
	@NonNull
	private final Logger logger;

	public App(@NonNull Configuration configuration,
						 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		// Use Guice modules for DI.
		// Also permit overrides for testing, e.g. swap in a transport that returns malformed documents
		Module module = new AppModule(configuration);

		if (testingModules != null)
			module = Modules.override(module).with(testingModules);

		this.configuration = configuration;
		this.injector = Guice.createInjector(module);
		this.logger = LoggerFactory.getLogger(App.class);

		getLogger().debug("Pizza client ready in {} environment, talking to {} via {} transport", configuration.getEnvironment(),
				configuration.getApiBaseUrl(), configuration.getApiTransportType().name());
	}

	@NonNull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Injector getInjector() {
		return this.injector;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
