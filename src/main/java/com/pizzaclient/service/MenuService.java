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

package com.pizzaclient.service;

import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.pizzaclient.Configuration;
import com.pizzaclient.model.Store;
import com.pizzaclient.model.menu.Menu;
import com.pizzaclient.parser.MenuNormalizer;
import com.pizzaclient.util.ApiClient;
import com.pizzaclient.util.ApiEndpoint;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Retrieves and normalizes store menus.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class MenuService {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final ApiClient apiClient;
	@NonNull
	private final MenuNormalizer menuNormalizer;
	@NonNull
	private final Logger logger;

	@Inject
	public MenuService(@NonNull Configuration configuration,
										 @NonNull ApiClient apiClient,
										 @NonNull MenuNormalizer menuNormalizer) {
		requireNonNull(configuration);
		requireNonNull(apiClient);
		requireNonNull(menuNormalizer);

		this.configuration = configuration;
		this.apiClient = apiClient;
		this.menuNormalizer = menuNormalizer;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * The store's menu, or nothing if it could not be fetched or carried no usable sections.
	 */
	@NonNull
	public Optional<Menu> findMenuForStore(@NonNull Store store) {
		requireNonNull(store);

		JsonObject document = getApiClient().fetchDocument(ApiEndpoint.GET_MENU, Map.of(
				"storeId", store.storeId(),
				"language", getConfiguration().getMenuLanguage()
		)).orElse(null);

		if (document == null)
			return Optional.empty();

		Optional<Menu> menu = getMenuNormalizer().normalize(document, store.storeId());

		menu.ifPresent(m -> getLogger().debug("Menu for store {} has {} categories, {} products, {} variants and {} coupons",
				m.storeId(), m.categories().size(), m.products().size(), m.lineItems().size(), m.coupons().size()));

		return menu;
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private ApiClient getApiClient() {
		return this.apiClient;
	}

	@NonNull
	private MenuNormalizer getMenuNormalizer() {
		return this.menuNormalizer;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
