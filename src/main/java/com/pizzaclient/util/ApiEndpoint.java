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

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * URL templates for the upstream API, relative to its base URL.
 * <p>
 * Placeholders look like {@code {name}} and are filled with URL-encoded values.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ApiEndpoint {
	FIND_STORES("/power/store-locator?s={addressLineOne}&c={addressLineTwo}&type={pickupType}"),
	GET_MENU("/power/store/{storeId}/menu?lang={language}&structured=true");

	@NonNull
	private static final Pattern PLACEHOLDER_PATTERN;

	static {
		PLACEHOLDER_PATTERN = Pattern.compile("\\{([A-Za-z]+)}");
	}

	@NonNull
	private final String pathTemplate;

	ApiEndpoint(@NonNull String pathTemplate) {
		requireNonNull(pathTemplate);
		this.pathTemplate = pathTemplate;
	}

	@NonNull
	public URI toUri(@NonNull URI baseUrl,
									 @NonNull Map<@NonNull String, @NonNull Object> parameters) {
		requireNonNull(baseUrl);
		requireNonNull(parameters);

		Matcher matcher = PLACEHOLDER_PATTERN.matcher(getPathTemplate());
		StringBuilder path = new StringBuilder();

		while (matcher.find()) {
			String name = matcher.group(1);
			Object value = parameters.get(name);

			if (value == null)
				throw new IllegalArgumentException(format("No value provided for '%s' in %s", name, name()));

			matcher.appendReplacement(path, Matcher.quoteReplacement(URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8)));
		}

		matcher.appendTail(path);

		String base = baseUrl.toString();

		if (base.endsWith("/"))
			base = base.substring(0, base.length() - 1);

		return URI.create(base + path);
	}

	@NonNull
	public String getPathTemplate() {
		return this.pathTemplate;
	}
}
