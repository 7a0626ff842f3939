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

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the loosely-typed scalars the upstream API sends as strings (store IDs, postal codes, prices).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Normalizer {
	@NonNull
	private static final Pattern SURROUNDING_WHITESPACE_PATTERN;

	static {
		// Also catches non-breaking and other Unicode separators, which String#trim() leaves alone
		SURROUNDING_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+|(\\p{Z}|\\s)+$");
	}

	@Nullable
	public static String trimToNull(@Nullable String value) {
		if (value == null)
			return null;

		value = SURROUNDING_WHITESPACE_PATTERN.matcher(value).replaceAll("");
		return value.isEmpty() ? null : value;
	}

	@NonNull
	public static Optional<Integer> parseInteger(@Nullable String value) {
		value = trimToNull(value);

		if (value == null)
			return Optional.empty();

		try {
			return Optional.of(Integer.valueOf(value));
		} catch (NumberFormatException ignored) {
			return Optional.empty();
		}
	}

	/**
	 * Prices must be plain decimal numbers no less than zero.
	 */
	@NonNull
	public static Optional<BigDecimal> parsePrice(@Nullable String value) {
		value = trimToNull(value);

		if (value == null)
			return Optional.empty();

		BigDecimal price;

		try {
			price = new BigDecimal(value);
		} catch (NumberFormatException ignored) {
			return Optional.empty();
		}

		return price.signum() < 0 ? Optional.empty() : Optional.of(price);
	}

	private Normalizer() {
		// Non-instantiable
	}
}
