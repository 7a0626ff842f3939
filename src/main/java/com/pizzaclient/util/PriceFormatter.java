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

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.pizzaclient.Configuration;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Renders prices for display, e.g. {@code $9.99} for {@code en-US} and {@code USD}.
 * <p>
 * Output is the currency symbol followed by the plain amount: no grouping separators, and never fewer decimal places
 * than the price carries, so {@code 1250} is {@code $1250.00} and {@code 9.995} stays {@code $9.995}.
 * <p>
 * {@link NumberFormat} instances are expensive to build and not threadsafe, so templates are cached per locale and currency
 * and every call formats with its own clone.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class PriceFormatter {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final LoadingCache<PriceFormat, NumberFormat> numberFormatsByPriceFormat;

	@Inject
	public PriceFormatter(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		this.configuration = configuration;
		this.numberFormatsByPriceFormat = Caffeine.newBuilder()
				.maximumSize(8)
				.build(PriceFormatter::createNumberFormat);
	}

	/**
	 * Formats in the configured locale and currency.
	 */
	@NonNull
	public String formatPrice(@NonNull BigDecimal price) {
		requireNonNull(price);
		return formatPrice(price, getConfiguration().getLocale(), getConfiguration().getCurrency());
	}

	@NonNull
	public String formatPrice(@NonNull BigDecimal price,
														@NonNull Locale locale,
														@NonNull Currency currency) {
		requireNonNull(price);
		requireNonNull(locale);
		requireNonNull(currency);

		NumberFormat numberFormat = (NumberFormat) getNumberFormatsByPriceFormat().get(new PriceFormat(locale, currency)).clone();

		// Never drop digits the price carries
		if (price.scale() > numberFormat.getMaximumFractionDigits())
			numberFormat.setMaximumFractionDigits(price.scale());

		return numberFormat.format(price);
	}

	@NonNull
	private static NumberFormat createNumberFormat(@NonNull PriceFormat priceFormat) {
		requireNonNull(priceFormat);

		NumberFormat numberFormat = NumberFormat.getCurrencyInstance(priceFormat.locale());
		numberFormat.setCurrency(priceFormat.currency());
		numberFormat.setGroupingUsed(false);
		return numberFormat;
	}

	private record PriceFormat(
			@NonNull Locale locale,
			@NonNull Currency currency
	) {
		public PriceFormat {
			requireNonNull(locale);
			requireNonNull(currency);
		}
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private LoadingCache<PriceFormat, NumberFormat> getNumberFormatsByPriceFormat() {
		return this.numberFormatsByPriceFormat;
	}
}
