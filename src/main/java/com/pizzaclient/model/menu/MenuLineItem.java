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

package com.pizzaclient.model.menu;

import org.jspecify.annotations.NonNull;

import java.math.BigDecimal;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One purchasable variant of a product, e.g. a large hand tossed pizza.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record MenuLineItem(
		@NonNull String code,
		@NonNull String name,
		@NonNull String productCode,
		@NonNull String sizeCode,
		@NonNull BigDecimal price
) {
	public MenuLineItem {
		requireNonNull(code);
		requireNonNull(name);
		requireNonNull(productCode);
		requireNonNull(sizeCode);
		requireNonNull(price);

		if (price.signum() < 0)
			throw new IllegalArgumentException(format("Line item %s has a negative price: %s", code, price.toPlainString()));
	}
}
