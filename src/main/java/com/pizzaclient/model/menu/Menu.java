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
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The normalized menu for one store.
 * <p>
 * Entries reference each other by code only, so lookups here are linear scans over small lists.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Menu(
		@NonNull Integer storeId,
		@NonNull List<@NonNull MenuCategory> categories,
		@NonNull List<@NonNull MenuProduct> products,
		@NonNull List<@NonNull MenuLineItem> lineItems,
		@NonNull List<@NonNull MenuCoupon> coupons
) {
	public Menu {
		requireNonNull(storeId);
		requireNonNull(categories);
		requireNonNull(products);
		requireNonNull(lineItems);
		requireNonNull(coupons);

		categories = List.copyOf(categories);
		products = List.copyOf(products);
		lineItems = List.copyOf(lineItems);
		coupons = List.copyOf(coupons);
	}

	@NonNull
	public Optional<MenuCategory> findCategoryByCode(@Nullable String code) {
		if (code == null)
			return Optional.empty();

		return categories().stream()
				.filter(category -> category.code().equals(code))
				.findFirst();
	}

	@NonNull
	public Optional<MenuProduct> findProductByCode(@Nullable String code) {
		if (code == null)
			return Optional.empty();

		return products().stream()
				.filter(product -> product.code().equals(code))
				.findFirst();
	}

	@NonNull
	public Optional<MenuCoupon> findCouponByCode(@Nullable String code) {
		if (code == null)
			return Optional.empty();

		return coupons().stream()
				.filter(coupon -> coupon.code().equals(code))
				.findFirst();
	}

	@NonNull
	public List<@NonNull MenuLineItem> findLineItemsForProduct(@Nullable String productCode) {
		if (productCode == null)
			return List.of();

		return lineItems().stream()
				.filter(lineItem -> lineItem.productCode().equals(productCode))
				.toList();
	}

	/**
	 * Resolves a category's product codes against this menu's products, in product order.
	 * Codes with no matching product are left out.
	 */
	@NonNull
	public List<@NonNull MenuProduct> findProductsForCategory(@Nullable String categoryCode) {
		MenuCategory category = findCategoryByCode(categoryCode).orElse(null);

		if (category == null)
			return List.of();

		return products().stream()
				.filter(product -> category.productCodes().contains(product.code()))
				.toList();
	}
}
