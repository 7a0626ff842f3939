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

package com.pizzaclient.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.pizzaclient.model.menu.Menu;
import com.pizzaclient.model.menu.MenuCategory;
import com.pizzaclient.model.menu.MenuCoupon;
import com.pizzaclient.model.menu.MenuLineItem;
import com.pizzaclient.model.menu.MenuProduct;
import com.pizzaclient.util.PriceFormatter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.pizzaclient.parser.JsonFields.findArray;
import static com.pizzaclient.parser.JsonFields.findMissingKeys;
import static com.pizzaclient.parser.JsonFields.findObject;
import static com.pizzaclient.parser.JsonFields.findString;
import static com.pizzaclient.parser.JsonFields.findStringList;
import static com.pizzaclient.util.Normalizer.parsePrice;
import static com.pizzaclient.util.Normalizer.trimToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns a raw menu document into a {@link Menu}.
 * <p>
 * The document's four sections (categories, products, variants and coupons) are parsed in independent passes.
 * A pass that hits a malformed record is handled according to the {@link MalformedRecordPolicy};
 * a discarded pass shows up as an empty list and never affects the other passes.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class MenuNormalizer {
	@NonNull
	private static final List<@NonNull String> REQUIRED_CATEGORY_KEYS;
	@NonNull
	private static final List<@NonNull String> REQUIRED_PRODUCT_KEYS;
	@NonNull
	private static final List<@NonNull String> REQUIRED_LINE_ITEM_KEYS;
	@NonNull
	private static final List<@NonNull String> REQUIRED_COUPON_KEYS;
	@NonNull
	private static final Pattern PRICE_IN_NAME_PATTERN;

	static {
		REQUIRED_CATEGORY_KEYS = List.of("Categories", "Code", "Name", "Description", "Products");
		REQUIRED_PRODUCT_KEYS = List.of("Code", "Name", "ProductType", "Description", "Variants");
		REQUIRED_LINE_ITEM_KEYS = List.of("Code", "Name", "Price", "SizeCode", "ProductCode");
		REQUIRED_COUPON_KEYS = List.of("Code", "Name", "Price");
		// e.g. "$9.99" or "$12.99"
		PRICE_IN_NAME_PATTERN = Pattern.compile("\\$\\d{1,2}\\.\\d{2}");
	}

	@NonNull
	private final MalformedRecordPolicy malformedRecordPolicy;
	@NonNull
	private final PriceFormatter priceFormatter;
	@NonNull
	private final Logger logger;

	@Inject
	public MenuNormalizer(@NonNull MalformedRecordPolicy malformedRecordPolicy,
												@NonNull PriceFormatter priceFormatter) {
		requireNonNull(malformedRecordPolicy);
		requireNonNull(priceFormatter);

		this.malformedRecordPolicy = malformedRecordPolicy;
		this.priceFormatter = priceFormatter;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Builds the menu for a store, or nothing if the document carries none of the four sections.
	 */
	@NonNull
	public Optional<Menu> normalize(@NonNull JsonObject menuDocument,
																	@NonNull Integer storeId) {
		requireNonNull(menuDocument);
		requireNonNull(storeId);

		List<JsonElement> rawCategories = findObject(menuDocument, "Categorization")
				.flatMap(categorization -> findObject(categorization, "Food"))
				.flatMap(food -> findArray(food, "Categories"))
				.map(this::elementsOf)
				.orElse(List.of());

		List<JsonElement> rawProducts = sectionValues(menuDocument, "Products");
		List<JsonElement> rawLineItems = sectionValues(menuDocument, "Variants");
		List<JsonElement> rawCoupons = sectionValues(menuDocument, "Coupons");

		if (rawCategories.isEmpty() && rawProducts.isEmpty() && rawLineItems.isEmpty() && rawCoupons.isEmpty()) {
			getLogger().warn("Menu for store {} has no categories, products, variants or coupons", storeId);
			return Optional.empty();
		}

		List<MenuCategory> categories = parseSection(storeId, "category", rawCategories, this::parseCategory);
		List<MenuProduct> products = parseSection(storeId, "product", rawProducts, this::parseProduct);
		List<MenuLineItem> lineItems = parseSection(storeId, "variant", rawLineItems, this::parseLineItem);
		List<MenuCoupon> coupons = parseSection(storeId, "coupon", rawCoupons, this::parseCoupon);

		Menu menu = new Menu(storeId, categories, products, lineItems, coupons);

		warnAboutUnknownProductCodes(menu);

		return Optional.of(menu);
	}

	/**
	 * Flattens a category subtree.
	 * <p>
	 * The category's own product codes win.  Only when it lists none are its children consulted, each by the same rule,
	 * so a child with products of its own contributes exactly those and its descendants are not visited.
	 */
	@NonNull
	public RecordResult<MenuCategory> parseCategory(@NonNull JsonElement rawCategory) {
		requireNonNull(rawCategory);

		RecordResult<CategoryNode> rootResult = parseCategoryNode(rawCategory);
		CategoryNode root = rootResult.getRecord().orElse(null);

		if (root == null)
			return rootResult.asFailure();

		Set<String> productCodes = new LinkedHashSet<>(root.productCodes());

		if (productCodes.isEmpty()) {
			Deque<JsonElement> pending = new ArrayDeque<>();
			pushChildren(pending, root);

			while (!pending.isEmpty()) {
				RecordResult<CategoryNode> childResult = parseCategoryNode(pending.pop());
				CategoryNode child = childResult.getRecord().orElse(null);

				if (child == null)
					return childResult.asFailure();

				if (child.productCodes().isEmpty())
					pushChildren(pending, child);
				else
					productCodes.addAll(child.productCodes());
			}
		}

		return new RecordResult.Succeeded<>(new MenuCategory(root.code(), root.name(), root.description(), productCodes));
	}

	@NonNull
	public RecordResult<MenuProduct> parseProduct(@NonNull JsonElement rawProduct) {
		requireNonNull(rawProduct);

		if (!rawProduct.isJsonObject())
			return RecordResult.invalidValues("Products");

		JsonObject product = rawProduct.getAsJsonObject();
		Set<String> missingKeys = findMissingKeys(product, REQUIRED_PRODUCT_KEYS);

		if (!missingKeys.isEmpty())
			return new RecordResult.MissingKeys<>(missingKeys);

		Set<String> invalidKeys = new LinkedHashSet<>();
		String code = requireString(product, "Code", invalidKeys);
		String name = requireString(product, "Name", invalidKeys);
		String productType = requireString(product, "ProductType", invalidKeys);
		String description = requireString(product, "Description", invalidKeys);
		List<String> variantCodes = findStringList(product, "Variants").orElse(null);

		if (variantCodes == null)
			invalidKeys.add("Variants");

		if (!invalidKeys.isEmpty())
			return new RecordResult.InvalidValues<>(invalidKeys);

		return new RecordResult.Succeeded<>(new MenuProduct(code, name, productType, description, new LinkedHashSet<>(variantCodes)));
	}

	@NonNull
	public RecordResult<MenuLineItem> parseLineItem(@NonNull JsonElement rawLineItem) {
		requireNonNull(rawLineItem);

		if (!rawLineItem.isJsonObject())
			return RecordResult.invalidValues("Variants");

		JsonObject lineItem = rawLineItem.getAsJsonObject();
		Set<String> missingKeys = findMissingKeys(lineItem, REQUIRED_LINE_ITEM_KEYS);

		if (!missingKeys.isEmpty())
			return new RecordResult.MissingKeys<>(missingKeys);

		Set<String> invalidKeys = new LinkedHashSet<>();
		String code = requireString(lineItem, "Code", invalidKeys);
		String name = requireString(lineItem, "Name", invalidKeys);
		String sizeCode = requireString(lineItem, "SizeCode", invalidKeys);
		String productCode = requireString(lineItem, "ProductCode", invalidKeys);
		BigDecimal price = parsePrice(findString(lineItem, "Price").orElse(null)).orElse(null);

		if (price == null)
			invalidKeys.add("Price");

		if (!invalidKeys.isEmpty())
			return new RecordResult.InvalidValues<>(invalidKeys);

		return new RecordResult.Succeeded<>(new MenuLineItem(code, name, productCode, sizeCode, price));
	}

	/**
	 * Coupon names get the coupon's price appended unless they already mention a dollar amount.
	 */
	@NonNull
	public RecordResult<MenuCoupon> parseCoupon(@NonNull JsonElement rawCoupon) {
		requireNonNull(rawCoupon);

		if (!rawCoupon.isJsonObject())
			return RecordResult.invalidValues("Coupons");

		JsonObject coupon = rawCoupon.getAsJsonObject();
		Set<String> missingKeys = findMissingKeys(coupon, REQUIRED_COUPON_KEYS);

		if (!missingKeys.isEmpty())
			return new RecordResult.MissingKeys<>(missingKeys);

		Set<String> invalidKeys = new LinkedHashSet<>();
		String code = requireString(coupon, "Code", invalidKeys);
		String name = requireString(coupon, "Name", invalidKeys);
		String rawPrice = findString(coupon, "Price").orElse(null);

		if (rawPrice == null)
			invalidKeys.add("Price");

		if (!invalidKeys.isEmpty())
			return new RecordResult.InvalidValues<>(invalidKeys);

		// Percentage-off and similar coupons have no price
		if (trimToNull(rawPrice) == null)
			return new RecordResult.Succeeded<>(new MenuCoupon(code, name));

		BigDecimal price = parsePrice(rawPrice).orElse(null);

		if (price == null)
			return RecordResult.invalidValues("Price");

		if (!PRICE_IN_NAME_PATTERN.matcher(name).find())
			name = format("%s %s", name, getPriceFormatter().formatPrice(price));

		return new RecordResult.Succeeded<>(new MenuCoupon(code, name));
	}

	@NonNull
	private <T> List<T> parseSection(@NonNull Integer storeId,
																	 @NonNull String recordType,
																	 @NonNull List<@NonNull JsonElement> rawRecords,
																	 @NonNull Function<JsonElement, RecordResult<T>> recordParser) {
		requireNonNull(storeId);
		requireNonNull(recordType);
		requireNonNull(rawRecords);
		requireNonNull(recordParser);

		List<T> records = new ArrayList<>(rawRecords.size());

		for (JsonElement rawRecord : rawRecords) {
			RecordResult<T> result = recordParser.apply(rawRecord);
			T record = result.getRecord().orElse(null);

			if (record != null) {
				records.add(record);
				continue;
			}

			if (getMalformedRecordPolicy() == MalformedRecordPolicy.ABORT_SECTION) {
				getLogger().warn("Could not parse {} record for store {} ({}), discarding all {} {} records: {}",
						recordType, storeId, result.describe(), rawRecords.size(), recordType, rawRecord);
				return List.of();
			}

			getLogger().warn("Skipping malformed {} record for store {} ({}): {}", recordType, storeId, result.describe(), rawRecord);
		}

		return records;
	}

	@NonNull
	private RecordResult<CategoryNode> parseCategoryNode(@NonNull JsonElement rawCategory) {
		requireNonNull(rawCategory);

		if (!rawCategory.isJsonObject())
			return RecordResult.invalidValues("Categories");

		JsonObject category = rawCategory.getAsJsonObject();
		Set<String> missingKeys = findMissingKeys(category, REQUIRED_CATEGORY_KEYS);

		if (!missingKeys.isEmpty())
			return new RecordResult.MissingKeys<>(missingKeys);

		Set<String> invalidKeys = new LinkedHashSet<>();
		String code = requireString(category, "Code", invalidKeys);
		String name = requireString(category, "Name", invalidKeys);
		String description = requireString(category, "Description", invalidKeys);
		List<String> productCodes = findStringList(category, "Products").orElse(null);
		JsonArray children = findArray(category, "Categories").orElse(null);

		if (productCodes == null)
			invalidKeys.add("Products");
		if (children == null)
			invalidKeys.add("Categories");

		if (!invalidKeys.isEmpty())
			return new RecordResult.InvalidValues<>(invalidKeys);

		return new RecordResult.Succeeded<>(new CategoryNode(code, name, description, productCodes, elementsOf(children)));
	}

	// Pushed in reverse so children are visited in document order
	private void pushChildren(@NonNull Deque<JsonElement> pending,
														@NonNull CategoryNode categoryNode) {
		requireNonNull(pending);
		requireNonNull(categoryNode);

		List<JsonElement> children = categoryNode.children();

		for (int i = children.size() - 1; i >= 0; i--)
			pending.push(children.get(i));
	}

	private void warnAboutUnknownProductCodes(@NonNull Menu menu) {
		requireNonNull(menu);

		// Without a product pass there is nothing to check against
		if (menu.products().isEmpty())
			return;

		Set<String> knownProductCodes = menu.products().stream()
				.map(MenuProduct::code)
				.collect(Collectors.toSet());

		for (MenuCategory category : menu.categories()) {
			Set<String> unknownProductCodes = category.productCodes().stream()
					.filter(productCode -> !knownProductCodes.contains(productCode))
					.collect(Collectors.toCollection(LinkedHashSet::new));

			if (!unknownProductCodes.isEmpty())
				getLogger().warn("Category {} for store {} references unknown products {}", category.code(), menu.storeId(), unknownProductCodes);
		}

		Set<String> unknownLineItemProductCodes = menu.lineItems().stream()
				.map(MenuLineItem::productCode)
				.filter(productCode -> !knownProductCodes.contains(productCode))
				.collect(Collectors.toCollection(LinkedHashSet::new));

		if (!unknownLineItemProductCodes.isEmpty())
			getLogger().warn("Variants for store {} reference unknown products {}", menu.storeId(), unknownLineItemProductCodes);
	}

	@Nullable
	private String requireString(@NonNull JsonObject jsonObject,
															 @NonNull String key,
															 @NonNull Set<String> invalidKeys) {
		requireNonNull(jsonObject);
		requireNonNull(key);
		requireNonNull(invalidKeys);

		String value = findString(jsonObject, key).orElse(null);

		if (value == null)
			invalidKeys.add(key);

		return value;
	}

	@NonNull
	private List<@NonNull JsonElement> sectionValues(@NonNull JsonObject menuDocument,
																									 @NonNull String sectionName) {
		requireNonNull(menuDocument);
		requireNonNull(sectionName);

		return findObject(menuDocument, sectionName)
				.map(section -> section.entrySet().stream()
						.map(Map.Entry::getValue)
						.toList())
				.orElse(List.of());
	}

	@NonNull
	private List<@NonNull JsonElement> elementsOf(@NonNull JsonArray jsonArray) {
		requireNonNull(jsonArray);

		List<JsonElement> elements = new ArrayList<>(jsonArray.size());

		for (JsonElement element : jsonArray)
			elements.add(element);

		return elements;
	}

	// A category as it appears in the document, before its subtree is folded in
	private record CategoryNode(
			@NonNull String code,
			@NonNull String name,
			@NonNull String description,
			@NonNull List<@NonNull String> productCodes,
			@NonNull List<@NonNull JsonElement> children
	) {
		public CategoryNode {
			requireNonNull(code);
			requireNonNull(name);
			requireNonNull(description);
			requireNonNull(productCodes);
			requireNonNull(children);
		}
	}

	@NonNull
	private MalformedRecordPolicy getMalformedRecordPolicy() {
		return this.malformedRecordPolicy;
	}

	@NonNull
	private PriceFormatter getPriceFormatter() {
		return this.priceFormatter;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
