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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.pizzaclient.App;
import com.pizzaclient.Configuration;
import com.pizzaclient.model.menu.Menu;
import com.pizzaclient.model.menu.MenuCategory;
import com.pizzaclient.model.menu.MenuCoupon;
import com.pizzaclient.model.menu.MenuLineItem;
import com.pizzaclient.model.menu.MenuProduct;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MenuNormalizerTests {
	private static final Integer STORE_ID = 4337;

	@Test
	public void testCategoryWithDirectProducts() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Menu menu = menuNormalizer.normalize(menuDocument(
				category("Pizza", "[\"P1\", \"P2\"]", "[]"), "", "", ""), STORE_ID).orElse(null);

		Assertions.assertNotNull(menu, "Expected a menu");
		Assertions.assertEquals(1, menu.categories().size(), "Expected a single category");
		Assertions.assertEquals(Set.of("P1", "P2"), menu.categories().get(0).productCodes(), "Wrong product codes");
		Assertions.assertEquals(STORE_ID, menu.storeId(), "Wrong store ID");
	}

	@Test
	public void testCategoryFallsBackToChildProducts() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Menu menu = menuNormalizer.normalize(menuDocument(
				category("Pizza", "[]", format("[%s]", category("Specialty", "[\"P3\"]", "[]"))), "", "", ""), STORE_ID).orElseThrow();

		Assertions.assertEquals(1, menu.categories().size(), "Children should be folded into their parent");
		Assertions.assertEquals("Pizza", menu.categories().get(0).code(), "Wrong category code");
		Assertions.assertEquals(Set.of("P3"), menu.categories().get(0).productCodes(), "Wrong product codes");
	}

	@Test
	public void testDeeplyNestedCategories() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		String a = category("A", "[]", format("[%s, %s]",
				category("B", "[\"P5\"]", "[]"),
				category("C", "[]", format("[%s]", category("D", "[\"P6\"]", "[]")))));
		String e = category("E", "[\"P7\"]", format("[%s]", category("F", "[\"P8\"]", "[]")));
		String root = category("Root", "[]", format("[%s, %s]", a, e));
		String withOwnProducts = category("Own", "[\"P1\"]", format("[%s]", category("Child", "[\"P2\"]", "[]")));

		Menu menu = menuNormalizer.normalize(menuDocument(root + ", " + withOwnProducts, "", "", ""), STORE_ID).orElseThrow();

		MenuCategory rootCategory = menu.findCategoryByCode("Root").orElseThrow();
		MenuCategory ownCategory = menu.findCategoryByCode("Own").orElseThrow();

		Assertions.assertEquals(2, menu.categories().size(), "Only top-level categories are emitted");
		Assertions.assertEquals(List.of("P5", "P6", "P7"), List.copyOf(rootCategory.productCodes()), "Wrong flattened product codes");
		Assertions.assertFalse(rootCategory.productCodes().contains("P8"), "A child with its own products hides its descendants");
		Assertions.assertEquals(Set.of("P1"), ownCategory.productCodes(), "Direct products should never be merged with children");
	}

	@Test
	public void testVeryDeepCategoryTree() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);
		String category = category("Leaf", "[\"DEEP\"]", "[]");

		for (int i = 0; i < 100; ++i)
			category = category(format("Level%d", i), "[]", format("[%s]", category));

		Menu menu = menuNormalizer.normalize(menuDocument(category, "", "", ""), STORE_ID).orElseThrow();

		Assertions.assertEquals(Set.of("DEEP"), menu.categories().get(0).productCodes(), "Leaf products should reach the top");
	}

	@Test
	public void testDuplicateProductCodesCollapse() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		String children = format("[%s, %s]", category("X", "[\"P1\", \"P2\"]", "[]"), category("Y", "[\"P2\", \"P1\"]", "[]"));
		Menu menu = menuNormalizer.normalize(menuDocument(category("Both", "[]", children), "", "", ""), STORE_ID).orElseThrow();

		Assertions.assertEquals(List.of("P1", "P2"), List.copyOf(menu.categories().get(0).productCodes()), "Wrong product codes");
	}

	@Test
	public void testMalformedCategoryDiscardsCategoryPass() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);
		String noDescription = "{\"Code\": \"Broken\", \"Name\": \"Broken\", \"Products\": [\"P2\"], \"Categories\": []}";

		Menu menu = menuNormalizer.normalize(menuDocument(
				category("Fine", "[\"P1\"]", "[]") + ", " + noDescription, product("P1"), "", ""), STORE_ID).orElseThrow();

		Assertions.assertTrue(menu.categories().isEmpty(), "One malformed category discards all categories");
		Assertions.assertEquals(1, menu.products().size(), "Products are parsed independently");
	}

	@Test
	public void testMalformedNestedCategory() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);
		String brokenChild = "{\"Code\": \"Broken\", \"Name\": \"Broken\", \"Description\": \"\", \"Products\": [\"P2\"]}";

		// Consulted because the parent has no products of its own
		Menu menu = menuNormalizer.normalize(menuDocument(
				category("Parent", "[]", format("[%s]", brokenChild)), "", "", coupon("1", "Deal", "5.00")), STORE_ID).orElseThrow();

		Assertions.assertTrue(menu.categories().isEmpty(), "A malformed child discards the category pass");
		Assertions.assertEquals(1, menu.coupons().size(), "Coupons are parsed independently");

		// Never consulted because the parent lists its own products
		menu = menuNormalizer.normalize(menuDocument(
				category("Parent", "[\"P1\"]", format("[%s]", brokenChild)), "", "", ""), STORE_ID).orElseThrow();

		Assertions.assertEquals(Set.of("P1"), menu.categories().get(0).productCodes(), "Unvisited children are not validated");
	}

	@Test
	public void testMalformedRecordsSkippedWhenConfigured() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.SKIP_RECORD);

		String categories = category("Fine", "[\"P1\"]", "[]") + ", {\"Code\": \"Broken\"}";
		String products = product("P1") + ", \"P2\": {\"Code\": \"P2\", \"Name\": \"Broken\"}";
		String variants = lineItem("V1", "P1", "9.99") + ", " + lineItem("V2", "P1", "nine");
		String coupons = coupon("1", "Deal", "5.00") + ", " + coupon("2", "Other Deal", "-5.00");

		Menu menu = menuNormalizer.normalize(menuDocument(categories, products, variants, coupons), STORE_ID).orElseThrow();

		Assertions.assertEquals(List.of("Fine"), menu.categories().stream().map(MenuCategory::code).toList(), "Wrong categories");
		Assertions.assertEquals(List.of("P1"), menu.products().stream().map(MenuProduct::code).toList(), "Wrong products");
		Assertions.assertEquals(List.of("V1"), menu.lineItems().stream().map(MenuLineItem::code).toList(), "Wrong variants");
		Assertions.assertEquals(List.of("1"), menu.coupons().stream().map(MenuCoupon::code).toList(), "Wrong coupons");
	}

	@Test
	public void testLineItemPrices() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Menu menu = menuNormalizer.normalize(menuDocument("", product("P1"),
				lineItem("V1", "P1", "8.99") + ", " + lineItem("V2", "P1", "0") + ", \"V3\": {\"Code\": \"V3\", \"Name\": \"V3\", "
						+ "\"Price\": 12.5, \"SizeCode\": \"14\", \"ProductCode\": \"P1\"}", ""), STORE_ID).orElseThrow();

		Assertions.assertEquals(3, menu.lineItems().size(), "Expected all variants");
		Assertions.assertEquals(0, new BigDecimal("8.99").compareTo(menu.lineItems().get(0).price()), "Wrong price");
		Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(menu.lineItems().get(1).price()), "Zero is a valid price");
		Assertions.assertEquals(0, new BigDecimal("12.5").compareTo(menu.lineItems().get(2).price()), "Numeric prices are accepted");
		Assertions.assertEquals(List.of("V1", "V2", "V3"), menu.findLineItemsForProduct("P1").stream().map(MenuLineItem::code).toList(),
				"Wrong variants for product");

		for (String badPrice : List.of("free", "-0.01", "", "1.2.3")) {
			menu = menuNormalizer.normalize(menuDocument("", product("P1"),
					lineItem("V1", "P1", "8.99") + ", " + lineItem("V2", "P1", badPrice), ""), STORE_ID).orElseThrow();

			Assertions.assertTrue(menu.lineItems().isEmpty(), format("Price '%s' should discard all variants", badPrice));
			Assertions.assertEquals(1, menu.products().size(), "Products are parsed independently");
		}
	}

	@Test
	public void testCouponNames() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Assertions.assertEquals("Large Pizza $9.99", couponName(menuNormalizer, "Large Pizza", "9.99"), "Price should be appended");
		Assertions.assertEquals("Large Pizza $9.99", couponName(menuNormalizer, "Large Pizza $9.99", "9.99"), "Price already present");
		Assertions.assertEquals("Two Mediums $12.99 Each", couponName(menuNormalizer, "Two Mediums $12.99 Each", "25.98"),
				"Any dollar amount in the name suppresses the suffix");
		Assertions.assertEquals("Free Delivery $0.00", couponName(menuNormalizer, "Free Delivery", "0"), "Zero is a valid price");
		Assertions.assertEquals("20% Off", couponName(menuNormalizer, "20% Off", ""), "Coupons without a price keep their name");
		Assertions.assertEquals("20% Off", couponName(menuNormalizer, "20% Off", "  "), "Coupons without a price keep their name");
	}

	@Test
	public void testInvalidCoupons() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		RecordResult<MenuCoupon> missingPrice = menuNormalizer.parseCoupon(JsonParser.parseString("{\"Code\": \"1\", \"Name\": \"Deal\"}"));
		RecordResult<MenuCoupon> badPrice = menuNormalizer.parseCoupon(JsonParser.parseString("{\"Code\": \"1\", \"Name\": \"Deal\", \"Price\": \"cheap\"}"));
		RecordResult<MenuCoupon> notAnObject = menuNormalizer.parseCoupon(JsonParser.parseString("[]"));

		Assertions.assertEquals(new RecordResult.MissingKeys<MenuCoupon>(Set.of("Price")), missingPrice, "Expected missing price");
		Assertions.assertEquals(new RecordResult.InvalidValues<MenuCoupon>(Set.of("Price")), badPrice, "Expected invalid price");
		Assertions.assertTrue(notAnObject instanceof RecordResult.InvalidValues, "Expected invalid record");
		Assertions.assertEquals("missing keys [Price]", missingPrice.describe(), "Wrong description");
	}

	@Test
	public void testMissingKeysAreAllReported() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		RecordResult<MenuProduct> product = menuNormalizer.parseProduct(JsonParser.parseString("{\"Code\": \"P1\", \"Name\": null}"));
		RecordResult<MenuLineItem> lineItem = menuNormalizer.parseLineItem(JsonParser.parseString("{\"Code\": \"V1\", \"Name\": \"V1\", \"Price\": \"1.00\"}"));

		Assertions.assertEquals(new RecordResult.MissingKeys<MenuProduct>(Set.of("Name", "ProductType", "Description", "Variants")), product,
				"Null values count as missing");
		Assertions.assertEquals(new RecordResult.MissingKeys<MenuLineItem>(Set.of("SizeCode", "ProductCode")), lineItem, "Wrong missing keys");
		Assertions.assertTrue(product.getRecord().isEmpty(), "Failures carry no record");
	}

	@Test
	public void testMalformedCouponLeavesOtherSectionsIntact() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Menu menu = menuNormalizer.normalize(menuDocument(
				category("Pizza", "[\"P1\"]", "[]"),
				product("P1"),
				lineItem("V1", "P1", "8.99"),
				coupon("1", "Deal", "5.00") + ", \"2\": {\"Code\": \"2\", \"Price\": \"5.00\"}"), STORE_ID).orElseThrow();

		Assertions.assertEquals(1, menu.categories().size(), "Categories should survive");
		Assertions.assertEquals(1, menu.products().size(), "Products should survive");
		Assertions.assertEquals(1, menu.lineItems().size(), "Variants should survive");
		Assertions.assertTrue(menu.coupons().isEmpty(), "Coupon pass should be discarded");
	}

	@Test
	public void testMenuWithoutSections() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Assertions.assertTrue(menuNormalizer.normalize(new JsonObject(), STORE_ID).isEmpty(), "Empty document has no menu");
		Assertions.assertTrue(menuNormalizer.normalize(menuDocument("", "", "", ""), STORE_ID).isEmpty(), "Empty sections have no menu");
		Assertions.assertTrue(menuNormalizer.normalize(JsonParser.parseString("{\"Products\": [], \"Coupons\": \"none\"}").getAsJsonObject(), STORE_ID).isEmpty(),
				"Mistyped sections have no menu");
	}

	@Test
	public void testSectionsDiscardedForMalformedRecordsStillYieldMenu() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Menu menu = menuNormalizer.normalize(menuDocument("", "", "", "\"1\": {\"Code\": \"1\"}"), STORE_ID).orElse(null);

		Assertions.assertNotNull(menu, "A section was present, so a menu is returned");
		Assertions.assertTrue(menu.coupons().isEmpty(), "Coupon pass should be discarded");
	}

	@Test
	public void testCrossReferences() {
		MenuNormalizer menuNormalizer = createMenuNormalizer(MalformedRecordPolicy.ABORT_SECTION);

		Menu menu = menuNormalizer.normalize(menuDocument(
				category("Pizza", "[\"P2\", \"P1\", \"MISSING\"]", "[]"),
				product("P1") + ", " + product("P2"),
				lineItem("V1", "P1", "8.99") + ", " + lineItem("V2", "P2", "9.99") + ", " + lineItem("V3", "P1", "10.99"),
				""), STORE_ID).orElseThrow();

		Assertions.assertEquals(List.of("P1", "P2"), menu.findProductsForCategory("Pizza").stream().map(MenuProduct::code).toList(),
				"Unknown product codes are left out");
		Assertions.assertEquals(List.of("V1", "V3"), menu.findLineItemsForProduct("P1").stream().map(MenuLineItem::code).toList(),
				"Wrong variants for product");
		Assertions.assertEquals(Set.of("V1"), menu.findProductByCode("P1").orElseThrow().variantCodes(), "Wrong variant codes");
		Assertions.assertTrue(menu.findProductsForCategory("Sides").isEmpty(), "Unknown category has no products");
		Assertions.assertTrue(menu.findCouponByCode("1").isEmpty(), "No coupons in this menu");
	}

	@NonNull
	private String couponName(@NonNull MenuNormalizer menuNormalizer,
														@NonNull String name,
														@NonNull String price) {
		requireNonNull(menuNormalizer);
		requireNonNull(name);
		requireNonNull(price);

		JsonObject rawCoupon = new JsonObject();
		rawCoupon.addProperty("Code", "1");
		rawCoupon.addProperty("Name", name);
		rawCoupon.addProperty("Price", price);

		return menuNormalizer.parseCoupon(rawCoupon).getRecord().orElseThrow().name();
	}

	@NonNull
	private MenuNormalizer createMenuNormalizer(@NonNull MalformedRecordPolicy malformedRecordPolicy) {
		requireNonNull(malformedRecordPolicy);

		App app = new App(new Configuration("local"), new AbstractModule() {
			@NonNull
			@Provides
			@Singleton
			public MalformedRecordPolicy provideMalformedRecordPolicy() {
				return malformedRecordPolicy;
			}

			@Override
			protected void configure() {
				// Guice module configuration; nothing to do
			}
		});

		return app.getInjector().getInstance(MenuNormalizer.class);
	}

	@NonNull
	private JsonObject menuDocument(@NonNull String categories,
																	@NonNull String products,
																	@NonNull String variants,
																	@NonNull String coupons) {
		String json = format("""
				{
				  "Categorization": {"Food": {"Code": "Food", "Name": "", "Description": "", "Products": [], "Categories": [%s]}},
				  "Products": {%s},
				  "Variants": {%s},
				  "Coupons": {%s}
				}
				""", categories, products, variants, coupons);

		return JsonParser.parseString(json).getAsJsonObject();
	}

	@NonNull
	private String category(@NonNull String code,
													@NonNull String products,
													@NonNull String children) {
		return format("{\"Code\": \"%s\", \"Name\": \"%s\", \"Description\": \"\", \"Products\": %s, \"Categories\": %s}",
				code, code, products, children);
	}

	@NonNull
	private String product(@NonNull String code) {
		return format("\"%s\": {\"Code\": \"%s\", \"Name\": \"%s\", \"ProductType\": \"Pizza\", \"Description\": \"\", \"Variants\": [\"V1\"]}",
				code, code, code);
	}

	@NonNull
	private String lineItem(@NonNull String code,
													@NonNull String productCode,
													@NonNull String price) {
		return format("\"%s\": {\"Code\": \"%s\", \"Name\": \"%s\", \"Price\": \"%s\", \"SizeCode\": \"12\", \"ProductCode\": \"%s\"}",
				code, code, code, price, productCode);
	}

	@NonNull
	private String coupon(@NonNull String code,
												@NonNull String name,
												@NonNull String price) {
		return format("\"%s\": {\"Code\": \"%s\", \"Name\": \"%s\", \"Price\": \"%s\"}", code, code, name, price);
	}
}
