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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class NormalizerTests {
	@Test
	public void testTrimToNull() {
		Assertions.assertEquals("8.99", Normalizer.trimToNull(" 8.99\t"), "Surrounding whitespace should be removed");
		Assertions.assertEquals("8.99", Normalizer.trimToNull("\u00A08.99\u2007"), "Unicode separators should be removed");
		Assertions.assertEquals("1 Main St", Normalizer.trimToNull("1 Main St"), "Inner whitespace should be kept");
		Assertions.assertNull(Normalizer.trimToNull("   "), "Blank should become null");
		Assertions.assertNull(Normalizer.trimToNull(null), "Null should stay null");
	}

	@Test
	public void testParseInteger() {
		Assertions.assertEquals(20500, Normalizer.parseInteger("20500").orElseThrow().intValue(), "Wrong value");
		Assertions.assertEquals(4336, Normalizer.parseInteger(" 4336 ").orElseThrow().intValue(), "Whitespace should be tolerated");
		Assertions.assertTrue(Normalizer.parseInteger("20500-1234").isEmpty(), "ZIP+4 is not an integer");
		Assertions.assertTrue(Normalizer.parseInteger("").isEmpty(), "Blank is not an integer");
	}

	@Test
	public void testParsePrice() {
		Assertions.assertEquals(new BigDecimal("8.99"), Normalizer.parsePrice("8.99").orElseThrow(), "Wrong price");
		Assertions.assertEquals(new BigDecimal("0"), Normalizer.parsePrice("0").orElseThrow(), "Zero is a price");
		Assertions.assertTrue(Normalizer.parsePrice("-1.00").isEmpty(), "Negative is not a price");
		Assertions.assertTrue(Normalizer.parsePrice("$8.99").isEmpty(), "Currency symbols are not accepted");
		Assertions.assertTrue(Normalizer.parsePrice(null).isEmpty(), "Null is not a price");
	}
}
