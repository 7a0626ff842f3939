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

package com.pizzaclient.model;

import org.jspecify.annotations.NonNull;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A North American street address, already normalized by the caller.
 * <p>
 * The store locator accepts an address as two opaque fragments: {@link #lineOne()} and {@link #lineTwo()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Address(
		@NonNull String street,
		@NonNull String city,
		@NonNull String region,
		@NonNull Integer postalCode
) {
	public Address {
		requireNonNull(street);
		requireNonNull(city);
		requireNonNull(region);
		requireNonNull(postalCode);
	}

	@NonNull
	public String lineOne() {
		return street();
	}

	@NonNull
	public String lineTwo() {
		return format("%s %s %d", city(), region(), postalCode());
	}
}
