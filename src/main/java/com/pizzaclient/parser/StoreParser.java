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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.pizzaclient.model.Address;
import com.pizzaclient.model.PickupType;
import com.pizzaclient.model.Store;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.pizzaclient.parser.JsonFields.findBoolean;
import static com.pizzaclient.parser.JsonFields.findMissingKeys;
import static com.pizzaclient.parser.JsonFields.findObject;
import static com.pizzaclient.parser.JsonFields.findString;
import static com.pizzaclient.util.Normalizer.parseInteger;
import static com.pizzaclient.util.Normalizer.trimToNull;
import static java.util.Objects.requireNonNull;

/**
 * Validates one entry of the store locator's {@code Stores} array.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StoreParser {
	@NonNull
	private static final List<@NonNull String> REQUIRED_ADDRESS_KEYS;

	static {
		REQUIRED_ADDRESS_KEYS = List.of("Street", "City", "Region", "PostalCode");
	}

	@NonNull
	public static RecordResult<Store> parseStore(@NonNull JsonElement rawStore,
																							 @NonNull PickupType pickupType) {
		requireNonNull(rawStore);
		requireNonNull(pickupType);

		if (!rawStore.isJsonObject())
			return RecordResult.invalidValues("Stores");

		JsonObject store = rawStore.getAsJsonObject();
		JsonObject rawAddress = findObject(store, "Address").orElse(null);

		if (rawAddress == null || isEntirelyBlank(rawAddress))
			return RecordResult.missingKeys("Address");

		Set<String> missingKeys = findMissingKeys(rawAddress, REQUIRED_ADDRESS_KEYS);

		if (findString(store, "StoreID").isEmpty())
			missingKeys.add("StoreID");

		if (!missingKeys.isEmpty())
			return new RecordResult.MissingKeys<>(missingKeys);

		Set<String> invalidKeys = new LinkedHashSet<>();
		Integer postalCode = parseInteger(findString(rawAddress, "PostalCode").orElse(null)).orElse(null);
		Integer storeId = parseInteger(findString(store, "StoreID").orElse(null)).orElse(null);

		if (postalCode == null)
			invalidKeys.add("PostalCode");

		if (storeId == null)
			invalidKeys.add("StoreID");

		String street = findString(rawAddress, "Street").orElse(null);
		String city = findString(rawAddress, "City").orElse(null);
		String region = findString(rawAddress, "Region").orElse(null);

		if (street == null)
			invalidKeys.add("Street");
		if (city == null)
			invalidKeys.add("City");
		if (region == null)
			invalidKeys.add("Region");

		if (!invalidKeys.isEmpty())
			return new RecordResult.InvalidValues<>(invalidKeys);

		// A pickup type the store never advertises is simply unavailable
		Boolean isAvailable = findBoolean(store, "IsOnlineNow")
				&& findBoolean(findObject(store, "ServiceIsOpen").orElse(null), pickupType.getWireValue());

		return new RecordResult.Succeeded<>(new Store(storeId, new Address(street, city, region, postalCode), isAvailable));
	}

	@NonNull
	private static Boolean isEntirelyBlank(@NonNull JsonObject rawAddress) {
		requireNonNull(rawAddress);

		for (String key : REQUIRED_ADDRESS_KEYS)
			if (trimToNull(findString(rawAddress, key).orElse(null)) != null)
				return false;

		return true;
	}

	private StoreParser() {
		// Non-instantiable
	}
}
