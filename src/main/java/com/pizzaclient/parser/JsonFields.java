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
import com.google.gson.JsonPrimitive;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Typed, null-safe access to fields of upstream JSON records.
 * <p>
 * A key whose value is JSON {@code null} counts as absent.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class JsonFields {
	/**
	 * Which of the required keys are absent from the object, in the order given.
	 */
	@NonNull
	public static Set<@NonNull String> findMissingKeys(@NonNull JsonObject jsonObject,
																										@NonNull List<@NonNull String> requiredKeys) {
		requireNonNull(jsonObject);
		requireNonNull(requiredKeys);

		Set<String> missingKeys = new LinkedHashSet<>();

		for (String requiredKey : requiredKeys)
			if (findElement(jsonObject, requiredKey).isEmpty())
				missingKeys.add(requiredKey);

		return missingKeys;
	}

	@NonNull
	public static Optional<JsonElement> findElement(@Nullable JsonObject jsonObject,
																									@NonNull String key) {
		requireNonNull(key);

		if (jsonObject == null)
			return Optional.empty();

		JsonElement element = jsonObject.get(key);

		if (element == null || element.isJsonNull())
			return Optional.empty();

		return Optional.of(element);
	}

	/**
	 * Strings and numbers both read as strings, since the upstream API is inconsistent about quoting numeric values.
	 */
	@NonNull
	public static Optional<String> findString(@Nullable JsonObject jsonObject,
																						@NonNull String key) {
		requireNonNull(key);

		return findElement(jsonObject, key)
				.filter(JsonElement::isJsonPrimitive)
				.map(JsonElement::getAsJsonPrimitive)
				.filter(primitive -> primitive.isString() || primitive.isNumber())
				.map(JsonPrimitive::getAsString);
	}

	@NonNull
	public static Boolean findBoolean(@Nullable JsonObject jsonObject,
																		@NonNull String key) {
		requireNonNull(key);

		return findElement(jsonObject, key)
				.filter(JsonElement::isJsonPrimitive)
				.map(JsonElement::getAsJsonPrimitive)
				.filter(JsonPrimitive::isBoolean)
				.map(JsonPrimitive::getAsBoolean)
				.orElse(false);
	}

	@NonNull
	public static Optional<JsonObject> findObject(@Nullable JsonObject jsonObject,
																								@NonNull String key) {
		requireNonNull(key);

		return findElement(jsonObject, key)
				.filter(JsonElement::isJsonObject)
				.map(JsonElement::getAsJsonObject);
	}

	@NonNull
	public static Optional<JsonArray> findArray(@Nullable JsonObject jsonObject,
																							@NonNull String key) {
		requireNonNull(key);

		return findElement(jsonObject, key)
				.filter(JsonElement::isJsonArray)
				.map(JsonElement::getAsJsonArray);
	}

	/**
	 * Reads an array of string codes.  Empty if the value is not an array or holds anything other than strings and numbers.
	 */
	@NonNull
	public static Optional<List<@NonNull String>> findStringList(@Nullable JsonObject jsonObject,
																															 @NonNull String key) {
		requireNonNull(key);

		JsonArray jsonArray = findArray(jsonObject, key).orElse(null);

		if (jsonArray == null)
			return Optional.empty();

		List<String> strings = new ArrayList<>(jsonArray.size());

		for (JsonElement element : jsonArray) {
			if (!element.isJsonPrimitive())
				return Optional.empty();

			JsonPrimitive primitive = element.getAsJsonPrimitive();

			if (!primitive.isString() && !primitive.isNumber())
				return Optional.empty();

			strings.add(primitive.getAsString());
		}

		return Optional.of(strings);
	}

	private JsonFields() {
		// Non-instantiable
	}
}
