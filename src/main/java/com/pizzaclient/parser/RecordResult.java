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

import org.jspecify.annotations.NonNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Validating a record from the upstream API can have many outcomes.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public sealed interface RecordResult<T> {
	record Succeeded<T>(@NonNull T record) implements RecordResult<T> {
		public Succeeded {
			requireNonNull(record);
		}
	}

	record MissingKeys<T>(@NonNull Set<@NonNull String> keys) implements RecordResult<T> {
		public MissingKeys {
			requireNonNull(keys);
			keys = Collections.unmodifiableSet(new LinkedHashSet<>(keys));
		}
	}

	record InvalidValues<T>(@NonNull Set<@NonNull String> keys) implements RecordResult<T> {
		public InvalidValues {
			requireNonNull(keys);
			keys = Collections.unmodifiableSet(new LinkedHashSet<>(keys));
		}
	}

	@NonNull
	static <T> RecordResult<T> missingKeys(@NonNull String... keys) {
		requireNonNull(keys);
		return new MissingKeys<>(Set.of(keys));
	}

	@NonNull
	static <T> RecordResult<T> invalidValues(@NonNull String... keys) {
		requireNonNull(keys);
		return new InvalidValues<>(Set.of(keys));
	}

	@NonNull
	default Optional<T> getRecord() {
		if (this instanceof Succeeded<T> succeeded)
			return Optional.of(succeeded.record());

		return Optional.empty();
	}

	/**
	 * Re-types a failure so it can be propagated from a nested record to its parent.
	 */
	@NonNull
	default <R> RecordResult<R> asFailure() {
		if (this instanceof MissingKeys<T> missingKeys)
			return new MissingKeys<>(missingKeys.keys());
		if (this instanceof InvalidValues<T> invalidValues)
			return new InvalidValues<>(invalidValues.keys());

		throw new IllegalStateException("A successful result is not a failure");
	}

	@NonNull
	default String describe() {
		if (this instanceof MissingKeys<T> missingKeys)
			return format("missing keys %s", missingKeys.keys());
		if (this instanceof InvalidValues<T> invalidValues)
			return format("invalid values for keys %s", invalidValues.keys());

		return "valid";
	}
}
