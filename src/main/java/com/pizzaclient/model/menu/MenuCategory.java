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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A top-level menu category with its subtree folded in.
 * <p>
 * {@code productCodes} refers to {@link MenuProduct#code()} by value.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record MenuCategory(
		@NonNull String code,
		@NonNull String name,
		@NonNull String description,
		@NonNull Set<@NonNull String> productCodes
) {
	public MenuCategory {
		requireNonNull(code);
		requireNonNull(name);
		requireNonNull(description);
		requireNonNull(productCodes);

		// Keep upstream order for display
		productCodes = Collections.unmodifiableSet(new LinkedHashSet<>(productCodes));
	}
}
