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

import static java.util.Objects.requireNonNull;

/**
 * A candidate store returned by the store locator.
 * <p>
 * {@code isAvailable} is relative to the {@link PickupType} the store was looked up with:
 * the store is online right now and its service for that pickup type is open.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Store(
		@NonNull Integer storeId,
		@NonNull Address address,
		@NonNull Boolean isAvailable
) {
	public Store {
		requireNonNull(storeId);
		requireNonNull(address);
		requireNonNull(isAvailable);
	}
}
