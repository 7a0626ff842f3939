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

package com.pizzaclient.service;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.pizzaclient.model.Address;
import com.pizzaclient.model.PickupType;
import com.pizzaclient.model.Store;
import com.pizzaclient.parser.MalformedRecordPolicy;
import com.pizzaclient.parser.RecordResult;
import com.pizzaclient.parser.StoreParser;
import com.pizzaclient.util.ApiClient;
import com.pizzaclient.util.ApiEndpoint;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static com.pizzaclient.parser.JsonFields.findArray;
import static java.util.Objects.requireNonNull;

/**
 * Finds stores near an address.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class StoreService {
	@NonNull
	private final ApiClient apiClient;
	@NonNull
	private final MalformedRecordPolicy malformedRecordPolicy;
	@NonNull
	private final Logger logger;

	@Inject
	public StoreService(@NonNull ApiClient apiClient,
											@NonNull MalformedRecordPolicy malformedRecordPolicy) {
		requireNonNull(apiClient);
		requireNonNull(malformedRecordPolicy);

		this.apiClient = apiClient;
		this.malformedRecordPolicy = malformedRecordPolicy;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Stores near the address, in the order the store locator returns them.
	 * <p>
	 * Issues one store locator request per call.  Entries are validated only as the stream is consumed,
	 * so the returned stream is single-use: call again (which re-fetches) for a fresh one.
	 * An unreachable or empty store list yields an empty stream.
	 */
	@NonNull
	public Stream<Store> findNearestStores(@NonNull Address address,
																				 @NonNull PickupType pickupType) {
		requireNonNull(address);
		requireNonNull(pickupType);

		JsonObject document = getApiClient().fetchDocument(ApiEndpoint.FIND_STORES, Map.of(
				"addressLineOne", address.lineOne(),
				"addressLineTwo", address.lineTwo(),
				"pickupType", pickupType.getWireValue()
		)).orElse(null);

		if (document == null)
			return Stream.empty();

		JsonArray rawStores = findArray(document, "Stores").orElse(null);

		if (rawStores == null || rawStores.size() == 0) {
			getLogger().warn("No stores found near {}", address);
			return Stream.empty();
		}

		Iterator<Store> storeIterator = new StoreIterator(rawStores.iterator(), pickupType);

		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(storeIterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	/**
	 * The first store near the address that is available for the pickup type, if any.
	 */
	@NonNull
	public Optional<Store> findClosestAvailableStore(@NonNull Address address,
																									 @NonNull PickupType pickupType) {
		requireNonNull(address);
		requireNonNull(pickupType);

		Optional<Store> store = findNearestStores(address, pickupType)
				.filter(Store::isAvailable)
				.findFirst();

		if (store.isEmpty())
			getLogger().info("No store near {} is available for {}", address, pickupType.getWireValue());

		return store;
	}

	// Pulls and validates one raw store at a time
	@NotThreadSafe
	private class StoreIterator implements Iterator<Store> {
		@NonNull
		private final Iterator<JsonElement> rawStores;
		@NonNull
		private final PickupType pickupType;
		@Nullable
		private Store nextStore;
		private boolean stopped;

		StoreIterator(@NonNull Iterator<JsonElement> rawStores,
									@NonNull PickupType pickupType) {
			requireNonNull(rawStores);
			requireNonNull(pickupType);

			this.rawStores = rawStores;
			this.pickupType = pickupType;
		}

		@Override
		public boolean hasNext() {
			while (this.nextStore == null && !this.stopped && this.rawStores.hasNext()) {
				JsonElement rawStore = this.rawStores.next();
				RecordResult<Store> result = StoreParser.parseStore(rawStore, this.pickupType);
				Store store = result.getRecord().orElse(null);

				if (store != null) {
					this.nextStore = store;
				} else if (getMalformedRecordPolicy() == MalformedRecordPolicy.ABORT_SECTION) {
					// One bad entry means the rest of the payload is not trustworthy either
					getLogger().warn("Could not parse store ({}), ignoring it and all stores after it: {}", result.describe(), rawStore);
					this.stopped = true;
				} else {
					getLogger().warn("Skipping malformed store ({}): {}", result.describe(), rawStore);
				}
			}

			return this.nextStore != null;
		}

		@Override
		@NonNull
		public Store next() {
			if (!hasNext())
				throw new NoSuchElementException();

			Store store = this.nextStore;
			this.nextStore = null;
			return store;
		}
	}

	@NonNull
	private ApiClient getApiClient() {
		return this.apiClient;
	}

	@NonNull
	private MalformedRecordPolicy getMalformedRecordPolicy() {
		return this.malformedRecordPolicy;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
