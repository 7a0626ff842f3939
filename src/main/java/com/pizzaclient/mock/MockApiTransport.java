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

package com.pizzaclient.mock;

import com.pizzaclient.util.ApiTransport;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link ApiTransport} which serves canned documents from the filesystem.
 * <p>
 * Every store locator request gets {@code store-locator.json} and every menu request gets {@code menu.json}, regardless of parameters.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockApiTransport implements ApiTransport {
	@NonNull
	private final Path fixturesDirectory;

	public MockApiTransport(@NonNull Path fixturesDirectory) {
		requireNonNull(fixturesDirectory);
		this.fixturesDirectory = fixturesDirectory;
	}

	@NonNull
	@Override
	public ApiResponse get(@NonNull ApiRequest request) throws ApiTransportException {
		requireNonNull(request);

		String fixtureName = switch (request.endpoint()) {
			case FIND_STORES -> "store-locator.json";
			case GET_MENU -> "menu.json";
		};

		Path fixture = getFixturesDirectory().resolve(fixtureName);

		if (!Files.isRegularFile(fixture))
			throw new ApiTransportException(format("No fixture found at %s for %s", fixture.toAbsolutePath(), request.uri()));

		try {
			return new ApiResponse(200, Files.readString(fixture, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new ApiTransportException(format("Error reading fixture from %s", fixture.toAbsolutePath()), e);
		}
	}

	@NonNull
	private Path getFixturesDirectory() {
		return this.fixturesDirectory;
	}
}
