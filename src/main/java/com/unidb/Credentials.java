/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.unidb;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Where and as whom to connect.
 * <p>
 * For {@link DatabaseFamily#SQLITE}, {@code database} is a filesystem path.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class Credentials {
	@NonNull
	static final String DEFAULT_HOST = "localhost";

	@NonNull
	private final String database;
	@Nullable
	private final String username;
	@Nullable
	private final String password;
	@Nullable
	private final String host;
	@Nullable
	private final Integer port;

	Credentials(@NonNull String database,
							@Nullable String username,
							@Nullable String password,
							@Nullable String host,
							@Nullable Integer port) {
		this.database = requireNonNull(database);
		this.username = username;
		this.password = password;
		this.host = host;
		this.port = port;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("database=%s", getDatabase()));

		if (this.username != null)
			components.add(format("username=%s", this.username));
		if (this.host != null)
			components.add(format("host=%s", this.host));
		if (this.port != null)
			components.add(format("port=%s", this.port));

		// Never log the password
		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	/**
	 * {@code host[:port]}, where the port only appears if it was explicitly set.
	 */
	@NonNull
	String getHostAndPort() {
		String host = getHost().orElse(DEFAULT_HOST);
		return this.port == null ? host : format("%s:%d", host, this.port);
	}

	@NonNull
	String getDatabase() {
		return this.database;
	}

	@NonNull
	Optional<String> getUsername() {
		return Optional.ofNullable(this.username);
	}

	@NonNull
	Optional<String> getPassword() {
		return Optional.ofNullable(this.password);
	}

	@NonNull
	Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	Optional<Integer> getPort() {
		return Optional.ofNullable(this.port);
	}
}
