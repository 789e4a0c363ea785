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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Driver;
import java.util.List;
import java.util.Optional;

/**
 * Contract for discovering which JDBC drivers are available to the running program.
 * <p>
 * A {@link Database} consults its locator exactly once, while it is being built, to decide which backend serves the
 * requested family.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public interface DriverLocator {
	/**
	 * Loads and instantiates a specific driver class.
	 *
	 * @param driverClassName fully-qualified name of the {@link Driver} implementation, e.g. {@code org.postgresql.Driver}
	 * @return the driver, or empty if the class is not available
	 */
	@NonNull
	Optional<Driver> loadDriver(@NonNull String driverClassName);

	/**
	 * Finds every registered driver which accepts the given JDBC URL, in registration order.
	 *
	 * @param jdbcUrl the URL to be served, e.g. {@code jdbc:sqlite:/tmp/example.db}
	 * @return the drivers which accept {@code jdbcUrl}; empty if there are none
	 */
	@NonNull
	List<@NonNull Driver> findDrivers(@NonNull String jdbcUrl);

	/**
	 * Acquires a locator that looks drivers up through the context class loader and {@link java.sql.DriverManager}.
	 *
	 * @return a {@code DriverLocator} with default configuration
	 */
	@NonNull
	static DriverLocator withDefaultConfiguration() {
		return new DefaultDriverLocator();
	}
}
