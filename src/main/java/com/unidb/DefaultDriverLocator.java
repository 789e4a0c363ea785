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

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.FINER;
import static java.util.stream.Collectors.toList;

/**
 * Basic implementation of {@link DriverLocator}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultDriverLocator implements DriverLocator {
	@Nonnull
	private final Logger logger;

	public DefaultDriverLocator() {
		this.logger = Logger.getLogger(getClass().getName());
	}

	@Override
	@Nonnull
	public Optional<Driver> loadDriver(@Nonnull String driverClassName) {
		requireNonNull(driverClassName);

		Class<?> driverClass;

		try {
			driverClass = Class.forName(driverClassName, true, getClassLoader());
		} catch (ClassNotFoundException | LinkageError e) {
			getLogger().log(FINER, format("JDBC driver %s is not available", driverClassName));
			return Optional.empty();
		}

		if (!Driver.class.isAssignableFrom(driverClass)) {
			getLogger().log(FINE, format("%s is not a %s implementation, ignoring it", driverClassName, Driver.class.getName()));
			return Optional.empty();
		}

		try {
			return Optional.of((Driver) driverClass.getDeclaredConstructor().newInstance());
		} catch (ReflectiveOperationException | LinkageError e) {
			getLogger().log(FINE, format("Unable to instantiate JDBC driver %s", driverClassName), e);
			return Optional.empty();
		}
	}

	@Override
	@Nonnull
	public List<Driver> findDrivers(@Nonnull String jdbcUrl) {
		requireNonNull(jdbcUrl);

		return DriverManager.drivers()
				.filter(driver -> acceptsUrl(driver, jdbcUrl))
				.collect(toList());
	}

	protected boolean acceptsUrl(@Nonnull Driver driver,
															 @Nonnull String jdbcUrl) {
		requireNonNull(driver);
		requireNonNull(jdbcUrl);

		try {
			return driver.acceptsURL(jdbcUrl);
		} catch (SQLException e) {
			getLogger().log(FINER, format("JDBC driver %s could not evaluate URL %s", driver.getClass().getName(), jdbcUrl), e);
			return false;
		}
	}

	@Nonnull
	protected ClassLoader getClassLoader() {
		ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
		return contextClassLoader == null ? DefaultDriverLocator.class.getClassLoader() : contextClassLoader;
	}

	@Nonnull
	protected Logger getLogger() {
		return this.logger;
	}
}
