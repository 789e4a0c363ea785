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
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Picks the one {@link Backend} that will serve a {@link Database}, based on which JDBC drivers are available.
 * <p>
 * Dedicated drivers are preferred over whatever {@link java.sql.DriverManager} offers for the family's URL. Resolution
 * either succeeds with exactly one backend or fails; there is no fallback after the fact.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class BackendResolver {
	@NonNull
	private final DriverLocator driverLocator;
	@NonNull
	private final Logger logger;

	BackendResolver(@NonNull DriverLocator driverLocator) {
		this.driverLocator = requireNonNull(driverLocator);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Resolves the backend for {@code family}.
	 *
	 * @param family      the requested database family
	 * @param credentials connection details; for SQLite the database is the file path that gets inspected
	 * @return the backend to use
	 * @throws EnvironmentException  if no suitable driver is available
	 * @throws ConnectivityException if an existing SQLite file cannot be read or is not a SQLite database
	 */
	@NonNull
	Backend resolve(@NonNull DatabaseFamily family,
									@NonNull Credentials credentials) {
		requireNonNull(family);
		requireNonNull(credentials);

		Backend backend;

		switch (family) {
			case MSSQL:
				backend = resolveMssql();
				break;
			case MYSQL:
				backend = resolveMysql(credentials);
				break;
			case POSTGRESQL:
				backend = resolvePostgresql(credentials);
				break;
			case SQLITE:
				backend = resolveSqlite(credentials);
				break;
			default:
				throw new IllegalStateException(format("Unhandled %s value %s", DatabaseFamily.class.getSimpleName(), family.name()));
		}

		getLogger().fine(format("Resolved %s backend for %s", backend.getType().name(), family.getDisplayName()));

		return backend;
	}

	@NonNull
	private Backend resolveMssql() {
		Driver driver = getDriverLocator().loadDriver(MssqlBackend.DRIVER_CLASS_NAME).orElse(null);

		if (driver == null)
			throw new EnvironmentException(EnvironmentException.Reason.MISSING_DRIVER,
					format("The MSSQL database type requires the JDBC driver %s", MssqlBackend.DRIVER_CLASS_NAME));

		return new MssqlBackend(driver);
	}

	@NonNull
	private Backend resolveMysql(@NonNull Credentials credentials) {
		Driver driver = getDriverLocator().loadDriver(MysqlBackend.MYSQL_DRIVER_CLASS_NAME).orElse(null);

		if (driver != null)
			return new MysqlBackend(BackendType.MYSQL, driver);

		driver = getDriverLocator().loadDriver(MysqlBackend.MARIADB_DRIVER_CLASS_NAME).orElse(null);

		if (driver != null)
			return new MysqlBackend(BackendType.MARIADB, driver);

		driver = findGenericDriver(DatabaseFamily.MYSQL, credentials).orElse(null);

		if (driver != null)
			return new GenericBackend(DatabaseFamily.MYSQL, driver);

		throw new EnvironmentException(EnvironmentException.Reason.MISSING_DRIVER,
				format("The MySQL database type requires one of the JDBC drivers %s or %s, or another driver registered for jdbc:mysql: URLs",
						MysqlBackend.MYSQL_DRIVER_CLASS_NAME, MysqlBackend.MARIADB_DRIVER_CLASS_NAME));
	}

	@NonNull
	private Backend resolvePostgresql(@NonNull Credentials credentials) {
		Driver driver = getDriverLocator().loadDriver(PgsqlBackend.DRIVER_CLASS_NAME).orElse(null);

		if (driver != null)
			return new PgsqlBackend(driver);

		driver = findGenericDriver(DatabaseFamily.POSTGRESQL, credentials).orElse(null);

		if (driver != null)
			return new GenericBackend(DatabaseFamily.POSTGRESQL, driver);

		throw new EnvironmentException(EnvironmentException.Reason.MISSING_DRIVER,
				format("The PostgreSQL database type requires the JDBC driver %s, or another driver registered for jdbc:postgresql: URLs",
						PgsqlBackend.DRIVER_CLASS_NAME));
	}

	@NonNull
	private Backend resolveSqlite(@NonNull Credentials credentials) {
		SqliteFormat sqliteFormat = SqliteFormat.detect(credentials.getDatabase());

		Driver genericDriver = sqliteFormat == SqliteFormat.V2 ? null : findGenericDriver(DatabaseFamily.SQLITE, credentials).orElse(null);

		if (genericDriver != null)
			return new GenericBackend(DatabaseFamily.SQLITE, genericDriver);

		Driver legacyDriver = sqliteFormat == SqliteFormat.V3 ? null : getDriverLocator().loadDriver(LegacySqliteBackend.DRIVER_CLASS_NAME).orElse(null);

		if (legacyDriver != null)
			return new LegacySqliteBackend(legacyDriver);

		if (sqliteFormat == SqliteFormat.V3 && getDriverLocator().loadDriver(LegacySqliteBackend.DRIVER_CLASS_NAME).isPresent())
			throw new EnvironmentException(EnvironmentException.Reason.INCOMPATIBLE_DRIVER,
					format("The SQLite database %s is a SQLite 3 database, which requires a JDBC driver registered for jdbc:sqlite: URLs. Only the SQLite 2 driver %s is available",
							credentials.getDatabase(), LegacySqliteBackend.DRIVER_CLASS_NAME));

		if (sqliteFormat == SqliteFormat.V2 && findGenericDriver(DatabaseFamily.SQLITE, credentials).isPresent())
			throw new EnvironmentException(EnvironmentException.Reason.INCOMPATIBLE_DRIVER,
					format("The SQLite database %s is a SQLite 2 database, which requires the JDBC driver %s. Only a SQLite 3 driver is available",
							credentials.getDatabase(), LegacySqliteBackend.DRIVER_CLASS_NAME));

		throw new EnvironmentException(EnvironmentException.Reason.MISSING_DRIVER,
				format("The SQLite database type requires a JDBC driver registered for jdbc:sqlite: URLs (SQLite 3) or the JDBC driver %s (SQLite 2)",
						LegacySqliteBackend.DRIVER_CLASS_NAME));
	}

	/**
	 * The first driver registered for the family's URL, never the legacy SQLite driver.
	 */
	@NonNull
	private Optional<Driver> findGenericDriver(@NonNull DatabaseFamily family,
																						 @NonNull Credentials credentials) {
		return getDriverLocator().findDrivers(family.jdbcUrl(credentials)).stream()
				.filter(driver -> !LegacySqliteBackend.DRIVER_CLASS_NAME.equals(driver.getClass().getName()))
				.findFirst();
	}

	@NonNull
	DriverLocator getDriverLocator() {
		return this.driverLocator;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
