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

import org.hsqldb.jdbc.JDBCDriver;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Driver;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class BackendResolverTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	public void testMssqlRequiresDedicatedDriver() {
		FakeDriverLocator driverLocator = new FakeDriverLocator();
		Credentials credentials = serverCredentials();

		EnvironmentException e = Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(driverLocator).resolve(DatabaseFamily.MSSQL, credentials));
		Assertions.assertEquals(EnvironmentException.Reason.MISSING_DRIVER, e.getReason());

		driverLocator.withGenericDriver(new JDBCDriver());
		Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(driverLocator).resolve(DatabaseFamily.MSSQL, credentials),
				"Generic drivers never serve MSSQL");

		driverLocator.withDedicatedDriver(MssqlBackend.DRIVER_CLASS_NAME, new JDBCDriver());
		Assertions.assertEquals(BackendType.MSSQL, new BackendResolver(driverLocator).resolve(DatabaseFamily.MSSQL, credentials).getType());
	}

	@Test
	public void testMysqlDriverPriority() {
		Credentials credentials = serverCredentials();

		FakeDriverLocator allDrivers = new FakeDriverLocator()
				.withDedicatedDriver(MysqlBackend.MYSQL_DRIVER_CLASS_NAME, new JDBCDriver())
				.withDedicatedDriver(MysqlBackend.MARIADB_DRIVER_CLASS_NAME, new JDBCDriver())
				.withGenericDriver(new JDBCDriver());
		Assertions.assertEquals(BackendType.MYSQL, new BackendResolver(allDrivers).resolve(DatabaseFamily.MYSQL, credentials).getType());

		FakeDriverLocator mariadbAndGeneric = new FakeDriverLocator()
				.withDedicatedDriver(MysqlBackend.MARIADB_DRIVER_CLASS_NAME, new JDBCDriver())
				.withGenericDriver(new JDBCDriver());
		Assertions.assertEquals(BackendType.MARIADB, new BackendResolver(mariadbAndGeneric).resolve(DatabaseFamily.MYSQL, credentials).getType());

		FakeDriverLocator genericOnly = new FakeDriverLocator().withGenericDriver(new JDBCDriver());
		Backend genericBackend = new BackendResolver(genericOnly).resolve(DatabaseFamily.MYSQL, credentials);
		Assertions.assertEquals(BackendType.GENERIC, genericBackend.getType());
		Assertions.assertEquals(DatabaseFamily.MYSQL, genericBackend.getFamily());
		Assertions.assertEquals(List.of("jdbc:mysql://localhost/inventory"), genericOnly.getRequestedUrls());

		EnvironmentException e = Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(new FakeDriverLocator()).resolve(DatabaseFamily.MYSQL, credentials));
		Assertions.assertEquals(EnvironmentException.Reason.MISSING_DRIVER, e.getReason());
	}

	@Test
	public void testPostgresqlDriverPriority() {
		Credentials credentials = new Credentials("inventory", "app", "secret", "db.example.com", 5433);

		FakeDriverLocator allDrivers = new FakeDriverLocator()
				.withDedicatedDriver(PgsqlBackend.DRIVER_CLASS_NAME, new JDBCDriver())
				.withGenericDriver(new JDBCDriver());
		Assertions.assertEquals(BackendType.PGSQL, new BackendResolver(allDrivers).resolve(DatabaseFamily.POSTGRESQL, credentials).getType());

		FakeDriverLocator genericOnly = new FakeDriverLocator().withGenericDriver(new JDBCDriver());
		Assertions.assertEquals(BackendType.GENERIC, new BackendResolver(genericOnly).resolve(DatabaseFamily.POSTGRESQL, credentials).getType());
		Assertions.assertEquals(List.of("jdbc:postgresql://db.example.com:5433/inventory"), genericOnly.getRequestedUrls());

		EnvironmentException e = Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(new FakeDriverLocator()).resolve(DatabaseFamily.POSTGRESQL, credentials));
		Assertions.assertEquals(EnvironmentException.Reason.MISSING_DRIVER, e.getReason());
	}

	@Test
	public void testNewSqliteFileAcceptsEitherDriver() {
		Credentials credentials = sqliteCredentials(this.temporaryDirectory.resolve("new.db"));

		FakeDriverLocator bothDrivers = new FakeDriverLocator()
				.withDedicatedDriver(LegacySqliteBackend.DRIVER_CLASS_NAME, new JDBCDriver())
				.withGenericDriver(new JDBCDriver());
		Assertions.assertEquals(BackendType.GENERIC, new BackendResolver(bothDrivers).resolve(DatabaseFamily.SQLITE, credentials).getType());

		FakeDriverLocator legacyOnly = new FakeDriverLocator()
				.withDedicatedDriver(LegacySqliteBackend.DRIVER_CLASS_NAME, new JDBCDriver());
		Assertions.assertEquals(BackendType.SQLITE, new BackendResolver(legacyOnly).resolve(DatabaseFamily.SQLITE, credentials).getType());

		EnvironmentException e = Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(new FakeDriverLocator()).resolve(DatabaseFamily.SQLITE, credentials));
		Assertions.assertEquals(EnvironmentException.Reason.MISSING_DRIVER, e.getReason());
	}

	@Test
	public void testEmptySqliteFileAcceptsEitherDriver() throws IOException {
		Path database = Files.createFile(this.temporaryDirectory.resolve("empty.db"));
		Credentials credentials = sqliteCredentials(database);

		FakeDriverLocator legacyOnly = new FakeDriverLocator()
				.withDedicatedDriver(LegacySqliteBackend.DRIVER_CLASS_NAME, new JDBCDriver());
		Assertions.assertEquals(BackendType.SQLITE, new BackendResolver(legacyOnly).resolve(DatabaseFamily.SQLITE, credentials).getType());
	}

	@Test
	public void testSqlite3File() throws IOException {
		Credentials credentials = sqliteCredentials(writeHeader("v3.db", SqliteFormat.V3_HEADER + "\0"));

		FakeDriverLocator genericOnly = new FakeDriverLocator().withGenericDriver(new JDBCDriver());
		Assertions.assertEquals(BackendType.GENERIC, new BackendResolver(genericOnly).resolve(DatabaseFamily.SQLITE, credentials).getType());

		FakeDriverLocator legacyOnly = new FakeDriverLocator()
				.withDedicatedDriver(LegacySqliteBackend.DRIVER_CLASS_NAME, new JDBCDriver());
		EnvironmentException e = Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(legacyOnly).resolve(DatabaseFamily.SQLITE, credentials));
		Assertions.assertEquals(EnvironmentException.Reason.INCOMPATIBLE_DRIVER, e.getReason());
	}

	@Test
	public void testSqlite2File() throws IOException {
		Credentials credentials = sqliteCredentials(writeHeader("v2.db", SqliteFormat.V2_HEADER + "\n\0\0"));

		FakeDriverLocator bothDrivers = new FakeDriverLocator()
				.withDedicatedDriver(LegacySqliteBackend.DRIVER_CLASS_NAME, new JDBCDriver())
				.withGenericDriver(new JDBCDriver());
		Assertions.assertEquals(BackendType.SQLITE, new BackendResolver(bothDrivers).resolve(DatabaseFamily.SQLITE, credentials).getType());

		FakeDriverLocator genericOnly = new FakeDriverLocator().withGenericDriver(new JDBCDriver());
		EnvironmentException incompatible = Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(genericOnly).resolve(DatabaseFamily.SQLITE, credentials));
		Assertions.assertEquals(EnvironmentException.Reason.INCOMPATIBLE_DRIVER, incompatible.getReason());

		EnvironmentException missing = Assertions.assertThrows(EnvironmentException.class,
				() -> new BackendResolver(new FakeDriverLocator()).resolve(DatabaseFamily.SQLITE, credentials));
		Assertions.assertEquals(EnvironmentException.Reason.MISSING_DRIVER, missing.getReason());
	}

	@Test
	public void testNonSqliteFileIsRejected() throws IOException {
		Credentials credentials = sqliteCredentials(writeHeader("notes.txt", "Just some notes, nothing to see here"));

		FakeDriverLocator bothDrivers = new FakeDriverLocator()
				.withDedicatedDriver(LegacySqliteBackend.DRIVER_CLASS_NAME, new JDBCDriver())
				.withGenericDriver(new JDBCDriver());

		Assertions.assertThrows(ConnectivityException.class,
				() -> new BackendResolver(bothDrivers).resolve(DatabaseFamily.SQLITE, credentials));
	}

	@Test
	public void testSqliteFormatDetection() throws IOException {
		Assertions.assertEquals(SqliteFormat.UNKNOWN, SqliteFormat.detect(this.temporaryDirectory.resolve("missing.db").toString()));
		Assertions.assertEquals(SqliteFormat.UNKNOWN, SqliteFormat.detect(":memory:"));
		Assertions.assertEquals(SqliteFormat.V3, SqliteFormat.detect(writeHeader("a.db", SqliteFormat.V3_HEADER).toString()));
		Assertions.assertEquals(SqliteFormat.V2, SqliteFormat.detect(writeHeader("b.db", SqliteFormat.V2_HEADER).toString()));
	}

	@NonNull
	private Path writeHeader(@NonNull String fileName,
													 @NonNull String header) throws IOException {
		requireNonNull(fileName);
		requireNonNull(header);

		Path file = this.temporaryDirectory.resolve(fileName);
		Files.write(file, header.getBytes(StandardCharsets.ISO_8859_1));
		return file;
	}

	@NonNull
	private Credentials serverCredentials() {
		return new Credentials("inventory", "app", "secret", null, null);
	}

	@NonNull
	private Credentials sqliteCredentials(@NonNull Path database) {
		requireNonNull(database);
		return new Credentials(database.toString(), null, null, null, null);
	}

	@NotThreadSafe
	private static class FakeDriverLocator implements DriverLocator {
		@NonNull
		private final Map<String, Driver> dedicatedDrivers = new HashMap<>();
		@NonNull
		private final List<Driver> genericDrivers = new ArrayList<>();
		@NonNull
		private final List<String> requestedUrls = new ArrayList<>();

		@NonNull
		FakeDriverLocator withDedicatedDriver(@NonNull String driverClassName,
																					@NonNull Driver driver) {
			this.dedicatedDrivers.put(requireNonNull(driverClassName), requireNonNull(driver));
			return this;
		}

		@NonNull
		FakeDriverLocator withGenericDriver(@NonNull Driver driver) {
			this.genericDrivers.add(requireNonNull(driver));
			return this;
		}

		@Override
		@NonNull
		public Optional<Driver> loadDriver(@NonNull String driverClassName) {
			return Optional.ofNullable(this.dedicatedDrivers.get(driverClassName));
		}

		@Override
		@NonNull
		public List<Driver> findDrivers(@NonNull String jdbcUrl) {
			this.requestedUrls.add(jdbcUrl);
			return List.copyOf(this.genericDrivers);
		}

		@NonNull
		List<String> getRequestedUrls() {
			return this.requestedUrls;
		}
	}
}
