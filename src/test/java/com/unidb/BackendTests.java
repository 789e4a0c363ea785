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

import org.hsqldb.jdbc.JDBCDataSource;
import org.hsqldb.jdbc.JDBCDriver;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Backend behavior that does not need a live server of the backend's own kind, exercised over HSQLDB.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class BackendTests {
	@Test
	public void testStringEscaping() throws SQLException {
		try (Connection connection = createConnection("backend_strings")) {
			String value = "O'Reilly \\ \"quoted\"\n";

			Assertions.assertEquals("'O\\'Reilly \\\\ \\\"quoted\\\"\\n'",
					new MysqlBackend(BackendType.MYSQL, new JDBCDriver()).escapeString(connection, value));
			Assertions.assertEquals("'O''Reilly \\ \"quoted\"\n'", new MssqlBackend(new JDBCDriver()).escapeString(connection, value));
			Assertions.assertEquals("'O''Reilly \\ \"quoted\"\n'", new LegacySqliteBackend(new JDBCDriver()).escapeString(connection, value));
			Assertions.assertEquals("'O''Reilly \\ \"quoted\"\n'", new PgsqlBackend(new JDBCDriver()).escapeString(connection, value),
					"Non-pgjdbc connections are treated as having standard_conforming_strings on");
			Assertions.assertEquals("'O''Reilly \\ \"quoted\"\n'",
					new GenericBackend(DatabaseFamily.SQLITE, new JDBCDriver()).escapeString(connection, value));
			Assertions.assertEquals("'O\\'Reilly \\\\ \\\"quoted\\\"\\n'",
					new GenericBackend(DatabaseFamily.MYSQL, new JDBCDriver()).escapeString(connection, value));
		}
	}

	@Test
	public void testMysqlEscapesControlCharacters() {
		Assertions.assertEquals("a\\0b\\rc\\Z", MysqlBackend.escapeMysql("a\0b\rc\032"));
	}

	@Test
	public void testBlobEscaping() throws SQLException {
		byte[] value = new byte[]{0x00, (byte) 0xff, 0x10, 'A'};

		try (Connection connection = createConnection("backend_blobs")) {
			Assertions.assertEquals("0x00ff1041", new MssqlBackend(new JDBCDriver()).escapeBlob(connection, value));
			Assertions.assertEquals("0x", new MssqlBackend(new JDBCDriver()).escapeBlob(connection, new byte[0]));
			Assertions.assertEquals("X'00ff1041'", new MysqlBackend(BackendType.MARIADB, new JDBCDriver()).escapeBlob(connection, value));
			Assertions.assertEquals("X'c328e9275c'", new MysqlBackend(BackendType.MYSQL, new JDBCDriver())
					.escapeBlob(connection, new byte[]{(byte) 0xc3, 0x28, (byte) 0xe9, '\'', '\\'}), "Invalid UTF-8 survives as hex");
			Assertions.assertEquals("X'00ff1041'", new LegacySqliteBackend(new JDBCDriver()).escapeBlob(connection, value));
			Assertions.assertEquals("X'00ff1041'", new GenericBackend(DatabaseFamily.SQLITE, new JDBCDriver()).escapeBlob(connection, value));
			Assertions.assertEquals("'\\x00ff1041'", new GenericBackend(DatabaseFamily.POSTGRESQL, new JDBCDriver()).escapeBlob(connection, value));
		}
	}

	@Test
	public void testPostgresqlByteaEscaping() throws SQLException {
		PgsqlBackend backend = new PgsqlBackend(new JDBCDriver());
		byte[] value = new byte[]{0x00, 'a', '\\', '\''};

		try (Connection connection = createConnection("backend_bytea")) {
			Assertions.assertEquals("'\\000a\\\\'''", backend.escapeBlob(connection, value));
		}

		Assertions.assertArrayEquals(value, backend.unescapeBlob(PostgresSupport.toByteaText(value)));
		Assertions.assertArrayEquals(new byte[]{0x00, (byte) 0xff}, backend.unescapeBlob("\\x00ff"));
		Assertions.assertArrayEquals(value, backend.unescapeBlob(value), "Bytes pass through untouched");
		Assertions.assertNull(backend.unescapeBlob(null));
	}

	@Test
	public void testBlobUnescapingIsIdentityElsewhere() throws SQLException {
		byte[] value = new byte[]{1, 2, 3};

		Assertions.assertSame(value, new MssqlBackend(new JDBCDriver()).unescapeBlob(value));
		Assertions.assertArrayEquals(new byte[]{'a', (byte) 0xe9}, new LegacySqliteBackend(new JDBCDriver()).unescapeBlob("aé"));
		Assertions.assertArrayEquals(new byte[]{0x00, (byte) 0xff},
				new GenericBackend(DatabaseFamily.POSTGRESQL, new JDBCDriver()).unescapeBlob("\\x00ff"));
		Assertions.assertThrows(SQLException.class,
				() -> new GenericBackend(DatabaseFamily.POSTGRESQL, new JDBCDriver()).unescapeBlob("\\xzz"));
	}

	@Test
	public void testErrorsAreNormalized() throws SQLException {
		String sql = "SELECT * FROM missing_table";

		try (Connection connection = createConnection("backend_errors")) {
			MysqlBackend mysqlBackend = new MysqlBackend(BackendType.MYSQL, new JDBCDriver());

			try (Execution execution = mysqlBackend.execute(connection, sql)) {
				Assertions.assertTrue(execution.isFailed());

				SqlExecutionException e = mysqlBackend.describeError(execution);
				String driverMessage = execution.getFailure().orElseThrow().getMessage();

				Assertions.assertEquals(format("MySQL error (%s) in %s", driverMessage, sql), e.getMessage());
				Assertions.assertEquals(sql, e.getSql());
				Assertions.assertNull(e.getCause(), "Driver exceptions are never exposed");
				Assertions.assertTrue(e.getSqlState().isPresent());
				Assertions.assertTrue(e.getErrorCode().isPresent());
			}

			GenericBackend genericBackend = new GenericBackend(DatabaseFamily.SQLITE, new JDBCDriver());

			try (Execution execution = genericBackend.execute(connection, sql)) {
				SqlExecutionException e = genericBackend.describeError(execution);
				String sqlState = execution.getFailure().orElseThrow().getSQLState();

				Assertions.assertTrue(e.getMessage().startsWith(format("SQLite error (%s: ", sqlState)), e.getMessage());
				Assertions.assertTrue(e.getMessage().endsWith(format(") in %s", sql)), e.getMessage());
			}
		}
	}

	@Test
	public void testCursorBackendMetadata() throws SQLException {
		MysqlBackend backend = new MysqlBackend(BackendType.MYSQL, new JDBCDriver());

		try (Connection connection = createConnection("backend_cursor")) {
			for (String color : List.of("red", "green", "blue")) {
				try (Execution execution = backend.execute(connection, format("INSERT INTO car (color) VALUES ('%s')", color))) {
					Assertions.assertFalse(execution.isFailed());
					Assertions.assertEquals(0L, backend.rowsReturned(execution));
					Assertions.assertEquals(1L, backend.rowsAffected(connection, execution));
					Assertions.assertTrue(backend.lastInsertId(connection, execution).orElseThrow() instanceof Long);
				}
			}

			try (Execution execution = backend.execute(connection, "SELECT id, color FROM car ORDER BY id")) {
				Assertions.assertEquals(3L, execution.getCursorRowCount().orElseThrow());
				Assertions.assertEquals(3L, backend.rowsReturned(execution));
				Assertions.assertEquals(0L, backend.rowsAffected(connection, execution));
				Assertions.assertTrue(backend.lastInsertId(connection, execution).isEmpty());

				Map<String, Object> firstRow = execution.getRows().get(0);
				Assertions.assertEquals(List.of("ID", "COLOR"), List.copyOf(firstRow.keySet()));
				Assertions.assertEquals("red", firstRow.get("COLOR"));
			}

			try (Execution execution = backend.execute(connection, "UPDATE car SET color = 'black' WHERE color <> 'red'")) {
				Assertions.assertEquals(2L, backend.rowsAffected(connection, execution));
			}
		}
	}

	@Test
	public void testMaterializingBackendMetadata() throws SQLException {
		GenericBackend backend = new GenericBackend(DatabaseFamily.SQLITE, new JDBCDriver());

		try (Connection connection = createConnection("backend_materializing")) {
			try (Execution execution = backend.execute(connection, "INSERT INTO car (color) VALUES ('red')")) {
				Assertions.assertEquals(1L, backend.rowsAffected(connection, execution));
				// HSQLDB has no last_insert_rowid(); the failure is contained
				Assertions.assertTrue(backend.lastInsertId(connection, execution).isEmpty());
			}

			try (Execution execution = backend.execute(connection, "SELECT * FROM car")) {
				Assertions.assertTrue(execution.getCursorRowCount().isEmpty());
				Assertions.assertEquals(1L, backend.rowsReturned(execution));
				Assertions.assertEquals(0L, backend.rowsAffected(connection, execution));
			}
		}
	}

	@Test
	public void testSessionStatements() {
		Assertions.assertEquals(List.of("SET sql_mode = 'ANSI,STRICT_ALL_TABLES'"),
				new MysqlBackend(BackendType.MARIADB, new JDBCDriver()).getSessionStatements());
		Assertions.assertEquals(List.of("SET sql_mode = 'ANSI,STRICT_ALL_TABLES'"),
				new GenericBackend(DatabaseFamily.MYSQL, new JDBCDriver()).getSessionStatements());
		Assertions.assertEquals(List.of("SET TEXTSIZE 2147483647"), new MssqlBackend(new JDBCDriver()).getSessionStatements());
		Assertions.assertEquals(List.of("PRAGMA short_column_names = 1"), new LegacySqliteBackend(new JDBCDriver()).getSessionStatements());
		Assertions.assertEquals(List.of(), new GenericBackend(DatabaseFamily.SQLITE, new JDBCDriver()).getSessionStatements());
		Assertions.assertEquals(List.of(), new PgsqlBackend(new JDBCDriver()).getSessionStatements());
	}

	@Test
	public void testJdbcUrls() {
		Credentials credentials = new Credentials("inventory", null, null, "db.example.com", 3307);

		Assertions.assertEquals("jdbc:mysql://db.example.com:3307/inventory",
				new MysqlBackend(BackendType.MYSQL, new JDBCDriver()).jdbcUrl(credentials));
		Assertions.assertEquals("jdbc:mariadb://db.example.com:3307/inventory",
				new MysqlBackend(BackendType.MARIADB, new JDBCDriver()).jdbcUrl(credentials));
		Assertions.assertEquals("jdbc:sqlserver://db.example.com:3307;databaseName=inventory",
				new MssqlBackend(new JDBCDriver()).jdbcUrl(credentials));
		Assertions.assertEquals("jdbc:postgresql://localhost/inventory",
				new PgsqlBackend(new JDBCDriver()).jdbcUrl(new Credentials("inventory", null, null, null, null)));
	}

	@Test
	public void testDriverRejectingUrlIsConnectivityFailure() {
		Backend backend = new GenericBackend(DatabaseFamily.SQLITE, new JDBCDriver());
		Credentials credentials = new Credentials("/tmp/never-created.db", null, null, null, null);

		Assertions.assertThrows(ConnectivityException.class, () -> backend.connect(credentials, new Properties()));
	}

	@Test
	public void testInsertDetection() {
		Assertions.assertTrue(AbstractBackend.isInsert("INSERT INTO t VALUES (1)"));
		Assertions.assertTrue(AbstractBackend.isInsert("  \n insert into t values (1)"));
		Assertions.assertTrue(AbstractBackend.isInsert("/* audit */ -- note\n INSERT INTO t VALUES (1)"));
		Assertions.assertFalse(AbstractBackend.isInsert("INSERTED"));
		Assertions.assertFalse(AbstractBackend.isInsert("SELECT 'INSERT'"));
		Assertions.assertFalse(AbstractBackend.isInsert("UPDATE t SET a = 1"));
		Assertions.assertFalse(AbstractBackend.isInsert(""));
	}

	@Test
	public void testIdNormalization() {
		Assertions.assertEquals(7L, AbstractBackend.normalizeId(7));
		Assertions.assertEquals(7L, AbstractBackend.normalizeId((short) 7));
		Assertions.assertEquals(7L, AbstractBackend.normalizeId(BigInteger.valueOf(7)));
		Assertions.assertEquals(7L, AbstractBackend.normalizeId(new BigDecimal("7")));
		Assertions.assertEquals(new BigDecimal("7.5"), AbstractBackend.normalizeId(new BigDecimal("7.5")));
		Assertions.assertEquals("abc", AbstractBackend.normalizeId("abc"));
		Assertions.assertNull(AbstractBackend.normalizeId(null));
	}

	@Test
	public void testBackendTypeMismatchIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new MysqlBackend(BackendType.PGSQL, new JDBCDriver()));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new GenericBackend(DatabaseFamily.MSSQL, new JDBCDriver()));
	}

	@Test
	public void testMysqlConnectionsReportChangedRowsAsAffected() {
		Credentials credentials = new Credentials("inventory", "app", "secret", null, null);

		RecordingDriver mysqlDriver = new RecordingDriver();
		Assertions.assertThrows(ConnectivityException.class,
				() -> new MysqlBackend(BackendType.MYSQL, mysqlDriver).connect(credentials, new Properties()));
		Assertions.assertEquals("true", mysqlDriver.getProperties().getProperty("useAffectedRows"));
		Assertions.assertEquals("app", mysqlDriver.getProperties().getProperty("user"));
		Assertions.assertEquals("secret", mysqlDriver.getProperties().getProperty("password"));

		RecordingDriver mariadbDriver = new RecordingDriver();
		Assertions.assertThrows(ConnectivityException.class,
				() -> new MysqlBackend(BackendType.MARIADB, mariadbDriver).connect(credentials, new Properties()));
		Assertions.assertEquals("true", mariadbDriver.getProperties().getProperty("useAffectedRows"));

		RecordingDriver genericDriver = new RecordingDriver();
		Assertions.assertThrows(ConnectivityException.class,
				() -> new GenericBackend(DatabaseFamily.MYSQL, genericDriver).connect(credentials, new Properties()));
		Assertions.assertEquals("true", genericDriver.getProperties().getProperty("useAffectedRows"));
	}

	@Test
	public void testCallerConnectionPropertiesWin() {
		Credentials credentials = new Credentials("inventory", null, null, null, null);
		Properties connectionProperties = new Properties();
		connectionProperties.setProperty("useAffectedRows", "false");

		RecordingDriver driver = new RecordingDriver();
		Assertions.assertThrows(ConnectivityException.class,
				() -> new MysqlBackend(BackendType.MYSQL, driver).connect(credentials, connectionProperties));
		Assertions.assertEquals("false", driver.getProperties().getProperty("useAffectedRows"));
	}

	@Test
	public void testOtherFamiliesGetNoDefaultConnectionProperties() {
		Credentials credentials = new Credentials("inventory", null, null, null, null);

		RecordingDriver pgsqlDriver = new RecordingDriver();
		Assertions.assertThrows(ConnectivityException.class,
				() -> new PgsqlBackend(pgsqlDriver).connect(credentials, new Properties()));
		Assertions.assertTrue(pgsqlDriver.getProperties().isEmpty());

		RecordingDriver sqliteDriver = new RecordingDriver();
		Assertions.assertThrows(ConnectivityException.class,
				() -> new GenericBackend(DatabaseFamily.SQLITE, sqliteDriver).connect(credentials, new Properties()));
		Assertions.assertTrue(sqliteDriver.getProperties().isEmpty());
	}

	@Test
	public void testDriverRuntimeFailureIsCapturedAsExecutionFailure() throws SQLException {
		IllegalStateException driverFailure = new IllegalStateException("Driver blew up");
		AtomicBoolean statementClosed = new AtomicBoolean(false);

		Statement statement = (Statement) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{Statement.class},
				(proxy, method, args) -> {
					if ("close".equals(method.getName())) {
						statementClosed.set(true);
						return null;
					}

					throw driverFailure;
				});

		Connection connection = (Connection) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{Connection.class},
				(proxy, method, args) -> {
					if ("createStatement".equals(method.getName()))
						return statement;

					throw new UnsupportedOperationException(method.getName());
				});

		GenericBackend backend = new GenericBackend(DatabaseFamily.SQLITE, new JDBCDriver());
		Execution execution = backend.execute(connection, "SELECT 1");

		Assertions.assertTrue(execution.isFailed());
		Assertions.assertSame(driverFailure, execution.getFailure().orElseThrow().getCause());

		SqlExecutionException e = backend.describeError(execution);
		Assertions.assertTrue(e.getMessage().startsWith("SQLite error (Driver failure: "), e.getMessage());
		Assertions.assertTrue(e.getMessage().contains("Driver blew up"), e.getMessage());
		Assertions.assertNull(e.getCause());

		Assertions.assertFalse(statementClosed.get());
		execution.close();
		Assertions.assertTrue(statementClosed.get());
	}

	@NonNull
	private Connection createConnection(@NonNull String databaseName) throws SQLException {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		Connection connection = dataSource.getConnection();

		try (Statement statement = connection.createStatement()) {
			statement.execute("CREATE TABLE car (id INT GENERATED BY DEFAULT AS IDENTITY (START WITH 1) PRIMARY KEY, color VARCHAR(32))");
		}

		return connection;
	}

	/**
	 * Remembers the properties it was asked to connect with, then declines the URL.
	 */
	private static class RecordingDriver implements Driver {
		@NonNull
		private final Properties properties = new Properties();

		@Override
		public Connection connect(String url, Properties info) {
			this.properties.putAll(info);
			return null;
		}

		@Override
		public boolean acceptsURL(String url) {
			return false;
		}

		@Override
		public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
			return new DriverPropertyInfo[0];
		}

		@Override
		public int getMajorVersion() {
			return 1;
		}

		@Override
		public int getMinorVersion() {
			return 0;
		}

		@Override
		public boolean jdbcCompliant() {
			return false;
		}

		@Override
		public Logger getParentLogger() throws SQLFeatureNotSupportedException {
			throw new SQLFeatureNotSupportedException();
		}

		@NonNull
		Properties getProperties() {
			return this.properties;
		}
	}
}
