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
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.Driver;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Shared plumbing for {@link Backend} implementations.
 * <p>
 * Subclasses decide how statements are created and how row counts and generated values are read; this class handles
 * connecting, running statements and materializing rows.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
abstract class AbstractBackend implements Backend {
	@NonNull
	private final BackendType type;
	@NonNull
	private final DatabaseFamily family;
	@NonNull
	private final Driver driver;
	@NonNull
	private final Logger logger;

	protected AbstractBackend(@NonNull BackendType type,
														@NonNull DatabaseFamily family,
														@NonNull Driver driver) {
		this.type = requireNonNull(type);
		this.family = requireNonNull(family);
		this.driver = requireNonNull(driver);
		this.logger = Logger.getLogger(getClass().getName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{type=%s, family=%s, driver=%s}", getClass().getSimpleName(), getType().name(),
				getFamily().name(), getDriver().getClass().getName());
	}

	/**
	 * The URL handed to the driver.
	 */
	@NonNull
	protected String jdbcUrl(@NonNull Credentials credentials) {
		return getFamily().jdbcUrl(credentials);
	}

	@Override
	@NonNull
	public Connection connect(@NonNull Credentials credentials,
														@NonNull Properties connectionProperties) {
		requireNonNull(credentials);
		requireNonNull(connectionProperties);

		Properties properties = new Properties();
		properties.putAll(getDefaultConnectionProperties());
		properties.putAll(connectionProperties);
		credentials.getUsername().ifPresent(username -> properties.setProperty("user", username));
		credentials.getPassword().ifPresent(password -> properties.setProperty("password", password));

		String jdbcUrl = jdbcUrl(credentials);
		Connection connection;

		try {
			connection = getDriver().connect(jdbcUrl, properties);
		} catch (SQLException | RuntimeException e) {
			throw new ConnectivityException("Unable to connect to database", e);
		}

		// Drivers return null for URLs they do not understand
		if (connection == null)
			throw new ConnectivityException(format("Unable to connect to database: %s does not accept %s",
					getDriver().getClass().getName(), jdbcUrl));

		getLogger().fine(format("Connected to %s using %s", credentials, this));

		return connection;
	}

	/**
	 * Driver properties applied before the caller's own, which take precedence.
	 * <p>
	 * MySQL drivers report matched rows as affected unless {@code useAffectedRows} is on; with it on, update counts
	 * only include rows whose values actually changed.
	 */
	@NonNull
	protected Map<@NonNull String, @NonNull String> getDefaultConnectionProperties() {
		if (getFamily() == DatabaseFamily.MYSQL)
			return Map.of("useAffectedRows", "true");

		return Map.of();
	}

	@Override
	@NonNull
	public List<@NonNull String> getSessionStatements() {
		switch (getFamily()) {
			case MYSQL:
				return List.of("SET sql_mode = 'ANSI,STRICT_ALL_TABLES'");
			case MSSQL:
				return List.of("SET TEXTSIZE 2147483647");
			default:
				return List.of();
		}
	}

	/**
	 * Should statements be opened with a scrollable cursor, so the row count can be read from the cursor itself?
	 */
	protected boolean usesScrollableCursor() {
		return false;
	}

	@NonNull
	protected Statement createStatement(@NonNull Connection connection) throws SQLException {
		requireNonNull(connection);

		if (usesScrollableCursor())
			return connection.createStatement(ResultSet.TYPE_SCROLL_INSENSITIVE, ResultSet.CONCUR_READ_ONLY);

		return connection.createStatement();
	}

	/**
	 * Executes {@code sql} on {@code statement}.
	 *
	 * @return {@code true} if the statement produced a result set
	 */
	protected boolean executeStatement(@NonNull Statement statement,
																		 @NonNull String sql) throws SQLException {
		return statement.execute(sql);
	}

	@Override
	@NonNull
	public Execution execute(@NonNull Connection connection,
													 @NonNull String sql) {
		requireNonNull(connection);
		requireNonNull(sql);

		Statement statement = null;

		try {
			statement = createStatement(connection);

			if (!executeStatement(statement, sql))
				return Execution.withUpdateCount(sql, statement, (long) statement.getUpdateCount());

			try (ResultSet resultSet = statement.getResultSet()) {
				List<Map<String, Object>> rows = readRows(resultSet);
				Long cursorRowCount = null;

				if (usesScrollableCursor() && resultSet.getType() != ResultSet.TYPE_FORWARD_ONLY)
					cursorRowCount = resultSet.last() ? (long) resultSet.getRow() : 0L;

				return Execution.withRows(sql, statement, rows, cursorRowCount);
			}
		} catch (SQLException e) {
			return Execution.failed(sql, statement, e);
		} catch (RuntimeException e) {
			// The failed execution still owns the statement and closes it
			return Execution.failed(sql, statement, new SQLException(format("Driver failure: %s", e), e));
		}
	}

	@NonNull
	protected List<@NonNull Map<@NonNull String, @Nullable Object>> readRows(@NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(resultSet);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnLabels = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			columnLabels.add(resultSetMetaData.getColumnLabel(i));

		List<Map<String, Object>> rows = new ArrayList<>();

		while (resultSet.next()) {
			Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);

			for (int i = 1; i <= columnCount; ++i)
				row.put(columnLabels.get(i - 1), readColumnValue(resultSet.getObject(i)));

			rows.add(row);
		}

		return rows;
	}

	/**
	 * Detaches LOB values from the result set so they stay readable once it is closed.
	 */
	@Nullable
	protected Object readColumnValue(@Nullable Object value) throws SQLException {
		if (value instanceof Blob blob)
			return readBlob(blob);

		if (value instanceof Clob clob) {
			try (Reader reader = clob.getCharacterStream()) {
				StringWriter writer = new StringWriter();
				reader.transferTo(writer);
				return writer.toString();
			} catch (IOException e) {
				throw new SQLException("Unable to read CLOB value", e);
			}
		}

		return value;
	}

	@Override
	@NonNull
	public SqlExecutionException describeError(@NonNull Execution execution) {
		requireNonNull(execution);

		SQLException failure = execution.getFailure()
				.orElseThrow(() -> new IllegalStateException("Execution did not fail"));
		SqlDiagnostics sqlDiagnostics = SqlDiagnostics.fromSqlException(failure);

		return new SqlExecutionException(format("%s error (%s) in %s", getFamily().getDisplayName(),
				errorMessage(failure, sqlDiagnostics), execution.getSql()), execution.getSql(), sqlDiagnostics);
	}

	/**
	 * The driver-reported text placed inside the error message.
	 */
	@NonNull
	protected String errorMessage(@NonNull SQLException failure,
																@NonNull SqlDiagnostics sqlDiagnostics) {
		return sqlDiagnostics.getMessage();
	}

	@Override
	public long rowsReturned(@NonNull Execution execution) {
		requireNonNull(execution);

		if (!execution.hasResultSet())
			return 0;

		return execution.getCursorRowCount().orElse((long) execution.getRows().size());
	}

	@Override
	public long rowsAffected(@NonNull Connection connection,
													 @NonNull Execution execution) throws SQLException {
		requireNonNull(connection);
		requireNonNull(execution);

		if (execution.hasResultSet())
			return 0;

		return Math.max(0L, execution.getUpdateCount());
	}

	@Override
	@NonNull
	public Optional<Object> lastInsertId(@NonNull Connection connection,
																			 @NonNull Execution execution) {
		requireNonNull(connection);
		requireNonNull(execution);

		if (!isInsert(execution.getSql()))
			return Optional.empty();

		try {
			return readInsertId(connection, execution).map(AbstractBackend::normalizeId);
		} catch (SQLException e) {
			getLogger().log(FINE, format("Unable to determine the auto-incremented value for %s", execution.getSql()), e);
			return Optional.empty();
		}
	}

	/**
	 * Reads the value generated by the insert that {@code execution} ran.
	 */
	@NonNull
	protected abstract Optional<Object> readInsertId(@NonNull Connection connection,
																									 @NonNull Execution execution) throws SQLException;

	@Override
	public byte @Nullable [] unescapeBlob(@Nullable Object value) throws SQLException {
		if (value == null)
			return null;

		if (value instanceof byte[] bytes)
			return bytes;

		if (value instanceof Blob blob)
			return readBlob(blob);

		return value.toString().getBytes(StandardCharsets.ISO_8859_1);
	}

	/**
	 * Shared by backends whose dialect reads {@code X'0a1b'} as binary data.
	 */
	@NonNull
	protected static String hexBlobLiteral(byte @NonNull [] value) {
		requireNonNull(value);
		return format("X'%s'", HexFormat.of().formatHex(value));
	}

	/**
	 * Runs a query expected to produce a single value, such as {@code SELECT @@IDENTITY}.
	 */
	@NonNull
	protected static Optional<Object> querySingleValue(@NonNull Connection connection,
																										 @NonNull String sql) throws SQLException {
		requireNonNull(connection);
		requireNonNull(sql);

		try (Statement statement = connection.createStatement();
				 ResultSet resultSet = statement.executeQuery(sql)) {
			return resultSet.next() ? Optional.ofNullable(resultSet.getObject(1)) : Optional.empty();
		}
	}

	/**
	 * Reads the first generated key the driver kept for {@code statement}.
	 */
	@NonNull
	protected static Optional<Object> firstGeneratedKey(@NonNull Statement statement) throws SQLException {
		requireNonNull(statement);

		try (ResultSet generatedKeys = statement.getGeneratedKeys()) {
			return generatedKeys != null && generatedKeys.next() ? Optional.ofNullable(generatedKeys.getObject(1)) : Optional.empty();
		}
	}

	/**
	 * Is the first keyword of {@code sql} {@code INSERT}?
	 */
	static boolean isInsert(@NonNull String sql) {
		requireNonNull(sql);

		int index = 0;

		while (index < sql.length()) {
			int afterNonCode = StatementSplitter.skipNonCode(sql, index);

			if (afterNonCode != index)
				index = afterNonCode;
			else if (Character.isWhitespace(sql.charAt(index)) || sql.charAt(index) == '(')
				++index;
			else
				break;
		}

		int wordEnd = StatementSplitter.wordEnd(sql, index);
		return "INSERT".equals(sql.substring(index, wordEnd).toUpperCase(Locale.ENGLISH));
	}

	/**
	 * Integral identifiers are exposed as {@link Long} no matter how the driver typed them.
	 */
	@Nullable
	static Object normalizeId(@Nullable Object id) {
		if (id instanceof Long)
			return id;

		if (id instanceof Integer || id instanceof Short || id instanceof Byte)
			return ((Number) id).longValue();

		if (id instanceof BigInteger bigInteger && bigInteger.bitLength() < Long.SIZE)
			return bigInteger.longValue();

		if (id instanceof BigDecimal bigDecimal) {
			try {
				return bigDecimal.longValueExact();
			} catch (ArithmeticException e) {
				return bigDecimal;
			}
		}

		return id;
	}

	private static byte @NonNull [] readBlob(@NonNull Blob blob) throws SQLException {
		try (InputStream inputStream = blob.getBinaryStream()) {
			return inputStream.readAllBytes();
		} catch (IOException e) {
			throw new SQLException("Unable to read BLOB value", e);
		}
	}

	@Override
	@NonNull
	public BackendType getType() {
		return this.type;
	}

	@Override
	@NonNull
	public DatabaseFamily getFamily() {
		return this.family;
	}

	@NonNull
	protected Driver getDriver() {
		return this.driver;
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}
}
