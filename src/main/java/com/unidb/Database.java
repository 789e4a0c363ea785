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

import javax.annotation.concurrent.NotThreadSafe;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.INFO;

/**
 * A single connection to a MSSQL, MySQL, PostgreSQL or SQLite database.
 * <p>
 * The JDBC driver to use is picked once, when the database is built, from the drivers available at runtime. Every
 * operation afterwards goes through that driver.
 * <p>
 * Minimal setup:
 * <pre>
 * try (Database database = Database.withFamily("sqlite", "/tmp/example.db").build()) {
 *   database.query("CREATE TABLE car (id INTEGER PRIMARY KEY, color TEXT)");
 *   Result result = database.queryForResult(format("INSERT INTO car (color) VALUES (%s)", database.escapeString("blue")));
 *   Object id = result.getAutoIncrementedValue().get();
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Database implements AutoCloseable {
	@NonNull
	private static final Set<String> FALSE_VALUES = Set.of("", "0", "f", "false");

	@NonNull
	private final DatabaseFamily family;
	@NonNull
	private final Credentials credentials;
	@NonNull
	private final Backend backend;
	@NonNull
	private final DateTimes dateTimes;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final SqlTranslatorFactory sqlTranslatorFactory;
	@NonNull
	private final Logger logger;

	@Nullable
	private Connection connection;
	@Nullable
	private SqlTranslator sqlTranslator;
	@NonNull
	private Duration totalQueryDuration;
	private boolean debug;

	private Database(@NonNull Builder builder) {
		requireNonNull(builder);

		this.family = requireNonNull(builder.family);
		this.credentials = new Credentials(builder.database, builder.username, builder.password, builder.host, builder.port);
		this.dateTimes = new DateTimes(builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone);
		this.statementLogger = builder.statementLogger == null ? new DefaultStatementLogger() : builder.statementLogger;
		this.sqlTranslatorFactory = builder.sqlTranslatorFactory == null ? SqlTranslatorFactory.withDefaultConfiguration() : builder.sqlTranslatorFactory;
		this.logger = Logger.getLogger(getClass().getName());
		this.totalQueryDuration = Duration.ZERO;
		this.debug = builder.debug;

		DriverLocator driverLocator = builder.driverLocator == null ? DriverLocator.withDefaultConfiguration() : builder.driverLocator;
		this.backend = new BackendResolver(driverLocator).resolve(this.family, this.credentials);

		Properties connectionProperties = new Properties();
		connectionProperties.putAll(builder.connectionProperties);

		this.connection = this.backend.connect(this.credentials, connectionProperties);

		try {
			for (String sessionStatement : this.backend.getSessionStatements())
				executeStatement(this.connection, sessionStatement);
		} catch (RuntimeException | Error e) {
			try {
				this.connection.close();
			} catch (Throwable cleanupException) {
				e.addSuppressed(cleanupException);
			}

			this.connection = null;
			throw e;
		}
	}

	/**
	 * Provides a {@link Database} builder for the given family and database.
	 *
	 * @param family   the database family to connect to
	 * @param database the database name, or for SQLite the path to the database file
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withFamily(@NonNull DatabaseFamily family,
																	 @NonNull String database) {
		requireNonNull(family);
		requireNonNull(database);

		return new Builder(family, database);
	}

	/**
	 * Provides a {@link Database} builder for the given family identifier and database.
	 *
	 * @param family   the database family identifier: {@code mssql}, {@code mysql}, {@code postgresql} or {@code sqlite}
	 * @param database the database name, or for SQLite the path to the database file
	 * @return a {@link Database} builder
	 * @throws ProgrammerException if {@code family} is not a supported family identifier
	 */
	@NonNull
	public static Builder withFamily(@Nullable String family,
																	 @NonNull String database) {
		return withFamily(DatabaseFamily.fromIdentifier(family), database);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{family=%s, backendType=%s, credentials=%s, closed=%s}", getClass().getSimpleName(),
				getFamily().name(), getBackendType().name(), this.credentials, isClosed());
	}

	/**
	 * Executes one or more SQL statements, separated by {@code ;}.
	 * <p>
	 * Statements run in order. The first statement that fails throws and later statements are not run.
	 *
	 * @param sql the SQL to execute
	 * @return one result per statement, in statement order
	 * @throws ProgrammerException   if {@code sql} is blank or this database is closed
	 * @throws SqlExecutionException if a statement fails
	 */
	@NonNull
	public List<@NonNull Result> query(@Nullable String sql) {
		List<String> statements = statementsFor(sql);
		Connection connection = openConnection();
		List<Result> results = new ArrayList<>(statements.size());

		for (String statement : statements)
			results.add(executeStatement(connection, statement));

		return results;
	}

	/**
	 * Executes exactly one SQL statement.
	 *
	 * @param sql the SQL to execute
	 * @return the statement's result
	 * @throws ProgrammerException   if {@code sql} is blank, holds more than one statement, or this database is closed
	 * @throws SqlExecutionException if the statement fails
	 */
	@NonNull
	public Result queryForResult(@Nullable String sql) {
		List<String> statements = statementsFor(sql);

		if (statements.size() > 1)
			throw new ProgrammerException(format("Expected a single SQL statement but found %d in %s", statements.size(), sql));

		return executeStatement(openConnection(), statements.get(0));
	}

	/**
	 * Rewrites {@code sql} with this database's {@link SqlTranslator}, then executes it as per {@link #query(String)}.
	 *
	 * @param sql the SQL to translate and execute
	 * @return one result per statement, in statement order
	 */
	@NonNull
	public List<@NonNull Result> translatedQuery(@Nullable String sql) {
		if (sql == null || sql.trim().isEmpty())
			throw new ProgrammerException("No SQL statement passed");

		openConnection();

		return query(getSqlTranslator().translate(sql));
	}

	@NonNull
	private List<String> statementsFor(@Nullable String sql) {
		if (sql == null || sql.trim().isEmpty())
			throw new ProgrammerException("No SQL statement passed");

		List<String> statements = StatementSplitter.split(sql);

		if (statements.isEmpty())
			throw new ProgrammerException(format("No SQL statement passed, only separators or comments were found in %s", sql));

		return statements;
	}

	@NonNull
	private Result executeStatement(@NonNull Connection connection,
																	@NonNull String sql) {
		requireNonNull(connection);
		requireNonNull(sql);

		Result result = new Result(sql);
		Duration executionDuration = null;
		Exception exception = null;
		Throwable thrown = null;
		long startTime = nanoTime();

		try (Execution execution = getBackend().execute(connection, sql)) {
			executionDuration = Duration.ofNanos(nanoTime() - startTime);
			this.totalQueryDuration = this.totalQueryDuration.plus(executionDuration);

			if (execution.isFailed())
				throw getBackend().describeError(execution);

			result.setRows(execution.getRows());
			result.setReturnedRows(getBackend().rowsReturned(execution));
			result.setAffectedRows(getBackend().rowsAffected(connection, execution));
			result.setAutoIncrementedValue(getBackend().lastInsertId(connection, execution).orElse(null));
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (SQLException e) {
			DatabaseException wrapped = new DatabaseException(format("Unable to read the outcome of %s", sql), e);
			exception = wrapped;
			thrown = wrapped;
			throw wrapped;
		} catch (RuntimeException | Error e) {
			exception = e instanceof RuntimeException runtimeException ? runtimeException : new DatabaseException(e);
			thrown = e;
			throw e;
		} finally {
			if (isDebug())
				logStatement(result, executionDuration, exception, thrown);
		}

		return result;
	}

	private void logStatement(@NonNull Result result,
														@Nullable Duration executionDuration,
														@Nullable Exception exception,
														@Nullable Throwable thrown) {
		StatementLog statementLog = StatementLog.withSql(result.getSql(), getBackendType())
				.executionDuration(executionDuration)
				.returnedRows(exception == null ? result.getReturnedRows() : null)
				.affectedRows(exception == null ? result.getAffectedRows() : null)
				.exception(exception)
				.build();

		try {
			getStatementLogger().log(statementLog);
		} catch (Throwable loggerFailure) {
			if (thrown != null) {
				thrown.addSuppressed(loggerFailure);
			} else if (loggerFailure instanceof RuntimeException runtimeException) {
				throw runtimeException;
			} else if (loggerFailure instanceof Error error) {
				throw error;
			} else {
				throw new RuntimeException(loggerFailure);
			}
		}
	}

	/**
	 * Renders {@code value} as a quoted string literal, or {@code NULL}.
	 *
	 * @param value the string to escape
	 * @return the literal, ready to be placed in SQL
	 */
	@NonNull
	public String escapeString(@Nullable String value) {
		if (value == null)
			return "NULL";

		try {
			return getBackend().escapeString(openConnection(), value);
		} catch (SQLException e) {
			throw new DatabaseException("Unable to escape string value", e);
		}
	}

	/**
	 * Strings come back from the database as-is; provided for symmetry with {@link #escapeString(String)}.
	 *
	 * @param value a value read from the database
	 * @return {@code value} as a string
	 */
	@Nullable
	public String unescapeString(@Nullable Object value) {
		return value == null ? null : value.toString();
	}

	/**
	 * Renders {@code value} as a binary literal, or {@code NULL}.
	 *
	 * @param value the bytes to escape
	 * @return the literal, ready to be placed in SQL
	 */
	@NonNull
	public String escapeBlob(byte @Nullable [] value) {
		if (value == null)
			return "NULL";

		try {
			return getBackend().escapeBlob(openConnection(), value);
		} catch (SQLException e) {
			throw new DatabaseException("Unable to escape binary value", e);
		}
	}

	/**
	 * Turns a binary column value, as read from the database, back into bytes.
	 *
	 * @param value a value read from the database
	 * @return the bytes, or {@code null} if {@code value} is {@code null}
	 */
	public byte @Nullable [] unescapeBlob(@Nullable Object value) {
		try {
			return getBackend().unescapeBlob(value);
		} catch (SQLException e) {
			throw new DatabaseException("Unable to unescape binary value", e);
		}
	}

	/**
	 * Renders {@code value} as a boolean literal this database accepts.
	 *
	 * @param value the boolean to escape
	 * @return the literal, ready to be placed in SQL
	 */
	@NonNull
	public String escapeBoolean(boolean value) {
		return getFamily().escapeBoolean(value);
	}

	/**
	 * Interprets a value read from the database as a boolean.
	 * <p>
	 * {@code null}, {@code false}, numeric zero and the strings {@code ""}, {@code "0"}, {@code "f"} and {@code "false"}
	 * (case-insensitive) are false; everything else is true.
	 *
	 * @param value a value read from the database
	 * @return the boolean
	 */
	public boolean unescapeBoolean(@Nullable Object value) {
		if (value == null)
			return false;

		if (value instanceof Boolean booleanValue)
			return booleanValue;

		if (value instanceof Number number)
			return number.doubleValue() != 0;

		return !FALSE_VALUES.contains(value.toString().trim().toLowerCase(Locale.ENGLISH));
	}

	/**
	 * Renders {@code value} as a quoted {@code yyyy-MM-dd HH:mm:ss} literal, or {@code NULL}.
	 *
	 * @param value a {@code java.time}, {@code java.sql} or {@link java.util.Date} value, or parseable text
	 * @return the literal, ready to be placed in SQL
	 * @throws ProgrammerException if {@code value} cannot be interpreted as a date/time
	 */
	@NonNull
	public String escapeTimestamp(@Nullable Object value) {
		return value == null ? "NULL" : format("'%s'", getDateTimes().formatTimestamp(value));
	}

	/**
	 * @return {@code value} rendered as {@code yyyy-MM-dd HH:mm:ss}, or {@code null}
	 */
	@Nullable
	public String unescapeTimestamp(@Nullable Object value) {
		return value == null ? null : getDateTimes().formatTimestamp(value);
	}

	/**
	 * Renders {@code value} as a quoted {@code yyyy-MM-dd} literal, or {@code NULL}.
	 *
	 * @param value a {@code java.time}, {@code java.sql} or {@link java.util.Date} value, or parseable text
	 * @return the literal, ready to be placed in SQL
	 * @throws ProgrammerException if {@code value} cannot be interpreted as a date
	 */
	@NonNull
	public String escapeDate(@Nullable Object value) {
		return value == null ? "NULL" : format("'%s'", getDateTimes().formatDate(value));
	}

	/**
	 * @return {@code value} rendered as {@code yyyy-MM-dd}, or {@code null}
	 */
	@Nullable
	public String unescapeDate(@Nullable Object value) {
		return value == null ? null : getDateTimes().formatDate(value);
	}

	/**
	 * Renders {@code value} as a quoted {@code HH:mm:ss} literal, or {@code NULL}.
	 *
	 * @param value a {@code java.time}, {@code java.sql} or {@link java.util.Date} value, or parseable text
	 * @return the literal, ready to be placed in SQL
	 * @throws ProgrammerException if {@code value} cannot be interpreted as a time
	 */
	@NonNull
	public String escapeTime(@Nullable Object value) {
		return value == null ? "NULL" : format("'%s'", getDateTimes().formatTime(value));
	}

	/**
	 * @return {@code value} rendered as {@code HH:mm:ss}, or {@code null}
	 */
	@Nullable
	public String unescapeTime(@Nullable Object value) {
		return value == null ? null : getDateTimes().formatTime(value);
	}

	/**
	 * Escapes {@code value} according to the named value type.
	 *
	 * @param valueType one of {@code string}, {@code blob}, {@code boolean}, {@code timestamp}, {@code date}, {@code time}
	 * @param value     the value to escape
	 * @return the literal, ready to be placed in SQL
	 * @throws ProgrammerException if {@code valueType} is not a known value type
	 */
	@NonNull
	public String escape(@Nullable String valueType,
											 @Nullable Object value) {
		switch (ValueType.fromName(valueType)) {
			case STRING:
				return escapeString(value == null ? null : value.toString());
			case BLOB:
				return escapeBlob(toBytes(value));
			case BOOLEAN:
				return value == null ? "NULL" : escapeBoolean(unescapeBoolean(value));
			case TIMESTAMP:
				return escapeTimestamp(value);
			case DATE:
				return escapeDate(value);
			case TIME:
				return escapeTime(value);
			default:
				throw new IllegalStateException(format("Unhandled %s value", ValueType.class.getSimpleName()));
		}
	}

	/**
	 * Unescapes {@code value} according to the named value type.
	 *
	 * @param valueType one of {@code string}, {@code blob}, {@code boolean}, {@code timestamp}, {@code date}, {@code time}
	 * @param value     a value read from the database
	 * @return the unescaped value
	 * @throws ProgrammerException if {@code valueType} is not a known value type
	 */
	@Nullable
	public Object unescape(@Nullable String valueType,
												 @Nullable Object value) {
		switch (ValueType.fromName(valueType)) {
			case STRING:
				return unescapeString(value);
			case BLOB:
				return unescapeBlob(value);
			case BOOLEAN:
				return unescapeBoolean(value);
			case TIMESTAMP:
				return unescapeTimestamp(value);
			case DATE:
				return unescapeDate(value);
			case TIME:
				return unescapeTime(value);
			default:
				throw new IllegalStateException(format("Unhandled %s value", ValueType.class.getSimpleName()));
		}
	}

	private static byte @Nullable [] toBytes(@Nullable Object value) {
		if (value == null)
			return null;

		if (value instanceof byte[] bytes)
			return bytes;

		if (value instanceof CharSequence)
			return value.toString().getBytes(StandardCharsets.UTF_8);

		throw new ProgrammerException(format("Unable to escape %s value as a blob", value.getClass().getName()));
	}

	/**
	 * Releases the connection.
	 * <p>
	 * Calling this more than once has no further effect. When debugging is enabled, the total time spent executing
	 * statements is logged.
	 */
	@Override
	public void close() {
		Connection connection = this.connection;

		if (connection == null)
			return;

		this.connection = null;

		if (isDebug())
			getLogger().log(INFO, format("Total query time: %s", getTotalQueryDuration()));

		try {
			connection.close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	@NonNull
	private Connection openConnection() {
		Connection connection = this.connection;

		if (connection == null)
			throw new ProgrammerException("This database has been closed");

		return connection;
	}

	@NonNull
	private SqlTranslator getSqlTranslator() {
		if (this.sqlTranslator == null)
			this.sqlTranslator = requireNonNull(getSqlTranslatorFactory().create(getFamily(), getBackendType()));

		return this.sqlTranslator;
	}

	/**
	 * Turns per-statement diagnostics on or off.
	 * <p>
	 * While on, each executed statement is passed to the configured {@link StatementLogger}.
	 *
	 * @param debug whether to emit diagnostics
	 */
	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	public boolean isDebug() {
		return this.debug;
	}

	public boolean isClosed() {
		return this.connection == null;
	}

	/**
	 * @return the database family this database connects to
	 */
	@NonNull
	public DatabaseFamily getFamily() {
		return this.family;
	}

	/**
	 * @return which backend serves this database, decided when it was built
	 */
	@NonNull
	public BackendType getBackendType() {
		return getBackend().getType();
	}

	/**
	 * @return the database name, or for SQLite the path to the database file
	 */
	@NonNull
	public String getDatabase() {
		return this.credentials.getDatabase();
	}

	@NonNull
	public ZoneId getTimeZone() {
		return getDateTimes().getTimeZone();
	}

	/**
	 * How long statements have spent executing since this database was built.
	 *
	 * @return the accumulated execution time
	 */
	@NonNull
	public Duration getTotalQueryDuration() {
		return this.totalQueryDuration;
	}

	@NonNull
	Backend getBackend() {
		return this.backend;
	}

	@NonNull
	private DateTimes getDateTimes() {
		return this.dateTimes;
	}

	@NonNull
	private StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	private SqlTranslatorFactory getSqlTranslatorFactory() {
		return this.sqlTranslatorFactory;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DatabaseFamily family;
		@NonNull
		private final String database;
		@NonNull
		private final Map<String, String> connectionProperties;
		@Nullable
		private String username;
		@Nullable
		private String password;
		@Nullable
		private String host;
		@Nullable
		private Integer port;
		@Nullable
		private ZoneId timeZone;
		private boolean debug;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private SqlTranslatorFactory sqlTranslatorFactory;
		@Nullable
		private DriverLocator driverLocator;

		private Builder(@NonNull DatabaseFamily family,
										@NonNull String database) {
			this.family = requireNonNull(family);
			this.database = requireNonNull(database);
			this.connectionProperties = new LinkedHashMap<>();
		}

		@NonNull
		public Builder username(@Nullable String username) {
			this.username = username;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		/**
		 * The server to connect to; ignored for SQLite.
		 *
		 * @param host the server host name (null for {@code localhost})
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		/**
		 * The server port; ignored for SQLite.
		 *
		 * @param port the server port (null for the driver's default port)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		/**
		 * Adds a driver-specific connection property, e.g. {@code ssl=true} for pgjdbc.
		 *
		 * @param name  the property name
		 * @param value the property value
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder connectionProperty(@NonNull String name,
																			@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.connectionProperties.put(name, value);
			return this;
		}

		/**
		 * The time zone date/time values are rendered in.
		 *
		 * @param timeZone the time zone (null for the system default)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public Builder debug(boolean debug) {
			this.debug = debug;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Builder sqlTranslatorFactory(@Nullable SqlTranslatorFactory sqlTranslatorFactory) {
			this.sqlTranslatorFactory = sqlTranslatorFactory;
			return this;
		}

		@NonNull
		public Builder driverLocator(@Nullable DriverLocator driverLocator) {
			this.driverLocator = driverLocator;
			return this;
		}

		/**
		 * Resolves the backend, connects and prepares the session.
		 *
		 * @return a connected {@code Database}
		 * @throws ProgrammerException   if the database name is blank
		 * @throws EnvironmentException  if no suitable JDBC driver is available
		 * @throws ConnectivityException if the connection cannot be established
		 * @throws SqlExecutionException if session setup fails
		 */
		@NonNull
		public Database build() {
			if (this.database.trim().isEmpty())
				throw new ProgrammerException("No database specified");

			return new Database(this);
		}
	}
}
