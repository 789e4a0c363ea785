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
import java.sql.Connection;
import java.sql.Driver;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HexFormat;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Any JDBC driver registered with {@link java.sql.DriverManager} for the family's URL.
 * <p>
 * Used when no dedicated driver is present, and always for SQLite 3.x files. Behavior that the JDBC API cannot express
 * portably (generated values, binary literals) is chosen per family.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class GenericBackend extends AbstractBackend {
	@NonNull
	private final SavepointSequenceReader savepointSequenceReader;

	GenericBackend(@NonNull DatabaseFamily family,
								 @NonNull Driver driver) {
		super(BackendType.GENERIC, family, driver);

		if (family == DatabaseFamily.MSSQL)
			throw new IllegalArgumentException(format("%s cannot serve %s", getClass().getSimpleName(), family.getDisplayName()));

		this.savepointSequenceReader = new SavepointSequenceReader();
	}

	@Override
	@NonNull
	protected String errorMessage(@NonNull SQLException failure,
																@NonNull SqlDiagnostics sqlDiagnostics) {
		String sqlState = sqlDiagnostics.getSqlState().orElse(null);
		return sqlState == null ? sqlDiagnostics.getMessage() : format("%s: %s", sqlState, sqlDiagnostics.getMessage());
	}

	@Override
	protected boolean executeStatement(@NonNull Statement statement,
																		 @NonNull String sql) throws SQLException {
		if (getFamily() == DatabaseFamily.MYSQL && isInsert(sql))
			return statement.execute(sql, Statement.RETURN_GENERATED_KEYS);

		return statement.execute(sql);
	}

	@Override
	@NonNull
	protected Optional<Object> readInsertId(@NonNull Connection connection,
																					@NonNull Execution execution) throws SQLException {
		switch (getFamily()) {
			case MYSQL:
				Statement statement = execution.getStatement().orElse(null);
				return statement == null ? Optional.empty() : firstGeneratedKey(statement);
			case POSTGRESQL:
				return this.savepointSequenceReader.read(connection);
			case SQLITE:
				return querySingleValue(connection, "SELECT last_insert_rowid()");
			default:
				return Optional.empty();
		}
	}

	@Override
	@NonNull
	public String escapeString(@NonNull Connection connection,
														 @NonNull String value) throws SQLException {
		requireNonNull(connection);
		requireNonNull(value);

		// MySQL treats backslashes in literals as escapes unless NO_BACKSLASH_ESCAPES is set
		if (getFamily() == DatabaseFamily.MYSQL)
			return format("'%s'", MysqlBackend.escapeMysql(value));

		return enquoteLiteral(connection, value);
	}

	@Override
	@NonNull
	public String escapeBlob(@NonNull Connection connection,
													 byte @NonNull [] value) throws SQLException {
		requireNonNull(connection);
		requireNonNull(value);

		if (getFamily() == DatabaseFamily.POSTGRESQL)
			return enquoteLiteral(connection, format("\\x%s", HexFormat.of().formatHex(value)));

		return hexBlobLiteral(value);
	}

	@Override
	public byte @Nullable [] unescapeBlob(@Nullable Object value) throws SQLException {
		if (getFamily() == DatabaseFamily.POSTGRESQL && value instanceof String string && string.startsWith("\\x")) {
			try {
				return HexFormat.of().parseHex(string.substring(2));
			} catch (IllegalArgumentException e) {
				throw new SQLException(format("Malformed bytea value '%s'", string), e);
			}
		}

		return super.unescapeBlob(value);
	}

	@NonNull
	private static String enquoteLiteral(@NonNull Connection connection,
																			 @NonNull String value) throws SQLException {
		try (Statement statement = connection.createStatement()) {
			return statement.enquoteLiteral(value);
		}
	}
}
