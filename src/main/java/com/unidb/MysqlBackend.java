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
import java.sql.Connection;
import java.sql.Driver;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * MySQL through MySQL Connector/J, or through MariaDB Connector/J when Connector/J is absent.
 * <p>
 * Strings are escaped like the client library's {@code mysql_real_escape_string}; binary values are written as hex
 * literals instead (see {@link #escapeBlob(Connection, byte[])}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class MysqlBackend extends AbstractBackend {
	@NonNull
	static final String MYSQL_DRIVER_CLASS_NAME = "com.mysql.cj.jdbc.Driver";
	@NonNull
	static final String MARIADB_DRIVER_CLASS_NAME = "org.mariadb.jdbc.Driver";

	MysqlBackend(@NonNull BackendType type,
							 @NonNull Driver driver) {
		super(type, DatabaseFamily.MYSQL, driver);

		if (type != BackendType.MYSQL && type != BackendType.MARIADB)
			throw new IllegalArgumentException(format("%s cannot serve backend type %s", getClass().getSimpleName(), type.name()));
	}

	@Override
	@NonNull
	protected String jdbcUrl(@NonNull Credentials credentials) {
		requireNonNull(credentials);

		if (getType() == BackendType.MARIADB)
			return format("jdbc:mariadb://%s/%s", credentials.getHostAndPort(), credentials.getDatabase());

		return super.jdbcUrl(credentials);
	}

	@Override
	protected boolean usesScrollableCursor() {
		return true;
	}

	@Override
	protected boolean executeStatement(@NonNull Statement statement,
																		 @NonNull String sql) throws SQLException {
		return isInsert(sql) ? statement.execute(sql, Statement.RETURN_GENERATED_KEYS) : statement.execute(sql);
	}

	@Override
	@NonNull
	protected Optional<Object> readInsertId(@NonNull Connection connection,
																					@NonNull Execution execution) throws SQLException {
		Statement statement = execution.getStatement().orElse(null);
		return statement == null ? Optional.empty() : firstGeneratedKey(statement);
	}

	@Override
	@NonNull
	public String escapeString(@NonNull Connection connection,
														 @NonNull String value) {
		return format("'%s'", escapeMysql(value));
	}

	/**
	 * Renders {@code value} as a {@code X'..'} hex literal rather than running it through {@link #escapeMysql(String)}.
	 * Escaping raw bytes as a string would need them decoded in the connection character set first, which corrupts
	 * sequences that are not valid in that character set; MySQL reads a hex literal as binary data whatever the
	 * connection character set is.
	 */
	@Override
	@NonNull
	public String escapeBlob(@NonNull Connection connection,
													 byte @NonNull [] value) {
		return hexBlobLiteral(value);
	}

	/**
	 * Escapes the same characters as the MySQL client library's {@code mysql_real_escape_string}.
	 */
	@NonNull
	static String escapeMysql(@NonNull String value) {
		requireNonNull(value);

		StringBuilder escaped = new StringBuilder(value.length() + 16);

		for (int i = 0; i < value.length(); ++i) {
			char c = value.charAt(i);

			switch (c) {
				case '\0':
					escaped.append("\\0");
					break;
				case '\n':
					escaped.append("\\n");
					break;
				case '\r':
					escaped.append("\\r");
					break;
				case '\\':
					escaped.append("\\\\");
					break;
				case '\'':
					escaped.append("\\'");
					break;
				case '"':
					escaped.append("\\\"");
					break;
				case '\032':
					escaped.append("\\Z");
					break;
				default:
					escaped.append(c);
			}
		}

		return escaped.toString();
	}
}
