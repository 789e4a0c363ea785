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
import java.util.HexFormat;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Microsoft SQL Server through the Microsoft JDBC driver.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class MssqlBackend extends AbstractBackend {
	@NonNull
	static final String DRIVER_CLASS_NAME = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

	MssqlBackend(@NonNull Driver driver) {
		super(BackendType.MSSQL, DatabaseFamily.MSSQL, driver);
	}

	@Override
	protected boolean usesScrollableCursor() {
		return true;
	}

	@Override
	public long rowsAffected(@NonNull Connection connection,
													 @NonNull Execution execution) throws SQLException {
		requireNonNull(connection);
		requireNonNull(execution);

		if (execution.hasResultSet())
			return 0;

		Object rowCount = querySingleValue(connection, "SELECT @@ROWCOUNT AS affected_rows").orElse(null);
		return rowCount instanceof Number number ? Math.max(0L, number.longValue()) : 0L;
	}

	@Override
	@NonNull
	protected Optional<Object> readInsertId(@NonNull Connection connection,
																					@NonNull Execution execution) throws SQLException {
		return querySingleValue(connection, "SELECT @@IDENTITY AS insert_id");
	}

	@Override
	@NonNull
	public String escapeString(@NonNull Connection connection,
														 @NonNull String value) {
		requireNonNull(value);
		return format("'%s'", value.replace("'", "''"));
	}

	@Override
	@NonNull
	public String escapeBlob(@NonNull Connection connection,
													 byte @NonNull [] value) {
		requireNonNull(value);
		return format("0x%s", HexFormat.of().formatHex(value));
	}
}
