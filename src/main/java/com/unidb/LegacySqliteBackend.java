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
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQLite 2.x files through the legacy {@code SQLite.JDBCDriver} (javasqlite).
 * <p>
 * SQLite 3.x files are served by {@link GenericBackend} instead.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class LegacySqliteBackend extends AbstractBackend {
	@NonNull
	static final String DRIVER_CLASS_NAME = "SQLite.JDBCDriver";

	LegacySqliteBackend(@NonNull Driver driver) {
		super(BackendType.SQLITE, DatabaseFamily.SQLITE, driver);
	}

	@Override
	@NonNull
	public List<@NonNull String> getSessionStatements() {
		// Keeps "table.column" selections keyed by the bare column name
		return List.of("PRAGMA short_column_names = 1");
	}

	@Override
	@NonNull
	protected Optional<Object> readInsertId(@NonNull Connection connection,
																					@NonNull Execution execution) throws SQLException {
		return querySingleValue(connection, "SELECT last_insert_rowid()");
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
		return hexBlobLiteral(value);
	}
}
