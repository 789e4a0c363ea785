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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * PostgreSQL through pgjdbc.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class PgsqlBackend extends AbstractBackend {
	@NonNull
	static final String DRIVER_CLASS_NAME = "org.postgresql.Driver";

	@NonNull
	private final SavepointSequenceReader savepointSequenceReader;

	PgsqlBackend(@NonNull Driver driver) {
		super(BackendType.PGSQL, DatabaseFamily.POSTGRESQL, driver);
		this.savepointSequenceReader = new SavepointSequenceReader();
	}

	@Override
	protected boolean usesScrollableCursor() {
		return true;
	}

	@Override
	@NonNull
	protected String errorMessage(@NonNull SQLException failure,
																@NonNull SqlDiagnostics sqlDiagnostics) {
		return sqlDiagnostics.getDbmsMessage().orElse(sqlDiagnostics.getMessage());
	}

	@Override
	@NonNull
	protected Optional<Object> readInsertId(@NonNull Connection connection,
																					@NonNull Execution execution) {
		return this.savepointSequenceReader.read(connection);
	}

	@Override
	@NonNull
	public String escapeString(@NonNull Connection connection,
														 @NonNull String value) throws SQLException {
		return format("'%s'", PostgresSupport.escapeLiteral(connection, value));
	}

	@Override
	@NonNull
	public String escapeBlob(@NonNull Connection connection,
													 byte @NonNull [] value) throws SQLException {
		requireNonNull(value);
		return format("'%s'", PostgresSupport.escapeLiteral(connection, PostgresSupport.toByteaText(value)));
	}

	@Override
	public byte @Nullable [] unescapeBlob(@Nullable Object value) throws SQLException {
		if (value instanceof String string)
			return PostgresSupport.fromByteaText(string);

		return super.unescapeBlob(value);
	}
}
