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
import org.postgresql.core.BaseConnection;
import org.postgresql.core.Utils;
import org.postgresql.util.PGbytea;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/**
 * Everything that touches pgjdbc classes directly.
 * <p>
 * pgjdbc is an optional dependency, so nothing outside this class may reference its types. Callers only reach these
 * methods once they know pgjdbc is loaded (the {@link BackendType#PGSQL} backend was resolved, or a driver exception
 * came from pgjdbc).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class PostgresSupport {
	@NonNull
	static final String PSQL_EXCEPTION_CLASS_NAME = "org.postgresql.util.PSQLException";

	private PostgresSupport() {
		// Non-instantiable
	}

	@NonNull
	static Boolean isPsqlException(@Nullable Throwable throwable) {
		return throwable != null && PSQL_EXCEPTION_CLASS_NAME.equals(throwable.getClass().getName());
	}

	@Nullable
	static SqlDiagnostics diagnosticsFor(@NonNull SQLException sqlException) {
		requireNonNull(sqlException);

		PSQLException psqlException = (PSQLException) sqlException;
		ServerErrorMessage serverErrorMessage = psqlException.getServerErrorMessage();

		if (serverErrorMessage == null)
			return null;

		int position = serverErrorMessage.getPosition();

		return new SqlDiagnostics(serverErrorMessage.getMessage(), psqlException.getErrorCode(),
				serverErrorMessage.getSQLState(), serverErrorMessage.getMessage(), serverErrorMessage.getDetail(),
				serverErrorMessage.getHint(), position > 0 ? position : null);
	}

	/**
	 * Escapes a string literal body the way the server expects given its {@code standard_conforming_strings} setting.
	 * Connections that are not pgjdbc connections are assumed to have it on, the PostgreSQL default since 9.1.
	 */
	@NonNull
	static String escapeLiteral(@NonNull Connection connection,
															@NonNull String value) throws SQLException {
		requireNonNull(connection);
		requireNonNull(value);

		boolean standardConformingStrings = true;

		if (connection.isWrapperFor(BaseConnection.class))
			standardConformingStrings = connection.unwrap(BaseConnection.class).getStandardConformingStrings();

		return Utils.escapeLiteral(null, value, standardConformingStrings).toString();
	}

	@NonNull
	static String toByteaText(byte @NonNull [] value) {
		requireNonNull(value);
		return PGbytea.toPGString(value);
	}

	static byte @NonNull [] fromByteaText(@NonNull String value) throws SQLException {
		requireNonNull(value);
		return PGbytea.toBytes(value.getBytes(StandardCharsets.US_ASCII));
	}
}
