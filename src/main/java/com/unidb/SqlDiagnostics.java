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
import java.sql.SQLException;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Error details copied out of a driver's {@link SQLException}, so the driver object itself never has to travel.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class SqlDiagnostics {
	@NonNull
	private final String message;
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final String dbmsMessage;
	@Nullable
	private final String detail;
	@Nullable
	private final String hint;
	@Nullable
	private final Integer position;

	SqlDiagnostics(@Nullable String message,
								 @Nullable Integer errorCode,
								 @Nullable String sqlState,
								 @Nullable String dbmsMessage,
								 @Nullable String detail,
								 @Nullable String hint,
								 @Nullable Integer position) {
		this.message = message == null ? "unknown error" : message;
		this.errorCode = errorCode;
		this.sqlState = sqlState;
		this.dbmsMessage = dbmsMessage;
		this.detail = detail;
		this.hint = hint;
		this.position = position;
	}

	@NonNull
	static SqlDiagnostics fromSqlException(@NonNull SQLException sqlException) {
		requireNonNull(sqlException);

		// Special handling for Postgres; pgjdbc classes are only touched when the exception came from pgjdbc
		if (PostgresSupport.isPsqlException(sqlException)) {
			SqlDiagnostics sqlDiagnostics = PostgresSupport.diagnosticsFor(sqlException);

			if (sqlDiagnostics != null)
				return sqlDiagnostics;
		}

		return new SqlDiagnostics(sqlException.getMessage(), sqlException.getErrorCode(), sqlException.getSQLState(),
				null, null, null, null);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{message=%s, errorCode=%s, sqlState=%s}", getClass().getSimpleName(), getMessage(),
				getErrorCode().orElse(null), getSqlState().orElse(null));
	}

	@NonNull
	String getMessage() {
		return this.message;
	}

	@NonNull
	Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	@NonNull
	Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	@NonNull
	Optional<String> getDbmsMessage() {
		return Optional.ofNullable(this.dbmsMessage);
	}

	@NonNull
	Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	@NonNull
	Optional<String> getHint() {
		return Optional.ofNullable(this.hint);
	}

	@NonNull
	Optional<Integer> getPosition() {
		return Optional.ofNullable(this.position);
	}
}
