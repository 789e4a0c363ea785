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

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when the database reports that a statement failed.
 * <p>
 * The message names the database and backend and embeds both the database's diagnostic text and the offending SQL.
 * The driver's own exception is not attached; its error code, SQLState and (for PostgreSQL) server details are copied
 * onto this exception instead.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class SqlExecutionException extends DatabaseException {
	@NonNull
	private final String sql;

	SqlExecutionException(@NonNull String message,
												@NonNull String sql,
												@NonNull SqlDiagnostics sqlDiagnostics) {
		super(requireNonNull(message), requireNonNull(sqlDiagnostics));
		this.sql = requireNonNull(sql);
	}

	/**
	 * The SQL statement that failed.
	 *
	 * @return the failing SQL
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}
}
