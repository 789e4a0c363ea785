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
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Everything that differs between the JDBC drivers a {@link Database} can sit on.
 * <p>
 * A backend never owns the connection. It is handed the connection for each operation so the facade can control the
 * connection's lifecycle in one place.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
interface Backend {
	@NonNull
	BackendType getType();

	@NonNull
	DatabaseFamily getFamily();

	/**
	 * Opens a new connection.
	 *
	 * @param credentials          where to connect and as whom
	 * @param connectionProperties extra driver properties
	 * @return an open connection
	 * @throws ConnectivityException if no connection could be established
	 */
	@NonNull
	Connection connect(@NonNull Credentials credentials,
										 @NonNull Properties connectionProperties);

	/**
	 * Statements run once, right after connecting, to put the session in a predictable state.
	 */
	@NonNull
	List<@NonNull String> getSessionStatements();

	/**
	 * Runs a single statement, capturing rather than throwing any driver failure.
	 */
	@NonNull
	Execution execute(@NonNull Connection connection,
										@NonNull String sql);

	/**
	 * Builds the exception reported for a failed {@link Execution}.
	 */
	@NonNull
	SqlExecutionException describeError(@NonNull Execution execution);

	long rowsReturned(@NonNull Execution execution);

	long rowsAffected(@NonNull Connection connection,
										@NonNull Execution execution) throws SQLException;

	/**
	 * The auto-increment value generated by an {@code INSERT}; empty for any other statement or when none was generated.
	 */
	@NonNull
	Optional<Object> lastInsertId(@NonNull Connection connection,
																@NonNull Execution execution);

	/**
	 * Renders {@code value} as a quoted string literal.
	 */
	@NonNull
	String escapeString(@NonNull Connection connection,
											@NonNull String value) throws SQLException;

	/**
	 * Renders {@code value} as a binary literal.
	 */
	@NonNull
	String escapeBlob(@NonNull Connection connection,
										byte @NonNull [] value) throws SQLException;

	/**
	 * Turns a binary column value, as returned by the driver, back into bytes.
	 */
	byte @Nullable [] unescapeBlob(@Nullable Object value) throws SQLException;
}
