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
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * What a {@link Backend} captured while running one statement: either the outcome or the driver failure, never both.
 * <p>
 * Holds the {@link Statement} open so metadata (generated keys, update counts) can still be read; {@link #close()}
 * releases it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class Execution implements AutoCloseable {
	@NonNull
	private final String sql;
	@Nullable
	private final Statement statement;
	@Nullable
	private final SQLException failure;
	@NonNull
	private final Boolean resultSet;
	@NonNull
	private final List<@NonNull Map<@NonNull String, @Nullable Object>> rows;
	@Nullable
	private final Long cursorRowCount;
	@NonNull
	private final Long updateCount;

	private Execution(@NonNull String sql,
										@Nullable Statement statement,
										@Nullable SQLException failure,
										@NonNull Boolean resultSet,
										@NonNull List<@NonNull Map<@NonNull String, @Nullable Object>> rows,
										@Nullable Long cursorRowCount,
										@NonNull Long updateCount) {
		this.sql = requireNonNull(sql);
		this.statement = statement;
		this.failure = failure;
		this.resultSet = requireNonNull(resultSet);
		this.rows = requireNonNull(rows);
		this.cursorRowCount = cursorRowCount;
		this.updateCount = requireNonNull(updateCount);
	}

	@NonNull
	static Execution withRows(@NonNull String sql,
														@NonNull Statement statement,
														@NonNull List<@NonNull Map<@NonNull String, @Nullable Object>> rows,
														@Nullable Long cursorRowCount) {
		return new Execution(sql, requireNonNull(statement), null, true, List.copyOf(rows), cursorRowCount, -1L);
	}

	@NonNull
	static Execution withUpdateCount(@NonNull String sql,
																	 @NonNull Statement statement,
																	 @NonNull Long updateCount) {
		return new Execution(sql, requireNonNull(statement), null, false, List.of(), null, updateCount);
	}

	@NonNull
	static Execution failed(@NonNull String sql,
													@Nullable Statement statement,
													@NonNull SQLException failure) {
		return new Execution(sql, statement, requireNonNull(failure), false, List.of(), null, -1L);
	}

	@Override
	public void close() throws SQLException {
		if (this.statement != null)
			this.statement.close();
	}

	@NonNull
	String getSql() {
		return this.sql;
	}

	@NonNull
	Boolean isFailed() {
		return this.failure != null;
	}

	@NonNull
	Optional<SQLException> getFailure() {
		return Optional.ofNullable(this.failure);
	}

	@NonNull
	Optional<Statement> getStatement() {
		return Optional.ofNullable(this.statement);
	}

	@NonNull
	Boolean hasResultSet() {
		return this.resultSet;
	}

	@NonNull
	List<@NonNull Map<@NonNull String, @Nullable Object>> getRows() {
		return this.rows;
	}

	/**
	 * Row count reported by a scrollable cursor, if the backend asked for one.
	 */
	@NonNull
	Optional<Long> getCursorRowCount() {
		return Optional.ofNullable(this.cursorRowCount);
	}

	/**
	 * The driver's update count; {@code -1} when not applicable.
	 */
	@NonNull
	Long getUpdateCount() {
		return this.updateCount;
	}
}
