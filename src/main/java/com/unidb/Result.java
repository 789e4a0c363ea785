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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of one executed SQL statement.
 * <p>
 * A fresh instance is created for every statement; nothing is shared between instances.
 * Row-returning statements populate {@link #getRows()} and {@link #getReturnedRows()}, mutating statements populate
 * {@link #getAffectedRows()} and, for inserts into tables with an auto-increment key, {@link #getAutoIncrementedValue()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Result {
	@NonNull
	private String sql;
	@NonNull
	private List<@NonNull Map<@NonNull String, @Nullable Object>> rows;
	@NonNull
	private Long returnedRows;
	@NonNull
	private Long affectedRows;
	@Nullable
	private Object autoIncrementedValue;

	/**
	 * Creates a {@code Result} for the given {@code sql}.
	 *
	 * @param sql the statement this result describes
	 */
	public Result(@NonNull String sql) {
		this.sql = requireNonNull(sql);
		this.rows = List.of();
		this.returnedRows = 0L;
		this.affectedRows = 0L;
		this.autoIncrementedValue = null;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("sql=%s", getSql().replaceAll("\n+", " ").trim()));
		components.add(format("returnedRows=%s", getReturnedRows()));
		components.add(format("affectedRows=%s", getAffectedRows()));

		Object autoIncrementedValue = getAutoIncrementedValue().orElse(null);

		if (autoIncrementedValue != null)
			components.add(format("autoIncrementedValue=%s", autoIncrementedValue));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	/**
	 * The first column of the first row, if any.
	 *
	 * @return the scalar value of a single-value query
	 */
	@NonNull
	public Optional<Object> fetchScalar() {
		if (getRows().isEmpty())
			return Optional.empty();

		Map<String, Object> firstRow = getRows().get(0);
		return firstRow.isEmpty() ? Optional.empty() : Optional.ofNullable(firstRow.values().iterator().next());
	}

	/**
	 * The exact SQL text that was sent to the database.
	 *
	 * @return the executed SQL
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	public void setSql(@NonNull String sql) {
		this.sql = requireNonNull(sql);
	}

	/**
	 * Rows produced by the statement, each keyed by column label in column order.
	 * <p>
	 * Empty for statements that do not return rows.
	 *
	 * @return the rows, unmodifiable
	 */
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> getRows() {
		return this.rows;
	}

	public void setRows(@NonNull List<@NonNull Map<@NonNull String, @Nullable Object>> rows) {
		requireNonNull(rows);
		this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
	}

	/**
	 * How many rows the statement returned; {@code 0} for statements that do not return rows.
	 *
	 * @return the number of returned rows
	 */
	@NonNull
	public Long getReturnedRows() {
		return this.returnedRows;
	}

	public void setReturnedRows(@NonNull Long returnedRows) {
		this.returnedRows = requireNonNull(returnedRows);
	}

	/**
	 * How many rows the statement inserted, updated or deleted; {@code 0} for row-returning statements.
	 *
	 * @return the number of affected rows
	 */
	@NonNull
	public Long getAffectedRows() {
		return this.affectedRows;
	}

	public void setAffectedRows(@NonNull Long affectedRows) {
		this.affectedRows = requireNonNull(affectedRows);
	}

	/**
	 * The value the database generated for an auto-increment (identity, serial, rowid) column during an {@code INSERT}.
	 * <p>
	 * Integral values are exposed as {@link Long}.
	 *
	 * @return the generated value, or empty if the statement was not an insert or no value could be determined
	 */
	@NonNull
	public Optional<Object> getAutoIncrementedValue() {
		return Optional.ofNullable(this.autoIncrementedValue);
	}

	public void setAutoIncrementedValue(@Nullable Object autoIncrementedValue) {
		this.autoIncrementedValue = autoIncrementedValue;
	}
}
