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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one executed SQL statement.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final String sql;
	@NonNull
	private final BackendType backendType;
	@NonNull
	private final Duration executionDuration;
	@Nullable
	private final Long returnedRows;
	@Nullable
	private final Long affectedRows;
	@Nullable
	private final Exception exception;

	/**
	 * Creates a {@code StatementLog} for the given {@code builder}.
	 *
	 * @param builder the builder used to construct this {@code StatementLog}
	 */
	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = requireNonNull(builder.sql);
		this.backendType = requireNonNull(builder.backendType);
		this.executionDuration = builder.executionDuration == null ? Duration.ZERO : builder.executionDuration;
		this.returnedRows = builder.returnedRows;
		this.affectedRows = builder.affectedRows;
		this.exception = builder.exception;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code sql}.
	 *
	 * @param sql         the statement that was executed
	 * @param backendType the backend that executed it
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String sql,
																@NonNull BackendType backendType) {
		requireNonNull(sql);
		requireNonNull(backendType);

		return new Builder(sql, backendType);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("sql=%s", getSql()));
		components.add(format("backendType=%s", getBackendType().name()));
		components.add(format("executionDuration=%s", getExecutionDuration()));

		Long returnedRows = getReturnedRows().orElse(null);

		if (returnedRows != null)
			components.add(format("returnedRows=%s", returnedRows));

		Long affectedRows = getAffectedRows().orElse(null);

		if (affectedRows != null)
			components.add(format("affectedRows=%s", affectedRows));

		Exception exception = getException().orElse(null);

		if (exception != null)
			components.add(format("exception=%s", exception));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getSql(), statementLog.getSql())
				&& Objects.equals(getBackendType(), statementLog.getBackendType())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getReturnedRows(), statementLog.getReturnedRows())
				&& Objects.equals(getAffectedRows(), statementLog.getAffectedRows())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getBackendType(), getExecutionDuration(), getReturnedRows(), getAffectedRows(),
				getException());
	}

	/**
	 * The SQL statement that was executed.
	 *
	 * @return the SQL statement that was executed
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * The backend that executed the statement.
	 *
	 * @return the executing backend
	 */
	@NonNull
	public BackendType getBackendType() {
		return this.backendType;
	}

	/**
	 * How long did the driver take to execute the SQL statement?
	 *
	 * @return how long it took to execute the SQL statement
	 */
	@NonNull
	public Duration getExecutionDuration() {
		return this.executionDuration;
	}

	@NonNull
	public Optional<Long> getReturnedRows() {
		return Optional.ofNullable(this.returnedRows);
	}

	@NonNull
	public Optional<Long> getAffectedRows() {
		return Optional.ofNullable(this.affectedRows);
	}

	/**
	 * The exception that occurred during SQL statement execution.
	 *
	 * @return the exception that occurred during SQL statement execution, if available
	 */
	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String sql;
		@NonNull
		private final BackendType backendType;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Long returnedRows;
		@Nullable
		private Long affectedRows;
		@Nullable
		private Exception exception;

		private Builder(@NonNull String sql,
										@NonNull BackendType backendType) {
			this.sql = requireNonNull(sql);
			this.backendType = requireNonNull(backendType);
		}

		/**
		 * Specifies how long it took to execute the SQL statement.
		 *
		 * @param executionDuration how long it took to execute the SQL statement
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder returnedRows(@Nullable Long returnedRows) {
			this.returnedRows = returnedRows;
			return this;
		}

		@NonNull
		public Builder affectedRows(@Nullable Long affectedRows) {
			this.affectedRows = affectedRows;
			return this;
		}

		/**
		 * Specifies the exception that occurred during SQL statement execution.
		 *
		 * @param exception the exception that occurred during SQL statement execution, if available
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		/**
		 * Constructs a {@code StatementLog} instance.
		 *
		 * @return a {@code StatementLog} instance
		 */
		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
