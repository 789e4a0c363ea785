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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when an error occurs when interacting with a {@link Database}.
 * <p>
 * Subclasses identify the kind of failure: {@link ProgrammerException}, {@link EnvironmentException},
 * {@link ConnectivityException} and {@link SqlExecutionException}.
 * <p>
 * If this exception was built from driver diagnostics, the {@link #getErrorCode()} and {@link #getSqlState()}
 * accessors expose the corresponding {@link SQLException} values.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
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

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, (Throwable) null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		SqlDiagnostics sqlDiagnostics = cause instanceof SQLException ? SqlDiagnostics.fromSqlException((SQLException) cause) : null;

		this.errorCode = sqlDiagnostics == null ? null : sqlDiagnostics.getErrorCode().orElse(null);
		this.sqlState = sqlDiagnostics == null ? null : sqlDiagnostics.getSqlState().orElse(null);
		this.dbmsMessage = sqlDiagnostics == null ? null : sqlDiagnostics.getDbmsMessage().orElse(null);
		this.detail = sqlDiagnostics == null ? null : sqlDiagnostics.getDetail().orElse(null);
		this.hint = sqlDiagnostics == null ? null : sqlDiagnostics.getHint().orElse(null);
		this.position = sqlDiagnostics == null ? null : sqlDiagnostics.getPosition().orElse(null);
	}

	/**
	 * Creates a {@code DatabaseException} which carries a copy of driver diagnostics but no driver exception.
	 *
	 * @param message        a message describing this exception
	 * @param sqlDiagnostics diagnostics copied from the driver
	 */
	protected DatabaseException(@Nullable String message,
															@NonNull SqlDiagnostics sqlDiagnostics) {
		super(message);

		this.errorCode = sqlDiagnostics.getErrorCode().orElse(null);
		this.sqlState = sqlDiagnostics.getSqlState().orElse(null);
		this.dbmsMessage = sqlDiagnostics.getDbmsMessage().orElse(null);
		this.detail = sqlDiagnostics.getDetail().orElse(null);
		this.hint = sqlDiagnostics.getHint().orElse(null);
		this.position = sqlDiagnostics.getPosition().orElse(null);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(7);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));
		if (getDbmsMessage().isPresent())
			components.add(format("dbmsMessage=%s", getDbmsMessage().get()));
		if (getDetail().isPresent())
			components.add(format("detail=%s", getDetail().get()));
		if (getHint().isPresent())
			components.add(format("hint=%s", getHint().get()));
		if (getPosition().isPresent())
			components.add(format("position=%s", getPosition().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	/**
	 * @return the primary message reported by the database server, or empty if not available
	 */
	@NonNull
	public Optional<String> getDbmsMessage() {
		return Optional.ofNullable(this.dbmsMessage);
	}

	/**
	 * @return the value of the error {@code detail}, or empty if not available
	 */
	@NonNull
	public Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	/**
	 * @return the value of the error {@code hint}, or empty if not available
	 */
	@NonNull
	public Optional<String> getHint() {
		return Optional.ofNullable(this.hint);
	}

	/**
	 * @return the value of the offending {@code position}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getPosition() {
		return Optional.ofNullable(this.position);
	}
}
