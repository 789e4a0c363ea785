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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when the host lacks a JDBC driver for the requested database family, or has a driver installed that cannot
 * open the requested SQLite file.
 * <p>
 * Requires a classpath change to resolve; retrying will not help.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class EnvironmentException extends DatabaseException {
	@NonNull
	private final Reason reason;

	/**
	 * Creates an {@code EnvironmentException} with the given {@code reason} and {@code message}.
	 *
	 * @param reason  why the environment is unusable
	 * @param message a message describing this exception
	 */
	public EnvironmentException(@NonNull Reason reason,
															@Nullable String message) {
		this(reason, message, null);
	}

	/**
	 * Creates an {@code EnvironmentException} with the given {@code reason}, {@code message} and {@code cause}.
	 *
	 * @param reason  why the environment is unusable
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public EnvironmentException(@NonNull Reason reason,
															@Nullable String message,
															@Nullable Throwable cause) {
		super(message, cause);
		this.reason = requireNonNull(reason);
	}

	/**
	 * Why the environment is unusable.
	 *
	 * @return the reason for this exception
	 */
	@NonNull
	public Reason getReason() {
		return this.reason;
	}

	/**
	 * Distinguishes "nothing installed" from "the wrong thing installed".
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	public enum Reason {
		/**
		 * None of the JDBC drivers that can serve the database family are available.
		 */
		MISSING_DRIVER,
		/**
		 * A JDBC driver for the family is available, but it cannot open the detected SQLite file format.
		 */
		INCOMPATIBLE_DRIVER
	}
}
