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

import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The database products a {@link Database} can talk to, independent of which JDBC driver does the talking.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum DatabaseFamily {
	/**
	 * Microsoft SQL Server.
	 */
	MSSQL("mssql", "MSSQL"),
	/**
	 * MySQL (and wire-compatible servers such as MariaDB).
	 */
	MYSQL("mysql", "MySQL"),
	/**
	 * PostgreSQL.
	 */
	POSTGRESQL("postgresql", "PostgreSQL"),
	/**
	 * SQLite, an embedded database stored in a single file.
	 */
	SQLITE("sqlite", "SQLite");

	@NonNull
	private final String identifier;
	@NonNull
	private final String displayName;

	DatabaseFamily(@NonNull String identifier,
								 @NonNull String displayName) {
		this.identifier = identifier;
		this.displayName = displayName;
	}

	/**
	 * Looks up a family by its identifier: {@code mssql}, {@code mysql}, {@code postgresql} or {@code sqlite}.
	 *
	 * @param identifier the family identifier, case-insensitive
	 * @return the matching family
	 * @throws ProgrammerException if {@code identifier} does not name a supported family
	 */
	@NonNull
	public static DatabaseFamily fromIdentifier(@Nullable String identifier) {
		if (identifier != null) {
			String normalizedIdentifier = identifier.trim().toLowerCase(Locale.ENGLISH);

			for (DatabaseFamily databaseFamily : values())
				if (databaseFamily.getIdentifier().equals(normalizedIdentifier))
					return databaseFamily;
		}

		throw new ProgrammerException(format("Invalid database type specified: '%s'. Must be one of mssql, mysql, postgresql, sqlite",
				identifier));
	}

	/**
	 * Renders a boolean as a literal this family accepts.
	 *
	 * @param value the boolean to render
	 * @return {@code TRUE}/{@code FALSE} for PostgreSQL and MySQL, {@code '1'}/{@code '0'} otherwise
	 */
	@NonNull
	public String escapeBoolean(boolean value) {
		switch (this) {
			case POSTGRESQL:
			case MYSQL:
				return value ? "TRUE" : "FALSE";
			default:
				return value ? "'1'" : "'0'";
		}
	}

	/**
	 * The JDBC URL conventionally used to reach this family.
	 * <p>
	 * The port is only part of the URL when one was given.
	 */
	@NonNull
	String jdbcUrl(@NonNull Credentials credentials) {
		requireNonNull(credentials);

		switch (this) {
			case MSSQL:
				return format("jdbc:sqlserver://%s;databaseName=%s", credentials.getHostAndPort(), credentials.getDatabase());
			case MYSQL:
				return format("jdbc:mysql://%s/%s", credentials.getHostAndPort(), credentials.getDatabase());
			case POSTGRESQL:
				return format("jdbc:postgresql://%s/%s", credentials.getHostAndPort(), credentials.getDatabase());
			case SQLITE:
				return format("jdbc:sqlite:%s", credentials.getDatabase());
			default:
				throw new IllegalStateException(format("Unhandled %s value %s", DatabaseFamily.class.getSimpleName(), name()));
		}
	}

	/**
	 * @return the lowercase identifier for this family, e.g. {@code postgresql}
	 */
	@NonNull
	public String getIdentifier() {
		return this.identifier;
	}

	/**
	 * @return the product name for this family, e.g. {@code PostgreSQL}
	 */
	@NonNull
	public String getDisplayName() {
		return this.displayName;
	}
}
