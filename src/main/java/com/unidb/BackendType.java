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

/**
 * Identifies the JDBC driver a {@link Database} resolved for its {@link DatabaseFamily}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum BackendType {
	/**
	 * Microsoft JDBC Driver for SQL Server.
	 */
	MSSQL("mssql"),
	/**
	 * MySQL Connector/J.
	 */
	MYSQL("mysql"),
	/**
	 * MariaDB Connector/J, used for MySQL when Connector/J is absent.
	 */
	MARIADB("mariadb"),
	/**
	 * The PostgreSQL JDBC driver (pgjdbc).
	 */
	PGSQL("pgsql"),
	/**
	 * The SQLite Java Wrapper, used for SQLite 2.1 files.
	 */
	SQLITE("sqlite"),
	/**
	 * Whichever driver {@link java.sql.DriverManager} offers for the family's JDBC URL.
	 */
	GENERIC("jdbc");

	@NonNull
	private final String identifier;

	BackendType(@NonNull String identifier) {
		this.identifier = identifier;
	}

	/**
	 * @return the short identifier for this backend, e.g. {@code pgsql}
	 */
	@NonNull
	public String getIdentifier() {
		return this.identifier;
	}
}
