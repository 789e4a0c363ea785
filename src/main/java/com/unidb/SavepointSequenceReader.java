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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.Optional;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Reads the most recent sequence value on PostgreSQL without disturbing the surrounding transaction.
 * <p>
 * {@code lastval()} errors out when no sequence has been used in the session, which would abort a transaction the
 * caller has open. The read is therefore fenced by a savepoint: a failed read rolls back to the savepoint only. When
 * no transaction was open, one is started for the read and committed afterwards.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class SavepointSequenceReader {
	@NonNull
	static final String SAVEPOINT_NAME = "get_last_val";
	@NonNull
	static final String DEFAULT_SQL = "SELECT lastval() AS insert_id";

	@NonNull
	private final String sql;
	@NonNull
	private final Logger logger;

	SavepointSequenceReader() {
		this(DEFAULT_SQL);
	}

	SavepointSequenceReader(@NonNull String sql) {
		this.sql = requireNonNull(sql);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Reads the last sequence value.
	 * <p>
	 * Never throws: failures are logged and reported as an empty result.
	 *
	 * @param connection the connection the insert ran on
	 * @return the last sequence value, or empty if it could not be read
	 */
	@NonNull
	Optional<Object> read(@NonNull Connection connection) {
		requireNonNull(connection);

		boolean openedTransaction = false;
		Optional<Object> value = Optional.empty();

		try {
			if (connection.getAutoCommit()) {
				connection.setAutoCommit(false);
				openedTransaction = true;
			}

			Savepoint savepoint = connection.setSavepoint(SAVEPOINT_NAME);

			try {
				value = readValue(connection);
				connection.releaseSavepoint(savepoint);
			} catch (SQLException e) {
				getLogger().log(FINE, "Unable to read last sequence value, rolling back to savepoint", e);
				connection.rollback(savepoint);
			}
		} catch (SQLException e) {
			getLogger().log(FINE, "Unable to fence last sequence value read with a savepoint", e);
			value = Optional.empty();
		} finally {
			if (openedTransaction)
				endImplicitTransaction(connection);
		}

		return value;
	}

	@NonNull
	private Optional<Object> readValue(@NonNull Connection connection) throws SQLException {
		try (Statement statement = connection.createStatement();
				 ResultSet resultSet = statement.executeQuery(getSql())) {
			return resultSet.next() ? Optional.ofNullable(resultSet.getObject(1)) : Optional.empty();
		}
	}

	private void endImplicitTransaction(@NonNull Connection connection) {
		try {
			connection.commit();
		} catch (SQLException e) {
			getLogger().log(FINE, "Unable to commit implicit transaction opened for last sequence value read", e);
		} finally {
			try {
				connection.setAutoCommit(true);
			} catch (SQLException e) {
				getLogger().log(FINE, "Unable to restore auto-commit after last sequence value read", e);
			}
		}
	}

	@NonNull
	String getSql() {
		return this.sql;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
