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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class DefaultStatementLoggerTests {
	@Test
	public void testFormatting() {
		DefaultStatementLogger statementLogger = new DefaultStatementLogger();

		StatementLog statementLog = StatementLog.withSql("  SELECT * FROM car  ", BackendType.GENERIC)
				.executionDuration(Duration.ofMillis(12))
				.returnedRows(3L)
				.affectedRows(0L)
				.build();

		Assertions.assertEquals("SELECT * FROM car\nPT0.012S executing on jdbc, 3 row(s) returned, 0 row(s) affected",
				statementLogger.formatStatementLog(statementLog));

		StatementLog failedStatementLog = StatementLog.withSql("SELECT * FROM missing", BackendType.MSSQL)
				.exception(new ProgrammerException("boom"))
				.build();

		String formatted = statementLogger.formatStatementLog(failedStatementLog);

		Assertions.assertTrue(formatted.startsWith("SELECT * FROM missing\nPT0S executing on mssql\nFailed due to "), formatted);
		Assertions.assertTrue(formatted.contains("boom"), formatted);
	}

	@Test
	public void testLongStatementsAreEllipsized() {
		DefaultStatementLogger statementLogger = new DefaultStatementLogger();
		String sql = "SELECT " + "x, ".repeat(1_000) + "y FROM t";

		String firstLine = statementLogger.formatStatementLog(StatementLog.withSql(sql, BackendType.SQLITE).build()).split("\n")[0];

		Assertions.assertEquals(2_003, firstLine.length());
		Assertions.assertTrue(firstLine.endsWith("..."));
	}

	@Test
	public void testStatementLogEquality() {
		StatementLog first = StatementLog.withSql("SELECT 1", BackendType.PGSQL).returnedRows(1L).build();
		StatementLog second = StatementLog.withSql("SELECT 1", BackendType.PGSQL).returnedRows(1L).build();

		Assertions.assertEquals(first, second);
		Assertions.assertEquals(first.hashCode(), second.hashCode());
		Assertions.assertNotEquals(first, StatementLog.withSql("SELECT 1", BackendType.MYSQL).returnedRows(1L).build());
	}
}
