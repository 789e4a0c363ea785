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

/**
 * Unidb is a single-connection SQL interface over MSSQL, MySQL, PostgreSQL and SQLite.
 * <p>
 * The JDBC driver is chosen at runtime from those available, preferring each family's dedicated driver.
 *
 * <pre>
 * // Connect; the driver is picked for you
 * Database database = Database.withFamily("postgresql", "inventory")
 *   .host("db.example.com")
 *   .username("app")
 *   .password(password)
 *   .build();
 *
 * // Several statements at once, one Result each
 * List&lt;Result&gt; results = database.query("DELETE FROM car WHERE color = 'red'; SELECT * FROM car");
 * long deleted = results.get(0).getAffectedRows();
 * List&lt;Map&lt;String, Object&gt;&gt; cars = results.get(1).getRows();
 *
 * // Escaping values for inline SQL
 * Result inserted = database.queryForResult(format("INSERT INTO car (color, built_at) VALUES (%s, %s)",
 *   database.escapeString("blue"), database.escapeTimestamp(LocalDateTime.now())));
 * Optional&lt;Object&gt; id = inserted.getAutoIncrementedValue();
 *
 * database.close();</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
package com.unidb;
