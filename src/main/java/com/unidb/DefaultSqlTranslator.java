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

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link SqlTranslator}.
 * <p>
 * Rewrites, outside of string literals, quoted identifiers and comments:
 * <ul>
 *   <li>{@code TRUE} and {@code FALSE} to {@code 1} and {@code 0} for databases without boolean literals</li>
 *   <li>{@code RAND()} and {@code RANDOM()} to the spelling the database uses</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultSqlTranslator implements SqlTranslator {
	@Nonnull
	private final DatabaseFamily family;
	@Nonnull
	private final BackendType backendType;

	public DefaultSqlTranslator(@Nonnull DatabaseFamily family,
															@Nonnull BackendType backendType) {
		this.family = requireNonNull(family);
		this.backendType = requireNonNull(backendType);
	}

	@Override
	@Nonnull
	public String translate(@Nonnull String sql) {
		requireNonNull(sql);

		StringBuilder translated = new StringBuilder(sql.length());
		int index = 0;

		while (index < sql.length()) {
			int afterNonCode = StatementSplitter.skipNonCode(sql, index);

			if (afterNonCode != index) {
				translated.append(sql, index, afterNonCode);
				index = afterNonCode;
				continue;
			}

			char c = sql.charAt(index);

			if (!StatementSplitter.isWordCharacter(c)) {
				translated.append(c);
				++index;
				continue;
			}

			int wordEnd = StatementSplitter.wordEnd(sql, index);
			String word = sql.substring(index, wordEnd);
			translated.append(translateWord(word, isFunctionCall(sql, wordEnd)));
			index = wordEnd;
		}

		return translated.toString();
	}

	/**
	 * Translates a single keyword or identifier.
	 *
	 * @param word         the word as written
	 * @param functionCall whether the word is immediately followed by {@code (}
	 * @return the replacement, or {@code word} itself if nothing applies
	 */
	@Nonnull
	protected String translateWord(@Nonnull String word,
																 boolean functionCall) {
		requireNonNull(word);

		String upperCaseWord = word.toUpperCase(Locale.ENGLISH);
		boolean numericBooleans = getFamily() == DatabaseFamily.MSSQL || getFamily() == DatabaseFamily.SQLITE;

		if (!functionCall && numericBooleans) {
			if ("TRUE".equals(upperCaseWord))
				return "1";
			if ("FALSE".equals(upperCaseWord))
				return "0";
		}

		if (functionCall && ("RAND".equals(upperCaseWord) || "RANDOM".equals(upperCaseWord)))
			return getFamily() == DatabaseFamily.POSTGRESQL || getFamily() == DatabaseFamily.SQLITE ? "RANDOM" : "RAND";

		return word;
	}

	private static boolean isFunctionCall(@Nonnull String sql,
																				int wordEnd) {
		int index = wordEnd;

		while (index < sql.length() && Character.isWhitespace(sql.charAt(index)))
			++index;

		return index < sql.length() && sql.charAt(index) == '(';
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{family=%s, backendType=%s}", getClass().getSimpleName(), getFamily().name(), getBackendType().name());
	}

	@Nonnull
	protected DatabaseFamily getFamily() {
		return this.family;
	}

	@Nonnull
	protected BackendType getBackendType() {
		return this.backendType;
	}
}
