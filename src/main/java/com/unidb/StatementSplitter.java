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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Breaks a string of SQL into its individual statements.
 * <p>
 * A {@code ;} only separates statements when it appears outside of string literals, quoted identifiers, comments and
 * compound blocks ({@code BEGIN ... END}, {@code CASE ... END}), so trigger and procedure bodies survive intact.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class StatementSplitter {
	/**
	 * Words that may follow {@code BEGIN} when it starts a transaction rather than a compound block: the SQLite locking
	 * modes, PostgreSQL transaction modes ({@code ISOLATION LEVEL}, {@code READ ONLY/WRITE}, {@code [NOT] DEFERRABLE})
	 * and MSSQL's {@code DISTRIBUTED TRANSACTION}.
	 */
	@NonNull
	private static final Set<String> TRANSACTION_BEGIN_MODIFIERS = Set.of("TRANSACTION", "WORK", "TRAN", "DEFERRED",
			"IMMEDIATE", "EXCLUSIVE", "ISOLATION", "READ", "NOT", "DEFERRABLE", "DISTRIBUTED");
	/**
	 * Words that may follow {@code END} when it closes a control-flow construct we do not track.
	 */
	@NonNull
	private static final Set<String> UNTRACKED_END_SUFFIXES = Set.of("IF", "LOOP", "WHILE", "REPEAT");

	private StatementSplitter() {
		// Non-instantiable
	}

	/**
	 * Splits {@code sql} into statements, in source order.
	 * <p>
	 * Input without any {@code ;} is returned as-is. Otherwise each statement is trimmed and statements with nothing
	 * but whitespace or comments are dropped.
	 *
	 * @param sql the SQL to split
	 * @return the individual statements
	 */
	@NonNull
	static List<@NonNull String> split(@NonNull String sql) {
		requireNonNull(sql);

		if (sql.indexOf(';') == -1)
			return List.of(sql);

		List<String> statements = new ArrayList<>();
		int statementStart = 0;
		int blockDepth = 0;
		int index = 0;
		int length = sql.length();

		while (index < length) {
			int afterNonCode = skipNonCode(sql, index);

			if (afterNonCode != index) {
				index = afterNonCode;
				continue;
			}

			char c = sql.charAt(index);

			if (isWordCharacter(c)) {
				int wordEnd = wordEnd(sql, index);
				String word = sql.substring(index, wordEnd).toUpperCase(Locale.ENGLISH);
				index = wordEnd;

				if ("CASE".equals(word)) {
					++blockDepth;
				} else if ("BEGIN".equals(word)) {
					if (opensBlock(sql, index))
						++blockDepth;
				} else if ("END".equals(word)) {
					int nextWordStart = skipWhitespace(sql, index);
					int nextWordEnd = wordEnd(sql, nextWordStart);
					String nextWord = sql.substring(nextWordStart, nextWordEnd).toUpperCase(Locale.ENGLISH);

					if (UNTRACKED_END_SUFFIXES.contains(nextWord)) {
						index = nextWordEnd;
					} else {
						// END CASE closes the CASE that opened it, same as a bare END
						if ("CASE".equals(nextWord))
							index = nextWordEnd;

						if (blockDepth > 0)
							--blockDepth;
					}
				}

				continue;
			}

			if (c == ';' && blockDepth == 0) {
				addStatement(statements, sql.substring(statementStart, index));
				statementStart = index + 1;
			}

			++index;
		}

		if (statementStart < length)
			addStatement(statements, sql.substring(statementStart));

		return statements;
	}

	/**
	 * If a string literal, quoted identifier or comment starts at {@code index}, returns the index just past it.
	 * Otherwise returns {@code index} unchanged.
	 * <p>
	 * Unterminated constructs run to the end of {@code sql}.
	 */
	static int skipNonCode(@NonNull String sql,
												 int index) {
		requireNonNull(sql);

		int length = sql.length();

		if (index >= length)
			return index;

		char c = sql.charAt(index);

		if (c == '\'') {
			int i = index + 1;

			while (i < length) {
				char current = sql.charAt(i);

				if (current == '\\') {
					i += 2;
				} else if (current == '\'') {
					if (i + 1 < length && sql.charAt(i + 1) == '\'')
						i += 2;
					else
						return i + 1;
				} else {
					++i;
				}
			}

			return length;
		}

		if (c == '"') {
			int closingQuote = sql.indexOf('"', index + 1);
			return closingQuote == -1 ? length : closingQuote + 1;
		}

		if (c == '-' && index + 1 < length && sql.charAt(index + 1) == '-') {
			int newline = sql.indexOf('\n', index + 2);
			return newline == -1 ? length : newline + 1;
		}

		if (c == '/' && index + 1 < length && sql.charAt(index + 1) == '*') {
			int commentEnd = sql.indexOf("*/", index + 2);
			return commentEnd == -1 ? length : commentEnd + 2;
		}

		return index;
	}

	static boolean isWordCharacter(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	static int wordEnd(@NonNull String sql,
										 int index) {
		int i = index;

		while (i < sql.length() && isWordCharacter(sql.charAt(i)))
			++i;

		return i;
	}

	private static int skipWhitespace(@NonNull String sql,
																		int index) {
		int i = index;

		while (i < sql.length() && Character.isWhitespace(sql.charAt(i)))
			++i;

		return i;
	}

	/**
	 * Does the {@code BEGIN} that ends just before {@code index} open a compound block?
	 */
	private static boolean opensBlock(@NonNull String sql,
																		int index) {
		int next = skipWhitespace(sql, index);

		if (next >= sql.length() || sql.charAt(next) == ';')
			return false;

		String nextWord = sql.substring(next, wordEnd(sql, next)).toUpperCase(Locale.ENGLISH);
		return !TRANSACTION_BEGIN_MODIFIERS.contains(nextWord);
	}

	private static void addStatement(@NonNull List<String> statements,
																	 @Nullable String statement) {
		if (statement == null)
			return;

		String trimmedStatement = statement.trim();

		if (containsCode(trimmedStatement))
			statements.add(trimmedStatement);
	}

	private static boolean containsCode(@NonNull String statement) {
		int index = 0;

		while (index < statement.length()) {
			char c = statement.charAt(index);

			boolean comment = (c == '-' || c == '/') && skipNonCode(statement, index) != index;

			if (comment)
				index = skipNonCode(statement, index);
			else if (Character.isWhitespace(c))
				++index;
			else
				return true;
		}

		return false;
	}
}
