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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * On-disk SQLite format versions, as identified by the file header.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
enum SqliteFormat {
	/**
	 * The file does not exist yet or is empty, so either format can be created.
	 */
	UNKNOWN,
	/**
	 * SQLite 2.x.
	 */
	V2,
	/**
	 * SQLite 3.x.
	 */
	V3;

	/**
	 * How much of the file is inspected.
	 */
	static final int HEADER_LENGTH = 64;

	@NonNull
	static final String V3_HEADER = "SQLite format 3";
	@NonNull
	static final String V2_HEADER = "** This file contains an SQLite 2.1 database **";

	/**
	 * Identifies the format of the database file at {@code database}.
	 *
	 * @param database the database file path, as given to the driver
	 * @return the detected format, {@link #UNKNOWN} if the file is absent or empty
	 * @throws ConnectivityException if the file exists but is not a SQLite database, or cannot be read
	 */
	@NonNull
	static SqliteFormat detect(@NonNull String database) {
		requireNonNull(database);

		Path path;

		try {
			path = Paths.get(database);
		} catch (InvalidPathException e) {
			// Special names like ":memory:" on platforms that reject them as paths
			return UNKNOWN;
		}

		if (!Files.isRegularFile(path))
			return UNKNOWN;

		byte[] header;

		try (InputStream inputStream = Files.newInputStream(path)) {
			header = inputStream.readNBytes(HEADER_LENGTH);
		} catch (IOException e) {
			throw new ConnectivityException(format("Unable to read database file %s", database), e);
		}

		if (header.length == 0)
			return UNKNOWN;

		String headerText = new String(header, StandardCharsets.ISO_8859_1);

		if (headerText.contains(V3_HEADER))
			return V3;

		if (headerText.contains(V2_HEADER))
			return V2;

		throw new ConnectivityException(format("Unable to connect to database: the file specified, %s, is not an SQLite database",
				database));
	}
}
