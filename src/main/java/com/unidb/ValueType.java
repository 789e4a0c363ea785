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

/**
 * The kinds of value {@link Database#escape(String, Object)} and {@link Database#unescape(String, Object)} know how to
 * render.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum ValueType {
	STRING,
	BLOB,
	BOOLEAN,
	TIMESTAMP,
	DATE,
	TIME;

	/**
	 * Looks up a value type by name, e.g. {@code "timestamp"}.
	 *
	 * @param name the value type name, case-insensitive
	 * @return the matching value type
	 * @throws ProgrammerException if {@code name} does not name a value type
	 */
	@NonNull
	public static ValueType fromName(@Nullable String name) {
		if (name != null) {
			String normalizedName = name.trim().toUpperCase(Locale.ENGLISH);

			for (ValueType valueType : values())
				if (valueType.name().equals(normalizedName))
					return valueType;
		}

		throw new ProgrammerException(format("Unknown value type '%s'. Must be one of string, blob, boolean, timestamp, date, time",
				name));
	}
}
