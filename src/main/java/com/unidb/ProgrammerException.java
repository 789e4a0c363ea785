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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when a {@link Database} is used incorrectly, for example with an unknown database family, empty SQL or an
 * unknown escape type.
 * <p>
 * Indicates a bug in calling code and should never be retried.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class ProgrammerException extends DatabaseException {
	/**
	 * Creates a {@code ProgrammerException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public ProgrammerException(@Nullable String message) {
		super(message);
	}
}
