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

/**
 * Creates the {@link SqlTranslator} for a {@link Database}.
 * <p>
 * A database asks its factory at most once, the first time {@link Database#translatedQuery(String)} is called.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface SqlTranslatorFactory {
	/**
	 * Creates a translator targeting the given family and backend.
	 *
	 * @param family      the connected database family
	 * @param backendType the backend that will execute translated SQL
	 * @return a translator
	 */
	@NonNull
	SqlTranslator create(@NonNull DatabaseFamily family,
											 @NonNull BackendType backendType);

	/**
	 * Acquires a factory which creates {@link DefaultSqlTranslator} instances.
	 *
	 * @return a {@code SqlTranslatorFactory} with default configuration
	 */
	@NonNull
	static SqlTranslatorFactory withDefaultConfiguration() {
		return DefaultSqlTranslator::new;
	}
}
