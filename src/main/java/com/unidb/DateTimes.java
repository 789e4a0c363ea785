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
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalQuery;
import java.util.Locale;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Parses loosely-formatted date/time input and renders it in the canonical forms every supported database accepts.
 * <p>
 * Values carrying an offset or zone are converted to this instance's time zone before rendering; values without one
 * are taken to already be in it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
final class DateTimes {
	@NonNull
	static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);
	@NonNull
	static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ENGLISH);
	@NonNull
	static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ENGLISH);

	/**
	 * {@code yyyy-MM-dd HH:mm[:ss[.fraction]]}, the format databases usually hand back.
	 */
	@NonNull
	private static final DateTimeFormatter SPACE_SEPARATED_DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
			.append(DateTimeFormatter.ISO_LOCAL_DATE)
			.appendLiteral(' ')
			.append(DateTimeFormatter.ISO_LOCAL_TIME)
			.toFormatter(Locale.ENGLISH);

	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final Clock clock;

	DateTimes(@NonNull ZoneId timeZone) {
		this(timeZone, Clock.system(timeZone));
	}

	DateTimes(@NonNull ZoneId timeZone,
						@NonNull Clock clock) {
		this.timeZone = requireNonNull(timeZone);
		this.clock = requireNonNull(clock);
	}

	@NonNull
	String formatTimestamp(@NonNull Object value) {
		return TIMESTAMP_FORMATTER.format(toLocalDateTime(value));
	}

	@NonNull
	String formatDate(@NonNull Object value) {
		return DATE_FORMATTER.format(toLocalDateTime(value));
	}

	@NonNull
	String formatTime(@NonNull Object value) {
		return TIME_FORMATTER.format(toLocalDateTime(value));
	}

	/**
	 * Interprets {@code value} as a point in time in this instance's time zone.
	 * <p>
	 * Date-only values fall at midnight, time-only values fall on today's date.
	 *
	 * @param value a {@code java.time}, {@code java.sql} or {@link java.util.Date} value, or text
	 * @return the local date and time
	 * @throws ProgrammerException if {@code value} cannot be interpreted
	 */
	@NonNull
	LocalDateTime toLocalDateTime(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof LocalDateTime localDateTime)
			return localDateTime;
		if (value instanceof LocalDate localDate)
			return localDate.atStartOfDay();
		if (value instanceof LocalTime localTime)
			return today().atTime(localTime);
		if (value instanceof OffsetDateTime offsetDateTime)
			return offsetDateTime.atZoneSameInstant(getTimeZone()).toLocalDateTime();
		if (value instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.withZoneSameInstant(getTimeZone()).toLocalDateTime();
		if (value instanceof Instant instant)
			return LocalDateTime.ofInstant(instant, getTimeZone());

		// java.sql types first, they extend java.util.Date
		if (value instanceof java.sql.Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (value instanceof java.sql.Date date)
			return date.toLocalDate().atStartOfDay();
		if (value instanceof java.sql.Time time)
			return today().atTime(time.toLocalTime());
		if (value instanceof java.util.Date date)
			return LocalDateTime.ofInstant(date.toInstant(), getTimeZone());

		if (value instanceof CharSequence)
			return parse(value.toString());

		throw new ProgrammerException(format("Unable to interpret %s value '%s' as a date/time", value.getClass().getName(), value));
	}

	@NonNull
	private LocalDateTime parse(@NonNull String text) {
		String trimmedText = text.trim();

		switch (trimmedText.toLowerCase(Locale.ENGLISH)) {
			case "now":
				return LocalDateTime.now(getClock().withZone(getTimeZone()));
			case "today":
				return today().atStartOfDay();
			case "tomorrow":
				return today().plusDays(1).atStartOfDay();
			case "yesterday":
				return today().minusDays(1).atStartOfDay();
			default:
				break;
		}

		LocalDateTime localDateTime = tryParse(trimmedText, DateTimeFormatter.ISO_LOCAL_DATE_TIME, LocalDateTime::from)
				.or(() -> tryParse(trimmedText, SPACE_SEPARATED_DATE_TIME_FORMATTER, LocalDateTime::from))
				.or(() -> tryParse(trimmedText, DateTimeFormatter.ISO_OFFSET_DATE_TIME, OffsetDateTime::from)
						.map(offsetDateTime -> offsetDateTime.atZoneSameInstant(getTimeZone()).toLocalDateTime()))
				.or(() -> tryParse(trimmedText, DateTimeFormatter.ISO_ZONED_DATE_TIME, ZonedDateTime::from)
						.map(zonedDateTime -> zonedDateTime.withZoneSameInstant(getTimeZone()).toLocalDateTime()))
				.or(() -> tryParse(trimmedText, DateTimeFormatter.ISO_LOCAL_DATE, LocalDate::from)
						.map(LocalDate::atStartOfDay))
				.or(() -> tryParse(trimmedText, DateTimeFormatter.ISO_LOCAL_TIME, LocalTime::from)
						.map(localTime -> today().atTime(localTime)))
				.or(() -> tryParse(trimmedText, DateTimeFormatter.RFC_1123_DATE_TIME, ZonedDateTime::from)
						.map(zonedDateTime -> zonedDateTime.withZoneSameInstant(getTimeZone()).toLocalDateTime()))
				.orElse(null);

		if (localDateTime == null)
			throw new ProgrammerException(format("Unable to parse '%s' as a date/time", text));

		return localDateTime;
	}

	@NonNull
	private static <T> Optional<T> tryParse(@NonNull String text,
																					@NonNull DateTimeFormatter formatter,
																					@NonNull TemporalQuery<T> query) {
		try {
			return Optional.of(formatter.parse(text, query));
		} catch (DateTimeParseException e) {
			// Not this format
			return Optional.empty();
		}
	}

	@NonNull
	private LocalDate today() {
		return LocalDate.now(getClock().withZone(getTimeZone()));
	}

	@NonNull
	ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	Clock getClock() {
		return this.clock;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{timeZone=%s}", getClass().getSimpleName(), getTimeZone());
	}
}
