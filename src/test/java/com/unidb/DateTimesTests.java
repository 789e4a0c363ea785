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

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public class DateTimesTests {
	private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

	// 2024-03-15 14:30:45 in New York
	private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-15T18:30:45Z"), NEW_YORK);

	@Test
	public void testCanonicalFormats() {
		DateTimes dateTimes = new DateTimes(NEW_YORK, FIXED_CLOCK);

		Assertions.assertEquals("2023-07-04 09:05:00", dateTimes.formatTimestamp("2023-07-04 09:05"));
		Assertions.assertEquals("2023-07-04 09:05:06", dateTimes.formatTimestamp("2023-07-04T09:05:06.789"));
		Assertions.assertEquals("2023-07-04", dateTimes.formatDate("2023-07-04 09:05:06"));
		Assertions.assertEquals("09:05:06", dateTimes.formatTime("2023-07-04 09:05:06"));
	}

	@Test
	public void testPartialInput() {
		DateTimes dateTimes = new DateTimes(NEW_YORK, FIXED_CLOCK);

		Assertions.assertEquals("2023-07-04 00:00:00", dateTimes.formatTimestamp("2023-07-04"));
		Assertions.assertEquals("2024-03-15 08:15:00", dateTimes.formatTimestamp("08:15"), "Time-only input falls on today");
		Assertions.assertEquals("00:00:00", dateTimes.formatTime("2023-07-04"));
	}

	@Test
	public void testRelativeKeywords() {
		DateTimes dateTimes = new DateTimes(NEW_YORK, FIXED_CLOCK);

		Assertions.assertEquals("2024-03-15 14:30:45", dateTimes.formatTimestamp("now"));
		Assertions.assertEquals("2024-03-15 00:00:00", dateTimes.formatTimestamp("Today"));
		Assertions.assertEquals("2024-03-16", dateTimes.formatDate("tomorrow"));
		Assertions.assertEquals("2024-03-14", dateTimes.formatDate(" yesterday "));
	}

	@Test
	public void testZonedInputIsConvertedToConfiguredZone() {
		DateTimes dateTimes = new DateTimes(NEW_YORK, FIXED_CLOCK);

		Assertions.assertEquals("2024-03-15 08:00:00", dateTimes.formatTimestamp("2024-03-15T12:00:00Z"));
		Assertions.assertEquals("2024-03-15 08:00:00", dateTimes.formatTimestamp("2024-03-15T14:00:00+02:00"));
		Assertions.assertEquals("2024-03-15 08:00:00", dateTimes.formatTimestamp("Fri, 15 Mar 2024 12:00:00 GMT"));
		Assertions.assertEquals("2024-03-15 08:00:00",
				dateTimes.formatTimestamp(OffsetDateTime.of(2024, 3, 15, 12, 0, 0, 0, ZoneOffset.UTC)));
		Assertions.assertEquals("2024-03-15 08:00:00", dateTimes.formatTimestamp(Instant.parse("2024-03-15T12:00:00Z")));
	}

	@Test
	public void testJavaTypes() {
		DateTimes dateTimes = new DateTimes(NEW_YORK, FIXED_CLOCK);

		Assertions.assertEquals("2020-02-29 23:59:59", dateTimes.formatTimestamp(LocalDateTime.of(2020, 2, 29, 23, 59, 59, 999)));
		Assertions.assertEquals("2020-02-29 00:00:00", dateTimes.formatTimestamp(LocalDate.of(2020, 2, 29)));
		Assertions.assertEquals("2024-03-15 07:08:09", dateTimes.formatTimestamp(LocalTime.of(7, 8, 9)));
		Assertions.assertEquals("2020-02-29 10:11:12", dateTimes.formatTimestamp(Timestamp.valueOf("2020-02-29 10:11:12.5")));
		Assertions.assertEquals("2020-02-29", dateTimes.formatDate(java.sql.Date.valueOf("2020-02-29")));
		Assertions.assertEquals("10:11:12", dateTimes.formatTime(java.sql.Time.valueOf("10:11:12")));
	}

	@Test
	public void testRoundTripIsStable() {
		DateTimes dateTimes = new DateTimes(NEW_YORK, FIXED_CLOCK);

		for (String input : new String[]{"2023-01-02 03:04:05", "2023-01-02T03:04:05.123456", "2023-01-02", "now"}) {
			String rendered = dateTimes.formatTimestamp(input);
			Assertions.assertEquals(rendered, dateTimes.formatTimestamp(rendered));
		}
	}

	@Test
	public void testUnparseableInput() {
		DateTimes dateTimes = new DateTimes(NEW_YORK, FIXED_CLOCK);

		Assertions.assertThrows(ProgrammerException.class, () -> dateTimes.formatTimestamp("not a date"));
		Assertions.assertThrows(ProgrammerException.class, () -> dateTimes.formatDate(""));
		Assertions.assertThrows(ProgrammerException.class, () -> dateTimes.formatTime(42));
	}
}
