/*
 * Copyright (c) 2025, Arcesium LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arcesium.moovitamix.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/** Utility class for date and time operations */
public class DateTimeUtil {
  private DateTimeUtil() {}

  /**
   * Parses a partition date string in ISO format (yyyy-MM-dd).
   *
   * @param value The date string to parse.
   * @return The parsed LocalDate.
   * @throws ValidationException if the value is null, empty or not in ISO format.
   */
  public static LocalDate parseLocalDate(String value) {
    ValidationException.checkNotNull(value, "Date string cannot be null");
    if (value.trim().isEmpty()) {
      throw new ValidationException("Date string cannot be empty");
    }

    try {
      return LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
    } catch (DateTimeParseException e) {
      throw new ValidationException(
          "Date '%s' must be in ISO format (yyyy-MM-dd, e.g., 2024-12-12)", value);
    }
  }

  /**
   * Formats a date the way partition directories are named.
   *
   * @param value The date to format.
   * @return The ISO formatted date.
   */
  public static String formatLocalDate(LocalDate value) {
    ValidationException.checkNotNull(value, "Date value cannot be null");
    return DateTimeFormatter.ISO_LOCAL_DATE.format(value);
  }

  /**
   * Converts a value read from the warehouse into a LocalDate. Timestamps keep their date part.
   *
   * @param value The value to convert.
   * @return The converted LocalDate, or null if the value is null.
   * @throws ValidationException if the value cannot be interpreted as a date.
   */
  public static LocalDate toLocalDate(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDate localDate) {
      return localDate;
    }
    if (value instanceof Date date) {
      return date.toLocalDate();
    }
    if (value instanceof LocalDateTime || value instanceof Timestamp) {
      return toLocalDateTime(value).toLocalDate();
    }
    if (value instanceof CharSequence text) {
      return parseLocalDate(text.toString());
    }
    throw new ValidationException(
        "Value of type %s cannot be converted to a date", value.getClass().getName());
  }

  /**
   * Returns the current time of the clock truncated to the warehouse timestamp precision.
   *
   * @param clock The clock to read.
   * @return The current LocalDateTime with microsecond precision.
   */
  public static LocalDateTime nowToMicros(Clock clock) {
    return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Converts a value read from a snapshot file into a LocalDateTime. Zoned values are shifted to
   * UTC before the zone is dropped; strings must be ISO local or offset date-times.
   *
   * @param value The value to convert.
   * @return The converted LocalDateTime, or null if the value is null.
   * @throws ValidationException if the value cannot be interpreted as a timestamp.
   */
  public static LocalDateTime toLocalDateTime(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDateTime localDateTime) {
      return localDateTime.truncatedTo(ChronoUnit.MICROS);
    }
    if (value instanceof Timestamp timestamp) {
      return timestamp.toLocalDateTime().truncatedTo(ChronoUnit.MICROS);
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime
          .withOffsetSameInstant(ZoneOffset.UTC)
          .toLocalDateTime()
          .truncatedTo(ChronoUnit.MICROS);
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return toLocalDateTime(zonedDateTime.toOffsetDateTime());
    }
    if (value instanceof Instant instant) {
      return LocalDateTime.ofInstant(instant, ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
    if (value instanceof LocalDate localDate) {
      return localDate.atStartOfDay();
    }
    if (value instanceof CharSequence text) {
      return parseLocalDateTimeToMicros(text.toString());
    }
    throw new ValidationException(
        "Value of type %s cannot be converted to a timestamp", value.getClass().getName());
  }

  /**
   * Parses a timestamp string, accepting ISO local date-times and ISO offset date-times.
   *
   * @param value The timestamp string to parse.
   * @return The parsed LocalDateTime truncated to microseconds.
   * @throws ValidationException if the value cannot be parsed.
   */
  public static LocalDateTime parseLocalDateTimeToMicros(String value) {
    ValidationException.checkNotNull(value, "Timestamp string cannot be null");
    String text = value.trim();
    if (text.isEmpty()) {
      throw new ValidationException("Timestamp string cannot be empty");
    }

    try {
      return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .truncatedTo(ChronoUnit.MICROS);
    } catch (DateTimeParseException e) {
      try {
        return toLocalDateTime(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
      } catch (DateTimeParseException ex) {
        throw new ValidationException(
            "Timestamp '%s' must be in ISO format (yyyy-MM-ddTHH:mm:ss[.SSSSSS], e.g., 2024-12-12T10:00:00)",
            value);
      }
    }
  }
}
