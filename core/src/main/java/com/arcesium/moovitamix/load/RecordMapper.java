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
package com.arcesium.moovitamix.load;

import com.arcesium.moovitamix.common.DateTimeUtil;
import com.arcesium.moovitamix.common.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps snapshot rows to warehouse rows. Source identity fields are renamed to the warehouse key
 * columns, descriptive attributes are passed through as text and source columns that the warehouse
 * does not know are ignored.
 */
public class RecordMapper {
  private static final Logger LOGGER = LoggerFactory.getLogger(RecordMapper.class);

  public TrackRecord toTrackRecord(Map<String, Object> row, LocalDateTime etlUpdatedAt) {
    return new TrackRecord(
        toInteger(row.get("id"), "id"),
        toText(row.get("name")),
        toText(row.get("artist")),
        toText(row.get("songwriters")),
        toText(row.get("duration")),
        toText(row.get("genres")),
        toText(row.get("album")),
        DateTimeUtil.toLocalDateTime(row.get("created_at")),
        DateTimeUtil.toLocalDateTime(row.get("updated_at")),
        etlUpdatedAt);
  }

  public UserRecord toUserRecord(Map<String, Object> row, LocalDateTime etlUpdatedAt) {
    return new UserRecord(
        toInteger(row.get("id"), "id"),
        toText(row.get("first_name")),
        toText(row.get("last_name")),
        toText(row.get("email")),
        toText(row.get("gender")),
        toText(row.get("favorite_genres")),
        DateTimeUtil.toLocalDateTime(row.get("created_at")),
        DateTimeUtil.toLocalDateTime(row.get("updated_at")),
        etlUpdatedAt);
  }

  /**
   * Expands a listen history record into one fact row per element of its {@code items} list. A
   * null or empty list yields no rows; a null element yields a row without a track.
   *
   * @param row The listen history record.
   * @param loadDate The load date stamped on every produced row.
   * @return The fact rows in the order of the items.
   */
  public List<ListenEvent> toListenEvents(Map<String, Object> row, LocalDate loadDate) {
    Object items = row.get("items");
    if (items == null) {
      return List.of();
    }
    if (!(items instanceof Collection)) {
      throw new ValidationException(
          "Listen history items must be a list, got %s", items.getClass().getName());
    }

    Integer userId = toInteger(row.get("user_id"), "user_id");
    LocalDateTime listenedAt = DateTimeUtil.toLocalDateTime(row.get("created_at"));
    List<ListenEvent> events = new ArrayList<>();
    for (Object item : (Collection<?>) items) {
      events.add(new ListenEvent(userId, toInteger(item, "items"), listenedAt, loadDate));
    }
    return events;
  }

  /**
   * Maps every row of a tracks snapshot. When the snapshot holds several rows for the same id the
   * last one wins.
   */
  public List<TrackRecord> toTrackRecords(
      List<Map<String, Object>> rows, LocalDateTime etlUpdatedAt) {
    Map<Integer, TrackRecord> records = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      TrackRecord record = toTrackRecord(row, etlUpdatedAt);
      records.put(record.getTrackId(), record);
    }
    logDuplicates("tracks", rows.size(), records.size());
    return new ArrayList<>(records.values());
  }

  /**
   * Maps every row of a users snapshot. When the snapshot holds several rows for the same id the
   * last one wins.
   */
  public List<UserRecord> toUserRecords(
      List<Map<String, Object>> rows, LocalDateTime etlUpdatedAt) {
    Map<Integer, UserRecord> records = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      UserRecord record = toUserRecord(row, etlUpdatedAt);
      records.put(record.getUserId(), record);
    }
    logDuplicates("users", rows.size(), records.size());
    return new ArrayList<>(records.values());
  }

  public List<ListenEvent> toListenEvents(List<Map<String, Object>> rows, LocalDate loadDate) {
    List<ListenEvent> events = new ArrayList<>();
    for (Map<String, Object> row : rows) {
      events.addAll(toListenEvents(row, loadDate));
    }
    return events;
  }

  private static void logDuplicates(String entity, int rowCount, int recordCount) {
    if (rowCount != recordCount) {
      LOGGER.debug(
          "Dropped {} duplicate {} rows, keeping the last row per id",
          rowCount - recordCount,
          entity);
    }
  }

  private static String toText(Object value) {
    return Objects.toString(value, null);
  }

  private static Integer toInteger(Object value, String column) {
    if (value == null) {
      return null;
    }
    if (value instanceof Integer) {
      return (Integer) value;
    }
    try {
      if (value instanceof Number) {
        // fractional and out-of-range values fail instead of being truncated
        return new BigDecimal(value.toString()).intValueExact();
      }
      if (value instanceof CharSequence) {
        return Integer.valueOf(value.toString().trim());
      }
    } catch (ArithmeticException | NumberFormatException e) {
      throw new ValidationException("Value '%s' of column %s is not an integer", value, column);
    }
    throw new ValidationException(
        "Value of type %s in column %s is not an integer", value.getClass().getName(), column);
  }
}
