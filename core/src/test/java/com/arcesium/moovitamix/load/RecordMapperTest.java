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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arcesium.moovitamix.common.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordMapperTest {
  private static final LocalDate LOAD_DATE = LocalDate.of(2024, 12, 12);
  private static final LocalDateTime ETL_UPDATED_AT = LocalDateTime.of(2024, 12, 12, 23, 0);
  private static final LocalDateTime LISTENED_AT = LocalDateTime.of(2024, 12, 12, 8, 0);

  private final RecordMapper recordMapper = new RecordMapper();

  @Test
  void testListenHistoryExpandsOneRowPerItem() {
    Map<String, Object> row = listenRow(7, List.of(10, 20, 10));

    List<ListenEvent> events = recordMapper.toListenEvents(row, LOAD_DATE);

    assertThat(events)
        .containsExactly(
            new ListenEvent(7, 10, LISTENED_AT, LOAD_DATE),
            new ListenEvent(7, 20, LISTENED_AT, LOAD_DATE),
            new ListenEvent(7, 10, LISTENED_AT, LOAD_DATE));
  }

  @Test
  void testEmptyOrNullItemsYieldNoRows() {
    assertThat(recordMapper.toListenEvents(listenRow(1, List.of()), LOAD_DATE)).isEmpty();
    assertThat(recordMapper.toListenEvents(listenRow(1, null), LOAD_DATE)).isEmpty();
  }

  @Test
  void testNullItemYieldsRowWithoutTrack() {
    List<ListenEvent> events =
        recordMapper.toListenEvents(listenRow(1, Arrays.asList(5, null)), LOAD_DATE);

    assertThat(events).extracting(ListenEvent::getTrackId).containsExactly(5, null);
  }

  @Test
  void testListenHistoryExpansionOverManyRows() {
    List<ListenEvent> events =
        recordMapper.toListenEvents(
            List.of(listenRow(1, List.of(1, 2)), listenRow(2, List.of()), listenRow(3, List.of(3))),
            LOAD_DATE);

    assertThat(events).hasSize(3);
    assertThat(events).extracting(ListenEvent::getUserId).containsExactly(1, 1, 3);
    assertThat(events).extracting(ListenEvent::getLoadDate).containsOnly(LOAD_DATE);
  }

  @Test
  void testItemsMustBeAList() {
    assertThatThrownBy(() -> recordMapper.toListenEvents(listenRow(1, "10,20"), LOAD_DATE))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("must be a list");
  }

  @Test
  void testTrackMapping() {
    Map<String, Object> row = new HashMap<>();
    row.put("id", 42L);
    row.put("name", "Song");
    row.put("artist", "Artist");
    row.put("songwriters", List.of("A", "B"));
    row.put("duration", "3:30");
    row.put("genres", null);
    row.put("album", "Album");
    row.put("created_at", LocalDateTime.of(2024, 1, 1, 0, 0));
    row.put("updated_at", "2024-01-02T00:00:00");
    row.put("popularity", 99);

    TrackRecord track = recordMapper.toTrackRecord(row, ETL_UPDATED_AT);

    assertThat(track.getTrackId()).isEqualTo(42);
    assertThat(track.getName()).isEqualTo("Song");
    assertThat(track.getSongwriters()).isEqualTo("[A, B]");
    assertThat(track.getGenres()).isNull();
    assertThat(track.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
    assertThat(track.getUpdatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 2, 0, 0));
    assertThat(track.getEtlUpdatedAt()).isEqualTo(ETL_UPDATED_AT);
  }

  @Test
  void testDuplicateIdsKeepLastRow() {
    Map<String, Object> first = userRow(1, "Ada");
    Map<String, Object> second = userRow(2, "Grace");
    Map<String, Object> third = userRow(1, "Alan");

    List<UserRecord> users =
        recordMapper.toUserRecords(List.of(first, second, third), ETL_UPDATED_AT);

    assertThat(users).extracting(UserRecord::getUserId).containsExactly(1, 2);
    assertThat(users).extracting(UserRecord::getFirstName).containsExactly("Alan", "Grace");
    assertThat(users).extracting(UserRecord::getEtlUpdatedAt).containsOnly(ETL_UPDATED_AT);
  }

  @Test
  void testIdOutOfIntegerRange() {
    Map<String, Object> row = userRow(1, "Ada");
    row.put("id", Long.MAX_VALUE);

    assertThatThrownBy(() -> recordMapper.toUserRecord(row, ETL_UPDATED_AT))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("not an integer");
  }

  @Test
  void testFractionalIdIsRejected() {
    Map<String, Object> row = userRow(1, "Ada");
    row.put("id", 1.7d);

    assertThatThrownBy(() -> recordMapper.toUserRecord(row, ETL_UPDATED_AT))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("'1.7'")
        .hasMessageContaining("not an integer");
  }

  @Test
  void testFractionalItemIsRejected() {
    List<Object> items = Arrays.asList(1, new BigDecimal("2.5"));

    assertThatThrownBy(() -> recordMapper.toListenEvents(listenRow(1, items), LOAD_DATE))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("column items is not an integer");
  }

  @Test
  void testIntegralDecimalValues() {
    Map<String, Object> row = userRow(1, "Ada");
    row.put("id", 3.0d);

    assertThat(recordMapper.toUserRecord(row, ETL_UPDATED_AT).getUserId()).isEqualTo(3);
    assertThat(
            recordMapper.toListenEvents(listenRow(1, List.of(new BigDecimal("7.00"))), LOAD_DATE))
        .extracting(ListenEvent::getTrackId)
        .containsExactly(7);
  }

  private static Map<String, Object> listenRow(int userId, Object items) {
    Map<String, Object> row = new HashMap<>();
    row.put("user_id", userId);
    row.put("items", items);
    row.put("created_at", LISTENED_AT);
    return row;
  }

  private static Map<String, Object> userRow(int id, String firstName) {
    Map<String, Object> row = new HashMap<>();
    row.put("id", id);
    row.put("first_name", firstName);
    row.put("last_name", "Doe");
    row.put("email", "user@example.com");
    row.put("gender", "F");
    row.put("favorite_genres", List.of("Jazz"));
    row.put("created_at", LISTENED_AT);
    row.put("updated_at", LISTENED_AT);
    return row;
  }
}
