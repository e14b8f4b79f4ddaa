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
package com.arcesium.moovitamix.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arcesium.moovitamix.TestUtil;
import com.arcesium.moovitamix.WarehouseEngine;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.apache.ibatis.session.SqlSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotReaderTest {
  private static final LocalDate DATE = LocalDate.of(2024, 12, 12);

  @TempDir Path baseDir;
  private WarehouseEngine engine;
  private PartitionLayout layout;
  private SnapshotReader reader;

  @BeforeEach
  void setUp() {
    engine = TestUtil.createWarehouseEngine(baseDir);
    layout = new PartitionLayout(baseDir);
    reader = new SnapshotReader(layout, engine.getSnapshotDao());
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  void testMissingFileIsAbsent() {
    try (SqlSession session = engine.openSession()) {
      SnapshotFile file = reader.read(session, DATE, SnapshotEntity.TRACKS);

      assertThat(file.isPresent()).isFalse();
      assertThat(file.getPath()).isEqualTo(layout.resolve(DATE, SnapshotEntity.TRACKS));
      assertThat(file.getRows()).isEmpty();
    }
  }

  @Test
  void testReadListenHistory() {
    TestUtil.writeListenHistory(
        engine,
        layout.resolve(DATE, SnapshotEntity.LISTEN_HISTORY),
        TestUtil.listenTuple(1, "[10, 20]", "2024-12-12 08:00:00"),
        TestUtil.listenTuple(2, "[]::INTEGER[]", "2024-12-12 09:30:00"));

    try (SqlSession session = engine.openSession()) {
      SnapshotFile file = reader.read(session, DATE, SnapshotEntity.LISTEN_HISTORY);

      assertThat(file.isPresent()).isTrue();
      assertThat(file.getRowCount()).isEqualTo(2);
      assertThat(file.getColumns()).containsExactly("user_id", "items", "created_at");
      Map<String, Object> first = file.getRows().get(0);
      assertThat(first.get("user_id")).isEqualTo(1);
      assertThat(first.get("items")).isEqualTo(List.of(10, 20));
      assertThat(first.get("created_at")).isEqualTo(LocalDateTime.of(2024, 12, 12, 8, 0));
      assertThat(file.getRows().get(1).get("items")).isEqualTo(List.of());
    }
  }

  @Test
  void testMissingRequiredColumns() {
    TestUtil.writeParquet(
        engine,
        layout.resolve(DATE, SnapshotEntity.USERS),
        "SELECT 1 AS id, 'Ada' AS first_name");

    try (SqlSession session = engine.openSession()) {
      assertThatThrownBy(() -> reader.read(session, DATE, SnapshotEntity.USERS))
          .isInstanceOf(SnapshotReadException.class)
          .hasMessageContaining("users.parquet")
          .hasMessageContaining("last_name")
          .hasMessageContaining("favorite_genres");
    }
  }

  @Test
  void testCorruptFile() throws Exception {
    Path path = layout.resolve(DATE, SnapshotEntity.TRACKS);
    Files.createDirectories(path.getParent());
    Files.writeString(path, "this is not a parquet file");

    try (SqlSession session = engine.openSession()) {
      assertThatThrownBy(() -> reader.read(session, DATE, SnapshotEntity.TRACKS))
          .isInstanceOf(SnapshotReadException.class)
          .hasMessageContaining("tracks")
          .hasCauseInstanceOf(java.sql.SQLException.class);
    }
  }
}
