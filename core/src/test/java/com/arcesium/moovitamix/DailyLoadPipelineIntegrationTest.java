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
package com.arcesium.moovitamix;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.arcesium.moovitamix.load.LoadMetrics;
import com.arcesium.moovitamix.load.LoadTransactionException;
import com.arcesium.moovitamix.schema.SchemaMode;
import com.arcesium.moovitamix.schema.WarehouseTable;
import com.arcesium.moovitamix.snapshot.PartitionLayout;
import com.arcesium.moovitamix.snapshot.SnapshotEntity;
import com.arcesium.moovitamix.verify.VerificationReport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DailyLoadPipelineIntegrationTest {
  private static final LocalDate DATE = LocalDate.of(2024, 12, 12);

  @TempDir Path baseDir;
  private WarehouseEngine engine;
  private PartitionLayout layout;
  private DailyLoadPipeline pipeline;

  @BeforeEach
  void setUp() {
    engine = TestUtil.createWarehouseEngine(baseDir);
    layout = new PartitionLayout(baseDir);
    pipeline = new DailyLoadPipeline(engine);
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  void testDailyLoad() {
    TestUtil.writeTracks(
        engine,
        layout.resolve(DATE, SnapshotEntity.TRACKS),
        TestUtil.trackTuple(1, "Song A"),
        TestUtil.trackTuple(2, "Song B"));
    TestUtil.writeUsers(
        engine, layout.resolve(DATE, SnapshotEntity.USERS), TestUtil.userTuple(1, "Ada"));
    TestUtil.writeListenHistory(
        engine,
        layout.resolve(DATE, SnapshotEntity.LISTEN_HISTORY),
        TestUtil.listenTuple(1, "[1, 2]", "2024-12-12 08:00:00"));

    assertThat(pipeline.run(DATE)).isZero();

    VerificationReport report = pipeline.verifyData();
    assertThat(report.getTrackCount()).isEqualTo(2);
    assertThat(report.getUserCount()).isEqualTo(1);
    assertThat(report.getHistoryCount()).isEqualTo(2);
    assertThat(report.getSampleTracks()).hasSize(2);
    assertThat(TestUtil.distinctLoadDates(engine)).containsExactly(DATE);
  }

  @Test
  void testEmptyPartition() throws Exception {
    Files.createDirectories(layout.partitionDir(DATE));

    assertThat(pipeline.run(DATE)).isZero();

    VerificationReport report = pipeline.verifyData();
    assertThat(report.getTrackCount()).isZero();
    assertThat(report.getUserCount()).isZero();
    assertThat(report.getHistoryCount()).isZero();
  }

  @Test
  void testRerunResetsWarehouse() {
    TestUtil.writeTracks(
        engine, layout.resolve(DATE, SnapshotEntity.TRACKS), TestUtil.trackTuple(1, "Song A"));

    assertThat(pipeline.run(DATE)).isZero();
    assertThat(pipeline.run(DATE)).isZero();

    assertThat(TestUtil.count(engine, "dim_tracks")).isEqualTo(1);
  }

  @Test
  void testRerunReplacesDimensionsWhenSchemaIsKept() {
    try (WarehouseEngine keepingEngine =
        TestUtil.getWarehouseEngineBuilder(baseDir)
            .schemaMode(SchemaMode.CREATE_IF_ABSENT)
            .build()) {
      TestUtil.writeTracks(
          keepingEngine,
          layout.resolve(DATE, SnapshotEntity.TRACKS),
          TestUtil.trackTuple(1, "Song A"),
          TestUtil.trackTuple(2, "Song B"));
      TestUtil.writeUsers(
          keepingEngine, layout.resolve(DATE, SnapshotEntity.USERS), TestUtil.userTuple(5, "Ada"));
      DailyLoadPipeline keepingPipeline = new DailyLoadPipeline(keepingEngine);

      assertThat(keepingPipeline.run(DATE)).isZero();
      LoadMetrics metrics = keepingPipeline.loadDailyData(Optional.of(DATE));
      assertThat(keepingPipeline.run(DATE)).isZero();

      assertThat(metrics.getRemovedRecordsCount(WarehouseTable.DIM_TRACKS)).isEqualTo(2);
      assertThat(metrics.getAddedRecordsCount(WarehouseTable.DIM_TRACKS)).isEqualTo(2);
      assertThat(metrics.getRemovedRecordsCount(WarehouseTable.DIM_USERS)).isEqualTo(1);
      assertThat(TestUtil.count(keepingEngine, "dim_tracks")).isEqualTo(2);
      assertThat(TestUtil.count(keepingEngine, "dim_users")).isEqualTo(1);
      assertThat(
              TestUtil.getRecords(keepingEngine, "SELECT name FROM dim_tracks ORDER BY track_id"))
          .extracting(r -> r.get("name"))
          .containsExactly("Song A", "Song B");
    }
  }

  @Test
  void testCorruptFileFailsRun() throws Exception {
    TestUtil.writeTracks(
        engine, layout.resolve(DATE, SnapshotEntity.TRACKS), TestUtil.trackTuple(1, "Song A"));
    Files.writeString(layout.resolve(DATE, SnapshotEntity.USERS), "not parquet");

    assertThat(pipeline.run(DATE)).isEqualTo(1);

    assertThat(TestUtil.count(engine, "dim_tracks")).isZero();
    assertThatThrownBy(() -> pipeline.loadDailyData(Optional.of(DATE)))
        .isInstanceOf(LoadTransactionException.class);
  }

  @Test
  void testLoadDailyData() {
    TestUtil.writeUsers(
        engine,
        layout.resolve(DATE, SnapshotEntity.USERS),
        TestUtil.userTuple(1, "Ada"),
        TestUtil.userTuple(2, "Grace"));

    LoadMetrics metrics = pipeline.loadDailyData(Optional.of(DATE));

    assertThat(metrics.getLoadDate()).isEqualTo(DATE);
    assertThat(metrics.getAddedRecordsCount(WarehouseTable.DIM_USERS)).isEqualTo(2);
    assertThat(metrics.getSkippedEntities())
        .containsExactly(SnapshotEntity.TRACKS, SnapshotEntity.LISTEN_HISTORY);
    assertThat(pipeline.verifyData().getUserCount()).isEqualTo(2);
  }
}
