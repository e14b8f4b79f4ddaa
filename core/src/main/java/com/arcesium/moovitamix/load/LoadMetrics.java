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

import com.arcesium.moovitamix.schema.WarehouseTable;
import com.arcesium.moovitamix.snapshot.SnapshotEntity;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Represents the outcome of a committed load run. */
public class LoadMetrics {
  private final LocalDate loadDate;
  private final LocalDateTime etlUpdatedAt;
  private final Map<WarehouseTable, Long> addedRecordsCount;
  private final Map<WarehouseTable, Long> removedRecordsCount;
  private final List<SnapshotEntity> skippedEntities;
  private final Duration totalDuration;

  /**
   * Constructs a LoadMetrics object.
   *
   * @param loadDate The partition date that was loaded.
   * @param etlUpdatedAt The ETL timestamp stamped on the dimension rows of the run.
   * @param addedRecordsCount Number of rows inserted per table.
   * @param removedRecordsCount Number of rows deleted per table before inserting.
   * @param skippedEntities Entities whose partition file was missing.
   * @param totalDuration Total duration of the run.
   */
  public LoadMetrics(
      LocalDate loadDate,
      LocalDateTime etlUpdatedAt,
      Map<WarehouseTable, Long> addedRecordsCount,
      Map<WarehouseTable, Long> removedRecordsCount,
      List<SnapshotEntity> skippedEntities,
      Duration totalDuration) {
    this.loadDate = loadDate;
    this.etlUpdatedAt = etlUpdatedAt;
    this.addedRecordsCount = copyOf(addedRecordsCount);
    this.removedRecordsCount = copyOf(removedRecordsCount);
    this.skippedEntities = List.copyOf(skippedEntities);
    this.totalDuration = totalDuration;
  }

  public LocalDate getLoadDate() {
    return loadDate;
  }

  public LocalDateTime getEtlUpdatedAt() {
    return etlUpdatedAt;
  }

  /**
   * Gets the number of rows inserted into a table.
   *
   * @param table The table.
   * @return The number of inserted rows, 0 if the table was not loaded.
   */
  public long getAddedRecordsCount(WarehouseTable table) {
    return addedRecordsCount.getOrDefault(table, 0L);
  }

  /**
   * Gets the number of rows deleted from a table before the new rows were inserted.
   *
   * @param table The table.
   * @return The number of deleted rows.
   */
  public long getRemovedRecordsCount(WarehouseTable table) {
    return removedRecordsCount.getOrDefault(table, 0L);
  }

  public List<SnapshotEntity> getSkippedEntities() {
    return skippedEntities;
  }

  public Duration getTotalDuration() {
    return totalDuration;
  }

  private static Map<WarehouseTable, Long> copyOf(Map<WarehouseTable, Long> counts) {
    Map<WarehouseTable, Long> copy = new EnumMap<>(WarehouseTable.class);
    copy.putAll(counts);
    return Collections.unmodifiableMap(copy);
  }

  @Override
  public String toString() {
    return "LoadMetrics{"
        + "loadDate="
        + loadDate
        + ", etlUpdatedAt="
        + etlUpdatedAt
        + ", addedRecordsCount="
        + addedRecordsCount
        + ", removedRecordsCount="
        + removedRecordsCount
        + ", skippedEntities="
        + skippedEntities
        + ", totalDuration="
        + totalDuration
        + '}';
  }
}
