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

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of reading one entity of a partition: either the file is absent, which is a tolerated
 * input, or it was read into an in-memory table of column name to value maps.
 */
public final class SnapshotFile {
  private final SnapshotEntity entity;
  private final Path path;
  private final boolean present;
  private final List<String> columns;
  private final List<Map<String, Object>> rows;

  private SnapshotFile(
      SnapshotEntity entity,
      Path path,
      boolean present,
      List<String> columns,
      List<Map<String, Object>> rows) {
    this.entity = entity;
    this.path = path;
    this.present = present;
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Creates the result for a partition file that does not exist.
   *
   * @param entity The entity that was looked up.
   * @param path The expected location of the file.
   * @return An absent SnapshotFile.
   */
  public static SnapshotFile absent(SnapshotEntity entity, Path path) {
    return new SnapshotFile(entity, path, false, List.of(), List.of());
  }

  /**
   * Creates the result for a partition file that was read.
   *
   * @param entity The entity that was read.
   * @param path The location of the file.
   * @param columns The column names of the file, in file order.
   * @param rows The rows of the file.
   * @return A present SnapshotFile.
   */
  public static SnapshotFile read(
      SnapshotEntity entity, Path path, List<String> columns, List<Map<String, Object>> rows) {
    return new SnapshotFile(
        entity,
        path,
        true,
        Collections.unmodifiableList(columns),
        Collections.unmodifiableList(rows));
  }

  public SnapshotEntity getEntity() {
    return entity;
  }

  public Path getPath() {
    return path;
  }

  public boolean isPresent() {
    return present;
  }

  public List<String> getColumns() {
    return columns;
  }

  /**
   * Returns the rows of the file.
   *
   * @return The rows, empty when the file is absent.
   */
  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public int getRowCount() {
    return rows.size();
  }

  @Override
  public String toString() {
    return "SnapshotFile{"
        + "entity="
        + entity
        + ", path="
        + path
        + ", present="
        + present
        + ", rowCount="
        + rows.size()
        + '}';
  }
}
