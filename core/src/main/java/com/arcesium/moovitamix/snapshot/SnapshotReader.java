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

import com.arcesium.moovitamix.common.WarehouseException;
import com.arcesium.moovitamix.dao.SnapshotDao;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.ibatis.session.SqlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the Parquet snapshot of an entity for a partition date. DuckDB decodes the file on the
 * connection of the session, so reads inside a load see the same engine settings as the inserts.
 */
public class SnapshotReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotReader.class);
  private final PartitionLayout partitionLayout;
  private final SnapshotDao snapshotDao;

  /**
   * Constructs a SnapshotReader.
   *
   * @param partitionLayout The layout used to locate snapshot files.
   * @param snapshotDao The DAO that decodes Parquet files.
   */
  public SnapshotReader(PartitionLayout partitionLayout, SnapshotDao snapshotDao) {
    this.partitionLayout = partitionLayout;
    this.snapshotDao = snapshotDao;
  }

  public PartitionLayout getPartitionLayout() {
    return partitionLayout;
  }

  /**
   * Reads the snapshot of an entity.
   *
   * @param session The session whose connection decodes the file.
   * @param date The partition date.
   * @param entity The entity to read.
   * @return An absent SnapshotFile if the file does not exist, otherwise the file contents.
   * @throws SnapshotReadException if the file cannot be decoded or lacks required columns.
   */
  public SnapshotFile read(SqlSession session, LocalDate date, SnapshotEntity entity) {
    Path path = partitionLayout.resolve(date, entity);
    if (!Files.isRegularFile(path)) {
      return SnapshotFile.absent(entity, path);
    }

    Pair<List<String>, List<Map<String, Object>>> table;
    try {
      table =
          snapshotDao.readParquetFile(session.getConnection(), path.toAbsolutePath().toString());
    } catch (WarehouseException e) {
      throw new SnapshotReadException(
          e.getCause() == null ? e : e.getCause(),
          "Unable to read %s snapshot file %s",
          entity.getName(),
          path);
    }

    List<String> missingColumns =
        entity.getRequiredColumns().stream()
            .filter(c -> !table.getLeft().contains(c))
            .collect(Collectors.toList());
    if (!missingColumns.isEmpty()) {
      throw new SnapshotReadException(
          null,
          "Snapshot file %s is missing required columns %s",
          path,
          String.join(", ", missingColumns));
    }

    LOGGER.info("Found {} records for {} in {}", table.getRight().size(), entity.getName(), path);
    return SnapshotFile.read(entity, path, table.getLeft(), table.getRight());
  }
}
