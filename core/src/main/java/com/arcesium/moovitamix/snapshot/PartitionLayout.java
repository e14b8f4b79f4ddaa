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

import com.arcesium.moovitamix.common.DateTimeUtil;
import com.arcesium.moovitamix.common.ValidationException;
import java.nio.file.Path;
import java.time.LocalDate;

/** Maps a partition date and an entity to the snapshot file written by the extract step. */
public class PartitionLayout {
  private final Path baseDir;

  /**
   * Constructs a PartitionLayout rooted at the given directory.
   *
   * @param baseDir The directory holding one sub-directory per partition date.
   */
  public PartitionLayout(Path baseDir) {
    this.baseDir = ValidationException.checkNotNull(baseDir, "Snapshot base directory is required");
  }

  public Path getBaseDir() {
    return baseDir;
  }

  /**
   * Returns the partition directory of a date, {@code <baseDir>/<yyyy-MM-dd>}.
   *
   * @param date The partition date.
   * @return The partition directory.
   */
  public Path partitionDir(LocalDate date) {
    return baseDir.resolve(DateTimeUtil.formatLocalDate(date));
  }

  /**
   * Returns the snapshot file of an entity inside the partition directory of a date.
   *
   * @param date The partition date.
   * @param entity The entity.
   * @return The snapshot file path.
   */
  public Path resolve(LocalDate date, SnapshotEntity entity) {
    return partitionDir(date).resolve(entity.getFileName());
  }
}
