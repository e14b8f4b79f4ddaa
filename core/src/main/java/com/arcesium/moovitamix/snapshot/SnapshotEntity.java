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

import java.util.List;

/**
 * The source entities extracted once per day. Each entity is stored as one Parquet file inside the
 * partition directory of its extraction date.
 */
public enum SnapshotEntity {
  TRACKS(
      "tracks",
      List.of(
          "id",
          "name",
          "artist",
          "songwriters",
          "duration",
          "genres",
          "album",
          "created_at",
          "updated_at")),
  USERS(
      "users",
      List.of(
          "id",
          "first_name",
          "last_name",
          "email",
          "gender",
          "favorite_genres",
          "created_at",
          "updated_at")),
  LISTEN_HISTORY("listen_history", List.of("user_id", "items", "created_at"));

  private final String name;
  private final List<String> requiredColumns;

  SnapshotEntity(String name, List<String> requiredColumns) {
    this.name = name;
    this.requiredColumns = requiredColumns;
  }

  /**
   * Returns the entity name, which is also the API endpoint and the file base name.
   *
   * @return The entity name.
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the name of the snapshot file inside a partition directory.
   *
   * @return The file name.
   */
  public String getFileName() {
    return name + ".parquet";
  }

  /**
   * Returns the source columns the load reads from this entity. Any other column is ignored.
   *
   * @return The required column names.
   */
  public List<String> getRequiredColumns() {
    return requiredColumns;
  }
}
