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
package com.arcesium.moovitamix.schema;

/**
 * The warehouse tables of the listening star schema, in load order: dimensions before the fact
 * table.
 */
public enum WarehouseTable {
  DIM_TRACKS("dim_tracks", "track_id", "Schema.createTrackDimension"),
  DIM_USERS("dim_users", "user_id", "Schema.createUserDimension"),
  FACT_LISTEN_HISTORY("fact_listen_history", null, "Schema.createListenHistoryFact");

  private final String tableName;
  private final String keyColumn;
  private final String createStatementId;

  WarehouseTable(String tableName, String keyColumn, String createStatementId) {
    this.tableName = tableName;
    this.keyColumn = keyColumn;
    this.createStatementId = createStatementId;
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * Returns the primary key column of the table.
   *
   * @return The key column, or null for the fact table which has no primary key.
   */
  public String getKeyColumn() {
    return keyColumn;
  }

  /**
   * Returns the id of the mapped statement holding the CREATE TABLE DDL of the table.
   *
   * @return The mapped statement id.
   */
  public String getCreateStatementId() {
    return createStatementId;
  }
}
