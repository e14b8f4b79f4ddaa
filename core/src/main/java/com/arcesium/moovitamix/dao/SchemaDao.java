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
package com.arcesium.moovitamix.dao;

import com.arcesium.moovitamix.WarehouseEngine;
import com.arcesium.moovitamix.schema.WarehouseTable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.ibatis.session.SqlSession;

/** Data Access Object for the DDL of the warehouse tables. */
public class SchemaDao extends BaseDao {
  private static final String namespace = "Schema";

  public SchemaDao(WarehouseEngine warehouseEngine) {
    super(warehouseEngine);
  }

  /**
   * Drops a table if it exists.
   *
   * @param session The session to run the DDL in.
   * @param table The table to drop.
   */
  public void dropTable(SqlSession session, WarehouseTable table) {
    Map<String, Object> params = new HashMap<>();
    params.put("table", table.getTableName());
    session.update(namespace + ".dropTable", params);
  }

  /**
   * Creates a table.
   *
   * @param session The session to run the DDL in.
   * @param table The table to create.
   * @param ifNotExists Whether an existing table is left as it is instead of failing.
   */
  public void createTable(SqlSession session, WarehouseTable table, boolean ifNotExists) {
    Map<String, Object> params = new HashMap<>();
    params.put("ifNotExists", ifNotExists);
    session.update(table.getCreateStatementId(), params);
  }

  /**
   * Lists the base tables of the main schema.
   *
   * @param session The session to query.
   * @return The table names in alphabetical order.
   */
  public List<String> listTables(SqlSession session) {
    return session.selectList(namespace + ".listTables");
  }
}
