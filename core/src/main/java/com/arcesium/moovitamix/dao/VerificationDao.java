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
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.ibatis.session.SqlSession;

/** Data Access Object for the read-only queries of the verifier. */
public class VerificationDao extends BaseDao {
  private static final String namespace = "Verification";

  public VerificationDao(WarehouseEngine warehouseEngine) {
    super(warehouseEngine);
  }

  /**
   * Gets the total row count of a table.
   *
   * @param session The session to query.
   * @param table The table.
   * @return The number of rows.
   */
  public long countRows(SqlSession session, WarehouseTable table) {
    Map<String, Object> params = new HashMap<>();
    params.put("table", table.getTableName());
    Long count = session.selectOne(namespace + ".countRows", params);
    return count == null ? 0L : count;
  }

  /**
   * Gets the number of fact rows stored for a load date.
   *
   * @param session The session to query.
   * @param loadDate The load date.
   * @return The number of rows.
   */
  public long countListenEventsForLoadDate(SqlSession session, LocalDate loadDate) {
    Map<String, Object> params = new HashMap<>();
    params.put("loadDate", loadDate);
    Long count = session.selectOne(namespace + ".countListenEventsForLoadDate", params);
    return count == null ? 0L : count;
  }

  /**
   * Reads the first rows of a table ordered by its key column.
   *
   * @param session The session to query.
   * @param table The table.
   * @param limit The maximum number of rows.
   * @return The rows as column name to value maps.
   */
  public List<Map<String, Object>> sampleRows(SqlSession session, WarehouseTable table, int limit) {
    Map<String, Object> params = new HashMap<>();
    params.put("table", table.getTableName());
    params.put("orderBy", table.getKeyColumn());
    params.put("limit", limit);
    return session.selectList(namespace + ".sampleRows", params);
  }
}
