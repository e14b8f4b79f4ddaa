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
import com.arcesium.moovitamix.load.ListenEvent;
import com.arcesium.moovitamix.load.TrackRecord;
import com.arcesium.moovitamix.load.UserRecord;
import com.arcesium.moovitamix.schema.WarehouseTable;
import com.google.common.collect.Lists;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.ibatis.session.SqlSession;

/**
 * Data Access Object for the writes of a load. Every method runs in the caller's session, so the
 * writes of one load commit or roll back together.
 */
public class LoadDao extends BaseDao {
  private static final String namespace = "Load";

  public LoadDao(WarehouseEngine warehouseEngine) {
    super(warehouseEngine);
  }

  /**
   * Deletes every row of a table.
   *
   * @param session The session to run the statement in.
   * @param table The table to empty.
   * @return The number of deleted rows.
   */
  public int deleteAll(SqlSession session, WarehouseTable table) {
    Map<String, Object> params = new HashMap<>();
    params.put("table", table.getTableName());
    return session.delete(namespace + ".deleteAll", params);
  }

  /**
   * Deletes the fact rows stored for a load date.
   *
   * @param session The session to run the statement in.
   * @param loadDate The load date.
   * @return The number of deleted rows.
   */
  public int deleteListenEventsForLoadDate(SqlSession session, LocalDate loadDate) {
    Map<String, Object> params = new HashMap<>();
    params.put("loadDate", loadDate);
    return session.delete(namespace + ".deleteListenEventsForLoadDate", params);
  }

  /**
   * Inserts track dimension rows.
   *
   * @param session The session to run the statements in.
   * @param records The rows to insert.
   * @return The number of inserted rows.
   */
  public long insertTracks(SqlSession session, List<TrackRecord> records) {
    return insertInBatches(session, namespace + ".insertTracks", records);
  }

  /**
   * Inserts user dimension rows.
   *
   * @param session The session to run the statements in.
   * @param records The rows to insert.
   * @return The number of inserted rows.
   */
  public long insertUsers(SqlSession session, List<UserRecord> records) {
    return insertInBatches(session, namespace + ".insertUsers", records);
  }

  /**
   * Inserts listen history fact rows.
   *
   * @param session The session to run the statements in.
   * @param events The rows to insert.
   * @return The number of inserted rows.
   */
  public long insertListenEvents(SqlSession session, List<ListenEvent> events) {
    return insertInBatches(session, namespace + ".insertListenEvents", events);
  }

  private long insertInBatches(SqlSession session, String statement, List<?> records) {
    long count = 0;
    for (List<?> batch : Lists.partition(records, warehouseEngine.getInsertBatchSize())) {
      Map<String, Object> params = new HashMap<>();
      params.put("records", batch);
      session.insert(statement, params);
      count += batch.size();
    }
    return count;
  }
}
