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
import com.arcesium.moovitamix.common.WarehouseException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.tuple.Pair;

/** Data Access Object that decodes Parquet snapshot files with DuckDB. */
public class SnapshotDao extends BaseDao {
  private static final String namespace = "Snapshot";

  public SnapshotDao(WarehouseEngine warehouseEngine) {
    super(warehouseEngine);
  }

  /**
   * Generates SQL that reads every column of a Parquet file.
   *
   * @param filePath The path of the Parquet file.
   * @return The generated SQL string.
   */
  public String getReadParquetFileSql(String filePath) {
    Map<String, Object> params = new HashMap<>();
    params.put("path", filePath.replace("'", "''"));
    return getSql(namespace + ".readParquetFile", params);
  }

  /**
   * Reads a Parquet file into memory.
   *
   * @param connection The DuckDB connection that decodes the file.
   * @param filePath The path of the Parquet file.
   * @return A pair of the column names of the file and its rows.
   * @throws WarehouseException if the file cannot be read.
   */
  public Pair<List<String>, List<Map<String, Object>>> readParquetFile(
      Connection connection, String filePath) {
    String sql = getReadParquetFileSql(filePath);
    try (Statement stmt = connection.createStatement();
        ResultSet resultSet = stmt.executeQuery(sql)) {
      return getDataInMap(resultSet);
    } catch (SQLException e) {
      throw new WarehouseException(e, "An error occurred while reading parquet file %s", filePath);
    }
  }
}
