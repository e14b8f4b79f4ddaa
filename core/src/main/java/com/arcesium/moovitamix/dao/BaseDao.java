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
import com.arcesium.moovitamix.common.ValidationException;
import com.arcesium.moovitamix.common.WarehouseException;
import java.sql.Array;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.ibatis.mapping.BoundSql;
import org.apache.ibatis.session.Configuration;
import org.duckdb.DuckDBStruct;

/**
 * Abstract base class for Data Access Objects (DAOs) of the warehouse. Provides access to the
 * mapped statements of the engine and conversion of DuckDB result sets.
 */
abstract class BaseDao {
  protected final WarehouseEngine warehouseEngine;

  /**
   * Constructs a BaseDao with the given WarehouseEngine.
   *
   * @param warehouseEngine The WarehouseEngine whose MyBatis configuration holds the statements.
   */
  BaseDao(WarehouseEngine warehouseEngine) {
    this.warehouseEngine = warehouseEngine;
  }

  /**
   * Retrieves the SQL string for a given statement id and parameters.
   *
   * @param id The ID of the SQL statement.
   * @param params The parameters to be used in the SQL statement.
   * @return The SQL string.
   */
  protected String getSql(String id, Object params) {
    Configuration configuration = warehouseEngine.getSqlSessionFactory().getConfiguration();
    if (!configuration.hasStatement(id)) {
      throw new ValidationException("Mybatis statement does not exist - %s", id);
    }
    BoundSql boundSql = configuration.getMappedStatement(id).getBoundSql(params);
    return boundSql.getSql();
  }

  /**
   * Reads a ResultSet into its column names and a list of rows. Rows keep the column order of the
   * result set; temporal values are converted to java.time types and lists to java.util.List.
   *
   * @param resultSet The ResultSet to convert.
   * @return A pair of the column names and the rows.
   * @throws WarehouseException If an error occurs during processing.
   */
  protected Pair<List<String>, List<Map<String, Object>>> getDataInMap(ResultSet resultSet) {
    List<Map<String, Object>> data = new ArrayList<>();
    try {
      ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
      int columnCount = resultSetMetaData.getColumnCount();
      List<String> columns = new ArrayList<>(columnCount);
      for (int i = 1; i <= columnCount; i++) {
        columns.add(resultSetMetaData.getColumnName(i));
      }
      while (resultSet.next()) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 1; i <= columnCount; i++) {
          map.put(columns.get(i - 1), convertValue(resultSet.getObject(i)));
        }
        data.add(map);
      }
      return Pair.of(columns, data);
    } catch (SQLException e) {
      throw new WarehouseException(e, "An error occurred while reading data from ResultSet.");
    }
  }

  private static Object convertValue(Object value) throws SQLException {
    if (value == null) {
      return null;
    }
    if (value instanceof Timestamp timestamp) {
      return timestamp.toLocalDateTime();
    } else if (value instanceof Date date) {
      return date.toLocalDate();
    } else if (value instanceof Array array) {
      List<Object> list = new ArrayList<>();
      for (Object element : Arrays.asList((Object[]) array.getArray())) {
        list.add(convertValue(element));
      }
      return list;
    } else if (value instanceof DuckDBStruct duckDBStruct) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : duckDBStruct.getMap().entrySet()) {
        map.put(entry.getKey(), convertValue(entry.getValue()));
      }
      return map;
    }
    return value;
  }
}
