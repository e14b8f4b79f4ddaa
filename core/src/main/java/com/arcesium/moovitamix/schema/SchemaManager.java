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

import com.arcesium.moovitamix.WarehouseEngine;
import com.arcesium.moovitamix.dao.SchemaDao;
import java.util.List;
import org.apache.ibatis.session.SqlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the star schema of the warehouse: the {@code dim_tracks} and {@code dim_users} dimension
 * tables and the {@code fact_listen_history} fact table.
 *
 * <p>Every operation runs its DDL in the given session and commits it as one unit. On failure the
 * session is rolled back, so the warehouse never ends up with a table dropped but not recreated.
 */
public class SchemaManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaManager.class);
  private final SchemaDao schemaDao;

  public SchemaManager(WarehouseEngine warehouseEngine) {
    this(warehouseEngine.getSchemaDao());
  }

  public SchemaManager(SchemaDao schemaDao) {
    this.schemaDao = schemaDao;
  }

  /**
   * Prepares the schema for a load run.
   *
   * @param session The session to run the DDL in.
   * @param schemaMode RESET drops and recreates every table, CREATE_IF_ABSENT keeps existing
   *     tables.
   * @throws SchemaException if any statement fails.
   */
  public void prepare(SqlSession session, SchemaMode schemaMode) {
    if (schemaMode == SchemaMode.CREATE_IF_ABSENT) {
      createSchemaIfAbsent(session);
    } else {
      resetSchema(session);
    }
  }

  /**
   * Drops the warehouse tables if present and recreates them empty.
   *
   * @param session The session to run the DDL in.
   * @throws SchemaException if any statement fails.
   */
  public void ensureSchema(SqlSession session) {
    resetSchema(session);
  }

  /**
   * Drops the warehouse tables if present and recreates them empty. Existing data is discarded.
   *
   * @param session The session to run the DDL in.
   * @throws SchemaException if any statement fails.
   */
  public void resetSchema(SqlSession session) {
    runInTransaction(
        session,
        "reset",
        () -> {
          for (WarehouseTable table : WarehouseTable.values()) {
            schemaDao.dropTable(session, table);
          }
          for (WarehouseTable table : WarehouseTable.values()) {
            schemaDao.createTable(session, table, false);
          }
        });
    LOGGER.info("Schema created successfully");
  }

  /**
   * Creates the warehouse tables that do not exist yet. Existing tables and their rows are kept.
   *
   * @param session The session to run the DDL in.
   * @throws SchemaException if any statement fails.
   */
  public void createSchemaIfAbsent(SqlSession session) {
    runInTransaction(
        session,
        "create",
        () -> {
          for (WarehouseTable table : WarehouseTable.values()) {
            schemaDao.createTable(session, table, true);
          }
        });
    LOGGER.info("Schema is present");
  }

  /**
   * Lists the base tables currently present in the warehouse.
   *
   * @param session The session to query.
   * @return The table names in alphabetical order.
   */
  public List<String> listTables(SqlSession session) {
    return schemaDao.listTables(session);
  }

  private void runInTransaction(SqlSession session, String operation, Runnable ddl) {
    try {
      ddl.run();
      session.commit(true);
    } catch (RuntimeException e) {
      LOGGER.error("Error creating schema", e);
      SchemaException schemaError =
          new SchemaException(e, "Unable to %s warehouse schema", operation);
      try {
        session.rollback(true);
      } catch (RuntimeException rollbackError) {
        LOGGER.error("Error during schema rollback", rollbackError);
        schemaError.addSuppressed(rollbackError);
      }
      throw schemaError;
    }
  }
}
