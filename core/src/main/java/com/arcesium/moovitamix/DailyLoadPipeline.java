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
package com.arcesium.moovitamix;

import com.arcesium.moovitamix.load.LoadEngine;
import com.arcesium.moovitamix.load.LoadMetrics;
import com.arcesium.moovitamix.schema.SchemaManager;
import com.arcesium.moovitamix.schema.SchemaMode;
import com.arcesium.moovitamix.verify.VerificationReport;
import com.arcesium.moovitamix.verify.Verifier;
import java.time.LocalDate;
import java.util.Optional;
import org.apache.ibatis.session.SqlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the daily load: prepares the schema, loads the partition of the date and verifies the
 * result. Every run uses one warehouse session that is closed on every path.
 */
public class DailyLoadPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(DailyLoadPipeline.class);
  private final WarehouseEngine warehouseEngine;
  private final SchemaManager schemaManager;
  private final LoadEngine loadEngine;
  private final Verifier verifier;
  private final SchemaMode schemaMode;

  public DailyLoadPipeline(WarehouseEngine warehouseEngine) {
    this(
        warehouseEngine,
        new SchemaManager(warehouseEngine),
        new LoadEngine(warehouseEngine),
        new Verifier(warehouseEngine));
  }

  public DailyLoadPipeline(
      WarehouseEngine warehouseEngine,
      SchemaManager schemaManager,
      LoadEngine loadEngine,
      Verifier verifier) {
    this.warehouseEngine = warehouseEngine;
    this.schemaManager = schemaManager;
    this.loadEngine = loadEngine;
    this.verifier = verifier;
    this.schemaMode = warehouseEngine.getConfiguration().getSchemaMode();
  }

  /**
   * Runs the pipeline for the current date of the engine clock.
   *
   * @return 0 on success, 1 on any failure.
   */
  public int run() {
    return run(LocalDate.now(warehouseEngine.getClock()));
  }

  /**
   * Runs schema preparation, load and verification for a date in one session.
   *
   * @param date The partition date.
   * @return 0 on success, 1 on any failure.
   */
  public int run(LocalDate date) {
    try (SqlSession session = warehouseEngine.openSession()) {
      schemaManager.prepare(session, schemaMode);
      loadEngine.load(session, date);
      verifier.verify(session, date);
      return 0;
    } catch (RuntimeException e) {
      LOGGER.error("Daily load for {} failed", date, e);
      return 1;
    }
  }

  /**
   * Prepares the schema and loads the partition of a date in one session.
   *
   * @param date The partition date, today when empty.
   * @return The metrics of the committed load.
   * @throws com.arcesium.moovitamix.common.WarehouseException if schema preparation or the load
   *     fails.
   */
  public LoadMetrics loadDailyData(Optional<LocalDate> date) {
    LocalDate loadDate = date.orElseGet(() -> LocalDate.now(warehouseEngine.getClock()));
    try (SqlSession session = warehouseEngine.openSession()) {
      schemaManager.prepare(session, schemaMode);
      return loadEngine.load(session, loadDate);
    }
  }

  /**
   * Verifies the warehouse in a session of its own.
   *
   * @return The verification report.
   * @throws com.arcesium.moovitamix.verify.VerificationException if a query fails.
   */
  public VerificationReport verifyData() {
    try (SqlSession session = warehouseEngine.openSession()) {
      return verifier.verify(session);
    }
  }

  /**
   * Verifies the warehouse without loading anything.
   *
   * @return 0 on success, 1 on any failure.
   */
  public int runVerification() {
    try {
      verifyData();
      return 0;
    } catch (RuntimeException e) {
      LOGGER.error("Verification failed", e);
      return 1;
    }
  }
}
