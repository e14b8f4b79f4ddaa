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
package com.arcesium.moovitamix.common;

import com.arcesium.moovitamix.load.FactLoadPolicy;
import com.arcesium.moovitamix.schema.SchemaMode;
import java.time.Clock;

/**
 * Configuration class for the warehouse. This class holds the settings used to open the DuckDB
 * warehouse, locate the snapshot partitions and control the load behaviour.
 */
public class WarehouseConfiguration {
  private String databasePath;
  private String snapshotBaseDir;
  private Integer threads;
  private Integer memoryLimitInMiB;
  private SchemaMode schemaMode;
  private FactLoadPolicy factLoadPolicy;
  private int verifySampleSize;
  private int insertBatchSize;
  private Clock clock;

  /**
   * Gets the path of the DuckDB database file. A null path means an in-memory warehouse.
   *
   * @return The database path.
   */
  public String getDatabasePath() {
    return databasePath;
  }

  /**
   * Sets the path of the DuckDB database file.
   *
   * @param databasePath The database path to set.
   */
  public void setDatabasePath(String databasePath) {
    this.databasePath = databasePath;
  }

  /**
   * Gets the base directory holding one sub-directory per partition date.
   *
   * @return The snapshot base directory.
   */
  public String getSnapshotBaseDir() {
    return snapshotBaseDir;
  }

  /**
   * Sets the base directory holding one sub-directory per partition date.
   *
   * @param snapshotBaseDir The snapshot base directory to set.
   */
  public void setSnapshotBaseDir(String snapshotBaseDir) {
    this.snapshotBaseDir = snapshotBaseDir;
  }

  /**
   * Gets the number of DuckDB threads.
   *
   * @return The number of threads.
   */
  public Integer getThreads() {
    return threads;
  }

  /**
   * Sets the number of DuckDB threads.
   *
   * @param threads The number of threads to set.
   */
  public void setThreads(Integer threads) {
    this.threads = threads;
  }

  /**
   * Gets the DuckDB memory limit in MiB, or null to keep the DuckDB default.
   *
   * @return The memory limit in MiB.
   */
  public Integer getMemoryLimitInMiB() {
    return memoryLimitInMiB;
  }

  /**
   * Sets the DuckDB memory limit in MiB.
   *
   * @param memoryLimitInMiB The memory limit in MiB to set.
   */
  public void setMemoryLimitInMiB(Integer memoryLimitInMiB) {
    this.memoryLimitInMiB = memoryLimitInMiB;
  }

  public SchemaMode getSchemaMode() {
    return schemaMode;
  }

  public void setSchemaMode(SchemaMode schemaMode) {
    this.schemaMode = schemaMode;
  }

  public FactLoadPolicy getFactLoadPolicy() {
    return factLoadPolicy;
  }

  public void setFactLoadPolicy(FactLoadPolicy factLoadPolicy) {
    this.factLoadPolicy = factLoadPolicy;
  }

  /**
   * Gets the number of track rows read back by the verifier.
   *
   * @return The verification sample size.
   */
  public int getVerifySampleSize() {
    return verifySampleSize;
  }

  /**
   * Sets the number of track rows read back by the verifier.
   *
   * @param verifySampleSize The verification sample size to set.
   */
  public void setVerifySampleSize(int verifySampleSize) {
    this.verifySampleSize = verifySampleSize;
  }

  /**
   * Gets the maximum number of rows written by one INSERT statement.
   *
   * @return The insert batch size.
   */
  public int getInsertBatchSize() {
    return insertBatchSize;
  }

  /**
   * Sets the maximum number of rows written by one INSERT statement.
   *
   * @param insertBatchSize The insert batch size to set.
   */
  public void setInsertBatchSize(int insertBatchSize) {
    this.insertBatchSize = insertBatchSize;
  }

  /**
   * Gets the clock used for the default run date and the ETL timestamp.
   *
   * @return The clock.
   */
  public Clock getClock() {
    return clock;
  }

  /**
   * Sets the clock used for the default run date and the ETL timestamp.
   *
   * @param clock The clock to set.
   */
  public void setClock(Clock clock) {
    this.clock = clock;
  }

  @Override
  public String toString() {
    return "WarehouseConfiguration{"
        + "databasePath='"
        + databasePath
        + '\''
        + ", snapshotBaseDir='"
        + snapshotBaseDir
        + '\''
        + ", threads="
        + threads
        + ", memoryLimitInMiB="
        + memoryLimitInMiB
        + ", schemaMode="
        + schemaMode
        + ", factLoadPolicy="
        + factLoadPolicy
        + ", verifySampleSize="
        + verifySampleSize
        + ", insertBatchSize="
        + insertBatchSize
        + '}';
  }
}
