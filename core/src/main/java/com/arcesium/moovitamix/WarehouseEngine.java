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

import com.arcesium.moovitamix.common.ValidationException;
import com.arcesium.moovitamix.common.WarehouseConfiguration;
import com.arcesium.moovitamix.common.WarehouseException;
import com.arcesium.moovitamix.dao.LoadDao;
import com.arcesium.moovitamix.dao.SchemaDao;
import com.arcesium.moovitamix.dao.SnapshotDao;
import com.arcesium.moovitamix.dao.VerificationDao;
import com.arcesium.moovitamix.load.FactLoadPolicy;
import com.arcesium.moovitamix.mybatis.WarehouseMybatisConfiguration;
import com.arcesium.moovitamix.schema.SchemaMode;
import com.arcesium.moovitamix.sql.WarehouseDataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.Locale;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.apache.ibatis.builder.xml.XMLConfigBuilder;
import org.apache.ibatis.executor.ErrorContext;
import org.apache.ibatis.io.Resources;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.defaults.DefaultSqlSessionFactory;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WarehouseEngine owns the DuckDB warehouse instance. It holds one root connection for the
 * lifetime of the engine, hands out duplicated connections through MyBatis sessions and gives
 * access to the DAOs of the load stage.
 */
public class WarehouseEngine implements AutoCloseable {
  public static final String DATABASE_PATH_PROPERTY = "moovitamix.database.path";
  public static final String SNAPSHOT_BASE_DIR_PROPERTY = "moovitamix.snapshot.base-dir";
  public static final String THREADS_PROPERTY = "moovitamix.duckdb.threads";
  public static final String MEMORY_LIMIT_PROPERTY = "moovitamix.duckdb.memory-limit-mib";
  public static final String SCHEMA_MODE_PROPERTY = "moovitamix.schema.mode";
  public static final String FACT_LOAD_POLICY_PROPERTY = "moovitamix.fact.load-policy";
  public static final String VERIFY_SAMPLE_SIZE_PROPERTY = "moovitamix.verify.sample-size";
  public static final String INSERT_BATCH_SIZE_PROPERTY = "moovitamix.load.insert-batch-size";

  private static final Logger LOGGER = LoggerFactory.getLogger(WarehouseEngine.class);
  private static final String MYBATIS_CONFIG_PATH = "dao/mybatis-config.xml";
  private final WarehouseConfiguration configuration;
  private final DuckDBConnection duckDBConnection;
  private final SqlSessionFactory sqlSessionFactory;
  private final SnapshotDao snapshotDao;
  private final SchemaDao schemaDao;
  private final LoadDao loadDao;
  private final VerificationDao verificationDao;

  private WarehouseEngine(WarehouseConfiguration configuration) {
    this.configuration = configuration;
    this.duckDBConnection = (DuckDBConnection) createDuckDBInstance();
    this.configureDuckDB();
    this.sqlSessionFactory = createSqlSessionFactory();
    this.snapshotDao = new SnapshotDao(this);
    this.schemaDao = new SchemaDao(this);
    this.loadDao = new LoadDao(this);
    this.verificationDao = new VerificationDao(this);
  }

  /**
   * Creates a new Builder with default settings: an in-memory warehouse, snapshots under {@code
   * data/raw}, destructive schema reset and replacement of the fact rows of the load date.
   *
   * @return A new Builder instance.
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Closes the root DuckDB connection. Connections handed out earlier must be closed first. */
  @Override
  public void close() {
    try {
      this.duckDBConnection.close();
      LOGGER.info("Warehouse connection closed");
    } catch (SQLException e) {
      LOGGER.error("An error occurred while closing WarehouseEngine instance.", e);
    }
  }

  public WarehouseConfiguration getConfiguration() {
    return configuration;
  }

  public Clock getClock() {
    return configuration.getClock();
  }

  public int getInsertBatchSize() {
    return configuration.getInsertBatchSize();
  }

  public SqlSessionFactory getSqlSessionFactory() {
    return sqlSessionFactory;
  }

  public SnapshotDao getSnapshotDao() {
    return snapshotDao;
  }

  public SchemaDao getSchemaDao() {
    return schemaDao;
  }

  public LoadDao getLoadDao() {
    return loadDao;
  }

  public VerificationDao getVerificationDao() {
    return verificationDao;
  }

  /**
   * Opens a session on a new warehouse connection. The session is not in auto-commit mode: its
   * writes become visible only after {@link SqlSession#commit(boolean)}. Closing the session
   * closes the connection.
   *
   * @return A new SqlSession.
   */
  public SqlSession openSession() {
    return sqlSessionFactory.openSession(false);
  }

  /**
   * Creates a new connection to the warehouse by duplicating the root connection.
   *
   * @return A new DuckDBConnection that the caller must close.
   * @throws WarehouseException if the connection cannot be created.
   */
  public DuckDBConnection createConnection() {
    try {
      synchronized (this.duckDBConnection) {
        return (DuckDBConnection) this.duckDBConnection.duplicate();
      }
    } catch (SQLException e) {
      throw new WarehouseException(e, "An exception occurred while creating new connection.");
    }
  }

  private Connection createDuckDBInstance() {
    String url = "jdbc:duckdb:";
    if (configuration.getDatabasePath() != null) {
      Path databasePath = Path.of(configuration.getDatabasePath()).toAbsolutePath();
      try {
        if (databasePath.getParent() != null) {
          Files.createDirectories(databasePath.getParent());
        }
      } catch (IOException e) {
        throw new WarehouseException(
            e, "Unable to create the directory of the warehouse file %s", databasePath);
      }
      url = url + databasePath;
    }
    try {
      Class.forName("org.duckdb.DuckDBDriver");
      Connection instance = DriverManager.getConnection(url);
      LOGGER.info("Opened warehouse {}", url);
      return instance;
    } catch (SQLException | ClassNotFoundException e) {
      throw new WarehouseException(e, "An error occurred while creating DuckDB instance.");
    }
  }

  private void configureDuckDB() {
    StringBuilder query = new StringBuilder();
    if (configuration.getThreads() != null) {
      query.append(String.format("SET GLOBAL threads TO %d;", configuration.getThreads()));
    }
    if (configuration.getMemoryLimitInMiB() != null) {
      query.append(
          String.format(
              "SET GLOBAL memory_limit='%dMiB';", configuration.getMemoryLimitInMiB()));
    }
    if (query.length() == 0) {
      return;
    }
    try (Statement stmt = duckDBConnection.createStatement()) {
      stmt.execute(query.toString());
      LOGGER.debug("DuckDB Configuration : {}", query);
    } catch (SQLException e) {
      throw new WarehouseException(e, "An error occurred while configuring DuckDB.");
    }
  }

  private SqlSessionFactory createSqlSessionFactory() {
    InputStream inputStream = null;
    try {
      inputStream = Resources.getResourceAsStream(MYBATIS_CONFIG_PATH);
      XMLConfigBuilder parser =
          new XMLConfigBuilder(WarehouseMybatisConfiguration.class, inputStream, null, null);
      WarehouseMybatisConfiguration config = (WarehouseMybatisConfiguration) parser.parse();
      config.setEnvironment(
          new Environment(
              "warehouse", new JdbcTransactionFactory(), new WarehouseDataSource(this)));
      return new DefaultSqlSessionFactory(config);
    } catch (Exception e) {
      throw new WarehouseException(e, "An error occurred while building SqlSessionFactory object.");
    } finally {
      ErrorContext.instance().reset();
      try {
        if (inputStream != null) {
          inputStream.close();
        }
      } catch (IOException e) {
        // Intentionally ignore. Prefer previous error.
      }
    }
  }

  /** Builder class for constructing WarehouseEngine instances. */
  public static class Builder {
    private final WarehouseConfiguration configuration;

    private Builder() {
      configuration = new WarehouseConfiguration();
      configuration.setSnapshotBaseDir("data/raw");
      configuration.setSchemaMode(SchemaMode.RESET);
      configuration.setFactLoadPolicy(FactLoadPolicy.REPLACE_LOAD_DATE);
      configuration.setVerifySampleSize(3);
      configuration.setInsertBatchSize(1000);
      configuration.setClock(Clock.systemDefaultZone());
    }

    /**
     * Sets the DuckDB database file. A null or blank path selects an in-memory warehouse.
     *
     * @param databasePath The database file path.
     * @return This Builder instance.
     */
    public Builder databasePath(String databasePath) {
      this.configuration.setDatabasePath(StringUtils.isBlank(databasePath) ? null : databasePath);
      return this;
    }

    /**
     * Sets the directory holding one partition directory per date.
     *
     * @param snapshotBaseDir The snapshot base directory.
     * @return This Builder instance.
     */
    public Builder snapshotBaseDir(String snapshotBaseDir) {
      ValidationException.check(
          StringUtils.isNotBlank(snapshotBaseDir), "Snapshot base directory cannot be blank.");
      this.configuration.setSnapshotBaseDir(snapshotBaseDir);
      return this;
    }

    /**
     * Sets the number of DuckDB threads.
     *
     * @param threads The number of threads, or null to keep the DuckDB default.
     * @return This Builder instance.
     */
    public Builder threads(Integer threads) {
      if (threads == null) {
        return this;
      }
      ValidationException.check(threads > 0, "Threads value must be greater than 0.");
      this.configuration.setThreads(threads);
      return this;
    }

    /**
     * Sets the DuckDB memory limit.
     *
     * @param memoryLimitInMiB The memory limit in MiB, or null to keep the DuckDB default.
     * @return This Builder instance.
     */
    public Builder memoryLimitInMiB(Integer memoryLimitInMiB) {
      if (memoryLimitInMiB == null) {
        return this;
      }
      ValidationException.check(memoryLimitInMiB > 0, "Memory limit value must be greater than 0.");
      this.configuration.setMemoryLimitInMiB(memoryLimitInMiB);
      return this;
    }

    public Builder schemaMode(SchemaMode schemaMode) {
      this.configuration.setSchemaMode(
          ValidationException.checkNotNull(schemaMode, "Schema mode cannot be null."));
      return this;
    }

    public Builder factLoadPolicy(FactLoadPolicy factLoadPolicy) {
      this.configuration.setFactLoadPolicy(
          ValidationException.checkNotNull(factLoadPolicy, "Fact load policy cannot be null."));
      return this;
    }

    public Builder verifySampleSize(int verifySampleSize) {
      ValidationException.check(
          verifySampleSize >= 0, "Verification sample size must be greater than or equal to 0.");
      this.configuration.setVerifySampleSize(verifySampleSize);
      return this;
    }

    public Builder insertBatchSize(int insertBatchSize) {
      ValidationException.check(insertBatchSize > 0, "Insert batch size must be greater than 0.");
      this.configuration.setInsertBatchSize(insertBatchSize);
      return this;
    }

    /**
     * Sets the clock used for the default run date and the ETL timestamp.
     *
     * @param clock The clock.
     * @return This Builder instance.
     */
    public Builder clock(Clock clock) {
      this.configuration.setClock(ValidationException.checkNotNull(clock, "Clock cannot be null."));
      return this;
    }

    /**
     * Applies the {@code moovitamix.*} keys present in the given properties. Absent keys keep the
     * current builder value.
     *
     * @param properties The properties to apply.
     * @return This Builder instance.
     */
    public Builder properties(Properties properties) {
      if (properties.containsKey(DATABASE_PATH_PROPERTY)) {
        databasePath(properties.getProperty(DATABASE_PATH_PROPERTY));
      }
      if (properties.containsKey(SNAPSHOT_BASE_DIR_PROPERTY)) {
        snapshotBaseDir(properties.getProperty(SNAPSHOT_BASE_DIR_PROPERTY));
      }
      threads(parseInteger(properties, THREADS_PROPERTY));
      memoryLimitInMiB(parseInteger(properties, MEMORY_LIMIT_PROPERTY));
      if (properties.containsKey(SCHEMA_MODE_PROPERTY)) {
        schemaMode(parseEnum(properties, SCHEMA_MODE_PROPERTY, SchemaMode.class));
      }
      if (properties.containsKey(FACT_LOAD_POLICY_PROPERTY)) {
        factLoadPolicy(parseEnum(properties, FACT_LOAD_POLICY_PROPERTY, FactLoadPolicy.class));
      }
      Integer sampleSize = parseInteger(properties, VERIFY_SAMPLE_SIZE_PROPERTY);
      if (sampleSize != null) {
        verifySampleSize(sampleSize);
      }
      Integer batchSize = parseInteger(properties, INSERT_BATCH_SIZE_PROPERTY);
      if (batchSize != null) {
        insertBatchSize(batchSize);
      }
      return this;
    }

    private static Integer parseInteger(Properties properties, String key) {
      String value = properties.getProperty(key);
      if (StringUtils.isBlank(value)) {
        return null;
      }
      try {
        return Integer.valueOf(value.trim());
      } catch (NumberFormatException e) {
        throw new ValidationException("Property %s must be an integer, got '%s'", key, value);
      }
    }

    private static <E extends Enum<E>> E parseEnum(
        Properties properties, String key, Class<E> enumType) {
      String value = properties.getProperty(key);
      try {
        return Enum.valueOf(enumType, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
      } catch (IllegalArgumentException e) {
        throw new ValidationException("Property %s has an unknown value '%s'", key, value);
      }
    }

    /**
     * Builds and returns a new WarehouseEngine instance.
     *
     * @return A new WarehouseEngine instance.
     */
    public WarehouseEngine build() {
      return new WarehouseEngine(configuration);
    }
  }
}
