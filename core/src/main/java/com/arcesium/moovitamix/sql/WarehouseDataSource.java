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
package com.arcesium.moovitamix.sql;

import com.arcesium.moovitamix.WarehouseEngine;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.logging.Logger;
import javax.sql.DataSource;
import org.slf4j.LoggerFactory;

/**
 * DataSource handing out connections to the warehouse of a {@link WarehouseEngine}. Every
 * connection is a duplicate of the engine's root DuckDB connection and must be closed by its user.
 *
 * <p>An embedded DuckDB database has no credentials and no login step, so the login timeout is
 * only recorded. Diagnostics go through SLF4J; a log writer, when set, is kept for callers that
 * ask for it back.
 */
public class WarehouseDataSource implements DataSource {
  private static final org.slf4j.Logger LOGGER =
      LoggerFactory.getLogger(WarehouseDataSource.class);
  private final WarehouseEngine warehouseEngine;
  private volatile PrintWriter logWriter;
  private volatile int loginTimeoutSeconds;

  public WarehouseDataSource(WarehouseEngine warehouseEngine) {
    this.warehouseEngine = warehouseEngine;
  }

  public WarehouseEngine getWarehouseEngine() {
    return warehouseEngine;
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection connection = warehouseEngine.createConnection();
    LOGGER.debug("Opened warehouse connection {}", connection);
    return connection;
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    throw new SQLFeatureNotSupportedException(
        "The embedded warehouse has no users; use getConnection()");
  }

  @Override
  public PrintWriter getLogWriter() {
    return logWriter;
  }

  @Override
  public void setLogWriter(PrintWriter out) {
    this.logWriter = out;
  }

  @Override
  public void setLoginTimeout(int seconds) throws SQLException {
    if (seconds < 0) {
      throw new SQLException("Login timeout cannot be negative: " + seconds);
    }
    this.loginTimeoutSeconds = seconds;
  }

  @Override
  public int getLoginTimeout() {
    return loginTimeoutSeconds;
  }

  @Override
  public Logger getParentLogger() throws SQLFeatureNotSupportedException {
    throw new SQLFeatureNotSupportedException("Warehouse logging goes through SLF4J");
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (isWrapperFor(iface)) {
      return iface.cast(this);
    }
    throw new SQLException(getClass().getSimpleName() + " does not implement " + iface.getName());
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return iface != null && iface.isInstance(this);
  }
}
