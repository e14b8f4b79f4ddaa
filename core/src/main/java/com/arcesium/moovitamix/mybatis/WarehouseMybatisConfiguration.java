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
package com.arcesium.moovitamix.mybatis;

import com.arcesium.moovitamix.mybatis.type.LocalDateTimeTypeHandler;
import com.arcesium.moovitamix.mybatis.type.LocalDateTypeHandler;
import org.apache.ibatis.session.Configuration;

/**
 * MyBatis configuration of the warehouse. Registers the java.time type handlers that bind values
 * the way the DuckDB JDBC driver expects them.
 */
public class WarehouseMybatisConfiguration extends Configuration {

  public WarehouseMybatisConfiguration() {
    super();
    this.getTypeHandlerRegistry().register(LocalDateTypeHandler.class);
    this.getTypeHandlerRegistry().register(LocalDateTimeTypeHandler.class);
  }
}
