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

import com.arcesium.moovitamix.common.DateTimeUtil;
import com.arcesium.moovitamix.common.ValidationException;
import com.arcesium.moovitamix.common.WarehouseException;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point of the daily load.
 *
 * <pre>
 * DailyLoadApplication [yyyy-MM-dd] [--verify-only]
 * </pre>
 *
 * Configuration is read from the {@code moovitamix.properties} classpath resource; system
 * properties with the same keys take precedence.
 */
public class DailyLoadApplication {
  private static final Logger LOGGER = LoggerFactory.getLogger(DailyLoadApplication.class);
  private static final String PROPERTIES_RESOURCE = "moovitamix.properties";
  private static final String VERIFY_ONLY_OPTION = "--verify-only";

  private DailyLoadApplication() {}

  public static void main(String[] args) {
    System.exit(execute(args, loadProperties()));
  }

  /**
   * Runs the daily load with the given arguments and configuration.
   *
   * @param args The command line arguments.
   * @param properties The configuration.
   * @return The exit status, 0 on success and 1 on any failure.
   */
  public static int execute(String[] args, Properties properties) {
    LocalDate date = null;
    boolean verifyOnly = false;
    try {
      for (String arg : args) {
        if (VERIFY_ONLY_OPTION.equals(arg)) {
          verifyOnly = true;
        } else if (arg.startsWith("--")) {
          throw new ValidationException("Unknown option %s", arg);
        } else if (date == null) {
          date = DateTimeUtil.parseLocalDate(arg);
        } else {
          throw new ValidationException("Unexpected argument %s", arg);
        }
      }
    } catch (ValidationException e) {
      LOGGER.error("Usage: DailyLoadApplication [yyyy-MM-dd] [{}]", VERIFY_ONLY_OPTION, e);
      return 1;
    }

    try (WarehouseEngine warehouseEngine =
        WarehouseEngine.builder().properties(properties).build()) {
      DailyLoadPipeline pipeline = new DailyLoadPipeline(warehouseEngine);
      if (verifyOnly) {
        return pipeline.runVerification();
      }
      return date == null ? pipeline.run() : pipeline.run(date);
    } catch (RuntimeException e) {
      LOGGER.error("Error in main", e);
      return 1;
    }
  }

  static Properties loadProperties() {
    Properties properties = new Properties();
    try (InputStream inputStream =
        DailyLoadApplication.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
      if (inputStream != null) {
        properties.load(inputStream);
      }
    } catch (IOException e) {
      throw new WarehouseException(e, "Unable to read %s", PROPERTIES_RESOURCE);
    }
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith("moovitamix.")) {
        properties.setProperty(key, System.getProperty(key));
      }
    }
    return properties;
  }
}
