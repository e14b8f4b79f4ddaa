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
package com.arcesium.moovitamix.verify;

import com.arcesium.moovitamix.WarehouseEngine;
import com.arcesium.moovitamix.common.ValidationException;
import com.arcesium.moovitamix.dao.VerificationDao;
import com.arcesium.moovitamix.schema.WarehouseTable;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.apache.ibatis.session.SqlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs read-only sanity queries against the warehouse and logs what it finds. */
public class Verifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(Verifier.class);
  private final VerificationDao verificationDao;
  private final int sampleSize;

  public Verifier(WarehouseEngine warehouseEngine) {
    this(
        warehouseEngine.getVerificationDao(),
        warehouseEngine.getConfiguration().getVerifySampleSize());
  }

  public Verifier(VerificationDao verificationDao, int sampleSize) {
    ValidationException.check(sampleSize >= 0, "Sample size must be greater than or equal to 0.");
    this.verificationDao = verificationDao;
    this.sampleSize = sampleSize;
  }

  /**
   * Counts the rows of every warehouse table and samples the track dimension.
   *
   * @param session The session to query.
   * @return The verification report.
   * @throws VerificationException if a query fails.
   */
  public VerificationReport verify(SqlSession session) {
    return verify(session, null);
  }

  /**
   * Counts the rows of every warehouse table, the fact rows of a load date and samples the track
   * dimension.
   *
   * @param session The session to query.
   * @param loadDate The load date to count fact rows for, or null.
   * @return The verification report.
   * @throws VerificationException if a query fails.
   */
  public VerificationReport verify(SqlSession session, LocalDate loadDate) {
    VerificationReport report;
    try {
      long trackCount = verificationDao.countRows(session, WarehouseTable.DIM_TRACKS);
      long userCount = verificationDao.countRows(session, WarehouseTable.DIM_USERS);
      long historyCount = verificationDao.countRows(session, WarehouseTable.FACT_LISTEN_HISTORY);
      Long historyCountForLoadDate =
          loadDate == null
              ? null
              : verificationDao.countListenEventsForLoadDate(session, loadDate);
      List<Map<String, Object>> sampleTracks =
          sampleSize == 0
              ? List.of()
              : verificationDao.sampleRows(session, WarehouseTable.DIM_TRACKS, sampleSize);
      report =
          new VerificationReport(
              trackCount, userCount, historyCount, loadDate, historyCountForLoadDate, sampleTracks);
    } catch (RuntimeException e) {
      LOGGER.error("Error verifying data", e);
      throw new VerificationException(e, "Unable to verify warehouse data");
    }

    LOGGER.info(
        "Data verification:\nTracks: {}\nUsers: {}\nListen History: {}",
        report.getTrackCount(),
        report.getUserCount(),
        report.getHistoryCount());
    if (loadDate != null) {
      LOGGER.info(
          "Listen History for {}: {}", loadDate, report.getHistoryCountForLoadDate());
    }
    if (!report.getSampleTracks().isEmpty()) {
      LOGGER.info("Sample tracks:");
      for (Map<String, Object> track : report.getSampleTracks()) {
        LOGGER.info("{}", track);
      }
    }
    return report;
  }
}
