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
package com.arcesium.moovitamix.load;

import com.arcesium.moovitamix.WarehouseEngine;
import com.arcesium.moovitamix.common.DateTimeUtil;
import com.arcesium.moovitamix.common.ValidationException;
import com.arcesium.moovitamix.dao.LoadDao;
import com.arcesium.moovitamix.schema.WarehouseTable;
import com.arcesium.moovitamix.snapshot.PartitionLayout;
import com.arcesium.moovitamix.snapshot.SnapshotEntity;
import com.arcesium.moovitamix.snapshot.SnapshotFile;
import com.arcesium.moovitamix.snapshot.SnapshotReader;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.ibatis.session.SqlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the snapshot partition of one date into the warehouse. Tracks, users and listen history
 * are loaded in that order inside one transaction that is either committed as a whole or rolled
 * back.
 */
public class LoadEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoadEngine.class);
  private final SnapshotReader snapshotReader;
  private final LoadDao loadDao;
  private final RecordMapper recordMapper;
  private final Clock clock;
  private final FactLoadPolicy factLoadPolicy;

  /**
   * Constructs a LoadEngine using the configuration and DAOs of the engine.
   *
   * @param warehouseEngine The warehouse engine.
   */
  public LoadEngine(WarehouseEngine warehouseEngine) {
    this(
        new SnapshotReader(
            new PartitionLayout(Path.of(warehouseEngine.getConfiguration().getSnapshotBaseDir())),
            warehouseEngine.getSnapshotDao()),
        warehouseEngine.getLoadDao(),
        warehouseEngine.getClock(),
        warehouseEngine.getConfiguration().getFactLoadPolicy());
  }

  public LoadEngine(
      SnapshotReader snapshotReader,
      LoadDao loadDao,
      Clock clock,
      FactLoadPolicy factLoadPolicy) {
    this.snapshotReader = snapshotReader;
    this.loadDao = loadDao;
    this.recordMapper = new RecordMapper();
    this.clock = clock;
    this.factLoadPolicy = factLoadPolicy;
  }

  public SnapshotReader getSnapshotReader() {
    return snapshotReader;
  }

  /**
   * Loads the partition of a date. A missing partition file skips its entity; any other failure
   * rolls back every change of the run.
   *
   * @param session The session to load in. It must not be in auto-commit mode.
   * @param date The partition date. Fact rows are stamped with it as their load date.
   * @return The metrics of the committed run.
   * @throws LoadTransactionException if the run fails. The transaction has been rolled back.
   */
  public LoadMetrics load(SqlSession session, LocalDate date) {
    ValidationException.checkNotNull(session, "Session cannot be null");
    ValidationException.checkNotNull(date, "Load date cannot be null");

    long startTime = System.nanoTime();
    LocalDateTime etlUpdatedAt = DateTimeUtil.nowToMicros(clock);
    Map<WarehouseTable, Long> addedRecordsCount = new EnumMap<>(WarehouseTable.class);
    Map<WarehouseTable, Long> removedRecordsCount = new EnumMap<>(WarehouseTable.class);
    List<SnapshotEntity> skippedEntities = new ArrayList<>();
    LOGGER.info("Starting data load for {}", DateTimeUtil.formatLocalDate(date));

    try {
      SnapshotFile tracks = snapshotReader.read(session, date, SnapshotEntity.TRACKS);
      if (tracks.isPresent()) {
        List<TrackRecord> records = recordMapper.toTrackRecords(tracks.getRows(), etlUpdatedAt);
        removedRecordsCount.put(
            WarehouseTable.DIM_TRACKS,
            (long) loadDao.deleteAll(session, WarehouseTable.DIM_TRACKS));
        addedRecordsCount.put(WarehouseTable.DIM_TRACKS, loadDao.insertTracks(session, records));
        LOGGER.info("Tracks loaded successfully ({} rows)", records.size());
      } else {
        skip(tracks, skippedEntities);
      }

      SnapshotFile users = snapshotReader.read(session, date, SnapshotEntity.USERS);
      if (users.isPresent()) {
        List<UserRecord> records = recordMapper.toUserRecords(users.getRows(), etlUpdatedAt);
        removedRecordsCount.put(
            WarehouseTable.DIM_USERS, (long) loadDao.deleteAll(session, WarehouseTable.DIM_USERS));
        addedRecordsCount.put(WarehouseTable.DIM_USERS, loadDao.insertUsers(session, records));
        LOGGER.info("Users loaded successfully ({} rows)", records.size());
      } else {
        skip(users, skippedEntities);
      }

      SnapshotFile history = snapshotReader.read(session, date, SnapshotEntity.LISTEN_HISTORY);
      if (history.isPresent()) {
        List<ListenEvent> events = recordMapper.toListenEvents(history.getRows(), date);
        if (factLoadPolicy == FactLoadPolicy.REPLACE_LOAD_DATE) {
          removedRecordsCount.put(
              WarehouseTable.FACT_LISTEN_HISTORY,
              (long) loadDao.deleteListenEventsForLoadDate(session, date));
        }
        addedRecordsCount.put(
            WarehouseTable.FACT_LISTEN_HISTORY, loadDao.insertListenEvents(session, events));
        LOGGER.info("Listen history loaded successfully ({} rows)", events.size());
      } else {
        skip(history, skippedEntities);
      }

      session.commit(true);
    } catch (RuntimeException e) {
      LOGGER.error("Error loading data for {}", date, e);
      LoadTransactionException loadError =
          new LoadTransactionException(e, "Unable to load data for %s", date);
      rollback(session, date, loadError);
      throw loadError;
    }

    LoadMetrics metrics =
        new LoadMetrics(
            date,
            etlUpdatedAt,
            addedRecordsCount,
            removedRecordsCount,
            skippedEntities,
            Duration.ofNanos(System.nanoTime() - startTime));
    LOGGER.info("Successfully loaded data for {}", date);
    LOGGER.debug("Load metrics {}", metrics);
    return metrics;
  }

  private static void skip(SnapshotFile file, List<SnapshotEntity> skippedEntities) {
    LOGGER.warn("{} file not found: {}", file.getEntity().getName(), file.getPath());
    skippedEntities.add(file.getEntity());
  }

  private static void rollback(
      SqlSession session, LocalDate date, LoadTransactionException loadError) {
    try {
      session.rollback(true);
      LOGGER.info("Transaction rolled back");
    } catch (RuntimeException e) {
      RollbackException rollbackError =
          new RollbackException(e, "Unable to roll back the load of %s", date);
      LOGGER.error("Error during rollback", rollbackError);
      loadError.addSuppressed(rollbackError);
    }
  }
}
