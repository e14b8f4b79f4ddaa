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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.arcesium.moovitamix.WarehouseEngine;
import com.arcesium.moovitamix.schema.WarehouseTable;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.ibatis.session.SqlSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VerificationDaoTest {

  @Mock private WarehouseEngine mockWarehouseEngine;

  @Mock private SqlSession mockSqlSession;

  private VerificationDao verificationDao;

  @BeforeEach
  void setUp() {
    verificationDao = new VerificationDao(mockWarehouseEngine);
  }

  @Test
  void testCountRows() {
    when(mockSqlSession.selectOne("Verification.countRows", Map.of("table", "dim_tracks")))
        .thenReturn(12L);

    assertThat(verificationDao.countRows(mockSqlSession, WarehouseTable.DIM_TRACKS))
        .isEqualTo(12L);
  }

  @Test
  void testCountRowsWithoutResult() {
    assertThat(verificationDao.countRows(mockSqlSession, WarehouseTable.DIM_USERS)).isZero();
  }

  @Test
  void testCountListenEventsForLoadDate() {
    LocalDate date = LocalDate.of(2024, 12, 12);
    when(mockSqlSession.selectOne(
            "Verification.countListenEventsForLoadDate", Map.of("loadDate", date)))
        .thenReturn(3L);

    assertThat(verificationDao.countListenEventsForLoadDate(mockSqlSession, date)).isEqualTo(3L);
  }

  @Test
  void testSampleRows() {
    Map<String, Object> params = new HashMap<>();
    params.put("table", "dim_tracks");
    params.put("orderBy", "track_id");
    params.put("limit", 3);
    List<Map<String, Object>> rows = List.of(Map.of("track_id", 1));
    when(mockSqlSession.<Map<String, Object>>selectList("Verification.sampleRows", params))
        .thenReturn(rows);

    assertThat(verificationDao.sampleRows(mockSqlSession, WarehouseTable.DIM_TRACKS, 3))
        .isEqualTo(rows);
  }
}
