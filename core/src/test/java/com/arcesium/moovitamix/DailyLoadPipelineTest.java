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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.arcesium.moovitamix.common.WarehouseConfiguration;
import com.arcesium.moovitamix.common.WarehouseException;
import com.arcesium.moovitamix.load.LoadEngine;
import com.arcesium.moovitamix.load.LoadTransactionException;
import com.arcesium.moovitamix.schema.SchemaException;
import com.arcesium.moovitamix.schema.SchemaManager;
import com.arcesium.moovitamix.schema.SchemaMode;
import com.arcesium.moovitamix.verify.VerificationException;
import com.arcesium.moovitamix.verify.Verifier;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.apache.ibatis.session.SqlSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DailyLoadPipelineTest {
  private static final LocalDate DATE = LocalDate.of(2024, 12, 12);

  @Mock private WarehouseEngine mockWarehouseEngine;

  @Mock private SchemaManager mockSchemaManager;

  @Mock private LoadEngine mockLoadEngine;

  @Mock private Verifier mockVerifier;

  @Mock private SqlSession mockSqlSession;

  private DailyLoadPipeline pipeline;

  @BeforeEach
  void setUp() {
    WarehouseConfiguration configuration = new WarehouseConfiguration();
    configuration.setSchemaMode(SchemaMode.RESET);
    when(mockWarehouseEngine.getConfiguration()).thenReturn(configuration);
    pipeline =
        new DailyLoadPipeline(mockWarehouseEngine, mockSchemaManager, mockLoadEngine, mockVerifier);
  }

  @Test
  void testSuccessfulRun() {
    when(mockWarehouseEngine.openSession()).thenReturn(mockSqlSession);

    assertThat(pipeline.run(DATE)).isZero();

    InOrder inOrder = inOrder(mockSchemaManager, mockLoadEngine, mockVerifier, mockSqlSession);
    inOrder.verify(mockSchemaManager).prepare(mockSqlSession, SchemaMode.RESET);
    inOrder.verify(mockLoadEngine).load(mockSqlSession, DATE);
    inOrder.verify(mockVerifier).verify(mockSqlSession, DATE);
    inOrder.verify(mockSqlSession).close();
  }

  @Test
  void testRunDefaultsToToday() {
    when(mockWarehouseEngine.openSession()).thenReturn(mockSqlSession);
    when(mockWarehouseEngine.getClock())
        .thenReturn(Clock.fixed(Instant.parse("2024-12-12T12:00:00Z"), ZoneOffset.UTC));

    assertThat(pipeline.run()).isZero();

    verify(mockLoadEngine).load(mockSqlSession, DATE);
  }

  @Test
  void testSchemaFailure() {
    when(mockWarehouseEngine.openSession()).thenReturn(mockSqlSession);
    doThrow(new SchemaException(null, "no disk"))
        .when(mockSchemaManager)
        .prepare(mockSqlSession, SchemaMode.RESET);

    assertThat(pipeline.run(DATE)).isEqualTo(1);

    verify(mockLoadEngine, never()).load(any(), any());
    verify(mockSqlSession, times(1)).close();
  }

  @Test
  void testLoadFailure() {
    when(mockWarehouseEngine.openSession()).thenReturn(mockSqlSession);
    when(mockLoadEngine.load(mockSqlSession, DATE))
        .thenThrow(new LoadTransactionException(null, "failed"));

    assertThat(pipeline.run(DATE)).isEqualTo(1);

    verify(mockVerifier, never()).verify(any(), any());
    verify(mockSqlSession, times(1)).close();
  }

  @Test
  void testVerificationFailure() {
    when(mockWarehouseEngine.openSession()).thenReturn(mockSqlSession);
    when(mockVerifier.verify(mockSqlSession, DATE))
        .thenThrow(new VerificationException(null, "failed"));

    assertThat(pipeline.run(DATE)).isEqualTo(1);

    verify(mockSqlSession, times(1)).close();
  }

  @Test
  void testSessionCannotBeOpened() {
    when(mockWarehouseEngine.openSession())
        .thenThrow(new WarehouseException(null, "database is locked"));

    assertThat(pipeline.run(DATE)).isEqualTo(1);
    assertThat(pipeline.runVerification()).isEqualTo(1);
  }

  @Test
  void testRunVerification() {
    when(mockWarehouseEngine.openSession()).thenReturn(mockSqlSession);

    assertThat(pipeline.runVerification()).isZero();

    verify(mockVerifier).verify(mockSqlSession);
    verify(mockSqlSession).close();
    verify(mockLoadEngine, never()).load(any(), any());
  }
}
