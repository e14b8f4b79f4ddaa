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

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** Row counts of the warehouse tables and a sample of the track dimension. */
public class VerificationReport {
  private final long trackCount;
  private final long userCount;
  private final long historyCount;
  private final LocalDate loadDate;
  private final Long historyCountForLoadDate;
  private final List<Map<String, Object>> sampleTracks;

  public VerificationReport(
      long trackCount,
      long userCount,
      long historyCount,
      LocalDate loadDate,
      Long historyCountForLoadDate,
      List<Map<String, Object>> sampleTracks) {
    this.trackCount = trackCount;
    this.userCount = userCount;
    this.historyCount = historyCount;
    this.loadDate = loadDate;
    this.historyCountForLoadDate = historyCountForLoadDate;
    this.sampleTracks = List.copyOf(sampleTracks);
  }

  public long getTrackCount() {
    return trackCount;
  }

  public long getUserCount() {
    return userCount;
  }

  public long getHistoryCount() {
    return historyCount;
  }

  /** Returns the load date the report was requested for, or null for a whole-warehouse report. */
  public LocalDate getLoadDate() {
    return loadDate;
  }

  /** Returns the number of fact rows of {@link #getLoadDate()}, or null when no date was given. */
  public Long getHistoryCountForLoadDate() {
    return historyCountForLoadDate;
  }

  public List<Map<String, Object>> getSampleTracks() {
    return sampleTracks;
  }

  @Override
  public String toString() {
    return "VerificationReport{"
        + "trackCount="
        + trackCount
        + ", userCount="
        + userCount
        + ", historyCount="
        + historyCount
        + ", loadDate="
        + loadDate
        + ", historyCountForLoadDate="
        + historyCountForLoadDate
        + ", sampleTracks="
        + sampleTracks.size()
        + '}';
  }
}
