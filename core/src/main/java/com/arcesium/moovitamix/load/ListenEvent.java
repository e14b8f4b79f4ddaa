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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A row of the {@code fact_listen_history} fact table: one track played by one user. The track is
 * not checked against {@code dim_tracks}.
 */
public class ListenEvent {
  private final Integer userId;
  private final Integer trackId;
  private final LocalDateTime listenedAt;
  private final LocalDate loadDate;

  public ListenEvent(
      Integer userId, Integer trackId, LocalDateTime listenedAt, LocalDate loadDate) {
    this.userId = userId;
    this.trackId = trackId;
    this.listenedAt = listenedAt;
    this.loadDate = loadDate;
  }

  public Integer getUserId() {
    return userId;
  }

  public Integer getTrackId() {
    return trackId;
  }

  public LocalDateTime getListenedAt() {
    return listenedAt;
  }

  public LocalDate getLoadDate() {
    return loadDate;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ListenEvent that)) {
      return false;
    }
    return Objects.equals(userId, that.userId)
        && Objects.equals(trackId, that.trackId)
        && Objects.equals(listenedAt, that.listenedAt)
        && Objects.equals(loadDate, that.loadDate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(userId, trackId, listenedAt, loadDate);
  }

  @Override
  public String toString() {
    return "ListenEvent{"
        + "userId="
        + userId
        + ", trackId="
        + trackId
        + ", listenedAt="
        + listenedAt
        + ", loadDate="
        + loadDate
        + '}';
  }
}
