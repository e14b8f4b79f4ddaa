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

import java.time.LocalDateTime;

/** A row of the {@code dim_tracks} dimension. */
public class TrackRecord {
  private final Integer trackId;
  private final String name;
  private final String artist;
  private final String songwriters;
  private final String duration;
  private final String genres;
  private final String album;
  private final LocalDateTime createdAt;
  private final LocalDateTime updatedAt;
  private final LocalDateTime etlUpdatedAt;

  public TrackRecord(
      Integer trackId,
      String name,
      String artist,
      String songwriters,
      String duration,
      String genres,
      String album,
      LocalDateTime createdAt,
      LocalDateTime updatedAt,
      LocalDateTime etlUpdatedAt) {
    this.trackId = trackId;
    this.name = name;
    this.artist = artist;
    this.songwriters = songwriters;
    this.duration = duration;
    this.genres = genres;
    this.album = album;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
    this.etlUpdatedAt = etlUpdatedAt;
  }

  public Integer getTrackId() {
    return trackId;
  }

  public String getName() {
    return name;
  }

  public String getArtist() {
    return artist;
  }

  public String getSongwriters() {
    return songwriters;
  }

  public String getDuration() {
    return duration;
  }

  public String getGenres() {
    return genres;
  }

  public String getAlbum() {
    return album;
  }

  public LocalDateTime getCreatedAt() {
    return createdAt;
  }

  public LocalDateTime getUpdatedAt() {
    return updatedAt;
  }

  public LocalDateTime getEtlUpdatedAt() {
    return etlUpdatedAt;
  }

  @Override
  public String toString() {
    return "TrackRecord{"
        + "trackId="
        + trackId
        + ", name='"
        + name
        + '\''
        + ", artist='"
        + artist
        + '\''
        + ", album='"
        + album
        + '\''
        + ", updatedAt="
        + updatedAt
        + ", etlUpdatedAt="
        + etlUpdatedAt
        + '}';
  }
}
