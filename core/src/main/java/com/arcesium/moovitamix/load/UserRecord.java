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

/** A row of the {@code dim_users} dimension. */
public class UserRecord {
  private final Integer userId;
  private final String firstName;
  private final String lastName;
  private final String email;
  private final String gender;
  private final String favoriteGenres;
  private final LocalDateTime createdAt;
  private final LocalDateTime updatedAt;
  private final LocalDateTime etlUpdatedAt;

  public UserRecord(
      Integer userId,
      String firstName,
      String lastName,
      String email,
      String gender,
      String favoriteGenres,
      LocalDateTime createdAt,
      LocalDateTime updatedAt,
      LocalDateTime etlUpdatedAt) {
    this.userId = userId;
    this.firstName = firstName;
    this.lastName = lastName;
    this.email = email;
    this.gender = gender;
    this.favoriteGenres = favoriteGenres;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
    this.etlUpdatedAt = etlUpdatedAt;
  }

  public Integer getUserId() {
    return userId;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getEmail() {
    return email;
  }

  public String getGender() {
    return gender;
  }

  public String getFavoriteGenres() {
    return favoriteGenres;
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
    return "UserRecord{"
        + "userId="
        + userId
        + ", firstName='"
        + firstName
        + '\''
        + ", lastName='"
        + lastName
        + '\''
        + ", updatedAt="
        + updatedAt
        + ", etlUpdatedAt="
        + etlUpdatedAt
        + '}';
  }
}
