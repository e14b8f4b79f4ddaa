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
package com.arcesium.moovitamix.snapshot;

import com.arcesium.moovitamix.common.WarehouseException;
import com.google.errorprone.annotations.FormatMethod;

/** Thrown when a snapshot file exists but cannot be decoded or lacks required columns. */
public class SnapshotReadException extends WarehouseException {
  @FormatMethod
  public SnapshotReadException(Throwable cause, String message, Object... args) {
    super(cause, message, args);
  }

  public SnapshotReadException(Throwable cause, String message) {
    super(cause, message);
  }
}
