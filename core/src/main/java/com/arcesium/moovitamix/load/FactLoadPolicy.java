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

/** Controls what happens to fact rows already stored for the load date of a run. */
public enum FactLoadPolicy {
  /** Insert the new fact rows next to any rows already stored for the same load date. */
  APPEND,
  /** Delete the fact rows stored for the load date before inserting the new ones. */
  REPLACE_LOAD_DATE
}
