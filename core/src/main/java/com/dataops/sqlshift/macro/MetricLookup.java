/*
 * Copyright (c) 2025, The SqlShift Authors. All rights reserved.
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
package com.dataops.sqlshift.macro;

import com.dataops.sqlshift.model.MetricDefinition;

/** Resolves a metric name to its definition during macro expansion. */
@FunctionalInterface
public interface MetricLookup {
  /**
   * Looks up a metric.
   *
   * @param name The case-sensitive metric name.
   * @return The definition, or null if the metric does not exist.
   */
  MetricDefinition lookup(String name);
}
