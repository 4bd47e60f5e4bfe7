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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** The SQL produced by {@link MacroExpander} and the metrics it expanded. */
public class MacroExpansion {
  private final String sql;
  private final List<String> expandedMetrics;

  MacroExpansion(String sql, List<String> expandedMetrics) {
    this.sql = sql;
    this.expandedMetrics = ImmutableList.copyOf(expandedMetrics);
  }

  public String getSql() {
    return sql;
  }

  public List<String> getExpandedMetrics() {
    return expandedMetrics;
  }
}
