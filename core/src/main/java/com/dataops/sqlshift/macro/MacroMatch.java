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

import com.dataops.sqlshift.model.SourceLocation;

/** One {@code METRIC(name)} call found in SQL text. */
public class MacroMatch {
  private final String metricName;
  private final String text;
  private final int start;
  private final int end;
  private final SourceLocation location;

  MacroMatch(String metricName, String text, int start, int end, SourceLocation location) {
    this.metricName = metricName;
    this.text = text;
    this.start = start;
    this.end = end;
    this.location = location;
  }

  public String getMetricName() {
    return metricName;
  }

  /**
   * Gets the matched call exactly as written.
   *
   * @return The call text.
   */
  public String getText() {
    return text;
  }

  /** Offset of the first character of the call. */
  public int getStart() {
    return start;
  }

  /** Offset just past the last character of the call. */
  public int getEnd() {
    return end;
  }

  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return text + " at " + location;
  }
}
