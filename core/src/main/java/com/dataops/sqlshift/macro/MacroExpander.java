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

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.model.MetricDefinition;
import com.dataops.sqlshift.model.SourceLocation;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a {@code METRIC(name)} call with the SQL expression of the named metric.
 *
 * <p>The expression is inserted verbatim, so a definition that needs grouping carries its own
 * parentheses. Expansion is textual and happens before parsing, so calls inside string literals
 * or comments are expanded too. A query may contain at most one call.
 */
public class MacroExpander {
  private static final Logger LOGGER = LoggerFactory.getLogger(MacroExpander.class);
  private static final Pattern METRIC_CALL =
      Pattern.compile(
          "\\bMETRIC\\s*\\(\\s*(?:'([^']+)'|\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))\\s*\\)",
          Pattern.CASE_INSENSITIVE);

  /** The maximum number of METRIC() calls in one query. */
  public static final int MAX_MACROS = 1;

  /**
   * Finds every METRIC() call in the SQL text, in order of appearance.
   *
   * @param sql The SQL text.
   * @return The calls found.
   */
  public List<MacroMatch> findMacros(String sql) {
    List<MacroMatch> matches = new ArrayList<>();
    Matcher matcher = METRIC_CALL.matcher(sql);
    while (matcher.find()) {
      String name = matcher.group(1);
      if (name == null) {
        name = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
      }
      matches.add(
          new MacroMatch(
              name,
              matcher.group(),
              matcher.start(),
              matcher.end(),
              SourceLocation.ofOffset(sql, matcher.start())));
    }
    return matches;
  }

  /**
   * Expands the METRIC() call in the SQL text, if any.
   *
   * @param sql The SQL text.
   * @param lookup Resolves metric names to definitions.
   * @return The expanded SQL and the names of the expanded metrics.
   * @throws TranspileException of kind MACRO_LIMIT_EXCEEDED if the SQL has more than one call, or
   *     METRIC_NOT_FOUND if the metric is unknown. Exceptions thrown by the lookup propagate.
   */
  public MacroExpansion expand(String sql, MetricLookup lookup) {
    List<MacroMatch> matches = findMacros(sql);
    if (matches.isEmpty()) {
      return new MacroExpansion(sql, ImmutableList.of());
    }
    if (matches.size() > MAX_MACROS) {
      MacroMatch extra = matches.get(MAX_MACROS);
      throw new TranspileException(
          ErrorKind.MACRO_LIMIT_EXCEEDED,
          String.format(
              "Found %d METRIC() calls but at most %d is allowed per query; extra call %s",
              matches.size(),
              MAX_MACROS,
              extra),
          extra.getMetricName(),
          null);
    }

    MacroMatch match = matches.get(0);
    MetricDefinition definition = lookup.lookup(match.getMetricName());
    if (definition == null) {
      throw new TranspileException(
          ErrorKind.METRIC_NOT_FOUND,
          String.format("Metric '%s' not found at %s", match.getMetricName(), match.getLocation()),
          match.getMetricName(),
          null);
    }
    LOGGER.debug("Expanding {} into {}", match.getText(), definition.getExpression());
    String expanded =
        sql.substring(0, match.getStart())
            + definition.getExpression()
            + sql.substring(match.getEnd());
    return new MacroExpansion(expanded, ImmutableList.of(match.getMetricName()));
  }
}
