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
package com.dataops.sqlshift.provider;

import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.model.MetricDefinition;
import com.dataops.sqlshift.model.RuleSet;

/**
 * Source of substitution rules and metric definitions. Implementations may perform I/O; callers
 * treat every failure as a {@link TranspileException}.
 */
public interface RuleProvider {
  /**
   * Fetches the current substitution rules.
   *
   * @return The rules in provider order, with their version tag.
   * @throws TranspileException of kind RULE_FETCH if the rules cannot be fetched or are malformed.
   */
  RuleSet fetchRules();

  /**
   * Fetches a metric definition by name.
   *
   * @param name The case-sensitive metric name.
   * @return The definition.
   * @throws TranspileException of kind METRIC_NOT_FOUND if no such metric exists, or RULE_FETCH if
   *     the lookup itself failed.
   */
  MetricDefinition fetchMetric(String name);
}
