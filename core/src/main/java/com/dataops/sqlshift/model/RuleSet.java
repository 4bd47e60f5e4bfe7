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
package com.dataops.sqlshift.model;

import com.dataops.sqlshift.common.ValidationException;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A consistent snapshot of substitution rules as returned by a rule provider, tagged with the
 * version that produced it. Rules keep the provider's order, which breaks priority ties.
 */
public class RuleSet {
  private final List<SubstitutionRule> rules;
  private final String version;

  public RuleSet(List<SubstitutionRule> rules, String version) {
    ValidationException.checkNotNull(rules, "Rules cannot be null");
    this.rules = ImmutableList.copyOf(rules);
    this.version = version;
  }

  public static RuleSet empty(String version) {
    return new RuleSet(ImmutableList.of(), version);
  }

  public List<SubstitutionRule> getRules() {
    return rules;
  }

  /**
   * Gets the version tag of this snapshot.
   *
   * @return The version, or null if the provider does not version its rules.
   */
  public String getVersion() {
    return version;
  }

  @Override
  public String toString() {
    return "RuleSet{version='" + version + "', rules=" + rules.size() + '}';
  }
}
