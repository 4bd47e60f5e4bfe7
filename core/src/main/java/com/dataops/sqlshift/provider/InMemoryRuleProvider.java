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

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.MetricDefinition;
import com.dataops.sqlshift.model.RuleSet;
import com.dataops.sqlshift.model.SubstitutionRule;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A {@link RuleProvider} over fixed rules and metrics, with no I/O. */
public class InMemoryRuleProvider implements RuleProvider {
  private final RuleSet ruleSet;
  private final Map<String, MetricDefinition> metrics;

  private InMemoryRuleProvider(Builder builder) {
    this.ruleSet = new RuleSet(builder.rules.build(), builder.version);
    this.metrics = ImmutableMap.copyOf(builder.metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public RuleSet fetchRules() {
    return ruleSet;
  }

  @Override
  public MetricDefinition fetchMetric(String name) {
    MetricDefinition definition = metrics.get(name);
    if (definition == null) {
      String available = metrics.isEmpty() ? "none" : String.join(", ", metrics.keySet());
      throw new TranspileException(
          ErrorKind.METRIC_NOT_FOUND,
          String.format("Metric '%s' not found. Available metrics: %s", name, available),
          name,
          null);
    }
    return definition;
  }

  /** Builder for {@link InMemoryRuleProvider}. */
  public static class Builder {
    private final ImmutableList.Builder<SubstitutionRule> rules = ImmutableList.builder();
    private final Map<String, MetricDefinition> metrics = new LinkedHashMap<>();
    private String version;

    private Builder() {}

    public Builder addRule(SubstitutionRule rule) {
      rules.add(ValidationException.checkNotNull(rule, "Rule cannot be null"));
      return this;
    }

    public Builder addRules(List<SubstitutionRule> rules) {
      rules.forEach(this::addRule);
      return this;
    }

    /**
     * Adds a rule with default priority.
     *
     * @param source The source table identifier.
     * @param target The target table identifier.
     * @return This Builder instance.
     */
    public Builder addRule(String source, String target) {
      return addRule(SubstitutionRule.builder(source, target).build());
    }

    public Builder addMetric(MetricDefinition metric) {
      ValidationException.checkNotNull(metric, "Metric cannot be null");
      ValidationException.check(
          !metrics.containsKey(metric.getName()), "Duplicate metric %s", metric.getName());
      metrics.put(metric.getName(), metric);
      return this;
    }

    public Builder addMetric(String name, String expression) {
      return addMetric(MetricDefinition.builder(name, expression).build());
    }

    public Builder version(String version) {
      this.version = version;
      return this;
    }

    public InMemoryRuleProvider build() {
      return new InMemoryRuleProvider(this);
    }
  }
}
