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
import java.util.Objects;

/** A named SQL expression that a {@code METRIC(name)} call expands into. */
public class MetricDefinition {
  private final String name;
  private final String expression;
  private final List<String> dependencies;
  private final String description;

  private MetricDefinition(
      String name, String expression, List<String> dependencies, String description) {
    this.name = name;
    this.expression = expression;
    this.dependencies = dependencies;
    this.description = description;
  }

  public static Builder builder(String name, String expression) {
    return new Builder(name, expression);
  }

  /**
   * Gets the metric name. Lookups by name are case-sensitive.
   *
   * @return The metric name.
   */
  public String getName() {
    return name;
  }

  public String getExpression() {
    return expression;
  }

  /**
   * Gets the upstream tables the expression reads from.
   *
   * @return An immutable list of table identifiers.
   */
  public List<String> getDependencies() {
    return dependencies;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricDefinition that = (MetricDefinition) o;
    return name.equals(that.name)
        && expression.equals(that.expression)
        && dependencies.equals(that.dependencies)
        && Objects.equals(description, that.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, expression, dependencies, description);
  }

  @Override
  public String toString() {
    return "MetricDefinition{name='" + name + "', expression='" + expression + "'}";
  }

  /** Builder for {@link MetricDefinition}. */
  public static class Builder {
    private final String name;
    private final String expression;
    private final ImmutableList.Builder<String> dependencies = ImmutableList.builder();
    private String description;

    private Builder(String name, String expression) {
      this.name = ValidationException.checkNotBlank(name, "Metric name cannot be blank");
      this.expression =
          ValidationException.checkNotBlank(
              expression, "Expression of metric %s cannot be blank", name);
    }

    public Builder dependency(String table) {
      this.dependencies.add(
          ValidationException.checkNotBlank(table, "Dependency of metric %s is blank", name));
      return this;
    }

    public Builder dependencies(List<String> tables) {
      if (tables != null) {
        tables.forEach(this::dependency);
      }
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public MetricDefinition build() {
      return new MetricDefinition(name, expression.trim(), dependencies.build(), description);
    }
  }
}
