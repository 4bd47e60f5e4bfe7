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
package com.dataops.sqlshift.template;

import com.dataops.sqlshift.common.ValidationException;
import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Values for the placeholders recognized by {@link TemplateRenderer}: the execution date, named
 * references to other datasets and named variables.
 */
public class TemplateContext {
  private static final TemplateContext EMPTY = builder().build();

  private final LocalDate executionDate;
  private final Map<String, String> variables;
  private final Map<String, String> refs;

  private TemplateContext(Builder builder) {
    this.executionDate = builder.executionDate;
    this.variables = ImmutableMap.copyOf(builder.variables);
    this.refs = ImmutableMap.copyOf(builder.refs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets a context with no variables, no references and the renderer's current date.
   *
   * @return The empty context.
   */
  public static TemplateContext empty() {
    return EMPTY;
  }

  /**
   * Gets the execution date.
   *
   * @return The date, or null to use the renderer's current date.
   */
  public LocalDate getExecutionDate() {
    return executionDate;
  }

  public Map<String, String> getVariables() {
    return variables;
  }

  public Map<String, String> getRefs() {
    return refs;
  }

  /** Builder for {@link TemplateContext}. */
  public static class Builder {
    private LocalDate executionDate;
    private final Map<String, String> variables = new HashMap<>();
    private final Map<String, String> refs = new HashMap<>();

    private Builder() {}

    public Builder executionDate(LocalDate executionDate) {
      this.executionDate = executionDate;
      return this;
    }

    public Builder variable(String name, String value) {
      ValidationException.checkNotBlank(name, "Variable name cannot be blank");
      ValidationException.checkNotNull(value, "Value of variable %s cannot be null", name);
      variables.put(name, value);
      return this;
    }

    public Builder variables(Map<String, String> variables) {
      variables.forEach(this::variable);
      return this;
    }

    /**
     * Registers the table a {@code ref('name')} placeholder resolves to.
     *
     * @param name The dataset name used in the placeholder.
     * @param table The table identifier written into the SQL.
     * @return This Builder instance.
     */
    public Builder ref(String name, String table) {
      ValidationException.checkNotBlank(name, "Reference name cannot be blank");
      ValidationException.checkNotBlank(
          table, "Reference %s cannot resolve to a blank table", name);
      refs.put(name, table);
      return this;
    }

    public Builder refs(Map<String, String> refs) {
      refs.forEach(this::ref);
      return this;
    }

    public TemplateContext build() {
      return new TemplateContext(this);
    }
  }
}
