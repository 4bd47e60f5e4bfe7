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
import java.util.Objects;

/**
 * A directive that rewrites references to one table into references to another. When several
 * enabled rules match the same reference, the highest {@link #getPriority() priority} wins and
 * equal priorities fall back to the order in which the provider returned the rules.
 */
public class SubstitutionRule {
  private final String id;
  private final QualifiedName source;
  private final QualifiedName target;
  private final int priority;
  private final boolean enabled;
  private final String description;

  private SubstitutionRule(Builder builder) {
    this.id = builder.id;
    this.source = builder.source;
    this.target = builder.target;
    this.priority = builder.priority;
    this.enabled = builder.enabled;
    this.description = builder.description;
  }

  /**
   * Creates a builder for a rule rewriting {@code source} to {@code target}.
   *
   * @param source The source table identifier, optionally catalog-qualified.
   * @param target The target table identifier.
   * @return A new Builder instance.
   */
  public static Builder builder(String source, String target) {
    return new Builder(source, target);
  }

  public String getId() {
    return id;
  }

  public QualifiedName getSource() {
    return source;
  }

  public QualifiedName getTarget() {
    return target;
  }

  public int getPriority() {
    return priority;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Checks whether this rule applies to a table reference.
   *
   * @param reference The fully qualified form of the reference, using whatever qualification was
   *     present in the SQL.
   * @return true if the rule is enabled and its source matches the trailing parts of the reference.
   */
  public boolean matches(QualifiedName reference) {
    return enabled && reference.endsWith(source);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SubstitutionRule that = (SubstitutionRule) o;
    return priority == that.priority
        && enabled == that.enabled
        && Objects.equals(id, that.id)
        && source.equals(that.source)
        && target.equals(that.target)
        && Objects.equals(description, that.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, source, target, priority, enabled, description);
  }

  @Override
  public String toString() {
    return "SubstitutionRule{"
        + "id='"
        + id
        + '\''
        + ", source="
        + source
        + ", target="
        + target
        + ", priority="
        + priority
        + ", enabled="
        + enabled
        + '}';
  }

  /** Builder for {@link SubstitutionRule}. */
  public static class Builder {
    private static final int MAX_PARTS = 3;
    private String id;
    private final QualifiedName source;
    private final QualifiedName target;
    private int priority;
    private boolean enabled = true;
    private String description;

    private Builder(String source, String target) {
      this.source = QualifiedName.parse(source);
      this.target = QualifiedName.parse(target);
      ValidationException.check(
          this.source.size() <= MAX_PARTS,
          "Rule source %s has more than %s parts",
          source,
          MAX_PARTS);
      ValidationException.check(
          this.target.size() <= MAX_PARTS,
          "Rule target %s has more than %s parts",
          target,
          MAX_PARTS);
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    /**
     * Builds the rule. Rules without an explicit id are identified by their source.
     *
     * @return A new SubstitutionRule instance.
     */
    public SubstitutionRule build() {
      if (id == null) {
        id = source.toString();
      }
      return new SubstitutionRule(this);
    }
  }
}
