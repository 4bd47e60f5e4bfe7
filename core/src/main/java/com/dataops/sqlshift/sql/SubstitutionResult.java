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
package com.dataops.sqlshift.sql;

import com.dataops.sqlshift.model.SubstitutionRule;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.sf.jsqlparser.statement.Statement;

/** Output of {@link TableSubstitutionPass}. */
public class SubstitutionResult {
  private final String sql;
  private final List<SubstitutionRule> appliedRules;
  private final List<Statement> statements;
  private final int rewriteCount;

  SubstitutionResult(
      String sql,
      List<SubstitutionRule> appliedRules,
      List<Statement> statements,
      int rewriteCount) {
    this.sql = sql;
    this.appliedRules = ImmutableList.copyOf(appliedRules);
    this.statements = statements;
    this.rewriteCount = rewriteCount;
  }

  public String getSql() {
    return sql;
  }

  /**
   * Gets the rules that rewrote at least one reference, in the order they were first applied.
   *
   * @return The applied rules.
   */
  public List<SubstitutionRule> getAppliedRules() {
    return appliedRules;
  }

  /**
   * Gets the statements after substitution, for the warning scan.
   *
   * @return The statements.
   */
  public List<Statement> getStatements() {
    return statements;
  }

  public int getRewriteCount() {
    return rewriteCount;
  }

  public boolean isChanged() {
    return rewriteCount > 0;
  }
}
