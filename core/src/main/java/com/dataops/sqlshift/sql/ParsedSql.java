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

import com.dataops.sqlshift.model.Dialect;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.sf.jsqlparser.statement.Statement;

/** SQL text together with the statements parsed from it. */
public class ParsedSql {
  static final String STATEMENT_SEPARATOR = ";\n";

  private final String sql;
  private final Dialect dialect;
  private final List<Statement> statements;

  ParsedSql(String sql, Dialect dialect, List<Statement> statements) {
    this.sql = sql;
    this.dialect = dialect;
    this.statements = ImmutableList.copyOf(statements);
  }

  public String getSql() {
    return sql;
  }

  public Dialect getDialect() {
    return dialect;
  }

  /**
   * Gets the parsed statements in source order. The statements are mutable AST nodes shared with
   * this instance.
   *
   * @return The statements.
   */
  public List<Statement> getStatements() {
    return statements;
  }

  /**
   * Renders the current state of the statements back to SQL text.
   *
   * @return The rendered SQL, one statement per line separated by semicolons.
   */
  public String render() {
    return statements.stream()
        .map(Statement::toString)
        .collect(Collectors.joining(STATEMENT_SEPARATOR));
  }
}
