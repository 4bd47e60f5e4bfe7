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

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.model.Dialect;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parses SQL text with the options of a target dialect. */
public class SqlParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqlParser.class);

  /**
   * Parses one or more semicolon-separated statements.
   *
   * @param sql The SQL text.
   * @param dialect The dialect whose lexical rules apply.
   * @return The parsed statements.
   * @throws TranspileException of kind PARSE carrying the parser diagnostic.
   */
  public ParsedSql parse(String sql, Dialect dialect) {
    try {
      Statements statements = parseStatements(sql, dialect);
      LOGGER.debug("Parsed {} statements for {}", statements.getStatements().size(), dialect);
      return new ParsedSql(sql, dialect, statements.getStatements());
    } catch (JSQLParserException ex) {
      String diagnostic = diagnostic(ex);
      throw new TranspileException(
          ErrorKind.PARSE,
          "Failed to parse SQL for " + dialect + ": " + diagnostic,
          diagnostic,
          ex);
    }
  }

  /**
   * Checks SQL for syntax errors without transforming it.
   *
   * @param sql The SQL text.
   * @param dialect The dialect whose lexical rules apply.
   * @return The parser diagnostics; empty if the SQL parses.
   */
  public List<String> validate(String sql, Dialect dialect) {
    try {
      parseStatements(sql, dialect);
      return ImmutableList.of();
    } catch (JSQLParserException ex) {
      LOGGER.debug("SQL failed validation for {}", dialect, ex);
      return ImmutableList.of(diagnostic(ex));
    }
  }

  private static Statements parseStatements(String sql, Dialect dialect)
      throws JSQLParserException {
    return CCJSqlParserUtil.parseStatements(
        sql, parser -> parser.withBackslashEscapeCharacter(dialect.usesBackslashEscapes()));
  }

  private static String diagnostic(JSQLParserException ex) {
    if (ex.getMessage() != null) {
      return ex.getMessage();
    }
    return ex.getCause() != null ? String.valueOf(ex.getCause().getMessage()) : ex.toString();
  }
}
