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

import com.dataops.sqlshift.model.Warning;
import com.dataops.sqlshift.model.WarningKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.drop.Drop;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.truncate.Truncate;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans parsed statements for risky patterns.
 *
 * <p>The scan only reads the AST, so text inside string literals and comments never produces a
 * warning. Queries nested in INSERT, CREATE TABLE AS, UPDATE and DELETE are scanned for
 * unbounded {@code SELECT *} as well.
 */
public class WarningDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(WarningDetector.class);

  static final String UNBOUNDED_SELECT_MESSAGE =
      "SELECT * without a row limit. Consider specifying columns or adding LIMIT.";
  static final String MISSING_LIMIT_MESSAGE =
      "No LIMIT clause detected. Consider adding LIMIT for safety.";
  static final String DANGEROUS_STATEMENT_MESSAGE = "Potentially dangerous statement detected";
  static final String DUPLICATE_CTE_MESSAGE =
      "Duplicate CTE name %s detected. Consider consolidating.";

  /**
   * Detects warnings in the statements, in statement order.
   *
   * @param statements The parsed statements.
   * @return The warnings found.
   */
  public List<Warning> detect(List<Statement> statements) {
    List<Warning> warnings = new ArrayList<>();
    for (Statement statement : statements) {
      detect(statement, warnings);
    }
    return warnings;
  }

  private void detect(Statement statement, List<Warning> warnings) {
    SelectScan scan = new SelectScan(warnings);
    if (statement instanceof Select select) {
      scan.visitSelect(select, false);
    } else {
      scanEmbeddedQueries(statement, scan);
    }
    if (scan.unboundedStar) {
      warnings.add(new Warning(WarningKind.UNBOUNDED_SELECT, UNBOUNDED_SELECT_MESSAGE));
    }

    if (statement instanceof Select select && !hasRowLimit(select)) {
      warnings.add(new Warning(WarningKind.MISSING_LIMIT, MISSING_LIMIT_MESSAGE));
    } else if (statement instanceof Drop drop) {
      dangerous(warnings, "DROP " + drop.getType());
    } else if (statement instanceof Truncate) {
      dangerous(warnings, "TRUNCATE");
    } else if (statement instanceof Delete delete && delete.getWhere() == null) {
      dangerous(warnings, "DELETE without WHERE");
    } else if (statement instanceof Update update && update.getWhere() == null) {
      dangerous(warnings, "UPDATE without WHERE");
    }
  }

  // Only queries feeding a write are scanned here; they never get a MISSING_LIMIT warning.
  private static void scanEmbeddedQueries(Statement statement, SelectScan scan) {
    if (statement instanceof Insert insert) {
      scan.visitWithItems(insert.getWithItemsList());
      if (insert.getSelect() != null) {
        scan.visitSelect(insert.getSelect(), false);
      }
    } else if (statement instanceof CreateTable createTable) {
      if (createTable.getSelect() != null) {
        scan.visitSelect(createTable.getSelect(), false);
      }
    } else if (statement instanceof Update update) {
      scan.visitWithItems(update.getWithItemsList());
      scan.visitSubqueries(update.getWhere());
    } else if (statement instanceof Delete delete) {
      scan.visitWithItems(delete.getWithItemsList());
      scan.visitSubqueries(delete.getWhere());
    }
  }

  private static void dangerous(List<Warning> warnings, String what) {
    warnings.add(
        new Warning(
            WarningKind.DANGEROUS_STATEMENT, DANGEROUS_STATEMENT_MESSAGE + " (" + what + ")"));
  }

  /**
   * Whether a query limits its rows, either directly or through the parenthesized query it wraps.
   */
  static boolean hasRowLimit(Select select) {
    if (select.getLimit() != null || select.getFetch() != null) {
      return true;
    }
    if (select instanceof PlainSelect plainSelect && plainSelect.getTop() != null) {
      return true;
    }
    return select instanceof ParenthesedSelect parenthesed
        && parenthesed.getSelect() != null
        && hasRowLimit(parenthesed.getSelect());
  }

  private static final class SelectScan {
    private final List<Warning> warnings;
    private boolean unboundedStar;

    private SelectScan(List<Warning> warnings) {
      this.warnings = warnings;
    }

    private void visitSelect(Select select, boolean limitedByEnclosing) {
      boolean limited = limitedByEnclosing || hasRowLimit(select);
      visitWithItems(select.getWithItemsList());

      if (select instanceof PlainSelect plainSelect) {
        if (!limited && hasUnqualifiedStar(plainSelect)) {
          unboundedStar = true;
        }
        visitFromItem(plainSelect.getFromItem(), limited);
        visitJoins(plainSelect.getJoins(), limited);
      } else if (select instanceof SetOperationList setOperationList) {
        for (Select branch : setOperationList.getSelects()) {
          visitSelect(branch, limited);
        }
      } else if (select instanceof ParenthesedSelect parenthesed
          && parenthesed.getSelect() != null) {
        visitSelect(parenthesed.getSelect(), limited);
      }
    }

    // CTE bodies are evaluated on their own, so an outer LIMIT does not bound them.
    private void visitWithItems(List<WithItem> withItems) {
      if (withItems == null) {
        return;
      }
      Set<String> names = new HashSet<>();
      for (WithItem withItem : withItems) {
        if (withItem.getAlias() != null) {
          String name = withItem.getAlias().getName();
          if (!names.add(name.toLowerCase(Locale.ROOT))) {
            warnings.add(
                new Warning(WarningKind.DUPLICATE_CTE, String.format(DUPLICATE_CTE_MESSAGE, name)));
          }
        }
        Select body = withItem.getSelect();
        if (body != null) {
          visitSelect(body, false);
        }
      }
    }

    private void visitSubqueries(Expression condition) {
      if (condition == null) {
        return;
      }
      SubqueryFinder finder = new SubqueryFinder();
      try {
        finder.getTables(condition);
      } catch (UnsupportedOperationException ex) {
        LOGGER.warn("Subqueries of condition {} could not be fully scanned", condition, ex);
      }
      for (ParenthesedSelect subquery : finder.subqueries) {
        visitSelect(subquery, false);
      }
    }

    private void visitFromItem(FromItem fromItem, boolean limited) {
      if (fromItem instanceof ParenthesedSelect subquery) {
        visitSelect(subquery, limited);
      } else if (fromItem instanceof ParenthesedFromItem parenthesed) {
        visitFromItem(parenthesed.getFromItem(), limited);
        visitJoins(parenthesed.getJoins(), limited);
      }
    }

    private void visitJoins(List<Join> joins, boolean limited) {
      if (joins == null) {
        return;
      }
      for (Join join : joins) {
        visitFromItem(join.getFromItem(), limited);
      }
    }

    private static boolean hasUnqualifiedStar(PlainSelect plainSelect) {
      if (plainSelect.getSelectItems() == null) {
        return false;
      }
      for (SelectItem<?> item : plainSelect.getSelectItems()) {
        if (item.getExpression() instanceof AllColumns
            && !(item.getExpression() instanceof AllTableColumns)) {
          return true;
        }
      }
      return false;
    }
  }

  /** Collects the outermost subqueries of a condition. */
  private static final class SubqueryFinder extends TablesNamesFinder {
    private final List<ParenthesedSelect> subqueries = new ArrayList<>();

    @Override
    public void visit(ParenthesedSelect select) {
      subqueries.add(select);
    }
  }
}
