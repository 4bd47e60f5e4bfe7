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

import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.Dialect;
import com.dataops.sqlshift.model.QualifiedName;
import com.dataops.sqlshift.model.SubstitutionRule;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import net.sf.jsqlparser.schema.Database;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.drop.Drop;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectVisitor;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.truncate.Truncate;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites table references according to substitution rules.
 *
 * <p>Every table reference in the statements (FROM items, joins, subqueries, CTE bodies, set
 * operations and DML/DDL targets) is matched against the enabled rules. The rule with the highest
 * priority wins, and ties go to the rule listed first. Rewrites are followed until no further rule
 * applies, so the output is a fixed point of the pass. References to CTEs declared by the same
 * query or an enclosing query are never rewritten, and neither are column qualifiers or aliases.
 */
public class TableSubstitutionPass {
  private static final Logger LOGGER = LoggerFactory.getLogger(TableSubstitutionPass.class);
  private final SqlParser parser;

  public TableSubstitutionPass() {
    this(new SqlParser());
  }

  public TableSubstitutionPass(SqlParser parser) {
    this.parser = ValidationException.checkNotNull(parser, "Parser cannot be null");
  }

  /**
   * Parses the SQL and rewrites its table references.
   *
   * @param sql The SQL text.
   * @param dialect The target dialect, used for parsing and for quoting rewritten names.
   * @param rules The rules in provider order.
   * @return The rewritten SQL and the rules that were applied.
   * @throws com.dataops.sqlshift.common.TranspileException of kind PARSE if the SQL does not
   *     parse.
   */
  public SubstitutionResult substitute(String sql, Dialect dialect, List<SubstitutionRule> rules) {
    return substitute(parser.parse(sql, dialect), rules);
  }

  /**
   * Rewrites the table references of already parsed SQL. The statements are modified in place.
   *
   * @param parsed The parsed SQL.
   * @param rules The rules in provider order.
   * @return The rewritten SQL and the rules that were applied. If nothing was rewritten the SQL
   *     is the original text.
   */
  public SubstitutionResult substitute(ParsedSql parsed, List<SubstitutionRule> rules) {
    List<SubstitutionRule> candidates = usableRules(rules);
    if (candidates.isEmpty()) {
      return new SubstitutionResult(
          parsed.getSql(), ImmutableList.of(), parsed.getStatements(), 0);
    }

    Rewriter rewriter = new Rewriter(candidates, parsed.getDialect());
    for (Statement statement : parsed.getStatements()) {
      rewriter.rewrite(statement);
    }
    if (rewriter.rewriteCount == 0) {
      return new SubstitutionResult(
          parsed.getSql(), ImmutableList.of(), parsed.getStatements(), 0);
    }
    LOGGER.debug(
        "Rewrote {} table references using rules {}",
        rewriter.rewriteCount,
        rewriter.applied.stream().map(SubstitutionRule::getId).collect(Collectors.toList()));
    return new SubstitutionResult(
        parsed.render(),
        new ArrayList<>(rewriter.applied),
        parsed.getStatements(),
        rewriter.rewriteCount);
  }

  private static List<SubstitutionRule> usableRules(List<SubstitutionRule> rules) {
    List<SubstitutionRule> usable = new ArrayList<>();
    for (SubstitutionRule rule : rules) {
      if (!rule.isEnabled()) {
        continue;
      }
      if (rule.getSource().equals(rule.getTarget())) {
        LOGGER.warn(
            "Ignoring rule {} because it maps {} to itself", rule.getId(), rule.getSource());
        continue;
      }
      usable.add(rule);
    }
    return usable;
  }

  private static String normalize(String identifier) {
    return QualifiedName.fromRawParts(Collections.singletonList(identifier))
        .getParts()
        .get(0)
        .toLowerCase(Locale.ROOT);
  }

  private static final class Rewriter {
    private final List<SubstitutionRule> rules;
    private final Dialect dialect;
    private final Set<SubstitutionRule> applied = new LinkedHashSet<>();
    private final Set<Table> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    private int rewriteCount;

    private Rewriter(List<SubstitutionRule> rules, Dialect dialect) {
      this.rules = rules;
      this.dialect = dialect;
    }

    private void rewrite(Statement statement) {
      try {
        new ReferenceFinder().getTables(statement);
      } catch (UnsupportedOperationException ex) {
        LOGGER.warn(
            "Table references of {} statements are not rewritten: {}",
            statement.getClass().getSimpleName(),
            ex.getMessage());
      }
    }

    /**
     * Visits table references while tracking which CTE names are visible. Each query opens a
     * scope for its WITH list, and a CTE name becomes visible only after its own body was visited
     * unless the CTE is recursive.
     */
    private final class ReferenceFinder extends TablesNamesFinder {
      private final Deque<Set<String>> scopes = new ArrayDeque<>();
      private final Set<WithItem> scopedWithItems =
          Collections.newSetFromMap(new IdentityHashMap<>());

      private ReferenceFinder() {
        scopes.push(new HashSet<>());
      }

      @Override
      public void visit(PlainSelect plainSelect) {
        enterQuery(plainSelect);
        try {
          super.visit(plainSelect);
        } finally {
          scopes.pop();
        }
      }

      @Override
      public void visit(SetOperationList setOperationList) {
        enterQuery(setOperationList);
        try {
          super.visit(setOperationList);
        } finally {
          scopes.pop();
        }
      }

      @Override
      public void visit(ParenthesedSelect parenthesedSelect) {
        enterQuery(parenthesedSelect);
        try {
          super.visit(parenthesedSelect);
        } finally {
          scopes.pop();
        }
      }

      // WITH lists outside a query, e.g. on INSERT, land in the enclosing scope.
      @Override
      public void visit(WithItem withItem) {
        if (!scopedWithItems.contains(withItem)) {
          declare(withItem);
        }
      }

      @Override
      public void visit(Table table) {
        rewriteTable(table, this::isCte);
      }

      @Override
      public void visit(Drop drop) {
        visit(drop.getName());
      }

      @Override
      public void visit(Truncate truncate) {
        visit(truncate.getTable());
      }

      private void enterQuery(Select query) {
        scopes.push(new HashSet<>());
        List<WithItem> withItems = query.getWithItemsList();
        if (withItems == null) {
          return;
        }
        for (WithItem withItem : withItems) {
          scopedWithItems.add(withItem);
          declare(withItem);
        }
      }

      private void declare(WithItem withItem) {
        String name = withItem.getAlias() == null ? null : normalize(withItem.getAlias().getName());
        if (name != null && withItem.isRecursive()) {
          scopes.peek().add(name);
        }
        if (withItem.getSelect() != null) {
          withItem.getSelect().accept((SelectVisitor) this);
        }
        if (name != null) {
          scopes.peek().add(name);
        }
      }

      private boolean isCte(String name) {
        for (Set<String> scope : scopes) {
          if (scope.contains(name)) {
            return true;
          }
        }
        return false;
      }
    }

    private void rewriteTable(Table table, Predicate<String> isCte) {
      if (table == null || table.getName() == null || !visited.add(table)) {
        return;
      }
      QualifiedName reference = referenceOf(table);
      String firstPart = reference.getParts().get(0).toLowerCase(Locale.ROOT);
      if (reference.size() == 1 && isCte.test(firstPart)) {
        return;
      }
      Pair<QualifiedName, List<SubstitutionRule>> resolved = resolve(reference);
      if (resolved == null) {
        return;
      }
      QualifiedName target = resolved.getLeft();
      setName(table, target);
      applied.addAll(resolved.getRight());
      rewriteCount++;
      LOGGER.debug("Rewrote {} to {}", reference, target);
    }

    // Returns the final target and the rules leading to it, or null if the reference stays as is.
    private Pair<QualifiedName, List<SubstitutionRule>> resolve(QualifiedName reference) {
      List<SubstitutionRule> chain = new ArrayList<>();
      Set<QualifiedName> seen = new HashSet<>();
      seen.add(reference);
      QualifiedName current = reference;
      while (true) {
        SubstitutionRule rule = bestMatch(current);
        if (rule == null || rule.getTarget().equals(current)) {
          return chain.isEmpty() ? null : Pair.of(current, chain);
        }
        if (!seen.add(rule.getTarget())) {
          LOGGER.warn(
              "Rules {} form a cycle through {}, leaving {} unchanged",
              chain.stream().map(SubstitutionRule::getId).collect(Collectors.toList()),
              rule.getTarget(),
              reference);
          return null;
        }
        chain.add(rule);
        current = rule.getTarget();
      }
    }

    private SubstitutionRule bestMatch(QualifiedName reference) {
      SubstitutionRule best = null;
      for (SubstitutionRule rule : rules) {
        if (rule.matches(reference) && (best == null || rule.getPriority() > best.getPriority())) {
          best = rule;
        }
      }
      return best;
    }

    private void setName(Table table, QualifiedName target) {
      List<String> parts = target.getParts();
      int size = parts.size();
      // Highest index first so that dropped qualifiers shrink the part list.
      table.setDatabase(
          new Database(size >= 3 ? dialect.quoteIfNeeded(parts.get(size - 3)) : null));
      table.setSchemaName(size >= 2 ? dialect.quoteIfNeeded(parts.get(size - 2)) : null);
      table.setName(dialect.quoteIfNeeded(parts.get(size - 1)));
    }
  }

  /**
   * Builds the qualified name of a table reference from the parts present in the SQL, with
   * quotes removed.
   *
   * @param table The table reference.
   * @return The qualified name.
   */
  static QualifiedName referenceOf(Table table) {
    List<String> rawParts = new ArrayList<>();
    Database database = table.getDatabase();
    if (database != null) {
      rawParts.add(database.getDatabaseName());
    }
    rawParts.add(table.getSchemaName());
    rawParts.add(table.getName());
    return QualifiedName.fromRawParts(rawParts);
  }
}
