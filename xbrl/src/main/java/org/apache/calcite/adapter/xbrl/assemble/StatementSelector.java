/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.xbrl.assemble;

import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Chooses a statement header in an {@link XbrlForest}.
 *
 * <p>Three kinds exist: by role URI text, by regular expression, and by
 * {@link FinancialStatement} category.
 *
 * <pre>{@code
 * forest.get(StatementSelector.category(FinancialStatement.BALANCE_SHEET));
 * forest.get(StatementSelector.pattern(Pattern.compile("(?i)cash\\s+flows")));
 * forest.get(StatementSelector.roleUri("http://www.acme.com/role/Income"));
 * }</pre>
 */
public abstract class StatementSelector {

  private StatementSelector() {
  }

  /**
   * Returns whether a statement header satisfies this selector.
   */
  public abstract boolean matches(XbrlElement header);

  /**
   * Selects headers whose role URI or label contains the text.
   */
  public static StatementSelector roleUri(String text) {
    return new RoleUriSelector(text);
  }

  /**
   * Selects headers whose role URI or label contains a match of the pattern.
   */
  public static StatementSelector pattern(Pattern pattern) {
    return new PatternSelector(pattern);
  }

  /**
   * Selects headers that classify as the given category.
   * {@link FinancialStatement#INVALID} selects nothing.
   */
  public static StatementSelector category(FinancialStatement statement) {
    return new CategorySelector(statement);
  }

  /** Selector on role URI or label text. */
  private static class RoleUriSelector extends StatementSelector {
    private final String text;

    RoleUriSelector(String text) {
      this.text = Objects.requireNonNull(text, "text");
    }

    @Override public boolean matches(XbrlElement header) {
      String label = header.getLabel();
      return header.getConceptId().contains(text)
          || (label != null && label.contains(text));
    }

    @Override public String toString() {
      return "roleUri(" + text + ")";
    }
  }

  /** Selector on a regular expression. */
  private static class PatternSelector extends StatementSelector {
    private final Pattern pattern;

    PatternSelector(Pattern pattern) {
      this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    @Override public boolean matches(XbrlElement header) {
      String label = header.getLabel();
      return pattern.matcher(header.getConceptId()).find()
          || (label != null && pattern.matcher(label).find());
    }

    @Override public String toString() {
      return "pattern(" + pattern + ")";
    }
  }

  /** Selector on statement category. */
  private static class CategorySelector extends StatementSelector {
    private final FinancialStatement statement;

    CategorySelector(FinancialStatement statement) {
      this.statement = Objects.requireNonNull(statement, "statement");
    }

    @Override public boolean matches(XbrlElement header) {
      return statement != FinancialStatement.INVALID
          && FinancialStatement.classify(header) == statement;
    }

    @Override public String toString() {
      return "category(" + statement + ")";
    }
  }
}
