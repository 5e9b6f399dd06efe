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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Pattern;

/**
 * Category of a statement header, derived from its display text.
 *
 * <p>Categories are tried in declaration order and the first match wins;
 * text that matches none is {@link #INVALID}. {@code INVALID} never
 * matches anything when selecting or merging statements.
 */
public enum FinancialStatement {
  DOCUMENT_INFORMATION("document\\s+(and|&)\\s+entity|document\\s+information|cover\\s+page"),
  INCOME_STATEMENT("statements?\\s+of\\s+(consolidated\\s+)?"
      + "(comprehensive\\s+)?(income|operations|earnings)|income\\s+statements?"),
  BALANCE_SHEET("balance\\s+sheets?|statements?\\s+of\\s+(consolidated\\s+)?"
      + "financial\\s+(position|condition)"),
  STOCKHOLDERS_EQUITY("(stockholders|shareholders|partners|changes\\s+in)['\\u2019]?"
      + "\\s*(equity|deficit|capital)"),
  CASH_FLOW("cash\\s+flows?"),
  NOTES("notes?\\s+to|polic(y|ies)|\\(details|\\(tables|disclosure"),
  INVALID(null);

  private final @Nullable Pattern pattern;

  FinancialStatement(@Nullable String regex) {
    this.pattern = regex == null
        ? null
        : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
  }

  /**
   * Returns whether display text falls into this category. Always false
   * for {@link #INVALID}.
   */
  public boolean matches(@Nullable String displayText) {
    return pattern != null && displayText != null && pattern.matcher(displayText).find();
  }

  /**
   * Classifies statement display text.
   */
  public static FinancialStatement classify(@Nullable String displayText) {
    for (FinancialStatement statement : values()) {
      if (statement.matches(displayText)) {
        return statement;
      }
    }
    return INVALID;
  }

  /**
   * Classifies a statement header by its label, falling back to its role
   * URI when the label does not classify.
   */
  public static FinancialStatement classify(XbrlElement header) {
    FinancialStatement statement = classify(header.getLabel());
    if (statement == INVALID) {
      statement = classify(splitCamelCase(header.getConceptId()));
    }
    return statement;
  }

  /** Turns {@code .../role/ConsolidatedBalanceSheets} into spaced words. */
  private static String splitCamelCase(String roleUri) {
    String tail = roleUri.substring(roleUri.lastIndexOf('/') + 1);
    return tail.replaceAll("([a-z])([A-Z])", "$1 $2");
  }
}
