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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link FinancialStatement} and {@link ContextSelection}.
 */
@Tag("unit")
class FinancialStatementTest {

  @Test void testClassify() {
    assertEquals(FinancialStatement.INCOME_STATEMENT,
        FinancialStatement.classify("CONSOLIDATED STATEMENTS OF INCOME"));
    assertEquals(FinancialStatement.INCOME_STATEMENT,
        FinancialStatement.classify("Consolidated Statements of Comprehensive Income"));
    assertEquals(FinancialStatement.INCOME_STATEMENT,
        FinancialStatement.classify("CONSOLIDATED STATEMENTS OF OPERATIONS"));
    assertEquals(FinancialStatement.BALANCE_SHEET,
        FinancialStatement.classify("Condensed Consolidated Balance Sheets"));
    assertEquals(FinancialStatement.BALANCE_SHEET,
        FinancialStatement.classify("Statements of Financial Position"));
    assertEquals(FinancialStatement.STOCKHOLDERS_EQUITY,
        FinancialStatement.classify("Consolidated Statements of Stockholders' Equity"));
    assertEquals(FinancialStatement.CASH_FLOW,
        FinancialStatement.classify("CONSOLIDATED STATEMENTS OF CASH FLOWS"));
    assertEquals(FinancialStatement.DOCUMENT_INFORMATION,
        FinancialStatement.classify("Document and Entity Information"));
    assertEquals(FinancialStatement.DOCUMENT_INFORMATION,
        FinancialStatement.classify("Cover Page"));
    assertEquals(FinancialStatement.NOTES,
        FinancialStatement.classify("Summary of Significant Accounting Policies"));
    assertEquals(FinancialStatement.NOTES,
        FinancialStatement.classify("Revenue (Details)"));
  }

  @Test void testUnclassified() {
    assertEquals(FinancialStatement.INVALID, FinancialStatement.classify("Miscellaneous"));
    assertEquals(FinancialStatement.INVALID, FinancialStatement.classify((String) null));
    assertFalse(FinancialStatement.INVALID.matches("anything"));
  }

  @Test void testClassifyHeaderFallsBackToRoleUri() {
    XbrlElement header =
        new XbrlElement("http://acme.example.com/role/ConsolidatedBalanceSheets", "Statement");
    assertEquals(FinancialStatement.BALANCE_SHEET, FinancialStatement.classify(header));
  }

  @Test void testDominantKeepsOnlyTheMaximum() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    counts.put("c1", 4);
    counts.put("c2", 3);
    counts.put("c3", 4);
    counts.put("c4", 1);
    assertEquals("[c1, c3]", ContextSelection.DOMINANT.select(counts).toString());
    assertEquals("[c1, c2, c3, c4]", ContextSelection.ALL.select(counts).toString());
  }

  @Test void testContextSelectionFromString() {
    assertEquals(ContextSelection.ALL, ContextSelection.fromString(" all "));
    assertEquals(ContextSelection.DOMINANT, ContextSelection.fromString("Dominant"));
    assertThrows(IllegalArgumentException.class, () -> ContextSelection.fromString("most"));
  }
}
