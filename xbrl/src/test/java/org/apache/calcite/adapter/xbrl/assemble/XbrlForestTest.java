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

import org.apache.calcite.adapter.xbrl.XbrlAssemblerConfig;
import org.apache.calcite.adapter.xbrl.XbrlException;
import org.apache.calcite.adapter.xbrl.XbrlTestFilings;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link XbrlForest} against the Acme test filing.
 */
@Tag("unit")
class XbrlForestTest {

  @Test void testHeadersStartUnassembled() {
    XbrlForest forest = XbrlTestFilings.forest();
    assertEquals(5, forest.size());
    assertTrue(forest.hasAssembler());
    for (String role : forest.getHeaders().keySet()) {
      assertEquals(AssemblyState.UNASSEMBLED, forest.getState(role));
    }
  }

  @Test void testBalanceSheet() {
    XbrlForest forest = XbrlTestFilings.forest();
    XbrlElement sheet = forest.get(FinancialStatement.BALANCE_SHEET);

    assertEquals(XbrlTestFilings.BALANCE_SHEET_ROLE, sheet.getConceptId());
    assertEquals(AssemblyState.ASSEMBLED, forest.getState(XbrlTestFilings.BALANCE_SHEET_ROLE));
    assertEquals(AssemblyState.UNASSEMBLED, forest.getState(XbrlTestFilings.INCOME_ROLE));
    assertEquals(12, sheet.facts().size());

    XbrlElement root = sheet.getChildren().get(0);
    assertEquals("us-gaap_StatementOfFinancialPositionAbstract", root.getConceptId());
    // arcs are listed out of order in the linkbase
    assertEquals(Arrays.asList("us-gaap_AssetsAbstract", "us-gaap_Liabilities",
        "us-gaap_StockholdersEquity", "us-gaap_LiabilitiesAndStockholdersEquity"),
        ids(root.getChildren()));
    XbrlElement assets = root.getChildren().get(0);
    assertEquals(Arrays.asList("us-gaap_Cash", "us-gaap_AccountsReceivableNetCurrent",
        "us-gaap_Assets"), ids(assets.getChildren()));

    XbrlElement cash = assets.getChildren().get(0);
    assertEquals("Cash", cash.getLabel());
    assertEquals(Arrays.asList("125000", "110000"), cash.getChildren().stream()
        .map(XbrlElement::getValue).collect(Collectors.toList()));
    assertEquals(new HashSet<>(Arrays.asList(XbrlTestFilings.MAR_2020, XbrlTestFilings.DEC_2019)),
        sheet.references().keySet());
  }

  @Test void testGetIsIdempotent() {
    XbrlForest forest = XbrlTestFilings.forest();
    XbrlElement first = forest.get(FinancialStatement.INCOME_STATEMENT);
    String before = first.visualize();
    XbrlElement second = forest.get(XbrlTestFilings.INCOME_ROLE);
    assertSame(first, second);
    assertEquals(before, second.visualize());
    assertEquals(10, second.facts().size());
  }

  @Test void testMinoritySegmentContextIsDropped() {
    XbrlElement income = XbrlTestFilings.forest().get(FinancialStatement.INCOME_STATEMENT);
    XbrlElement revenues = income.search(Pattern.compile("^us-gaap_Revenues$"));
    assertEquals(Arrays.asList(XbrlTestFilings.Q1_2020, XbrlTestFilings.Q1_2019),
        revenues.getChildren().stream().map(XbrlElement::getContextRef)
            .collect(Collectors.toList()));
  }

  @Test void testAllContextsKeepsSegment() {
    XbrlAssemblerConfig config = XbrlAssemblerConfig.builder()
        .contextSelection(ContextSelection.ALL)
        .build();
    XbrlElement income = XbrlTestFilings.forest(config).get(FinancialStatement.INCOME_STATEMENT);
    XbrlElement revenues = income.search(Pattern.compile("^us-gaap_Revenues$"));
    assertEquals(3, revenues.getChildren().size());
    assertEquals(11, income.facts().size());
  }

  @Test void testSelectors() {
    XbrlForest forest = XbrlTestFilings.forest();
    XbrlElement cover = forest.get(Pattern.compile("(?i)entity information"));
    assertEquals(XbrlTestFilings.DEI_ROLE, cover.getConceptId());
    assertEquals(Arrays.asList("10-Q", "2020-03-31", "Acme Corp", "0000123456"),
        cover.facts().stream().map(XbrlElement::getValue).collect(Collectors.toList()));
    assertSame(cover, forest.get(FinancialStatement.DOCUMENT_INFORMATION));
    assertSame(cover, forest.get("DocumentAndEntity"));
  }

  @Test void testOrderingKeyDecidesBetweenCandidates() {
    XbrlAssemblerConfig config = XbrlAssemblerConfig.builder()
        .includeParenthetical(true)
        .build();
    XbrlForest forest = XbrlTestFilings.forest(config);
    assertEquals(6, forest.size());
    assertEquals(XbrlTestFilings.BALANCE_SHEET_ROLE,
        forest.get(FinancialStatement.BALANCE_SHEET).getConceptId());
    XbrlElement parenthetical = forest.get("Parenthetical");
    assertEquals(2, parenthetical.facts().size());
  }

  @Test void testFailuresAreRecorded() {
    XbrlForest forest = XbrlTestFilings.forest();
    XbrlException noSection = assertThrows(XbrlException.class,
        () -> forest.get(FinancialStatement.CASH_FLOW));
    assertEquals(XbrlException.Reason.NO_REFERENCE_SECTION, noSection.getReason());
    assertTrue(noSection.isStatementUnavailable());
    assertEquals(AssemblyState.FAILED, forest.getState(XbrlTestFilings.CASH_FLOW_ROLE));
    assertFalse(forest.getHeader(XbrlTestFilings.CASH_FLOW_ROLE).hasChildren());

    XbrlException again = assertThrows(XbrlException.class,
        () -> forest.assemble(XbrlTestFilings.CASH_FLOW_ROLE));
    assertSame(noSection, again);

    XbrlException empty = assertThrows(XbrlException.class,
        () -> forest.get(FinancialStatement.NOTES));
    assertEquals(XbrlException.Reason.EMPTY_STATEMENT, empty.getReason());
  }

  @Test void testNotFound() {
    XbrlForest forest = XbrlTestFilings.forest();
    XbrlException e = assertThrows(XbrlException.class,
        () -> forest.get(FinancialStatement.STOCKHOLDERS_EQUITY));
    assertEquals(XbrlException.Reason.NOT_FOUND, e.getReason());
    assertThrows(XbrlException.class, () -> forest.get(FinancialStatement.INVALID));
    assertThrows(XbrlException.class, () -> forest.getState("http://acme.example.com/role/X"));
    assertThrows(XbrlException.class, () -> forest.assemble("http://acme.example.com/role/X"));
  }

  @Test void testAssembleAll() {
    XbrlForest forest = XbrlTestFilings.forest().assembleAll();
    Map<String, XbrlException> failures = forest.getFailures();
    assertEquals(new HashSet<>(Arrays.asList(XbrlTestFilings.CASH_FLOW_ROLE,
        XbrlTestFilings.POLICIES_ROLE)), failures.keySet());
    assertEquals(AssemblyState.ASSEMBLED, forest.getState(XbrlTestFilings.DEI_ROLE));
    assertEquals(AssemblyState.ASSEMBLED, forest.getState(XbrlTestFilings.BALANCE_SHEET_ROLE));
    assertEquals(AssemblyState.ASSEMBLED, forest.getState(XbrlTestFilings.INCOME_ROLE));
  }

  @Test void testParallelAssemblyMatchesSequential() throws InterruptedException {
    XbrlForest sequential = XbrlTestFilings.forest().assembleAll();
    XbrlForest parallel = XbrlTestFilings.forest();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      parallel.assembleAll(executor);
    } finally {
      executor.shutdown();
    }
    assertEquals(sequential.getFailures().keySet(), parallel.getFailures().keySet());
    for (String role : sequential.getHeaders().keySet()) {
      assertEquals(sequential.getHeader(role).visualize(), parallel.getHeader(role).visualize());
    }
  }

  private static List<String> ids(List<XbrlElement> elements) {
    List<String> ids = new ArrayList<>();
    for (XbrlElement element : elements) {
      ids.add(element.getConceptId());
    }
    return ids;
  }
}
