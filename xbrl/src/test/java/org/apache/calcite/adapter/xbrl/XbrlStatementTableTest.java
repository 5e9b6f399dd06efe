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
package org.apache.calcite.adapter.xbrl;

import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link XbrlStatementTable} rows and {@link XbrlSchema} table names.
 */
@Tag("unit")
class XbrlStatementTableTest {

  @Test void testDurationRow() {
    XbrlElement concept = new XbrlElement("us-gaap_Revenues", "Revenues");
    XbrlElement fact = new XbrlElement("us-gaap_Revenues", null, "D20200101-20200331", "1,250");
    concept.addChild(fact);
    assertArrayEquals(new Object[] {
        "us-gaap_Revenues", "Revenues", "D20200101-20200331",
        (int) LocalDate.of(2020, 1, 1).toEpochDay(),
        (int) LocalDate.of(2020, 3, 31).toEpochDay(),
        "1,250", 1250d}, XbrlStatementTable.toRow(fact));
  }

  @Test void testInstantAndTextRow() {
    XbrlElement fact = new XbrlElement("dei_DocumentType", null, "I20200331", "10-Q");
    assertArrayEquals(new Object[] {
        "dei_DocumentType", null, "I20200331", null,
        (int) LocalDate.of(2020, 3, 31).toEpochDay(), "10-Q", null},
        XbrlStatementTable.toRow(fact));
  }

  @Test void testUndatedContext() {
    XbrlElement fact = new XbrlElement("us-gaap_Cash", "Cash", "c-12", "5");
    Object[] row = XbrlStatementTable.toRow(fact);
    assertNull(row[3]);
    assertNull(row[4]);
    assertEquals("Cash", row[1]);
  }

  @Test void testTableNames() {
    assertEquals("consolidated_balance_sheets", XbrlSchema.tableName(
        new XbrlElement("http://x/role/BS", "CONSOLIDATED BALANCE SHEETS")));
    assertEquals("consolidated_balance_sheets_parenthetical", XbrlSchema.tableName(
        new XbrlElement("http://x/role/BS", "CONSOLIDATED BALANCE SHEETS (Parenthetical)")));
    assertEquals("consolidated_statements_of_cash_flows", XbrlSchema.tableName(
        new XbrlElement("http://x/role/ConsolidatedStatementsOfCashFlows")));
  }
}
