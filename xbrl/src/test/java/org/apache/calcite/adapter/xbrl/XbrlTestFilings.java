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

import org.apache.calcite.adapter.xbrl.assemble.XbrlForest;
import org.apache.calcite.adapter.xbrl.assemble.XbrlForestBuilder;
import org.apache.calcite.adapter.xbrl.document.FilingDocuments;
import org.apache.calcite.adapter.xbrl.document.JsoupXbrlDocument;
import org.apache.calcite.adapter.xbrl.document.XbrlDocument;
import org.apache.calcite.adapter.xbrl.document.XbrlDocumentType;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Access to the synthetic Acme Corp 10-Q filing under
 * {@code src/test/resources/filing}.
 *
 * <p>Statements: document and entity information, balance sheets (and
 * their parenthetical), income (with one product-segment revenue fact),
 * cash flows (no presentation section) and accounting policies (no facts).
 */
public final class XbrlTestFilings {

  public static final String ROLE_PREFIX = "http://acme.example.com/role/";
  public static final String DEI_ROLE = ROLE_PREFIX + "DocumentAndEntityInformation";
  public static final String BALANCE_SHEET_ROLE = ROLE_PREFIX + "ConsolidatedBalanceSheets";
  public static final String PARENTHETICAL_ROLE =
      ROLE_PREFIX + "ConsolidatedBalanceSheetsParenthetical";
  public static final String INCOME_ROLE = ROLE_PREFIX + "ConsolidatedStatementsOfIncome";
  public static final String CASH_FLOW_ROLE = ROLE_PREFIX + "ConsolidatedStatementsOfCashFlows";
  public static final String POLICIES_ROLE =
      ROLE_PREFIX + "SummaryOfSignificantAccountingPolicies";

  public static final String Q1_2020 = "D20200101-20200331";
  public static final String Q1_2019 = "D20190101-20190331";
  public static final String MAR_2020 = "I20200331";
  public static final String DEC_2019 = "I20191231";
  public static final String PRODUCT_SEGMENT =
      "D20200101-20200331_srt_ProductOrServiceAxis_ProductMember";

  private XbrlTestFilings() {
  }

  public static Path directory() {
    URL url = XbrlTestFilings.class.getResource("/filing");
    if (url == null) {
      throw new IllegalStateException("Test filing not on classpath");
    }
    try {
      return Paths.get(url.toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  public static XbrlDocument document(String fileName) {
    try {
      return JsoupXbrlDocument.parse(directory().resolve(fileName));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static XbrlDocument schema() {
    return document("acme-20200331.xsd");
  }

  public static XbrlDocument labels() {
    return document("acme-20200331_lab.xml");
  }

  public static XbrlDocument data() {
    return document("acme-20200331.xml");
  }

  public static XbrlDocument presentation() {
    return document("acme-20200331_pre.xml");
  }

  public static FilingDocuments documents() {
    try {
      return FilingDocuments.fromDirectory(directory(), XbrlDocumentType.PRESENTATION);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Builds a fresh, unassembled forest of the Acme filing. */
  public static XbrlForest forest() {
    return forest(XbrlAssemblerConfig.defaults());
  }

  public static XbrlForest forest(XbrlAssemblerConfig config) {
    return new XbrlForestBuilder(config).build(documents());
  }
}
