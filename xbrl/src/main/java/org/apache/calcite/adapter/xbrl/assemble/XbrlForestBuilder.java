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
import org.apache.calcite.adapter.xbrl.document.FilingDocuments;
import org.apache.calcite.adapter.xbrl.document.XbrlDocument;
import org.apache.calcite.adapter.xbrl.extract.CellExtractor;
import org.apache.calcite.adapter.xbrl.extract.LabelExtractor;
import org.apache.calcite.adapter.xbrl.extract.SchemaExtractor;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs the schema, label and cell extractors over a filing and wires their
 * results into an {@link XbrlForest} whose headers assemble on demand.
 *
 * <p>Construction is all or nothing: a missing document or an extractor
 * that finds nothing fails the whole filing.
 */
public class XbrlForestBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlForestBuilder.class);

  private final XbrlAssemblerConfig config;

  public XbrlForestBuilder() {
    this(XbrlAssemblerConfig.defaults());
  }

  public XbrlForestBuilder(XbrlAssemblerConfig config) {
    this.config = config;
  }

  public XbrlForest build(FilingDocuments documents) {
    return build(documents.getSchema(), documents.getLabels(), documents.getData(),
        documents.getReference());
  }

  /**
   * Builds the forest of one filing.
   *
   * @param schema Taxonomy schema
   * @param labels Label linkbase
   * @param data Instance document
   * @param reference Presentation, definition or calculation linkbase
   * @throws XbrlException with {@link XbrlException.Reason#MISSING_DOCUMENT}
   *     or {@link XbrlException.Reason#EMPTY_EXTRACTION}
   */
  public XbrlForest build(@Nullable XbrlDocument schema, @Nullable XbrlDocument labels,
      @Nullable XbrlDocument data, @Nullable XbrlDocument reference) {
    XbrlDocument schemaDocument = require(schema, "schema");
    XbrlDocument labelDocument = require(labels, "label");
    XbrlDocument dataDocument = require(data, "data");
    XbrlDocument referenceDocument = require(reference, "reference");

    Map<String, XbrlElement> headers =
        SchemaExtractor.extract(schemaDocument, config.isIncludeParenthetical());
    if (headers.isEmpty()) {
      throw emptyExtraction("statement roles", schemaDocument);
    }
    Map<String, String> labelLookup = LabelExtractor.extract(labelDocument);
    if (labelLookup.isEmpty()) {
      throw emptyExtraction("labels", labelDocument);
    }
    Map<String, List<XbrlElement>> cells = CellExtractor.extract(dataDocument);
    if (cells.isEmpty()) {
      throw emptyExtraction("facts", dataDocument);
    }

    LOGGER.info("Built forest of {} statements from {} ({} labels, {} concepts with facts)",
        headers.size(), dataDocument.getName(), labelLookup.size(), cells.size());
    StatementAssembler assembler = new StatementAssembler(labelLookup, cells,
        referenceDocument, config.getContextSelection());
    return new XbrlForest(headers, assembler);
  }

  private static XbrlDocument require(@Nullable XbrlDocument document, String role) {
    if (document == null) {
      throw new XbrlException(XbrlException.Reason.MISSING_DOCUMENT,
          "No " + role + " document supplied");
    }
    return document;
  }

  private static XbrlException emptyExtraction(String what, XbrlDocument document) {
    return new XbrlException(XbrlException.Reason.EMPTY_EXTRACTION,
        "Found no " + what + " in " + document.getName());
  }
}
