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
package org.apache.calcite.adapter.xbrl.document;

import org.apache.calcite.adapter.xbrl.XbrlException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The four parsed documents of one filing: schema, labels, instance data
 * and one reference linkbase.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * FilingDocuments documents =
 *     FilingDocuments.fromDirectory(Paths.get("/data/goog-2020q1"),
 *         XbrlDocumentType.PRESENTATION);
 * XbrlForest forest = new XbrlForestBuilder(config).build(documents);
 * }</pre>
 */
public class FilingDocuments {
  private static final Logger LOGGER = LoggerFactory.getLogger(FilingDocuments.class);

  private static final Pattern XBRL_FILE = Pattern.compile("(?i).*\\.(xml|xsd)$");

  /** Reference linkbases tried after the preferred one, in this order. */
  private static final List<XbrlDocumentType> REFERENCE_FALLBACK =
      Arrays.asList(XbrlDocumentType.PRESENTATION, XbrlDocumentType.DEFINITION,
          XbrlDocumentType.CALCULATION);

  private final XbrlDocument schema;
  private final XbrlDocument labels;
  private final XbrlDocument data;
  private final XbrlDocument reference;
  private final XbrlDocumentType referenceType;

  public FilingDocuments(XbrlDocument schema, XbrlDocument labels, XbrlDocument data,
      XbrlDocument reference, XbrlDocumentType referenceType) {
    this.schema = schema;
    this.labels = labels;
    this.data = data;
    this.reference = reference;
    this.referenceType = referenceType;
  }

  public XbrlDocument getSchema() {
    return schema;
  }

  public XbrlDocument getLabels() {
    return labels;
  }

  public XbrlDocument getData() {
    return data;
  }

  public XbrlDocument getReference() {
    return reference;
  }

  public XbrlDocumentType getReferenceType() {
    return referenceType;
  }

  /**
   * Picks the documents of a filing from classified candidates.
   *
   * @param documents Parsed documents by role
   * @param preferredReference Reference linkbase to use when present
   * @throws XbrlException with {@link XbrlException.Reason#MISSING_DOCUMENT}
   *     if a role has no document
   */
  public static FilingDocuments of(Map<XbrlDocumentType, XbrlDocument> documents,
      XbrlDocumentType preferredReference) {
    @Nullable XbrlDocumentType referenceType = null;
    List<XbrlDocumentType> candidates = new ArrayList<>();
    candidates.add(preferredReference);
    candidates.addAll(REFERENCE_FALLBACK);
    for (XbrlDocumentType candidate : candidates) {
      if (candidate.isReference() && documents.containsKey(candidate)) {
        referenceType = candidate;
        break;
      }
    }
    if (referenceType == null) {
      throw new XbrlException(XbrlException.Reason.MISSING_DOCUMENT,
          "No presentation, definition or calculation linkbase among "
              + documents.keySet());
    }
    return new FilingDocuments(
        require(documents, XbrlDocumentType.SCHEMA),
        require(documents, XbrlDocumentType.LABEL),
        require(documents, XbrlDocumentType.DATA),
        documents.get(referenceType),
        referenceType);
  }

  /**
   * Scans a directory for the {@code .xml} and {@code .xsd} files of one
   * filing, classifies them by name and parses them.
   *
   * <p>Files whose names do not classify are skipped. When several files
   * classify as instance data, the first one that actually carries facts
   * is used.
   *
   * @param directory Directory holding one filing
   * @param preferredReference Reference linkbase to use when present
   * @throws IOException If the directory cannot be listed or a file read
   */
  public static FilingDocuments fromDirectory(Path directory,
      XbrlDocumentType preferredReference) throws IOException {
    if (directory == null || !Files.isDirectory(directory)) {
      throw new XbrlException(XbrlException.Reason.MISSING_DOCUMENT,
          directory + " is not a valid directory");
    }

    List<Path> files;
    try (Stream<Path> stream = Files.list(directory)) {
      files = stream
          .filter(Files::isRegularFile)
          .filter(p -> XBRL_FILE.matcher(p.getFileName().toString()).matches())
          .sorted()
          .collect(Collectors.toList());
    }

    Map<XbrlDocumentType, XbrlDocument> documents = new EnumMap<>(XbrlDocumentType.class);
    for (Path file : files) {
      String fileName = file.getFileName().toString();
      XbrlDocumentType type = XbrlDocumentType.fromName(fileName);
      if (type == null) {
        LOGGER.debug("Skipping unclassified file {}", fileName);
        continue;
      }
      XbrlDocument existing = documents.get(type);
      if (existing != null && !(type == XbrlDocumentType.DATA && !hasFacts(existing))) {
        LOGGER.debug("Ignoring {} as {}, already using {}", fileName, type,
            existing.getName());
        continue;
      }
      LOGGER.debug("Loading {} as {}", fileName, type);
      documents.put(type, JsoupXbrlDocument.parse(file));
    }
    return of(documents, preferredReference);
  }

  private static boolean hasFacts(XbrlDocument document) {
    return !document.findAllWithAttribute("contextRef").isEmpty();
  }

  private static XbrlDocument require(Map<XbrlDocumentType, XbrlDocument> documents,
      XbrlDocumentType type) {
    @Nullable XbrlDocument document = documents.get(type);
    if (document == null) {
      throw new XbrlException(XbrlException.Reason.MISSING_DOCUMENT,
          "No " + type.name().toLowerCase(Locale.ROOT)
              + " document among " + documents.keySet());
    }
    return document;
  }
}
