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
package org.apache.calcite.adapter.xbrl.persist;

import org.apache.calcite.adapter.xbrl.XbrlException;
import org.apache.calcite.adapter.xbrl.assemble.XbrlForest;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes forests as JSON: an object keyed by role URI whose
 * values are {@link ElementRecord} trees.
 *
 * <p>A loaded forest has no assembler; headers that were persisted with
 * children are already assembled.
 */
public final class ForestSerializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(ForestSerializer.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, ElementRecord>> RECORDS_TYPE =
      new TypeReference<LinkedHashMap<String, ElementRecord>>() { };

  private ForestSerializer() {
  }

  public static Map<String, ElementRecord> toRecords(XbrlForest forest) {
    Map<String, ElementRecord> records = new LinkedHashMap<>();
    for (Map.Entry<String, XbrlElement> entry : forest.getHeaders().entrySet()) {
      records.put(entry.getKey(), toRecord(entry.getValue()));
    }
    return records;
  }

  public static ElementRecord toRecord(XbrlElement element) {
    ElementRecord record = new ElementRecord(element.getConceptId(), element.getLabel(),
        element.getContextRef(), element.getValue());
    for (XbrlElement child : element.getChildren()) {
      record.getChildren().add(toRecord(child));
    }
    return record;
  }

  /**
   * Rebuilds a forest from records.
   *
   * @throws XbrlException with {@link XbrlException.Reason#MALFORMED_INPUT}
   *     if a record has no concept id
   */
  public static XbrlForest fromRecords(Map<String, ElementRecord> records) {
    Map<String, XbrlElement> headers = new LinkedHashMap<>();
    for (Map.Entry<String, ElementRecord> entry : records.entrySet()) {
      if (entry.getValue() == null) {
        throw malformed("Statement " + entry.getKey() + " has no record");
      }
      headers.put(entry.getKey(), fromRecord(entry.getValue()));
    }
    return new XbrlForest(headers, null);
  }

  public static XbrlElement fromRecord(ElementRecord record) {
    String conceptId = record.getConceptId();
    if (conceptId == null) {
      throw malformed("Element record without conceptId: " + record);
    }
    XbrlElement element = new XbrlElement(conceptId, record.getLabel(),
        record.getContextRef(), record.getValue());
    List<ElementRecord> children = record.getChildren();
    for (int i = 0; i < children.size(); i++) {
      ElementRecord child = children.get(i);
      if (child == null) {
        throw malformed("Element record " + conceptId
            + " has a null child");
      }
      element.addChild(fromRecord(child), i);
    }
    return element;
  }

  public static String toJson(XbrlForest forest) {
    try {
      return MAPPER.writeValueAsString(toRecords(forest));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize " + forest, e);
    }
  }

  /**
   * Parses a forest from JSON.
   *
   * @throws XbrlException with {@link XbrlException.Reason#MALFORMED_INPUT}
   *     if the text is not a valid forest
   */
  public static XbrlForest fromJson(String json) {
    try {
      Map<String, ElementRecord> records = MAPPER.readValue(json, RECORDS_TYPE);
      if (records == null) {
        throw malformed("Forest JSON is null");
      }
      return fromRecords(records);
    } catch (JsonProcessingException e) {
      throw malformed("Invalid forest JSON: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Reads a forest written by {@link #write}.
   */
  public static XbrlForest read(Path file) throws IOException {
    String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    XbrlForest forest = fromJson(json);
    LOGGER.debug("Read {} statements from {}", forest.size(), file);
    return forest;
  }

  /**
   * Writes a forest to a file. If the file already holds a forest, statements
   * with the same role URI are merged and other statements are kept; the
   * given forest is not modified.
   */
  public static void write(XbrlForest forest, Path file) throws IOException {
    Map<String, XbrlElement> combined = new LinkedHashMap<>();
    if (Files.isRegularFile(file)) {
      combined.putAll(read(file).getHeaders());
    }
    int merged = 0;
    for (Map.Entry<String, XbrlElement> entry : forest.getHeaders().entrySet()) {
      XbrlElement copy = fromRecord(toRecord(entry.getValue()));
      XbrlElement existing = combined.get(entry.getKey());
      if (existing != null) {
        existing.merge(copy);
        merged++;
      } else {
        combined.put(entry.getKey(), copy);
      }
    }
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Map<String, ElementRecord> records = toRecords(new XbrlForest(combined, null));
    MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), records);
    LOGGER.info("Wrote {} statements to {} ({} merged with existing)", records.size(), file,
        merged);
  }

  private static XbrlException malformed(String message) {
    return new XbrlException(XbrlException.Reason.MALFORMED_INPUT, message);
  }

  private static XbrlException malformed(String message, Throwable cause) {
    return new XbrlException(XbrlException.Reason.MALFORMED_INPUT, message, cause);
  }
}
