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

import org.apache.calcite.adapter.xbrl.assemble.ContextSelection;
import org.apache.calcite.adapter.xbrl.document.XbrlDocumentType;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Configuration for assembling XBRL filings.
 *
 * <h3>Model operand</h3>
 * <pre>{@code
 * operand:
 *   directory: /data/edgar/goog-2020q1
 *   referenceDocument: presentation   # or definition, calculation
 *   contextSelection: dominant        # or all
 *   includeParenthetical: false
 *   parallelism: 4
 *   cacheFile: /data/edgar/goog-2020q1.json   # optional
 * }</pre>
 */
public class XbrlAssemblerConfig {

  private final XbrlDocumentType referenceDocument;
  private final ContextSelection contextSelection;
  private final boolean includeParenthetical;
  private final int parallelism;

  private XbrlAssemblerConfig(Builder builder) {
    this.referenceDocument = builder.referenceDocument;
    this.contextSelection = builder.contextSelection;
    this.includeParenthetical = builder.includeParenthetical;
    this.parallelism = builder.parallelism;
  }

  /**
   * Returns the reference linkbase to lay out statements with when the
   * filing has it.
   */
  public XbrlDocumentType getReferenceDocument() {
    return referenceDocument;
  }

  public ContextSelection getContextSelection() {
    return contextSelection;
  }

  public boolean isIncludeParenthetical() {
    return includeParenthetical;
  }

  /**
   * Returns the number of threads used to assemble all statements; 1 means
   * the calling thread.
   */
  public int getParallelism() {
    return parallelism;
  }

  public static XbrlAssemblerConfig defaults() {
    return builder().build();
  }

  public static XbrlAssemblerConfig fromMap(Map<String, Object> map) {
    Builder builder = new Builder();
    if (map.containsKey("referenceDocument")) {
      builder.referenceDocument(
          XbrlDocumentType.fromString(String.valueOf(map.get("referenceDocument"))));
    }
    if (map.containsKey("contextSelection")) {
      builder.contextSelection(
          ContextSelection.fromString(String.valueOf(map.get("contextSelection"))));
    }
    Object includeParenthetical = map.get("includeParenthetical");
    if (includeParenthetical != null) {
      builder.includeParenthetical(toBoolean(includeParenthetical));
    }
    Object parallelism = map.get("parallelism");
    if (parallelism != null) {
      builder.parallelism(toInt(parallelism));
    }
    return builder.build();
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return Boolean.parseBoolean(value.toString());
  }

  private static int toInt(Object value) {
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    return Integer.parseInt(value.toString().trim());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "XbrlAssemblerConfig{referenceDocument=" + referenceDocument
        + ", contextSelection=" + contextSelection
        + ", includeParenthetical=" + includeParenthetical
        + ", parallelism=" + parallelism + "}";
  }

  /** Builder for {@link XbrlAssemblerConfig}. */
  public static class Builder {
    private XbrlDocumentType referenceDocument = XbrlDocumentType.PRESENTATION;
    private ContextSelection contextSelection = ContextSelection.DOMINANT;
    private boolean includeParenthetical;
    private int parallelism = 1;

    public Builder referenceDocument(XbrlDocumentType referenceDocument) {
      this.referenceDocument = referenceDocument;
      return this;
    }

    public Builder contextSelection(ContextSelection contextSelection) {
      this.contextSelection = contextSelection;
      return this;
    }

    public Builder includeParenthetical(boolean includeParenthetical) {
      this.includeParenthetical = includeParenthetical;
      return this;
    }

    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public XbrlAssemblerConfig build() {
      @Nullable XbrlDocumentType reference = referenceDocument;
      if (reference == null || !reference.isReference()) {
        throw new IllegalArgumentException(
            "referenceDocument must be presentation, definition or calculation, not "
                + reference);
      }
      if (contextSelection == null) {
        throw new IllegalArgumentException("XbrlAssemblerConfig requires 'contextSelection'");
      }
      if (parallelism < 1) {
        throw new IllegalArgumentException("parallelism must be at least 1, not " + parallelism);
      }
      return new XbrlAssemblerConfig(this);
    }
  }
}
