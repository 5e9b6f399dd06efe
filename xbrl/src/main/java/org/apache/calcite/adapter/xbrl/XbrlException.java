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

/**
 * Exception thrown when a filing cannot be turned into statement trees.
 *
 * <p>The {@link Reason} tells callers whether the filing's inputs are
 * unusable ({@link #isInputUnusable()}) or whether only one statement is
 * unavailable in an otherwise valid filing ({@link #isStatementUnavailable()}).
 */
public class XbrlException extends RuntimeException {

  /** Why the operation failed. */
  public enum Reason {
    /** A schema, label, data or reference document could not be located. */
    MISSING_DOCUMENT,
    /** An extractor produced no usable entries. */
    EMPTY_EXTRACTION,
    /** The reference document has no section for a statement role. */
    NO_REFERENCE_SECTION,
    /** The reference section exists but no concept in it carries facts. */
    EMPTY_STATEMENT,
    /** A selector matched no statement header. */
    NOT_FOUND,
    /** A persisted record is structurally invalid. */
    MALFORMED_INPUT
  }

  private final Reason reason;

  public XbrlException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public XbrlException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  /**
   * Returns whether the filing as a whole cannot be used.
   */
  public boolean isInputUnusable() {
    return reason == Reason.MISSING_DOCUMENT || reason == Reason.EMPTY_EXTRACTION;
  }

  /**
   * Returns whether a single statement is not available in this filing.
   */
  public boolean isStatementUnavailable() {
    return reason == Reason.NO_REFERENCE_SECTION
        || reason == Reason.EMPTY_STATEMENT
        || reason == Reason.NOT_FOUND;
  }
}
