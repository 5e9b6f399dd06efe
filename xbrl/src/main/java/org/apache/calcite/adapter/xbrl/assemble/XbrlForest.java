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

import org.apache.calcite.adapter.xbrl.XbrlException;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * The statement trees of one filing, keyed by role URI.
 *
 * <p>Headers are assembled lazily: {@link #get(StatementSelector)} assembles
 * the selected header on first access, {@link #assembleAll()} assembles
 * every header that is still unassembled and records failures instead of
 * throwing. A forest read back from JSON has no assembler; its headers are
 * used as stored.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * XbrlForest forest = new XbrlForestBuilder(config).build(documents);
 * XbrlElement income = forest.get(FinancialStatement.INCOME_STATEMENT);
 * System.out.println(income.visualize());
 * }</pre>
 */
public class XbrlForest {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlForest.class);

  /** Headers ordered by ordering key; headers without one go last. */
  private static final Comparator<XbrlElement> BY_ORDERING_KEY =
      Comparator.comparing(XbrlElement::getContextRef,
          Comparator.nullsLast(Comparator.naturalOrder()));

  private final Map<String, XbrlElement> headers;
  private final @Nullable StatementAssembler assembler;
  private final Map<String, AssemblyState> states = new ConcurrentHashMap<>();
  private final Map<String, XbrlException> failures = new ConcurrentHashMap<>();

  /**
   * Creates a forest.
   *
   * @param headers Statement headers by role URI
   * @param assembler Assembler for unassembled headers, or null if the
   *     headers are final (e.g. loaded from JSON)
   */
  public XbrlForest(Map<String, XbrlElement> headers, @Nullable StatementAssembler assembler) {
    this.headers = new LinkedHashMap<>(headers);
    this.assembler = assembler;
    for (Map.Entry<String, XbrlElement> entry : this.headers.entrySet()) {
      states.put(entry.getKey(),
          entry.getValue().hasChildren() ? AssemblyState.ASSEMBLED : AssemblyState.UNASSEMBLED);
    }
  }

  /**
   * Returns all headers by role URI, in schema order.
   */
  public Map<String, XbrlElement> getHeaders() {
    return Collections.unmodifiableMap(headers);
  }

  public @Nullable XbrlElement getHeader(String roleUri) {
    return headers.get(roleUri);
  }

  public int size() {
    return headers.size();
  }

  public AssemblyState getState(String roleUri) {
    AssemblyState state = states.get(roleUri);
    if (state == null) {
      throw new XbrlException(XbrlException.Reason.NOT_FOUND,
          "No statement with role " + roleUri);
    }
    return state;
  }

  /**
   * Returns the failures recorded for headers that could not be assembled,
   * by role URI.
   */
  public Map<String, XbrlException> getFailures() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  public boolean hasAssembler() {
    return assembler != null;
  }

  /**
   * Returns the first header, by ordering key, that satisfies the selector,
   * assembling it if needed.
   *
   * @throws XbrlException with {@link XbrlException.Reason#NOT_FOUND} if no
   *     header matches, or the failure of assembling the matched header
   */
  public XbrlElement get(StatementSelector selector) {
    List<XbrlElement> candidates = new ArrayList<>(headers.values());
    candidates.sort(BY_ORDERING_KEY);
    for (XbrlElement header : candidates) {
      if (selector.matches(header)) {
        return assemble(header.getConceptId());
      }
    }
    throw new XbrlException(XbrlException.Reason.NOT_FOUND,
        "No statement matches " + selector + "; available: " + headers.keySet());
  }

  public XbrlElement get(FinancialStatement statement) {
    return get(StatementSelector.category(statement));
  }

  public XbrlElement get(Pattern pattern) {
    return get(StatementSelector.pattern(pattern));
  }

  public XbrlElement get(String roleUri) {
    return get(StatementSelector.roleUri(roleUri));
  }

  /**
   * Assembles one header unless it already is. Assembling an assembled
   * header is a no-op; a header that failed rethrows its recorded failure.
   *
   * @param roleUri Role URI of the header
   * @return The header
   */
  public XbrlElement assemble(String roleUri) {
    XbrlElement header = headers.get(roleUri);
    if (header == null) {
      throw new XbrlException(XbrlException.Reason.NOT_FOUND,
          "No statement with role " + roleUri);
    }
    synchronized (header) {
      AssemblyState state = states.get(roleUri);
      if (state == AssemblyState.ASSEMBLED) {
        return header;
      }
      if (state == AssemblyState.FAILED) {
        throw failures.get(roleUri);
      }
      if (assembler == null) {
        return header;
      }
      states.put(roleUri, AssemblyState.ASSEMBLING);
      try {
        assembler.assemble(header);
        states.put(roleUri, AssemblyState.ASSEMBLED);
        return header;
      } catch (XbrlException e) {
        failures.put(roleUri, e);
        states.put(roleUri, AssemblyState.FAILED);
        throw e;
      }
    }
  }

  /**
   * Assembles every unassembled header, recording failures.
   *
   * @return this forest
   */
  public XbrlForest assembleAll() {
    for (String roleUri : headers.keySet()) {
      assembleQuietly(roleUri);
    }
    logSummary();
    return this;
  }

  /**
   * Assembles every unassembled header on an executor. Headers own
   * disjoint subtrees and the lookups are read-only, so headers can be
   * assembled in parallel.
   *
   * @return this forest
   * @throws InterruptedException if interrupted while waiting
   */
  public XbrlForest assembleAll(ExecutorService executor) throws InterruptedException {
    List<Callable<Void>> tasks = new ArrayList<>();
    for (String roleUri : headers.keySet()) {
      tasks.add(() -> {
        assembleQuietly(roleUri);
        return null;
      });
    }
    for (Future<Void> future : executor.invokeAll(tasks)) {
      try {
        future.get();
      } catch (ExecutionException e) {
        throw new IllegalStateException("Statement assembly failed unexpectedly",
            e.getCause());
      }
    }
    logSummary();
    return this;
  }

  private void assembleQuietly(String roleUri) {
    try {
      assemble(roleUri);
    } catch (XbrlException e) {
      LOGGER.warn("Could not assemble {}: {}", roleUri, e.getMessage());
    }
  }

  private void logSummary() {
    if (!failures.isEmpty()) {
      LOGGER.info("Assembled {} of {} statements; {} failed", headers.size() - failures.size(),
          headers.size(), failures.size());
    }
  }

  @Override public String toString() {
    return "XbrlForest(" + headers.size() + " statements, " + failures.size() + " failed)";
  }
}
