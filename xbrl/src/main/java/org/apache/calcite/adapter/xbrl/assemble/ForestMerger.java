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

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splices the facts of other filings of the same entity into a forest.
 *
 * <p>Each local statement is paired with the statement of the same
 * {@link FinancialStatement category} in every other forest (the one with
 * the same role URI when there is one, otherwise the first by ordering key).
 * Every foreign fact whose concept also appears in the local statement is
 * copied next to the local facts of that concept; identical facts
 * collapse. Foreign structure is not imported, and facts of concepts the
 * local statement does not have are dropped, since taxonomies drift
 * between filings.
 *
 * <p>Headers of both forests are assembled on demand; statements that
 * cannot be assembled are skipped. Only the local forest is modified. Callers must not merge into one
 * forest from several threads at once.
 */
public final class ForestMerger {
  private static final Logger LOGGER = LoggerFactory.getLogger(ForestMerger.class);

  private ForestMerger() {
  }

  /**
   * Merges the facts of {@code others} into {@code local}.
   *
   * @param local Forest to extend
   * @param others Forests of other filings
   * @return Counts of matched statements, spliced and dropped facts
   */
  public static MergeResult merge(XbrlForest local, XbrlForest... others) {
    int matched = 0;
    int spliced = 0;
    int dropped = 0;
    for (Map.Entry<String, XbrlElement> entry : local.getHeaders().entrySet()) {
      String roleUri = entry.getKey();
      FinancialStatement statement = FinancialStatement.classify(entry.getValue());
      if (statement == FinancialStatement.INVALID) {
        continue;
      }
      XbrlElement localHeader;
      try {
        localHeader = local.assemble(roleUri);
      } catch (XbrlException e) {
        LOGGER.debug("Not merging into {}: {}", roleUri, e.getMessage());
        continue;
      }
      for (XbrlForest other : others) {
        XbrlElement otherHeader = counterpart(other, localHeader, statement);
        if (otherHeader == null || otherHeader == localHeader) {
          continue;
        }
        matched++;
        Map<String, XbrlElement> index = indexConcepts(localHeader);
        for (XbrlElement fact : otherHeader.facts()) {
          XbrlElement target = index.get(fact.getConceptId().toLowerCase(Locale.ROOT));
          if (target == null) {
            dropped++;
            continue;
          }
          XbrlElement owner = target.isFact() ? target.getParent() : target;
          if (owner == null) {
            dropped++;
            continue;
          }
          owner.addChild(fact.copy());
          spliced++;
        }
      }
    }
    MergeResult result = new MergeResult(matched, spliced, dropped);
    LOGGER.info("Merged {} forests into {}: {}", others.length, local, result);
    return result;
  }

  /**
   * Finds and assembles the statement of {@code other} matching a local
   * header, or returns null if there is none or it cannot be assembled.
   */
  private static @Nullable XbrlElement counterpart(XbrlForest other, XbrlElement localHeader,
      FinancialStatement statement) {
    try {
      XbrlElement sameRole = other.getHeader(localHeader.getConceptId());
      if (sameRole != null && FinancialStatement.classify(sameRole) == statement) {
        return other.assemble(sameRole.getConceptId());
      }
      return other.get(StatementSelector.category(statement));
    } catch (XbrlException e) {
      LOGGER.debug("No {} to merge into {}: {}", statement, localHeader.getConceptId(),
          e.getMessage());
      return null;
    }
  }

  /**
   * Maps each lower-cased concept id of a subtree to its first node in
   * pre-order. Built once per statement pair so splicing does not change
   * the lookup.
   */
  private static Map<String, XbrlElement> indexConcepts(XbrlElement header) {
    Map<String, XbrlElement> index = new HashMap<>();
    List<XbrlElement> nodes = header.flatten();
    for (XbrlElement node : nodes.subList(1, nodes.size())) {
      index.putIfAbsent(node.getConceptId().toLowerCase(Locale.ROOT), node);
    }
    return index;
  }
}
