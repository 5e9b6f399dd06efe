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

/**
 * Outcome of {@link ForestMerger#merge}.
 */
public class MergeResult {

  private final int matchedStatements;
  private final int splicedFacts;
  private final int droppedFacts;

  MergeResult(int matchedStatements, int splicedFacts, int droppedFacts) {
    this.matchedStatements = matchedStatements;
    this.splicedFacts = splicedFacts;
    this.droppedFacts = droppedFacts;
  }

  /**
   * Returns the number of (local, foreign) statement pairs that were merged.
   */
  public int getMatchedStatements() {
    return matchedStatements;
  }

  /**
   * Returns the number of foreign facts attached to the local trees,
   * including facts that collapsed into identical local facts.
   */
  public int getSplicedFacts() {
    return splicedFacts;
  }

  /**
   * Returns the number of foreign facts whose concept has no node in the
   * matching local statement.
   */
  public int getDroppedFacts() {
    return droppedFacts;
  }

  @Override public String toString() {
    return "MergeResult{statements=" + matchedStatements + ", spliced=" + splicedFacts
        + ", dropped=" + droppedFacts + "}";
  }
}
