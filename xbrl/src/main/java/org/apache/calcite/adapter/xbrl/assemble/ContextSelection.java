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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides which reporting contexts belong in an assembled statement.
 *
 * <p>A statement section references concepts whose facts were reported
 * under many contexts: the statement's own periods, but also segment,
 * parenthetical or footnote-only columns. The assembler counts how often
 * each context occurs across the section and asks the policy which ones to
 * keep.
 */
public enum ContextSelection {
  /**
   * Keeps only the contexts whose count equals the highest count. A context
   * one fact short of the maximum is dropped.
   */
  DOMINANT {
    @Override public Set<String> select(Map<String, Integer> counts) {
      int max = 0;
      for (int count : counts.values()) {
        max = Math.max(max, count);
      }
      Set<String> kept = new LinkedHashSet<>();
      for (Map.Entry<String, Integer> entry : counts.entrySet()) {
        if (entry.getValue() == max) {
          kept.add(entry.getKey());
        }
      }
      return Collections.unmodifiableSet(kept);
    }
  },

  /** Keeps every context that occurs at least once. */
  ALL {
    @Override public Set<String> select(Map<String, Integer> counts) {
      return Collections.unmodifiableSet(new LinkedHashSet<>(counts.keySet()));
    }
  };

  /**
   * Returns the contexts to keep, in the iteration order of {@code counts}.
   *
   * @param counts Number of facts per context ref
   */
  public abstract Set<String> select(Map<String, Integer> counts);

  public static ContextSelection fromString(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
