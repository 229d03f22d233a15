/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.vartracker;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The scope of the body of a loop.
 *
 * <p>The body is traversed once. Besides the definitions written in the body, this scope collects
 * what the traversal needs to account for the other iterations:
 *
 * <ul>
 *   <li>reads in the body that no definition inside the body precedes. On a later iteration they
 *       may observe the definitions live at the end of the body.
 *   <li>the definitions live at each {@code continue}, which also flow to the next iteration.
 *   <li>the definitions live at each {@code break}, which flow to the code after the loop.
 * </ul>
 */
public final class VariableTrackingLoopScope extends VariableTrackingBranchScope {

  private final SetMultimap<String, Integer> exposedUses = LinkedHashMultimap.create();

  private final List<ImmutableMap<String, ImmutableSet<Integer>>> continueDefinitions =
      new ArrayList<>();

  private final List<ImmutableMap<String, ImmutableSet<Integer>>> breakDefinitions =
      new ArrayList<>();

  VariableTrackingLoopScope(VariableTrackingScope parentScope) {
    super(parentScope);
  }

  /** Records a read of {@code name} that no definition inside this loop precedes. */
  public void recordExposedUse(String name, int useId) {
    exposedUses.put(name, useId);
  }

  public SetMultimap<String, Integer> getExposedUses() {
    return exposedUses;
  }

  /** Records the definitions written inside the loop that are live at a {@code continue}. */
  public void recordContinue(Map<String, ImmutableSet<Integer>> definitions) {
    continueDefinitions.add(ImmutableMap.copyOf(definitions));
  }

  /** Records the definitions written inside the loop that are live at a {@code break}. */
  public void recordBreak(Map<String, ImmutableSet<Integer>> definitions) {
    breakDefinitions.add(ImmutableMap.copyOf(definitions));
  }

  public ImmutableList<ImmutableMap<String, ImmutableSet<Integer>>> getContinueDefinitions() {
    return ImmutableList.copyOf(continueDefinitions);
  }

  public ImmutableList<ImmutableMap<String, ImmutableSet<Integer>>> getBreakDefinitions() {
    return ImmutableList.copyOf(breakDefinitions);
  }

  /** Replaces the definitions written in this scope, e.g. with the join of its continue paths. */
  public void replaceDefinitions(Map<String, ImmutableSet<Integer>> definitions) {
    defs.clear();
    defs.putAll(definitions);
  }
}
