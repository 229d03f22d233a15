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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The definitions of each variable that may reach the current point of one control flow path of a
 * function body.
 *
 * <p>This is the scope of the function body itself. Branches are tracked with {@link
 * VariableTrackingBranchScope}s, which store only what the branch writes and delegate everything
 * else to their parent, so entering a branch is cheap. When the branches of a statement
 * reconverge, their definitions are merged back into the parent with {@link
 * #mergeBranchDefinitions}.
 */
public class VariableTrackingScope {

  // Maps variable names to the ids of the definitions live on this path.
  final Map<String, ImmutableSet<Integer>> defs = new LinkedHashMap<>();

  // Maps variable names to the ids of the reads seen on this path.
  final SetMultimap<String, Integer> uses = LinkedHashMultimap.create();

  public VariableTrackingScope() {}

  /** Makes {@code defId} the only live definition of {@code name} on this path. */
  public void recordDefinitionById(String name, int defId) {
    defs.put(name, ImmutableSet.of(defId));
  }

  /** Returns the ids of the definitions of {@code name} live on this path; empty if none. */
  public ImmutableSet<Integer> getDefinition(String name) {
    ImmutableSet<Integer> result = defs.get(name);
    return result != null ? result : ImmutableSet.of();
  }

  /** Records that {@code nodeId} read {@code name} on this path. */
  public void recordUsageById(String name, int nodeId) {
    uses.put(name, nodeId);
  }

  /** Returns the reads of {@code name} recorded on this path and on merged branches. */
  public ImmutableSet<Integer> getUses(String name) {
    return ImmutableSet.copyOf(uses.get(name));
  }

  public VariableTrackingBranchScope createBranchScope() {
    return new VariableTrackingBranchScope(this);
  }

  public VariableTrackingLoopScope createLoopScope() {
    return new VariableTrackingLoopScope(this);
  }

  /**
   * Joins the exits of the branches of a statement into this scope.
   *
   * <p>Each branch is given as the definitions it wrote since it left this scope. The join is a
   * union: a variable written on only some branches keeps this scope's definitions for the paths
   * through the other branches, so it is "maybe defined" by either afterwards.
   *
   * @param branches the definitions written by each branch that reaches the join
   * @param includeSelf whether a path that skips all branches also reaches the join, e.g. an
   *     {@code if} without an {@code else}, or a loop that runs zero times
   */
  public void mergeBranchDefinitions(
      List<? extends Map<String, ImmutableSet<Integer>>> branches, boolean includeSelf) {
    Set<String> names = new LinkedHashSet<>();
    for (Map<String, ImmutableSet<Integer>> branch : branches) {
      names.addAll(branch.keySet());
    }
    Map<String, ImmutableSet<Integer>> merged = new LinkedHashMap<>();
    for (String name : names) {
      ImmutableSet<Integer> own = getDefinition(name);
      ImmutableSet.Builder<Integer> builder = ImmutableSet.builder();
      if (includeSelf) {
        builder.addAll(own);
      }
      for (Map<String, ImmutableSet<Integer>> branch : branches) {
        ImmutableSet<Integer> branchDefs = branch.get(name);
        builder.addAll(branchDefs != null ? branchDefs : own);
      }
      merged.put(name, builder.build());
    }
    defs.putAll(merged);
  }

  /** Copies the reads recorded in {@code other} into this scope. */
  public void mergeUses(VariableTrackingScope other) {
    uses.putAll(other.uses);
  }

  /** Returns the definitions written directly in this scope. */
  ImmutableMap<String, ImmutableSet<Integer>> getOwnDefinitions() {
    return ImmutableMap.copyOf(defs);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + defs;
  }
}
