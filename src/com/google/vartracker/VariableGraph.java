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
import com.google.vartracker.ast.Node;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A summary of all of the definitions and uses of all of the variables within one function body.
 *
 * <p>A definition is identified by the id of the node that performs it, so two writes to the same
 * name at different points are different definitions. Which definitions a read observes is decided
 * by the {@link VariableTrackingScope} passed in by the traversal.
 *
 * <p>None of the methods throw: a read that no definition reaches and a query about an id that was
 * never recorded are both valid states.
 */
public final class VariableGraph {

  static final int IS_REFERENCE = 1 << 0;
  static final int IS_GLOBAL = 1 << 1;
  static final int IS_STATIC = 1 << 2;

  static final int IS_REFERENCE_OR_GLOBAL_OR_STATIC = IS_REFERENCE | IS_GLOBAL | IS_STATIC;

  // Maps variable name to (definition id to the ids of the uses of that definition).
  private final Map<String, Map<Integer, Set<Integer>>> defUses = new LinkedHashMap<>();

  // Maps variable name to (definition id to the line of the definition).
  private final Map<String, Map<Integer, Integer>> defLines = new LinkedHashMap<>();

  // Definition ids of the value in a foreach over keys and values.
  private final Set<Integer> loopDefIds = new HashSet<>();

  // Maps variable names to the IS_* categories they have ever occurred as in this function.
  private final Map<String, Integer> variableTypes = new LinkedHashMap<>();

  public VariableGraph() {}

  /**
   * Records that {@code node} defines {@code name} and makes it the reaching definition of
   * {@code name} in {@code scope}. Recording the same node twice keeps the uses already recorded
   * for it.
   */
  public void recordVariableDefinition(String name, Node node, VariableTrackingScope scope) {
    int id = node.getId();
    defUses
        .computeIfAbsent(name, k -> new LinkedHashMap<>())
        .computeIfAbsent(id, k -> newUseSet());
    defLines.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(id, node.getLineno());
    scope.recordDefinitionById(name, id);
  }

  /**
   * Records that {@code node} reads {@code name}, linking it to every definition of {@code name}
   * that is live in {@code scope}. Does nothing if no definition reaches the read.
   */
  public void recordVariableUsage(String name, Node node, VariableTrackingScope scope) {
    Set<Integer> defsForVariable = scope.getDefinition(name);
    if (defsForVariable.isEmpty()) {
      return;
    }
    int nodeId = node.getId();
    scope.recordUsageById(name, nodeId);
    Map<Integer, Set<Integer>> usesByDef = defUses.get(name);
    if (usesByDef == null) {
      return;
    }
    for (int defId : defsForVariable) {
      Set<Integer> uses = usesByDef.get(defId);
      // Definitions written to the scope directly, bypassing this graph, have no line; skip them.
      if (uses != null && defId != nodeId) {
        uses.add(nodeId);
      }
    }
  }

  /**
   * Links {@code defId} to reads in a loop body that observe it on the next iteration. The loop
   * body is traversed once, so those reads were visited before the definition and could not be
   * linked by {@link #recordVariableUsage}.
   */
  public void recordLoopSelfUsage(
      String name, int defId, Collection<Integer> loopUsesOfOwnVariable) {
    Map<Integer, Set<Integer>> usesByDef = defUses.get(name);
    Set<Integer> uses = usesByDef != null ? usesByDef.get(defId) : null;
    if (uses == null) {
      return;
    }
    for (int nodeId : loopUsesOfOwnVariable) {
      if (nodeId != defId) {
        uses.add(nodeId);
      }
    }
  }

  public void markAsReference(String name) {
    markBitForVariableName(name, IS_REFERENCE);
  }

  public void markAsStaticVariable(String name) {
    markBitForVariableName(name, IS_STATIC);
  }

  public void markAsGlobalVariable(String name) {
    markBitForVariableName(name, IS_GLOBAL);
  }

  /**
   * Marks {@code node} as the loop variable {@code $v} in {@code foreach ($arr as $k => $v)}. There
   * is no way to avoid setting the value there, so it is not reported as unused.
   */
  public void markAsLoopValueNode(@Nullable Node node) {
    if (node != null) {
      loopDefIds.add(node.getId());
    }
  }

  /** Checks if the node for this id is defined as the value in a foreach over keys and values. */
  public boolean isLoopValueDefinitionId(int definitionId) {
    return loopDefIds.contains(definitionId);
  }

  private void markBitForVariableName(String name, int bit) {
    variableTypes.merge(name, bit, (a, b) -> a | b);
  }

  private static Set<Integer> newUseSet() {
    return new LinkedHashSet<>();
  }

  // Queries for the checks that read the finished graph.

  /** Returns the names with at least one recorded definition, in order of first definition. */
  public ImmutableSet<String> getVariableNames() {
    return ImmutableSet.copyOf(defLines.keySet());
  }

  /** Returns the ids of the recorded definitions of {@code name}, in recording order. */
  public ImmutableSet<Integer> getDefinitionIds(String name) {
    Map<Integer, Integer> lines = defLines.get(name);
    return lines == null ? ImmutableSet.of() : ImmutableSet.copyOf(lines.keySet());
  }

  /** Returns the uses of the given definition; empty if it has none or was never recorded. */
  public ImmutableSet<Integer> getUses(String name, int defId) {
    Map<Integer, Set<Integer>> usesByDef = defUses.get(name);
    if (usesByDef == null) {
      return ImmutableSet.of();
    }
    Set<Integer> uses = usesByDef.get(defId);
    return uses == null ? ImmutableSet.of() : ImmutableSet.copyOf(uses);
  }

  /** Whether the given definition has been recorded, independently of its uses. */
  public boolean hasDefinition(String name, int defId) {
    Map<Integer, Integer> lines = defLines.get(name);
    return lines != null && lines.containsKey(defId);
  }

  /** Returns the line of the given definition, or -1 if it was never recorded. */
  public int getDefinitionLine(String name, int defId) {
    Map<Integer, Integer> lines = defLines.get(name);
    if (lines == null) {
      return -1;
    }
    Integer line = lines.get(defId);
    return line == null ? -1 : line;
  }

  /** Whether any definition of {@code name} has an edge to the given use. */
  public boolean hasDefinitionReaching(String name, int useId) {
    Map<Integer, Set<Integer>> usesByDef = defUses.get(name);
    if (usesByDef == null) {
      return false;
    }
    for (Set<Integer> uses : usesByDef.values()) {
      if (uses.contains(useId)) {
        return true;
      }
    }
    return false;
  }

  /** Returns an immutable copy of the edge relation. */
  public ImmutableMap<String, ImmutableMap<Integer, ImmutableSet<Integer>>> getDefUses() {
    ImmutableMap.Builder<String, ImmutableMap<Integer, ImmutableSet<Integer>>> builder =
        ImmutableMap.builder();
    for (Map.Entry<String, Map<Integer, Set<Integer>>> entry : defUses.entrySet()) {
      ImmutableMap.Builder<Integer, ImmutableSet<Integer>> usesByDef = ImmutableMap.builder();
      for (Map.Entry<Integer, Set<Integer>> uses : entry.getValue().entrySet()) {
        usesByDef.put(uses.getKey(), ImmutableSet.copyOf(uses.getValue()));
      }
      builder.put(entry.getKey(), usesByDef.buildOrThrow());
    }
    return builder.buildOrThrow();
  }

  /** Returns the IS_* bits recorded for {@code name}. */
  public int getVariableTypes(String name) {
    return variableTypes.getOrDefault(name, 0);
  }

  public boolean isReference(String name) {
    return (getVariableTypes(name) & IS_REFERENCE) != 0;
  }

  public boolean isGlobal(String name) {
    return (getVariableTypes(name) & IS_GLOBAL) != 0;
  }

  public boolean isStatic(String name) {
    return (getVariableTypes(name) & IS_STATIC) != 0;
  }

  public boolean isReferenceOrGlobalOrStatic(String name) {
    return (getVariableTypes(name) & IS_REFERENCE_OR_GLOBAL_OR_STATIC) != 0;
  }

  /** Returns the number of recorded definitions, over all names. */
  public int getDefinitionCount() {
    int count = 0;
    for (Map<Integer, Integer> lines : defLines.values()) {
      count += lines.size();
    }
    return count;
  }
}
