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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A scope for one branch of a statement. Stores only the definitions written in the branch and
 * delegates every other lookup to its parent.
 */
public class VariableTrackingBranchScope extends VariableTrackingScope {

  private final VariableTrackingScope parentScope;

  VariableTrackingBranchScope(VariableTrackingScope parentScope) {
    this.parentScope = checkNotNull(parentScope);
  }

  public VariableTrackingScope getParentScope() {
    return parentScope;
  }

  @Override
  public ImmutableSet<Integer> getDefinition(String name) {
    ImmutableSet<Integer> result = defs.get(name);
    return result != null ? result : parentScope.getDefinition(name);
  }

  /**
   * Returns the definitions of {@code name} written in this scope or in the scopes between it and
   * {@code limit}, {@code limit} included. Returns null if {@code name} was not written there.
   */
  public @Nullable ImmutableSet<Integer> getDefinitionUpToScope(
      String name, VariableTrackingScope limit) {
    VariableTrackingScope scope = this;
    while (true) {
      ImmutableSet<Integer> result = scope.defs.get(name);
      if (result != null) {
        return result;
      }
      if (scope == limit) {
        return null;
      }
      checkArgument(
          scope instanceof VariableTrackingBranchScope, "%s is not an ancestor of %s", limit, this);
      scope = ((VariableTrackingBranchScope) scope).getParentScope();
    }
  }

  /**
   * Returns every definition written in this scope or in the scopes between it and {@code limit},
   * {@code limit} included. Inner writes hide outer ones.
   */
  public ImmutableMap<String, ImmutableSet<Integer>> getDefinitionsUpToScope(
      VariableTrackingScope limit) {
    Map<String, ImmutableSet<Integer>> result = new LinkedHashMap<>();
    VariableTrackingScope scope = this;
    while (true) {
      for (Map.Entry<String, ImmutableSet<Integer>> entry : scope.defs.entrySet()) {
        result.putIfAbsent(entry.getKey(), entry.getValue());
      }
      if (scope == limit) {
        return ImmutableMap.copyOf(result);
      }
      checkArgument(
          scope instanceof VariableTrackingBranchScope, "%s is not an ancestor of %s", limit, this);
      scope = ((VariableTrackingBranchScope) scope).getParentScope();
    }
  }
}
