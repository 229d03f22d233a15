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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.vartracker.ast.Node;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Reads the {@link VariableGraph} of a callable and reports definitions that no read observes, and
 * reads that no definition reaches.
 */
public final class UnusedVariableCheck {

  public static final DiagnosticType UNUSED_VARIABLE =
      DiagnosticType.warning(
          "UNUSED_VARIABLE", "Variable {0} is assigned in {1} but never read.");

  public static final DiagnosticType UNUSED_CATCH_VARIABLE =
      DiagnosticType.warning(
          "UNUSED_CATCH_VARIABLE", "Caught exception {0} is never read in {1}.");

  public static final DiagnosticType UNUSED_PARAMETER =
      DiagnosticType.disabled("UNUSED_PARAMETER", "Parameter {0} of {1} is never read.");

  public static final DiagnosticType UNDEFINED_VARIABLE =
      DiagnosticType.warning(
          "UNDEFINED_VARIABLE", "Variable {0} is read in {1} before it is defined.");

  private final Pattern ignoredVariablePattern;
  private final ImmutableSet<String> predefinedVariableNames;

  public UnusedVariableCheck(VariableTrackerOptions options) {
    checkNotNull(options);
    this.ignoredVariablePattern = options.getIgnoredVariablePattern();
    this.predefinedVariableNames = options.getPredefinedVariableNames();
  }

  /** Returns the diagnostics for one analyzed callable, at their default levels. */
  public ImmutableList<AnalysisError> check(VariableTracker.Result result) {
    ImmutableList.Builder<AnalysisError> errors = ImmutableList.builder();
    checkUnusedDefinitions(result, errors);
    checkUndefinedUses(result, errors);
    return errors.build();
  }

  private void checkUnusedDefinitions(
      VariableTracker.Result result, ImmutableList.Builder<AnalysisError> errors) {
    VariableGraph graph = result.getGraph();
    @Nullable String sourceName = result.getCallable().getSourceFileName();
    for (String name : graph.getVariableNames()) {
      if (graph.isReferenceOrGlobalOrStatic(name) || isIgnored(name)) {
        continue;
      }
      for (int defId : graph.getDefinitionIds(name)) {
        if (!graph.getUses(name, defId).isEmpty() || graph.isLoopValueDefinitionId(defId)) {
          continue;
        }
        errors.add(
            AnalysisError.make(
                sourceName,
                graph.getDefinitionLine(name, defId),
                unusedDiagnosticFor(result, defId),
                name,
                result.getCallableName()));
      }
    }
  }

  private static DiagnosticType unusedDiagnosticFor(VariableTracker.Result result, int defId) {
    if (result.getParameterDefinitionIds().contains(defId)) {
      return UNUSED_PARAMETER;
    } else if (result.getCatchDefinitionIds().contains(defId)) {
      return UNUSED_CATCH_VARIABLE;
    }
    return UNUSED_VARIABLE;
  }

  private void checkUndefinedUses(
      VariableTracker.Result result, ImmutableList.Builder<AnalysisError> errors) {
    VariableGraph graph = result.getGraph();
    @Nullable String sourceName = result.getCallable().getSourceFileName();
    for (Map.Entry<String, Node> entry : result.getUndefinedUses().entries()) {
      String name = entry.getKey();
      Node use = entry.getValue();
      if (predefinedVariableNames.contains(name)
          || graph.hasDefinitionReaching(name, use.getId())) {
        continue;
      }
      errors.add(
          AnalysisError.make(
              sourceName, use.getLineno(), UNDEFINED_VARIABLE, name, result.getCallableName()));
    }
  }

  private boolean isIgnored(String name) {
    return ignoredVariablePattern.matcher(name).find();
  }
}
