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
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Named groups of DiagnosticTypes reported by the variable tracker.
 */
public final class DiagnosticGroups {

  private DiagnosticGroups() {}

  private static final Map<String, DiagnosticGroup> groupsByName = new LinkedHashMap<>();

  static DiagnosticGroup registerGroup(String name, DiagnosticType... types) {
    DiagnosticGroup group = new DiagnosticGroup(name, types);
    groupsByName.put(name, group);
    return group;
  }

  static DiagnosticGroup registerGroup(String name, DiagnosticGroup... groups) {
    DiagnosticGroup group = new DiagnosticGroup(name, groups);
    groupsByName.put(name, group);
    return group;
  }

  /** Get the registered diagnostic groups, indexed by name. */
  public static ImmutableMap<String, DiagnosticGroup> getRegisteredGroups() {
    return ImmutableMap.copyOf(groupsByName);
  }

  /** Find the diagnostic group registered under the given name, or null if there is none. */
  public static @Nullable DiagnosticGroup forName(String name) {
    return groupsByName.get(name);
  }

  public static final DiagnosticGroup UNUSED_VARIABLES =
      DiagnosticGroups.registerGroup(
          "unusedVariables",
          UnusedVariableCheck.UNUSED_VARIABLE,
          UnusedVariableCheck.UNUSED_CATCH_VARIABLE);

  public static final DiagnosticGroup UNUSED_PARAMETERS =
      DiagnosticGroups.registerGroup("unusedParameters", UnusedVariableCheck.UNUSED_PARAMETER);

  public static final DiagnosticGroup UNDEFINED_VARIABLES =
      DiagnosticGroups.registerGroup("undefinedVariables", UnusedVariableCheck.UNDEFINED_VARIABLE);

  public static final DiagnosticGroup VARIABLE_TRACKER =
      DiagnosticGroups.registerGroup(
          "variableTracker", UNUSED_VARIABLES, UNUSED_PARAMETERS, UNDEFINED_VARIABLES);
}
