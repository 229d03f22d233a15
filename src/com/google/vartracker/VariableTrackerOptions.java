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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** Options for the variable tracker. */
public class VariableTrackerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Names matching this pattern are never reported as unused. */
  public static final Pattern DEFAULT_IGNORED_VARIABLE_PATTERN =
      Pattern.compile("^(_$|[iI]gnored|[uU]nused)");

  public static final ImmutableSet<String> DEFAULT_PREDEFINED_VARIABLE_NAMES =
      ImmutableSet.of("this");

  // Later guards take precedence over earlier ones.
  private final List<WarningsGuard> warningsGuards = new ArrayList<>();

  private Pattern ignoredVariablePattern = DEFAULT_IGNORED_VARIABLE_PATTERN;

  private ImmutableSet<String> predefinedVariableNames = DEFAULT_PREDEFINED_VARIABLE_NAMES;

  private int numParallelThreads = 1;

  public VariableTrackerOptions() {}

  /** Configure the given type of warning to the given level. */
  public void setWarningLevel(DiagnosticGroup type, CheckLevel level) {
    addWarningsGuard(new DiagnosticGroupWarningsGuard(type, level));
  }

  /** Adds a guard that overrides the guards added before it. */
  public void addWarningsGuard(WarningsGuard guard) {
    warningsGuards.add(checkNotNull(guard));
  }

  ImmutableList<WarningsGuard> getWarningsGuards() {
    return ImmutableList.copyOf(warningsGuards);
  }

  /**
   * Returns the level {@code error} is reported at: the level given by the last guard that has an
   * opinion on it, or else the default level of its type.
   */
  public CheckLevel getErrorLevel(AnalysisError error) {
    for (int i = warningsGuards.size() - 1; i >= 0; i--) {
      CheckLevel level = warningsGuards.get(i).level(error);
      if (level != null) {
        return level;
      }
    }
    return error.type().level;
  }

  public void setIgnoredVariablePattern(Pattern ignoredVariablePattern) {
    this.ignoredVariablePattern = checkNotNull(ignoredVariablePattern);
  }

  public Pattern getIgnoredVariablePattern() {
    return ignoredVariablePattern;
  }

  /** Sets the names that are defined on entry to every callable, like {@code this}. */
  public void setPredefinedVariableNames(Set<String> names) {
    this.predefinedVariableNames = ImmutableSet.copyOf(names);
  }

  public ImmutableSet<String> getPredefinedVariableNames() {
    return predefinedVariableNames;
  }

  /** Sets the number of threads used to analyze callables. 1 analyzes on the calling thread. */
  public void setNumParallelThreads(int numParallelThreads) {
    checkArgument(
        numParallelThreads > 0, "Expected a positive thread count: %s", numParallelThreads);
    this.numParallelThreads = numParallelThreads;
  }

  public int getNumParallelThreads() {
    return numParallelThreads;
  }

  @Override
  public String toString() {
    return "VariableTrackerOptions{guards="
        + warningsGuards
        + ", ignoredVariablePattern="
        + ignoredVariablePattern
        + ", predefinedVariableNames="
        + predefinedVariableNames
        + ", numParallelThreads="
        + numParallelThreads
        + "}";
  }
}
