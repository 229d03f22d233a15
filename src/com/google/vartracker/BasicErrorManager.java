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
import com.google.errorprone.annotations.ForOverride;
import java.util.Comparator;
import java.util.TreeSet;

/**
 * An error manager that keeps the errors and warnings reported to it in memory, sorted by level,
 * source name, line, variable and description.
 *
 * <p>This error manager does not produce any output, but subclasses can override {@link
 * #println(CheckLevel, AnalysisError)} and {@link #printSummary()} to generate custom output from
 * {@link #generateReport()}.
 */
public class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(LEVELED_ERROR_COMPARATOR);
  private int errorCount = 0;
  private int warningCount = 0;

  public BasicErrorManager() {}

  @Override
  public void report(CheckLevel level, AnalysisError error) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<AnalysisError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<AnalysisError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<AnalysisError> toList(CheckLevel level) {
    ImmutableList.Builder<AnalysisError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /** Prints one message. Called by {@link #generateReport()}; does nothing by default. */
  @ForOverride
  protected void println(CheckLevel level, AnalysisError error) {}

  /** Prints the number of errors and warnings. Does nothing by default. */
  @ForOverride
  protected void printSummary() {}

  // Errors first, then by source name (unknown sources first), line, variable and description.
  private static final Comparator<ErrorWithLevel> LEVELED_ERROR_COMPARATOR =
      Comparator.<ErrorWithLevel, CheckLevel>comparing(p -> p.level)
          .thenComparing(
              p -> p.error.sourceName(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
          .thenComparingInt(p -> p.error.lineno())
          .thenComparing(p -> p.error.variableName())
          .thenComparing(p -> p.error.description());

  private static final class ErrorWithLevel {
    final AnalysisError error;
    final CheckLevel level;

    ErrorWithLevel(AnalysisError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
