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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * Analysis error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location, or -1 if unknown.
 * @param variableName The variable the error is about.
 */
public record AnalysisError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    String variableName) {
  public AnalysisError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(variableName, "variableName");
  }

  private static final int DEFAULT_LINENO = -1;

  /**
   * Creates an AnalysisError about a variable.
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param type The DiagnosticType
   * @param variableName The variable, also the first format argument
   * @param arguments Further arguments to be incorporated into the message
   */
  public static AnalysisError make(
      @Nullable String sourceName,
      int lineno,
      DiagnosticType type,
      String variableName,
      String... arguments) {
    String[] formatArguments = new String[arguments.length + 1];
    formatArguments[0] = variableName;
    System.arraycopy(arguments, 0, formatArguments, 1, arguments.length);
    return new AnalysisError(
        type,
        type.format(formatArguments),
        sourceName,
        lineno < 0 ? DEFAULT_LINENO : lineno,
        variableName);
  }

  /** @return the default rendering of an error as text. */
  @Override
  public String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    return this.type().key + ". " + this.description() + " at " + sourceName + " line " + lineno;
  }
}
