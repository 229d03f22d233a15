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

import java.util.logging.Level;

/**
 * Controls checking levels of the variable tracker's diagnostics, so that each check can be
 * turned off, reported as a warning, or reported as an error.
 */
public enum CheckLevel {
  ERROR(Level.SEVERE),
  WARNING(Level.WARNING),
  OFF(Level.OFF);

  private final Level logLevel;

  CheckLevel(Level logLevel) {
    this.logLevel = logLevel;
  }

  boolean isOn() {
    return this != OFF;
  }

  /** Returns the level at which a diagnostic reported at this check level is logged. */
  Level toLogLevel() {
    return logLevel;
  }
}
