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

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Decides what to do with a reported warning or error.
 *
 * <p>A guard returns OFF to suppress the error, WARNING or ERROR to report it at that level, or
 * null when it does not know what to do with it, letting the next guard decide.
 */
public abstract class WarningsGuard implements Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * Returns a new check level for a given error, or null if this guard has no opinion.
   *
   * @param error a reported error.
   * @return what level given error should have.
   */
  public abstract @Nullable CheckLevel level(AnalysisError error);
}
