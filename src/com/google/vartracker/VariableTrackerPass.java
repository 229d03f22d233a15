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
import static com.google.common.base.Throwables.throwIfUnchecked;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.vartracker.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the {@link VariableTracker} on every function and closure of a tree and reports what the
 * {@link UnusedVariableCheck} finds to an {@link ErrorManager}.
 *
 * <p>Callables are analyzed independently. With more than one thread configured, they are analyzed
 * on a fixed thread pool; the diagnostics are still reported on the calling thread, in the order
 * the callables appear in the tree.
 */
public class VariableTrackerPass {
  private static final Logger logger = Logger.getLogger(VariableTrackerPass.class.getName());

  private final VariableTrackerOptions options;
  private final ErrorManager errorManager;
  private final UnusedVariableCheck check;

  public VariableTrackerPass(VariableTrackerOptions options, ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
    this.check = new UnusedVariableCheck(options);
  }

  /**
   * Analyzes every callable under {@code root}, nested ones included.
   *
   * @return the result of each callable, in tree order
   */
  public ImmutableList<VariableTracker.Result> process(Node root) {
    List<Node> callables = new ArrayList<>();
    collectCallables(root, callables);

    ImmutableList<VariableTracker.Result> results =
        options.getNumParallelThreads() > 1 && callables.size() > 1
            ? analyzeInParallel(callables)
            : analyzeSequentially(callables);

    int reported = 0;
    for (VariableTracker.Result result : results) {
      reported += report(result);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Analyzed " + results.size() + " callable(s), reported " + reported + " diagnostic(s)");
    }
    return results;
  }

  private static void collectCallables(Node n, List<Node> callables) {
    if (n.isCallable()) {
      callables.add(n);
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      collectCallables(child, callables);
    }
  }

  private static ImmutableList<VariableTracker.Result> analyzeSequentially(List<Node> callables) {
    ImmutableList.Builder<VariableTracker.Result> results = ImmutableList.builder();
    for (Node callable : callables) {
      results.add(VariableTracker.analyze(callable));
    }
    return results.build();
  }

  private ImmutableList<VariableTracker.Result> analyzeInParallel(List<Node> callables) {
    ExecutorService executor =
        Executors.newFixedThreadPool(
            options.getNumParallelThreads(),
            new ThreadFactoryBuilder().setNameFormat("vartracker-%d").setDaemon(true).build());
    try {
      List<Future<VariableTracker.Result>> futures = new ArrayList<>();
      for (Node callable : callables) {
        futures.add(executor.submit(() -> VariableTracker.analyze(callable)));
      }
      ImmutableList.Builder<VariableTracker.Result> results = ImmutableList.builder();
      for (Future<VariableTracker.Result> future : futures) {
        results.add(future.get());
      }
      return results.build();
    } catch (ExecutionException e) {
      throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } finally {
      executor.shutdownNow();
    }
  }

  private int report(VariableTracker.Result result) {
    int reported = 0;
    for (AnalysisError error : check.check(result)) {
      CheckLevel level = options.getErrorLevel(error);
      if (level.isOn()) {
        errorManager.report(level, error);
        reported++;
      }
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          result.getCallableName()
              + ": "
              + result.getGraph().getDefinitionCount()
              + " definition(s), "
              + reported
              + " diagnostic(s)");
    }
    return reported;
  }
}
