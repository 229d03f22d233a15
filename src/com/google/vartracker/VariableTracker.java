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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.vartracker.ast.Node;
import com.google.vartracker.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks the body of one function or closure and records every definition and use of its variables
 * in a {@link VariableGraph}.
 *
 * <p>The body is traversed once, depth first, in program order. Each branch of a statement is
 * visited in its own {@link VariableTrackingBranchScope}; where the branches reconverge, the
 * definitions live at the end of each branch that can reach that point are unioned. Loop bodies are
 * visited once as well; reads that a later iteration may link to a definition further down the
 * body are replayed with {@link VariableGraph#recordLoopSelfUsage} once the body is done.
 *
 * <p>Nested closures are not entered: each callable gets its own, independent analysis.
 */
public final class VariableTracker {

  /** What the traversal of one callable found. */
  public static final class Result {
    private final Node callable;
    private final VariableGraph graph;
    private final ImmutableSet<Integer> parameterDefinitionIds;
    private final ImmutableSet<Integer> catchDefinitionIds;
    private final ImmutableSetMultimap<String, Node> undefinedUses;

    private Result(
        Node callable,
        VariableGraph graph,
        ImmutableSet<Integer> parameterDefinitionIds,
        ImmutableSet<Integer> catchDefinitionIds,
        ImmutableSetMultimap<String, Node> undefinedUses) {
      this.callable = callable;
      this.graph = graph;
      this.parameterDefinitionIds = parameterDefinitionIds;
      this.catchDefinitionIds = catchDefinitionIds;
      this.undefinedUses = undefinedUses;
    }

    public Node getCallable() {
      return callable;
    }

    /** Returns the function name, or {@code {closure}} for a closure. */
    public String getCallableName() {
      return callable.getToken() == Token.FUNCTION ? callable.getString() : "{closure}";
    }

    public VariableGraph getGraph() {
      return graph;
    }

    /** Ids of the definitions made by parameters and by variables captured by a closure. */
    public ImmutableSet<Integer> getParameterDefinitionIds() {
      return parameterDefinitionIds;
    }

    /** Ids of the definitions made by catch clauses. */
    public ImmutableSet<Integer> getCatchDefinitionIds() {
      return catchDefinitionIds;
    }

    /** Reads that no definition reached when they were visited, by variable name. */
    public ImmutableSetMultimap<String, Node> getUndefinedUses() {
      return undefinedUses;
    }
  }

  private final Node callable;
  private final VariableGraph graph = new VariableGraph();

  // Innermost loop first.
  private final Deque<VariableTrackingLoopScope> loopScopes = new ArrayDeque<>();

  // Definitions made inside the try statements being visited, innermost first.
  private final Deque<SetMultimap<String, Integer>> tryDefinitions = new ArrayDeque<>();

  // Try statements with a finally block being visited, innermost first. A break or continue
  // inside one reaches its loop only after the finally block has run.
  private final Deque<FinallyFrame> finallyFrames = new ArrayDeque<>();

  private final ImmutableSet.Builder<Integer> parameterDefinitionIds = ImmutableSet.builder();
  private final ImmutableSet.Builder<Integer> catchDefinitionIds = ImmutableSet.builder();
  private final SetMultimap<String, Node> undefinedUses = LinkedHashMultimap.create();

  /** A break or continue whose definitions still have to pass through finally blocks. */
  private static final class PendingJump {
    final Token token;
    final VariableTrackingLoopScope target;
    final int targetDepth;
    final ImmutableMap<String, ImmutableSet<Integer>> definitions;

    PendingJump(
        Token token,
        VariableTrackingLoopScope target,
        int targetDepth,
        ImmutableMap<String, ImmutableSet<Integer>> definitions) {
      this.token = token;
      this.target = target;
      this.targetDepth = targetDepth;
      this.definitions = definitions;
    }

    PendingJump withWritesOf(Map<String, ImmutableSet<Integer>> finallyDefinitions) {
      Map<String, ImmutableSet<Integer>> overlaid = new LinkedHashMap<>(definitions);
      overlaid.putAll(finallyDefinitions);
      return new PendingJump(token, target, targetDepth, ImmutableMap.copyOf(overlaid));
    }
  }

  private static final class FinallyFrame {
    // Number of loops around the try statement.
    final int loopDepth;
    final List<PendingJump> pendingJumps = new ArrayList<>();

    FinallyFrame(int loopDepth) {
      this.loopDepth = loopDepth;
    }
  }

  private VariableTracker(Node callable) {
    this.callable = callable;
  }

  /** Analyzes a FUNCTION or CLOSURE node. */
  public static Result analyze(Node callable) {
    checkArgument(callable.isCallable(), "Expected a function or closure: %s", callable);
    VariableTracker tracker = new VariableTracker(callable);
    tracker.visitCallable();
    return new Result(
        callable,
        tracker.graph,
        tracker.parameterDefinitionIds.build(),
        tracker.catchDefinitionIds.build(),
        ImmutableSetMultimap.copyOf(tracker.undefinedUses));
  }

  private void visitCallable() {
    VariableTrackingScope scope = new VariableTrackingScope();
    Node params = callable.getFirstChild();
    for (Node param = params.getFirstChild(); param != null; param = param.getNext()) {
      if (param.hasChildren()) {
        // Default value.
        visitExpression(param.getFirstChild(), scope);
      }
      recordParameter(param, scope);
    }
    if (callable.getToken() == Token.CLOSURE) {
      for (Node use : callable.getSecondChild().children()) {
        recordParameter(use, scope);
      }
    }
    visitStatement(callable.getLastChild(), scope);
  }

  private void recordParameter(Node param, VariableTrackingScope scope) {
    checkState(param.isName(), param);
    if (param.isByRef()) {
      graph.markAsReference(param.getString());
    }
    recordDefinition(param, scope);
    parameterDefinitionIds.add(param.getId());
  }

  /**
   * Visits a statement.
   *
   * @return whether control may continue with the next statement
   */
  private boolean visitStatement(Node n, VariableTrackingScope scope) {
    switch (n.getToken()) {
      case BLOCK:
        return visitBlock(n, scope);
      case EMPTY:
      case FUNCTION:
        // Nested function declarations are analyzed on their own.
        return true;
      case EXPR_RESULT:
      case ECHO:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          visitExpression(child, scope);
        }
        return true;
      case RETURN:
      case THROW:
        if (n.hasChildren()) {
          visitExpression(n.getFirstChild(), scope);
        }
        return false;
      case IF:
        return visitIf(n, scope);
      case WHILE:
        return visitWhile(n, scope);
      case DO:
        return visitDo(n, scope);
      case FOR:
        return visitFor(n, scope);
      case FOREACH:
        return visitForEach(n, scope);
      case TRY:
        return visitTry(n, scope);
      case BREAK:
      case CONTINUE:
        return visitBreakOrContinue(n, scope);
      case GLOBAL:
        for (Node name = n.getFirstChild(); name != null; name = name.getNext()) {
          graph.markAsGlobalVariable(name.getString());
          recordDefinition(name, scope);
        }
        return true;
      case STATIC:
        for (Node name = n.getFirstChild(); name != null; name = name.getNext()) {
          if (name.hasChildren()) {
            visitExpression(name.getFirstChild(), scope);
          }
          graph.markAsStaticVariable(name.getString());
          recordDefinition(name, scope);
        }
        return true;
      default:
        throw new IllegalStateException("Unexpected statement: " + n);
    }
  }

  private boolean visitBlock(Node block, VariableTrackingScope scope) {
    // Statements after a return or break are still visited; their definitions go to a path that
    // no join picks up.
    boolean completes = true;
    for (Node child = block.getFirstChild(); child != null; child = child.getNext()) {
      if (!visitStatement(child, scope)) {
        completes = false;
      }
    }
    return completes;
  }

  private boolean visitIf(Node n, VariableTrackingScope scope) {
    visitExpression(n.getFirstChild(), scope);
    Node thenBranch = n.getSecondChild();
    Node elseBranch = thenBranch.getNext();

    List<ImmutableMap<String, ImmutableSet<Integer>>> exits = new ArrayList<>();
    VariableTrackingBranchScope thenScope = scope.createBranchScope();
    if (visitStatement(thenBranch, thenScope)) {
      exits.add(thenScope.getOwnDefinitions());
    }
    scope.mergeUses(thenScope);

    boolean includeSelf = elseBranch == null;
    if (elseBranch != null) {
      VariableTrackingBranchScope elseScope = scope.createBranchScope();
      if (visitStatement(elseBranch, elseScope)) {
        exits.add(elseScope.getOwnDefinitions());
      }
      scope.mergeUses(elseScope);
    }
    if (exits.isEmpty() && !includeSelf) {
      return false;
    }
    scope.mergeBranchDefinitions(exits, includeSelf);
    return true;
  }

  private boolean visitWhile(Node n, VariableTrackingScope scope) {
    VariableTrackingLoopScope loopScope = enterLoop(scope);
    visitExpression(n.getFirstChild(), loopScope);
    boolean bodyCompletes = visitStatement(n.getLastChild(), loopScope);
    boolean reachesNextIteration = joinIterationEnd(loopScope, bodyCompletes);
    return exitLoop(scope, loopScope, reachesNextIteration, /* mayRunZeroTimes= */ true);
  }

  private boolean visitDo(Node n, VariableTrackingScope scope) {
    VariableTrackingLoopScope loopScope = enterLoop(scope);
    boolean bodyCompletes = visitStatement(n.getFirstChild(), loopScope);
    boolean reachesCondition = joinIterationEnd(loopScope, bodyCompletes);
    if (reachesCondition) {
      visitExpression(n.getLastChild(), loopScope);
    }
    return exitLoop(scope, loopScope, reachesCondition, /* mayRunZeroTimes= */ false);
  }

  private boolean visitFor(Node n, VariableTrackingScope scope) {
    Node init = n.getFirstChild();
    Node cond = init.getNext();
    Node incr = cond.getNext();
    Node body = incr.getNext();

    visitExpression(init, scope);
    VariableTrackingLoopScope loopScope = enterLoop(scope);
    visitExpression(cond, loopScope);
    boolean bodyCompletes = visitStatement(body, loopScope);
    boolean reachesIncrement = joinIterationEnd(loopScope, bodyCompletes);
    if (reachesIncrement) {
      visitExpression(incr, loopScope);
    }
    return exitLoop(scope, loopScope, reachesIncrement, /* mayRunZeroTimes= */ true);
  }

  private boolean visitForEach(Node n, VariableTrackingScope scope) {
    Node subject = n.getFirstChild();
    Node key = subject.getNext();
    Node value = key.getNext();
    Node body = value.getNext();

    visitExpression(subject, scope);
    VariableTrackingLoopScope loopScope = enterLoop(scope);
    boolean hasKey = !key.isEmpty();
    if (hasKey) {
      recordDefinition(key, loopScope);
    }
    if (value.isName()) {
      if (value.isByRef()) {
        graph.markAsReference(value.getString());
      } else if (hasKey) {
        // foreach ($arr as $k => $v) has to assign $v even when only the keys are wanted.
        graph.markAsLoopValueNode(value);
      }
      recordDefinition(value, loopScope);
    } else {
      visitAssignmentTarget(value, loopScope);
    }
    boolean bodyCompletes = visitStatement(body, loopScope);
    boolean reachesNextIteration = joinIterationEnd(loopScope, bodyCompletes);
    return exitLoop(scope, loopScope, reachesNextIteration, /* mayRunZeroTimes= */ true);
  }

  private VariableTrackingLoopScope enterLoop(VariableTrackingScope scope) {
    VariableTrackingLoopScope loopScope = scope.createLoopScope();
    loopScopes.push(loopScope);
    return loopScope;
  }

  /**
   * Replaces the definitions of the loop scope with the join of the paths that start another
   * iteration: the end of the body and every {@code continue}.
   *
   * @return whether any path starts another iteration
   */
  private boolean joinIterationEnd(VariableTrackingLoopScope loopScope, boolean bodyCompletes) {
    List<ImmutableMap<String, ImmutableSet<Integer>>> ends = new ArrayList<>();
    if (bodyCompletes) {
      ends.add(loopScope.getOwnDefinitions());
    }
    ends.addAll(loopScope.getContinueDefinitions());
    if (ends.isEmpty()) {
      return false;
    }
    loopScope.replaceDefinitions(ImmutableMap.of());
    loopScope.mergeBranchDefinitions(ends, /* includeSelf= */ false);
    return true;
  }

  /**
   * Links the reads exposed to the start of the loop to the definitions live at the end of an
   * iteration, pops the loop, and joins its exits into {@code scope}.
   */
  private boolean exitLoop(
      VariableTrackingScope scope,
      VariableTrackingLoopScope loopScope,
      boolean reachesNextIteration,
      boolean mayRunZeroTimes) {
    checkState(loopScopes.peek() == loopScope);
    if (reachesNextIteration) {
      replayLoopUses(loopScope);
    }
    loopScopes.pop();

    List<ImmutableMap<String, ImmutableSet<Integer>>> exits = new ArrayList<>();
    if (reachesNextIteration) {
      exits.add(loopScope.getOwnDefinitions());
    }
    exits.addAll(loopScope.getBreakDefinitions());
    scope.mergeUses(loopScope);
    if (exits.isEmpty() && !mayRunZeroTimes) {
      return false;
    }
    scope.mergeBranchDefinitions(exits, mayRunZeroTimes);
    return true;
  }

  private void replayLoopUses(VariableTrackingLoopScope loopScope) {
    SetMultimap<String, Integer> exposedUses = loopScope.getExposedUses();
    for (String name : exposedUses.keySet()) {
      ImmutableSet<Integer> carriedDefinitions =
          loopScope.getDefinitionUpToScope(name, loopScope);
      if (carriedDefinitions == null) {
        continue;
      }
      Collection<Integer> uses = exposedUses.get(name);
      for (int defId : carriedDefinitions) {
        graph.recordLoopSelfUsage(name, defId, uses);
      }
    }
  }

  private boolean visitBreakOrContinue(Node n, VariableTrackingScope scope) {
    VariableTrackingLoopScope loopScope = loopScopes.peek();
    checkState(loopScope != null, "%s outside of a loop", n);
    ImmutableMap<String, ImmutableSet<Integer>> definitions =
        ((VariableTrackingBranchScope) scope).getDefinitionsUpToScope(loopScope);
    dispatchJump(new PendingJump(n.getToken(), loopScope, loopScopes.size(), definitions));
    return false;
  }

  /**
   * Hands a jump to the innermost enclosing finally block inside its target loop, or records it on
   * the loop when there is none.
   */
  private void dispatchJump(PendingJump jump) {
    FinallyFrame frame = finallyFrames.peek();
    if (frame != null && frame.loopDepth >= jump.targetDepth) {
      frame.pendingJumps.add(jump);
    } else if (jump.token == Token.BREAK) {
      jump.target.recordBreak(jump.definitions);
    } else {
      jump.target.recordContinue(jump.definitions);
    }
  }

  private boolean visitTry(Node n, VariableTrackingScope scope) {
    Node tryBlock = n.getFirstChild();
    Node catches = tryBlock.getNext();
    Node finallyBlock = catches.getNext();

    FinallyFrame finallyFrame = null;
    if (!finallyBlock.isEmpty()) {
      finallyFrame = new FinallyFrame(loopScopes.size());
      finallyFrames.push(finallyFrame);
    }
    SetMultimap<String, Integer> definitionsInTry = LinkedHashMultimap.create();
    tryDefinitions.push(definitionsInTry);
    List<ImmutableMap<String, ImmutableSet<Integer>>> exits = new ArrayList<>();
    VariableTrackingBranchScope tryScope = scope.createBranchScope();
    if (visitStatement(tryBlock, tryScope)) {
      exits.add(tryScope.getOwnDefinitions());
    }
    scope.mergeUses(tryScope);

    // Any write in the try block may be the last one before the exception.
    ImmutableList<ImmutableMap<String, ImmutableSet<Integer>>> throwPoints =
        ImmutableList.of(toDefinitionMap(definitionsInTry));
    for (Node catchNode = catches.getFirstChild();
        catchNode != null;
        catchNode = catchNode.getNext()) {
      VariableTrackingBranchScope catchScope = scope.createBranchScope();
      catchScope.mergeBranchDefinitions(throwPoints, /* includeSelf= */ true);
      Node name = catchNode.getFirstChild();
      if (name.isName()) {
        recordDefinition(name, catchScope);
        catchDefinitionIds.add(name.getId());
      }
      if (visitStatement(catchNode.getLastChild(), catchScope)) {
        exits.add(catchScope.getOwnDefinitions());
      }
      scope.mergeUses(catchScope);
    }
    checkState(tryDefinitions.pop() == definitionsInTry);
    if (finallyFrame != null) {
      checkState(finallyFrames.pop() == finallyFrame);
    }

    // The finally block also runs when the try or a catch is left early, so it may observe the
    // state before the try as well as any write made in the try or the catches.
    VariableTrackingBranchScope finallyEntry = null;
    if (finallyFrame != null) {
      finallyEntry = scope.createBranchScope();
      finallyEntry.mergeBranchDefinitions(
          ImmutableList.of(toDefinitionMap(definitionsInTry)), /* includeSelf= */ true);
    }

    boolean completes = !exits.isEmpty();
    if (completes) {
      scope.mergeBranchDefinitions(exits, /* includeSelf= */ false);
    }
    if (finallyEntry == null) {
      return completes;
    }

    VariableTrackingBranchScope finallyScope = finallyEntry.createBranchScope();
    boolean finallyCompletes = visitStatement(finallyBlock, finallyScope);
    scope.mergeUses(finallyScope);
    if (!finallyCompletes) {
      // The pending jumps end in the finally block.
      return false;
    }
    ImmutableMap<String, ImmutableSet<Integer>> finallyDefinitions =
        finallyScope.getOwnDefinitions();
    for (PendingJump jump : finallyFrame.pendingJumps) {
      dispatchJump(jump.withWritesOf(finallyDefinitions));
    }
    if (completes) {
      scope.mergeBranchDefinitions(
          ImmutableList.of(finallyDefinitions), /* includeSelf= */ false);
    }
    return completes;
  }

  private static ImmutableMap<String, ImmutableSet<Integer>> toDefinitionMap(
      SetMultimap<String, Integer> definitions) {
    ImmutableMap.Builder<String, ImmutableSet<Integer>> builder = ImmutableMap.builder();
    for (Map.Entry<String, Collection<Integer>> entry : definitions.asMap().entrySet()) {
      builder.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
    }
    return builder.buildOrThrow();
  }

  private void visitExpression(Node n, VariableTrackingScope scope) {
    switch (n.getToken()) {
      case NAME:
        recordUsage(n, scope);
        return;
      case EMPTY:
      case NUMBER:
      case STRINGLIT:
        return;
      case ASSIGN:
        visitExpression(n.getLastChild(), scope);
        visitAssignmentTarget(n.getFirstChild(), scope);
        return;
      case ASSIGN_OP:
        visitExpression(n.getLastChild(), scope);
        visitReadModifyWrite(n.getFirstChild(), scope);
        return;
      case INC:
      case DEC:
        visitReadModifyWrite(n.getFirstChild(), scope);
        return;
      case ASSIGN_REF:
        visitAssignRef(n, scope);
        return;
      case AND:
      case OR:
        {
          visitExpression(n.getFirstChild(), scope);
          VariableTrackingBranchScope rightScope = scope.createBranchScope();
          visitExpression(n.getLastChild(), rightScope);
          scope.mergeUses(rightScope);
          scope.mergeBranchDefinitions(
              ImmutableList.of(rightScope.getOwnDefinitions()), /* includeSelf= */ true);
          return;
        }
      case HOOK:
        {
          visitExpression(n.getFirstChild(), scope);
          VariableTrackingBranchScope thenScope = scope.createBranchScope();
          visitExpression(n.getSecondChild(), thenScope);
          VariableTrackingBranchScope elseScope = scope.createBranchScope();
          visitExpression(n.getLastChild(), elseScope);
          scope.mergeUses(thenScope);
          scope.mergeUses(elseScope);
          scope.mergeBranchDefinitions(
              ImmutableList.of(thenScope.getOwnDefinitions(), elseScope.getOwnDefinitions()),
              /* includeSelf= */ false);
          return;
        }
      case CLOSURE:
        visitClosureCaptures(n.getSecondChild(), scope);
        return;
      case CALL:
      case GETELEM:
      case BINARY_OP:
      case NOT:
      case EXPR_LIST:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          visitExpression(child, scope);
        }
        return;
      default:
        throw new IllegalStateException("Unexpected expression: " + n);
    }
  }

  private void visitAssignmentTarget(Node target, VariableTrackingScope scope) {
    switch (target.getToken()) {
      case NAME:
        recordDefinition(target, scope);
        return;
      case GETELEM:
        // $a[$i] = ... modifies the existing value of $a.
        visitExpression(target.getLastChild(), scope);
        visitElementBase(target.getFirstChild(), scope);
        return;
      case EXPR_LIST:
        // [$a, $b] = ...
        for (Node child = target.getFirstChild(); child != null; child = child.getNext()) {
          visitAssignmentTarget(child, scope);
        }
        return;
      case EMPTY:
        return;
      default:
        throw new IllegalStateException("Unexpected assignment target: " + target);
    }
  }

  private void visitElementBase(Node base, VariableTrackingScope scope) {
    if (base.getToken() == Token.GETELEM) {
      visitExpression(base.getLastChild(), scope);
      visitElementBase(base.getFirstChild(), scope);
    } else {
      visitExpression(base, scope);
    }
  }

  private void visitReadModifyWrite(Node target, VariableTrackingScope scope) {
    if (target.isName()) {
      recordUsage(target, scope);
      recordDefinition(target, scope);
    } else {
      visitAssignmentTarget(target, scope);
    }
  }

  private void visitAssignRef(Node n, VariableTrackingScope scope) {
    Node target = n.getFirstChild();
    Node source = n.getLastChild();
    if (source.isName()) {
      bindByReference(source, scope);
    } else {
      visitExpression(source, scope);
    }
    if (target.isName()) {
      graph.markAsReference(target.getString());
      recordDefinition(target, scope);
    } else {
      visitAssignmentTarget(target, scope);
    }
  }

  private void visitClosureCaptures(Node uses, VariableTrackingScope scope) {
    for (Node use = uses.getFirstChild(); use != null; use = use.getNext()) {
      if (use.isByRef()) {
        bindByReference(use, scope);
      } else {
        recordUsage(use, scope);
      }
    }
  }

  /**
   * Handles a variable that becomes an alias of another binding, as the source of {@code $a = &$b}
   * or in {@code function () use (&$b)}. Binding an undefined variable by reference defines it.
   */
  private void bindByReference(Node name, VariableTrackingScope scope) {
    graph.markAsReference(name.getString());
    if (scope.getDefinition(name.getString()).isEmpty()) {
      recordDefinition(name, scope);
    } else {
      recordUsage(name, scope);
    }
  }

  private void recordDefinition(Node name, VariableTrackingScope scope) {
    String varName = name.getString();
    graph.recordVariableDefinition(varName, name, scope);
    for (SetMultimap<String, Integer> definitions : tryDefinitions) {
      definitions.put(varName, name.getId());
    }
  }

  private void recordUsage(Node name, VariableTrackingScope scope) {
    String varName = name.getString();
    if (scope.getDefinition(varName).isEmpty()) {
      undefinedUses.put(varName, name);
    }
    graph.recordVariableUsage(varName, name, scope);
    for (VariableTrackingLoopScope loopScope : loopScopes) {
      if (((VariableTrackingBranchScope) scope).getDefinitionUpToScope(varName, loopScope)
          != null) {
        break;
      }
      loopScope.recordExposedUse(varName, name.getId());
    }
  }
}
