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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.vartracker.ast.IR;
import com.google.vartracker.ast.Node;
import com.google.vartracker.ast.NodeArena;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link VariableTracker}. */
@RunWith(JUnit4.class)
public final class VariableTrackerTest {

  private final IR ir = IR.forArena(new NodeArena());

  @Test
  public void testStraightLine() {
    Node a = ir.name("a");
    Node readA = ir.name("a");
    Node b = ir.name("b");
    Node readB = ir.name("b");
    VariableTracker.Result result =
        analyze(
            assign(a, ir.number(1)),
            assign(b, readA),
            ir.echo(readB));

    assertUses(result, a, readA);
    assertUses(result, b, readB);
    assertThat(result.getUndefinedUses()).isEmpty();
    assertThat(result.getCallableName()).isEqualTo("f");
  }

  @Test
  public void testParameters() {
    Node p = ir.name("p");
    Node q = ir.name("q");
    Node readQ = ir.name("q");
    Node fn = function(ir.paramList(p, q), ir.returnNode(readQ));

    VariableTracker.Result result = VariableTracker.analyze(fn);

    assertUses(result, p);
    assertUses(result, q, readQ);
    assertThat(result.getParameterDefinitionIds()).containsExactly(p.getId(), q.getId());
  }

  @Test
  public void testParameterDefaultValueIsRead() {
    Node readDefault = ir.name("d");
    Node p = ir.param("p", readDefault);
    Node fn = function(ir.paramList(p), ir.returnNode(ir.name("p")));

    VariableTracker.Result result = VariableTracker.analyze(fn);

    assertThat(result.getUndefinedUses().get("d")).containsExactly(readDefault);
  }

  @Test
  public void testByRefParameterIsReference() {
    Node fn = function(ir.paramList(ir.refName("out")), ir.empty());

    VariableTracker.Result result = VariableTracker.analyze(fn);

    assertThat(result.getGraph().isReference("out")).isTrue();
  }

  @Test
  public void testRedefinitionHidesEarlierDefinition() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(assign(x1, ir.number(1)), assign(x2, ir.number(2)), ir.echo(read));

    assertUses(result, x1);
    assertUses(result, x2, read);
  }

  @Test
  public void testIfWithoutElseMergesWithPathAround() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.ifNode(ir.number(1), ir.block(assign(x2, ir.number(2)))),
            ir.echo(read));

    assertUses(result, x1, read);
    assertUses(result, x2, read);
  }

  @Test
  public void testIfElseReplacesEarlierDefinition() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node x3 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.ifNode(
                ir.number(1),
                ir.block(assign(x2, ir.number(2))),
                ir.block(assign(x3, ir.number(3)))),
            ir.echo(read));

    assertUses(result, x1);
    assertUses(result, x2, read);
    assertUses(result, x3, read);
  }

  @Test
  public void testIfElseOnlyOneBranchDefines() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.ifNode(
                ir.number(1),
                ir.block(assign(x2, ir.number(2))),
                ir.block(ir.echo(ir.number(3)))),
            ir.echo(read));

    assertUses(result, x1, read);
    assertUses(result, x2, read);
  }

  @Test
  public void testBranchThatReturnsDoesNotReachJoin() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.ifNode(ir.number(1), ir.block(assign(x2, ir.number(2)), ir.returnNode())),
            ir.echo(read));

    assertUses(result, x1, read);
    assertUses(result, x2);
  }

  @Test
  public void testBranchThatThrowsDoesNotReachJoin() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.ifNode(
                ir.number(1),
                ir.block(assign(x2, ir.number(2))),
                ir.block(ir.throwNode(ir.call("error")))),
            ir.echo(read));

    assertUses(result, x1);
    assertUses(result, x2, read);
  }

  @Test
  public void testWhileLoopSelfUsage() {
    Node x1 = ir.name("x");
    Node readInBody = ir.name("x");
    Node readInIncrement = ir.name("x");
    Node x2 = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(0)),
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.echo(readInBody),
                    assign(x2, ir.binaryOp("+", readInIncrement, ir.number(1))))),
            ir.echo(readAfter));

    assertUses(result, x1, readInBody, readInIncrement, readAfter);
    assertUses(result, x2, readInBody, readInIncrement, readAfter);
  }

  @Test
  public void testWhileConditionSeesDefinitionsFromBody() {
    Node x1 = ir.name("x");
    Node readInCondition = ir.name("x");
    Node x2 = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(0)),
            ir.whileNode(readInCondition, ir.block(assign(x2, ir.call("next")))));

    assertUses(result, x1, readInCondition);
    assertUses(result, x2, readInCondition);
  }

  @Test
  public void testLoopDefinitionReadOnlyOnNextIteration() {
    Node read = ir.name("y");
    Node y = ir.name("y");
    VariableTracker.Result result =
        analyze(
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.ifNode(ir.call("notFirst"), ir.block(ir.echo(read))),
                    assign(y, ir.number(1)))));

    assertUses(result, y, read);
    // Undefined when visited; the loop-carried edge is added afterwards.
    assertThat(result.getUndefinedUses().get("y")).containsExactly(read);
    assertThat(result.getGraph().hasDefinitionReaching("y", read.getId())).isTrue();
  }

  @Test
  public void testIncrementInLoopDoesNotJustifyItself() {
    Node i1 = ir.name("i");
    Node i2 = ir.name("i");
    VariableTracker.Result result =
        analyze(
            assign(i1, ir.number(0)),
            ir.whileNode(ir.call("more"), ir.block(ir.exprResult(ir.inc(i2)))));

    assertUses(result, i1, i2);
    assertUses(result, i2);
  }

  @Test
  public void testCompoundAssignmentInLoop() {
    Node sum1 = ir.name("sum");
    Node sum2 = ir.name("sum");
    Node readAfter = ir.name("sum");
    VariableTracker.Result result =
        analyze(
            assign(sum1, ir.number(0)),
            ir.whileNode(
                ir.call("more"),
                ir.block(ir.exprResult(ir.assignOp("+=", sum2, ir.call("next"))))),
            ir.returnNode(readAfter));

    assertUses(result, sum1, sum2, readAfter);
    assertUses(result, sum2, readAfter);
  }

  @Test
  public void testForLoop() {
    Node i1 = ir.name("i");
    Node readInCondition = ir.name("i");
    Node readInBody = ir.name("i");
    Node increment = ir.name("i");
    VariableTracker.Result result =
        analyze(
            ir.forNode(
                ir.exprList(ir.assign(i1, ir.number(0))),
                ir.binaryOp("<", readInCondition, ir.number(10)),
                ir.exprList(ir.inc(increment)),
                ir.block(ir.echo(readInBody))));

    assertUses(result, i1, readInCondition, readInBody, increment);
    assertUses(result, increment, readInCondition, readInBody);
  }

  @Test
  public void testDoWhile() {
    Node x0 = ir.name("x");
    Node readInBody = ir.name("x");
    Node x1 = ir.name("x");
    Node readInCondition = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x0, ir.number(0)),
            ir.doNode(ir.block(ir.echo(readInBody), assign(x1, ir.number(1))), readInCondition),
            ir.echo(readAfter));

    assertUses(result, x0, readInBody);
    assertUses(result, x1, readInBody, readInCondition, readAfter);
  }

  @Test
  public void testNestedLoops() {
    Node x0 = ir.name("x");
    Node read = ir.name("x");
    Node x1 = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x0, ir.number(0)),
            ir.whileNode(
                ir.call("outer"),
                ir.block(
                    ir.whileNode(ir.call("inner"), ir.block(ir.echo(read))),
                    assign(x1, ir.number(1)))));

    assertUses(result, x0, read);
    assertUses(result, x1, read);
  }

  @Test
  public void testBreak() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node x3 = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(0)),
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.ifNode(
                        ir.call("done"), ir.block(assign(x2, ir.number(1)), ir.breakNode())),
                    assign(x3, ir.number(2)))),
            ir.echo(readAfter));

    assertUses(result, x1, readAfter);
    assertUses(result, x2, readAfter);
    assertUses(result, x3, readAfter);
  }

  @Test
  public void testContinue() {
    Node x1 = ir.name("x");
    Node readInBody = ir.name("x");
    Node x2 = ir.name("x");
    Node x3 = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(0)),
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.echo(readInBody),
                    ir.ifNode(
                        ir.call("skip"), ir.block(assign(x2, ir.number(1)), ir.continueNode())),
                    assign(x3, ir.number(2)))));

    assertUses(result, x1, readInBody);
    assertUses(result, x2, readInBody);
    assertUses(result, x3, readInBody);
  }

  @Test
  public void testDoWhileBodyAlwaysBreaks() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(0)),
            ir.doNode(ir.block(assign(x2, ir.number(1)), ir.breakNode()), ir.call("more")),
            ir.echo(readAfter));

    assertUses(result, x1);
    assertUses(result, x2, readAfter);
  }

  @Test
  public void testForEachWithKeyMarksValue() {
    Node arr = ir.name("arr");
    Node readArr = ir.name("arr");
    Node k = ir.name("k");
    Node v = ir.name("v");
    Node readK = ir.name("k");
    Node fn =
        function(ir.paramList(arr), ir.forEach(readArr, k, v, ir.block(ir.echo(readK))));

    VariableTracker.Result result = VariableTracker.analyze(fn);

    assertUses(result, arr, readArr);
    assertUses(result, k, readK);
    assertUses(result, v);
    assertThat(result.getGraph().isLoopValueDefinitionId(v.getId())).isTrue();
    assertThat(result.getGraph().isLoopValueDefinitionId(k.getId())).isFalse();
  }

  @Test
  public void testForEachWithoutKey() {
    Node v = ir.name("v");
    VariableTracker.Result result =
        analyze(ir.forEach(ir.call("items"), null, v, ir.block()));

    assertUses(result, v);
    assertThat(result.getGraph().isLoopValueDefinitionId(v.getId())).isFalse();
  }

  @Test
  public void testForEachByReference() {
    Node k = ir.name("k");
    Node v = ir.refName("v");
    VariableTracker.Result result =
        analyze(ir.forEach(ir.call("items"), k, v, ir.block(ir.echo(ir.name("k")))));

    assertThat(result.getGraph().isReference("v")).isTrue();
    assertThat(result.getGraph().isLoopValueDefinitionId(v.getId())).isFalse();
  }

  @Test
  public void testForEachValueCarriedToNextIteration() {
    Node last1 = ir.name("last");
    Node readLast = ir.name("last");
    Node v = ir.name("v");
    Node last2 = ir.name("last");
    Node readV = ir.name("v");
    VariableTracker.Result result =
        analyze(
            assign(last1, ir.number(0)),
            ir.forEach(
                ir.call("items"),
                null,
                v,
                ir.block(ir.echo(readLast), assign(last2, readV))));

    assertUses(result, last1, readLast);
    assertUses(result, last2, readLast);
    assertUses(result, v, readV);
  }

  @Test
  public void testTryCatch() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node x3 = ir.name("x");
    Node e = ir.name("e");
    Node readInCatch = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.tryCatch(
                ir.block(
                    assign(x2, ir.number(2)),
                    ir.exprResult(ir.call("mayThrow")),
                    assign(x3, ir.number(3))),
                ir.catchNode(e, ir.block(ir.echo(readInCatch)))),
            ir.echo(readAfter));

    assertUses(result, x1, readInCatch, readAfter);
    assertUses(result, x2, readInCatch, readAfter);
    assertUses(result, x3, readInCatch, readAfter);
    assertUses(result, e);
    assertThat(result.getCatchDefinitionIds()).containsExactly(e.getId());
  }

  @Test
  public void testCatchThatReturns() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.tryCatch(
                ir.block(assign(x2, ir.number(2))),
                ir.catchNode(ir.empty(), ir.block(ir.returnNode()))),
            ir.echo(readAfter));

    assertUses(result, x1);
    assertUses(result, x2, readAfter);
    assertThat(result.getCatchDefinitionIds()).isEmpty();
  }

  @Test
  public void testTryFinally() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node readInFinally = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.tryFinally(
                ir.block(assign(x2, ir.call("compute"))), ir.block(ir.echo(readInFinally))),
            ir.echo(readAfter));

    assertUses(result, x1, readInFinally);
    assertUses(result, x2, readInFinally, readAfter);
  }

  @Test
  public void testFinallyDefinitionReplacesTryDefinitions() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node x3 = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.tryCatchFinally(
                ir.block(assign(x2, ir.number(2))),
                ir.block(ir.catchNode(ir.name("e"), ir.block())),
                ir.block(assign(x3, ir.number(3)))),
            ir.echo(readAfter));

    assertUses(result, x1);
    assertUses(result, x2);
    assertUses(result, x3, readAfter);
  }

  @Test
  public void testBreakThroughFinally() {
    Node x = ir.name("x");
    Node readAfter = ir.name("x");
    VariableTracker.Result result =
        analyze(
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.tryFinally(ir.block(ir.breakNode()), ir.block(assign(x, ir.number(1)))))),
            ir.echo(readAfter));

    assertUses(result, x, readAfter);
    assertThat(result.getUndefinedUses()).isEmpty();
  }

  @Test
  public void testContinueThroughFinally() {
    Node readInBody = ir.name("x");
    Node x = ir.name("x");
    VariableTracker.Result result =
        analyze(
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.echo(readInBody),
                    ir.tryFinally(
                        ir.block(ir.continueNode()), ir.block(assign(x, ir.number(1)))))));

    assertUses(result, x, readInBody);
    assertThat(result.getGraph().hasDefinitionReaching("x", readInBody.getId())).isTrue();
  }

  @Test
  public void testBreakThroughNestedFinallyBlocks() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node y = ir.name("y");
    Node readX = ir.name("x");
    Node readY = ir.name("y");
    VariableTracker.Result result =
        analyze(
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.tryFinally(
                        ir.block(
                            ir.tryFinally(
                                ir.block(assign(x1, ir.number(1)), ir.breakNode()),
                                ir.block(assign(x2, ir.number(2))))),
                        ir.block(assign(y, ir.number(3)))))),
            ir.echo(readX, readY));

    assertUses(result, x1);
    assertUses(result, x2, readX);
    assertUses(result, y, readY);
  }

  @Test
  public void testBreakInsideTryWithinLoopInsideTry() {
    Node x = ir.name("x");
    Node inFinally = ir.name("y");
    Node readX = ir.name("x");
    VariableTracker.Result result =
        analyze(
            ir.tryFinally(
                ir.block(
                    ir.whileNode(
                        ir.call("more"),
                        ir.block(assign(x, ir.number(1)), ir.breakNode())),
                    ir.echo(readX)),
                ir.block(assign(inFinally, ir.number(2)))));

    assertUses(result, x, readX);
  }

  @Test
  public void testGlobalAndStatic() {
    Node g = ir.name("g");
    Node readG = ir.name("g");
    Node s = ir.staticVar("s", ir.number(0));
    VariableTracker.Result result =
        analyze(ir.global(g), ir.echo(readG), ir.staticNode(s));

    VariableGraph graph = result.getGraph();
    assertUses(result, g, readG);
    assertUses(result, s);
    assertThat(graph.isGlobal("g")).isTrue();
    assertThat(graph.isStatic("s")).isTrue();
    assertThat(graph.isReference("g")).isFalse();
  }

  @Test
  public void testAssignByReference() {
    Node a = ir.name("a");
    Node b = ir.name("b");
    VariableTracker.Result result = analyze(ir.exprResult(ir.assignRef(a, b)));

    VariableGraph graph = result.getGraph();
    assertThat(graph.isReference("a")).isTrue();
    assertThat(graph.isReference("b")).isTrue();
    // Binding an undefined variable by reference defines it.
    assertThat(graph.hasDefinition("b", b.getId())).isTrue();
    assertThat(result.getUndefinedUses()).isEmpty();
  }

  @Test
  public void testAssignByReferenceToDefinedVariable() {
    Node b1 = ir.name("b");
    Node b2 = ir.name("b");
    VariableTracker.Result result =
        analyze(assign(b1, ir.number(1)), ir.exprResult(ir.assignRef(ir.name("a"), b2)));

    assertUses(result, b1, b2);
  }

  @Test
  public void testElementAssignmentReadsBaseAndIndex() {
    Node arr = ir.name("arr");
    Node i = ir.name("i");
    Node readArr = ir.name("arr");
    Node readI = ir.name("i");
    Node fn =
        function(
            ir.paramList(arr, i),
            ir.exprResult(ir.assign(ir.getelem(readArr, readI), ir.number(1))));

    VariableTracker.Result result = VariableTracker.analyze(fn);

    assertUses(result, arr, readArr);
    assertUses(result, i, readI);
  }

  @Test
  public void testListAssignmentDefinesEachName() {
    Node a = ir.name("a");
    Node b = ir.name("b");
    Node readB = ir.name("b");
    VariableTracker.Result result =
        analyze(ir.exprResult(ir.assign(ir.exprList(a, b), ir.call("pair"))), ir.echo(readB));

    assertUses(result, a);
    assertUses(result, b, readB);
  }

  @Test
  public void testShortCircuitAssignmentIsConditional() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.exprResult(ir.and(ir.call("check"), ir.assign(x2, ir.number(2)))),
            ir.echo(read));

    assertUses(result, x1, read);
    assertUses(result, x2, read);
  }

  @Test
  public void testHookAssignsOnBothBranches() {
    Node x1 = ir.name("x");
    Node x2 = ir.name("x");
    Node x3 = ir.name("x");
    Node read = ir.name("x");
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(1)),
            ir.exprResult(
                ir.hook(
                    ir.call("check"),
                    ir.assign(x2, ir.number(2)),
                    ir.assign(x3, ir.number(3)))),
            ir.echo(read));

    assertUses(result, x1);
    assertUses(result, x2, read);
    assertUses(result, x3, read);
  }

  @Test
  public void testClosureCaptures() {
    Node a = ir.name("a");
    Node b = ir.name("b");
    Node captureA = ir.name("a");
    Node captureB = ir.refName("b");
    Node readAInClosure = ir.name("a");
    Node fnVar = ir.name("fn");
    Node closure =
        ir.closure(
            ir.paramList(),
            ir.closureUses(captureA, captureB),
            ir.block(ir.echo(readAInClosure)));
    Node fn =
        function(
            ir.paramList(),
            assign(a, ir.number(1)),
            assign(b, ir.number(2)),
            assign(fnVar, closure),
            ir.returnNode(ir.name("fn")));

    VariableTracker.Result outer = VariableTracker.analyze(fn);
    assertUses(outer, a, captureA);
    assertUses(outer, b, captureB);
    assertThat(outer.getGraph().isReference("b")).isTrue();
    assertThat(outer.getGraph().isReference("a")).isFalse();
    // The closure body is not part of the enclosing analysis.
    assertThat(outer.getGraph().hasDefinitionReaching("a", readAInClosure.getId())).isFalse();

    VariableTracker.Result inner = VariableTracker.analyze(closure);
    assertThat(inner.getCallableName()).isEqualTo("{closure}");
    assertUses(inner, captureA, readAInClosure);
    assertUses(inner, captureB);
    assertThat(inner.getParameterDefinitionIds())
        .containsExactly(captureA.getId(), captureB.getId());
    assertThat(inner.getGraph().isReference("b")).isTrue();
  }

  @Test
  public void testClosureCaptureByReferenceDefinesVariable() {
    Node capture = ir.refName("out");
    Node closure = ir.closure(ir.paramList(), ir.closureUses(capture), ir.block());
    VariableTracker.Result result = analyze(ir.exprResult(ir.call("run", closure)));

    assertThat(result.getGraph().hasDefinition("out", capture.getId())).isTrue();
    assertThat(result.getGraph().isReference("out")).isTrue();
    assertThat(result.getUndefinedUses()).isEmpty();
  }

  @Test
  public void testUndefinedUse() {
    Node read = ir.name("nope");
    VariableTracker.Result result = analyze(ir.echo(read));

    assertThat(result.getUndefinedUses().get("nope")).containsExactly(read);
    assertThat(result.getGraph().getVariableNames()).isEmpty();
  }

  @Test
  public void testNoSelfEdges() {
    List<Node> names = new ArrayList<>();
    Node x1 = track(names, ir.name("x"));
    Node x2 = track(names, ir.name("x"));
    Node x3 = track(names, ir.name("x"));
    VariableTracker.Result result =
        analyze(
            assign(x1, ir.number(0)),
            ir.whileNode(
                ir.call("more"),
                ir.block(
                    ir.exprResult(ir.inc(x2)),
                    ir.exprResult(ir.assignOp("*=", x3, ir.number(2))))));

    VariableGraph graph = result.getGraph();
    for (Node n : names) {
      assertThat(graph.getUses("x", n.getId())).doesNotContain(n.getId());
    }
    assertUses(result, x1, x2);
    assertUses(result, x2, x3);
    assertUses(result, x3, x2);
  }

  @Test
  public void testEveryDefinitionHasALine() {
    Node x = ir.name("x");
    Node fn = function(ir.paramList(), ir.at(7).exprResult(ir.assign(x, ir.number(1))));

    VariableTracker.Result result = VariableTracker.analyze(fn);

    assertThat(result.getGraph().getDefinitionLine("x", x.getId())).isEqualTo(7);
  }

  @Test
  public void testNestedFunctionIsNotEntered() {
    Node inner = ir.function("g", ir.paramList(), ir.block(assign(ir.name("y"), ir.number(1))));
    VariableTracker.Result result = analyze(inner);

    assertThat(result.getGraph().getVariableNames()).isEmpty();
  }

  @Test
  public void testBreakOutsideLoop() {
    Node fn = function(ir.paramList(), ir.breakNode());

    assertThrows(IllegalStateException.class, () -> VariableTracker.analyze(fn));
  }

  @Test
  public void testAnalyzeRequiresCallable() {
    assertThrows(IllegalArgumentException.class, () -> VariableTracker.analyze(ir.block()));
  }

  private static Node track(List<Node> names, Node name) {
    names.add(name);
    return name;
  }

  private Node assign(Node target, Node value) {
    return ir.exprResult(ir.assign(target, value));
  }

  private Node function(Node params, Node... statements) {
    Node fn = ir.function("f", params, ir.block(statements));
    ir.script("test.php", fn);
    return fn;
  }

  private VariableTracker.Result analyze(Node... statements) {
    return VariableTracker.analyze(function(ir.paramList(), statements));
  }

  private static void assertUses(VariableTracker.Result result, Node def, Node... uses) {
    ImmutableList.Builder<Integer> ids = ImmutableList.builder();
    for (Node use : uses) {
      ids.add(use.getId());
    }
    assertThat(result.getGraph().hasDefinition(def.getString(), def.getId())).isTrue();
    assertThat(result.getGraph().getUses(def.getString(), def.getId()))
        .containsExactlyElementsIn(ids.build());
  }
}
