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

package com.google.vartracker.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class. Each instance creates nodes in one {@link NodeArena}.
 *
 * <p>{@code ir.at(3).exprResult(...)} stamps line 3 on every node of the new statement that does
 * not have a line yet.
 */
public final class IR {

  private final NodeArena arena;
  private final int lineno;

  private IR(NodeArena arena, int lineno) {
    this.arena = checkNotNull(arena);
    this.lineno = lineno;
  }

  public static IR forArena(NodeArena arena) {
    return new IR(arena, -1);
  }

  /** Returns a factory on the same arena that puts the nodes it builds on the given line. */
  public IR at(int lineno) {
    checkArgument(lineno >= 0, "bad line %s", lineno);
    return new IR(arena, lineno);
  }

  public NodeArena getArena() {
    return arena;
  }

  private Node finish(Node n) {
    if (lineno != -1) {
      n.setLinenoTreeIfMissing(lineno);
    }
    return n;
  }

  private Node make(Token token, Node... children) {
    return finish(arena.newNode(token, children));
  }

  // Structure

  public Node root(Node... scripts) {
    for (Node script : scripts) {
      checkState(script.getToken() == Token.SCRIPT, script);
    }
    return make(Token.ROOT, scripts);
  }

  public Node script(String sourceName, Node... children) {
    Node script = arena.newString(Token.SCRIPT, checkNotNull(sourceName));
    for (Node child : children) {
      script.addChildToBack(child);
    }
    return finish(script);
  }

  public Node function(String name, Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    Node fn = arena.newString(Token.FUNCTION, checkNotNull(name));
    fn.addChildToBack(params);
    fn.addChildToBack(body);
    return finish(fn);
  }

  public Node closure(Node params, Node uses, Node body) {
    checkState(params.isParamList(), params);
    checkState(uses.getToken() == Token.CLOSURE_USES, uses);
    checkState(body.isBlock(), body);
    return make(Token.CLOSURE, params, uses, body);
  }

  public Node paramList(Node... params) {
    for (Node param : params) {
      checkState(param.isName(), param);
    }
    return make(Token.PARAM_LIST, params);
  }

  /** A parameter with a default value. */
  public Node param(String name, Node defaultValue) {
    Node param = arena.newString(Token.NAME, name);
    param.addChildToBack(defaultValue);
    return finish(param);
  }

  public Node closureUses(Node... names) {
    for (Node name : names) {
      checkState(name.isName(), name);
    }
    return make(Token.CLOSURE_USES, names);
  }

  // Statements

  public Node block(Node... statements) {
    return make(Token.BLOCK, statements);
  }

  public Node empty() {
    return make(Token.EMPTY);
  }

  public Node exprResult(Node expr) {
    return make(Token.EXPR_RESULT, expr);
  }

  public Node echo(Node... exprs) {
    checkArgument(exprs.length > 0);
    return make(Token.ECHO, exprs);
  }

  public Node returnNode() {
    return make(Token.RETURN);
  }

  public Node returnNode(Node expr) {
    return make(Token.RETURN, expr);
  }

  public Node throwNode(Node expr) {
    return make(Token.THROW, expr);
  }

  public Node ifNode(Node cond, Node then) {
    checkState(then.isBlock(), then);
    return make(Token.IF, cond, then);
  }

  public Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(then.isBlock(), then);
    checkState(elseNode.isBlock() || elseNode.getToken() == Token.IF, elseNode);
    return make(Token.IF, cond, then, elseNode);
  }

  public Node whileNode(Node cond, Node body) {
    checkState(body.isBlock(), body);
    return make(Token.WHILE, cond, body);
  }

  public Node doNode(Node body, Node cond) {
    checkState(body.isBlock(), body);
    return make(Token.DO, body, cond);
  }

  /** Any of init, cond and incr may be an EMPTY node. */
  public Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isEmpty() || init.getToken() == Token.EXPR_LIST, init);
    checkState(incr.isEmpty() || incr.getToken() == Token.EXPR_LIST, incr);
    checkState(body.isBlock(), body);
    return make(Token.FOR, init, cond, incr, body);
  }

  /** {@code foreach (subject as key => value) body}; a null key is stored as EMPTY. */
  public Node forEach(Node subject, @Nullable Node key, Node value, Node body) {
    checkState(key == null || key.isName(), key);
    checkState(body.isBlock(), body);
    Node keyOrEmpty = key != null ? key : arena.newNode(Token.EMPTY);
    return make(Token.FOREACH, subject, keyOrEmpty, value, body);
  }

  public Node tryCatch(Node tryBlock, Node... catches) {
    return tryCatchFinally(tryBlock, block(catches), empty());
  }

  public Node tryFinally(Node tryBlock, Node finallyBlock) {
    return tryCatchFinally(tryBlock, block(), finallyBlock);
  }

  public Node tryCatchFinally(Node tryBlock, Node catches, Node finallyBlock) {
    checkState(tryBlock.isBlock(), tryBlock);
    checkState(catches.isBlock(), catches);
    for (Node c : catches.children()) {
      checkState(c.isCatch(), c);
    }
    checkState(finallyBlock.isBlock() || finallyBlock.isEmpty(), finallyBlock);
    return make(Token.TRY, tryBlock, catches, finallyBlock);
  }

  /** A catch clause; {@code name} is EMPTY for a catch without a variable. */
  public Node catchNode(Node name, Node block) {
    checkState(name.isName() || name.isEmpty(), name);
    checkState(block.isBlock(), block);
    return make(Token.CATCH, name, block);
  }

  public Node breakNode() {
    return make(Token.BREAK);
  }

  public Node continueNode() {
    return make(Token.CONTINUE);
  }

  public Node global(Node... names) {
    checkArgument(names.length > 0);
    for (Node name : names) {
      checkState(name.isName() && !name.hasChildren(), name);
    }
    return make(Token.GLOBAL, names);
  }

  public Node staticNode(Node... names) {
    checkArgument(names.length > 0);
    for (Node name : names) {
      checkState(name.isName(), name);
    }
    return make(Token.STATIC, names);
  }

  /** A static variable with an initializer. */
  public Node staticVar(String name, Node initializer) {
    Node nameNode = arena.newString(Token.NAME, name);
    nameNode.addChildToBack(initializer);
    return finish(nameNode);
  }

  // Expressions

  public Node exprList(Node... exprs) {
    return make(Token.EXPR_LIST, exprs);
  }

  public Node name(String name) {
    checkArgument(!name.isEmpty(), "empty name");
    return finish(arena.newString(Token.NAME, name));
  }

  /** A by-reference binding such as {@code &$x}. */
  public Node refName(String name) {
    return name(name).setByRef(true);
  }

  public Node number(String value) {
    return finish(arena.newString(Token.NUMBER, value));
  }

  public Node number(int value) {
    return number(String.valueOf(value));
  }

  public Node string(String value) {
    return finish(arena.newString(Token.STRINGLIT, value));
  }

  public Node assign(Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    return make(Token.ASSIGN, target, value);
  }

  /** A compound assignment such as {@code target += value}. */
  public Node assignOp(String op, Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    Node n = arena.newString(Token.ASSIGN_OP, op);
    n.addChildToBack(target);
    n.addChildToBack(value);
    return finish(n);
  }

  public Node assignRef(Node target, Node source) {
    checkState(isAssignmentTarget(target), target);
    return make(Token.ASSIGN_REF, target, source);
  }

  public Node inc(Node target) {
    checkState(isAssignmentTarget(target), target);
    return make(Token.INC, target);
  }

  public Node dec(Node target) {
    checkState(isAssignmentTarget(target), target);
    return make(Token.DEC, target);
  }

  public Node and(Node left, Node right) {
    return make(Token.AND, left, right);
  }

  public Node or(Node left, Node right) {
    return make(Token.OR, left, right);
  }

  public Node hook(Node cond, Node then, Node elseExpr) {
    return make(Token.HOOK, cond, then, elseExpr);
  }

  public Node not(Node expr) {
    return make(Token.NOT, expr);
  }

  public Node binaryOp(String op, Node left, Node right) {
    Node n = arena.newString(Token.BINARY_OP, op);
    n.addChildToBack(left);
    n.addChildToBack(right);
    return finish(n);
  }

  public Node call(Node callee, Node... args) {
    Node call = make(Token.CALL, callee);
    for (Node arg : args) {
      call.addChildToBack(arg);
    }
    return finish(call);
  }

  /** A call of a named function; the callee is a string, not a variable read. */
  public Node call(String functionName, Node... args) {
    return call(string(functionName), args);
  }

  public Node getelem(Node base, Node index) {
    return make(Token.GETELEM, base, index);
  }

  private static boolean isAssignmentTarget(Node n) {
    return n.isName() || n.getToken() == Token.GETELEM || n.getToken() == Token.EXPR_LIST;
  }
}
