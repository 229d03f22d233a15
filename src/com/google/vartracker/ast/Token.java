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

/**
 * The node types of the tree analyzed by the variable tracker.
 */
public enum Token {
  ROOT,
  SCRIPT,

  // Callables
  FUNCTION, // PARAM_LIST, BLOCK
  CLOSURE, // PARAM_LIST, CLOSURE_USES, BLOCK
  PARAM_LIST,
  CLOSURE_USES,

  // Statements
  BLOCK,
  EMPTY,
  EXPR_RESULT,
  ECHO,
  RETURN,
  THROW,
  IF, // condition, then, [else]
  WHILE, // condition, body
  DO, // body, condition
  FOR, // init, condition, increment, body
  FOREACH, // subject, key or EMPTY, value, body
  TRY, // block, catches, finally or EMPTY
  CATCH, // name or EMPTY, block
  BREAK,
  CONTINUE,
  GLOBAL, // NAME...
  STATIC, // NAME [initializer]...

  // Expressions
  EXPR_LIST,
  NAME,
  NUMBER,
  STRINGLIT,
  ASSIGN, // target = value
  ASSIGN_OP, // target op= value
  ASSIGN_REF, // target =& source
  INC,
  DEC,
  AND,
  OR,
  HOOK, // condition ? then : else
  CALL, // callee, args...
  GETELEM, // base[index]
  BINARY_OP,
  NOT;

  /** Whether nodes of this type can carry a string payload. */
  boolean hasString() {
    switch (this) {
      case SCRIPT:
      case FUNCTION:
      case NAME:
      case STRINGLIT:
      case NUMBER:
      case ASSIGN_OP:
      case BINARY_OP:
        return true;
      default:
        return false;
    }
  }
}
