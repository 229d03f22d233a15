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
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of the analyzed tree.
 *
 * <p>Every node carries an id minted by the {@link NodeArena} that created it. Ids are sequential
 * and unique within an arena, so analyses key their maps on {@link #getId()} instead of on object
 * identity.
 */
public final class Node {

  private final Token token;
  private final int id;
  private final @Nullable String string;

  private int lineno = -1;

  // Whether this binding is made by reference (&$x).
  private boolean byRef;

  private @Nullable Node parent;
  private @Nullable Node first;
  // Non-null whenever first is non-null.
  private @Nullable Node last;
  private @Nullable Node next;

  Node(Token token, int id, @Nullable String string) {
    checkArgument(string == null || token.hasString(), "%s does not carry a string", token);
    this.token = token;
    this.id = id;
    this.string = string;
  }

  public Token getToken() {
    return token;
  }

  /** Returns the arena-assigned id of this node. */
  public int getId() {
    return id;
  }

  public String getString() {
    checkState(string != null, "%s has no string", this);
    return string;
  }

  public int getLineno() {
    return lineno;
  }

  @CanIgnoreReturnValue
  public Node setLineno(int lineno) {
    this.lineno = lineno < 0 ? -1 : lineno;
    return this;
  }

  public boolean isByRef() {
    return byRef;
  }

  @CanIgnoreReturnValue
  public Node setByRef(boolean byRef) {
    this.byRef = byRef;
    return this;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  public boolean hasChildren() {
    return first != null;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public @Nullable Node getLastChild() {
    return last;
  }

  public @Nullable Node getNext() {
    return next;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   */
  public Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "no child at index %s of %s", i, this);
      n = n.next;
      i--;
    }
    checkArgument(n != null, "no child at index %s of %s", i, this);
    return n;
  }

  public int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    if (first == null) {
      first = child;
    } else {
      last.next = child;
    }
    last = child;
    child.parent = this;
  }

  /** Returns the children of this node, in order. */
  public Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    final Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = n.next;
      return n;
    }
  }

  /**
   * Sets the line of every node in this subtree that has none yet. Nodes built before their
   * statement knows its line pick up the statement's line this way.
   */
  @CanIgnoreReturnValue
  public Node setLinenoTreeIfMissing(int lineno) {
    if (this.lineno == -1) {
      setLineno(lineno);
    }
    for (Node child = first; child != null; child = child.next) {
      child.setLinenoTreeIfMissing(lineno);
    }
    return this;
  }

  /** Returns the name of the enclosing script, or null if this node is not inside one. */
  public @Nullable String getSourceFileName() {
    for (Node n = this; n != null; n = n.parent) {
      if (n.token == Token.SCRIPT) {
        return n.string;
      }
    }
    return null;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isCatch() {
    return token == Token.CATCH;
  }

  /** Whether this node is a function or closure, i.e. the root of one analysis. */
  public boolean isCallable() {
    return token == Token.FUNCTION || token == Token.CLOSURE;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token).append('#').append(id);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (byRef) {
      sb.append(" [by_ref]");
    }
    if (lineno != -1) {
      sb.append(" :").append(lineno);
    }
    return sb.toString();
  }
}
