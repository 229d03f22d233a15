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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * Mints the ids of the nodes of one tree. Ids start at 1 and are assigned in creation order.
 *
 * <p>Not thread-safe: a tree is built by a single thread. Analyses of a finished tree only read
 * ids, so they may run concurrently.
 */
public final class NodeArena {

  private int nextId = 1;

  public Node newNode(Token token) {
    return new Node(checkNotNull(token), nextId++, null);
  }

  public Node newNode(Token token, Node... children) {
    Node n = newNode(token);
    for (Node child : children) {
      n.addChildToBack(child);
    }
    return n;
  }

  public Node newString(Token token, @Nullable String str) {
    return new Node(checkNotNull(token), nextId++, str);
  }

  /** Returns the number of nodes created by this arena so far. */
  public int size() {
    return nextId - 1;
  }
}
