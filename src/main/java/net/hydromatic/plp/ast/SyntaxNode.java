/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.plp.ast;

import static java.util.Objects.requireNonNull;

/**
 * Node of a syntax tree: either a {@link Syntax.Tree} (a production with
 * children) or a {@link Syntax.Leaf} (a token).
 *
 * <p>Equality is structural; the position is ignored. Identity is stable for
 * as long as the tree produced by one parse is alive.
 */
public abstract class SyntaxNode {
  public final Pos pos;

  SyntaxNode(Pos pos) {
    this.pos = requireNonNull(pos);
  }

  /** Appends a debugging representation of this node to a builder. */
  public abstract StringBuilder unparse(StringBuilder buf);

  @Override
  public final String toString() {
    return unparse(new StringBuilder()).toString();
  }
}

// End SyntaxNode.java
