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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plp.ast.Syntax.Leaf;
import net.hydromatic.plp.ast.Syntax.Tree;

/** Builds syntax tree nodes. */
public enum SyntaxBuilder {
  /**
   * The singleton instance of the syntax builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  syntax;

  /** Creates a tree node. */
  public Tree tree(
      Pos pos, NodeKind kind, List<? extends SyntaxNode> children) {
    return new Tree(pos, kind, children);
  }

  /** Creates a tree node with no position. */
  public Tree tree(NodeKind kind, SyntaxNode... children) {
    return new Tree(Pos.ZERO, kind, ImmutableList.copyOf(children));
  }

  /** Creates a tree node whose position spans its children. */
  public Tree span(NodeKind kind, List<? extends SyntaxNode> children) {
    Pos pos = Pos.ZERO;
    for (SyntaxNode child : children) {
      pos = pos.plus(child.pos);
    }
    return new Tree(pos, kind, children);
  }

  /** Creates a leaf node. */
  public Leaf leaf(Pos pos, TokenKind kind, String text) {
    return new Leaf(pos, kind, text);
  }

  /** Creates a leaf node with no position. */
  public Leaf leaf(TokenKind kind, String text) {
    return new Leaf(Pos.ZERO, kind, text);
  }

  /** Creates a variable leaf with no position. */
  public Leaf var(String name) {
    return leaf(TokenKind.VAR, name);
  }

  /** Creates a constant leaf with no position. */
  public Leaf constant(String name) {
    return leaf(TokenKind.CONST, name);
  }

  /** Creates a functor-name leaf with no position. */
  public Leaf id(String name) {
    return leaf(TokenKind.ID, name);
  }

  /** Creates a probability leaf with no position. */
  public Leaf prob(String text) {
    return leaf(TokenKind.PROB, text);
  }
}

// End SyntaxBuilder.java
