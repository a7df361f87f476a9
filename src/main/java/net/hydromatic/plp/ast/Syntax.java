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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Syntax tree node classes. */
public class Syntax {
  private Syntax() {}

  /** Production node: a kind plus an ordered list of children. */
  public static final class Tree extends SyntaxNode {
    public final NodeKind kind;
    public final List<SyntaxNode> children;

    /** Lazily computed; 0 means not yet computed. */
    private int hash;

    Tree(Pos pos, NodeKind kind, List<? extends SyntaxNode> children) {
      super(pos);
      this.kind = requireNonNull(kind);
      this.children = ImmutableList.copyOf(children);
    }

    /** Returns the {@code i}th child. */
    public SyntaxNode child(int i) {
      return children.get(i);
    }

    /** Returns a tree with the same kind and position but other children. */
    public Tree copy(List<? extends SyntaxNode> children) {
      return new Tree(pos, kind, children);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append(kind.lowerName()).append('(');
      for (int i = 0; i < children.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        children.get(i).unparse(buf);
      }
      return buf.append(')');
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Tree
              && kind == ((Tree) o).kind
              && hashCode() == o.hashCode()
              && children.equals(((Tree) o).children);
    }

    @Override
    public int hashCode() {
      int h = hash;
      if (h == 0) {
        h = kind.hashCode() * 31 + children.hashCode();
        hash = h == 0 ? 1 : h;
      }
      return hash;
    }
  }

  /** Token node: a kind plus the literal text of the token. */
  public static final class Leaf extends SyntaxNode {
    public final TokenKind kind;
    public final String text;

    Leaf(Pos pos, TokenKind kind, String text) {
      super(pos);
      this.kind = requireNonNull(kind);
      this.text = requireNonNull(text);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(text);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Leaf
              && kind == ((Leaf) o).kind
              && text.equals(((Leaf) o).text);
    }

    @Override
    public int hashCode() {
      return kind.hashCode() * 31 + text.hashCode();
    }
  }
}

// End Syntax.java
