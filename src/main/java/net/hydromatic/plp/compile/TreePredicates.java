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
package net.hydromatic.plp.compile;

import com.google.common.collect.ImmutableList;
import java.util.function.Predicate;
import net.hydromatic.plp.ast.Interval;
import net.hydromatic.plp.ast.NodeKind;
import net.hydromatic.plp.ast.Sign;
import net.hydromatic.plp.ast.Syntax.Leaf;
import net.hydromatic.plp.ast.Syntax.Tree;
import net.hydromatic.plp.ast.SyntaxNode;
import net.hydromatic.plp.ast.TokenKind;

/** Classifies syntax-tree nodes by production kind. */
public class TreePredicates {
  private TreePredicates() {}

  /** Returns whether a node is a tree of a given kind. */
  public static boolean is(SyntaxNode x, NodeKind kind) {
    return x instanceof Tree && ((Tree) x).kind == kind;
  }

  /** Returns whether a node is a token of a given kind. */
  public static boolean is(SyntaxNode x, TokenKind kind) {
    return x instanceof Leaf && ((Leaf) x).kind == kind;
  }

  /** Returns whether a node is a fact. */
  public static boolean isFact(SyntaxNode x) {
    return is(x, NodeKind.FACT);
  }

  /** Returns whether a node is a probabilistic fact. */
  public static boolean isPfact(SyntaxNode x) {
    return is(x, NodeKind.PFACT);
  }

  /** Returns whether a node is a credal fact. */
  public static boolean isCfact(SyntaxNode x) {
    return is(x, NodeKind.CFACT);
  }

  /** Returns whether a node is a rule. */
  public static boolean isRule(SyntaxNode x) {
    return is(x, NodeKind.RULE);
  }

  /** Returns whether a node is a probabilistic rule. */
  public static boolean isPrule(SyntaxNode x) {
    return is(x, NodeKind.PRULE);
  }

  /** Returns whether a node is an integrity constraint. */
  public static boolean isConstraint(SyntaxNode x) {
    return is(x, NodeKind.CONSTRAINT);
  }

  /** Returns whether a node is a query. */
  public static boolean isQuery(SyntaxNode x) {
    return is(x, NodeKind.QUERY);
  }

  /** Returns whether a node is a(n) (ground) atom. */
  public static boolean isAtom(SyntaxNode x) {
    return is(x, NodeKind.ATOM) || is(x, NodeKind.GRATOM);
  }

  /** Returns whether a node is a (ground) predicate. */
  public static boolean isPred(SyntaxNode x) {
    return is(x, NodeKind.PRED) || is(x, NodeKind.GRPRED);
  }

  /** Returns whether a node is an interval. */
  public static boolean isInterval(SyntaxNode x) {
    return is(x, NodeKind.INTERVAL);
  }

  /** Returns whether a node is a variable token. */
  public static boolean isVar(SyntaxNode x) {
    return is(x, TokenKind.VAR);
  }

  /**
   * Returns whether a node (in practice a fact or rule) is probabilistic,
   * that is, whether its first child is a probability token.
   */
  public static boolean isProb(SyntaxNode x) {
    return x instanceof Tree
        && !((Tree) x).children.isEmpty()
        && is(((Tree) x).child(0), TokenKind.PROB);
  }

  /** Returns the polarity of an atom, or NOT_APPLICABLE if not an atom. */
  public static Sign atomSign(SyntaxNode x) {
    return isAtom(x) ? sign((Tree) x) : Sign.NOT_APPLICABLE;
  }

  /**
   * Returns the polarity of a predicate, or NOT_APPLICABLE if not a
   * predicate.
   */
  public static Sign predSign(SyntaxNode x) {
    return isPred(x) ? sign((Tree) x) : Sign.NOT_APPLICABLE;
  }

  /**
   * Returns the polarity of an atom or predicate, or NOT_APPLICABLE if
   * neither.
   */
  public static Sign sign(SyntaxNode x) {
    final Sign sign = atomSign(x);
    return sign != Sign.NOT_APPLICABLE ? sign : predSign(x);
  }

  private static Sign sign(Tree literal) {
    if (literal.children.isEmpty()) {
      throw new InvalidNodeException("Literal has no name", literal);
    }
    return is(literal.child(0), TokenKind.NEG) ? Sign.NEGATIVE : Sign.POSITIVE;
  }

  /**
   * Converts an interval node {@code lo..hi} into a pair of integers.
   *
   * @throws InvalidNodeException if the node is not an interval of two
   *     integers
   */
  public static Interval expandInterval(SyntaxNode x) {
    if (!isInterval(x)) {
      throw new InvalidNodeException("Node is not an interval", x);
    }
    final Tree tree = (Tree) x;
    if (tree.children.size() != 2
        || !is(tree.child(0), TokenKind.CONST)
        || !is(tree.child(1), TokenKind.CONST)) {
      throw new InvalidNodeException("Interval must have two bounds", x);
    }
    try {
      return new Interval(
          Integer.parseInt(((Leaf) tree.child(0)).text),
          Integer.parseInt(((Leaf) tree.child(1)).text));
    } catch (NumberFormatException e) {
      throw new InvalidNodeException("Interval bound is not an integer", x);
    }
  }

  /**
   * Returns every node of a tree, in depth-first pre-order, that satisfies a
   * predicate.
   */
  public static ImmutableList<SyntaxNode> find(
      SyntaxNode x, Predicate<SyntaxNode> predicate) {
    final ImmutableList.Builder<SyntaxNode> b = ImmutableList.builder();
    find(x, predicate, b);
    return b.build();
  }

  private static void find(
      SyntaxNode x,
      Predicate<SyntaxNode> predicate,
      ImmutableList.Builder<SyntaxNode> b) {
    if (predicate.test(x)) {
      b.add(x);
    }
    if (x instanceof Tree) {
      for (SyntaxNode child : ((Tree) x).children) {
        find(child, predicate, b);
      }
    }
  }

  /** Returns all facts in a tree. */
  public static ImmutableList<SyntaxNode> facts(SyntaxNode x) {
    return find(x, TreePredicates::isFact);
  }

  /** Returns all probabilistic facts in a tree. */
  public static ImmutableList<SyntaxNode> pfacts(SyntaxNode x) {
    return find(x, TreePredicates::isPfact);
  }

  /** Returns all rules in a tree. */
  public static ImmutableList<SyntaxNode> rules(SyntaxNode x) {
    return find(x, TreePredicates::isRule);
  }

  /** Returns all probabilistic rules in a tree. */
  public static ImmutableList<SyntaxNode> prules(SyntaxNode x) {
    return find(x, TreePredicates::isPrule);
  }

  /** Returns all probabilistic facts and rules in a tree. */
  public static ImmutableList<SyntaxNode> probs(SyntaxNode x) {
    return find(x, n -> isPfact(n) || isPrule(n));
  }
}

// End TreePredicates.java
