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

import com.google.common.collect.Sets;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.plp.ast.Syntax.Tree;
import net.hydromatic.plp.ast.SyntaxNode;

/**
 * Determines whether a subtree is ground, that is, contains no variable.
 *
 * <p>The parser may share one subtree object between several parents, so the
 * search remembers, by identity, the nodes it has visited and does not visit
 * them again. The visited set belongs to a single call.
 */
public class Groundedness {
  private Groundedness() {}

  /**
   * Performs a depth-first search, returning true as soon as a node
   * satisfying {@code predicate} is found.
   */
  public static boolean contains(
      SyntaxNode x, Predicate<? super SyntaxNode> predicate) {
    final Set<SyntaxNode> visited = Sets.newIdentityHashSet();
    return visit(x, predicate, visited);
  }

  private static boolean visit(
      SyntaxNode x,
      Predicate<? super SyntaxNode> predicate,
      Set<SyntaxNode> visited) {
    visited.add(x);
    if (predicate.test(x)) {
      return true;
    }
    if (x instanceof Tree) {
      for (SyntaxNode child : ((Tree) x).children) {
        if (!visited.contains(child) && visit(child, predicate, visited)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns whether any node in the subtree of {@code x} is a variable. */
  public static boolean isNonGround(SyntaxNode x) {
    return contains(x, TreePredicates::isVar);
  }

  /** Returns whether any node of a sequence is not ground. */
  public static boolean isNonGround(Iterable<? extends SyntaxNode> xs) {
    for (SyntaxNode x : xs) {
      if (isNonGround(x)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether no node in the subtree of {@code x} is a variable. */
  public static boolean isGround(SyntaxNode x) {
    return !isNonGround(x);
  }

  /** Returns whether every node of a sequence is ground. */
  public static boolean isGround(Iterable<? extends SyntaxNode> xs) {
    return !isNonGround(xs);
  }
}

// End Groundedness.java
