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

import static java.util.Objects.requireNonNull;

import net.hydromatic.plp.ast.SyntaxNode;

/**
 * Thrown when a syntax tree does not have the shape that a production
 * requires.
 *
 * <p>The parser never produces such trees, so this indicates a programming
 * error in whoever built the tree, not an error in the user's program.
 */
public class InvalidNodeException extends IllegalArgumentException {
  public final SyntaxNode node;

  public InvalidNodeException(String message, SyntaxNode node) {
    super(message + ": " + node);
    this.node = requireNonNull(node);
  }
}

// End InvalidNodeException.java
