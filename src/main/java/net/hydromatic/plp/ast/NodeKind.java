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

import java.util.Locale;

/** Production kinds of a {@link Syntax.Tree}. */
public enum NodeKind {
  /** Root of a parsed program; children are statements. */
  PLP,

  // statements
  FACT,
  PFACT,
  CFACT,
  RULE,
  PRULE,
  CONSTRAINT,
  QUERY,

  // parts of statements
  HEAD,
  /** Head of a probabilistic rule: functor token followed by arguments. */
  OHEAD,
  BODY,

  // literals
  ATOM,
  GRATOM,
  PRED,
  GRPRED,

  // terms
  INTERVAL,
  /** Binary operation: arithmetic in a term, or comparison in a body. */
  BOP;

  /** Returns the name of this kind in lower case, as used in messages. */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns whether this kind is a top-level statement. */
  public boolean isStatement() {
    switch (this) {
      case FACT:
      case PFACT:
      case CFACT:
      case RULE:
      case PRULE:
      case CONSTRAINT:
      case QUERY:
        return true;
      default:
        return false;
    }
  }
}

// End NodeKind.java
