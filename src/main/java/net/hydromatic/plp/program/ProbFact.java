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
package net.hydromatic.plp.program;

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;

/**
 * Probabilistic fact {@code p::a.}: ground atom {@code a} is true with
 * probability {@code p}.
 *
 * <p>The probability is not validated; a consumer may reject values outside
 * [0, 1].
 */
public class ProbFact {
  public final String atom;
  public final BigDecimal p;

  public ProbFact(String atom, BigDecimal p) {
    this.atom = requireNonNull(atom);
    this.p = requireNonNull(p);
  }

  /**
   * Creates a ProbFact from the text of a probability literal.
   *
   * @throws NumberFormatException if {@code p} is not a decimal number
   */
  public static ProbFact of(String atom, String p) {
    return new ProbFact(atom, new BigDecimal(p));
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ProbFact
            && atom.equals(((ProbFact) o).atom)
            && p.compareTo(((ProbFact) o).p) == 0;
  }

  @Override
  public int hashCode() {
    return atom.hashCode() * 31 + p.stripTrailingZeros().hashCode();
  }

  @Override
  public String toString() {
    return p.toPlainString() + "::" + atom + ".";
  }
}

// End ProbFact.java
