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

import java.util.Objects;

/**
 * Credal fact {@code [l, u]::a.}: the probability of ground atom {@code a}
 * lies between {@code lower} and {@code upper}.
 *
 * <p>Bounds are kept as they were written; the consumer checks that they
 * form an interval.
 */
public class CredalFact {
  public final String atom;
  public final String lower;
  public final String upper;

  public CredalFact(String atom, String lower, String upper) {
    this.atom = requireNonNull(atom);
    this.lower = requireNonNull(lower);
    this.upper = requireNonNull(upper);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof CredalFact
            && atom.equals(((CredalFact) o).atom)
            && lower.equals(((CredalFact) o).lower)
            && upper.equals(((CredalFact) o).upper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(atom, lower, upper);
  }

  @Override
  public String toString() {
    return "[" + lower + ", " + upper + "]::" + atom + ".";
  }
}

// End CredalFact.java
