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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Probabilistic rule {@code p::h :- b.}.
 *
 * <p>A <em>propositional</em> rule (one without variables) is equivalent to a
 * fresh probabilistic fact {@code p::u.} plus the plain rule
 * {@code h :- b, u.}; both are held in {@link #propFact} and
 * {@link #propProbFact}.
 *
 * <p>A <em>parameterized</em> rule instead holds a {@link #unify} clause,
 * which makes every grounding that shares a key reuse one probabilistic
 * choice.
 */
public class ProbRule {
  /** Identifier of the rule; the probability as written. */
  public final String id;
  /** The rule without its probability, {@code h :- b}. */
  public final String rule;
  public final boolean isProp;
  public final @Nullable String propFact;
  public final @Nullable ProbFact propProbFact;
  public final @Nullable String unify;

  private ProbRule(
      String id,
      String rule,
      boolean isProp,
      @Nullable String propFact,
      @Nullable ProbFact propProbFact,
      @Nullable String unify) {
    this.id = requireNonNull(id);
    this.rule = requireNonNull(rule);
    this.isProp = isProp;
    this.propFact = propFact;
    this.propProbFact = propProbFact;
    this.unify = unify;
  }

  /** Creates a propositional rule. */
  public static ProbRule propositional(
      String id, String rule, String propFact, ProbFact propProbFact) {
    checkArgument(!propFact.isEmpty(), "empty fact");
    return new ProbRule(
        id, rule, true, propFact, requireNonNull(propProbFact), null);
  }

  /** Creates a parameterized rule. */
  public static ProbRule parameterized(String id, String rule, String unify) {
    checkArgument(!unify.isEmpty(), "empty unify clause");
    return new ProbRule(id, rule, false, null, null, unify);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ProbRule
            && id.equals(((ProbRule) o).id)
            && rule.equals(((ProbRule) o).rule)
            && isProp == ((ProbRule) o).isProp
            && Objects.equals(propFact, ((ProbRule) o).propFact)
            && Objects.equals(propProbFact, ((ProbRule) o).propProbFact)
            && Objects.equals(unify, ((ProbRule) o).unify);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, rule, isProp, propFact, propProbFact, unify);
  }

  @Override
  public String toString() {
    return id + "::" + rule + ".";
  }
}

// End ProbRule.java
