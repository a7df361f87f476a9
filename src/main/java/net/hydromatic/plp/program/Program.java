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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A probabilistic logic program, normalized for a grounding and inference
 * engine.
 *
 * <p>{@link #logicProgram} is the deterministic part: facts, rules,
 * constraints, and the clauses synthesized from probabilistic rules, one per
 * line. Each list preserves the order in which its elements first appeared
 * in the source; engines number their probabilistic variables in that order.
 */
public class Program {
  public final String logicProgram;
  public final List<ProbFact> probFacts;
  public final List<ProbRule> probRules;
  public final List<Query> queries;
  public final List<CredalFact> credalFacts;

  public Program(
      String logicProgram,
      List<ProbFact> probFacts,
      List<ProbRule> probRules,
      List<Query> queries,
      List<CredalFact> credalFacts) {
    this.logicProgram = requireNonNull(logicProgram);
    this.probFacts = ImmutableList.copyOf(probFacts);
    this.probRules = ImmutableList.copyOf(probRules);
    this.queries = ImmutableList.copyOf(queries);
    this.credalFacts = ImmutableList.copyOf(credalFacts);
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Program
            && logicProgram.equals(((Program) o).logicProgram)
            && probFacts.equals(((Program) o).probFacts)
            && probRules.equals(((Program) o).probRules)
            && queries.equals(((Program) o).queries)
            && credalFacts.equals(((Program) o).credalFacts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        logicProgram, probFacts, probRules, queries, credalFacts);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /**
   * Writes this program in sections, each headed by a comment, omitting
   * empty sections.
   */
  public StringBuilder describeTo(StringBuilder buf) {
    if (!logicProgram.isEmpty()) {
      buf.append("% Logic program\n").append(logicProgram).append('\n');
    }
    section(buf, "Probabilistic facts", probFacts);
    section(buf, "Credal facts", credalFacts);
    section(buf, "Probabilistic rules", probRules);
    section(buf, "Queries", queries);
    return buf;
  }

  private static void section(
      StringBuilder buf, String title, List<?> elements) {
    if (elements.isEmpty()) {
      return;
    }
    buf.append("% ").append(title).append('\n');
    for (Object element : elements) {
      buf.append(element).append('\n');
    }
  }

  /** Accumulates the parts of a program, in order. */
  public static class Builder {
    private final List<String> lines = new ArrayList<>();
    private final ImmutableList.Builder<ProbFact> probFacts =
        ImmutableList.builder();
    private final ImmutableList.Builder<ProbRule> probRules =
        ImmutableList.builder();
    private final ImmutableList.Builder<Query> queries =
        ImmutableList.builder();
    private final ImmutableList.Builder<CredalFact> credalFacts =
        ImmutableList.builder();

    private Builder() {}

    /** Adds a fact, rule or constraint to the logic program. */
    @CanIgnoreReturnValue
    public Builder addClause(String clause) {
      lines.add(requireNonNull(clause));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addProbFact(ProbFact probFact) {
      probFacts.add(probFact);
      return this;
    }

    /**
     * Adds a probabilistic rule, and also the clause synthesized from it: the
     * gated rule and its fresh probabilistic fact if propositional, otherwise
     * the unify clause.
     */
    @CanIgnoreReturnValue
    public Builder addProbRule(ProbRule probRule) {
      probRules.add(probRule);
      if (probRule.isProp) {
        addClause(requireNonNull(probRule.propFact));
        addProbFact(requireNonNull(probRule.propProbFact));
      } else {
        addClause(requireNonNull(probRule.unify));
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addQuery(Query query) {
      queries.add(query);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addCredalFact(CredalFact credalFact) {
      credalFacts.add(credalFact);
      return this;
    }

    public Program build() {
      return new Program(
          String.join("\n", lines),
          probFacts.build(),
          probRules.build(),
          queries.build(),
          credalFacts.build());
    }
  }
}

// End Program.java
