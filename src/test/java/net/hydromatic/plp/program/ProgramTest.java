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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

/** Tests for {@link Program} and its parts. */
public class ProgramTest {
  @Test
  void testProbFact() {
    final ProbFact f = ProbFact.of("a", "0.30");
    assertThat(f, is(ProbFact.of("a", "0.3")));
    assertThat(f.hashCode(), is(ProbFact.of("a", "0.3").hashCode()));
    assertThat(f, is(new ProbFact("a", new BigDecimal("0.3"))));
    assertThat(f, not(ProbFact.of("b", "0.3")));
    assertThat(f, not(ProbFact.of("a", "0.31")));
    assertThat(ProbFact.of("a", ".25"), hasToString("0.25::a."));
    assertThrows(NumberFormatException.class, () -> ProbFact.of("a", "x"));
  }

  @Test
  void testProbRule() {
    final ProbRule prop =
        ProbRule.propositional(
            "0.7", "d :- a", "d :- a, u0.", ProbFact.of("u0", "0.7"));
    assertThat(prop, hasToString("0.7::d :- a."));
    assertThat(prop.isProp, is(true));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ProbRule.propositional(
                "0.7", "d :- a", "", ProbFact.of("u", "1")));
    assertThrows(
        IllegalArgumentException.class,
        () -> ProbRule.parameterized("0.5", "b(X) :- c(X)", ""));
    assertThat(
        ProbRule.parameterized("0.5", "b(X) :- c(X)", "x."),
        is(ProbRule.parameterized("0.5", "b(X) :- c(X)", "x.")));
  }

  @Test
  void testBuilder() {
    final Program program =
        Program.builder()
            .addClause("c(1).")
            .addProbFact(ProbFact.of("a", "0.3"))
            .addProbRule(
                ProbRule.propositional(
                    "0.7", "d :- a", "d :- a, u0.", ProbFact.of("u0", "0.7")))
            .addProbRule(
                ProbRule.parameterized(
                    "0.5",
                    "b(X) :- c(X)",
                    "b(@unify(\"0.5\", b, 1, 1, X, \"X\")) :- c(X)."))
            .addQuery(new Query(ImmutableList.of("b(1)"), ImmutableList.of()))
            .addCredalFact(new CredalFact("e", "0.1", "0.2"))
            .build();
    assertThat(
        program.logicProgram,
        is("c(1).\nd :- a, u0.\n"
            + "b(@unify(\"0.5\", b, 1, 1, X, \"X\")) :- c(X)."));
    assertThat(
        program.probFacts,
        is(
            ImmutableList.of(
                ProbFact.of("a", "0.3"), ProbFact.of("u0", "0.7"))));
    final String expected =
        "% Logic program\n"
            + "c(1).\n"
            + "d :- a, u0.\n"
            + "b(@unify(\"0.5\", b, 1, 1, X, \"X\")) :- c(X).\n"
            + "% Probabilistic facts\n"
            + "0.3::a.\n"
            + "0.7::u0.\n"
            + "% Credal facts\n"
            + "[0.1, 0.2]::e.\n"
            + "% Probabilistic rules\n"
            + "0.7::d :- a.\n"
            + "0.5::b(X) :- c(X).\n"
            + "% Queries\n"
            + "?- b(1).\n";
    assertThat(program, hasToString(expected));
  }

  @Test
  void testEmptyProgram() {
    final Program program = Program.builder().build();
    assertThat(program.logicProgram, is(""));
    assertThat(program, hasToString(""));
    assertThat(
        program,
        is(
            new Program(
                "",
                ImmutableList.of(),
                ImmutableList.of(),
                ImmutableList.of(),
                ImmutableList.of())));
  }

  @Test
  void testQueryWithNegativesOnly() {
    assertThat(
        new Query(ImmutableList.of(), ImmutableList.of("a", "b(1)")),
        hasToString("?- not a, not b(1)."));
  }
}

// End ProgramTest.java
