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
package net.hydromatic.plp;

import static net.hydromatic.plp.Matchers.isPlpError;
import static net.hydromatic.plp.Matchers.throwsA;
import static net.hydromatic.plp.Pl.pl;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.hydromatic.plp.parse.NoInputException;
import net.hydromatic.plp.parse.PlpParseException;
import net.hydromatic.plp.program.ProbFact;
import net.hydromatic.plp.program.Program;
import net.hydromatic.plp.program.Query;
import net.hydromatic.plp.util.Prop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Plp}, reading programs end to end. */
public class PlpTest {
  @TempDir Path dir;

  @Test
  void testExample() {
    final String expected =
        "% Logic program\n"
            + "b(@unify(\"0.5\", b, 1, 1, X, \"X\")) :- c(X).\n"
            + "c(1).\n"
            + "% Probabilistic facts\n"
            + "0.3::a.\n"
            + "% Probabilistic rules\n"
            + "0.5::b(X) :- c(X).\n";
    pl("0.3::a.", "0.5::b(X) :- c(X).", "c(1).")
        .assertParse(
            "plp(pfact(0.3, gratom(a)), "
                + "prule(0.5, ohead(b, X), body(pred(c, X))), "
                + "fact(grpred(c, 1)))")
        .assertLogic(containsString("c(1)."))
        .assertProgram(p -> assertThat(p, hasToString(expected)));
    assertThat(
        Plp.parse("0.3::a.", "0.5::b(X) :- c(X).", "c(1).").probFacts,
        is(ImmutableList.of(ProbFact.of("a", "0.3"))));
  }

  @Test
  void testProbabilisticFactsInOrder() {
    pl("0.1::a.", "0.2::b.", "0.3::c.")
        .assertProgram(
            p ->
                assertThat(
                    p.probFacts,
                    is(
                        ImmutableList.of(
                            ProbFact.of("a", "0.1"),
                            ProbFact.of("b", "0.2"),
                            ProbFact.of("c", "0.3")))));
  }

  @Test
  void testPropositionalAndParameterized() {
    pl("0.7::d :- a.", "0.5::b(X) :- c(X).", "a.", "c(2).")
        .assertLogic(
            is("d :- a, __pr_0.\n"
                + "b(@unify(\"0.5\", b, 1, 1, X, \"X\")) :- c(X).\n"
                + "a.\n"
                + "c(2)."))
        .assertProgram(
            p -> {
              assertThat(p.probRules.get(0).isProp, is(true));
              assertThat(p.probRules.get(1).isProp, is(false));
              assertThat(
                  p.probFacts,
                  is(ImmutableList.of(ProbFact.of("__pr_0", "0.7"))));
            });
  }

  @Test
  void testQueries() {
    final Query query =
        new Query(ImmutableList.of("a"), ImmutableList.of("b"));
    pl("a.", "?- a, not b.")
        .assertProgram(
            p -> assertThat(p.queries, is(ImmutableList.of(query))));
  }

  @Test
  void testProperties() {
    final Pl pl = pl("0.7::d :- a.").withProp(Prop.PROP_FACT_PREFIX, "gate");
    pl.assertLogic(is("d :- a, gate0."));
    final Plp plp = new Plp().withProp(Prop.UNIFY_FUNCTION, "@u");
    assertThat(
        plp.parseString(ImmutableList.of("0.5::b(X) :- c(X).")).logicProgram,
        is("b(@u(\"0.5\", b, 1, 1, X, \"X\")) :- c(X)."));
    assertThat(plp.props().get(Prop.UNIFY_FUNCTION), is("@u"));
    // A new Plp has no properties set.
    assertThat(new Plp().props().isEmpty(), is(true));
  }

  @Test
  void testErrors() {
    pl("a(X).").assertError(isPlpError(startsWith("1.1 Error: Fact must be")));
    pl("a :- ")
        .assertError(
            throwsA(PlpParseException.class, containsString("line 1")));
    assertThrows(NoInputException.class, Plp::parse);
  }

  @Test
  void testFiles() throws IOException {
    final Path f1 = dir.resolve("facts.plp");
    final Path f2 = dir.resolve("rules.plp");
    Files.write(
        f1, "0.3::a.\nc(1).\n".getBytes(StandardCharsets.UTF_8));
    Files.write(
        f2,
        "% shares a fact with facts.plp\nc(1).\n0.5::b(X) :- c(X).\n"
            .getBytes(StandardCharsets.UTF_8));
    final Program program = new Plp().parseFiles(ImmutableList.of(f1, f2));
    assertThat(
        program.logicProgram,
        is("c(1).\nb(@unify(\"0.5\", b, 1, 1, X, \"X\")) :- c(X)."));
    assertThat(program.probRules.size(), is(1));

    final Program program2 =
        new Plp()
            .withProp(Prop.DEDUPLICATE, false)
            .parseFiles(ImmutableList.of(f1, f2));
    assertThat(
        program2.logicProgram,
        is("c(1).\nc(1).\nb(@unify(\"0.5\", b, 1, 1, X, \"X\")) :- c(X)."));

    assertThrows(
        NoInputException.class,
        () -> new Plp().parseFiles(ImmutableList.of()));
  }
}

// End PlpTest.java
