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

/**
 * Normalizer for probabilistic logic programs.
 *
 * <p>Reads programs written in a probabilistic extension of answer set
 * programming and produces a {@link net.hydromatic.plp.program.Program} that a
 * grounding and inference engine can consume directly.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.plp.Plp} - Main entry point. Orchestrates the
 *       pipeline: read &rarr; parse &rarr; merge &rarr; transform.
 *   <li>{@link net.hydromatic.plp.parse.SourceLoader} - Reads files or text
 *       blocks, parses them with the JavaCC-based {@code PlpParserImpl}, and
 *       merges the trees.
 *   <li>{@link net.hydromatic.plp.ast.Syntax} - Generic syntax tree: production
 *       nodes and tokens.
 *   <li>{@link net.hydromatic.plp.compile.TreePredicates} and {@link
 *       net.hydromatic.plp.compile.Groundedness} - Classify nodes and decide
 *       whether subtrees contain variables.
 *   <li>{@link net.hydromatic.plp.compile.ProgramTransformer} - Folds the tree
 *       into a program, synthesizing clauses for probabilistic rules.
 * </ul>
 *
 * <h2>Supported Syntax</h2>
 *
 * <ul>
 *   <li>Facts: {@code edge(1, 2).}
 *   <li>Rules: {@code path(X, Y) :- edge(X, Y), not blocked(X).}
 *   <li>Probabilistic facts: {@code 0.3::rain.}
 *   <li>Probabilistic rules: {@code 0.5::wet(X) :- rain, outside(X).}
 *   <li>Credal facts: {@code [0.2, 0.8]::coin.}
 *   <li>Integrity constraints: {@code :- a, not b.}
 *   <li>Queries: {@code ?- wet(1), not rain.}
 *   <li>Comparisons and arithmetic: {@code p(X + 1) :- q(X), X < 10.}
 *   <li>Intervals: {@code n(1..5).}
 *   <li>Comments: {@code % to end of line}
 * </ul>
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * Program p = Plp.parse("0.3::a.", "0.5::b(X) :- c(X).", "c(1).");
 * p.logicProgram;
 * // b(@unify("0.5", b, 1, 1, X, "X")) :- c(X).
 * // c(1).
 * p.probFacts;   // [0.3::a.]
 * }</pre>
 */
package net.hydromatic.plp;

// End package-info.java
