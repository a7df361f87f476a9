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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plp.ast.Syntax.Tree;
import net.hydromatic.plp.compile.ProgramTransformer;
import net.hydromatic.plp.parse.SourceLoader;
import net.hydromatic.plp.program.Program;
import net.hydromatic.plp.util.Prop;

/**
 * Entry point: reads probabilistic logic programs and transforms them into
 * {@link Program} values.
 *
 * <p>For example,
 *
 * <pre>{@code
 * Program program = Plp.parse("0.3::a.", "0.5::b(X) :- c(X).", "c(1).");
 * program.probFacts;   // [0.3::a.]
 * program.probRules;   // [0.5::b(X) :- c(X).]
 * }</pre>
 *
 * <p>Instances are immutable; each call transforms afresh.
 */
public class Plp {
  private final ImmutableMap<Prop, Object> map;

  /** Creates a Plp with default properties. */
  public Plp() {
    this(ImmutableMap.of());
  }

  /** Creates a Plp with the given properties. */
  public Plp(Map<Prop, Object> map) {
    this.map = ImmutableMap.copyOf(map);
  }

  /** Returns a copy of this Plp with a property set to a given value. */
  public Plp withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(this.map);
    prop.set(map, value);
    return new Plp(map);
  }

  /** Returns the properties. */
  public Map<Prop, Object> props() {
    return map;
  }

  /** Parses blocks of text as one program, using default properties. */
  public static Program parse(String... blocks) {
    return new Plp().parseString(ImmutableList.copyOf(blocks));
  }

  /**
   * Parses blocks of text, joined by line breaks, as one program.
   *
   * @throws net.hydromatic.plp.parse.NoInputException if there are no blocks
   * @throws net.hydromatic.plp.parse.PlpParseException if the text is invalid
   */
  public Program parseString(List<String> blocks) {
    return transform(new SourceLoader(map).readString(blocks));
  }

  /**
   * Reads and merges files, and transforms them into one program.
   *
   * @throws net.hydromatic.plp.parse.NoInputException if there are no files
   * @throws net.hydromatic.plp.parse.PlpParseException if a file is invalid
   * @throws java.io.UncheckedIOException if a file cannot be read
   */
  public Program parseFiles(List<Path> files) {
    return transform(new SourceLoader(map).read(files));
  }

  /** Transforms a syntax tree into a program. */
  public Program transform(Tree tree) {
    return new ProgramTransformer(map).transform(tree);
  }
}

// End Plp.java
