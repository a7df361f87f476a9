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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.plp.ast.Syntax.Tree;
import net.hydromatic.plp.parse.SourceLoader;
import net.hydromatic.plp.program.Program;
import net.hydromatic.plp.util.Prop;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Pl {
  private final List<String> blocks;
  private final Map<Prop, Object> propMap;

  Pl(List<String> blocks, Map<Prop, Object> propMap) {
    this.blocks = ImmutableList.copyOf(blocks);
    this.propMap = new EnumMap<>(Prop.class);
    this.propMap.putAll(propMap);
  }

  /** Creates a {@code Pl} from blocks of program text. */
  static Pl pl(String... blocks) {
    return new Pl(ImmutableList.copyOf(blocks), new EnumMap<>(Prop.class));
  }

  /** Returns a copy of this fixture with a property set. */
  Pl withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(propMap);
    prop.set(map, value);
    return new Pl(blocks, map);
  }

  Tree parse() {
    return new SourceLoader(propMap).readString(blocks);
  }

  Program program() {
    return new Plp(propMap).parseString(blocks);
  }

  /** Checks that the text parses to a tree with a given unparsed form. */
  @CanIgnoreReturnValue
  Pl assertParse(String expected) {
    assertThat(parse().toString(), is(expected));
    return this;
  }

  /** Checks the logic program text. */
  @CanIgnoreReturnValue
  Pl assertLogic(Matcher<String> matcher) {
    assertThat(program().logicProgram, matcher);
    return this;
  }

  /** Checks the whole program. */
  @CanIgnoreReturnValue
  Pl assertProgram(Consumer<Program> consumer) {
    consumer.accept(program());
    return this;
  }

  /** Checks that transforming the text throws. */
  @CanIgnoreReturnValue
  Pl assertError(Matcher<Throwable> matcher) {
    try {
      final Program program = program();
      fail("expected error, got " + program);
    } catch (RuntimeException e) {
      assertThat(e, matcher);
    }
    return this;
  }
}

// End Pl.java
