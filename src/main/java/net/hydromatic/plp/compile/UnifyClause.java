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
package net.hydromatic.plp.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Clause that gives a parameterized probabilistic rule one probabilistic
 * choice per key.
 *
 * <p>For rule {@code rid::name(h...) :- body} it renders as
 *
 * <pre>{@code
 * name(@unify("rid", name, k, m, h1, ..., hk, "b1", ..., "bm")) :- body.
 * }</pre>
 *
 * <p>where {@code h1..hk} are the non-ground head arguments, unquoted, so
 * that the grounder substitutes their values, and {@code b1..bm} are the
 * non-ground body arguments, quoted, so that the grounder sees their names.
 * The external function returns the same choice for every grounding with
 * the same key and head values.
 */
public class UnifyClause {
  public final String function;
  public final String ruleId;
  public final String name;
  public final List<String> headArgs;
  public final List<String> bodyArgs;
  public final String body;

  public UnifyClause(
      String function,
      String ruleId,
      String name,
      List<String> headArgs,
      List<String> bodyArgs,
      String body) {
    this.function = requireNonNull(function);
    this.ruleId = requireNonNull(ruleId);
    this.name = requireNonNull(name);
    this.headArgs = ImmutableList.copyOf(headArgs);
    this.bodyArgs = ImmutableList.copyOf(bodyArgs);
    this.body = requireNonNull(body);
  }

  /** Returns the arguments of the external call, in order. */
  public List<String> arguments() {
    final List<String> args = new ArrayList<>();
    args.add(quote(ruleId));
    args.add(name);
    args.add(Integer.toString(headArgs.size()));
    args.add(Integer.toString(bodyArgs.size()));
    args.addAll(headArgs);
    for (String bodyArg : bodyArgs) {
      args.add(quote(bodyArg));
    }
    return args;
  }

  @Override
  public String toString() {
    return name
        + "("
        + function
        + "("
        + String.join(", ", arguments())
        + ")) :- "
        + body
        + ".";
  }

  /** Encloses a string in double quotes, escaping as necessary. */
  static String quote(String s) {
    return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}

// End UnifyClause.java
