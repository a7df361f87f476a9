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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Query {@code ?- l1, ..., ln.}, split by polarity.
 *
 * <p>{@link #negative} holds the atoms of negated literals without the
 * {@code not}.
 */
public class Query {
  public final List<String> positive;
  public final List<String> negative;

  public Query(List<String> positive, List<String> negative) {
    this.positive = ImmutableList.copyOf(positive);
    this.negative = ImmutableList.copyOf(negative);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Query
            && positive.equals(((Query) o).positive)
            && negative.equals(((Query) o).negative);
  }

  @Override
  public int hashCode() {
    return Objects.hash(positive, negative);
  }

  @Override
  public String toString() {
    final List<String> literals = new ArrayList<>(positive);
    for (String atom : negative) {
      literals.add("not " + atom);
    }
    return "?- " + String.join(", ", literals) + ".";
  }
}

// End Query.java
