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
package net.hydromatic.plp.ast;

/**
 * Closed range of integers {@code lower..upper}, as written in an interval
 * term. Empty if {@code lower > upper}.
 */
public final class Interval {
  public final int lower;
  public final int upper;

  public Interval(int lower, int upper) {
    this.lower = lower;
    this.upper = upper;
  }

  /** Returns the number of integers in this interval. */
  public int size() {
    return Math.max(0, upper - lower + 1);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Interval
            && lower == ((Interval) o).lower
            && upper == ((Interval) o).upper;
  }

  @Override
  public int hashCode() {
    return lower * 31 + upper;
  }

  @Override
  public String toString() {
    return lower + ".." + upper;
  }
}

// End Interval.java
