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
package net.hydromatic.patmat.compile;

import static net.hydromatic.patmat.util.Static.bug;
import static net.hydromatic.patmat.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern.Pat;

/**
 * Row of patterns; one per column of a {@link Matrix}.
 *
 * <p>The first pattern is the head; the usefulness algorithm examines the
 * head and recurses on the rest.
 */
public class PatStack {
  private static final PatStack EMPTY = new PatStack(ImmutableList.of());

  private final ImmutableList<Pat> pats;

  private PatStack(ImmutableList<Pat> pats) {
    this.pats = pats;
  }

  /** Creates a row with one pattern. */
  public static PatStack of(Pat pat) {
    return new PatStack(ImmutableList.of(pat));
  }

  /** Creates a row. */
  public static PatStack of(List<? extends Pat> pats) {
    return pats.isEmpty() ? EMPTY : new PatStack(ImmutableList.copyOf(pats));
  }

  /** Returns a row with no patterns. */
  public static PatStack empty() {
    return EMPTY;
  }

  public int size() {
    return pats.size();
  }

  public boolean isEmpty() {
    return pats.isEmpty();
  }

  public List<Pat> pats() {
    return pats;
  }

  /** Returns the first pattern. */
  public Pat head() {
    if (pats.isEmpty()) {
      throw bug("head of empty row");
    }
    return pats.get(0);
  }

  /** Returns the constructors of the head pattern. */
  public List<Constructor> headCtors(MatchCheckContext cx) {
    return Constructors.patConstructors(cx, head());
  }

  /**
   * Specializes this row by a constructor: replaces the head with the
   * subpatterns a value built by the constructor must match. Returns no rows
   * if the head cannot match such a value, and several if the head is an
   * or-pattern.
   */
  public List<PatStack> specializeConstructor(MatchCheckContext cx,
      Constructor ctor, List<Pat> wildSubpatterns) {
    final List<Pat> tail = pats.subList(1, pats.size());
    return transformEager(
        Specializer.specializeOnePattern(cx, head(), ctor, wildSubpatterns),
        heads ->
            new PatStack(
                ImmutableList.<Pat>builder().addAll(heads).addAll(tail)
                    .build()));
  }

  @Override
  public int hashCode() {
    return pats.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PatStack && pats.equals(((PatStack) o).pats);
  }

  @Override
  public String toString() {
    return pats.toString();
  }
}

// End PatStack.java
