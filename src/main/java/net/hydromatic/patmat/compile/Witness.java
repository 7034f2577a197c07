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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.Type;

/**
 * Partially built example of a value that a matrix does not match.
 *
 * <p>Patterns are stored in reverse order: the last pattern is for the
 * first column. As the usefulness algorithm returns from specializing by
 * constructor {@code c} of arity {@code n}, it replaces the last {@code n}
 * patterns with {@code c} applied to them; at the top level, one pattern
 * remains.
 */
public class Witness {
  private static final Witness EMPTY = new Witness(ImmutableList.of());

  private final ImmutableList<Pat> pats;

  private Witness(ImmutableList<Pat> pats) {
    this.pats = pats;
  }

  /** Returns a witness with no patterns. */
  static Witness empty() {
    return EMPTY;
  }

  /** Returns the patterns, one per column, in column order. */
  public List<Pat> pats() {
    return Lists.reverse(pats);
  }

  /**
   * Returns the single pattern of a complete witness.
   *
   * @throws InternalCompilerError if there is not exactly one pattern
   */
  public Pat singlePattern() {
    if (pats.size() != 1) {
      throw bug("witness has %s patterns: %s", pats.size(), this);
    }
    return pats.get(0);
  }

  /** Returns a witness with one more pattern, for the first column. */
  Witness push(Pat pat) {
    return new Witness(
        ImmutableList.<Pat>builder().addAll(pats).add(pat).build());
  }

  /**
   * Replaces the patterns for the fields of a constructor with the
   * constructor applied to them.
   */
  Witness applyConstructor(MatchCheckContext cx, Constructor ctor,
      Type type) {
    final int arity = ctor.arity(cx, type);
    final int length = pats.size();
    if (length < arity) {
      throw bug("witness %s is too short for %s", this, ctor);
    }
    final List<Pat> args = Lists.reverse(pats.subList(length - arity, length));
    final Pat pat = ctor.apply(cx, type, args);
    return new Witness(
        ImmutableList.<Pat>builder()
            .addAll(pats.subList(0, length - arity))
            .add(pat)
            .build());
  }

  @Override
  public String toString() {
    return pats().toString();
  }
}

// End Witness.java
