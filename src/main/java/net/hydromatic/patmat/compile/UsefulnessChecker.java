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

import static net.hydromatic.patmat.util.Static.anyMatch;
import static net.hydromatic.patmat.util.Static.bug;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.Type;

/**
 * Decides whether a row of patterns is useful with respect to a matrix: that
 * is, whether some value matches the row but no row of the matrix.
 *
 * <p>The algorithm is that of Luc Maranget, "Warnings for pattern matching"
 * (2007), extended with meta-constructors (ranges, variable-length
 * sequences, wildcards and missing constructors) so that types with many or
 * infinitely many constructors can be handled by splitting constructors
 * into a small number of groups.
 *
 * <p>To check that a match is exhaustive, ask whether a wildcard is useful
 * with respect to the matrix of arms; the witnesses are the values that are
 * not matched. To check that an arm is reachable, ask whether it is useful
 * with respect to the matrix of the arms before it.
 */
public abstract class UsefulnessChecker {
  private UsefulnessChecker() {}

  /**
   * Returns whether {@code v} is useful with respect to {@code matrix}.
   *
   * @param cx Context
   * @param matrix Matrix; every row has the same width as {@code v}
   * @param v Row
   * @param preference Whether to build witnesses
   */
  public static Usefulness isUseful(MatchCheckContext cx, Matrix matrix,
      PatStack v, WitnessPreference preference) {
    final Usefulness usefulness = isUseful_(cx, matrix, v, preference);
    cx.tracer.onUseful(matrix, v, usefulness);
    return usefulness;
  }

  private static Usefulness isUseful_(MatchCheckContext cx, Matrix matrix,
      PatStack v, WitnessPreference preference) {
    if (!matrix.isEmpty() && matrix.rows().get(0).size() != v.size()) {
      throw bug("row %s has different width than matrix", v);
    }

    // No columns left. The row is useful if and only if there are no rows
    // that would have matched first.
    if (v.isEmpty()) {
      return matrix.isEmpty()
          ? Usefulness.newUseful(preference)
          : Usefulness.NOT_USEFUL;
    }

    final Type type = columnType(matrix, v);
    final List<Constructor> vCtors = v.headCtors(cx);

    // A variant whose field list is declared non-exhaustive in another crate
    // might contain fields that the other rows do not mention.
    if (cx.isNonExhaustiveVariant(unwrap(v.head()))
        && !cx.isLocal(type)
        && !anyMatch(vCtors, Constructor::isWildcard)) {
      return Usefulness.USEFUL;
    }

    // Split using the constructors of the matrix and of the row. The row's
    // own constructors matter only if it is an or-pattern whose
    // alternatives overlap.
    final List<Constructor> headCtors = new ArrayList<>(matrix.headCtors(cx));
    for (Constructor c : vCtors) {
      if (!c.isWildcard()) {
        headCtors.add(c);
      }
    }

    for (Constructor vCtor : vCtors) {
      for (Constructor ctor : vCtor.split(cx, type, headCtors)) {
        final Usefulness usefulness =
            isUsefulSpecialized(cx, matrix, v, ctor, type, preference);
        if (usefulness.isUseful()) {
          return usefulness;
        }
      }
    }
    return Usefulness.NOT_USEFUL;
  }

  /**
   * Returns whether {@code v} is useful with respect to {@code matrix}, for
   * values built by constructor {@code ctor}.
   */
  static Usefulness isUsefulSpecialized(MatchCheckContext cx, Matrix matrix,
      PatStack v, Constructor ctor, Type type,
      WitnessPreference preference) {
    final List<Pat> wildSubpatterns = ctor.wildcardSubpatterns(cx, type);
    final Matrix specialized =
        matrix.specializeConstructor(cx, ctor, wildSubpatterns);
    cx.tracer.onSpecialize(ctor, specialized);
    for (PatStack v2 : v.specializeConstructor(cx, ctor, wildSubpatterns)) {
      final Usefulness usefulness = isUseful(cx, specialized, v2, preference);
      if (usefulness.isUseful()) {
        return usefulness.applyConstructor(cx, ctor, type);
      }
    }
    return Usefulness.NOT_USEFUL;
  }

  /**
   * Returns the type of the first column: the type of the first head that
   * is not of error type, or else of the head of {@code v}.
   */
  private static Type columnType(Matrix matrix, PatStack v) {
    for (Pat head : matrix.heads()) {
      if (!head.type.isError()) {
        return head.type;
      }
    }
    return v.head().type;
  }

  private static Pat unwrap(Pat pat) {
    while (pat instanceof Pattern.BindingPat
        && ((Pattern.BindingPat) pat).subpattern != null) {
      pat = ((Pattern.BindingPat) pat).subpattern;
    }
    return pat;
  }
}

// End UsefulnessChecker.java
