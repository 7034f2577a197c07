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

import static net.hydromatic.patmat.ast.PatternBuilder.patterns;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.ast.PatternExpander;
import net.hydromatic.patmat.ast.Pos;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.Type;

/**
 * Checks whether the patterns of a match expression are exhaustive and
 * whether any pattern is redundant.
 *
 * <p>Each check expands the patterns (see {@link PatternExpander}), builds a
 * {@link Matrix}, and asks {@link UsefulnessChecker} whether a row is useful.
 */
public class PatternCoverageChecker {
  private PatternCoverageChecker() {}

  /**
   * Returns whether a pattern is covered by a list of previous patterns; that
   * is, whether every value that matches {@code pat} matches one of
   * {@code prevPats}.
   */
  public static boolean isCoveredBy(MatchCheckContext cx,
      List<? extends Pat> prevPats, Pat pat) {
    final Usefulness usefulness =
        UsefulnessChecker.isUseful(cx, matrix(prevPats),
            PatStack.of(PatternExpander.expand(pat)),
            WitnessPreference.LEAVE_OUT_WITNESS);
    return !usefulness.isUseful();
  }

  /**
   * Returns whether a list of patterns is exhaustive; that is, whether every
   * value of {@code type} matches at least one of the patterns.
   */
  public static boolean isExhaustive(MatchCheckContext cx, Type type,
      List<? extends Pat> pats) {
    return isCoveredBy(cx, pats, patterns.wildcardPat(type));
  }

  /**
   * Returns patterns that describe the values of {@code type} that match
   * none of {@code pats}; empty if {@code pats} is exhaustive.
   */
  public static List<Pat> missingPatterns(MatchCheckContext cx, Type type,
      List<? extends Pat> pats) {
    final Usefulness usefulness =
        UsefulnessChecker.isUseful(cx, matrix(pats),
            PatStack.of(patterns.wildcardPat(type)),
            WitnessPreference.CONSTRUCT_WITNESS);
    // Different paths through the algorithm may build the same witness.
    final Map<String, Pat> map = new LinkedHashMap<>();
    for (Witness witness : usefulness.witnesses()) {
      final Pat pat = witness.singlePattern();
      map.putIfAbsent(pat.toString(), pat);
    }
    return ImmutableList.copyOf(map.values());
  }

  /**
   * Checks the arms of a match expression.
   *
   * <p>An arm is redundant if it is not useful with respect to the unguarded
   * arms before it. Arms with a guard are checked for redundancy, but since
   * the guard might be false, they do not make later arms redundant, nor do
   * they count toward exhaustiveness.
   */
  public static MatchReport checkMatch(MatchCheckContext cx, Type type,
      List<MatchArm> arms) {
    final List<Pat> prevPats = new ArrayList<>();
    final List<Integer> redundantArms = new ArrayList<>();
    for (int i = 0; i < arms.size(); i++) {
      final MatchArm arm = arms.get(i);
      if (isCoveredBy(cx, prevPats, arm.pat)) {
        redundantArms.add(i);
      }
      if (!arm.hasGuard) {
        prevPats.add(arm.pat);
      }
    }
    final List<Pat> missingPatterns =
        arms.isEmpty() && isEmptyMatchExhaustive(cx, type)
            ? ImmutableList.of()
            : missingPatterns(cx, type, prevPats);
    return new MatchReport(type, arms, redundantArms, missingPatterns);
  }

  /**
   * Returns whether a match with no arms is exhaustive: if the type is known
   * to be uninhabited, or is an enum with no variants that is not declared
   * non-exhaustive in another crate.
   */
  private static boolean isEmptyMatchExhaustive(MatchCheckContext cx,
      Type type) {
    if (cx.isUninhabited(type)) {
      return true;
    }
    if (type instanceof DataType) {
      final DataType dataType = (DataType) type;
      return dataType.isEnum()
          && dataType.variants().isEmpty()
          && !(cx.isNonExhaustiveEnum(type) && !cx.isLocal(type));
    }
    return false;
  }

  /**
   * Checks a match expression, and reports problems.
   *
   * <p>If an arm is redundant, creates an error for the first such arm, and
   * throws it unless the context's tracer handles it. Otherwise, if the
   * match is not exhaustive, passes a warning to {@code warningConsumer}.
   * Does nothing if {@link Prop#MATCH_COVERAGE_ENABLED} is false.
   */
  public static void check(MatchCheckContext cx, Type type,
      List<MatchArm> arms, Pos pos,
      Consumer<CompileException> warningConsumer) {
    if (!cx.matchCoverageEnabled()) {
      return;
    }
    final MatchReport report = checkMatch(cx, type, arms);
    if (report.hasRedundancy()) {
      final String message = report.isExhaustive()
          ? "match redundant"
          : "match redundant and nonexhaustive";
      final MatchArm arm = arms.get(report.redundantArms.get(0));
      final CompileException e = new CompileException(message, false, arm.pos);
      if (!cx.tracer.handleCompileException(e)) {
        throw e;
      }
    } else if (!report.isExhaustive()) {
      warningConsumer.accept(
          new CompileException("match nonexhaustive; patterns not covered: "
              + report.describeMissing(), true, pos));
    }
  }

  private static Matrix matrix(List<? extends Pat> pats) {
    Matrix matrix = Matrix.empty();
    for (Pat pat : pats) {
      matrix = matrix.plus(PatStack.of(PatternExpander.expand(pat)));
    }
    return matrix;
  }
}

// End PatternCoverageChecker.java
