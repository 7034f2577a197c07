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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.PrimitiveType;
import net.hydromatic.patmat.type.SliceType;
import net.hydromatic.patmat.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests {@link Specializer}, {@link PatStack} and {@link Matrix}. */
public class SpecializerTest {
  private final TypeSystem ts = new TypeSystem();
  private final MatchCheckContext cx = MatchCheckContext.of(ts);

  private List<List<Pat>> specialize(Pat pat, Constructor ctor,
      net.hydromatic.patmat.type.Type type) {
    return Specializer.specializeOnePattern(cx, pat, ctor,
        ctor.wildcardSubpatterns(cx, type));
  }

  @Test
  void testSpecializeVariant() {
    final DataType option = ts.option(PrimitiveType.BOOL);
    final Constructor some = Constructor.variant(option.variant("Some"));
    final Constructor none = Constructor.variant(option.variant("None"));
    final Pat someTrue =
        patterns.variantPat(option, "Some", patterns.boolPat(true));
    assertThat(specialize(someTrue, some, option), hasToString("[[true]]"));
    assertThat(specialize(someTrue, none, option), hasSize(0));
    assertThat(specialize(patterns.wildcardPat(option), some, option),
        hasToString("[[_]]"));
    assertThat(specialize(patterns.wildcardPat(option), none, option),
        hasToString("[[]]"));
    // A binding with a subpattern is transparent.
    assertThat(specialize(patterns.bindingPat("x", someTrue), some, option),
        hasToString("[[true]]"));
  }

  /** An or-pattern yields one row per matching alternative. */
  @Test
  void testSpecializeOr() {
    final Pat pat =
        patterns.orPat(patterns.intPat(PrimitiveType.U8, 1),
            patterns.intRangePat(PrimitiveType.U8, 0, 10),
            patterns.intPat(PrimitiveType.U8, 20));
    final Constructor one =
        IntRange.of(cx, PrimitiveType.U8, BigInteger.ONE, BigInteger.ONE);
    assertThat(specialize(pat, one, PrimitiveType.U8),
        hasToString("[[], []]"));
  }

  /** A range that partly overlaps a constructor indicates a bad split. */
  @Test
  void testPartialOverlapIsBug() {
    final Constructor ctor =
        IntRange.of(cx, PrimitiveType.U8, BigInteger.ZERO,
            BigInteger.valueOf(20));
    final Pat pat = patterns.intRangePat(PrimitiveType.U8, 10, 30);
    final InternalCompilerError e =
        assertThrows(InternalCompilerError.class,
            () -> specialize(pat, ctor, PrimitiveType.U8));
    assertThat(e.getMessage(),
        is("internal compiler error: range IntRange(0..=20) overlaps "
            + "pattern 10..=30"));
  }

  @Test
  void testSpecializeSequence() {
    final SliceType slice = ts.sliceType(PrimitiveType.BOOL);
    final Pat t = patterns.boolPat(true);
    final Pat f = patterns.boolPat(false);
    final Pat firstTrue =
        patterns.sequenceRestPat(slice, ImmutableList.of(t),
            ImmutableList.of(f));
    assertThat(specialize(firstTrue, Constructor.fixedLen(4), slice),
        hasToString("[[true, _, _, false]]"));
    assertThat(specialize(firstTrue, Constructor.fixedLen(1), slice),
        hasSize(0));
    assertThat(specialize(firstTrue, Constructor.varLen(2, 1), slice),
        hasToString("[[true, _, false]]"));
    final Pat pair = patterns.sequencePat(slice, t, f);
    assertThat(specialize(pair, Constructor.fixedLen(2), slice),
        hasToString("[[true, false]]"));
    assertThat(specialize(pair, Constructor.fixedLen(3), slice), hasSize(0));
  }

  @Test
  void testSpecializeWildcard() {
    final Pat t = patterns.boolPat(true);
    assertThat(
        specialize(t, Constructor.WILDCARD, PrimitiveType.BOOL), hasSize(0));
    assertThat(
        specialize(patterns.bindingPat(PrimitiveType.BOOL, "b"),
            Constructor.WILDCARD, PrimitiveType.BOOL),
        hasToString("[[]]"));
  }

  /** A float constant is covered by a range that includes it. */
  @Test
  void testConstantRange() {
    final Pat range =
        patterns.rangePat(PrimitiveType.F64, 1.0, 2.0,
            net.hydromatic.patmat.ast.Pattern.RangeEnd.EXCLUDED);
    assertThat(
        Specializer.constructorIntersectsPattern(cx,
            Constructor.constantValue(PrimitiveType.F64, 1.0), range),
        is(true));
    assertThat(
        Specializer.constructorIntersectsPattern(cx,
            Constructor.constantValue(PrimitiveType.F64, 2.0), range),
        is(false));
    assertThat(
        Specializer.constructorIntersectsPattern(cx,
            Constructor.constantRange(PrimitiveType.F64, 1.0, 2.0,
                net.hydromatic.patmat.ast.Pattern.RangeEnd.EXCLUDED),
            range),
        is(true));
  }

  @Test
  void testMatrix() {
    final Pat t = patterns.boolPat(true);
    final Pat wild = patterns.wildcardPat(PrimitiveType.BOOL);
    final Matrix matrix =
        Matrix.empty()
            .plus(PatStack.of(ImmutableList.of(t, wild)))
            .plus(PatStack.of(ImmutableList.of(wild, t)));
    final String expected = "+------+------+\n"
        + "| true | _    |\n"
        + "| _    | true |\n"
        + "+------+------+\n";
    assertThat(matrix, hasToString(expected));
    assertThat(Matrix.empty(), hasToString(""));
    assertThat(matrix.heads(), hasToString("[true, _]"));
    assertThat(matrix.headCtors(cx), hasToString("[ConstantValue(true)]"));

    final Constructor trueCtor =
        Constructor.constantValue(PrimitiveType.BOOL, true);
    final Matrix specialized =
        matrix.specializeConstructor(cx, trueCtor, ImmutableList.of());
    assertThat(specialized.rows(), hasToString("[[_], [true]]"));

    final Constructor falseCtor =
        Constructor.constantValue(PrimitiveType.BOOL, false);
    assertThat(
        matrix.specializeConstructor(cx, falseCtor, ImmutableList.of())
            .rows(),
        hasToString("[[true]]"));

    assertThrows(IllegalArgumentException.class,
        () -> matrix.plus(PatStack.of(t)));
  }

  @Test
  void testPatStack() {
    final PatStack empty = PatStack.empty();
    assertThat(empty.isEmpty(), is(true));
    assertThrows(InternalCompilerError.class, empty::head);
    final PatStack row =
        PatStack.of(
            ImmutableList.of(patterns.boolPat(false),
                patterns.wildcardPat(PrimitiveType.U8)));
    assertThat(row.size(), is(2));
    assertThat(row, hasToString("[false, _]"));
    assertThat(row.equals(PatStack.of(row.pats())), is(true));
  }

  @Test
  void testWitness() {
    final Pat t = patterns.boolPat(true);
    final Pat f = patterns.boolPat(false);
    final Witness witness = Witness.empty().push(f).push(t);
    assertThat(witness.pats(), hasToString("[true, false]"));
    assertThrows(InternalCompilerError.class, witness::singlePattern);

    final Witness pair =
        witness.applyConstructor(cx, Constructor.SINGLE,
            ts.tupleType(PrimitiveType.BOOL, PrimitiveType.BOOL));
    assertThat(pair.singlePattern(), hasToString("(true, false)"));

    // Applying a constructor that needs more patterns than are present.
    assertThrows(InternalCompilerError.class,
        () -> Witness.empty().push(t).applyConstructor(cx,
            Constructor.SINGLE,
            ts.tupleType(PrimitiveType.BOOL, PrimitiveType.BOOL)));
  }
}

// End SpecializerTest.java
