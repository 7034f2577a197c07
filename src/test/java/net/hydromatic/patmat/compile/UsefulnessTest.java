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

import static net.hydromatic.patmat.Mc.mc;
import static net.hydromatic.patmat.ast.PatternBuilder.patterns;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.ArrayType;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.PrimitiveType;
import net.hydromatic.patmat.type.RefType;
import net.hydromatic.patmat.type.SliceType;
import net.hydromatic.patmat.type.TupleType;
import net.hydromatic.patmat.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests {@link UsefulnessChecker}. */
public class UsefulnessTest {
  private final TypeSystem ts = new TypeSystem();

  private static Pat t() {
    return patterns.boolPat(true);
  }

  private static Pat f() {
    return patterns.boolPat(false);
  }

  private static Pat wild(net.hydromatic.patmat.type.Type type) {
    return patterns.wildcardPat(type);
  }

  /** A boolean match that lacks {@code false}. */
  @Test
  void testBool() {
    mc(ts, PrimitiveType.BOOL)
        .arms(t())
        .assertMissing("false")
        .assertRedundant();
    mc(ts, PrimitiveType.BOOL)
        .arms(t(), f())
        .assertExhaustive()
        .assertRedundant();
    mc(ts, PrimitiveType.BOOL)
        .arms(t(), f(), t())
        .assertExhaustive()
        .assertRedundant(2);
  }

  /** A match on {@code Option<bool>} that lacks {@code Some(false)}. */
  @Test
  void testOption() {
    final DataType option = ts.option(PrimitiveType.BOOL);
    final Pat none = patterns.variantPat(option, "None");
    mc(ts, option)
        .arms(none, patterns.variantPat(option, "Some", t()))
        .assertMissing("Some(false)");
    mc(ts, option)
        .arms(patterns.variantPat(option, "Some", wild(PrimitiveType.BOOL)))
        .assertMissing("None");
    mc(ts, option)
        .arms(none,
            patterns.variantPat(option, "Some",
                patterns.bindingPat(PrimitiveType.BOOL, "b")))
        .assertExhaustive();
  }

  /** Overlapping integer ranges, and the gap after them. */
  @Test
  void testIntRanges() {
    final Pat r0 = patterns.intRangePat(PrimitiveType.U8, 0, 100);
    final Pat r1 = patterns.intRangePat(PrimitiveType.U8, 50, 200);
    mc(ts, PrimitiveType.U8)
        .arms(r0, r1)
        .assertMissing("201..=255")
        .assertRedundant();
    mc(ts, PrimitiveType.U8)
        .arms(r0, r1, patterns.intRangePat(PrimitiveType.U8, 201, 255))
        .assertExhaustive();
    mc(ts, PrimitiveType.U8)
        .arms(r0, patterns.intRangePat(PrimitiveType.U8, 50, 60))
        .assertRedundant(1);
    mc(ts, PrimitiveType.U8)
        .arms(r0)
        .assertUseful(patterns.intPat(PrimitiveType.U8, 100), false)
        .assertUseful(patterns.intPat(PrimitiveType.U8, 101), true)
        .assertUseful(patterns.intRangePat(PrimitiveType.U8, 90, 110), true);
  }

  /** A single missing value becomes a constant, not a range. */
  @Test
  void testSignedGap() {
    mc(ts, PrimitiveType.I8)
        .arms(patterns.intRangePat(PrimitiveType.I8, -128, -1),
            patterns.intRangePat(PrimitiveType.I8, 1, 127))
        .assertMissing("0");
    mc(ts, PrimitiveType.I32)
        .arms(patterns.intRangePat(PrimitiveType.I32, Integer.MIN_VALUE, 9))
        .assertMissing("10..=2147483647");
  }

  @Test
  void testExclusiveRange() {
    mc(ts, PrimitiveType.U8)
        .arms(
            patterns.rangePat(PrimitiveType.U8, 0, 100,
                net.hydromatic.patmat.ast.Pattern.RangeEnd.EXCLUDED),
            patterns.intRangePat(PrimitiveType.U8, 101, 255))
        .assertMissing("100");
  }

  /** The gaps in a match on characters, including the surrogate gap. */
  @Test
  void testChar() {
    mc(ts, PrimitiveType.CHAR)
        .arms(patterns.charRangePat('a', 'z'))
        .assertMissing("'\\u{0}'..='`'", "'{'..='\\u{d7ff}'",
            "'\\u{e000}'..='\\u{10ffff}'");
    mc(ts, PrimitiveType.CHAR)
        .arms(patterns.charRangePat(0, 0xD7FF),
            patterns.charRangePat(0xE000, 0x10FFFF))
        .assertExhaustive();
  }

  /**
   * Pointer-sized integers cannot be enumerated unless precise matching is
   * enabled.
   */
  @Test
  void testPointerSized() {
    final Pat all =
        patterns.intRangePat(PrimitiveType.ISIZE, Long.MIN_VALUE,
            Long.MAX_VALUE);
    mc(ts, PrimitiveType.ISIZE)
        .arms(all)
        .assertMissing("_");
    mc(ts, PrimitiveType.ISIZE)
        .withProp(Prop.PRECISE_POINTER_SIZE_MATCHING, true)
        .arms(all)
        .assertExhaustive();
    mc(ts, PrimitiveType.USIZE)
        .withProp(Prop.PRECISE_POINTER_SIZE_MATCHING, true)
        .withProp(Prop.POINTER_WIDTH, 32)
        .arms(patterns.intRangePat(PrimitiveType.USIZE, 0, 4294967295L))
        .assertExhaustive();
    mc(ts, PrimitiveType.USIZE)
        .withProp(Prop.PRECISE_POINTER_SIZE_MATCHING, true)
        .withProp(Prop.POINTER_WIDTH, 32)
        .arms(patterns.intRangePat(PrimitiveType.USIZE, 1, 4294967295L))
        .assertMissing("0");

    // Without precise matching, a constant is covered only by a range that
    // includes it.
    mc(ts, PrimitiveType.ISIZE)
        .arms(patterns.intRangePat(PrimitiveType.ISIZE, 0, 10))
        .assertUseful(patterns.intPat(PrimitiveType.ISIZE, 5), false)
        .assertUseful(patterns.intRangePat(PrimitiveType.ISIZE, 5, 11),
            true);
  }

  /** A slice match that lacks sequences that start with false. */
  @Test
  void testSlice() {
    final SliceType slice = ts.sliceType(PrimitiveType.BOOL);
    final Pat empty = patterns.sequencePat(slice);
    mc(ts, slice)
        .arms(empty,
            patterns.sequenceRestPat(slice, ImmutableList.of(t()),
                ImmutableList.of()))
        .assertMissing("[false, ..]");
    mc(ts, slice)
        .arms(empty,
            patterns.sequenceRestPat(slice, ImmutableList.of(),
                ImmutableList.of(t())))
        .assertMissing("[.., false]");
    mc(ts, slice)
        .arms(empty,
            patterns.sequencePat(slice, wild(PrimitiveType.BOOL)),
            patterns.sequenceRestPat(slice,
                ImmutableList.of(wild(PrimitiveType.BOOL),
                    wild(PrimitiveType.BOOL)),
                ImmutableList.of()))
        .assertExhaustive();
  }

  /**
   * Fixed-length rows cover only their lengths; the witnesses are the lengths
   * that no row mentions.
   */
  @Test
  void testSliceLengths() {
    final SliceType slice = ts.sliceType(PrimitiveType.BOOL);
    mc(ts, slice)
        .arms(patterns.sequencePat(slice, t()))
        .assertMissing("[]", "[_, _, ..]");
    mc(ts, slice)
        .arms(patterns.sequencePat(slice),
            patterns.sequencePat(slice, wild(PrimitiveType.BOOL),
                wild(PrimitiveType.BOOL)))
        .assertMissing("[_]", "[_, _, _, ..]");
  }

  @Test
  void testSliceRedundant() {
    final SliceType slice = ts.sliceType(PrimitiveType.BOOL);
    final Pat first = patterns.bindingPat(PrimitiveType.BOOL, "first");
    final Pat last = patterns.bindingPat(PrimitiveType.BOOL, "last");
    mc(ts, slice)
        .arms(
            patterns.sequenceRestPat(slice, ImmutableList.of(first),
                ImmutableList.of()),
            patterns.sequenceRestPat(slice, ImmutableList.of(),
                ImmutableList.of(last)),
            patterns.sequencePat(slice))
        .assertRedundant(1)
        .assertExhaustive();
    // "[x, y]" is covered by "[_, .., true]" and "[_, .., false]"
    mc(ts, slice)
        .arms(
            patterns.sequenceRestPat(slice,
                ImmutableList.of(wild(PrimitiveType.BOOL)),
                ImmutableList.of(t())),
            patterns.sequenceRestPat(slice,
                ImmutableList.of(wild(PrimitiveType.BOOL)),
                ImmutableList.of(f())))
        .assertUseful(
            patterns.sequencePat(slice, wild(PrimitiveType.BOOL),
                wild(PrimitiveType.BOOL)), false)
        .assertUseful(patterns.sequencePat(slice, t()), true)
        .assertMissing("[]", "[_]");
  }

  /** An array of known length behaves like a tuple. */
  @Test
  void testArray() {
    final ArrayType array = ts.arrayType(PrimitiveType.BOOL, 2);
    mc(ts, array)
        .arms(patterns.sequencePat(array, t(), wild(PrimitiveType.BOOL)),
            patterns.sequencePat(array, wild(PrimitiveType.BOOL), t()))
        .assertMissing("[false, false]");
    mc(ts, array)
        .arms(
            patterns.sequenceRestPat(array, ImmutableList.of(t()),
                ImmutableList.of()),
            patterns.sequenceRestPat(array, ImmutableList.of(),
                ImmutableList.of(wild(PrimitiveType.BOOL))))
        .assertExhaustive();
  }

  /** An array of unknown length behaves like a slice. */
  @Test
  void testArrayOfUnknownLength() {
    final ArrayType array = ts.arrayType(PrimitiveType.BOOL);
    mc(ts, array)
        .arms(patterns.sequencePat(array))
        .assertMissing("[_, ..]");
  }

  /**
   * An enum declared non-exhaustive in another crate needs a wildcard, even
   * if every variant is listed; but not if it is local.
   */
  @Test
  void testNonExhaustiveEnum() {
    final DataType foreign =
        ts.enumBuilder("Foreign", DataType.Flag.NON_EXHAUSTIVE)
            .variant("A").variant("B").build();
    mc(ts, foreign)
        .arms(patterns.variantPat(foreign, "A"),
            patterns.variantPat(foreign, "B"))
        .assertMissing("_");
    final DataType local =
        ts.enumBuilder("Local", DataType.Flag.NON_EXHAUSTIVE,
                DataType.Flag.LOCAL)
            .variant("A").variant("B").build();
    mc(ts, local)
        .arms(patterns.variantPat(local, "A"),
            patterns.variantPat(local, "B"))
        .assertExhaustive();
  }

  /**
   * A variant with a non-exhaustive field list, from another crate, is
   * useful even after an arm that matches it with "..".
   */
  @Test
  void testNonExhaustiveVariant() {
    final DataType e =
        ts.enumBuilder("Message")
            .variant("Quit")
            .variant("Move", true,
                ImmutableList.of(DataType.Field.of("x", PrimitiveType.BOOL)))
            .build();
    final Pat move = patterns.variantPat(e, "Move", ImmutableMap.of());
    mc(ts, e)
        .arms(patterns.variantPat(e, "Quit"), move)
        .assertExhaustive()
        .assertUseful(move, true);
  }

  @Test
  void testTuple() {
    final TupleType type =
        ts.tupleType(PrimitiveType.BOOL, PrimitiveType.BOOL);
    mc(ts, type)
        .arms(patterns.tuplePat(ts, t(), wild(PrimitiveType.BOOL)),
            patterns.tuplePat(ts, wild(PrimitiveType.BOOL), t()))
        .assertMissing("(false, false)");
    mc(ts, TupleType.UNIT)
        .arms(patterns.tuplePat(TupleType.UNIT, ImmutableList.of()))
        .assertExhaustive();
  }

  @Test
  void testStruct() {
    final DataType point =
        ts.structBuilder("Point", DataType.Flag.LOCAL)
            .fields(DataType.Field.of("x", PrimitiveType.BOOL),
                DataType.Field.of("y", PrimitiveType.BOOL))
            .build();
    mc(ts, point)
        .arms(patterns.structPat(point, ImmutableMap.of("x", t())),
            patterns.structPat(point, ImmutableMap.of("y", t())))
        .assertMissing("Point { x: false, y: false }");
  }

  /**
   * A private field of a struct from another crate cannot be matched; it is
   * treated as having the error type.
   */
  @Test
  void testPrivateField() {
    final DataType secret =
        ts.structBuilder("Secret")
            .fields(DataType.Field.of("shown", PrimitiveType.BOOL),
                DataType.Field.ofPrivate("hidden", PrimitiveType.BOOL))
            .build();
    final MatchCheckContext cx = MatchCheckContext.of(ts);
    final List<Pat> wilds =
        Constructor.SINGLE.wildcardSubpatterns(cx, secret);
    assertThat(wilds, hasSize(2));
    assertThat(wilds.get(0).type, is(PrimitiveType.BOOL));
    assertThat(wilds.get(1).type.isError(), is(true));
    mc(ts, secret)
        .arms(patterns.structPat(secret, ImmutableMap.of("shown", t())))
        .assertMissing("Secret { shown: false, .. }");
  }

  /**
   * A variant whose field is uninhabited need not be matched, but only if
   * the checker knows about uninhabited types.
   */
  @Test
  void testUninhabitedVariant() {
    final DataType never = ts.enumBuilder("Void").build();
    final DataType e =
        ts.enumBuilder("E", DataType.Flag.LOCAL)
            .variant("A", PrimitiveType.BOOL)
            .variant("B", never)
            .build();
    final Pat a = patterns.variantPat(e, "A", wild(PrimitiveType.BOOL));
    mc(ts, e)
        .arms(a)
        .assertMissing("B(_)");
    mc(ts, e)
        .withProp(Prop.EXHAUSTIVE_PATTERNS, true)
        .arms(a)
        .assertExhaustive();
  }

  /**
   * A slice of uninhabited elements can only be empty, if the checker
   * knows about uninhabited types.
   */
  @Test
  void testSliceOfNever() {
    final SliceType slice = ts.sliceType(PrimitiveType.NEVER);
    mc(ts, slice)
        .withProp(Prop.EXHAUSTIVE_PATTERNS, true)
        .arms(patterns.sequencePat(slice))
        .assertExhaustive();
    mc(ts, slice)
        .arms(patterns.sequencePat(slice))
        .assertMissing("[_, ..]");
  }

  @Test
  void testReference() {
    final RefType ref = ts.refType(PrimitiveType.BOOL);
    mc(ts, ref)
        .arms(patterns.derefPat(ref, t()))
        .assertMissing("&false");
    final RefType box = ts.boxType(PrimitiveType.BOOL);
    mc(ts, box)
        .arms(patterns.derefPat(box, f()))
        .assertMissing("box true");
  }

  /**
   * A string constant of reference type is matched through the reference;
   * strings cannot be enumerated.
   */
  @Test
  void testString() {
    final RefType strRef = ts.refType(PrimitiveType.STR);
    final Pat foo = patterns.constantPat(strRef, "foo");
    mc(ts, strRef)
        .arms(foo)
        .assertMissing("&_")
        .assertUseful(patterns.constantPat(strRef, "foo"), false)
        .assertUseful(patterns.constantPat(strRef, "bar"), true);
  }

  @Test
  void testFloat() {
    final Pat range =
        patterns.rangePat(PrimitiveType.F64, 1.0, 2.0,
            net.hydromatic.patmat.ast.Pattern.RangeEnd.INCLUDED);
    mc(ts, PrimitiveType.F64)
        .arms(range)
        .assertMissing("_")
        .assertUseful(patterns.floatPat(PrimitiveType.F64, 1.5), false)
        .assertUseful(patterns.floatPat(PrimitiveType.F64, 2.0), false)
        .assertUseful(patterns.floatPat(PrimitiveType.F64, 2.5), true);
  }

  @Test
  void testOrPattern() {
    final DataType option = ts.option(PrimitiveType.BOOL);
    final Pat none = patterns.variantPat(option, "None");
    final Pat someTrue = patterns.variantPat(option, "Some", t());
    final Pat someAny =
        patterns.variantPat(option, "Some", wild(PrimitiveType.BOOL));
    mc(ts, PrimitiveType.BOOL)
        .arms(patterns.orPat(t(), f()))
        .assertExhaustive();
    mc(ts, option)
        .arms(patterns.orPat(none, someTrue))
        .assertMissing("Some(false)");
    mc(ts, option)
        .arms(someAny, none, patterns.orPat(none, someTrue))
        .assertRedundant(2);
    mc(ts, option)
        .arms(someAny, patterns.orPat(none, someTrue))
        .assertRedundant()
        .assertExhaustive();
  }

  /**
   * An or-pattern whose alternatives overlap each other, but not a row of
   * the matrix.
   */
  @Test
  void testOverlappingOrPattern() {
    final Pat lo = patterns.intRangePat(PrimitiveType.U8, 0, 10);
    final Pat hi = patterns.intRangePat(PrimitiveType.U8, 5, 20);
    mc(ts, PrimitiveType.U8)
        .arms(lo)
        .assertUseful(patterns.orPat(lo, hi), true)
        .assertUseful(patterns.orPat(hi, lo), true)
        .assertUseful(
            patterns.orPat(lo, patterns.intRangePat(PrimitiveType.U8, 3, 7)),
            false);
    mc(ts, PrimitiveType.BOOL)
        .arms(t())
        .assertUseful(patterns.orPat(t(), wild(PrimitiveType.BOOL)), true);
  }

  @Test
  void testBindings() {
    mc(ts, PrimitiveType.BOOL)
        .arms(patterns.bindingPat("x", t()),
            patterns.bindingPat(PrimitiveType.BOOL, "b"))
        .assertExhaustive()
        .assertRedundant();
    mc(ts, PrimitiveType.BOOL)
        .arms(patterns.bindingPat(PrimitiveType.BOOL, "b"), t())
        .assertRedundant(1);
    mc(ts, PrimitiveType.BOOL)
        .arms(patterns.bindingPat("x", t()))
        .assertMissing("false");
  }

  /** A recursive type; the witness is a value two levels deep. */
  @Test
  void testRecursiveList() {
    final DataType.Builder b = ts.enumBuilder("List", DataType.Flag.LOCAL);
    final RefType boxList = ts.boxType(b.self());
    final DataType list =
        b.variant("Nil")
            .variant("Cons", PrimitiveType.BOOL, boxList)
            .build();
    final Pat nil = patterns.variantPat(list, "Nil");
    mc(ts, list)
        .arms(nil,
            patterns.variantPat(list, "Cons", wild(PrimitiveType.BOOL),
                patterns.derefPat(boxList, nil)))
        .assertMissing("Cons(_, box Cons(_, _))");
  }

  private boolean useful(Matrix matrix, Pat pat) {
    return UsefulnessChecker.isUseful(MatchCheckContext.of(ts), matrix,
        PatStack.of(pat), WitnessPreference.LEAVE_OUT_WITNESS).isUseful();
  }

  private static Matrix rows(Pat... pats) {
    Matrix matrix = Matrix.empty();
    for (Pat pat : pats) {
      matrix = matrix.plus(PatStack.of(pat));
    }
    return matrix;
  }

  /** Rows that cover a prefix of {@code u8}; the rest is still useful. */
  @Test
  void testRangeGap() {
    final Matrix matrix =
        rows(patterns.intRangePat(PrimitiveType.U8, 0, 2),
            patterns.intRangePat(PrimitiveType.U8, 3, 4));
    assertThat(useful(matrix, patterns.intRangePat(PrimitiveType.U8, 5, 5)),
        is(true));
    assertThat(useful(matrix, patterns.intRangePat(PrimitiveType.U8, 0, 4)),
        is(false));
    assertThat(
        useful(rows(patterns.intRangePat(PrimitiveType.U8, 0, 255)),
            wild(PrimitiveType.U8)),
        is(false));
  }

  /** Slices of length 1 and 3 leave length 2 uncovered. */
  @Test
  void testSliceGap() {
    final SliceType slice = ts.sliceType(PrimitiveType.BOOL);
    final Matrix matrix =
        rows(
            patterns.sequencePat(slice,
                patterns.bindingPat(PrimitiveType.BOOL, "x")),
            patterns.sequencePat(slice, wild(PrimitiveType.BOOL),
                wild(PrimitiveType.BOOL), wild(PrimitiveType.BOOL)));
    final Pat atLeastTwo =
        patterns.sequenceRestPat(slice,
            ImmutableList.of(wild(PrimitiveType.BOOL)),
            ImmutableList.of(wild(PrimitiveType.BOOL)));
    assertThat(useful(matrix, atLeastTwo), is(true));
    assertThat(
        useful(matrix,
            patterns.sequencePat(slice, t(), wild(PrimitiveType.BOOL))),
        is(true));
    assertThat(useful(matrix, patterns.sequencePat(slice, f())), is(false));
  }

  /**
   * A row after a wildcard is never useful, and adding a row in front never
   * makes a later row useful.
   */
  @Test
  void testMonotonic() {
    assertThat(useful(rows(wild(PrimitiveType.BOOL)), t()), is(false));
    assertThat(useful(rows(f()), t()), is(true));
    assertThat(useful(rows(t(), f()), t()), is(false));
    assertThat(useful(rows(f(), t()), t()), is(false));
  }

  /** Calls the checker directly on a matrix with two columns. */
  @Test
  void testTwoColumns() {
    final MatchCheckContext cx = MatchCheckContext.of(ts);
    final Matrix matrix =
        Matrix.of(
            ImmutableList.of(PatStack.of(ImmutableList.of(t(), t())),
                PatStack.of(ImmutableList.of(f(), wild(PrimitiveType.BOOL)))));
    final PatStack wilds =
        PatStack.of(
            ImmutableList.of(wild(PrimitiveType.BOOL),
                wild(PrimitiveType.BOOL)));
    final Usefulness usefulness =
        UsefulnessChecker.isUseful(cx, matrix, wilds,
            WitnessPreference.CONSTRUCT_WITNESS);
    assertThat(usefulness.kind, is(Usefulness.Kind.USEFUL_WITH_WITNESS));
    assertThat(usefulness.witnesses(), hasSize(1));
    assertThat(usefulness.witnesses().get(0).pats(),
        hasToString("[true, false]"));

    final Usefulness usefulness2 =
        UsefulnessChecker.isUseful(cx, matrix, wilds,
            WitnessPreference.LEAVE_OUT_WITNESS);
    assertThat(usefulness2, is(Usefulness.USEFUL));
    assertThat(usefulness2.witnesses().isEmpty(), is(true));

    final PatStack row = PatStack.of(ImmutableList.of(f(), t()));
    assertThat(
        UsefulnessChecker.isUseful(cx, matrix, row,
            WitnessPreference.LEAVE_OUT_WITNESS).isUseful(),
        is(false));
  }

  /** A row must be as wide as the rows of the matrix. */
  @Test
  void testRowWidthMismatch() {
    final MatchCheckContext cx = MatchCheckContext.of(ts);
    final Matrix matrix =
        Matrix.of(ImmutableList.of(PatStack.of(ImmutableList.of(t(), f()))));
    final InternalCompilerError e =
        assertThrows(InternalCompilerError.class, () ->
            UsefulnessChecker.isUseful(cx, matrix, PatStack.of(t()),
                WitnessPreference.LEAVE_OUT_WITNESS));
    assertThat(e.getMessage(), startsWith("internal compiler error: row"));
  }

  /** With no columns, a row is useful if and only if the matrix is empty. */
  @Test
  void testNoColumns() {
    final MatchCheckContext cx = MatchCheckContext.of(ts);
    final Usefulness u0 =
        UsefulnessChecker.isUseful(cx, Matrix.empty(), PatStack.empty(),
            WitnessPreference.CONSTRUCT_WITNESS);
    assertThat(u0.isUseful(), is(true));
    assertThat(u0.witnesses(), hasSize(1));
    assertThat(u0.witnesses().get(0).pats().isEmpty(), is(true));

    final Matrix matrix = Matrix.empty().plus(PatStack.empty());
    final Usefulness u1 =
        UsefulnessChecker.isUseful(cx, matrix, PatStack.empty(),
            WitnessPreference.CONSTRUCT_WITNESS);
    assertThat(u1, is(Usefulness.NOT_USEFUL));
  }
}

// End UsefulnessTest.java
