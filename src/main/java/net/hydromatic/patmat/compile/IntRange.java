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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.patmat.ast.PatternBuilder.patterns;
import static net.hydromatic.patmat.util.Static.bug;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.patmat.ast.Pattern;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.PrimitiveType;
import net.hydromatic.patmat.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Constructor for an inclusive range of values of an integral type
 * ({@code char} or an integer type).
 *
 * <p>Bounds are stored biased: for a signed type with {@code n} bits,
 * 2<sup>n-1</sup> is added to each value, so that the order of biased
 * values is the same as the order of the original values and all biased
 * values are non-negative.
 */
public class IntRange extends Constructor {
  public final Type type;
  /** Lower bound, biased, inclusive. */
  public final BigInteger lo;
  /** Upper bound, biased, inclusive. */
  public final BigInteger hi;
  private final BigInteger bias;

  IntRange(Type type, BigInteger lo, BigInteger hi, BigInteger bias) {
    super(Kind.INT_RANGE);
    this.type = requireNonNull(type);
    this.lo = requireNonNull(lo);
    this.hi = requireNonNull(hi);
    this.bias = requireNonNull(bias);
    checkArgument(lo.compareTo(hi) <= 0, "empty range %s..=%s", lo, hi);
  }

  /**
   * Creates a range from unbiased bounds.
   *
   * @throws IllegalArgumentException if {@code type} is not integral, or the
   *   range is empty
   */
  public static IntRange of(MatchCheckContext cx, Type type, BigInteger lo,
      BigInteger hi) {
    checkArgument(isIntegral(type), "not integral: %s", type);
    final BigInteger bias = signedBias(cx, type);
    return new IntRange(type, lo.add(bias), hi.add(bias), bias);
  }

  /** Returns whether a type is {@code char} or an integer type. */
  static boolean isIntegral(Type type) {
    return type.isIntegral();
  }

  /**
   * Returns whether the values of a type can be enumerated exhaustively.
   * Values of pointer-sized types can be enumerated only if
   * {@link Prop#PRECISE_POINTER_SIZE_MATCHING} is set.
   */
  static boolean shouldTreatRangeExhaustively(MatchCheckContext cx,
      Type type) {
    return isIntegral(type)
        && (!cx.isPointerSized(type) || cx.precisePointerSizeMatching());
  }

  /** Returns the number to add to a value of a type to bias it. */
  static BigInteger signedBias(MatchCheckContext cx, Type type) {
    if (type instanceof PrimitiveType && ((PrimitiveType) type).isSigned()) {
      final int bits = ((PrimitiveType) type).bits(cx.pointerWidth());
      return BigInteger.ONE.shiftLeft(bits - 1);
    }
    return BigInteger.ZERO;
  }

  /**
   * Creates a range containing a single constant, or returns null if the
   * type is not integral.
   */
  @SuppressWarnings("rawtypes")
  static @Nullable IntRange fromConstant(MatchCheckContext cx, Type type,
      Comparable value) {
    if (!isIntegral(type)) {
      return null;
    }
    final BigInteger v = toBigInteger(value);
    return of(cx, type, v, v);
  }

  /**
   * Creates a range from the bounds of a range pattern, or returns null if
   * the type is not integral or the range is empty.
   */
  @SuppressWarnings("rawtypes")
  static @Nullable IntRange fromRange(MatchCheckContext cx, Type type,
      Comparable lo, Comparable hi, Pattern.RangeEnd end) {
    if (!isIntegral(type)) {
      return null;
    }
    final BigInteger lo2 = toBigInteger(lo);
    BigInteger hi2 = toBigInteger(hi);
    if (end == Pattern.RangeEnd.EXCLUDED) {
      hi2 = hi2.subtract(BigInteger.ONE);
    }
    if (lo2.compareTo(hi2) > 0) {
      return null;
    }
    return of(cx, type, lo2, hi2);
  }

  /**
   * Creates a range from a constant or range pattern, or returns null if the
   * pattern is of another kind or its type is not integral.
   */
  static @Nullable IntRange fromPat(MatchCheckContext cx, Pat pat) {
    switch (pat.op) {
    case BINDING_PAT:
      final Pattern.BindingPat bindingPat = (Pattern.BindingPat) pat;
      return bindingPat.subpattern == null
          ? null
          : fromPat(cx, bindingPat.subpattern);
    case CONSTANT_PAT:
      final Pattern.ConstantPat constantPat = (Pattern.ConstantPat) pat;
      return fromConstant(cx, pat.type, constantPat.value);
    case RANGE_PAT:
      final Pattern.RangePat rangePat = (Pattern.RangePat) pat;
      return fromRange(cx, pat.type, rangePat.lo, rangePat.hi, rangePat.end);
    default:
      return null;
    }
  }

  @SuppressWarnings("rawtypes")
  private static BigInteger toBigInteger(Comparable value) {
    if (value instanceof BigInteger) {
      return (BigInteger) value;
    }
    if (value instanceof Character) {
      return BigInteger.valueOf((Character) value);
    }
    if (value instanceof Number) {
      return BigInteger.valueOf(((Number) value).longValue());
    }
    throw bug("not an integral value: %s", value);
  }

  /** Returns whether this range contains a single value. */
  public boolean isSingleton() {
    return lo.equals(hi);
  }

  /** Returns whether every value in this range is in {@code other}. */
  public boolean isSubrange(IntRange other) {
    return other.lo.compareTo(lo) <= 0 && hi.compareTo(other.hi) <= 0;
  }

  /**
   * Returns the values that are in both this range and {@code other}, or
   * null if there are none.
   *
   * <p>If the values of the type cannot be enumerated, two ranges intersect
   * only if this is a subrange of {@code other}.
   */
  public @Nullable IntRange intersection(MatchCheckContext cx,
      IntRange other) {
    if (shouldTreatRangeExhaustively(cx, type)) {
      final BigInteger lo2 = lo.max(other.lo);
      final BigInteger hi2 = hi.min(other.hi);
      return lo2.compareTo(hi2) <= 0
          ? new IntRange(type, lo2, hi2, bias)
          : null;
    }
    return isSubrange(other) ? this : null;
  }

  /**
   * Removes the values of this range from each of a list of ranges,
   * returning the remaining ranges.
   */
  List<IntRange> subtractFrom(List<IntRange> ranges) {
    final List<IntRange> remaining = new ArrayList<>();
    for (IntRange range : ranges) {
      if (hi.compareTo(range.lo) < 0 || lo.compareTo(range.hi) > 0) {
        // No overlap
        remaining.add(range);
        continue;
      }
      if (range.lo.compareTo(lo) < 0) {
        remaining.add(
            new IntRange(type, range.lo, lo.subtract(BigInteger.ONE), bias));
      }
      if (hi.compareTo(range.hi) < 0) {
        remaining.add(
            new IntRange(type, hi.add(BigInteger.ONE), range.hi, bias));
      }
    }
    return remaining;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Splits into sub-ranges at the boundaries of every head range that
   * overlaps this range, so that each sub-range is either inside or outside
   * each head range.
   */
  @Override
  List<Constructor> split_(MatchCheckContext cx, Type type,
      List<Constructor> headCtors) {
    if (!shouldTreatRangeExhaustively(cx, this.type)) {
      return ImmutableList.of(this);
    }
    // A border "b" means "just before value b". The border after the
    // maximum value is one greater than the maximum.
    final List<BigInteger> borders = new ArrayList<>();
    for (Constructor c : headCtors) {
      if (c instanceof IntRange) {
        final IntRange r = intersection(cx, (IntRange) c);
        if (r != null) {
          borders.add(r.lo);
          borders.add(r.hi.add(BigInteger.ONE));
        }
      }
    }
    borders.add(lo);
    borders.add(hi.add(BigInteger.ONE));
    borders.sort(null);
    final ImmutableList.Builder<Constructor> b = ImmutableList.builder();
    for (int i = 0; i + 1 < borders.size(); i++) {
      final BigInteger from = borders.get(i);
      final BigInteger to = borders.get(i + 1);
      if (from.compareTo(to) < 0) {
        b.add(
            new IntRange(this.type, from, to.subtract(BigInteger.ONE), bias));
      }
    }
    return b.build();
  }

  @Override
  List<Constructor> subtract(MatchCheckContext cx, List<Constructor> used) {
    List<IntRange> remaining = ImmutableList.of(this);
    for (Constructor c : used) {
      if (c instanceof IntRange) {
        remaining = ((IntRange) c).subtractFrom(remaining);
      }
    }
    return ImmutableList.copyOf(remaining);
  }

  @Override
  public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
    return toPat(type);
  }

  /**
   * Converts this range to a pattern: a constant if it contains one value,
   * otherwise an inclusive range.
   */
  public Pat toPat(Type type) {
    final BigInteger lo = this.lo.subtract(bias);
    final BigInteger hi = this.hi.subtract(bias);
    if (lo.equals(hi)) {
      return patterns.constantPat(type, lo);
    }
    return patterns.rangePat(type, lo, hi, Pattern.RangeEnd.INCLUDED);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, lo, hi);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof IntRange
            && type.equals(((IntRange) o).type)
            && lo.equals(((IntRange) o).lo)
            && hi.equals(((IntRange) o).hi);
  }

  @Override
  public String toString() {
    return "IntRange(" + lo.subtract(bias) + "..=" + hi.subtract(bias) + ")";
  }
}

// End IntRange.java
