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
import static net.hydromatic.patmat.util.Static.flatTransform;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.ArrayType;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.PrimitiveType;
import net.hydromatic.patmat.type.SliceType;
import net.hydromatic.patmat.type.Type;

/** Utilities for {@link Constructor}. */
public abstract class Constructors {
  private Constructors() {}

  /**
   * Returns the constructors that, between them, build every value of a
   * type.
   *
   * <p>The list is empty if the type is uninhabited (and
   * {@link Prop#EXHAUSTIVE_PATTERNS} is set). Integral types are described by
   * ranges; variable-length sequences by a single {@code VarLen(0, 0)}.
   */
  public static List<Constructor> allConstructors(MatchCheckContext cx,
      Type type) {
    switch (type.op()) {
    case PRIMITIVE_TYPE:
      final PrimitiveType primitiveType = (PrimitiveType) type;
      if (primitiveType == PrimitiveType.BOOL) {
        return ImmutableList.of(Constructor.constantValue(type, true),
            Constructor.constantValue(type, false));
      }
      if (primitiveType == PrimitiveType.CHAR) {
        // Surrogate code points are not characters.
        return ImmutableList.of(
            IntRange.of(cx, type, BigInteger.ZERO,
                BigInteger.valueOf(0xD7FF)),
            IntRange.of(cx, type, BigInteger.valueOf(0xE000),
                BigInteger.valueOf(Character.MAX_CODE_POINT)));
      }
      if (primitiveType.isIntegral()) {
        final int pointerWidth = cx.pointerWidth();
        return ImmutableList.of(
            IntRange.of(cx, type, primitiveType.minValue(pointerWidth),
                primitiveType.maxValue(pointerWidth)));
      }
      return singleOrEmpty(cx, type);

    case ARRAY_TYPE:
      final ArrayType arrayType = (ArrayType) type;
      if (arrayType.length != null) {
        if (arrayType.length > 0 && cx.isUninhabited(arrayType.elementType)) {
          return ImmutableList.of();
        }
        return ImmutableList.of(Constructor.fixedLen(arrayType.length));
      }
      return sequence(cx, arrayType.elementType);

    case SLICE_TYPE:
      return sequence(cx, ((SliceType) type).elementType);

    case DATA_TYPE:
      final DataType dataType = (DataType) type;
      if (!dataType.isEnum()) {
        return singleOrEmpty(cx, type);
      }
      final ImmutableList.Builder<Constructor> b = ImmutableList.builder();
      for (DataType.Variant variant : dataType.variants()) {
        if (!cx.isVariantUninhabited(dataType, variant)) {
          b.add(Constructor.variant(variant));
        }
      }
      return b.build();

    default:
      return singleOrEmpty(cx, type);
    }
  }

  private static List<Constructor> sequence(MatchCheckContext cx,
      Type elementType) {
    // If the elements are uninhabited, the only value is the empty sequence.
    return cx.isUninhabited(elementType)
        ? ImmutableList.of(Constructor.fixedLen(0))
        : ImmutableList.of(Constructor.varLen(0, 0));
  }

  private static List<Constructor> singleOrEmpty(MatchCheckContext cx,
      Type type) {
    return cx.isUninhabited(type)
        ? ImmutableList.of()
        : ImmutableList.of(Constructor.SINGLE);
  }

  /**
   * Returns the constructors of a pattern: {@link Constructor#WILDCARD} for
   * a wildcard or binding, one constructor for most other patterns, and the
   * constructors of every alternative for an or-pattern.
   */
  public static List<Constructor> patConstructors(MatchCheckContext cx,
      Pat pat) {
    switch (pat.op) {
    case WILDCARD_PAT:
      return ImmutableList.of(Constructor.WILDCARD);

    case BINDING_PAT:
      final Pattern.BindingPat bindingPat = (Pattern.BindingPat) pat;
      return bindingPat.subpattern == null
          ? ImmutableList.of(Constructor.WILDCARD)
          : patConstructors(cx, bindingPat.subpattern);

    case LEAF_PAT:
    case DEREF_PAT:
      return ImmutableList.of(Constructor.SINGLE);

    case VARIANT_PAT:
      return ImmutableList.of(
          Constructor.variant(((Pattern.VariantPat) pat).variant()));

    case CONSTANT_PAT:
      final Pattern.ConstantPat constantPat = (Pattern.ConstantPat) pat;
      final IntRange intRange =
          IntRange.fromConstant(cx, pat.type, constantPat.value);
      return ImmutableList.of(
          intRange != null
              ? intRange
              : Constructor.constantValue(pat.type, constantPat.value));

    case RANGE_PAT:
      final Pattern.RangePat rangePat = (Pattern.RangePat) pat;
      if (IntRange.isIntegral(pat.type)) {
        final IntRange intRange2 =
            IntRange.fromRange(cx, pat.type, rangePat.lo, rangePat.hi,
                rangePat.end);
        if (intRange2 == null) {
          throw bug("empty range pattern %s", pat);
        }
        return ImmutableList.of(intRange2);
      }
      return ImmutableList.of(
          Constructor.constantRange(pat.type, rangePat.lo, rangePat.hi,
              rangePat.end));

    case SEQUENCE_PAT:
      final Pattern.SequencePat sequencePat = (Pattern.SequencePat) pat;
      if (pat.type instanceof ArrayType
          && ((ArrayType) pat.type).length != null) {
        return ImmutableList.of(
            Constructor.fixedLen(((ArrayType) pat.type).length));
      }
      return ImmutableList.of(
          sequencePat.slice != null
              ? Constructor.varLen(sequencePat.prefix.size(),
                  sequencePat.suffix.size())
              : Constructor.fixedLen(sequencePat.fixedLength()));

    case OR_PAT:
      return flatTransform(((Pattern.OrPat) pat).alternatives,
          p -> patConstructors(cx, p));

    default:
      throw bug("unknown pattern %s", pat.op);
    }
  }
}

// End Constructors.java
