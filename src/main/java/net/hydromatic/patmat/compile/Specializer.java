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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern;
import net.hydromatic.patmat.ast.Pattern.Pat;

/**
 * Specializes the head of a row by a constructor.
 *
 * <p>Specializing pattern {@code p} by constructor {@code c} yields the rows
 * of subpatterns that a value built by {@code c} must match for {@code p} to
 * match it; no rows if {@code p} cannot match such a value.
 */
abstract class Specializer {
  private Specializer() {}

  /**
   * Specializes a pattern by a constructor.
   *
   * @param cx Context
   * @param pat Head of a row
   * @param ctor Constructor
   * @param wildSubpatterns Wildcard subpatterns of the constructor, one per
   *                        field
   * @return Zero or more rows of subpatterns; more than one only if the
   *   pattern is an or-pattern
   */
  static List<List<Pat>> specializeOnePattern(MatchCheckContext cx, Pat pat,
      Constructor ctor, List<Pat> wildSubpatterns) {
    if (pat instanceof Pattern.BindingPat
        && ((Pattern.BindingPat) pat).subpattern != null) {
      return specializeOnePattern(cx, ((Pattern.BindingPat) pat).subpattern,
          ctor, wildSubpatterns);
    }
    if (pat instanceof Pattern.OrPat) {
      final List<List<Pat>> list = new ArrayList<>();
      for (Pat alternative : ((Pattern.OrPat) pat).alternatives) {
        list.addAll(
            specializeOnePattern(cx, alternative, ctor, wildSubpatterns));
      }
      return list;
    }

    if (ctor.kind == Constructor.Kind.WILDCARD
        || ctor.kind == Constructor.Kind.MISSING_CONSTRUCTORS) {
      // A row survives only if its head is a wildcard; the wildcard is
      // consumed, and there are no subpatterns.
      return pat.isWildcard()
          ? ImmutableList.of(ImmutableList.of())
          : ImmutableList.of();
    }

    switch (pat.op) {
    case WILDCARD_PAT:
    case BINDING_PAT:
      return ImmutableList.of(wildSubpatterns);

    case VARIANT_PAT:
      final Pattern.VariantPat variantPat = (Pattern.VariantPat) pat;
      if (!Constructor.variant(variantPat.variant()).equals(ctor)) {
        return ImmutableList.of();
      }
      return ImmutableList.of(
          patternsForVariant(variantPat.subpatterns, wildSubpatterns));

    case LEAF_PAT:
      if (ctor.kind != Constructor.Kind.SINGLE) {
        return ImmutableList.of();
      }
      return ImmutableList.of(
          patternsForVariant(((Pattern.LeafPat) pat).subpatterns,
              wildSubpatterns));

    case DEREF_PAT:
      if (ctor.kind != Constructor.Kind.SINGLE) {
        return ImmutableList.of();
      }
      return ImmutableList.of(
          ImmutableList.of(((Pattern.DerefPat) pat).subpattern));

    case CONSTANT_PAT:
    case RANGE_PAT:
      return constructorIntersectsPattern(cx, ctor, pat)
          ? ImmutableList.of(ImmutableList.of())
          : ImmutableList.of();

    case SEQUENCE_PAT:
      return specializeSequence((Pattern.SequencePat) pat, ctor,
          wildSubpatterns);

    default:
      throw bug("unknown pattern %s", pat.op);
    }
  }

  /**
   * Specializes a sequence pattern by a sequence constructor. The prefix and
   * suffix of the pattern line up with the first and last fields of the
   * constructor; the fields in between are matched by the pattern's slice,
   * if it has one.
   */
  private static List<List<Pat>> specializeSequence(
      Pattern.SequencePat sequencePat, Constructor ctor,
      List<Pat> wildSubpatterns) {
    if (ctor.kind != Constructor.Kind.FIXED_LEN_SEQUENCE
        && ctor.kind != Constructor.Kind.VAR_LEN_SEQUENCE) {
      throw bug("sequence pattern %s specialized by %s", sequencePat, ctor);
    }
    final int arity = wildSubpatterns.size();
    final int sliceCount = arity - sequencePat.fixedLength();
    if (sliceCount < 0
        || sliceCount > 0 && sequencePat.slice == null) {
      return ImmutableList.of();
    }
    final int prefixCount = sequencePat.prefix.size();
    return ImmutableList.of(
        ImmutableList.<Pat>builder()
            .addAll(sequencePat.prefix)
            .addAll(
                wildSubpatterns.subList(prefixCount, prefixCount + sliceCount))
            .addAll(sequencePat.suffix)
            .build());
  }

  /**
   * Places the subpatterns of a struct or variant pattern into a list of
   * wildcards, one per field.
   */
  private static List<Pat> patternsForVariant(
      List<Pattern.FieldPat> subpatterns, List<Pat> wildSubpatterns) {
    final List<Pat> result = new ArrayList<>(wildSubpatterns);
    for (Pattern.FieldPat subpattern : subpatterns) {
      if (subpattern.field >= result.size()) {
        throw bug("field %s out of range", subpattern.field);
      }
      result.set(subpattern.field, subpattern.pat);
    }
    return result;
  }

  /**
   * Returns whether a constant or range pattern matches every value built by
   * a constructor.
   *
   * <p>Constructors have been split so that the values they build are either
   * all inside or all outside each pattern; for integral types, a partial
   * overlap is a bug.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  static boolean constructorIntersectsPattern(MatchCheckContext cx,
      Constructor ctor, Pat pat) {
    switch (ctor.kind) {
    case SINGLE:
      return true;

    case INT_RANGE:
      final IntRange ctorRange = (IntRange) ctor;
      final IntRange patRange = IntRange.fromPat(cx, pat);
      if (patRange == null) {
        throw bug("pattern %s is not an integer range", pat);
      }
      if (ctorRange.intersection(cx, patRange) == null) {
        return false;
      }
      if (!ctorRange.isSubrange(patRange)) {
        throw bug("range %s overlaps pattern %s", ctor, pat);
      }
      return true;

    case CONSTANT_VALUE:
    case CONSTANT_RANGE:
      final Comparable from;
      final Comparable to;
      final Pattern.RangeEnd end;
      if (ctor instanceof Constructor.ConstantValue) {
        from = to = ((Constructor.ConstantValue) ctor).value;
        end = Pattern.RangeEnd.INCLUDED;
      } else {
        final Constructor.ConstantRange range =
            (Constructor.ConstantRange) ctor;
        from = range.lo;
        to = range.hi;
        end = range.end;
      }
      final Comparable patFrom;
      final Comparable patTo;
      final Pattern.RangeEnd patEnd;
      if (pat instanceof Pattern.ConstantPat) {
        patFrom = patTo = ((Pattern.ConstantPat) pat).value;
        patEnd = Pattern.RangeEnd.INCLUDED;
      } else if (pat instanceof Pattern.RangePat) {
        patFrom = ((Pattern.RangePat) pat).lo;
        patTo = ((Pattern.RangePat) pat).hi;
        patEnd = ((Pattern.RangePat) pat).end;
      } else {
        throw bug("unexpected pattern %s", pat);
      }
      final int c = to.compareTo(patTo);
      return from.compareTo(patFrom) >= 0
          && (c < 0
              || c == 0
                  && (end == patEnd || patEnd == Pattern.RangeEnd.INCLUDED));

    default:
      throw bug("cannot specialize %s by %s", pat, ctor);
    }
  }
}

// End Specializer.java
