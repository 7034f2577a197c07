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
import static net.hydromatic.patmat.util.Static.anyMatch;
import static net.hydromatic.patmat.util.Static.bug;
import static net.hydromatic.patmat.util.Static.flatTransform;
import static net.hydromatic.patmat.util.Static.repeat;
import static net.hydromatic.patmat.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.patmat.ast.Pattern;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.ArrayType;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.ErrorType;
import net.hydromatic.patmat.type.RefType;
import net.hydromatic.patmat.type.SliceType;
import net.hydromatic.patmat.type.TupleType;
import net.hydromatic.patmat.type.Type;

/**
 * Constructor of values, or a set of constructors.
 *
 * <p>A pattern is a constructor applied to subpatterns: {@code Some(x)} is
 * the constructor {@code Some} applied to {@code x}. Base constructors
 * ({@link Kind#SINGLE}, {@link Kind#VARIANT}, {@link Kind#CONSTANT_VALUE},
 * {@link Kind#FIXED_LEN_SEQUENCE}) each denote exactly one way of building a
 * value. Meta-constructors ({@link Kind#INT_RANGE},
 * {@link Kind#CONSTANT_RANGE}, {@link Kind#VAR_LEN_SEQUENCE},
 * {@link Kind#WILDCARD}, {@link Kind#MISSING_CONSTRUCTORS}) denote sets of
 * base constructors; the usefulness algorithm splits them into groups that
 * the rows of a matrix cannot tell apart.
 */
public abstract class Constructor {
  /** Constructor of the only value shape of a tuple, struct or reference. */
  public static final Constructor SINGLE = new Single();

  /** Constructor that stands for all constructors of a type. */
  public static final Constructor WILDCARD = new Wildcard();

  public final Kind kind;

  Constructor(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Creates a constructor for a variant of an enum. */
  public static Constructor variant(DataType.Variant variant) {
    return new Variant(variant);
  }

  /** Creates a constructor for a constant that is not an integer. */
  @SuppressWarnings("rawtypes")
  public static Constructor constantValue(Type type, Comparable value) {
    return new ConstantValue(type, value);
  }

  /** Creates a constructor for a range of values that are not integers. */
  @SuppressWarnings("rawtypes")
  public static Constructor constantRange(Type type, Comparable lo,
      Comparable hi, Pattern.RangeEnd end) {
    return new ConstantRange(type, lo, hi, end);
  }

  /** Creates a constructor for sequences of a given length. */
  public static Constructor fixedLen(int length) {
    return new FixedLenSequence(length);
  }

  /**
   * Creates a constructor for sequences of length at least
   * {@code prefix + suffix}.
   */
  public static Constructor varLen(int prefix, int suffix) {
    return new VarLenSequence(prefix, suffix);
  }

  /** Returns whether this is {@link #WILDCARD}. */
  public boolean isWildcard() {
    return false;
  }

  /**
   * Splits this constructor into constructors that each behave uniformly
   * with respect to a given set of constructors.
   *
   * @param cx Context
   * @param type Type of the column
   * @param headCtors Constructors of the heads of the rows being checked
   */
  public final List<Constructor> split(MatchCheckContext cx, Type type,
      List<Constructor> headCtors) {
    final List<Constructor> list = split_(cx, type, headCtors);
    cx.tracer.onSplit(this, list);
    return list;
  }

  /** Implementation of {@link #split}; by default, does not split. */
  List<Constructor> split_(MatchCheckContext cx, Type type,
      List<Constructor> headCtors) {
    return ImmutableList.of(this);
  }

  /**
   * Returns the constructors covered by this constructor but not by any of
   * the given constructors.
   *
   * <p>By default, removes this constructor if it equals one of the used
   * constructors.
   */
  List<Constructor> subtract(MatchCheckContext cx, List<Constructor> used) {
    return anyMatch(used, this::equals)
        ? ImmutableList.of()
        : ImmutableList.of(this);
  }

  /**
   * Returns the types of the fields of a value built by this constructor;
   * empty for constants and wildcards.
   */
  List<Type> subpatternTypes(MatchCheckContext cx, Type type) {
    return ImmutableList.of();
  }

  /** Returns one wildcard pattern per field of this constructor. */
  public List<Pat> wildcardSubpatterns(MatchCheckContext cx, Type type) {
    return transformEager(subpatternTypes(cx, type), patterns::wildcardPat);
  }

  /** Returns the number of fields of this constructor. */
  public int arity(MatchCheckContext cx, Type type) {
    return subpatternTypes(cx, type).size();
  }

  /**
   * Builds a pattern by applying this constructor to subpatterns. The
   * number of subpatterns must equal the {@link #arity}.
   */
  public abstract Pat apply(MatchCheckContext cx, Type type, List<Pat> pats);

  /** Builds a pattern by applying this constructor to wildcards. */
  public Pat applyWildcards(MatchCheckContext cx, Type type) {
    return apply(cx, type, wildcardSubpatterns(cx, type));
  }

  /** Returns the element type of an array or slice type. */
  static Type elementType(Type type) {
    if (type instanceof ArrayType) {
      return ((ArrayType) type).elementType;
    }
    if (type instanceof SliceType) {
      return ((SliceType) type).elementType;
    }
    throw bug("sequence constructor for non-sequence type %s", type);
  }

  /** Kind of constructor. */
  public enum Kind {
    SINGLE,
    VARIANT,
    CONSTANT_VALUE,
    FIXED_LEN_SEQUENCE,
    INT_RANGE,
    CONSTANT_RANGE,
    VAR_LEN_SEQUENCE,
    WILDCARD,
    MISSING_CONSTRUCTORS;

    /** Returns whether this kind of constructor stands for a set. */
    public boolean isMeta() {
      switch (this) {
      case INT_RANGE:
      case CONSTANT_RANGE:
      case VAR_LEN_SEQUENCE:
      case WILDCARD:
      case MISSING_CONSTRUCTORS:
        return true;
      default:
        return false;
      }
    }
  }

  /**
   * Abstract constructor of a tuple, struct, reference or enum variant;
   * its fields are those of the type.
   */
  abstract static class Product extends Constructor {
    Product(Kind kind) {
      super(kind);
    }

    /** Returns the variant of a data type that this constructor builds. */
    abstract DataType.Variant variant(DataType dataType);

    @Override
    List<Type> subpatternTypes(MatchCheckContext cx, Type type) {
      if (type instanceof TupleType) {
        return ((TupleType) type).argTypes;
      }
      if (type instanceof RefType) {
        return ImmutableList.of(((RefType) type).elementType);
      }
      if (type instanceof DataType) {
        final DataType dataType = (DataType) type;
        final DataType.Variant variant = variant(dataType);
        final boolean nonExhaustive =
            variant.nonExhaustive && !dataType.isLocal();
        final ImmutableList.Builder<Type> types = ImmutableList.builder();
        for (DataType.Field field : variant.fields) {
          if (!dataType.isVisible(field)
              || nonExhaustive && cx.isUninhabited(field.type)) {
            // The field cannot be matched, and its inhabitedness must not
            // leak out.
            types.add(ErrorType.INSTANCE);
          } else if (field.type instanceof ArrayType
              && ((ArrayType) field.type).length == null) {
            types.add(ErrorType.INSTANCE);
          } else {
            types.add(field.type);
          }
        }
        return types.build();
      }
      if (type instanceof ArrayType || type instanceof SliceType) {
        throw bug("%s constructor for sequence type %s", kind, type);
      }
      return ImmutableList.of();
    }

    @Override
    public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
      if (type instanceof TupleType) {
        return patterns.leafPat(type, fieldPats(pats));
      }
      if (type instanceof DataType) {
        final DataType dataType = (DataType) type;
        if (dataType.isEnum()) {
          return patterns.variantPat(dataType, variant(dataType).index,
              fieldPats(pats));
        }
        return patterns.leafPat(type, fieldPats(pats));
      }
      if (type instanceof RefType) {
        return patterns.derefPat((RefType) type, pats.get(0));
      }
      return patterns.wildcardPat(type);
    }

    private static List<Pattern.FieldPat> fieldPats(List<Pat> pats) {
      final List<Pattern.FieldPat> list = new ArrayList<>();
      for (int i = 0; i < pats.size(); i++) {
        list.add(patterns.fieldPat(i, pats.get(i)));
      }
      return list;
    }
  }

  /** See {@link #SINGLE}. */
  static class Single extends Product {
    private Single() {
      super(Kind.SINGLE);
    }

    @Override
    DataType.Variant variant(DataType dataType) {
      if (dataType.isEnum()) {
        throw bug("single constructor for enum %s", dataType);
      }
      return dataType.variants().get(0);
    }

    @Override
    public String toString() {
      return "Single";
    }
  }

  /** Constructor for a variant of an enum. */
  static class Variant extends Product {
    final DataType.Variant variant;

    Variant(DataType.Variant variant) {
      super(Kind.VARIANT);
      this.variant = requireNonNull(variant);
    }

    @Override
    DataType.Variant variant(DataType dataType) {
      if (variant.index >= dataType.variants().size()
          || dataType.variants().get(variant.index) != variant) {
        throw bug("variant %s does not belong to %s", variant, dataType);
      }
      return variant;
    }

    @Override
    public int hashCode() {
      return variant.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Variant && variant == ((Variant) o).variant;
    }

    @Override
    public String toString() {
      return "Variant(" + variant.name + ")";
    }
  }

  /**
   * Constructor for a literal value that is not an integer, such as a
   * boolean, float or string.
   */
  @SuppressWarnings("rawtypes")
  static class ConstantValue extends Constructor {
    final Type type;
    final Comparable value;

    ConstantValue(Type type, Comparable value) {
      super(Kind.CONSTANT_VALUE);
      this.type = requireNonNull(type);
      this.value = requireNonNull(value);
    }

    @Override
    public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
      return patterns.constantPat(type, value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ConstantValue
              && type.equals(((ConstantValue) o).type)
              && value.equals(((ConstantValue) o).value);
    }

    @Override
    public String toString() {
      return "ConstantValue(" + value + ")";
    }
  }

  /** Constructor for a range of values that are not integers. */
  @SuppressWarnings("rawtypes")
  static class ConstantRange extends Constructor {
    final Type type;
    final Comparable lo;
    final Comparable hi;
    final Pattern.RangeEnd end;

    ConstantRange(Type type, Comparable lo, Comparable hi,
        Pattern.RangeEnd end) {
      super(Kind.CONSTANT_RANGE);
      this.type = requireNonNull(type);
      this.lo = requireNonNull(lo);
      this.hi = requireNonNull(hi);
      this.end = requireNonNull(end);
    }

    @Override
    public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
      return patterns.rangePat(type, lo, hi, end);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, lo, hi, end);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ConstantRange
              && type.equals(((ConstantRange) o).type)
              && lo.equals(((ConstantRange) o).lo)
              && hi.equals(((ConstantRange) o).hi)
              && end == ((ConstantRange) o).end;
    }

    @Override
    public String toString() {
      return "ConstantRange(" + lo + end.symbol + hi + ")";
    }
  }

  /** Constructor for arrays and slices of a given length. */
  static class FixedLenSequence extends Constructor {
    final int length;

    FixedLenSequence(int length) {
      super(Kind.FIXED_LEN_SEQUENCE);
      checkArgument(length >= 0, "negative length %s", length);
      this.length = length;
    }

    @Override
    List<Constructor> subtract(MatchCheckContext cx, List<Constructor> used) {
      for (Constructor c : used) {
        if (c instanceof FixedLenSequence
            && ((FixedLenSequence) c).length == length
            || c instanceof VarLenSequence
                && ((VarLenSequence) c).arity() <= length) {
          return ImmutableList.of();
        }
      }
      return ImmutableList.of(this);
    }

    @Override
    List<Type> subpatternTypes(MatchCheckContext cx, Type type) {
      return repeat(elementType(type), length);
    }

    @Override
    public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
      return patterns.sequencePat(type, pats, null, ImmutableList.of());
    }

    @Override
    public int hashCode() {
      return length;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FixedLenSequence
              && length == ((FixedLenSequence) o).length;
    }

    @Override
    public String toString() {
      return "FixedLen(" + length + ")";
    }
  }

  /**
   * Constructor for arrays and slices whose length is at least
   * {@code prefix + suffix}. The first {@code prefix} and the last
   * {@code suffix} elements are its fields.
   */
  static class VarLenSequence extends Constructor {
    final int prefix;
    final int suffix;

    VarLenSequence(int prefix, int suffix) {
      super(Kind.VAR_LEN_SEQUENCE);
      checkArgument(prefix >= 0 && suffix >= 0, "negative length");
      this.prefix = prefix;
      this.suffix = suffix;
    }

    int arity() {
      return prefix + suffix;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Sequences that are longer than every fixed-length row, and whose
     * prefix and suffix are longer than those of every variable-length row,
     * behave the same; so the result is a fixed-length constructor for each
     * shorter length, followed by one variable-length constructor.
     */
    @Override
    List<Constructor> split_(MatchCheckContext cx, Type type,
        List<Constructor> headCtors) {
      int maxPrefix = prefix;
      int maxSuffix = suffix;
      int maxFixed = 0;
      for (Constructor c : headCtors) {
        if (c instanceof FixedLenSequence) {
          maxFixed = Math.max(maxFixed, ((FixedLenSequence) c).length);
        } else if (c instanceof VarLenSequence) {
          maxPrefix = Math.max(maxPrefix, ((VarLenSequence) c).prefix);
          maxSuffix = Math.max(maxSuffix, ((VarLenSequence) c).suffix);
        }
      }
      // Make sure that every fixed-length row is shorter than the
      // variable-length constructor.
      if (maxFixed + 1 >= maxPrefix + maxSuffix) {
        maxPrefix = maxFixed + 1 - maxSuffix;
      }
      final ImmutableList.Builder<Constructor> b = ImmutableList.builder();
      for (int length = arity(); length < maxPrefix + maxSuffix; length++) {
        b.add(new FixedLenSequence(length));
      }
      b.add(new VarLenSequence(maxPrefix, maxSuffix));
      return b.build();
    }

    @Override
    List<Constructor> subtract(MatchCheckContext cx, List<Constructor> used) {
      // The shortest variable-length constructor that covers a suffix of
      // this one.
      int maxLength = Integer.MAX_VALUE;
      final SortedSet<Integer> fixedLengths = new TreeSet<>();
      for (Constructor c : used) {
        if (c instanceof VarLenSequence) {
          maxLength = Math.min(maxLength, ((VarLenSequence) c).arity());
        } else if (c instanceof FixedLenSequence) {
          fixedLengths.add(((FixedLenSequence) c).length);
        }
      }
      final int length = arity();
      if (maxLength <= length) {
        return ImmutableList.of();
      }
      final ImmutableList.Builder<Constructor> b = ImmutableList.builder();
      if (maxLength != Integer.MAX_VALUE) {
        for (int i = length; i < maxLength; i++) {
          if (!fixedLengths.contains(i)) {
            b.add(new FixedLenSequence(i));
          }
        }
        return b.build();
      }
      // No variable-length constructor is used. Lengths beyond the longest
      // fixed length are not covered.
      final int minFree =
          fixedLengths.isEmpty()
              ? length
              : Math.max(fixedLengths.last() + 1, length);
      for (int i = length; i < minFree; i++) {
        if (!fixedLengths.contains(i)) {
          b.add(new FixedLenSequence(i));
        }
      }
      b.add(new VarLenSequence(minFree - suffix, suffix));
      return b.build();
    }

    @Override
    List<Type> subpatternTypes(MatchCheckContext cx, Type type) {
      return repeat(elementType(type), arity());
    }

    @Override
    public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
      return patterns.sequencePat(type, pats.subList(0, prefix),
          patterns.wildcardPat(type), pats.subList(prefix, pats.size()));
    }

    @Override
    public int hashCode() {
      return Objects.hash(prefix, suffix);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof VarLenSequence
              && prefix == ((VarLenSequence) o).prefix
              && suffix == ((VarLenSequence) o).suffix;
    }

    @Override
    public String toString() {
      return "VarLen(" + prefix + ", " + suffix + ")";
    }
  }

  /** See {@link #WILDCARD}. */
  static class Wildcard extends Constructor {
    private Wildcard() {
      super(Kind.WILDCARD);
    }

    @Override
    public boolean isWildcard() {
      return true;
    }

    /**
     * {@inheritDoc}
     *
     * <p>If some constructors of the type appear in no row, they all behave
     * the same, and the result is a single {@link MissingConstructors}.
     * Otherwise, the result is every constructor of the type, each split in
     * turn.
     *
     * <p>If the type is non-exhaustive (it has constructors that the program
     * cannot see or that are too many to enumerate), the wildcard is not
     * split.
     */
    @Override
    List<Constructor> split_(MatchCheckContext cx, Type type,
        List<Constructor> headCtors) {
      final List<Constructor> allCtors =
          Constructors.allConstructors(cx, type);
      final boolean isDeclaredNonExhaustive =
          cx.isNonExhaustiveEnum(type) && !cx.isLocal(type);
      // Empty for a reason other than being uninhabited, for instance
      // because its variants are not visible.
      final boolean isPrivatelyEmpty =
          allCtors.isEmpty() && !cx.isUninhabited(type);
      final boolean isNonExhaustive =
          isPrivatelyEmpty
              || isDeclaredNonExhaustive
              || cx.isPointerSized(type) && !cx.precisePointerSizeMatching();
      if (isNonExhaustive) {
        return ImmutableList.of(this);
      }
      final MissingConstructors missing =
          new MissingConstructors(cx, allCtors, headCtors);
      if (!missing.isEmpty()) {
        return headCtors.isEmpty()
            ? ImmutableList.of(this)
            : ImmutableList.of(missing);
      }
      return flatTransform(allCtors, c -> c.split(cx, type, headCtors));
    }

    @Override
    public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
      return patterns.wildcardPat(type);
    }

    @Override
    public String toString() {
      return "Wildcard";
    }
  }
}

// End Constructor.java
