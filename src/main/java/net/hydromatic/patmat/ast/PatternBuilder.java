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
package net.hydromatic.patmat.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.hydromatic.patmat.type.ArrayType;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.PrimitiveType;
import net.hydromatic.patmat.type.RefType;
import net.hydromatic.patmat.type.SliceType;
import net.hydromatic.patmat.type.TupleType;
import net.hydromatic.patmat.type.Type;
import net.hydromatic.patmat.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds patterns. */
public enum PatternBuilder {
  /**
   * The singleton instance of the pattern builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  patterns;

  /** Creates a wildcard pattern, "{@code _}". */
  public Pattern.WildcardPat wildcardPat(Type type) {
    return new Pattern.WildcardPat(Pos.ZERO, type);
  }

  /** Creates a binding pattern that has no subpattern, "{@code x}". */
  public Pattern.BindingPat bindingPat(Type type, String name) {
    return new Pattern.BindingPat(Pos.ZERO, type, name, null);
  }

  /** Creates a binding pattern with a subpattern, "{@code x @ p}". */
  public Pattern.BindingPat bindingPat(String name, Pattern.Pat subpattern) {
    return new Pattern.BindingPat(Pos.ZERO, subpattern.type, name,
        subpattern);
  }

  /** Creates a constant pattern. */
  @SuppressWarnings("rawtypes")
  public Pattern.ConstantPat constantPat(Type type, Comparable value) {
    return new Pattern.ConstantPat(Pos.ZERO, type, normalize(type, value));
  }

  /** Creates a boolean constant pattern. */
  public Pattern.ConstantPat boolPat(boolean value) {
    return constantPat(PrimitiveType.BOOL, value);
  }

  /** Creates an integer constant pattern. */
  public Pattern.ConstantPat intPat(Type type, long value) {
    return constantPat(type, BigInteger.valueOf(value));
  }

  /** Creates a character constant pattern. */
  public Pattern.ConstantPat charPat(int codePoint) {
    return constantPat(PrimitiveType.CHAR, BigInteger.valueOf(codePoint));
  }

  /** Creates a floating-point constant pattern. */
  public Pattern.ConstantPat floatPat(Type type, double value) {
    return constantPat(type, value);
  }

  /** Creates a string constant pattern, of type {@code str}. */
  public Pattern.ConstantPat strPat(String value) {
    return constantPat(PrimitiveType.STR, value);
  }

  /** Creates a range pattern. */
  @SuppressWarnings("rawtypes")
  public Pattern.RangePat rangePat(Type type, Comparable lo, Comparable hi,
      Pattern.RangeEnd end) {
    return new Pattern.RangePat(Pos.ZERO, type, normalize(type, lo),
        normalize(type, hi), end);
  }

  /** Creates an inclusive integer range pattern, "{@code lo..=hi}". */
  public Pattern.RangePat intRangePat(Type type, long lo, long hi) {
    return rangePat(type, BigInteger.valueOf(lo), BigInteger.valueOf(hi),
        Pattern.RangeEnd.INCLUDED);
  }

  /** Creates an inclusive character range pattern, "{@code 'a'..='z'}". */
  public Pattern.RangePat charRangePat(int lo, int hi) {
    return rangePat(PrimitiveType.CHAR, BigInteger.valueOf(lo),
        BigInteger.valueOf(hi), Pattern.RangeEnd.INCLUDED);
  }

  /**
   * Converts a constant to its canonical representation: integers and
   * characters to {@link BigInteger}, floating-point numbers to
   * {@link Double}.
   */
  @SuppressWarnings("rawtypes")
  private static Comparable normalize(Type type, Comparable value) {
    if (type.isIntegral()) {
      if (value instanceof BigInteger) {
        return value;
      }
      if (value instanceof Character) {
        return BigInteger.valueOf((Character) value);
      }
      if (value instanceof Long
          || value instanceof Integer
          || value instanceof Short
          || value instanceof Byte) {
        return BigInteger.valueOf(((Number) value).longValue());
      }
      throw new IllegalArgumentException("not an integer: " + value);
    }
    if (type == PrimitiveType.BOOL) {
      checkArgument(value instanceof Boolean, "not a boolean: %s", value);
    }
    if (type instanceof PrimitiveType && ((PrimitiveType) type).isFloat()
        && value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return value;
  }

  /** Creates a tuple pattern, deriving the tuple type from the arguments. */
  public Pattern.LeafPat tuplePat(TypeSystem typeSystem,
      Pattern.Pat... args) {
    final List<Pattern.Pat> argList = Arrays.asList(args);
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    argList.forEach(arg -> types.add(arg.type));
    return tuplePat(typeSystem.tupleType(types.build()), argList);
  }

  /** Creates a tuple pattern. */
  public Pattern.LeafPat tuplePat(TupleType type, List<Pattern.Pat> args) {
    checkArgument(args.size() == type.argTypes.size(),
        "wrong number of arguments for %s", type);
    return new Pattern.LeafPat(Pos.ZERO, type, fields(args));
  }

  /** Creates a struct pattern that lists every field. */
  public Pattern.LeafPat structPat(DataType type, Pattern.Pat... args) {
    checkArgument(!type.isEnum(), "not a struct: %s", type);
    checkArgument(args.length == type.variants().get(0).fields.size(),
        "wrong number of fields for %s", type);
    return new Pattern.LeafPat(Pos.ZERO, type, fields(Arrays.asList(args)));
  }

  /**
   * Creates a struct pattern that lists some fields, by name; the others are
   * "{@code ..}".
   */
  public Pattern.LeafPat structPat(DataType type,
      Map<String, Pattern.Pat> args) {
    checkArgument(!type.isEnum(), "not a struct: %s", type);
    return new Pattern.LeafPat(Pos.ZERO, type,
        namedFields(type.variants().get(0), args));
  }

  /** Creates a pattern for a type with a single constructor. */
  public Pattern.LeafPat leafPat(Type type, List<Pattern.FieldPat> fields) {
    return new Pattern.LeafPat(Pos.ZERO, type, ImmutableList.copyOf(fields));
  }

  /** Creates a variant pattern that lists every field. */
  public Pattern.VariantPat variantPat(DataType type, String variantName,
      Pattern.Pat... args) {
    final DataType.Variant variant = type.variant(variantName);
    checkArgument(args.length == variant.fields.size(),
        "wrong number of fields for %s", variantName);
    return new Pattern.VariantPat(Pos.ZERO, type, variant.index,
        fields(Arrays.asList(args)));
  }

  /**
   * Creates a variant pattern that lists some fields, by name; the others
   * are "{@code ..}".
   */
  public Pattern.VariantPat variantPat(DataType type, String variantName,
      Map<String, Pattern.Pat> args) {
    final DataType.Variant variant = type.variant(variantName);
    return new Pattern.VariantPat(Pos.ZERO, type, variant.index,
        namedFields(variant, args));
  }

  /** Creates a variant pattern. */
  public Pattern.VariantPat variantPat(DataType type, int variantIndex,
      List<Pattern.FieldPat> fields) {
    checkArgument(type.isEnum(), "not an enum: %s", type);
    checkArgument(variantIndex >= 0
            && variantIndex < type.variants().size(),
        "bad variant index %s", variantIndex);
    return new Pattern.VariantPat(Pos.ZERO, type, variantIndex,
        ImmutableList.copyOf(fields));
  }

  /** Creates a field subpattern. */
  public Pattern.FieldPat fieldPat(int field, Pattern.Pat pat) {
    return new Pattern.FieldPat(field, pat);
  }

  /** Creates a dereference pattern, "{@code &p}" or "{@code box p}". */
  public Pattern.DerefPat derefPat(RefType type, Pattern.Pat subpattern) {
    return new Pattern.DerefPat(Pos.ZERO, type, subpattern);
  }

  /** Creates a sequence pattern. */
  public Pattern.SequencePat sequencePat(Type type, List<Pattern.Pat> prefix,
      Pattern.@Nullable Pat slice, List<Pattern.Pat> suffix) {
    checkArgument(type instanceof ArrayType || type instanceof SliceType,
        "not an array or slice: %s", type);
    return new Pattern.SequencePat(Pos.ZERO, type,
        ImmutableList.copyOf(prefix), slice, ImmutableList.copyOf(suffix));
  }

  /** Creates a sequence pattern of fixed length, "{@code [p, q]}". */
  public Pattern.SequencePat sequencePat(Type type, Pattern.Pat... elements) {
    return sequencePat(type, Arrays.asList(elements), null,
        ImmutableList.of());
  }

  /**
   * Creates a sequence pattern of variable length,
   * "{@code [p, .., q]}".
   */
  public Pattern.SequencePat sequenceRestPat(Type type,
      List<Pattern.Pat> prefix, List<Pattern.Pat> suffix) {
    return sequencePat(type, prefix, wildcardPat(type), suffix);
  }

  /** Creates an or-pattern. */
  public Pattern.OrPat orPat(Pattern.Pat... alternatives) {
    return orPat(Arrays.asList(alternatives));
  }

  /** Creates an or-pattern. */
  public Pattern.OrPat orPat(List<? extends Pattern.Pat> alternatives) {
    checkArgument(!alternatives.isEmpty(), "no alternatives");
    return new Pattern.OrPat(Pos.ZERO, alternatives.get(0).type,
        ImmutableList.copyOf(alternatives));
  }

  private ImmutableList<Pattern.FieldPat> fields(List<Pattern.Pat> args) {
    final ImmutableList.Builder<Pattern.FieldPat> b = ImmutableList.builder();
    for (int i = 0; i < args.size(); i++) {
      b.add(new Pattern.FieldPat(i, args.get(i)));
    }
    return b.build();
  }

  private ImmutableList<Pattern.FieldPat> namedFields(
      DataType.Variant variant, Map<String, Pattern.Pat> args) {
    final ImmutableList.Builder<Pattern.FieldPat> b = ImmutableList.builder();
    for (int i = 0; i < variant.fields.size(); i++) {
      final Pattern.Pat pat = args.get(variant.fields.get(i).name);
      if (pat != null) {
        b.add(new Pattern.FieldPat(i, pat));
      }
    }
    for (String name : args.keySet()) {
      checkArgument(
          variant.fields.stream().anyMatch(f -> f.name.equals(name)),
          "no field '%s' in %s", name, variant);
    }
    return b.build();
  }
}

// End PatternBuilder.java
