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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.PrimitiveType;
import net.hydromatic.patmat.type.RefType;
import net.hydromatic.patmat.type.TupleType;
import net.hydromatic.patmat.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Patterns, the left-hand sides of the arms of a match expression.
 *
 * <p>Every pattern carries the type of the values it matches. Patterns are
 * immutable; create them using {@link PatternBuilder#patterns}.
 *
 * <p>Constant values are represented as follows: integers and characters
 * as {@link BigInteger} (a character by its code point); booleans as
 * {@link Boolean}; floating-point numbers as {@link Double}; strings as
 * {@link String}.
 */
public class Pattern {
  private Pattern() {}

  /** Whether the upper bound of a range pattern is included. */
  public enum RangeEnd {
    INCLUDED("..="),
    EXCLUDED("..");

    public final String symbol;

    RangeEnd(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Base class for a pattern. */
  public abstract static class Pat extends AstNode {
    public final Type type;

    Pat(Pos pos, Op op, Type type) {
      super(pos, op);
      this.type = requireNonNull(type);
    }

    /**
     * Returns whether this pattern matches every value without looking at
     * it; true for a wildcard and for a binding that has no subpattern.
     */
    public boolean isWildcard() {
      return false;
    }

    /** Accepts a shuttle, returning a pattern of the same type. */
    public abstract Pat accept(PatShuttle shuttle);
  }

  /** Wildcard pattern, "{@code _}". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos, Type type) {
      super(pos, Op.WILDCARD_PAT, type);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append('_');
    }

    @Override
    public boolean isWildcard() {
      return true;
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /**
   * Binding pattern, "{@code x}" or "{@code x @ p}".
   *
   * <p>A binding without a subpattern matches everything; with a subpattern,
   * it matches what the subpattern matches.
   */
  public static class BindingPat extends Pat {
    public final String name;
    public final @Nullable Pat subpattern;

    BindingPat(Pos pos, Type type, String name, @Nullable Pat subpattern) {
      super(pos, Op.BINDING_PAT, type);
      this.name = requireNonNull(name);
      this.subpattern = subpattern;
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (subpattern == null) {
        return buf.append(name);
      }
      final boolean paren = left > op.left || right > op.right;
      if (paren) {
        buf.append('(');
      }
      buf.append(name).append(op.padded);
      subpattern.unparse(buf, op.right, paren ? 0 : right);
      return paren ? buf.append(')') : buf;
    }

    @Override
    public boolean isWildcard() {
      return subpattern == null;
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }

    public BindingPat copy(@Nullable Pat subpattern) {
      return subpattern == this.subpattern
          ? this
          : new BindingPat(pos, type, name, subpattern);
    }
  }

  /** Constant pattern, e.g. "{@code 5}", "{@code 'a'}", "{@code true}". */
  @SuppressWarnings("rawtypes")
  public static class ConstantPat extends Pat {
    public final Comparable value;

    ConstantPat(Pos pos, Type type, Comparable value) {
      super(pos, Op.CONSTANT_PAT, type);
      this.value = requireNonNull(value);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      return appendValue(buf, type, value);
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /** Range pattern, e.g. "{@code 0..=9}" or "{@code 'a'..'z'}". */
  @SuppressWarnings("rawtypes")
  public static class RangePat extends Pat {
    public final Comparable lo;
    public final Comparable hi;
    public final RangeEnd end;

    RangePat(Pos pos, Type type, Comparable lo, Comparable hi,
        RangeEnd end) {
      super(pos, Op.RANGE_PAT, type);
      this.lo = requireNonNull(lo);
      this.hi = requireNonNull(hi);
      this.end = requireNonNull(end);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      appendValue(buf, type, lo).append(end.symbol);
      return appendValue(buf, type, hi);
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }
  }

  /**
   * Pattern for a type that has a single constructor: a tuple or a struct.
   * It lists the subpatterns of some or all of the fields.
   */
  public static class LeafPat extends Pat {
    public final List<FieldPat> subpatterns;

    LeafPat(Pos pos, Type type, ImmutableList<FieldPat> subpatterns) {
      super(pos, Op.LEAF_PAT, type);
      this.subpatterns = requireNonNull(subpatterns);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (type instanceof DataType) {
        final DataType.Variant variant =
            ((DataType) type).variants().get(0);
        return unparseFields(buf, variant.name, variant, subpatterns);
      }
      final int fieldCount = type instanceof TupleType
          ? ((TupleType) type).argTypes.size()
          : subpatterns.size();
      buf.append('(');
      unparsePositional(buf, fieldCount, subpatterns);
      if (fieldCount == 1) {
        buf.append(',');
      }
      return buf.append(')');
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }

    public LeafPat copy(List<FieldPat> subpatterns) {
      return subpatterns.equals(this.subpatterns)
          ? this
          : new LeafPat(pos, type, ImmutableList.copyOf(subpatterns));
    }
  }

  /** Pattern for a variant of an enum, e.g. "{@code Some(x)}". */
  public static class VariantPat extends Pat {
    public final DataType dataType;
    public final int variantIndex;
    public final List<FieldPat> subpatterns;

    VariantPat(Pos pos, DataType dataType, int variantIndex,
        ImmutableList<FieldPat> subpatterns) {
      super(pos, Op.VARIANT_PAT, dataType);
      this.dataType = dataType;
      this.variantIndex = variantIndex;
      this.subpatterns = requireNonNull(subpatterns);
    }

    /** Returns the variant. */
    public DataType.Variant variant() {
      return dataType.variants().get(variantIndex);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      final DataType.Variant variant = variant();
      return unparseFields(buf, variant.name, variant, subpatterns);
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }

    public VariantPat copy(List<FieldPat> subpatterns) {
      return subpatterns.equals(this.subpatterns)
          ? this
          : new VariantPat(pos, dataType, variantIndex,
              ImmutableList.copyOf(subpatterns));
    }
  }

  /** Dereference pattern, "{@code &p}" or "{@code box p}". */
  public static class DerefPat extends Pat {
    public final Pat subpattern;

    DerefPat(Pos pos, Type type, Pat subpattern) {
      super(pos, Op.DEREF_PAT, type);
      this.subpattern = requireNonNull(subpattern);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      final boolean box = type instanceof RefType && ((RefType) type).box;
      buf.append(box ? "box " : op.padded);
      return subpattern.unparse(buf, op.right, right);
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }

    public DerefPat copy(Pat subpattern) {
      return subpattern == this.subpattern
          ? this
          : new DerefPat(pos, type, subpattern);
    }
  }

  /**
   * Pattern for an array or slice, e.g. "{@code [a, b]}" or
   * "{@code [first, .., last]}".
   *
   * <p>If {@link #slice} is not null, the pattern matches sequences of any
   * length of at least {@code prefix.size() + suffix.size()}.
   */
  public static class SequencePat extends Pat {
    public final List<Pat> prefix;
    public final @Nullable Pat slice;
    public final List<Pat> suffix;

    SequencePat(Pos pos, Type type, ImmutableList<Pat> prefix,
        @Nullable Pat slice, ImmutableList<Pat> suffix) {
      super(pos, Op.SEQUENCE_PAT, type);
      this.prefix = requireNonNull(prefix);
      this.slice = slice;
      this.suffix = requireNonNull(suffix);
      checkArgument(slice != null || suffix.isEmpty(),
          "suffix requires slice");
    }

    /** Returns the number of elements matched by the prefix and suffix. */
    public int fixedLength() {
      return prefix.size() + suffix.size();
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      buf.append('[');
      int i = 0;
      for (Pat pat : prefix) {
        if (i++ > 0) {
          buf.append(", ");
        }
        pat.unparse(buf, 0, 0);
      }
      if (slice != null) {
        if (i++ > 0) {
          buf.append(", ");
        }
        if (slice instanceof BindingPat) {
          buf.append(((BindingPat) slice).name).append(" @ ");
        }
        buf.append("..");
        for (Pat pat : suffix) {
          buf.append(", ");
          pat.unparse(buf, 0, 0);
        }
      }
      return buf.append(']');
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }

    public SequencePat copy(List<Pat> prefix, @Nullable Pat slice,
        List<Pat> suffix) {
      return prefix.equals(this.prefix)
          && slice == this.slice
          && suffix.equals(this.suffix)
          ? this
          : new SequencePat(pos, type, ImmutableList.copyOf(prefix), slice,
              ImmutableList.copyOf(suffix));
    }
  }

  /** Or-pattern, "{@code p | q}"; matches if any alternative matches. */
  public static class OrPat extends Pat {
    public final List<Pat> alternatives;

    OrPat(Pos pos, Type type, ImmutableList<Pat> alternatives) {
      super(pos, Op.OR_PAT, type);
      this.alternatives = requireNonNull(alternatives);
      checkArgument(!alternatives.isEmpty(), "or-pattern needs alternatives");
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int left, int right) {
      final boolean paren = left > op.left || right > op.right;
      if (paren) {
        buf.append('(');
      }
      int i = 0;
      for (Pat alternative : alternatives) {
        if (i++ > 0) {
          buf.append(op.padded);
        }
        alternative.unparse(buf, 0, 0);
      }
      return paren ? buf.append(')') : buf;
    }

    @Override
    public Pat accept(PatShuttle shuttle) {
      return shuttle.visit(this);
    }

    public OrPat copy(List<Pat> alternatives) {
      return alternatives.equals(this.alternatives)
          ? this
          : new OrPat(pos, type, ImmutableList.copyOf(alternatives));
    }
  }

  /** Subpattern for a field, identified by its ordinal. */
  public static class FieldPat {
    public final int field;
    public final Pat pat;

    FieldPat(int field, Pat pat) {
      checkArgument(field >= 0, "negative field %s", field);
      this.field = field;
      this.pat = requireNonNull(pat);
    }

    public FieldPat copy(Pat pat) {
      return pat == this.pat ? this : new FieldPat(field, pat);
    }

    @Override
    public int hashCode() {
      return Objects.hash(field, pat);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FieldPat
              && field == ((FieldPat) o).field
              && pat == ((FieldPat) o).pat;
    }

    @Override
    public String toString() {
      return field + ": " + pat;
    }
  }

  /** Writes the fields of a struct or of a variant. */
  private static StringBuilder unparseFields(StringBuilder buf, String name,
      DataType.Variant variant, List<FieldPat> subpatterns) {
    buf.append(name);
    if (variant.fields.isEmpty()) {
      return buf;
    }
    if (variant.isPositional()) {
      buf.append('(');
      unparsePositional(buf, variant.fields.size(), subpatterns);
      return buf.append(')');
    }
    buf.append(" { ");
    int i = 0;
    for (FieldPat fieldPat : subpatterns) {
      // Inaccessible fields stay hidden behind "..".
      if (fieldPat.pat.op == Op.WILDCARD_PAT && fieldPat.pat.type.isError()) {
        continue;
      }
      if (i++ > 0) {
        buf.append(", ");
      }
      buf.append(variant.fields.get(fieldPat.field).name).append(": ");
      fieldPat.pat.unparse(buf, 0, 0);
    }
    if (i < variant.fields.size()) {
      buf.append(i > 0 ? ", .." : "..");
    }
    return buf.append(" }");
  }

  /** Writes positional fields, writing "_" for fields that are absent. */
  private static void unparsePositional(StringBuilder buf, int fieldCount,
      List<FieldPat> subpatterns) {
    final Pat[] pats = new Pat[Math.max(fieldCount, subpatterns.size())];
    for (FieldPat fieldPat : subpatterns) {
      pats[fieldPat.field] = fieldPat.pat;
    }
    for (int i = 0; i < pats.length; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      if (pats[i] == null) {
        buf.append('_');
      } else {
        pats[i].unparse(buf, 0, 0);
      }
    }
  }

  /** Writes a constant value of a given type. */
  @SuppressWarnings("rawtypes")
  static StringBuilder appendValue(StringBuilder buf, Type type,
      Comparable value) {
    if (value instanceof String) {
      buf.append('"');
      final String s = (String) value;
      s.codePoints().forEach(c -> appendChar(buf, c, '"'));
      return buf.append('"');
    }
    if (type == PrimitiveType.CHAR && value instanceof BigInteger) {
      buf.append('\'');
      appendChar(buf, ((BigInteger) value).intValueExact(), '\'');
      return buf.append('\'');
    }
    return buf.append(value);
  }

  private static void appendChar(StringBuilder buf, int c, char quote) {
    switch (c) {
    case '\n':
      buf.append("\\n");
      break;
    case '\r':
      buf.append("\\r");
      break;
    case '\t':
      buf.append("\\t");
      break;
    case '\\':
      buf.append("\\\\");
      break;
    default:
      if (c == quote) {
        buf.append('\\').append(quote);
      } else if (c < 0x20 || c >= 0x7f) {
        buf.append("\\u{").append(Integer.toHexString(c)).append('}');
      } else {
        buf.append((char) c);
      }
    }
  }
}

// End Pattern.java
