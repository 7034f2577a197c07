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
package net.hydromatic.patmat.type;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import net.hydromatic.patmat.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Algebraic data type: an enum (a sum of variants) or a struct (a single
 * variant).
 *
 * <p>A data type may refer to itself through its fields, for example a list
 * whose {@code Cons} variant has a field of type {@code Box<List>}. To allow
 * this, the variants are assigned once, when {@link Builder#build()} is
 * called; {@link Builder#self()} gives access to the type while it is being
 * defined.
 */
public class DataType implements Type {
  public final String name;
  private final ImmutableSet<Flag> flags;
  private @Nullable ImmutableList<Variant> variants;

  DataType(String name, Set<Flag> flags) {
    this.name = requireNonNull(name);
    this.flags = ImmutableSet.copyOf(flags);
  }

  /** Returns whether this is an enum; otherwise it is a struct. */
  public boolean isEnum() {
    return flags.contains(Flag.ENUM);
  }

  /** Returns whether this type is defined in the crate being checked. */
  public boolean isLocal() {
    return flags.contains(Flag.LOCAL);
  }

  /**
   * Returns whether this type is declared non-exhaustive: other crates must
   * assume that it has variants they cannot see.
   */
  public boolean isNonExhaustive() {
    return flags.contains(Flag.NON_EXHAUSTIVE);
  }

  /** Returns the variants; a struct has exactly one. */
  public List<Variant> variants() {
    checkState(variants != null, "type %s is not yet defined", name);
    return variants;
  }

  /** Returns the variant with a given name. */
  public Variant variant(String name) {
    for (Variant variant : variants()) {
      if (variant.name.equals(name)) {
        return variant;
      }
    }
    throw new IllegalArgumentException("no variant '" + name + "' in "
        + this.name);
  }

  /**
   * Returns whether field {@code field} of a variant can be seen by the code
   * being checked.
   */
  public boolean isVisible(Field field) {
    return isEnum() || isLocal() || field.isPublic;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(name);
  }

  @Override
  public Op op() {
    return Op.DATA_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Properties of a data type. */
  public enum Flag {
    ENUM,
    LOCAL,
    NON_EXHAUSTIVE
  }

  /** Variant of a data type. */
  public static class Variant {
    public final String name;
    public final int index;
    public final List<Field> fields;
    /**
     * Whether the field list is declared non-exhaustive; other crates must
     * assume that there are fields they cannot see.
     */
    public final boolean nonExhaustive;

    Variant(String name, int index, ImmutableList<Field> fields,
        boolean nonExhaustive) {
      this.name = requireNonNull(name);
      this.index = index;
      this.fields = requireNonNull(fields);
      this.nonExhaustive = nonExhaustive;
    }

    /**
     * Returns whether the fields are positional, like a tuple, rather than
     * named. They are positional if their names are "0", "1", etc.
     */
    public boolean isPositional() {
      for (int i = 0; i < fields.size(); i++) {
        if (!fields.get(i).name.equals(Integer.toString(i))) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Field of a variant. */
  public static class Field {
    public final String name;
    public final Type type;
    public final boolean isPublic;

    Field(String name, Type type, boolean isPublic) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.isPublic = isPublic;
    }

    /** Creates a public field. */
    public static Field of(String name, Type type) {
      return new Field(name, type, true);
    }

    /** Creates a private field. */
    public static Field ofPrivate(String name, Type type) {
      return new Field(name, type, false);
    }

    @Override
    public String toString() {
      return name + ": " + type.describe();
    }
  }

  /** Builds a data type. */
  public static class Builder {
    private final TypeSystem typeSystem;
    private final DataType dataType;
    private final List<Variant> variants = new ArrayList<>();

    Builder(TypeSystem typeSystem, DataType dataType) {
      this.typeSystem = typeSystem;
      this.dataType = dataType;
    }

    /**
     * Returns the data type under construction, for use in the types of
     * recursive fields.
     */
    public DataType self() {
      return dataType;
    }

    /** Adds a variant with positional public fields. */
    public Builder variant(String name, Type... fieldTypes) {
      final ImmutableList.Builder<Field> fields = ImmutableList.builder();
      for (int i = 0; i < fieldTypes.length; i++) {
        fields.add(Field.of(Integer.toString(i), fieldTypes[i]));
      }
      return variant(name, false, fields.build());
    }

    /** Adds a variant. */
    public Builder variant(String name, boolean nonExhaustive,
        List<Field> fields) {
      checkArgument(dataType.isEnum() || variants.isEmpty(),
          "struct %s must have exactly one variant", dataType.name);
      variants.add(
          new Variant(name, variants.size(), ImmutableList.copyOf(fields),
              nonExhaustive));
      return this;
    }

    /** Defines the fields of a struct. */
    public Builder fields(Field... fields) {
      return variant(dataType.name, false, Arrays.asList(fields));
    }

    /** Defines the fields of a struct whose field list is non-exhaustive. */
    public Builder nonExhaustiveFields(Field... fields) {
      return variant(dataType.name, true, Arrays.asList(fields));
    }

    /** Assigns the variants and registers the type. */
    public DataType build() {
      checkState(dataType.variants == null, "already built");
      if (!dataType.isEnum() && variants.isEmpty()) {
        fields();
      }
      dataType.variants = ImmutableList.copyOf(variants);
      typeSystem.register(dataType);
      return dataType;
    }
  }
}

// End DataType.java
