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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A collection of types. */
public class TypeSystem {
  private final Map<String, DataType> dataTypeByName = new HashMap<>();
  private final Map<Type, DataType> optionTypes = new HashMap<>();

  /** Creates a builder for an enum. */
  public DataType.Builder enumBuilder(String name, DataType.Flag... flags) {
    final Set<DataType.Flag> flagSet = EnumSet.of(DataType.Flag.ENUM, flags);
    return new DataType.Builder(this, new DataType(name, flagSet));
  }

  /** Creates a builder for a struct. */
  public DataType.Builder structBuilder(String name, DataType.Flag... flags) {
    final Set<DataType.Flag> flagSet = EnumSet.noneOf(DataType.Flag.class);
    flagSet.addAll(Arrays.asList(flags));
    if (flagSet.contains(DataType.Flag.ENUM)) {
      throw new IllegalArgumentException("struct must not have flag ENUM");
    }
    return new DataType.Builder(this, new DataType(name, flagSet));
  }

  void register(DataType dataType) {
    final DataType previous = dataTypeByName.put(dataType.name, dataType);
    if (previous != null && previous != dataType) {
      dataTypeByName.put(dataType.name, previous);
      throw new IllegalArgumentException("duplicate type " + dataType.name);
    }
  }

  /** Looks up a data type by name; returns null if not found. */
  public @Nullable DataType lookupOpt(String name) {
    return dataTypeByName.get(name);
  }

  /** Looks up a data type by name; throws if not found. */
  public DataType lookup(String name) {
    final DataType dataType = dataTypeByName.get(name);
    if (dataType == null) {
      throw new IllegalArgumentException("unknown type " + name);
    }
    return dataType;
  }

  /** Creates a tuple type. */
  public TupleType tupleType(Type... argTypes) {
    return tupleType(Arrays.asList(argTypes));
  }

  /** Creates a tuple type. */
  public TupleType tupleType(List<? extends Type> argTypes) {
    if (argTypes.isEmpty()) {
      return TupleType.UNIT;
    }
    return new TupleType(ImmutableList.copyOf(argTypes));
  }

  /** Creates a reference type, {@code &T}. */
  public RefType refType(Type elementType) {
    return new RefType(elementType, false);
  }

  /** Creates a box type, {@code Box<T>}. */
  public RefType boxType(Type elementType) {
    return new RefType(elementType, true);
  }

  /** Creates an array type of known length, {@code [T; n]}. */
  public ArrayType arrayType(Type elementType, int length) {
    if (length < 0) {
      throw new IllegalArgumentException("negative length " + length);
    }
    return new ArrayType(elementType, length);
  }

  /** Creates an array type whose length is not known. */
  public ArrayType arrayType(Type elementType) {
    return new ArrayType(elementType, null);
  }

  /** Creates a slice type, {@code [T]}. */
  public SliceType sliceType(Type elementType) {
    return new SliceType(elementType);
  }

  /**
   * Returns the type {@code Option<T>}, an enum with variants {@code None}
   * and {@code Some(T)}, creating it if necessary.
   */
  public DataType option(Type elementType) {
    requireNonNull(elementType);
    DataType dataType = optionTypes.get(elementType);
    if (dataType == null) {
      final String name = "Option<" + elementType.describe() + ">";
      final DataType.Builder b = new DataType.Builder(this,
          new DataType(name, EnumSet.of(DataType.Flag.ENUM)));
      dataType = b.variant("None").variant("Some", elementType).build();
      optionTypes.put(elementType, dataType);
    }
    return dataType;
  }

  /**
   * Returns whether a type has no values.
   *
   * <p>A reference is always considered inhabited, as is a data type that
   * refers to itself while the check is in progress.
   */
  public boolean isUninhabited(Type type) {
    return type.accept(new UninhabitedVisitor());
  }

  /** Returns whether a variant of a data type has no values. */
  public boolean isVariantUninhabited(DataType dataType,
      DataType.Variant variant) {
    return new UninhabitedVisitor().isUninhabited(dataType, variant);
  }

  /** Visitor that returns whether a type is uninhabited. */
  private static class UninhabitedVisitor extends TypeVisitor<Boolean> {
    /** Data types currently being checked; guards against recursion. */
    final Set<DataType> active = new HashSet<>();

    @Override
    public Boolean visit(PrimitiveType primitiveType) {
      return primitiveType == PrimitiveType.NEVER;
    }

    @Override
    public Boolean visit(TupleType tupleType) {
      for (Type argType : tupleType.argTypes) {
        if (argType.accept(this)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public Boolean visit(DataType dataType) {
      // Another crate may add variants to a non-exhaustive enum.
      if (dataType.isEnum() && dataType.isNonExhaustive()
          && !dataType.isLocal()) {
        return false;
      }
      if (!active.add(dataType)) {
        return false;
      }
      try {
        for (DataType.Variant variant : dataType.variants()) {
          if (!isUninhabited(dataType, variant)) {
            return false;
          }
        }
        // An enum with no variants, or with only uninhabited variants.
        return true;
      } finally {
        active.remove(dataType);
      }
    }

    boolean isUninhabited(DataType dataType, DataType.Variant variant) {
      if (variant.nonExhaustive && !dataType.isLocal()) {
        return false;
      }
      for (DataType.Field field : variant.fields) {
        if (dataType.isVisible(field) && field.type.accept(this)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public Boolean visit(RefType refType) {
      return false;
    }

    @Override
    public Boolean visit(ArrayType arrayType) {
      return arrayType.length != null
          && arrayType.length > 0
          && arrayType.elementType.accept(this);
    }

    @Override
    public Boolean visit(SliceType sliceType) {
      return false;
    }

    @Override
    public Boolean visit(ErrorType errorType) {
      return false;
    }
  }
}

// End TypeSystem.java
