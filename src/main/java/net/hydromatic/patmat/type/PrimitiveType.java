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

import java.math.BigInteger;
import net.hydromatic.patmat.ast.Op;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL("bool"),
  CHAR("char", 32, false),
  I8("i8", 8, true),
  I16("i16", 16, true),
  I32("i32", 32, true),
  I64("i64", 64, true),
  I128("i128", 128, true),
  /** Signed integer whose width is that of a pointer on the target. */
  ISIZE("isize", 0, true),
  U8("u8", 8, false),
  U16("u16", 16, false),
  U32("u32", 32, false),
  U64("u64", 64, false),
  U128("u128", 128, false),
  /** Unsigned integer whose width is that of a pointer on the target. */
  USIZE("usize", 0, false),
  F32("f32"),
  F64("f64"),
  STR("str"),
  /** The "never" type; it has no values. */
  NEVER("!");

  /** Name in surface syntax, e.g. "i32". */
  public final String description;

  /** Number of bits; 0 for pointer-sized types; -1 if not integral. */
  private final int bits;

  private final boolean signed;

  PrimitiveType(String description) {
    this(description, -1, false);
  }

  PrimitiveType(String description, int bits, boolean signed) {
    this.description = description;
    this.bits = bits;
    this.signed = signed;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(description);
  }

  @Override
  public Op op() {
    return Op.PRIMITIVE_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isIntegral() {
    return bits >= 0;
  }

  /** Returns whether this is a signed integer type. */
  public boolean isSigned() {
    return signed;
  }

  /** Returns whether this is {@link #ISIZE} or {@link #USIZE}. */
  public boolean isPointerSized() {
    return bits == 0;
  }

  /** Returns whether this is a floating-point type. */
  public boolean isFloat() {
    return this == F32 || this == F64;
  }

  /**
   * Returns the number of bits in a value of this type, given the width of a
   * pointer.
   */
  public int bits(int pointerWidth) {
    if (bits < 0) {
      throw new IllegalArgumentException("not integral: " + this);
    }
    return bits == 0 ? pointerWidth : bits;
  }

  /** Returns the smallest value of this integral type. */
  public BigInteger minValue(int pointerWidth) {
    if (this == CHAR) {
      return BigInteger.ZERO;
    }
    return signed
        ? BigInteger.ONE.shiftLeft(bits(pointerWidth) - 1).negate()
        : BigInteger.ZERO;
  }

  /** Returns the largest value of this integral type. */
  public BigInteger maxValue(int pointerWidth) {
    if (this == CHAR) {
      return BigInteger.valueOf(Character.MAX_CODE_POINT);
    }
    final int width = signed ? bits(pointerWidth) - 1 : bits(pointerWidth);
    return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }
}

// End PrimitiveType.java
