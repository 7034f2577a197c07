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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests {@link TypeSystem} and the types it creates. */
public class TypeSystemTest {
  private final TypeSystem ts = new TypeSystem();

  @Test
  void testDescribe() {
    assertThat(PrimitiveType.I32.describe(), is("i32"));
    assertThat(PrimitiveType.NEVER.describe(), is("!"));
    assertThat(ts.tupleType().describe(), is("()"));
    assertThat(ts.tupleType(PrimitiveType.BOOL).describe(), is("(bool,)"));
    assertThat(ts.tupleType(PrimitiveType.BOOL, PrimitiveType.U8).describe(),
        is("(bool, u8)"));
    assertThat(ts.refType(PrimitiveType.STR).describe(), is("&str"));
    assertThat(ts.boxType(PrimitiveType.CHAR).describe(), is("Box<char>"));
    assertThat(ts.arrayType(PrimitiveType.U8, 4).describe(), is("[u8; 4]"));
    assertThat(ts.arrayType(PrimitiveType.U8).describe(), is("[u8; _]"));
    assertThat(ts.sliceType(PrimitiveType.U8).describe(), is("[u8]"));
    assertThat(ts.option(PrimitiveType.BOOL).describe(), is("Option<bool>"));
    assertThat(ErrorType.INSTANCE.describe(), is("{error}"));
  }

  @Test
  void testPrimitiveRanges() {
    assertThat(PrimitiveType.I8.minValue(64), is(BigInteger.valueOf(-128)));
    assertThat(PrimitiveType.I8.maxValue(64), is(BigInteger.valueOf(127)));
    assertThat(PrimitiveType.U16.maxValue(64), is(BigInteger.valueOf(65535)));
    assertThat(PrimitiveType.USIZE.maxValue(32),
        is(BigInteger.valueOf(4294967295L)));
    assertThat(PrimitiveType.ISIZE.minValue(16),
        is(BigInteger.valueOf(-32768)));
    assertThat(PrimitiveType.U128.maxValue(64),
        is(BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE)));
    assertThat(PrimitiveType.CHAR.maxValue(64),
        is(BigInteger.valueOf(0x10FFFF)));
    assertThat(PrimitiveType.CHAR.isIntegral(), is(true));
    assertThat(PrimitiveType.BOOL.isIntegral(), is(false));
    assertThat(PrimitiveType.F32.isFloat(), is(true));
    assertThat(PrimitiveType.ISIZE.isPointerSized(), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> PrimitiveType.BOOL.bits(64));
  }

  /** The same tuple, reference or slice type is equal, not identical. */
  @Test
  void testEquality() {
    assertThat(ts.tupleType(PrimitiveType.BOOL),
        is(ts.tupleType(PrimitiveType.BOOL)));
    assertThat(ts.sliceType(PrimitiveType.BOOL),
        is(ts.sliceType(PrimitiveType.BOOL)));
    assertThat(ts.refType(PrimitiveType.BOOL)
        .equals(ts.boxType(PrimitiveType.BOOL)), is(false));
    assertThat(ts.arrayType(PrimitiveType.BOOL, 2)
        .equals(ts.arrayType(PrimitiveType.BOOL)), is(false));
    // Option types are cached.
    assertThat(ts.option(PrimitiveType.U8),
        sameInstance(ts.option(PrimitiveType.U8)));
  }

  @Test
  void testDataType() {
    final DataType color =
        ts.enumBuilder("Color", DataType.Flag.LOCAL)
            .variant("Red").variant("Green").build();
    assertThat(color.isEnum(), is(true));
    assertThat(color.isLocal(), is(true));
    assertThat(color.isNonExhaustive(), is(false));
    assertThat(color.variants().size(), is(2));
    assertThat(color.variant("Green").index, is(1));
    assertThat(ts.lookup("Color"), sameInstance(color));
    assertThat(ts.lookupOpt("Colour"), nullValue());
    assertThrows(IllegalArgumentException.class, () -> ts.lookup("Colour"));
    assertThrows(IllegalArgumentException.class,
        () -> color.variant("Blue"));
    assertThrows(IllegalArgumentException.class,
        () -> ts.enumBuilder("Color").build());

    final DataType point =
        ts.structBuilder("Point")
            .fields(DataType.Field.of("x", PrimitiveType.I32),
                DataType.Field.ofPrivate("y", PrimitiveType.I32))
            .build();
    assertThat(point.isEnum(), is(false));
    assertThat(point.variants().size(), is(1));
    final DataType.Variant variant = point.variants().get(0);
    assertThat(variant.name, is("Point"));
    assertThat(variant.isPositional(), is(false));
    assertThat(point.isVisible(variant.fields.get(0)), is(true));
    assertThat(point.isVisible(variant.fields.get(1)), is(false));

    // Private fields are visible inside the crate that defines them.
    final DataType localPoint =
        ts.structBuilder("LocalPoint", DataType.Flag.LOCAL)
            .fields(DataType.Field.ofPrivate("y", PrimitiveType.I32))
            .build();
    assertThat(
        localPoint.isVisible(localPoint.variants().get(0).fields.get(0)),
        is(true));

    final DataType pair =
        ts.structBuilder("Pair")
            .variant("Pair", PrimitiveType.BOOL, PrimitiveType.BOOL)
            .build();
    assertThat(pair.variants().get(0).isPositional(), is(true));

    assertThrows(IllegalArgumentException.class,
        () -> ts.structBuilder("Bad", DataType.Flag.ENUM));
  }

  @Test
  void testUninhabited() {
    assertThat(ts.isUninhabited(PrimitiveType.NEVER), is(true));
    assertThat(ts.isUninhabited(PrimitiveType.BOOL), is(false));
    assertThat(ts.isUninhabited(ts.tupleType(PrimitiveType.BOOL,
        PrimitiveType.NEVER)), is(true));
    // References, slices and the error type are always inhabited.
    assertThat(ts.isUninhabited(ts.refType(PrimitiveType.NEVER)), is(false));
    assertThat(ts.isUninhabited(ts.sliceType(PrimitiveType.NEVER)),
        is(false));
    assertThat(ts.isUninhabited(ErrorType.INSTANCE), is(false));
    // Arrays are uninhabited if they have an element that is.
    assertThat(ts.isUninhabited(ts.arrayType(PrimitiveType.NEVER, 1)),
        is(true));
    assertThat(ts.isUninhabited(ts.arrayType(PrimitiveType.NEVER, 0)),
        is(false));
    assertThat(ts.isUninhabited(ts.arrayType(PrimitiveType.NEVER)),
        is(false));

    final DataType empty = ts.enumBuilder("Empty").build();
    assertThat(ts.isUninhabited(empty), is(true));
    final DataType opaque =
        ts.enumBuilder("Opaque", DataType.Flag.NON_EXHAUSTIVE).build();
    assertThat(ts.isUninhabited(opaque), is(false));

    final DataType either =
        ts.enumBuilder("Either")
            .variant("Left", empty)
            .variant("Right", PrimitiveType.NEVER)
            .build();
    assertThat(ts.isUninhabited(either), is(true));
    assertThat(ts.isUninhabited(ts.option(either)), is(false));
    final DataType.Variant some = ts.option(either).variant("Some");
    assertThat(ts.isVariantUninhabited(ts.option(either), some), is(true));

    // A private field does not count, outside its crate.
    final DataType hidden =
        ts.structBuilder("Hidden")
            .fields(DataType.Field.ofPrivate("never", PrimitiveType.NEVER))
            .build();
    assertThat(ts.isUninhabited(hidden), is(false));

    // A recursive type is not uninhabited merely because it refers to
    // itself.
    final DataType.Builder b = ts.enumBuilder("Stream");
    final DataType stream =
        b.variant("Cons", PrimitiveType.BOOL, b.self()).build();
    assertThat(ts.isUninhabited(stream), is(false));
  }

  /** A visitor that counts primitive types, not descending into data types. */
  @Test
  void testVisitor() {
    final int[] count = {0};
    final TypeVisitor<Void> visitor = new TypeVisitor<Void>() {
      @Override
      public Void visit(PrimitiveType primitiveType) {
        ++count[0];
        return null;
      }
    };
    ts.tupleType(PrimitiveType.BOOL,
            ts.refType(ts.sliceType(PrimitiveType.U8)),
            ts.option(PrimitiveType.CHAR))
        .accept(visitor);
    assertThat(count[0], is(2));
  }
}

// End TypeSystemTest.java
