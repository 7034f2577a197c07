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

import java.util.Objects;
import net.hydromatic.patmat.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Fixed-size array type, e.g. {@code [u8; 4]}.
 *
 * <p>The length may be unknown (null), for instance if it depends on a
 * generic parameter; then the array is matched as if it were a slice.
 */
public class ArrayType implements Type {
  public final Type elementType;
  public final @Nullable Integer length;

  ArrayType(Type elementType, @Nullable Integer length) {
    this.elementType = requireNonNull(elementType);
    this.length = length;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    elementType.describe(buf.append('['));
    buf.append("; ");
    if (length == null) {
      buf.append('_');
    } else {
      buf.append(length);
    }
    return buf.append(']');
  }

  @Override
  public Op op() {
    return Op.ARRAY_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, length);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ArrayType
            && elementType.equals(((ArrayType) o).elementType)
            && Objects.equals(length, ((ArrayType) o).length);
  }

  @Override
  public String toString() {
    return describe();
  }
}

// End ArrayType.java
