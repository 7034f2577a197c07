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

import net.hydromatic.patmat.ast.Op;

/** Slice type, e.g. {@code [u8]}; a sequence of any length. */
public class SliceType implements Type {
  public final Type elementType;

  SliceType(Type elementType) {
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return elementType.describe(buf.append('[')).append(']');
  }

  @Override
  public Op op() {
    return Op.SLICE_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return elementType.hashCode() * 31 + 7;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SliceType
            && elementType.equals(((SliceType) o).elementType);
  }

  @Override
  public String toString() {
    return describe();
  }
}

// End SliceType.java
