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

/**
 * Reference or box type, e.g. {@code &i32} or {@code Box<i32>}.
 *
 * <p>Both have a single constructor, which is matched by a dereference
 * pattern.
 */
public class RefType implements Type {
  public final Type elementType;
  /** Whether this is an owning box rather than a borrowed reference. */
  public final boolean box;

  RefType(Type elementType, boolean box) {
    this.elementType = requireNonNull(elementType);
    this.box = box;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    if (box) {
      return elementType.describe(buf.append("Box<")).append('>');
    }
    return elementType.describe(buf.append('&'));
  }

  @Override
  public Op op() {
    return Op.REF_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, box);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RefType
            && elementType.equals(((RefType) o).elementType)
            && box == ((RefType) o).box;
  }

  @Override
  public String toString() {
    return describe();
  }
}

// End RefType.java
