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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.patmat.ast.Op;

/** Tuple type, e.g. {@code (i32, bool)}. The empty tuple is "unit". */
public class TupleType implements Type {
  public static final TupleType UNIT = new TupleType(ImmutableList.of());

  public final List<Type> argTypes;

  TupleType(ImmutableList<Type> argTypes) {
    this.argTypes = argTypes;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    for (int i = 0; i < argTypes.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      argTypes.get(i).describe(buf);
    }
    if (argTypes.size() == 1) {
      buf.append(',');
    }
    return buf.append(')');
  }

  @Override
  public Op op() {
    return Op.TUPLE_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return argTypes.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType && argTypes.equals(((TupleType) o).argTypes);
  }

  @Override
  public String toString() {
    return describe();
  }
}

// End TupleType.java
