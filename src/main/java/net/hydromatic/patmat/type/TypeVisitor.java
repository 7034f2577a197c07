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

/**
 * Visitor over {@link Type} objects.
 *
 * <p>The default methods visit component types and return null. They do not
 * descend into the fields of a data type, which may be recursive.
 *
 * @param <R> return type from {@code visit} methods
 */
public class TypeVisitor<R> {
  public R visit(PrimitiveType primitiveType) {
    return null;
  }

  public R visit(TupleType tupleType) {
    tupleType.argTypes.forEach(t -> t.accept(this));
    return null;
  }

  public R visit(DataType dataType) {
    return null;
  }

  public R visit(RefType refType) {
    return refType.elementType.accept(this);
  }

  public R visit(ArrayType arrayType) {
    return arrayType.elementType.accept(this);
  }

  public R visit(SliceType sliceType) {
    return sliceType.elementType.accept(this);
  }

  public R visit(ErrorType errorType) {
    return null;
  }
}

// End TypeVisitor.java
