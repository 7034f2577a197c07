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

import net.hydromatic.patmat.ast.Op;

/** Type of the scrutinee of a match, or of a sub-pattern. */
public interface Type {
  /**
   * Description of the type, e.g. "{@code (i32, bool)}", "{@code [u8; 4]}",
   * "{@code Option}".
   */
  default String describe() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes a description of this type to a buffer. */
  StringBuilder describe(StringBuilder buf);

  /** Type operator. */
  Op op();

  /** Accepts a visitor. */
  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Returns whether values of this type are integers whose ranges can be
   * enumerated; true for {@code char} and all integer types.
   */
  default boolean isIntegral() {
    return false;
  }

  /** Returns whether this is the error type. */
  default boolean isError() {
    return false;
  }
}

// End Type.java
