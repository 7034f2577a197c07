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
package net.hydromatic.patmat.ast;

/**
 * Sub-types of {@link AstNode} and of {@link net.hydromatic.patmat.type.Type}.
 */
public enum Op {
  // patterns
  WILDCARD_PAT(true),
  BINDING_PAT(" @ ", 2),
  CONSTANT_PAT(true),
  RANGE_PAT(true),
  LEAF_PAT(true),
  VARIANT_PAT(true),
  DEREF_PAT("&", 3),
  SEQUENCE_PAT(true),
  OR_PAT(" | ", 1),

  // types
  PRIMITIVE_TYPE(true),
  TUPLE_TYPE(true),
  DATA_TYPE(true),
  REF_TYPE(true),
  ARRAY_TYPE(true),
  SLICE_TYPE(true),
  ERROR_TYPE(true);

  /** Padded name, e.g. " | ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this operator is a pattern. */
  public boolean isPat() {
    return name().endsWith("_PAT");
  }
}

// End Op.java
