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

import static net.hydromatic.patmat.ast.PatternBuilder.patterns;

import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.RefType;

/**
 * Converts patterns to the form expected by the usefulness algorithm.
 *
 * <ul>
 *   <li>A binding that has a subpattern is replaced by its subpattern, since
 *       the subpattern is what constrains matching;
 *   <li>A constant of reference type, such as a string literal of type
 *       {@code &str}, becomes a dereference of a constant of the referent
 *       type.
 * </ul>
 */
public class PatternExpander extends PatShuttle {
  private static final PatternExpander INSTANCE = new PatternExpander();

  /** Expands a pattern. */
  public static Pat expand(Pat pat) {
    return pat.accept(INSTANCE);
  }

  @Override
  public Pat visit(Pattern.BindingPat bindingPat) {
    if (bindingPat.subpattern != null) {
      return bindingPat.subpattern.accept(this);
    }
    return bindingPat;
  }

  @Override
  public Pat visit(Pattern.ConstantPat constantPat) {
    if (constantPat.type instanceof RefType) {
      final RefType refType = (RefType) constantPat.type;
      final Pat inner =
          patterns.constantPat(refType.elementType, constantPat.value);
      return patterns.derefPat(refType, inner.accept(this));
    }
    return constantPat;
  }

  @Override
  public Pat visit(Pattern.RangePat rangePat) {
    if (rangePat.type instanceof RefType) {
      final RefType refType = (RefType) rangePat.type;
      final Pat inner =
          patterns.rangePat(refType.elementType, rangePat.lo, rangePat.hi,
              rangePat.end);
      return patterns.derefPat(refType, inner);
    }
    return rangePat;
  }
}

// End PatternExpander.java
