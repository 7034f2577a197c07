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
package net.hydromatic.patmat.compile;

import static net.hydromatic.patmat.util.Static.bug;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.Type;

/**
 * Meta-constructor that stands for the constructors of a type that appear in
 * no row of a matrix.
 *
 * <p>The missing constructors are computed lazily, since it is often enough
 * to know whether there are any.
 */
public class MissingConstructors extends Constructor {
  private final MatchCheckContext cx;
  private final List<Constructor> allCtors;
  private final List<Constructor> usedCtors;

  MissingConstructors(MatchCheckContext cx, List<Constructor> allCtors,
      List<Constructor> usedCtors) {
    super(Kind.MISSING_CONSTRUCTORS);
    this.cx = cx;
    this.allCtors = ImmutableList.copyOf(allCtors);
    this.usedCtors = ImmutableList.copyOf(usedCtors);
  }

  /** Returns the missing constructors, computing them lazily. */
  public Iterable<Constructor> iterable() {
    return Iterables.concat(
        Iterables.transform(allCtors, c -> c.subtract(cx, usedCtors)));
  }

  /** Returns whether there are no missing constructors. */
  public boolean isEmpty() {
    return Iterables.isEmpty(iterable());
  }

  /** Returns the missing constructors as a list. */
  public List<Constructor> toList() {
    return ImmutableList.copyOf(iterable());
  }

  @Override
  public boolean isWildcard() {
    throw bug("isWildcard called on %s", this);
  }

  /**
   * Not supported. A witness built from missing constructors becomes
   * several witnesses; see {@link Usefulness#applyConstructor}.
   */
  @Override
  public Pat apply(MatchCheckContext cx, Type type, List<Pat> pats) {
    throw bug("cannot apply %s", this);
  }

  /** Not supported. Missing constructors are never split further. */
  @Override
  List<Constructor> split_(MatchCheckContext cx, Type type,
      List<Constructor> headCtors) {
    throw bug("cannot split %s", this);
  }

  @Override
  public int hashCode() {
    throw bug("hashCode called on %s", this);
  }

  @Override
  public boolean equals(Object o) {
    throw bug("equals called on %s", this);
  }

  @Override
  public String toString() {
    return "MissingConstructors" + toList();
  }
}

// End MissingConstructors.java
