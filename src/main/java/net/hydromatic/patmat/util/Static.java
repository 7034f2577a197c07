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
package net.hydromatic.patmat.util;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.patmat.compile.InternalCompilerError;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Returns an error to throw when an internal invariant of the match checker
   * does not hold.
   *
   * <p>Usage: {@code throw bug("no arity for %s", ctor);}
   */
  public static InternalCompilerError bug(String format, Object... args) {
    return new InternalCompilerError(String.format(format, args));
  }

  /** Returns whether a predicate is true for at least one element of a list. */
  public static <E> boolean anyMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (predicate.test(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Eagerly converts an Iterable of elements to an ImmutableList, applying to
   * each element a function that returns zero or more results.
   */
  public static <E, T> ImmutableList<T> flatTransform(
      Iterable<? extends E> elements,
      Function<E, ? extends Iterable<? extends T>> mapper) {
    final ImmutableList.Builder<T> b = ImmutableList.builder();
    elements.forEach(e -> b.addAll(mapper.apply(e)));
    return b.build();
  }

  /** Returns a list containing {@code n} copies of an element. */
  public static <E> ImmutableList<E> repeat(E e, int n) {
    final ImmutableList.Builder<E> b = ImmutableList.builderWithExpectedSize(n);
    for (int i = 0; i < n; i++) {
      b.add(e);
    }
    return b.build();
  }
}

// End Static.java
