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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.patmat.type.Type;

/**
 * Result of checking whether a row is useful with respect to a matrix.
 *
 * <p>A row is useful if some value matches the row and no row of the matrix.
 * If witnesses were requested, a useful result carries examples of such
 * values.
 */
public class Usefulness {
  /** Useful, with no witnesses. */
  public static final Usefulness USEFUL =
      new Usefulness(Kind.USEFUL, ImmutableList.of());

  /** Not useful. */
  public static final Usefulness NOT_USEFUL =
      new Usefulness(Kind.NOT_USEFUL, ImmutableList.of());

  public final Kind kind;
  private final ImmutableList<Witness> witnesses;

  private Usefulness(Kind kind, ImmutableList<Witness> witnesses) {
    this.kind = requireNonNull(kind);
    this.witnesses = requireNonNull(witnesses);
  }

  /** Creates a useful result with witnesses. */
  static Usefulness usefulWithWitness(List<Witness> witnesses) {
    return new Usefulness(Kind.USEFUL_WITH_WITNESS,
        ImmutableList.copyOf(witnesses));
  }

  /**
   * Returns the result for an empty row that is useful; it has one empty
   * witness if witnesses are wanted.
   */
  static Usefulness newUseful(WitnessPreference preference) {
    switch (preference) {
    case CONSTRUCT_WITNESS:
      return usefulWithWitness(ImmutableList.of(Witness.empty()));
    default:
      return USEFUL;
    }
  }

  public boolean isUseful() {
    return kind != Kind.NOT_USEFUL;
  }

  /** Returns the witnesses; empty unless the kind is USEFUL_WITH_WITNESS. */
  public List<Witness> witnesses() {
    return witnesses;
  }

  /**
   * Applies a constructor to each witness.
   *
   * <p>If the constructor is {@link MissingConstructors}, each witness
   * becomes several, one per missing constructor, each applied to
   * wildcards.
   */
  Usefulness applyConstructor(MatchCheckContext cx, Constructor ctor,
      Type type) {
    if (kind != Kind.USEFUL_WITH_WITNESS) {
      return this;
    }
    final ImmutableList.Builder<Witness> b = ImmutableList.builder();
    if (ctor instanceof MissingConstructors) {
      final List<Constructor> missing = ((MissingConstructors) ctor).toList();
      for (Witness witness : witnesses) {
        for (Constructor c : missing) {
          b.add(witness.push(c.applyWildcards(cx, type)));
        }
      }
    } else {
      for (Witness witness : witnesses) {
        b.add(witness.applyConstructor(cx, ctor, type));
      }
    }
    return usefulWithWitness(b.build());
  }

  @Override
  public String toString() {
    switch (kind) {
    case USEFUL_WITH_WITNESS:
      return "UsefulWithWitness" + witnesses;
    case USEFUL:
      return "Useful";
    default:
      return "NotUseful";
    }
  }

  /** Kind of result. */
  public enum Kind {
    USEFUL,
    USEFUL_WITH_WITNESS,
    NOT_USEFUL
  }
}

// End Usefulness.java
