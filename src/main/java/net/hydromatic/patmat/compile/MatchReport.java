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
import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.type.Type;

/** Result of checking the arms of a match expression. */
public class MatchReport {
  public final Type type;
  public final List<MatchArm> arms;
  /** Ordinals of arms that can never be reached, in ascending order. */
  public final List<Integer> redundantArms;
  /** Examples of values that no arm matches. */
  public final List<Pat> missingPatterns;

  MatchReport(Type type, List<MatchArm> arms, List<Integer> redundantArms,
      List<Pat> missingPatterns) {
    this.type = requireNonNull(type);
    this.arms = ImmutableList.copyOf(arms);
    this.redundantArms = ImmutableList.copyOf(redundantArms);
    this.missingPatterns = ImmutableList.copyOf(missingPatterns);
  }

  /** Returns whether every value of the type is matched by some arm. */
  public boolean isExhaustive() {
    return missingPatterns.isEmpty();
  }

  /** Returns whether some arm can never be reached. */
  public boolean hasRedundancy() {
    return !redundantArms.isEmpty();
  }

  /**
   * Describes the missing patterns, e.g. "{@code `None` and `Some(false)`}";
   * after three patterns, the rest are counted.
   */
  public String describeMissing() {
    final StringBuilder buf = new StringBuilder();
    final int n = missingPatterns.size();
    final int shown = n > 4 ? 3 : n;
    for (int i = 0; i < shown; i++) {
      if (i > 0) {
        buf.append(i == n - 1 ? " and " : ", ");
      }
      buf.append('`').append(missingPatterns.get(i)).append('`');
    }
    if (shown < n) {
      buf.append(" and ").append(n - shown).append(" more");
    }
    return buf.toString();
  }

  @Override
  public String toString() {
    return "MatchReport{type=" + type.describe()
        + ", redundantArms=" + redundantArms
        + ", missingPatterns=" + missingPatterns + "}";
  }
}

// End MatchReport.java
