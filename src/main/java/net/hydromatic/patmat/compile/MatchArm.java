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

import net.hydromatic.patmat.ast.Pattern.Pat;
import net.hydromatic.patmat.ast.Pos;

/** Arm of a match expression: a pattern and, optionally, a guard. */
public class MatchArm {
  public final Pat pat;
  /**
   * Whether the arm has a guard ("{@code if cond}"). The value of the guard
   * is not known, so a guarded arm does not help to make the match
   * exhaustive.
   */
  public final boolean hasGuard;
  public final Pos pos;

  private MatchArm(Pat pat, boolean hasGuard, Pos pos) {
    this.pat = requireNonNull(pat);
    this.hasGuard = hasGuard;
    this.pos = requireNonNull(pos);
  }

  public static MatchArm of(Pat pat) {
    return new MatchArm(pat, false, pat.pos);
  }

  public static MatchArm of(Pat pat, boolean hasGuard, Pos pos) {
    return new MatchArm(pat, hasGuard, pos);
  }

  @Override
  public String toString() {
    return pat + (hasGuard ? " if ..." : "");
  }
}

// End MatchArm.java
