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

import static net.hydromatic.patmat.util.Static.transformEager;

import net.hydromatic.patmat.ast.Pattern.Pat;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits and transforms a pattern tree.
 *
 * <p>Each method visits the children of a node, and returns the same node if
 * no child changed.
 */
public class PatShuttle {
  public Pat visit(Pattern.WildcardPat wildcardPat) {
    return wildcardPat;
  }

  public Pat visit(Pattern.BindingPat bindingPat) {
    return bindingPat.copy(accept(bindingPat.subpattern));
  }

  public Pat visit(Pattern.ConstantPat constantPat) {
    return constantPat;
  }

  public Pat visit(Pattern.RangePat rangePat) {
    return rangePat;
  }

  public Pat visit(Pattern.LeafPat leafPat) {
    return leafPat.copy(
        transformEager(leafPat.subpatterns, f -> f.copy(f.pat.accept(this))));
  }

  public Pat visit(Pattern.VariantPat variantPat) {
    return variantPat.copy(
        transformEager(variantPat.subpatterns,
            f -> f.copy(f.pat.accept(this))));
  }

  public Pat visit(Pattern.DerefPat derefPat) {
    return derefPat.copy(derefPat.subpattern.accept(this));
  }

  public Pat visit(Pattern.SequencePat sequencePat) {
    return sequencePat.copy(
        transformEager(sequencePat.prefix, p -> p.accept(this)),
        accept(sequencePat.slice),
        transformEager(sequencePat.suffix, p -> p.accept(this)));
  }

  public Pat visit(Pattern.OrPat orPat) {
    return orPat.copy(transformEager(orPat.alternatives, p -> p.accept(this)));
  }

  private @Nullable Pat accept(@Nullable Pat pat) {
    return pat == null ? null : pat.accept(this);
  }
}

// End PatShuttle.java
