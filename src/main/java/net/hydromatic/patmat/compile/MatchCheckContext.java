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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.patmat.ast.Pattern;
import net.hydromatic.patmat.type.DataType;
import net.hydromatic.patmat.type.PrimitiveType;
import net.hydromatic.patmat.type.Type;
import net.hydromatic.patmat.type.TypeSystem;

/**
 * Environment in which a match is checked: the type system, the properties
 * that control checking, and a tracer.
 *
 * <p>Immutable; one context may be shared by any number of checks.
 */
public class MatchCheckContext {
  public final TypeSystem typeSystem;
  public final Tracer tracer;
  private final ImmutableMap<Prop, Object> propMap;

  private MatchCheckContext(TypeSystem typeSystem,
      ImmutableMap<Prop, Object> propMap, Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.propMap = requireNonNull(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a context. */
  public static MatchCheckContext create(TypeSystem typeSystem,
      Map<Prop, Object> propMap, Tracer tracer) {
    return new MatchCheckContext(typeSystem, ImmutableMap.copyOf(propMap),
        tracer);
  }

  /** Creates a context with default properties and no tracing. */
  public static MatchCheckContext of(TypeSystem typeSystem) {
    return create(typeSystem, ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a context that is the same as this but with a given tracer. */
  public MatchCheckContext withTracer(Tracer tracer) {
    return tracer == this.tracer
        ? this
        : new MatchCheckContext(typeSystem, propMap, tracer);
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(propMap);
  }

  public boolean exhaustivePatterns() {
    return Prop.EXHAUSTIVE_PATTERNS.booleanValue(propMap);
  }

  public boolean precisePointerSizeMatching() {
    return Prop.PRECISE_POINTER_SIZE_MATCHING.booleanValue(propMap);
  }

  public int pointerWidth() {
    return Prop.POINTER_WIDTH.intValue(propMap);
  }

  public boolean matchCoverageEnabled() {
    return Prop.MATCH_COVERAGE_ENABLED.booleanValue(propMap);
  }

  /**
   * Returns whether a type is known to be uninhabited. Always false unless
   * {@link Prop#EXHAUSTIVE_PATTERNS} is set.
   */
  public boolean isUninhabited(Type type) {
    return exhaustivePatterns() && typeSystem.isUninhabited(type);
  }

  /** As {@link #isUninhabited(Type)}, for a variant of a data type. */
  public boolean isVariantUninhabited(DataType dataType,
      DataType.Variant variant) {
    return exhaustivePatterns()
        && typeSystem.isVariantUninhabited(dataType, variant);
  }

  /** Returns whether a type is defined in the crate being checked. */
  public boolean isLocal(Type type) {
    return type instanceof DataType && ((DataType) type).isLocal();
  }

  /** Returns whether a type is an enum declared non-exhaustive. */
  public boolean isNonExhaustiveEnum(Type type) {
    return type instanceof DataType
        && ((DataType) type).isEnum()
        && ((DataType) type).isNonExhaustive();
  }

  /**
   * Returns whether a pattern is a variant pattern whose variant has a
   * non-exhaustive field list.
   */
  public boolean isNonExhaustiveVariant(Pattern.Pat pat) {
    return pat instanceof Pattern.VariantPat
        && ((Pattern.VariantPat) pat).variant().nonExhaustive;
  }

  /** Returns whether a type is {@code isize} or {@code usize}. */
  public boolean isPointerSized(Type type) {
    return type instanceof PrimitiveType
        && ((PrimitiveType) type).isPointerSized();
  }
}

// End MatchCheckContext.java
