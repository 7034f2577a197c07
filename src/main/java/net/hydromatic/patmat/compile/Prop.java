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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how match expressions are checked.
 *
 * @see MatchCheckContext
 */
public enum Prop {
  /**
   * Boolean property "exhaustivePatterns" controls whether the checker knows
   * which types are uninhabited. If true, variants and elements of
   * uninhabited type need not be matched. Default is false.
   */
  EXHAUSTIVE_PATTERNS("exhaustivePatterns", Boolean.class, true, false),

  /**
   * Boolean property "precisePointerSizeMatching" controls whether the
   * values of pointer-sized integers ({@code isize}, {@code usize}) can be
   * enumerated exhaustively, as they can for other integer types. If false
   * (the default), a match on such a value is exhaustive only if it has a
   * wildcard.
   */
  PRECISE_POINTER_SIZE_MATCHING("precisePointerSizeMatching", Boolean.class,
      true, false),

  /**
   * Integer property "pointerWidth" is the number of bits in a pointer-sized
   * integer on the target. Default is 64.
   */
  POINTER_WIDTH("pointerWidth", Integer.class, true, 64),

  /**
   * Boolean property "matchCoverageEnabled" controls whether to check the
   * coverage of patterns. If true (the default), the checker warns if
   * patterns are not exhaustive and gives errors if patterns are redundant.
   * If false, it does not analyze pattern coverage.
   */
  MATCH_COVERAGE_ENABLED("matchCoverageEnabled", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type);
      }
      if (this == POINTER_WIDTH) {
        final int width = (Integer) value;
        checkArgument(width == 16 || width == 32 || width == 64,
            "pointer width must be 16, 32 or 64; got %s", width);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous
   * value or null.
   */
  public Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
