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
import static net.hydromatic.patmat.util.Static.flatTransform;
import static net.hydromatic.patmat.util.Static.transformEager;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.patmat.ast.Pattern.Pat;

/**
 * Matrix of patterns; each row is a {@link PatStack}, typically the
 * (expanded) pattern of an arm of a match expression.
 *
 * <p>Immutable. All rows have the same number of patterns.
 */
public class Matrix {
  private static final Matrix EMPTY = new Matrix(ImmutableList.of());

  private final ImmutableList<PatStack> rows;

  private Matrix(ImmutableList<PatStack> rows) {
    this.rows = rows;
  }

  /** Returns a matrix with no rows. */
  public static Matrix empty() {
    return EMPTY;
  }

  /** Creates a matrix. */
  public static Matrix of(List<PatStack> rows) {
    Matrix matrix = EMPTY;
    for (PatStack row : rows) {
      matrix = matrix.plus(row);
    }
    return matrix;
  }

  /** Returns a matrix with one more row. */
  public Matrix plus(PatStack row) {
    checkArgument(rows.isEmpty() || rows.get(0).size() == row.size(),
        "row %s has different width than matrix", row);
    return new Matrix(
        ImmutableList.<PatStack>builder().addAll(rows).add(row).build());
  }

  public List<PatStack> rows() {
    return rows;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Returns the first pattern of each row. */
  public List<Pat> heads() {
    return transformEager(rows, PatStack::head);
  }

  /**
   * Returns the constructors of the heads of the rows, excluding wildcards.
   */
  public List<Constructor> headCtors(MatchCheckContext cx) {
    final List<Constructor> list = new ArrayList<>();
    for (PatStack row : rows) {
      for (Constructor c : row.headCtors(cx)) {
        if (!c.isWildcard()) {
          list.add(c);
        }
      }
    }
    return list;
  }

  /** Specializes each row by a constructor. */
  public Matrix specializeConstructor(MatchCheckContext cx, Constructor ctor,
      List<Pat> wildSubpatterns) {
    return new Matrix(
        flatTransform(rows,
            row -> row.specializeConstructor(cx, ctor, wildSubpatterns)));
  }

  /**
   * {@inheritDoc}
   *
   * <p>Draws the matrix as a table, one line per row:
   *
   * <pre>
   * +---+------+
   * | _ | true |
   * +---+------+
   * </pre>
   */
  @Override
  public String toString() {
    if (rows.isEmpty()) {
      return "";
    }
    final List<List<String>> cells = new ArrayList<>();
    final List<Integer> widths = new ArrayList<>();
    for (PatStack row : rows) {
      final List<String> strings = transformEager(row.pats(), Pat::toString);
      for (int i = 0; i < strings.size(); i++) {
        final int width = strings.get(i).length();
        if (i < widths.size()) {
          widths.set(i, Math.max(widths.get(i), width));
        } else {
          widths.add(width);
        }
      }
      cells.add(strings);
    }
    final StringBuilder border = new StringBuilder("+");
    widths.forEach(w -> border.append(Strings.repeat("-", w + 2)).append('+'));
    final StringBuilder buf = new StringBuilder();
    buf.append(border).append('\n');
    for (List<String> row : cells) {
      buf.append('|');
      for (int i = 0; i < row.size(); i++) {
        buf.append(' ')
            .append(Strings.padEnd(row.get(i), widths.get(i), ' '))
            .append(" |");
      }
      buf.append('\n');
    }
    buf.append(border).append('\n');
    return buf.toString();
  }
}

// End Matrix.java
