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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events while checking a match. */
public interface Tracer {
  /**
   * Called when the usefulness of a row with respect to a matrix has been
   * computed.
   */
  void onUseful(Matrix matrix, PatStack row, Usefulness usefulness);

  /** Called when a constructor has been split. */
  void onSplit(Constructor constructor, List<Constructor> splitConstructors);

  /** Called when a matrix has been specialized by a constructor. */
  void onSpecialize(Constructor constructor, Matrix specialized);

  /**
   * Called with the exception produced by checking a match, or null if there
   * was none. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
