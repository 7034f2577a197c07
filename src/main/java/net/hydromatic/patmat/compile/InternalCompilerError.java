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

/**
 * Error thrown when an invariant of the match checker does not hold, for
 * example when a pattern does not have the type of its column.
 *
 * <p>It indicates a bug in the checker or in the code that called it, not a
 * problem with the program being checked.
 *
 * @see net.hydromatic.patmat.util.Static#bug(String, Object...)
 */
public class InternalCompilerError extends AssertionError {
  public InternalCompilerError(String message) {
    super("internal compiler error: " + message);
  }
}

// End InternalCompilerError.java
