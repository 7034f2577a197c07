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

/** Whether {@link UsefulnessChecker} should build witnesses. */
public enum WitnessPreference {
  /**
   * Build witnesses: example values that the matrix does not match. Used to
   * check exhaustiveness.
   */
  CONSTRUCT_WITNESS,
  /** Only find out whether a row is useful. Used to check reachability. */
  LEAVE_OUT_WITNESS
}

// End WitnessPreference.java
