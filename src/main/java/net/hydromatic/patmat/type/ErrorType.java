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
package net.hydromatic.patmat.type;

import net.hydromatic.patmat.ast.Op;

/**
 * Placeholder type.
 *
 * <p>Used for fields that are not visible at the match site, and for columns
 * whose type could not be determined. A column of this type is matched only
 * by wildcards.
 */
public enum ErrorType implements Type {
  INSTANCE;

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("{error}");
  }

  @Override
  public Op op() {
    return Op.ERROR_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isError() {
    return true;
  }
}

// End ErrorType.java
