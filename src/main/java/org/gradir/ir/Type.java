/*
 * Copyright 2025 The Gradir Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gradir.ir;

import org.jspecify.annotations.Nullable;

/**
 * The static type of a {@link Value}. Types form a simple tree: each type other than a root has a
 * single supertype, and {@link #isSubtypeOf} follows that chain.
 *
 * <ul>
 *   <li>DYNAMIC: a tensor about which nothing else is known (including whether it will be
 *       present); TENSOR and UNDEFINED_TENSOR are both subtypes of it.
 *   <li>TENSOR: a tensor that is known to be present.
 *   <li>UNDEFINED_TENSOR: a tensor that is known to be structurally absent, e.g. the gradient of an
 *       input that does not require one.
 *   <li>NUMBER, INT, FLOAT, BOOL, INT_LIST: non-tensor values.
 * </ul>
 */
public enum Type {
  DYNAMIC("Dynamic", null),
  TENSOR("Tensor", DYNAMIC),
  UNDEFINED_TENSOR("UndefinedTensor", DYNAMIC),
  NUMBER("Scalar", null),
  INT("int", NUMBER),
  FLOAT("float", NUMBER),
  BOOL("bool", null),
  INT_LIST("int[]", null);

  /** The name used when printing a graph. */
  public final String printName;

  private final @Nullable Type supertype;

  Type(String printName, @Nullable Type supertype) {
    this.printName = printName;
    this.supertype = supertype;
  }

  /** Returns the immediate supertype of this type, or null if it is a root. */
  public @Nullable Type supertype() {
    return supertype;
  }

  /** True if this type is {@code other} or one of its (transitive) subtypes. */
  public boolean isSubtypeOf(Type other) {
    for (Type t = this; t != null; t = t.supertype) {
      if (t == other) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return printName;
  }
}
