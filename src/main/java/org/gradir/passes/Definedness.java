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

package org.gradir.passes;

import org.gradir.ir.Type;

/**
 * What {@link SpecializeUndef} knows about whether a tensor value will be present at runtime.
 * UNKNOWN is the conservative answer, and is used for every value the pass cannot reason about.
 */
public enum Definedness {
  DEFINED,
  UNDEFINED,
  UNKNOWN;

  /**
   * Returns the initial state of a graph input with the given declared type. Types that are known
   * to be absent are UNDEFINED; other tensor types are DEFINED; everything else is UNKNOWN.
   */
  public static Definedness forInputType(Type type) {
    // UNDEFINED_TENSOR is itself a subtype of DYNAMIC, so it has to be checked first.
    if (type.isSubtypeOf(Type.UNDEFINED_TENSOR)) {
      return UNDEFINED;
    } else if (type.isSubtypeOf(Type.DYNAMIC)) {
      return DEFINED;
    } else {
      return UNKNOWN;
    }
  }
}
