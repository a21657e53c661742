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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a graph is found to be internally inconsistent, e.g. a node is destroyed while its
 * outputs are still in use, or a pass is given a graph that violates the contract between it and
 * the code that built the graph. These are programming errors, not problems with user input, and
 * there is no way to recover from them; the graph should not be used after one is thrown.
 *
 * <p>Misuse of the graph-building API (such as inserting a node that is already in a block) is
 * instead reported with the usual {@link IllegalArgumentException} or {@link
 * IllegalStateException}.
 */
public class GraphInvariantError extends AssertionError {

  @FormatMethod
  public GraphInvariantError(String fmt, Object... args) {
    super(String.format(fmt, args));
  }

  @FormatMethod
  public GraphInvariantError(Throwable cause, String fmt, Object... args) {
    super(String.format(fmt, args), cause);
  }

  /** Throws a GraphInvariantError with the given message if {@code condition} is false. */
  @FormatMethod
  public static void check(boolean condition, String fmt, Object... args) {
    if (!condition) {
      throw new GraphInvariantError(fmt, args);
    }
  }
}
