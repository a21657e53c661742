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

import org.gradir.ir.Graph;

/** A GraphPass transforms a {@link Graph} in place. */
public interface GraphPass {

  /** Used only for logging and error messages. */
  String name();

  /**
   * Transforms {@code graph}, reporting any changes to {@code monitor}. The pass must have
   * exclusive access to the graph until it returns.
   */
  void run(Graph graph, PassMonitor monitor);

  /** Equivalent to {@code run(graph, PassMonitor.NONE)}. */
  default void run(Graph graph) {
    run(graph, PassMonitor.NONE);
  }
}
