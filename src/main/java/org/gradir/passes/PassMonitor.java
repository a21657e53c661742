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

import com.google.errorprone.annotations.FormatMethod;
import java.io.PrintStream;
import org.gradir.ir.Graph;
import org.gradir.ir.Node;

/**
 * A PassMonitor is notified as passes run, to enable logging or other instrumentation. All methods
 * have empty default implementations, so monitors only need to override the events they care
 * about.
 *
 * <p>Monitors are called synchronously from the thread running the pass, and must not modify the
 * graph.
 */
public interface PassMonitor {

  /** Called before {@code pass} is run on {@code graph}. */
  default void passStarted(GraphPass pass, Graph graph) {}

  /** Called after {@code pass} has completed on {@code graph}. */
  default void passFinished(GraphPass pass, Graph graph) {}

  /**
   * Called when {@code pass} is about to rewrite {@code node}; the node is still in its original
   * state.
   *
   * @param action a short description of what is being done, e.g. "hoisted"
   */
  default void nodeRewritten(GraphPass pass, Node node, String action) {}

  /** A monitor that ignores all events. */
  PassMonitor NONE = new PassMonitor() {};

  /**
   * A monitor that writes a line for each event to a PrintStream. If {@code verbose} is true the
   * complete graph is also printed before and after each pass.
   */
  class Printing implements PassMonitor {
    private final PrintStream out;
    private final boolean verbose;

    public Printing(PrintStream out, boolean verbose) {
      this.out = out;
      this.verbose = verbose;
    }

    /** Returns a non-verbose monitor that writes to {@code System.err}. */
    public static Printing toStderr() {
      return new Printing(System.err, false);
    }

    @Override
    public void passStarted(GraphPass pass, Graph graph) {
      log("%s: started", pass.name());
      if (verbose) {
        out.print(graph);
      }
    }

    @Override
    public void passFinished(GraphPass pass, Graph graph) {
      log("%s: finished", pass.name());
      if (verbose) {
        out.print(graph);
      }
    }

    @Override
    public void nodeRewritten(GraphPass pass, Node node, String action) {
      log("%s: %s %s", pass.name(), action, node);
    }

    @FormatMethod
    private void log(String fmt, Object... args) {
      out.println("** " + String.format(fmt, args));
    }
  }
}
