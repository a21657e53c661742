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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.gradir.ir.Graph;
import org.gradir.ir.GraphInvariantError;
import org.gradir.ir.GraphLint;

/**
 * A PassPipeline runs a fixed sequence of {@link GraphPass}es over a graph. By default the graph is
 * checked with {@link GraphLint} before the first pass and after each pass, so that a pass that
 * corrupts the graph is identified immediately.
 *
 * <p>PassPipelines are immutable and may be shared between threads, but the passes they contain
 * may not be (see {@link SpecializeUndef}); each graph must be processed by only one thread.
 */
public class PassPipeline {
  public final ImmutableList<GraphPass> passes;
  public final boolean lint;
  public final PassMonitor monitor;

  private PassPipeline(Builder builder) {
    this.passes = builder.passes.build();
    this.lint = builder.lint;
    this.monitor = builder.monitor;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Runs each of the passes in order on {@code graph}. */
  public void run(Graph graph) {
    if (lint) {
      GraphLint.check(graph);
    }
    for (GraphPass pass : passes) {
      monitor.passStarted(pass, graph);
      pass.run(graph, monitor);
      if (lint) {
        try {
          GraphLint.check(graph);
        } catch (GraphInvariantError e) {
          throw new GraphInvariantError(e, "Graph is inconsistent after %s", pass.name());
        }
      }
      monitor.passFinished(pass, graph);
    }
  }

  /** A Builder is used to construct a PassPipeline. */
  public static class Builder {
    private final ImmutableList.Builder<GraphPass> passes = ImmutableList.builder();
    private boolean lint = true;
    private PassMonitor monitor = PassMonitor.NONE;

    private Builder() {}

    /** Adds a pass to the end of the pipeline. */
    @CanIgnoreReturnValue
    public Builder add(GraphPass pass) {
      passes.add(Preconditions.checkNotNull(pass));
      return this;
    }

    /** If false, the graph will not be checked between passes. */
    @CanIgnoreReturnValue
    public Builder lintAfterEachPass(boolean lint) {
      this.lint = lint;
      return this;
    }

    /** Sets the monitor that will be notified as passes run. */
    @CanIgnoreReturnValue
    public Builder monitor(PassMonitor monitor) {
      this.monitor = Preconditions.checkNotNull(monitor);
      return this;
    }

    public PassPipeline build() {
      return new PassPipeline(this);
    }
  }
}
