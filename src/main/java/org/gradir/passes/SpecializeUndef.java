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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.gradir.ir.Block;
import org.gradir.ir.Graph;
import org.gradir.ir.GraphInvariantError;
import org.gradir.ir.Node;
import org.gradir.ir.NodeKind;
import org.gradir.ir.Value;
import org.jspecify.annotations.Nullable;

/**
 * Propagates {@link Definedness} through a gradient graph, and uses it to remove GradOf nodes and
 * to simplify AutogradAdds.
 *
 * <p>The pass only understands the three node kinds generated by symbolic differentiation:
 *
 * <ul>
 *   <li>{@code prim::GradOf}: if all of its inputs are undefined its outputs are undefined, so the
 *       node is replaced by a single {@code prim::Undefined}. Otherwise the GradOf must be able to
 *       handle any combination of defined and undefined inputs, so its body is hoisted into the
 *       enclosing block and run unconditionally.
 *   <li>{@code prim::AutogradAdd}: if either argument is undefined the result is the other
 *       argument; if both are defined it is replaced by an ordinary {@code aten::add}. Otherwise it
 *       is left alone, since it will need to check for undefined arguments at runtime.
 *   <li>{@code prim::Undefined}: its output is undefined.
 * </ul>
 *
 * <p>The outputs of all other nodes are UNKNOWN, and those nodes (and any blocks they contain) are
 * not examined. The exception is a node hoisted out of a GradOf body: GradOfs that have at least
 * one defined input are required to produce defined outputs, so the outputs of hoisted nodes are
 * DEFINED.
 *
 * <p>Graph inputs are given an initial state based on their type (see {@link
 * Definedness#forInputType}). Only the graph's top-level block is walked, along with the bodies of
 * any GradOfs that are hoisted into it.
 *
 * <p>A SpecializeUndef instance retains the states and statistics from its most recent run, so an
 * instance must not be used by more than one thread at a time.
 */
public class SpecializeUndef implements GraphPass {

  /** The kinds of node that this pass distinguishes. */
  enum Kind {
    GRAD_OF,
    AUTOGRAD_ADD,
    UNDEFINED,
    OTHER;

    static Kind of(NodeKind kind) {
      if (kind == NodeKind.GRAD_OF) {
        return GRAD_OF;
      } else if (kind == NodeKind.AUTOGRAD_ADD) {
        return AUTOGRAD_ADD;
      } else if (kind == NodeKind.UNDEFINED) {
        return UNDEFINED;
      } else {
        return OTHER;
      }
    }
  }

  /** Counts of the rewrites done by a single run. */
  public static class Stats {
    int gradOfsUndefined;
    int gradOfsHoisted;
    int addsFolded;
    int addsLowered;
    int addsKept;

    /** The number of GradOfs that were replaced by an undefined value. */
    public int gradOfsUndefined() {
      return gradOfsUndefined;
    }

    /** The number of GradOfs whose body was hoisted into the enclosing block. */
    public int gradOfsHoisted() {
      return gradOfsHoisted;
    }

    /** The number of AutogradAdds that were replaced by one of their arguments. */
    public int addsFolded() {
      return addsFolded;
    }

    /** The number of AutogradAdds that were replaced by an {@code aten::add}. */
    public int addsLowered() {
      return addsLowered;
    }

    /** The number of AutogradAdds that were left unchanged. */
    public int addsKept() {
      return addsKept;
    }

    @Override
    public String toString() {
      return String.format(
          "gradOfs(undefined=%s, hoisted=%s) adds(folded=%s, lowered=%s, kept=%s)",
          gradOfsUndefined, gradOfsHoisted, addsFolded, addsLowered, addsKept);
    }
  }

  private final Map<Value, Definedness> state = new HashMap<>();
  private Stats stats = new Stats();

  // Only set while run() is executing.
  private @Nullable Graph graph;
  private @Nullable PassMonitor monitor;
  // Nodes moved out of a GradOf body by the current run.
  private final Set<Node> hoisted = new HashSet<>();

  @Override
  public String name() {
    return "SpecializeUndef";
  }

  @Override
  public void run(Graph graph, PassMonitor monitor) {
    this.graph = graph;
    this.monitor = monitor;
    state.clear();
    stats = new Stats();
    try {
      for (Value input : graph.inputs()) {
        state.put(input, Definedness.forInputType(input.type()));
      }
      Block block = graph.block();
      for (Node n = block.paramNode().next(); n != block.returnNode(); ) {
        n = visit(n);
      }
    } finally {
      this.graph = null;
      this.monitor = null;
      hoisted.clear();
    }
  }

  /**
   * Returns the state computed for {@code value} by the most recent run, or null if the value was
   * not reached (e.g. because it was removed, or is defined inside a block that was not walked).
   */
  public @Nullable Definedness stateOf(Value value) {
    return state.get(value);
  }

  /** Returns the statistics from the most recent run. */
  public Stats stats() {
    return stats;
  }

  /**
   * Updates the state map for {@code n}, rewriting or removing it if possible. Returns the next node
   * to visit.
   */
  private Node visit(Node n) {
    Node next = n.next();
    return switch (Kind.of(n.kind())) {
      case GRAD_OF -> visitGradOf(n, next);
      case AUTOGRAD_ADD -> {
        visitAutogradAdd(n);
        yield next;
      }
      case UNDEFINED -> {
        state.put(n.output(), Definedness.UNDEFINED);
        yield next;
      }
      case OTHER -> {
        Definedness outputState =
            hoisted.contains(n) ? Definedness.DEFINED : Definedness.UNKNOWN;
        for (Value output : n.outputs()) {
          state.put(output, outputState);
        }
        yield next;
      }
    };
  }

  /** Removes a GradOf node, and returns the next node to visit. */
  private Node visitGradOf(Node n, Node next) {
    GraphInvariantError.check(n.blocks().size() == 1, "%s should have exactly one block", n);
    Block body = n.blocks().get(0);
    List<Value> outputs = n.outputs();
    GraphInvariantError.check(
        body.outputs().size() == outputs.size(),
        "%s has %s outputs but its block has %s",
        n,
        outputs.size(),
        body.outputs().size());

    if (n.inputs().stream().allMatch(v -> state(v) == Definedness.UNDEFINED)) {
      // If all the gradient inputs are undefined, so are all the gradient outputs.
      monitor.nodeRewritten(this, n, "replaced by prim::Undefined");
      ++stats.gradOfsUndefined;
      Node undef = graph.createUndefined().insertAfter(n);
      for (Value output : outputs) {
        output.replaceAllUsesWith(undef.output());
      }
      n.destroy();
      // Visiting the new node will record its output as undefined.
      return undef;
    }

    // Otherwise the GradOf's body must correctly handle any combination of defined and undefined
    // inputs, so we can just run it unconditionally. The graphs we get only contain GradOfs whose
    // inputs are the result of other GradOfs, AutogradAdds, or graph inputs, so there should be
    // no unknowns.
    for (Value input : n.inputs()) {
      GraphInvariantError.check(
          state(input) != Definedness.UNKNOWN,
          "Can't specialize %s: definedness of input %s is unknown",
          n,
          input);
    }
    monitor.nodeRewritten(this, n, "hoisted");
    ++stats.gradOfsHoisted;
    for (int i = 0; i < outputs.size(); i++) {
      outputs.get(i).replaceAllUsesWith(body.outputs().get(i));
    }
    Node first = null;
    for (Node bodyNode : body.nodes()) {
      bodyNode.moveBefore(n);
      hoisted.add(bodyNode);
      if (first == null) {
        first = bodyNode;
      }
    }
    n.destroy();
    // The hoisted nodes are visited next, so that any GradOfs and AutogradAdds among them are
    // simplified; the rest have DEFINED outputs.
    return (first != null) ? first : next;
  }

  private void visitAutogradAdd(Node n) {
    GraphInvariantError.check(
        n.inputs().size() == 2 && n.outputs().size() == 1, "Malformed AutogradAdd: %s", n);
    Value a = n.input(0);
    Value b = n.input(1);
    Definedness aState = state(a);
    Definedness bState = state(b);
    if (aState == Definedness.UNDEFINED) {
      // undef + b == b (even if b is also undefined)
      monitor.nodeRewritten(this, n, "replaced by second argument");
      ++stats.addsFolded;
      n.output().replaceAllUsesWith(b);
      n.destroy();
    } else if (bState == Definedness.UNDEFINED) {
      // a + undef == a
      monitor.nodeRewritten(this, n, "replaced by first argument");
      ++stats.addsFolded;
      n.output().replaceAllUsesWith(a);
      n.destroy();
    } else if (aState == Definedness.DEFINED && bState == Definedness.DEFINED) {
      // Both are defined, so an ordinary add will do.
      monitor.nodeRewritten(this, n, "lowered to aten::add");
      ++stats.addsLowered;
      Node add = graph.create(NodeKind.ADD, ImmutableList.of(a, b), 1).insertBefore(n);
      Value sum = add.output().setType(n.output().type());
      state.put(sum, Definedness.DEFINED);
      n.output().replaceAllUsesWith(sum);
      n.destroy();
    } else {
      // At least one argument may or may not be defined, so we need the runtime check.
      ++stats.addsKept;
      state.put(n.output(), Definedness.UNKNOWN);
    }
  }

  /** Returns the state of a value that must have already been visited. */
  private Definedness state(Value v) {
    Definedness result = state.get(v);
    GraphInvariantError.check(result != null, "No definedness recorded for %s", v);
    return result;
  }
}
