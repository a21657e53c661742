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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;

/**
 * A Graph is a computation represented as a top-level {@link Block} of {@link Node}s; the graph's
 * inputs and outputs are the inputs and outputs of that block.
 *
 * <p>Graphs are built by a front end (for example, the code that derives a gradient graph from a
 * forward computation) and then transformed in place by passes. A Graph and everything in it may
 * only be used by one thread at a time; there is no internal synchronization.
 *
 * <p>A simple graph can be built like this:
 *
 * <pre>{@code
 * Graph g = new Graph();
 * Value x = g.addInput(Type.TENSOR).setDebugName("x");
 * Value y = g.appendNode(g.create(NodeKind.of("aten::neg"), x)).output();
 * g.registerOutput(y);
 * }</pre>
 */
public final class Graph {
  private final Block block;
  private int nextValueId;

  public Graph() {
    this.block = new Block(this, null);
  }

  /** The graph's top-level block. */
  public Block block() {
    return block;
  }

  /** An unmodifiable view of the graph's inputs. */
  public List<Value> inputs() {
    return block.inputs();
  }

  /** An unmodifiable view of the graph's outputs. */
  public List<Value> outputs() {
    return block.outputs();
  }

  /** Adds an input to the graph and returns it. */
  @CanIgnoreReturnValue
  public Value addInput(Type type) {
    return block.addInput(type);
  }

  /** Appends {@code value} to the graph's outputs and returns its index. */
  @CanIgnoreReturnValue
  public int registerOutput(Value value) {
    return block.registerOutput(value);
  }

  /** Returns a snapshot of the nodes in the graph's top-level block. */
  public ImmutableList<Node> nodes() {
    return block.nodes();
  }

  /**
   * Creates a new node with the given kind, inputs, and number of outputs (each of type {@link
   * Type#DYNAMIC}). The new node is not in any block.
   */
  public Node create(NodeKind kind, List<Value> inputs, int numOutputs) {
    Preconditions.checkArgument(
        kind != NodeKind.PARAM && kind != NodeKind.RETURN, "%s nodes are created by Block", kind);
    Preconditions.checkArgument(numOutputs >= 0);
    Node node = new Node(this, kind);
    for (Value input : inputs) {
      node.addInput(input);
    }
    for (int i = 0; i < numOutputs; i++) {
      node.addOutput(Type.DYNAMIC);
    }
    return node;
  }

  /** Creates a new node with the given kind and inputs, and a single output of type DYNAMIC. */
  public Node create(NodeKind kind, Value... inputs) {
    return create(kind, ImmutableList.copyOf(inputs), 1);
  }

  /** Creates a {@link NodeKind#UNDEFINED} node, whose output has type UNDEFINED_TENSOR. */
  public Node createUndefined() {
    Node node = create(NodeKind.UNDEFINED, ImmutableList.of(), 1);
    node.output().setType(Type.UNDEFINED_TENSOR);
    return node;
  }

  /**
   * Creates a GradOf node with the given inputs and number of outputs, and an empty nested block.
   * The caller is responsible for filling in the block and registering one output for each of the
   * node's outputs.
   *
   * @param name the name of the operation whose gradient the block computes; used only for
   *     printing
   */
  public Node createGradOf(String name, List<Value> inputs, int numOutputs) {
    Node node = create(NodeKind.GRAD_OF, inputs, numOutputs);
    node.setAttribute("name", name);
    node.addBlock();
    return node;
  }

  /** Appends {@code node} (which must not already be in a block) to the top-level block. */
  @CanIgnoreReturnValue
  public Node appendNode(Node node) {
    return block.appendNode(node);
  }

  /** Returns a new id for a Value. */
  int nextValueId() {
    return nextValueId++;
  }

  @Override
  public String toString() {
    return GraphPrinter.print(this);
  }
}
