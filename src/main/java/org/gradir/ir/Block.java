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
import org.jspecify.annotations.Nullable;

/**
 * A Block is an ordered sequence of {@link Node}s together with a list of inputs and a list of
 * outputs. Every graph has a top-level block (whose inputs and outputs are the graph's), and nodes
 * such as GradOf own nested blocks.
 *
 * <p>A Block's inputs are the outputs of its {@link #paramNode}, and its outputs are the inputs of
 * its {@link #returnNode}. Neither of those nodes is considered part of the block's node sequence,
 * but they bracket it: {@code paramNode().next()} is the first node in the block (or the return
 * node, if the block is empty). Representing the outputs as inputs of a node means that they are
 * tracked in the outputs' use lists like any other reference, so {@link Value#replaceAllUsesWith}
 * updates them too.
 */
public final class Block {
  private final Graph graph;
  private final @Nullable Node owningNode;
  private final Node paramNode;
  private final Node returnNode;

  Block(Graph graph, @Nullable Node owningNode) {
    this.graph = graph;
    this.owningNode = owningNode;
    this.paramNode = new Node(graph, NodeKind.PARAM);
    this.returnNode = new Node(graph, NodeKind.RETURN);
    paramNode.initSentinel(this, null, returnNode);
    returnNode.initSentinel(this, paramNode, null);
  }

  public Graph graph() {
    return graph;
  }

  /** The node that owns this block, or null if this is a graph's top-level block. */
  public @Nullable Node owningNode() {
    return owningNode;
  }

  /** The node whose outputs are this block's inputs. */
  public Node paramNode() {
    return paramNode;
  }

  /** The node whose inputs are this block's outputs. */
  public Node returnNode() {
    return returnNode;
  }

  /** An unmodifiable view of this block's inputs. */
  public List<Value> inputs() {
    return paramNode.outputs();
  }

  /** An unmodifiable view of this block's outputs. */
  public List<Value> outputs() {
    return returnNode.inputs();
  }

  /** Adds an input to this block and returns it. */
  @CanIgnoreReturnValue
  public Value addInput(Type type) {
    return paramNode.addOutput(type);
  }

  /** Appends {@code value} to this block's outputs and returns its index. */
  @CanIgnoreReturnValue
  public int registerOutput(Value value) {
    returnNode.addInput(value);
    return returnNode.inputs().size() - 1;
  }

  /** True if the block contains no nodes (other than its param and return nodes). */
  public boolean isEmpty() {
    return paramNode.next == returnNode;
  }

  /**
   * Returns the nodes currently in this block, in order. The result is a snapshot, so it is not
   * affected by subsequent changes to the block.
   */
  public ImmutableList<Node> nodes() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node n = paramNode.next; n != returnNode; n = n.next) {
      builder.add(n);
    }
    return builder.build();
  }

  /** Inserts {@code node} (which must not already be in a block) at the end of this block. */
  @CanIgnoreReturnValue
  public Node appendNode(Node node) {
    return node.insertBefore(returnNode);
  }

  /** Inserts {@code node} (which must not already be in a block) at the start of this block. */
  @CanIgnoreReturnValue
  public Node prependNode(Node node) {
    return node.insertAfter(paramNode);
  }

  /**
   * Destroys all the nodes in this block, last to first, after releasing the block's outputs. Called
   * when the owning node is destroyed.
   */
  void destroy() {
    Preconditions.checkState(owningNode != null, "Can't destroy a graph's top-level block");
    returnNode.removeAllInputs();
    for (Node n = returnNode.prev; n != paramNode; ) {
      Node prev = n.prev;
      n.destroy();
      n = prev;
    }
    returnNode.destroySentinel();
    paramNode.destroySentinel();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    GraphPrinter.appendBlock(sb, this, 0, 0);
    return sb.toString();
  }
}
