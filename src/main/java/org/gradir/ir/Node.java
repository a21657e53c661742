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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A Node is a single operation in a {@link Graph}. Each Node has a {@link NodeKind}, an ordered
 * list of input {@link Value}s, an ordered list of output Values (which it defines), zero or more
 * nested {@link Block}s, and a small map of named attributes (constant parameters such as the name
 * of the operation a GradOf differentiates).
 *
 * <p>Nodes are created by {@link Graph#create} and are not part of any block until they are
 * inserted with {@link #insertBefore}, {@link #insertAfter}, or {@link Block#appendNode}. Within a
 * block, nodes form a doubly-linked list that starts with the block's param node and ends with its
 * return node; because of this, removing or moving one node never disturbs a traversal that has
 * already saved a reference to the following node.
 */
public final class Node {
  private final Graph graph;
  private final NodeKind kind;

  private final List<Value> inputs = new ArrayList<>();
  private final List<Value> outputs = new ArrayList<>();
  private final List<Block> blocks = new ArrayList<>();
  private final Map<String, Object> attributes = new LinkedHashMap<>();

  /** Null if this node is not currently in a block. */
  private @Nullable Block owningBlock;

  // Only meaningful when owningBlock is non-null; param nodes have a null prev and return nodes
  // have a null next.
  @Nullable Node prev;
  @Nullable Node next;

  private boolean destroyed;

  Node(Graph graph, NodeKind kind) {
    this.graph = graph;
    this.kind = kind;
  }

  public Graph graph() {
    return graph;
  }

  public NodeKind kind() {
    return kind;
  }

  /** An unmodifiable view of this node's inputs. */
  public List<Value> inputs() {
    return Collections.unmodifiableList(inputs);
  }

  public Value input(int i) {
    return inputs.get(i);
  }

  /** An unmodifiable view of this node's outputs. */
  public List<Value> outputs() {
    return Collections.unmodifiableList(outputs);
  }

  /** Should only be called on nodes with exactly one output; returns it. */
  public Value output() {
    Preconditions.checkState(outputs.size() == 1, "%s does not have exactly one output", kind);
    return outputs.get(0);
  }

  /** An unmodifiable view of this node's nested blocks. */
  public List<Block> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  /** The block that currently contains this node, or null if it has not been inserted. */
  public @Nullable Block owningBlock() {
    return owningBlock;
  }

  public boolean isInBlock() {
    return owningBlock != null;
  }

  /**
   * The node after this one in its block. The last node in each block is followed by the block's
   * {@link Block#returnNode}; the return node itself returns null.
   */
  public @Nullable Node next() {
    return next;
  }

  /**
   * The node before this one in its block. The first node in each block is preceded by the block's
   * {@link Block#paramNode}; the param node itself returns null.
   */
  public @Nullable Node prev() {
    return prev;
  }

  /** True if {@link #destroy} has been called on this node. */
  public boolean isDestroyed() {
    return destroyed;
  }

  /** Appends {@code value} to this node's inputs. */
  @CanIgnoreReturnValue
  public Value addInput(Value value) {
    checkLive();
    Preconditions.checkArgument(value.node().graph == graph, "%s is from another graph", value);
    int offset = inputs.size();
    inputs.add(value);
    value.addUse(new Use(this, offset));
    return value;
  }

  /** Replaces the {@code i}th input of this node, and returns the value that it replaced. */
  @CanIgnoreReturnValue
  public Value replaceInput(int i, Value newValue) {
    checkLive();
    Preconditions.checkArgument(newValue.node().graph == graph, "%s is from another graph", newValue);
    Value old = inputs.get(i);
    Use use = new Use(this, i);
    old.removeUse(use);
    inputs.set(i, newValue);
    newValue.addUse(use);
    return old;
  }

  /** Replaces each occurrence of {@code from} in this node's inputs with {@code to}. */
  public void replaceInputWith(Value from, Value to) {
    for (int i = 0; i < inputs.size(); i++) {
      if (inputs.get(i) == from) {
        replaceInput(i, to);
      }
    }
  }

  /** Removes the {@code i}th input of this node; later inputs are shifted down. */
  public void removeInput(int i) {
    checkLive();
    inputs.get(i).removeUse(new Use(this, i));
    inputs.remove(i);
    for (int j = i; j < inputs.size(); j++) {
      inputs.get(j).renumberUse(new Use(this, j + 1), new Use(this, j));
    }
  }

  /** Removes all of this node's inputs. */
  public void removeAllInputs() {
    for (int i = inputs.size() - 1; i >= 0; i--) {
      removeInput(i);
    }
  }

  /**
   * Used by {@link Value#replaceAllUsesWith}, which does its own use-list bookkeeping; just updates
   * the input list.
   */
  void setInputUnchecked(int i, Value value) {
    inputs.set(i, value);
  }

  /** Adds a new output of the given type and returns it. */
  @CanIgnoreReturnValue
  public Value addOutput(Type type) {
    checkLive();
    Value result = new Value(this, outputs.size(), type);
    outputs.add(result);
    return result;
  }

  /** Adds a new, empty nested block to this node and returns it. */
  @CanIgnoreReturnValue
  public Block addBlock() {
    checkLive();
    Preconditions.checkState(!isSentinel(), "%s can't have nested blocks", kind);
    Block block = new Block(graph, this);
    blocks.add(block);
    return block;
  }

  /** Sets the named attribute; {@code value} must be a String or a Number. */
  @CanIgnoreReturnValue
  public Node setAttribute(String name, Object value) {
    Preconditions.checkArgument(
        value instanceof String || value instanceof Number,
        "Unsupported attribute value: %s",
        value);
    attributes.put(name, value);
    return this;
  }

  /** Returns the named attribute, or null if it has not been set. */
  public @Nullable Object attribute(String name) {
    return attributes.get(name);
  }

  /** Returns all of this node's attributes, in the order they were first set. */
  public ImmutableMap<String, Object> attributes() {
    return ImmutableMap.copyOf(attributes);
  }

  /** Inserts this node (which must not be in a block) immediately before {@code other}. */
  @CanIgnoreReturnValue
  public Node insertBefore(Node other) {
    checkInsertable(other);
    Preconditions.checkArgument(other.kind != NodeKind.PARAM, "Can't insert before a param node");
    link(other.prev, other);
    return this;
  }

  /** Inserts this node (which must not be in a block) immediately after {@code other}. */
  @CanIgnoreReturnValue
  public Node insertAfter(Node other) {
    checkInsertable(other);
    Preconditions.checkArgument(other.kind != NodeKind.RETURN, "Can't insert after a return node");
    link(other, other.next);
    return this;
  }

  /**
   * Moves this node from its current position (possibly in another block) to immediately before
   * {@code other}. Its inputs, outputs and their uses are unchanged.
   */
  @CanIgnoreReturnValue
  public Node moveBefore(Node other) {
    Preconditions.checkArgument(other != this);
    removeFromList();
    return insertBefore(other);
  }

  /** Moves this node from its current position to immediately after {@code other}. */
  @CanIgnoreReturnValue
  public Node moveAfter(Node other) {
    Preconditions.checkArgument(other != this);
    removeFromList();
    return insertAfter(other);
  }

  /**
   * Returns true if this node appears before {@code other}; both must be in the same block. A node
   * is not before itself.
   */
  public boolean isBefore(Node other) {
    Preconditions.checkArgument(
        owningBlock != null && owningBlock == other.owningBlock, "Nodes are not in the same block");
    for (Node n = next; n != null; n = n.next) {
      if (n == other) {
        return true;
      }
    }
    return false;
  }

  /**
   * Removes this node from the graph. None of its outputs may still have uses; the node's own
   * inputs are released, and any nested blocks are destroyed along with it.
   *
   * @throws GraphInvariantError if an output is still in use
   */
  public void destroy() {
    checkLive();
    Preconditions.checkState(!isSentinel(), "%s nodes are destroyed with their block", kind);
    for (Value output : outputs) {
      GraphInvariantError.check(
          !output.hasUses(), "Can't destroy %s: %s is still used by %s", this, output, output.uses());
    }
    removeAllInputs();
    for (int i = blocks.size() - 1; i >= 0; i--) {
      blocks.get(i).destroy();
    }
    blocks.clear();
    if (owningBlock != null) {
      removeFromList();
    }
    destroyed = true;
  }

  /** Used by {@link Block#destroy} to remove its param and return nodes. */
  void destroySentinel() {
    assert isSentinel();
    for (Value output : outputs) {
      GraphInvariantError.check(
          !output.hasUses(), "Block input %s is still used by %s", output, output.uses());
    }
    removeAllInputs();
    destroyed = true;
  }

  /** Called once, by the Block that this sentinel belongs to. */
  void initSentinel(Block block, @Nullable Node prev, @Nullable Node next) {
    assert isSentinel() && owningBlock == null;
    this.owningBlock = block;
    this.prev = prev;
    this.next = next;
  }

  private boolean isSentinel() {
    return kind == NodeKind.PARAM || kind == NodeKind.RETURN;
  }

  private void checkLive() {
    Preconditions.checkState(!destroyed, "%s has been destroyed", kind);
  }

  private void checkInsertable(Node other) {
    checkLive();
    Preconditions.checkState(owningBlock == null, "%s is already in a block", this);
    Preconditions.checkArgument(other.owningBlock != null, "%s is not in a block", other);
    Preconditions.checkArgument(other.graph == graph, "%s is from another graph", other);
  }

  private void link(Node before, Node after) {
    this.owningBlock = after.owningBlock;
    this.prev = before;
    this.next = after;
    before.next = this;
    after.prev = this;
  }

  private void removeFromList() {
    Preconditions.checkState(owningBlock != null && !isSentinel(), "%s is not in a block", this);
    prev.next = next;
    next.prev = prev;
    prev = null;
    next = null;
    owningBlock = null;
  }

  /**
   * Returns a one-line description of this node in the same format used when printing a graph (but
   * without any nested blocks).
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    GraphPrinter.appendNodeHeader(sb, this);
    return sb.toString();
  }
}
