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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A Value is a single-assignment result: the {@link #offset}th output of the node that defines it
 * (graph and block inputs are the outputs of their block's {@link NodeKind#PARAM} node).
 *
 * <p>Each Value keeps the list of {@link Use}s that refer to it. The use list is maintained by the
 * methods on {@link Node} that change its inputs, so it always matches the inputs of the live nodes
 * in the graph.
 */
public final class Value {
  private final Node node;
  private final int offset;

  /** Unique within the graph; used to name the value when it has no {@link #debugName}. */
  public final int id;

  private Type type;
  private @Nullable String debugName;

  private final List<Use> uses = new ArrayList<>();

  Value(Node node, int offset, Type type) {
    this.node = node;
    this.offset = offset;
    this.type = type;
    this.id = node.graph().nextValueId();
  }

  /** The node that defines this value. */
  public Node node() {
    return node;
  }

  /** This value's position in {@code node().outputs()}. */
  public int offset() {
    return offset;
  }

  public Type type() {
    return type;
  }

  @CanIgnoreReturnValue
  public Value setType(Type type) {
    this.type = Preconditions.checkNotNull(type);
    return this;
  }

  public @Nullable String debugName() {
    return debugName;
  }

  /**
   * Sets a name to be used when printing this value in place of its id. Names that are all digits
   * are not allowed, since they could be confused with ids.
   */
  @CanIgnoreReturnValue
  public Value setDebugName(@Nullable String name) {
    Preconditions.checkArgument(
        name == null || (!name.isEmpty() && !name.chars().allMatch(Character::isDigit)),
        "Invalid debug name \"%s\"",
        name);
    this.debugName = name;
    return this;
  }

  /** An unmodifiable view of the uses of this value, in the order they were added. */
  public List<Use> uses() {
    return Collections.unmodifiableList(uses);
  }

  public boolean hasUses() {
    return !uses.isEmpty();
  }

  /**
   * Changes every use of this value (including uses as a block output) to use {@code newValue}
   * instead. Afterwards this value has no uses.
   */
  public void replaceAllUsesWith(Value newValue) {
    Preconditions.checkArgument(newValue != this, "Can't replace %s with itself", this);
    Preconditions.checkArgument(newValue.node.graph() == node.graph());
    for (Use use : ImmutableList.copyOf(uses)) {
      use.user.setInputUnchecked(use.offset, newValue);
      newValue.uses.add(use);
    }
    uses.clear();
  }

  void addUse(Use use) {
    uses.add(use);
  }

  void removeUse(Use use) {
    boolean removed = uses.remove(use);
    GraphInvariantError.check(removed, "%s is not used by %s", this, use);
  }

  /** Replaces an existing Use with one that refers to a different input offset of the same node. */
  void renumberUse(Use from, Use to) {
    int i = uses.indexOf(from);
    GraphInvariantError.check(i >= 0, "%s is not used by %s", this, from);
    uses.set(i, to);
  }

  /** Returns this value's name as it appears when printing, e.g. {@code "%3"} or {@code "%dx"}. */
  @Override
  public String toString() {
    return "%" + (debugName != null ? debugName : String.valueOf(id));
  }
}
