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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural invariants of a graph:
 *
 * <ul>
 *   <li>each block's node list is properly linked, and each node in it records that block as its
 *       owner (and each nested block records its node);
 *   <li>no destroyed node is reachable;
 *   <li>every input of every node (including block outputs) is a value defined earlier in the same
 *       block or in an enclosing block;
 *   <li>use lists are exact: each input of a node appears in the input value's use list, and each
 *       use in a value's use list corresponds to an input of a live node.
 * </ul>
 *
 * <p>Any violation throws a {@link GraphInvariantError}.
 */
public class GraphLint {

  private GraphLint() {}

  public static void check(Graph graph) {
    Block block = graph.block();
    GraphInvariantError.check(block.owningNode() == null, "Top-level block has an owner");
    checkBlock(block, new HashSet<>());
  }

  /**
   * Checks a block. {@code outerScope} contains the values visible from enclosing blocks; it is not
   * modified.
   */
  private static void checkBlock(Block block, Set<Value> outerScope) {
    Set<Value> scope = new HashSet<>(outerScope);
    Node param = block.paramNode();
    GraphInvariantError.check(
        param.owningBlock() == block && param.prev() == null, "Malformed param node");
    checkOutputs(param);
    scope.addAll(param.outputs());

    Node prev = param;
    for (Node node = param.next(); node != block.returnNode(); node = node.next()) {
      GraphInvariantError.check(node != null, "Node list for block is not terminated");
      GraphInvariantError.check(!node.isDestroyed(), "Destroyed node %s is still linked", node);
      GraphInvariantError.check(node.prev() == prev, "Broken prev link at %s", node);
      GraphInvariantError.check(
          node.owningBlock() == block, "%s does not record its owning block", node);
      checkInputs(node, scope);
      for (Block nested : node.blocks()) {
        GraphInvariantError.check(
            nested.owningNode() == node, "Nested block of %s has the wrong owner", node);
        checkBlock(nested, scope);
      }
      checkOutputs(node);
      scope.addAll(node.outputs());
      prev = node;
    }

    Node ret = block.returnNode();
    GraphInvariantError.check(
        ret.owningBlock() == block && ret.prev() == prev && ret.next() == null,
        "Malformed return node");
    checkInputs(ret, scope);
  }

  private static void checkInputs(Node node, Set<Value> scope) {
    List<Value> inputs = node.inputs();
    for (int i = 0; i < inputs.size(); i++) {
      Value input = inputs.get(i);
      GraphInvariantError.check(
          scope.contains(input), "%s uses %s, which is not defined before it", node, input);
      int offset = i;
      long count =
          input.uses().stream().filter(u -> u.user == node && u.offset == offset).count();
      GraphInvariantError.check(
          count == 1, "%s has %s uses for input %s of %s", input, count, offset, node);
    }
  }

  private static void checkOutputs(Node node) {
    List<Value> outputs = node.outputs();
    for (int i = 0; i < outputs.size(); i++) {
      Value output = outputs.get(i);
      GraphInvariantError.check(
          output.node() == node && output.offset() == i,
          "%s does not record its definition by %s",
          output,
          node);
      for (Use use : output.uses()) {
        GraphInvariantError.check(
            !use.user.isDestroyed() && use.user.owningBlock() != null,
            "%s is used by a node that is not in the graph (%s)",
            output,
            use);
        GraphInvariantError.check(
            use.offset < use.user.inputs().size() && use.user.input(use.offset) == output,
            "Use list of %s is stale (%s)",
            output,
            use);
      }
    }
  }
}
