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

import com.google.common.collect.ImmutableMap;
import org.gradir.util.StringUtil;

/**
 * A static-only class that converts graphs to a readable text form, e.g.
 *
 * <pre>
 * graph(%x : Tensor, %dy : UndefinedTensor) {
 *   %2 : Dynamic = prim::GradOf[name="aten::neg"](%dy)
 *     block0() {
 *       %3 : Dynamic = aten::neg(%dy)
 *       -&gt; (%3)
 *     }
 *   return (%2);
 * }
 * </pre>
 *
 * <p>The output is stable (it depends only on the graph's structure, value ids, and debug names),
 * so tests compare it against expected text.
 */
class GraphPrinter {

  private GraphPrinter() {}

  static String print(Graph graph) {
    StringBuilder sb = new StringBuilder();
    Block block = graph.block();
    sb.append("graph(");
    appendParams(sb, block);
    sb.append(") {\n");
    appendNodes(sb, block, 2);
    indent(sb, 2).append("return (");
    StringUtil.joinTo(sb, block.outputs(), Value::toString);
    sb.append(");\n}\n");
    return sb.toString();
  }

  /**
   * Appends a node's outputs, kind, attributes, and inputs, e.g. {@code "%4 : Dynamic =
   * aten::mul(%2, %3)"}.
   */
  static void appendNodeHeader(StringBuilder sb, Node node) {
    if (!node.outputs().isEmpty()) {
      StringUtil.joinTo(sb, node.outputs(), GraphPrinter::typedName);
      sb.append(" = ");
    }
    sb.append(node.kind());
    ImmutableMap<String, Object> attributes = node.attributes();
    if (!attributes.isEmpty()) {
      sb.append('[');
      StringUtil.joinTo(
          sb,
          attributes.entrySet().asList(),
          e -> e.getKey() + "=" + attributeToString(e.getValue()));
      sb.append(']');
    }
    sb.append('(');
    StringUtil.joinTo(sb, node.inputs(), Value::toString);
    sb.append(')');
  }

  /**
   * Appends a nested block, with its header indented by {@code indent} spaces and its contents
   * indented two more.
   */
  static void appendBlock(StringBuilder sb, Block block, int index, int indent) {
    indent(sb, indent).append("block").append(index).append('(');
    appendParams(sb, block);
    sb.append(") {\n");
    appendNodes(sb, block, indent + 2);
    indent(sb, indent + 2).append("-> (");
    StringUtil.joinTo(sb, block.outputs(), Value::toString);
    sb.append(")\n");
    indent(sb, indent).append("}\n");
  }

  private static void appendNodes(StringBuilder sb, Block block, int indent) {
    for (Node node : block.nodes()) {
      indent(sb, indent);
      appendNodeHeader(sb, node);
      sb.append('\n');
      for (int i = 0; i < node.blocks().size(); i++) {
        appendBlock(sb, node.blocks().get(i), i, indent + 2);
      }
    }
  }

  private static void appendParams(StringBuilder sb, Block block) {
    StringUtil.joinTo(sb, block.inputs(), GraphPrinter::typedName);
  }

  private static String typedName(Value value) {
    return value + " : " + value.type();
  }

  private static String attributeToString(Object value) {
    return (value instanceof String s) ? StringUtil.escape(s) : String.valueOf(value);
  }

  private static StringBuilder indent(StringBuilder sb, int indent) {
    for (int i = 0; i < indent; i++) {
      sb.append(' ');
    }
    return sb;
  }
}
