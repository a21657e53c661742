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
import java.util.concurrent.ConcurrentHashMap;

/**
 * A NodeKind identifies the operation performed by a {@link Node}, using a namespaced name such as
 * {@code "aten::mul"} or {@code "prim::GradOf"}. NodeKinds are interned, so they can be compared
 * with {@code ==}.
 *
 * <p>The "prim" namespace is used for structural kinds that are interpreted by the graph itself or
 * by the passes; all other kinds are opaque to this package.
 */
public final class NodeKind {

  private static final ConcurrentHashMap<String, NodeKind> INTERNED = new ConcurrentHashMap<>();

  /** The node that defines a block's inputs; never appears in a block's node list. */
  public static final NodeKind PARAM = of("prim::Param");

  /** The node whose inputs are a block's outputs; never appears in a block's node list. */
  public static final NodeKind RETURN = of("prim::Return");

  /**
   * A conditional gradient block: its single nested block computes a gradient that should only be
   * computed if at least one of the node's inputs is defined.
   */
  public static final NodeKind GRAD_OF = of("prim::GradOf");

  /**
   * Adds two gradient contributions, either of which may be undefined; if one is undefined the
   * result is the other.
   */
  public static final NodeKind AUTOGRAD_ADD = of("prim::AutogradAdd");

  /** Produces an undefined tensor. */
  public static final NodeKind UNDEFINED = of("prim::Undefined");

  /** An ordinary tensor addition, which requires both arguments to be defined. */
  public static final NodeKind ADD = of("aten::add");

  /** The part of the name before "::". */
  public final String namespace;

  /** The part of the name after "::". */
  public final String name;

  private NodeKind(String namespace, String name) {
    this.namespace = namespace;
    this.name = name;
  }

  /** Returns the NodeKind with the given qualified name, e.g. {@code "aten::neg"}. */
  public static NodeKind of(String qualifiedName) {
    return INTERNED.computeIfAbsent(
        qualifiedName,
        s -> {
          int sep = s.indexOf("::");
          Preconditions.checkArgument(
              sep > 0 && sep + 2 < s.length(), "NodeKind must be \"namespace::name\" (%s)", s);
          return new NodeKind(s.substring(0, sep), s.substring(sep + 2));
        });
  }

  /** True if this kind is in the "prim" namespace. */
  public boolean isPrim() {
    return namespace.equals("prim");
  }

  @Override
  public String toString() {
    return namespace + "::" + name;
  }
}
