/*
 * Copyright 2025 The Codescope Authors
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

package org.codescope.analysis;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * An immutable control-flow tree. Like {@link org.codescope.compiler.ParseTree} it is an arena
 * that owns its nodes, which refer to each other by handle.
 *
 * <p>Handles are assigned in preorder: the ENTRY node is handle 0, and every child's handle is
 * larger than its parent's. A {@link FlowNode.LoopBack} refers to its loop (an ancestor) by handle,
 * but that reference is not a child edge.
 */
public final class ControlFlowGraph {
  private final ImmutableList<FlowNode> nodes;

  ControlFlowGraph(ImmutableList<FlowNode> nodes) {
    this.nodes = nodes;
  }

  public FlowNode.Entry entry() {
    return (FlowNode.Entry) nodes.get(0);
  }

  public FlowNode node(int id) {
    return nodes.get(id);
  }

  /** All nodes, in preorder. */
  public ImmutableList<FlowNode> nodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  public long count(FlowNode.Kind kind) {
    return nodes.stream().filter(n -> n.kind() == kind).count();
  }

  /** Returns the nodes reachable from ENTRY by following child edges, in preorder. */
  public ImmutableList<FlowNode> reachable() {
    ImmutableList.Builder<FlowNode> result = ImmutableList.builder();
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(0);
    while (!stack.isEmpty()) {
      FlowNode node = nodes.get(stack.pop());
      result.add(node);
      ImmutableList<Integer> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return result.build();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ControlFlowGraph other && nodes.equals(other.nodes);
  }

  @Override
  public int hashCode() {
    return nodes.hashCode();
  }

  /**
   * Returns an indented rendering of the graph. Each chain of {@code next} edges is printed at a
   * single indentation level; other children are indented one more.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendChain(sb, 0, 0);
    return sb.toString();
  }

  private void appendChain(StringBuilder sb, int id, int indent) {
    while (id != FlowNode.NONE) {
      FlowNode node = nodes.get(id);
      sb.append(Strings.repeat("  ", indent)).append(node.kind());
      if (node instanceof FlowNode.LoopBack loopBack) {
        sb.append(" -> ").append(loopBack.target());
      } else if (!node.text().isEmpty()) {
        sb.append(' ').append(node.text());
      }
      sb.append('\n');
      for (int child : node.children()) {
        if (child != node.next()) {
          appendChain(sb, child, indent + 1);
        }
      }
      id = node.next();
    }
  }
}
