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

package org.codescope.compiler;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * An immutable tree of {@link ParseNode}s. The ParseTree is an arena that owns every node; nodes
 * are identified by their index (handle) in it, and refer to their children by handle.
 *
 * <p>Nodes are added bottom-up, so every child handle is smaller than its parent's. This rules out
 * cycles by construction.
 */
public final class ParseTree {
  private final ImmutableList<ParseNode> nodes;
  private final int root;

  private ParseTree(ImmutableList<ParseNode> nodes, int root) {
    this.nodes = nodes;
    this.root = root;
  }

  public ParseNode root() {
    return nodes.get(root);
  }

  public int rootId() {
    return root;
  }

  /** Returns the node with the given handle. */
  public ParseNode node(int id) {
    return nodes.get(id);
  }

  /**
   * Returns the node with the given handle, which must be an instance of {@code type}.
   *
   * @throws InternalFault if the node has some other type
   */
  public <T extends ParseNode> T node(int id, Class<T> type) {
    ParseNode node = nodes.get(id);
    if (!type.isInstance(node)) {
      throw new InternalFault(
          String.format("Expected %s, found %s", type.getSimpleName(), node.kind()),
          node.line(),
          node.column());
    }
    return type.cast(node);
  }

  /** Returns the children of the given node, in order. */
  public ImmutableList<ParseNode> children(ParseNode node) {
    return node.children().stream().map(nodes::get).collect(ImmutableList.toImmutableList());
  }

  /** The number of nodes in the arena. */
  public int size() {
    return nodes.size();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ParseTree other && root == other.root && nodes.equals(other.nodes);
  }

  @Override
  public int hashCode() {
    return nodes.hashCode() * 31 + root;
  }

  /** Returns an indented rendering of the tree, one node per line. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb, root, 0);
    return sb.toString();
  }

  private void appendTo(StringBuilder sb, int id, int indent) {
    ParseNode node = nodes.get(id);
    sb.append(Strings.repeat("  ", indent)).append(label(node)).append('\n');
    for (int child : node.children()) {
      appendTo(sb, child, indent + 1);
    }
    if (node instanceof ParseNode.ForClause clause && clause.parsed() != ParseNode.NONE) {
      sb.append(Strings.repeat("  ", indent + 1)).append("=>\n");
      appendTo(sb, clause.parsed(), indent + 2);
    }
  }

  /** A one-line description of the node, without its children. */
  static String label(ParseNode node) {
    String kind = node.kind().name();
    if (node instanceof ParseNode.TokenLeaf leaf) {
      return kind + " " + leaf.value();
    } else if (node instanceof ParseNode.Identifier identifier) {
      return kind + " " + identifier.name();
    } else if (node instanceof ParseNode.Literal literal) {
      return kind + " " + literal.type() + " " + literal.value();
    } else if (node instanceof ParseNode.VarDecl decl) {
      return kind + " " + decl.keyword() + " " + decl.name();
    } else if (node instanceof ParseNode.Function function) {
      return kind + " " + function.name();
    } else if (node instanceof ParseNode.Assign assign) {
      return kind + " " + assign.operator();
    } else if (node instanceof ParseNode.Binary binary) {
      return kind + " " + binary.operator();
    } else if (node instanceof ParseNode.Unary unary) {
      return kind + " " + (unary.postfix() ? "postfix " : "") + unary.operator();
    } else if (node instanceof ParseNode.Member member) {
      return kind + " ." + member.property();
    } else if (node instanceof ParseNode.If ifNode) {
      return kind + " (" + ifNode.conditionText() + ")";
    } else if (node instanceof ParseNode.While whileNode) {
      return kind + " (" + whileNode.conditionText() + ")";
    } else if (node instanceof ParseNode.Error error) {
      return kind + " " + error.message();
    }
    return kind;
  }

  /** Accumulates nodes for a new ParseTree. */
  public static final class Builder {
    private final List<ParseNode> nodes = new ArrayList<>();

    /**
     * Adds the node returned by {@code factory}, which is passed the new node's handle. All of the
     * node's children must already have been added.
     *
     * @return the new node's handle
     */
    public int add(IntFunction<ParseNode> factory) {
      int id = nodes.size();
      ParseNode node = factory.apply(id);
      Preconditions.checkState(node.id() == id, "Node created with wrong id");
      for (int child : node.children()) {
        Preconditions.checkArgument(child >= 0 && child < id, "Bad child handle %s", child);
      }
      nodes.add(node);
      return id;
    }

    /** Returns a node that has already been added. */
    public ParseNode get(int id) {
      return nodes.get(id);
    }

    public ParseTree build(int root) {
      Preconditions.checkArgument(root >= 0 && root < nodes.size());
      return new ParseTree(ImmutableList.copyOf(nodes), root);
    }
  }
}
