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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.codescope.analysis.FlowNode.Effects;
import org.codescope.compiler.InternalFault;
import org.codescope.compiler.ParseNode;
import org.codescope.compiler.ParseNode.ArrayLiteral;
import org.codescope.compiler.ParseNode.Block;
import org.codescope.compiler.ParseNode.Call;
import org.codescope.compiler.ParseNode.ExprStatement;
import org.codescope.compiler.ParseNode.For;
import org.codescope.compiler.ParseNode.ForClause;
import org.codescope.compiler.ParseNode.Identifier;
import org.codescope.compiler.ParseNode.If;
import org.codescope.compiler.ParseNode.Member;
import org.codescope.compiler.ParseNode.Return;
import org.codescope.compiler.ParseNode.VarDecl;
import org.codescope.compiler.ParseNode.While;
import org.codescope.compiler.ParseTree;
import org.jspecify.annotations.Nullable;

/**
 * Derives a {@link ControlFlowGraph} from a ParseTree.
 *
 * <p>The graph is built in two passes. The first translates statements into mutable {@link Draft}s
 * linked top-down; the second numbers the drafts in preorder and freezes them into FlowNodes.
 * Statements that follow a {@code return} in the same statement list are left out, since no path
 * reaches them. Statements that failed to parse (ERROR nodes) are also left out.
 */
public final class ControlFlowBuilder {

  /** Calls to methods with these names are taken to grow the receiver. */
  private static final ImmutableSet<String> GROWING_METHODS =
      ImmutableSet.of("push", "add", "append");

  private final ParseTree tree;

  private ControlFlowBuilder(ParseTree tree) {
    this.tree = tree;
  }

  /**
   * Returns the control-flow graph of the given program.
   *
   * @throws InternalFault if there is no tree, or if the graph does not have exactly one ENTRY and
   *     at least one EXIT
   */
  public static ControlFlowGraph build(@Nullable ParseTree tree) {
    if (tree == null) {
      throw new InternalFault("Control flow analysis requires a parse tree");
    }
    ParseNode.Program program = tree.node(tree.rootId(), ParseNode.Program.class);
    ControlFlowBuilder builder = new ControlFlowBuilder(tree);
    Draft entry = builder.draft(FlowNode.Kind.ENTRY, program);
    entry.next = builder.sequence(program.statements(), true, endOf(tree));
    ControlFlowGraph graph = builder.freeze(entry);
    InternalFault.check(
        graph.count(FlowNode.Kind.ENTRY) == 1, "Control flow graph must have exactly one ENTRY");
    InternalFault.check(
        graph.reachable().stream().anyMatch(n -> n.kind() == FlowNode.Kind.EXIT),
        "Control flow graph has no reachable EXIT");
    return graph;
  }

  /** A FlowNode under construction. Which fields are used depends on {@link #kind}. */
  private static final class Draft {
    final FlowNode.Kind kind;
    final int line;
    final int column;
    String text = "";
    String increment = "";
    Effects effects = Effects.NONE;

    /** The loop body, the true branch, or the function body. */
    @Nullable Draft first;

    /** The false branch, or the loop-back leaf. */
    @Nullable Draft second;

    @Nullable Draft next;

    /** The loop that a LOOP_BACK returns to. */
    @Nullable Draft target;

    int id = FlowNode.NONE;

    Draft(FlowNode.Kind kind, int line, int column) {
      this.kind = kind;
      this.line = line;
      this.column = column;
    }
  }

  /** A chain of drafts linked by {@code next}. */
  private static final class Chain {
    @Nullable Draft head;
    @Nullable Draft tail;

    void add(Draft draft) {
      if (head == null) {
        head = draft;
      } else {
        tail.next = draft;
      }
      tail = draft;
    }

    /** True once the chain ends in an EXIT; nothing may follow it. */
    boolean terminated() {
      return tail != null && tail.kind == FlowNode.Kind.EXIT;
    }
  }

  private static Draft draft(FlowNode.Kind kind, int line, int column) {
    return new Draft(kind, line, column);
  }

  private static Draft draft(FlowNode.Kind kind, ParseNode at) {
    return draft(kind, at.line(), at.column());
  }

  /** The position of the last node of the program, used for its implicit EXIT. */
  private static int[] endOf(ParseTree tree) {
    int line = 1;
    int column = 1;
    for (int i = 0; i < tree.size(); i++) {
      ParseNode node = tree.node(i);
      if (node.line() > line || (node.line() == line && node.column() > column)) {
        line = node.line();
        column = node.column();
      }
    }
    return new int[] {line, column};
  }

  /**
   * Returns the head of a chain for the given statements, or null if there are none and no EXIT
   * is required.
   *
   * @param withExit if true, the chain ends in an EXIT (added at {@code end} if the statements do
   *     not already end in one)
   */
  private @Nullable Draft sequence(List<Integer> statements, boolean withExit, int[] end) {
    Chain chain = new Chain();
    addAll(chain, statements);
    if (withExit && !chain.terminated()) {
      Draft exit = draft(FlowNode.Kind.EXIT, end[0], end[1]);
      exit.text = "end";
      chain.add(exit);
    }
    return chain.head;
  }

  private void addAll(Chain chain, List<Integer> statements) {
    for (int id : statements) {
      if (chain.terminated()) {
        return;
      }
      add(chain, id);
    }
  }

  /** Returns the chain for a branch or loop body, which may be a Block or a single statement. */
  private @Nullable Draft body(int id) {
    if (id == ParseNode.NONE) {
      return null;
    }
    Chain chain = new Chain();
    add(chain, id);
    return chain.head;
  }

  /** Adds the drafts for one statement to the chain. */
  private void add(Chain chain, int id) {
    ParseNode node = tree.node(id);
    if (node instanceof Block block) {
      addAll(chain, block.statements());
    } else if (node instanceof VarDecl decl) {
      chain.add(statement(decl, decl.text()));
    } else if (node instanceof ExprStatement expr) {
      chain.add(statement(expr, expr.text()));
    } else if (node instanceof Return ret) {
      Draft exit = draft(FlowNode.Kind.EXIT, ret);
      exit.text = ret.text();
      exit.effects = effects(ret);
      chain.add(exit);
    } else if (node instanceof If ifNode) {
      Draft branch = draft(FlowNode.Kind.IF, ifNode);
      branch.text = ifNode.conditionText();
      branch.effects = effects(tree.node(ifNode.condition()));
      branch.first = body(ifNode.thenBranch());
      branch.second = body(ifNode.elseBranch());
      chain.add(branch);
    } else if (node instanceof While whileNode) {
      Draft loop = draft(FlowNode.Kind.WHILE, whileNode);
      loop.text = whileNode.conditionText();
      loop.effects = effects(tree.node(whileNode.condition()));
      loop.first = body(whileNode.body());
      loop.second = loopBack(loop);
      chain.add(loop);
    } else if (node instanceof For forNode) {
      addFor(chain, forNode);
    } else if (node instanceof ParseNode.Function function) {
      Draft draft = draft(FlowNode.Kind.FUNCTION, function);
      draft.text = function.name();
      Block body = tree.node(function.body(), Block.class);
      draft.first = sequence(body.statements(), true, new int[] {body.line(), body.column()});
      chain.add(draft);
    } else if (!(node instanceof ParseNode.Error)) {
      throw new InternalFault(
          String.format("Unexpected %s in statement position", node.kind()),
          node.line(),
          node.column());
    }
  }

  private void addFor(Chain chain, For forNode) {
    ForClause init = tree.node(forNode.init(), ForClause.class);
    ForClause condition = tree.node(forNode.condition(), ForClause.class);
    ForClause increment = tree.node(forNode.increment(), ForClause.class);
    ForClause body = tree.node(forNode.body(), ForClause.class);
    if (init.parsed() != ParseNode.NONE) {
      chain.add(statement(init, init.text()));
    }
    Draft loop = draft(FlowNode.Kind.FOR, forNode);
    loop.text = condition.text();
    loop.increment = increment.text();
    loop.effects = effects(condition);
    Chain bodyChain = new Chain();
    if (body.parsed() != ParseNode.NONE) {
      addAll(bodyChain, tree.node(body.parsed(), Block.class).statements());
    }
    if (increment.parsed() != ParseNode.NONE && !bodyChain.terminated()) {
      bodyChain.add(statement(increment, increment.text()));
    }
    loop.first = bodyChain.head;
    loop.second = loopBack(loop);
    chain.add(loop);
  }

  private Draft statement(ParseNode node, String text) {
    Draft draft = draft(FlowNode.Kind.STATEMENT, node);
    draft.text = text;
    draft.effects = effects(node);
    return draft;
  }

  private static Draft loopBack(Draft loop) {
    Draft draft = draft(FlowNode.Kind.LOOP_BACK, loop.line, loop.column);
    draft.target = loop;
    return draft;
  }

  /** Returns the calls and allocations made by evaluating the given subtree. */
  private Effects effects(ParseNode root) {
    ImmutableMultiset.Builder<String> calls = ImmutableMultiset.builder();
    boolean allocates = false;
    Deque<ParseNode> pending = new ArrayDeque<>();
    pending.push(root);
    while (!pending.isEmpty()) {
      ParseNode node = pending.pop();
      if (node instanceof ForClause clause) {
        // A clause's tokens duplicate its structured form.
        if (clause.parsed() != ParseNode.NONE) {
          pending.push(tree.node(clause.parsed()));
        }
        continue;
      }
      if (node instanceof ArrayLiteral) {
        allocates = true;
      } else if (node instanceof Call call) {
        String name = calleeName(tree.node(call.callee()));
        if (name != null) {
          calls.add(name);
          allocates |= GROWING_METHODS.contains(name.substring(name.lastIndexOf('.') + 1));
        }
      }
      for (ParseNode child : tree.children(node)) {
        pending.push(child);
      }
    }
    ImmutableMultiset<String> called = calls.build();
    return (called.isEmpty() && !allocates) ? Effects.NONE : new Effects(called, allocates);
  }

  private static @Nullable String calleeName(ParseNode callee) {
    if (callee instanceof Identifier identifier) {
      return identifier.name();
    } else if (callee instanceof Member member) {
      return member.property();
    }
    return null;
  }

  /** Numbers the drafts reachable from {@code entry} in preorder and freezes them. */
  private ControlFlowGraph freeze(Draft entry) {
    List<Draft> ordered = new ArrayList<>();
    Deque<Draft> pending = new ArrayDeque<>();
    pending.push(entry);
    while (!pending.isEmpty()) {
      Draft draft = pending.pop();
      draft.id = ordered.size();
      ordered.add(draft);
      // Push in reverse so that children are numbered in order.
      for (Draft child : reversed(draft.first, draft.second, draft.next)) {
        pending.push(child);
      }
    }
    ImmutableList.Builder<FlowNode> nodes = ImmutableList.builderWithExpectedSize(ordered.size());
    for (Draft draft : ordered) {
      nodes.add(freezeNode(draft));
    }
    return new ControlFlowGraph(nodes.build());
  }

  private static List<Draft> reversed(@Nullable Draft... drafts) {
    List<Draft> result = new ArrayList<>();
    for (int i = drafts.length - 1; i >= 0; i--) {
      if (drafts[i] != null) {
        result.add(drafts[i]);
      }
    }
    return result;
  }

  private static int id(@Nullable Draft draft) {
    return (draft == null) ? FlowNode.NONE : draft.id;
  }

  private static FlowNode freezeNode(Draft d) {
    return switch (d.kind) {
      case ENTRY -> new FlowNode.Entry(d.id, id(d.next));
      case EXIT -> new FlowNode.Exit(d.id, d.line, d.column, d.text, d.effects);
      case STATEMENT ->
          new FlowNode.Statement(d.id, d.line, d.column, d.text, d.effects, id(d.next));
      case IF ->
          new FlowNode.Branch(
              d.id, d.line, d.column, d.text, d.effects, id(d.first), id(d.second), id(d.next));
      case FOR, WHILE ->
          new FlowNode.Loop(
              d.id,
              d.kind,
              d.line,
              d.column,
              d.text,
              d.increment,
              d.effects,
              id(d.first),
              id(d.second),
              id(d.next));
      case FUNCTION ->
          new FlowNode.Function(d.id, d.line, d.column, d.text, id(d.first), id(d.next));
      case LOOP_BACK -> new FlowNode.LoopBack(d.id, d.line, d.column, id(d.target));
    };
  }
}
