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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.codescope.analysis.FlowNode.Branch;
import org.codescope.analysis.FlowNode.Effects;
import org.codescope.analysis.FlowNode.Exit;
import org.codescope.analysis.FlowNode.Loop;
import org.codescope.compiler.InternalFault;
import org.jspecify.annotations.Nullable;

/**
 * Estimates the complexity of a program from its control-flow graph. The time and space estimates
 * are heuristics, not bounds:
 *
 * <ul>
 *   <li>Each loop adds a linear factor, except that a FOR loop whose increment multiplies, divides
 *       or shifts its variable adds a logarithmic factor. Loops in sequence take the maximum; loops
 *       that nest multiply.
 *   <li>A call to a function declared in the program costs what that function's body costs.
 *   <li>A function that is part of a cycle in the call graph is recursive. If it can make two or
 *       more recursive calls along one path through its body, or makes one inside a loop, the
 *       program is O(2^n). Otherwise the recursion adds one linear factor.
 *   <li>Space is O(n) if a growing structure (an array literal, or a {@code push}, {@code add} or
 *       {@code append} call) is created inside a loop, or if there is any recursion; else O(1).
 * </ul>
 */
public final class ComplexityEstimator {

  /** Matches the increment of a loop whose variable grows or shrinks geometrically. */
  private static final Pattern MULTIPLICATIVE_INCREMENT =
      Pattern.compile("\\*=|/=|<<=|>>=|^\\s*(\\w+)\\s*=\\s*\\1\\s*(\\*|/|<<|>>)");

  /** A polynomial-logarithmic cost, n^linear * log(n)^log. */
  record Cost(int linear, int log) implements Comparable<Cost> {
    static final Cost CONSTANT = new Cost(0, 0);

    Cost plus(Cost other) {
      return new Cost(linear + other.linear, log + other.log);
    }

    static Cost max(Cost a, Cost b) {
      return (a.compareTo(b) >= 0) ? a : b;
    }

    @Override
    public int compareTo(Cost other) {
      return (linear != other.linear)
          ? Integer.compare(linear, other.linear)
          : Integer.compare(log, other.log);
    }

    @Override
    public String toString() {
      if (linear == 0 && log == 0) {
        return "O(1)";
      }
      StringBuilder sb = new StringBuilder("O(");
      if (linear > 0) {
        sb.append(linear == 1 ? "n" : "n^" + linear);
      }
      if (log > 0) {
        if (linear > 0) {
          sb.append(' ');
        }
        sb.append(log == 1 ? "log n" : "log^" + log + " n");
      }
      return sb.append(')').toString();
    }
  }

  /**
   * The most recursive calls made along paths through a chain. {@code exited} covers paths that
   * reach an EXIT and {@code through} those that fall off the end of the chain; either is -1 if
   * there are no such paths.
   */
  private record Paths(int exited, int through, boolean inLoop) {
    int max() {
      return Math.max(exited, through);
    }
  }

  private final ControlFlowGraph graph;

  /** The first declaration of each function name. */
  private final Map<String, FlowNode.Function> functions = new LinkedHashMap<>();

  /** For each function, the functions reachable from it through one or more calls. */
  private final Map<String, Set<String>> reachable = new HashMap<>();

  private final Map<String, Cost> functionCosts = new HashMap<>();
  private final Set<String> inProgress = new HashSet<>();

  /** The function whose cost is being computed, if any. */
  private @Nullable String costing;
  private final Set<String> rationale = new LinkedHashSet<>();

  private ComplexityEstimator(ControlFlowGraph graph) {
    this.graph = graph;
  }

  /**
   * Returns the complexity estimates for the given graph.
   *
   * @throws InternalFault if there is no graph
   */
  public static ComplexityInfo estimate(@Nullable ControlFlowGraph graph) {
    if (graph == null) {
      throw new InternalFault("Complexity estimation requires a control flow graph");
    }
    return new ComplexityEstimator(graph).estimate();
  }

  private ComplexityInfo estimate() {
    int cyclomatic =
        (int)
                (graph.count(FlowNode.Kind.IF)
                    + graph.count(FlowNode.Kind.FOR)
                    + graph.count(FlowNode.Kind.WHILE))
            + 1;
    for (FlowNode node : graph.nodes()) {
      if (node instanceof FlowNode.Function function) {
        functions.putIfAbsent(function.text(), function);
      }
    }
    buildCallGraph();

    boolean exponential = false;
    for (String name : functions.keySet()) {
      if (isRecursive(name) && isExponential(name)) {
        exponential = true;
      }
    }
    String time;
    if (exponential) {
      time = "O(2^n)";
    } else {
      Cost cost = chainCost(graph.entry().next());
      for (String name : functions.keySet()) {
        cost = Cost.max(cost, functionCost(name));
      }
      time = cost.toString();
    }
    String space = spaceComplexity();
    return new ComplexityInfo(cyclomatic, time, space, ImmutableList.copyOf(rationale));
  }

  // Call graph

  private void buildCallGraph() {
    Map<String, Set<String>> callees = new HashMap<>();
    for (FlowNode.Function function : functions.values()) {
      Set<String> called = new LinkedHashSet<>();
      forEachNode(
          function.body(),
          node -> {
            for (String name : node.effects().calls().elementSet()) {
              if (functions.containsKey(name)) {
                called.add(name);
              }
            }
          });
      callees.put(function.text(), called);
    }
    for (String name : functions.keySet()) {
      Set<String> seen = new HashSet<>();
      Deque<String> pending = new ArrayDeque<>(callees.get(name));
      while (!pending.isEmpty()) {
        String next = pending.pop();
        if (seen.add(next)) {
          pending.addAll(callees.get(next));
        }
      }
      reachable.put(name, seen);
    }
  }

  private boolean isRecursive(String name) {
    return reachable.get(name).contains(name);
  }

  /** True if a call from {@code caller} to {@code callee} may lead back to {@code caller}. */
  private boolean inCycle(String caller, String callee) {
    Set<String> fromCallee = reachable.get(callee);
    return fromCallee != null && fromCallee.contains(caller);
  }

  private int recursiveCalls(Effects effects, String function) {
    int count = 0;
    for (String name : effects.calls().elementSet()) {
      if (inCycle(function, name)) {
        count += effects.calls().count(name);
      }
    }
    return count;
  }

  /**
   * Calls {@code action} on each node of the chain starting at {@code id} and on their
   * descendants, not including the bodies of nested functions.
   */
  private void forEachNode(int id, Consumer<FlowNode> action) {
    Deque<Integer> pending = new ArrayDeque<>();
    if (id != FlowNode.NONE) {
      pending.push(id);
    }
    while (!pending.isEmpty()) {
      FlowNode node = graph.node(pending.pop());
      action.accept(node);
      if (node instanceof FlowNode.Function) {
        if (node.next() != FlowNode.NONE) {
          pending.push(node.next());
        }
      } else {
        node.children().forEach(pending::push);
      }
    }
  }

  // Recursion

  private boolean isExponential(String name) {
    Paths paths = recursivePaths(functions.get(name).body(), name);
    if (paths.inLoop()) {
      rationale.add(String.format("Function '%s' makes a recursive call inside a loop", name));
      return true;
    } else if (paths.max() >= 2) {
      rationale.add(
          String.format(
              "Function '%s' makes %s recursive calls along one path", name, paths.max()));
      return true;
    }
    return false;
  }

  private static int plus(int a, int b) {
    return (a < 0 || b < 0) ? -1 : a + b;
  }

  private Paths recursivePaths(int id, String function) {
    int exited = -1;
    int through = 0;
    boolean inLoop = false;
    while (id != FlowNode.NONE && through >= 0) {
      FlowNode node = graph.node(id);
      int calls = recursiveCalls(node.effects(), function);
      if (node instanceof Exit) {
        exited = Math.max(exited, through + calls);
        through = -1;
      } else if (node instanceof Branch branch) {
        through += calls;
        Paths whenTrue = recursivePaths(branch.whenTrue(), function);
        Paths whenFalse = recursivePaths(branch.whenFalse(), function);
        inLoop |= whenTrue.inLoop() || whenFalse.inLoop();
        exited =
            Math.max(
                exited,
                Math.max(plus(through, whenTrue.exited()), plus(through, whenFalse.exited())));
        through =
            Math.max(plus(through, whenTrue.through()), plus(through, whenFalse.through()));
      } else if (node instanceof Loop loop) {
        Paths body = recursivePaths(loop.body(), function);
        inLoop |= calls > 0 || body.inLoop() || body.max() > 0;
        through += calls;
        exited = Math.max(exited, plus(through, body.exited()));
      } else {
        through += calls;
      }
      id = node.next();
    }
    return new Paths(exited, through, inLoop);
  }

  // Time

  private Cost functionCost(String name) {
    Cost cost = functionCosts.get(name);
    if (cost != null) {
      return cost;
    } else if (!inProgress.add(name)) {
      return Cost.CONSTANT;
    }
    String outer = costing;
    costing = name;
    cost = chainCost(functions.get(name).body());
    costing = outer;
    if (isRecursive(name)) {
      rationale.add(
          String.format("Function '%s' is linearly recursive, adding a linear factor", name));
      cost = cost.plus(new Cost(1, 0));
    }
    inProgress.remove(name);
    functionCosts.put(name, cost);
    return cost;
  }

  /** Returns the cost of the calls in {@code effects}, other than recursive ones. */
  private Cost callCost(Effects effects) {
    Cost cost = Cost.CONSTANT;
    for (String name : effects.calls().elementSet()) {
      if (functions.containsKey(name) && (costing == null || !inCycle(costing, name))) {
        cost = Cost.max(cost, functionCost(name));
      }
    }
    return cost;
  }

  /** Returns the cost of the most expensive node of the chain starting at {@code id}. */
  private Cost chainCost(int id) {
    Cost cost = Cost.CONSTANT;
    for (; id != FlowNode.NONE; id = graph.node(id).next()) {
      cost = Cost.max(cost, graph.node(id).accept(nodeCost));
    }
    return cost;
  }

  private final FlowNode.Visitor<Cost> nodeCost =
      new FlowNode.Visitor<>() {
        @Override
        public Cost visitEntry(FlowNode.Entry node) {
          return Cost.CONSTANT;
        }

        @Override
        public Cost visitExit(Exit node) {
          return callCost(node.effects());
        }

        @Override
        public Cost visitStatement(FlowNode.Statement node) {
          return callCost(node.effects());
        }

        @Override
        public Cost visitBranch(Branch node) {
          return Cost.max(
              callCost(node.effects()),
              Cost.max(chainCost(node.whenTrue()), chainCost(node.whenFalse())));
        }

        @Override
        public Cost visitLoop(Loop node) {
          Cost level;
          if (node.kind() == FlowNode.Kind.FOR
              && MULTIPLICATIVE_INCREMENT.matcher(node.increment()).find()) {
            rationale.add(
                String.format(
                    "FOR loop at line %s has a multiplicative increment '%s', adding a logarithmic"
                        + " factor",
                    node.line(),
                    node.increment()));
            level = new Cost(0, 1);
          } else {
            rationale.add(
                String.format("%s loop at line %s adds a linear factor", node.kind(), node.line()));
            level = new Cost(1, 0);
          }
          return level.plus(Cost.max(callCost(node.effects()), chainCost(node.body())));
        }

        @Override
        public Cost visitFunction(FlowNode.Function node) {
          return Cost.CONSTANT;
        }

        @Override
        public Cost visitLoopBack(FlowNode.LoopBack node) {
          return Cost.CONSTANT;
        }
      };

  // Space

  private String spaceComplexity() {
    boolean linear = false;
    for (FlowNode node : graph.nodes()) {
      if (node instanceof Loop loop) {
        boolean[] allocates = {loop.effects().allocates()};
        forEachNode(loop.body(), n -> allocates[0] |= n.effects().allocates());
        if (allocates[0]) {
          rationale.add(
              String.format(
                  "%s loop at line %s creates a growing structure", loop.kind(), loop.line()));
          linear = true;
        }
      }
    }
    ImmutableSet<String> recursive =
        functions.keySet().stream()
            .filter(this::isRecursive)
            .collect(ImmutableSet.toImmutableSet());
    if (!recursive.isEmpty()) {
      rationale.add(
          String.format(
              "Recursion in %s uses stack space proportional to its depth",
              String.join(", ", recursive)));
      linear = true;
    }
    return linear ? "O(n)" : "O(1)";
  }
}
