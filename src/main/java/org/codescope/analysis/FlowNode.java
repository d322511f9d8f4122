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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;

/**
 * A node of a {@link ControlFlowGraph}. Each kind of node is a separate record carrying only the
 * fields that kind needs; nodes refer to their children by handle into the owning graph.
 *
 * <p>Straight-line flow is represented by {@link #next} edges, so a sequence of statements is a
 * chain rather than a list of siblings. Loops keep the edge back to their condition as an explicit
 * {@link LoopBack} leaf, so that the graph remains a tree.
 */
public interface FlowNode {

  /** The handle used for an absent child. */
  int NONE = -1;

  enum Kind {
    ENTRY,
    EXIT,
    STATEMENT,
    IF,
    FOR,
    WHILE,
    FUNCTION,
    LOOP_BACK
  }

  int id();

  Kind kind();

  int line();

  int column();

  /** The node's source text: a statement, a condition, or a function name. */
  String text();

  /** Handles of this node's children, in order; {@link #next} (if present) is always last. */
  ImmutableList<Integer> children();

  /** The handle of the node that follows this one, or {@link #NONE}. */
  default int next() {
    return NONE;
  }

  /** The calls and allocations this node performs itself (not those of its children). */
  default Effects effects() {
    return Effects.NONE;
  }

  <T> T accept(Visitor<T> visitor);

  interface Visitor<T> {
    T visitEntry(Entry node);

    T visitExit(Exit node);

    T visitStatement(Statement node);

    T visitBranch(Branch node);

    T visitLoop(Loop node);

    T visitFunction(Function node);

    T visitLoopBack(LoopBack node);
  }

  /**
   * What evaluating a node does besides control transfer.
   *
   * @param calls the names of the functions called, with multiplicity; a method call is named by
   *     its property (e.g. {@code log} for {@code console.log(x)})
   * @param allocates true if a growing structure is created: an array literal, or a call to {@code
   *     push}, {@code add} or {@code append}
   */
  record Effects(ImmutableMultiset<String> calls, boolean allocates) {
    public static final Effects NONE = new Effects(ImmutableMultiset.of(), false);
  }

  /** Returns the given handles in order, omitting any that are {@link #NONE}. */
  static ImmutableList<Integer> handles(int... ids) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (int id : ids) {
      if (id != NONE) {
        builder.add(id);
      }
    }
    return builder.build();
  }

  /** The root of every graph. */
  record Entry(int id, int next) implements FlowNode {
    @Override
    public Kind kind() {
      return Kind.ENTRY;
    }

    @Override
    public int line() {
      return 1;
    }

    @Override
    public int column() {
      return 1;
    }

    @Override
    public String text() {
      return "entry";
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(next);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitEntry(this);
    }
  }

  /** A {@code return}, or the implicit end of the program or of a function body. */
  record Exit(int id, int line, int column, String text, Effects effects) implements FlowNode {
    @Override
    public Kind kind() {
      return Kind.EXIT;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExit(this);
    }
  }

  record Statement(int id, int line, int column, String text, Effects effects, int next)
      implements FlowNode {
    @Override
    public Kind kind() {
      return Kind.STATEMENT;
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(next);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitStatement(this);
    }
  }

  /**
   * An IF decision. {@code whenFalse} is {@link #NONE} if there is no else branch; either branch
   * may also be NONE if it is empty.
   *
   * @param text the condition
   */
  record Branch(
      int id,
      int line,
      int column,
      String text,
      Effects effects,
      int whenTrue,
      int whenFalse,
      int next)
      implements FlowNode {
    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(whenTrue, whenFalse, next);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBranch(this);
    }
  }

  /**
   * A FOR or WHILE loop. Its children are the body chain (absent if the body is empty), then the
   * {@link LoopBack} leaf, then {@code next}. A FOR loop's initializer precedes it as a separate
   * STATEMENT, and its increment is the last node of the body chain.
   *
   * @param text the loop condition, empty if omitted
   * @param increment the FOR loop's increment text, empty if omitted (always empty for WHILE)
   * @param effects the calls and allocations of the condition
   */
  record Loop(
      int id,
      Kind kind,
      int line,
      int column,
      String text,
      String increment,
      Effects effects,
      int body,
      int loopBack,
      int next)
      implements FlowNode {
    static final ImmutableSet<Kind> KINDS = ImmutableSet.of(Kind.FOR, Kind.WHILE);

    public Loop {
      Preconditions.checkArgument(KINDS.contains(kind), "Not a loop: %s", kind);
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(body, loopBack, next);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLoop(this);
    }
  }

  /**
   * A function declaration, which appears in the flow where it was declared; its body chain always
   * ends in EXIT nodes.
   *
   * @param text the function's name
   */
  record Function(int id, int line, int column, String text, int body, int next)
      implements FlowNode {
    @Override
    public Kind kind() {
      return Kind.FUNCTION;
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(body, next);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFunction(this);
    }
  }

  /** The edge from the end of a loop body back to its condition. */
  record LoopBack(int id, int line, int column, int target) implements FlowNode {
    @Override
    public Kind kind() {
      return Kind.LOOP_BACK;
    }

    @Override
    public String text() {
      return "loop back";
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLoopBack(this);
    }
  }
}
