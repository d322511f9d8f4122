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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.codescope.analysis.FlowNode.Kind;
import org.codescope.compiler.Diagnostics;
import org.codescope.compiler.InternalFault;
import org.codescope.compiler.Lexer;
import org.codescope.compiler.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ControlFlowBuilderTest {

  private static ControlFlowGraph build(String source) {
    Diagnostics diagnostics = new Diagnostics();
    return ControlFlowBuilder.build(
        Parser.parse(new Lexer().tokenize(source, diagnostics), diagnostics));
  }

  private static String render(String... lines) {
    return String.join("\n", lines) + "\n";
  }

  @Test
  public void straightLine() {
    ControlFlowGraph graph = build("let x = 1;\nx = x + 1;");
    assertThat(graph.toString())
        .isEqualTo(render("ENTRY entry", "STATEMENT let x = 1", "STATEMENT x = x + 1", "EXIT end"));
    assertThat(graph.entry().id()).isEqualTo(0);
    assertThat(graph.node(3).line()).isEqualTo(2);
  }

  @Test
  public void emptyProgram() {
    ControlFlowGraph graph = build("");
    assertThat(graph.toString()).isEqualTo(render("ENTRY entry", "EXIT end"));
  }

  @Test
  public void ifElse() {
    ControlFlowGraph graph = build("if (a) { b = 1; } else { b = 2; }\nc();");
    assertThat(graph.toString())
        .isEqualTo(
            render(
                "ENTRY entry",
                "IF a",
                "  STATEMENT b = 1",
                "  STATEMENT b = 2",
                "STATEMENT c()",
                "EXIT end"));
    FlowNode.Branch branch = (FlowNode.Branch) graph.node(1);
    assertThat(graph.node(branch.whenTrue()).text()).isEqualTo("b = 1");
    assertThat(graph.node(branch.whenFalse()).text()).isEqualTo("b = 2");
    assertThat(graph.node(branch.next()).text()).isEqualTo("c()");
  }

  @Test
  public void ifWithoutElse() {
    FlowNode.Branch branch = (FlowNode.Branch) build("if (a) b = 1;").node(1);
    assertThat(branch.whenTrue()).isNotEqualTo(FlowNode.NONE);
    assertThat(branch.whenFalse()).isEqualTo(FlowNode.NONE);
    assertThat(branch.children()).hasSize(2);
  }

  @Test
  public void whileLoop() {
    ControlFlowGraph graph = build("while (i < 3) { i++; }");
    assertThat(graph.toString())
        .isEqualTo(
            render(
                "ENTRY entry", "WHILE i < 3", "  STATEMENT i++", "  LOOP_BACK -> 1", "EXIT end"));
    FlowNode.Loop loop = (FlowNode.Loop) graph.node(1);
    FlowNode.LoopBack loopBack = (FlowNode.LoopBack) graph.node(loop.loopBack());
    assertThat(loopBack.target()).isEqualTo(loop.id());
    assertThat(loop.children())
        .containsExactly(loop.body(), loop.loopBack(), loop.next())
        .inOrder();
  }

  @Test
  public void forLoop() {
    ControlFlowGraph graph = build("for (let i = 0; i < n; i++) { s = s + i; }");
    assertThat(graph.toString())
        .isEqualTo(
            render(
                "ENTRY entry",
                "STATEMENT let i = 0",
                "FOR i < n",
                "  STATEMENT s = s + i",
                "  STATEMENT i++",
                "  LOOP_BACK -> 2",
                "EXIT end"));
    assertThat(((FlowNode.Loop) graph.node(2)).increment()).isEqualTo("i++");
  }

  @Test
  public void emptyForLoop() {
    ControlFlowGraph graph = build("for (;;) {}");
    assertThat(graph.toString())
        .isEqualTo(render("ENTRY entry", "FOR", "  LOOP_BACK -> 1", "EXIT end"));
    assertThat(((FlowNode.Loop) graph.node(1)).body()).isEqualTo(FlowNode.NONE);
  }

  @Test
  public void functionWithSeveralReturns() {
    ControlFlowGraph graph =
        build("function sign(x) {\n  if (x < 0) { return -1; }\n  return 1;\n}\nsign(2);");
    assertThat(graph.toString())
        .isEqualTo(
            render(
                "ENTRY entry",
                "FUNCTION sign",
                "  IF x < 0",
                "    EXIT return -1",
                "  EXIT return 1",
                "STATEMENT sign(2)",
                "EXIT end"));
    assertThat(graph.count(Kind.EXIT)).isEqualTo(3);
  }

  @Test
  public void functionBodyGetsImplicitExit() {
    ControlFlowGraph graph = build("function f() { g(); }");
    assertThat(graph.toString())
        .isEqualTo(
            render("ENTRY entry", "FUNCTION f", "  STATEMENT g()", "  EXIT end", "EXIT end"));
  }

  @Test
  public void codeAfterReturnIsOmitted() {
    ControlFlowGraph graph = build("let a = 1;\nreturn;\nlet b = 2;");
    assertThat(graph.toString())
        .isEqualTo(render("ENTRY entry", "STATEMENT let a = 1", "EXIT return"));
  }

  @Test
  public void effects() {
    ControlFlowGraph graph =
        build("let a = [];\nfor (let i = 0; i < n(); i++) { a.push(f(i), f(i + 1)); }");
    FlowNode first = graph.node(graph.entry().next());
    assertThat(first.effects().allocates()).isTrue();
    assertThat(first.effects().calls()).isEmpty();

    FlowNode.Loop loop =
        (FlowNode.Loop)
            graph.nodes().stream().filter(n -> n.kind() == Kind.FOR).findFirst().get();
    assertThat(loop.effects().calls()).containsExactly("n");
    FlowNode push = graph.node(loop.body());
    assertThat(push.text()).isEqualTo("a.push(f(i), f(i + 1))");
    assertThat(push.effects().calls()).containsExactly("push", "f", "f");
    assertThat(push.effects().allocates()).isTrue();
    FlowNode increment = graph.node(push.next());
    assertThat(increment.effects()).isEqualTo(FlowNode.Effects.NONE);
  }

  @Test
  public void handlesArePreorder() {
    ControlFlowGraph graph =
        build(
            "function f(n) {\n"
                + "  while (n > 0) {\n"
                + "    if (n % 2 == 0) { n = n / 2; } else { n = n - 1; }\n"
                + "  }\n"
                + "  return n;\n"
                + "}\n"
                + "for (let i = 0; i < 3; i++) { f(i); }");
    for (FlowNode node : graph.nodes()) {
      assertThat(node.id()).isEqualTo(graph.nodes().indexOf(node));
      for (int child : node.children()) {
        assertThat(child).isGreaterThan(node.id());
      }
      if (node instanceof FlowNode.LoopBack loopBack) {
        assertThat(graph.node(loopBack.target()).kind()).isAnyOf(Kind.FOR, Kind.WHILE);
      }
    }
    assertThat(graph.reachable()).containsExactlyElementsIn(graph.nodes()).inOrder();
  }

  @Test
  public void oneEntryAndAReachableExitDespiteErrors() {
    ControlFlowGraph graph = build("let = ;\nwhile (x) {\n  if (y { z(); }\n");
    assertThat(graph.count(Kind.ENTRY)).isEqualTo(1);
    assertThat(graph.reachable().stream().anyMatch(n -> n.kind() == Kind.EXIT)).isTrue();
  }

  @Test
  public void deterministic() {
    String source = "function f(n) { return n; }\nwhile (f(1)) { if (a) { b(); } }";
    assertThat(build(source)).isEqualTo(build(source));
    assertThat(build(source).hashCode()).isEqualTo(build(source).hashCode());
  }

  @Test
  public void requiresATree() {
    assertThrows(InternalFault.class, () -> ControlFlowBuilder.build(null));
  }
}
