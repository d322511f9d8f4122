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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.codescope.CompilerError.Kind;
import org.codescope.compiler.ParseNode.Block;
import org.codescope.compiler.ParseNode.For;
import org.codescope.compiler.ParseNode.ForClause;
import org.codescope.compiler.ParseNode.If;
import org.codescope.compiler.ParseNode.Program;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParserTest {

  private final Diagnostics diagnostics = new Diagnostics();

  private ParseTree parse(String source) {
    return Parser.parse(new Lexer().tokenize(source, diagnostics), diagnostics);
  }

  private static ImmutableList<String> tokenValues(ParseTree tree, ParseNode node) {
    return tree.children(node).stream()
        .map(n -> ((ParseNode.TokenLeaf) n).value())
        .collect(ImmutableList.toImmutableList());
  }

  private static ParseNode onlyStatement(ParseTree tree) {
    Program program = (Program) tree.root();
    assertThat(program.statements()).hasSize(1);
    return tree.node(program.statements().get(0));
  }

  @Test
  public void forLoopClauses() {
    ParseTree tree = parse("for(i=0;i<n;i++){x=x+1;}");
    assertThat(diagnostics.all()).isEmpty();
    For forNode = (For) onlyStatement(tree);
    ImmutableList<ParseNode> clauses = tree.children(forNode);
    assertThat(clauses.stream().map(ParseNode::kind))
        .containsExactly(
            ParseNode.Kind.FOR_INIT,
            ParseNode.Kind.FOR_CONDITION,
            ParseNode.Kind.FOR_INCREMENT,
            ParseNode.Kind.FOR_BODY)
        .inOrder();
    assertThat(tokenValues(tree, clauses.get(0))).containsExactly("i", "=", "0").inOrder();
    assertThat(tokenValues(tree, clauses.get(1))).containsExactly("i", "<", "n").inOrder();
    assertThat(tokenValues(tree, clauses.get(2))).containsExactly("i", "++").inOrder();
    assertThat(tokenValues(tree, clauses.get(3)))
        .containsExactly("x", "=", "x", "+", "1", ";")
        .inOrder();

    ForClause init = (ForClause) clauses.get(0);
    assertThat(init.text()).isEqualTo("i=0");
    assertThat(tree.node(init.parsed()).kind()).isEqualTo(ParseNode.Kind.EXPR);
    assertThat(tree.node(((ForClause) clauses.get(1)).parsed()).kind())
        .isEqualTo(ParseNode.Kind.BINARY);
    assertThat(tree.node(((ForClause) clauses.get(2)).parsed()).kind())
        .isEqualTo(ParseNode.Kind.UNARY);
    Block body = tree.node(((ForClause) clauses.get(3)).parsed(), Block.class);
    assertThat(body.statements()).hasSize(1);
  }

  @Test
  public void emptyForClauses() {
    ParseTree tree = parse("for (;;) {}");
    assertThat(diagnostics.all()).isEmpty();
    ImmutableList<ParseNode> clauses = tree.children(onlyStatement(tree));
    for (ParseNode clause : clauses.subList(0, 3)) {
      assertThat(clause.children()).isEmpty();
      assertThat(((ForClause) clause).parsed()).isEqualTo(ParseNode.NONE);
    }
    ForClause body = (ForClause) clauses.get(3);
    assertThat(tree.node(body.parsed(), Block.class).statements()).isEmpty();
  }

  @Test
  public void bracelessForBody() {
    ParseTree tree = parse("for (let i = 0; i < 3; i++) x = i;\ny = 1;");
    assertThat(diagnostics.all()).isEmpty();
    Program program = (Program) tree.root();
    assertThat(program.statements()).hasSize(2);
    For forNode = tree.node(program.statements().get(0), For.class);
    ForClause init = tree.node(forNode.init(), ForClause.class);
    assertThat(tree.node(init.parsed()).kind()).isEqualTo(ParseNode.Kind.VAR_DECL);
    ForClause body = tree.node(forNode.body(), ForClause.class);
    assertThat(tokenValues(tree, body)).containsExactly("x", "=", "i", ";").inOrder();
    assertThat(tree.node(body.parsed(), Block.class).statements()).hasSize(1);
  }

  @Test
  public void forHeaderMissingSemicolon() {
    ParseTree tree = parse("for (i = 0) { }\nlet z = 1;");
    assertThat(diagnostics.all())
        .containsExactly(
            Diagnostic.error(
                Kind.SYNTAX, "Unexpected token ')', missing ';' in for loop header", 1, 11));
    Program program = (Program) tree.root();
    assertThat(tree.node(program.statements().get(0)).kind()).isEqualTo(ParseNode.Kind.ERROR);
    assertThat(tree.node(program.statements().get(1)).kind()).isEqualTo(ParseNode.Kind.VAR_DECL);
  }

  @Test
  public void precedence() {
    ParseTree tree = parse("x = 1 + 2 * 3 << 1;");
    assertThat(tree.toString())
        .isEqualTo(
            String.join(
                "\n",
                "PROGRAM",
                "  EXPR",
                "    ASSIGN =",
                "      IDENTIFIER x",
                "      BINARY <<",
                "        BINARY +",
                "          LITERAL NUMBER 1",
                "          BINARY *",
                "            LITERAL NUMBER 2",
                "            LITERAL NUMBER 3",
                "        LITERAL NUMBER 1",
                ""));
  }

  @Test
  public void postfixChains() {
    ParseTree tree = parse("a.b[c](d, 'e').f++;");
    assertThat(diagnostics.all()).isEmpty();
    assertThat(tree.toString())
        .isEqualTo(
            String.join(
                "\n",
                "PROGRAM",
                "  EXPR",
                "    UNARY postfix ++",
                "      MEMBER .f",
                "        CALL",
                "          INDEX",
                "            MEMBER .b",
                "              IDENTIFIER a",
                "            IDENTIFIER c",
                "          IDENTIFIER d",
                "          LITERAL STRING e",
                ""));
  }

  @Test
  public void callIsNotAnIncrementTarget() {
    parse("f()++;");
    assertThat(diagnostics.all())
        .containsExactly(
            Diagnostic.error(Kind.SYNTAX, "Unexpected token '++', invalid increment target", 1, 4));
  }

  @Test
  public void ifElse() {
    ParseTree tree = parse("if (a > 1) { b(); } else c = [1, 2];");
    If ifNode = (If) onlyStatement(tree);
    assertThat(ifNode.conditionText()).isEqualTo("a > 1");
    assertThat(tree.node(ifNode.thenBranch()).kind()).isEqualTo(ParseNode.Kind.BLOCK);
    assertThat(tree.node(ifNode.elseBranch()).kind()).isEqualTo(ParseNode.Kind.EXPR);
  }

  @Test
  public void functionDeclaration() {
    ParseTree tree = parse("function add(a, b) { return a + b; }");
    ParseNode.Function function = (ParseNode.Function) onlyStatement(tree);
    assertThat(function.name()).isEqualTo("add");
    assertThat(function.params()).hasSize(2);
    Block body = tree.node(function.body(), Block.class);
    ParseNode.Return ret = tree.node(body.statements().get(0), ParseNode.Return.class);
    assertThat(ret.text()).isEqualTo("return a + b");
  }

  @Test
  public void recoversFromMultipleErrors() {
    ParseTree tree = parse("let = 5;\nlet y = 2;\nx = ;\n");
    assertThat(diagnostics.all())
        .containsExactly(
            Diagnostic.error(
                Kind.SYNTAX, "Unexpected token '=', expected identifier after 'let'", 1, 5),
            Diagnostic.error(Kind.SYNTAX, "Unexpected token ';', expected expression", 3, 5))
        .inOrder();
    Program program = (Program) tree.root();
    assertThat(program.statements().stream().map(id -> tree.node(id).kind()))
        .containsExactly(ParseNode.Kind.ERROR, ParseNode.Kind.VAR_DECL, ParseNode.Kind.ERROR)
        .inOrder();
  }

  @Test
  public void recoveryStopsAtEnclosingBlock() {
    ParseTree tree = parse("function f() {\n  x = = 1\n}\nlet after = 1;");
    assertThat(diagnostics.all())
        .containsExactly(
            Diagnostic.error(Kind.SYNTAX, "Unexpected token '=', expected expression", 2, 7));
    Program program = (Program) tree.root();
    assertThat(program.statements()).hasSize(2);
    ParseNode.Function function = tree.node(program.statements().get(0), ParseNode.Function.class);
    Block body = tree.node(function.body(), Block.class);
    assertThat(tree.node(body.statements().get(0)).kind()).isEqualTo(ParseNode.Kind.ERROR);
  }

  @Test
  public void strayCloseBrace() {
    ParseTree tree = parse("}\nlet a = 1;");
    assertThat(diagnostics.all())
        .containsExactly(
            Diagnostic.error(Kind.SYNTAX, "Unexpected token '}', expected expression", 1, 1));
    assertThat(((Program) tree.root()).statements()).hasSize(2);
  }

  @Test
  public void unterminatedBlockKeepsPartialTree() {
    ParseTree tree = parse("function f() {\n  let x = 1;\n");
    assertThat(diagnostics.all())
        .containsExactly(
            Diagnostic.error(Kind.SYNTAX, "Missing '}' to close block opened at line 1", 2, 13));
    ParseNode.Function function = (ParseNode.Function) onlyStatement(tree);
    assertThat(tree.node(function.body(), Block.class).statements()).hasSize(1);
  }

  @Test
  public void missingSemicolon() {
    parse("let a = 1\nlet b = 2;");
    assertThat(diagnostics.all())
        .containsExactly(
            Diagnostic.error(
                Kind.SYNTAX, "Unexpected token 'let', expected ';' at end of statement", 2, 1));
  }

  @Test
  public void emptyProgram() {
    ParseTree tree = parse("  // nothing here\n");
    assertThat(diagnostics.all()).isEmpty();
    assertThat(tree.root().kind()).isEqualTo(ParseNode.Kind.PROGRAM);
    assertThat(tree.root().children()).isEmpty();
  }

  @Test
  public void childHandlesPrecedeParents() {
    ParseTree tree =
        parse("function f(n) { for (let i = 0; i < n; i++) { if (i) { f(i); } } }\nlet q = ;");
    for (int id = 0; id < tree.size(); id++) {
      ParseNode node = tree.node(id);
      assertThat(node.id()).isEqualTo(id);
      for (int child : node.children()) {
        assertThat(child).isLessThan(id);
      }
    }
    assertThat(tree.rootId()).isEqualTo(tree.size() - 1);
  }

  @Test
  public void deterministic() {
    String source = "let a = [1, 2];\nwhile (a.length > 0) { a = a; }\nlet = ;";
    assertThat(parse(source)).isEqualTo(parse(source));
  }

  @Test
  public void nestingLimit() {
    ImmutableList<Token> tokens = new Lexer().tokenize("{ { { x; } } }");
    InternalFault fault =
        assertThrows(InternalFault.class, () -> Parser.parse(tokens, diagnostics, 2));
    assertThat(fault).hasMessageThat().startsWith("Nesting depth exceeds the limit of 2");
    assertThat(fault.line).isEqualTo(1);
    assertThat(fault.column).isEqualTo(5);
  }

  @Test
  public void chainedOperatorsCountTowardsNestingLimit() {
    assertThat(Parser.parse(new Lexer().tokenize("a + b;"), diagnostics, 3).size())
        .isGreaterThan(1);

    InternalFault binary =
        assertThrows(
            InternalFault.class,
            () -> Parser.parse(new Lexer().tokenize("a + b + c;"), diagnostics, 3));
    assertThat(binary.line).isEqualTo(1);
    assertThat(binary.column).isEqualTo(7);

    InternalFault member =
        assertThrows(
            InternalFault.class,
            () -> Parser.parse(new Lexer().tokenize("a.b.c;"), diagnostics, 3));
    assertThat(member.column).isEqualTo(4);
  }

  @Test
  public void nestingCountResetsAfterAChain() {
    // Each statement is within the limit on its own.
    ParseTree tree =
        Parser.parse(new Lexer().tokenize("a + b;\nc.d;\ng - h;"), diagnostics, 3);
    assertThat(tree.node(tree.rootId(), Program.class).statements()).hasSize(3);
    assertThat(diagnostics.all()).isEmpty();
  }
}
