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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import org.codescope.CompilerError.Kind;

/**
 * A base class for ParseTree visitors that provides two useful functions:
 *
 * <ul>
 *   <li>Every visit method that a subclass doesn't override throws an AssertionError, rather than
 *       silently doing nothing; a visitor that reaches a node kind it wasn't written for is a bug,
 *       and failing loudly makes it easier to find.
 *   <li>It tracks the node currently being visited and provides diagnostic methods that use that
 *       node as the location.
 * </ul>
 */
public abstract class VisitorBase<T> implements ParseNode.Visitor<T> {

  protected final ParseTree tree;
  protected final Diagnostics diagnostics;

  /** The node currently being visited. */
  private ParseNode currentNode;

  protected VisitorBase(ParseTree tree, Diagnostics diagnostics) {
    this.tree = tree;
    this.diagnostics = diagnostics;
  }

  /** Visits the node with the given handle, binding it as the current node for the duration. */
  @CanIgnoreReturnValue
  public final T visit(int id) {
    ParseNode prevNode = currentNode;
    currentNode = tree.node(id);
    try {
      return currentNode.accept(this);
    } finally {
      currentNode = prevNode;
    }
  }

  /** Returns the node currently being visited. */
  protected ParseNode currentNode() {
    return currentNode;
  }

  /** Reports a SEMANTIC error located at the current node. */
  @FormatMethod
  protected void error(String fmt, Object... fmtArgs) {
    diagnostics.error(Kind.SEMANTIC, currentNode.line(), currentNode.column(), fmt, fmtArgs);
  }

  /** Reports a SEMANTIC error located at the given node. */
  @FormatMethod
  protected void errorAt(ParseNode node, String fmt, Object... fmtArgs) {
    diagnostics.error(Kind.SEMANTIC, node.line(), node.column(), fmt, fmtArgs);
  }

  /** Reports a SEMANTIC warning located at the given node. */
  @FormatMethod
  protected void warningAt(ParseNode node, String fmt, Object... fmtArgs) {
    diagnostics.warning(Kind.SEMANTIC, node.line(), node.column(), fmt, fmtArgs);
  }

  @Override
  public T visitProgram(ParseNode.Program node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitBlock(ParseNode.Block node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitVarDecl(ParseNode.VarDecl node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitFunction(ParseNode.Function node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitReturn(ParseNode.Return node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitIf(ParseNode.If node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitWhile(ParseNode.While node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitFor(ParseNode.For node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitForClause(ParseNode.ForClause node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitExprStatement(ParseNode.ExprStatement node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitAssign(ParseNode.Assign node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitBinary(ParseNode.Binary node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitUnary(ParseNode.Unary node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitCall(ParseNode.Call node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitMember(ParseNode.Member node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitIndex(ParseNode.Index node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitArrayLiteral(ParseNode.ArrayLiteral node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitIdentifier(ParseNode.Identifier node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitLiteral(ParseNode.Literal node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitTokenLeaf(ParseNode.TokenLeaf node) {
    throw new AssertionError(node.kind());
  }

  @Override
  public T visitError(ParseNode.Error node) {
    throw new AssertionError(node.kind());
  }
}
