// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** A function call whose result is discarded. */
public final class CFunctionCallStatement extends AbstractStatement {

  private static final long serialVersionUID = 7606010817704105593L;

  private final CFunctionCallExpression functionCall;

  public CFunctionCallStatement(FileLocation pFileLocation, CFunctionCallExpression pFunctionCall) {
    super(pFileLocation);
    functionCall = checkNotNull(pFunctionCall);
  }

  public CFunctionCallExpression getFunctionCallExpression() {
    return functionCall;
  }

  @Override
  public String toASTString() {
    return functionCall.toASTString() + ";";
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return functionCall.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CFunctionCallStatement
        && functionCall.equals(((CFunctionCallStatement) obj).functionCall);
  }
}
