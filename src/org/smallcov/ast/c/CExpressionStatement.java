// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** An expression evaluated for its side effects, e.g. {@code i++;}. */
public final class CExpressionStatement extends AbstractStatement {

  private static final long serialVersionUID = -1478624568232453962L;

  private final CExpression expression;

  public CExpressionStatement(FileLocation pFileLocation, CExpression pExpression) {
    super(pFileLocation);
    expression = checkNotNull(pExpression);
  }

  public CExpression getExpression() {
    return expression;
  }

  @Override
  public String toASTString() {
    return expression.toASTString() + ";";
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CExpressionStatement
        && expression.equals(((CExpressionStatement) obj).expression);
  }
}
