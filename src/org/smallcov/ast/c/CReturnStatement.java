// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

public final class CReturnStatement extends AbstractStatement {

  private static final long serialVersionUID = -7073556363348785665L;

  private final @Nullable CExpression expression;

  public CReturnStatement(FileLocation pFileLocation, @Nullable CExpression pExpression) {
    super(pFileLocation);
    expression = pExpression;
  }

  public Optional<CExpression> getReturnValue() {
    return Optional.ofNullable(expression);
  }

  @Override
  public String toASTString() {
    return "return" + (expression == null ? "" : " " + expression.toASTString()) + ";";
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(expression);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CReturnStatement
        && Objects.equals(expression, ((CReturnStatement) obj).expression);
  }
}
