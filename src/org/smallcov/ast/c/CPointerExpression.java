// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CType;

/** A dereference {@code *p}. */
public final class CPointerExpression extends AbstractExpression implements CLeftHandSide {

  private static final long serialVersionUID = -7287829426446099016L;

  private final CExpression operand;

  public CPointerExpression(FileLocation pFileLocation, CType pType, CExpression pOperand) {
    super(pFileLocation, pType);
    operand = checkNotNull(pOperand);
  }

  public CExpression getOperand() {
    return operand;
  }

  @Override
  public String toASTString() {
    return "*" + operand.toParenthesizedASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + operand.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return super.equals(obj) && operand.equals(((CPointerExpression) obj).operand);
  }
}
