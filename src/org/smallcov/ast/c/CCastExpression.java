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

/** A cast. The expression type is the target type of the cast. */
public final class CCastExpression extends AbstractExpression {

  private static final long serialVersionUID = 2137263418164221474L;

  private final CExpression operand;

  public CCastExpression(FileLocation pFileLocation, CType pCastType, CExpression pOperand) {
    super(pFileLocation, pCastType);
    operand = checkNotNull(pOperand);
  }

  public CExpression getOperand() {
    return operand;
  }

  public CType getCastType() {
    return getExpressionType();
  }

  @Override
  public String toASTString() {
    return "(" + getCastType().toASTString("") + ")" + operand.toParenthesizedASTString();
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
    return super.equals(obj) && operand.equals(((CCastExpression) obj).operand);
  }
}
