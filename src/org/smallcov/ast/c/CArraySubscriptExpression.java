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

public final class CArraySubscriptExpression extends AbstractExpression implements CLeftHandSide {

  private static final long serialVersionUID = 1170789536452463565L;

  private final CExpression arrayExpression;
  private final CExpression subscriptExpression;

  public CArraySubscriptExpression(
      FileLocation pFileLocation,
      CType pType,
      CExpression pArrayExpression,
      CExpression pSubscriptExpression) {
    super(pFileLocation, pType);
    arrayExpression = checkNotNull(pArrayExpression);
    subscriptExpression = checkNotNull(pSubscriptExpression);
  }

  public CExpression getArrayExpression() {
    return arrayExpression;
  }

  public CExpression getSubscriptExpression() {
    return subscriptExpression;
  }

  @Override
  public String toASTString() {
    String left = arrayExpression.toParenthesizedASTString();
    return left + "[" + subscriptExpression.toASTString() + "]";
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * super.hashCode() + arrayExpression.hashCode())
        + subscriptExpression.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    CArraySubscriptExpression other = (CArraySubscriptExpression) obj;
    return arrayExpression.equals(other.arrayExpression)
        && subscriptExpression.equals(other.subscriptExpression);
  }
}
