// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigDecimal;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CType;

public final class CFloatLiteralExpression extends AbstractExpression {

  private static final long serialVersionUID = 5021145411123854111L;

  private final BigDecimal value;

  public CFloatLiteralExpression(FileLocation pFileLocation, CType pType, BigDecimal pValue) {
    super(pFileLocation, pType);
    value = checkNotNull(pValue);
  }

  public BigDecimal getValue() {
    return value;
  }

  @Override
  public String toASTString() {
    String s = value.toString();
    // keep the literal a floating-point one
    return s.contains(".") || s.contains("E") ? s : s + ".0";
  }

  @Override
  public String toParenthesizedASTString() {
    return value.signum() < 0 ? "(" + toASTString() + ")" : toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + value.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return super.equals(obj) && value.equals(((CFloatLiteralExpression) obj).value);
  }
}
