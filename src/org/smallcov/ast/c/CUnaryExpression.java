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

public final class CUnaryExpression extends AbstractExpression {

  private static final long serialVersionUID = -7701970127701577207L;

  private final CExpression operand;
  private final UnaryOperator operator;

  public CUnaryExpression(
      FileLocation pFileLocation, CType pType, CExpression pOperand, UnaryOperator pOperator) {
    super(pFileLocation, pType);
    operand = checkNotNull(pOperand);
    operator = checkNotNull(pOperator);
  }

  public CExpression getOperand() {
    return operand;
  }

  public UnaryOperator getOperator() {
    return operator;
  }

  @Override
  public String toASTString() {
    if (operator == UnaryOperator.SIZEOF || operator == UnaryOperator.ALIGNOF) {
      return operator.getOperator() + "(" + operand.toASTString() + ")";
    }
    return operator.getOperator() + operand.toParenthesizedASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  public enum UnaryOperator {
    MINUS("-"),
    TILDE("~"),
    NOT("!"),
    AMPER("&"),
    SIZEOF("sizeof"),
    ALIGNOF("_Alignof"),
    ;

    private final String mOp;

    UnaryOperator(String pOp) {
      mOp = pOp;
    }

    /** Returns the string representation of this operator (e.g. "*", "+"). */
    public String getOperator() {
      return mOp;
    }
  }

  @Override
  public int hashCode() {
    return 31 * (31 * super.hashCode() + operand.hashCode()) + operator.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    CUnaryExpression other = (CUnaryExpression) obj;
    return operator == other.operator && operand.equals(other.operand);
  }
}
