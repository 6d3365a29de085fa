// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CType;

public final class CBinaryExpression extends AbstractExpression {

  private static final long serialVersionUID = 1902123965106390020L;

  private final CExpression operand1;
  private final CExpression operand2;
  private final BinaryOperator operator;

  public CBinaryExpression(
      FileLocation pFileLocation,
      CType pExpressionType,
      CExpression pOperand1,
      CExpression pOperand2,
      BinaryOperator pOperator) {
    super(pFileLocation, pExpressionType);
    operand1 = checkNotNull(pOperand1);
    operand2 = checkNotNull(pOperand2);
    operator = checkNotNull(pOperator);
  }

  public CExpression getOperand1() {
    return operand1;
  }

  public CExpression getOperand2() {
    return operand2;
  }

  public BinaryOperator getOperator() {
    return operator;
  }

  @Override
  public String toASTString() {
    return operand1.toParenthesizedASTString()
        + " "
        + operator.getOperator()
        + " "
        + operand2.toParenthesizedASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  public enum BinaryOperator {
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    PLUS("+"),
    MINUS("-"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    BINARY_AND("&"),
    BINARY_XOR("^"),
    BINARY_OR("|"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    LOGICAL_AND("&&"),
    LOGICAL_OR("||"),
    ;

    private final String op;

    BinaryOperator(String pOp) {
      op = pOp;
    }

    /** Returns the string representation of this operator (e.g. "*", "+"). */
    public String getOperator() {
      return op;
    }

    public boolean isLogicalOperator() {
      switch (this) {
        case MULTIPLY:
        case DIVIDE:
        case MODULO:
        case PLUS:
        case MINUS:
        case SHIFT_LEFT:
        case SHIFT_RIGHT:
        case BINARY_AND:
        case BINARY_OR:
        case BINARY_XOR:
          return false;
        case LESS_EQUAL:
        case LESS_THAN:
        case GREATER_EQUAL:
        case GREATER_THAN:
        case EQUALS:
        case NOT_EQUALS:
        case LOGICAL_AND:
        case LOGICAL_OR:
          return true;
        default:
          throw new AssertionError("Unhandled case statement");
      }
    }
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + Objects.hash(operand1, operand2, operator);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    CBinaryExpression other = (CBinaryExpression) obj;
    return operator == other.operator
        && operand1.equals(other.operand1)
        && operand2.equals(other.operand2);
  }
}
