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

/** An operator applied to a type name, like {@code sizeof(struct s)}. */
public final class CTypeIdExpression extends AbstractExpression {

  private static final long serialVersionUID = -665995216646475799L;

  private final TypeIdOperator operator;
  private final CType type;

  public CTypeIdExpression(
      FileLocation pFileLocation, CType pExpressionType, TypeIdOperator pOperator, CType pType) {
    super(pFileLocation, pExpressionType);
    operator = checkNotNull(pOperator);
    type = checkNotNull(pType);
  }

  public TypeIdOperator getOperator() {
    return operator;
  }

  /** Returns the operand type. */
  public CType getType() {
    return type;
  }

  @Override
  public String toASTString() {
    return operator.getOperator() + "(" + type.toASTString("") + ")";
  }

  @Override
  public String toParenthesizedASTString() {
    return toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  public enum TypeIdOperator {
    SIZEOF("sizeof"),
    ALIGNOF("_Alignof"),
    TYPEOF("__typeof__"),
    ;

    private final String cRepresentation;

    TypeIdOperator(String pCRepresentation) {
      cRepresentation = pCRepresentation;
    }

    public String getOperator() {
      return cRepresentation;
    }
  }

  @Override
  public int hashCode() {
    return 31 * (31 * super.hashCode() + operator.hashCode()) + type.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    CTypeIdExpression other = (CTypeIdExpression) obj;
    return operator == other.operator && type.equals(other.type);
  }
}
