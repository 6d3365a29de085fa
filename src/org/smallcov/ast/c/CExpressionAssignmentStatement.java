// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

public final class CExpressionAssignmentStatement extends AbstractStatement {

  private static final long serialVersionUID = -5024636179305930137L;

  private final CLeftHandSide leftHandSide;
  private final CExpression rightHandSide;

  public CExpressionAssignmentStatement(
      FileLocation pFileLocation, CLeftHandSide pLeftHandSide, CExpression pRightHandSide) {
    super(pFileLocation);
    leftHandSide = checkNotNull(pLeftHandSide);
    rightHandSide = checkNotNull(pRightHandSide);
  }

  public CLeftHandSide getLeftHandSide() {
    return leftHandSide;
  }

  public CExpression getRightHandSide() {
    return rightHandSide;
  }

  @Override
  public String toASTString() {
    return leftHandSide.toASTString() + " = " + rightHandSide.toASTString() + ";";
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * leftHandSide.hashCode() + rightHandSide.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof CExpressionAssignmentStatement)) {
      return false;
    }
    CExpressionAssignmentStatement other = (CExpressionAssignmentStatement) obj;
    return leftHandSide.equals(other.leftHandSide) && rightHandSide.equals(other.rightHandSide);
  }
}
