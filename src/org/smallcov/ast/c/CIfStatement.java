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

public final class CIfStatement extends AbstractStatement {

  private static final long serialVersionUID = 4522941440939385418L;

  private final CExpression condition;
  private final CStatement thenStatement;
  private final @Nullable CStatement elseStatement;

  public CIfStatement(
      FileLocation pFileLocation,
      CExpression pCondition,
      CStatement pThenStatement,
      @Nullable CStatement pElseStatement) {
    super(pFileLocation);
    condition = checkNotNull(pCondition);
    thenStatement = checkNotNull(pThenStatement);
    elseStatement = pElseStatement;
  }

  public CExpression getCondition() {
    return condition;
  }

  public CStatement getThenStatement() {
    return thenStatement;
  }

  public @Nullable CStatement getElseStatement() {
    return elseStatement;
  }

  @Override
  public String toASTString() {
    String result = "if (" + condition.toASTString() + ") " + thenStatement.toASTString();
    if (elseStatement != null) {
      result += " else " + elseStatement.toASTString();
    }
    return result;
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, thenStatement, elseStatement);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof CIfStatement)) {
      return false;
    }
    CIfStatement other = (CIfStatement) obj;
    return condition.equals(other.condition)
        && thenStatement.equals(other.thenStatement)
        && Objects.equals(elseStatement, other.elseStatement);
  }
}
