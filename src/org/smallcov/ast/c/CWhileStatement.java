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

/** A while loop, or a do-while loop if {@link #isDoWhile()} holds. */
public final class CWhileStatement extends AbstractStatement {

  private static final long serialVersionUID = -4186390546264575813L;

  private final CExpression condition;
  private final CStatement body;
  private final boolean doWhile;

  public CWhileStatement(
      FileLocation pFileLocation, CExpression pCondition, CStatement pBody, boolean pDoWhile) {
    super(pFileLocation);
    condition = checkNotNull(pCondition);
    body = checkNotNull(pBody);
    doWhile = pDoWhile;
  }

  public CExpression getCondition() {
    return condition;
  }

  public CStatement getBody() {
    return body;
  }

  public boolean isDoWhile() {
    return doWhile;
  }

  @Override
  public String toASTString() {
    if (doWhile) {
      return "do " + body.toASTString() + " while (" + condition.toASTString() + ");";
    }
    return "while (" + condition.toASTString() + ") " + body.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, body, doWhile);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof CWhileStatement)) {
      return false;
    }
    CWhileStatement other = (CWhileStatement) obj;
    return doWhile == other.doWhile
        && condition.equals(other.condition)
        && body.equals(other.body);
  }
}
