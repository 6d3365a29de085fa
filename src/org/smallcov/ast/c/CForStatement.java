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

/**
 * A for loop. The initializer is an expression or declaration statement, the iteration an
 * expression or assignment statement; both are printed from their statement form.
 */
public final class CForStatement extends AbstractStatement {

  private static final long serialVersionUID = 1873490146516232796L;

  private final @Nullable CStatement initializer;
  private final @Nullable CExpression condition;
  private final @Nullable CStatement iteration;
  private final CStatement body;

  public CForStatement(
      FileLocation pFileLocation,
      @Nullable CStatement pInitializer,
      @Nullable CExpression pCondition,
      @Nullable CStatement pIteration,
      CStatement pBody) {
    super(pFileLocation);
    initializer = pInitializer;
    condition = pCondition;
    iteration = pIteration;
    body = checkNotNull(pBody);
  }

  public @Nullable CStatement getInitializer() {
    return initializer;
  }

  public @Nullable CExpression getCondition() {
    return condition;
  }

  public @Nullable CStatement getIteration() {
    return iteration;
  }

  public CStatement getBody() {
    return body;
  }

  @Override
  public String toASTString() {
    StringBuilder lASTString = new StringBuilder("for (");
    lASTString.append(initializer == null ? ";" : initializer.toASTString());
    if (condition != null) {
      lASTString.append(' ').append(condition.toASTString());
    }
    lASTString.append(';');
    if (iteration != null) {
      String it = iteration.toASTString();
      lASTString.append(' ').append(it, 0, it.length() - 1); // without ';'
    }
    lASTString.append(") ").append(body.toASTString());
    return lASTString.toString();
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(initializer, condition, iteration, body);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof CForStatement)) {
      return false;
    }
    CForStatement other = (CForStatement) obj;
    return Objects.equals(initializer, other.initializer)
        && Objects.equals(condition, other.condition)
        && Objects.equals(iteration, other.iteration)
        && body.equals(other.body);
  }
}
