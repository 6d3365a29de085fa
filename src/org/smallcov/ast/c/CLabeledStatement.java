// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

public final class CLabeledStatement extends AbstractStatement {

  private static final long serialVersionUID = 2314285738916234770L;

  private final String label;
  private final CStatement statement;

  public CLabeledStatement(FileLocation pFileLocation, String pLabel, CStatement pStatement) {
    super(pFileLocation);
    label = checkNotNull(pLabel);
    statement = checkNotNull(pStatement);
  }

  public String getLabel() {
    return label;
  }

  public CStatement getStatement() {
    return statement;
  }

  @Override
  public String toASTString() {
    return label + ":\n" + statement.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * label.hashCode() + statement.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof CLabeledStatement)) {
      return false;
    }
    CLabeledStatement other = (CLabeledStatement) obj;
    return label.equals(other.label) && statement.equals(other.statement);
  }
}
