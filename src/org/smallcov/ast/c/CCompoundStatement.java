// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A block <code>{ ... }</code>. Local declarations appear as {@link CDeclarationStatement}s. */
public final class CCompoundStatement extends AbstractStatement {

  private static final long serialVersionUID = 3129477520146744553L;

  private final ImmutableList<CStatement> statements;

  public CCompoundStatement(FileLocation pFileLocation, List<? extends CStatement> pStatements) {
    super(pFileLocation);
    statements = ImmutableList.copyOf(pStatements);
  }

  public ImmutableList<CStatement> getStatements() {
    return statements;
  }

  @Override
  public String toASTString() {
    if (statements.isEmpty()) {
      return "{\n}";
    }
    StringBuilder lASTString = new StringBuilder("{\n");
    for (CStatement statement : statements) {
      lASTString.append(indent(statement.toASTString())).append('\n');
    }
    return lASTString.append('}').toString();
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return statements.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CCompoundStatement
        && statements.equals(((CCompoundStatement) obj).statements);
  }
}
