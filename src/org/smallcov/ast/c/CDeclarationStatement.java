// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** A declaration inside a function body. */
public final class CDeclarationStatement extends AbstractStatement {

  private static final long serialVersionUID = -3219506584911283428L;

  private final CDeclaration declaration;

  public CDeclarationStatement(FileLocation pFileLocation, CDeclaration pDeclaration) {
    super(pFileLocation);
    declaration = checkNotNull(pDeclaration);
  }

  public CDeclaration getDeclaration() {
    return declaration;
  }

  @Override
  public String toASTString() {
    return declaration.toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CStatementVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return declaration.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CDeclarationStatement
        && declaration.equals(((CDeclarationStatement) obj).declaration);
  }
}
