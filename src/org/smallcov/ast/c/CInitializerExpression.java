// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

public final class CInitializerExpression implements CInitializer {

  private static final long serialVersionUID = 8141924113808040683L;

  private final FileLocation fileLocation;
  private final CExpression expression;

  public CInitializerExpression(FileLocation pFileLocation, CExpression pExpression) {
    fileLocation = checkNotNull(pFileLocation);
    expression = checkNotNull(pExpression);
  }

  @Override
  public FileLocation getFileLocation() {
    return fileLocation;
  }

  public CExpression getExpression() {
    return expression;
  }

  @Override
  public String toASTString() {
    return expression.toASTString();
  }

  @Override
  public String toString() {
    return toASTString();
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CInitializerExpression
        && expression.equals(((CInitializerExpression) obj).expression);
  }
}
