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

public abstract class AbstractExpression implements CExpression {

  private static final long serialVersionUID = -5616462580829066658L;

  private final FileLocation fileLocation;
  private final CType type;

  protected AbstractExpression(FileLocation pFileLocation, CType pType) {
    fileLocation = checkNotNull(pFileLocation);
    type = checkNotNull(pType);
  }

  @Override
  public FileLocation getFileLocation() {
    return fileLocation;
  }

  @Override
  public CType getExpressionType() {
    return type;
  }

  @Override
  public String toParenthesizedASTString() {
    return "(" + toASTString() + ")";
  }

  @Override
  public String toString() {
    return toASTString();
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return type.equals(((AbstractExpression) obj).type);
  }
}
