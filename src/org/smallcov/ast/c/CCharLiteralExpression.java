// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CType;

public final class CCharLiteralExpression extends AbstractExpression {

  private static final long serialVersionUID = 6806494425621157804L;

  private final char character;

  public CCharLiteralExpression(FileLocation pFileLocation, CType pType, char pCharacter) {
    super(pFileLocation, pType);
    character = pCharacter;
  }

  public char getCharacter() {
    return character;
  }

  @Override
  public String toASTString() {
    if (character == '\'') {
      return "'\\''";
    }
    if (character == '"') {
      return "'\"'";
    }
    return "'" + CStringLiteralExpression.escape(String.valueOf(character)) + "'";
  }

  @Override
  public String toParenthesizedASTString() {
    return toASTString();
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + character;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return super.equals(obj) && character == ((CCharLiteralExpression) obj).character;
  }
}
