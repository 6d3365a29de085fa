// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CArrayType;
import org.smallcov.types.c.CNumericTypes;
import org.smallcov.types.c.CType;

/** A string literal. The stored value is the unescaped content without the terminating NUL. */
public final class CStringLiteralExpression extends AbstractExpression {

  private static final long serialVersionUID = 2656216584704518185L;

  private static final Escaper C_STRING_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\t', "\\t")
          .addEscape('\r', "\\r")
          .addEscape('\0', "\\000")
          .build();

  private final String value;

  public CStringLiteralExpression(FileLocation pFileLocation, CType pType, String pValue) {
    super(pFileLocation, pType);
    value = checkNotNull(pValue);
  }

  /** Creates a literal of type {@code char[n]} for the given content. */
  public static CStringLiteralExpression of(String pValue) {
    CType type =
        new CArrayType(
            false,
            false,
            CNumericTypes.CHAR,
            CIntegerLiteralExpression.createDummyLiteral(
                pValue.length() + 1L, CNumericTypes.SIZE_T));
    return new CStringLiteralExpression(FileLocation.DUMMY, type, pValue);
  }

  static String escape(String pContent) {
    return C_STRING_ESCAPER.escape(pContent);
  }

  public String getContentString() {
    return value;
  }

  @Override
  public String toASTString() {
    return "\"" + escape(value) + "\"";
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
    return 31 * super.hashCode() + value.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return super.equals(obj) && value.equals(((CStringLiteralExpression) obj).value);
  }
}
