// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CNumericTypes;
import org.smallcov.types.c.CSimpleType;
import org.smallcov.types.c.CType;
import org.smallcov.types.c.CTypes;

public final class CIntegerLiteralExpression extends AbstractExpression {

  private static final long serialVersionUID = 7691279268370356228L;

  public static final CIntegerLiteralExpression ZERO = createDummyLiteral(0L, CNumericTypes.INT);
  public static final CIntegerLiteralExpression ONE = createDummyLiteral(1L, CNumericTypes.INT);

  private final BigInteger value;

  public CIntegerLiteralExpression(FileLocation pFileLocation, CType pType, BigInteger pValue) {
    super(pFileLocation, pType);
    value = checkNotNull(pValue);
  }

  public static CIntegerLiteralExpression createDummyLiteral(long pValue, CType pType) {
    return new CIntegerLiteralExpression(FileLocation.DUMMY, pType, BigInteger.valueOf(pValue));
  }

  public BigInteger getValue() {
    return value;
  }

  @Override
  public String toASTString() {
    String suffix = "";
    CType type = CTypes.resolveTypedefs(getExpressionType());
    if (type instanceof CSimpleType) {
      CSimpleType simpleType = (CSimpleType) type;
      if (simpleType.isUnsigned()) {
        suffix += "U";
      }
      switch (simpleType.getLength()) {
        case LONG:
          suffix += "L";
          break;
        case LONG_LONG:
          suffix += "LL";
          break;
        default:
          break;
      }
    }
    return value.toString() + suffix;
  }

  @Override
  public String toParenthesizedASTString() {
    return value.signum() < 0 ? "(" + toASTString() + ")" : toASTString();
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
    return super.equals(obj) && value.equals(((CIntegerLiteralExpression) obj).value);
  }
}
