// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.ast.c.CExpression;
import org.smallcov.ast.c.CIntegerLiteralExpression;

/** An array, with or without a length expression. */
public final class CArrayType implements CType {

  private static final long serialVersionUID = 5260717418935128512L;

  private final boolean isConst;
  private final boolean isVolatile;
  private final CType elementType;
  private final @Nullable CExpression length;

  public CArrayType(
      boolean pConst, boolean pVolatile, CType pElementType, @Nullable CExpression pLength) {
    isConst = pConst;
    isVolatile = pVolatile;
    elementType = checkNotNull(pElementType);
    length = pLength;
  }

  @Override
  public boolean isConst() {
    return isConst;
  }

  @Override
  public boolean isVolatile() {
    return isVolatile;
  }

  /** Returns the element type, as written (typedefs are not resolved). */
  public CType getType() {
    return elementType;
  }

  public @Nullable CExpression getLength() {
    return length;
  }

  private @Nullable BigInteger getLiteralLength() {
    if (length instanceof CIntegerLiteralExpression) {
      return ((CIntegerLiteralExpression) length).getValue();
    }
    return null;
  }

  @Override
  public CArrayType withQualifiers(boolean pConst, boolean pVolatile) {
    if (!pConst && !pVolatile) {
      return this;
    }
    return new CArrayType(
        isConst, isVolatile, elementType.withQualifiers(pConst, pVolatile), length);
  }

  @Override
  public String toASTString(String pDeclarator) {
    checkNotNull(pDeclarator);
    String subscript = "[" + (length == null ? "" : length.toASTString()) + "]";
    return TypeText.qualifiersOf(this)
        .add(elementType.toASTString(pDeclarator + subscript))
        .toString();
  }

  @Override
  public String toString() {
    return toASTString("");
  }

  @Override
  public <R, X extends Exception> R accept(CTypeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(isConst, isVolatile, elementType, getLiteralLength());
  }

  /** Literal lengths are compared by value, other lengths as expressions. */
  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CArrayType)) {
      return false;
    }
    CArrayType other = (CArrayType) obj;
    if (isConst != other.isConst
        || isVolatile != other.isVolatile
        || !elementType.equals(other.elementType)) {
      return false;
    }
    BigInteger literal = getLiteralLength();
    if (literal != null) {
      return literal.equals(other.getLiteralLength());
    }
    return Objects.equals(length, other.length);
  }
}
