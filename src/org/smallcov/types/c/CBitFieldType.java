// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CComplexType.ComplexTypeKind;

/** The type of a struct or union member declared with a width, as in <code>int flag : 1</code>. */
public final class CBitFieldType implements CType {

  private static final long serialVersionUID = 1L;

  private final CType type;
  private final int bitFieldSize;

  /**
   * Creates a bit-field type.
   *
   * @param pBitFieldType the declared type, an integer type or an enum, possibly behind typedefs
   * @param pBitFieldSize the width in bits, not negative
   * @throws IllegalArgumentException if the type cannot carry a width or the width is negative
   */
  public CBitFieldType(CType pBitFieldType, int pBitFieldSize) {
    checkArgument(
        isIntegral(CTypes.resolveTypedefs(checkNotNull(pBitFieldType))),
        "%s cannot be a bit field",
        pBitFieldType);
    checkArgument(pBitFieldSize >= 0, "negative bit-field width %s", pBitFieldSize);
    type = pBitFieldType;
    bitFieldSize = pBitFieldSize;
  }

  private static boolean isIntegral(CType pResolved) {
    if (pResolved instanceof CSimpleType) {
      return ((CSimpleType) pResolved).getType().isIntegerType();
    }
    return pResolved instanceof CComplexType
        && ((CComplexType) pResolved).getKind() == ComplexTypeKind.ENUM;
  }

  /** Returns the declared type of the field, as written. */
  public CType getType() {
    return type;
  }

  public int getBitFieldSize() {
    return bitFieldSize;
  }

  @Override
  public boolean isConst() {
    return type.isConst();
  }

  @Override
  public boolean isVolatile() {
    return type.isVolatile();
  }

  @Override
  public CBitFieldType withQualifiers(boolean pConst, boolean pVolatile) {
    CType qualified = type.withQualifiers(pConst, pVolatile);
    return qualified == type ? this : new CBitFieldType(qualified, bitFieldSize);
  }

  @Override
  public String toASTString(String pDeclarator) {
    checkNotNull(pDeclarator);
    // a zero-width field cannot be named
    String declarator = bitFieldSize == 0 ? "" : pDeclarator;
    return type.toASTString(declarator) + " : " + bitFieldSize;
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
    return Objects.hash(type, bitFieldSize);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (pObj == this) {
      return true;
    }
    if (!(pObj instanceof CBitFieldType)) {
      return false;
    }
    CBitFieldType other = (CBitFieldType) pObj;
    return bitFieldSize == other.bitFieldSize && type.equals(other.type);
  }
}
