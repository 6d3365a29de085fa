// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The C type {@code void}, optionally qualified. */
public final class CVoidType implements CType {

  private static final long serialVersionUID = 1385808708190595556L;

  public static final CVoidType VOID = new CVoidType(false, false);

  private final boolean isConst;
  private final boolean isVolatile;

  private CVoidType(boolean pConst, boolean pVolatile) {
    isConst = pConst;
    isVolatile = pVolatile;
  }

  @Override
  public boolean isConst() {
    return isConst;
  }

  @Override
  public boolean isVolatile() {
    return isVolatile;
  }

  @Override
  public CVoidType withQualifiers(boolean pConst, boolean pVolatile) {
    if ((isConst || !pConst) && (isVolatile || !pVolatile)) {
      return this;
    }
    return new CVoidType(isConst || pConst, isVolatile || pVolatile);
  }

  @Override
  public String toASTString(String pDeclarator) {
    return TypeText.qualifiersOf(this).add("void").add(pDeclarator).toString();
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
    return Objects.hash(isConst, isVolatile);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CVoidType)) {
      return false;
    }
    CVoidType other = (CVoidType) obj;
    return isConst == other.isConst && isVolatile == other.isVolatile;
  }
}
