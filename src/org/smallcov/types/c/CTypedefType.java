// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A type referenced by its typedef name. Printing keeps the name, {@link
 * CTypes#unrollTypedefs(CType)} replaces it by the aliased type.
 */
public final class CTypedefType implements CType {

  private static final long serialVersionUID = -7352402779093291538L;

  private final boolean isConst;
  private final boolean isVolatile;
  private final String name;
  private final CType aliased;

  public CTypedefType(boolean pConst, boolean pVolatile, String pName, CType pRealType) {
    isConst = pConst;
    isVolatile = pVolatile;
    name = checkNotNull(pName);
    aliased = checkNotNull(pRealType);
  }

  public String getName() {
    return name;
  }

  /** The aliased type, without the qualifiers written at this use of the name. */
  public CType getRealType() {
    return aliased;
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
  public CTypedefType withQualifiers(boolean pConst, boolean pVolatile) {
    if ((isConst || !pConst) && (isVolatile || !pVolatile)) {
      return this;
    }
    return new CTypedefType(isConst || pConst, isVolatile || pVolatile, name, aliased);
  }

  @Override
  public String toASTString(String pDeclarator) {
    checkNotNull(pDeclarator);
    return TypeText.qualifiersOf(this).add(name).add(pDeclarator).toString();
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
    return Objects.hash(name, isConst, isVolatile, aliased);
  }

  /** Compares the type as written, two names for the same type are not equal. */
  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CTypedefType)) {
      return false;
    }
    CTypedefType other = (CTypedefType) obj;
    return isConst == other.isConst
        && isVolatile == other.isVolatile
        && name.equals(other.name)
        && aliased.equals(other.aliased);
  }
}
