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

/** A pointer. Its own qualifiers follow the asterisk, as in <code>int * const p</code>. */
public final class CPointerType implements CType {

  private static final long serialVersionUID = -2671738013419592513L;

  public static final CPointerType POINTER_TO_VOID = new CPointerType(false, false, CVoidType.VOID);
  public static final CPointerType POINTER_TO_CHAR =
      new CPointerType(false, false, CNumericTypes.CHAR);
  public static final CPointerType POINTER_TO_CONST_CHAR =
      new CPointerType(false, false, CNumericTypes.CONST_CHAR);

  private final boolean isConst;
  private final boolean isVolatile;
  private final CType target;

  public CPointerType(boolean pConst, boolean pVolatile, CType pTarget) {
    isConst = pConst;
    isVolatile = pVolatile;
    target = checkNotNull(pTarget);
  }

  @Override
  public boolean isConst() {
    return isConst;
  }

  @Override
  public boolean isVolatile() {
    return isVolatile;
  }

  /** Returns the pointed-to type, as written (typedefs are not resolved). */
  public CType getType() {
    return target;
  }

  @Override
  public CPointerType withQualifiers(boolean pConst, boolean pVolatile) {
    if ((isConst || !pConst) && (isVolatile || !pVolatile)) {
      return this;
    }
    return new CPointerType(isConst || pConst, isVolatile || pVolatile, target);
  }

  @Override
  public String toASTString(String pDeclarator) {
    checkNotNull(pDeclarator);
    String asterisk = isConst || isVolatile ? "* " : "*";
    String declarator = asterisk + TypeText.qualifiersOf(this).add(pDeclarator);

    if (target instanceof CArrayType || target instanceof CFunctionType) {
      // "*" binds weaker than "[]" and "()"
      declarator = "(" + declarator + ")";
    }

    // the member list of the target is never repeated
    if (target instanceof CCompositeType) {
      return ((CCompositeType) target).toASTString(declarator, false);
    } else if (target instanceof CEnumType) {
      return ((CEnumType) target).toASTString(declarator, false);
    }
    return target.toASTString(declarator);
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
    return Objects.hash(isConst, isVolatile, target);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CPointerType)) {
      return false;
    }
    CPointerType other = (CPointerType) obj;
    return isConst == other.isConst
        && isVolatile == other.isVolatile
        && target.equals(other.target);
  }
}
