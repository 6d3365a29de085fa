// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An arithmetic type written with keywords, e.g. <code>unsigned long int</code>. The type is
 * stored as written: <code>int</code> and <code>signed int</code> are different instances.
 */
@Immutable
public final class CSimpleType implements CType {

  private static final long serialVersionUID = 4121850478296574581L;

  /** Explicit signedness keyword. */
  public enum Signedness {
    NONE(""),
    SIGNED("signed"),
    UNSIGNED("unsigned");

    private final String keyword;

    Signedness(String pKeyword) {
      keyword = pKeyword;
    }
  }

  /** Length modifier. C allows at most one of them. */
  public enum Length {
    NONE(""),
    SHORT("short"),
    LONG("long"),
    LONG_LONG("long long");

    private final String keyword;

    Length(String pKeyword) {
      keyword = pKeyword;
    }
  }

  private final boolean isConst;
  private final boolean isVolatile;
  private final CBasicType type;
  private final Signedness signedness;
  private final Length length;

  public CSimpleType(
      boolean pConst,
      boolean pVolatile,
      CBasicType pType,
      Signedness pSignedness,
      Length pLength) {
    isConst = pConst;
    isVolatile = pVolatile;
    type = checkNotNull(pType);
    signedness = checkNotNull(pSignedness);
    length = checkNotNull(pLength);
  }

  @Override
  public boolean isConst() {
    return isConst;
  }

  @Override
  public boolean isVolatile() {
    return isVolatile;
  }

  public CBasicType getType() {
    return type;
  }

  public Signedness getSignedness() {
    return signedness;
  }

  public Length getLength() {
    return length;
  }

  public boolean isUnsigned() {
    return signedness == Signedness.UNSIGNED;
  }

  @Override
  public CSimpleType withQualifiers(boolean pConst, boolean pVolatile) {
    if ((isConst || !pConst) && (isVolatile || !pVolatile)) {
      return this;
    }
    return new CSimpleType(isConst || pConst, isVolatile || pVolatile, type, signedness, length);
  }

  @Override
  public String toASTString(String pDeclarator) {
    checkNotNull(pDeclarator);
    return TypeText.qualifiersOf(this)
        .add(signedness.keyword)
        .add(length.keyword)
        .add(type.toASTString())
        .add(pDeclarator)
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
    return Objects.hash(isConst, isVolatile, type, signedness, length);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CSimpleType)) {
      return false;
    }
    CSimpleType other = (CSimpleType) obj;
    return isConst == other.isConst
        && isVolatile == other.isVolatile
        && type == other.type
        && signedness == other.signedness
        && length == other.length;
  }
}
