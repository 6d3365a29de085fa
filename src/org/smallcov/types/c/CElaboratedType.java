// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A reference to a struct, union, or enum by its tag name, as in {@code struct s *p}. The
 * referenced definition may be unknown (forward declaration).
 */
public final class CElaboratedType implements CComplexType {

  private static final long serialVersionUID = -3566628634889842927L;

  private final boolean isConst;
  private final boolean isVolatile;
  private final ComplexTypeKind kind;
  private final String name;
  private @Nullable CComplexType realType;

  public CElaboratedType(
      boolean pConst,
      boolean pVolatile,
      ComplexTypeKind pKind,
      String pName,
      @Nullable CComplexType pRealType) {
    checkArgument(!pName.isEmpty(), "a %s reference needs a tag name", pKind.toASTString());
    isConst = pConst;
    isVolatile = pVolatile;
    kind = checkNotNull(pKind);
    name = pName;
    realType = pRealType;
  }

  @Override
  public ComplexTypeKind getKind() {
    return kind;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getQualifiedName() {
    return kind.toASTString() + " " + name;
  }

  /** Returns the referenced definition, following references to references, or null if unknown. */
  public @Nullable CComplexType getRealType() {
    CComplexType target = realType;
    while (target instanceof CElaboratedType) {
      target = ((CElaboratedType) target).realType;
    }
    return target;
  }

  /** Links a forward reference to the definition once it has been seen. */
  public void setRealType(CComplexType pRealType) {
    checkState(getRealType() == null, "%s is already resolved", this);
    checkArgument(pRealType != this);
    checkArgument(
        pRealType.getKind() == kind && name.equals(pRealType.getName()),
        "%s cannot resolve %s",
        pRealType.getQualifiedName(),
        getQualifiedName());
    realType = pRealType;
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
  public CElaboratedType withQualifiers(boolean pConst, boolean pVolatile) {
    if ((isConst || !pConst) && (isVolatile || !pVolatile)) {
      return this;
    }
    return new CElaboratedType(isConst || pConst, isVolatile || pVolatile, kind, name, realType);
  }

  @Override
  public String toASTString(String pDeclarator) {
    checkNotNull(pDeclarator);
    return TypeText.qualifiersOf(this)
        .add(kind.toASTString())
        .add(name)
        .add(pDeclarator)
        .toString();
  }

  @Override
  public String toString() {
    return getQualifiedName();
  }

  @Override
  public <R, X extends Exception> R accept(CTypeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(isConst, isVolatile, kind, name);
  }

  /** References are equal if they name the same tag, resolved or not. */
  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CElaboratedType)) {
      return false;
    }
    CElaboratedType other = (CElaboratedType) obj;
    return isConst == other.isConst
        && isVolatile == other.isVolatile
        && kind == other.kind
        && name.equals(other.name);
  }
}
