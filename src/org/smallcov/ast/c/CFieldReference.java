// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CType;

/** A member access, either {@code s.f} or {@code p->f}. */
public final class CFieldReference extends AbstractExpression implements CLeftHandSide {

  private static final long serialVersionUID = 3207784831993980113L;

  private final String name;
  private final CExpression owner;
  private final boolean isPointerDereference;

  public CFieldReference(
      FileLocation pFileLocation,
      CType pType,
      String pName,
      CExpression pOwner,
      boolean pIsPointerDereference) {
    super(pFileLocation, pType);
    name = checkNotNull(pName);
    owner = checkNotNull(pOwner);
    isPointerDereference = pIsPointerDereference;
  }

  public String getFieldName() {
    return name;
  }

  public CExpression getFieldOwner() {
    return owner;
  }

  public boolean isPointerDereference() {
    return isPointerDereference;
  }

  @Override
  public String toASTString() {
    String left = owner.toParenthesizedASTString();
    String op = isPointerDereference ? "->" : ".";
    return left + op + name;
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + Objects.hash(name, owner, isPointerDereference);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    CFieldReference other = (CFieldReference) obj;
    return isPointerDereference == other.isPointerDereference
        && name.equals(other.name)
        && owner.equals(other.owner);
  }
}
