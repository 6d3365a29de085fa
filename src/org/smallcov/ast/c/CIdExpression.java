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

public final class CIdExpression extends AbstractExpression implements CLeftHandSide {

  private static final long serialVersionUID = 3385929463648283567L;

  private final String name;
  private final @Nullable CSimpleDeclaration declaration;

  public CIdExpression(
      FileLocation pFileLocation,
      CType pType,
      String pName,
      @Nullable CSimpleDeclaration pDeclaration) {
    super(pFileLocation, pType);
    name = checkNotNull(pName);
    declaration = pDeclaration;
  }

  /** Creates an id expression referencing the given declaration, with its type. */
  public CIdExpression(FileLocation pFileLocation, CSimpleDeclaration pDeclaration) {
    this(pFileLocation, pDeclaration.getType(), pDeclaration.getName(), pDeclaration);
  }

  public String getName() {
    return name;
  }

  /** Returns the declaration this identifier refers to, if the parser resolved it. */
  public @Nullable CSimpleDeclaration getDeclaration() {
    return declaration;
  }

  @Override
  public String toASTString() {
    return name;
  }

  @Override
  public String toParenthesizedASTString() {
    return name;
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + name.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return super.equals(obj)
        && name.equals(((CIdExpression) obj).name)
        && Objects.equals(declaration, ((CIdExpression) obj).declaration);
  }
}
