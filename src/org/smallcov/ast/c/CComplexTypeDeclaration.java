// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import org.smallcov.types.c.CComplexType;
import org.smallcov.types.c.CCompositeType;
import org.smallcov.types.c.CElaboratedType;
import org.smallcov.types.c.CEnumType;

/**
 * Declaration of a struct, union, or enum. Holding a {@link CCompositeType} or {@link CEnumType}
 * makes it a definition, holding a {@link CElaboratedType} makes it a forward declaration like
 * {@code struct s;}.
 */
public final class CComplexTypeDeclaration extends AbstractDeclaration {

  private static final long serialVersionUID = 7373225216427473022L;

  public CComplexTypeDeclaration(
      FileLocation pFileLocation, boolean pIsGlobal, CComplexType pType) {
    super(pFileLocation, pIsGlobal, pType, pType.getName());
  }

  /** Creates the forward declaration {@code struct n;} (or union, enum) for the given type. */
  public static CComplexTypeDeclaration forwardDeclarationOf(
      FileLocation pFileLocation, CComplexType pType) {
    return new CComplexTypeDeclaration(
        pFileLocation,
        true,
        new CElaboratedType(false, false, pType.getKind(), pType.getName(), null));
  }

  @Override
  public CComplexType getType() {
    return (CComplexType) super.getType();
  }

  public boolean isDefinition() {
    return !(getType() instanceof CElaboratedType);
  }

  @Override
  public String toASTString() {
    return getType().toASTString("") + ";";
  }

  @Override
  public <R, X extends Exception> R accept(CGlobalVisitor<R, X> pV) throws X {
    return pV.visit(this);
  }
}
