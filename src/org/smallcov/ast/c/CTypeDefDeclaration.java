// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import org.smallcov.types.c.CType;
import org.smallcov.types.c.CTypedefType;

/**
 * A typedef. The type of this declaration is the real type, the name is the new typedef name.
 */
public final class CTypeDefDeclaration extends AbstractDeclaration {

  private static final long serialVersionUID = -607383651501118425L;

  public CTypeDefDeclaration(
      FileLocation pFileLocation, boolean pIsGlobal, CType pType, String pName) {
    super(pFileLocation, pIsGlobal, pType, pName);
  }

  /** Returns the type that uses of this typedef name have. */
  public CTypedefType getDefinedType() {
    return new CTypedefType(false, false, getName(), getType());
  }

  @Override
  public String toASTString() {
    return "typedef " + getType().toASTString(getName()) + ";";
  }

  @Override
  public <R, X extends Exception> R accept(CGlobalVisitor<R, X> pV) throws X {
    return pV.visit(this);
  }
}
