// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CStorageClass;
import org.smallcov.types.c.CType;

/** A declaration or definition of a variable, either global or local. */
public final class CVariableDeclaration extends AbstractDeclaration {

  private static final long serialVersionUID = 8303959164064236061L;

  private final CStorageClass storageClass;
  private final @Nullable CInitializer initializer;

  public CVariableDeclaration(
      FileLocation pFileLocation,
      boolean pIsGlobal,
      CStorageClass pStorageClass,
      CType pType,
      String pName,
      @Nullable CInitializer pInitializer) {
    super(pFileLocation, pIsGlobal, pType, pName);
    storageClass = checkNotNull(pStorageClass);
    checkArgument(
        storageClass != CStorageClass.TYPEDEF, "Typedefs are represented by CTypeDefDeclaration");
    initializer = pInitializer;
  }

  public CStorageClass getCStorageClass() {
    return storageClass;
  }

  public @Nullable CInitializer getInitializer() {
    return initializer;
  }

  /**
   * Whether this declaration reserves storage. Only an {@code extern} declaration without
   * initializer does not.
   */
  public boolean isDefinition() {
    return storageClass != CStorageClass.EXTERN || initializer != null;
  }

  @Override
  public <R, X extends Exception> R accept(CGlobalVisitor<R, X> pV) throws X {
    return pV.visit(this);
  }

  @Override
  public String toASTString() {
    StringBuilder lASTString = new StringBuilder();
    lASTString.append(storageClass.toASTString());
    lASTString.append(getType().toASTString(getName()));
    if (initializer != null) {
      lASTString.append(" = ");
      lASTString.append(initializer.toASTString());
    }
    lASTString.append(";");
    return lASTString.toString();
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + Objects.hash(storageClass, initializer);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!super.equals(obj)) {
      return false;
    }
    CVariableDeclaration other = (CVariableDeclaration) obj;
    return storageClass == other.storageClass && Objects.equals(initializer, other.initializer);
  }
}
