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

/** Common fields of all declarations: location, scope, type, and name. */
public abstract class AbstractDeclaration implements CDeclaration {

  private static final long serialVersionUID = 3218969369130423033L;

  private final FileLocation fileLocation;
  private final boolean isGlobal;
  private final CType type;
  private final String name;

  protected AbstractDeclaration(
      FileLocation pFileLocation, boolean pIsGlobal, CType pType, String pName) {
    fileLocation = checkNotNull(pFileLocation);
    isGlobal = pIsGlobal;
    type = checkNotNull(pType);
    name = checkNotNull(pName);
  }

  @Override
  public FileLocation getFileLocation() {
    return fileLocation;
  }

  @Override
  public boolean isGlobal() {
    return isGlobal;
  }

  @Override
  public CType getType() {
    return type;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return toASTString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(isGlobal, type, name);
  }

  /** Declarations compare by scope, type, and name. The location is ignored. */
  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    AbstractDeclaration other = (AbstractDeclaration) obj;
    return isGlobal == other.isGlobal && type.equals(other.type) && name.equals(other.name);
  }
}
