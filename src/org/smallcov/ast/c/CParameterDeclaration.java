// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CType;

/** A function parameter. The name is empty for unnamed parameters of prototypes. */
public final class CParameterDeclaration implements CSimpleDeclaration {

  private static final long serialVersionUID = -6856088248264928629L;

  private final CType type;
  private final String name;

  public CParameterDeclaration(CType pType, @Nullable String pName) {
    type = checkNotNull(pType);
    name = Strings.nullToEmpty(pName);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public CType getType() {
    return type;
  }

  @Override
  public String toASTString() {
    return type.toASTString(name);
  }

  @Override
  public String toString() {
    return toASTString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CParameterDeclaration)) {
      return false;
    }
    CParameterDeclaration other = (CParameterDeclaration) obj;
    return type.equals(other.type) && name.equals(other.name);
  }
}
