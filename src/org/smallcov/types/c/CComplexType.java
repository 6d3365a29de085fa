// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import java.util.Locale;

/** Interface for types representing enums, structs, and unions. */
public interface CComplexType extends CType {

  ComplexTypeKind getKind();

  /**
   * Returns the unqualified name, e.g. for the type "struct s", this returns "s".
   *
   * @return A name string or the empty string if the type has no name.
   */
  String getName();

  /**
   * Returns the qualified name, e.g. for the type "struct s", this returns "struct s". If the
   * name is empty, this contains only the qualifier.
   */
  String getQualifiedName();

  enum ComplexTypeKind {
    ENUM,
    STRUCT,
    UNION;

    public String toASTString() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
