// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import java.io.Serializable;

/** Interface for all C types. Instances are immutable once they are fully constructed. */
public interface CType extends Serializable {

  boolean isConst();

  boolean isVolatile();

  /**
   * Render a declaration of the given declarator with this type, e.g. <code>int *</code> around
   * <code>p</code> gives <code>int *p</code>. An empty declarator gives the type name as used in
   * casts and <code>sizeof</code>.
   */
  String toASTString(String declarator);

  /**
   * Return this type with the given qualifiers added to its own. Qualifiers of an array apply to
   * its elements (C11 § 6.7.3 (9)), function types cannot be qualified and stay unchanged.
   */
  CType withQualifiers(boolean addConst, boolean addVolatile);

  <R, X extends Exception> R accept(CTypeVisitor<R, X> visitor) throws X;
}
