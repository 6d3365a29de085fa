// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

/** A named declaration that may appear at the top level. */
public interface CDeclaration extends CSimpleDeclaration, CGlobal {

  boolean isGlobal();

  @Override
  String toASTString();
}
