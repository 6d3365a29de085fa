// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import java.io.Serializable;
import org.smallcov.types.c.CType;

/**
 * Anything an identifier can refer to: variables, functions, parameters, typedef names and
 * enumeration constants.
 */
public interface CSimpleDeclaration extends Serializable {

  String getName();

  CType getType();

  String toASTString();
}
