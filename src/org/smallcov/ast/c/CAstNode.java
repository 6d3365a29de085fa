// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import java.io.Serializable;

public interface CAstNode extends Serializable {

  FileLocation getFileLocation();

  /** Returns the C source text of this node. */
  String toASTString();
}
