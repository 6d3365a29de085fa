// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

public enum CBasicType {
  UNSPECIFIED(""),
  BOOL("_Bool"),
  CHAR("char"),
  INT("int"),
  INT128("__int128"),
  FLOAT("float"),
  DOUBLE("double"),
  FLOAT128("__float128");

  private final String code;

  CBasicType(String pCode) {
    code = pCode;
  }

  public boolean isIntegerType() {
    return this == BOOL || this == CHAR || this == INT || this == INT128 || this == UNSPECIFIED;
  }

  public String toASTString() {
    return code;
  }
}
