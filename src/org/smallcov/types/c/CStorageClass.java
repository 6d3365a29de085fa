// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import java.util.Locale;

public enum CStorageClass {
  AUTO,
  STATIC,
  EXTERN,
  TYPEDEF;

  public String toASTString() {
    if (equals(AUTO)) {
      return "";
    }
    return name().toLowerCase(Locale.ROOT) + " ";
  }
}
