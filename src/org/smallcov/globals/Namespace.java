// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

/** The C namespaces a top-level name can live in. */
public enum Namespace {
  /** typedef names */
  TYPEDEF("typedef"),
  /** struct, union, and enum tags */
  TAG("tag"),
  /** variables and functions */
  VARIABLE("var");

  private final String shortName;

  Namespace(String pShortName) {
    shortName = pShortName;
  }

  public String getShortName() {
    return shortName;
  }
}
