// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.parser;

/** Exception thrown if a C file cannot be parsed. */
public class CParserException extends Exception {

  private static final long serialVersionUID = 2377475523222364935L;

  public CParserException(String msg) {
    super(msg);
  }

  public CParserException(Throwable cause) {
    super(cause.getMessage(), cause);
  }

  public CParserException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
