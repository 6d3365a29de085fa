// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

public abstract class AbstractStatement implements CStatement {

  private static final long serialVersionUID = -2682818218051235918L;

  private final FileLocation fileLocation;

  protected AbstractStatement(FileLocation pFileLocation) {
    fileLocation = checkNotNull(pFileLocation);
  }

  @Override
  public FileLocation getFileLocation() {
    return fileLocation;
  }

  @Override
  public String toString() {
    return toASTString();
  }

  /** Indent every line of the given code by two spaces. */
  static String indent(String pCode) {
    return StreamSupport.stream(Splitter.on('\n').split(pCode).spliterator(), false)
        .map(line -> line.isEmpty() ? line : "  " + line)
        .collect(Collectors.joining("\n"));
  }
}
