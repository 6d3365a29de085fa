// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Position of an AST node in its source file. */
public final class FileLocation implements Serializable {

  private static final long serialVersionUID = 6652099907084949014L;

  public static final FileLocation DUMMY = new FileLocation("<none>", 0);

  private final String fileName;
  private final int startingLine;

  public FileLocation(String pFileName, int pStartingLine) {
    fileName = checkNotNull(pFileName);
    startingLine = pStartingLine;
  }

  public String getFileName() {
    return fileName;
  }

  public int getStartingLineNumber() {
    return startingLine;
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, startingLine);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FileLocation)) {
      return false;
    }
    FileLocation other = (FileLocation) obj;
    return startingLine == other.startingLine && fileName.equals(other.fileName);
  }

  @Override
  public String toString() {
    if (equals(DUMMY)) {
      return "none";
    }
    return fileName + ", line " + startingLine;
  }
}
