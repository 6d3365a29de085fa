// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Top-level text that is copied verbatim, e.g. pragmas or top-level asm. */
public final class CGlobalText implements CGlobal {

  private static final long serialVersionUID = -2196395227540564893L;

  private final FileLocation fileLocation;
  private final String text;

  public CGlobalText(FileLocation pFileLocation, String pText) {
    fileLocation = checkNotNull(pFileLocation);
    text = checkNotNull(pText);
  }

  @Override
  public FileLocation getFileLocation() {
    return fileLocation;
  }

  public String getText() {
    return text;
  }

  @Override
  public String toASTString() {
    return text;
  }

  @Override
  public String toString() {
    return text;
  }

  @Override
  public <R, X extends Exception> R accept(CGlobalVisitor<R, X> pV) throws X {
    return pV.visit(this);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof CGlobalText && text.equals(((CGlobalText) obj).text);
  }
}
