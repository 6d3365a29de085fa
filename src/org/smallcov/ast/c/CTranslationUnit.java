// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The top-level items of one source file, in source order. */
public final class CTranslationUnit {

  private final String fileName;
  private final List<CGlobal> globals;

  public CTranslationUnit(String pFileName, List<? extends CGlobal> pGlobals) {
    fileName = checkNotNull(pFileName);
    globals = new ArrayList<>(pGlobals);
  }

  public String getFileName() {
    return fileName;
  }

  /** Returns an unmodifiable view of the globals. */
  public List<CGlobal> getGlobals() {
    return Collections.unmodifiableList(globals);
  }

  public void setGlobals(List<? extends CGlobal> pGlobals) {
    List<CGlobal> copy = new ArrayList<>(pGlobals);
    globals.clear();
    globals.addAll(copy);
  }

  /** Returns the C source text of all globals, one after another. */
  public String toASTString() {
    return Joiner.on('\n').join(Iterables.transform(globals, CGlobal::toASTString)) + "\n";
  }

  @Override
  public String toString() {
    return fileName + " (" + globals.size() + " globals)";
  }
}
