// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.parser;

import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CTranslationUnit;

/** Writes globals back as C source code. */
public final class CProgramPrinter {

  private CProgramPrinter() {}

  /** Append the source text of the given globals, each on its own line(s). */
  public static void print(Iterable<? extends CGlobal> pGlobals, Appendable pOut)
      throws IOException {
    for (CGlobal global : pGlobals) {
      pOut.append(global.toASTString());
      pOut.append('\n');
    }
  }

  public static String print(Iterable<? extends CGlobal> pGlobals) {
    StringBuilder sb = new StringBuilder();
    try {
      print(pGlobals, sb);
    } catch (IOException e) {
      throw new AssertionError("StringBuilder does not throw IOException", e);
    }
    return sb.toString();
  }

  /**
   * Write a translation unit to the given file. Missing parent directories are created, an
   * existing file is overwritten.
   */
  public static void write(CTranslationUnit pUnit, Path pFile) throws IOException {
    MoreFiles.createParentDirectories(pFile);
    try (Writer w = Files.newBufferedWriter(pFile, StandardCharsets.UTF_8)) {
      w.append("/* Generated by SmallCov from ").append(pUnit.getFileName()).append(" */\n");
      print(pUnit.getGlobals(), w);
    }
  }
}
