// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.parser;

import java.io.IOException;
import java.nio.file.Path;
import org.smallcov.ast.c.CTranslationUnit;

/**
 * Front end that turns a preprocessed C file into its top-level declarations, with types,
 * declarations of identifiers, and function bodies resolved.
 *
 * <p>Implementations are expected to mark function declarations they made up for calls to
 * undeclared functions with {@link org.smallcov.ast.c.CFunctionDeclaration#isMissingPrototype()}.
 */
public interface CParser {

  /**
   * Parse the content of a file into a translation unit.
   *
   * @param pFile the file to parse
   * @return the globals of the file, in source order
   * @throws CParserException if the file contains invalid C code
   * @throws IOException if the file cannot be read
   * @throws InterruptedException if parsing was interrupted
   */
  CTranslationUnit parseFile(Path pFile)
      throws CParserException, IOException, InterruptedException;
}
