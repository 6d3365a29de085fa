// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.parser;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.smallcov.ast.c.CTranslationUnit;
import org.sosy_lab.common.configuration.InvalidConfigurationException;

/**
 * Loads the program under repair. The input is either a single C file (<code>.c</code>, or
 * <code>.i</code> if already preprocessed) or a <code>.txt</code> file listing one C file per
 * line. Relative names in a list are resolved against the directory of the list.
 */
public final class SourceFiles {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n').trimResults().omitEmptyStrings();

  private SourceFiles() {}

  /**
   * Parse all files of the program.
   *
   * @return the parsed files, keyed by the name under which they are written after
   *     instrumentation, in input order
   */
  public static ImmutableMap<String, CTranslationUnit> load(Path pSource, CParser pParser)
      throws InvalidConfigurationException, CParserException, IOException, InterruptedException {
    String name = pSource.getFileName().toString();

    if (name.endsWith(".c") || name.endsWith(".i")) {
      return ImmutableMap.of(name, pParser.parseFile(pSource));

    } else if (name.endsWith(".txt")) {
      String content = MoreFiles.asCharSource(pSource, StandardCharsets.UTF_8).read();
      ImmutableMap.Builder<String, CTranslationUnit> result = ImmutableMap.builder();
      for (String fileName : LINE_SPLITTER.split(content)) {
        result.put(fileName, pParser.parseFile(pSource.resolveSibling(fileName)));
      }
      return result.buildKeepingLast();

    } else {
      throw new InvalidConfigurationException(
          "Unexpected input file "
              + pSource
              + ", expected a C file (.c or .i) or a list of C files (.txt)");
    }
  }
}
