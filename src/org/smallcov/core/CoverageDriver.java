// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.core;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import org.smallcov.ast.c.CTranslationUnit;
import org.smallcov.exec.CompilerInvoker;
import org.smallcov.exec.CoverageRunResult;
import org.smallcov.exec.TestRunner;
import org.smallcov.instrumentation.CoverageInstrumenter;
import org.smallcov.instrumentation.PrimitivePrototypes;
import org.smallcov.parser.CParser;
import org.smallcov.parser.CParserException;
import org.smallcov.parser.SourceFiles;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;

/**
 * Computes which tests execute the program under repair: the program is instrumented, compiled,
 * and run on every test.
 */
@Options(prefix = "smallcov")
public class CoverageDriver {

  @Option(
      secure = true,
      name = "source",
      description = "the program to instrument, a C file or a .txt file listing C files")
  private String source = "";

  @Option(
      secure = true,
      name = "coverageOutput",
      description = "file the instrumented program writes the names of executed files to")
  private String coverageOutput = "coverage.path";

  @Option(
      secure = true,
      name = "targetDirectory",
      description = "directory for the instrumented source files")
  private String targetDirectory = "coverage";

  @Option(
      secure = true,
      name = "executable",
      description = "name of the compiled instrumented program")
  private String executable = "coverage.exe";

  private final LogManager logger;
  private final CParser parser;
  private final CompilerInvoker compiler;
  private final TestRunner testRunner;
  private final CoverageInstrumenter instrumenter;

  public CoverageDriver(Configuration pConfig, LogManager pLogger, CParser pParser)
      throws InvalidConfigurationException {
    pConfig.inject(this, CoverageDriver.class);
    if (source.isEmpty()) {
      throw new InvalidConfigurationException("No program given in option smallcov.source");
    }
    logger = pLogger;
    parser = pParser;
    compiler = new CompilerInvoker(pConfig, pLogger);
    testRunner = new TestRunner(pConfig, pLogger);
    instrumenter =
        new CoverageInstrumenter(pLogger, new PrimitivePrototypes(pLogger, compiler, pParser));
  }

  /**
   * Instrument, build and test the program.
   *
   * @return the tests that executed instrumented code, or a result without tests if the
   *     instrumented program does not compile
   * @throws InvalidConfigurationException if the program has an unknown file type
   * @throws CParserException if the program cannot be parsed
   * @throws IOException if the program cannot be read or the instrumented files cannot be written
   */
  public CoverageRunResult run()
      throws InvalidConfigurationException, CParserException, IOException, InterruptedException {
    logger.log(Level.INFO, "Computing coverage of", source);

    ImmutableMap<String, CTranslationUnit> files = SourceFiles.load(Path.of(source), parser);
    ImmutableList<Path> instrumented =
        instrumenter.instrument(files, coverageOutput, Path.of(targetDirectory));

    Path exe = Path.of(executable);
    if (!compiler.compile(Joiner.on(' ').join(instrumented), exe)) {
      logger.log(Level.WARNING, "Could not compile instrumented program", source);
      return CoverageRunResult.notCompiled();
    }

    CoverageRunResult result = testRunner.runTests(Path.of(coverageOutput), exe, source);
    logger.log(Level.INFO, "Coverage computed:", result);
    return result;
  }
}
