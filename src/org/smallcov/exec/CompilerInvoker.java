// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;

/**
 * Invokes the C compiler, either as preprocessor or to build an executable. The command lines
 * are configurable templates that are run by the shell.
 */
@Options(prefix = "compiler")
public class CompilerInvoker {

  static final String COMPILER_NAME = "__COMPILER_NAME__";
  static final String COMPILER_OPTIONS = "__COMPILER_OPTIONS__";
  static final String SOURCE_NAME = "__SOURCE_NAME__";
  static final String OUT_NAME = "__OUT_NAME__";
  static final String EXE_NAME = "__EXE_NAME__";

  @Option(secure = true, name = "name", description = "the C compiler to use")
  private String compilerName = "gcc";

  @Option(
      secure = true,
      name = "options",
      description = "options passed to the compiler, e.g., include paths and libraries")
  private String compilerOptions = "";

  @Option(
      secure = true,
      name = "compileCommand",
      description =
          "template for the command that builds an executable; "
              + "__COMPILER_NAME__, __EXE_NAME__, __SOURCE_NAME__ and __COMPILER_OPTIONS__ "
              + "are replaced")
  private String compileCommand =
      COMPILER_NAME
          + " -o "
          + EXE_NAME
          + " "
          + SOURCE_NAME
          + " "
          + COMPILER_OPTIONS
          + " 2>/dev/null >/dev/null";

  @Option(
      secure = true,
      name = "preprocessCommand",
      description =
          "template for the command that preprocesses a file; "
              + "__COMPILER_NAME__, __SOURCE_NAME__, __OUT_NAME__ and __COMPILER_OPTIONS__ "
              + "are replaced")
  private String preprocessCommand =
      COMPILER_NAME + " -E " + SOURCE_NAME + " " + COMPILER_OPTIONS + " > " + OUT_NAME;

  private final LogManager logger;

  public CompilerInvoker(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this, CompilerInvoker.class);
    logger = pLogger;
  }

  /**
   * Run the preprocessor on a file.
   *
   * @return whether the preprocessor exited successfully
   */
  public boolean preprocess(Path pSource, Path pOutput) throws InterruptedException {
    String command =
        fillCommonPlaceholders(preprocessCommand)
            .replace(SOURCE_NAME, pSource.toString())
            .replace(OUT_NAME, pOutput.toString());
    return execute(command, "preprocess " + pSource);
  }

  /**
   * Build an executable from one or more source files (separated by spaces).
   *
   * @return whether the compiler exited successfully
   */
  public boolean compile(String pSources, Path pExecutable) throws InterruptedException {
    String command =
        fillCommonPlaceholders(compileCommand)
            .replace(SOURCE_NAME, pSources)
            .replace(EXE_NAME, pExecutable.toString());
    return execute(command, "compile " + pSources);
  }

  public boolean compile(Path pSource, Path pExecutable) throws InterruptedException {
    return compile(pSource.toString(), pExecutable);
  }

  private String fillCommonPlaceholders(String pTemplate) {
    return pTemplate
        .replace(COMPILER_NAME, compilerName)
        .replace(COMPILER_OPTIONS, compilerOptions);
  }

  private boolean execute(String pCommand, String pWhat) throws InterruptedException {
    try {
      int exitCode = ShellCommand.run(logger, pCommand);
      if (exitCode != 0) {
        logger.log(Level.FINE, "Could not", pWhat, "(exit code", exitCode + ")");
        return false;
      }
      return true;
    } catch (IOException e) {
      logger.logUserException(Level.WARNING, e, "Could not " + pWhat);
      return false;
    }
  }
}
