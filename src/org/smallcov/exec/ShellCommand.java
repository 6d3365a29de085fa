// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.exec;

import java.io.IOException;
import java.util.logging.Level;
import org.sosy_lab.common.ProcessExecutor;
import org.sosy_lab.common.log.LogManager;

/**
 * Runs a single command line through <code>/bin/sh -c</code>, so that redirections in command
 * templates work. Output of the command is only logged.
 */
final class ShellCommand extends ProcessExecutor<IOException> {

  private ShellCommand(LogManager pLogger, String pCommandLine) throws IOException {
    super(pLogger, IOException.class, "/bin/sh", "-c", pCommandLine);
  }

  /**
   * Execute the command line and wait for it.
   *
   * @return the exit code of the shell
   * @throws IOException if the shell cannot be started
   */
  static int run(LogManager pLogger, String pCommandLine)
      throws IOException, InterruptedException {
    pLogger.log(Level.FINER, "Executing", pCommandLine);
    return new ShellCommand(pLogger, pCommandLine).join();
  }

  @Override
  protected void handleOutput(String pLine) {
    logger.log(Level.FINEST, pLine);
  }

  @Override
  protected void handleErrorOutput(String pLine) {
    logger.log(Level.FINEST, pLine);
  }

  @Override
  protected void handleExitCode(int pCode) {
    if (pCode != 0) {
      logger.log(Level.FINER, "Command exited with code", pCode);
    }
  }
}
