// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.exec;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;

/** Runs the test suite of the program under repair through a configurable test script. */
@Options(prefix = "tests")
public class TestRunner {

  static final String TEST_SCRIPT = "__TEST_SCRIPT__";
  static final String TEST_NAME = "__TEST_NAME__";
  static final String EXE_NAME = "__EXE_NAME__";
  static final String SOURCE_NAME = "__SOURCE_NAME__";

  @Option(secure = true, name = "script", description = "the script that runs a single test")
  private String testScript = "sh test.sh";

  @Option(
      secure = true,
      name = "command",
      description =
          "template for the command that runs a single test; "
              + "__TEST_SCRIPT__, __TEST_NAME__, __EXE_NAME__ and __SOURCE_NAME__ are replaced")
  private String testCommand =
      TEST_SCRIPT
          + " "
          + TEST_NAME
          + " "
          + EXE_NAME
          + " "
          + SOURCE_NAME
          + " 2>/dev/null >/dev/null";

  @Option(secure = true, name = "positive", description = "number of positive tests")
  private int posTests = 1;

  @Option(secure = true, name = "negative", description = "number of negative tests")
  private int negTests = 1;

  private final LogManager logger;

  public TestRunner(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this, TestRunner.class);
    if (posTests < 0 || negTests < 0) {
      throw new InvalidConfigurationException("Number of tests must not be negative");
    }
    logger = pLogger;
  }

  /**
   * Run a single test.
   *
   * @return whether the test passed, i.e., the test script exited with code 0
   */
  public boolean runTest(Path pExecutable, String pSource, TestCase pTest)
      throws InterruptedException {
    String command =
        testCommand
            .replace(TEST_SCRIPT, testScript)
            .replace(TEST_NAME, pTest.getName())
            .replace(EXE_NAME, pExecutable.toString())
            .replace(SOURCE_NAME, pSource);
    try {
      return ShellCommand.run(logger, command) == 0;
    } catch (IOException e) {
      logger.logUserException(Level.WARNING, e, "Could not run test " + pTest);
      return false;
    }
  }

  /**
   * Run all negative and then all positive tests and record which of them executed
   * instrumented code.
   *
   * @param pCoverageFile the file the instrumented program writes its coverage into; it is
   *     emptied before each test
   * @throws IOException if the coverage file cannot be reset or read
   */
  public CoverageRunResult runTests(Path pCoverageFile, Path pExecutable, String pSource)
      throws IOException, InterruptedException {
    ImmutableSet.Builder<TestCase> covering = ImmutableSet.builder();
    ImmutableSet.Builder<TestCase> unexpected = ImmutableSet.builder();

    for (TestCase test : getTests()) {
      Files.deleteIfExists(pCoverageFile);
      MoreFiles.createParentDirectories(pCoverageFile);
      Files.createFile(pCoverageFile);

      boolean passed = runTest(pExecutable, pSource, test);
      if (passed != test.isPositive()) {
        logger.log(Level.FINE, "Test", test, passed ? "passed" : "failed", "unexpectedly");
        unexpected.add(test);
      }
      if (MoreFiles.asCharSource(pCoverageFile, StandardCharsets.UTF_8).readFirstLine() != null) {
        covering.add(test);
      }
    }

    return new CoverageRunResult(true, covering.build(), unexpected.build());
  }

  /** All configured tests, negative ones first. */
  ImmutableSet<TestCase> getTests() {
    ImmutableSet.Builder<TestCase> tests = ImmutableSet.builder();
    for (int i = 1; i <= negTests; i++) {
      tests.add(TestCase.negative(i));
    }
    for (int i = 1; i <= posTests; i++) {
      tests.add(TestCase.positive(i));
    }
    return tests.build();
  }
}
