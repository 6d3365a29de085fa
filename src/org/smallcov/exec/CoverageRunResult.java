// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.exec;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

/** Outcome of running the test suite against an instrumented program. */
public final class CoverageRunResult {

  private static final CoverageRunResult NOT_COMPILED =
      new CoverageRunResult(false, ImmutableSet.of(), ImmutableSet.of());

  private final boolean compiled;
  private final ImmutableSet<TestCase> coveringTests;
  private final ImmutableSet<TestCase> unexpectedTests;

  CoverageRunResult(
      boolean pCompiled,
      ImmutableSet<TestCase> pCoveringTests,
      ImmutableSet<TestCase> pUnexpectedTests) {
    compiled = pCompiled;
    coveringTests = pCoveringTests;
    unexpectedTests = pUnexpectedTests;
  }

  /** Result for a program that could not be built, no test was run. */
  public static CoverageRunResult notCompiled() {
    return NOT_COMPILED;
  }

  public boolean isCompiled() {
    return compiled;
  }

  /** Tests during which at least one probe was hit. */
  public ImmutableSet<TestCase> getCoveringTests() {
    return coveringTests;
  }

  /** Negative tests that passed and positive tests that failed. */
  public ImmutableSet<TestCase> getUnexpectedTests() {
    return unexpectedTests;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("compiled", compiled)
        .add("covering", coveringTests)
        .add("unexpected", unexpectedTests)
        .toString();
  }
}
