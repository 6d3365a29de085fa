// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.exec;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A test of the program under repair. Positive tests pass on the original program, negative
 * tests expose the fault.
 */
@Immutable
public final class TestCase {

  private final boolean positive;
  private final int number;

  private TestCase(boolean pPositive, int pNumber) {
    checkArgument(pNumber > 0, "test numbers start at 1, got %s", pNumber);
    positive = pPositive;
    number = pNumber;
  }

  public static TestCase positive(int pNumber) {
    return new TestCase(true, pNumber);
  }

  public static TestCase negative(int pNumber) {
    return new TestCase(false, pNumber);
  }

  public boolean isPositive() {
    return positive;
  }

  public int getNumber() {
    return number;
  }

  /** The name passed to the test script, <code>p1</code> or <code>n1</code>. */
  public String getName() {
    return (positive ? "p" : "n") + number;
  }

  @Override
  public String toString() {
    return getName();
  }

  @Override
  public int hashCode() {
    return 31 * Boolean.hashCode(positive) + number;
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof TestCase)) {
      return false;
    }
    TestCase other = (TestCase) pObj;
    return positive == other.positive && number == other.number;
  }
}
