// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.exec;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class TestCaseTest {

  @Test
  public void testNames() {
    assertThat(TestCase.positive(3).getName()).isEqualTo("p3");
    assertThat(TestCase.negative(1).getName()).isEqualTo("n1");
  }

  @Test
  public void testEquality() {
    assertThat(TestCase.positive(1)).isEqualTo(TestCase.positive(1));
    assertThat(TestCase.positive(1)).isNotEqualTo(TestCase.negative(1));
    assertThat(TestCase.positive(1).hashCode()).isEqualTo(TestCase.positive(1).hashCode());
  }

  @Test
  public void testNumbersStartAtOne() {
    assertThrows(IllegalArgumentException.class, () -> TestCase.positive(0));
  }
}
