// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.exceptions;

/**
 * Exception type to use as a type argument for visitors and other code that is generic over its
 * exception but cannot throw one. Can never be instantiated.
 */
public final class NoException extends RuntimeException {

  private static final long serialVersionUID = 2394812345123L;

  private NoException() {}
}
