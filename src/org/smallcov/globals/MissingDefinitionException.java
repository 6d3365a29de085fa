// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown if a global needs a name for which there is neither a declaration nor a definition in
 * the program.
 */
public class MissingDefinitionException extends Exception {

  private static final long serialVersionUID = -4385736172845293754L;

  private final DependencyTag tag;

  public MissingDefinitionException(DependencyTag pTag) {
    super("Missing definition for " + pTag);
    tag = checkNotNull(pTag);
  }

  /** Returns the tag that was requested but could not be found. */
  public DependencyTag getTag() {
    return tag;
  }
}
