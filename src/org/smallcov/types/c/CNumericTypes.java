// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import org.smallcov.types.c.CSimpleType.Length;
import org.smallcov.types.c.CSimpleType.Signedness;

public final class CNumericTypes {

  private CNumericTypes() {}

  public static final CSimpleType BOOL = simple(CBasicType.BOOL, Signedness.NONE, Length.NONE);
  public static final CSimpleType CHAR = simple(CBasicType.CHAR, Signedness.NONE, Length.NONE);
  public static final CSimpleType INT = simple(CBasicType.INT, Signedness.NONE, Length.NONE);
  public static final CSimpleType UNSIGNED_INT =
      simple(CBasicType.INT, Signedness.UNSIGNED, Length.NONE);
  public static final CSimpleType LONG_INT = simple(CBasicType.INT, Signedness.NONE, Length.LONG);
  public static final CSimpleType UNSIGNED_LONG_INT =
      simple(CBasicType.INT, Signedness.UNSIGNED, Length.LONG);
  public static final CSimpleType DOUBLE =
      simple(CBasicType.DOUBLE, Signedness.NONE, Length.NONE);

  public static final CSimpleType CONST_CHAR = CHAR.withQualifiers(true, false);

  /** The type {@code size_t} has on the supported 64-bit targets. */
  public static final CSimpleType SIZE_T = UNSIGNED_LONG_INT;

  private static CSimpleType simple(CBasicType pType, Signedness pSignedness, Length pLength) {
    return new CSimpleType(false, false, pType, pSignedness, pLength);
  }
}
