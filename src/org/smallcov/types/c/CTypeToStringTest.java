// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.smallcov.ast.c.CIntegerLiteralExpression;
import org.smallcov.types.c.CComplexType.ComplexTypeKind;
import org.smallcov.types.c.CCompositeType.CCompositeTypeMemberDeclaration;

@RunWith(Parameterized.class)
@SuppressFBWarnings(
    value = "NP_NONNULL_FIELD_NOT_INITIALIZED_IN_CONSTRUCTOR",
    justification = "Fields are filled by parameterization of JUnit")
public class CTypeToStringTest {

  private static final String VAR = "var";

  private static final CIntegerLiteralExpression THREE =
      CIntegerLiteralExpression.createDummyLiteral(3L, CNumericTypes.INT);

  private static final CCompositeType STRUCT_S =
      new CCompositeType(
          false,
          false,
          ComplexTypeKind.STRUCT,
          ImmutableList.of(new CCompositeTypeMemberDeclaration(CNumericTypes.INT, "x")),
          "s");

  private static final CTypedefType SIZE_T =
      new CTypedefType(false, false, "size_t", CNumericTypes.UNSIGNED_LONG_INT);

  @Parameters(name = "{0}")
  public static Object[][] types() {
    return new Object[][] {
      // NUMERICS
      {"int var", CNumericTypes.INT},
      {"unsigned long int var", CNumericTypes.UNSIGNED_LONG_INT},
      {"const char var", CNumericTypes.CONST_CHAR},
      {"_Bool var", CNumericTypes.BOOL},

      // POINTERS
      {"char *var", CPointerType.POINTER_TO_CHAR},
      {"const char *var", CPointerType.POINTER_TO_CONST_CHAR},
      { // declare var as const pointer to int
        "int * const var", new CPointerType(true, false, CNumericTypes.INT),
      },
      { // declare var as pointer to pointer to void
        "void **var", new CPointerType(false, false, CPointerType.POINTER_TO_VOID),
      },

      // ARRAYS
      {"int var[3]", new CArrayType(false, false, CNumericTypes.INT, THREE)},
      {"double var[]", new CArrayType(false, false, CNumericTypes.DOUBLE, null)},
      { // declare var as array 3 of pointer to char
        "char *var[3]", new CArrayType(false, false, CPointerType.POINTER_TO_CHAR, THREE),
      },
      { // declare var as pointer to array 3 of int
        "int (*var)[3]",
        new CPointerType(false, false, new CArrayType(false, false, CNumericTypes.INT, THREE)),
      },

      // FUNCTIONS
      {"int var(void)", new CFunctionType(CNumericTypes.INT, ImmutableList.of(), false)},
      {
        "int var(const char *, ...)",
        new CFunctionType(
            CNumericTypes.INT, ImmutableList.of(CPointerType.POINTER_TO_CONST_CHAR), true),
      },
      { // declare var as pointer to function (char) returning int
        "int (*var)(char)",
        new CPointerType(
            false,
            false,
            new CFunctionType(CNumericTypes.INT, ImmutableList.of(CNumericTypes.CHAR), false)),
      },

      // NAMED TYPES
      {"size_t var", SIZE_T},
      {
        "const size_t var",
        new CTypedefType(true, false, "size_t", CNumericTypes.UNSIGNED_LONG_INT),
      },
      {"struct s var", new CElaboratedType(false, false, ComplexTypeKind.STRUCT, "s", STRUCT_S)},
      { // a pointer never repeats the members of its target
        "struct s *var", new CPointerType(false, false, STRUCT_S),
      },
      {"struct s {\n  int x;\n} var", STRUCT_S},
    };
  }

  @Parameter(0)
  public String stringRepr;

  @Parameter(1)
  public CType type;

  @Test
  public void testToString() {
    assertThat(type.toASTString(VAR)).isEqualTo(stringRepr);
  }

  @Test
  public void testUnrolledTypeHasNoTypedefs() {
    assertThat(CTypes.unrollTypedefs(type).toASTString(VAR)).doesNotContain("size_t");
  }
}
