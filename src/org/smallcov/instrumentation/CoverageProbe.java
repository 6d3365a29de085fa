// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.instrumentation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.ast.c.CBinaryExpression;
import org.smallcov.ast.c.CBinaryExpression.BinaryOperator;
import org.smallcov.ast.c.CCompoundStatement;
import org.smallcov.ast.c.CDeclaration;
import org.smallcov.ast.c.CExpression;
import org.smallcov.ast.c.CExpressionAssignmentStatement;
import org.smallcov.ast.c.CFunctionCallExpression;
import org.smallcov.ast.c.CFunctionCallStatement;
import org.smallcov.ast.c.CFunctionDeclaration;
import org.smallcov.ast.c.CIdExpression;
import org.smallcov.ast.c.CIfStatement;
import org.smallcov.ast.c.CIntegerLiteralExpression;
import org.smallcov.ast.c.CStatement;
import org.smallcov.ast.c.CStringLiteralExpression;
import org.smallcov.ast.c.FileLocation;
import org.smallcov.types.c.CNumericTypes;
import org.smallcov.types.c.CType;

/**
 * Builds the statements that record the execution of a function:
 *
 * <pre>
 * if (_coverage_fout == 0) {
 *   _coverage_fout = fopen("coverage.path", "wb");
 * }
 * fprintf(_coverage_fout, "file.c\n");
 * fflush(_coverage_fout);
 * </pre>
 */
final class CoverageProbe {

  private static final FileLocation LOCATION = new FileLocation("<coverage probe>", 0);

  private final CIdExpression coverageFile;
  private final CStatement openCoverageFile;
  private final CDeclaration fprintf;
  private final CDeclaration fflush;

  CoverageProbe(PrimitivePrototypes pPrimitives, String pCoverageOutput)
      throws InterruptedException {
    checkNotNull(pCoverageOutput);
    coverageFile =
        new CIdExpression(LOCATION, pPrimitives.getDeclaration(PrimitivePrototypes.COVERAGE_FOUT));
    fprintf = pPrimitives.getDeclaration(PrimitivePrototypes.FPRINTF);
    fflush = pPrimitives.getDeclaration(PrimitivePrototypes.FFLUSH);

    CExpression isClosed =
        new CBinaryExpression(
            LOCATION,
            CNumericTypes.INT,
            coverageFile,
            CIntegerLiteralExpression.ZERO,
            BinaryOperator.EQUALS);
    CExpression open =
        call(
            pPrimitives.getDeclaration(PrimitivePrototypes.FOPEN),
            ImmutableList.of(
                CStringLiteralExpression.of(pCoverageOutput), CStringLiteralExpression.of("wb")));
    openCoverageFile =
        new CIfStatement(
            LOCATION,
            isClosed,
            new CCompoundStatement(
                LOCATION,
                ImmutableList.of(new CExpressionAssignmentStatement(LOCATION, coverageFile, open))),
            null);
  }

  /** The probe for a function defined in the given file. */
  ImmutableList<CStatement> statementsFor(String pFileName) {
    // the file name is used as format string
    String line = pFileName.replace("%", "%%") + "\n";
    return ImmutableList.of(
        openCoverageFile,
        new CFunctionCallStatement(
            LOCATION,
            call(fprintf, ImmutableList.of(coverageFile, CStringLiteralExpression.of(line)))),
        new CFunctionCallStatement(LOCATION, call(fflush, ImmutableList.of(coverageFile))));
  }

  private static CFunctionCallExpression call(CDeclaration pFunction, List<CExpression> pArgs) {
    @Nullable CFunctionDeclaration declaration = null;
    CType returnType = CNumericTypes.INT;
    if (pFunction instanceof CFunctionDeclaration) {
      declaration = (CFunctionDeclaration) pFunction;
      returnType = declaration.getType().getReturnType();
    }
    return new CFunctionCallExpression(
        LOCATION, returnType, new CIdExpression(LOCATION, pFunction), pArgs, declaration);
  }
}
