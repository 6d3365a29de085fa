// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.ast.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.types.c.CType;

public final class CFunctionCallExpression extends AbstractExpression {

  private static final long serialVersionUID = 5614917329716898498L;

  private final CExpression functionName;
  private final ImmutableList<CExpression> parameters;
  private final @Nullable CFunctionDeclaration declaration;

  public CFunctionCallExpression(
      FileLocation pFileLocation,
      CType pType,
      CExpression pFunctionName,
      List<? extends CExpression> pParameters,
      @Nullable CFunctionDeclaration pDeclaration) {
    super(pFileLocation, pType);
    functionName = checkNotNull(pFunctionName);
    parameters = ImmutableList.copyOf(pParameters);
    declaration = pDeclaration;
  }

  public CExpression getFunctionNameExpression() {
    return functionName;
  }

  public ImmutableList<CExpression> getParameterExpressions() {
    return parameters;
  }

  /**
   * Get the declaration of the function. A function may have several declarations in a C file
   * (several forward declarations without a body, and one with it). In this case, it is not
   * defined which declaration is returned.
   *
   * <p>The result may be null if the function was not declared, or if a complex function name
   * expression is used (i.e., a function pointer).
   */
  public @Nullable CFunctionDeclaration getDeclaration() {
    return declaration;
  }

  @Override
  public String toASTString() {
    StringBuilder lASTString = new StringBuilder();
    lASTString.append(functionName.toParenthesizedASTString());
    lASTString.append("(");
    Joiner.on(", ").appendTo(lASTString, Iterables.transform(parameters, CExpression::toASTString));
    lASTString.append(")");
    return lASTString.toString();
  }

  @Override
  public <R, X extends Exception> R accept(CExpressionVisitor<R, X> v) throws X {
    return v.visit(this);
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + Objects.hash(functionName, parameters);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!super.equals(obj)) {
      return false;
    }
    CFunctionCallExpression other = (CFunctionCallExpression) obj;
    return functionName.equals(other.functionName) && parameters.equals(other.parameters);
  }
}
