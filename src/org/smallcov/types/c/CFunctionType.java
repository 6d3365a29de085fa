// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The type of a C function. Parameter names are not part of the type, they are stored in {@link
 * org.smallcov.ast.c.CFunctionDeclaration}.
 */
public final class CFunctionType implements CType {

  private static final long serialVersionUID = 2413264436915428497L;

  private final CType returnType;
  private final ImmutableList<CType> parameters;
  private final boolean takesVarArgs;

  public CFunctionType(CType pReturnType, List<CType> pParameters, boolean pTakesVarArgs) {
    returnType = checkNotNull(pReturnType);
    parameters = ImmutableList.copyOf(pParameters);
    takesVarArgs = pTakesVarArgs;
  }

  public CType getReturnType() {
    return returnType;
  }

  public ImmutableList<CType> getParameters() {
    return parameters;
  }

  public boolean takesVarArgs() {
    return takesVarArgs;
  }

  @Override
  public boolean isConst() {
    return false;
  }

  @Override
  public boolean isVolatile() {
    return false;
  }

  @Override
  public CFunctionType withQualifiers(boolean pConst, boolean pVolatile) {
    return this;
  }

  @Override
  public String toASTString(String pDeclarator) {
    checkNotNull(pDeclarator);
    return toASTString(
        pDeclarator, Lists.transform(parameters, parameter -> parameter.toASTString("")));
  }

  /**
   * Render this function type around the given declarator, using the given strings for the
   * parameters (e.g., with names attached).
   */
  public String toASTString(String pDeclarator, List<String> pParameterStrings) {
    List<String> parameterList = new ArrayList<>(pParameterStrings);
    if (takesVarArgs) {
      parameterList.add("...");
    } else if (parameterList.isEmpty()) {
      parameterList.add("void");
    }
    return returnType.toASTString(pDeclarator + "(" + Joiner.on(", ").join(parameterList) + ")");
  }

  @Override
  public String toString() {
    return toASTString("");
  }

  @Override
  public <R, X extends Exception> R accept(CTypeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(returnType, parameters, takesVarArgs);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CFunctionType)) {
      return false;
    }
    CFunctionType other = (CFunctionType) obj;
    return takesVarArgs == other.takesVarArgs
        && Objects.equals(returnType, other.returnType)
        && Objects.equals(parameters, other.parameters);
  }
}
