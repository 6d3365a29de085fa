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
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.ast.c.CExpression;
import org.smallcov.ast.c.CSimpleDeclaration;

/** An enum together with its enumerators. An empty name denotes an anonymous enum. */
public final class CEnumType implements CComplexType {

  private static final long serialVersionUID = -986078271714119880L;

  private static final Joiner ENUMERATOR_JOINER = Joiner.on(",\n  ");

  private final boolean isConst;
  private final boolean isVolatile;
  private final String name;
  private final ImmutableList<CEnumerator> enumerators;

  public CEnumType(
      boolean pConst, boolean pVolatile, List<CEnumerator> pEnumerators, String pName) {
    isConst = pConst;
    isVolatile = pVolatile;
    enumerators = ImmutableList.copyOf(pEnumerators);
    name = checkNotNull(pName);
    for (CEnumerator enumerator : enumerators) {
      // qualified copies share the enumerators of the type they were made from
      if (enumerator.enumType == null) {
        enumerator.enumType = this;
      }
    }
  }

  @Override
  public ComplexTypeKind getKind() {
    return ComplexTypeKind.ENUM;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getQualifiedName() {
    return TypeText.of("enum").add(name).toString();
  }

  public boolean isAnonymous() {
    return name.isEmpty();
  }

  public ImmutableList<CEnumerator> getEnumerators() {
    return enumerators;
  }

  @Override
  public boolean isConst() {
    return isConst;
  }

  @Override
  public boolean isVolatile() {
    return isVolatile;
  }

  @Override
  public CEnumType withQualifiers(boolean pConst, boolean pVolatile) {
    if ((isConst || !pConst) && (isVolatile || !pVolatile)) {
      return this;
    }
    return new CEnumType(isConst || pConst, isVolatile || pVolatile, enumerators, name);
  }

  @Override
  public String toASTString(String pDeclarator) {
    return toASTString(pDeclarator, true);
  }

  /** Prints the type, with its enumerator block only if <code>pWithEnumerators</code> is set. */
  public String toASTString(String pDeclarator, boolean pWithEnumerators) {
    checkNotNull(pDeclarator);
    TypeText text = TypeText.qualifiersOf(this).add("enum").add(name);
    if (pWithEnumerators) {
      List<String> lines = Lists.transform(enumerators, CEnumerator::toASTString);
      text.add("{\n  " + ENUMERATOR_JOINER.join(lines) + "\n}");
    }
    return text.add(pDeclarator).toString();
  }

  @Override
  public String toString() {
    return toASTString("", false);
  }

  @Override
  public <R, X extends Exception> R accept(CTypeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(isConst, isVolatile, name);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CEnumType)) {
      return false;
    }
    CEnumType other = (CEnumType) obj;
    return isConst == other.isConst
        && isVolatile == other.isVolatile
        && name.equals(other.name)
        && enumerators.equals(other.enumerators);
  }

  /** An enumeration constant, with its explicit value if one was written. */
  public static final class CEnumerator implements CSimpleDeclaration {

    private static final long serialVersionUID = -2526725372840523651L;

    private final String name;
    private final @Nullable CExpression value;
    private @Nullable CEnumType enumType;

    public CEnumerator(String pName, @Nullable CExpression pValue) {
      name = checkNotNull(pName);
      value = pValue;
    }

    @Override
    public String getName() {
      return name;
    }

    /** Enumeration constants have type int (C11 § 6.4.4.3). */
    @Override
    public CType getType() {
      return CNumericTypes.INT;
    }

    public @Nullable CExpression getValue() {
      return value;
    }

    /** Returns the enum this constant belongs to, null until the enum has been created. */
    public @Nullable CEnumType getEnum() {
      return enumType;
    }

    @Override
    public String toASTString() {
      return value == null ? name : name + " = " + value.toASTString();
    }

    @Override
    public String toString() {
      return toASTString();
    }

    // the enum is left out, it compares its enumerators itself
    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      if (obj == this) {
        return true;
      }
      if (!(obj instanceof CEnumerator)) {
        return false;
      }
      CEnumerator other = (CEnumerator) obj;
      return name.equals(other.name) && Objects.equals(value, other.value);
    }
  }
}
