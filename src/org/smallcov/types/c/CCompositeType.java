// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.types.c;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A struct or union together with its member list. An empty name denotes an anonymous composite
 * which can only be used in place.
 */
public final class CCompositeType implements CComplexType {

  private static final long serialVersionUID = -839957929135012583L;

  private final boolean isConst;
  private final boolean isVolatile;
  private final ComplexTypeKind kind;
  private final String name;
  private @Nullable ImmutableList<CCompositeTypeMemberDeclaration> members;

  /** Create a composite whose members are set later with {@link #setMembers(List)}. */
  public CCompositeType(boolean pConst, boolean pVolatile, ComplexTypeKind pKind, String pName) {
    checkArgument(
        pKind == ComplexTypeKind.STRUCT || pKind == ComplexTypeKind.UNION,
        "%s is not a struct or union",
        pKind);
    isConst = pConst;
    isVolatile = pVolatile;
    kind = pKind;
    name = checkNotNull(pName);
  }

  public CCompositeType(
      boolean pConst,
      boolean pVolatile,
      ComplexTypeKind pKind,
      List<CCompositeTypeMemberDeclaration> pMembers,
      String pName) {
    this(pConst, pVolatile, pKind, pName);
    members = ImmutableList.copyOf(pMembers);
  }

  @Override
  public ComplexTypeKind getKind() {
    return kind;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getQualifiedName() {
    return TypeText.of(kind.toASTString()).add(name).toString();
  }

  public boolean isAnonymous() {
    return name.isEmpty();
  }

  public boolean hasMembers() {
    return members != null;
  }

  public ImmutableList<CCompositeTypeMemberDeclaration> getMembers() {
    checkState(members != null, "members of %s are not known yet", getQualifiedName());
    return members;
  }

  /** Sets the members once, after the type exists, so that members may point back to it. */
  public void setMembers(List<CCompositeTypeMemberDeclaration> pMembers) {
    checkState(members == null, "members of %s are already set", getQualifiedName());
    members = ImmutableList.copyOf(pMembers);
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
  public CCompositeType withQualifiers(boolean pConst, boolean pVolatile) {
    if ((isConst || !pConst) && (isVolatile || !pVolatile)) {
      return this;
    }
    CCompositeType qualified =
        new CCompositeType(isConst || pConst, isVolatile || pVolatile, kind, name);
    qualified.members = members;
    return qualified;
  }

  @Override
  public String toASTString(String pDeclarator) {
    return toASTString(pDeclarator, true);
  }

  /** Prints the type, with its member block only if <code>pWithMembers</code> is set. */
  public String toASTString(String pDeclarator, boolean pWithMembers) {
    checkNotNull(pDeclarator);
    TypeText text = TypeText.qualifiersOf(this).add(kind.toASTString()).add(name);
    if (pWithMembers) {
      text.add(members == null ? "/* members unknown */" : memberBlock(members));
    }
    return text.add(pDeclarator).toString();
  }

  private static String memberBlock(List<CCompositeTypeMemberDeclaration> pMembers) {
    StringBuilder block = new StringBuilder("{\n");
    for (CCompositeTypeMemberDeclaration member : pMembers) {
      block.append("  ").append(member.toASTString()).append('\n');
    }
    return block.append('}').toString();
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
    return Objects.hash(isConst, isVolatile, kind, name);
  }

  /** Composites are compared by kind and name, the members are not looked at. */
  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CCompositeType)) {
      return false;
    }
    CCompositeType other = (CCompositeType) obj;
    return isConst == other.isConst
        && isVolatile == other.isVolatile
        && kind == other.kind
        && name.equals(other.name);
  }

  /** A member of a struct or union. Unnamed members (padding bit fields) have no name. */
  public static final class CCompositeTypeMemberDeclaration implements Serializable {

    private static final long serialVersionUID = 8647666228796784933L;

    private final CType type;
    private final @Nullable String name;

    public CCompositeTypeMemberDeclaration(CType pType, @Nullable String pName) {
      type = checkNotNull(pType);
      name = pName;
    }

    public CType getType() {
      return type;
    }

    public @Nullable String getName() {
      return name;
    }

    public String toASTString() {
      return type.toASTString(Strings.nullToEmpty(name)) + ";";
    }

    @Override
    public String toString() {
      return toASTString();
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, name);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof CCompositeTypeMemberDeclaration)) {
        return false;
      }
      CCompositeTypeMemberDeclaration other = (CCompositeTypeMemberDeclaration) obj;
      return type.equals(other.type) && Objects.equals(name, other.name);
    }
  }
}
