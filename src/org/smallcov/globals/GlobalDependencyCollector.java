// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.globals;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.ast.c.CArraySubscriptExpression;
import org.smallcov.ast.c.CBinaryExpression;
import org.smallcov.ast.c.CBinaryExpression.BinaryOperator;
import org.smallcov.ast.c.CCastExpression;
import org.smallcov.ast.c.CCharLiteralExpression;
import org.smallcov.ast.c.CComplexTypeDeclaration;
import org.smallcov.ast.c.CCompoundStatement;
import org.smallcov.ast.c.CDeclaration;
import org.smallcov.ast.c.CDeclarationStatement;
import org.smallcov.ast.c.CExpression;
import org.smallcov.ast.c.CExpressionAssignmentStatement;
import org.smallcov.ast.c.CExpressionStatement;
import org.smallcov.ast.c.CExpressionVisitor;
import org.smallcov.ast.c.CFieldReference;
import org.smallcov.ast.c.CFloatLiteralExpression;
import org.smallcov.ast.c.CForStatement;
import org.smallcov.ast.c.CFunctionCallExpression;
import org.smallcov.ast.c.CFunctionCallStatement;
import org.smallcov.ast.c.CFunctionDeclaration;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CGlobalText;
import org.smallcov.ast.c.CGlobalVisitor;
import org.smallcov.ast.c.CIdExpression;
import org.smallcov.ast.c.CIfStatement;
import org.smallcov.ast.c.CInitializer;
import org.smallcov.ast.c.CInitializerExpression;
import org.smallcov.ast.c.CInitializerList;
import org.smallcov.ast.c.CIntegerLiteralExpression;
import org.smallcov.ast.c.CJumpStatement;
import org.smallcov.ast.c.CLabeledStatement;
import org.smallcov.ast.c.CPointerExpression;
import org.smallcov.ast.c.CReturnStatement;
import org.smallcov.ast.c.CSimpleDeclaration;
import org.smallcov.ast.c.CStatement;
import org.smallcov.ast.c.CStatementVisitor;
import org.smallcov.ast.c.CStringLiteralExpression;
import org.smallcov.ast.c.CTypeDefDeclaration;
import org.smallcov.ast.c.CTypeIdExpression;
import org.smallcov.ast.c.CUnaryExpression;
import org.smallcov.ast.c.CUnaryExpression.UnaryOperator;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.ast.c.CWhileStatement;
import org.smallcov.types.c.CArrayType;
import org.smallcov.types.c.CBitFieldType;
import org.smallcov.types.c.CCompositeType;
import org.smallcov.types.c.CCompositeType.CCompositeTypeMemberDeclaration;
import org.smallcov.types.c.CElaboratedType;
import org.smallcov.types.c.CEnumType;
import org.smallcov.types.c.CEnumType.CEnumerator;
import org.smallcov.types.c.CFunctionType;
import org.smallcov.types.c.CPointerType;
import org.smallcov.types.c.CSimpleType;
import org.smallcov.types.c.CType;
import org.smallcov.types.c.CTypeVisitor;
import org.smallcov.types.c.CTypedefType;
import org.smallcov.types.c.CTypes;
import org.smallcov.types.c.CVoidType;

/**
 * Computes which other globals a global needs, and at which strength.
 *
 * <p>A type used through a pointer needs only a declaration, a type used as array element needs a
 * definition, and every other type occurrence needs the strength the global itself was requested
 * at. Expressions that depend on the layout of a type (sizeof, pointer arithmetic, member and
 * element access) need its definition. Used global variables and functions need a declaration.
 * All requested tags are resolved against an {@link InstantiationTable}.
 */
public final class GlobalDependencyCollector {

  private final InstantiationTable table;

  public GlobalDependencyCollector(InstantiationTable pTable) {
    table = checkNotNull(pTable);
  }

  /** The outcome of {@link #collectDependencies(CGlobal, DependencyTag)}. */
  public static final class Dependencies {

    private final ImmutableList<DependencyTag> dependencies;
    private final boolean containsArrayType;

    private Dependencies(ImmutableList<DependencyTag> pDependencies, boolean pContainsArrayType) {
      dependencies = pDependencies;
      containsArrayType = pContainsArrayType;
    }

    /** Returns the resolved tags, in order of first occurrence and without duplicates. */
    public ImmutableList<DependencyTag> getDependencies() {
      return dependencies;
    }

    /** Whether an array type occurred anywhere in the global. */
    public boolean containsArrayType() {
      return containsArrayType;
    }

    @Override
    public String toString() {
      return dependencies + (containsArrayType ? " (with array)" : "");
    }
  }

  /**
   * Collect the dependencies of a global.
   *
   * @param pGlobal the global to inspect
   * @param pCurrentTag the tag under which the global was requested; its strength determines the
   *     strength of plain type occurrences, and tags of the same entity are not reported
   * @throws MissingDefinitionException if a required name has no declaration or definition
   */
  public Dependencies collectDependencies(CGlobal pGlobal, DependencyTag pCurrentTag)
      throws MissingDefinitionException {
    Walker walker = new Walker(pCurrentTag);
    pGlobal.accept(walker);
    return new Dependencies(ImmutableList.copyOf(walker.dependencies), walker.containsArrayType);
  }

  /** Traverses one global. All visit methods return null. */
  private final class Walker
      implements CGlobalVisitor<Void, MissingDefinitionException>,
          CStatementVisitor<Void, MissingDefinitionException>,
          CExpressionVisitor<Void, MissingDefinitionException> {

    private final DependencyTag currentTag;
    private final Set<DependencyTag> dependencies = new LinkedHashSet<>();
    private boolean containsArrayType = false;

    // typedef and tag names declared in the enclosing blocks
    private Set<String> localTypedefs = new HashSet<>();
    private Set<String> localTags = new HashSet<>();

    Walker(DependencyTag pCurrentTag) {
      currentTag = pCurrentTag;
    }

    private void addDependency(DependencyTag pTag) throws MissingDefinitionException {
      DependencyTag resolved = table.resolveTag(pTag);
      if (!resolved.sameEntity(currentTag)) {
        dependencies.add(resolved);
      }
    }

    /** Walk a type with the strength the current global was requested at. */
    private void walkType(CType pType) throws MissingDefinitionException {
      walkType(pType, currentTag.isDefinition());
    }

    private void walkType(CType pType, boolean pDefinition) throws MissingDefinitionException {
      CType dependedType;
      boolean dependedStrength;
      if (pType instanceof CArrayType) {
        containsArrayType = true;
        dependedType = ((CArrayType) pType).getType();
        dependedStrength = true;
      } else if (pType instanceof CPointerType) {
        dependedType = ((CPointerType) pType).getType();
        dependedStrength = false;
      } else {
        dependedType = pType;
        dependedStrength = pDefinition;
      }

      DependencyTag named = getNamedTypeTag(dependedType, dependedStrength);
      if (named != null && isLocal(named)) {
        // declared in the function body, its own declaration statement was walked already
        return;
      } else if (named != null) {
        addDependency(named);
      } else {
        pType.accept(new TypeWalker(pDefinition));
      }
    }

    private boolean isLocal(DependencyTag pTag) {
      switch (pTag.getNamespace()) {
        case TYPEDEF:
          return localTypedefs.contains(pTag.getName());
        case TAG:
          return localTags.contains(pTag.getName());
        default:
          return false;
      }
    }

    private void walkExpression(@Nullable CExpression pExpression)
        throws MissingDefinitionException {
      if (pExpression != null) {
        pExpression.accept(this);
      }
    }

    private void walkStatement(@Nullable CStatement pStatement) throws MissingDefinitionException {
      if (pStatement != null) {
        pStatement.accept(this);
      }
    }

    private void walkInitializer(@Nullable CInitializer pInitializer)
        throws MissingDefinitionException {
      if (pInitializer instanceof CInitializerExpression) {
        walkExpression(((CInitializerExpression) pInitializer).getExpression());
      } else if (pInitializer instanceof CInitializerList) {
        for (CInitializer initializer : ((CInitializerList) pInitializer).getInitializers()) {
          walkInitializer(initializer);
        }
      }
    }

    /** Require the definition of what a pointer or array operand points to. */
    private void walkPointee(CExpression pOperand) throws MissingDefinitionException {
      CType pointee = CTypes.getPointeeType(pOperand.getExpressionType());
      if (pointee != null) {
        walkType(pointee, true);
      }
    }

    // globals

    @Override
    public Void visit(CTypeDefDeclaration pDecl) throws MissingDefinitionException {
      walkType(pDecl.getType());
      return null;
    }

    @Override
    public Void visit(CComplexTypeDeclaration pDecl) throws MissingDefinitionException {
      CType type = pDecl.getType();
      if (type instanceof CCompositeType && ((CCompositeType) type).hasMembers()) {
        for (CCompositeTypeMemberDeclaration member : ((CCompositeType) type).getMembers()) {
          walkType(member.getType());
        }
      } else if (type instanceof CEnumType) {
        for (CEnumerator enumerator : ((CEnumType) type).getEnumerators()) {
          walkExpression(enumerator.getValue());
        }
      }
      return null;
    }

    @Override
    public Void visit(CVariableDeclaration pDecl) throws MissingDefinitionException {
      walkType(pDecl.getType());
      walkInitializer(pDecl.getInitializer());
      return null;
    }

    @Override
    public Void visit(CFunctionDeclaration pDecl) throws MissingDefinitionException {
      walkType(pDecl.getType());
      return null;
    }

    @Override
    public Void visit(CFunctionDefinition pDef) throws MissingDefinitionException {
      walkType(pDef.getDeclaration().getType());
      walkStatement(pDef.getBody());
      return null;
    }

    @Override
    public Void visit(CGlobalText pText) {
      return null;
    }

    // statements

    @Override
    public Void visit(CCompoundStatement pStatement) throws MissingDefinitionException {
      Set<String> outerTypedefs = localTypedefs;
      Set<String> outerTags = localTags;
      localTypedefs = new HashSet<>(outerTypedefs);
      localTags = new HashSet<>(outerTags);
      for (CStatement statement : pStatement.getStatements()) {
        statement.accept(this);
      }
      localTypedefs = outerTypedefs;
      localTags = outerTags;
      return null;
    }

    @Override
    public Void visit(CExpressionStatement pStatement) throws MissingDefinitionException {
      walkExpression(pStatement.getExpression());
      return null;
    }

    @Override
    public Void visit(CExpressionAssignmentStatement pStatement)
        throws MissingDefinitionException {
      walkExpression(pStatement.getLeftHandSide());
      walkExpression(pStatement.getRightHandSide());
      return null;
    }

    @Override
    public Void visit(CFunctionCallStatement pStatement) throws MissingDefinitionException {
      walkExpression(pStatement.getFunctionCallExpression());
      return null;
    }

    @Override
    public Void visit(CDeclarationStatement pStatement) throws MissingDefinitionException {
      CDeclaration declaration = pStatement.getDeclaration();
      if (declaration instanceof CComplexTypeDeclaration && !declaration.getName().isEmpty()) {
        // in scope for its own members already
        localTags.add(declaration.getName());
      }
      declaration.accept(this);
      if (declaration instanceof CTypeDefDeclaration) {
        localTypedefs.add(declaration.getName());
      }
      return null;
    }

    @Override
    public Void visit(CIfStatement pStatement) throws MissingDefinitionException {
      walkExpression(pStatement.getCondition());
      walkStatement(pStatement.getThenStatement());
      walkStatement(pStatement.getElseStatement());
      return null;
    }

    @Override
    public Void visit(CWhileStatement pStatement) throws MissingDefinitionException {
      walkExpression(pStatement.getCondition());
      walkStatement(pStatement.getBody());
      return null;
    }

    @Override
    public Void visit(CForStatement pStatement) throws MissingDefinitionException {
      walkStatement(pStatement.getInitializer());
      walkExpression(pStatement.getCondition());
      walkStatement(pStatement.getIteration());
      walkStatement(pStatement.getBody());
      return null;
    }

    @Override
    public Void visit(CReturnStatement pStatement) throws MissingDefinitionException {
      walkExpression(pStatement.getReturnValue().orElse(null));
      return null;
    }

    @Override
    public Void visit(CJumpStatement pStatement) {
      return null;
    }

    @Override
    public Void visit(CLabeledStatement pStatement) throws MissingDefinitionException {
      walkStatement(pStatement.getStatement());
      return null;
    }

    // expressions

    @Override
    public Void visit(CIdExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      // the variable itself is the host of this lvalue
      walkType(e.getExpressionType(), true);
      CSimpleDeclaration declaration = e.getDeclaration();
      if (declaration instanceof CFunctionDeclaration
          || (declaration instanceof CVariableDeclaration
              && ((CVariableDeclaration) declaration).isGlobal())) {
        addDependency(DependencyTag.declaration(Namespace.VARIABLE, e.getName()));
      } else if (declaration instanceof CEnumerator) {
        // the constant is only known together with its enum
        CEnumType enumType = ((CEnumerator) declaration).getEnum();
        if (enumType != null && !enumType.isAnonymous()) {
          DependencyTag enumTag = DependencyTag.definition(Namespace.TAG, enumType.getName());
          if (!isLocal(enumTag)) {
            addDependency(enumTag);
          }
        }
      }
      return null;
    }

    @Override
    public Void visit(CIntegerLiteralExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      return null;
    }

    @Override
    public Void visit(CCharLiteralExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      return null;
    }

    @Override
    public Void visit(CFloatLiteralExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      return null;
    }

    @Override
    public Void visit(CStringLiteralExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      return null;
    }

    @Override
    public Void visit(CUnaryExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      if (e.getOperator() == UnaryOperator.SIZEOF || e.getOperator() == UnaryOperator.ALIGNOF) {
        walkType(e.getOperand().getExpressionType(), true);
      }
      walkExpression(e.getOperand());
      return null;
    }

    @Override
    public Void visit(CTypeIdExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      walkType(e.getType(), true);
      return null;
    }

    @Override
    public Void visit(CBinaryExpression e) throws MissingDefinitionException {
      CExpression op1 = e.getOperand1();
      CExpression op2 = e.getOperand2();
      boolean pointerArithmetic =
          (e.getOperator() == BinaryOperator.PLUS || e.getOperator() == BinaryOperator.MINUS)
              && (CTypes.isPointerOrArrayType(op1.getExpressionType())
                  || CTypes.isPointerOrArrayType(op2.getExpressionType()));
      if (pointerArithmetic) {
        // the size of the pointed-to type is needed, the result type adds nothing new
        walkPointee(op1);
        walkPointee(op2);
      } else {
        walkType(e.getExpressionType());
      }
      walkExpression(op1);
      walkExpression(op2);
      return null;
    }

    @Override
    public Void visit(CCastExpression e) throws MissingDefinitionException {
      walkType(e.getCastType());
      walkExpression(e.getOperand());
      return null;
    }

    @Override
    public Void visit(CFieldReference e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      CExpression owner = e.getFieldOwner();
      if (e.isPointerDereference()) {
        walkPointee(owner);
      } else {
        walkType(owner.getExpressionType(), true);
      }
      walkExpression(owner);
      return null;
    }

    @Override
    public Void visit(CArraySubscriptExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      walkPointee(e.getArrayExpression());
      walkExpression(e.getArrayExpression());
      walkExpression(e.getSubscriptExpression());
      return null;
    }

    @Override
    public Void visit(CPointerExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      walkPointee(e.getOperand());
      walkExpression(e.getOperand());
      return null;
    }

    @Override
    public Void visit(CFunctionCallExpression e) throws MissingDefinitionException {
      walkType(e.getExpressionType());
      walkExpression(e.getFunctionNameExpression());
      for (CExpression param : e.getParameterExpressions()) {
        walkExpression(param);
      }
      return null;
    }

    /**
     * Descends into types that have no name of their own. Named types are handled by {@link
     * #walkType(CType, boolean)} before this visitor is reached.
     */
    private final class TypeWalker implements CTypeVisitor<Void, MissingDefinitionException> {

      private final boolean definition;

      TypeWalker(boolean pDefinition) {
        definition = pDefinition;
      }

      @Override
      public Void visit(CArrayType pArrayType) throws MissingDefinitionException {
        walkType(pArrayType.getType(), definition);
        walkExpression(pArrayType.getLength());
        return null;
      }

      @Override
      public Void visit(CCompositeType pCompositeType) throws MissingDefinitionException {
        // anonymous, so its members are part of the current global
        if (pCompositeType.hasMembers()) {
          for (CCompositeTypeMemberDeclaration member : pCompositeType.getMembers()) {
            walkType(member.getType(), definition);
          }
        }
        return null;
      }

      @Override
      public Void visit(CElaboratedType pElaboratedType) {
        return null;
      }

      @Override
      public Void visit(CEnumType pEnumType) throws MissingDefinitionException {
        for (CEnumerator enumerator : pEnumType.getEnumerators()) {
          walkExpression(enumerator.getValue());
        }
        return null;
      }

      @Override
      public Void visit(CFunctionType pFunctionType) throws MissingDefinitionException {
        walkType(pFunctionType.getReturnType(), definition);
        for (CType param : pFunctionType.getParameters()) {
          walkType(param, definition);
        }
        return null;
      }

      @Override
      public Void visit(CPointerType pPointerType) throws MissingDefinitionException {
        walkType(pPointerType.getType(), definition);
        return null;
      }

      @Override
      public Void visit(CSimpleType pSimpleType) {
        return null;
      }

      @Override
      public Void visit(CTypedefType pTypedefType) {
        return null;
      }

      @Override
      public Void visit(CVoidType pVoidType) {
        return null;
      }

      @Override
      public Void visit(CBitFieldType pCBitFieldType) throws MissingDefinitionException {
        walkType(pCBitFieldType.getType(), definition);
        return null;
      }
    }
  }

  /** Returns the tag of a type that has a name in one of the namespaces, otherwise null. */
  private static @Nullable DependencyTag getNamedTypeTag(CType pType, boolean pDefinition) {
    if (pType instanceof CTypedefType) {
      return DependencyTag.of(Namespace.TYPEDEF, pDefinition, ((CTypedefType) pType).getName());
    } else if (pType instanceof CElaboratedType) {
      return DependencyTag.of(Namespace.TAG, pDefinition, ((CElaboratedType) pType).getName());
    } else if (pType instanceof CCompositeType && !((CCompositeType) pType).isAnonymous()) {
      return DependencyTag.of(Namespace.TAG, pDefinition, ((CCompositeType) pType).getName());
    } else if (pType instanceof CEnumType && !((CEnumType) pType).isAnonymous()) {
      return DependencyTag.of(Namespace.TAG, pDefinition, ((CEnumType) pType).getName());
    }
    return null;
  }
}
