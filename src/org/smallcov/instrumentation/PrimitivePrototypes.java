// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.instrumentation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smallcov.ast.c.CComplexTypeDeclaration;
import org.smallcov.ast.c.CDeclaration;
import org.smallcov.ast.c.CFunctionDeclaration;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CParameterDeclaration;
import org.smallcov.ast.c.CTranslationUnit;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.ast.c.FileLocation;
import org.smallcov.exceptions.NoException;
import org.smallcov.exec.CompilerInvoker;
import org.smallcov.parser.CParser;
import org.smallcov.parser.CParserException;
import org.smallcov.types.c.CArrayType;
import org.smallcov.types.c.CComplexType;
import org.smallcov.types.c.CCompositeType;
import org.smallcov.types.c.CElaboratedType;
import org.smallcov.types.c.CEnumType;
import org.smallcov.types.c.CFunctionType;
import org.smallcov.types.c.CPointerType;
import org.smallcov.types.c.CStorageClass;
import org.smallcov.types.c.CType;
import org.smallcov.types.c.CTypes;
import org.smallcov.types.c.DefaultCTypeVisitor;
import org.sosy_lab.common.io.TempFile;
import org.sosy_lab.common.io.TempFile.DeleteOnCloseFile;
import org.sosy_lab.common.log.LogManager;

/**
 * Cache of the declarations of the library functions a coverage probe calls, and of the global
 * file handle it writes to.
 *
 * <p>The declarations are taken from the system headers: on first access a small program that
 * includes them is preprocessed and parsed. Everything is resolved only once, later accesses
 * return the same declarations.
 */
public class PrimitivePrototypes {

  public static final String FCLOSE = "fclose";
  public static final String FFLUSH = "fflush";
  public static final String FOPEN = "fopen";
  public static final String FPRINTF = "fprintf";
  public static final String MEMSET = "memset";
  public static final String COVERAGE_FOUT = "_coverage_fout";

  static final ImmutableList<String> PRIMITIVES =
      ImmutableList.of(FCLOSE, FFLUSH, FOPEN, FPRINTF, MEMSET, COVERAGE_FOUT);

  static final String BOOTSTRAP_PROGRAM =
      "#include <stdio.h>\n"
          + "#include <string.h>\n"
          + "FILE * "
          + COVERAGE_FOUT
          + ";\n"
          + "int main() { return 0; }\n";

  private static final FileLocation LOCATION = new FileLocation("<coverage primitives>", 0);

  private final LogManager logger;
  private final CompilerInvoker compiler;
  private final CParser parser;

  // both null until resolved
  private @Nullable ImmutableMap<String, CDeclaration> declarations = null;
  private @Nullable ImmutableMap<String, ImmutableList<CGlobal>> injectable = null;

  public PrimitivePrototypes(LogManager pLogger, CompilerInvoker pCompiler, CParser pParser) {
    logger = pLogger;
    compiler = pCompiler;
    parser = pParser;
  }

  /**
   * Get the declaration of a primitive. This is the declaration from the system headers, or a
   * placeholder of type <code>void *</code> if it could not be found there.
   */
  public CDeclaration getDeclaration(String pName) throws InterruptedException {
    checkArgument(PRIMITIVES.contains(pName), "%s is not a coverage primitive", pName);
    resolve();
    return declarations.get(pName);
  }

  /**
   * Get the globals that have to be added to a program for each primitive it does not declare
   * itself: the declaration and forward declarations of the struct, union and enum types it
   * mentions. Placeholders for missing library functions are not included.
   */
  public ImmutableMap<String, ImmutableList<CGlobal>> getInjectable()
      throws InterruptedException {
    resolve();
    return injectable;
  }

  private synchronized void resolve() throws InterruptedException {
    if (declarations != null) {
      return;
    }

    Map<String, CDeclaration> found = harvestFromSystemHeaders();

    ImmutableMap.Builder<String, CDeclaration> decls = ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableList<CGlobal>> inject = ImmutableMap.builder();
    for (String name : PRIMITIVES) {
      CDeclaration decl = found.get(name);
      if (decl != null) {
        decls.put(name, decl);
        inject.put(name, withForwardDeclarations(decl));
      } else {
        logger.log(
            Level.WARNING,
            "Could not find declaration of",
            name,
            "in system headers, using a void pointer instead");
        CDeclaration placeholder = placeholderFor(name);
        decls.put(name, placeholder);
        if (name.equals(COVERAGE_FOUT)) {
          inject.put(name, ImmutableList.of(placeholder));
        }
      }
    }

    injectable = inject.buildOrThrow();
    declarations = decls.buildOrThrow();
  }

  private Map<String, CDeclaration> harvestFromSystemHeaders() throws InterruptedException {
    logger.log(Level.FINE, "Looking up declarations of coverage primitives");
    Map<String, CDeclaration> result = new HashMap<>();

    try (DeleteOnCloseFile source =
            TempFile.builder()
                .prefix("smallcov-primitives")
                .suffix(".c")
                .initialContent(BOOTSTRAP_PROGRAM, StandardCharsets.UTF_8)
                .createDeleteOnClose();
        DeleteOnCloseFile preprocessed =
            TempFile.builder().prefix("smallcov-primitives").suffix(".i").createDeleteOnClose()) {

      if (!compiler.preprocess(source.toPath(), preprocessed.toPath())) {
        logger.log(Level.WARNING, "Could not preprocess declarations of coverage primitives");
        return result;
      }

      CTranslationUnit unit = parser.parseFile(preprocessed.toPath());
      for (CGlobal global : unit.getGlobals()) {
        if ((global instanceof CFunctionDeclaration || global instanceof CVariableDeclaration)
            && PRIMITIVES.contains(((CDeclaration) global).getName())) {
          CDeclaration decl = withoutTypedefs((CDeclaration) global);
          result.put(decl.getName(), decl);
        }
      }

    } catch (IOException e) {
      logger.logUserException(
          Level.WARNING, e, "Could not look up declarations of coverage primitives");
    } catch (CParserException e) {
      logger.logUserException(
          Level.WARNING, e, "Could not parse declarations of coverage primitives");
    }
    return result;
  }

  private static CDeclaration withoutTypedefs(CDeclaration pDecl) {
    if (pDecl instanceof CFunctionDeclaration) {
      CFunctionDeclaration funDecl = (CFunctionDeclaration) pDecl;
      return new CFunctionDeclaration(
          funDecl.getFileLocation(),
          (CFunctionType) CTypes.unrollTypedefs(funDecl.getType()),
          funDecl.getName(),
          funDecl.getParameters().stream()
              .map(p -> new CParameterDeclaration(CTypes.unrollTypedefs(p.getType()), p.getName()))
              .collect(toImmutableList()),
          funDecl.getCStorageClass());
    } else {
      CVariableDeclaration varDecl = (CVariableDeclaration) pDecl;
      return new CVariableDeclaration(
          varDecl.getFileLocation(),
          true,
          varDecl.getCStorageClass(),
          CTypes.unrollTypedefs(varDecl.getType()),
          varDecl.getName(),
          varDecl.getInitializer());
    }
  }

  /** Forward declarations of all named complex types in the declaration's type, then itself. */
  private static ImmutableList<CGlobal> withForwardDeclarations(CDeclaration pDecl) {
    ComplexTypeCollector collector = new ComplexTypeCollector();
    pDecl.getType().accept(collector);

    ImmutableList.Builder<CGlobal> result = ImmutableList.builder();
    for (CComplexType type : collector.getCollectedTypes()) {
      result.add(CComplexTypeDeclaration.forwardDeclarationOf(LOCATION, type));
    }
    return result.add(pDecl).build();
  }

  private static CDeclaration placeholderFor(String pName) {
    // the file handle needs storage, everything else is only referenced
    CStorageClass storage =
        pName.equals(COVERAGE_FOUT) ? CStorageClass.AUTO : CStorageClass.EXTERN;
    return new CVariableDeclaration(
        LOCATION, true, storage, CPointerType.POINTER_TO_VOID, pName, null);
  }

  /**
   * Collects named structs, unions and enums that a type refers to through pointers, arrays and
   * function signatures. Members of composite types are not visited.
   */
  private static class ComplexTypeCollector extends DefaultCTypeVisitor<Void, NoException> {

    // keyed by kind and name, so an elaborated type and its definition count once
    private final Map<String, CComplexType> collectedTypes = new LinkedHashMap<>();
    private final Set<CType> visited = new LinkedHashSet<>();

    ImmutableList<CComplexType> getCollectedTypes() {
      return ImmutableList.copyOf(collectedTypes.values());
    }

    private void addComplexType(CComplexType pType) {
      if (!pType.getName().isEmpty()) {
        collectedTypes.putIfAbsent(pType.getQualifiedName(), pType);
      }
    }

    @Override
    public @Nullable Void visitDefault(CType pT) {
      return null;
    }

    @Override
    public @Nullable Void visit(CArrayType pArrayType) {
      if (visited.add(pArrayType)) {
        pArrayType.getType().accept(this);
      }
      return null;
    }

    @Override
    public @Nullable Void visit(CCompositeType pCompositeType) {
      addComplexType(pCompositeType);
      return null;
    }

    @Override
    public @Nullable Void visit(CElaboratedType pElaboratedType) {
      addComplexType(pElaboratedType);
      return null;
    }

    @Override
    public @Nullable Void visit(CEnumType pEnumType) {
      addComplexType(pEnumType);
      return null;
    }

    @Override
    public @Nullable Void visit(CFunctionType pFunctionType) {
      if (visited.add(pFunctionType)) {
        pFunctionType.getReturnType().accept(this);
        for (CType parameterType : pFunctionType.getParameters()) {
          parameterType.accept(this);
        }
      }
      return null;
    }

    @Override
    public @Nullable Void visit(CPointerType pPointerType) {
      if (visited.add(pPointerType)) {
        pPointerType.getType().accept(this);
      }
      return null;
    }
  }
}
