// This file is part of SmallCov,
// a coverage instrumenter for automated C program repair.
//
// SPDX-FileCopyrightText: 2024 The SmallCov Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.smallcov.instrumentation;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import org.smallcov.ast.c.CDeclaration;
import org.smallcov.ast.c.CFunctionDeclaration;
import org.smallcov.ast.c.CFunctionDefinition;
import org.smallcov.ast.c.CGlobal;
import org.smallcov.ast.c.CTranslationUnit;
import org.smallcov.ast.c.CVariableDeclaration;
import org.smallcov.globals.GlobalsSorter;
import org.smallcov.globals.MissingDefinitionException;
import org.smallcov.parser.CProgramPrinter;
import org.smallcov.types.c.CStorageClass;
import org.sosy_lab.common.log.LogManager;

/**
 * Adds coverage probes to every function of a program and writes the instrumented files.
 *
 * <p>The declarations the probes need are added to each file unless the file declares them
 * itself. Afterwards the globals of each file are sorted again, because the added declarations
 * may refer to types the file defines only later.
 */
public class CoverageInstrumenter {

  private final LogManager logger;
  private final PrimitivePrototypes primitives;

  public CoverageInstrumenter(LogManager pLogger, PrimitivePrototypes pPrimitives) {
    logger = pLogger;
    primitives = pPrimitives;
  }

  /**
   * Instrument the given files. The translation units are modified in place and written to the
   * target directory, under the same relative names as given as keys. The first file that gets the
   * coverage file handle defines it, the other files declare it <code>extern</code>.
   *
   * @param pFiles the files of the program, keyed by their names
   * @param pCoverageOutput the path the instrumented program writes its coverage to
   * @param pTargetDirectory the directory the instrumented files are written to
   * @return the written files, in the order of the given map
   * @throws IOException if writing a file fails or a name leads out of the target directory
   */
  public ImmutableList<Path> instrument(
      Map<String, CTranslationUnit> pFiles, String pCoverageOutput, Path pTargetDirectory)
      throws IOException, InterruptedException {
    CoverageProbe probe = new CoverageProbe(primitives, pCoverageOutput);
    ImmutableList.Builder<Path> written = ImmutableList.builder();
    boolean handleDefined = false;

    for (Map.Entry<String, CTranslationUnit> file : pFiles.entrySet()) {
      String fileName = file.getKey();
      CTranslationUnit unit = file.getValue();
      Path output = outputPath(pTargetDirectory, fileName);
      logger.log(Level.FINE, "Instrumenting", fileName);

      List<CGlobal> instrumented =
          instrumentGlobals(fileName, unit.getGlobals(), probe, !handleDefined);
      handleDefined |= definesCoverageHandle(instrumented);
      unit.setGlobals(instrumented);

      CProgramPrinter.write(unit, output);
      written.add(output);
    }
    return written.build();
  }

  /**
   * Place a file under the target directory. Absolute names lose their root, names that lead out
   * of the directory are rejected.
   */
  static Path outputPath(Path pTargetDirectory, String pFileName) throws IOException {
    Path name = Path.of(pFileName).normalize();
    if (name.getRoot() != null) {
      name = name.getRoot().relativize(name);
    }
    if (name.getNameCount() == 0 || name.startsWith("..")) {
      throw new IOException("Cannot write " + pFileName + " below " + pTargetDirectory);
    }
    return pTargetDirectory.resolve(name);
  }

  private List<CGlobal> instrumentGlobals(
      String pFileName, List<CGlobal> pGlobals, CoverageProbe pProbe, boolean pDefineHandle)
      throws InterruptedException {
    Map<String, ImmutableList<CGlobal>> toInject =
        new LinkedHashMap<>(primitives.getInjectable());
    if (!pDefineHandle) {
      // another file of the program holds the definition
      toInject.computeIfPresent(
          PrimitivePrototypes.COVERAGE_FOUT,
          (name, globals) ->
              globals.stream()
                  .map(CoverageInstrumenter::asExternDeclaration)
                  .collect(toImmutableList()));
    }
    List<CGlobal> globals = new ArrayList<>(pGlobals.size());

    for (CGlobal global : pGlobals) {
      if (global instanceof CFunctionDeclaration || global instanceof CVariableDeclaration) {
        String name = ((CDeclaration) global).getName();
        if (toInject.containsKey(name)) {
          if (global instanceof CFunctionDeclaration
              && ((CFunctionDeclaration) global).isMissingPrototype()) {
            // replaced by the real prototype
            continue;
          }
          toInject.remove(name);
        }
        globals.add(global);

      } else if (global instanceof CFunctionDefinition
          && shouldInstrument((CFunctionDefinition) global)) {
        CFunctionDefinition function = (CFunctionDefinition) global;
        globals.add(function.withBodyPrepended(pProbe.statementsFor(pFileName)));

      } else {
        globals.add(global);
      }
    }

    List<CGlobal> result = new ArrayList<>();
    toInject.values().forEach(result::addAll);
    result.addAll(globals);

    try {
      return GlobalsSorter.sortPreservingUntagged(result);
    } catch (MissingDefinitionException e) {
      logger.log(
          Level.WARNING,
          "Could not reorder globals of",
          pFileName,
          "because there is no instantiation of",
          e.getTag() + ", keeping original order");
      return result;
    }
  }

  private static CGlobal asExternDeclaration(CGlobal pGlobal) {
    if (pGlobal instanceof CVariableDeclaration) {
      CVariableDeclaration variable = (CVariableDeclaration) pGlobal;
      return new CVariableDeclaration(
          variable.getFileLocation(),
          true,
          CStorageClass.EXTERN,
          variable.getType(),
          variable.getName(),
          null);
    }
    return pGlobal;
  }

  private static boolean definesCoverageHandle(List<CGlobal> pGlobals) {
    for (CGlobal global : pGlobals) {
      if (global instanceof CVariableDeclaration
          && ((CVariableDeclaration) global).getName().equals(PrimitivePrototypes.COVERAGE_FOUT)
          && ((CVariableDeclaration) global).isDefinition()) {
        return true;
      }
    }
    return false;
  }

  /** Whether a probe should be added to the given function. Currently every function gets one. */
  private boolean shouldInstrument(@SuppressWarnings("unused") CFunctionDefinition pFunction) {
    return true;
  }
}
