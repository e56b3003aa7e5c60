/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.jspy.pycomp;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.jspy.ast.ClassMember;
import com.google.jspy.ast.Expression;
import com.google.jspy.ast.Expression.StringLiteral;
import com.google.jspy.ast.ImportSpecifier;
import com.google.jspy.ast.ModuleDeclaration;
import com.google.jspy.ast.Pattern;
import com.google.jspy.ast.Program;
import com.google.jspy.ast.SourceLocation;
import com.google.jspy.ast.Statement;
import com.google.jspy.ast.Statement.Block;
import com.google.jspy.pyast.Identifier;
import com.google.jspy.pyast.PyModule;
import com.google.jspy.pyast.PyStmt;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Translates one source file into a target module.
 *
 * <p>A translator is created per file and owns the state of that file's translation: the import
 * table, the counter for synthetic names and the warnings reported so far. It is not thread-safe;
 * files translated in parallel each need their own translator.
 *
 * <p>Translation stops at the first source tree shape that has no lowering rule. The error is
 * reported to the {@link ErrorManager} and an {@link InternalTranslatorError} is thrown; there is
 * no partial output.
 */
public final class PythonTranslator {
  private static final Logger logger = Logger.getLogger(PythonTranslator.class.getName());

  /** The name an {@code importMember} call is left with when it is not assigned to a variable. */
  static final String IMPORT_MEMBER_PLACEHOLDER = "importMember";

  private final String sourceName;
  private final TranslatorOptions options;
  private final ErrorManager errorManager;
  private final ModuleNames moduleNames;
  private final ImportTable imports = new ImportTable();
  private final SyntheticNameGenerator nameGenerator;
  private final Set<String> onlyOnceWarnings = new HashSet<>();

  private final ExpressionTranslator expressionTranslator;
  private final StatementTranslator statementTranslator;
  private final FunctionTranslator functionTranslator;
  private final ClassTranslator classTranslator;

  public PythonTranslator(String sourceName, TranslatorOptions options, ErrorManager errorManager) {
    this.sourceName = sourceName;
    this.options = new TranslatorOptions(options);
    this.errorManager = errorManager;
    this.moduleNames =
        new ModuleNames(
            this.options.getLibraryDirectoryName(), this.options.getLibraryNamespace());
    this.nameGenerator = new SyntheticNameGenerator(sourceName);
    this.expressionTranslator = new ExpressionTranslator(this);
    this.statementTranslator = new StatementTranslator(this);
    this.functionTranslator = new FunctionTranslator(this);
    this.classTranslator = new ClassTranslator(this);
  }

  /**
   * Translates {@code program} with a fresh translator, then writes the diagnostics report.
   *
   * @throws InternalTranslatorError if the program contains a shape that cannot be translated
   */
  public static PyModule transformFile(
      Program program, TranslatorOptions options, ErrorManager errorManager) {
    PythonTranslator translator =
        new PythonTranslator(program.sourceName(), options, errorManager);
    try {
      return translator.translateProgram(program);
    } finally {
      errorManager.generateReport();
    }
  }

  /**
   * Translates the top-level declarations in order. The imports collected while translating are
   * placed first, wherever the import declarations appear in the source.
   */
  public PyModule translateProgram(Program program) {
    TranslationContext ctx = TranslationContext.root();
    ImmutableList.Builder<PyStmt> body = ImmutableList.builder();
    for (ModuleDeclaration declaration : program.body()) {
      switch (declaration.getKind()) {
        case IMPORT:
          ModuleDeclaration.Import importDecl = (ModuleDeclaration.Import) declaration;
          translateImports(ctx, importDecl.specifiers(), importDecl.source());
          break;
        case EXPORT_NAMED:
          body.addAll(translateExport(ctx, (ModuleDeclaration.ExportNamed) declaration));
          break;
        case PRIVATE:
          body.addAll(
              translateStatement(
                  ctx,
                  ReturnStrategy.NO_RETURN,
                  ((ModuleDeclaration.Private) declaration).statement()));
          break;
      }
    }
    ImmutableList<PyStmt> stmts =
        body.build().stream()
            .filter(BodyNormalizer::isProductive)
            .collect(ImmutableList.toImmutableList());
    ImmutableList<PyStmt> allImports = getAllImports();
    logger.fine(
        "Translated "
            + sourceName
            + ": "
            + allImports.size()
            + " import statement(s), "
            + stmts.size()
            + " statement(s)");
    return new PyModule(
        ImmutableList.<PyStmt>builder().addAll(allImports).addAll(stmts).build());
  }

  /** Exported variables are bound even without an initializer, so the module defines them. */
  private ImmutableList<PyStmt> translateExport(
      TranslationContext ctx, ModuleDeclaration.ExportNamed export) {
    Statement declaration = export.declaration();
    return switch (declaration.getKind()) {
      case VARIABLE_DECLARATION ->
          translateStatement(
              ctx.withHoistVars(name -> true), ReturnStrategy.NO_RETURN, declaration);
      case FUNCTION_DECLARATION, CLASS_DECLARATION ->
          translateStatement(ctx, ReturnStrategy.NO_RETURN, declaration);
      default ->
          throw internalError(
              TranslatorErrors.UNSUPPORTED_STATEMENT,
              export.location(),
              "export of " + declaration.getKind());
    };
  }

  public ExprWithPrelude translateExpression(TranslationContext ctx, Expression expr) {
    return expressionTranslator.translate(ctx, expr);
  }

  public ImmutableList<PyStmt> translateStatement(
      TranslationContext ctx, ReturnStrategy strategy, Statement stmt) {
    return statementTranslator.translate(ctx, strategy, stmt);
  }

  /**
   * Translates a class into its definition, preceded by the statements its superclass expression
   * needs. A class without a name gets a synthetic one.
   */
  public ImmutableList<PyStmt> translateClass(
      TranslationContext ctx,
      List<ClassMember> body,
      Expression.@Nullable Identifier name,
      @Nullable Expression superClass,
      @Nullable SourceLocation location) {
    return classTranslator.translateClass(ctx, body, name, superClass, location);
  }

  public PyStmt.FunctionDef translateFunction(
      TranslationContext ctx, Expression.Identifier name, List<Pattern> params, Block body) {
    return functionTranslator.translateFunction(ctx, name, params, body);
  }

  /**
   * Adds the imports of an import declaration to the import table.
   *
   * @return the import statements for the names that were not imported before
   */
  @CanIgnoreReturnValue
  public ImmutableList<PyStmt> translateImports(
      TranslationContext ctx, List<ImportSpecifier> specifiers, StringLiteral source) {
    String module = moduleNames.resolve(source.value());
    ImmutableList.Builder<PyStmt> added = ImmutableList.builder();
    for (ImportSpecifier specifier : specifiers) {
      String name =
          switch (specifier.getKind()) {
            case MEMBER -> ((ImportSpecifier.Member) specifier).imported().name();
            case DEFAULT -> "default";
            case NAMESPACE -> "*";
          };
      checkNotPlaceholder(name, source.value(), specifier.location());
      if (imports.get(module, name) == null) {
        added.add(
            imports.add(module, name, PythonNames.clean(specifier.local().name())).toStatement());
      }
    }
    return added.build();
  }

  /**
   * Returns the local name under which {@code name} from {@code modulePath} is imported, adding the
   * import if it is new. {@code *} and {@code default} stand for the whole module.
   *
   * @return the local name, or empty if {@code name} is empty
   */
  public Optional<Identifier> getImportReference(
      TranslationContext ctx,
      String name,
      String modulePath,
      @Nullable SourceLocation location) {
    if (name.isEmpty()) {
      return Optional.empty();
    }
    checkNotPlaceholder(name, modulePath, location);
    String module = moduleNames.resolve(modulePath);
    ImportTable.Entry entry = imports.get(module, name);
    if (entry == null) {
      String localName =
          ImportTable.isWholeModule(name)
              ? ModuleNames.defaultLocalName(modulePath)
              : PythonNames.clean(name);
      entry = imports.add(module, name, localName);
    }
    return Optional.of(entry.localName());
  }

  private void checkNotPlaceholder(
      String name, String modulePath, @Nullable SourceLocation location) {
    if (name.equals(IMPORT_MEMBER_PLACEHOLDER)) {
      throw internalError(TranslatorErrors.IMPORT_MEMBER_PLACEHOLDER, location, modulePath);
    }
  }

  /** Returns the import statements of every name imported so far. */
  public ImmutableList<PyStmt> getAllImports() {
    return imports.getAllImports();
  }

  /** Reports a warning, unless a warning with the same message was reported before. */
  public void warnOnlyOnce(
      DiagnosticType type, @Nullable SourceLocation location, String... arguments) {
    TranslationError warning = TranslationError.make(type, location, arguments);
    if (onlyOnceWarnings.add(warning.description())) {
      errorManager.report(
          options.isWarningsAsErrors() ? CheckLevel.ERROR : type.level, warning);
    }
  }

  /**
   * Reports an error and returns the exception that stops the translation, for the caller to
   * throw.
   */
  InternalTranslatorError internalError(
      DiagnosticType type, @Nullable SourceLocation location, String... arguments) {
    TranslationError error = TranslationError.make(type, location, arguments);
    errorManager.report(CheckLevel.ERROR, error);
    return new InternalTranslatorError(error);
  }

  Identifier createSyntheticName(String prefix) {
    return nameGenerator.getUniqueName(prefix);
  }

  String getLiftedFunctionPrefix() {
    return options.getLiftedFunctionPrefix();
  }

  TranslatorOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  ExpressionTranslator getExpressionTranslator() {
    return expressionTranslator;
  }

  StatementTranslator getStatementTranslator() {
    return statementTranslator;
  }

  FunctionTranslator getFunctionTranslator() {
    return functionTranslator;
  }

  ClassTranslator getClassTranslator() {
    return classTranslator;
  }
}
