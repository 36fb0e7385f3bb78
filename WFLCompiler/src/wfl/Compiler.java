package wfl;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;

import wfl.runtime.DslWorkflow;

/**
 * Drives the phases of compiling one workflow unit: parse, resolve imports, analyze, generate
 * Java, and compile it. A failing phase stops the pipeline; syntax failures and semantic failures
 * are reported as distinct exception types.
 */
public class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  private static final String CLASS_PREFIX = "Workflow_";

  /** A parsed and analyzed unit. */
  private static final class Analyzed {
    private final AST ast;
    private final ImmutableList<Diagnostic> diagnostics;

    Analyzed(AST ast, ImmutableList<Diagnostic> diagnostics) {
      this.ast = ast;
      this.diagnostics = diagnostics;
    }
  }

  private final SourceMapRegistry sourceMaps;
  private final ImportResolver.SourceLoader loader;
  private final Supplier<InMemoryJavac> javac = Suppliers.memoize(InMemoryJavac::new);

  public Compiler() {
    this(SourceMapRegistry.shared(), ImportResolver.FILE_SYSTEM);
  }

  public Compiler(SourceMapRegistry sourceMaps, ImportResolver.SourceLoader loader) {
    this.sourceMaps = sourceMaps;
    this.loader = loader;
  }

  public SourceMapRegistry sourceMaps() {
    return sourceMaps;
  }

  /** Source text as compiled: always terminated by a newline. */
  public static String normalize(String source) {
    return source.endsWith("\n") ? source : source + "\n";
  }

  /** Name of the class generated for a unit; stable for the same name and source. */
  static String className(String source, String name) {
    String hash =
        Hashing.sha256()
            .newHasher()
            .putString(name, StandardCharsets.UTF_8)
            .putByte((byte) 0)
            .putString(normalize(source), StandardCharsets.UTF_8)
            .hash()
            .toString();
    return CLASS_PREFIX + hash.substring(0, 12);
  }

  public CompiledWorkflow compile(String source, String name) throws DslCompileException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    GeneratedSource generated = generateSource(source, name, true);
    Class<? extends DslWorkflow> workflowClass = javac.get().compile(generated);
    sourceMaps.register(generated.qualifiedName(), generated.mappings());
    logger.debug("{}: compiled to {} in {}", name, generated.qualifiedName(), stopwatch);
    return new CompiledWorkflow(name, generated, workflowClass, sourceMaps);
  }

  /**
   * Every diagnostic of the unit, sorted by position; empty when it is valid and warning-free. No
   * code is generated.
   */
  public ImmutableList<Diagnostic> validate(String source, String name) {
    try {
      return analyze(source, name).diagnostics;
    } catch (DslCompileException ex) {
      return ex.diagnostics();
    }
  }

  /** Definition counts of the unit itself, imports not included. */
  public FileStats fileStats(String source, String name) throws DslSyntaxException {
    return FileStats.of(parse(source, name));
  }

  public GeneratedSource generateSource(String source, String name, boolean sourceComments)
      throws DslCompileException {
    Analyzed analyzed = analyze(source, name);
    GeneratedSource generated =
        CodeGenerator.generate(analyzed.ast, className(source, name), sourceComments);
    logger.debug(
        "{}: generated {} lines, {} source mappings",
        name,
        generated.source().split("\n", -1).length - 1,
        generated.mappings().size());
    return generated;
  }

  private AST parse(String source, String name) throws DslSyntaxException {
    logger.debug("{}: parsing", name);
    try {
      return Transformer.transform(name, EarleyParser.parse(name, normalize(source)));
    } catch (CompilerException ex) {
      throw new DslSyntaxException(name, ex);
    }
  }

  private Analyzed analyze(String source, String name) throws DslCompileException {
    AST ast = parse(source, name);
    List<Diagnostic> diagnostics = new ArrayList<>();
    ImportResolver imports = new ImportResolver(loader);
    try {
      ast = imports.resolve(ast);
    } catch (CompilerException ex) {
      throw new DslSyntaxException(name, ex);
    }
    diagnostics.addAll(imports.diagnostics());

    logger.debug("{}: analyzing {} definitions", name, ast.declarations().size());
    SemanticAnalyzer.Result result = new SemanticAnalyzer(ast).analyze();
    diagnostics.addAll(result.diagnostics());
    ImmutableList<Diagnostic> sorted =
        diagnostics.stream().sorted(Diagnostic.ORDER).collect(ImmutableList.toImmutableList());
    if (sorted.stream().anyMatch(Diagnostic::isError)) {
      throw new DslSemanticException(name, sorted);
    }
    return new Analyzed(ast, sorted);
  }
}
