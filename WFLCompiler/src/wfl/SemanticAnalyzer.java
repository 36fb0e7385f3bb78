package wfl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Two-pass analysis of a (fully imported) unit: symbol collection, then the validators that need
 * the completed symbol table. Diagnostics from every validator are reported together.
 */
public class SemanticAnalyzer extends ErrorCollectingValidator {
  private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

  public enum Phase {
    INIT,
    COLLECTING_SYMBOLS,
    VALIDATING_REFERENCES,
    VALID,
    INVALID;
  }

  @AutoValue
  public abstract static class Result {
    public abstract SymbolTable symbols();

    /** Errors and warnings, sorted by position. */
    public abstract ImmutableList<Diagnostic> diagnostics();

    public boolean isValid() {
      return diagnostics().stream().noneMatch(Diagnostic::isError);
    }

    public ImmutableList<Diagnostic> errors() {
      return diagnostics()
          .stream()
          .filter(Diagnostic::isError)
          .collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<Diagnostic> warnings() {
      return diagnostics()
          .stream()
          .filter(d -> !d.isError())
          .collect(ImmutableList.toImmutableList());
    }

    static Result create(SymbolTable symbols, ImmutableList<Diagnostic> diagnostics) {
      return new AutoValue_SemanticAnalyzer_Result(symbols, diagnostics);
    }
  }

  private final AST ast;
  private Phase phase = Phase.INIT;

  public SemanticAnalyzer(AST ast) {
    this.ast = ast;
  }

  public Phase phase() {
    return phase;
  }

  public Result analyze() {
    phase = Phase.COLLECTING_SYMBOLS;
    SymbolCollector collector = new SymbolCollector();
    acceptAll(collector);
    SymbolTable symbols = collector.symbols();
    logger.debug(
        "{}: collected {} agents, {} flows, {} globals",
        ast.file(),
        symbols.count(SymbolTable.Kind.AGENT),
        symbols.count(SymbolTable.Kind.FLOW),
        symbols.globals().size());

    // Duplicates do not stop the second pass; the first definition stands in for the name.
    phase = Phase.VALIDATING_REFERENCES;
    acceptAll(new ReferenceValidator(symbols));
    acceptAll(new ScopeValidator(symbols));
    acceptAll(new GuardrailValidator());
    acceptAll(new ControlFlowValidator());

    AgentCycleDetector detector = new AgentCycleDetector();
    ast.accept(detector, null);
    detector.validate();
    takeDiagnostics(detector);

    phase = hasErrors() ? Phase.INVALID : Phase.VALID;
    ImmutableList<Diagnostic> sorted =
        diagnostics().stream().sorted(Diagnostic.ORDER).collect(ImmutableList.toImmutableList());
    logger.debug("{}: analysis finished {} with {} diagnostics", ast.file(), phase, sorted.size());
    return Result.create(symbols, sorted);
  }

  private void acceptAll(ErrorCollectingValidator visitor) {
    ast.accept(visitor, null);
    takeDiagnostics(visitor);
  }
}
