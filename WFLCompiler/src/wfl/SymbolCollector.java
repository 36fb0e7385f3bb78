package wfl;

import java.util.Optional;

/** Registers every top-level definition; of two same-kind names the first wins. */
class SymbolCollector extends ErrorCollectingValidator {

  // Variables written anywhere in a statement list, including nested blocks.
  static final class AssignedVariables extends VoidDefaultASTVisitor {
    private final SymbolTable.Builder table;

    AssignedVariables(SymbolTable.Builder table) {
      this.table = table;
    }

    @Override
    public void visitImpl(Statement.Assignment node) {
      table.addGlobal(node.target());
    }

    @Override
    public void visitImpl(Statement.RunStatement node) {
      node.target().ifPresent(table::addGlobal);
    }

    @Override
    public void visitImpl(Statement.CallStatement node) {
      node.target().ifPresent(table::addGlobal);
    }

    @Override
    public void visitImpl(Statement.FlowCallStatement node) {
      node.target().ifPresent(table::addGlobal);
    }
  }

  private final SymbolTable.Builder table = SymbolTable.builder();

  public SymbolTable symbols() {
    return table.build();
  }

  private void define(SymbolTable.Kind kind, String name, AST.Declaration declaration) {
    Optional<AST.Declaration> previous = table.define(kind, name, declaration);
    if (previous.isPresent()) {
      logError(
          ErrorCode.E0003,
          declaration.pos(),
          String.format("duplicate %s '%s'", kind.singular(), name),
          Optional.of("first defined at " + previous.get().pos()));
    }
  }

  @Override
  public void visitImpl(AST.ModelDef node) {
    define(SymbolTable.Kind.MODEL, node.name(), node);
  }

  @Override
  public void visitImpl(AST.SchemaDef node) {
    define(SymbolTable.Kind.SCHEMA, node.name(), node);
  }

  @Override
  public void visitImpl(AST.ToolDef node) {
    define(SymbolTable.Kind.TOOL, node.name(), node);
  }

  @Override
  public void visitImpl(AST.PromptDef node) {
    define(SymbolTable.Kind.PROMPT, node.name(), node);
  }

  @Override
  public void visitImpl(AST.AgentDef node) {
    define(SymbolTable.Kind.AGENT, node.name(), node);
  }

  @Override
  public void visitImpl(AST.FlowDef node) {
    define(SymbolTable.Kind.FLOW, node.name(), node);
  }

  @Override
  public void visitImpl(AST.GuardrailDef node) {
    define(SymbolTable.Kind.GUARDRAIL, node.name(), node);
  }

  @Override
  public void visitImpl(AST.RetryPolicyDef node) {
    define(SymbolTable.Kind.RETRY_POLICY, node.name(), node);
  }

  @Override
  public void visitImpl(AST.TimeoutPolicyDef node) {
    define(SymbolTable.Kind.TIMEOUT_POLICY, node.name(), node);
  }

  @Override
  public void visitImpl(AST.HandlerDef node) {
    if (node.event() == AST.HandlerDef.Event.START) {
      node.visitChildren(new AssignedVariables(table), null);
    }
  }
}
