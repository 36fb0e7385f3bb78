package wfl;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;

/**
 * Resolves every name used by a definition or statement against the {@link SymbolTable}, and
 * checks the properties a definition cannot do without.
 */
class ReferenceValidator extends ErrorCollectingValidator {

  private final SymbolTable symbols;

  ReferenceValidator(SymbolTable symbols) {
    this.symbols = symbols;
  }

  private void resolve(SymbolTable.Kind kind, AST.Ref ref) {
    if (symbols.contains(kind, ref.name())) return;
    logError(
        ErrorCode.E0001,
        ref.pos(),
        String.format("undefined %s '%s'", kind.singular(), ref.name()),
        suggest(ref.name(), symbols.names(kind), kind.plural()));
  }

  // A model string with a '/' is a provider model id rather than a model name.
  private void resolveModel(AST.Ref ref) {
    if (ref.name().contains("/")) return;
    resolve(SymbolTable.Kind.MODEL, ref);
  }

  private void resolveGuardrail(AST.Ref ref) {
    if (SymbolTable.BUILTIN_GUARDRAILS.contains(ref.name())) return;
    if (symbols.contains(SymbolTable.Kind.GUARDRAIL, ref.name())) return;
    logError(
        ErrorCode.E0001,
        ref.pos(),
        String.format("undefined guardrail '%s'", ref.name()),
        suggest(
            ref.name(),
            Sets.union(SymbolTable.BUILTIN_GUARDRAILS, symbols.names(SymbolTable.Kind.GUARDRAIL)),
            "guardrails"));
  }

  private void missing(Tokenizer.Pos pos, String what, String property) {
    logError(
        ErrorCode.E0010,
        pos,
        String.format("%s is missing required property '%s'", what, property));
  }

  @Override
  public void visitImpl(AST.ModelDef node) {
    if (!node.shorthand().isPresent() && !node.properties().containsKey("name")) {
      missing(node.pos(), "model '" + node.name() + "'", "name");
    }
  }

  @Override
  public void visitImpl(AST.ToolDef node) {
    if (node.kind() == AST.ToolDef.Kind.CONFIGURED && !node.properties().containsKey("type")) {
      missing(node.pos(), "tool '" + node.name() + "'", "type");
    }
  }

  @Override
  public void visitImpl(AST.SchemaDef node) {
    Set<String> names = new HashSet<>();
    for (AST.Field field : node.fields()) {
      if (!names.add(field.name())) {
        logError(
            ErrorCode.E0003,
            field.pos(),
            String.format("duplicate field '%s' in schema '%s'", field.name(), node.name()));
      }
      checkFieldType(field.fieldType(), field.typePos());
    }
  }

  private void checkFieldType(AST.FieldType type, Tokenizer.Pos pos) {
    if (type.isList()) {
      if (!type.base().equals("list")) {
        logError(
            ErrorCode.E0004,
            pos,
            String.format("'%s' takes no element type; use list[T] or T[]", type.base()));
        return;
      }
      checkFieldType(type.element().get(), pos);
      return;
    }
    if (AST.FieldType.PRIMITIVES.contains(type.base())) return;
    if (type.base().equals("list")) {
      logError(ErrorCode.E0004, pos, "list needs an element type, e.g. list[string]");
    } else if (symbols.contains(SymbolTable.Kind.SCHEMA, type.base())) {
      logError(
          ErrorCode.E0004,
          pos,
          String.format("schemas cannot reference other schemas ('%s')", type.base()));
    } else {
      logError(
          ErrorCode.E0004,
          pos,
          String.format("unknown field type '%s'", type.base()),
          Optional.of("valid types are: string, int, float, bool, object, list[T], T[], T?"));
    }
  }

  @Override
  public void visitImpl(AST.PromptDef node) {
    node.model().ifPresent(this::resolveModel);
    node.schema().ifPresent(ref -> resolve(SymbolTable.Kind.SCHEMA, ref));
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(AST.AgentDef node) {
    for (AST.Ref tool : node.tools()) {
      // Dotted names are builtin tool modules.
      if (tool.name().contains(".")) continue;
      resolve(SymbolTable.Kind.TOOL, tool);
    }
    if (node.instruction().isPresent()) {
      resolve(SymbolTable.Kind.PROMPT, node.instruction().get());
    } else {
      missing(node.pos(), "agent '" + node.name() + "'", "instruction");
    }
    node.retry().ifPresent(ref -> resolve(SymbolTable.Kind.RETRY_POLICY, ref));
    node.timeoutPolicy().ifPresent(ref -> resolve(SymbolTable.Kind.TIMEOUT_POLICY, ref));
    for (AST.Ref agent : Iterables.concat(node.delegate(), node.use())) {
      resolve(SymbolTable.Kind.AGENT, agent);
    }
  }

  @Override
  public void visitImpl(Statement.RunStatement node) {
    resolve(SymbolTable.Kind.AGENT, node.callee());
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.CallStatement node) {
    resolve(SymbolTable.Kind.PROMPT, node.callee());
    node.model().ifPresent(m -> resolveModel(new AST.Ref(m, node.pos())));
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.FlowCallStatement node) {
    resolve(SymbolTable.Kind.FLOW, node.callee());
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Statement.MaskAction node) {
    resolveGuardrail(node.guardrail());
  }

  @Override
  public void visitImpl(Statement.BlockAction node) {
    node.guardrail().ifPresent(this::resolveGuardrail);
    node.visitChildren(this, null);
  }
}
