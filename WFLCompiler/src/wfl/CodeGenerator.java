package wfl;

import static wfl.ExpressionGenerator.literal;
import static wfl.ExpressionGenerator.pathArgs;
import static wfl.ExpressionGenerator.quote;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Generates the Java class for a workflow unit. Definitions become registrations in the
 * constructor, and every flow and handler becomes a private method taking the flow's {@code
 * WorkflowContext}. Lines generated from a statement are mapped back to its source position.
 */
final class CodeGenerator extends VoidDefaultASTVisitor {
  static final String PACKAGE = "wfl.generated";

  private static final ImmutableList<String> IMPORTS =
      ImmutableList.of(
          "com.google.common.collect.ImmutableList",
          "wfl.runtime.AbortException",
          "wfl.runtime.AgentSpec",
          "wfl.runtime.DslWorkflow",
          "wfl.runtime.EscalationCondition",
          "wfl.runtime.Ops",
          "wfl.runtime.ParallelTask",
          "wfl.runtime.PromptSpec",
          "wfl.runtime.RetryPolicy",
          "wfl.runtime.SchemaSpec",
          "wfl.runtime.ToolSpec",
          "wfl.runtime.WorkflowContext",
          "wfl.runtime.WorkflowException");

  // Model properties that only make up the model id.
  private static final ImmutableSet<String> MODEL_ID_PROPERTIES =
      ImmutableSet.of("name", "provider");

  private static final String WARNING_DEFAULT = "Warning condition triggered";

  private final AST ast;
  private final String className;
  private final CodeEmitter out;
  private final ExpressionGenerator expressions = new ExpressionGenerator();

  private final List<AST.FlowDef> flows = new ArrayList<>();
  private final List<AST.HandlerDef> handlers = new ArrayList<>();
  private final Map<AST.HandlerDef, String> handlerMethods = new HashMap<>();
  private final Map<String, Integer> handlerCounts = new HashMap<>();
  private int temporaries = 0;

  private CodeGenerator(AST ast, String className, boolean sourceComments) {
    this.ast = ast;
    this.className = className;
    this.out = new CodeEmitter(sourceComments);
  }

  /** Generates {@code className} for an analyzed unit; the AST must be free of errors. */
  static GeneratedSource generate(AST ast, String className, boolean sourceComments) {
    CodeGenerator generator = new CodeGenerator(ast, className, sourceComments);
    generator.generateClass();
    return GeneratedSource.create(className, generator.out.source(), generator.out.mappings());
  }

  static String flowMethodName(String flow) {
    return "flow_" + flow.replace('-', '_');
  }

  private void generateClass() {
    out.emit("// Generated from " + ast.file() + ". Do not edit.");
    out.emit("package " + PACKAGE + ";");
    out.blank();
    for (String name : IMPORTS) {
      out.emit("import " + name + ";");
    }
    out.blank();
    out.emit("public final class " + className + " extends DslWorkflow {");
    out.indent();
    out.emit("public " + className + "() {");
    out.indent();
    ASTNodeUtils.accept(ast.declarations(), this, null);
    out.dedent();
    out.emit("}");

    for (AST.FlowDef flow : flows) {
      out.blank();
      out.emit(
          "private Object "
              + flowMethodName(flow.name())
              + "(WorkflowContext ctx) throws WorkflowException {",
          flow.pos());
      out.indent();
      methodBody(flow.body());
      out.dedent();
      out.emit("}");
    }
    for (AST.HandlerDef handler : handlers) {
      out.blank();
      out.emit(
          "private Object "
              + handlerMethods.get(handler)
              + "(WorkflowContext ctx) throws WorkflowException {",
          handler.pos());
      out.indent();
      methodBody(handler.body());
      out.dedent();
      out.emit("}");
    }
    out.dedent();
    out.emit("}");
  }

  // A trailing 'on failure' wraps the rest of the body in a try.
  private void methodBody(List<Statement> body) {
    Statement last = body.isEmpty() ? null : body.get(body.size() - 1);
    boolean completes;
    if (last != null && last.type() == Statement.Type.FAILURE) {
      Statement.FailureBlock failure = last.cast();
      List<Statement> main = body.subList(0, body.size() - 1);
      out.emit("try {");
      out.indent();
      statements(main);
      out.dedent();
      out.emit("} catch (Exception _failure) {", failure.pos());
      out.indent();
      out.emit("ctx.onFailure(_failure);");
      statements(failure.body());
      out.dedent();
      out.emit("}");
      completes =
          ASTNodeUtils.completesNormally(main)
              || ASTNodeUtils.completesNormally(failure.body());
    } else {
      statements(body);
      completes = ASTNodeUtils.completesNormally(body);
    }
    if (completes) out.emit("return null;");
  }

  // javac rejects statements after a return, so dead code is dropped.
  private void statements(List<Statement> body) {
    ASTNodeUtils.accept(ASTNodeUtils.reachable(body), this, null);
  }

  private void block(String header, Tokenizer.Pos pos, List<Statement> body) {
    out.emit(header + " {", pos);
    out.indent();
    statements(body);
    out.dedent();
    out.emit("}");
  }

  private String temporary(String prefix) {
    return "_" + prefix + (++temporaries);
  }

  /** Emits {@code head}, then one continuation line per chained call. */
  private void chain(String head, List<String> calls, Tokenizer.Pos pos) {
    out.emit(head, pos);
    out.indent();
    out.indent();
    for (String call : calls) {
      out.emit(call);
    }
    out.dedent();
    out.dedent();
  }

  private void assign(Optional<String> target, String value, Tokenizer.Pos pos) {
    if (target.isPresent()) {
      out.emit("ctx.set(" + quote(target.get()) + ", " + value + ");", pos);
    } else {
      out.emit(value + ";", pos);
    }
  }

  // Definitions.

  @Override
  public void visitImpl(AST.VersionDecl node) {}

  @Override
  public void visitImpl(AST.ImportDef node) {}

  @Override
  public void visitImpl(AST.ModelDef node) {
    List<String> extra = new ArrayList<>();
    for (Map.Entry<String, Object> property : node.properties().entrySet()) {
      if (MODEL_ID_PROPERTIES.contains(property.getKey())) continue;
      extra.add(quote(property.getKey()));
      extra.add(literal(property.getValue()));
    }
    String args = quote(node.name()) + ", " + quote(node.modelId());
    if (!extra.isEmpty()) args += ", Ops.map(" + Joiner.on(", ").join(extra) + ")";
    out.emit("model(" + args + ");", node.pos());
  }

  @Override
  public void visitImpl(AST.SchemaDef node) {
    List<String> calls = new ArrayList<>();
    for (AST.Field field : node.fields()) {
      calls.add(".field(" + quote(field.name()) + ", " + quote(field.fieldType().toString()) + ")");
    }
    calls.add(".build());");
    chain("schema(SchemaSpec.builder(" + quote(node.name()) + ")", calls, node.pos());
  }

  @Override
  public void visitImpl(AST.ToolDef node) {
    String kind;
    Optional<String> location = node.location();
    switch (node.kind()) {
      case MCP:
        kind = "mcp";
        break;
      case BUILTIN:
        kind = "builtin";
        break;
      default:
        kind = String.valueOf(node.properties().getOrDefault("type", "configured"));
        if (!location.isPresent() && node.properties().containsKey("url")) {
          location = Optional.of(node.properties().get("url").toString());
        }
    }
    List<String> calls = new ArrayList<>();
    location.ifPresent(l -> calls.add(".setLocation(" + quote(l) + ")"));
    node.authScheme().ifPresent(s -> calls.add(".setAuthScheme(" + quote(s) + ")"));
    node.authValue().ifPresent(v -> calls.add(".setAuthValue(" + quote(v) + ")"));
    for (Map.Entry<String, Object> property : node.properties().entrySet()) {
      calls.add(
          ".putProperty(" + quote(property.getKey()) + ", " + literal(property.getValue()) + ")");
    }
    calls.add(".build());");
    chain(
        "tool(ToolSpec.builder(" + quote(node.name()) + ", " + quote(kind) + ")",
        calls,
        node.pos());
  }

  @Override
  public void visitImpl(AST.GuardrailDef node) {
    out.emit("guardrail(" + quote(node.name()) + ", " + quote(node.pattern()) + ");", node.pos());
  }

  @Override
  public void visitImpl(AST.RetryPolicyDef node) {
    out.emit(
        String.format(
            "retryPolicy(%s, %d, RetryPolicy.Backoff.%s);",
            quote(node.name()), node.times(), node.backoff().name()),
        node.pos());
  }

  @Override
  public void visitImpl(AST.TimeoutPolicyDef node) {
    out.emit(
        "timeoutPolicy(" + quote(node.name()) + ", " + node.seconds() + "L);", node.pos());
  }

  @Override
  public void visitImpl(AST.PromptDef node) {
    List<String> calls = new ArrayList<>();
    calls.add(".setBody(ctx -> " + expressions.template(node.body()) + ")");
    node.model().ifPresent(m -> calls.add(".setModel(" + quote(m.name()) + ")"));
    node.schema().ifPresent(s -> calls.add(".setSchema(" + quote(s.name()) + ")"));
    if (node.expectsArray()) calls.add(".setExpectsArray(true)");
    node.inherit().ifPresent(i -> calls.add(".setInherit(" + quote(i) + ")"));
    node.escalation()
        .ifPresent(
            e ->
                calls.add(
                    ".setEscalation(new EscalationCondition("
                        + quote(e.op())
                        + ", "
                        + quote(e.value())
                        + "))"));
    calls.add(".build());");
    chain("prompt(PromptSpec.builder(" + quote(node.name()) + ")", calls, node.pos());
  }

  @Override
  public void visitImpl(AST.AgentDef node) {
    List<String> calls = new ArrayList<>();
    node.instruction().ifPresent(i -> calls.add(".setInstruction(" + quote(i.name()) + ")"));
    for (AST.Ref tool : node.tools()) {
      calls.add(".addTool(" + quote(tool.name()) + ")");
    }
    node.retry().ifPresent(r -> calls.add(".setRetry(" + quote(r.name()) + ")"));
    node.timeoutPolicy().ifPresent(t -> calls.add(".setTimeoutPolicy(" + quote(t.name()) + ")"));
    node.timeoutSeconds().ifPresent(s -> calls.add(".setTimeoutSeconds(" + s + "L)"));
    node.description().ifPresent(d -> calls.add(".setDescription(" + quote(d) + ")"));
    for (AST.Ref delegate : node.delegate()) {
      calls.add(".addDelegate(" + quote(delegate.name()) + ")");
    }
    for (AST.Ref use : node.use()) {
      calls.add(".addUse(" + quote(use.name()) + ")");
    }
    calls.add(".build());");
    chain("agent(AgentSpec.builder(" + quote(node.name()) + ")", calls, node.pos());
  }

  @Override
  public void visitImpl(AST.FlowDef node) {
    List<String> params = new ArrayList<>();
    for (String param : node.params()) {
      params.add(quote(param));
    }
    out.emit(
        String.format(
            "flow(%s, ImmutableList.of(%s), this::%s);",
            quote(node.name()), Joiner.on(", ").join(params), flowMethodName(node.name())),
        node.pos());
    flows.add(node);
  }

  @Override
  public void visitImpl(AST.HandlerDef node) {
    String key = node.methodName();
    int count = handlerCounts.merge(key, 1, Integer::sum);
    String method = count == 1 ? key : key + "_" + count;
    out.emit("handler(" + quote(key) + ", this::" + method + ");", node.pos());
    handlerMethods.put(node, method);
    handlers.add(node);
  }

  // Statements.

  @Override
  public void visitImpl(Statement.Assignment node) {
    out.emit(
        "ctx.set(" + quote(node.target()) + ", " + expressions.generate(node.value()) + ");",
        node.pos());
  }

  @Override
  public void visitImpl(Statement.PropertyAssignment node) {
    out.emit(
        "ctx.setProperty("
            + quote(node.variable())
            + ", "
            + expressions.generate(node.value())
            + pathArgs(node.path())
            + ");",
        node.pos());
  }

  @Override
  public void visitImpl(Statement.RunStatement node) {
    String agent = node.callee().name();
    if (!node.escalationHandler().isPresent()) {
      assign(
          node.target(),
          "ctx.runAgent(" + quote(agent) + expressions.args(node.argList()) + ")",
          node.pos());
      return;
    }
    assign(
        node.target(),
        "ctx.runAgentWithEscalation(" + quote(agent) + expressions.args(node.argList()) + ")",
        node.pos());
    Statement.EscalationHandler handler = node.escalationHandler().get();
    out.emit("if (ctx.lastEscalated()) {", handler.pos());
    out.indent();
    switch (handler.action()) {
      case RETURN:
        out.emit(
            "return "
                + handler.value().map(expressions::generate).orElse("null")
                + ";");
        break;
      case CONTINUE:
        out.emit("continue;");
        break;
      case ABORT:
        out.emit(
            "throw new AbortException("
                + quote("escalation from agent '" + agent + "'")
                + ");");
        break;
    }
    out.dedent();
    out.emit("}");
  }

  @Override
  public void visitImpl(Statement.CallStatement node) {
    assign(
        node.target(),
        "ctx.callLlm("
            + quote(node.callee().name())
            + ", "
            + node.model().map(ExpressionGenerator::quote).orElse("null")
            + expressions.args(node.argList())
            + ")",
        node.pos());
  }

  @Override
  public void visitImpl(Statement.FlowCallStatement node) {
    assign(
        node.target(),
        "ctx.runFlow(" + quote(node.callee().name()) + expressions.args(node.argList()) + ")",
        node.pos());
  }

  @Override
  public void visitImpl(Statement.ReturnStatement node) {
    out.emit(
        "return " + node.value().map(expressions::generate).orElse("null") + ";", node.pos());
  }

  @Override
  public void visitImpl(Statement.PushStatement node) {
    out.emit(
        "ctx.push(" + quote(node.list()) + ", " + expressions.generate(node.value()) + ");",
        node.pos());
  }

  @Override
  public void visitImpl(Statement.ForLoop node) {
    String item = temporary("item");
    out.emit(
        "for (Object "
            + item
            + " : Ops.iterable("
            + expressions.generate(node.iterable())
            + ")) {",
        node.pos());
    out.indent();
    out.emit("ctx.set(" + quote(node.variable()) + ", " + item + ");");
    statements(node.body());
    out.dedent();
    out.emit("}");
  }

  @Override
  public void visitImpl(Statement.LoopBlock node) {
    if (node.max().isPresent()) {
      String i = temporary("i");
      block(
          String.format(
              "for (int %s = 0; %s < %d && ctx.isActive(); %s++)", i, i, node.max().get(), i),
          node.pos(),
          node.body());
    } else {
      block("while (ctx.isActive())", node.pos(), node.body());
    }
  }

  @Override
  public void visitImpl(Statement.ParallelBlock node) {
    if (node.body().isEmpty()) return;
    out.emit("ctx.runParallel(", node.pos());
    out.indent();
    out.indent();
    for (int i = 0; i < node.body().size(); i++) {
      Statement.RunStatement run = node.body().get(i).cast();
      String task =
          "ParallelTask.agent("
              + quote(run.callee().name())
              + expressions.args(run.argList())
              + ")"
              + run.target().map(t -> ".into(" + quote(t) + ")").orElse("");
      out.emit(task + (i + 1 < node.body().size() ? "," : ");"), run.pos());
    }
    out.dedent();
    out.dedent();
  }

  @Override
  public void visitImpl(Statement.IfBlock node) {
    out.emit("if (" + expressions.condition(node.condition()) + ") {", node.pos());
    out.indent();
    statements(node.thenBody());
    out.dedent();
    if (!node.elseBody().isEmpty()) {
      out.emit("} else {");
      out.indent();
      statements(node.elseBody());
      out.dedent();
    }
    out.emit("}");
  }

  @Override
  public void visitImpl(Statement.MatchBlock node) {
    String subject = temporary("match");
    out.emit(
        "Object " + subject + " = " + expressions.generate(node.subject()) + ";", node.pos());
    boolean first = true;
    for (Statement.WhenClause clause : node.clauses()) {
      out.emit(
          (first ? "if (" : "} else if (")
              + "Ops.equal("
              + subject
              + ", "
              + expressions.generate(clause.pattern())
              + ")) {",
          clause.pos());
      out.indent();
      clause.statement().accept(this, null);
      out.dedent();
      first = false;
    }
    if (node.otherwise().isPresent()) {
      out.emit(first ? "{" : "} else {");
      out.indent();
      node.otherwise().get().accept(this, null);
      out.dedent();
      first = false;
    }
    if (!first) out.emit("}");
  }

  @Override
  public void visitImpl(Statement.FailureBlock node) {
    throw new IllegalStateException("'on failure' is only allowed at the end of a body");
  }

  @Override
  public void visitImpl(Statement.Log node) {
    out.emit("ctx.log(" + expressions.generate(node.message()) + ");", node.pos());
  }

  @Override
  public void visitImpl(Statement.Notify node) {
    out.emit("ctx.sendNotification(" + expressions.generate(node.message()) + ");", node.pos());
  }

  @Override
  public void visitImpl(Statement.EscalateToHuman node) {
    out.emit(
        "ctx.escalateToHuman("
            + node.message().map(expressions::generate).orElse("null")
            + ");",
        node.pos());
  }

  @Override
  public void visitImpl(Statement.Continue node) {
    out.emit("continue;", node.pos());
  }

  @Override
  public void visitImpl(Statement.Abort node) {
    String reason =
        node.reason().map(r -> "Ops.stringify(" + expressions.generate(r) + ")").orElse(
            quote("aborted"));
    out.emit("throw new AbortException(" + reason + ");", node.pos());
  }

  @Override
  public void visitImpl(Statement.MaskAction node) {
    out.emit(
        "ctx.set(\"message\", ctx.mask("
            + quote(node.guardrail().name())
            + ", ctx.get(\"message\")));",
        node.pos());
  }

  @Override
  public void visitImpl(Statement.BlockAction node) {
    if (node.guardrail().isPresent()) {
      String guardrail = quote(node.guardrail().get().name());
      out.emit("if (ctx.check(" + guardrail + ", ctx.get(\"message\"))) {", node.pos());
      out.indent();
      out.emit("ctx.block(" + guardrail + ");");
    } else {
      out.emit("if (" + expressions.condition(node.condition().get()) + ") {", node.pos());
      out.indent();
      out.emit("ctx.block(null);");
    }
    out.dedent();
    out.emit("}");
  }

  @Override
  public void visitImpl(Statement.WarnAction node) {
    if (!node.condition().isPresent()) {
      out.emit(
          "ctx.warn("
              + node.message().map(expressions::generate).orElse(quote(WARNING_DEFAULT))
              + ");",
          node.pos());
      return;
    }
    out.emit("if (" + expressions.condition(node.condition().get()) + ") {", node.pos());
    out.indent();
    out.emit(
        "ctx.warn("
            + node.message().map(expressions::generate).orElse(quote(WARNING_DEFAULT))
            + ");");
    out.dedent();
    out.emit("}");
  }

  @Override
  public void visitImpl(Statement.RetryAction node) {
    String retry = "ctx.retryWith(" + expressions.generate(node.message()) + ");";
    if (!node.condition().isPresent()) {
      out.emit(retry, node.pos());
      return;
    }
    out.emit("if (" + expressions.condition(node.condition().get()) + ") {", node.pos());
    out.indent();
    out.emit(retry);
    out.dedent();
    out.emit("}");
  }
}
