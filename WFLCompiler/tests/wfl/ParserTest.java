package wfl;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class ParserTest {

  private static AST parse(String... lines) throws CompilerException {
    String source = Joiner.on('\n').join(lines) + "\n";
    return Transformer.transform("/test/file.wf", EarleyParser.parse("/test/file.wf", source));
  }

  private static <T extends AST.Declaration> T only(AST ast, AST.Declaration.Type type) {
    ImmutableList<T> decls = ast.declarations(type);
    assertThat(decls).hasSize(1);
    return decls.get(0);
  }

  private static ImmutableList<Statement> flowBody(String... bodyLines) throws CompilerException {
    String[] lines = new String[bodyLines.length + 1];
    lines[0] = "flow main:";
    for (int i = 0; i < bodyLines.length; i++) {
      lines[i + 1] = "    " + bodyLines[i];
    }
    AST.FlowDef flow = only(parse(lines), AST.Declaration.Type.FLOW);
    return flow.body();
  }

  private static void assertErrors(String errorSubstr, String... lines) {
    CompilerException ex = assertThrows(CompilerException.class, () -> parse(lines));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void emptyFile() throws CompilerException {
    assertThat(parse("").declarations()).isEmpty();
  }

  @Test
  public void versionAndImports() throws CompilerException {
    AST ast = parse("version 2", "import ./shared/common.wf", "import \"lib/tools.wf\"");

    assertThat(ast.version()).hasValue("2");
    ImmutableList<AST.ImportDef> imports = ast.declarations(AST.Declaration.Type.IMPORT);
    assertThat(imports).hasSize(2);
    assertThat(imports.get(0).path()).isEqualTo("./shared/common.wf");
    assertThat(imports.get(1).path()).isEqualTo("lib/tools.wf");
  }

  @Test
  public void modelShorthand() throws CompilerException {
    AST.ModelDef model =
        only(parse("model main = anthropic/claude-sonnet"), AST.Declaration.Type.MODEL);

    assertThat(model.name()).isEqualTo("main");
    assertThat(model.shorthand()).hasValue("anthropic/claude-sonnet");
    assertThat(model.properties()).isEmpty();
  }

  @Test
  public void modelBlockWithNestedProperties() throws CompilerException {
    AST.ModelDef model =
        only(
            parse(
                "model fast:",
                "    provider: openai",
                "    name: \"gpt-4o\"",
                "    options:",
                "        temperature: 0.2",
                "        max_tokens: 512"),
            AST.Declaration.Type.MODEL);

    assertThat(model.shorthand()).isEmpty();
    assertThat(model.properties())
        .containsExactly(
            "provider",
            "openai",
            "name",
            "gpt-4o",
            "options",
            ImmutableMap.of("temperature", 0.2, "max_tokens", 512L))
        .inOrder();
  }

  @Test
  public void duplicatePropertyError() {
    CompilerException ex =
        assertThrows(
            CompilerException.class,
            () -> parse("model fast:", "    provider: openai", "    provider: anthropic"));
    assertThat(ex.code()).isEqualTo(ErrorCode.E0003);
    assertThat(ex).hasMessageThat().contains("property 'provider' is set twice");
  }

  @Test
  public void schemaFieldTypes() throws CompilerException {
    AST.SchemaDef schema =
        only(
            parse(
                "schema Review:",
                "    score: int",
                "    tags: string[]",
                "    notes: list[string]?",
                "    summary: string?"),
            AST.Declaration.Type.SCHEMA);

    ImmutableList<AST.Field> fields = schema.fields();
    assertThat(fields).hasSize(4);
    assertThat(fields.get(0).fieldType().base()).isEqualTo("int");
    assertThat(fields.get(1).fieldType().isList()).isTrue();
    assertThat(fields.get(1).fieldType().element().get().base()).isEqualTo("string");
    assertThat(fields.get(2).fieldType().isList()).isTrue();
    assertThat(fields.get(2).fieldType().optional()).isTrue();
    assertThat(fields.get(3).fieldType().isList()).isFalse();
    assertThat(fields.get(3).fieldType().optional()).isTrue();
  }

  @Test
  public void toolForms() throws CompilerException {
    AST ast =
        parse(
            "tool github = mcp \"github-server\" with auth bearer \"$GITHUB_TOKEN\"",
            "tool search = builtin web.search",
            "tool weather:",
            "    type: http",
            "    url: \"https://weather.example.com\"");

    ImmutableList<AST.ToolDef> tools = ast.declarations(AST.Declaration.Type.TOOL);
    assertThat(tools).hasSize(3);

    assertThat(tools.get(0).kind()).isEqualTo(AST.ToolDef.Kind.MCP);
    assertThat(tools.get(0).location()).hasValue("github-server");
    assertThat(tools.get(0).authScheme()).hasValue("bearer");
    assertThat(tools.get(0).authValue()).hasValue("$GITHUB_TOKEN");

    assertThat(tools.get(1).kind()).isEqualTo(AST.ToolDef.Kind.BUILTIN);
    assertThat(tools.get(1).location()).hasValue("web.search");

    assertThat(tools.get(2).kind()).isEqualTo(AST.ToolDef.Kind.CONFIGURED);
    assertThat(tools.get(2).location()).hasValue("https://weather.example.com");
    assertThat(tools.get(2).properties()).containsEntry("type", "http");
  }

  @Test
  public void policies() throws CompilerException {
    AST ast =
        parse(
            "guardrail secrets = regex \"sk-[a-z0-9]+\"",
            "retry careful = 3 times, exponential backoff",
            "retry plain = 2 times",
            "timeout quick = 2 minutes");

    AST.GuardrailDef guardrail = only(ast, AST.Declaration.Type.GUARDRAIL);
    assertThat(guardrail.pattern()).isEqualTo("sk-[a-z0-9]+");

    ImmutableList<AST.RetryPolicyDef> retries = ast.declarations(AST.Declaration.Type.RETRY_POLICY);
    assertThat(retries.get(0).times()).isEqualTo(3);
    assertThat(retries.get(0).backoff()).isEqualTo(AST.RetryPolicyDef.Backoff.EXPONENTIAL);
    assertThat(retries.get(1).backoff()).isEqualTo(AST.RetryPolicyDef.Backoff.FIXED);

    AST.TimeoutPolicyDef timeout = only(ast, AST.Declaration.Type.TIMEOUT_POLICY);
    assertThat(timeout.seconds()).isEqualTo(120);
  }

  @Test
  public void unknownBackoffError() {
    assertErrors("unknown backoff 'random'", "retry r = 3 times, random backoff");
  }

  @Test
  public void unknownTimeUnitError() {
    CompilerException ex =
        assertThrows(CompilerException.class, () -> parse("timeout t = 3 fortnights"));
    assertThat(ex.code()).isEqualTo(ErrorCode.E0007);
  }

  @Test
  public void promptWithModifiers() throws CompilerException {
    AST.PromptDef prompt =
        only(
            parse(
                "prompt review using model \"fast\" expecting Review[] inherit $ctx: \"\"\"",
                "    Review the code from $author.",
                "    \"\"\"",
                "    escalate if contains \"UNSURE\""),
            AST.Declaration.Type.PROMPT);

    assertThat(prompt.name()).isEqualTo("review");
    assertThat(prompt.model().get().name()).isEqualTo("fast");
    assertThat(prompt.schema().get().name()).isEqualTo("Review");
    assertThat(prompt.expectsArray()).isTrue();
    assertThat(prompt.inherit()).hasValue("ctx");
    assertThat(prompt.escalation().get().op()).isEqualTo("contains");
    assertThat(prompt.escalation().get().value()).isEqualTo("UNSURE");
    assertThat(prompt.body().parts()).hasSize(3);
    assertThat(prompt.body().parts().get(1).variable()).isEqualTo("author");
  }

  @Test
  public void promptOnOneLine() throws CompilerException {
    AST.PromptDef prompt =
        only(parse("prompt greet: \"Say hello\""), AST.Declaration.Type.PROMPT);

    assertThat(prompt.body().isConstant()).isTrue();
    assertThat(prompt.model()).isEmpty();
    assertThat(prompt.escalation()).isEmpty();
  }

  @Test
  public void agentProperties() throws CompilerException {
    AST ast =
        parse(
            "agent reviewer:",
            "    tools github, web.search",
            "    instruction review",
            "    retry careful",
            "    timeout 30 seconds",
            "    description \"Reviews pull requests\"",
            "    delegate fixer",
            "agent:",
            "    instruction greet",
            "    timeout quick");

    ImmutableList<AST.AgentDef> agents = ast.declarations(AST.Declaration.Type.AGENT);
    AST.AgentDef reviewer = agents.get(0);
    assertThat(reviewer.name()).isEqualTo("reviewer");
    assertThat(reviewer.tools().stream().map(AST.Ref::name).toArray())
        .asList()
        .containsExactly("github", "web.search")
        .inOrder();
    assertThat(reviewer.instruction().get().name()).isEqualTo("review");
    assertThat(reviewer.retry().get().name()).isEqualTo("careful");
    assertThat(reviewer.timeoutSeconds()).hasValue(30L);
    assertThat(reviewer.description()).hasValue("Reviews pull requests");
    assertThat(reviewer.delegate()).hasSize(1);

    AST.AgentDef entry = agents.get(1);
    assertThat(entry.declaredName()).isEmpty();
    assertThat(entry.timeoutPolicy().get().name()).isEqualTo("quick");
    assertThat(entry.timeoutSeconds()).isEmpty();
  }

  @Test
  public void agentPropertySetTwiceError() {
    CompilerException ex =
        assertThrows(
            CompilerException.class,
            () -> parse("agent a:", "    instruction p", "    instruction q"));
    assertThat(ex.code()).isEqualTo(ErrorCode.E0003);
    assertThat(ex).hasMessageThat().contains("agent property 'instruction' is set twice");
  }

  @Test
  public void flowParameters() throws CompilerException {
    AST.FlowDef flow =
        only(parse("flow review $pr $depth:", "    return $pr"), AST.Declaration.Type.FLOW);

    assertThat(flow.name()).isEqualTo("review");
    assertThat(flow.params()).containsExactly("pr", "depth").inOrder();
    assertThat(flow.body()).hasSize(1);
    assertThat(flow.body().get(0).type()).isEqualTo(Statement.Type.RETURN);
  }

  @Test
  public void handlers() throws CompilerException {
    AST ast =
        parse(
            "on input do",
            "    mask pii",
            "end",
            "after tool-call do",
            "    warn if $x > 3",
            "end");

    ImmutableList<AST.HandlerDef> handlers = ast.declarations(AST.Declaration.Type.HANDLER);
    assertThat(handlers.get(0).timing()).isEqualTo(AST.HandlerDef.Timing.ON);
    assertThat(handlers.get(0).event()).isEqualTo(AST.HandlerDef.Event.INPUT);
    assertThat(handlers.get(0).methodName()).isEqualTo("on_input");
    assertThat(handlers.get(1).toString()).isEqualTo("after tool-call");
    assertThat(handlers.get(1).methodName()).isEqualTo("after_tool_call");
    assertThat(handlers.get(1).body().get(0).type()).isEqualTo(Statement.Type.WARN);
  }

  @Test
  public void invocations() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody(
            "$r = run agent reviewer with $pr, \"strict\", on escalate return \"stopped\"",
            "call llm summarize $r using model \"fast\"",
            "$s = run cleanup $r");

    Statement.RunStatement run = body.get(0).cast();
    assertThat(run.target()).hasValue("r");
    assertThat(run.callee().name()).isEqualTo("reviewer");
    assertThat(run.args()).hasSize(2);
    assertThat(run.escalationHandler().get().action())
        .isEqualTo(Statement.EscalationHandler.Action.RETURN);

    Statement.CallStatement call = body.get(1).cast();
    assertThat(call.target()).isEmpty();
    assertThat(call.callee().name()).isEqualTo("summarize");
    assertThat(call.model()).hasValue("fast");

    Statement.FlowCallStatement flowCall = body.get(2).cast();
    assertThat(flowCall.callee().name()).isEqualTo("cleanup");
    assertThat(flowCall.args()).hasSize(1);
  }

  @Test
  public void escalationActions() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody("run agent a $x, on escalate continue", "run agent a $x, on escalate abort");

    assertThat(body.get(0).<Statement.RunStatement>cast().escalationHandler().get().action())
        .isEqualTo(Statement.EscalationHandler.Action.CONTINUE);
    assertThat(body.get(1).<Statement.RunStatement>cast().escalationHandler().get().action())
        .isEqualTo(Statement.EscalationHandler.Action.ABORT);
  }

  @Test
  public void loops() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody(
            "for $item in $items do",
            "    push $item to $seen",
            "end",
            "loop max 3 do",
            "    continue",
            "end",
            "loop do",
            "    abort \"stop\"",
            "end");

    Statement.ForLoop forLoop = body.get(0).cast();
    assertThat(forLoop.variable()).isEqualTo("item");
    assertThat(forLoop.body().get(0).<Statement.PushStatement>cast().list()).isEqualTo("seen");
    assertThat(body.get(1).<Statement.LoopBlock>cast().max()).hasValue(3);
    assertThat(body.get(2).<Statement.LoopBlock>cast().max()).isEmpty();
  }

  @Test
  public void ifElse() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody(
            "if $score >= 7 and not $draft:",
            "    log \"good\"",
            "else:",
            "    log \"bad\"",
            "    notify \"team\"");

    Statement.IfBlock ifBlock = body.get(0).cast();
    Expression.Binary condition = ifBlock.condition().cast();
    assertThat(condition.op()).isEqualTo(Expression.BinaryOperator.AND);
    assertThat(ifBlock.thenBody()).hasSize(1);
    assertThat(ifBlock.elseBody()).hasSize(2);
  }

  @Test
  public void matchBlock() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody(
            "match $verdict do",
            "    when \"approve\" -> return true",
            "    when \"reject\" -> return false",
            "    else -> escalate to human \"unclear\"",
            "end");

    Statement.MatchBlock match = body.get(0).cast();
    assertThat(match.clauses()).hasSize(2);
    assertThat(match.clauses().get(1).statement().type()).isEqualTo(Statement.Type.RETURN);
    assertThat(match.otherwise().get().type()).isEqualTo(Statement.Type.ESCALATE_TO_HUMAN);
  }

  @Test
  public void parallelAndFailure() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody(
            "parallel do",
            "    $a = run agent one $x",
            "    $b = run agent two $x",
            "end",
            "on failure:",
            "    log $error");

    assertThat(body.get(0).<Statement.ParallelBlock>cast().body()).hasSize(2);
    assertThat(body.get(1).type()).isEqualTo(Statement.Type.FAILURE);
  }

  @Test
  public void guardrailActions() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody(
            "mask pii",
            "block if secrets",
            "block if $message contains \"DROP TABLE\"",
            "warn \"careful\"",
            "retry with \"shorter please\" if $length > 100");

    assertThat(body.get(0).<Statement.MaskAction>cast().guardrail().name()).isEqualTo("pii");
    assertThat(body.get(1).<Statement.BlockAction>cast().guardrail().get().name())
        .isEqualTo("secrets");
    assertThat(body.get(2).<Statement.BlockAction>cast().condition()).isPresent();
    assertThat(body.get(3).<Statement.WarnAction>cast().message()).isPresent();
    assertThat(body.get(4).<Statement.RetryAction>cast().condition()).isPresent();
  }

  @Test
  public void assignments() throws CompilerException {
    ImmutableList<Statement> body =
        flowBody("$x = {name: \"a\", \"tags\": [1, 2.5, null]}", "$x.meta.count = -1");

    Statement.Assignment assignment = body.get(0).cast();
    Expression.ObjectLiteral object = assignment.value().cast();
    assertThat(object.entries()).hasSize(2);
    assertThat(object.entries().get(1).key()).isEqualTo("tags");

    Statement.PropertyAssignment property = body.get(1).cast();
    assertThat(property.variable()).isEqualTo("x");
    assertThat(property.path()).containsExactly("meta", "count").inOrder();
    assertThat(property.value().<Expression.NumberLiteral>cast().text()).isEqualTo("-1");
  }

  @Test
  public void operatorPrecedence() throws CompilerException {
    Statement.Assignment assignment = flowBody("$x = 1 + 2 * 3").get(0).cast();
    Expression.Binary sum = assignment.value().cast();

    assertThat(sum.op()).isEqualTo(Expression.BinaryOperator.ADD);
    assertThat(sum.rhs().<Expression.Binary>cast().op())
        .isEqualTo(Expression.BinaryOperator.MULTIPLY);
  }

  @Test
  public void filterExpression() throws CompilerException {
    Statement.Assignment assignment =
        flowBody("$high = filter $issues where .severity.level >= 3").get(0).cast();
    Expression.Filter filter = assignment.value().cast();

    assertThat(filter.property().path()).containsExactly("severity", "level").inOrder();
    assertThat(filter.op()).isEqualTo(Expression.BinaryOperator.GREATER_EQUAL);
  }

  @Test
  public void missingEndError() {
    assertErrors("'end'", "flow main:", "    for $x in $xs do", "        log $x");
  }

  @Test
  public void unexpectedTokenError() {
    CompilerException ex =
        assertThrows(CompilerException.class, () -> parse("flow main:", "    return = 3"));
    assertThat(ex.code()).isEqualTo(ErrorCode.E0007);
    assertThat(ex).hasMessageThat().contains("unexpected '='");
    assertThat(ex.pos().lineNumber()).isEqualTo(1);
  }
}
