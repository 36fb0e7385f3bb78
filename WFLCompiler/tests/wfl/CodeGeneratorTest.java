package wfl;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;

public class CodeGeneratorTest {

  private static String generate(boolean comments, String... lines) throws DslCompileException {
    return new Compiler()
        .generateSource(Joiner.on('\n').join(lines), "/test/gen.wf", comments)
        .source();
  }

  private static String generate(String... lines) throws DslCompileException {
    return generate(false, lines);
  }

  @Test
  public void classShape() throws DslCompileException {
    String source = generate(true, "model main = anthropic/claude-sonnet");

    assertThat(source).startsWith("// Generated from /test/gen.wf. Do not edit.\n");
    assertThat(source).contains("package wfl.generated;\n");
    assertThat(source).containsMatch("public final class Workflow_\\w{12} extends DslWorkflow");
    assertThat(source)
        .contains("    // /test/gen.wf:1\n    model(\"main\", \"anthropic/claude-sonnet\");");
  }

  @Test
  public void commentsCanBeLeftOut() throws DslCompileException {
    String source = generate(false, "flow main:", "    log \"hi\"");

    assertThat(source).doesNotContain("// /test/gen.wf");
    assertThat(source).contains("ctx.log(\"hi\");");
  }

  @Test
  public void definitions() throws DslCompileException {
    String source =
        generate(
            "model fast:",
            "    provider: openai",
            "    name: \"gpt-4o\"",
            "    options:",
            "        temperature: 0.2",
            "schema Review:",
            "    score: int",
            "    tags: string[]",
            "tool search = builtin web.search",
            "guardrail secrets = regex \"sk-[a-z0-9]+\"",
            "retry careful = 3 times, exponential backoff",
            "retry plain = 2 times",
            "timeout quick = 2 minutes",
            "prompt review using model \"fast\" expecting Review[]: \"Review $pr\"",
            "agent reviewer:",
            "    instruction review",
            "    tools search",
            "    retry careful",
            "    timeout 30 seconds");

    assertThat(source)
        .contains(
            "model(\"fast\", \"openai/gpt-4o\", Ops.map(\"options\", Ops.map(\"temperature\","
                + " 0.2d)));");
    assertThat(source).contains(".field(\"tags\", \"list[string]\")");
    assertThat(source).contains("tool(ToolSpec.builder(\"search\", \"builtin\")");
    assertThat(source).contains(".setLocation(\"web.search\")");
    assertThat(source).contains("guardrail(\"secrets\", \"sk-[a-z0-9]+\");");
    assertThat(source).contains("retryPolicy(\"careful\", 3, RetryPolicy.Backoff.EXPONENTIAL);");
    assertThat(source).contains("retryPolicy(\"plain\", 2, RetryPolicy.Backoff.FIXED);");
    assertThat(source).contains("timeoutPolicy(\"quick\", 120L);");
    assertThat(source).contains(".setBody(ctx -> (\"Review \" + ctx.resolve(\"pr\")))");
    assertThat(source).contains(".setExpectsArray(true)");
    assertThat(source).contains(".setTimeoutSeconds(30L)");
  }

  @Test
  public void flowsAndHandlersBecomeMethods() throws DslCompileException {
    String source =
        generate(
            "flow main $ticket:",
            "    log $ticket",
            "on input do",
            "    warn \"first\"",
            "end",
            "on input do",
            "    warn \"second\"",
            "end");

    assertThat(source).contains("flow(\"main\", ImmutableList.of(\"ticket\"), this::flow_main);");
    assertThat(source).contains("handler(\"on_input\", this::on_input);");
    assertThat(source).contains("handler(\"on_input\", this::on_input_2);");
    assertThat(source)
        .contains("private Object flow_main(WorkflowContext ctx) throws WorkflowException {");
    assertThat(source)
        .contains("private Object on_input_2(WorkflowContext ctx) throws WorkflowException {");
  }

  @Test
  public void flowMethodNames() {
    assertThat(CodeGenerator.flowMethodName("main")).isEqualTo("flow_main");
    assertThat(CodeGenerator.flowMethodName("fix-bugs")).isEqualTo("flow_fix_bugs");
  }

  @Test
  public void parallelBlocks() throws DslCompileException {
    String source =
        generate(
            "prompt p: \"Help.\"",
            "agent one:",
            "    instruction p",
            "agent two:",
            "    instruction p",
            "flow main $x:",
            "    parallel do",
            "        $a = run agent one $x",
            "        run agent two",
            "    end");

    assertThat(source)
        .contains(
            "    ctx.runParallel(\n"
                + "        ParallelTask.agent(\"one\", ctx.get(\"x\")).into(\"a\"),\n"
                + "        ParallelTask.agent(\"two\"));");
  }

  @Test
  public void unreachableStatementsAreDropped() throws DslCompileException {
    String source = generate("flow main:", "    return 1", "    log \"never\"");

    assertThat(source).contains("return 1L;");
    assertThat(source).doesNotContain("never");
    assertThat(source).doesNotContain("return null;");
  }

  @Test
  public void failureBlocksWrapTheBody() throws DslCompileException {
    String source =
        generate("flow main:", "    log \"work\"", "    on failure:", "        log $error");

    assertThat(source).contains("} catch (Exception _failure) {");
    assertThat(source).contains("ctx.onFailure(_failure);");
    assertThat(source).contains("ctx.log(ctx.get(\"error\"));");
  }

  @Test
  public void expressions() throws DslCompileException {
    String source =
        generate(
            "flow main $x:",
            "    $y = ($x + 1) * 2 > 3 and not $x contains \"a\"",
            "    $z = filter $x where .meta.score >= 5",
            "    $x.meta.count = -1");

    assertThat(source)
        .contains(
            "ctx.set(\"y\", (Ops.truthy(Ops.compare(\">\", Ops.multiply(Ops.add(ctx.get(\"x\"),"
                + " 1L), 2L), 3L)) && Ops.truthy(!Ops.truthy(Ops.contains(ctx.get(\"x\"),"
                + " \"a\")))));");
    assertThat(source)
        .contains(
            "ctx.set(\"z\", Ops.filter(ctx.get(\"x\"), \">=\", 5L, \"meta\", \"score\"));");
    assertThat(source).contains("ctx.setProperty(\"x\", -1L, \"meta\", \"count\");");
  }
}
