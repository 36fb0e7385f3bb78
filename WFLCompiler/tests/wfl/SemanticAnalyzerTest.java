package wfl;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class SemanticAnalyzerTest {

  private static final ImmutableList<String> GREETER =
      ImmutableList.of(
          "model main = anthropic/claude-sonnet",
          "prompt greet: \"Say hello to $name\"",
          "agent greeter:",
          "    instruction greet");

  private static ImmutableList<Diagnostic> validate(String... lines) {
    List<String> all = new ArrayList<>(GREETER);
    all.addAll(Arrays.asList(lines));
    return new Compiler().validate(Joiner.on('\n').join(all), "/test/file.wf");
  }

  private static Diagnostic assertSingle(ErrorCode code, String errorSubstr, String... lines) {
    ImmutableList<Diagnostic> diagnostics = validate(lines);
    assertThat(diagnostics).comparingElementsUsing(codes()).containsExactly(code);
    Diagnostic diagnostic = diagnostics.get(0);
    assertThat(diagnostic.message()).contains(errorSubstr);
    return diagnostic;
  }

  @Test
  public void validProgram() {
    assertThat(
            validate(
                "flow main $name:",
                "    $reply = run agent greeter $name",
                "    return $reply"))
        .isEmpty();
  }

  @Test
  public void undefinedAgentSuggestsClosestName() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0001,
            "undefined agent 'greter'",
            "flow main $name:",
            "    $reply = run agent greter $name");

    assertThat(d.isError()).isTrue();
    assertThat(d.line()).isEqualTo(6);
    assertThat(d.column()).isEqualTo(24);
    assertThat(d.help()).hasValue("did you mean 'greeter'?");
  }

  @Test
  public void undefinedPromptListsWhatIsDefined() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0001,
            "undefined prompt 'summarize'",
            "flow main $x:",
            "    call llm summarize $x");

    assertThat(d.help()).hasValue("defined prompts are: greet");
  }

  @Test
  public void undefinedModelInPrompt() {
    assertSingle(ErrorCode.E0001, "undefined model 'fast'", "prompt p using model \"fast\": \"x\"");
  }

  @Test
  public void providerModelIdsNeedNoDefinition() {
    assertThat(validate("prompt p using model \"openai/gpt-4o\": \"x\"")).isEmpty();
  }

  @Test
  public void undefinedGuardrail() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0001, "undefined guardrail 'pi'", "on input do", "    mask pi", "end");

    assertThat(d.help()).hasValue("did you mean 'pii'?");
  }

  @Test
  public void variableUsedBeforeDefinition() {
    assertSingle(
        ErrorCode.E0002,
        "variable '$later' is used before it is defined",
        "flow main:",
        "    log $later",
        "    $later = 1");
  }

  @Test
  public void loopVariableDoesNotEscape() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0002,
            "'$item'",
            "flow main:",
            "    for $item in [1, 2] do",
            "        log $item",
            "    end",
            "    log $item");

    assertThat(d.line()).isEqualTo(9);
  }

  @Test
  public void startHandlerAssignmentsAreGlobal() {
    assertThat(
            validate(
                "on start do",
                "    $greeting = \"hi\"",
                "end",
                "flow main:",
                "    log $greeting",
                "    log $session_id"))
        .isEmpty();
  }

  @Test
  public void afterStartAssignmentsAreGlobal() {
    assertThat(
            validate(
                "after start do",
                "    $mode = \"strict\"",
                "end",
                "flow main:",
                "    log $mode"))
        .isEmpty();
  }

  @Test
  public void handlerVariables() {
    assertThat(
            validate(
                "after tool-result do",
                "    log $tool",
                "    log $tool_result",
                "end"))
        .isEmpty();
    assertSingle(
        ErrorCode.E0002, "'$output'", "on input do", "    warn if $output == \"x\"", "end");
  }

  @Test
  public void errorVariableInFailureBlock() {
    assertThat(
            validate(
                "flow main $name:",
                "    run agent greeter $name",
                "    on failure:",
                "        log $error"))
        .isEmpty();
  }

  @Test
  public void duplicateDefinition() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0003,
            "duplicate agent 'greeter'",
            "agent greeter:",
            "    instruction greet");

    assertThat(d.line()).isEqualTo(5);
    assertThat(d.help().get()).startsWith("first defined at ");
  }

  @Test
  public void duplicateSchemaField() {
    assertSingle(
        ErrorCode.E0003,
        "duplicate field 'score' in schema 'Review'",
        "schema Review:",
        "    score: int",
        "    score: float");
  }

  @Test
  public void fieldTypes() {
    assertSingle(
        ErrorCode.E0004, "unknown field type 'integer'", "schema S:", "    n: integer");
    assertSingle(
        ErrorCode.E0004,
        "schemas cannot reference other schemas ('A')",
        "schema A:",
        "    n: int",
        "schema B:",
        "    a: A");
    assertSingle(ErrorCode.E0004, "list needs an element type", "schema S:", "    xs: list");
  }

  @Test
  public void maskIsNotAllowedInFlows() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0009, "'mask' is not allowed in a flow", "flow main:", "    mask pii");

    assertThat(d.help().get()).contains("'on input'");
  }

  @Test
  public void retryOnlyInOutputHandlers() {
    assertSingle(
        ErrorCode.E0009,
        "'retry with' is not allowed in an 'on input' handler",
        "on input do",
        "    retry with \"again\"",
        "end");
    assertThat(validate("on output do", "    retry with \"again\" if $output == \"\"", "end"))
        .isEmpty();
  }

  @Test
  public void afterHandlersOnlyWarn() {
    assertSingle(
        ErrorCode.E0009,
        "'block' is not allowed in an 'after output' handler",
        "after output do",
        "    block if jailbreak",
        "end");
    assertThat(validate("after output do", "    warn \"seen\"", "end")).isEmpty();
  }

  @Test
  public void missingRequiredProperties() {
    assertSingle(
        ErrorCode.E0010,
        "agent 'helper' is missing required property 'instruction'",
        "agent helper:",
        "    description \"helps\"");
    assertSingle(
        ErrorCode.E0010,
        "model 'fast' is missing required property 'name'",
        "model fast:",
        "    provider: openai");
    assertSingle(
        ErrorCode.E0010,
        "tool 'weather' is missing required property 'type'",
        "tool weather:",
        "    url: \"https://weather.example.com\"");
  }

  @Test
  public void circularAgentReference() {
    assertSingle(
        ErrorCode.E0011,
        "circular agent reference: a -> b -> c -> a",
        "agent a:",
        "    instruction greet",
        "    delegate b",
        "agent b:",
        "    instruction greet",
        "    delegate c",
        "agent c:",
        "    instruction greet",
        "    use a");
  }

  @Test
  public void selfDelegation() {
    assertSingle(
        ErrorCode.E0011,
        "circular agent reference: a -> a",
        "agent a:",
        "    instruction greet",
        "    delegate a");
  }

  @Test
  public void invalidGuardrailPattern() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0012,
            "invalid pattern for guardrail 'broken'",
            "guardrail broken = regex \"[unclosed\"");

    assertThat(d.line()).isEqualTo(5);
  }

  @Test
  public void continueOutsideLoop() {
    assertSingle(
        ErrorCode.E0013,
        "'continue' is only allowed inside 'for' and 'loop' blocks",
        "flow main:",
        "    if true:",
        "        continue");
    assertThat(validate("flow main:", "    loop max 2 do", "        continue", "    end"))
        .isEmpty();
  }

  @Test
  public void escalateContinueOutsideLoop() {
    assertSingle(
        ErrorCode.E0013,
        "'on escalate continue'",
        "flow main $x:",
        "    run agent greeter $x, on escalate continue");
  }

  @Test
  public void parallelHoldsOnlyAgentRuns() {
    assertSingle(
        ErrorCode.E0014,
        "only 'run agent' statements are allowed in 'parallel do'",
        "flow main $x:",
        "    parallel do",
        "        $a = run agent greeter $x",
        "        log $x",
        "    end");
  }

  @Test
  public void statementsAfterFailureBlock() {
    Diagnostic d =
        assertSingle(
            ErrorCode.E0007,
            "statements after 'on failure' are not allowed",
            "flow main:",
            "    on failure:",
            "        log $error",
            "    log \"done\"");

    assertThat(d.line()).isEqualTo(8);
  }

  @Test
  public void delegateAndUseIsOnlyAWarning() {
    ImmutableList<Diagnostic> diagnostics =
        validate(
            "agent lead:",
            "    instruction greet",
            "    delegate greeter",
            "    use helper",
            "agent helper:",
            "    instruction greet");

    assertThat(diagnostics).comparingElementsUsing(codes()).containsExactly(ErrorCode.W0002);
    assertThat(diagnostics.get(0).isError()).isFalse();
    assertThat(diagnostics.get(0).toString())
        .isEqualTo("/test/file.wf:5:1: warning[W0002]: agent 'lead' has both 'delegate' and 'use'");
  }

  @Test
  public void syntaxErrorsAreReportedAsDiagnostics() {
    ImmutableList<Diagnostic> diagnostics = validate("flow main:", "    return = 3");

    assertThat(diagnostics).comparingElementsUsing(codes()).containsExactly(ErrorCode.E0007);
    assertThat(diagnostics.get(0).line()).isEqualTo(6);
  }

  @Test
  public void allErrorsAreReportedInSourceOrder() {
    ImmutableList<Diagnostic> diagnostics =
        validate(
            "flow main:",
            "    log $missing",
            "    run agent nobody",
            "    continue");

    assertThat(diagnostics)
        .comparingElementsUsing(codes())
        .containsExactly(ErrorCode.E0002, ErrorCode.E0001, ErrorCode.E0013)
        .inOrder();
  }

  private static Correspondence<Diagnostic, ErrorCode> codes() {
    return Correspondence.from((d, c) -> d.code() == c, "has code");
  }
}
