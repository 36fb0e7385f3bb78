package wfl;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

public class DiagnosticRendererTest {

  private static final String SOURCE =
      "model main = x/y\nprompt p using model \"fast\": \"x\"\nflow main:\n    log 1";

  private static Diagnostic error(String file, int line, int column, String help) {
    return Diagnostic.at(
        ErrorCode.E0001, new Tokenizer.Pos(file, line, column), "undefined model 'fast'", help);
  }

  private static Diagnostic warning(String file) {
    return Diagnostic.at(
        ErrorCode.W0002, new Tokenizer.Pos(file, 2, 0), "agent 'a' has both 'delegate' and 'use'");
  }

  @Test
  public void rendersSourceContextAndCarets() {
    DiagnosticRenderer renderer = new DiagnosticRenderer().addSource("agent.wf", SOURCE);

    String rendered = renderer.render(error("agent.wf", 1, 21, "did you mean 'main'?"));

    assertThat(rendered)
        .isEqualTo(
            Joiner.on('\n')
                .join(
                    "error[E0001]: undefined model 'fast'",
                    "  --> agent.wf:2:22",
                    "     |",
                    "   1 | model main = x/y",
                    "   2 | prompt p using model \"fast\": \"x\"",
                    "     |                      ^^^^^^^",
                    "   3 | flow main:",
                    "     |",
                    "     = help: did you mean 'main'?",
                    ""));
  }

  @Test
  public void rendersWithoutSource() {
    String rendered = new DiagnosticRenderer().render(warning("other.wf"));

    assertThat(rendered)
        .isEqualTo(
            "warning[W0002]: agent 'a' has both 'delegate' and 'use'\n"
                + "  --> other.wf:3:1\n"
                + "     |\n");
  }

  @Test
  public void caretsKeepTabs() {
    DiagnosticRenderer renderer =
        new DiagnosticRenderer().addSource("t.wf", "flow main:\n\tlog $x");

    String rendered = renderer.render(error("t.wf", 1, 5, "h"));

    assertThat(rendered).contains("     | \t    ^^\n");
  }

  @Test
  public void renderAllEndsWithSummary() {
    DiagnosticRenderer renderer = new DiagnosticRenderer().addSource("agent.wf", SOURCE);

    String rendered =
        renderer.renderAll(
            ImmutableList.of(error("agent.wf", 1, 21, "help"), error("agent.wf", 3, 4, "help")));

    assertThat(rendered).endsWith("\nFound 2 errors in agent.wf\n");
    assertThat(renderer.renderAll(ImmutableList.of())).isEmpty();
  }

  @Test
  public void summaryCounts() {
    assertThat(DiagnosticRenderer.summary(ImmutableList.of(error("a.wf", 0, 0, "h"))))
        .isEqualTo("Found 1 error in a.wf");
    assertThat(
            DiagnosticRenderer.summary(
                ImmutableList.of(
                    error("a.wf", 0, 0, "h"), error("b.wf", 0, 0, "h"), warning("b.wf"))))
        .isEqualTo("Found 2 errors and 1 warning in 2 files");
    assertThat(DiagnosticRenderer.summary(ImmutableList.of(warning("a.wf"), warning("a.wf"))))
        .isEqualTo("Found 2 warnings in a.wf");
  }

  @Test
  public void json() throws Exception {
    String json =
        new DiagnosticRenderer()
            .toJson(
                ImmutableList.of(
                    error("agent.wf", 1, 21, "did you mean 'main'?"), warning("agent.wf")),
                "agent.wf",
                Optional.of(FileStats.create(1, 2, 3, 0)));

    JsonNode root = new ObjectMapper().readTree(json);
    assertThat(root.get("version").asText()).isEqualTo("1.0");
    assertThat(root.get("valid").asBoolean()).isFalse();
    assertThat(root.get("errors")).hasSize(1);
    assertThat(root.get("warnings")).hasSize(1);

    JsonNode error = root.get("errors").get(0);
    assertThat(error.get("code").asText()).isEqualTo("E0001");
    assertThat(error.get("severity").asText()).isEqualTo("error");
    assertThat(error.get("location").get("line").asInt()).isEqualTo(2);
    assertThat(error.get("location").get("column").asInt()).isEqualTo(22);
    assertThat(error.get("help").asText()).isEqualTo("did you mean 'main'?");
    assertThat(root.get("warnings").get(0).has("help")).isFalse();
    assertThat(root.get("stats").get("flows").asInt()).isEqualTo(3);
  }

  @Test
  public void jsonWithoutStats() throws Exception {
    String json = new DiagnosticRenderer().toJson(ImmutableList.of(), "ok.wf", Optional.empty());

    JsonNode root = new ObjectMapper().readTree(json);
    assertThat(root.get("valid").asBoolean()).isTrue();
    assertThat(root.has("stats")).isFalse();
  }
}
