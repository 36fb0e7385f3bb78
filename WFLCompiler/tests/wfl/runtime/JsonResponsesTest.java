package wfl.runtime;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;

public class JsonResponsesTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  @Test
  public void plainJson() throws JsonParseException {
    JsonNode node = JsonResponses.parse("  {\"score\": 7}\n");

    assertThat(node.get("score").asInt()).isEqualTo(7);
  }

  @Test
  public void fencedBlockWithLanguageTag() throws JsonParseException {
    JsonNode node =
        JsonResponses.parse(
            lines("Here is the review:", "```json", "[1, 2, 3]", "```", "Hope that helps."));

    assertThat(node.isArray()).isTrue();
    assertThat(node.size()).isEqualTo(3);
  }

  @Test
  public void multipleBlocksAreRejected() {
    JsonParseException ex =
        assertThrows(
            JsonParseException.class,
            () -> JsonResponses.parse(lines("```", "{}", "```", "```", "{}", "```")));

    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("Response contains multiple code blocks. Please return a single JSON object.");
  }

  @Test
  public void invalidJsonKeepsTheRawResponse() {
    JsonParseException ex =
        assertThrows(JsonParseException.class, () -> JsonResponses.parse("{\"score\": }"));

    assertThat(ex.rawResponse()).isEqualTo("{\"score\": }");
    assertThat(ex).hasCauseThat().isNotNull();
  }

  @Test
  public void trailingContentIsRejected() {
    String response = "{\"label\": \"a\", \"score\": 1} and more";

    JsonParseException ex =
        assertThrows(JsonParseException.class, () -> JsonResponses.parse(response));

    assertThat(ex.rawResponse()).isEqualTo(response);
  }

  @Test
  public void emptyResponse() {
    JsonParseException ex = assertThrows(JsonParseException.class, () -> JsonResponses.parse(""));

    assertThat(ex).hasMessageThat().isEqualTo("Response is empty");
  }

  @Test
  public void toJava() throws JsonParseException {
    Object value =
        JsonResponses.toJava(
            JsonResponses.parse("{\"n\": 2, \"x\": 1.5, \"tags\": [\"a\", null], \"ok\": true}"));

    assertThat(value).isInstanceOf(Map.class);
    Map<?, ?> map = (Map<?, ?>) value;
    assertThat(map.get("n")).isEqualTo(2L);
    assertThat(map.get("x")).isEqualTo(1.5);
    assertThat((List<?>) map.get("tags")).containsExactly("a", null).inOrder();
    assertThat(map.get("ok")).isEqualTo(true);
    assertThat(JsonResponses.toJson(value))
        .isEqualTo("{\"n\":2,\"x\":1.5,\"tags\":[\"a\",null],\"ok\":true}");
  }
}
