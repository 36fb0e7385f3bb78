package wfl.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/** Pulls the JSON value out of a model response, which may wrap it in a markdown fence. */
public final class JsonResponses {
  private static final String FENCE = "```";
  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  /**
   * Parses the response as JSON: the whole text when it has no fenced block, the block's content
   * when it has exactly one. Several blocks are ambiguous and rejected.
   */
  public static JsonNode parse(String content) throws JsonParseException {
    List<String> blocks = fencedBlocks(content);
    String json;
    if (blocks.isEmpty()) {
      json = content.trim();
    } else if (blocks.size() == 1) {
      json = blocks.get(0).trim();
    } else {
      throw new JsonParseException(
          "Response contains multiple code blocks. Please return a single JSON object.", content);
    }
    try {
      JsonNode node = MAPPER.readTree(json);
      if (node == null || node.isMissingNode()) {
        throw new JsonParseException("Response is empty", content);
      }
      return node;
    } catch (JsonProcessingException ex) {
      throw new JsonParseException(ex.getOriginalMessage(), content, ex);
    }
  }

  // The language tag after an opening fence is ignored.
  static List<String> fencedBlocks(String content) {
    List<String> blocks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    boolean inBlock = false;
    for (String line : Splitter.on('\n').split(content)) {
      if (line.startsWith(FENCE)) {
        if (inBlock) {
          blocks.add(Joiner.on('\n').join(current));
          current.clear();
        }
        inBlock = !inBlock;
      } else if (inBlock) {
        current.add(line);
      }
    }
    return blocks;
  }

  /** Plain Java form: maps, lists, {@code Long}, {@code Double}, strings, booleans and null. */
  public static Object toJava(JsonNode node) {
    switch (node.getNodeType()) {
      case OBJECT:
        {
          Map<String, Object> map = new LinkedHashMap<>();
          node.fields().forEachRemaining(e -> map.put(e.getKey(), toJava(e.getValue())));
          return map;
        }
      case ARRAY:
        {
          List<Object> list = new ArrayList<>();
          node.forEach(item -> list.add(toJava(item)));
          return list;
        }
      case NUMBER:
        return node.isIntegralNumber() ? (Object) node.longValue() : (Object) node.doubleValue();
      case STRING:
        return node.textValue();
      case BOOLEAN:
        return node.booleanValue();
      default:
        return null;
    }
  }

  /** Serializes a plain Java value as compact JSON. */
  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("value is not serializable as JSON", ex);
    }
  }

  /** Indented JSON, as shown to a model. */
  public static String toPrettyJson(Object value) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("value is not serializable as JSON", ex);
    }
  }

  private JsonResponses() {}
}
