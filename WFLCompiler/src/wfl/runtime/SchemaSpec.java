package wfl.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;

/** A named record shape that structured model responses must match. */
public final class SchemaSpec {
  private final String name;
  private final ImmutableMap<String, FieldType> fields;

  private SchemaSpec(String name, Map<String, FieldType> fields) {
    this.name = name;
    this.fields = ImmutableMap.copyOf(fields);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  /** Fields in declaration order. */
  public ImmutableMap<String, FieldType> fields() {
    return fields;
  }

  /** The JSON Schema of one record, as shown to the model. */
  public ObjectNode jsonShape() {
    JsonNodeFactory json = JsonNodeFactory.instance;
    ObjectNode shape = json.objectNode();
    shape.put("title", name);
    shape.put("type", "object");
    ObjectNode properties = shape.putObject("properties");
    ArrayNode required = shape.putArray("required");
    for (Map.Entry<String, FieldType> field : fields.entrySet()) {
      properties.set(field.getKey(), shapeOf(field.getValue()));
      if (!field.getValue().optional()) required.add(field.getKey());
    }
    return shape;
  }

  private static ObjectNode shapeOf(FieldType type) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    switch (type.base()) {
      case "string":
        node.put("type", "string");
        break;
      case "int":
        node.put("type", "integer");
        break;
      case "float":
        node.put("type", "number");
        break;
      case "bool":
        node.put("type", "boolean");
        break;
      case "list":
        node.put("type", "array");
        node.set("items", shapeOf(type.element().get()));
        break;
      default:
        node.put("type", "object");
        break;
    }
    if (type.optional()) {
      JsonNode single = node.remove("type");
      node.putArray("type").add(single).add("null");
    }
    return node;
  }

  public static final class Builder {
    private final String name;
    private final Map<String, FieldType> fields = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder field(String name, String type) {
      fields.put(name, FieldType.parse(type));
      return this;
    }

    public SchemaSpec build() {
      return new SchemaSpec(name, fields);
    }
  }
}
