package wfl.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

/** Checks parsed responses against a {@link SchemaSpec}, field by field. Unknown fields pass. */
public final class SchemaValidator {

  /** Every mismatch of {@code value} against one record of {@code schema}; empty when it fits. */
  public static ImmutableList<String> validate(JsonNode value, SchemaSpec schema) {
    List<String> errors = new ArrayList<>();
    validateRecord(value, schema, "", errors);
    return ImmutableList.copyOf(errors);
  }

  /** As {@link #validate}, for a JSON array whose every element is a record. */
  public static ImmutableList<String> validateArray(JsonNode value, SchemaSpec schema) {
    List<String> errors = new ArrayList<>();
    if (!value.isArray()) {
      errors.add("expected a JSON array, got " + describe(value));
    } else {
      for (int i = 0; i < value.size(); i++) {
        validateRecord(value.get(i), schema, "[" + i + "].", errors);
      }
    }
    return ImmutableList.copyOf(errors);
  }

  private static void validateRecord(
      JsonNode value, SchemaSpec schema, String prefix, List<String> errors) {
    if (!value.isObject()) {
      errors.add(String.format("%sexpected an object, got %s", prefix, describe(value)));
      return;
    }
    for (Map.Entry<String, FieldType> field : schema.fields().entrySet()) {
      String path = prefix + field.getKey();
      JsonNode fieldValue = value.get(field.getKey());
      if (fieldValue == null || fieldValue.isNull()) {
        if (!field.getValue().optional()) {
          errors.add(String.format("%s: field required", path));
        }
        continue;
      }
      checkType(fieldValue, field.getValue(), path, errors);
    }
  }

  private static void checkType(JsonNode value, FieldType type, String path, List<String> errors) {
    boolean ok;
    switch (type.base()) {
      case "string":
        ok = value.isTextual();
        break;
      case "int":
        ok = value.isIntegralNumber();
        break;
      case "float":
        ok = value.isNumber();
        break;
      case "bool":
        ok = value.isBoolean();
        break;
      case "object":
        ok = value.isObject();
        break;
      case "list":
        ok = value.isArray();
        if (ok) {
          FieldType element = type.element().get();
          for (int i = 0; i < value.size(); i++) {
            JsonNode item = value.get(i);
            if (item.isNull() && element.optional()) continue;
            checkType(item, element, path + "[" + i + "]", errors);
          }
        }
        break;
      default:
        throw new IllegalStateException("unknown field type: " + type);
    }
    if (!ok) {
      errors.add(String.format("%s: expected %s, got %s", path, type, describe(value)));
    }
  }

  private static String describe(JsonNode value) {
    return value.getNodeType().name().toLowerCase();
  }

  private SchemaValidator() {}
}
