package wfl.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;

/**
 * Operators of the workflow language over plain values: strings, {@code Long}/{@code Double}
 * numbers, booleans, lists, maps and null. Generated flow code calls these.
 */
public final class Ops {

  public static boolean truthy(Object value) {
    if (value == null) return false;
    if (value instanceof Boolean) return (Boolean) value;
    if (value instanceof Number) return ((Number) value).doubleValue() != 0;
    if (value instanceof String) return !((String) value).isEmpty();
    if (value instanceof Collection) return !((Collection<?>) value).isEmpty();
    if (value instanceof Map) return !((Map<?, ?>) value).isEmpty();
    return true;
  }

  /** Numbers compare by value regardless of their boxed type. */
  public static boolean equal(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return compareNumbers((Number) a, (Number) b) == 0;
    }
    return Objects.equals(a, b);
  }

  public static boolean normalizedEquals(Object a, Object b) {
    return EscalationCondition.normalizedEquals(stringify(a), stringify(b));
  }

  /** {@code haystack contains needle}: substring, list membership or map key. */
  public static boolean contains(Object haystack, Object needle) {
    if (haystack == null) return false;
    if (haystack instanceof String) return ((String) haystack).contains(stringify(needle));
    if (haystack instanceof Collection) {
      for (Object item : (Collection<?>) haystack) {
        if (equal(item, needle)) return true;
      }
      return false;
    }
    if (haystack instanceof Map) return ((Map<?, ?>) haystack).containsKey(needle);
    return false;
  }

  /** Ordering comparison; {@code op} is one of {@code < > <= >=}. */
  public static boolean compare(String op, Object a, Object b) throws TypeMismatchException {
    int c;
    if (a instanceof Number && b instanceof Number) {
      c = compareNumbers((Number) a, (Number) b);
    } else if (a instanceof String && b instanceof String) {
      c = ((String) a).compareTo((String) b);
    } else {
      throw new TypeMismatchException(
          String.format("cannot compare %s %s %s", typeName(a), op, typeName(b)));
    }
    switch (op) {
      case "<":
        return c < 0;
      case ">":
        return c > 0;
      case "<=":
        return c <= 0;
      case ">=":
        return c >= 0;
      default:
        throw new IllegalArgumentException("not an ordering operator: " + op);
    }
  }

  /** Any comparison operator of the language, as used by {@code filter}. */
  public static boolean test(String op, Object a, Object b) throws TypeMismatchException {
    switch (op) {
      case "==":
        return equal(a, b);
      case "!=":
        return !equal(a, b);
      case "contains":
        return contains(a, b);
      case "~":
        return normalizedEquals(a, b);
      default:
        return compare(op, a, b);
    }
  }

  public static Object add(Object a, Object b) throws TypeMismatchException {
    if (a instanceof Number && b instanceof Number) {
      if (isIntegral(a) && isIntegral(b)) {
        return ((Number) a).longValue() + ((Number) b).longValue();
      }
      return ((Number) a).doubleValue() + ((Number) b).doubleValue();
    }
    if (a instanceof String || b instanceof String) return stringify(a) + stringify(b);
    if (a instanceof List && b instanceof List) {
      List<Object> joined = new ArrayList<>((List<?>) a);
      joined.addAll((List<?>) b);
      return joined;
    }
    throw mismatch("+", a, b);
  }

  public static Object subtract(Object a, Object b) throws TypeMismatchException {
    checkNumbers("-", a, b);
    if (isIntegral(a) && isIntegral(b)) return ((Number) a).longValue() - ((Number) b).longValue();
    return ((Number) a).doubleValue() - ((Number) b).doubleValue();
  }

  public static Object multiply(Object a, Object b) throws TypeMismatchException {
    checkNumbers("*", a, b);
    if (isIntegral(a) && isIntegral(b)) return ((Number) a).longValue() * ((Number) b).longValue();
    return ((Number) a).doubleValue() * ((Number) b).doubleValue();
  }

  /** True division: the result is always a {@code Double}. */
  public static Object divide(Object a, Object b) throws TypeMismatchException {
    checkNumbers("/", a, b);
    if (((Number) b).doubleValue() == 0) throw new TypeMismatchException("division by zero");
    return ((Number) a).doubleValue() / ((Number) b).doubleValue();
  }

  public static Object negate(Object a) throws TypeMismatchException {
    if (isIntegral(a)) return -((Number) a).longValue();
    if (a instanceof Number) return -((Number) a).doubleValue();
    throw new TypeMismatchException("cannot negate " + typeName(a));
  }

  /**
   * Reads {@code base.path...}. A string holding a JSON object or array is parsed first; a missing
   * key or a step into a non-map yields null.
   */
  public static Object property(Object base, String... path) {
    Object value = base;
    for (String key : path) {
      value = coerceJson(value);
      if (!(value instanceof Map)) return null;
      value = ((Map<?, ?>) value).get(key);
    }
    return value;
  }

  /** A mutable list, so that {@code push} can extend literals. */
  public static List<Object> list(Object... items) {
    List<Object> list = new ArrayList<>(items.length);
    for (Object item : items) {
      list.add(item);
    }
    return list;
  }

  /** A mutable insertion-ordered map from alternating keys and values. */
  public static Map<String, Object> map(Object... keysAndValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      map.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return map;
  }

  /**
   * {@code filter list where .path op value}: the items whose property satisfies the comparison,
   * in their original order.
   */
  public static List<Object> filter(Object list, String op, Object value, String... path)
      throws TypeMismatchException {
    List<Object> kept = new ArrayList<>();
    for (Object item : iterable(list)) {
      Object property = property(item, path);
      if (property == null && !op.equals("==") && !op.equals("!=")) continue;
      if (test(op, property, value)) kept.add(item);
    }
    return kept;
  }

  @SuppressWarnings("unchecked")
  public static Iterable<Object> iterable(Object value) throws TypeMismatchException {
    Object coerced = coerceJson(value);
    if (coerced instanceof Iterable) return (Iterable<Object>) coerced;
    if (coerced instanceof Map) return new ArrayList<>(((Map<String, Object>) coerced).values());
    throw new TypeMismatchException("cannot iterate over " + typeName(value));
  }

  /** Text form used for interpolation: JSON for lists and maps, empty for null. */
  public static String stringify(Object value) {
    if (value == null) return "";
    if (value instanceof Map || value instanceof List) return JsonResponses.toJson(value);
    return value.toString();
  }

  /** Arguments joined with spaces, as sent to an agent. */
  public static String join(Object... args) {
    List<String> parts = new ArrayList<>();
    for (Object arg : args) {
      parts.add(stringify(arg));
    }
    return Joiner.on(' ').join(parts);
  }

  static String typeName(Object value) {
    if (value == null) return "null";
    if (value instanceof String) return "string";
    if (value instanceof Boolean) return "bool";
    if (isIntegral(value)) return "int";
    if (value instanceof Number) return "float";
    if (value instanceof List) return "list";
    if (value instanceof Map) return "object";
    return value.getClass().getSimpleName();
  }

  private static Object coerceJson(Object value) {
    if (!(value instanceof String)) return value;
    String s = CharMatcher.whitespace().trimFrom((String) value);
    if (!s.startsWith("{") && !s.startsWith("[")) return value;
    try {
      JsonNode node = JsonResponses.parse(s);
      return JsonResponses.toJava(node);
    } catch (JsonParseException ex) {
      // Text that merely starts with a bracket.
      return value;
    }
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
  }

  private static int compareNumbers(Number a, Number b) {
    if (isIntegral(a) && isIntegral(b)) return Long.compare(a.longValue(), b.longValue());
    return Double.compare(a.doubleValue(), b.doubleValue());
  }

  private static void checkNumbers(String op, Object a, Object b) throws TypeMismatchException {
    if (!(a instanceof Number) || !(b instanceof Number)) throw mismatch(op, a, b);
  }

  private static TypeMismatchException mismatch(String op, Object a, Object b) {
    return new TypeMismatchException(
        String.format("unsupported operand types for %s: %s and %s", op, typeName(a), typeName(b)));
  }

  private Ops() {}
}
