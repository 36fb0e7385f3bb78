package wfl.runtime;

import java.util.Optional;

import com.google.common.collect.ImmutableSet;

/** A schema field type such as {@code string}, {@code list[T]} or {@code int?}. */
public final class FieldType {
  private static final ImmutableSet<String> PRIMITIVES =
      ImmutableSet.of("string", "int", "float", "bool", "object");

  private final String base;
  private final Optional<FieldType> element;
  private final boolean optional;

  private FieldType(String base, Optional<FieldType> element, boolean optional) {
    this.base = base;
    this.element = element;
    this.optional = optional;
  }

  /** Parses the canonical spelling, e.g. {@code list[string]?}. */
  public static FieldType parse(String spelling) {
    boolean optional = spelling.endsWith("?");
    String s = optional ? spelling.substring(0, spelling.length() - 1) : spelling;
    if (s.startsWith("list[") && s.endsWith("]")) {
      return new FieldType(
          "list", Optional.of(parse(s.substring("list[".length(), s.length() - 1))), optional);
    }
    if (!PRIMITIVES.contains(s)) {
      throw new IllegalArgumentException("unknown field type: " + spelling);
    }
    return new FieldType(s, Optional.empty(), optional);
  }

  public String base() {
    return base;
  }

  public Optional<FieldType> element() {
    return element;
  }

  public boolean optional() {
    return optional;
  }

  @Override
  public String toString() {
    String s = element.isPresent() ? "list[" + element.get() + "]" : base;
    return optional ? s + "?" : s;
  }
}
