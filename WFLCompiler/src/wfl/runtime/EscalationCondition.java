package wfl.runtime;

import java.util.Locale;

import com.google.common.base.CharMatcher;

/** A prompt's {@code escalate if OP "value"} test, applied to an agent's stringified result. */
public final class EscalationCondition {
  // ASCII punctuation, including the '*' and '_' of markdown emphasis.
  private static final CharMatcher PUNCTUATION =
      CharMatcher.inRange('!', '/')
          .or(CharMatcher.inRange(':', '@'))
          .or(CharMatcher.inRange('[', '`'))
          .or(CharMatcher.inRange('{', '~'));

  private final String op;
  private final String value;

  public EscalationCondition(String op, String value) {
    this.op = op;
    this.value = value;
  }

  public String op() {
    return op;
  }

  public String value() {
    return value;
  }

  public boolean matches(String result) {
    switch (op) {
      case "==":
        return result.equals(value);
      case "!=":
        return !result.equals(value);
      case "contains":
        return result.contains(value);
      case "~":
        return normalizedEquals(result, value);
      default:
        throw new IllegalStateException("unknown escalation operator: " + op);
    }
  }

  /**
   * Equality that ignores markdown emphasis, punctuation, case and runs of whitespace, so that
   * {@code "**Drifted.**"} equals {@code "drifted"}.
   */
  public static boolean normalizedEquals(String a, String b) {
    return normalize(a).equals(normalize(b));
  }

  static String normalize(String s) {
    String stripped = PUNCTUATION.removeFrom(s);
    return CharMatcher.whitespace().trimAndCollapseFrom(stripped, ' ').toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return op + " \"" + value + "\"";
  }
}
