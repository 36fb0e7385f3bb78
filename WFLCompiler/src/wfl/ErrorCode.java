package wfl;

/** Stable diagnostic codes. Codes starting with {@code W} are warnings. */
public enum ErrorCode {
  E0001("undefined reference"),
  E0002("variable used before definition"),
  E0003("duplicate definition"),
  E0004("type mismatch"),
  E0005("import file not found"),
  E0006("circular import"),
  E0007("invalid token"),
  E0008("mismatched indentation"),
  E0009("invalid guardrail action"),
  E0010("missing required property"),
  E0011("circular agent reference"),
  E0012("invalid guardrail pattern"),
  E0013("'continue' outside of a loop"),
  E0014("statement not allowed in 'parallel do'"),
  W0002("agent has both delegate and use");

  private final String title;

  ErrorCode(String title) {
    this.title = title;
  }

  public String title() {
    return title;
  }

  public Diagnostic.Severity severity() {
    return name().startsWith("W") ? Diagnostic.Severity.WARNING : Diagnostic.Severity.ERROR;
  }
}
