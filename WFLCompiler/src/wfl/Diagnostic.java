package wfl;

import java.util.Comparator;
import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A compiler error or warning at a 1-based source position. */
@AutoValue
public abstract class Diagnostic {
  public enum Severity {
    ERROR,
    WARNING;

    public String label() {
      return name().toLowerCase();
    }
  }

  public static final Comparator<Diagnostic> ORDER =
      Comparator.<Diagnostic, String>comparing(Diagnostic::file)
          .thenComparing(Diagnostic::line)
          .thenComparing(Diagnostic::column)
          .thenComparing(Diagnostic::code);

  public abstract Severity severity();

  public abstract ErrorCode code();

  public abstract String file();

  public abstract int line();

  public abstract int column();

  public abstract String message();

  public abstract Optional<String> help();

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  public static Diagnostic at(ErrorCode code, Tokenizer.Pos pos, String message) {
    return create(code, pos, message, Optional.empty());
  }

  public static Diagnostic at(ErrorCode code, Tokenizer.Pos pos, String message, String help) {
    return create(code, pos, message, Optional.of(help));
  }

  public static Diagnostic create(
      ErrorCode code, Tokenizer.Pos pos, String message, Optional<String> help) {
    return new AutoValue_Diagnostic(
        code.severity(),
        code,
        pos.file(),
        Math.max(pos.lineNumber(), 0) + 1,
        Math.max(pos.column(), 0) + 1,
        message,
        help);
  }

  @Override
  public final String toString() {
    return String.format(
        "%s:%d:%d: %s[%s]: %s", file(), line(), column(), severity().label(), code(), message());
  }
}
