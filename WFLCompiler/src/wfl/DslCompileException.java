package wfl;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** A workflow unit failed to compile; carries every diagnostic found. */
public class DslCompileException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String file;
  private final ImmutableList<Diagnostic> diagnostics;

  public DslCompileException(String file, List<Diagnostic> diagnostics) {
    super(message(file, diagnostics));
    this.file = file;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  public String file() {
    return file;
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public ImmutableList<Diagnostic> errors() {
    return diagnostics.stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  private static String message(String file, List<Diagnostic> diagnostics) {
    Diagnostic first =
        diagnostics.stream().filter(Diagnostic::isError).findFirst().orElse(diagnostics.get(0));
    if (diagnostics.size() == 1) return first.toString();
    return String.format("%s (and %d more in %s)", first, diagnostics.size() - 1, file);
  }
}
