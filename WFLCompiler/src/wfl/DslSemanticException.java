package wfl;

import java.util.List;

/** The unit parsed but failed semantic analysis. */
public class DslSemanticException extends DslCompileException {
  private static final long serialVersionUID = 1L;

  public DslSemanticException(String file, List<Diagnostic> diagnostics) {
    super(file, diagnostics);
  }
}
