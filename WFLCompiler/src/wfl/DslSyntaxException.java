package wfl;

import com.google.common.collect.ImmutableList;

/** The unit could not be tokenized or parsed, or an import of it could not. */
public class DslSyntaxException extends DslCompileException {
  private static final long serialVersionUID = 1L;

  public DslSyntaxException(String file, CompilerException cause) {
    super(file, ImmutableList.of(cause.toDiagnostic()));
    initCause(cause);
  }
}
