package wfl;

/** A positioned failure of the tokenizer, indenter, parser or transformer. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;
  private final ErrorCode code;

  public CompilerException(Tokenizer.Pos pos, String errorMsg) {
    this(pos, ErrorCode.E0007, errorMsg);
  }

  public CompilerException(Tokenizer.Pos pos, ErrorCode code, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.code = code;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public ErrorCode code() {
    return code;
  }

  public Diagnostic toDiagnostic() {
    return Diagnostic.at(code, pos, getMessage());
  }
}
