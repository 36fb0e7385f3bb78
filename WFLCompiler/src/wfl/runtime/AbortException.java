package wfl.runtime;

/** Raised by {@code abort} and by {@code on escalate abort}. */
public class AbortException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  public AbortException(String reason) {
    super(reason);
  }
}
