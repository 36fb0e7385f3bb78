package wfl.runtime;

/** The model backend failed to produce a response. */
public class ModelInvocationException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  public ModelInvocationException(String message) {
    super(message);
  }

  public ModelInvocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
