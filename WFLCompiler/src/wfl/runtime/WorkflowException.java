package wfl.runtime;

/** A failure while running a workflow. */
public class WorkflowException extends Exception {
  private static final long serialVersionUID = 1L;

  public WorkflowException(String message) {
    super(message);
  }

  public WorkflowException(String message, Throwable cause) {
    super(message, cause);
  }
}
