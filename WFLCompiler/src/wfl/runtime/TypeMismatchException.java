package wfl.runtime;

/** An operation applied to a value of the wrong kind, e.g. a property set on a string. */
public class TypeMismatchException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  public TypeMismatchException(String message) {
    super(message);
  }
}
