package wfl.runtime;

/** A name with no definition: an agent, prompt, flow or variable. */
public class UndefinedReferenceException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  public UndefinedReferenceException(String kind, String name) {
    super(String.format("undefined %s '%s'", kind, name));
  }
}
