package wfl.runtime;

/** A {@code block} action fired in a guardrail handler. */
public class GuardrailBlockedException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  private final String guardrail;

  public GuardrailBlockedException(String guardrail) {
    super("message blocked by guardrail '" + guardrail + "'");
    this.guardrail = guardrail;
  }

  public String guardrail() {
    return guardrail;
  }
}
