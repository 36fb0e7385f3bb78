package wfl.runtime;

/** An agent invocation that outlived its timeout. */
public class AgentTimeoutException extends WorkflowException {
  private static final long serialVersionUID = 1L;

  public AgentTimeoutException(String agent, long seconds, Throwable cause) {
    super(String.format("agent '%s' timed out after %d seconds", agent, seconds), cause);
  }
}
