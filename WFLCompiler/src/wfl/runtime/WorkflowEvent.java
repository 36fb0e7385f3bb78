package wfl.runtime;

import java.util.Optional;

/** Progress reported by a running workflow, in the order it happened. */
public abstract class WorkflowEvent {
  public enum Type {
    FLOW_STARTED,
    FLOW_COMPLETED,
    AGENT_STARTED,
    AGENT_COMPLETED,
    LLM_CALL,
    LLM_RESPONSE,
    ESCALATION,
    MODEL_OUTPUT,
    NOTIFICATION;
  }

  private final Type type;

  protected WorkflowEvent(Type type) {
    this.type = type;
  }

  public Type type() {
    return type;
  }

  @SuppressWarnings("unchecked")
  public <T extends WorkflowEvent> T cast() {
    return (T) this;
  }

  public static final class FlowStartedEvent extends WorkflowEvent {
    private final String flow;

    public FlowStartedEvent(String flow) {
      super(Type.FLOW_STARTED);
      this.flow = flow;
    }

    public String flow() {
      return flow;
    }

    @Override
    public String toString() {
      return "flow started: " + flow;
    }
  }

  public static final class FlowCompletedEvent extends WorkflowEvent {
    private final String flow;
    private final Object result;

    public FlowCompletedEvent(String flow, Object result) {
      super(Type.FLOW_COMPLETED);
      this.flow = flow;
      this.result = result;
    }

    public String flow() {
      return flow;
    }

    public Object result() {
      return result;
    }

    @Override
    public String toString() {
      return "flow completed: " + flow;
    }
  }

  public static final class AgentStartedEvent extends WorkflowEvent {
    private final String agent;
    private final String input;

    public AgentStartedEvent(String agent, String input) {
      super(Type.AGENT_STARTED);
      this.agent = agent;
      this.input = input;
    }

    public String agent() {
      return agent;
    }

    public String input() {
      return input;
    }

    @Override
    public String toString() {
      return "agent started: " + agent;
    }
  }

  public static final class AgentCompletedEvent extends WorkflowEvent {
    private final String agent;
    private final String result;

    public AgentCompletedEvent(String agent, String result) {
      super(Type.AGENT_COMPLETED);
      this.agent = agent;
      this.result = result;
    }

    public String agent() {
      return agent;
    }

    public String result() {
      return result;
    }

    @Override
    public String toString() {
      return "agent completed: " + agent;
    }
  }

  public static final class LlmCallEvent extends WorkflowEvent {
    private final String prompt;
    private final String model;
    private final String promptText;

    public LlmCallEvent(String prompt, String model, String promptText) {
      super(Type.LLM_CALL);
      this.prompt = prompt;
      this.model = model;
      this.promptText = promptText;
    }

    public String prompt() {
      return prompt;
    }

    /** Resolved model id; empty for the backend's default. */
    public String model() {
      return model;
    }

    public String promptText() {
      return promptText;
    }

    @Override
    public String toString() {
      return "llm call: " + prompt;
    }
  }

  public static final class LlmResponseEvent extends WorkflowEvent {
    private final String prompt;
    private final String content;

    public LlmResponseEvent(String prompt, String content) {
      super(Type.LLM_RESPONSE);
      this.prompt = prompt;
      this.content = content;
    }

    public String prompt() {
      return prompt;
    }

    public String content() {
      return content;
    }

    @Override
    public String toString() {
      return "llm response: " + prompt;
    }
  }

  public static final class EscalationEvent extends WorkflowEvent {
    private final String agent;
    private final String result;
    private final EscalationCondition condition;

    public EscalationEvent(String agent, String result, EscalationCondition condition) {
      super(Type.ESCALATION);
      this.agent = agent;
      this.result = result;
      this.condition = condition;
    }

    public String agent() {
      return agent;
    }

    public String result() {
      return result;
    }

    public EscalationCondition condition() {
      return condition;
    }

    @Override
    public String toString() {
      return "escalation: " + agent + " (" + condition + ")";
    }
  }

  /** Partial output streamed by the model backend. */
  public static final class ModelOutputEvent extends WorkflowEvent {
    private final Optional<String> agent;
    private final String text;

    public ModelOutputEvent(Optional<String> agent, String text) {
      super(Type.MODEL_OUTPUT);
      this.agent = agent;
      this.text = text;
    }

    public Optional<String> agent() {
      return agent;
    }

    public String text() {
      return text;
    }

    @Override
    public String toString() {
      return "model output: " + text;
    }
  }

  public static final class NotificationEvent extends WorkflowEvent {
    public enum Kind {
      NOTIFY,
      ESCALATE_TO_HUMAN;
    }

    private final Kind kind;
    private final String message;

    public NotificationEvent(Kind kind, String message) {
      super(Type.NOTIFICATION);
      this.kind = kind;
      this.message = message;
    }

    public Kind kind() {
      return kind;
    }

    public String message() {
      return message;
    }

    @Override
    public String toString() {
      return kind.name().toLowerCase() + ": " + message;
    }
  }
}
