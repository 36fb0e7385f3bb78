package wfl.runtime;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * An {@code agent} definition. Sub-agents ({@code delegate}) and tool-wrapped agents ({@code use})
 * are kept as names and only resolved when the agent is built, so agents may refer to each other
 * in any order.
 */
@AutoValue
public abstract class AgentSpec {
  public abstract String name();

  /** Prompt holding the agent's instruction. */
  public abstract Optional<String> instruction();

  public abstract ImmutableList<String> tools();

  public abstract Optional<String> retry();

  public abstract Optional<String> timeoutPolicy();

  /** Inline {@code timeout N unit}, in seconds. */
  public abstract Optional<Long> timeoutSeconds();

  public abstract Optional<String> description();

  public abstract ImmutableList<String> delegate();

  public abstract ImmutableList<String> use();

  public static Builder builder(String name) {
    return new AutoValue_AgentSpec.Builder().setName(name);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    public abstract Builder setInstruction(String instruction);

    public abstract Builder setRetry(String retry);

    public abstract Builder setTimeoutPolicy(String timeoutPolicy);

    public abstract Builder setTimeoutSeconds(Long timeoutSeconds);

    public abstract Builder setDescription(String description);

    abstract ImmutableList.Builder<String> toolsBuilder();

    abstract ImmutableList.Builder<String> delegateBuilder();

    abstract ImmutableList.Builder<String> useBuilder();

    public Builder addTool(String tool) {
      toolsBuilder().add(tool);
      return this;
    }

    public Builder addDelegate(String agent) {
      delegateBuilder().add(agent);
      return this;
    }

    public Builder addUse(String agent) {
      useBuilder().add(agent);
      return this;
    }

    public abstract AgentSpec build();
  }
}
