package wfl.runtime;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A single completion request. An empty model id selects the backend's default model. */
@AutoValue
public abstract class ModelRequest {
  public abstract String modelId();

  public abstract ImmutableList<Message> messages();

  /** The agent on whose behalf the call is made; absent for {@code call llm}. */
  public abstract Optional<AgentInstance> agent();

  public static ModelRequest create(String modelId, List<Message> messages) {
    return new AutoValue_ModelRequest(modelId, ImmutableList.copyOf(messages), Optional.empty());
  }

  public static ModelRequest forAgent(String modelId, List<Message> messages, AgentInstance agent) {
    return new AutoValue_ModelRequest(modelId, ImmutableList.copyOf(messages), Optional.of(agent));
  }
}
