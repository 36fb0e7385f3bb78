package wfl.runtime;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A {@code prompt} definition. The body is rendered against the calling context on each use. */
@AutoValue
public abstract class PromptSpec {
  public abstract String name();

  public abstract PromptBody body();

  /** Model name or id from {@code using model}. */
  public abstract Optional<String> model();

  /** Schema the response must match, from {@code expecting}. */
  public abstract Optional<String> schema();

  /** Whether the response is a JSON array of schema objects ({@code expecting Name[]}). */
  public abstract boolean expectsArray();

  /** Variable holding the conversation history to prepend. */
  public abstract Optional<String> inherit();

  public abstract Optional<EscalationCondition> escalation();

  public static Builder builder(String name) {
    return new AutoValue_PromptSpec.Builder().setName(name).setExpectsArray(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(String name);

    public abstract Builder setBody(PromptBody body);

    public abstract Builder setModel(String model);

    public abstract Builder setSchema(String schema);

    public abstract Builder setExpectsArray(boolean expectsArray);

    public abstract Builder setInherit(String inherit);

    public abstract Builder setEscalation(EscalationCondition escalation);

    public abstract PromptSpec build();
  }
}
