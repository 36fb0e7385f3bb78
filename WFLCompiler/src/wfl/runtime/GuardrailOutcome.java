package wfl.runtime;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** What the {@code on}/{@code after} handlers of an event did to a message. */
@AutoValue
public abstract class GuardrailOutcome {
  /** The message after masking. */
  public abstract String message();

  public abstract boolean blocked();

  /** Guardrail that blocked the message, or {@code condition} for {@code block if <expr>}. */
  public abstract Optional<String> blockedBy();

  /** Message to send back to the model, from {@code retry with}. */
  public abstract Optional<String> retryMessage();

  public abstract ImmutableList<String> warnings();

  static GuardrailOutcome passed(String message, Optional<String> retry, List<String> warnings) {
    return new AutoValue_GuardrailOutcome(
        message, false, Optional.empty(), retry, ImmutableList.copyOf(warnings));
  }

  static GuardrailOutcome blocked(String message, String blockedBy, List<String> warnings) {
    return new AutoValue_GuardrailOutcome(
        message, true, Optional.of(blockedBy), Optional.empty(), ImmutableList.copyOf(warnings));
  }
}
