package wfl.runtime;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.Optional;

import com.google.auto.value.AutoValue;

/** Tunables of the workflow runtime. */
@AutoValue
public abstract class RuntimeConfig {
  /** Attempts for a model call whose response must match a schema. */
  public abstract int schemaAttempts();

  /** Delay before the first agent retry; backoff policies scale it. */
  public abstract Duration retryBaseDelay();

  /** Timeout of agents without a timeout of their own. */
  public abstract Optional<Duration> defaultAgentTimeout();

  public abstract int parallelWorkers();

  /** Events buffered between a running flow and its consumer. */
  public abstract int eventCapacity();

  public static RuntimeConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_RuntimeConfig.Builder()
        .setSchemaAttempts(3)
        .setRetryBaseDelay(Duration.ofSeconds(1))
        .setParallelWorkers(4)
        .setEventCapacity(256);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSchemaAttempts(int schemaAttempts);

    public abstract Builder setRetryBaseDelay(Duration retryBaseDelay);

    public abstract Builder setDefaultAgentTimeout(Duration defaultAgentTimeout);

    public abstract Builder setParallelWorkers(int parallelWorkers);

    public abstract Builder setEventCapacity(int eventCapacity);

    abstract RuntimeConfig autoBuild();

    public RuntimeConfig build() {
      RuntimeConfig config = autoBuild();
      checkArgument(config.schemaAttempts() > 0, "schemaAttempts must be positive");
      checkArgument(config.parallelWorkers() > 0, "parallelWorkers must be positive");
      checkArgument(config.eventCapacity() > 0, "eventCapacity must be positive");
      return config;
    }
  }
}
