package wfl.runtime;

import java.util.Optional;

/** One {@code [$x =] run agent NAME args} of a {@code parallel do} block. */
public final class ParallelTask {
  private final String agent;
  private final Optional<String> target;
  private final Object[] args;

  private ParallelTask(String agent, Optional<String> target, Object[] args) {
    this.agent = agent;
    this.target = target;
    this.args = args;
  }

  public static ParallelTask agent(String agent, Object... args) {
    return new ParallelTask(agent, Optional.empty(), args.clone());
  }

  /** The same task, assigning its result to {@code variable} once the whole block completes. */
  public ParallelTask into(String variable) {
    return new ParallelTask(agent, Optional.of(variable), args);
  }

  public String agent() {
    return agent;
  }

  public Optional<String> target() {
    return target;
  }

  Object[] args() {
    return args.clone();
  }

  @Override
  public String toString() {
    return target.map(t -> "$" + t + " = ").orElse("") + "run agent " + agent;
  }
}
