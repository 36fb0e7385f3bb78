package wfl.runtime;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * A live agent: its definition plus the instances it owns. Sub-agents come from {@code delegate}
 * (the model may hand the conversation over to them), tool agents from {@code use} (invoked like a
 * tool and always returning to this agent).
 */
public final class AgentInstance {
  private final AgentSpec spec;
  private final ImmutableList<AgentInstance> subAgents;
  private final ImmutableList<AgentInstance> toolAgents;
  private boolean closed = false;

  AgentInstance(
      AgentSpec spec,
      ImmutableList<AgentInstance> subAgents,
      ImmutableList<AgentInstance> toolAgents) {
    this.spec = spec;
    this.subAgents = subAgents;
    this.toolAgents = toolAgents;
  }

  public String name() {
    return spec.name();
  }

  public AgentSpec spec() {
    return spec;
  }

  public ImmutableList<AgentInstance> subAgents() {
    return subAgents;
  }

  public ImmutableList<AgentInstance> toolAgents() {
    return toolAgents;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  // Sub-agents first, then tool agents, then this one.
  synchronized void close(ImmutableList.Builder<String> closedOut) {
    Verify.verify(!closed, "agent '%s' closed twice", name());
    for (AgentInstance sub : subAgents) {
      sub.close(closedOut);
    }
    for (AgentInstance tool : toolAgents) {
      tool.close(closedOut);
    }
    closed = true;
    closedOut.add(name());
  }

  @Override
  public String toString() {
    return name();
  }
}
