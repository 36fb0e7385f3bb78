package wfl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

/**
 * Builds the graph of {@code delegate} and {@code use} edges between agents and reports each
 * distinct cycle with its full path. Agents mixing both composition styles get a warning.
 */
class AgentCycleDetector extends ErrorCollectingValidator {

  private final MutableGraph<String> edges =
      GraphBuilder.directed().allowsSelfLoops(true).build();
  private final Map<String, AST.AgentDef> agents = new HashMap<>();

  @Override
  public void visitImpl(AST.AgentDef agent) {
    // Duplicates are reported by the symbol pass; only the first definition counts here.
    if (agents.putIfAbsent(agent.name(), agent) != null) return;

    edges.addNode(agent.name());
    for (AST.Ref sub : agent.delegate()) {
      edges.putEdge(agent.name(), sub.name());
    }
    for (AST.Ref tool : agent.use()) {
      if (!tool.name().equals(agent.name())) {
        edges.putEdge(agent.name(), tool.name());
      }
    }

    if (!agent.delegate().isEmpty() && !agent.use().isEmpty()) {
      logWarning(
          ErrorCode.W0002,
          agent.pos(),
          String.format("agent '%s' has both 'delegate' and 'use'", agent.name()),
          "'delegate' hands the conversation to a sub-agent; 'use' calls an agent as a tool."
              + " Mixing both on one agent is usually unintended");
    }
  }

  public void validate() {
    for (List<String> cycle : findCycles(edges)) {
      AST.AgentDef first = agents.get(cycle.get(0));
      logError(
          ErrorCode.E0011,
          first.pos(),
          "circular agent reference: " + Joiner.on(" -> ").join(cycle));
    }
  }
}
