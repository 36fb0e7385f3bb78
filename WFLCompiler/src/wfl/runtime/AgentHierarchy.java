package wfl.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Builds agent instances with their {@code delegate} and {@code use} children, reusing each root
 * for the rest of the run, and tears everything down depth-first.
 *
 * <p>Children are resolved by name at build time. A child that is undefined, or that is already
 * one of its own ancestors, is logged and skipped rather than failing the whole build.
 */
public final class AgentHierarchy {
  private static final Logger logger = LoggerFactory.getLogger(AgentHierarchy.class);

  private final Function<String, Optional<AgentSpec>> specs;
  private final Map<String, AgentInstance> roots = new LinkedHashMap<>();
  private boolean closed = false;

  public AgentHierarchy(Function<String, Optional<AgentSpec>> specs) {
    this.specs = specs;
  }

  /** The live instance of a top-level agent, built on first use. */
  public synchronized AgentInstance instance(String name) throws UndefinedReferenceException {
    if (closed) throw new IllegalStateException("agent hierarchy is closed");
    AgentInstance instance = roots.get(name);
    if (instance != null) return instance;

    Optional<AgentSpec> spec = specs.apply(name);
    if (!spec.isPresent()) throw new UndefinedReferenceException("agent", name);
    instance = build(spec.get(), new ArrayDeque<>());
    roots.put(name, instance);
    return instance;
  }

  private AgentInstance build(AgentSpec spec, Deque<String> ancestors) {
    ancestors.push(spec.name());
    ImmutableList<AgentInstance> subAgents =
        children(spec, spec.delegate(), "sub-agent", ancestors);
    ImmutableList<AgentInstance> toolAgents = children(spec, spec.use(), "agent tool", ancestors);
    ancestors.pop();
    logger.debug(
        "built agent {} ({} sub-agents, {} agent tools)",
        spec.name(),
        subAgents.size(),
        toolAgents.size());
    return new AgentInstance(spec, subAgents, toolAgents);
  }

  private ImmutableList<AgentInstance> children(
      AgentSpec parent, ImmutableList<String> names, String role, Deque<String> ancestors) {
    ImmutableList.Builder<AgentInstance> children = ImmutableList.builder();
    for (String name : names) {
      if (ancestors.contains(name)) {
        logger.warn(
            "skipping {} '{}' of agent '{}': circular reference", role, name, parent.name());
        continue;
      }
      Optional<AgentSpec> child = specs.apply(name);
      if (!child.isPresent()) {
        logger.warn("skipping {} '{}' of agent '{}': not defined", role, name, parent.name());
        continue;
      }
      children.add(build(child.get(), ancestors));
    }
    return children.build();
  }

  /** Closes every built agent, children before parents; returns the names in closing order. */
  public synchronized ImmutableList<String> close() {
    ImmutableList.Builder<String> closedNames = ImmutableList.builder();
    if (closed) return closedNames.build();
    closed = true;
    for (AgentInstance root : roots.values()) {
      root.close(closedNames);
    }
    ImmutableList<String> order = closedNames.build();
    logger.debug("closed agents {}", order);
    return order;
  }
}
