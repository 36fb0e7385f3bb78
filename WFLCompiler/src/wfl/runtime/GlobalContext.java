package wfl.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * State shared by every context of one run: global variables, the event sink and the agents built
 * so far. Created when a run starts and discarded when it completes.
 */
final class GlobalContext {
  private final DslWorkflow workflow;
  private final EventSink sink;
  private final AgentHierarchy agents;
  private final Map<String, Object> variables = Collections.synchronizedMap(new HashMap<>());
  private volatile boolean cancelled = false;

  GlobalContext(DslWorkflow workflow, EventSink sink, String input) {
    this.workflow = workflow;
    this.sink = sink;
    this.agents = new AgentHierarchy(workflow::agentSpec);

    List<Object> conversation = Collections.synchronizedList(new ArrayList<>());
    variables.put("input_prompt", input);
    variables.put("conversation", conversation);
    variables.put("current_agent", null);
    variables.put("session_id", UUID.randomUUID().toString());
    variables.put("turn_count", 1L);
  }

  DslWorkflow workflow() {
    return workflow;
  }

  RuntimeConfig config() {
    return workflow.config();
  }

  EventSink sink() {
    return sink;
  }

  AgentHierarchy agents() {
    return agents;
  }

  boolean has(String name) {
    return variables.containsKey(name);
  }

  Object get(String name) {
    return variables.get(name);
  }

  void set(String name, Object value) {
    variables.put(name, value);
  }

  @SuppressWarnings("unchecked")
  void record(String role, String content) {
    Object conversation = variables.get("conversation");
    if (!(conversation instanceof List)) return;
    Map<String, Object> entry = Ops.map("role", role, "content", content);
    ((List<Object>) conversation).add(entry);
  }

  Optional<String> prompt(String name, WorkflowContext ctx) {
    return workflow.promptSpec(name).map(p -> p.body().render(ctx));
  }

  boolean cancelled() {
    return cancelled;
  }

  void cancel() {
    cancelled = true;
  }
}
