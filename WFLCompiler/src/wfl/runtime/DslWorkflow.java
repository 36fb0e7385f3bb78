package wfl.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;

/**
 * Base class of compiled workflows. The generated constructor registers the workflow's
 * definitions; flows and handlers are generated methods registered as {@link FlowBody}s.
 *
 * <p>A workflow instance may serve several runs. Each run gets its own global variables and agent
 * instances; the guardrail entry points ({@link #processInput} and friends) share one session.
 */
public abstract class DslWorkflow implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(DslWorkflow.class);

  /** Events with {@code on}/{@code after} handlers. */
  public enum Event {
    START(null),
    INPUT("input"),
    OUTPUT("output"),
    TOOL_CALL(null),
    TOOL_RESULT("tool_result");

    private final String variable;

    Event(String variable) {
      this.variable = variable;
    }

    /** Handler variable holding the message, next to {@code $message}. */
    Optional<String> variable() {
      return Optional.ofNullable(variable);
    }

    String handlerKey(String timing) {
      return timing + "_" + name().toLowerCase();
    }
  }

  private static final class FlowDefinition {
    private final ImmutableList<String> params;
    private final FlowBody body;

    FlowDefinition(ImmutableList<String> params, FlowBody body) {
      this.params = params;
      this.body = body;
    }
  }

  private final Map<String, ModelSpec> models = new LinkedHashMap<>();
  private final Map<String, SchemaSpec> schemas = new LinkedHashMap<>();
  private final Map<String, ToolSpec> tools = new LinkedHashMap<>();
  private final Map<String, PromptSpec> prompts = new LinkedHashMap<>();
  private final Map<String, AgentSpec> agents = new LinkedHashMap<>();
  private final Map<String, RetryPolicy> retryPolicies = new LinkedHashMap<>();
  private final Map<String, Duration> timeoutPolicies = new LinkedHashMap<>();
  private final Map<String, FlowDefinition> flows = new LinkedHashMap<>();
  private final ListMultimap<String, FlowBody> handlers = ArrayListMultimap.create();
  private final GuardrailProvider guardrails = new GuardrailProvider();

  private ModelClient modelClient =
      (request, sink) -> {
        throw new ModelInvocationException("no model client configured");
      };
  private RuntimeConfig config = RuntimeConfig.defaults();
  private StackTraceTranslator stackTraceTranslator = StackTraceTranslator.NONE;

  private ListeningExecutorService executor;
  private ExecutorService timeoutThreads;
  private TimeLimiter timeLimiter;
  private GlobalContext session;

  // Configuration

  public DslWorkflow setModelClient(ModelClient modelClient) {
    this.modelClient = modelClient;
    return this;
  }

  public DslWorkflow setConfig(RuntimeConfig config) {
    this.config = config;
    return this;
  }

  public DslWorkflow setStackTraceTranslator(StackTraceTranslator stackTraceTranslator) {
    this.stackTraceTranslator = stackTraceTranslator;
    return this;
  }

  public RuntimeConfig config() {
    return config;
  }

  ModelClient modelClient() {
    return modelClient;
  }

  GuardrailProvider guardrails() {
    return guardrails;
  }

  // Registration, called by generated constructors

  protected void model(String name, String modelId) {
    models.put(name, ModelSpec.create(name, modelId));
  }

  protected void model(String name, String modelId, Map<String, Object> properties) {
    models.put(name, ModelSpec.create(name, modelId, properties));
  }

  protected void schema(SchemaSpec schema) {
    schemas.put(schema.name(), schema);
  }

  protected void tool(ToolSpec tool) {
    tools.put(tool.name(), tool);
  }

  protected void guardrail(String name, String pattern) {
    guardrails.register(name, pattern);
  }

  protected void retryPolicy(String name, int times, RetryPolicy.Backoff backoff) {
    retryPolicies.put(name, new RetryPolicy(times, backoff));
  }

  protected void timeoutPolicy(String name, long seconds) {
    timeoutPolicies.put(name, Duration.ofSeconds(seconds));
  }

  protected void prompt(PromptSpec prompt) {
    prompts.put(prompt.name(), prompt);
  }

  protected void agent(AgentSpec agent) {
    agents.put(agent.name(), agent);
  }

  protected void flow(String name, List<String> params, FlowBody body) {
    flows.put(name, new FlowDefinition(ImmutableList.copyOf(params), body));
  }

  /** @param key timing and event, e.g. {@code on_tool_call} */
  protected void handler(String key, FlowBody body) {
    handlers.put(key, body);
  }

  // Lookup

  public Optional<ModelSpec> modelSpec(String name) {
    return Optional.ofNullable(models.get(name));
  }

  public Optional<SchemaSpec> schemaSpec(String name) {
    return Optional.ofNullable(schemas.get(name));
  }

  public Optional<ToolSpec> toolSpec(String name) {
    return Optional.ofNullable(tools.get(name));
  }

  public Optional<PromptSpec> promptSpec(String name) {
    return Optional.ofNullable(prompts.get(name));
  }

  public Optional<AgentSpec> agentSpec(String name) {
    return Optional.ofNullable(agents.get(name));
  }

  public Optional<RetryPolicy> retryPolicy(String name) {
    return Optional.ofNullable(retryPolicies.get(name));
  }

  public Optional<Duration> timeoutPolicy(String name) {
    return Optional.ofNullable(timeoutPolicies.get(name));
  }

  public ImmutableSet<String> flowNames() {
    return ImmutableSet.copyOf(flows.keySet());
  }

  public ImmutableMap<String, AgentSpec> agents() {
    return ImmutableMap.copyOf(agents);
  }

  public ImmutableList<String> flowParams(String flow) throws UndefinedReferenceException {
    FlowDefinition definition = flows.get(flow);
    if (definition == null) throw new UndefinedReferenceException("flow", flow);
    return definition.params;
  }

  // Runs

  /**
   * Starts a run of {@code flow} on its own thread. The flow's first parameter, if any, receives
   * {@code input}, which is also the global {@code $input_prompt}.
   */
  public EventStream run(String flow, String input) {
    ThreadFactory threads =
        new ThreadFactoryBuilder().setNameFormat("wfl-run-" + flow + "-%d").setDaemon(true).build();
    EventStream stream =
        new EventStream(config.eventCapacity(), threads, sink -> execute(flow, input, sink));
    stream.start();
    return stream;
  }

  /** Runs {@code flow} on the calling thread, reporting events to {@code sink}. */
  public Object runBlocking(String flow, String input, EventSink sink) throws WorkflowException {
    return execute(flow, input, sink);
  }

  private Object execute(String flow, String input, EventSink sink) throws WorkflowException {
    GlobalContext global = new GlobalContext(this, sink, input);
    try {
      if (!flows.containsKey(flow)) throw new UndefinedReferenceException("flow", flow);
      runStartHandlers(global);
      Object[] args = flows.get(flow).params.isEmpty() ? new Object[0] : new Object[] {input};
      return invokeFlow(global, flow, args);
    } catch (WorkflowException | RuntimeException ex) {
      stackTraceTranslator.translate(ex);
      logger.warn("flow {} failed: {}", flow, ex.getMessage());
      throw ex;
    } finally {
      global.cancel();
      global.agents().close();
    }
  }

  Object invokeFlow(GlobalContext global, String name, Object[] args) throws WorkflowException {
    FlowDefinition flow = flows.get(name);
    if (flow == null) throw new UndefinedReferenceException("flow", name);

    WorkflowContext ctx = new WorkflowContext(global, false);
    for (int i = 0; i < flow.params.size(); i++) {
      ctx.set(flow.params.get(i), i < args.length ? args[i] : null);
    }
    logger.info("running flow {}", name);
    global.sink().emit(new WorkflowEvent.FlowStartedEvent(name));
    Object result = flow.body.run(ctx);
    global.sink().emit(new WorkflowEvent.FlowCompletedEvent(name, result));
    return result;
  }

  private void runStartHandlers(GlobalContext global) throws WorkflowException {
    for (String timing : ImmutableList.of("on", "after")) {
      for (FlowBody body : handlers.get(Event.START.handlerKey(timing))) {
        body.run(new WorkflowContext(global, true));
      }
    }
  }

  /**
   * Runs the {@code on} then {@code after} handlers of {@code event} over a message. A blocked
   * message is reported in the outcome, not thrown.
   */
  GuardrailOutcome runHandlers(GlobalContext global, Event event, String message)
      throws WorkflowException {
    return runHandlers(global, event, message, ImmutableMap.of());
  }

  private GuardrailOutcome runHandlers(
      GlobalContext global, Event event, String message, Map<String, Object> extra)
      throws WorkflowException {
    Iterable<FlowBody> bodies =
        Iterables.concat(
            handlers.get(event.handlerKey("on")), handlers.get(event.handlerKey("after")));
    if (Iterables.isEmpty(bodies)) {
      return GuardrailOutcome.passed(message, Optional.empty(), ImmutableList.of());
    }

    WorkflowContext ctx = new WorkflowContext(global, false);
    ctx.set("message", message);
    event.variable().ifPresent(v -> ctx.set(v, message));
    extra.forEach(ctx::set);
    try {
      for (FlowBody body : bodies) {
        body.run(ctx);
      }
    } catch (GuardrailBlockedException ex) {
      return GuardrailOutcome.blocked(ctx.resolve("message"), ex.guardrail(), ctx.warnings());
    }
    return GuardrailOutcome.passed(ctx.resolve("message"), ctx.retryMessage(), ctx.warnings());
  }

  // Guardrail entry points for messages exchanged outside of a flow

  public GuardrailOutcome processInput(String message) throws WorkflowException {
    return runHandlers(session(), Event.INPUT, message);
  }

  public GuardrailOutcome processOutput(String message) throws WorkflowException {
    return runHandlers(session(), Event.OUTPUT, message);
  }

  public GuardrailOutcome processToolCall(String tool, String message) throws WorkflowException {
    return runHandlers(session(), Event.TOOL_CALL, message, ImmutableMap.of("tool", tool));
  }

  public GuardrailOutcome processToolResult(String tool, String message) throws WorkflowException {
    return runHandlers(session(), Event.TOOL_RESULT, message, ImmutableMap.of("tool", tool));
  }

  private synchronized GlobalContext session() throws WorkflowException {
    if (session == null) {
      GlobalContext created = new GlobalContext(this, EventSink.DISCARD, "");
      runStartHandlers(created);
      session = created;
    }
    return session;
  }

  // Threads

  synchronized ListeningExecutorService executor() {
    if (executor == null) {
      executor =
          MoreExecutors.listeningDecorator(
              Executors.newFixedThreadPool(
                  config.parallelWorkers(),
                  new ThreadFactoryBuilder()
                      .setNameFormat("wfl-parallel-%d")
                      .setDaemon(true)
                      .build()));
    }
    return executor;
  }

  synchronized TimeLimiter timeLimiter() {
    if (timeLimiter == null) {
      timeoutThreads =
          Executors.newCachedThreadPool(
              new ThreadFactoryBuilder().setNameFormat("wfl-timeout-%d").setDaemon(true).build());
      timeLimiter = SimpleTimeLimiter.create(timeoutThreads);
    }
    return timeLimiter;
  }

  /** Tears down the guardrail session's agents and the workflow's threads. */
  @Override
  public synchronized void close() {
    if (session != null) {
      session.agents().close();
      session = null;
    }
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
    if (timeoutThreads != null) {
      timeoutThreads.shutdownNow();
      timeoutThreads = null;
      timeLimiter = null;
    }
  }
}
