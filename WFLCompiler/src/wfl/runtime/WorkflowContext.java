package wfl.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * The variable store and operations available to one flow or handler invocation. Generated
 * workflow code calls these methods; local variables live here, globals in the run's shared
 * {@link GlobalContext}.
 *
 * <p>A context is confined to the thread running its flow. Contexts for the tasks of a {@code
 * parallel do} block are separate and only share the global state.
 */
public final class WorkflowContext {
  private static final Logger logger = LoggerFactory.getLogger(WorkflowContext.class);

  private static final Pattern TEMPLATE_VARIABLE =
      Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)((?:\\.[A-Za-z_][A-Za-z0-9_]*)*)");

  private static final String SCHEMA_RETRY_HINT =
      "Please fix the JSON and try again. Ensure you return only valid JSON matching the schema.";

  private final GlobalContext global;
  private final Map<String, Object> locals = new HashMap<>();
  private final boolean writesGlobals;

  private boolean lastEscalated = false;
  private final List<String> warnings = new ArrayList<>();
  private Optional<String> retryMessage = Optional.empty();

  WorkflowContext(GlobalContext global, boolean writesGlobals) {
    this.global = global;
    this.writesGlobals = writesGlobals;
  }

  private DslWorkflow workflow() {
    return global.workflow();
  }

  // Variables

  /** The value of a variable; locals shadow globals. */
  public Object get(String name) throws UndefinedReferenceException {
    if (!has(name)) throw new UndefinedReferenceException("variable", name);
    return lookup(name);
  }

  private Object lookup(String name) {
    return locals.containsKey(name) ? locals.get(name) : global.get(name);
  }

  public boolean has(String name) {
    return locals.containsKey(name) || global.has(name);
  }

  /** Assigns a local variable, or a global one inside a start handler. */
  public void set(String name, Object value) {
    if (writesGlobals) {
      global.set(name, value);
    } else {
      locals.put(name, value);
    }
  }

  /**
   * {@code $var.a.b = value}: every key before the last must already exist and hold a mapping; the
   * last key is replaced or added.
   */
  @SuppressWarnings("unchecked")
  public void setProperty(String variable, Object value, String... path) throws WorkflowException {
    Object current = get(variable);
    String walked = "$" + variable;
    for (int i = 0; i < path.length; i++) {
      if (!(current instanceof Map)) {
        throw new TypeMismatchException(
            String.format(
                "cannot set '%s' on %s: it is %s, not an object",
                path[i],
                walked,
                Ops.typeName(current)));
      }
      Map<String, Object> map = (Map<String, Object>) current;
      if (i == path.length - 1) {
        map.put(path[i], value);
        return;
      }
      if (!map.containsKey(path[i])) throw new MissingKeyException(walked, path[i]);
      current = map.get(path[i]);
      walked = walked + "." + path[i];
    }
  }

  /** {@code push value to $list}. */
  @SuppressWarnings("unchecked")
  public void push(String list, Object value) throws WorkflowException {
    Object current = get(list);
    if (!(current instanceof List)) {
      throw new TypeMismatchException(
          String.format("cannot push to $%s: it is %s, not a list", list, Ops.typeName(current)));
    }
    ((List<Object>) current).add(value);
  }

  /**
   * Text of {@code $name} inside a string: a variable, else the rendered body of the prompt of that
   * name, else empty.
   */
  public String resolve(String name) {
    if (has(name)) return Ops.stringify(lookup(name));
    return global.prompt(name, this).orElse("");
  }

  /** Text of {@code $name.a.b} inside a string; empty when any step is missing. */
  public String resolveProperty(String name, String... path) {
    if (!has(name)) return "";
    return Ops.stringify(Ops.property(lookup(name), path));
  }

  /** Substitutes {@code $name} and {@code $name.prop} references in text built at run time. */
  public String interpolate(String template) {
    Matcher matcher = TEMPLATE_VARIABLE.matcher(template);
    StringBuffer out = new StringBuffer();
    while (matcher.find()) {
      String name = matcher.group(1);
      String replacement;
      if (matcher.group(2).isEmpty()) {
        replacement = resolve(name);
      } else {
        List<String> path = Splitter.on('.').omitEmptyStrings().splitToList(matcher.group(2));
        replacement = resolveProperty(name, path.toArray(new String[0]));
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  public String stringify(Object value) {
    return Ops.stringify(value);
  }

  // Agents

  /** {@code run agent NAME args}: the agent's reply to the space-joined arguments. */
  public Object runAgent(String agent, Object... args) throws WorkflowException {
    return invokeAgent(agent, Ops.join(args));
  }

  /**
   * Like {@link #runAgent}, additionally testing the escalation condition of the agent's
   * instruction prompt against the reply; see {@link #lastEscalated()}.
   */
  public Object runAgentWithEscalation(String agent, Object... args) throws WorkflowException {
    lastEscalated = false;
    String result = invokeAgent(agent, Ops.join(args));
    Optional<EscalationCondition> condition =
        workflow()
            .agentSpec(agent)
            .flatMap(AgentSpec::instruction)
            .flatMap(workflow()::promptSpec)
            .flatMap(PromptSpec::escalation);
    if (condition.isPresent() && condition.get().matches(result)) {
      logger.info("agent {} escalated ({})", agent, condition.get());
      lastEscalated = true;
      emit(new WorkflowEvent.EscalationEvent(agent, result, condition.get()));
    }
    return result;
  }

  public boolean lastEscalated() {
    return lastEscalated;
  }

  private String invokeAgent(String name, String input) throws WorkflowException {
    AgentInstance agent = global.agents().instance(name);

    GuardrailOutcome in = workflow().runHandlers(global, DslWorkflow.Event.INPUT, input);
    if (in.blocked()) throw new GuardrailBlockedException(in.blockedBy().get());

    logger.info("running agent {}", name);
    emit(new WorkflowEvent.AgentStartedEvent(name, in.message()));
    global.set("current_agent", name);

    List<Message> messages = new ArrayList<>();
    agent
        .spec()
        .instruction()
        .flatMap(p -> global.prompt(p, this))
        .ifPresent(text -> messages.add(Message.system(text)));
    messages.add(Message.user(in.message()));
    String reply = completeWithRetry(agent, messages);

    GuardrailOutcome out = workflow().runHandlers(global, DslWorkflow.Event.OUTPUT, reply);
    if (out.retryMessage().isPresent() && !out.blocked()) {
      logger.info("agent {} output rejected, retrying: {}", name, out.retryMessage().get());
      messages.add(Message.assistant(reply));
      messages.add(Message.user(out.retryMessage().get()));
      reply = completeWithRetry(agent, messages);
      out = workflow().runHandlers(global, DslWorkflow.Event.OUTPUT, reply);
    }
    if (out.blocked()) throw new GuardrailBlockedException(out.blockedBy().get());

    String result = out.message();
    global.record(Message.USER, in.message());
    global.record(Message.ASSISTANT, result);
    emit(new WorkflowEvent.AgentCompletedEvent(name, result));
    return result;
  }

  private String completeWithRetry(AgentInstance agent, List<Message> messages)
      throws WorkflowException {
    AgentSpec spec = agent.spec();
    Optional<RetryPolicy> policy = spec.retry().flatMap(workflow()::retryPolicy);
    int attempts = policy.isPresent() ? Math.max(policy.get().times(), 1) : 1;
    Optional<Duration> timeout = timeout(spec);
    ModelRequest request =
        ModelRequest.forAgent(
            modelId(spec.instruction().flatMap(workflow()::promptSpec).flatMap(PromptSpec::model)),
            messages,
            agent);

    for (int attempt = 1; ; attempt++) {
      try {
        return complete(request, timeout, spec.name());
      } catch (ModelInvocationException | AgentTimeoutException ex) {
        if (attempt >= attempts) throw ex;
        Duration delay = policy.get().delay(attempt, global.config().retryBaseDelay());
        logger.warn(
            "agent {} failed (attempt {} of {}), retrying in {} ms: {}",
            spec.name(),
            attempt,
            attempts,
            delay.toMillis(),
            ex.getMessage());
        sleep(delay);
      }
    }
  }

  private Optional<Duration> timeout(AgentSpec spec) {
    if (spec.timeoutSeconds().isPresent()) {
      return Optional.of(Duration.ofSeconds(spec.timeoutSeconds().get()));
    }
    Optional<Duration> policy = spec.timeoutPolicy().flatMap(workflow()::timeoutPolicy);
    return policy.isPresent() ? policy : global.config().defaultAgentTimeout();
  }

  private String complete(ModelRequest request, Optional<Duration> timeout, String agent)
      throws WorkflowException {
    if (!timeout.isPresent()) return workflow().modelClient().complete(request, global.sink());

    try {
      return workflow().timeLimiter().callWithTimeout(
          () -> workflow().modelClient().complete(request, global.sink()),
          timeout.get().toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      throw new AgentTimeoutException(agent, timeout.get().getSeconds(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AbortException("interrupted while waiting for agent '" + agent + "'");
    } catch (ExecutionException | UncheckedExecutionException ex) {
      if (ex.getCause() instanceof WorkflowException) throw (WorkflowException) ex.getCause();
      throw new ModelInvocationException("agent '" + agent + "' failed", ex.getCause());
    }
  }

  private static void sleep(Duration delay) throws AbortException {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AbortException("interrupted during retry backoff");
    }
  }

  // Model calls

  /** Model id for a model name: a defined model's id, else the name itself. */
  private String modelId(Optional<String> model) {
    String name = model.orElse(workflow().modelSpec("main").isPresent() ? "main" : "");
    return workflow().modelSpec(name).map(ModelSpec::modelId).orElse(name);
  }

  /**
   * {@code call llm PROMPT args [using model "m"]}. With an expected schema the response is parsed
   * and validated, and an invalid response is sent back with the errors until it validates or the
   * configured attempts are used up.
   *
   * @param model the {@code using model} override, or null
   */
  public Object callLlm(String prompt, String model, Object... args) throws WorkflowException {
    PromptSpec spec =
        workflow()
            .promptSpec(prompt)
            .orElseThrow(() -> new UndefinedReferenceException("prompt", prompt));
    String text = spec.body().render(this);
    if (args.length > 0) text = text + "\n\n" + Ops.join(args);

    Optional<SchemaSpec> schema = spec.schema().flatMap(workflow()::schemaSpec);
    if (schema.isPresent()) text = text + schemaInstruction(schema.get(), spec.expectsArray());

    List<Message> messages = new ArrayList<>();
    if (spec.inherit().isPresent()) messages.addAll(inherited(spec.inherit().get()));
    messages.add(Message.user(text));

    String modelId = modelId(model != null ? Optional.of(model) : spec.model());
    logger.info("calling prompt {} on model {}", prompt, modelId.isEmpty() ? "(default)" : modelId);
    emit(new WorkflowEvent.LlmCallEvent(prompt, modelId, text));

    if (!schema.isPresent()) {
      String content =
          workflow().modelClient().complete(ModelRequest.create(modelId, messages), global.sink());
      emit(new WorkflowEvent.LlmResponseEvent(prompt, content));
      return content;
    }
    return callWithSchema(prompt, modelId, messages, schema.get(), spec.expectsArray());
  }

  private Object callWithSchema(
      String prompt, String modelId, List<Message> messages, SchemaSpec schema, boolean array)
      throws WorkflowException {
    int attempts = global.config().schemaAttempts();
    ImmutableList<String> errors = ImmutableList.of();
    String content = "";
    for (int attempt = 1; attempt <= attempts; attempt++) {
      content =
          workflow().modelClient().complete(ModelRequest.create(modelId, messages), global.sink());
      emit(new WorkflowEvent.LlmResponseEvent(prompt, content));

      String error;
      try {
        JsonNode parsed = JsonResponses.parse(content);
        errors =
            array
                ? SchemaValidator.validateArray(parsed, schema)
                : SchemaValidator.validate(parsed, schema);
        if (errors.isEmpty()) return JsonResponses.toJava(parsed);
        error = Joiner.on("; ").join(errors);
      } catch (JsonParseException ex) {
        errors = ImmutableList.of(ex.getMessage());
        error = ex.getMessage();
      }

      logger.warn(
          "response to prompt {} failed validation (attempt {} of {}): {}",
          prompt,
          attempt,
          attempts,
          error);
      messages.add(Message.assistant(content));
      messages.add(Message.user("Error: " + error + "\n\n" + SCHEMA_RETRY_HINT));
    }
    throw new SchemaValidationException(schema.name(), errors, content);
  }

  private static String schemaInstruction(SchemaSpec schema, boolean array) {
    String shape = JsonResponses.toPrettyJson(schema.jsonShape());
    if (array) {
      return "\n\nIMPORTANT: You MUST respond with a JSON array of objects, where each element"
          + " matches this schema:\n```json\n"
          + shape
          + "\n```\n\nDo NOT include any text outside the JSON array.";
    }
    return "\n\nIMPORTANT: You MUST respond with valid JSON that matches this schema:\n```json\n"
        + shape
        + "\n```\n\nDo NOT include any text outside the JSON object.";
  }

  // A history variable holds role/content maps; anything else is one user message.
  private List<Message> inherited(String variable) throws WorkflowException {
    Object history = get(variable);
    if (!(history instanceof List)) return ImmutableList.of(Message.user(Ops.stringify(history)));
    List<Message> messages = new ArrayList<>();
    synchronized (history) {
      for (Object item : (List<?>) history) {
        Object role = Ops.property(item, "role");
        Object content = Ops.property(item, "content");
        if (role == null || content == null) {
          messages.add(Message.user(Ops.stringify(item)));
        } else {
          messages.add(Message.create(role.toString(), Ops.stringify(content)));
        }
      }
    }
    return messages;
  }

  // Flows

  /** {@code run FLOW args}: runs another flow in a fresh local scope of the same run. */
  public Object runFlow(String flow, Object... args) throws WorkflowException {
    return workflow().invokeFlow(global, flow, args);
  }

  /**
   * Runs the tasks of a {@code parallel do} block concurrently and waits for all of them; the first
   * failure fails the block and no result is assigned. Results are assigned to their variables in
   * declaration order, and also returned in that order.
   */
  public Object[] runParallel(ParallelTask... tasks) throws WorkflowException {
    List<ListenableFuture<Object>> futures = new ArrayList<>();
    for (ParallelTask task : tasks) {
      WorkflowContext taskContext = new WorkflowContext(global, false);
      futures.add(
          workflow().executor().submit(() -> taskContext.runAgent(task.agent(), task.args())));
    }

    List<Object> results;
    try {
      results = Futures.allAsList(futures).get();
    } catch (InterruptedException ex) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new AbortException("interrupted while waiting for parallel agents");
    } catch (ExecutionException ex) {
      futures.forEach(f -> f.cancel(true));
      if (ex.getCause() instanceof WorkflowException) throw (WorkflowException) ex.getCause();
      throw new WorkflowException("parallel agent failed", ex.getCause());
    }

    for (int i = 0; i < tasks.length; i++) {
      if (tasks[i].target().isPresent()) set(tasks[i].target().get(), results.get(i));
    }
    return results.toArray();
  }

  /** False once the run has been cancelled; unbounded loops test it on every iteration. */
  public boolean isActive() {
    return !global.cancelled() && !Thread.currentThread().isInterrupted();
  }

  /** Entry of an {@code on failure} block: exposes the failure as {@code $error}. */
  public void onFailure(Exception failure) {
    logger.warn("flow failed, running its failure handler: {}", failure.getMessage());
    set("error", failure.getMessage() == null ? failure.toString() : failure.getMessage());
  }

  // Guardrails

  public String mask(String guardrail, Object text) {
    return workflow().guardrails().mask(guardrail, Ops.stringify(text));
  }

  public boolean check(String guardrail, Object text) {
    return workflow().guardrails().check(guardrail, Ops.stringify(text));
  }

  /**
   * Blocks the message being processed.
   *
   * @param guardrail the guardrail that fired, or null for a {@code block if} condition
   */
  public void block(String guardrail) throws GuardrailBlockedException {
    String by = guardrail == null ? "condition" : guardrail;
    logger.warn("message blocked by {}", by);
    throw new GuardrailBlockedException(by);
  }

  public void warn(Object message) {
    String text = Ops.stringify(message);
    logger.warn("workflow warning: {}", text);
    warnings.add(text);
  }

  /** {@code retry with}: asks for the model's output to be regenerated with this message. */
  public void retryWith(Object message) {
    retryMessage = Optional.of(Ops.stringify(message));
  }

  ImmutableList<String> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  Optional<String> retryMessage() {
    return retryMessage;
  }

  // Notifications

  public void log(Object message) {
    logger.info("{}", Ops.stringify(message));
  }

  public void sendNotification(Object message) throws WorkflowException {
    String text = Ops.stringify(message);
    logger.info("notify: {}", text);
    emit(
        new WorkflowEvent.NotificationEvent(WorkflowEvent.NotificationEvent.Kind.NOTIFY, text));
  }

  /** @param message the message for the human, or null */
  public void escalateToHuman(Object message) throws WorkflowException {
    String text = message == null ? "Escalating to human" : Ops.stringify(message);
    logger.warn("escalating to human: {}", text);
    emit(
        new WorkflowEvent.NotificationEvent(
            WorkflowEvent.NotificationEvent.Kind.ESCALATE_TO_HUMAN, text));
  }

  public void emit(WorkflowEvent event) throws WorkflowException {
    global.sink().emit(event);
  }

  Map<String, Object> locals() {
    return Collections.unmodifiableMap(locals);
  }
}
