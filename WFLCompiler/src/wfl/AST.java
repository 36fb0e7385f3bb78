package wfl;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import wfl.processor.ASTChild;
import wfl.processor.ASTNode;

/** A parsed workflow source unit: its top-level definitions, in source order. */
@ASTNode
public final class AST implements AST_ASTNode {

  /** A name used at some position, e.g. an agent in a {@code delegate} list. */
  public static final class Ref {
    private final String name;
    private final Tokenizer.Pos pos;

    public Ref(String name, Tokenizer.Pos pos) {
      this.name = name;
      this.pos = pos;
    }

    public String name() {
      return name;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public abstract static class Declaration implements ASTNodeInterface {
    public enum Type {
      VERSION,
      IMPORT,
      MODEL,
      SCHEMA,
      TOOL,
      GUARDRAIL,
      RETRY_POLICY,
      TIMEOUT_POLICY,
      PROMPT,
      AGENT,
      FLOW,
      HANDLER;
    }

    private final Type type;
    private final Tokenizer.Pos pos;

    protected Declaration(Type type, Tokenizer.Pos pos) {
      this.type = type;
      this.pos = pos;
    }

    public Type type() {
      return type;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }

    @SuppressWarnings("unchecked")
    public <T extends Declaration> T cast() {
      return (T) this;
    }
  }

  /** A top-level definition that introduces a name into the symbol table. */
  public abstract static class NamedDeclaration extends Declaration {
    private final String name;

    protected NamedDeclaration(Type type, String name, Tokenizer.Pos pos) {
      super(type, pos);
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  @ASTNode
  public static final class VersionDecl extends Declaration implements AST_VersionDecl_ASTNode {
    private final String version;

    public VersionDecl(String version, Tokenizer.Pos pos) {
      super(Type.VERSION, pos);
      this.version = version;
    }

    public String version() {
      return version;
    }
  }

  @ASTNode
  public static final class ImportDef extends Declaration implements AST_ImportDef_ASTNode {
    private final String path;

    public ImportDef(String path, Tokenizer.Pos pos) {
      super(Type.IMPORT, pos);
      this.path = path;
    }

    public String path() {
      return path;
    }
  }

  @ASTNode
  public static final class ModelDef extends NamedDeclaration implements AST_ModelDef_ASTNode {
    private final Optional<String> shorthand;
    private final ImmutableMap<String, Object> properties;

    public ModelDef(
        String name,
        Optional<String> shorthand,
        Map<String, Object> properties,
        Tokenizer.Pos pos) {
      super(Type.MODEL, name, pos);
      this.shorthand = shorthand;
      this.properties = ImmutableMap.copyOf(properties);
    }

    /** The model id of {@code model x = provider/name}, if written that way. */
    public Optional<String> shorthand() {
      return shorthand;
    }

    // Values are String, Long, Double, or nested maps of the same.
    public ImmutableMap<String, Object> properties() {
      return properties;
    }

    /** The identifier handed to the model backend. */
    public String modelId() {
      if (shorthand.isPresent()) return shorthand.get();
      Object name = properties.get("name");
      Object provider = properties.get("provider");
      if (name == null) return name();
      if (provider != null && !name.toString().contains("/")) return provider + "/" + name;
      return name.toString();
    }
  }

  /** A schema field type: a base name or a list of an element type, optionally nullable. */
  public static final class FieldType {
    public static final ImmutableList<String> PRIMITIVES =
        ImmutableList.of("string", "int", "float", "bool", "object");

    private final String base;
    private final Optional<FieldType> element;
    private final boolean optional;

    public FieldType(String base, Optional<FieldType> element, boolean optional) {
      this.base = base;
      this.element = element;
      this.optional = optional;
    }

    public String base() {
      return base;
    }

    public boolean isList() {
      return element.isPresent();
    }

    public Optional<FieldType> element() {
      return element;
    }

    public boolean optional() {
      return optional;
    }

    @Override
    public String toString() {
      String s = element.isPresent() ? "list[" + element.get() + "]" : base;
      return optional ? s + "?" : s;
    }
  }

  @ASTNode
  public static final class Field implements AST_Field_ASTNode {
    private final String name;
    private final FieldType fieldType;
    private final Tokenizer.Pos pos;
    private final Tokenizer.Pos typePos;

    public Field(String name, FieldType fieldType, Tokenizer.Pos pos, Tokenizer.Pos typePos) {
      this.name = name;
      this.fieldType = fieldType;
      this.pos = pos;
      this.typePos = typePos;
    }

    public String name() {
      return name;
    }

    public FieldType fieldType() {
      return fieldType;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }

    public Tokenizer.Pos typePos() {
      return typePos;
    }
  }

  @ASTNode
  public static final class SchemaDef extends NamedDeclaration implements AST_SchemaDef_ASTNode {
    private final ImmutableList<Field> fields;

    public SchemaDef(String name, List<Field> fields, Tokenizer.Pos pos) {
      super(Type.SCHEMA, name, pos);
      this.fields = ImmutableList.copyOf(fields);
    }

    @ASTChild
    @Override
    public ImmutableList<Field> fields() {
      return fields;
    }
  }

  @ASTNode
  public static final class ToolDef extends NamedDeclaration implements AST_ToolDef_ASTNode {
    public enum Kind {
      MCP,
      BUILTIN,
      CONFIGURED;
    }

    private final Kind kind;
    private final Optional<String> location;
    private final Optional<String> authScheme;
    private final Optional<String> authValue;
    private final ImmutableMap<String, Object> properties;

    public ToolDef(
        String name,
        Kind kind,
        Optional<String> location,
        Optional<String> authScheme,
        Optional<String> authValue,
        Map<String, Object> properties,
        Tokenizer.Pos pos) {
      super(Type.TOOL, name, pos);
      this.kind = kind;
      this.location = location;
      this.authScheme = authScheme;
      this.authValue = authValue;
      this.properties = ImmutableMap.copyOf(properties);
    }

    public Kind kind() {
      return kind;
    }

    /** The MCP url, or the builtin's dotted name. */
    public Optional<String> location() {
      return location;
    }

    public Optional<String> authScheme() {
      return authScheme;
    }

    public Optional<String> authValue() {
      return authValue;
    }

    public ImmutableMap<String, Object> properties() {
      return properties;
    }
  }

  @ASTNode
  public static final class GuardrailDef extends NamedDeclaration
      implements AST_GuardrailDef_ASTNode {
    private final String pattern;
    private final Tokenizer.Pos patternPos;

    public GuardrailDef(String name, String pattern, Tokenizer.Pos pos, Tokenizer.Pos patternPos) {
      super(Type.GUARDRAIL, name, pos);
      this.pattern = pattern;
      this.patternPos = patternPos;
    }

    public String pattern() {
      return pattern;
    }

    public Tokenizer.Pos patternPos() {
      return patternPos;
    }
  }

  @ASTNode
  public static final class RetryPolicyDef extends NamedDeclaration
      implements AST_RetryPolicyDef_ASTNode {
    public enum Backoff {
      FIXED,
      LINEAR,
      EXPONENTIAL;
    }

    private final int times;
    private final Backoff backoff;

    public RetryPolicyDef(String name, int times, Backoff backoff, Tokenizer.Pos pos) {
      super(Type.RETRY_POLICY, name, pos);
      this.times = times;
      this.backoff = backoff;
    }

    public int times() {
      return times;
    }

    public Backoff backoff() {
      return backoff;
    }
  }

  @ASTNode
  public static final class TimeoutPolicyDef extends NamedDeclaration
      implements AST_TimeoutPolicyDef_ASTNode {
    private final long seconds;

    public TimeoutPolicyDef(String name, long seconds, Tokenizer.Pos pos) {
      super(Type.TIMEOUT_POLICY, name, pos);
      this.seconds = seconds;
    }

    public long seconds() {
      return seconds;
    }
  }

  /** {@code escalate if OP "literal"} on a prompt. */
  public static final class EscalationCondition {
    private final String op;
    private final String value;

    public EscalationCondition(String op, String value) {
      this.op = op;
      this.value = value;
    }

    public String op() {
      return op;
    }

    public String value() {
      return value;
    }
  }

  @ASTNode
  public static final class PromptDef extends NamedDeclaration implements AST_PromptDef_ASTNode {
    private final Expression.StringLiteral body;
    private final Optional<Ref> model;
    private final Optional<Ref> schema;
    private final boolean expectsArray;
    private final Optional<String> inherit;
    private final Optional<EscalationCondition> escalation;

    public PromptDef(
        String name,
        Expression.StringLiteral body,
        Optional<Ref> model,
        Optional<Ref> schema,
        boolean expectsArray,
        Optional<String> inherit,
        Optional<EscalationCondition> escalation,
        Tokenizer.Pos pos) {
      super(Type.PROMPT, name, pos);
      this.body = body;
      this.model = model;
      this.schema = schema;
      this.expectsArray = expectsArray;
      this.inherit = inherit;
      this.escalation = escalation;
    }

    @ASTChild
    @Override
    public Expression.StringLiteral body() {
      return body;
    }

    public Optional<Ref> model() {
      return model;
    }

    public Optional<Ref> schema() {
      return schema;
    }

    public boolean expectsArray() {
      return expectsArray;
    }

    /** Variable whose history the prompt inherits. */
    public Optional<String> inherit() {
      return inherit;
    }

    public Optional<EscalationCondition> escalation() {
      return escalation;
    }
  }

  @ASTNode
  public static final class AgentDef extends Declaration implements AST_AgentDef_ASTNode {
    public static final String DEFAULT_NAME = "default";

    private final Optional<String> name;
    private final ImmutableList<Ref> tools;
    private final Optional<Ref> instruction;
    private final Optional<Ref> retry;
    private final Optional<Ref> timeoutPolicy;
    private final Optional<Long> timeoutSeconds;
    private final Optional<String> description;
    private final ImmutableList<Ref> delegate;
    private final ImmutableList<Ref> use;

    public AgentDef(
        Optional<String> name,
        List<Ref> tools,
        Optional<Ref> instruction,
        Optional<Ref> retry,
        Optional<Ref> timeoutPolicy,
        Optional<Long> timeoutSeconds,
        Optional<String> description,
        List<Ref> delegate,
        List<Ref> use,
        Tokenizer.Pos pos) {
      super(Type.AGENT, pos);
      this.name = name;
      this.tools = ImmutableList.copyOf(tools);
      this.instruction = instruction;
      this.retry = retry;
      this.timeoutPolicy = timeoutPolicy;
      this.timeoutSeconds = timeoutSeconds;
      this.description = description;
      this.delegate = ImmutableList.copyOf(delegate);
      this.use = ImmutableList.copyOf(use);
    }

    public Optional<String> declaredName() {
      return name;
    }

    /** The agent's name; the unnamed entry agent is called {@value #DEFAULT_NAME}. */
    public String name() {
      return name.orElse(DEFAULT_NAME);
    }

    public ImmutableList<Ref> tools() {
      return tools;
    }

    public Optional<Ref> instruction() {
      return instruction;
    }

    public Optional<Ref> retry() {
      return retry;
    }

    public Optional<Ref> timeoutPolicy() {
      return timeoutPolicy;
    }

    public Optional<Long> timeoutSeconds() {
      return timeoutSeconds;
    }

    public Optional<String> description() {
      return description;
    }

    public ImmutableList<Ref> delegate() {
      return delegate;
    }

    public ImmutableList<Ref> use() {
      return use;
    }
  }

  @ASTNode
  public static final class FlowDef extends NamedDeclaration implements AST_FlowDef_ASTNode {
    private final ImmutableList<String> params;
    private final ImmutableList<Statement> body;

    public FlowDef(String name, List<String> params, List<Statement> body, Tokenizer.Pos pos) {
      super(Type.FLOW, name, pos);
      this.params = ImmutableList.copyOf(params);
      this.body = ImmutableList.copyOf(body);
    }

    public ImmutableList<String> params() {
      return params;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  /** An {@code on}/{@code after} event hook. */
  @ASTNode
  public static final class HandlerDef extends Declaration implements AST_HandlerDef_ASTNode {
    public enum Timing {
      ON,
      AFTER;
    }

    public enum Event {
      START("start"),
      INPUT("input"),
      OUTPUT("output"),
      TOOL_CALL("tool-call"),
      TOOL_RESULT("tool-result");

      private final String keyword;

      Event(String keyword) {
        this.keyword = keyword;
      }

      public String keyword() {
        return keyword;
      }

      public static Event fromKeyword(String keyword) {
        for (Event e : values()) {
          if (e.keyword.equals(keyword)) return e;
        }
        throw new IllegalArgumentException("unknown event: " + keyword);
      }
    }

    private final Timing timing;
    private final Event event;
    private final ImmutableList<Statement> body;

    public HandlerDef(Timing timing, Event event, List<Statement> body, Tokenizer.Pos pos) {
      super(Type.HANDLER, pos);
      this.timing = timing;
      this.event = event;
      this.body = ImmutableList.copyOf(body);
    }

    public Timing timing() {
      return timing;
    }

    public Event event() {
      return event;
    }

    /** Method-safe identifier, e.g. {@code on_tool_call}. */
    public String methodName() {
      return timing.name().toLowerCase() + "_" + event.name().toLowerCase();
    }

    @Override
    public String toString() {
      return timing.name().toLowerCase() + " " + event.keyword();
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  private final String file;
  private final ImmutableList<Declaration> declarations;

  public AST(String file, List<Declaration> declarations) {
    this.file = file;
    this.declarations = ImmutableList.copyOf(declarations);
  }

  public String file() {
    return file;
  }

  @ASTChild
  @Override
  public ImmutableList<Declaration> declarations() {
    return declarations;
  }

  @Override
  public Tokenizer.Pos pos() {
    return new Tokenizer.Pos(file, 0, 0);
  }

  public Optional<String> version() {
    return declarations
        .stream()
        .filter(d -> d.type() == Declaration.Type.VERSION)
        .map(d -> d.<VersionDecl>cast().version())
        .findFirst();
  }

  public <T extends Declaration> ImmutableList<T> declarations(Declaration.Type type) {
    return declarations
        .stream()
        .filter(d -> d.type() == type)
        .map(d -> d.<T>cast())
        .collect(ImmutableList.toImmutableList());
  }

  /** A unit with {@code extra} declarations appended, as produced by import expansion. */
  public AST withDeclarations(List<Declaration> extra) {
    return new AST(
        file, ImmutableList.<Declaration>builder().addAll(declarations).addAll(extra).build());
  }
}
