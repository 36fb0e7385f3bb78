package wfl;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Top-level definitions by kind and name, plus the global variables. Read-only once built. */
public final class SymbolTable {

  public enum Kind {
    MODEL("model", "models"),
    SCHEMA("schema", "schemas"),
    TOOL("tool", "tools"),
    PROMPT("prompt", "prompts"),
    AGENT("agent", "agents"),
    FLOW("flow", "flows"),
    GUARDRAIL("guardrail", "guardrails"),
    RETRY_POLICY("retry policy", "retry policies"),
    TIMEOUT_POLICY("timeout policy", "timeout policies");

    private final String singular;
    private final String plural;

    Kind(String singular, String plural) {
      this.singular = singular;
      this.plural = plural;
    }

    public String singular() {
      return singular;
    }

    public String plural() {
      return plural;
    }
  }

  /** Variables every flow and handler can read. */
  public static final ImmutableSet<String> BUILTIN_VARIABLES =
      ImmutableSet.of("input_prompt", "conversation", "current_agent", "session_id", "turn_count");

  /** Guardrails provided by the runtime. */
  public static final ImmutableSet<String> BUILTIN_GUARDRAILS = ImmutableSet.of("pii", "jailbreak");

  private final ImmutableMap<Kind, ImmutableMap<String, AST.Declaration>> entries;
  private final ImmutableSet<String> globals;

  private SymbolTable(
      ImmutableMap<Kind, ImmutableMap<String, AST.Declaration>> entries,
      ImmutableSet<String> globals) {
    this.entries = entries;
    this.globals = globals;
  }

  public Optional<AST.Declaration> lookup(Kind kind, String name) {
    return Optional.ofNullable(entries.get(kind).get(name));
  }

  public boolean contains(Kind kind, String name) {
    return entries.get(kind).containsKey(name);
  }

  public ImmutableSet<String> names(Kind kind) {
    return entries.get(kind).keySet();
  }

  @SuppressWarnings("unchecked")
  public <T extends AST.Declaration> Iterable<T> all(Kind kind) {
    return (Iterable<T>) entries.get(kind).values();
  }

  /** Variables assigned in {@code on start} and {@code after start} handlers. */
  public ImmutableSet<String> globals() {
    return globals;
  }

  public int count(Kind kind) {
    return entries.get(kind).size();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final Map<Kind, Map<String, AST.Declaration>> entries = new EnumMap<>(Kind.class);
    private final ImmutableSet.Builder<String> globals = ImmutableSet.builder();

    private Builder() {
      for (Kind kind : Kind.values()) {
        entries.put(kind, new LinkedHashMap<>());
      }
    }

    /** Returns the earlier definition if the name is already taken; the table keeps that one. */
    Optional<AST.Declaration> define(Kind kind, String name, AST.Declaration declaration) {
      return Optional.ofNullable(entries.get(kind).putIfAbsent(name, declaration));
    }

    void addGlobal(String name) {
      globals.add(name);
    }

    SymbolTable build() {
      ImmutableMap.Builder<Kind, ImmutableMap<String, AST.Declaration>> built =
          ImmutableMap.builder();
      for (Map.Entry<Kind, Map<String, AST.Declaration>> e : entries.entrySet()) {
        built.put(e.getKey(), ImmutableMap.copyOf(e.getValue()));
      }
      return new SymbolTable(built.build(), globals.build());
    }
  }
}
