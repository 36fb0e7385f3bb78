package wfl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

import wfl.Tokenizer.Kind;
import wfl.Tokenizer.Token;

/**
 * The context-free grammar of the workflow language.
 *
 * <p>Rules are written in Java with small EBNF helpers ({@code opt}, {@code star}, {@code plus},
 * {@code alt}, {@code seq}); each helper becomes an auxiliary <em>inline</em> nonterminal whose
 * children are spliced into the enclosing node. A rule may carry an alias {@link Production}, which
 * names the parse tree node it builds; unaliased rules of an inline nonterminal build nothing.
 */
public final class Grammar {

  public enum Production {
    FILE,
    VERSION,
    IMPORT,
    MODEL_SHORT,
    MODEL_BLOCK,
    PROPERTY,
    PROPERTY_BLOCK,
    SCHEMA,
    FIELD,
    FIELD_TYPE,
    TOOL_MCP,
    TOOL_BUILTIN,
    TOOL_BLOCK,
    DOTTED_NAME,
    GUARDRAIL,
    RETRY_POLICY,
    TIMEOUT_POLICY,
    PROMPT,
    PROMPT_MODEL,
    PROMPT_SCHEMA,
    PROMPT_INHERIT,
    ESCALATE_IF,
    AGENT,
    AGENT_TOOLS,
    AGENT_INSTRUCTION,
    AGENT_RETRY,
    AGENT_TIMEOUT,
    AGENT_DESCRIPTION,
    AGENT_DELEGATE,
    AGENT_USE,
    FLOW,
    HANDLER,

    // Statements
    ASSIGN,
    PROPERTY_ASSIGN,
    RUN_AGENT,
    CALL_LLM,
    RUN_FLOW,
    ESCALATION,
    RETURN,
    PUSH,
    FOR,
    LOOP,
    PARALLEL,
    IF,
    ELSE,
    MATCH,
    WHEN,
    MATCH_ELSE,
    ON_FAILURE,
    LOG,
    NOTIFY,
    ESCALATE_TO_HUMAN,
    CONTINUE,
    ABORT,
    MASK,
    BLOCK_GUARDRAIL,
    BLOCK_IF,
    WARN,
    WARN_IF,
    RETRY_WITH,

    // Expressions
    OR,
    AND,
    NOT,
    COMPARE,
    ARITHMETIC,
    NEGATE,
    FILTER,
    IMPLICIT_PROPERTY,
    VAR_REF,
    PROPERTY_ACCESS,
    STRING_LITERAL,
    NUMBER_LITERAL,
    TRUE_LITERAL,
    FALSE_LITERAL,
    NULL_LITERAL,
    LIST_LITERAL,
    OBJECT_LITERAL,
    OBJECT_ENTRY;
  }

  /** Names that can never be used as identifiers; they still match as keywords. */
  public static final ImmutableSet<String> HARD_KEYWORDS =
      ImmutableSet.of(
          "abort", "after", "agent", "and", "block", "call", "continue", "contains", "do", "else",
          "end", "escalate", "false", "filter", "flow", "for", "guardrail", "if", "import", "in",
          "log", "loop", "mask", "match", "model", "not", "notify", "null", "on", "or", "parallel",
          "prompt", "push", "retry", "return", "run", "schema", "timeout", "to", "tool", "true",
          "version", "warn", "when", "where", "with");

  public abstract static class Symbol {
    public abstract String display();

    @Override
    public String toString() {
      return display();
    }
  }

  public static final class Terminal extends Symbol {
    private final Kind kind;
    private final String text;
    private final boolean keep;
    private final boolean identifier;

    private Terminal(Kind kind, String text, boolean keep, boolean identifier) {
      this.kind = kind;
      this.text = text;
      this.keep = keep;
      this.identifier = identifier;
    }

    public boolean matches(Token token) {
      if (token.kind() != kind) return false;
      if (text != null) return token.text().equals(text);
      return !identifier || !HARD_KEYWORDS.contains(token.text());
    }

    /** Whether the matched leaf carries payload for the transformer. */
    public boolean keep() {
      return keep;
    }

    @Override
    public String display() {
      return text != null ? "'" + text + "'" : kind.description();
    }
  }

  public static final class NonTerminal extends Symbol {
    private final String name;
    private final Production production;
    private final int id;

    private NonTerminal(String name, Production production, int id) {
      this.name = name;
      this.production = production;
      this.id = id;
    }

    public boolean inline() {
      return production == null;
    }

    public Production production() {
      return production;
    }

    public int id() {
      return id;
    }

    @Override
    public String display() {
      return name;
    }
  }

  public static final class Rule {
    private final int index;
    private final NonTerminal lhs;
    private final ImmutableList<Symbol> rhs;
    private final Production alias;

    private Rule(int index, NonTerminal lhs, List<Symbol> rhs, Production alias) {
      this.index = index;
      this.lhs = lhs;
      this.rhs = ImmutableList.copyOf(rhs);
      this.alias = alias;
    }

    public int index() {
      return index;
    }

    public NonTerminal lhs() {
      return lhs;
    }

    public ImmutableList<Symbol> rhs() {
      return rhs;
    }

    /** The node this rule builds, or null if its children are spliced into the parent. */
    public Production builds() {
      return alias != null ? alias : lhs.production;
    }

    @Override
    public String toString() {
      return lhs.display() + " -> " + rhs;
    }
  }

  private static final Terminal NAME = new Terminal(Kind.NAME, null, true, true);
  private static final Terminal ANY_NAME = new Terminal(Kind.NAME, null, true, false);
  private static final Terminal VAR = new Terminal(Kind.VAR, null, true, false);
  private static final Terminal PATH = new Terminal(Kind.PATH, null, true, false);
  private static final Terminal STRING = new Terminal(Kind.STRING, null, true, false);
  private static final Terminal TRIPLE_STRING =
      new Terminal(Kind.TRIPLE_STRING, null, true, false);
  private static final Terminal NUMBER = new Terminal(Kind.NUMBER, null, true, false);
  private static final Terminal NEWLINE = new Terminal(Kind.NEWLINE, null, false, false);
  private static final Terminal INDENT = new Terminal(Kind.INDENT, null, false, false);
  private static final Terminal DEDENT = new Terminal(Kind.DEDENT, null, false, false);
  private static final Terminal EOF = new Terminal(Kind.EOF, null, false, false);

  private static final Grammar WORKFLOW = new Builder().buildWorkflowGrammar();

  public static Grammar workflow() {
    return WORKFLOW;
  }

  private final NonTerminal start;
  private final ImmutableList<Rule> rules;
  private final ImmutableListMultimap<NonTerminal, Rule> rulesByLhs;
  private final ImmutableSet<NonTerminal> nullable;
  private final int nonTerminalCount;

  private Grammar(NonTerminal start, List<Rule> rules, int nonTerminalCount) {
    this.start = start;
    this.rules = ImmutableList.copyOf(rules);
    this.rulesByLhs = this.rules.stream().collect(ImmutableListMultimap.toImmutableListMultimap(
        Rule::lhs, r -> r));
    this.nullable = computeNullable(this.rules);
    this.nonTerminalCount = nonTerminalCount;
  }

  public NonTerminal start() {
    return start;
  }

  public ImmutableList<Rule> rules() {
    return rules;
  }

  public ImmutableList<Rule> rulesFor(NonTerminal lhs) {
    return rulesByLhs.get(lhs);
  }

  public boolean isNullable(NonTerminal symbol) {
    return nullable.contains(symbol);
  }

  public int nonTerminalCount() {
    return nonTerminalCount;
  }

  private static ImmutableSet<NonTerminal> computeNullable(List<Rule> rules) {
    Set<NonTerminal> nullable = new HashSet<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Rule rule : rules) {
        if (nullable.contains(rule.lhs)) continue;
        if (rule.rhs.stream().allMatch(s -> s instanceof NonTerminal && nullable.contains(s))) {
          nullable.add(rule.lhs);
          changed = true;
        }
      }
    }
    return ImmutableSet.copyOf(nullable);
  }

  private static final class Builder {
    private final List<Rule> rules = new ArrayList<>();
    private final Map<String, Terminal> keywords = new LinkedHashMap<>();
    private int nextId = 0;
    private int helperCount = 0;

    private NonTerminal node(Production production) {
      return new NonTerminal(production.name().toLowerCase(), production, nextId++);
    }

    private NonTerminal inline(String name) {
      return new NonTerminal(name, null, nextId++);
    }

    private void rule(NonTerminal lhs, Object... rhs) {
      alias(lhs, null, rhs);
    }

    private void alias(NonTerminal lhs, Production alias, Object... rhs) {
      List<Symbol> symbols = new ArrayList<>();
      for (Object o : rhs) {
        symbols.add(symbol(o));
      }
      rules.add(new Rule(rules.size(), lhs, symbols, alias));
    }

    private Symbol symbol(Object o) {
      if (o instanceof Symbol) return (Symbol) o;
      Preconditions.checkArgument(o instanceof String, "bad grammar element: %s", o);
      return keyword((String) o, false);
    }

    // Keywords and punctuation are anonymous unless kept.
    private Terminal keyword(String text, boolean keep) {
      String key = text + (keep ? "!" : "");
      return keywords.computeIfAbsent(
          key,
          k ->
              new Terminal(
                  Character.isLetter(text.charAt(0)) ? Kind.NAME : Kind.OP, text, keep, false));
    }

    private Terminal keep(String text) {
      return keyword(text, true);
    }

    private NonTerminal helper(String kind) {
      return inline("_" + kind + (helperCount++));
    }

    private NonTerminal seq(Object... items) {
      NonTerminal n = helper("seq");
      rule(n, items);
      return n;
    }

    private NonTerminal opt(Object... items) {
      NonTerminal n = helper("opt");
      rule(n);
      rule(n, items);
      return n;
    }

    private NonTerminal star(Object... items) {
      NonTerminal n = helper("star");
      rule(n);
      Object[] rhs = new Object[items.length + 1];
      rhs[0] = n;
      System.arraycopy(items, 0, rhs, 1, items.length);
      rule(n, rhs);
      return n;
    }

    private NonTerminal plus(Object... items) {
      NonTerminal n = helper("plus");
      rule(n, items);
      Object[] rhs = new Object[items.length + 1];
      rhs[0] = n;
      System.arraycopy(items, 0, rhs, 1, items.length);
      rule(n, rhs);
      return n;
    }

    private NonTerminal alt(Object... alternatives) {
      NonTerminal n = helper("alt");
      for (Object alternative : alternatives) {
        rule(n, alternative);
      }
      return n;
    }

    Grammar buildWorkflowGrammar() {
      NonTerminal start = inline("start");

      // Expressions, lowest precedence first.
      NonTerminal expression = inline("expression");
      NonTerminal orExpr = inline("or_expr");
      NonTerminal andExpr = inline("and_expr");
      NonTerminal notExpr = inline("not_expr");
      NonTerminal comparison = inline("comparison");
      NonTerminal sum = inline("sum");
      NonTerminal term = inline("term");
      NonTerminal unary = inline("unary");
      NonTerminal primary = inline("primary");
      NonTerminal atom = inline("atom");
      NonTerminal compareOp =
          alt(
              keep("=="),
              keep("!="),
              keep("<"),
              keep(">"),
              keep("<="),
              keep(">="),
              keep("contains"),
              keep("~"));

      rule(expression, orExpr);
      alias(orExpr, Production.OR, orExpr, "or", andExpr);
      rule(orExpr, andExpr);
      alias(andExpr, Production.AND, andExpr, "and", notExpr);
      rule(andExpr, notExpr);
      alias(notExpr, Production.NOT, "not", notExpr);
      rule(notExpr, comparison);
      alias(comparison, Production.COMPARE, sum, compareOp, sum);
      rule(comparison, sum);
      alias(sum, Production.ARITHMETIC, sum, alt(keep("+"), keep("-")), term);
      rule(sum, term);
      alias(term, Production.ARITHMETIC, term, alt(keep("*"), keep("/")), unary);
      rule(term, unary);
      alias(unary, Production.NEGATE, "-", unary);
      rule(unary, primary);
      rule(primary, atom);

      NonTerminal implicitProperty = node(Production.IMPLICIT_PROPERTY);
      rule(implicitProperty, plus(".", ANY_NAME));
      NonTerminal filter = node(Production.FILTER);
      rule(filter, "filter", atom, "where", implicitProperty, compareOp, sum);
      rule(primary, filter);

      NonTerminal entry = node(Production.OBJECT_ENTRY);
      rule(entry, alt(ANY_NAME, STRING), ":", expression);

      alias(atom, Production.VAR_REF, VAR);
      alias(atom, Production.PROPERTY_ACCESS, VAR, plus(".", ANY_NAME));
      alias(atom, Production.STRING_LITERAL, STRING);
      alias(atom, Production.STRING_LITERAL, TRIPLE_STRING);
      alias(atom, Production.NUMBER_LITERAL, NUMBER);
      alias(atom, Production.TRUE_LITERAL, "true");
      alias(atom, Production.FALSE_LITERAL, "false");
      alias(atom, Production.NULL_LITERAL, "null");
      alias(
          atom,
          Production.LIST_LITERAL,
          "[",
          opt(expression, star(",", expression), opt(",")),
          "]");
      alias(atom, Production.OBJECT_LITERAL, "{", opt(entry, star(",", entry), opt(",")), "}");
      rule(atom, "(", expression, ")");

      // Shared pieces of declarations.
      NonTerminal dotted = node(Production.DOTTED_NAME);
      rule(dotted, NAME, star(".", ANY_NAME));
      NonTerminal nameList = seq(dotted, star(",", dotted));

      NonTerminal property = node(Production.PROPERTY);
      NonTerminal value = alt(STRING, TRIPLE_STRING, NUMBER, PATH, ANY_NAME);
      NonTerminal key = alt(ANY_NAME, STRING);
      rule(property, key, ":", value, NEWLINE);
      alias(property, Production.PROPERTY_BLOCK, key, ":", NEWLINE, INDENT, plus(property), DEDENT);

      // Statements.
      NonTerminal statement = inline("statement");
      NonTerminal block = seq(INDENT, plus(statement), DEDENT);
      NonTerminal invocation = inline("invocation");
      NonTerminal argList = seq(atom, star(opt(","), atom));
      NonTerminal args = alt(seq(), seq("with", argList), argList);

      NonTerminal escalation = node(Production.ESCALATION);
      rule(escalation, "on", "escalate", "return", expression);
      rule(escalation, "on", "escalate", "continue");
      rule(escalation, "on", "escalate", "abort");

      alias(invocation, Production.RUN_AGENT, "run", "agent", NAME, args, opt(",", escalation));
      alias(
          invocation,
          Production.CALL_LLM,
          "call",
          "llm",
          NAME,
          args,
          opt("using", "model", STRING));
      alias(invocation, Production.RUN_FLOW, "run", NAME, args);

      NonTerminal elseClause = node(Production.ELSE);
      rule(elseClause, "else", ":", NEWLINE, block);
      NonTerminal whenClause = node(Production.WHEN);
      rule(whenClause, "when", expression, "->", statement);
      NonTerminal matchElse = node(Production.MATCH_ELSE);
      rule(matchElse, "else", "->", statement);

      alias(statement, Production.ASSIGN, VAR, "=", expression, NEWLINE);
      alias(statement, Production.ASSIGN, VAR, "=", invocation, NEWLINE);
      alias(statement, Production.PROPERTY_ASSIGN, VAR, plus(".", ANY_NAME), "=", expression,
          NEWLINE);
      rule(statement, invocation, NEWLINE);
      alias(statement, Production.RETURN, "return", opt(expression), NEWLINE);
      alias(statement, Production.PUSH, "push", expression, "to", VAR, NEWLINE);
      alias(statement, Production.FOR, "for", VAR, "in", expression, "do", NEWLINE, block, "end",
          NEWLINE);
      alias(statement, Production.LOOP, "loop", opt("max", NUMBER), "do", NEWLINE, block, "end",
          NEWLINE);
      alias(statement, Production.PARALLEL, "parallel", "do", NEWLINE, block, "end", NEWLINE);
      alias(statement, Production.IF, "if", expression, ":", NEWLINE, block, opt(elseClause));
      alias(
          statement,
          Production.MATCH,
          "match",
          expression,
          opt("do"),
          NEWLINE,
          INDENT,
          plus(whenClause),
          opt(matchElse),
          DEDENT,
          "end",
          NEWLINE);
      alias(statement, Production.ON_FAILURE, "on", "failure", ":", NEWLINE, block);
      alias(statement, Production.LOG, "log", expression, NEWLINE);
      alias(statement, Production.NOTIFY, "notify", expression, NEWLINE);
      alias(statement, Production.ESCALATE_TO_HUMAN, "escalate", "to", "human", opt(expression),
          NEWLINE);
      alias(statement, Production.CONTINUE, "continue", NEWLINE);
      alias(statement, Production.ABORT, "abort", opt(expression), NEWLINE);
      alias(statement, Production.MASK, "mask", NAME, NEWLINE);
      alias(statement, Production.BLOCK_GUARDRAIL, "block", "if", NAME, NEWLINE);
      alias(statement, Production.BLOCK_IF, "block", "if", expression, NEWLINE);
      alias(statement, Production.WARN_IF, "warn", "if", expression, NEWLINE);
      alias(statement, Production.WARN, "warn", expression, NEWLINE);
      alias(statement, Production.RETRY_WITH, "retry", "with", expression,
          opt("if", expression), NEWLINE);

      // Declarations.
      NonTerminal declaration = inline("declaration");

      NonTerminal version = node(Production.VERSION);
      rule(version, "version", alt(ANY_NAME, NUMBER, STRING), NEWLINE);
      NonTerminal importDef = node(Production.IMPORT);
      rule(importDef, "import", alt(PATH, STRING), NEWLINE);

      NonTerminal model = inline("model");
      alias(model, Production.MODEL_SHORT, "model", NAME, "=", alt(PATH, STRING, ANY_NAME),
          NEWLINE);
      alias(model, Production.MODEL_BLOCK, "model", NAME, ":", NEWLINE, INDENT, plus(property),
          DEDENT);

      NonTerminal fieldType = node(Production.FIELD_TYPE);
      rule(fieldType, ANY_NAME, opt("?"));
      rule(fieldType, ANY_NAME, "[", fieldType, "]", opt("?"));
      rule(fieldType, ANY_NAME, "[", "]", opt("?"));
      NonTerminal field = node(Production.FIELD);
      rule(field, ANY_NAME, ":", fieldType, NEWLINE);
      NonTerminal schema = node(Production.SCHEMA);
      rule(schema, "schema", NAME, ":", NEWLINE, INDENT, plus(field), DEDENT);

      NonTerminal tool = inline("tool");
      alias(tool, Production.TOOL_MCP, "tool", NAME, "=", "mcp", STRING,
          opt("with", "auth", ANY_NAME, STRING), NEWLINE);
      alias(tool, Production.TOOL_BUILTIN, "tool", NAME, "=", "builtin", dotted, NEWLINE);
      alias(tool, Production.TOOL_BLOCK, "tool", NAME, ":", NEWLINE, INDENT, plus(property),
          DEDENT);

      NonTerminal guardrail = node(Production.GUARDRAIL);
      rule(guardrail, "guardrail", NAME, "=", "regex", STRING, NEWLINE);
      NonTerminal retryPolicy = node(Production.RETRY_POLICY);
      rule(retryPolicy, "retry", NAME, "=", NUMBER, "times", opt(",", ANY_NAME, "backoff"),
          NEWLINE);
      NonTerminal timeoutPolicy = node(Production.TIMEOUT_POLICY);
      rule(timeoutPolicy, "timeout", NAME, "=", NUMBER, ANY_NAME, NEWLINE);

      NonTerminal promptModifier = inline("prompt_modifier");
      alias(promptModifier, Production.PROMPT_MODEL, "using", "model", STRING);
      alias(promptModifier, Production.PROMPT_SCHEMA, "expecting", ANY_NAME, opt("[", "]"));
      alias(promptModifier, Production.PROMPT_INHERIT, "inherit", VAR);
      NonTerminal escalateIf = node(Production.ESCALATE_IF);
      rule(escalateIf, "escalate", "if", alt(keep("=="), keep("!="), keep("~"), keep("contains")),
          STRING, NEWLINE);
      NonTerminal promptBody = alt(TRIPLE_STRING, STRING);
      NonTerminal prompt = node(Production.PROMPT);
      rule(prompt, "prompt", NAME, star(promptModifier), ":", promptBody, NEWLINE,
          opt(INDENT, escalateIf, DEDENT));
      rule(prompt, "prompt", NAME, star(promptModifier), ":", NEWLINE, INDENT, promptBody,
          NEWLINE, opt(escalateIf), DEDENT);

      NonTerminal agentProperty = inline("agent_property");
      alias(agentProperty, Production.AGENT_TOOLS, "tools", nameList, NEWLINE);
      alias(agentProperty, Production.AGENT_INSTRUCTION, "instruction", NAME, NEWLINE);
      alias(agentProperty, Production.AGENT_RETRY, "retry", NAME, NEWLINE);
      alias(agentProperty, Production.AGENT_TIMEOUT, "timeout", NAME, NEWLINE);
      alias(agentProperty, Production.AGENT_TIMEOUT, "timeout", NUMBER, ANY_NAME, NEWLINE);
      alias(agentProperty, Production.AGENT_DESCRIPTION, "description",
          alt(STRING, TRIPLE_STRING), NEWLINE);
      alias(agentProperty, Production.AGENT_DELEGATE, "delegate", nameList, NEWLINE);
      alias(agentProperty, Production.AGENT_USE, "use", nameList, NEWLINE);
      NonTerminal agent = node(Production.AGENT);
      rule(agent, "agent", opt(NAME), ":", NEWLINE, INDENT, plus(agentProperty), DEDENT);

      NonTerminal flow = node(Production.FLOW);
      rule(flow, "flow", NAME, star(VAR), ":", NEWLINE, block);

      NonTerminal handler = node(Production.HANDLER);
      rule(
          handler,
          alt(keep("on"), keep("after")),
          alt(keep("start"), keep("input"), keep("output"), keep("tool-call"), keep("tool-result")),
          "do",
          NEWLINE,
          block,
          "end",
          NEWLINE);

      for (NonTerminal d :
          ImmutableList.of(
              version, importDef, model, schema, tool, guardrail, retryPolicy, timeoutPolicy,
              prompt, agent, flow, handler)) {
        rule(declaration, d);
      }

      NonTerminal file = node(Production.FILE);
      rule(file, opt(NEWLINE), star(declaration), EOF);
      rule(start, file);

      return new Grammar(start, rules, nextId);
    }
  }
}
