package wfl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.base.Joiner;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

import wfl.Grammar.NonTerminal;
import wfl.Grammar.Rule;
import wfl.Grammar.Symbol;
import wfl.Grammar.Terminal;
import wfl.Tokenizer.Kind;
import wfl.Tokenizer.Token;

/**
 * Chart parser for {@link Grammar}. Recognition follows Earley with the Aycock–Horspool treatment
 * of nullable nonterminals; the tree is then rebuilt from the chart.
 *
 * <p>When the input is ambiguous the first derivation wins: a symbol's rules are tried in
 * declaration order, and a child that could begin at several positions takes the earliest one.
 */
public final class EarleyParser {

  private static final class Item {
    final Rule rule;
    final int dot;
    final int origin;

    Item(Rule rule, int dot, int origin) {
      this.rule = rule;
      this.dot = dot;
      this.origin = origin;
    }

    boolean complete() {
      return dot == rule.rhs().size();
    }

    Symbol next() {
      return rule.rhs().get(dot);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Item)) return false;
      Item that = (Item) o;
      return rule.index() == that.rule.index() && dot == that.dot && origin == that.origin;
    }

    @Override
    public int hashCode() {
      return (rule.index() * 31 + dot) * 100_003 + origin;
    }
  }

  private static final class ItemSet {
    final List<Item> items = new ArrayList<>();
    final Set<Item> seen = new HashSet<>();
    final Map<Integer, List<Item>> waiting = new HashMap<>();

    void add(Item item) {
      if (seen.add(item)) {
        items.add(item);
      }
    }

    boolean contains(Rule rule, int dot, int origin) {
      return seen.contains(new Item(rule, dot, origin));
    }

    List<Item> waitingFor(NonTerminal symbol) {
      return waiting.computeIfAbsent(symbol.id(), k -> new ArrayList<>());
    }
  }

  public static ParseTree.Node parse(String file, String content) throws CompilerException {
    return parse(Indenter.process(new Tokenizer(file, content).tokenize()));
  }

  public static ParseTree.Node parse(List<Token> tokens) throws CompilerException {
    return new EarleyParser(Grammar.workflow(), tokens).run();
  }

  private final Grammar grammar;
  private final ImmutableList<Token> tokens;
  private final List<ItemSet> chart = new ArrayList<>();
  private final Map<String, Optional<List<ParseTree>>> memo = new HashMap<>();
  private final Set<String> active = new HashSet<>();

  private EarleyParser(Grammar grammar, List<Token> tokens) {
    this.grammar = grammar;
    this.tokens = ImmutableList.copyOf(tokens);
  }

  private ParseTree.Node run() throws CompilerException {
    recognize();

    List<ParseTree> root =
        buildSymbol(grammar.start(), 0, tokens.size())
            .orElseThrow(() -> new IllegalStateException("accepted input has no derivation"));
    Verify.verify(root.size() == 1 && !root.get(0).isLeaf(), "bad root: %s", root);
    return root.get(0).asNode();
  }

  private void recognize() throws CompilerException {
    for (int i = 0; i <= tokens.size(); i++) {
      chart.add(new ItemSet());
    }
    for (Rule rule : grammar.rulesFor(grammar.start())) {
      chart.get(0).add(new Item(rule, 0, 0));
    }

    for (int i = 0; i <= tokens.size(); i++) {
      ItemSet set = chart.get(i);
      for (int j = 0; j < set.items.size(); j++) {
        Item item = set.items.get(j);
        if (item.complete()) {
          complete(item, i);
        } else if (item.next() instanceof NonTerminal) {
          predict(item, (NonTerminal) item.next(), i);
        } else if (i < tokens.size() && ((Terminal) item.next()).matches(tokens.get(i))) {
          chart.get(i + 1).add(new Item(item.rule, item.dot + 1, item.origin));
        }
      }

      if (i < tokens.size() && chart.get(i + 1).items.isEmpty()) {
        throw unexpected(i);
      }
    }

    boolean accepted =
        grammar
            .rulesFor(grammar.start())
            .stream()
            .anyMatch(r -> chart.get(tokens.size()).contains(r, r.rhs().size(), 0));
    if (!accepted) {
      throw unexpected(tokens.size() - 1);
    }
  }

  private void predict(Item item, NonTerminal symbol, int i) {
    ItemSet set = chart.get(i);
    set.waitingFor(symbol).add(item);
    for (Rule rule : grammar.rulesFor(symbol)) {
      set.add(new Item(rule, 0, i));
    }
    if (grammar.isNullable(symbol)) {
      set.add(new Item(item.rule, item.dot + 1, item.origin));
    }
  }

  private void complete(Item item, int i) {
    List<Item> waiting = chart.get(item.origin).waitingFor(item.rule.lhs());
    for (int k = 0; k < waiting.size(); k++) {
      Item parent = waiting.get(k);
      chart.get(i).add(new Item(parent.rule, parent.dot + 1, parent.origin));
    }
  }

  private CompilerException unexpected(int index) {
    Token token = tokens.get(index);
    Set<String> expected = new TreeSet<>();
    for (Item item : chart.get(index).items) {
      if (!item.complete() && item.next() instanceof Terminal) {
        expected.add(item.next().display());
      }
    }

    if (token.kind() == Kind.INDENT) {
      return new CompilerException(token.pos(), ErrorCode.E0008, "unexpected indentation");
    }
    String found =
        token.kind() == Kind.EOF ? "unexpected end of input" : "unexpected " + token.describe();
    String message =
        expected.isEmpty() ? found : found + "; expected one of: " + Joiner.on(", ").join(expected);
    return new CompilerException(token.pos(), ErrorCode.E0007, message);
  }

  // Children of `symbol` spanning tokens [start, end), already spliced if the symbol is inline.
  private Optional<List<ParseTree>> buildSymbol(NonTerminal symbol, int start, int end) {
    String key = symbol.id() + ":" + start + ":" + end;
    Optional<List<ParseTree>> cached = memo.get(key);
    if (cached != null) return cached;
    if (!active.add(key)) return Optional.empty();

    Optional<List<ParseTree>> result = Optional.empty();
    ItemSet endSet = chart.get(end);
    for (Rule rule : grammar.rulesFor(symbol)) {
      if (!endSet.contains(rule, rule.rhs().size(), start)) continue;
      Optional<List<ParseTree>> children = buildPrefix(rule, rule.rhs().size(), start, end);
      if (children.isPresent()) {
        result = Optional.of(ImmutableList.copyOf(wrap(rule, children.get(), start)));
        break;
      }
    }

    active.remove(key);
    memo.put(key, result);
    return result;
  }

  // The first `dot` symbols of `rule`, deriving tokens [start, end).
  private Optional<List<ParseTree>> buildPrefix(Rule rule, int dot, int start, int end) {
    if (dot == 0) {
      return start == end ? Optional.of(new ArrayList<>()) : Optional.empty();
    }

    Symbol last = rule.rhs().get(dot - 1);
    if (last instanceof Terminal) {
      Terminal terminal = (Terminal) last;
      if (end - 1 < start
          || !terminal.matches(tokens.get(end - 1))
          || !chart.get(end - 1).contains(rule, dot - 1, start)) {
        return Optional.empty();
      }
      Optional<List<ParseTree>> prefix = buildPrefix(rule, dot - 1, start, end - 1);
      prefix.ifPresent(p -> p.add(new ParseTree.Leaf(tokens.get(end - 1), !terminal.keep())));
      return prefix;
    }

    NonTerminal symbol = (NonTerminal) last;
    for (int mid = start; mid <= end; mid++) {
      if (!chart.get(mid).contains(rule, dot - 1, start)) continue;
      Optional<List<ParseTree>> child = buildSymbol(symbol, mid, end);
      if (!child.isPresent()) continue;
      Optional<List<ParseTree>> prefix = buildPrefix(rule, dot - 1, start, mid);
      if (prefix.isPresent()) {
        prefix.get().addAll(child.get());
        return prefix;
      }
    }
    return Optional.empty();
  }

  private List<ParseTree> wrap(Rule rule, List<ParseTree> children, int start) {
    Grammar.Production production = rule.builds();
    if (production == null) {
      return children;
    }
    Tokenizer.Pos pos = children.isEmpty() ? tokens.get(start).pos() : children.get(0).pos();
    List<ParseTree> node = new ArrayList<>();
    node.add(new ParseTree.Node(production, children, pos));
    return node;
  }
}
