package wfl;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import wfl.Tokenizer.Kind;
import wfl.Tokenizer.Token;

/** Concrete syntax tree produced by {@link EarleyParser}. Every element carries its position. */
public abstract class ParseTree {

  private final Tokenizer.Pos pos;

  private ParseTree(Tokenizer.Pos pos) {
    this.pos = pos;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public abstract boolean isLeaf();

  public Node asNode() {
    Preconditions.checkState(!isLeaf(), "not a node: %s", this);
    return (Node) this;
  }

  public Leaf asLeaf() {
    Preconditions.checkState(isLeaf(), "not a leaf: %s", this);
    return (Leaf) this;
  }

  public static final class Node extends ParseTree {
    private final Grammar.Production production;
    private final ImmutableList<ParseTree> children;

    Node(Grammar.Production production, List<ParseTree> children, Tokenizer.Pos pos) {
      super(pos);
      this.production = production;
      this.children = ImmutableList.copyOf(children);
    }

    public Grammar.Production production() {
      return production;
    }

    public ImmutableList<ParseTree> children() {
      return children;
    }

    /** Children with keyword, punctuation and layout leaves removed. */
    public ImmutableList<ParseTree> significant() {
      return children
          .stream()
          .filter(c -> !c.isLeaf() || !c.asLeaf().anonymous())
          .collect(ImmutableList.toImmutableList());
    }

    public ParseTree child(int index) {
      return significant().get(index);
    }

    public ImmutableList<Node> nodes(Grammar.Production production) {
      return children
          .stream()
          .filter(c -> !c.isLeaf() && c.asNode().production() == production)
          .map(ParseTree::asNode)
          .collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<Leaf> leaves(Kind kind) {
      return significant()
          .stream()
          .filter(c -> c.isLeaf() && c.asLeaf().token().kind() == kind)
          .map(ParseTree::asLeaf)
          .collect(ImmutableList.toImmutableList());
    }

    /** True if a keyword or punctuation terminal with this text is among the direct children. */
    public boolean hasKeyword(String text) {
      return children
          .stream()
          .anyMatch(
              c ->
                  c.isLeaf()
                      && (c.asLeaf().token().kind() == Kind.NAME
                          || c.asLeaf().token().kind() == Kind.OP)
                      && c.asLeaf().token().text().equals(text));
    }

    @Override
    public boolean isLeaf() {
      return false;
    }

    @Override
    public String toString() {
      return children
          .stream()
          .map(ParseTree::toString)
          .collect(Collectors.joining(" ", "(" + production.name().toLowerCase() + " ", ")"));
    }
  }

  public static final class Leaf extends ParseTree {
    private final Token token;
    private final boolean anonymous;

    Leaf(Token token, boolean anonymous) {
      super(token.pos());
      this.token = token;
      this.anonymous = anonymous;
    }

    public Token token() {
      return token;
    }

    public String text() {
      return token.text();
    }

    // Keywords, punctuation and layout tokens carry no payload of their own.
    public boolean anonymous() {
      return anonymous;
    }

    @Override
    public boolean isLeaf() {
      return true;
    }

    @Override
    public String toString() {
      return token.describe();
    }
  }
}
