package wfl;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import wfl.processor.ASTChild;
import wfl.processor.ASTNode;

/** Expressions: literals, variable and property reads, operators and {@code filter}. */
public abstract class Expression implements ASTNodeInterface {

  public enum Type {
    VAR_REF,
    PROPERTY_ACCESS,
    STRING_LITERAL,
    NUMBER_LITERAL,
    BOOLEAN_LITERAL,
    NULL_LITERAL,
    LIST_LITERAL,
    OBJECT_LITERAL,
    BINARY,
    UNARY,
    FILTER,
    IMPLICIT_PROPERTY;
  }

  public enum BinaryOperator {
    OR("or"),
    AND("and"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    CONTAINS("contains"),
    NORMALIZED_EQUAL("~"),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String repr;

    BinaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    public boolean isComparison() {
      return ordinal() >= EQUAL.ordinal() && ordinal() <= NORMALIZED_EQUAL.ordinal();
    }

    public static BinaryOperator parse(String repr) {
      for (BinaryOperator op : values()) {
        if (op.repr.equals(repr)) return op;
      }
      throw new IllegalArgumentException("unknown operator: " + repr);
    }
  }

  public enum UnaryOperator {
    NOT,
    NEGATE;
  }

  private final Type type;
  private final Tokenizer.Pos pos;

  protected Expression(Type type, Tokenizer.Pos pos) {
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
  public <T extends Expression> T cast() {
    return (T) this;
  }

  @ASTNode
  public static final class VarRef extends Expression implements Expression_VarRef_ASTNode {
    private final String name;

    public VarRef(String name, Tokenizer.Pos pos) {
      super(Type.VAR_REF, pos);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return "$" + name;
    }
  }

  /** {@code $base.a.b}. */
  @ASTNode
  public static final class PropertyAccess extends Expression
      implements Expression_PropertyAccess_ASTNode {
    private final String base;
    private final ImmutableList<String> path;

    public PropertyAccess(String base, List<String> path, Tokenizer.Pos pos) {
      super(Type.PROPERTY_ACCESS, pos);
      this.base = base;
      this.path = ImmutableList.copyOf(path);
    }

    public String base() {
      return base;
    }

    public ImmutableList<String> path() {
      return path;
    }

    @Override
    public String toString() {
      return "$" + base + "." + Joiner.on('.').join(path);
    }
  }

  /**
   * A string with its {@code $var} / {@code $var.prop} interpolations split out. Escapes are
   * already decoded.
   */
  @ASTNode
  public static final class StringLiteral extends Expression
      implements Expression_StringLiteral_ASTNode {

    public static final class Part {
      private final String text;
      private final Optional<String> variable;
      private final ImmutableList<String> path;

      private Part(String text, Optional<String> variable, List<String> path) {
        this.text = text;
        this.variable = variable;
        this.path = ImmutableList.copyOf(path);
      }

      public static Part text(String text) {
        return new Part(text, Optional.empty(), ImmutableList.of());
      }

      public static Part variable(String name, List<String> path) {
        return new Part("", Optional.of(name), path);
      }

      public boolean isText() {
        return !variable.isPresent();
      }

      public String text() {
        return text;
      }

      public String variable() {
        return variable.get();
      }

      public ImmutableList<String> path() {
        return path;
      }

      @Override
      public String toString() {
        if (isText()) return text;
        return "$" + variable.get() + (path.isEmpty() ? "" : "." + Joiner.on('.').join(path));
      }
    }

    private final ImmutableList<Part> parts;

    public StringLiteral(List<Part> parts, Tokenizer.Pos pos) {
      super(Type.STRING_LITERAL, pos);
      this.parts = ImmutableList.copyOf(parts);
    }

    public ImmutableList<Part> parts() {
      return parts;
    }

    public boolean isConstant() {
      return parts.stream().allMatch(Part::isText);
    }

    /** The text with interpolations written back as {@code $name}. */
    public String template() {
      return Joiner.on("").join(parts);
    }
  }

  @ASTNode
  public static final class NumberLiteral extends Expression
      implements Expression_NumberLiteral_ASTNode {
    private final String text;

    public NumberLiteral(String text, Tokenizer.Pos pos) {
      super(Type.NUMBER_LITERAL, pos);
      this.text = text;
    }

    public String text() {
      return text;
    }

    public boolean isInteger() {
      return text.indexOf('.') < 0;
    }
  }

  @ASTNode
  public static final class BooleanLiteral extends Expression
      implements Expression_BooleanLiteral_ASTNode {
    private final boolean value;

    public BooleanLiteral(boolean value, Tokenizer.Pos pos) {
      super(Type.BOOLEAN_LITERAL, pos);
      this.value = value;
    }

    public boolean value() {
      return value;
    }
  }

  @ASTNode
  public static final class NullLiteral extends Expression
      implements Expression_NullLiteral_ASTNode {
    public NullLiteral(Tokenizer.Pos pos) {
      super(Type.NULL_LITERAL, pos);
    }
  }

  @ASTNode
  public static final class ListLiteral extends Expression
      implements Expression_ListLiteral_ASTNode {
    private final ImmutableList<Expression> items;

    public ListLiteral(List<Expression> items, Tokenizer.Pos pos) {
      super(Type.LIST_LITERAL, pos);
      this.items = ImmutableList.copyOf(items);
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> items() {
      return items;
    }
  }

  @ASTNode
  public static final class ObjectLiteral extends Expression
      implements Expression_ObjectLiteral_ASTNode {

    @ASTNode
    public static final class Entry implements Expression_ObjectLiteral_Entry_ASTNode {
      private final String key;
      private final Expression value;

      public Entry(String key, Expression value) {
        this.key = key;
        this.value = value;
      }

      public String key() {
        return key;
      }

      @ASTChild
      @Override
      public Expression value() {
        return value;
      }

      @Override
      public Tokenizer.Pos pos() {
        return value.pos();
      }
    }

    private final ImmutableList<Entry> entries;

    public ObjectLiteral(List<Entry> entries, Tokenizer.Pos pos) {
      super(Type.OBJECT_LITERAL, pos);
      this.entries = ImmutableList.copyOf(entries);
    }

    @ASTChild
    @Override
    public ImmutableList<Entry> entries() {
      return entries;
    }
  }

  @ASTNode
  public static final class Binary extends Expression implements Expression_Binary_ASTNode {
    private final Expression lhs;
    private final BinaryOperator op;
    private final Expression rhs;

    public Binary(Expression lhs, BinaryOperator op, Expression rhs, Tokenizer.Pos pos) {
      super(Type.BINARY, pos);
      this.lhs = lhs;
      this.op = op;
      this.rhs = rhs;
    }

    @ASTChild
    @Override
    public Expression lhs() {
      return lhs;
    }

    public BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression rhs() {
      return rhs;
    }
  }

  @ASTNode
  public static final class Unary extends Expression implements Expression_Unary_ASTNode {
    private final UnaryOperator op;
    private final Expression operand;

    public Unary(UnaryOperator op, Expression operand, Tokenizer.Pos pos) {
      super(Type.UNARY, pos);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression operand() {
      return operand;
    }
  }

  /** {@code .a.b} inside a {@code filter ... where} condition: a property of the current item. */
  @ASTNode
  public static final class ImplicitPropertyAccess extends Expression
      implements Expression_ImplicitPropertyAccess_ASTNode {
    private final ImmutableList<String> path;

    public ImplicitPropertyAccess(List<String> path, Tokenizer.Pos pos) {
      super(Type.IMPLICIT_PROPERTY, pos);
      this.path = ImmutableList.copyOf(path);
    }

    public ImmutableList<String> path() {
      return path;
    }
  }

  /** {@code filter LIST where .prop OP value}; keeps matching items in their original order. */
  @ASTNode
  public static final class Filter extends Expression implements Expression_Filter_ASTNode {
    private final Expression list;
    private final ImplicitPropertyAccess property;
    private final BinaryOperator op;
    private final Expression value;

    public Filter(
        Expression list,
        ImplicitPropertyAccess property,
        BinaryOperator op,
        Expression value,
        Tokenizer.Pos pos) {
      super(Type.FILTER, pos);
      this.list = list;
      this.property = property;
      this.op = op;
      this.value = value;
    }

    @ASTChild
    @Override
    public Expression list() {
      return list;
    }

    @ASTChild
    @Override
    public ImplicitPropertyAccess property() {
      return property;
    }

    public BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }
  }
}
