package wfl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Verify;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Translates expressions to Java expressions over {@code wfl.runtime.Ops} and the flow's {@code
 * ctx}. Every generated expression has a reference type or {@code boolean}, so it can be passed
 * where an {@code Object} is expected.
 */
final class ExpressionGenerator extends DefaultASTVisitor<String> {
  private static final Escaper JAVA_STRING =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .addEscape('\b', "\\b")
          .addEscape('\f', "\\f")
          .build();

  static String quote(String s) {
    return "\"" + JAVA_STRING.escape(s) + "\"";
  }

  /** Java literal for a definition property: a string, number, boolean, or nested map or list. */
  static String literal(Object value) {
    if (value == null) return "(Object) null";
    if (value instanceof String) return quote((String) value);
    if (value instanceof Long || value instanceof Integer) return value + "L";
    if (value instanceof Double) return value + "d";
    if (value instanceof Boolean) return value.toString();
    if (value instanceof Map) {
      List<String> args = new ArrayList<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        args.add(quote(entry.getKey().toString()));
        args.add(literal(entry.getValue()));
      }
      return "Ops.map(" + Joiner.on(", ").join(args) + ")";
    }
    if (value instanceof List) {
      List<String> args = new ArrayList<>();
      for (Object item : (List<?>) value) {
        args.add(literal(item));
      }
      return "Ops.list(" + Joiner.on(", ").join(args) + ")";
    }
    throw new IllegalArgumentException("no literal form for " + value.getClass());
  }

  /** {@code "a", "b"} for a property path, with a leading comma when non-empty. */
  static String pathArgs(List<String> path) {
    StringBuilder out = new StringBuilder();
    for (String key : path) {
      out.append(", ").append(quote(key));
    }
    return out.toString();
  }

  String generate(Expression expression) {
    String code = expression.accept(this, null);
    Verify.verifyNotNull(code, "no code for %s", expression.type());
    return code;
  }

  /** Arguments of an invocation, each prefixed with a comma. */
  String args(List<Expression> args) {
    StringBuilder out = new StringBuilder();
    for (Expression arg : args) {
      out.append(", ").append(generate(arg));
    }
    return out.toString();
  }

  String condition(Expression expression) {
    return "Ops.truthy(" + generate(expression) + ")";
  }

  /** Java for a string with interpolations, as rendered text. */
  String template(Expression.StringLiteral node) {
    if (node.isConstant()) return quote(node.template());
    List<String> pieces = new ArrayList<>();
    for (Expression.StringLiteral.Part part : node.parts()) {
      if (part.isText()) {
        if (!part.text().isEmpty()) pieces.add(quote(part.text()));
      } else if (part.path().isEmpty()) {
        pieces.add("ctx.resolve(" + quote(part.variable()) + ")");
      } else {
        pieces.add(
            "ctx.resolveProperty(" + quote(part.variable()) + pathArgs(part.path()) + ")");
      }
    }
    return pieces.size() == 1 ? pieces.get(0) : "(" + Joiner.on(" + ").join(pieces) + ")";
  }

  @Override
  public String visit(Expression.VarRef node, String value) {
    return "ctx.get(" + quote(node.name()) + ")";
  }

  @Override
  public String visit(Expression.PropertyAccess node, String value) {
    return "Ops.property(ctx.get(" + quote(node.base()) + ")" + pathArgs(node.path()) + ")";
  }

  @Override
  public String visit(Expression.StringLiteral node, String value) {
    return template(node);
  }

  @Override
  public String visit(Expression.NumberLiteral node, String value) {
    return node.text() + (node.isInteger() ? "L" : "d");
  }

  @Override
  public String visit(Expression.BooleanLiteral node, String value) {
    return node.value() ? "true" : "false";
  }

  @Override
  public String visit(Expression.NullLiteral node, String value) {
    return "(Object) null";
  }

  @Override
  public String visit(Expression.ListLiteral node, String value) {
    List<String> items = new ArrayList<>();
    for (Expression item : node.items()) {
      items.add(generate(item));
    }
    return "Ops.list(" + Joiner.on(", ").join(items) + ")";
  }

  @Override
  public String visit(Expression.ObjectLiteral node, String value) {
    List<String> args = new ArrayList<>();
    for (Expression.ObjectLiteral.Entry entry : node.entries()) {
      args.add(quote(entry.key()));
      args.add(generate(entry.value()));
    }
    return "Ops.map(" + Joiner.on(", ").join(args) + ")";
  }

  @Override
  public String visit(Expression.Binary node, String value) {
    String lhs = generate(node.lhs());
    String rhs = generate(node.rhs());
    switch (node.op()) {
      case OR:
        return "(Ops.truthy(" + lhs + ") || Ops.truthy(" + rhs + "))";
      case AND:
        return "(Ops.truthy(" + lhs + ") && Ops.truthy(" + rhs + "))";
      case EQUAL:
        return "Ops.equal(" + lhs + ", " + rhs + ")";
      case NOT_EQUAL:
        return "!Ops.equal(" + lhs + ", " + rhs + ")";
      case CONTAINS:
        return "Ops.contains(" + lhs + ", " + rhs + ")";
      case NORMALIZED_EQUAL:
        return "Ops.normalizedEquals(" + lhs + ", " + rhs + ")";
      case LESS:
      case GREATER:
      case LESS_EQUAL:
      case GREATER_EQUAL:
        return "Ops.compare(" + quote(node.op().repr()) + ", " + lhs + ", " + rhs + ")";
      case ADD:
        return "Ops.add(" + lhs + ", " + rhs + ")";
      case SUBTRACT:
        return "Ops.subtract(" + lhs + ", " + rhs + ")";
      case MULTIPLY:
        return "Ops.multiply(" + lhs + ", " + rhs + ")";
      case DIVIDE:
        return "Ops.divide(" + lhs + ", " + rhs + ")";
      default:
        throw new IllegalStateException("unhandled operator " + node.op());
    }
  }

  @Override
  public String visit(Expression.Unary node, String value) {
    String operand = generate(node.operand());
    switch (node.op()) {
      case NOT:
        return "!Ops.truthy(" + operand + ")";
      case NEGATE:
        return "Ops.negate(" + operand + ")";
      default:
        throw new IllegalStateException("unhandled operator " + node.op());
    }
  }

  @Override
  public String visit(Expression.Filter node, String value) {
    return "Ops.filter("
        + generate(node.list())
        + ", "
        + quote(node.op().repr())
        + ", "
        + generate(node.value())
        + pathArgs(node.property().path())
        + ")";
  }

  @Override
  public String visit(Expression.ImplicitPropertyAccess node, String value) {
    throw new IllegalStateException("'." + Joiner.on('.').join(node.path()) + "' outside filter");
  }
}
