package wfl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import wfl.Grammar.Production;
import wfl.ParseTree.Leaf;
import wfl.ParseTree.Node;
import wfl.Tokenizer.Kind;

/**
 * Converts the parse tree into the typed AST, one case per production. Payloads are always read
 * through {@link Node#significant()}, so keywords, punctuation and layout tokens never reach the
 * AST.
 */
public final class Transformer {

  public static AST transform(String file, Node root) throws CompilerException {
    return new Transformer().transformFile(file, root);
  }

  private Transformer() {}

  private AST transformFile(String file, Node root) throws CompilerException {
    List<AST.Declaration> declarations = new ArrayList<>();
    for (ParseTree child : root.significant()) {
      declarations.add(declaration(child.asNode()));
    }
    return new AST(file, declarations);
  }

  private AST.Declaration declaration(Node node) throws CompilerException {
    ImmutableList<ParseTree> c = node.significant();
    switch (node.production()) {
      case VERSION:
        return new AST.VersionDecl(constant(c.get(0).asLeaf()), node.pos());
      case IMPORT:
        return new AST.ImportDef(constant(c.get(0).asLeaf()), node.pos());
      case MODEL_SHORT:
        return new AST.ModelDef(
            text(c.get(0)), Optional.of(constant(c.get(1).asLeaf())), noProperties(), node.pos());
      case MODEL_BLOCK:
        return new AST.ModelDef(
            text(c.get(0)), Optional.empty(), properties(c.subList(1, c.size())), node.pos());
      case SCHEMA:
        return schema(node, c);
      case TOOL_MCP:
        return new AST.ToolDef(
            text(c.get(0)),
            AST.ToolDef.Kind.MCP,
            Optional.of(constant(c.get(1).asLeaf())),
            c.size() > 3 ? Optional.of(text(c.get(2))) : Optional.empty(),
            c.size() > 3 ? Optional.of(constant(c.get(3).asLeaf())) : Optional.empty(),
            noProperties(),
            node.pos());
      case TOOL_BUILTIN:
        return new AST.ToolDef(
            text(c.get(0)),
            AST.ToolDef.Kind.BUILTIN,
            Optional.of(dotted(c.get(1).asNode()).name()),
            Optional.empty(),
            Optional.empty(),
            noProperties(),
            node.pos());
      case TOOL_BLOCK:
        {
          Map<String, Object> props = properties(c.subList(1, c.size()));
          Object url = props.get("url");
          return new AST.ToolDef(
              text(c.get(0)),
              AST.ToolDef.Kind.CONFIGURED,
              url == null ? Optional.empty() : Optional.of(url.toString()),
              Optional.empty(),
              Optional.empty(),
              props,
              node.pos());
        }
      case GUARDRAIL:
        return new AST.GuardrailDef(
            text(c.get(0)), constant(c.get(1).asLeaf()), node.pos(), c.get(1).pos());
      case RETRY_POLICY:
        return retryPolicy(node, c);
      case TIMEOUT_POLICY:
        return new AST.TimeoutPolicyDef(
            text(c.get(0)), seconds(c.get(1).asLeaf(), c.get(2).asLeaf()), node.pos());
      case PROMPT:
        return prompt(node, c);
      case AGENT:
        return agent(node, c);
      case FLOW:
        {
          List<String> params = new ArrayList<>();
          for (Leaf leaf : node.leaves(Kind.VAR)) {
            params.add(leaf.text());
          }
          return new AST.FlowDef(text(c.get(0)), params, statements(c), node.pos());
        }
      case HANDLER:
        return new AST.HandlerDef(
            AST.HandlerDef.Timing.valueOf(text(c.get(0)).toUpperCase()),
            AST.HandlerDef.Event.fromKeyword(text(c.get(1))),
            statements(c),
            node.pos());
      default:
        throw new IllegalStateException("not a declaration: " + node.production());
    }
  }

  private static Map<String, Object> noProperties() {
    return ImmutableMap.of();
  }

  private AST.SchemaDef schema(Node node, List<ParseTree> c) throws CompilerException {
    List<AST.Field> fields = new ArrayList<>();
    for (Node field : node.nodes(Production.FIELD)) {
      List<ParseTree> fc = field.significant();
      fields.add(
          new AST.Field(
              text(fc.get(0)), fieldType(fc.get(1).asNode()), field.pos(), fc.get(1).pos()));
    }
    return new AST.SchemaDef(text(c.get(0)), fields, node.pos());
  }

  private AST.FieldType fieldType(Node node) {
    List<Node> nested = node.nodes(Production.FIELD_TYPE);
    String base = text(node.significant().get(0));
    boolean optional = node.hasKeyword("?");
    if (!nested.isEmpty()) {
      return new AST.FieldType(base, Optional.of(fieldType(nested.get(0))), optional);
    }
    if (node.hasKeyword("[")) {
      // T[] is shorthand for list[T].
      return new AST.FieldType(
          "list", Optional.of(new AST.FieldType(base, Optional.empty(), false)), optional);
    }
    return new AST.FieldType(base, Optional.empty(), optional);
  }

  private AST.RetryPolicyDef retryPolicy(Node node, List<ParseTree> c) throws CompilerException {
    AST.RetryPolicyDef.Backoff backoff = AST.RetryPolicyDef.Backoff.FIXED;
    if (c.size() > 2) {
      String strategy = text(c.get(2));
      try {
        backoff = AST.RetryPolicyDef.Backoff.valueOf(strategy.toUpperCase());
      } catch (IllegalArgumentException ex) {
        throw new CompilerException(
            c.get(2).pos(),
            ErrorCode.E0007,
            String.format(
                "unknown backoff '%s'; expected exponential, linear or fixed", strategy));
      }
    }
    return new AST.RetryPolicyDef(
        text(c.get(0)), (int) integer(c.get(1).asLeaf()), backoff, node.pos());
  }

  private AST.PromptDef prompt(Node node, List<ParseTree> c) throws CompilerException {
    Optional<AST.Ref> model = Optional.empty();
    Optional<AST.Ref> schema = Optional.empty();
    boolean array = false;
    Optional<String> inherit = Optional.empty();
    Optional<AST.EscalationCondition> escalation = Optional.empty();
    Expression.StringLiteral body = null;

    for (ParseTree child : c.subList(1, c.size())) {
      if (child.isLeaf()) {
        body = StringTemplates.template(child.asLeaf().token());
        continue;
      }
      Node mod = child.asNode();
      List<ParseTree> mc = mod.significant();
      switch (mod.production()) {
        case PROMPT_MODEL:
          model = Optional.of(new AST.Ref(constant(mc.get(0).asLeaf()), mc.get(0).pos()));
          break;
        case PROMPT_SCHEMA:
          schema = Optional.of(ref(mc.get(0)));
          array = mod.hasKeyword("[");
          break;
        case PROMPT_INHERIT:
          inherit = Optional.of(text(mc.get(0)));
          break;
        case ESCALATE_IF:
          escalation =
              Optional.of(
                  new AST.EscalationCondition(text(mc.get(0)), constant(mc.get(1).asLeaf())));
          break;
        default:
          throw new IllegalStateException("unexpected prompt part: " + mod.production());
      }
    }
    return new AST.PromptDef(
        text(c.get(0)), body, model, schema, array, inherit, escalation, node.pos());
  }

  private AST.AgentDef agent(Node node, List<ParseTree> c) throws CompilerException {
    Optional<String> name = Optional.empty();
    List<AST.Ref> tools = new ArrayList<>();
    Optional<AST.Ref> instruction = Optional.empty();
    Optional<AST.Ref> retry = Optional.empty();
    Optional<AST.Ref> timeoutPolicy = Optional.empty();
    Optional<Long> timeoutSeconds = Optional.empty();
    Optional<String> description = Optional.empty();
    List<AST.Ref> delegate = new ArrayList<>();
    List<AST.Ref> use = new ArrayList<>();
    Map<Production, Node> seen = new LinkedHashMap<>();

    for (ParseTree child : c) {
      if (child.isLeaf()) {
        name = Optional.of(text(child));
        continue;
      }
      Node prop = child.asNode();
      if (seen.put(prop.production(), prop) != null) {
        throw new CompilerException(
            prop.pos(),
            ErrorCode.E0003,
            "agent property '" + prop.children().get(0).asLeaf().text() + "' is set twice");
      }
      List<ParseTree> pc = prop.significant();
      switch (prop.production()) {
        case AGENT_TOOLS:
          tools.addAll(refList(prop));
          break;
        case AGENT_INSTRUCTION:
          instruction = Optional.of(ref(pc.get(0)));
          break;
        case AGENT_RETRY:
          retry = Optional.of(ref(pc.get(0)));
          break;
        case AGENT_TIMEOUT:
          if (pc.size() == 1) {
            timeoutPolicy = Optional.of(ref(pc.get(0)));
          } else {
            timeoutSeconds = Optional.of(seconds(pc.get(0).asLeaf(), pc.get(1).asLeaf()));
          }
          break;
        case AGENT_DESCRIPTION:
          description = Optional.of(constant(pc.get(0).asLeaf()));
          break;
        case AGENT_DELEGATE:
          delegate.addAll(refList(prop));
          break;
        case AGENT_USE:
          use.addAll(refList(prop));
          break;
        default:
          throw new IllegalStateException("unexpected agent property: " + prop.production());
      }
    }
    return new AST.AgentDef(
        name,
        tools,
        instruction,
        retry,
        timeoutPolicy,
        timeoutSeconds,
        description,
        delegate,
        use,
        node.pos());
  }

  private List<AST.Ref> refList(Node node) {
    List<AST.Ref> refs = new ArrayList<>();
    for (Node dotted : node.nodes(Production.DOTTED_NAME)) {
      refs.add(dotted(dotted));
    }
    return refs;
  }

  private AST.Ref dotted(Node node) {
    List<String> parts = new ArrayList<>();
    for (ParseTree leaf : node.significant()) {
      parts.add(text(leaf));
    }
    return new AST.Ref(Joiner.on('.').join(parts), node.pos());
  }

  private Map<String, Object> properties(List<ParseTree> nodes) throws CompilerException {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (ParseTree child : nodes) {
      Node prop = child.asNode();
      List<ParseTree> pc = prop.significant();
      Leaf keyLeaf = pc.get(0).asLeaf();
      String key = constant(keyLeaf);
      Object value =
          prop.production() == Production.PROPERTY_BLOCK
              ? properties(pc.subList(1, pc.size()))
              : propertyValue(pc.get(1).asLeaf());
      if (properties.put(key, value) != null) {
        throw new CompilerException(
            keyLeaf.pos(), ErrorCode.E0003, "property '" + key + "' is set twice");
      }
    }
    return properties;
  }

  private Object propertyValue(Leaf leaf) throws CompilerException {
    if (leaf.token().kind() == Kind.NUMBER) {
      return number(leaf);
    }
    return constant(leaf);
  }

  private List<Statement> statements(List<ParseTree> children) throws CompilerException {
    List<Statement> statements = new ArrayList<>();
    for (ParseTree child : children) {
      if (child.isLeaf()) continue;
      Node node = child.asNode();
      if (node.production() == Production.ELSE
          || node.production() == Production.WHEN
          || node.production() == Production.MATCH_ELSE) {
        continue;
      }
      statements.add(statement(node));
    }
    return statements;
  }

  private Statement statement(Node node) throws CompilerException {
    ImmutableList<ParseTree> c = node.significant();
    switch (node.production()) {
      case ASSIGN:
        {
          String target = text(c.get(0));
          Node value = c.get(1).asNode();
          if (isInvocation(value)) {
            return invocation(value, Optional.of(target), node.pos());
          }
          return new Statement.Assignment(target, expression(value), node.pos());
        }
      case PROPERTY_ASSIGN:
        {
          List<String> path = new ArrayList<>();
          for (ParseTree p : c.subList(1, c.size() - 1)) {
            path.add(text(p));
          }
          return new Statement.PropertyAssignment(
              text(c.get(0)), path, expression(c.get(c.size() - 1).asNode()), node.pos());
        }
      case RUN_AGENT:
      case CALL_LLM:
      case RUN_FLOW:
        return invocation(node, Optional.empty(), node.pos());
      case RETURN:
        return new Statement.ReturnStatement(optionalExpression(c, 0), node.pos());
      case PUSH:
        return new Statement.PushStatement(
            expression(c.get(0).asNode()), text(c.get(1)), c.get(1).pos(), node.pos());
      case FOR:
        return new Statement.ForLoop(
            text(c.get(0)), expression(c.get(1).asNode()), statements(c.subList(2, c.size())),
            node.pos());
      case LOOP:
        {
          Optional<Integer> max = Optional.empty();
          if (!c.isEmpty() && c.get(0).isLeaf()) {
            max = Optional.of((int) integer(c.get(0).asLeaf()));
          }
          return new Statement.LoopBlock(max, statements(c), node.pos());
        }
      case PARALLEL:
        return new Statement.ParallelBlock(statements(c), node.pos());
      case IF:
        {
          List<Node> elseNodes = node.nodes(Production.ELSE);
          List<Statement> elseBody =
              elseNodes.isEmpty()
                  ? ImmutableList.of()
                  : statements(elseNodes.get(0).significant());
          return new Statement.IfBlock(
              expression(c.get(0).asNode()),
              statements(c.subList(1, c.size())),
              elseBody,
              node.pos());
        }
      case MATCH:
        {
          List<Statement.WhenClause> clauses = new ArrayList<>();
          for (Node when : node.nodes(Production.WHEN)) {
            List<ParseTree> wc = when.significant();
            clauses.add(
                new Statement.WhenClause(
                    expression(wc.get(0).asNode()), statement(wc.get(1).asNode())));
          }
          Optional<Statement> otherwise = Optional.empty();
          for (Node other : node.nodes(Production.MATCH_ELSE)) {
            otherwise = Optional.of(statement(other.significant().get(0).asNode()));
          }
          return new Statement.MatchBlock(
              expression(c.get(0).asNode()), clauses, otherwise, node.pos());
        }
      case ON_FAILURE:
        return new Statement.FailureBlock(statements(c), node.pos());
      case LOG:
        return new Statement.Log(expression(c.get(0).asNode()), node.pos());
      case NOTIFY:
        return new Statement.Notify(expression(c.get(0).asNode()), node.pos());
      case ESCALATE_TO_HUMAN:
        return new Statement.EscalateToHuman(optionalExpression(c, 0), node.pos());
      case CONTINUE:
        return new Statement.Continue(node.pos());
      case ABORT:
        return new Statement.Abort(optionalExpression(c, 0), node.pos());
      case MASK:
        return new Statement.MaskAction(ref(c.get(0)), node.pos());
      case BLOCK_GUARDRAIL:
        return new Statement.BlockAction(Optional.of(ref(c.get(0))), Optional.empty(), node.pos());
      case BLOCK_IF:
        return new Statement.BlockAction(
            Optional.empty(), Optional.of(expression(c.get(0).asNode())), node.pos());
      case WARN_IF:
        return new Statement.WarnAction(
            Optional.of(expression(c.get(0).asNode())), Optional.empty(), node.pos());
      case WARN:
        return new Statement.WarnAction(
            Optional.empty(), Optional.of(expression(c.get(0).asNode())), node.pos());
      case RETRY_WITH:
        return new Statement.RetryAction(
            expression(c.get(0).asNode()), optionalExpression(c, 1), node.pos());
      default:
        throw new IllegalStateException("not a statement: " + node.production());
    }
  }

  private static boolean isInvocation(Node node) {
    return node.production() == Production.RUN_AGENT
        || node.production() == Production.CALL_LLM
        || node.production() == Production.RUN_FLOW;
  }

  private Statement invocation(Node node, Optional<String> target, Tokenizer.Pos pos)
      throws CompilerException {
    List<ParseTree> c = node.significant();
    AST.Ref callee = ref(c.get(0));
    List<Expression> args = new ArrayList<>();
    Optional<Statement.EscalationHandler> handler = Optional.empty();
    Optional<String> model = Optional.empty();

    for (ParseTree child : c.subList(1, c.size())) {
      if (child.isLeaf()) {
        model = Optional.of(constant(child.asLeaf()));
      } else if (child.asNode().production() == Production.ESCALATION) {
        handler = Optional.of(escalationHandler(child.asNode()));
      } else {
        args.add(expression(child.asNode()));
      }
    }

    switch (node.production()) {
      case RUN_AGENT:
        return new Statement.RunStatement(target, callee, args, handler, pos);
      case CALL_LLM:
        return new Statement.CallStatement(target, callee, args, model, pos);
      default:
        return new Statement.FlowCallStatement(target, callee, args, pos);
    }
  }

  private Statement.EscalationHandler escalationHandler(Node node) throws CompilerException {
    if (node.hasKeyword("return")) {
      return new Statement.EscalationHandler(
          Statement.EscalationHandler.Action.RETURN,
          Optional.of(expression(node.significant().get(0).asNode())),
          node.pos());
    }
    return new Statement.EscalationHandler(
        node.hasKeyword("continue")
            ? Statement.EscalationHandler.Action.CONTINUE
            : Statement.EscalationHandler.Action.ABORT,
        Optional.empty(),
        node.pos());
  }

  private Optional<Expression> optionalExpression(List<ParseTree> c, int index)
      throws CompilerException {
    if (c.size() <= index) return Optional.empty();
    return Optional.of(expression(c.get(index).asNode()));
  }

  Expression expression(Node node) throws CompilerException {
    ImmutableList<ParseTree> c = node.significant();
    switch (node.production()) {
      case OR:
        return binary(node, Expression.BinaryOperator.OR, c.get(0), c.get(1));
      case AND:
        return binary(node, Expression.BinaryOperator.AND, c.get(0), c.get(1));
      case NOT:
        return new Expression.Unary(
            Expression.UnaryOperator.NOT, expression(c.get(0).asNode()), node.pos());
      case COMPARE:
      case ARITHMETIC:
        return binary(
            node, Expression.BinaryOperator.parse(text(c.get(1))), c.get(0), c.get(2));
      case NEGATE:
        {
          Expression operand = expression(c.get(0).asNode());
          if (operand.type() == Expression.Type.NUMBER_LITERAL) {
            Expression.NumberLiteral number = operand.cast();
            if (!number.text().startsWith("-")) {
              return new Expression.NumberLiteral("-" + number.text(), node.pos());
            }
          }
          return new Expression.Unary(Expression.UnaryOperator.NEGATE, operand, node.pos());
        }
      case FILTER:
        return new Expression.Filter(
            expression(c.get(0).asNode()),
            expression(c.get(1).asNode()).cast(),
            Expression.BinaryOperator.parse(text(c.get(2))),
            expression(c.get(3).asNode()),
            node.pos());
      case IMPLICIT_PROPERTY:
        return new Expression.ImplicitPropertyAccess(texts(c), node.pos());
      case VAR_REF:
        return new Expression.VarRef(text(c.get(0)), node.pos());
      case PROPERTY_ACCESS:
        return new Expression.PropertyAccess(
            text(c.get(0)), texts(c.subList(1, c.size())), node.pos());
      case STRING_LITERAL:
        return StringTemplates.template(c.get(0).asLeaf().token());
      case NUMBER_LITERAL:
        number(c.get(0).asLeaf());
        return new Expression.NumberLiteral(text(c.get(0)), node.pos());
      case TRUE_LITERAL:
        return new Expression.BooleanLiteral(true, node.pos());
      case FALSE_LITERAL:
        return new Expression.BooleanLiteral(false, node.pos());
      case NULL_LITERAL:
        return new Expression.NullLiteral(node.pos());
      case LIST_LITERAL:
        {
          List<Expression> items = new ArrayList<>();
          for (ParseTree item : c) {
            items.add(expression(item.asNode()));
          }
          return new Expression.ListLiteral(items, node.pos());
        }
      case OBJECT_LITERAL:
        {
          List<Expression.ObjectLiteral.Entry> entries = new ArrayList<>();
          for (Node entry : node.nodes(Production.OBJECT_ENTRY)) {
            List<ParseTree> ec = entry.significant();
            entries.add(
                new Expression.ObjectLiteral.Entry(
                    constant(ec.get(0).asLeaf()), expression(ec.get(1).asNode())));
          }
          return new Expression.ObjectLiteral(entries, node.pos());
        }
      default:
        throw new IllegalStateException("not an expression: " + node.production());
    }
  }

  private Expression binary(
      Node node, Expression.BinaryOperator op, ParseTree lhs, ParseTree rhs)
      throws CompilerException {
    return new Expression.Binary(
        expression(lhs.asNode()), op, expression(rhs.asNode()), node.pos());
  }

  private static AST.Ref ref(ParseTree leaf) {
    return new AST.Ref(text(leaf), leaf.pos());
  }

  private static String text(ParseTree leaf) {
    return leaf.asLeaf().text();
  }

  private static List<String> texts(List<ParseTree> leaves) {
    List<String> texts = new ArrayList<>();
    for (ParseTree leaf : leaves) {
      texts.add(text(leaf));
    }
    return texts;
  }

  private static String constant(Leaf leaf) {
    Kind kind = leaf.token().kind();
    if (kind == Kind.STRING || kind == Kind.TRIPLE_STRING) {
      return StringTemplates.constant(leaf.token());
    }
    return leaf.text();
  }

  private static Object number(Leaf leaf) throws CompilerException {
    try {
      if (leaf.text().indexOf('.') >= 0) {
        return Double.parseDouble(leaf.text());
      }
      return Long.parseLong(leaf.text());
    } catch (NumberFormatException ex) {
      throw new CompilerException(
          leaf.pos(), ErrorCode.E0007, "invalid number '" + leaf.text() + "'");
    }
  }

  private static long integer(Leaf leaf) throws CompilerException {
    Object value = number(leaf);
    if (!(value instanceof Long) || (Long) value > Integer.MAX_VALUE) {
      throw new CompilerException(
          leaf.pos(), ErrorCode.E0007, "expected a whole number, got '" + leaf.text() + "'");
    }
    return (Long) value;
  }

  private static long seconds(Leaf amount, Leaf unit) throws CompilerException {
    long value = integer(amount);
    switch (unit.text()) {
      case "second":
      case "seconds":
        return value;
      case "minute":
      case "minutes":
        return value * 60;
      case "hour":
      case "hours":
        return value * 3600;
      default:
        throw new CompilerException(
            unit.pos(),
            ErrorCode.E0007,
            String.format(
                "unknown time unit '%s'; expected seconds, minutes or hours", unit.text()));
    }
  }
}
