package wfl;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles regex guardrails eagerly and checks that guardrail actions only appear in handlers
 * where they mean something.
 */
class GuardrailValidator extends ErrorCollectingValidator {

  @Override
  public void visitImpl(AST.GuardrailDef node) {
    try {
      Pattern.compile(node.pattern());
    } catch (PatternSyntaxException ex) {
      logError(
          ErrorCode.E0012,
          node.patternPos(),
          String.format(
              "invalid pattern for guardrail '%s': %s", node.name(), ex.getDescription()));
    }
  }

  @Override
  public void visitImpl(AST.FlowDef node) {
    checkActions(node.body(), null);
  }

  @Override
  public void visitImpl(AST.HandlerDef node) {
    checkActions(node.body(), node);
  }

  private void checkActions(List<Statement> body, AST.HandlerDef handler) {
    for (Statement statement : body) {
      if (statement.type().isGuardrailAction() && !allowed(statement.type(), handler)) {
        logError(
            ErrorCode.E0009,
            statement.pos(),
            String.format(
                "'%s' is not allowed in %s",
                keyword(statement.type()),
                handler == null ? "a flow" : "an '" + handler + "' handler"),
            Optional.of(help(statement.type())));
      }
      for (List<Statement> nested : statement.nestedBodies()) {
        checkActions(nested, handler);
      }
    }
  }

  private static boolean allowed(Statement.Type action, AST.HandlerDef handler) {
    if (handler == null || handler.event() == AST.HandlerDef.Event.START) return false;
    switch (action) {
      case WARN:
        return true;
      case RETRY:
        return handler.timing() == AST.HandlerDef.Timing.ON
            && handler.event() == AST.HandlerDef.Event.OUTPUT;
      default:
        return handler.timing() == AST.HandlerDef.Timing.ON;
    }
  }

  private static String keyword(Statement.Type action) {
    switch (action) {
      case MASK:
        return "mask";
      case BLOCK:
        return "block";
      case WARN:
        return "warn";
      default:
        return "retry with";
    }
  }

  private static String help(Statement.Type action) {
    switch (action) {
      case WARN:
        return "'warn' can be used in any input, output or tool handler";
      case RETRY:
        return "'retry with' can only be used in 'on output' handlers";
      default:
        return String.format(
            "'%s' can only be used in 'on input', 'on output', 'on tool-call' and"
                + " 'on tool-result' handlers",
            keyword(action));
    }
  }
}
