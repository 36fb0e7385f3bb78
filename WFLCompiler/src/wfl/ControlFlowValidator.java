package wfl;

import java.util.List;
import java.util.Optional;

/**
 * Structural rules of statement bodies: {@code continue} needs an enclosing loop, {@code parallel
 * do} holds only agent runs, and {@code on failure} closes a flow.
 */
class ControlFlowValidator extends ErrorCollectingValidator {

  @Override
  public void visitImpl(AST.FlowDef node) {
    checkBody(node.body(), 0, true);
  }

  @Override
  public void visitImpl(AST.HandlerDef node) {
    checkBody(node.body(), 0, false);
  }

  private void checkBody(List<Statement> body, int loopDepth, boolean flowTopLevel) {
    for (int i = 0; i < body.size(); i++) {
      Statement statement = body.get(i);
      if (statement.type() == Statement.Type.FAILURE) {
        if (!flowTopLevel) {
          logError(
              ErrorCode.E0007,
              statement.pos(),
              "'on failure' is only allowed at the top level of a flow");
        } else if (i != body.size() - 1) {
          logError(
              ErrorCode.E0007,
              body.get(i + 1).pos(),
              "statements after 'on failure' are not allowed",
              Optional.of("'on failure' must be the last statement of a flow"));
        }
      }
      check(statement, loopDepth);
    }
  }

  private void check(Statement statement, int loopDepth) {
    switch (statement.type()) {
      case CONTINUE:
        if (loopDepth == 0) {
          logError(
              ErrorCode.E0013,
              statement.pos(),
              "'continue' is only allowed inside 'for' and 'loop' blocks");
        }
        break;
      case RUN_AGENT:
        {
          Statement.RunStatement run = statement.cast();
          if (run.escalationHandler().isPresent()
              && run.escalationHandler().get().action()
                  == Statement.EscalationHandler.Action.CONTINUE
              && loopDepth == 0) {
            logError(
                ErrorCode.E0013,
                run.escalationHandler().get().pos(),
                "'on escalate continue' is only allowed inside 'for' and 'loop' blocks");
          }
          break;
        }
      case FOR:
      case LOOP:
        for (List<Statement> body : statement.nestedBodies()) {
          checkBody(body, loopDepth + 1, false);
        }
        break;
      case PARALLEL:
        checkParallel(statement.cast());
        break;
      case MATCH:
        {
          Statement.MatchBlock match = statement.cast();
          for (Statement.WhenClause clause : match.clauses()) {
            check(clause.statement(), loopDepth);
          }
          match.otherwise().ifPresent(s -> check(s, loopDepth));
          break;
        }
      case FAILURE:
        // The handler body runs outside any loop of the flow.
        for (List<Statement> body : statement.nestedBodies()) {
          checkBody(body, 0, false);
        }
        break;
      default:
        for (List<Statement> body : statement.nestedBodies()) {
          checkBody(body, loopDepth, false);
        }
        break;
    }
  }

  private void checkParallel(Statement.ParallelBlock block) {
    for (Statement statement : block.body()) {
      if (statement.type() != Statement.Type.RUN_AGENT) {
        logError(
            ErrorCode.E0014,
            statement.pos(),
            "only 'run agent' statements are allowed in 'parallel do'");
        continue;
      }
      Statement.RunStatement run = statement.cast();
      if (run.escalationHandler().isPresent()) {
        logError(
            ErrorCode.E0014,
            run.escalationHandler().get().pos(),
            "escalation handlers are not supported in 'parallel do'");
      }
    }
  }
}
