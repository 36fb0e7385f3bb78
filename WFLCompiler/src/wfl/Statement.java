package wfl;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import wfl.processor.ASTChild;
import wfl.processor.ASTNode;

/** Statements of flow and handler bodies. */
public abstract class Statement implements ASTNodeInterface {

  public enum Type {
    ASSIGNMENT,
    PROPERTY_ASSIGNMENT,
    RUN_AGENT,
    CALL_LLM,
    RUN_FLOW,
    RETURN,
    PUSH,
    FOR,
    LOOP,
    PARALLEL,
    IF,
    MATCH,
    FAILURE,
    LOG,
    NOTIFY,
    ESCALATE_TO_HUMAN,
    CONTINUE,
    ABORT,
    MASK,
    BLOCK,
    WARN,
    RETRY;

    public boolean isGuardrailAction() {
      return this == MASK || this == BLOCK || this == WARN || this == RETRY;
    }

    public boolean isInvocation() {
      return this == RUN_AGENT || this == CALL_LLM || this == RUN_FLOW;
    }
  }

  private final Type type;
  private final Tokenizer.Pos pos;

  protected Statement(Type type, Tokenizer.Pos pos) {
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
  public <T extends Statement> T cast() {
    return (T) this;
  }

  /** Statement lists nested directly in this one, e.g. both branches of an {@code if}. */
  public ImmutableList<ImmutableList<Statement>> nestedBodies() {
    return ImmutableList.of();
  }

  /** Common shape of the three invocation statements. */
  public abstract static class Invocation extends Statement {
    private final Optional<String> target;
    private final AST.Ref callee;
    private final ImmutableList<Expression> args;

    protected Invocation(
        Type type,
        Optional<String> target,
        AST.Ref callee,
        List<Expression> args,
        Tokenizer.Pos pos) {
      super(type, pos);
      this.target = target;
      this.callee = callee;
      this.args = ImmutableList.copyOf(args);
    }

    /** Variable receiving the result, if any. */
    public Optional<String> target() {
      return target;
    }

    public AST.Ref callee() {
      return callee;
    }

    public ImmutableList<Expression> argList() {
      return args;
    }
  }

  @ASTNode
  public static final class Assignment extends Statement implements Statement_Assignment_ASTNode {
    private final String target;
    private final Expression value;

    public Assignment(String target, Expression value, Tokenizer.Pos pos) {
      super(Type.ASSIGNMENT, pos);
      this.target = target;
      this.value = value;
    }

    public String target() {
      return target;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }
  }

  /** {@code $obj.a.b = value}: mutation of an existing nested mapping. */
  @ASTNode
  public static final class PropertyAssignment extends Statement
      implements Statement_PropertyAssignment_ASTNode {
    private final String variable;
    private final ImmutableList<String> path;
    private final Expression value;

    public PropertyAssignment(
        String variable, List<String> path, Expression value, Tokenizer.Pos pos) {
      super(Type.PROPERTY_ASSIGNMENT, pos);
      this.variable = variable;
      this.path = ImmutableList.copyOf(path);
      this.value = value;
    }

    public String variable() {
      return variable;
    }

    public ImmutableList<String> path() {
      return path;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }
  }

  @ASTNode
  public static final class EscalationHandler implements Statement_EscalationHandler_ASTNode {
    public enum Action {
      RETURN,
      CONTINUE,
      ABORT;
    }

    private final Action action;
    private final Optional<Expression> value;
    private final Tokenizer.Pos pos;

    public EscalationHandler(Action action, Optional<Expression> value, Tokenizer.Pos pos) {
      this.action = action;
      this.value = value;
      this.pos = pos;
    }

    public Action action() {
      return action;
    }

    @ASTChild
    @Override
    public Optional<Expression> value() {
      return value;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pos;
    }
  }

  @ASTNode
  public static final class RunStatement extends Invocation
      implements Statement_RunStatement_ASTNode {
    private final Optional<EscalationHandler> escalationHandler;

    public RunStatement(
        Optional<String> target,
        AST.Ref agent,
        List<Expression> args,
        Optional<EscalationHandler> escalationHandler,
        Tokenizer.Pos pos) {
      super(Type.RUN_AGENT, target, agent, args, pos);
      this.escalationHandler = escalationHandler;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> args() {
      return argList();
    }

    @ASTChild
    @Override
    public Optional<EscalationHandler> escalationHandler() {
      return escalationHandler;
    }
  }

  @ASTNode
  public static final class CallStatement extends Invocation
      implements Statement_CallStatement_ASTNode {
    private final Optional<String> model;

    public CallStatement(
        Optional<String> target,
        AST.Ref prompt,
        List<Expression> args,
        Optional<String> model,
        Tokenizer.Pos pos) {
      super(Type.CALL_LLM, target, prompt, args, pos);
      this.model = model;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> args() {
      return argList();
    }

    /** {@code using model "x"} override. */
    public Optional<String> model() {
      return model;
    }
  }

  @ASTNode
  public static final class FlowCallStatement extends Invocation
      implements Statement_FlowCallStatement_ASTNode {
    public FlowCallStatement(
        Optional<String> target, AST.Ref flow, List<Expression> args, Tokenizer.Pos pos) {
      super(Type.RUN_FLOW, target, flow, args, pos);
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> args() {
      return argList();
    }
  }

  @ASTNode
  public static final class ReturnStatement extends Statement
      implements Statement_ReturnStatement_ASTNode {
    private final Optional<Expression> value;

    public ReturnStatement(Optional<Expression> value, Tokenizer.Pos pos) {
      super(Type.RETURN, pos);
      this.value = value;
    }

    @ASTChild
    @Override
    public Optional<Expression> value() {
      return value;
    }
  }

  @ASTNode
  public static final class PushStatement extends Statement
      implements Statement_PushStatement_ASTNode {
    private final Expression value;
    private final String list;
    private final Tokenizer.Pos listPos;

    public PushStatement(Expression value, String list, Tokenizer.Pos listPos, Tokenizer.Pos pos) {
      super(Type.PUSH, pos);
      this.value = value;
      this.list = list;
      this.listPos = listPos;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    public String list() {
      return list;
    }

    public Tokenizer.Pos listPos() {
      return listPos;
    }
  }

  @ASTNode
  public static final class ForLoop extends Statement implements Statement_ForLoop_ASTNode {
    private final String variable;
    private final Expression iterable;
    private final ImmutableList<Statement> body;

    public ForLoop(
        String variable, Expression iterable, List<Statement> body, Tokenizer.Pos pos) {
      super(Type.FOR, pos);
      this.variable = variable;
      this.iterable = iterable;
      this.body = ImmutableList.copyOf(body);
    }

    public String variable() {
      return variable;
    }

    @ASTChild
    @Override
    public Expression iterable() {
      return iterable;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    @Override
    public ImmutableList<ImmutableList<Statement>> nestedBodies() {
      return ImmutableList.of(body);
    }
  }

  /** {@code loop max N do} or the unbounded {@code loop do}. */
  @ASTNode
  public static final class LoopBlock extends Statement implements Statement_LoopBlock_ASTNode {
    private final Optional<Integer> max;
    private final ImmutableList<Statement> body;

    public LoopBlock(Optional<Integer> max, List<Statement> body, Tokenizer.Pos pos) {
      super(Type.LOOP, pos);
      this.max = max;
      this.body = ImmutableList.copyOf(body);
    }

    public Optional<Integer> max() {
      return max;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    @Override
    public ImmutableList<ImmutableList<Statement>> nestedBodies() {
      return ImmutableList.of(body);
    }
  }

  @ASTNode
  public static final class ParallelBlock extends Statement
      implements Statement_ParallelBlock_ASTNode {
    private final ImmutableList<Statement> body;

    public ParallelBlock(List<Statement> body, Tokenizer.Pos pos) {
      super(Type.PARALLEL, pos);
      this.body = ImmutableList.copyOf(body);
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    @Override
    public ImmutableList<ImmutableList<Statement>> nestedBodies() {
      return ImmutableList.of(body);
    }
  }

  @ASTNode
  public static final class IfBlock extends Statement implements Statement_IfBlock_ASTNode {
    private final Expression condition;
    private final ImmutableList<Statement> thenBody;
    private final ImmutableList<Statement> elseBody;

    public IfBlock(
        Expression condition,
        List<Statement> thenBody,
        List<Statement> elseBody,
        Tokenizer.Pos pos) {
      super(Type.IF, pos);
      this.condition = condition;
      this.thenBody = ImmutableList.copyOf(thenBody);
      this.elseBody = ImmutableList.copyOf(elseBody);
    }

    @ASTChild
    @Override
    public Expression condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> thenBody() {
      return thenBody;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> elseBody() {
      return elseBody;
    }

    @Override
    public ImmutableList<ImmutableList<Statement>> nestedBodies() {
      return ImmutableList.of(thenBody, elseBody);
    }
  }

  @ASTNode
  public static final class WhenClause implements Statement_WhenClause_ASTNode {
    private final Expression pattern;
    private final Statement statement;

    public WhenClause(Expression pattern, Statement statement) {
      this.pattern = pattern;
      this.statement = statement;
    }

    @ASTChild
    @Override
    public Expression pattern() {
      return pattern;
    }

    @ASTChild
    @Override
    public Statement statement() {
      return statement;
    }

    @Override
    public Tokenizer.Pos pos() {
      return pattern.pos();
    }
  }

  @ASTNode
  public static final class MatchBlock extends Statement implements Statement_MatchBlock_ASTNode {
    private final Expression subject;
    private final ImmutableList<WhenClause> clauses;
    private final Optional<Statement> otherwise;

    public MatchBlock(
        Expression subject,
        List<WhenClause> clauses,
        Optional<Statement> otherwise,
        Tokenizer.Pos pos) {
      super(Type.MATCH, pos);
      this.subject = subject;
      this.clauses = ImmutableList.copyOf(clauses);
      this.otherwise = otherwise;
    }

    @ASTChild
    @Override
    public Expression subject() {
      return subject;
    }

    @ASTChild
    @Override
    public ImmutableList<WhenClause> clauses() {
      return clauses;
    }

    @ASTChild
    @Override
    public Optional<Statement> otherwise() {
      return otherwise;
    }

    @Override
    public ImmutableList<ImmutableList<Statement>> nestedBodies() {
      ImmutableList.Builder<ImmutableList<Statement>> bodies = ImmutableList.builder();
      for (WhenClause clause : clauses) {
        bodies.add(ImmutableList.of(clause.statement()));
      }
      otherwise.ifPresent(s -> bodies.add(ImmutableList.of(s)));
      return bodies.build();
    }
  }

  /** {@code on failure:}; runs when an earlier statement of the enclosing flow fails. */
  @ASTNode
  public static final class FailureBlock extends Statement
      implements Statement_FailureBlock_ASTNode {
    private final ImmutableList<Statement> body;

    public FailureBlock(List<Statement> body, Tokenizer.Pos pos) {
      super(Type.FAILURE, pos);
      this.body = ImmutableList.copyOf(body);
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    @Override
    public ImmutableList<ImmutableList<Statement>> nestedBodies() {
      return ImmutableList.of(body);
    }
  }

  @ASTNode
  public static final class Log extends Statement implements Statement_Log_ASTNode {
    private final Expression message;

    public Log(Expression message, Tokenizer.Pos pos) {
      super(Type.LOG, pos);
      this.message = message;
    }

    @ASTChild
    @Override
    public Expression message() {
      return message;
    }
  }

  @ASTNode
  public static final class Notify extends Statement implements Statement_Notify_ASTNode {
    private final Expression message;

    public Notify(Expression message, Tokenizer.Pos pos) {
      super(Type.NOTIFY, pos);
      this.message = message;
    }

    @ASTChild
    @Override
    public Expression message() {
      return message;
    }
  }

  @ASTNode
  public static final class EscalateToHuman extends Statement
      implements Statement_EscalateToHuman_ASTNode {
    private final Optional<Expression> message;

    public EscalateToHuman(Optional<Expression> message, Tokenizer.Pos pos) {
      super(Type.ESCALATE_TO_HUMAN, pos);
      this.message = message;
    }

    @ASTChild
    @Override
    public Optional<Expression> message() {
      return message;
    }
  }

  @ASTNode
  public static final class Continue extends Statement implements Statement_Continue_ASTNode {
    public Continue(Tokenizer.Pos pos) {
      super(Type.CONTINUE, pos);
    }
  }

  @ASTNode
  public static final class Abort extends Statement implements Statement_Abort_ASTNode {
    private final Optional<Expression> reason;

    public Abort(Optional<Expression> reason, Tokenizer.Pos pos) {
      super(Type.ABORT, pos);
      this.reason = reason;
    }

    @ASTChild
    @Override
    public Optional<Expression> reason() {
      return reason;
    }
  }

  @ASTNode
  public static final class MaskAction extends Statement implements Statement_MaskAction_ASTNode {
    private final AST.Ref guardrail;

    public MaskAction(AST.Ref guardrail, Tokenizer.Pos pos) {
      super(Type.MASK, pos);
      this.guardrail = guardrail;
    }

    public AST.Ref guardrail() {
      return guardrail;
    }
  }

  /** {@code block if GUARDRAIL} or {@code block if <expr>}. */
  @ASTNode
  public static final class BlockAction extends Statement
      implements Statement_BlockAction_ASTNode {
    private final Optional<AST.Ref> guardrail;
    private final Optional<Expression> condition;

    public BlockAction(
        Optional<AST.Ref> guardrail, Optional<Expression> condition, Tokenizer.Pos pos) {
      super(Type.BLOCK, pos);
      this.guardrail = guardrail;
      this.condition = condition;
    }

    public Optional<AST.Ref> guardrail() {
      return guardrail;
    }

    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }
  }

  /** {@code warn if <expr>} or {@code warn <message>}. */
  @ASTNode
  public static final class WarnAction extends Statement implements Statement_WarnAction_ASTNode {
    private final Optional<Expression> condition;
    private final Optional<Expression> message;

    public WarnAction(
        Optional<Expression> condition, Optional<Expression> message, Tokenizer.Pos pos) {
      super(Type.WARN, pos);
      this.condition = condition;
      this.message = message;
    }

    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }

    @ASTChild
    @Override
    public Optional<Expression> message() {
      return message;
    }
  }

  @ASTNode
  public static final class RetryAction extends Statement
      implements Statement_RetryAction_ASTNode {
    private final Expression message;
    private final Optional<Expression> condition;

    public RetryAction(Expression message, Optional<Expression> condition, Tokenizer.Pos pos) {
      super(Type.RETRY, pos);
      this.message = message;
      this.condition = condition;
    }

    @ASTChild
    @Override
    public Expression message() {
      return message;
    }

    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }
  }
}
