package wfl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Checks that every variable is written before it is read.
 *
 * <p>Scopes nest as global, flow or handler, and block. Builtins and variables assigned in
 * {@code on start} or {@code after start} handlers are global. Any assignment defines its variable
 * in the enclosing flow or handler from that statement on, in source order; loop variables live
 * only in their loop body.
 * Interpolations inside strings are resolved leniently at run time and are not checked here.
 */
class ScopeValidator extends ErrorCollectingValidator {

  // Variables read by an expression, in evaluation order.
  private static final class Reads extends VoidDefaultASTVisitor {
    private final List<Expression> reads;

    Reads(List<Expression> reads) {
      this.reads = reads;
    }

    @Override
    public void visitImpl(Expression.VarRef node) {
      reads.add(node);
    }

    @Override
    public void visitImpl(Expression.PropertyAccess node) {
      reads.add(node);
    }
  }

  private final SymbolTable symbols;
  private final Deque<Set<String>> scopes = new ArrayDeque<>();

  ScopeValidator(SymbolTable symbols) {
    this.symbols = symbols;
  }

  private static ImmutableSet<String> handlerVariables(AST.HandlerDef.Event event) {
    switch (event) {
      case INPUT:
        return ImmutableSet.of("message", "input");
      case OUTPUT:
        return ImmutableSet.of("message", "output");
      case TOOL_CALL:
        return ImmutableSet.of("message", "tool");
      case TOOL_RESULT:
        return ImmutableSet.of("message", "tool", "tool_result");
      default:
        return ImmutableSet.of("message");
    }
  }

  @Override
  public void visitImpl(AST.FlowDef node) {
    Set<String> global = new HashSet<>(SymbolTable.BUILTIN_VARIABLES);
    global.addAll(symbols.globals());
    scopes.push(global);
    scopes.push(new HashSet<>(node.params()));
    checkBody(node.body());
    scopes.clear();
  }

  @Override
  public void visitImpl(AST.HandlerDef node) {
    Set<String> global = new HashSet<>(SymbolTable.BUILTIN_VARIABLES);
    boolean start = node.event() == AST.HandlerDef.Event.START;
    // A start handler is where globals are written, so it sees them only once assigned.
    if (!start || node.timing() == AST.HandlerDef.Timing.AFTER) {
      global.addAll(symbols.globals());
    }
    scopes.push(global);
    scopes.push(new HashSet<>(handlerVariables(node.event())));
    checkBody(node.body());
    scopes.clear();
  }

  private void checkBody(List<Statement> body) {
    for (Statement statement : body) {
      check(statement);
    }
  }

  private void define(String name) {
    // The flow or handler scope is the one just above the global scope.
    Iterator<Set<String>> outermost = scopes.descendingIterator();
    outermost.next();
    outermost.next().add(name);
  }

  private boolean isDefined(String name) {
    for (Set<String> scope : scopes) {
      if (scope.contains(name)) return true;
    }
    return false;
  }

  private void read(String name, Tokenizer.Pos pos) {
    if (isDefined(name)) return;
    Set<String> visible = new HashSet<>();
    scopes.forEach(visible::addAll);
    logError(
        ErrorCode.E0002,
        pos,
        String.format("variable '$%s' is used before it is defined", name),
        suggest(name, visible, "variables"));
  }

  private void reads(ASTNodeInterface node) {
    List<Expression> found = new ArrayList<>();
    node.accept(new Reads(found), null);
    for (Expression e : found) {
      if (e.type() == Expression.Type.VAR_REF) {
        read(e.<Expression.VarRef>cast().name(), e.pos());
      } else {
        read(e.<Expression.PropertyAccess>cast().base(), e.pos());
      }
    }
  }

  private void block(List<Statement> body, Set<String> locals) {
    scopes.push(locals);
    checkBody(body);
    scopes.pop();
  }

  private void check(Statement statement) {
    switch (statement.type()) {
      case ASSIGNMENT:
        {
          Statement.Assignment s = statement.cast();
          reads(s.value());
          define(s.target());
          break;
        }
      case PROPERTY_ASSIGNMENT:
        {
          Statement.PropertyAssignment s = statement.cast();
          reads(s.value());
          read(s.variable(), s.pos());
          break;
        }
      case RUN_AGENT:
      case CALL_LLM:
      case RUN_FLOW:
        {
          Statement.Invocation s = statement.cast();
          reads(s);
          s.target().ifPresent(this::define);
          break;
        }
      case PUSH:
        {
          Statement.PushStatement s = statement.cast();
          reads(s.value());
          read(s.list(), s.listPos());
          break;
        }
      case FOR:
        {
          Statement.ForLoop s = statement.cast();
          reads(s.iterable());
          Set<String> locals = new HashSet<>();
          locals.add(s.variable());
          block(s.body(), locals);
          break;
        }
      case IF:
        {
          Statement.IfBlock s = statement.cast();
          reads(s.condition());
          block(s.thenBody(), new HashSet<>());
          block(s.elseBody(), new HashSet<>());
          break;
        }
      case MATCH:
        {
          Statement.MatchBlock s = statement.cast();
          reads(s.subject());
          for (Statement.WhenClause clause : s.clauses()) {
            reads(clause.pattern());
            check(clause.statement());
          }
          s.otherwise().ifPresent(this::check);
          break;
        }
      case FAILURE:
        {
          Statement.FailureBlock s = statement.cast();
          Set<String> locals = new HashSet<>();
          locals.add("error");
          block(s.body(), locals);
          break;
        }
      case LOOP:
      case PARALLEL:
        for (List<Statement> body : statement.nestedBodies()) {
          block(body, new HashSet<>());
        }
        break;
      default:
        // Simple statements: only their expressions read variables.
        reads(statement);
        break;
    }
  }
}
