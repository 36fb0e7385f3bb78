package wfl;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/** Visiting helpers for the generated visitors, and control-flow facts about statements. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface obj, ASTVisitor<V> visitor, V value) {
    return obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Stream<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    for (Iterator<? extends ASTNodeInterface> iter = obj.iterator(); iter.hasNext(); ) {
      value = accept(iter.next(), visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {
    return obj.map(o -> accept(o, visitor, value)).orElse(value);
  }

  /**
   * Whether control can reach the end of {@code statement}. False for {@code return}, {@code
   * continue} and {@code abort}, and for branching statements all of whose branches end that way.
   * Loops always can: their exit conditions are evaluated at run time.
   */
  public static boolean completesNormally(Statement statement) {
    switch (statement.type()) {
      case RETURN:
      case CONTINUE:
      case ABORT:
        return false;
      case IF:
        {
          Statement.IfBlock s = statement.cast();
          return completesNormally(s.thenBody()) || completesNormally(s.elseBody());
        }
      case MATCH:
        {
          Statement.MatchBlock s = statement.cast();
          if (!s.otherwise().isPresent() || completesNormally(s.otherwise().get())) return true;
          return s.clauses().stream().anyMatch(c -> completesNormally(c.statement()));
        }
      default:
        return true;
    }
  }

  /** Whether control can reach the end of a statement list; an empty list trivially does. */
  public static boolean completesNormally(List<Statement> body) {
    for (Statement statement : body) {
      if (!completesNormally(statement)) return false;
    }
    return true;
  }

  /** The prefix of {@code body} that can be reached: everything up to the first dead end. */
  public static List<Statement> reachable(List<Statement> body) {
    for (int i = 0; i < body.size(); i++) {
      if (!completesNormally(body.get(i))) return body.subList(0, i + 1);
    }
    return body;
  }

  private ASTNodeUtils() {}
}
