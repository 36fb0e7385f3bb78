package wfl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graph;

/** Base of the analysis passes: walks the AST and collects diagnostics instead of throwing. */
abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  protected ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  protected void logError(ErrorCode code, Tokenizer.Pos pos, String msg) {
    diagnostics.add(Diagnostic.at(code, pos, msg));
  }

  protected void logError(ErrorCode code, Tokenizer.Pos pos, String msg, Optional<String> help) {
    diagnostics.add(Diagnostic.create(code, pos, msg, help));
  }

  protected void logWarning(ErrorCode code, Tokenizer.Pos pos, String msg, String help) {
    diagnostics.add(Diagnostic.at(code, pos, msg, help));
  }

  protected void takeDiagnostics(ErrorCollectingValidator other) {
    diagnostics.addAll(other.diagnostics);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  /**
   * Help text for an unresolved name: the closest candidate within two edits, or else the full list
   * of what is defined.
   */
  protected static Optional<String> suggest(
      String name, Collection<String> candidates, String what) {
    String best = null;
    int bestDistance = 3;
    for (String candidate : candidates) {
      int distance = editDistance(name, candidate);
      if (distance < bestDistance) {
        best = candidate;
        bestDistance = distance;
      }
    }
    if (best != null) {
      return Optional.of(String.format("did you mean '%s'?", best));
    }
    if (candidates.isEmpty()) {
      return Optional.of(String.format("no %s are defined", what));
    }
    return Optional.of(String.format("defined %s are: %s", what, Joiner.on(", ").join(candidates)));
  }

  static int editDistance(String a, String b) {
    int[] prev = new int[b.length() + 1];
    int[] cur = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      cur[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int substitute = prev[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
        cur[j] = Math.min(substitute, Math.min(prev[j], cur[j - 1]) + 1);
      }
      int[] tmp = prev;
      prev = cur;
      cur = tmp;
    }
    return prev[b.length()];
  }

  /**
   * Every distinct elementary cycle reached by a depth-first search that tracks the recursion
   * stack. Each cycle is returned as its path with the first node repeated at the end, rotated to
   * start at the node that comes first in the graph's node order.
   */
  protected static <T> ImmutableList<ImmutableList<T>> findCycles(Graph<T> graph) {
    List<T> order = new ArrayList<>(graph.nodes());
    Set<T> done = new HashSet<>();
    Set<List<T>> found = new LinkedHashSet<>();
    for (T node : order) {
      if (!done.contains(node)) {
        dfs(graph, node, new ArrayDeque<>(), new HashSet<>(), done, order, found);
      }
    }
    return found
        .stream()
        .map(ImmutableList::copyOf)
        .collect(ImmutableList.toImmutableList());
  }

  private static <T> void dfs(
      Graph<T> graph,
      T node,
      Deque<T> stack,
      Set<T> onStack,
      Set<T> done,
      List<T> order,
      Set<List<T>> found) {
    stack.addLast(node);
    onStack.add(node);
    for (T next : graph.successors(node)) {
      if (onStack.contains(next)) {
        List<T> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (T t : stack) {
          if (t.equals(next)) inCycle = true;
          if (inCycle) cycle.add(t);
        }
        found.add(canonical(cycle, order));
      } else if (!done.contains(next)) {
        dfs(graph, next, stack, onStack, done, order, found);
      }
    }
    stack.removeLast();
    onStack.remove(node);
    done.add(node);
  }

  private static <T> List<T> canonical(List<T> cycle, List<T> order) {
    int start = 0;
    for (int i = 1; i < cycle.size(); i++) {
      if (order.indexOf(cycle.get(i)) < order.indexOf(cycle.get(start))) start = i;
    }
    List<T> rotated = new ArrayList<>();
    for (int i = 0; i < cycle.size(); i++) {
      rotated.add(cycle.get((start + i) % cycle.size()));
    }
    rotated.add(rotated.get(0));
    return rotated;
  }
}
