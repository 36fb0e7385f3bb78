package wfl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Formats diagnostics the way compilers like rustc do:
 *
 * <pre>
 * error[E0001]: undefined model 'fast'
 *   --> agent.wf:15:18
 *      |
 *   14 | prompt review:
 *   15 |     using model "fast"
 *      |                  ^^^^
 *   16 | ...
 *      |
 *      = help: defined models are: main, compact
 * </pre>
 */
public class DiagnosticRenderer {
  private static final int GUTTER_WIDTH = 5;
  private static final int CONTEXT_LINES = 1;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Map<String, ImmutableList<String>> sources = new HashMap<>();

  public DiagnosticRenderer addSource(String file, String content) {
    sources.put(file, ImmutableList.copyOf(Splitter.on('\n').split(content)));
    return this;
  }

  public String render(Diagnostic diagnostic) {
    StringBuilder out = new StringBuilder();
    out.append(diagnostic.severity().label())
        .append('[')
        .append(diagnostic.code())
        .append("]: ")
        .append(diagnostic.message())
        .append('\n');
    out.append("  --> ")
        .append(diagnostic.file())
        .append(':')
        .append(diagnostic.line())
        .append(':')
        .append(diagnostic.column())
        .append('\n');

    String gutter = Strings.repeat(" ", GUTTER_WIDTH);
    out.append(gutter).append("|\n");
    ImmutableList<String> lines = sources.get(diagnostic.file());
    int index = diagnostic.line() - 1;
    if (lines != null && index >= 0 && index < lines.size()) {
      for (int i = Math.max(0, index - CONTEXT_LINES);
          i < Math.min(lines.size(), index + CONTEXT_LINES + 1);
          i++) {
        out.append(Strings.padStart(Integer.toString(i + 1), GUTTER_WIDTH - 1, ' '))
            .append(" | ")
            .append(lines.get(i))
            .append('\n');
        if (i == index) {
          out.append(gutter).append("| ").append(carets(lines.get(i), diagnostic.column() - 1));
          out.append('\n');
        }
      }
      out.append(gutter).append("|\n");
    }
    if (diagnostic.help().isPresent()) {
      out.append(gutter).append("= help: ").append(diagnostic.help().get()).append('\n');
    }
    return out.toString();
  }

  // Tabs in the prefix are kept so the carets line up with the source.
  private static String carets(String line, int column) {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < column && i < line.length(); i++) {
      out.append(line.charAt(i) == '\t' ? '\t' : ' ');
    }
    int end = column;
    while (end < line.length() && !CharMatcher.whitespace().matches(line.charAt(end))) {
      end++;
    }
    return out.append(Strings.repeat("^", Math.max(1, end - column))).toString();
  }

  /** Every diagnostic, blank-line separated, followed by the summary line. */
  public String renderAll(List<Diagnostic> diagnostics) {
    if (diagnostics.isEmpty()) return "";
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < diagnostics.size(); i++) {
      if (i > 0) out.append('\n');
      out.append(render(diagnostics.get(i)));
    }
    out.append('\n').append(summary(diagnostics)).append('\n');
    return out.toString();
  }

  /** E.g. {@code Found 2 errors and 1 warning in agent.wf}. */
  public static String summary(List<Diagnostic> diagnostics) {
    long errors = diagnostics.stream().filter(Diagnostic::isError).count();
    long warnings = diagnostics.size() - errors;
    long files = diagnostics.stream().map(Diagnostic::file).distinct().count();

    StringBuilder counts = new StringBuilder();
    if (errors > 0) counts.append(plural(errors, "error"));
    if (warnings > 0) {
      if (errors > 0) counts.append(" and ");
      counts.append(plural(warnings, "warning"));
    }
    String where = files == 1 ? diagnostics.get(0).file() : files + " files";
    return "Found " + counts + " in " + where;
  }

  static String plural(long count, String noun) {
    return count + " " + noun + (count == 1 ? "" : "s");
  }

  public String toJson(List<Diagnostic> diagnostics, String file, Optional<FileStats> stats) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("version", "1.0");
    root.put("file", file);
    root.put("valid", diagnostics.stream().noneMatch(Diagnostic::isError));
    ArrayNode errors = root.putArray("errors");
    ArrayNode warnings = root.putArray("warnings");
    for (Diagnostic diagnostic : diagnostics) {
      (diagnostic.isError() ? errors : warnings).add(toJson(diagnostic));
    }
    if (stats.isPresent()) {
      ObjectNode node = root.putObject("stats");
      node.put("models", stats.get().models());
      node.put("agents", stats.get().agents());
      node.put("flows", stats.get().flows());
      node.put("handlers", stats.get().handlers());
    }
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("cannot serialize diagnostics", ex);
    }
  }

  private static ObjectNode toJson(Diagnostic diagnostic) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("severity", diagnostic.severity().label());
    node.put("code", diagnostic.code().name());
    node.put("message", diagnostic.message());
    ObjectNode location = node.putObject("location");
    location.put("file", diagnostic.file());
    location.put("line", diagnostic.line());
    location.put("column", diagnostic.column());
    diagnostic.help().ifPresent(help -> node.put("help", help));
    return node;
  }
}
