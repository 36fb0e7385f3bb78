package wfl;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;

/** Definition counts of one source unit, as shown by {@code check}. */
@AutoValue
public abstract class FileStats {
  public abstract int models();

  public abstract int agents();

  public abstract int flows();

  public abstract int handlers();

  public static FileStats create(int models, int agents, int flows, int handlers) {
    return new AutoValue_FileStats(models, agents, flows, handlers);
  }

  static FileStats of(AST ast) {
    return create(
        ast.declarations(AST.Declaration.Type.MODEL).size(),
        ast.declarations(AST.Declaration.Type.AGENT).size(),
        ast.declarations(AST.Declaration.Type.FLOW).size(),
        ast.declarations(AST.Declaration.Type.HANDLER).size());
  }

  /** E.g. {@code valid (2 models, 1 agent)}; zero counts are left out. */
  public String summary() {
    List<String> parts = new ArrayList<>();
    if (models() > 0) parts.add(DiagnosticRenderer.plural(models(), "model"));
    if (agents() > 0) parts.add(DiagnosticRenderer.plural(agents(), "agent"));
    if (flows() > 0) parts.add(DiagnosticRenderer.plural(flows(), "flow"));
    if (handlers() > 0) parts.add(DiagnosticRenderer.plural(handlers(), "handler"));
    return parts.isEmpty() ? "valid" : "valid (" + Joiner.on(", ").join(parts) + ")";
  }
}
