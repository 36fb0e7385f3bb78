package wfl;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * Writes generated Java one line at a time, tracking indentation and the source position of each
 * mapped line.
 */
final class CodeEmitter {
  private static final int INDENT_WIDTH = 2;

  private final StringBuilder out = new StringBuilder();
  private final List<SourceMapping> mappings = new ArrayList<>();
  private final boolean sourceComments;
  private int depth = 0;
  private int line = 1;

  CodeEmitter(boolean sourceComments) {
    this.sourceComments = sourceComments;
  }

  void emit(String code) {
    Verify.verify(code.indexOf('\n') < 0, "multi-line emit: %s", code);
    if (!code.isEmpty()) out.append(Strings.repeat(" ", depth * INDENT_WIDTH)).append(code);
    out.append('\n');
    line++;
  }

  /** Emits a line generated from {@code pos}, preceded by a {@code // file:line} comment. */
  void emit(String code, Tokenizer.Pos pos) {
    if (sourceComments) {
      emit(String.format("// %s:%d", pos.file(), Math.max(pos.lineNumber(), 0) + 1));
    }
    mappings.add(SourceMapping.at(line, pos));
    emit(code);
  }

  void blank() {
    emit("");
  }

  void indent() {
    depth++;
  }

  void dedent() {
    Verify.verify(depth > 0, "unbalanced dedent");
    depth--;
  }

  /** Line number the next emitted line will have. */
  int line() {
    return line;
  }

  String source() {
    return out.toString();
  }

  ImmutableList<SourceMapping> mappings() {
    return ImmutableList.copyOf(mappings);
  }
}
