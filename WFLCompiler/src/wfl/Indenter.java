package wfl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.ImmutableList;

import wfl.Tokenizer.Kind;
import wfl.Tokenizer.Token;

/**
 * Rewrites the raw token stream so that leading-whitespace depth becomes explicit {@code INDENT}
 * and {@code DEDENT} tokens. The result always ends with {@code NEWLINE}, the pending dedents and
 * {@code EOF}.
 */
public final class Indenter {
  public static final int TAB_WIDTH = 8;

  public static ImmutableList<Token> process(List<Token> raw) throws CompilerException {
    ImmutableList.Builder<Token> out = ImmutableList.builder();
    Deque<Integer> levels = new ArrayDeque<>();
    levels.push(0);

    if (!raw.isEmpty() && raw.get(0).kind() != Kind.EOF && raw.get(0).pos().column() != 0) {
      throw new CompilerException(
          raw.get(0).pos(), ErrorCode.E0008, "unexpected indentation at the start of the file");
    }

    Token previous = null;
    for (int i = 0; i < raw.size(); i++) {
      Token token = raw.get(i);
      switch (token.kind()) {
        case NEWLINE:
          {
            out.add(Token.create(Kind.NEWLINE, "\n", token.pos()));
            Token next = i + 1 < raw.size() ? raw.get(i + 1) : token;
            int width = width(token.text());
            if (width > levels.peek()) {
              levels.push(width);
              out.add(Token.create(Kind.INDENT, "", next.pos()));
            } else {
              while (width < levels.peek()) {
                levels.pop();
                out.add(Token.create(Kind.DEDENT, "", next.pos()));
              }
              if (width != levels.peek()) {
                throw new CompilerException(
                    next.pos(),
                    ErrorCode.E0008,
                    "unindent does not match any outer indentation level");
              }
            }
            break;
          }
        case EOF:
          {
            if (previous != null && previous.kind() != Kind.NEWLINE) {
              out.add(Token.create(Kind.NEWLINE, "\n", token.pos()));
            }
            while (levels.peek() > 0) {
              levels.pop();
              out.add(Token.create(Kind.DEDENT, "", token.pos()));
            }
            out.add(token);
            break;
          }
        default:
          out.add(token);
          break;
      }
      previous = token;
    }
    return out.build();
  }

  // Width of the whitespace after the last newline, with tabs advancing to the next tab stop.
  static int width(String newlineText) {
    int width = 0;
    for (int i = newlineText.lastIndexOf('\n') + 1; i < newlineText.length(); i++) {
      char ch = newlineText.charAt(i);
      if (ch == '\t') {
        width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
      } else if (ch == ' ') {
        width++;
      }
    }
    return width;
  }

  private Indenter() {}
}
