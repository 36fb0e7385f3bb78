package wfl;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import wfl.Tokenizer.Kind;
import wfl.Tokenizer.Token;

/** Decoding of string tokens: escapes, triple-quoted block dedent and {@code $var} splitting. */
final class StringTemplates {

  /** The literal value of a string token, with no interpolation. */
  static String constant(Token token) {
    StringBuilder sb = new StringBuilder();
    String text = body(token);
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (ch == '\\' && i + 1 < text.length()) {
        appendEscape(sb, text.charAt(++i));
      } else {
        sb.append(ch);
      }
    }
    return sb.toString();
  }

  static Expression.StringLiteral template(Token token) {
    String text = body(token);
    List<Expression.StringLiteral.Part> parts = new ArrayList<>();
    StringBuilder sb = new StringBuilder();

    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      if (ch == '\\' && i + 1 < text.length()) {
        appendEscape(sb, text.charAt(i + 1));
        i += 2;
      } else if (ch == '$' && i + 1 < text.length() && isNameStart(text.charAt(i + 1))) {
        if (sb.length() > 0) {
          parts.add(Expression.StringLiteral.Part.text(sb.toString()));
          sb.setLength(0);
        }
        int end = scanName(text, i + 1);
        String name = text.substring(i + 1, end);
        ImmutableList.Builder<String> path = ImmutableList.builder();
        while (end + 1 < text.length()
            && text.charAt(end) == '.'
            && isNameStart(text.charAt(end + 1))) {
          int segmentEnd = scanName(text, end + 1);
          path.add(text.substring(end + 1, segmentEnd));
          end = segmentEnd;
        }
        parts.add(Expression.StringLiteral.Part.variable(name, path.build()));
        i = end;
      } else {
        sb.append(ch);
        i++;
      }
    }
    if (sb.length() > 0 || parts.isEmpty()) {
      parts.add(Expression.StringLiteral.Part.text(sb.toString()));
    }
    return new Expression.StringLiteral(parts, token.pos());
  }

  private static String body(Token token) {
    return token.kind() == Kind.TRIPLE_STRING ? dedent(token.text()) : token.text();
  }

  // Drops the newline after the opening quotes and the whitespace-only line before the closing
  // ones, then removes the indentation shared by all non-blank lines.
  static String dedent(String raw) {
    List<String> lines = new ArrayList<>(Splitter.on('\n').splitToList(raw));
    if (lines.size() > 1 && CharMatcher.whitespace().matchesAllOf(lines.get(0))) {
      lines.remove(0);
    }
    if (lines.size() > 1 && CharMatcher.whitespace().matchesAllOf(lines.get(lines.size() - 1))) {
      lines.remove(lines.size() - 1);
    }

    int common = Integer.MAX_VALUE;
    for (String line : lines) {
      if (CharMatcher.whitespace().matchesAllOf(line)) continue;
      common = Math.min(common, CharMatcher.anyOf(" \t").negate().indexIn(line));
    }
    if (common == Integer.MAX_VALUE) common = 0;

    List<String> out = new ArrayList<>();
    for (String line : lines) {
      out.add(line.length() >= common ? line.substring(common) : line.trim());
    }
    return String.join("\n", out);
  }

  private static void appendEscape(StringBuilder sb, char escaped) {
    switch (escaped) {
      case 'n':
        sb.append('\n');
        break;
      case 't':
        sb.append('\t');
        break;
      case '"':
      case '\\':
      case '$':
        sb.append(escaped);
        break;
      default:
        // Unknown escapes such as the \d of a regex are kept as written.
        sb.append('\\').append(escaped);
        break;
    }
  }

  private static int scanName(String text, int start) {
    int i = start;
    while (i < text.length()
        && (isNameStart(text.charAt(i)) || Character.isDigit(text.charAt(i)))) {
      i++;
    }
    return i;
  }

  private static boolean isNameStart(char ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
  }

  private StringTemplates() {}
}
