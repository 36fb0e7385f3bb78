package wfl;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Produces the raw token stream of a workflow source file.
 *
 * <p>Line structure is preserved through {@link Kind#NEWLINE} tokens, whose text is the newline
 * followed by the leading whitespace of the next non-blank line; {@link Indenter} turns those into
 * block markers. Newlines inside brackets, blank lines and {@code #} comments produce no tokens.
 */
public class Tokenizer {
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    // 0-based.
    public int lineNumber() {
      return lineNumber;
    }

    // 0-based.
    public int column() {
      return column;
    }

    public Pos addColumns(int columns) {
      return new Pos(file, lineNumber, column + columns);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(Pos::file)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public String toString() {
      return String.format("%s:%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  public enum Kind {
    NAME("name"),
    VAR("variable"),
    PATH("path"),
    STRING("string"),
    TRIPLE_STRING("triple-quoted string"),
    NUMBER("number"),
    OP("punctuation"),
    NEWLINE("end of line"),
    INDENT("indented block"),
    DEDENT("end of block"),
    EOF("end of file");

    private final String description;

    Kind(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  @AutoValue
  public abstract static class Token {
    public abstract Kind kind();

    // For VAR the name without '$'; for strings the raw text between the quotes.
    public abstract String text();

    public abstract Pos pos();

    public static Token create(Kind kind, String text, Pos pos) {
      return new AutoValue_Tokenizer_Token(kind, text, pos);
    }

    public boolean is(Kind kind, String text) {
      return kind() == kind && text().equals(text);
    }

    public String describe() {
      switch (kind()) {
        case NAME:
        case OP:
        case NUMBER:
        case PATH:
          return "'" + text() + "'";
        case VAR:
          return "'$" + text() + "'";
        default:
          return kind().description();
      }
    }
  }

  private static final ImmutableSet<String> TWO_CHAR_OPS =
      ImmutableSet.of("->", "==", "!=", "<=", ">=");
  private static final String ONE_CHAR_OPS = ":=,.()[]{}<>~+-*/?";

  public static final char QUOTE = '\"';
  public static final String TRIPLE_QUOTE = "\"\"\"";

  private final String file;
  private final String content;
  private int index = 0;
  private int line = 0;
  private int col = 0;

  // Open brackets with their positions; newlines are insignificant while non-empty.
  private final Deque<Token> brackets = new ArrayDeque<>();
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private Token last = null;

  public Tokenizer(String file, String content) {
    this.file = file;
    this.content = content;
  }

  public ImmutableList<Token> tokenize() throws CompilerException {
    while (index < content.length()) {
      char ch = content.charAt(index);
      if (ch == '\n') {
        if (brackets.isEmpty()) {
          readNewline();
        } else {
          advance(1);
        }
      } else if (ch == ' ' || ch == '\t' || ch == '\r') {
        advance(1);
      } else if (ch == '#') {
        skipComment();
      } else if (content.startsWith(TRIPLE_QUOTE, index)) {
        readTripleString();
      } else if (ch == QUOTE) {
        readString();
      } else if (ch == '$' && index + 1 < content.length() && isNameStart(peek(1))) {
        readVar();
      } else if (content.startsWith("./", index) || content.startsWith("../", index)) {
        readPath(pos(), index);
      } else if (isNameStart(ch)) {
        readName();
      } else if (Character.isDigit(ch)) {
        readNumber();
      } else {
        readOp();
      }
    }

    if (!brackets.isEmpty()) {
      Token open = brackets.peek();
      throw new CompilerException(open.pos(), String.format("unclosed '%s'", open.text()));
    }

    emit(Token.create(Kind.EOF, "", pos()));
    return tokens.build();
  }

  private void readNewline() {
    Pos newlinePos = pos();
    advance(1);
    // Skip blank and comment-only lines; the indentation of the next real line is kept.
    while (true) {
      int start = index;
      while (index < content.length()
          && (content.charAt(index) == ' '
              || content.charAt(index) == '\t'
              || content.charAt(index) == '\r')) {
        advance(1);
      }
      if (index >= content.length()) {
        break;
      }
      char ch = content.charAt(index);
      if (ch == '#') {
        skipComment();
      }
      if (index < content.length() && content.charAt(index) == '\n') {
        advance(1);
        continue;
      }
      if (index >= content.length()) {
        break;
      }

      if (last != null && last.kind() != Kind.NEWLINE) {
        emit(Token.create(Kind.NEWLINE, "\n" + content.substring(start, index), newlinePos));
      }
      return;
    }

    if (last != null && last.kind() != Kind.NEWLINE) {
      emit(Token.create(Kind.NEWLINE, "\n", newlinePos));
    }
  }

  private void skipComment() {
    while (index < content.length() && content.charAt(index) != '\n') {
      advance(1);
    }
  }

  private void readTripleString() throws CompilerException {
    Pos start = pos();
    int end = content.indexOf(TRIPLE_QUOTE, index + 3);
    while (end >= 0 && isEscaped(end)) {
      end = content.indexOf(TRIPLE_QUOTE, end + 1);
    }
    if (end < 0) {
      throw new CompilerException(start, "unterminated triple-quoted string");
    }
    String text = content.substring(index + 3, end);
    advance(end + 3 - index);
    emit(Token.create(Kind.TRIPLE_STRING, text, start));
  }

  private void readString() throws CompilerException {
    Pos start = pos();
    int i = index + 1;
    while (i < content.length()) {
      char ch = content.charAt(i);
      if (ch == '\\') {
        i += 2;
        continue;
      }
      if (ch == '\n') {
        break;
      }
      if (ch == QUOTE) {
        String text = content.substring(index + 1, i);
        advance(i + 1 - index);
        emit(Token.create(Kind.STRING, text, start));
        return;
      }
      i++;
    }
    throw new CompilerException(start, "unterminated string");
  }

  private boolean isEscaped(int at) {
    int backslashes = 0;
    for (int i = at - 1; i >= 0 && content.charAt(i) == '\\'; i--) {
      backslashes++;
    }
    return backslashes % 2 == 1;
  }

  private void readVar() {
    Pos start = pos();
    int i = index + 1;
    while (i < content.length() && isNamePart(content.charAt(i))) {
      i++;
    }
    String name = content.substring(index + 1, i);
    advance(i - index);
    emit(Token.create(Kind.VAR, name, start));
  }

  private void readName() {
    Pos start = pos();
    int begin = index;
    int i = index + 1;
    while (i < content.length()) {
      char ch = content.charAt(i);
      if (isNamePart(ch)) {
        i++;
      } else if (ch == '-' && i + 1 < content.length() && isNamePart(content.charAt(i + 1))) {
        // Internal dashes: tool-call, gpt-4.
        i += 2;
      } else {
        break;
      }
    }

    if (i + 1 < content.length() && content.charAt(i) == '/' && isPathPart(content.charAt(i + 1))) {
      advance(i - index);
      readPath(start, begin);
      return;
    }

    String name = content.substring(index, i);
    advance(i - index);
    emit(Token.create(Kind.NAME, name, start));
  }

  private void readPath(Pos start, int begin) {
    int i = index;
    while (i < content.length() && isPathPart(content.charAt(i))) {
      i++;
    }
    advance(i - index);
    emit(Token.create(Kind.PATH, content.substring(begin, i), start));
  }

  private void readNumber() {
    Pos start = pos();
    int i = index;
    while (i < content.length() && Character.isDigit(content.charAt(i))) {
      i++;
    }
    if (i + 1 < content.length()
        && content.charAt(i) == '.'
        && Character.isDigit(content.charAt(i + 1))) {
      i++;
      while (i < content.length() && Character.isDigit(content.charAt(i))) {
        i++;
      }
    }
    String text = content.substring(index, i);
    advance(i - index);
    emit(Token.create(Kind.NUMBER, text, start));
  }

  private void readOp() throws CompilerException {
    Pos start = pos();
    if (index + 1 < content.length()
        && TWO_CHAR_OPS.contains(content.substring(index, index + 2))) {
      String op = content.substring(index, index + 2);
      advance(2);
      emit(Token.create(Kind.OP, op, start));
      return;
    }

    char ch = content.charAt(index);
    if (ONE_CHAR_OPS.indexOf(ch) < 0) {
      throw new CompilerException(start, String.format("unexpected character '%c'", ch));
    }

    Token token = Token.create(Kind.OP, String.valueOf(ch), start);
    if (ch == '(' || ch == '[' || ch == '{') {
      brackets.push(token);
    } else if (ch == ')' || ch == ']' || ch == '}') {
      if (brackets.isEmpty() || !closes(brackets.peek().text().charAt(0), ch)) {
        throw new CompilerException(start, String.format("unmatched '%c'", ch));
      }
      brackets.pop();
    }
    advance(1);
    emit(token);
  }

  private static boolean closes(char open, char close) {
    return (open == '(' && close == ')')
        || (open == '[' && close == ']')
        || (open == '{' && close == '}');
  }

  private static boolean isNameStart(char ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
  }

  private static boolean isNamePart(char ch) {
    return isNameStart(ch) || (ch >= '0' && ch <= '9');
  }

  private static boolean isPathPart(char ch) {
    return isNamePart(ch) || ch == '.' || ch == ':' || ch == '/' || ch == '-';
  }

  private char peek(int ahead) {
    return content.charAt(index + ahead);
  }

  private void advance(int count) {
    for (int i = 0; i < count; i++) {
      if (content.charAt(index) == '\n') {
        line++;
        col = 0;
      } else {
        col++;
      }
      index++;
    }
  }

  private void emit(Token token) {
    tokens.add(token);
    last = token;
  }

  private Pos pos() {
    return new Pos(file, line, col);
  }
}
