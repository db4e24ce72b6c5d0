package dfs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

/** Produces a tokenization of the input, collecting every lexical error along the way. */
public class Tokenizer {
  public static class Pos implements Comparable<Pos> {
    private static final String BLOCK_FILE = "<block>";
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    /** A position in a block graph rather than in source text. */
    public static Pos block(int index) {
      return new Pos(BLOCK_FILE, -1, index);
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

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    public boolean isBlock() {
      return file.equals(BLOCK_FILE);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(p -> p.file().toString())
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      Pos that = (Pos) o;
      return file.equals(that.file) && lineNumber == that.lineNumber && column == that.column;
    }

    @Override
    public int hashCode() {
      return Objects.hash(file, lineNumber, column);
    }

    @Override
    public String toString() {
      if (isBlock()) {
        return "block #" + column;
      }
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  public enum TokenKind {
    NUMBER,
    STRING,
    TEXT,
    RAW_NAME,
    IDENTIFIER,
    KEYWORD,
    SYMBOL,
    GAME_VALUE,
    EVENT_HEAD,
    COMPOSITE_HEAD,
    ERROR,
    EOF;
  }

  @AutoValue
  public abstract static class Token {
    public abstract TokenKind kind();

    // Literal contents with escapes resolved, the word, or the symbol character.
    public abstract String text();

    public abstract Pos pos();

    public abstract Pos end();

    public boolean is(TokenKind kind) {
      return kind() == kind;
    }

    public boolean is(TokenKind kind, String text) {
      return kind() == kind && text().equals(text);
    }

    public boolean isSymbol(char symbol) {
      return is(TokenKind.SYMBOL, String.valueOf(symbol));
    }

    public boolean isKeyword(String keyword) {
      return is(TokenKind.KEYWORD, keyword);
    }

    public String describe() {
      switch (kind()) {
        case EOF:
          return "end of file";
        case SYMBOL:
          return "'" + text() + "'";
        case STRING:
          return "string literal";
        case TEXT:
          return "text literal";
        case NUMBER:
          return "number " + text();
        case COMPOSITE_HEAD:
          return "'" + text() + "('";
        default:
          return kind().name().toLowerCase().replace('_', ' ') + " '" + text() + "'";
      }
    }

    public static Token create(TokenKind kind, String text, Pos pos, Pos end) {
      return new AutoValue_Tokenizer_Token(kind, text, pos, end);
    }

    @Override
    public String toString() {
      return kind() + "(" + text() + ")";
    }
  }

  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "fn", "proc", "line", "local", "game", "save", "else", "repeat", "forever", "while",
          "ifp", "ife", "ifg", "ifv", "start", "use");

  public static final ImmutableSet<String> COMPOSITE_HEADS =
      ImmutableSet.of(
          "Location", "Vector", "Sound", "Potion", "Particle", "Item", "Entity", "Effect",
          "Number");

  private static final String SYMBOLS = "@+-*/(){}.:!?,;=";

  public static final char STRING_QUOTE = '\'';
  public static final char TEXT_QUOTE = '"';
  public static final char RAW_QUOTE = '`';

  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));
  private static final CharMatcher IDENTIFIER_PART =
      IDENTIFIER_START.or(CharMatcher.inRange('0', '9'));
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');

  private final String file;
  private final ImmutableList<String> lines;
  private int line = 0;
  private int col = -1; // In the initial state we have not read anything yet.
  private char ch = ' ';

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();
  private final List<CompilerException> errors = new ArrayList<>();

  public Tokenizer(String file, String content) {
    this.file = file;
    this.lines =
        ImmutableList.copyOf(Iterables.transform(Splitter.on('\n').split(content), s -> s + "\n"));
  }

  public static boolean isIdentifier(String word) {
    return !word.isEmpty()
        && IDENTIFIER_START.matches(word.charAt(0))
        && IDENTIFIER_PART.matchesAllOf(word)
        && !KEYWORDS.contains(word);
  }

  public ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  public ImmutableList<Token> tokenize() {
    while (advance()) {
      if (skipCommentsOrWhitespace()) {
        continue;
      }

      Pos start = pos();
      if (DIGIT.matches(ch)) {
        readNumber(start);
      } else if (ch == STRING_QUOTE) {
        readQuoted(start, TokenKind.STRING);
      } else if (ch == TEXT_QUOTE) {
        readQuoted(start, TokenKind.TEXT);
      } else if (ch == RAW_QUOTE) {
        readQuoted(start, TokenKind.RAW_NAME);
      } else if (ch == '$') {
        readGameValue(start);
      } else if (ch == '@' && canPeek() && IDENTIFIER_START.matches(peek())) {
        advance();
        add(TokenKind.EVENT_HEAD, readIdentifier(), start);
      } else if (IDENTIFIER_START.matches(ch)) {
        readWord(start);
      } else if (SYMBOLS.indexOf(ch) >= 0) {
        add(TokenKind.SYMBOL, String.valueOf(ch), start);
      } else {
        error(start, String.format("unexpected character '%c'", ch));
        add(TokenKind.ERROR, String.valueOf(ch), start);
      }
    }

    Pos eof = new Pos(file, lines.size() - 1, lines.get(lines.size() - 1).length() - 1);
    tokensBuilder.add(Token.create(TokenKind.EOF, "", eof, eof));
    return tokensBuilder.build();
  }

  private void error(Pos pos, String msg) {
    errors.add(new CompilerException(CompilerException.Kind.LEX, pos, msg));
  }

  private void add(TokenKind kind, String text, Pos start) {
    tokensBuilder.add(Token.create(kind, text, start, pos()));
  }

  private boolean canPeek() {
    return canPeek(1);
  }

  private boolean canPeek(int ahead) {
    if (line >= lines.size()) {
      return false;
    }

    int nCol = col + ahead;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine).length();
      if (++nLine == lines.size()) return false;
    }
    return true;
  }

  private char peek() {
    return peek(1);
  }

  private char peek(int ahead) {
    int nCol = col + ahead;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine++).length();
    }
    return lines.get(nLine).charAt(nCol);
  }

  private boolean advance() {
    if (line >= lines.size()) return false;

    col++;
    while (col >= lines.get(line).length()) {
      col -= lines.get(line).length();
      if (++line == lines.size()) return false;
    }

    ch = lines.get(line).charAt(col);
    return true;
  }

  private Pos pos() {
    return new Pos(file, line, col);
  }

  private boolean skipCommentsOrWhitespace() {
    if (Character.isWhitespace(ch)) {
      return true;
    } else if (ch != '/' || !canPeek()) {
      return false;
    }

    char second = peek();
    if (second == '/') {
      // Skip the rest of the line.
      col = lines.get(line).length() - 1;
      return true;
    } else if (second == '*') {
      Pos start = pos();
      advance();
      while (advance()) {
        if (ch == '*' && canPeek() && peek() == '/') {
          advance();
          return true;
        }
      }
      error(start, "unterminated comment");
      return true;
    }
    return false;
  }

  private void readNumber(Pos start) {
    StringBuilder digits = new StringBuilder().append(ch);
    boolean seenDot = false;
    boolean malformed = false;
    while (canPeek()) {
      char next = peek();
      if (DIGIT.matches(next)) {
        digits.append(next);
      } else if (next == '_') {
        // Digit grouping.
      } else if (next == '.' && canPeek(2) && DIGIT.matches(peek(2))) {
        malformed |= seenDot;
        seenDot = true;
        digits.append(next);
      } else {
        break;
      }
      advance();
    }

    if (malformed) {
      error(start, "malformed number: " + digits);
      add(TokenKind.ERROR, digits.toString(), start);
    } else if (Double.isInfinite(Double.parseDouble(digits.toString()))) {
      error(start, "number out of range: " + digits);
      add(TokenKind.ERROR, digits.toString(), start);
    } else {
      add(TokenKind.NUMBER, digits.toString(), start);
    }
  }

  private void readQuoted(Pos start, TokenKind kind) {
    char quote = ch;
    StringBuilder text = new StringBuilder();
    boolean malformed = false;
    while (true) {
      if (!canPeek() || peek() == '\n') {
        error(start, String.format("unterminated %s literal", kind.name().toLowerCase()));
        add(TokenKind.ERROR, text.toString(), start);
        return;
      }

      advance();
      if (ch == quote) {
        break;
      } else if (ch != '\\') {
        text.append(ch);
      } else if (!canPeek()) {
        malformed = true;
      } else {
        advance();
        if (ch == 'n') {
          text.append('\n');
        } else if (ch == '\\' || ch == STRING_QUOTE || ch == TEXT_QUOTE || ch == RAW_QUOTE) {
          text.append(ch);
        } else if (kind == TokenKind.TEXT) {
          // Markup escapes are kept for the runtime to interpret.
          text.append('\\').append(ch);
        } else {
          error(pos(), String.format("illegal escape '\\%c'", ch));
          malformed = true;
        }
      }
    }

    add(malformed ? TokenKind.ERROR : kind, text.toString(), start);
  }

  private String readIdentifier() {
    StringBuilder word = new StringBuilder().append(ch);
    while (canPeek() && IDENTIFIER_PART.matches(peek())) {
      advance();
      word.append(ch);
    }
    return word.toString();
  }

  private void readGameValue(Pos start) {
    if (!canPeek() || !IDENTIFIER_START.matches(peek())) {
      error(start, "expected a game value name after '$'");
      add(TokenKind.ERROR, "$", start);
      return;
    }

    advance();
    String name = readIdentifier();
    if (canPeek(2) && peek() == ':' && IDENTIFIER_START.matches(peek(2))) {
      advance(); // ':'
      advance();
      name = name + ":" + readIdentifier();
    }
    add(TokenKind.GAME_VALUE, name, start);
  }

  private void readWord(Pos start) {
    String word = readIdentifier();
    if (COMPOSITE_HEADS.contains(word) && canPeek() && peek() == '(') {
      advance();
      add(TokenKind.COMPOSITE_HEAD, word, start);
    } else if (KEYWORDS.contains(word)) {
      add(TokenKind.KEYWORD, word, start);
    } else {
      add(TokenKind.IDENTIFIER, word, start);
    }
  }
}
