package spark;

import java.util.List;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * Splits one physical source line into tokens. Tokenization never fails: concatenating the token
 * texts always reproduces the input line exactly, whatever it contains.
 */
public class Tokenizer {
  public static class Pos {
    /** A position that refers to a file as a whole rather than to a line in it. */
    public static Pos wholeFile(String file) {
      return new Pos(file, -1, -1);
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

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Pos)) {
        return false;
      }
      Pos that = (Pos) obj;
      return file.equals(that.file) && lineNumber == that.lineNumber && column == that.column;
    }

    @Override
    public int hashCode() {
      return (file.hashCode() * 31 + lineNumber) * 31 + column;
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  public enum Type {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHAR,
    COMMENT,
    WHITESPACE,
    SYMBOL;
  }

  @AutoValue
  public abstract static class Token {
    public abstract Type type();

    public abstract String text();

    public abstract Pos pos();

    public boolean isIdentifier() {
      return type() == Type.IDENTIFIER;
    }

    public boolean isIdentifier(String name) {
      return isIdentifier() && text().equals(name);
    }

    public boolean isSymbol(char symbol) {
      return type() == Type.SYMBOL && text().charAt(0) == symbol;
    }

    // Whitespace and comments carry no meaning for the rewrite rules.
    public boolean isSignificant() {
      return type() != Type.WHITESPACE && type() != Type.COMMENT;
    }

    public Token withText(String text) {
      return create(type(), text, pos());
    }

    public static Token create(Type type, String text, Pos pos) {
      return new AutoValue_Tokenizer_Token(type, text, pos);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  public static final char QUOTE = '\"';
  public static final char APOSTROPHE = '\'';
  private static final char ESCAPE = '\\';

  private final String file;
  private final int lineNumber;
  private final String line;
  private int col = 0;

  public Tokenizer(String file, int lineNumber, String line) {
    this.file = file;
    this.lineNumber = lineNumber;
    this.line = line;
  }

  public static ImmutableList<Token> tokenize(String line) {
    return new Tokenizer("<line>", 0, line).tokenize();
  }

  public static String join(List<Token> tokens) {
    return tokens.stream().map(Token::text).collect(Collectors.joining());
  }

  public ImmutableList<Token> tokenize() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (col < line.length()) {
      int start = col;
      char ch = line.charAt(col);

      Type type;
      if (CharMatcher.whitespace().matches(ch)) {
        type = Type.WHITESPACE;
        skipWhile(CharMatcher.whitespace());
      } else if (ch == '/' && peek(1) == '/') {
        // Comments run to the end of the line.
        type = Type.COMMENT;
        col = line.length();
      } else if (ch == QUOTE || ch == APOSTROPHE) {
        type = ch == QUOTE ? Type.STRING : Type.CHAR;
        readLiteral(ch);
      } else if (Identifiers.isIdentifierStart(ch)) {
        type = Type.IDENTIFIER;
        skipIdentifierChars();
      } else if (Identifiers.isIdentifierChar(ch)) {
        type = Type.NUMBER;
        skipIdentifierChars();
      } else {
        type = Type.SYMBOL;
        col++;
      }

      tokens.add(Token.create(type, line.substring(start, col), new Pos(file, lineNumber, start)));
    }
    return tokens.build();
  }

  private char peek(int ahead) {
    int index = col + ahead;
    return index < line.length() ? line.charAt(index) : '\0';
  }

  private void skipWhile(CharMatcher matcher) {
    while (col < line.length() && matcher.matches(line.charAt(col))) col++;
  }

  private void skipIdentifierChars() {
    while (col < line.length() && Identifiers.isIdentifierChar(line.charAt(col))) col++;
  }

  // An unterminated literal swallows the rest of the line.
  private void readLiteral(char quote) {
    col++;
    while (col < line.length()) {
      char ch = line.charAt(col);
      if (ch == ESCAPE) {
        col += 2;
        continue;
      }
      col++;
      if (ch == quote) {
        break;
      }
    }
    col = Math.min(col, line.length());
  }
}
