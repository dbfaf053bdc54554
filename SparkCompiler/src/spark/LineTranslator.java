package spark;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Translates one physical Spark line into Rust.
 *
 * <p>The line's leading spaces are kept as-is; the rest is trimmed, stripped of its trailing
 * comment, and rewritten by exactly one of the structural rules below (first match wins):
 *
 * <ol>
 *   <li>{@code struct Name ...}: gets a derive attribute on the line above.
 *   <li>{@code static name: type;}: becomes an empty {@code Option} cell, filled in by the prelude.
 *   <li>{@code let name;}: zero-filled at the binding site.
 *   <li>{@code if} statements: the condition is tested as an integer against zero.
 *   <li>{@code fn name(params)}: every parameter becomes mutable.
 * </ol>
 *
 * Every line also receives the keyword rewrites of {@link #rewriteKeywords} and has references to
 * registered statics replaced with {@link StaticRegistry#wrapperFor}.
 */
public final class LineTranslator {

  public static final String DERIVE_ATTRIBUTE = "#[derive(Debug, Copy, Clone, PartialEq, Eq)]";

  public static final String ZEROED = "unsafe { std::mem::zeroed() }";

  /** Name given to the program's own {@code main}, since the prelude defines the real one. */
  public static final String ENTRY_POINT = "main_";

  private static final ImmutableMap<String, String> KEYWORDS =
      ImmutableMap.<String, String>builder()
          .put("int", "usize")
          .put("let", "let mut")
          .put("type", "type_")
          .put("struct", "struct_")
          .put("static", "static mut")
          .put("fn", "unsafe fn")
          .build();

  private static final CharMatcher INDENT = CharMatcher.is(' ');

  // static NAME: TYPE;
  @AutoValue
  abstract static class StaticDeclaration {
    abstract String name();

    // Index of the first token after the colon.
    abstract int typeIndex();

    static StaticDeclaration create(String name, int typeIndex) {
      return new AutoValue_LineTranslator_StaticDeclaration(name, typeIndex);
    }
  }

  private final String file;
  private final StaticRegistry statics;

  public LineTranslator(String file, StaticRegistry statics) {
    this.file = file;
    this.statics = statics;
  }

  public String translate(String line) {
    return translate(0, line);
  }

  public String translate(int lineNumber, String line) {
    String indent = Strings.repeat(" ", line.length() - INDENT.trimLeadingFrom(line).length());
    String body = translateBody(tokenizeCode(file, lineNumber, line));
    return indent + body.replace("\n", "\n" + indent);
  }

  /**
   * Returns the static declared by {@code line}, under its rewritten name, if the line is a static
   * declaration.
   */
  public static Optional<String> declaredStatic(String file, int lineNumber, String line) {
    return parseStatic(tokenizeCode(file, lineNumber, line)).map(StaticDeclaration::name);
  }

  /**
   * Tokenizes the trimmed line with its comment removed.
   *
   * <p>Only a {@code //} outside string and char literals starts a comment.
   */
  static ImmutableList<Tokenizer.Token> tokenizeCode(String file, int lineNumber, String line) {
    ImmutableList<Tokenizer.Token> tokens = new Tokenizer(file, lineNumber, line).tokenize();
    int end = tokens.size();
    if (end > 0 && tokens.get(end - 1).type() == Tokenizer.Type.COMMENT) end--;
    while (end > 0 && tokens.get(end - 1).type() == Tokenizer.Type.WHITESPACE) end--;
    int start = 0;
    while (start < end && tokens.get(start).type() == Tokenizer.Type.WHITESPACE) start++;
    return tokens.subList(start, end);
  }

  private String translateBody(ImmutableList<Tokenizer.Token> tokens) {
    if (tokens.isEmpty()) {
      return "";
    }

    List<Tokenizer.Token> significant = significant(tokens);
    Tokenizer.Token first = significant.get(0);

    if (first.isIdentifier("struct")
        && significant.size() > 1
        && significant.get(1).isIdentifier()) {
      return DERIVE_ATTRIBUTE + "\n" + first.text() + rewrite(tokens.subList(1, tokens.size()));
    }

    Optional<StaticDeclaration> declaration = parseStatic(tokens);
    if (declaration.isPresent()) {
      return translateStatic(tokens, declaration.get());
    }

    ImmutableList<Tokenizer.Token> rewritten = rewriteTokens(tokens);
    if (first.isIdentifier("let") && tokens.stream().noneMatch(t -> t.isSymbol('='))) {
      return translateUninitializedLet(tokens, rewritten);
    }

    Optional<String> conditional = translateConditional(tokens, rewritten);
    if (conditional.isPresent()) {
      return conditional.get();
    }

    if (first.isIdentifier("fn") && hasParameters(tokens)) {
      return translateFunctionWithParameters(tokens, rewritten);
    }

    return Tokenizer.join(rewritten);
  }

  private String translateStatic(
      ImmutableList<Tokenizer.Token> tokens, StaticDeclaration declaration) {
    int typeEnd = tokens.size();
    if (tokens.get(typeEnd - 1).isSymbol(';')) typeEnd--;
    String type = rewrite(tokens.subList(declaration.typeIndex(), typeEnd)).trim();
    return "static mut " + declaration.name() + ": Option<" + type + "> = None;";
  }

  private static String translateUninitializedLet(
      ImmutableList<Tokenizer.Token> tokens, ImmutableList<Tokenizer.Token> rewritten) {
    int end = tokens.size();
    if (tokens.get(end - 1).isSymbol(';')) end--;
    return Tokenizer.join(rewritten.subList(0, end)).trim() + " = " + ZEROED + ";";
  }

  // if COND {   |   } else if COND {   |   if COND:
  private static Optional<String> translateConditional(
      ImmutableList<Tokenizer.Token> tokens, ImmutableList<Tokenizer.Token> rewritten) {
    int ifIndex = -1;
    for (int i = 0; i < tokens.size(); i++) {
      Tokenizer.Token token = tokens.get(i);
      if (!token.isSignificant()) {
        continue;
      } else if (token.isIdentifier("if")) {
        ifIndex = i;
        break;
      } else if (!token.isSymbol('}') && !token.isIdentifier("else")) {
        return Optional.empty();
      }
    }

    int last = tokens.size() - 1;
    if (ifIndex < 0
        || last <= ifIndex + 1
        || !(tokens.get(last).isSymbol('{') || tokens.get(last).isSymbol(':'))) {
      return Optional.empty();
    }

    String head = Tokenizer.join(rewritten.subList(0, ifIndex + 1));
    String condition = Tokenizer.join(rewritten.subList(ifIndex + 1, last)).trim();
    if (condition.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(head + " (" + condition + ") as usize != 0 {");
  }

  private static boolean hasParameters(ImmutableList<Tokenizer.Token> tokens) {
    List<Tokenizer.Token> significant = significant(tokens);
    for (int i = 0; i + 1 < significant.size(); i++) {
      if (significant.get(i).isSymbol('(')) {
        return !significant.get(i + 1).isSymbol(')');
      }
    }
    return false;
  }

  // Prefixes each top-level parameter of the first parameter list with "mut".
  private static String translateFunctionWithParameters(
      ImmutableList<Tokenizer.Token> tokens, ImmutableList<Tokenizer.Token> rewritten) {
    StringBuilder result = new StringBuilder();
    int depth = 0;
    boolean expectParameter = false;
    for (int i = 0; i < tokens.size(); i++) {
      Tokenizer.Token token = tokens.get(i);
      if (expectParameter && token.isSignificant()) {
        if (!token.isSymbol(')') && !token.isIdentifier("mut")) {
          result.append("mut ");
        }
        expectParameter = false;
      }
      result.append(rewritten.get(i).text());

      if (depth < 0) {
        // Past the parameter list.
        continue;
      } else if (depth == 0) {
        if (token.isSymbol('(')) {
          depth = 1;
          expectParameter = true;
        }
      } else if (token.isSymbol('(') || token.isSymbol('[') || token.isSymbol('<')) {
        depth++;
      } else if (token.isSymbol(')') || token.isSymbol(']') || isClosingAngle(tokens, i)) {
        depth = depth == 1 ? -1 : depth - 1;
      } else if (token.isSymbol(',') && depth == 1) {
        expectParameter = true;
      }
    }
    return result.toString();
  }

  // '>' of "->" does not close anything.
  private static boolean isClosingAngle(List<Tokenizer.Token> tokens, int index) {
    return tokens.get(index).isSymbol('>') && !tokens.get(index - 1).isSymbol('-');
  }

  static Optional<StaticDeclaration> parseStatic(List<Tokenizer.Token> tokens) {
    List<Integer> significant = new ArrayList<>();
    for (int i = 0; i < tokens.size() && significant.size() < 4; i++) {
      if (tokens.get(i).isSignificant()) significant.add(i);
    }
    if (significant.size() > 1 && tokens.get(significant.get(1)).isIdentifier("mut")) {
      significant.remove(1);
    }
    if (significant.size() < 3
        || !tokens.get(significant.get(0)).isIdentifier("static")
        || !tokens.get(significant.get(1)).isIdentifier()
        || !tokens.get(significant.get(2)).isSymbol(':')) {
      return Optional.empty();
    }

    // A keyword such as "let" rewrites to two words and cannot name a static.
    String name = rewriteKeyword(tokens, significant.get(1));
    if (!Identifiers.isIdentifier(name)) {
      return Optional.empty();
    }
    return Optional.of(StaticDeclaration.create(name, significant.get(2) + 1));
  }

  private String rewrite(List<Tokenizer.Token> tokens) {
    return Tokenizer.join(rewriteTokens(tokens));
  }

  private ImmutableList<Tokenizer.Token> rewriteTokens(List<Tokenizer.Token> tokens) {
    return statics.rewriteReferences(rewriteKeywords(tokens));
  }

  /**
   * Applies the keyword and type rewrites that every line receives. The result has one token per
   * input token.
   */
  static ImmutableList<Tokenizer.Token> rewriteKeywords(List<Tokenizer.Token> tokens) {
    ImmutableList.Builder<Tokenizer.Token> result = ImmutableList.builder();
    for (int i = 0; i < tokens.size(); i++) {
      Tokenizer.Token token = tokens.get(i);
      String text = rewriteKeyword(tokens, i);
      result.add(text.equals(token.text()) ? token : token.withText(text));
    }
    return result.build();
  }

  private static String rewriteKeyword(List<Tokenizer.Token> tokens, int index) {
    Tokenizer.Token token = tokens.get(index);
    if (!token.isIdentifier()) {
      return token.text();
    }

    String text = token.text();
    if (text.equals("main")
        && index + 2 < tokens.size()
        && tokens.get(index + 1).isSymbol('(')
        && tokens.get(index + 2).isSymbol(')')) {
      return ENTRY_POINT;
    } else if ((text.equals("let") || text.equals("static")) && nextIsMut(tokens, index)) {
      return text;
    }
    return KEYWORDS.getOrDefault(text, text);
  }

  private static boolean nextIsMut(List<Tokenizer.Token> tokens, int index) {
    for (int i = index + 1; i < tokens.size(); i++) {
      if (tokens.get(i).isSignificant()) {
        return tokens.get(i).isIdentifier("mut");
      }
    }
    return false;
  }

  private static List<Tokenizer.Token> significant(List<Tokenizer.Token> tokens) {
    List<Tokenizer.Token> result = new ArrayList<>();
    for (Tokenizer.Token token : tokens) {
      if (token.isSignificant()) result.add(token);
    }
    return result;
  }
}
