package spark;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The global mutable variables ("statics") declared by one program.
 *
 * <p>Statics are emitted as {@code Option} cells that the runtime prelude fills in before the
 * entry point runs, so every reference to one is rewritten into a checked dereference of its cell.
 */
public final class StaticRegistry {
  private static final StaticRegistry EMPTY = new StaticRegistry(ImmutableSet.of());

  public static StaticRegistry empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The expression that replaces a reference to the static {@code name}. */
  public static String wrapperFor(String name) {
    return "(*" + name + ".as_mut().unwrap())";
  }

  public static final class Builder {
    private final Set<String> names = new LinkedHashSet<>();

    private Builder() {}

    /** Returns false if {@code name} was already registered. */
    public boolean register(String name) {
      Preconditions.checkArgument(Identifiers.isIdentifier(name), "not an identifier: %s", name);
      return names.add(name);
    }

    public StaticRegistry build() {
      return new StaticRegistry(ImmutableSet.copyOf(names));
    }
  }

  private final ImmutableSet<String> names;

  private StaticRegistry(ImmutableSet<String> names) {
    this.names = names;
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  /** Registered names in declaration order. */
  public ImmutableSet<String> names() {
    return names;
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  public String rewriteReferences(String line) {
    return Tokenizer.join(rewriteReferences(Tokenizer.tokenize(line)));
  }

  /**
   * Replaces each identifier token naming a registered static with its wrapper expression. The
   * result has one token per input token. Literals, comments, longer identifiers and member
   * accesses such as {@code point.name} are left alone.
   */
  public ImmutableList<Tokenizer.Token> rewriteReferences(List<Tokenizer.Token> tokens) {
    if (names.isEmpty()) {
      return ImmutableList.copyOf(tokens);
    }

    ImmutableList.Builder<Tokenizer.Token> result = ImmutableList.builder();
    for (int i = 0; i < tokens.size(); i++) {
      Tokenizer.Token token = tokens.get(i);
      if (token.isIdentifier() && names.contains(token.text()) && !isMemberAccess(tokens, i)) {
        result.add(token.withText(wrapperFor(token.text())));
      } else {
        result.add(token);
      }
    }
    return result.build();
  }

  // A single '.' before the name; '..' is a range and does not count.
  private static boolean isMemberAccess(List<Tokenizer.Token> tokens, int index) {
    return index > 0
        && tokens.get(index - 1).isSymbol('.')
        && (index < 2 || !tokens.get(index - 2).isSymbol('.'));
  }

  @Override
  public String toString() {
    return "StaticRegistry" + names;
  }
}
