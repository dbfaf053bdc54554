package spark;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.template.soy.data.SanitizedContent.ContentKind;

/**
 * Translates a whole Spark source file into a Rust program, runtime included.
 *
 * <p>Translation takes two passes over the lines. The first collects every static declaration into
 * a {@link StaticRegistry}; the second translates each line against the completed registry, so a
 * static is rewritten wherever it is referenced, whether before or after its declaration.
 */
public final class ProgramTranslator {

  @AutoValue
  public abstract static class TranslationResult {
    /** The complete Rust program: lint header, translated lines and runtime prelude. */
    public abstract String program();

    /** The translated lines alone, one entry per source line. */
    public abstract ImmutableList<String> translatedLines();

    public abstract StaticRegistry statics();

    public static TranslationResult create(
        String program, ImmutableList<String> translatedLines, StaticRegistry statics) {
      return new AutoValue_ProgramTranslator_TranslationResult(program, translatedLines, statics);
    }
  }

  private static final Escaper RUST_STRING_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('\"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  private final CompilerOptions options;

  public ProgramTranslator(CompilerOptions options) {
    this.options = options;
  }

  public TranslationResult translate(String source) {
    return translate("<source>", source);
  }

  public TranslationResult translate(String file, String source) {
    ImmutableList<String> lines = splitLines(source);
    StaticRegistry statics = collectStatics(file, lines);

    LineTranslator lineTranslator = new LineTranslator(file, statics);
    ImmutableList.Builder<String> translated = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      translated.add(lineTranslator.translate(i, lines.get(i)));
    }
    ImmutableList<String> translatedLines = translated.build();

    return TranslationResult.create(
        render(Joiner.on('\n').join(translatedLines), statics), translatedLines, statics);
  }

  static StaticRegistry collectStatics(String file, List<String> lines) {
    StaticRegistry.Builder builder = StaticRegistry.builder();
    for (int i = 0; i < lines.size(); i++) {
      Optional<String> name = LineTranslator.declaredStatic(file, i, lines.get(i));
      name.ifPresent(builder::register);
    }
    return builder.build();
  }

  /** Splits on any line terminator. A trailing terminator does not start another line. */
  static ImmutableList<String> splitLines(String source) {
    List<String> lines = Splitter.onPattern("\r\n|\r|\n").splitToList(source);
    if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
      lines = lines.subList(0, lines.size() - 1);
    }
    return ImmutableList.copyOf(lines);
  }

  private String render(String body, StaticRegistry statics) {
    Map<String, Object> data = new HashMap<>();
    data.put("body", body);
    data.put("inputPath", RUST_STRING_ESCAPER.escape(options.runtimeInputPath()));
    data.put("outputPath", RUST_STRING_ESCAPER.escape(options.runtimeOutputPath()));
    data.put("staticNames", statics.names().asList());

    return RuntimeTemplateHolder.tofu()
        .newRenderer("spark.runtime.program")
        .setContentKind(ContentKind.TEXT)
        .setData(data)
        .render();
  }
}
