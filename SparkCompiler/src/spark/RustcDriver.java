package spark;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/**
 * Translates a Spark file, writes the Rust program next to it and hands it to the native compiler.
 * The compiler's diagnostics go straight to the console; its exit status is returned as-is.
 */
public final class RustcDriver {
  private final CompilerOptions options;
  private final CommandRunner runner;

  public RustcDriver(CompilerOptions options, CommandRunner runner) {
    this.options = options;
    this.runner = runner;
  }

  /** {@code dir/prog.spk} becomes {@code dir/prog.rs}. */
  public File targetFile(File source) {
    return new File(
        source.getParentFile(),
        Files.getNameWithoutExtension(source.getName()) + options.targetExtension());
  }

  /** Translates {@code source} and writes the result to {@link #targetFile}. */
  public File translate(File source) throws IOException {
    String text = Files.asCharSource(source, StandardCharsets.UTF_8).read();
    ProgramTranslator.TranslationResult result =
        new ProgramTranslator(options).translate(source.getPath(), text);

    File target = targetFile(source);
    Files.asCharSink(target, StandardCharsets.UTF_8).write(result.program());
    return target;
  }

  /** Translates {@code source}, then runs the compiler on the written file. */
  public int compile(File source) throws CompilerException, IOException {
    File target = translate(source);

    ImmutableList<String> command =
        ImmutableList.<String>builder()
            .addAll(options.compilerCommand())
            .add(target.getPath())
            .build();
    try {
      return runner.run(command);
    } catch (IOException ex) {
      throw new CompilerException(
          Tokenizer.Pos.wholeFile(target.getPath()),
          String.format("could not run '%s': %s", command.get(0), ex.getMessage()),
          ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CompilerException(
          Tokenizer.Pos.wholeFile(target.getPath()), "interrupted while compiling", ex);
    }
  }
}
