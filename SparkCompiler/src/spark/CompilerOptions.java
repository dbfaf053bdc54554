package spark;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Settings shared by the translator and the compilation driver. */
@AutoValue
public abstract class CompilerOptions {

  /** File the emitted program reads its input bytes from, relative to its working directory. */
  public abstract String runtimeInputPath();

  /** File the emitted program writes its output bytes to. */
  public abstract String runtimeOutputPath();

  /** Native compiler invocation; the path of the emitted file is appended. */
  public abstract ImmutableList<String> compilerCommand();

  /** Extension given to the emitted file, including the dot. */
  public abstract String targetExtension();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setRuntimeInputPath("test.txt")
        .setRuntimeOutputPath("out.bin")
        .setCompilerCommand(ImmutableList.of("rustc", "-O"))
        .setTargetExtension(".rs");
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setRuntimeInputPath(String runtimeInputPath);

    public abstract Builder setRuntimeOutputPath(String runtimeOutputPath);

    public abstract Builder setCompilerCommand(List<String> compilerCommand);

    public abstract Builder setTargetExtension(String targetExtension);

    public abstract CompilerOptions build();
  }
}
