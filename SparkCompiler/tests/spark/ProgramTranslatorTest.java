package spark;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ProgramTranslatorTest {

  private static final String HEADER =
      "#![allow(unused_mut, unused_unsafe, unused_parens, bad_style, dead_code,"
          + " unused_variables)]\n";

  private static String source(String... lines) {
    return Arrays.asList(lines).stream().collect(Collectors.joining("\n", "", "\n"));
  }

  private static ProgramTranslator.TranslationResult translate(String... lines) {
    return new ProgramTranslator(CompilerOptions.defaults()).translate(source(lines));
  }

  private static int occurrences(String text, String needle) {
    int count = 0;
    for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
      count++;
    }
    return count;
  }

  @Test
  public void emptyProgram() {
    String program = translate().program();

    assertThat(program).startsWith(HEADER);
    assertThat(program).endsWith("unsafe fn init_statics() {\n}\n");
  }

  @Test
  public void layout() {
    ProgramTranslator.TranslationResult result = translate("fn main() {", "}");

    assertThat(result.translatedLines()).containsExactly("unsafe fn main_() {", "}").inOrder();
    assertThat(result.program())
        .startsWith(HEADER + "unsafe fn main_() {\n}\n\nfn __syscall_exit(code: usize) {\n");
  }

  @Test
  public void runtime() {
    String program = translate("fn main() {", "}").program();

    assertThat(program).contains("println!(\"Exit code: {}\", code);");
    assertThat(program).contains("unsafe fn __syscall_read() -> usize {");
    assertThat(program).contains("        256\n");
    assertThat(program).contains("unsafe fn __syscall_write(byte: usize) {");
    assertThat(program).contains("writer.flush().expect(\"failed to flush\");");
    assertThat(program).contains("fs::File::open(\"test.txt\")");
    assertThat(program).contains("fs::File::create(\"out.bin\")");
    assertThat(program).contains("        init_statics();\n        main_();\n");
  }

  @Test
  public void runtimePathsAreConfigurable() {
    CompilerOptions options =
        CompilerOptions.builder()
            .setRuntimeInputPath("C:\\data\\in \"1\".bin")
            .setRuntimeOutputPath("result.bin")
            .build();

    String program = new ProgramTranslator(options).translate("").program();

    assertThat(program).contains("fs::File::open(\"C:\\\\data\\\\in \\\"1\\\".bin\")");
    assertThat(program).contains("fs::File::create(\"result.bin\")");
  }

  @Test
  public void staticRoundTrip() {
    ProgramTranslator.TranslationResult result =
        translate(
            "static n: int;",
            "",
            "fn bump(by: int) {",
            "    n = n + by; // increment",
            "}",
            "",
            "fn main() {",
            "    bump(2);",
            "    __syscall_exit(n);",
            "}");

    String n = StaticRegistry.wrapperFor("n");
    assertThat(result.statics().names()).containsExactly("n");
    assertThat(result.translatedLines())
        .containsExactly(
            "static mut n: Option<usize> = None;",
            "",
            "unsafe fn bump(mut by: usize) {",
            "    " + n + " = " + n + " + by;",
            "}",
            "",
            "unsafe fn main_() {",
            "    bump(2);",
            "    __syscall_exit(" + n + ");",
            "}")
        .inOrder();
    assertThat(occurrences(result.program(), "n = Some(std::mem::zeroed());")).isEqualTo(1);

    ImmutableList<String> lines = result.translatedLines();
    for (String line : lines.subList(1, lines.size())) {
      assertThat(
              Tokenizer.tokenize(line.replace(n, ""))
                  .stream()
                  .anyMatch(t -> t.isIdentifier("n")))
          .isFalse();
    }
  }

  @Test
  public void duplicateStaticIsInitializedOnce() {
    String program = translate("static n: int;", "static n: int;").program();

    assertThat(occurrences(program, "    n = Some(std::mem::zeroed());\n")).isEqualTo(1);
  }

  @Test
  public void staticsAreInitializedInDeclarationOrder() {
    String program = translate("static b: int;", "static a: Point;").program();

    assertThat(program)
        .endsWith(
            "unsafe fn init_statics() {\n"
                + "    b = Some(std::mem::zeroed());\n"
                + "    a = Some(std::mem::zeroed());\n"
                + "}\n");
  }

  @Test
  public void staticReferencedBeforeItsDeclaration() {
    ProgramTranslator.TranslationResult result =
        translate("fn reset() {", "    total = 0;", "}", "static total: int;");

    assertThat(result.translatedLines().get(1))
        .isEqualTo("    " + StaticRegistry.wrapperFor("total") + " = 0;");
  }

  @Test
  public void noStateLeaksBetweenRuns() {
    ProgramTranslator translator = new ProgramTranslator(CompilerOptions.defaults());
    translator.translate(source("static leaked: int;"));

    ProgramTranslator.TranslationResult second = translator.translate(source("leaked = 1;"));

    assertThat(second.statics().isEmpty()).isTrue();
    assertThat(second.translatedLines()).containsExactly("leaked = 1;");
    assertThat(second.program()).doesNotContain("leaked = Some(");
  }

  @Test
  public void keywordNamedStaticIsNotRegistered() {
    ProgramTranslator.TranslationResult result =
        translate("static let: int;", "static static: int;", "static n: int;");

    assertThat(result.statics().names()).containsExactly("n");
    assertThat(result.translatedLines().get(0)).isEqualTo("static mut let mut: usize;");
    assertThat(result.program()).doesNotContain("let mut = Some(");
  }

  @Test
  public void lineEndings() {
    assertThat(ProgramTranslator.splitLines("a\r\nb\nc")).containsExactly("a", "b", "c").inOrder();
    assertThat(ProgramTranslator.splitLines("a\n\n")).containsExactly("a", "").inOrder();
    assertThat(ProgramTranslator.splitLines("")).isEmpty();
  }

  @Test
  public void oneOutputLinePerSourceLine() {
    ProgramTranslator.TranslationResult result =
        translate("struct Point {", "    x: int,", "    y: int,", "}", "", "// done");

    assertThat(result.translatedLines()).hasSize(6);
    assertThat(result.translatedLines().get(0))
        .isEqualTo(LineTranslator.DERIVE_ATTRIBUTE + "\nstruct Point {");
    assertThat(result.translatedLines().get(5)).isEmpty();
  }
}
