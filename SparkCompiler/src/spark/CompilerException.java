package spark;

import java.io.PrintStream;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;
  private final String errorMsg;

  public CompilerException(Tokenizer.Pos pos, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public void print(PrintStream out) {
    if (pos.lineNumber() < 0) {
      out.println(String.format("ERROR: %s %s", pos.file(), errorMsg));
    } else {
      out.println(
          String.format(
              "ERROR: %s@%d:%d %s", pos.file(), pos.lineNumber() + 1, pos.column() + 1, errorMsg));
    }
  }
}
