package spark;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

public class CompilerMain {

  static final String USAGE = "Usage: $COMPILER spark_file";

  public static void main(String[] args) {
    int status =
        run(args, CompilerOptions.defaults(), CommandRunner.inheritIo(), System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the compiler and returns the process exit status. */
  static int run(
      String[] args,
      CompilerOptions options,
      CommandRunner runner,
      PrintStream out,
      PrintStream err) {
    if (args.length != 1) {
      err.println(USAGE);
      return 1;
    }

    File source = new File(args[0]);
    RustcDriver driver = new RustcDriver(options, runner);
    int status;
    try {
      status = driver.compile(source);
    } catch (CompilerException ex) {
      ex.print(err);
      return 1;
    } catch (IOException ex) {
      err.println(String.format("ERROR: %s %s", source, ex.getMessage()));
      return 1;
    }

    out.println("Wrote " + driver.targetFile(source));
    if (status != 0) {
      out.println(
          String.format("%s exited with status %d", options.compilerCommand().get(0), status));
    }
    return status;
  }
}
