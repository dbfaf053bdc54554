package spark;

import java.io.IOException;
import java.util.List;

/** Runs an external command to completion and reports its exit status. */
public interface CommandRunner {
  int run(List<String> command) throws IOException, InterruptedException;

  /** Starts a real process that shares this process's standard streams. */
  static CommandRunner inheritIo() {
    return command -> {
      ProcessBuilder builder = new ProcessBuilder(command).inheritIO();
      Process process = builder.start();
      try {
        return process.waitFor();
      } catch (InterruptedException ex) {
        process.destroy();
        throw ex;
      }
    };
  }
}
