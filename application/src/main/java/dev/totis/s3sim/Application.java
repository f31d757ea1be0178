package dev.totis.s3sim;

import dev.totis.s3sim.commands.S3SimCommand;
import java.util.Arrays;
import picocli.CommandLine;

public class Application {

  public static void main(String[] args) {
    if (Arrays.asList(args).contains("-v") || Arrays.asList(args).contains("--verbose")) {
      // must be set before the first logger is created
      System.setProperty("org.slf4j.simpleLogger.log.dev.totis.s3sim", "debug");
    }
    System.exit(commandLine(new S3SimCommand()).execute(args));
  }

  /** Errors print one line to stderr and exit with 1; usage errors keep picocli's exit code 2. */
  public static CommandLine commandLine(S3SimCommand root) {
    return new CommandLine(root)
        .setExecutionExceptionHandler(
            (e, cmd, parseResult) -> {
              cmd.getErr().println(cmd.getColorScheme().errorText("Error: " + e.getMessage()));
              return 1;
            });
  }
}
