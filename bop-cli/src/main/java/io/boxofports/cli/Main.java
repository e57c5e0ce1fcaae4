package io.boxofports.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "bop",
    description = "Resolve gateway port specifications and render result tables",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {PortsCommand.class, RenderCommand.class, CommandLine.HelpCommand.class})
public class Main implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_IO = 1;
  static final int EXIT_RESOLUTION = 2;

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = "--config",
      paramLabel = "FILE",
      description = "Configuration file (default: $BOP_CONFIG or ~/.boxofports/config.properties)")
  private Path configFile;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(System.out);
    return EXIT_OK;
  }

  BopConfig config() throws IOException {
    return BopConfig.load(configFile);
  }
}
