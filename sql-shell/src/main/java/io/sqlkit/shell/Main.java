package io.sqlkit.shell;

import io.sqlkit.core.completion.SchemaField;
import io.sqlkit.shell.schema.SchemaLoadException;
import io.sqlkit.shell.schema.SchemaLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "sqlkit",
    description = "Interactive SQL editor shell with completion and highlighting",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

  @CommandLine.Option(
      names = {"-t", "--tables"},
      split = ",",
      description = "Table names offered for completion")
  private List<String> tables = new ArrayList<>();

  @CommandLine.Option(
      names = {"-s", "--schema"},
      description = "JSON schema file with the fields offered for completion")
  private Path schemaFile;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner")
  private boolean quiet;

  @CommandLine.Option(
      names = {"-e", "--execute"},
      description = "Run a single line and exit")
  private String execute;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    List<SchemaField> fields = List.of();
    if (schemaFile != null) {
      if (!Files.exists(schemaFile)) {
        System.err.println("Error: schema file not found: " + schemaFile);
        return 1;
      }
      try {
        fields = new SchemaLoader().load(schemaFile);
      } catch (SchemaLoadException e) {
        System.err.println("Error: " + e.getMessage() + " (" + e.getType() + ")");
        return 1;
      }
    }

    try (Shell shell = new Shell(new ShellState(tables, fields))) {
      if (execute != null) {
        shell.execute(execute);
      } else {
        shell.run(quiet);
      }
      return 0;
    }
  }
}
