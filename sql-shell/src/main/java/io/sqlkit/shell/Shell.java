package io.sqlkit.shell;

import io.sqlkit.core.SqlEditorSupport;
import io.sqlkit.core.lexer.TextRange;
import io.sqlkit.shell.cli.CommandDispatcher;
import io.sqlkit.shell.cli.SqlHighlighter;
import io.sqlkit.shell.cli.SqlShellCompleter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Interactive SQL editor shell. */
public final class Shell implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Shell.class);

  private final Terminal terminal;
  private final LineReader lineReader;
  private final SqlHighlighter highlighter;
  private final CommandDispatcher dispatcher;
  private boolean running = true;

  public Shell(ShellState state) throws IOException {
    this.terminal = TerminalBuilder.builder().system(true).build();
    SqlEditorSupport editor = new SqlEditorSupport();
    this.highlighter = new SqlHighlighter(editor);

    Path histPath = Paths.get(System.getProperty("user.home"), ".sqlkit", "history");
    try {
      Files.createDirectories(histPath.getParent());
    } catch (IOException e) {
      log.warn("Cannot create history directory {}: {}", histPath.getParent(), e.getMessage());
    }

    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variable(LineReader.HISTORY_FILE, histPath)
            .history(new DefaultHistory())
            .completer(new SqlShellCompleter(editor, state))
            .highlighter(highlighter)
            .build();
    this.dispatcher =
        new CommandDispatcher(
            editor,
            state,
            new CommandDispatcher.IO() {
              @Override
              public void println(String s) {
                terminal.writer().println(s);
                terminal.flush();
              }

              @Override
              public void printf(String fmt, Object... args) {
                terminal.writer().printf(fmt, args);
                terminal.flush();
              }

              @Override
              public void error(String s) {
                terminal.writer().println("Error: " + s);
                terminal.flush();
              }

              @Override
              public void printQuery(String sql, TextRange errorRange) {
                terminal.writer().println(highlighter.highlight(sql, errorRange).toAnsi(terminal));
                terminal.flush();
              }
            });
  }

  public void run(boolean quiet) {
    if (!quiet) {
      printBanner();
    }

    while (running) {
      try {
        String input = lineReader.readLine("sql> ");
        if (input == null || input.isBlank()) continue;
        execute(input);
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        terminal.writer().println();
        terminal.writer().println("Goodbye!");
        terminal.flush();
        running = false;
      }
    }
  }

  /** Executes one line as if typed at the prompt. */
  public void execute(String input) {
    String trimmed = input.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if ("exit".equals(lower) || "quit".equals(lower)) {
      running = false;
      return;
    }
    try {
      dispatcher.dispatch(trimmed);
    } catch (RuntimeException e) {
      log.debug("Command failed: {}", trimmed, e);
      terminal.writer().println("Error: " + e.getMessage());
      terminal.flush();
    }
  }

  private void printBanner() {
    terminal.writer().println("╔═══════════════════════════════════════╗");
    terminal.writer().println("║              sqlkit shell             ║");
    terminal.writer().println("║   Tokens, completion and highlighting ║");
    terminal.writer().println("╚═══════════════════════════════════════╝");
    terminal.writer().println("Type 'help' for commands, 'exit' to quit, TAB to complete");
    terminal.writer().println();
    terminal.flush();
  }

  @Override
  public void close() throws IOException {
    terminal.close();
  }
}
