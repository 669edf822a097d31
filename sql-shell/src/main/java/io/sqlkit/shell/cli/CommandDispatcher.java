package io.sqlkit.shell.cli;

import io.sqlkit.core.SqlEditorSupport;
import io.sqlkit.core.completion.SchemaField;
import io.sqlkit.core.error.SqlErrorPosition;
import io.sqlkit.core.lexer.TextRange;
import io.sqlkit.core.lexer.Token;
import io.sqlkit.shell.ShellState;
import java.util.Locale;
import java.util.Optional;

/**
 * Executes shell commands against the current query. Any line that is not a command becomes the
 * new current query.
 */
public class CommandDispatcher {

  public interface IO {
    void println(String s);

    void printf(String fmt, Object... args);

    void error(String s);

    /** Prints a query, marking {@code errorRange} if not null. Plain text by default. */
    default void printQuery(String sql, TextRange errorRange) {
      println(sql);
    }
  }

  private final SqlEditorSupport editor;
  private final ShellState state;
  private final IO io;

  public CommandDispatcher(SqlEditorSupport editor, ShellState state, IO io) {
    this.editor = editor;
    this.state = state;
    this.io = io;
  }

  public void dispatch(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return;
    }

    int space = indexOfWhitespace(trimmed);
    String cmd = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
    String arg = space < 0 ? "" : trimmed.substring(space + 1).trim();

    switch (cmd) {
      case "help":
        cmdHelp();
        break;
      case "tables":
        cmdTables();
        break;
      case "fields":
        cmdFields();
        break;
      case "tokens":
        cmdTokens();
        break;
      case "columns":
        cmdColumns();
        break;
      case "project":
        cmdProject(arg);
        break;
      case "error":
        cmdError(arg);
        break;
      case "show":
        cmdShow();
        break;
      default:
        state.setQuery(trimmed);
        io.printQuery(trimmed, null);
    }
  }

  private void cmdHelp() {
    io.println("Commands:");
    io.println("  <sql>              set the current query");
    io.println("  show               print the current query");
    io.println("  tokens             list the tokens of the current query");
    io.println("  columns            print the SELECT column list of the current query");
    io.println("  project <list>     replace the SELECT column list, e.g. project *");
    io.println("  error <message>    mark the position reported by a server error message");
    io.println("  tables             list known tables");
    io.println("  fields             list known schema fields");
    io.println("  help               show this help");
    io.println("  exit | quit        leave the shell");
  }

  private void cmdTables() {
    if (state.tableNames().isEmpty()) {
      io.println("No tables configured.");
      return;
    }
    state.tableNames().forEach(io::println);
  }

  private void cmdFields() {
    if (state.schemaFields().isEmpty()) {
      io.println("No schema loaded.");
      return;
    }
    for (SchemaField field : state.schemaFields()) {
      io.printf("%-24s %s%n", field.name(), field.dataType() == null ? "" : field.dataType());
    }
  }

  private void cmdTokens() {
    if (!requireQuery()) {
      return;
    }
    for (Token token : editor.tokenize(state.query())) {
      if (!token.isTrivia()) {
        io.printf("%-18s %-10s %s%n", token.kind(), token.range(), token.value());
      }
    }
  }

  private void cmdColumns() {
    if (!requireQuery()) {
      return;
    }
    Optional<TextRange> range = editor.selectColumnListRange(state.query());
    if (range.isPresent()) {
      io.println(range.get().slice(state.query()));
    } else {
      io.error("No SELECT ... FROM column list in the current query.");
    }
  }

  private void cmdProject(String columns) {
    if (columns.isEmpty()) {
      io.error("Usage: project <column list>");
      return;
    }
    if (!requireQuery()) {
      return;
    }
    Optional<String> rewritten = editor.replaceColumnList(state.query(), columns);
    if (rewritten.isEmpty()) {
      io.error("No SELECT ... FROM column list in the current query.");
      return;
    }
    state.setQuery(rewritten.get());
    io.printQuery(rewritten.get(), null);
  }

  private void cmdError(String message) {
    if (message.isEmpty()) {
      io.error("Usage: error <server error message>");
      return;
    }
    if (!requireQuery()) {
      return;
    }
    Optional<SqlErrorPosition> position = editor.parsePosition(message);
    if (position.isEmpty()) {
      io.error("No line/column position in message.");
      return;
    }
    Optional<TextRange> range = editor.highlightRangeForError(message, state.query());
    if (range.isEmpty()) {
      io.error(position.get() + " is outside the current query.");
      return;
    }
    io.println(position.get() + " -> " + range.get().slice(state.query()) + " " + range.get());
    io.printQuery(state.query(), range.get());
  }

  private void cmdShow() {
    if (requireQuery()) {
      io.printQuery(state.query(), null);
    }
  }

  private boolean requireQuery() {
    if (!state.hasQuery()) {
      io.error("No current query. Type a SQL statement first.");
      return false;
    }
    return true;
  }

  private static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
