package io.sqlkit.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.sqlkit.core.SqlEditorSupport;
import io.sqlkit.core.completion.SchemaField;
import io.sqlkit.core.lexer.TextRange;
import io.sqlkit.shell.ShellState;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CommandDispatcherTest {

  static class BufferIO implements CommandDispatcher.IO {
    final List<String> out = new ArrayList<>();
    final List<String> errors = new ArrayList<>();
    final List<TextRange> errorRanges = new ArrayList<>();

    @Override
    public void println(String s) {
      out.add(s);
    }

    @Override
    public void printf(String fmt, Object... args) {
      out.add(String.format(fmt, args).stripTrailing());
    }

    @Override
    public void error(String s) {
      errors.add(s);
    }

    @Override
    public void printQuery(String sql, TextRange errorRange) {
      out.add(sql);
      errorRanges.add(errorRange);
    }
  }

  private ShellState state;
  private BufferIO io;
  private CommandDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    state =
        new ShellState(
            List.of("access_logs", "metrics"),
            List.of(new SchemaField("level", "Utf8"), new SchemaField("tags", null)));
    io = new BufferIO();
    dispatcher = new CommandDispatcher(new SqlEditorSupport(), state, io);
  }

  @Test
  void plainLineBecomesCurrentQuery() {
    dispatcher.dispatch("  SELECT a, b FROM t  ");

    assertEquals("SELECT a, b FROM t", state.query());
    assertEquals(List.of("SELECT a, b FROM t"), io.out);
  }

  @Test
  void blankLineIsIgnored() {
    dispatcher.dispatch("   ");

    assertTrue(io.out.isEmpty());
    assertFalse(state.hasQuery());
  }

  @Test
  void listsTablesAndFields() {
    dispatcher.dispatch("tables");
    dispatcher.dispatch("FIELDS");

    assertEquals(List.of("access_logs", "metrics", "level                    Utf8", "tags"), io.out);
  }

  @Test
  void helpListsCommands() {
    dispatcher.dispatch("help");

    assertTrue(io.out.stream().anyMatch(l -> l.contains("project <list>")));
  }

  @Nested
  class WithQuery {
    @BeforeEach
    void setQuery() {
      dispatcher.dispatch("SELECT a, b FROM t ORDER BY a");
      io.out.clear();
      io.errorRanges.clear();
    }

    @Test
    void columnsPrintsColumnList() {
      dispatcher.dispatch("columns");

      assertEquals(List.of("a, b"), io.out);
    }

    @Test
    void projectRewritesQuery() {
      dispatcher.dispatch("project  \"x\", \"y\"");

      assertEquals("SELECT \"x\", \"y\" FROM t ORDER BY a", state.query());
      assertEquals(List.of(state.query()), io.out);
    }

    @Test
    void projectWithoutArgument() {
      dispatcher.dispatch("project");

      assertEquals(1, io.errors.size());
      assertEquals("SELECT a, b FROM t ORDER BY a", state.query());
    }

    @Test
    void tokensSkipsTrivia() {
      dispatcher.dispatch("tokens");

      assertEquals(9, io.out.size());
      assertTrue(io.out.get(0).startsWith("KEYWORD"));
      assertTrue(io.out.get(0).endsWith("SELECT"));
    }

    @Test
    void errorMarksToken() {
      dispatcher.dispatch("error Expected: an expression, found: FROM at Line: 1, Column 13");

      assertEquals("Line: 1, Column: 13 -> FROM [12, 16)", io.out.get(0));
      assertEquals(new TextRange(12, 16), io.errorRanges.get(0));
    }

    @Test
    void errorWithoutPosition() {
      dispatcher.dispatch("error table not found");

      assertEquals(1, io.errors.size());
      assertTrue(io.out.isEmpty());
    }

    @Test
    void errorOutsideQuery() {
      dispatcher.dispatch("error Line: 4, Column: 1");

      assertEquals(List.of("Line: 4, Column: 1 is outside the current query."), io.errors);
    }

    @Test
    void showPrintsQuery() {
      dispatcher.dispatch("show");

      assertEquals(List.of("SELECT a, b FROM t ORDER BY a"), io.out);
    }
  }

  @Test
  void commandsNeedAQuery() {
    dispatcher.dispatch("columns");
    dispatcher.dispatch("tokens");
    dispatcher.dispatch("show");

    assertEquals(3, io.errors.size());
  }

  @Test
  void columnsWithoutFrom() {
    dispatcher.dispatch("SELECT 1");
    dispatcher.dispatch("columns");

    assertEquals(1, io.errors.size());
  }
}
