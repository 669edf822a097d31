package io.sqlkit.shell.cli;

import io.sqlkit.core.SqlEditorSupport;
import io.sqlkit.core.completion.CompletionItem;
import io.sqlkit.core.completion.CompletionResult;
import io.sqlkit.shell.ShellState;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JLine completer backed by the SQL completion provider. The whole input line is treated as SQL
 * text with the cursor at JLine's cursor position.
 */
public class SqlShellCompleter implements Completer {

  private static final Logger log = LoggerFactory.getLogger(SqlShellCompleter.class);

  // Debug flag - set to true to see completion debug output
  private static final boolean DEBUG = Boolean.getBoolean("sqlkit.shell.debug");

  private final SqlEditorSupport editor;
  private final ShellState state;

  public SqlShellCompleter(SqlEditorSupport editor, ShellState state) {
    this.editor = editor;
    this.state = state;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    CompletionResult result =
        editor.completions(line.line(), line.cursor(), state.tableNames(), state.schemaFields());

    // JLine replaces its whole word, which may start before our prefix (e.g. a quote or comma)
    String word = line.word() == null ? "" : line.word().substring(0, line.wordCursor());
    String jlinePrefix = calculateJlinePrefix(word, result.prefix());

    if (DEBUG) {
      log.info(
          "line='{}' cursor={} word='{}' prefix='{}' jlinePrefix='{}' items={}",
          line.line(),
          line.cursor(),
          word,
          result.prefix(),
          jlinePrefix,
          result.items().size());
    }

    for (CompletionItem item : result.items()) {
      candidates.add(
          new Candidate(
              jlinePrefix + item.insertText(),
              item.displayText(),
              null,
              describe(item),
              null,
              null,
              true));
    }
  }

  /**
   * Calculates the part of JLine's current word that precedes the completion prefix. JLine matches
   * candidates against its whole word, so candidate values must carry this part too.
   *
   * <p>Examples:
   *
   * <ul>
   *   <li>jlineWord="\"acc", partial="acc" → "\""
   *   <li>jlineWord="a,b", partial="b" → "a,"
   *   <li>jlineWord="lev", partial="lev" → ""
   * </ul>
   */
  static String calculateJlinePrefix(String jlineWord, String partial) {
    if (jlineWord == null || jlineWord.isEmpty()) {
      return "";
    }
    if (partial == null || partial.isEmpty()) {
      return jlineWord;
    }
    if (jlineWord.length() > partial.length() && jlineWord.endsWith(partial)) {
      return jlineWord.substring(0, jlineWord.length() - partial.length());
    }
    return "";
  }

  private static String describe(CompletionItem item) {
    return item.detail() == null ? item.kindLabel() : item.kindLabel() + " " + item.detail();
  }
}
