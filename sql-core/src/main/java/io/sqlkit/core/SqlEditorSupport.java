package io.sqlkit.core;

import io.sqlkit.core.completion.CompletionContextAnalyzer;
import io.sqlkit.core.completion.CompletionResult;
import io.sqlkit.core.completion.SchemaField;
import io.sqlkit.core.completion.SqlCompletionProvider;
import io.sqlkit.core.error.ErrorPositionMapper;
import io.sqlkit.core.error.SqlErrorPosition;
import io.sqlkit.core.highlight.SqlSyntaxHighlighter;
import io.sqlkit.core.highlight.StyledRange;
import io.sqlkit.core.lexer.SqlTokenizer;
import io.sqlkit.core.lexer.TextRange;
import io.sqlkit.core.lexer.Token;
import io.sqlkit.core.structure.ColumnListLocator;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Entry points used by a SQL editor. Every method is a pure function of its arguments, never
 * throws on malformed SQL and is safe to call from any thread.
 */
public final class SqlEditorSupport {

  private final SqlTokenizer tokenizer;
  private final ColumnListLocator columnListLocator;
  private final ErrorPositionMapper errorMapper;
  private final SqlCompletionProvider completionProvider;
  private final SqlSyntaxHighlighter highlighter;

  public SqlEditorSupport() {
    this.tokenizer = new SqlTokenizer();
    this.columnListLocator = new ColumnListLocator(tokenizer);
    this.errorMapper = new ErrorPositionMapper(tokenizer);
    this.completionProvider = new SqlCompletionProvider(new CompletionContextAnalyzer(tokenizer));
    this.highlighter = new SqlSyntaxHighlighter();
  }

  public List<Token> tokenize(String sql) {
    return tokenizer.tokenize(sql);
  }

  public Optional<TextRange> selectColumnListRange(String sql) {
    return columnListLocator.locate(sql);
  }

  public Optional<String> replaceColumnList(String sql, String columns) {
    return columnListLocator.replace(sql, columns);
  }

  public Optional<SqlErrorPosition> parsePosition(String errorMessage) {
    return SqlErrorPosition.parse(errorMessage);
  }

  public Optional<TextRange> errorHighlightRange(int line, int column, String sql) {
    return errorMapper.errorHighlightRange(line, column, sql);
  }

  public Optional<TextRange> highlightRangeForError(String errorMessage, String sql) {
    return errorMapper.highlightRange(errorMessage, sql);
  }

  public CompletionResult completions(
      String sql,
      int cursor,
      Collection<String> tableNames,
      Collection<SchemaField> schemaFields) {
    return completionProvider.completions(sql, cursor, tableNames, schemaFields);
  }

  public List<StyledRange> classify(String sql) {
    return highlighter.classify(sql);
  }
}
