package io.sqlkit.core;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fixed SQL vocabularies shared by the tokenizer, the completion provider and the highlighter.
 *
 * <p>Two keyword sets exist. {@link #STRUCTURAL_KEYWORDS} decides which words the tokenizer
 * classifies as keywords, so it only needs what the structural passes and the context classifier
 * look at. {@link #EDITOR_KEYWORDS} is the larger set offered for completion and colored by the
 * highlighter.
 */
public final class SqlVocabulary {

  public static final Set<String> STRUCTURAL_KEYWORDS =
      Set.of(
          "SELECT", "DISTINCT", "FROM", "WHERE", "GROUP", "BY", "HAVING", "ORDER", "LIMIT",
          "OFFSET", "AS", "AND", "OR", "NOT", "IN", "IS", "NULL", "LIKE", "BETWEEN", "CASE", "WHEN",
          "THEN", "ELSE", "END", "JOIN", "ON", "LEFT", "RIGHT", "INNER", "OUTER", "CROSS", "FULL",
          "UNION", "ALL", "INTERSECT", "EXCEPT", "INSERT", "UPDATE", "DELETE", "CREATE", "DROP",
          "ALTER", "SET", "INTO", "VALUES", "ASC", "DESC", "EXISTS", "TRUE", "FALSE", "WITH",
          "RECURSIVE", "OVER", "PARTITION", "WINDOW", "ROWS", "RANGE", "UNBOUNDED", "PRECEDING",
          "FOLLOWING", "CURRENT", "ROW", "FILTER", "LATERAL", "NATURAL", "USING", "FETCH", "FIRST",
          "LAST", "NEXT", "ONLY", "TIES", "TOP");

  public static final Set<String> EDITOR_KEYWORDS =
      Set.of(
          "ADD", "ALL", "ALTER", "AND", "AS", "ASC",
          "BETWEEN", "BY",
          "CASE", "CAST", "CREATE", "CROSS", "CUBE", "CURRENT",
          "DELETE", "DESC", "DISTINCT", "DROP",
          "ELSE", "END", "EXCEPT", "EXISTS", "EXTRACT",
          "FALSE", "FETCH", "FILTER", "FIRST", "FOLLOWING", "FOR", "FROM", "FULL",
          "GROUP", "GROUPING",
          "HAVING",
          "IF", "IN", "INNER", "INSERT", "INTERSECT", "INTERVAL", "INTO", "IS",
          "JOIN",
          "LATERAL", "LEFT", "LIKE", "LIMIT",
          "NATURAL", "NEXT", "NOT", "NULL",
          "OFFSET", "ON", "ONLY", "OR", "ORDER", "OUTER", "OVER",
          "PARTITION", "PERCENT", "PRECEDING",
          "RANGE", "RECURSIVE", "RIGHT", "ROLLUP", "ROW", "ROWS",
          "SELECT", "SET", "SETS",
          "TABLE", "THEN", "TOP", "TRUE",
          "UNBOUNDED", "UNION", "UPDATE", "USING",
          "VALUES",
          "WHEN", "WHERE", "WINDOW", "WITH");

  public static final Set<String> FUNCTIONS =
      Set.of(
          "ABS", "ARRAY_AGG", "AVG",
          "CEIL", "COALESCE", "CONCAT", "COUNT",
          "DATE", "DATE_TRUNC", "DENSE_RANK",
          "FIRST_VALUE", "FLOOR",
          "IIF", "IFNULL",
          "JSON_EXTRACT", "JSON_VALUE",
          "LAG", "LAST_VALUE", "LEAD", "LENGTH", "LOWER",
          "MAX", "MIN",
          "NOW", "NTH_VALUE", "NTILE", "NULLIF",
          "RANK", "REPLACE", "ROUND", "ROW_NUMBER",
          "STRING_AGG", "SUBSTRING", "SUM",
          "TIME", "TIMESTAMP", "TO_CHAR", "TO_DATE", "TO_TIMESTAMP", "TRIM",
          "UPPER");

  /** Editor keywords in alphabetical order. */
  public static final List<String> SORTED_KEYWORDS = List.copyOf(new TreeSet<>(EDITOR_KEYWORDS));

  /** Functions in alphabetical order. */
  public static final List<String> SORTED_FUNCTIONS = List.copyOf(new TreeSet<>(FUNCTIONS));

  private SqlVocabulary() {}
}
