package io.sqlkit.core.lexer;

/**
 * Half-open span {@code [start, end)} of UTF-16 offsets into a source string.
 *
 * @param start first offset covered (inclusive)
 * @param end offset just past the last covered character (exclusive)
 */
public record TextRange(int start, int end) {

  public TextRange {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
    }
  }

  /** Creates an empty range positioned at {@code offset}. */
  public static TextRange empty(int offset) {
    return new TextRange(offset, offset);
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /**
   * Checks whether {@code offset} falls inside this range. The end offset is not contained.
   *
   * @param offset the offset to test
   * @return true if {@code start <= offset < end}
   */
  public boolean contains(int offset) {
    return offset >= start && offset < end;
  }

  /** Checks whether {@code other} lies entirely within this range. */
  public boolean encloses(TextRange other) {
    return other.start >= start && other.end <= end;
  }

  /** Returns the part of {@code text} covered by this range. */
  public String slice(String text) {
    return text.substring(start, end);
  }

  /** Returns {@code text} with this range replaced by {@code replacement}. */
  public String replaceIn(String text, String replacement) {
    return text.substring(0, start) + replacement + text.substring(end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
