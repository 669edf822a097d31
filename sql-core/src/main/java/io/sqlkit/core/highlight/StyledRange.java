package io.sqlkit.core.highlight;

import io.sqlkit.core.lexer.TextRange;

/**
 * A run of text and the style to paint it with.
 *
 * @param range the styled text range
 * @param style the style
 */
public record StyledRange(TextRange range, HighlightStyle style) {}
