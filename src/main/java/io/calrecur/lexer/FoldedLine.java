package io.calrecur.lexer;

import io.calrecur.Span;

/**
 * A logical content line reassembled from one or more physical lines.
 *
 * @param text the unfolded text, fold whitespace removed
 * @param span the physical lines the text was read from
 */
public record FoldedLine(String text, Span span) {}
