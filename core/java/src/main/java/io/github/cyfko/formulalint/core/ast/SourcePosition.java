package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Span of formula text covered by a syntax element, end exclusive.
 *
 * @param start first character of the span
 * @param end   position right after the last character of the span
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SourcePosition(TextPosition start, TextPosition end) {

    public SourcePosition {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span ends before it starts: " + start + " > " + end);
        }
    }

    /**
     * Span from the start of {@code first} to the end of {@code last}.
     */
    public static SourcePosition covering(SourcePosition first, SourcePosition last) {
        return new SourcePosition(first.start(), last.end());
    }

    public int startLine() {
        return start.line();
    }

    public int startColumn() {
        return start.column();
    }

    public int endLine() {
        return end.line();
    }

    public int endColumn() {
        return end.column();
    }

    /**
     * @see TextPosition#rebase(TextPosition)
     */
    public SourcePosition rebase(TextPosition base) {
        return new SourcePosition(start.rebase(base), end.rebase(base));
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
