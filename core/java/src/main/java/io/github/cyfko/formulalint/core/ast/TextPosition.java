package io.github.cyfko.formulalint.core.ast;

/**
 * A single point in formula text.
 * <p>
 * Lines and columns are 0-indexed. {@code offset} is the absolute character index, which lets
 * callers slice the original text without re-scanning it.
 * </p>
 *
 * @param line   0-indexed line
 * @param column 0-indexed column on that line
 * @param offset absolute character offset
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TextPosition(int line, int column, int offset) {

    /** Start of a formula that is not embedded in anything. */
    public static final TextPosition ORIGIN = new TextPosition(0, 0, 0);

    public TextPosition {
        if (line < 0 || column < 0 || offset < 0) {
            throw new IllegalArgumentException(
                    "Position components must not be negative, got " + line + ":" + column + "@" + offset);
        }
    }

    /**
     * Returns the position reached after consuming one character.
     *
     * @param c the consumed character
     * @return the next position
     */
    public TextPosition advance(char c) {
        if (c == '\n') {
            return new TextPosition(line + 1, 0, offset + 1);
        }
        return new TextPosition(line, column + 1, offset + 1);
    }

    /**
     * Returns the position reached after consuming the given text, counting newlines.
     *
     * @param text the consumed text
     * @return the position right after the last character of {@code text}
     */
    public TextPosition advance(CharSequence text) {
        TextPosition current = this;
        for (int i = 0; i < text.length(); i++) {
            current = current.advance(text.charAt(i));
        }
        return current;
    }

    /**
     * Shifts a position relative to a formula onto the text enclosing it.
     * The column shift only applies to the first line of the formula.
     *
     * @param base where the formula starts in the enclosing text
     * @return the re-based position
     */
    public TextPosition rebase(TextPosition base) {
        int rebasedColumn = line == 0 ? column + base.column() : column;
        return new TextPosition(line + base.line(), rebasedColumn, offset + base.offset());
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
