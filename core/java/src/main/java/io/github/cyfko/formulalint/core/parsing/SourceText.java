package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.SourcePosition;
import io.github.cyfko.formulalint.core.ast.TextPosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Formula characters paired with the position each one was read at.
 * <p>
 * The tokenizer drops whitespace from operands, and nested formulas are slices of operands, so
 * character indexes of the text being parsed no longer match offsets of the original formula.
 * Keeping the source position of every character lets any sub-formula, argument or parameter
 * report the exact span it came from.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SourceText implements CharSequence {

    private final String text;
    private final List<TextPosition> starts;
    private final TextPosition end;

    private SourceText(String text, List<TextPosition> starts, TextPosition end) {
        this.text = text;
        this.starts = starts;
        this.end = end;
    }

    /**
     * Reads {@code raw} starting at {@code base}, counting newlines.
     *
     * @param raw  formula text
     * @param base position of the first character
     * @return the positioned text
     */
    public static SourceText of(String raw, TextPosition base) {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(base, "base");
        List<TextPosition> starts = new ArrayList<>(raw.length());
        TextPosition cursor = base;
        for (int i = 0; i < raw.length(); i++) {
            starts.add(cursor);
            cursor = cursor.advance(raw.charAt(i));
        }
        return new SourceText(raw, List.copyOf(starts), cursor);
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public char charAt(int index) {
        return text.charAt(index);
    }

    @Override
    public SourceText subSequence(int startIndex, int endIndex) {
        Objects.checkFromToIndex(startIndex, endIndex, text.length());
        TextPosition sliceEnd = endIndex > startIndex ? endOf(endIndex - 1) : positionAt(startIndex);
        return new SourceText(text.substring(startIndex, endIndex), starts.subList(startIndex, endIndex), sliceEnd);
    }

    /**
     * @param index character index, {@code length()} meaning the end of the text
     * @return where that character starts
     */
    public TextPosition positionAt(int index) {
        return index == text.length() ? end : starts.get(index);
    }

    /**
     * @return the position right after the character at {@code index}
     */
    public TextPosition endOf(int index) {
        return starts.get(index).advance(text.charAt(index));
    }

    /**
     * @return span of the characters {@code [startIndex, endIndex)}
     */
    public SourcePosition span(int startIndex, int endIndex) {
        return subSequence(startIndex, endIndex).span();
    }

    /**
     * @return span of the whole text
     */
    public SourcePosition span() {
        return new SourcePosition(start(), end);
    }

    public TextPosition start() {
        return positionAt(0);
    }

    public TextPosition end() {
        return end;
    }

    public int indexOf(char c) {
        return text.indexOf(c);
    }

    @Override
    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * Collects characters picked from other texts, keeping their original positions.
     */
    static final class Builder {
        private final StringBuilder text = new StringBuilder();
        private final List<TextPosition> starts = new ArrayList<>();
        private TextPosition end;

        Builder append(SourceText source, int index) {
            text.append(source.charAt(index));
            starts.add(source.positionAt(index));
            end = source.endOf(index);
            return this;
        }

        boolean isEmpty() {
            return text.length() == 0;
        }

        CharSequence chars() {
            return text;
        }

        SourceText build() {
            if (isEmpty()) {
                throw new IllegalStateException("Cannot build an empty operand");
            }
            return new SourceText(text.toString(), List.copyOf(starts), end);
        }

        void clear() {
            text.setLength(0);
            starts.clear();
            end = null;
        }
    }
}
