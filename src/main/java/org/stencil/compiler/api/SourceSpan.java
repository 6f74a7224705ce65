package org.stencil.compiler.api;

/**
 * A pure data class representing a region of the original template source.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical name of the template the region belongs to.
 * @param start The offset of the first character (inclusive).
 * @param end The offset after the last character (exclusive).
 * @param line The 1-based line of the first character.
 * @param column The 1-based column of the first character.
 */
public record SourceSpan(String fileName, int start, int end, int line, int column) {

    /**
     * @return The number of source characters covered by this span.
     */
    public int length() {
        return end - start;
    }

    /**
     * Computes the span of a sub-region of {@code text}, where {@code text} is the exact
     * source slice covered by this span.
     *
     * @param text The source text covered by this span.
     * @param from The start index within {@code text} (inclusive).
     * @param to The end index within {@code text} (exclusive).
     * @return The span of the sub-region.
     */
    public SourceSpan slice(String text, int from, int to) {
        int l = line;
        int c = column;
        for (int i = 0; i < from && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                l++;
                c = 1;
            } else {
                c++;
            }
        }
        return new SourceSpan(fileName, start + from, start + to, l, c);
    }

    /**
     * Creates a span covering both this span and {@code other}.
     * @param other A span that starts at or after this one.
     * @return The combined span.
     */
    public SourceSpan union(SourceSpan other) {
        if (other == null) {
            return this;
        }
        return start <= other.start
                ? new SourceSpan(fileName, start, Math.max(end, other.end), line, column)
                : other.union(this);
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, line, column);
    }
}
