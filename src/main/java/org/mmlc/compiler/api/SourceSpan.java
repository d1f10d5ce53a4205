package org.mmlc.compiler.api;

import java.util.Comparator;

/**
 * A pure data class representing a range in the source code.
 * It is part of the public compiler API and free of implementation details.
 * <p>
 * Spans order by file, then start position, then end position. This ordering is what
 * makes diagnostic output reproducible regardless of the order in which stages report.
 *
 * @param fileName  The file where the code is located.
 * @param startLine The 1-based line of the first character.
 * @param startCol  The 1-based column of the first character.
 * @param endLine   The 1-based line of the last character.
 * @param endCol    The 1-based column after the last character.
 */
public record SourceSpan(String fileName, int startLine, int startCol, int endLine, int endCol)
        implements Comparable<SourceSpan> {

    /** Span of nodes injected by the compiler itself (built-in types and operators). */
    public static final SourceSpan SYNTHETIC = new SourceSpan("<synthetic>", 0, 0, 0, 0);

    private static final Comparator<SourceSpan> ORDER = Comparator
            .comparing(SourceSpan::fileName)
            .thenComparingInt(SourceSpan::startLine)
            .thenComparingInt(SourceSpan::startCol)
            .thenComparingInt(SourceSpan::endLine)
            .thenComparingInt(SourceSpan::endCol);

    /**
     * Creates a span that covers a single line.
     * @param fileName The file name.
     * @param line The line number.
     * @param startCol The first column.
     * @param endCol The column after the last character.
     * @return The span.
     */
    public static SourceSpan onLine(String fileName, int line, int startCol, int endCol) {
        return new SourceSpan(fileName, line, startCol, line, endCol);
    }

    /**
     * Returns the smallest span that contains both given spans.
     * Synthetic spans are ignored unless both spans are synthetic.
     * @param a The first span.
     * @param b The second span.
     * @return The covering span.
     */
    public static SourceSpan covering(SourceSpan a, SourceSpan b) {
        if (a.isSynthetic()) return b;
        if (b.isSynthetic()) return a;
        SourceSpan first = a.compareTo(b) <= 0 ? a : b;
        boolean aEndsLater = a.endLine() > b.endLine()
                || (a.endLine() == b.endLine() && a.endCol() >= b.endCol());
        SourceSpan last = aEndsLater ? a : b;
        return new SourceSpan(first.fileName(), first.startLine(), first.startCol(), last.endLine(), last.endCol());
    }

    /**
     * @return {@code true} if this span does not point into user source.
     */
    public boolean isSynthetic() {
        return this.equals(SYNTHETIC);
    }

    @Override
    public int compareTo(SourceSpan other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, startLine, startCol);
    }
}
