package com.blanklines.api.tree;

import java.util.Objects;

/**
 * Position of a node in its source text. Lines and columns are 1-based and inclusive.
 */
public final class SourceSpan {
    private final int beginLine;
    private final int beginColumn;
    private final int endLine;
    private final int endColumn;

    public SourceSpan(int beginLine, int beginColumn, int endLine, int endColumn) {
        this.beginLine = beginLine;
        this.beginColumn = beginColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public int getBeginLine() { return beginLine; }
    public int getBeginColumn() { return beginColumn; }
    public int getEndLine() { return endLine; }
    public int getEndColumn() { return endColumn; }

    /**
     * Number of lines from the end of {@code previous} to the start of this span.
     * Zero means both share a line, one means they touch, anything above one means
     * at least one line lies between them.
     */
    public int lineGapAfter(SourceSpan previous) {
        return beginLine - previous.endLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return beginLine == that.beginLine && beginColumn == that.beginColumn
                && endLine == that.endLine && endColumn == that.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(beginLine, beginColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return "(" + beginLine + ":" + beginColumn + ")-(" + endLine + ":" + endColumn + ")";
    }
}
