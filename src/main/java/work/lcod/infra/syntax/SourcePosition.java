package work.lcod.infra.syntax;

public record SourcePosition(int line, int column) implements Comparable<SourcePosition> {
    private static final long COLUMNS_PER_LINE = 100_000L;

    public static final SourcePosition NONE = new SourcePosition(0, 0);

    /**
     * Collapses the position into a single monotonically increasing number; lines longer than
     * 100,000 columns would overlap the next line.
     */
    public long ordinal() {
        return line * COLUMNS_PER_LINE + column;
    }

    @Override
    public int compareTo(SourcePosition other) {
        return Long.compare(ordinal(), other.ordinal());
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
