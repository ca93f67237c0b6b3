package org.abstractica.fiveinarow.engine;

/**
 * The four line directions a winning run can follow.
 *
 * <p>Each direction moves forward by one row (or one column for
 * {@link #HORIZONTAL}) and shifts the column by {@link #columnStep()}. In the
 * flat index space that is a constant stride relative to the row width.</p>
 */
public enum Direction
{
    HORIZONTAL(0, 1),
    VERTICAL(1, 0),
    DIAGONAL(1, 1),
    ANTI_DIAGONAL(1, -1);

    private final int rowStep;
    private final int columnStep;

    Direction(int rowStep, int columnStep)
    {
        this.rowStep = rowStep;
        this.columnStep = columnStep;
    }

    public int rowStep()
    {
        return rowStep;
    }

    public int columnStep()
    {
        return columnStep;
    }

    /**
     * Returns the flat index distance between consecutive cells of a run.
     *
     * @param columns the row width
     * @return 1, W, W + 1 or W - 1
     */
    public int stride(int columns)
    {
        return rowStep * columns + columnStep;
    }
}
