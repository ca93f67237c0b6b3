package org.abstractica.fiveinarow.engine;

import java.util.Objects;

/**
 * A run of same-colored cells long enough to win.
 *
 * @param direction  the direction the run follows
 * @param startIndex flat index of the first cell of the run
 * @param length     number of cells in the run
 */
public record WinningLine(Direction direction, int startIndex, int length)
{
    public WinningLine
    {
        Objects.requireNonNull(direction, "direction");
    }

    /**
     * Returns the flat indices covered by the run.
     *
     * @param columns the row width of the board
     * @return cell indices in run order
     */
    public int[] cells(int columns)
    {
        int stride = direction.stride(columns);
        int[] indices = new int[length];
        for (int i = 0; i < length; i++)
        {
            indices[i] = startIndex + i * stride;
        }
        return indices;
    }
}
