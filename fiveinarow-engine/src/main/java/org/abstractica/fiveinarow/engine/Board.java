package org.abstractica.fiveinarow.engine;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size grid of cell values stored row by row.
 *
 * <p>A cell holds {@link #EMPTY} or the color of the player occupying it.
 * The size is fixed at construction. Reads and writes outside the board
 * throw {@link IndexOutOfBoundsException}; callers are expected to validate
 * indices coming from the network first.</p>
 *
 * <p>Not thread-safe. The board is only touched while holding the game lock.</p>
 */
public final class Board
{
    public static final int EMPTY = 0;
    public static final int DEFAULT_COLUMNS = 15;
    public static final int DEFAULT_ROWS = 17;

    private final int columns;
    private final int rows;
    private final int[] cells;

    /**
     * Creates the default 15 x 17 board (255 cells).
     */
    public Board()
    {
        this(DEFAULT_COLUMNS, DEFAULT_ROWS);
    }

    public Board(int columns, int rows)
    {
        if (columns <= 0 || rows <= 0)
        {
            throw new IllegalArgumentException("Board dimensions must be positive: " + columns + "x" + rows);
        }
        this.columns = columns;
        this.rows = rows;
        this.cells = new int[columns * rows];
    }

    public int get(int index)
    {
        return cells[Objects.checkIndex(index, cells.length)];
    }

    public void set(int index, int value)
    {
        cells[Objects.checkIndex(index, cells.length)] = value;
    }

    public boolean isEmpty(int index)
    {
        return get(index) == EMPTY;
    }

    /**
     * Returns whether an index lies on the board.
     *
     * @param index flat cell index
     * @return true if {@code 0 <= index < size()}
     */
    public boolean contains(int index)
    {
        return index >= 0 && index < cells.length;
    }

    public int rowOf(int index)
    {
        return Objects.checkIndex(index, cells.length) / columns;
    }

    public int columnOf(int index)
    {
        return Objects.checkIndex(index, cells.length) % columns;
    }

    public int columns()
    {
        return columns;
    }

    public int rows()
    {
        return rows;
    }

    public int size()
    {
        return cells.length;
    }

    /**
     * Sets every cell back to {@link #EMPTY}.
     */
    public void clear()
    {
        Arrays.fill(cells, EMPTY);
    }

    /**
     * Returns a copy of all cells in row-major order.
     *
     * @return defensive copy of the cells
     */
    public int[] snapshot()
    {
        return cells.clone();
    }
}
