package org.abstractica.fiveinarow.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Scans a board for a run of one color long enough to win.
 *
 * <p>Rows are scanned one at a time so a horizontal run never continues
 * from the end of one row into the start of the next. The vertical and
 * diagonal directions walk the flat index space with a fixed stride; every
 * step must land exactly one row down and in the expected column, which
 * rejects strides that would wrap across the board edge.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class WinDetector
{
    public static final int DEFAULT_RUN_LENGTH = 5;

    private final int runLength;

    public WinDetector()
    {
        this(DEFAULT_RUN_LENGTH);
    }

    public WinDetector(int runLength)
    {
        if (runLength < 2)
        {
            throw new IllegalArgumentException("Run length must be at least 2: " + runLength);
        }
        this.runLength = runLength;
    }

    public int runLength()
    {
        return runLength;
    }

    /**
     * Finds the first winning run of the given color.
     *
     * @param board the board to scan
     * @param color the occupant color to look for
     * @return the winning line, or empty if the color has not won
     */
    public Optional<WinningLine> findWinningLine(Board board, int color)
    {
        Objects.requireNonNull(board, "board");
        if (color == Board.EMPTY)
        {
            throw new IllegalArgumentException("Cannot detect wins for empty cells");
        }

        Optional<WinningLine> line = scanRows(board, color);
        for (Direction direction : new Direction[]{Direction.VERTICAL, Direction.DIAGONAL, Direction.ANTI_DIAGONAL})
        {
            if (line.isPresent())
            {
                break;
            }
            line = scanStride(board, color, direction);
        }
        return line;
    }

    /**
     * Returns whether the color has a winning run anywhere on the board.
     *
     * @param board the board to scan
     * @param color the occupant color to look for
     * @return true if the color has won
     */
    public boolean hasWon(Board board, int color)
    {
        return findWinningLine(board, color).isPresent();
    }

    private Optional<WinningLine> scanRows(Board board, int color)
    {
        int columns = board.columns();
        for (int row = 0; row < board.rows(); row++)
        {
            int rowStart = row * columns;
            int run = 0;
            for (int column = 0; column < columns; column++)
            {
                run = board.get(rowStart + column) == color ? run + 1 : 0;
                if (run >= runLength)
                {
                    return Optional.of(new WinningLine(Direction.HORIZONTAL, rowStart + column - run + 1, run));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<WinningLine> scanStride(Board board, int color, Direction direction)
    {
        int stride = direction.stride(board.columns());
        for (int start = 0; start < board.size(); start++)
        {
            if (board.get(start) != color)
            {
                continue;
            }
            // Only count from the first cell of a run
            int previous = start - stride;
            if (hasStep(board, previous, start, direction) && board.get(previous) == color)
            {
                continue;
            }

            int run = 1;
            int current = start;
            while (run < runLength && hasStep(board, current, current + stride, direction)
                    && board.get(current + stride) == color)
            {
                current += stride;
                run++;
            }
            if (run >= runLength)
            {
                return Optional.of(new WinningLine(direction, start, run));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns whether {@code to} is the neighbour of {@code from} in the given
     * direction, i.e. both are on the board and no row boundary was wrapped.
     */
    private static boolean hasStep(Board board, int from, int to, Direction direction)
    {
        if (!board.contains(from) || !board.contains(to))
        {
            return false;
        }
        return board.rowOf(to) - board.rowOf(from) == direction.rowStep()
                && board.columnOf(to) - board.columnOf(from) == direction.columnStep();
    }
}
