package org.abstractica.fiveinarow.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable view of the game at one point in time.
 *
 * @param phase        the game phase
 * @param players      roster in registration order
 * @param activePlayer name of the player to move next, if turn order is set
 * @param winner       name of the winner, if decided
 * @param columns      row width of the board
 * @param cells        board cells in row-major order
 */
public record GameSnapshot(
        GamePhase phase,
        List<PlayerView> players,
        Optional<String> activePlayer,
        Optional<String> winner,
        int columns,
        int[] cells
)
{
    public GameSnapshot
    {
        Objects.requireNonNull(phase, "phase");
        players = List.copyOf(players);
        Objects.requireNonNull(activePlayer, "activePlayer");
        Objects.requireNonNull(winner, "winner");
        cells = cells.clone();
    }

    /**
     * A roster entry.
     *
     * @param name   display name
     * @param peer   network address the player connected from
     * @param color  assigned color, if any
     * @param seated whether the player is one of the two participants
     */
    public record PlayerView(String name, String peer, OptionalInt color, boolean seated)
    {
    }

    @Override
    public int[] cells()
    {
        return cells.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof GameSnapshot other))
        {
            return false;
        }
        return columns == other.columns
                && phase == other.phase
                && players.equals(other.players)
                && activePlayer.equals(other.activePlayer)
                && winner.equals(other.winner)
                && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(phase, players, activePlayer, winner, columns);
        return 31 * result + Arrays.hashCode(cells);
    }

    @Override
    public String toString()
    {
        return "GameSnapshot[phase=" + phase
                + ", players=" + players
                + ", activePlayer=" + activePlayer
                + ", winner=" + winner
                + ", columns=" + columns
                + ", cells=" + Arrays.toString(cells) + "]";
    }

    /**
     * Renders the board as text, one line per row: {@code .} for empty cells,
     * the color digit otherwise.
     *
     * @return the rendered board
     */
    public String render()
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.length; i++)
        {
            sb.append(cells[i] == Board.EMPTY ? '.' : Character.forDigit(cells[i], Character.MAX_RADIX));
            if ((i + 1) % columns == 0)
            {
                sb.append(System.lineSeparator());
            }
            else
            {
                sb.append(' ');
            }
        }
        return sb.toString();
    }
}
