package org.abstractica.fiveinarow.engine;

import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The authoritative state of the single shared game.
 *
 * <p>Players are appended to the roster as they connect; the first two
 * entries are the seated participants, later entries stay in the roster
 * without a seat. The first move after two players are seated may come from
 * either of them: the mover gets color 1, the other seated player color 2,
 * and the other player moves next. After that the turn alternates.</p>
 *
 * <p>Every command either fully applies or leaves the game untouched. All
 * validation happens before the first field is written.</p>
 *
 * <p>Not thread-safe. Share it through {@link GuardedGame}.</p>
 */
public final class Game
{
    private static final Logger LOG = LoggerFactory.getLogger(Game.class);

    public static final int SEATS = 2;
    public static final int FIRST_COLOR = 1;
    public static final int SECOND_COLOR = 2;

    private final Board board;
    private final WinDetector winDetector;
    private final List<Player> players;
    private Integer activePlayer;
    private String winner;

    /**
     * Creates a game on the default board with five-in-a-row detection.
     */
    public Game()
    {
        this(new Board(), new WinDetector());
    }

    public Game(Board board, WinDetector winDetector)
    {
        this.board = Objects.requireNonNull(board, "board");
        this.winDetector = Objects.requireNonNull(winDetector, "winDetector");
        this.players = new ArrayList<>();
        this.activePlayer = null;
        this.winner = null;
    }

    // ========== Commands ==========

    /**
     * Applies a decoded command on behalf of a peer.
     *
     * @param command the command
     * @param peer    address of the peer that sent it
     * @return the response to deliver
     */
    public Response apply(Command command, String peer)
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(peer, "peer");

        if (command instanceof Command.Connect connect)
        {
            return connect(connect.name(), peer);
        }
        if (command instanceof Command.Move move)
        {
            return move(move.cellIndex(), move.name(), peer);
        }
        if (command instanceof Command.Reset)
        {
            return reset();
        }
        throw new IllegalArgumentException("Unsupported command: " + command.getClass().getName());
    }

    /**
     * Registers a player. Always succeeds.
     *
     * @param name display name
     * @param peer address of the connecting peer
     * @return acknowledgment for the connecting peer
     */
    public Response connect(String name, String peer)
    {
        Player player = new Player(peer, name);
        players.add(player);

        if (players.size() <= SEATS)
        {
            LOG.info("Player {} took seat {}", player, players.size());
        }
        else
        {
            LOG.info("Player {} registered without a seat ({} players)", player, players.size());
        }
        return new Response.Ok(peer);
    }

    /**
     * Places the named player's stone.
     *
     * @param cellIndex flat board index
     * @param name      the name the player connected with
     * @param peer      address of the peer that sent the move
     * @return the move result to broadcast, or a failure for the sender
     */
    public Response move(int cellIndex, String name, String peer)
    {
        Optional<Rejection> rejection = validateMove(cellIndex, name);
        if (rejection.isPresent())
        {
            LOG.debug("Rejected move {} by {} from {}: {}", cellIndex, name, peer, rejection.get());
            return rejection.get().toResponse(peer);
        }

        int mover = seatOf(name);
        int other = SEATS - 1 - mover;

        if (activePlayer == null)
        {
            players.get(mover).setColor(FIRST_COLOR);
            players.get(other).setColor(SECOND_COLOR);
            LOG.info("Opening move by {}, {} plays color {}", players.get(mover), players.get(other), SECOND_COLOR);
        }
        activePlayer = other;

        int color = players.get(mover).getColor().orElseThrow();
        board.set(cellIndex, color);

        Optional<WinningLine> line = winDetector.findWinningLine(board, color);
        if (line.isPresent())
        {
            winner = players.get(mover).getName();
            LOG.info("Player {} wins with {}", players.get(mover), line.get());
        }

        return new Response.Move(cellIndex, color, Optional.ofNullable(winner));
    }

    /**
     * Clears the board, turn order and winner. The roster and any assigned
     * colors are kept; colors are reassigned by the next opening move.
     *
     * @return the reset notification to broadcast
     */
    public Response reset()
    {
        activePlayer = null;
        winner = null;
        board.clear();
        LOG.info("Game reset with {} registered players", players.size());
        return new Response.Reset();
    }

    private Optional<Rejection> validateMove(int cellIndex, String name)
    {
        if (players.size() < SEATS)
        {
            return Optional.of(Rejection.NOT_ENOUGH_PLAYERS);
        }
        int mover = seatOf(name);
        if (mover < 0)
        {
            return Optional.of(Rejection.UNKNOWN_PLAYER);
        }
        if (winner != null)
        {
            return Optional.of(Rejection.GAME_OVER);
        }
        if (activePlayer != null && activePlayer != mover)
        {
            return Optional.of(Rejection.OUT_OF_TURN);
        }
        if (!board.contains(cellIndex))
        {
            return Optional.of(Rejection.INVALID_CELL);
        }
        if (!board.isEmpty(cellIndex))
        {
            return Optional.of(Rejection.CELL_OCCUPIED);
        }
        return Optional.empty();
    }

    /**
     * Resolves a name to a seat, first match wins.
     *
     * @return 0 or 1, or -1 if neither seated player has the name
     */
    private int seatOf(String name)
    {
        for (int seat = 0; seat < Math.min(SEATS, players.size()); seat++)
        {
            if (players.get(seat).getName().equals(name))
            {
                return seat;
            }
        }
        return -1;
    }

    // ========== Queries ==========

    public GamePhase getPhase()
    {
        if (players.size() < SEATS)
        {
            return GamePhase.LOBBY;
        }
        if (winner != null)
        {
            return GamePhase.WON;
        }
        return activePlayer == null ? GamePhase.OPENING : GamePhase.IN_PLAY;
    }

    /**
     * Returns the roster in registration order.
     *
     * @return unmodifiable view of the players
     */
    public List<Player> getPlayers()
    {
        return Collections.unmodifiableList(players);
    }

    public Optional<Player> getActivePlayer()
    {
        return activePlayer == null ? Optional.empty() : Optional.of(players.get(activePlayer));
    }

    public Optional<String> getWinner()
    {
        return Optional.ofNullable(winner);
    }

    public Board getBoard()
    {
        return board;
    }

    /**
     * Captures the current state as an immutable snapshot.
     *
     * @return the snapshot
     */
    public GameSnapshot snapshot()
    {
        List<GameSnapshot.PlayerView> views = new ArrayList<>();
        for (int i = 0; i < players.size(); i++)
        {
            Player player = players.get(i);
            views.add(new GameSnapshot.PlayerView(player.getName(), player.getPeer(), player.getColor(), i < SEATS));
        }
        return new GameSnapshot(
                getPhase(),
                views,
                getActivePlayer().map(Player::getName),
                getWinner(),
                board.columns(),
                board.snapshot()
        );
    }
}
