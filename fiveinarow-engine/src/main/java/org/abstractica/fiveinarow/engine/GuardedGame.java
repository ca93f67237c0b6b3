package org.abstractica.fiveinarow.engine;

import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.Response;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The one {@link Game} shared by every connection, behind a single lock.
 *
 * <p>Commands are applied one at a time in the order they acquire the lock.
 * The response is handed to the caller's sink before the lock is released,
 * so responses leave in the same order the commands were applied. Sinks must
 * not block.</p>
 */
public final class GuardedGame
{
    private final Game game;
    private final ReentrantLock lock;

    public GuardedGame(Game game)
    {
        this.game = Objects.requireNonNull(game, "game");
        this.lock = new ReentrantLock(true);
    }

    /**
     * Applies a command and delivers its response under the game lock.
     *
     * @param command the command to apply
     * @param peer    address of the peer that sent it
     * @param sink    receives the response while the lock is held
     * @return the response
     */
    public Response submit(Command command, String peer, Consumer<Response> sink)
    {
        Objects.requireNonNull(sink, "sink");
        lock.lock();
        try
        {
            Response response = game.apply(command, peer);
            sink.accept(response);
            return response;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Runs a read-only query against the game under the game lock.
     *
     * @param query the query; must not modify the game
     * @param <T>   the result type
     * @return the query result
     */
    public <T> T read(Function<Game, T> query)
    {
        Objects.requireNonNull(query, "query");
        lock.lock();
        try
        {
            return query.apply(game);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Captures a consistent snapshot of the game.
     *
     * @return the snapshot
     */
    public GameSnapshot snapshot()
    {
        return read(Game::snapshot);
    }
}
