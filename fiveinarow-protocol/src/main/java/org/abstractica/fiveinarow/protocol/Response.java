package org.abstractica.fiveinarow.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * Responses sent from the server to clients.
 *
 * <p>{@link Ok} and {@link Fail} answer the peer that issued the command and
 * are delivered to that peer only. {@link Move} and {@link Reset} change the
 * shared game and are broadcast to every connected peer.</p>
 */
public sealed interface Response permits
        Response.Ok,
        Response.Fail,
        Response.Move,
        Response.Reset
{
    /**
     * Returns whether this response goes to every connected peer.
     *
     * @return true for broadcast responses, false for direct replies
     */
    default boolean isBroadcast()
    {
        return this instanceof Move || this instanceof Reset;
    }

    /**
     * Acknowledges a command.
     *
     * @param peer address of the peer the acknowledgment is for
     */
    record Ok(String peer) implements Response
    {
        public Ok
        {
            Objects.requireNonNull(peer, "peer");
        }
    }

    /**
     * Rejects a command without changing the game.
     *
     * @param message human readable reason
     * @param peer    address of the peer whose command was rejected
     */
    record Fail(String message, String peer) implements Response
    {
        public Fail
        {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(peer, "peer");
        }
    }

    /**
     * A stone was placed.
     *
     * @param cellIndex flat board index of the placed stone
     * @param color     color of the player who moved
     * @param winner    name of the winner, once the game is decided
     */
    record Move(int cellIndex, int color, Optional<String> winner) implements Response
    {
        public Move
        {
            Objects.requireNonNull(winner, "winner");
        }
    }

    /**
     * The board was cleared.
     */
    record Reset() implements Response
    {
    }
}
