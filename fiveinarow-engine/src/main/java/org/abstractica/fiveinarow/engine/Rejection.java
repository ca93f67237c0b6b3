package org.abstractica.fiveinarow.engine;

import org.abstractica.fiveinarow.protocol.Response;

/**
 * Reasons a move is refused.
 *
 * <p>Rejections are ordinary, recoverable outcomes. They are reported to the
 * offending peer as a {@link Response.Fail} and never change the game.</p>
 */
public enum Rejection
{
    NOT_ENOUGH_PLAYERS("Wait for a second player to connect"),
    UNKNOWN_PLAYER("You are not seated in this game"),
    GAME_OVER("The game is over, reset to play again"),
    OUT_OF_TURN("It's not your move"),
    INVALID_CELL("There is no such cell on the board"),
    CELL_OCCUPIED("That cell is already taken");

    private final String message;

    Rejection(String message)
    {
        this.message = message;
    }

    public String message()
    {
        return message;
    }

    /**
     * Builds the failure response addressed to the offending peer.
     *
     * @param peer address of the peer whose move was refused
     * @return the failure response
     */
    public Response.Fail toResponse(String peer)
    {
        return new Response.Fail(message, peer);
    }
}
