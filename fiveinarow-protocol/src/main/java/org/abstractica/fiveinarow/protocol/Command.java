package org.abstractica.fiveinarow.protocol;

import java.util.Objects;

/**
 * Commands sent from a client to the server.
 *
 * <p>A closed set: the server decodes every inbound payload into exactly
 * one of these records and handles each case explicitly.</p>
 */
public sealed interface Command permits
        Command.Connect,
        Command.Move,
        Command.Reset
{
    /**
     * Registers a participant under a display name.
     *
     * @param name the display name of the player
     */
    record Connect(String name) implements Command
    {
        public Connect
        {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Attempts to place the named player's stone on a cell.
     *
     * @param cellIndex flat board index (row * columns + column)
     * @param name      the display name the player connected with
     */
    record Move(int cellIndex, String name) implements Command
    {
        public Move
        {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Clears the current game while keeping the registered players.
     */
    record Reset() implements Command
    {
    }
}
