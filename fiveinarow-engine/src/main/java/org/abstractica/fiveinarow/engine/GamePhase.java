package org.abstractica.fiveinarow.engine;

/**
 * Coarse state of the shared game, derived from the game's fields.
 */
public enum GamePhase
{
    /** Fewer than two players registered. */
    LOBBY,
    /** Two players seated, waiting for the opening move. */
    OPENING,
    /** Moves alternate between the two seated players. */
    IN_PLAY,
    /** A winner has been decided; only a reset continues the game. */
    WON
}
