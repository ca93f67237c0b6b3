package org.abstractica.fiveinarow.server;

/**
 * Server statistics for monitoring.
 *
 * <p>Values are read live; the application can poll them and push them
 * wherever it likes.</p>
 */
public interface ServerStats
{
    /**
     * Returns the number of currently registered connections.
     *
     * @return active connection count
     */
    int getActiveConnections();

    /**
     * Returns the number of connections accepted since start.
     *
     * @return total accepted connections
     */
    long getTotalConnections();

    /**
     * Returns the number of commands applied to the game.
     *
     * @return commands processed, rejected ones included
     */
    long getCommandsProcessed();

    /**
     * Returns the number of commands answered with a failure.
     *
     * @return rejected command count
     */
    long getRejectedCommands();

    /**
     * Returns the number of connections closed for malformed input.
     *
     * @return protocol error count
     */
    long getProtocolErrors();
}
