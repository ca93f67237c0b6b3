package org.abstractica.fiveinarow.server.session;

import org.abstractica.fiveinarow.server.ServerStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ServerStats.
 *
 * <p>Counters are updated by the server as connections and commands are
 * processed.</p>
 */
public class DefaultServerStats implements ServerStats
{
    private final ConnectionRegistry registry;
    private final AtomicLong totalConnections = new AtomicLong(0);
    private final AtomicLong commandsProcessed = new AtomicLong(0);
    private final AtomicLong rejectedCommands = new AtomicLong(0);
    private final AtomicLong protocolErrors = new AtomicLong(0);

    /**
     * Creates stats for a connection registry.
     *
     * @param registry the registry to report active connections from
     */
    public DefaultServerStats(ConnectionRegistry registry)
    {
        this.registry = registry;
    }

    @Override
    public int getActiveConnections()
    {
        return registry.size();
    }

    @Override
    public long getTotalConnections()
    {
        return totalConnections.get();
    }

    @Override
    public long getCommandsProcessed()
    {
        return commandsProcessed.get();
    }

    @Override
    public long getRejectedCommands()
    {
        return rejectedCommands.get();
    }

    @Override
    public long getProtocolErrors()
    {
        return protocolErrors.get();
    }

    // ========== Update Methods ==========

    public void recordConnection()
    {
        totalConnections.incrementAndGet();
    }

    /**
     * Records an applied command.
     *
     * @param rejected whether the game answered with a failure
     */
    public void recordCommand(boolean rejected)
    {
        commandsProcessed.incrementAndGet();
        if (rejected)
        {
            rejectedCommands.incrementAndGet();
        }
    }

    public void recordProtocolError()
    {
        protocolErrors.incrementAndGet();
    }

    @Override
    public String toString()
    {
        return "connections=" + getActiveConnections()
                + " accepted=" + getTotalConnections()
                + " commands=" + getCommandsProcessed()
                + " rejected=" + getRejectedCommands()
                + " protocolErrors=" + getProtocolErrors();
    }
}
