package org.abstractica.fiveinarow.server.session;

/**
 * Thrown when a direct message names a peer that is not registered.
 */
public class UnknownPeerException extends IllegalStateException
{
    private final String peer;

    public UnknownPeerException(String peer)
    {
        super("No connection registered for peer " + peer);
        this.peer = peer;
    }

    public String getPeer()
    {
        return peer;
    }
}
