package org.abstractica.fiveinarow.server.session;

import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.serialization.GameProtocol;
import org.abstractica.fiveinarow.server.DisconnectReason;

/**
 * Callback interface from a peer connection to the server.
 *
 * <p>Used by PeerConnection to hand over decoded commands, report closure,
 * and reach the shared protocol.</p>
 */
public interface ConnectionCallback
{
    /**
     * Gets the protocol for message serialization.
     *
     * @return the protocol
     */
    GameProtocol getProtocol();

    /**
     * Handles a command decoded from the connection. Called on the
     * connection's reader thread.
     *
     * @param connection the connection the command arrived on
     * @param command    the decoded command
     */
    void onCommand(PeerConnection connection, Command command);

    /**
     * Notifies that a connection has closed. Called exactly once per
     * connection.
     *
     * @param connection the closed connection
     * @param reason     why it closed
     */
    void onClosed(PeerConnection connection, DisconnectReason reason);
}
