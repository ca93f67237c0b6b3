package org.abstractica.fiveinarow.server;

import java.io.IOException;

/**
 * Reason a peer connection was closed.
 *
 * <p>Sealed interface enabling exhaustive handling of disconnect causes.</p>
 */
public sealed interface DisconnectReason
{
    /**
     * The peer closed its end at a frame boundary.
     */
    record EndOfStream() implements DisconnectReason {}

    /**
     * Network-level error occurred.
     *
     * @param cause the underlying I/O exception
     */
    record NetworkError(IOException cause) implements DisconnectReason {}

    /**
     * Protocol error (bad frame length, undecodable payload).
     *
     * @param details description of the protocol violation
     */
    record ProtocolError(String details) implements DisconnectReason {}

    /**
     * Server is shutting down.
     */
    record ServerShutdown() implements DisconnectReason {}
}
