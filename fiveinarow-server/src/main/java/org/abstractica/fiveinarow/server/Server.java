package org.abstractica.fiveinarow.server;

import org.abstractica.fiveinarow.engine.GameSnapshot;

import java.net.InetSocketAddress;

/**
 * A TCP server hosting the single shared five-in-a-row game.
 *
 * <p>Every accepted connection may send commands. Move results and resets
 * are broadcast to all connected peers; acknowledgments and rejections go
 * only to the peer they name.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Server server = new DefaultServerFactory().builder()
 *     .port(3333)
 *     .build();
 * server.start();
 * }</pre>
 */
public interface Server extends AutoCloseable
{
    /**
     * Starts the server.
     *
     * <p>Binds the listen socket and begins accepting connections. This
     * method returns immediately; the server runs on background threads.</p>
     *
     * @throws java.io.UncheckedIOException if the socket cannot be bound
     * @throws IllegalStateException        if the server was already started
     */
    void start();

    /**
     * Stops accepting new connections.
     *
     * <p>Existing connections stay open and the game continues.</p>
     */
    void stop();

    /**
     * Closes the server and all connections.
     */
    @Override
    void close();

    /**
     * Returns the address the server is listening on.
     *
     * <p>Useful when the server was configured with port 0.</p>
     *
     * @return the bound address
     * @throws IllegalStateException if the server has not been started
     */
    InetSocketAddress getLocalAddress();

    /**
     * Returns server statistics.
     *
     * @return live statistics
     */
    ServerStats getStats();

    /**
     * Resets the game from the server side and broadcasts the reset to all
     * connected peers.
     */
    void resetGame();

    /**
     * Captures a consistent snapshot of the game.
     *
     * @return the snapshot
     */
    GameSnapshot snapshot();
}
