package org.abstractica.fiveinarow.server;

import java.net.InetAddress;

/**
 * Factory for creating Server instances.
 *
 * <p>Use the builder to configure the server before creation:</p>
 * <pre>{@code
 * ServerFactory factory = new DefaultServerFactory();
 * Server server = factory.builder()
 *     .bindAddress(InetAddress.getLoopbackAddress())
 *     .port(0)
 *     .build();
 * }</pre>
 */
public interface ServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Server.
     */
    interface Builder
    {
        /**
         * Sets the port to listen on.
         *
         * <p>Optional. Defaults to 3333. Port 0 picks an ephemeral port.</p>
         *
         * @param port the port number
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets the address to bind to.
         *
         * <p>Optional. Defaults to all interfaces.</p>
         *
         * @param address the bind address
         * @return this builder
         */
        Builder bindAddress(InetAddress address);

        /**
         * Sets the number of board columns.
         *
         * <p>Optional. Defaults to 15.</p>
         *
         * @param columns board width
         * @return this builder
         */
        Builder boardColumns(int columns);

        /**
         * Sets the number of board rows.
         *
         * <p>Optional. Defaults to 17.</p>
         *
         * @param rows board height
         * @return this builder
         */
        Builder boardRows(int rows);

        /**
         * Sets how many contiguous stones win.
         *
         * <p>Optional. Defaults to 5.</p>
         *
         * @param runLength winning run length
         * @return this builder
         */
        Builder runLength(int runLength);

        /**
         * Sets the maximum accepted frame payload in bytes.
         *
         * <p>Optional. Defaults to 4096.</p>
         *
         * @param size maximum frame size
         * @return this builder
         */
        Builder maxFrameSize(int size);

        /**
         * Builds the server.
         *
         * @return the configured server, not yet started
         * @throws IllegalStateException if the settings are inconsistent
         */
        Server build();
    }
}
