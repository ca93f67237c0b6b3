package org.abstractica.fiveinarow.server.session;

import org.abstractica.fiveinarow.engine.GameSnapshot;
import org.abstractica.fiveinarow.engine.GuardedGame;
import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.Response;
import org.abstractica.fiveinarow.protocol.serialization.GameProtocol;
import org.abstractica.fiveinarow.server.DisconnectReason;
import org.abstractica.fiveinarow.server.Server;
import org.abstractica.fiveinarow.server.ServerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of the Server interface.
 *
 * <p>Runs an accept loop on a background thread and gives every accepted
 * socket its own {@link PeerConnection}. Commands from all connections are
 * applied to one {@link GuardedGame}; each response is routed while the game
 * lock is still held, so every peer sees broadcasts in the order the game
 * applied them.</p>
 */
public class DefaultServer implements Server, ConnectionCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultServer.class);

    /**
     * Peer name recorded for commands issued from the server console.
     */
    static final String SERVER_PEER = "server";

    private final InetSocketAddress bindAddress;
    private final GuardedGame game;
    private final GameProtocol protocol;
    private final int maxFrameSize;

    private final ConnectionRegistry registry;
    private final Set<PeerConnection> connections;
    private final DefaultServerStats stats;

    private volatile ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;
    private volatile boolean acceptingConnections;

    /**
     * Creates a new server.
     *
     * <p>Use {@link DefaultServerFactory} to create instances.</p>
     */
    DefaultServer(
            InetSocketAddress bindAddress,
            GuardedGame game,
            GameProtocol protocol,
            int maxFrameSize
    )
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.game = Objects.requireNonNull(game, "game");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.maxFrameSize = maxFrameSize;

        this.registry = new ConnectionRegistry();
        this.connections = ConcurrentHashMap.newKeySet();
        this.stats = new DefaultServerStats(registry);

        this.running = false;
        this.acceptingConnections = false;
    }

    // ========== Server Interface ==========

    @Override
    public synchronized void start()
    {
        if (running)
        {
            throw new IllegalStateException("Server already started");
        }

        LOG.info("Starting server on {}", bindAddress);

        ServerSocket socket;
        try
        {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(bindAddress);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Could not bind " + bindAddress, e);
        }

        serverSocket = socket;
        running = true;
        acceptingConnections = true;

        acceptThread = new Thread(this::acceptLoop, "server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        LOG.info("Server started on {}", getLocalAddress());
    }

    @Override
    public synchronized void stop()
    {
        if (!acceptingConnections)
        {
            return;
        }
        LOG.info("Stopping server (no new connections)");
        acceptingConnections = false;
        closeServerSocket();
    }

    @Override
    public synchronized void close()
    {
        if (!running)
        {
            return;
        }

        LOG.info("Closing server");

        running = false;
        acceptingConnections = false;
        closeServerSocket();

        for (PeerConnection connection : connections)
        {
            connection.close(new DisconnectReason.ServerShutdown());
        }

        LOG.info("Server closed");
    }

    @Override
    public InetSocketAddress getLocalAddress()
    {
        ServerSocket socket = serverSocket;
        if (socket == null)
        {
            throw new IllegalStateException("Server not started");
        }
        return new InetSocketAddress(socket.getInetAddress(), socket.getLocalPort());
    }

    @Override
    public ServerStats getStats()
    {
        return stats;
    }

    @Override
    public void resetGame()
    {
        LOG.info("Resetting game from the server");
        game.submit(new Command.Reset(), SERVER_PEER, response -> route(response, null));
    }

    @Override
    public GameSnapshot snapshot()
    {
        return game.snapshot();
    }

    // ========== ConnectionCallback ==========

    @Override
    public GameProtocol getProtocol()
    {
        return protocol;
    }

    @Override
    public void onCommand(PeerConnection connection, Command command)
    {
        try
        {
            Response response = game.submit(command, connection.getPeer(), r -> route(r, connection));
            stats.recordCommand(response instanceof Response.Fail);
        }
        catch (UnknownPeerException e)
        {
            stats.recordCommand(false);
            LOG.error("Response to {} from {} was not delivered: {}", command, connection.getPeer(), e.getMessage());
        }
    }

    @Override
    public void onClosed(PeerConnection connection, DisconnectReason reason)
    {
        connections.remove(connection);
        registry.unregister(connection.getPeer(), connection);

        if (reason instanceof DisconnectReason.ProtocolError)
        {
            stats.recordProtocolError();
            LOG.warn("Connection {} closed: {}", connection.getPeer(), reason);
        }
        else if (reason instanceof DisconnectReason.NetworkError error)
        {
            LOG.info("Connection {} lost: {}", connection.getPeer(), error.cause().getMessage());
        }
        else
        {
            LOG.info("Connection {} closed: {}", connection.getPeer(), reason);
        }
    }

    // ========== Internal ==========

    private void acceptLoop()
    {
        ServerSocket socket = serverSocket;
        while (acceptingConnections)
        {
            try
            {
                Socket client = socket.accept();
                openConnection(client);
            }
            catch (IOException e)
            {
                if (!acceptingConnections)
                {
                    break;
                }
                LOG.warn("Error accepting connection: {}", e.getMessage());
            }
            catch (Exception e)
            {
                LOG.error("Error in accept loop", e);
            }
        }
        LOG.debug("Accept loop ended");
    }

    /**
     * Registers and starts a connection for an accepted socket. Holds the
     * server monitor so a concurrent {@link #close()} either sees the new
     * connection or makes this method reject the socket.
     */
    synchronized void openConnection(Socket socket) throws IOException
    {
        if (!running)
        {
            LOG.debug("Rejecting connection from {} after shutdown", socket.getRemoteSocketAddress());
            socket.close();
            return;
        }
        try
        {
            socket.setTcpNoDelay(true);
        }
        catch (IOException e)
        {
            try
            {
                socket.close();
            }
            catch (IOException suppressed)
            {
                e.addSuppressed(suppressed);
            }
            throw e;
        }

        PeerConnection connection = new PeerConnection(socket, this, maxFrameSize);
        connections.add(connection);
        registry.register(connection.getPeer(), connection);
        stats.recordConnection();

        LOG.info("Accepted connection from {}", connection.getPeer());
        connection.start();
    }

    /**
     * Delivers a response. Runs under the game lock.
     *
     * <p>A direct reply to the connection that sent the command goes straight
     * to that connection, which may already be closing. Any other direct
     * reply must name a registered peer.</p>
     *
     * @param origin the connection the command came from, or null for
     *               server-issued commands
     */
    private void route(Response response, PeerConnection origin)
    {
        byte[] payload = protocol.encodeResponse(response);
        if (response.isBroadcast())
        {
            int delivered = registry.broadcast(payload);
            LOG.debug("Broadcast {} to {} peers", response, delivered);
        }
        else
        {
            String recipient = recipientOf(response);
            if (origin != null && origin.getPeer().equals(recipient))
            {
                if (!origin.offer(payload))
                {
                    LOG.debug("Dropped {} for closed connection {}", response, recipient);
                }
            }
            else
            {
                registry.directMessage(payload, recipient);
            }
        }
    }

    private static String recipientOf(Response response)
    {
        if (response instanceof Response.Ok ok)
        {
            return ok.peer();
        }
        if (response instanceof Response.Fail fail)
        {
            return fail.peer();
        }
        throw new IllegalArgumentException("Response has no recipient: " + response);
    }

    private void closeServerSocket()
    {
        ServerSocket socket = serverSocket;
        if (socket == null)
        {
            return;
        }
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing listen socket: {}", e.getMessage());
        }
    }
}
