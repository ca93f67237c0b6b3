package org.abstractica.fiveinarow.server.session;

import org.abstractica.fiveinarow.engine.Game;
import org.abstractica.fiveinarow.engine.GuardedGame;
import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.serialization.GameProtocol;
import org.abstractica.fiveinarow.server.DisconnectReason;
import org.abstractica.fiveinarow.server.transport.FrameCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultServer's connection handling without the accept loop.
 */
class DefaultServerTest
{
    private DefaultServer server;
    private ServerSocket listener;
    private Socket client;
    private Socket accepted;

    @BeforeEach
    void setUp() throws IOException
    {
        server = new DefaultServer(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0),
                new GuardedGame(new Game()),
                new GameProtocol(),
                FrameCodec.DEFAULT_MAX_FRAME_SIZE
        );

        listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        client = new Socket(InetAddress.getLoopbackAddress(), listener.getLocalPort());
        accepted = listener.accept();
    }

    @AfterEach
    void tearDown() throws IOException
    {
        server.close();
        client.close();
        accepted.close();
        listener.close();
    }

    // ========== Shutdown ==========

    @Test
    void openConnection_afterShutdown_closesSocketWithoutRegistering() throws IOException
    {
        server.openConnection(accepted);

        assertTrue(accepted.isClosed());
        assertEquals(0, server.getStats().getActiveConnections());
        assertEquals(0, server.getStats().getTotalConnections());

        client.setSoTimeout(5000);
        assertEquals(-1, client.getInputStream().read());
    }

    // ========== Direct Replies ==========

    @Test
    void onCommand_replyGoesToOriginatingConnection()
    {
        PeerConnection connection = new PeerConnection(accepted, server, FrameCodec.DEFAULT_MAX_FRAME_SIZE);

        server.onCommand(connection, new Command.Connect("alice"));

        assertEquals(1, connection.pendingMessages());
        assertEquals(1, server.getStats().getCommandsProcessed());
        assertEquals(0, server.getStats().getRejectedCommands());
    }

    @Test
    void onCommand_closedOrigin_dropsReplyAndKeepsGameState()
    {
        PeerConnection connection = new PeerConnection(accepted, server, FrameCodec.DEFAULT_MAX_FRAME_SIZE);
        connection.close(new DisconnectReason.NetworkError(new IOException("Broken pipe")));

        assertDoesNotThrow(() -> server.onCommand(connection, new Command.Connect("bob")));

        assertEquals(0, connection.pendingMessages());
        assertEquals(1, server.getStats().getCommandsProcessed());
        assertEquals(1, server.snapshot().players().size());
    }

    @Test
    void onCommand_failReplyCountedAsRejection()
    {
        PeerConnection connection = new PeerConnection(accepted, server, FrameCodec.DEFAULT_MAX_FRAME_SIZE);

        server.onCommand(connection, new Command.Move(0, "alice"));

        assertEquals(1, connection.pendingMessages());
        assertEquals(1, server.getStats().getRejectedCommands());
    }
}
