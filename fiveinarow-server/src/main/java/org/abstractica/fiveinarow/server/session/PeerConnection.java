package org.abstractica.fiveinarow.server.session;

import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.serialization.DecodeException;
import org.abstractica.fiveinarow.server.DisconnectReason;
import org.abstractica.fiveinarow.server.transport.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One accepted TCP connection.
 *
 * <p>A reader thread decodes incoming frames into commands and hands them to
 * the {@link ConnectionCallback}. A writer thread drains the outbound queue
 * to the socket. Neither direction waits on the other, and
 * {@link #offer(byte[])} never blocks.</p>
 *
 * <p>The first failure in either direction closes the connection. Closing
 * is idempotent and reports a single {@link DisconnectReason}.</p>
 */
public class PeerConnection implements OutboundChannel
{
    private static final Logger LOG = LoggerFactory.getLogger(PeerConnection.class);

    private final Socket socket;
    private final String peer;
    private final ConnectionCallback callback;
    private final int maxFrameSize;

    private final BlockingQueue<byte[]> outbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Thread readerThread;
    private Thread writerThread;

    public PeerConnection(Socket socket, ConnectionCallback callback, int maxFrameSize)
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.callback = Objects.requireNonNull(callback, "callback");
        if (maxFrameSize <= 0)
        {
            throw new IllegalArgumentException("maxFrameSize must be positive: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
        this.peer = describe(socket.getRemoteSocketAddress());
    }

    /**
     * Formats a socket address as the {@code host:port} string used to
     * identify peers.
     *
     * @param address the address
     * @return the peer identifier
     */
    public static String describe(SocketAddress address)
    {
        if (address instanceof InetSocketAddress inet && inet.getAddress() != null)
        {
            return inet.getAddress().getHostAddress() + ":" + inet.getPort();
        }
        return String.valueOf(address);
    }

    /**
     * Starts the reader and writer threads.
     */
    public void start()
    {
        writerThread = new Thread(this::writeLoop, "peer-writer-" + peer);
        writerThread.setDaemon(true);
        writerThread.start();

        readerThread = new Thread(this::readLoop, "peer-reader-" + peer);
        readerThread.setDaemon(true);
        readerThread.start();

        LOG.debug("Connection {} started", peer);
    }

    public String getPeer()
    {
        return peer;
    }

    /**
     * Returns the number of payloads waiting for the writer.
     */
    int pendingMessages()
    {
        return outbound.size();
    }

    @Override
    public boolean offer(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (closed.get())
        {
            return false;
        }
        return outbound.offer(payload);
    }

    /**
     * Closes the connection. Only the first call has any effect.
     *
     * @param reason why the connection is closing
     */
    public void close(DisconnectReason reason)
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket for {}: {}", peer, e.getMessage());
        }
        if (writerThread != null)
        {
            writerThread.interrupt();
        }
        outbound.clear();

        callback.onClosed(this, reason);
    }

    // ========== Reader ==========

    private void readLoop()
    {
        close(readCommands());
    }

    private DisconnectReason readCommands()
    {
        try
        {
            DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            while (!closed.get())
            {
                byte[] frame = FrameCodec.readFrame(in, maxFrameSize);
                if (frame == null)
                {
                    return new DisconnectReason.EndOfStream();
                }

                Command command = callback.getProtocol().decodeCommand(frame);
                LOG.debug("Received {} from {}", command, peer);
                dispatch(command);
            }
            return new DisconnectReason.ServerShutdown();
        }
        catch (DecodeException e)
        {
            LOG.warn("Malformed input from {}: {}", peer, e.getMessage());
            return new DisconnectReason.ProtocolError(e.getMessage());
        }
        catch (IOException e)
        {
            if (closed.get())
            {
                return new DisconnectReason.ServerShutdown();
            }
            return new DisconnectReason.NetworkError(e);
        }
    }

    private void dispatch(Command command)
    {
        try
        {
            callback.onCommand(this, command);
        }
        catch (RuntimeException e)
        {
            LOG.error("Error handling {} from {}", command, peer, e);
        }
    }

    // ========== Writer ==========

    private void writeLoop()
    {
        try
        {
            DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
            while (!closed.get())
            {
                byte[] payload = outbound.take();
                FrameCodec.writeFrame(out, payload);
                if (outbound.isEmpty())
                {
                    out.flush();
                }
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (IOException e)
        {
            close(new DisconnectReason.NetworkError(e));
        }
    }

    @Override
    public String toString()
    {
        return "PeerConnection[" + peer + "]";
    }
}
