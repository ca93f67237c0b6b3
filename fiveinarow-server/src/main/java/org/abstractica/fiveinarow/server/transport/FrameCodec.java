package org.abstractica.fiveinarow.server.transport;

import org.abstractica.fiveinarow.protocol.serialization.DecodeException;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Objects;

/**
 * Reads and writes length-prefixed frames on a TCP stream.
 *
 * <p>A frame is a 4-byte big-endian payload length followed by the payload.
 * The length must be between 1 and the configured maximum.</p>
 */
public final class FrameCodec
{
    public static final int HEADER_SIZE = 4;
    public static final int DEFAULT_MAX_FRAME_SIZE = 4096;

    private FrameCodec() {}

    // ========== Reading ==========

    /**
     * Reads one frame.
     *
     * @param in           the stream to read from
     * @param maxFrameSize largest accepted payload length
     * @return the payload, or null if the stream ended cleanly before a new frame
     * @throws EOFException    if the stream ends inside a frame
     * @throws DecodeException if the length prefix is out of range
     * @throws IOException     on other read errors
     */
    public static byte[] readFrame(DataInputStream in, int maxFrameSize) throws IOException
    {
        Objects.requireNonNull(in, "in");

        int first = in.read();
        if (first < 0)
        {
            return null;
        }
        int length = (first << 24)
                | (in.readUnsignedByte() << 16)
                | (in.readUnsignedByte() << 8)
                | in.readUnsignedByte();

        if (length <= 0 || length > maxFrameSize)
        {
            throw new DecodeException("Frame length out of range 1.." + maxFrameSize + ": " + length);
        }

        byte[] payload = new byte[length];
        in.readFully(payload);
        return payload;
    }

    // ========== Writing ==========

    /**
     * Writes one frame. Does not flush.
     *
     * @param out     the stream to write to
     * @param payload the payload, at least one byte
     * @throws IOException on write errors
     */
    public static void writeFrame(DataOutputStream out, byte[] payload) throws IOException
    {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0)
        {
            throw new IllegalArgumentException("Frame payload must not be empty");
        }
        out.writeInt(payload.length);
        out.write(payload);
    }
}
