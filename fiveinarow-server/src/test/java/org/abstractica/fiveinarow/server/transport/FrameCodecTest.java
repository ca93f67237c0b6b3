package org.abstractica.fiveinarow.server.transport;

import org.abstractica.fiveinarow.protocol.serialization.DecodeException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FrameCodec.
 */
class FrameCodecTest
{
    private static DataInputStream input(byte[] bytes)
    {
        return new DataInputStream(new ByteArrayInputStream(bytes));
    }

    private static DataInputStream input(int... values)
    {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++)
        {
            bytes[i] = (byte) values[i];
        }
        return input(bytes);
    }

    // ========== Writing ==========

    @Test
    void writeFrame_prefixesBigEndianLength() throws IOException
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);

        FrameCodec.writeFrame(out, new byte[]{0x0A, 0x0B, 0x0C});
        out.flush();

        assertArrayEquals(new byte[]{0, 0, 0, 3, 0x0A, 0x0B, 0x0C}, bytes.toByteArray());
    }

    @Test
    void writeFrame_emptyPayload_throws()
    {
        DataOutputStream out = new DataOutputStream(new ByteArrayOutputStream());

        assertThrows(IllegalArgumentException.class, () -> FrameCodec.writeFrame(out, new byte[0]));
    }

    // ========== Reading ==========

    @Test
    void readFrame_consecutiveFrames() throws IOException
    {
        DataInputStream in = input(0, 0, 0, 2, 1, 2, 0, 0, 0, 1, 9);

        assertArrayEquals(new byte[]{1, 2}, FrameCodec.readFrame(in, 16));
        assertArrayEquals(new byte[]{9}, FrameCodec.readFrame(in, 16));
        assertNull(FrameCodec.readFrame(in, 16));
    }

    @Test
    void readFrame_emptyStream_returnsNull() throws IOException
    {
        assertNull(FrameCodec.readFrame(input(), 16));
    }

    @Test
    void readFrame_largeLengthUsesAllHeaderBytes() throws IOException
    {
        byte[] frame = new byte[4 + 0x0102];
        frame[2] = 0x01;
        frame[3] = 0x02;

        byte[] payload = FrameCodec.readFrame(input(frame), 0x0102);

        assertEquals(0x0102, payload.length);
    }

    @Test
    void readFrame_truncatedHeader_throwsEof()
    {
        assertThrows(EOFException.class, () -> FrameCodec.readFrame(input(0, 0), 16));
    }

    @Test
    void readFrame_truncatedPayload_throwsEof()
    {
        assertThrows(EOFException.class, () -> FrameCodec.readFrame(input(0, 0, 0, 4, 1, 2), 16));
    }

    @Test
    void readFrame_zeroLength_throwsDecodeException()
    {
        assertThrows(DecodeException.class, () -> FrameCodec.readFrame(input(0, 0, 0, 0), 16));
    }

    @Test
    void readFrame_negativeLength_throwsDecodeException()
    {
        assertThrows(DecodeException.class,
                () -> FrameCodec.readFrame(input(0xFF, 0xFF, 0xFF, 0xFF), 16));
    }

    @Test
    void readFrame_overMaximum_throwsDecodeException()
    {
        assertThrows(DecodeException.class, () -> FrameCodec.readFrame(input(0, 0, 0, 17), 16));
    }

    @Test
    void readFrame_exactlyMaximum_accepted() throws IOException
    {
        byte[] frame = new byte[4 + 16];
        frame[3] = 16;

        assertEquals(16, FrameCodec.readFrame(input(frame), 16).length);
    }
}
