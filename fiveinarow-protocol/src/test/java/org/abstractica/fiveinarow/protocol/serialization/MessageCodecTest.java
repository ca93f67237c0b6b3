package org.abstractica.fiveinarow.protocol.serialization;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MessageCodec}.
 */
class MessageCodecTest
{
    // ========== Test Records ==========

    record Cell(int index, String owner) {}
    record Outcome(Optional<String> winner, boolean finished) {}
    record Stamped(long stamp) {}
    record Nested(Cell cell, int color) {}

    // ========== Layout ==========

    @Test
    void encode_intAndString_layout()
    {
        byte[] encoded = MessageCodec.encode(new Cell(7, "ab"));

        // 4-byte int, 2-byte length, 2 UTF-8 bytes
        assertArrayEquals(new byte[]{0, 0, 0, 7, 0, 2, 'a', 'b'}, encoded);
    }

    @Test
    void encode_emptyOptional_writesPresenceByteOnly()
    {
        byte[] encoded = MessageCodec.encode(new Outcome(Optional.empty(), false));

        assertArrayEquals(new byte[]{0, 0}, encoded);
    }

    @Test
    void calculateSize_matchesEncodedLength()
    {
        Nested nested = new Nested(new Cell(224, "Ærø"), 2);

        assertEquals(MessageCodec.encode(nested).length, MessageCodec.calculateSize(nested));
    }

    // ========== Round Trips ==========

    @Test
    void decode_presentOptional()
    {
        Outcome original = new Outcome(Optional.of("alice"), true);

        assertEquals(original, MessageCodec.decode(MessageCodec.encode(original), Outcome.class));
    }

    @Test
    void decode_nestedRecordWithUnicode()
    {
        Nested original = new Nested(new Cell(3, "こんにちは"), 1);

        assertEquals(original, MessageCodec.decode(MessageCodec.encode(original), Nested.class));
    }

    // ========== Malformed Input ==========

    @Test
    void decode_truncated_throws()
    {
        byte[] encoded = MessageCodec.encode(new Cell(1, "bob"));
        byte[] truncated = new byte[encoded.length - 1];
        System.arraycopy(encoded, 0, truncated, 0, truncated.length);

        assertThrows(DecodeException.class, () -> MessageCodec.decode(truncated, Cell.class));
    }

    @Test
    void decode_trailingBytes_throws()
    {
        byte[] encoded = MessageCodec.encode(new Cell(1, "bob"));
        byte[] padded = new byte[encoded.length + 1];
        System.arraycopy(encoded, 0, padded, 0, encoded.length);

        assertThrows(DecodeException.class, () -> MessageCodec.decode(padded, Cell.class));
    }

    @Test
    void decode_stringLengthBeyondPayload_throws()
    {
        byte[] data = {0, 0, 0, 1, 0x7F, 0x7F, 'x'};

        assertThrows(DecodeException.class, () -> MessageCodec.decode(data, Cell.class));
    }

    @Test
    void decode_invalidUtf8_throws()
    {
        byte[] data = {0, 0, 0, 1, 0, 1, (byte) 0xFF};

        assertThrows(DecodeException.class, () -> MessageCodec.decode(data, Cell.class));
    }

    @Test
    void decode_invalidPresenceByte_throws()
    {
        byte[] data = {5, 0};

        assertThrows(DecodeException.class, () -> MessageCodec.decode(data, Outcome.class));
    }

    // ========== Unsupported Types ==========

    @Test
    void unsupportedComponentType_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> MessageCodec.encode(new Stamped(1L)));
        assertThrows(IllegalArgumentException.class,
                () -> MessageCodec.decode(new byte[8], Stamped.class));
    }

    @Test
    void encode_stringTooLong_throws()
    {
        String huge = "x".repeat(MessageCodec.MAX_STRING_LENGTH + 1);

        assertThrows(IllegalArgumentException.class, () -> MessageCodec.encode(new Cell(0, huge)));
    }

    @Test
    void encode_multiByteCharacters_countsBytesNotChars()
    {
        String name = "ø";
        byte[] encoded = MessageCodec.encode(new Cell(0, name));

        assertEquals(4 + 2 + name.getBytes(StandardCharsets.UTF_8).length, encoded.length);
    }
}
