package org.abstractica.fiveinarow.protocol.serialization;

import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Encodes and decodes Java records to/from wire format.
 *
 * <p>Components are written in declaration order, big-endian:</p>
 * <ul>
 *   <li>int: 4 bytes, boolean: 1 byte</li>
 *   <li>String: 2-byte length + UTF-8 bytes</li>
 *   <li>Optional&lt;T&gt;: 1-byte presence + value if present</li>
 *   <li>Nested records: serialized fields concatenated</li>
 * </ul>
 */
public final class MessageCodec
{
    private MessageCodec() {}

    /**
     * Maximum string length in bytes (2-byte length field).
     */
    public static final int MAX_STRING_LENGTH = 65535;

    // ========== Encoding ==========

    /**
     * Encodes a record to bytes.
     *
     * @param record the record to encode
     * @return encoded bytes
     */
    public static byte[] encode(Record record)
    {
        Objects.requireNonNull(record, "record");

        ByteBuffer buffer = ByteBuffer.allocate(calculateSize(record));
        encodeRecord(buffer, record);
        return buffer.array();
    }

    /**
     * Encodes a record into a ByteBuffer.
     *
     * @param buffer the buffer to write to
     * @param record the record to encode
     */
    public static void encodeRecord(ByteBuffer buffer, Record record)
    {
        for (RecordComponent component : record.getClass().getRecordComponents())
        {
            encodeValue(buffer, readComponent(record, component), component.getGenericType());
        }
    }

    private static void encodeValue(ByteBuffer buffer, Object value, Type type)
    {
        Class<?> rawType = getRawType(type);

        if (rawType == int.class || rawType == Integer.class)
        {
            buffer.putInt((Integer) value);
        }
        else if (rawType == boolean.class || rawType == Boolean.class)
        {
            buffer.put((byte) ((Boolean) value ? 1 : 0));
        }
        else if (rawType == String.class)
        {
            byte[] bytes = encodeUtf8((String) value);
            buffer.putShort((short) bytes.length);
            buffer.put(bytes);
        }
        else if (rawType == Optional.class)
        {
            Optional<?> optional = (Optional<?>) value;
            buffer.put((byte) (optional.isPresent() ? 1 : 0));
            if (optional.isPresent())
            {
                encodeValue(buffer, optional.get(), getTypeArgument(type));
            }
        }
        else if (rawType.isRecord())
        {
            encodeRecord(buffer, (Record) value);
        }
        else
        {
            throw new IllegalArgumentException("Unsupported type: " + rawType.getName());
        }
    }

    // ========== Decoding ==========

    /**
     * Decodes bytes to a record, requiring that every byte is consumed.
     *
     * @param data  the bytes to decode
     * @param clazz the record class
     * @param <T>   the record type
     * @return decoded record
     * @throws DecodeException if the bytes do not form exactly one record
     */
    public static <T extends Record> T decode(byte[] data, Class<T> clazz)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(clazz, "clazz");

        ByteBuffer buffer = ByteBuffer.wrap(data);
        T record = decodeRecord(buffer, clazz);
        if (buffer.hasRemaining())
        {
            throw new DecodeException(buffer.remaining() + " trailing bytes after " + clazz.getSimpleName());
        }
        return record;
    }

    /**
     * Decodes a record from a ByteBuffer.
     *
     * @param buffer the buffer to read from
     * @param clazz  the record class
     * @param <T>    the record type
     * @return decoded record
     * @throws DecodeException if the buffer is truncated or holds invalid values
     */
    public static <T extends Record> T decodeRecord(ByteBuffer buffer, Class<T> clazz)
    {
        if (!clazz.isRecord())
        {
            throw new IllegalArgumentException("Not a record class: " + clazz.getName());
        }

        RecordComponent[] components = clazz.getRecordComponents();
        Object[] args = new Object[components.length];
        Class<?>[] argTypes = new Class<?>[components.length];

        try
        {
            for (int i = 0; i < components.length; i++)
            {
                argTypes[i] = components[i].getType();
                args[i] = decodeValue(buffer, components[i].getGenericType());
            }
        }
        catch (BufferUnderflowException e)
        {
            throw new DecodeException("Truncated " + clazz.getSimpleName(), e);
        }

        try
        {
            Constructor<T> constructor = clazz.getDeclaredConstructor(argTypes);
            constructor.setAccessible(true);
            return constructor.newInstance(args);
        }
        catch (ReflectiveOperationException e)
        {
            throw new DecodeException("Failed to construct " + clazz.getSimpleName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Object decodeValue(ByteBuffer buffer, Type type)
    {
        Class<?> rawType = getRawType(type);

        if (rawType == int.class || rawType == Integer.class)
        {
            return buffer.getInt();
        }
        else if (rawType == boolean.class || rawType == Boolean.class)
        {
            return decodeBoolean(buffer.get());
        }
        else if (rawType == String.class)
        {
            return decodeString(buffer);
        }
        else if (rawType == Optional.class)
        {
            boolean present = decodeBoolean(buffer.get());
            return present ? Optional.of(decodeValue(buffer, getTypeArgument(type))) : Optional.empty();
        }
        else if (rawType.isRecord())
        {
            return decodeRecord(buffer, (Class<? extends Record>) rawType);
        }
        else
        {
            throw new IllegalArgumentException("Unsupported type: " + rawType.getName());
        }
    }

    private static boolean decodeBoolean(byte value)
    {
        if (value != 0 && value != 1)
        {
            throw new DecodeException("Invalid boolean byte: " + value);
        }
        return value == 1;
    }

    private static String decodeString(ByteBuffer buffer)
    {
        int length = buffer.getShort() & 0xFFFF;
        if (length > buffer.remaining())
        {
            throw new DecodeException("String length " + length + " exceeds remaining " + buffer.remaining() + " bytes");
        }
        ByteBuffer slice = buffer.slice();
        slice.limit(length);
        buffer.position(buffer.position() + length);
        try
        {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(slice)
                    .toString();
        }
        catch (CharacterCodingException e)
        {
            throw new DecodeException("Invalid UTF-8 string", e);
        }
    }

    // ========== Size calculation ==========

    /**
     * Calculates the encoded size of a record.
     *
     * @param record the record
     * @return size in bytes
     */
    public static int calculateSize(Record record)
    {
        int size = 0;
        for (RecordComponent component : record.getClass().getRecordComponents())
        {
            size += calculateValueSize(readComponent(record, component), component.getGenericType());
        }
        return size;
    }

    private static int calculateValueSize(Object value, Type type)
    {
        Class<?> rawType = getRawType(type);

        if (rawType == int.class || rawType == Integer.class)
        {
            return 4;
        }
        else if (rawType == boolean.class || rawType == Boolean.class)
        {
            return 1;
        }
        else if (rawType == String.class)
        {
            return 2 + encodeUtf8((String) value).length;
        }
        else if (rawType == Optional.class)
        {
            Optional<?> optional = (Optional<?>) value;
            return 1 + (optional.isPresent() ? calculateValueSize(optional.get(), getTypeArgument(type)) : 0);
        }
        else if (rawType.isRecord())
        {
            return calculateSize((Record) value);
        }
        throw new IllegalArgumentException("Unsupported type: " + rawType.getName());
    }

    // ========== Helpers ==========

    private static Object readComponent(Record record, RecordComponent component)
    {
        try
        {
            var accessor = component.getAccessor();
            accessor.setAccessible(true);
            Object value = accessor.invoke(record);
            return Objects.requireNonNull(value, () -> "Null component: " + component.getName());
        }
        catch (ReflectiveOperationException e)
        {
            throw new IllegalStateException("Failed to read component: " + component.getName(), e);
        }
    }

    private static byte[] encodeUtf8(String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_LENGTH)
        {
            throw new IllegalArgumentException("String too long: " + bytes.length + " bytes (max " + MAX_STRING_LENGTH + ")");
        }
        return bytes;
    }

    static Class<?> getRawType(Type type)
    {
        if (type instanceof Class<?> clazz)
        {
            return clazz;
        }
        if (type instanceof ParameterizedType parameterized)
        {
            return (Class<?>) parameterized.getRawType();
        }
        throw new IllegalArgumentException("Unsupported type: " + type);
    }

    private static Type getTypeArgument(Type type)
    {
        if (type instanceof ParameterizedType parameterized)
        {
            return parameterized.getActualTypeArguments()[0];
        }
        throw new IllegalArgumentException("Raw generic type without argument: " + type);
    }
}
