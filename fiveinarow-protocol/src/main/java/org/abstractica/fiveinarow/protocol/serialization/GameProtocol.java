package org.abstractica.fiveinarow.protocol.serialization;

import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the {@link Command} and {@link Response} hierarchies to wire type IDs
 * and converts messages to and from their binary form.
 *
 * <p>Every message is a 2-byte big-endian type ID followed by the
 * {@link MessageCodec} encoding of the record. Commands use IDs
 * 0x0000-0x7FFF and responses use 0x8000-0xFFFF. Within each range the IDs
 * follow the fully-qualified class names in sorted order, so both ends
 * derive the same table from the same classes.</p>
 *
 * <p>Instances are immutable and safe to share between connections.</p>
 */
public final class GameProtocol
{
    private static final Logger LOG = LoggerFactory.getLogger(GameProtocol.class);

    private static final int TYPE_ID_SIZE = 2;
    private static final int RESPONSE_ID_BASE = 0x8000;

    private final Map<Class<?>, Integer> typeToId;
    private final Map<Integer, Class<? extends Record>> idToType;

    /**
     * Creates the protocol from the sealed message hierarchies.
     */
    public GameProtocol()
    {
        Map<Class<?>, Integer> types = new HashMap<>();
        Map<Integer, Class<? extends Record>> ids = new HashMap<>();

        assignIds(Command.class, 0, types, ids);
        assignIds(Response.class, RESPONSE_ID_BASE, types, ids);

        this.typeToId = Map.copyOf(types);
        this.idToType = Map.copyOf(ids);

        LOG.debug("Protocol registered {} message types", idToType.size());
    }

    /**
     * Gets the type ID for a message class.
     *
     * @param messageClass the message class
     * @return the type ID
     * @throws IllegalArgumentException if the class is not registered
     */
    public int getTypeId(Class<?> messageClass)
    {
        Integer id = typeToId.get(messageClass);
        if (id == null)
        {
            throw new IllegalArgumentException("Unknown message type: " + messageClass.getName());
        }
        return id;
    }

    /**
     * Checks if a type ID belongs to a command.
     *
     * @param typeId the type ID
     * @return true if command (0x0000-0x7FFF)
     */
    public boolean isCommand(int typeId)
    {
        return (typeId & RESPONSE_ID_BASE) == 0;
    }

    // ========== Encoding ==========

    /**
     * Encodes a command (type ID + payload).
     *
     * @param command the command
     * @return encoded bytes
     */
    public byte[] encodeCommand(Command command)
    {
        return encodeMessage((Record) Objects.requireNonNull(command, "command"));
    }

    /**
     * Encodes a response (type ID + payload).
     *
     * @param response the response
     * @return encoded bytes
     */
    public byte[] encodeResponse(Response response)
    {
        return encodeMessage((Record) Objects.requireNonNull(response, "response"));
    }

    private byte[] encodeMessage(Record message)
    {
        int typeId = getTypeId(message.getClass());
        byte[] payload = MessageCodec.encode(message);

        ByteBuffer buffer = ByteBuffer.allocate(TYPE_ID_SIZE + payload.length);
        buffer.putShort((short) typeId);
        buffer.put(payload);
        return buffer.array();
    }

    // ========== Decoding ==========

    /**
     * Decodes a command received from a client.
     *
     * @param data the encoded bytes (type ID + payload)
     * @return the decoded command
     * @throws DecodeException if the bytes are not exactly one valid command
     */
    public Command decodeCommand(byte[] data)
    {
        int typeId = peekTypeId(data);
        if (!isCommand(typeId))
        {
            throw new DecodeException("Expected command (0x0000-0x7FFF), got type ID: 0x" + Integer.toHexString(typeId));
        }
        return (Command) decodeMessage(typeId, data);
    }

    /**
     * Decodes a response received from the server.
     *
     * @param data the encoded bytes (type ID + payload)
     * @return the decoded response
     * @throws DecodeException if the bytes are not exactly one valid response
     */
    public Response decodeResponse(byte[] data)
    {
        int typeId = peekTypeId(data);
        if (isCommand(typeId))
        {
            throw new DecodeException("Expected response (0x8000-0xFFFF), got type ID: 0x" + Integer.toHexString(typeId));
        }
        return (Response) decodeMessage(typeId, data);
    }

    private Record decodeMessage(int typeId, byte[] data)
    {
        Class<? extends Record> clazz = idToType.get(typeId);
        if (clazz == null)
        {
            throw new DecodeException("Unknown type ID: 0x" + Integer.toHexString(typeId));
        }

        byte[] payload = new byte[data.length - TYPE_ID_SIZE];
        System.arraycopy(data, TYPE_ID_SIZE, payload, 0, payload.length);
        return MessageCodec.decode(payload, clazz);
    }

    private int peekTypeId(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        if (data.length < TYPE_ID_SIZE)
        {
            throw new DecodeException("Data too short to contain type ID: " + data.length + " bytes");
        }
        return ((data[0] & 0xFF) << 8) | (data[1] & 0xFF);
    }

    // ========== Registry ==========

    @SuppressWarnings("unchecked")
    private static void assignIds(
            Class<?> sealedInterface,
            int firstId,
            Map<Class<?>, Integer> types,
            Map<Integer, Class<? extends Record>> ids
    )
    {
        List<Class<? extends Record>> permitted = new ArrayList<>();
        for (Class<?> subclass : sealedInterface.getPermittedSubclasses())
        {
            if (!subclass.isRecord())
            {
                throw new IllegalArgumentException("Permitted type must be a record: " + subclass.getName());
            }
            permitted.add((Class<? extends Record>) subclass);
        }

        // Sort by fully-qualified name for deterministic ordering
        permitted.sort(Comparator.comparing(Class::getName));

        int id = firstId;
        for (Class<? extends Record> type : permitted)
        {
            types.put(type, id);
            ids.put(id, type);
            id++;
        }
    }
}
