package org.abstractica.fiveinarow.protocol.serialization;

/**
 * Thrown when a payload cannot be decoded into a protocol message.
 *
 * <p>A malformed payload is fatal for the connection it arrived on and
 * must never reach the game.</p>
 */
public class DecodeException extends RuntimeException
{
    public DecodeException(String message)
    {
        super(message);
    }

    public DecodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
