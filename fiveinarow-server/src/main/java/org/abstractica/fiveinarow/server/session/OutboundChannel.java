package org.abstractica.fiveinarow.server.session;

/**
 * Non-blocking outbound path to one peer.
 */
public interface OutboundChannel
{
    /**
     * Queues an encoded message for delivery.
     *
     * <p>Must never block.</p>
     *
     * @param payload the encoded message
     * @return false if the channel is closed and the payload was dropped
     */
    boolean offer(byte[] payload);
}
