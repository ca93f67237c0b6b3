package org.abstractica.fiveinarow.server.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps peer addresses to their outbound channels.
 *
 * <p>Thread-safe. A channel that refuses a payload is considered closed and
 * is removed, so a dead peer never blocks delivery to the others.</p>
 */
public class ConnectionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, OutboundChannel> channels = new ConcurrentHashMap<>();

    /**
     * Registers a peer's channel.
     *
     * @param peer    the peer address
     * @param channel its outbound channel
     */
    public void register(String peer, OutboundChannel channel)
    {
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(channel, "channel");

        OutboundChannel previous = channels.put(peer, channel);
        if (previous != null && previous != channel)
        {
            LOG.warn("Peer {} re-registered, replacing its previous channel", peer);
        }
        LOG.debug("Registered peer {} ({} connected)", peer, channels.size());
    }

    /**
     * Removes a peer, but only if it is still mapped to the given channel.
     *
     * @param peer    the peer address
     * @param channel the channel being closed
     * @return true if the entry was removed
     */
    public boolean unregister(String peer, OutboundChannel channel)
    {
        boolean removed = channels.remove(peer, channel);
        if (removed)
        {
            LOG.debug("Unregistered peer {} ({} connected)", peer, channels.size());
        }
        return removed;
    }

    /**
     * Offers a payload to every registered peer.
     *
     * @param payload the encoded message
     * @return number of peers that accepted it
     */
    public int broadcast(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        int delivered = 0;
        for (Map.Entry<String, OutboundChannel> entry : channels.entrySet())
        {
            if (deliver(entry.getKey(), entry.getValue(), payload))
            {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Offers a payload to one peer.
     *
     * @param payload the encoded message
     * @param peer    the recipient
     * @return true if the peer's channel accepted it
     * @throws UnknownPeerException if the peer is not registered
     */
    public boolean directMessage(byte[] payload, String peer)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(peer, "peer");

        OutboundChannel channel = channels.get(peer);
        if (channel == null)
        {
            throw new UnknownPeerException(peer);
        }
        return deliver(peer, channel, payload);
    }

    public boolean contains(String peer)
    {
        return channels.containsKey(peer);
    }

    public int size()
    {
        return channels.size();
    }

    /**
     * Returns the registered peer addresses.
     *
     * @return an immutable copy
     */
    public Set<String> peers()
    {
        return Set.copyOf(channels.keySet());
    }

    private boolean deliver(String peer, OutboundChannel channel, byte[] payload)
    {
        if (channel.offer(payload))
        {
            return true;
        }
        if (channels.remove(peer, channel))
        {
            LOG.info("Pruned peer {} after a failed delivery", peer);
        }
        return false;
    }
}
