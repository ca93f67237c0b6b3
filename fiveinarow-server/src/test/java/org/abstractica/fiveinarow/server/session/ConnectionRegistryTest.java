package org.abstractica.fiveinarow.server.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConnectionRegistry.
 */
class ConnectionRegistryTest
{
    private static final byte[] PAYLOAD = {1, 2, 3};

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp()
    {
        registry = new ConnectionRegistry();
    }

    private static final class RecordingChannel implements OutboundChannel
    {
        final List<byte[]> received = new ArrayList<>();
        boolean open = true;

        @Override
        public boolean offer(byte[] payload)
        {
            if (!open)
            {
                return false;
            }
            received.add(payload);
            return true;
        }
    }

    // ========== Registration ==========

    @Test
    void register_addsPeer()
    {
        registry.register("10.0.0.1:4000", new RecordingChannel());

        assertTrue(registry.contains("10.0.0.1:4000"));
        assertEquals(1, registry.size());
        assertEquals(Set.of("10.0.0.1:4000"), registry.peers());
    }

    @Test
    void unregister_onlyRemovesMatchingChannel()
    {
        RecordingChannel old = new RecordingChannel();
        RecordingChannel current = new RecordingChannel();
        registry.register("peer:1", old);
        registry.register("peer:1", current);

        assertFalse(registry.unregister("peer:1", old));
        assertTrue(registry.contains("peer:1"));

        assertTrue(registry.unregister("peer:1", current));
        assertFalse(registry.contains("peer:1"));
    }

    // ========== Delivery ==========

    @Test
    void broadcast_reachesEveryPeer()
    {
        RecordingChannel a = new RecordingChannel();
        RecordingChannel b = new RecordingChannel();
        registry.register("a:1", a);
        registry.register("b:1", b);

        int delivered = registry.broadcast(PAYLOAD);

        assertEquals(2, delivered);
        assertEquals(1, a.received.size());
        assertEquals(1, b.received.size());
    }

    @Test
    void broadcast_prunesClosedChannel()
    {
        RecordingChannel alive = new RecordingChannel();
        RecordingChannel dead = new RecordingChannel();
        dead.open = false;
        registry.register("alive:1", alive);
        registry.register("dead:1", dead);

        int delivered = registry.broadcast(PAYLOAD);

        assertEquals(1, delivered);
        assertEquals(1, alive.received.size());
        assertFalse(registry.contains("dead:1"));
        assertTrue(registry.contains("alive:1"));
    }

    @Test
    void directMessage_reachesOnlyRecipient()
    {
        RecordingChannel a = new RecordingChannel();
        RecordingChannel b = new RecordingChannel();
        registry.register("a:1", a);
        registry.register("b:1", b);

        assertTrue(registry.directMessage(PAYLOAD, "b:1"));

        assertTrue(a.received.isEmpty());
        assertEquals(1, b.received.size());
        assertSame(PAYLOAD, b.received.get(0));
    }

    @Test
    void directMessage_unknownPeer_throws()
    {
        UnknownPeerException e = assertThrows(UnknownPeerException.class,
                () -> registry.directMessage(PAYLOAD, "nobody:1"));

        assertEquals("nobody:1", e.getPeer());
    }

    @Test
    void directMessage_closedChannel_prunesAndReturnsFalse()
    {
        RecordingChannel dead = new RecordingChannel();
        dead.open = false;
        registry.register("dead:1", dead);

        assertFalse(registry.directMessage(PAYLOAD, "dead:1"));
        assertFalse(registry.contains("dead:1"));
    }

    @Test
    void peers_isSnapshot()
    {
        registry.register("a:1", new RecordingChannel());
        Set<String> peers = registry.peers();

        registry.register("b:1", new RecordingChannel());

        assertEquals(1, peers.size());
        assertThrows(UnsupportedOperationException.class, () -> peers.add("c:1"));
    }
}
