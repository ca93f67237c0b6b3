package org.abstractica.fiveinarow.engine;

import org.abstractica.fiveinarow.protocol.Command;
import org.abstractica.fiveinarow.protocol.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GuardedGame}.
 */
class GuardedGameTest
{
    private GuardedGame guarded;

    @BeforeEach
    void setUp()
    {
        guarded = new GuardedGame(new Game());
    }

    @Test
    void submit_deliversResponseToSink()
    {
        List<Response> delivered = new ArrayList<>();

        Response response = guarded.submit(new Command.Connect("A"), "peer-a", delivered::add);

        assertEquals(List.of(response), delivered);
    }

    @Test
    void read_seesAppliedState()
    {
        guarded.submit(new Command.Connect("A"), "peer-a", r -> {});
        guarded.submit(new Command.Connect("B"), "peer-b", r -> {});

        assertEquals(GamePhase.OPENING, guarded.read(Game::getPhase));
        assertEquals(2, guarded.snapshot().players().size());
    }

    @Test
    void concurrentConnects_allRegistered() throws Exception
    {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Response>> results = new ArrayList<>();
        try
        {
            for (int i = 0; i < threads; i++)
            {
                String name = "player-" + i;
                results.add(executor.submit(() ->
                {
                    start.await();
                    return guarded.submit(new Command.Connect(name), name, r -> {});
                }));
            }
            start.countDown();
        }
        finally
        {
            executor.shutdown();
        }

        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        for (Future<Response> result : results)
        {
            assertInstanceOf(Response.Ok.class, result.get());
        }
        int size = guarded.read(game -> game.getPlayers().size());
        assertEquals(threads, size);
    }

    @Test
    void concurrentMoves_sinkOrderMatchesApplyOrder() throws Exception
    {
        guarded.submit(new Command.Connect("A"), "peer-a", r -> {});
        guarded.submit(new Command.Connect("B"), "peer-b", r -> {});

        List<Response> delivered = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger accepted = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> workers = new ArrayList<>();

        // Both players hammer the board; only legal alternating moves succeed
        for (String name : new String[]{"A", "B"})
        {
            int offset = name.equals("A") ? 0 : 1;
            workers.add(executor.submit(() ->
            {
                start.await();
                for (int cell = offset; cell < 200; cell += 2)
                {
                    Response response = guarded.submit(new Command.Move(cell, name), "peer-" + name, delivered::add);
                    if (response instanceof Response.Move)
                    {
                        accepted.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        for (Future<?> worker : workers)
        {
            worker.get();
        }

        int lastColor = 0;
        int moves = 0;
        for (Response response : delivered)
        {
            if (response instanceof Response.Move move)
            {
                assertNotEquals(lastColor, move.color(), "Colors must alternate in delivery order");
                lastColor = move.color();
                moves++;
            }
        }
        assertEquals(accepted.get(), moves);

        int[] cells = guarded.snapshot().cells();
        int occupied = 0;
        for (int cell : cells)
        {
            if (cell != Board.EMPTY)
            {
                occupied++;
            }
        }
        assertEquals(moves, occupied);
    }
}
