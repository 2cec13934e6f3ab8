package com.flyknight.server;

import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageType;
import com.flyknight.session.SessionRegistry;
import com.flyknight.state.GameStateStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pushes the full world to every session at a fixed rate.
 *
 * Each tick copies the snapshot under the store lock, then posts one
 * {@code game_state} message to all sessions. Both happen under the registry
 * lock (registry → store order), which every event broadcast also takes.
 * The loop then sleeps for whatever is left of the period. A late tick is
 * not made up for: the next one simply starts right away, so the rate never
 * exceeds the configured one.
 */
public class BroadcastLoop implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastLoop.class);

    private final GameStateStore store;
    private final SessionRegistry registry;
    private final Duration period;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong();
    private Thread thread;

    public BroadcastLoop(GameStateStore store, SessionRegistry registry, Duration period) {
        this.store = store;
        this.registry = registry;
        this.period = period;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        thread = new Thread(this, "broadcast-loop");
        thread.setDaemon(true);
        thread.start();
        logger.info("Broadcast loop started ({}ms period)", period.toMillis());
    }

    @Override
    public void run() {
        long periodNanos = period.toNanos();

        while (running.get()) {
            long started = System.nanoTime();

            try {
                tick();
            } catch (RuntimeException e) {
                logger.error("Broadcast tick failed", e);
            }

            long remaining = periodNanos - (System.nanoTime() - started);
            if (remaining > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.info("Broadcast loop stopped after {} ticks", ticks.get());
    }

    /**
     * Runs one broadcast: snapshot, then send to every live session. The
     * snapshot is taken inside the registry lock, so no event posted after it
     * can reach a peer ahead of it.
     */
    public void tick() {
        registry.broadcast(() -> Message.of(MessageType.GAME_STATE, store.snapshot()));
        ticks.incrementAndGet();
    }

    /**
     * Stops the loop and waits briefly for the worker to finish its tick.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(period.toMillis() * 2 + 100);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getTickCount() {
        return ticks.get();
    }
}
