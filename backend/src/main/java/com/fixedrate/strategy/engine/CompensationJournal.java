package com.fixedrate.strategy.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo actions for collaborator calls (token transfers, venue deposits and withdrawals) that already took effect
 * inside the engine call in flight. A failed call unwinds them newest first; a committed call clears them.
 * Only touched while the engine lock is held.
 */
@Slf4j
public class CompensationJournal {

    private final Deque<Compensation> pending = new ArrayDeque<>();

    public void record(String description, Runnable undo) {
        pending.push(new Compensation(description, undo));
    }

    public void clear() {
        pending.clear();
    }

    public int size() {
        return pending.size();
    }

    /**
     * Runs every recorded undo, newest first. An undo that fails is logged and attached to {@code cause} as a
     * suppressed exception; the remaining ones still run.
     */
    public void unwind(RuntimeException cause) {
        while (!pending.isEmpty()) {
            Compensation compensation = pending.pop();
            try {
                compensation.undo().run();
                log.debug("Compensated: {}", compensation.description());
            } catch (RuntimeException e) {
                log.error("Compensation failed ({}): {}", compensation.description(), e.getMessage(), e);
                cause.addSuppressed(e);
            }
        }
    }

    private record Compensation(String description, Runnable undo) {
    }
}
