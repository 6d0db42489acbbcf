package com.fixedrate.common;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Whole-instance mutual exclusion that refuses re-entry. A thread already inside a guarded section gets
 * {@code false} from {@link #tryEnter()} instead of nesting; other threads wait for the holder to leave.
 */
public class NonReentrantLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * Acquires the lock for the current thread. Returns false, without acquiring, when the current thread
     * already holds it.
     */
    public boolean tryEnter() {
        if (lock.isHeldByCurrentThread()) {
            return false;
        }
        lock.lock();
        return true;
    }

    public void exit() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * Runs a read under the lock. A thread already inside a guarded section reads in place.
     */
    public <T> T read(Supplier<T> reader) {
        if (lock.isHeldByCurrentThread()) {
            return reader.get();
        }
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }
}
