package com.bank.dispute.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work on a single dispute. Different disputes proceed in parallel.
 * Locks are created on first use and kept for the life of the process.
 */
@Component
public class DisputeLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String disputeId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(disputeId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return locks.size();
    }
}
