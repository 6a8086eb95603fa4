package com.tinypool.core;

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Per-slot worker state, one entry per worker, created with the pool and never removed.
 * Every slot starts as {@link WorkerState#WAITING}.
 */
public class IdleRegistry {

    private final AtomicReferenceArray<WorkerState> states;

    public IdleRegistry(int slots) {
        if (slots < 1) {
            throw new IllegalArgumentException("Slots must be positive: " + slots);
        }
        this.states = new AtomicReferenceArray<>(slots);
        for (int i = 0; i < slots; i++) {
            states.set(i, WorkerState.WAITING);
        }
    }

    void markWaiting(int slot) {
        states.set(slot, WorkerState.WAITING);
    }

    void markBusy(int slot) {
        states.set(slot, WorkerState.BUSY);
    }

    void markTerminated(int slot) {
        states.set(slot, WorkerState.TERMINATED);
    }

    public WorkerState stateOf(int slot) {
        return states.get(slot);
    }

    public int idleCount() {
        return count(WorkerState.WAITING);
    }

    public int busyCount() {
        return count(WorkerState.BUSY);
    }

    public int terminatedCount() {
        return count(WorkerState.TERMINATED);
    }

    public int slots() {
        return states.length();
    }

    private int count(WorkerState state) {
        int n = 0;
        for (int i = 0; i < states.length(); i++) {
            if (states.get(i) == state) {
                n++;
            }
        }
        return n;
    }
}
