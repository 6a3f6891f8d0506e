package it.unimib.datai.faaslocal.scheduler.queue;

import it.unimib.datai.faaslocal.common.model.Invocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO of invocations waiting for one function's process to pick them up.
 * Every operation takes the same lock and never blocks on anything else.
 */
public class InvocationQueue {
    private final String functionName;
    private final ArrayDeque<Invocation> pending = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public InvocationQueue(String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    public void push(Invocation invocation) {
        lock.lock();
        try {
            pending.addLast(invocation);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Invocation> pop() {
        lock.lock();
        try {
            return Optional.ofNullable(pending.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns everything still queued, oldest first.
     */
    public List<Invocation> drain() {
        lock.lock();
        try {
            List<Invocation> drained = new ArrayList<>(pending);
            pending.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
