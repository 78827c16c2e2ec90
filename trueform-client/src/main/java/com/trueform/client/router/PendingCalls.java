package com.trueform.client.router;

import com.trueform.client.errors.TrueNasException;
import com.trueform.client.rpc.JsonRpcMessage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Routing table: one single-use delivery slot per in-flight request id.
 * Guarded by its own lock, independent of connection state.
 */
public class PendingCalls {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, CompletableFuture<JsonRpcMessage.Response>> slots = new HashMap<>();

    /**
     * Register a slot for {@code id}.
     *
     * @throws IllegalStateException if the id is already registered
     */
    public CompletableFuture<JsonRpcMessage.Response> register(long id) {
        CompletableFuture<JsonRpcMessage.Response> slot = new CompletableFuture<>();
        lock.lock();
        try {
            if (slots.putIfAbsent(id, slot) != null) {
                throw new IllegalStateException("request id " + id + " already in flight");
            }
        } finally {
            lock.unlock();
        }
        return slot;
    }

    public void unregister(long id) {
        lock.lock();
        try {
            slots.remove(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand a response to the caller waiting for its id.
     *
     * @return false if nobody is waiting any more or the slot was already settled
     */
    public boolean deliver(JsonRpcMessage.Response response) {
        if (response.getId() == null) {
            return false;
        }
        CompletableFuture<JsonRpcMessage.Response> slot;
        lock.lock();
        try {
            slot = slots.get(response.getId());
        } finally {
            lock.unlock();
        }
        return slot != null && slot.complete(response);
    }

    /**
     * Fail every waiting caller, e.g. when the connection drops.
     *
     * @return the number of callers that were failed
     */
    public int failAll(TrueNasException cause) {
        List<CompletableFuture<JsonRpcMessage.Response>> waiting;
        lock.lock();
        try {
            waiting = new ArrayList<>(slots.values());
        } finally {
            lock.unlock();
        }
        int failed = 0;
        for (CompletableFuture<JsonRpcMessage.Response> slot : waiting) {
            if (slot.completeExceptionally(cause)) {
                failed++;
            }
        }
        return failed;
    }

    public int size() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }
}
