package com.resource.guard.coalesce;

import java.util.concurrent.CompletableFuture;

/**
 * One in-flight execution for a key. Mutable state is guarded by the owning
 * coalescer's registry lock; the future is the completion signal.
 */
final class Call<V> {

    private final String key;
    private final CompletableFuture<CallResult<V>> done = new CompletableFuture<>();
    private int joined;

    Call(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    void join() {
        joined++;
    }

    int joined() {
        return joined;
    }

    void complete(CallResult<V> result) {
        done.complete(result);
    }

    CompletableFuture<CallResult<V>> future() {
        return done;
    }

    CallResult<V> await() {
        // completed normally by construction, join() never throws here
        return done.join();
    }
}
