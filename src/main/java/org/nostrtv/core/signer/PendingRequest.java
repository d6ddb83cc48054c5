package org.nostrtv.core.signer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * An RPC request awaiting its response. Whoever removes it from the pending table resolves it.
 */
class PendingRequest {

    private final String id;
    private final BunkerMethod method;
    private final long sentAt;
    private final CompletableFuture<String> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timeout;

    PendingRequest(String id, BunkerMethod method, long sentAt) {
        this.id = id;
        this.method = method;
        this.sentAt = sentAt;
    }

    String getId() { return id; }
    BunkerMethod getMethod() { return method; }
    long getSentAt() { return sentAt; }
    CompletableFuture<String> getFuture() { return future; }

    void setTimeout(ScheduledFuture<?> timeout) {
        this.timeout = timeout;
    }

    void cancelTimeout() {
        ScheduledFuture<?> handle = timeout;
        if (handle != null) {
            handle.cancel(false);
        }
    }
}
