package org.nostrtv.core.client;

/**
 * One text-frame connection to one relay. {@link RelayPool} owns the reconnect policy;
 * a transport only opens, sends, closes and reports what happened.
 */
public interface RelayTransport {

    /**
     * Callbacks for a single transport. Invoked on the transport's own I/O thread.
     */
    interface Listener {
        void onOpen();
        void onMessage(String text);
        void onFailure(Throwable error);
        void onClosed(int code, String reason);
    }

    String getUrl();

    /**
     * Start connecting. Exactly one of {@code onOpen} or {@code onFailure} follows.
     */
    void open(Listener listener);

    /**
     * Queue a text frame.
     *
     * @return false if the frame could not be queued (socket closing or gone)
     */
    boolean send(String text);

    /**
     * Close gracefully; no-op if already closed.
     */
    void close();
}
