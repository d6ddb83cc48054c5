package org.nostrtv.core.client;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.concurrent.TimeUnit;

/**
 * WebSocket transport backed by OkHttp.
 */
public class OkHttpRelayTransport extends WebSocketListener implements RelayTransport {

    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final OkHttpClient httpClient;
    private final String url;
    private volatile WebSocket webSocket;
    private volatile Listener listener;

    public OkHttpRelayTransport(OkHttpClient httpClient, String url) {
        this.httpClient = httpClient;
        this.url = url;
    }

    /**
     * Client configured for long-lived relay sockets: no read timeout, OkHttp pings for liveness.
     */
    public static OkHttpClient createHttpClient(long pingIntervalMs) {
        return new OkHttpClient.Builder()
            .connectTimeout(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .readTimeout(0, TimeUnit.SECONDS)
            .writeTimeout(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .pingInterval(pingIntervalMs, TimeUnit.MILLISECONDS)
            .build();
    }

    public static RelayTransportFactory factory(OkHttpClient httpClient) {
        return relayUrl -> new OkHttpRelayTransport(httpClient, relayUrl);
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public void open(Listener listener) {
        this.listener = listener;
        Request request = new Request.Builder().url(url).build();
        this.webSocket = httpClient.newWebSocket(request, this);
    }

    @Override
    public boolean send(String text) {
        WebSocket socket = webSocket;
        return socket != null && socket.send(text);
    }

    @Override
    public void close() {
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(1000, "Client disconnect");
        }
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
        listener.onOpen();
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
        listener.onMessage(text);
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
        webSocket.close(1000, null);
    }

    @Override
    public void onClosed(WebSocket webSocket, int code, String reason) {
        listener.onClosed(code, reason);
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
        listener.onFailure(t);
    }
}
