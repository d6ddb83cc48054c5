package org.nostrtv.core.signer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.binary.Hex;
import org.nostrtv.core.client.RelayPool;
import org.nostrtv.core.crypto.EventSigner;
import org.nostrtv.core.crypto.NostrKeyManager;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventIds;
import org.nostrtv.core.protocol.EventKinds;
import org.nostrtv.core.protocol.Filter;
import org.nostrtv.core.protocol.UnsignedEvent;
import org.nostrtv.core.router.RoutedEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * NIP-46 client: signs events with a key held by a remote signer ("bunker").
 * <p>
 * Requests and replies are NIP-44 encrypted kind 24133 events exchanged through the relay pool.
 * Replies arrive through the event router and are decrypted on this client's scheduler, never on
 * the router thread. Each request waits in a pending table; the reply and the request's timeout
 * both claim the entry with {@code pending.remove(id)}, so exactly one of them resolves it.
 * <p>
 * Two ways to connect:
 * <ul>
 *   <li>{@link #connect(BunkerUri)}: the user pastes a {@code bunker://} URI naming the signer.</li>
 *   <li>{@link #createNostrConnectUri} and {@link #awaitSigner}: this client shows a
 *       {@code nostrconnect://} URI and learns the signer from its first reply.</li>
 * </ul>
 * A handshake secret that comes back altered ends in the ERROR state, never CONNECTED.
 */
public class RemoteSignerClient implements RoutedEventListener, EventSigner {

    private static final Logger logger = LoggerFactory.getLogger(RemoteSignerClient.class);

    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_SCAN_TIMEOUT_MS = 180_000;

    static final String ACK = "ack";
    static final String PURPOSE = "remote-signer";
    static final long SUBSCRIPTION_LOOKBACK_SECONDS = 10;

    private final RelayPool pool;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final SecureRandom random = new SecureRandom();

    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final List<SignerStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private volatile BunkerConnectionState state = BunkerConnectionState.disconnected();
    private volatile BunkerSession session;
    private volatile String subscriptionId;
    private volatile NostrKeyManager preparedClientKeys;
    private volatile CompletableFuture<String> scanHandshake;
    private volatile ScheduledFuture<?> scanTimeout;

    private long requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private long scanTimeoutMs = DEFAULT_SCAN_TIMEOUT_MS;

    public RemoteSignerClient(RelayPool pool, ScheduledExecutorService scheduler) {
        this(pool, scheduler, Clock.systemUTC());
    }

    public RemoteSignerClient(RelayPool pool, ScheduledExecutorService scheduler, Clock clock) {
        this.pool = pool;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    public void setScanTimeoutMs(long scanTimeoutMs) { this.scanTimeoutMs = scanTimeoutMs; }

    public void addStateListener(SignerStateListener listener) { stateListeners.add(listener); }
    public void removeStateListener(SignerStateListener listener) { stateListeners.remove(listener); }

    public BunkerConnectionState getState() { return state; }
    public BunkerSession getSession() { return session; }

    public boolean isConnected() {
        return state.isConnected();
    }

    /**
     * Remote identity once connected, else null.
     */
    @Override
    public String getPublicKeyHex() {
        BunkerSession current = session;
        return current != null ? current.getUserPubkey() : null;
    }

    // Direct flow

    /**
     * Connect to the signer named in a {@code bunker://} URI with a fresh client key.
     *
     * @return future completing with the user's pubkey once CONNECTED
     */
    public CompletableFuture<String> connect(BunkerUri uri) {
        return connect(uri, NostrKeyManager.generate());
    }

    /**
     * Connect with a given client key, e.g. one restored from {@link BunkerSession#getClientPrivateKeyHex()}.
     */
    public CompletableFuture<String> connect(BunkerUri uri, NostrKeyManager clientKeys) {
        resetConnection();
        setState(BunkerConnectionState.connecting());

        BunkerSession newSession = new BunkerSession(uri.getSignerPubkey(), uri.getRelay(), clientKeys,
            uri.getSecret(), clock.millis());
        session = newSession;
        openChannel(newSession);
        setState(BunkerConnectionState.waitingForApproval());
        logger.info("Connecting to remote signer {} via {}", shortKey(uri.getSignerPubkey()), uri.getRelay());

        List<String> params = new ArrayList<>();
        params.add(uri.getSignerPubkey());
        if (uri.getSecret() != null) {
            params.add(uri.getSecret());
        }
        CompletableFuture<String> handshake = sendRequest(BunkerMethod.CONNECT, params, requestTimeoutMs)
            .thenCompose(result -> {
                if (!isAcceptedHandshake(result, newSession.getSecret())) {
                    return RemoteSignerClient.<String>failed(authenticationFailed());
                }
                newSession.clearSecret();
                return CompletableFuture.completedFuture(result);
            });
        return completeHandshake(newSession, handshake);
    }

    // Reverse flow

    /**
     * Prepare a {@code nostrconnect://} URI with a fresh client key and secret. Pass it to
     * {@link #awaitSigner} after showing it to the user.
     */
    public NostrConnectUri createNostrConnectUri(String relayUrl, String appName, String appUrl) {
        NostrKeyManager clientKeys = NostrKeyManager.generate();
        preparedClientKeys = clientKeys;
        byte[] secret = new byte[16];
        random.nextBytes(secret);
        return new NostrConnectUri(clientKeys.getPublicKeyHex(), relayUrl, Hex.encodeHexString(secret), appName, appUrl);
    }

    /**
     * Wait for a signer app to answer a URI from {@link #createNostrConnectUri}. Fails with
     * {@code TIMEOUT} if nobody answers within the scan timeout.
     *
     * @return future completing with the user's pubkey once CONNECTED
     */
    public CompletableFuture<String> awaitSigner(NostrConnectUri uri) {
        NostrKeyManager clientKeys = preparedClientKeys;
        if (clientKeys == null || !clientKeys.isMyPublicKey(uri.getClientPubkey())) {
            return failed(new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI,
                "URI was not created by this client"));
        }
        resetConnection();
        setState(BunkerConnectionState.connecting());

        BunkerSession newSession = new BunkerSession(null, uri.getRelay(), clientKeys, uri.getSecret(), clock.millis());
        CompletableFuture<String> handshake = new CompletableFuture<>();
        scanHandshake = handshake;
        session = newSession;
        openChannel(newSession);
        setState(BunkerConnectionState.waitingForScan());
        logger.info("Waiting for a signer to answer on {}", uri.getRelay());

        scanTimeout = scheduler.schedule(() -> {
            if (handshake.completeExceptionally(new RemoteSignerException(RemoteSignerException.Reason.TIMEOUT,
                "No signer answered within " + scanTimeoutMs + "ms"))) {
                logger.warn("Timed out waiting for a signer");
            }
        }, scanTimeoutMs, TimeUnit.MILLISECONDS);

        return completeHandshake(newSession, handshake);
    }

    private CompletableFuture<String> completeHandshake(BunkerSession target, CompletableFuture<String> handshake) {
        CompletableFuture<String> connected = handshake
            .thenCompose(ack -> sendRequest(BunkerMethod.GET_PUBLIC_KEY, Collections.emptyList(), requestTimeoutMs))
            .thenApply(userPubkey -> {
                target.setUserPubkey(userPubkey);
                if (session == target) {
                    setState(BunkerConnectionState.connected(userPubkey));
                    logger.info("Remote signer connected for {}", shortKey(userPubkey));
                }
                return userPubkey;
            });
        connected.whenComplete((userPubkey, error) -> {
            ScheduledFuture<?> timeout = scanTimeout;
            if (timeout != null) {
                timeout.cancel(false);
            }
            if (error != null && session == target && state.getStatus() != BunkerConnectionState.Status.ERROR
                && state.getStatus() != BunkerConnectionState.Status.DISCONNECTED) {
                Throwable cause = unwrap(error);
                logger.warn("Remote signer handshake failed: {}", cause.getMessage());
                setState(BunkerConnectionState.error(cause.getMessage()));
            }
        });
        return connected;
    }

    private static boolean isAcceptedHandshake(String result, String secret) {
        return ACK.equals(result) || (secret != null && secret.equals(result));
    }

    private RemoteSignerException authenticationFailed() {
        logger.warn("Remote signer returned an unexpected handshake result");
        setState(BunkerConnectionState.error("Authentication failed: secret mismatch"));
        return new RemoteSignerException(RemoteSignerException.Reason.AUTHENTICATION_FAILED, "Handshake secret mismatch");
    }

    private void openChannel(BunkerSession target) {
        pool.addRelay(target.getRelayUrl()).whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("Signer relay {} not reachable yet: {}", target.getRelayUrl(), error.getMessage());
            }
        });
        long since = clock.millis() / 1000 - SUBSCRIPTION_LOOKBACK_SECONDS;
        Filter filter = Filter.builder()
            .kinds(EventKinds.NOSTR_CONNECT)
            .pTags(target.getClientPubkey())
            .since(since)
            .build();
        subscriptionId = pool.subscribe(filter, PURPOSE);
    }

    // Operations

    public CompletableFuture<String> getPublicKey() {
        return sendRequest(BunkerMethod.GET_PUBLIC_KEY, Collections.emptyList(), requestTimeoutMs);
    }

    public CompletableFuture<Void> ping() {
        return sendRequest(BunkerMethod.PING, Collections.emptyList(), requestTimeoutMs).thenApply(result -> null);
    }

    /**
     * Have the remote signer sign a template. The returned event is checked before the future
     * completes: its id must match its content and its signature must verify for the user's key.
     */
    @Override
    public CompletableFuture<Event> signEvent(UnsignedEvent template) {
        String userPubkey = getPublicKeyHex();
        if (userPubkey == null) {
            return failed(new RemoteSignerException(RemoteSignerException.Reason.NOT_CONNECTED, "Not connected to a signer"));
        }
        String templateJson;
        try {
            templateJson = jsonMapper.writeValueAsString(template);
        } catch (JsonProcessingException e) {
            return failed(new RemoteSignerException(RemoteSignerException.Reason.ENCRYPTION_FAILED,
                "Could not serialize event template", e));
        }
        return sendRequest(BunkerMethod.SIGN_EVENT, Collections.singletonList(templateJson), requestTimeoutMs)
            .thenCompose(result -> {
                try {
                    return CompletableFuture.completedFuture(parseSignedEvent(result, userPubkey));
                } catch (RemoteSignerException e) {
                    return RemoteSignerClient.<Event>failed(e);
                }
            });
    }

    private Event parseSignedEvent(String result, String userPubkey) throws RemoteSignerException {
        Event event;
        try {
            event = jsonMapper.readValue(result, Event.class);
        } catch (IOException e) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_RESPONSE, "Signed event is not JSON", e);
        }
        if (event.getPubkey() == null || !event.getPubkey().equalsIgnoreCase(userPubkey)) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_RESPONSE, "Signed by an unexpected key");
        }
        if (event.getCreatedAt() == null || event.getId() == null
            || !event.getId().equalsIgnoreCase(EventIds.calculateId(event))) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_RESPONSE, "Signed event id mismatch");
        }
        if (!NostrKeyManager.verifyHex(event.getSig(), EventIds.hash(event), event.getPubkey())) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_RESPONSE, "Invalid signature on signed event");
        }
        return event;
    }

    public CompletableFuture<String> nip44Encrypt(String peerPubkey, String plaintext) {
        return sendRequest(BunkerMethod.NIP44_ENCRYPT, Arrays.asList(peerPubkey, plaintext), requestTimeoutMs);
    }

    public CompletableFuture<String> nip44Decrypt(String peerPubkey, String payload) {
        return sendRequest(BunkerMethod.NIP44_DECRYPT, Arrays.asList(peerPubkey, payload), requestTimeoutMs);
    }

    /**
     * Drop the connection: outstanding requests fail with {@code NOT_CONNECTED} and their timers
     * are cancelled.
     */
    public void disconnect() {
        resetConnection();
        setState(BunkerConnectionState.disconnected());
        logger.info("Remote signer disconnected");
    }

    private void resetConnection() {
        session = null;
        CompletableFuture<String> handshake = scanHandshake;
        scanHandshake = null;
        ScheduledFuture<?> timeout = scanTimeout;
        if (timeout != null) {
            timeout.cancel(false);
        }
        if (handshake != null) {
            handshake.completeExceptionally(new RemoteSignerException(RemoteSignerException.Reason.NOT_CONNECTED,
                "Disconnected"));
        }
        for (String id : new ArrayList<>(pendingRequests.keySet())) {
            PendingRequest request = pendingRequests.remove(id);
            if (request != null) {
                request.cancelTimeout();
                request.getFuture().completeExceptionally(new RemoteSignerException(
                    RemoteSignerException.Reason.NOT_CONNECTED, "Disconnected"));
            }
        }
        String current = subscriptionId;
        subscriptionId = null;
        if (current != null) {
            pool.unsubscribe(current);
        }
    }

    // RPC

    /**
     * Encrypt, sign and publish one request.
     *
     * @return future resolved by the matching reply, or failed by the timeout
     */
    CompletableFuture<String> sendRequest(BunkerMethod method, List<String> params, long timeoutMs) {
        BunkerSession current = session;
        if (current == null || current.getSignerPubkey() == null) {
            return failed(new RemoteSignerException(RemoteSignerException.Reason.NOT_CONNECTED, "Not connected to a signer"));
        }
        String signerPubkey = current.getSignerPubkey();
        BunkerRequest request = new BunkerRequest(method.getWireName(), params);
        PendingRequest pending = new PendingRequest(request.getId(), method, clock.millis());
        pendingRequests.put(request.getId(), pending);
        pending.setTimeout(scheduler.schedule(() -> expireRequest(request.getId()), timeoutMs, TimeUnit.MILLISECONDS));

        try {
            String json = jsonMapper.writeValueAsString(request);
            String encrypted = current.getClientKeys().nip44Encrypt(json, signerPubkey);
            List<List<String>> tags = new ArrayList<>();
            tags.add(UnsignedEvent.tag("p", signerPubkey));
            Event event = current.getClientKeys().signEvent(UnsignedEvent.now(EventKinds.NOSTR_CONNECT, tags, encrypted));
            pool.publish(event);
            current.touch(clock.millis());
            logger.debug("Sent {} request {}", method.getWireName(), request.getId());
        } catch (JsonProcessingException | GeneralSecurityException e) {
            failRequest(request.getId(), new RemoteSignerException(RemoteSignerException.Reason.ENCRYPTION_FAILED,
                "Could not encrypt " + method.getWireName() + " request", e));
        }
        return pending.getFuture();
    }

    /**
     * Resolve a pending request from its reply.
     *
     * @return false if the request was already resolved or never existed
     */
    boolean handleResponse(BunkerResponse response) {
        if (response.getId() == null) {
            return false;
        }
        PendingRequest pending = pendingRequests.remove(response.getId());
        if (pending == null) {
            logger.debug("Reply for unknown or expired request {}", response.getId());
            return false;
        }
        pending.cancelTimeout();
        if (response.getError() != null) {
            pending.getFuture().completeExceptionally(new RemoteSignerException(
                RemoteSignerException.Reason.REMOTE_ERROR, response.getError()));
        } else if (response.getResult() != null) {
            pending.getFuture().complete(response.getResult());
        } else {
            pending.getFuture().completeExceptionally(new RemoteSignerException(
                RemoteSignerException.Reason.INVALID_RESPONSE, "Reply has neither result nor error"));
        }
        return true;
    }

    /**
     * Timeout path of a pending request.
     *
     * @return false if the reply already resolved it
     */
    boolean expireRequest(String requestId) {
        PendingRequest pending = pendingRequests.remove(requestId);
        if (pending == null) {
            return false;
        }
        logger.warn("{} request {} timed out after {}ms", pending.getMethod().getWireName(), requestId,
            clock.millis() - pending.getSentAt());
        pending.getFuture().completeExceptionally(new RemoteSignerException(RemoteSignerException.Reason.TIMEOUT,
            pending.getMethod().getWireName() + " timed out"));
        return true;
    }

    private void failRequest(String requestId, RemoteSignerException error) {
        PendingRequest pending = pendingRequests.remove(requestId);
        if (pending != null) {
            pending.cancelTimeout();
            pending.getFuture().completeExceptionally(error);
        }
    }

    int pendingRequestCount() {
        return pendingRequests.size();
    }

    boolean hasPendingRequest(String requestId) {
        return pendingRequests.containsKey(requestId);
    }

    List<String> pendingRequestIds() {
        return new ArrayList<>(pendingRequests.keySet());
    }

    // Inbound

    @Override
    public void onRemoteSignerMessage(Event event) {
        try {
            scheduler.execute(() -> handleMessage(event));
        } catch (RejectedExecutionException e) {
            logger.debug("Signer scheduler stopped, dropping message {}", event.getId());
        }
    }

    void handleMessage(Event event) {
        BunkerSession current = session;
        if (current == null || !event.getTagValues("p").contains(current.getClientPubkey())) {
            return;
        }
        String sender = event.getPubkey();
        String expected = current.getSignerPubkey();
        if (expected != null && !expected.equalsIgnoreCase(sender)) {
            logger.debug("Ignoring signer message from unexpected key {}", shortKey(sender));
            return;
        }

        BunkerResponse response;
        try {
            String json = current.getClientKeys().nip44Decrypt(event.getContent(), sender);
            response = jsonMapper.readValue(json, BunkerResponse.class);
        } catch (GeneralSecurityException e) {
            logger.warn("Could not decrypt signer message {}: {}", event.getId(), e.getMessage());
            return;
        } catch (IOException e) {
            logger.warn("Malformed signer message {}: {}", event.getId(), e.getMessage());
            return;
        }

        CompletableFuture<String> handshake = scanHandshake;
        if (handshake != null && !handshake.isDone()) {
            handleScanReply(current, sender, response, handshake);
            return;
        }
        handleResponse(response);
    }

    /**
     * First replies of the reverse flow. The sender becomes the counterpart; the reply must carry
     * the secret or the fixed acknowledgement.
     */
    private void handleScanReply(BunkerSession current, String sender, BunkerResponse response,
                                 CompletableFuture<String> handshake) {
        if (current.getSignerPubkey() == null) {
            current.setSignerPubkey(sender.toLowerCase(Locale.ROOT));
            logger.info("Signer {} answered, waiting for approval", shortKey(sender));
            setState(BunkerConnectionState.waitingForApproval());
        }
        if (response.getError() != null) {
            setState(BunkerConnectionState.error("Signer rejected connection: " + response.getError()));
            handshake.completeExceptionally(new RemoteSignerException(RemoteSignerException.Reason.REMOTE_ERROR,
                response.getError()));
            return;
        }
        String result = response.getResult();
        if (result == null || result.isEmpty()) {
            logger.debug("Ignoring empty handshake reply {}", response.getId());
            return;
        }
        if (isAcceptedHandshake(result, current.getSecret())) {
            current.clearSecret();
            handshake.complete(result);
            return;
        }
        handshake.completeExceptionally(authenticationFailed());
    }

    // State

    private void setState(BunkerConnectionState newState) {
        state = newState;
        logger.debug("Signer state: {}", newState);
        for (SignerStateListener listener : stateListeners) {
            try {
                listener.onStateChanged(newState);
            } catch (RuntimeException e) {
                logger.error("Signer state listener failed", e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    private static String shortKey(String pubkey) {
        return pubkey != null && pubkey.length() > 8 ? pubkey.substring(0, 8) + "..." : String.valueOf(pubkey);
    }
}
