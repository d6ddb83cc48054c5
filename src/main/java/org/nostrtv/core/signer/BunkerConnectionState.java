package org.nostrtv.core.signer;

import java.util.Objects;

/**
 * Snapshot of the remote signer connection. Immutable.
 */
public final class BunkerConnectionState {

    public enum Status {
        DISCONNECTED,
        CONNECTING,
        /** Connect URI shown, no reply from a signer yet */
        WAITING_FOR_SCAN,
        WAITING_FOR_APPROVAL,
        CONNECTED,
        ERROR
    }

    private static final BunkerConnectionState DISCONNECTED = new BunkerConnectionState(Status.DISCONNECTED, null, null);
    private static final BunkerConnectionState CONNECTING = new BunkerConnectionState(Status.CONNECTING, null, null);
    private static final BunkerConnectionState WAITING_FOR_SCAN = new BunkerConnectionState(Status.WAITING_FOR_SCAN, null, null);
    private static final BunkerConnectionState WAITING_FOR_APPROVAL = new BunkerConnectionState(Status.WAITING_FOR_APPROVAL, null, null);

    private final Status status;
    private final String userPubkey;
    private final String errorMessage;

    private BunkerConnectionState(Status status, String userPubkey, String errorMessage) {
        this.status = status;
        this.userPubkey = userPubkey;
        this.errorMessage = errorMessage;
    }

    public static BunkerConnectionState disconnected() { return DISCONNECTED; }
    public static BunkerConnectionState connecting() { return CONNECTING; }
    public static BunkerConnectionState waitingForScan() { return WAITING_FOR_SCAN; }
    public static BunkerConnectionState waitingForApproval() { return WAITING_FOR_APPROVAL; }

    public static BunkerConnectionState connected(String userPubkey) {
        return new BunkerConnectionState(Status.CONNECTED, Objects.requireNonNull(userPubkey), null);
    }

    public static BunkerConnectionState error(String message) {
        return new BunkerConnectionState(Status.ERROR, null, message);
    }

    public Status getStatus() { return status; }

    /** Remote identity, set only when connected */
    public String getUserPubkey() { return userPubkey; }

    /** Set only in the error state */
    public String getErrorMessage() { return errorMessage; }

    public boolean isConnected() {
        return status == Status.CONNECTED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BunkerConnectionState that = (BunkerConnectionState) o;
        return status == that.status
            && Objects.equals(userPubkey, that.userPubkey)
            && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, userPubkey, errorMessage);
    }

    @Override
    public String toString() {
        switch (status) {
            case CONNECTED:
                return "CONNECTED(" + userPubkey + ")";
            case ERROR:
                return "ERROR(" + errorMessage + ")";
            default:
                return status.name();
        }
    }
}
