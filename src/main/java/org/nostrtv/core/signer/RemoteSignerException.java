package org.nostrtv.core.signer;

/**
 * Failure of a remote signer call or handshake, delivered through the caller's future.
 */
public class RemoteSignerException extends Exception {

    public enum Reason {
        INVALID_URI,
        NOT_CONNECTED,
        TIMEOUT,
        INVALID_RESPONSE,
        REMOTE_ERROR,
        CONNECTION_FAILED,
        ENCRYPTION_FAILED,
        DECRYPTION_FAILED,
        AUTHENTICATION_FAILED
    }

    private final Reason reason;

    public RemoteSignerException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RemoteSignerException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
