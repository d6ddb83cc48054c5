package org.nostrtv.core.client;

/**
 * What the pool does with a subscription when a relay connection is re-established.
 */
public enum ResubscribePolicy {

    /** Replay the recorded filter. */
    AUTOMATIC,

    /**
     * The filter was built from parameters the caller owns and may have changed. The pool closes
     * the subscription and reports it through
     * {@link ConnectionEventListener#onResubscribeRequired(String, String)} so the caller can
     * issue a fresh one.
     */
    EXTERNAL
}
