package org.nostrtv.core.router;

/**
 * How much of an inbound event the router checks before dispatch.
 */
public enum ValidationMode {
    /** Structure, id and signature */
    FULL,
    /** Structure and id only; remote signer traffic is still fully verified */
    SKIP_SIGNATURE
}
