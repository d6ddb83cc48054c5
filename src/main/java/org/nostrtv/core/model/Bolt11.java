package org.nostrtv.core.model;

import java.util.Locale;

/**
 * Reads the amount from the human-readable part of a BOLT-11 invoice.
 * <p>
 * The human-readable part ends at the last {@code '1'} (the bech32 separator) and is
 * {@code ln + network + [amount[multiplier]]}, e.g. {@code lnbc2500u}.
 */
public final class Bolt11 {

    private static final String[] NETWORK_PREFIXES = {"lnbcrt", "lntbs", "lntb", "lnbc", "lnsb"};

    private static final long MSAT_PER_BTC = 100_000_000_000L;

    /**
     * Amount in millisatoshis, or null when the invoice carries no amount or cannot be read.
     */
    public static Long amountMillisats(String invoice) {
        if (invoice == null) {
            return null;
        }
        String lower = invoice.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("lightning:")) {
            lower = lower.substring("lightning:".length());
        }
        int separator = lower.lastIndexOf('1');
        if (separator < 0) {
            return null;
        }
        String humanReadable = lower.substring(0, separator);
        String amountPart = null;
        for (String prefix : NETWORK_PREFIXES) {
            if (humanReadable.startsWith(prefix)) {
                amountPart = humanReadable.substring(prefix.length());
                break;
            }
        }
        if (amountPart == null || amountPart.isEmpty()) {
            return null;
        }

        char last = amountPart.charAt(amountPart.length() - 1);
        String digits = Character.isDigit(last) ? amountPart : amountPart.substring(0, amountPart.length() - 1);
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return null;
        }
        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }

        // Amounts too large for a long are treated as unreadable.
        try {
            switch (Character.isDigit(last) ? ' ' : last) {
                case ' ': return Math.multiplyExact(value, MSAT_PER_BTC);
                case 'm': return Math.multiplyExact(value, MSAT_PER_BTC / 1_000);
                case 'u': return Math.multiplyExact(value, MSAT_PER_BTC / 1_000_000);
                case 'n': return Math.multiplyExact(value, MSAT_PER_BTC / 1_000_000_000);
                case 'p': return value / 10;
                default: return null;
            }
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private Bolt11() {
        // Utility class
    }
}
