package org.nostrtv.core.protocol;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Address of a replaceable resource: {@code "<kind>:<pubkey>:<d-identifier>"} (the value of an
 * {@code a} tag).
 * <p>
 * Relays and clients disagree on pubkey case, so every map keyed by coordinate must use
 * {@link #normalize(String)}. Only the pubkey segment is lower-cased; the identifier is
 * case-sensitive.
 */
public final class Coordinate {

    private static final Pattern HEX_PUBKEY = Pattern.compile("[0-9a-fA-F]{64}");

    private final int kind;
    private final String pubkey;
    private final String identifier;

    private Coordinate(int kind, String pubkey, String identifier) {
        this.kind = kind;
        this.pubkey = pubkey;
        this.identifier = identifier;
    }

    public static Coordinate of(int kind, String pubkey, String identifier) {
        Objects.requireNonNull(pubkey, "pubkey");
        Objects.requireNonNull(identifier, "identifier");
        return new Coordinate(kind, pubkey.toLowerCase(Locale.ROOT), identifier);
    }

    /**
     * Parse a coordinate string.
     *
     * @return the coordinate, or null if it is not {@code <numeric kind>:<64 hex>:<non-empty id>}
     */
    public static Coordinate parse(String value) {
        if (value == null) {
            return null;
        }
        String[] parts = value.split(":", 3);
        if (parts.length != 3 || parts[2].isEmpty() || !HEX_PUBKEY.matcher(parts[1]).matches()) {
            return null;
        }
        try {
            return of(Integer.parseInt(parts[0]), parts[1], parts[2]);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Whether the value has the shape of a coordinate.
     */
    public static boolean isValid(String value) {
        return parse(value) != null;
    }

    /**
     * Lower-case the pubkey segment and leave the rest untouched. Values with fewer than three
     * segments are lower-cased whole. Applying this twice gives the same result as applying it once.
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String[] parts = value.split(":", 3);
        if (parts.length < 3) {
            return value.toLowerCase(Locale.ROOT);
        }
        return parts[0] + ":" + parts[1].toLowerCase(Locale.ROOT) + ":" + parts[2];
    }

    public int getKind() { return kind; }
    public String getPubkey() { return pubkey; }
    public String getIdentifier() { return identifier; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Coordinate that = (Coordinate) o;
        return kind == that.kind && pubkey.equals(that.pubkey) && identifier.equals(that.identifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, pubkey, identifier);
    }

    @Override
    public String toString() {
        return kind + ":" + pubkey + ":" + identifier;
    }
}
