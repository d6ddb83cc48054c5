package org.nostrtv.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.crypto.digests.SHA256Digest;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Canonical event serialization and id computation (NIP-01).
 */
public final class EventIds {

    private static final ObjectMapper JSON = new ObjectMapper();

    /**
     * The canonical form: {@code [0, pubkey, created_at, kind, tags, content]} without whitespace.
     */
    public static String serialize(Event event) {
        List<Object> canonical = Arrays.asList(
            0,
            event.getPubkey(),
            event.getCreatedAt(),
            event.getKind(),
            event.getTags() != null ? event.getTags() : Collections.emptyList(),
            event.getContent() != null ? event.getContent() : ""
        );
        try {
            return JSON.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Event cannot be serialized", e);
        }
    }

    /**
     * SHA-256 of the canonical form, hex encoded.
     */
    public static String calculateId(Event event) {
        return new String(Hex.encodeHex(hash(event)));
    }

    /**
     * SHA-256 of the canonical form as raw bytes, the message signed by the author.
     */
    public static byte[] hash(Event event) {
        byte[] data = serialize(event).getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private EventIds() {
        // Utility class
    }
}
