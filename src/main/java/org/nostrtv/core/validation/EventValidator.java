package org.nostrtv.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.nostrtv.core.crypto.SchnorrSigner;
import org.nostrtv.core.protocol.Coordinate;
import org.nostrtv.core.protocol.Event;
import org.nostrtv.core.protocol.EventIds;
import org.nostrtv.core.protocol.EventKinds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structural, cryptographic and per-kind validation of inbound events.
 * <p>
 * Checks run in a fixed order and stop at the first failure: required fields, id, signature,
 * timestamp, then kind-specific shape. Holds configuration only and is safe to share.
 */
public class EventValidator {

    private static final Logger logger = LoggerFactory.getLogger(EventValidator.class);

    /** Default tolerance for clock skew on created_at */
    public static final long DEFAULT_FUTURE_TOLERANCE_SECONDS = 300;

    private static final Set<String> STREAM_STATUSES = new HashSet<>(Arrays.asList("live", "ended", "planned"));

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final Clock clock;
    private final long futureToleranceSeconds;

    public EventValidator() {
        this(Clock.systemUTC(), DEFAULT_FUTURE_TOLERANCE_SECONDS);
    }

    public EventValidator(Clock clock, long futureToleranceSeconds) {
        this.clock = clock;
        this.futureToleranceSeconds = futureToleranceSeconds;
    }

    /**
     * Run every check including signature verification.
     *
     * @throws EventValidationException on the first failed check
     */
    public void validate(Event event) throws EventValidationException {
        validate(event, true);
    }

    /**
     * Same as {@link #validate(Event)} but skips signature verification. Only for events whose
     * source is already trusted.
     */
    public void validateWithoutSignature(Event event) throws EventValidationException {
        validate(event, false);
    }

    public boolean isValid(Event event, boolean verifySignature) {
        try {
            validate(event, verifySignature);
            return true;
        } catch (EventValidationException e) {
            logger.debug("Rejected event {}: {}", event.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Keep only the valid events, preserving order.
     */
    public List<Event> filterValid(List<Event> events, boolean verifySignature) {
        List<Event> valid = new ArrayList<>();
        for (Event event : events) {
            if (isValid(event, verifySignature)) {
                valid.add(event);
            }
        }
        return valid;
    }

    private void validate(Event event, boolean verifySignature) throws EventValidationException {
        checkRequiredFields(event);
        checkIdentifier(event);
        if (verifySignature) {
            checkSignature(event);
        }
        checkTimestamp(event);
        checkKindSpecific(event);
    }

    private void checkRequiredFields(Event event) throws EventValidationException {
        if (isBlank(event.getId())) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_FIELD, "id");
        }
        if (isBlank(event.getPubkey())) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_FIELD, "pubkey");
        }
        if (event.getCreatedAt() == null) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_FIELD, "created_at");
        }
        if (isBlank(event.getSig())) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_FIELD, "sig");
        }
    }

    private void checkIdentifier(Event event) throws EventValidationException {
        String expected = EventIds.calculateId(event);
        if (!expected.equalsIgnoreCase(event.getId())) {
            throw new EventValidationException(ValidationError.INVALID_IDENTIFIER,
                "claimed " + event.getId() + ", computed " + expected);
        }
    }

    private void checkSignature(Event event) throws EventValidationException {
        boolean valid;
        try {
            valid = SchnorrSigner.verify(
                Hex.decodeHex(event.getSig()),
                Hex.decodeHex(event.getId()),
                Hex.decodeHex(event.getPubkey()));
        } catch (DecoderException e) {
            valid = false;
        }
        if (!valid) {
            throw new EventValidationException(ValidationError.INVALID_SIGNATURE, "event " + event.getId());
        }
    }

    private void checkTimestamp(Event event) throws EventValidationException {
        long now = clock.millis() / 1000;
        if (event.getCreatedAt() > now + futureToleranceSeconds) {
            throw new EventValidationException(ValidationError.FROM_FUTURE,
                "created_at " + event.getCreatedAt() + " is ahead of " + now);
        }
    }

    private void checkKindSpecific(Event event) throws EventValidationException {
        int kind = event.getKind();
        if (kind == EventKinds.METADATA) {
            checkMetadata(event);
        } else if (kind == EventKinds.LIVE_CHAT_MESSAGE) {
            checkChatMessage(event);
        } else if (kind == EventKinds.ZAP_RECEIPT) {
            checkZapReceipt(event);
        } else if (EventKinds.isAddressable(kind)) {
            checkAddressable(event);
        }
    }

    private void checkMetadata(Event event) throws EventValidationException {
        if (event.getContent().isEmpty()) {
            return;
        }
        JsonNode content = parseJson(event.getContent());
        if (content == null || !content.isObject()) {
            throw new EventValidationException(ValidationError.INVALID_CONTENT, "metadata must be a JSON object");
        }
    }

    private void checkAddressable(Event event) throws EventValidationException {
        if (event.getTagValue("d") == null) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_TAG, "d");
        }
        if (event.getKind() == EventKinds.LIVE_EVENT) {
            String status = event.getTagValue("status");
            if (status != null && !STREAM_STATUSES.contains(status.toLowerCase(Locale.ROOT))) {
                throw new EventValidationException(ValidationError.INVALID_TAG_FORMAT, "status " + status);
            }
        }
    }

    private void checkChatMessage(Event event) throws EventValidationException {
        String coordinate = event.getTagValue("a");
        if (coordinate == null) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_TAG, "a");
        }
        if (!Coordinate.isValid(coordinate)) {
            throw new EventValidationException(ValidationError.INVALID_TAG_FORMAT, "a " + coordinate);
        }
    }

    private void checkZapReceipt(Event event) throws EventValidationException {
        if (event.getTagValue("bolt11") == null) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_TAG, "bolt11");
        }
        String description = event.getTagValue("description");
        if (description == null) {
            throw new EventValidationException(ValidationError.MISSING_REQUIRED_TAG, "description");
        }
        JsonNode zapRequest = parseJson(description);
        if (zapRequest == null || !zapRequest.isObject() || !zapRequest.path("pubkey").isTextual()) {
            throw new EventValidationException(ValidationError.INVALID_TAG_FORMAT,
                "description must be a zap request with a pubkey");
        }
    }

    private JsonNode parseJson(String json) {
        try {
            return jsonMapper.readTree(json);
        } catch (IOException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
