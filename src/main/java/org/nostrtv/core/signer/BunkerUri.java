package org.nostrtv.core.signer;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed {@code bunker://<signer-pubkey>?relay=<url>&secret=<secret>} connection string handed out
 * by a remote signer.
 */
public final class BunkerUri {

    public static final String SCHEME = "bunker://";

    static final Pattern PUBKEY = Pattern.compile("[0-9a-fA-F]{64}");

    private final String signerPubkey;
    private final List<String> relays;
    private final String secret;

    private BunkerUri(String signerPubkey, List<String> relays, String secret) {
        this.signerPubkey = signerPubkey;
        this.relays = Collections.unmodifiableList(relays);
        this.secret = secret;
    }

    /**
     * @throws RemoteSignerException with {@code INVALID_URI} if the scheme, pubkey or relay is missing
     */
    public static BunkerUri parse(String uri) throws RemoteSignerException {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "URI must start with " + SCHEME);
        }
        String rest = uri.substring(SCHEME.length());
        int query = rest.indexOf('?');
        if (query < 0) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "Missing query parameters");
        }
        String pubkey = rest.substring(0, query);
        if (!PUBKEY.matcher(pubkey).matches()) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "Invalid signer pubkey: " + pubkey);
        }
        Map<String, List<String>> params = parseQuery(rest.substring(query + 1));
        List<String> relays = params.getOrDefault("relay", Collections.emptyList());
        if (relays.isEmpty()) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "Missing required 'relay' parameter");
        }
        return new BunkerUri(pubkey.toLowerCase(Locale.ROOT), new ArrayList<>(relays), first(params, "secret"));
    }

    public String getSignerPubkey() { return signerPubkey; }

    /** First relay; the one this client talks through */
    public String getRelay() { return relays.get(0); }
    public List<String> getRelays() { return relays; }

    /** May be null */
    public String getSecret() { return secret; }

    static Map<String, List<String>> parseQuery(String query) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            params.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return params;
    }

    static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() || values.get(0).isEmpty() ? null : values.get(0);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        StringBuilder uri = new StringBuilder(SCHEME).append(signerPubkey);
        char separator = '?';
        for (String relay : relays) {
            uri.append(separator).append("relay=").append(NostrConnectUri.encode(relay));
            separator = '&';
        }
        if (secret != null) {
            uri.append("&secret=").append(NostrConnectUri.encode(secret));
        }
        return uri.toString();
    }
}
