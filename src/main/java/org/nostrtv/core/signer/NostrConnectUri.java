package org.nostrtv.core.signer;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code nostrconnect://<client-pubkey>?relay=..&secret=..&name=..&url=..}, displayed (usually as a
 * QR code) so that a signer app can open the connection to this client.
 */
public final class NostrConnectUri {

    public static final String SCHEME = "nostrconnect://";

    private final String clientPubkey;
    private final String relay;
    private final String secret;
    private final String appName;
    private final String appUrl;

    public NostrConnectUri(String clientPubkey, String relay, String secret, String appName, String appUrl) {
        this.clientPubkey = clientPubkey;
        this.relay = relay;
        this.secret = secret;
        this.appName = appName;
        this.appUrl = appUrl;
    }

    public static NostrConnectUri parse(String uri) throws RemoteSignerException {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "URI must start with " + SCHEME);
        }
        String rest = uri.substring(SCHEME.length());
        int query = rest.indexOf('?');
        if (query < 0) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "Missing query parameters");
        }
        String pubkey = rest.substring(0, query);
        if (!BunkerUri.PUBKEY.matcher(pubkey).matches()) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "Invalid client pubkey: " + pubkey);
        }
        Map<String, List<String>> params = BunkerUri.parseQuery(rest.substring(query + 1));
        String relay = BunkerUri.first(params, "relay");
        if (relay == null) {
            throw new RemoteSignerException(RemoteSignerException.Reason.INVALID_URI, "Missing relay parameter");
        }
        return new NostrConnectUri(pubkey.toLowerCase(Locale.ROOT), relay, BunkerUri.first(params, "secret"),
            BunkerUri.first(params, "name"), BunkerUri.first(params, "url"));
    }

    public String getClientPubkey() { return clientPubkey; }
    public String getRelay() { return relay; }
    public String getSecret() { return secret; }
    public String getAppName() { return appName; }
    public String getAppUrl() { return appUrl; }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Override
    public String toString() {
        StringBuilder uri = new StringBuilder(SCHEME).append(clientPubkey)
            .append("?relay=").append(encode(relay));
        if (secret != null) {
            uri.append("&secret=").append(encode(secret));
        }
        if (appName != null) {
            uri.append("&name=").append(encode(appName));
        }
        if (appUrl != null) {
            uri.append("&url=").append(encode(appUrl));
        }
        return uri.toString();
    }
}
