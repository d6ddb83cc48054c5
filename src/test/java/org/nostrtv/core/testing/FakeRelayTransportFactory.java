package org.nostrtv.core.testing;

import org.nostrtv.core.client.RelayTransport;
import org.nostrtv.core.client.RelayTransportFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hands out {@link FakeRelayTransport}s and remembers every one it created.
 */
public class FakeRelayTransportFactory implements RelayTransportFactory {

    private final boolean autoOpen;
    private final List<FakeRelayTransport> created = new CopyOnWriteArrayList<>();

    /**
     * @param autoOpen open each transport as soon as the pool opens it
     */
    public FakeRelayTransportFactory(boolean autoOpen) {
        this.autoOpen = autoOpen;
    }

    @Override
    public RelayTransport create(String relayUrl) {
        FakeRelayTransport transport = new FakeRelayTransport(relayUrl, autoOpen);
        created.add(transport);
        return transport;
    }

    public List<FakeRelayTransport> getCreated() {
        return new ArrayList<>(created);
    }

    public List<FakeRelayTransport> getCreated(String relayUrl) {
        List<FakeRelayTransport> matching = new ArrayList<>();
        for (FakeRelayTransport transport : created) {
            if (transport.getUrl().equals(relayUrl)) {
                matching.add(transport);
            }
        }
        return matching;
    }

    /**
     * Most recent transport for a relay, or null.
     */
    public FakeRelayTransport latest(String relayUrl) {
        List<FakeRelayTransport> matching = getCreated(relayUrl);
        return matching.isEmpty() ? null : matching.get(matching.size() - 1);
    }
}
