package org.nostrtv.core.client;

import org.nostrtv.core.protocol.Filter;

/**
 * A subscription recorded by the pool so it can be replayed after reconnects.
 */
public class SubscriptionInfo {

    private final String id;
    private final Filter filter;
    private final String purpose;
    private final ResubscribePolicy policy;

    public SubscriptionInfo(String id, Filter filter, String purpose, ResubscribePolicy policy) {
        this.id = id;
        this.filter = filter;
        this.purpose = purpose;
        this.policy = policy;
    }

    public String getId() { return id; }
    public Filter getFilter() { return filter; }
    public String getPurpose() { return purpose; }
    public ResubscribePolicy getPolicy() { return policy; }

    @Override
    public String toString() {
        return "Subscription{" + id + ", purpose=" + purpose + ", policy=" + policy + "}";
    }
}
