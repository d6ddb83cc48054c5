package org.nostrtv.core.signer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * RPC request, sent NIP-44 encrypted as the content of a kind 24133 event.
 */
public class BunkerRequest {

    @JsonProperty("id")
    private String id;

    @JsonProperty("method")
    private String method;

    @JsonProperty("params")
    private List<String> params;

    public BunkerRequest() {
        this.params = new ArrayList<>();
    }

    public BunkerRequest(String method, List<String> params) {
        this(UUID.randomUUID().toString(), method, params);
    }

    public BunkerRequest(String id, String method, List<String> params) {
        this.id = id;
        this.method = method;
        this.params = new ArrayList<>(params);
    }

    public String getId() { return id; }
    public String getMethod() { return method; }
    public List<String> getParams() { return params; }

    public void setId(String id) { this.id = id; }
    public void setMethod(String method) { this.method = method; }
    public void setParams(List<String> params) { this.params = params; }
}
