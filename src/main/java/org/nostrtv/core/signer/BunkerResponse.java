package org.nostrtv.core.signer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RPC response; exactly one of result or error is expected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BunkerResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("result")
    private String result;

    @JsonProperty("error")
    private String error;

    public BunkerResponse() {}

    public BunkerResponse(String id, String result, String error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static BunkerResponse success(String id, String result) {
        return new BunkerResponse(id, result, null);
    }

    public static BunkerResponse failure(String id, String error) {
        return new BunkerResponse(id, null, error);
    }

    public String getId() { return id; }
    public String getResult() { return result; }
    public String getError() { return error; }

    public void setId(String id) { this.id = id; }
    public void setResult(String result) { this.result = result; }
    public void setError(String error) { this.error = error; }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
