package org.nostrtv.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.nostrtv.core.protocol.Event;

import java.io.IOException;

/**
 * Profile metadata from a kind 0 event (NIP-01, NIP-24).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Profile {

    @JsonIgnore
    private String pubkey;

    /** created_at of the metadata event, 0 when built locally */
    @JsonIgnore
    private long createdAt;

    @JsonProperty("name")
    private String name;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("about")
    private String about;

    @JsonProperty("picture")
    private String picture;

    /** NIP-05 internet identifier */
    @JsonProperty("nip05")
    private String nip05;

    /** Lightning address used for zaps */
    @JsonProperty("lud16")
    private String lud16;

    public Profile() {}

    public Profile(String pubkey, String name, String displayName) {
        this.pubkey = pubkey;
        this.name = name;
        this.displayName = displayName;
    }

    /**
     * Parse the JSON content of a metadata event. An empty content gives an empty profile.
     */
    public static Profile fromEvent(Event event, ObjectMapper jsonMapper) throws IOException {
        Profile profile = event.getContent().isEmpty()
            ? new Profile()
            : jsonMapper.readValue(event.getContent(), Profile.class);
        profile.pubkey = event.getPubkey();
        profile.createdAt = event.getCreatedAtOrZero();
        return profile;
    }

    public String getPubkey() { return pubkey; }
    @JsonIgnore
    public long getCreatedAt() { return createdAt; }
    public String getName() { return name; }
    public String getDisplayName() { return displayName; }
    public String getAbout() { return about; }
    public String getPicture() { return picture; }
    public String getNip05() { return nip05; }
    public String getLud16() { return lud16; }

    public void setPubkey(String pubkey) { this.pubkey = pubkey; }
    @JsonIgnore
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public void setName(String name) { this.name = name; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public void setAbout(String about) { this.about = about; }
    public void setPicture(String picture) { this.picture = picture; }
    public void setNip05(String nip05) { this.nip05 = nip05; }
    public void setLud16(String lud16) { this.lud16 = lud16; }

    /**
     * Best name to show: display_name, then name, then a shortened pubkey.
     */
    @JsonIgnore
    public String getBestName() {
        if (displayName != null && !displayName.isEmpty()) {
            return displayName;
        }
        if (name != null && !name.isEmpty()) {
            return name;
        }
        return shortPubkey(pubkey);
    }

    static String shortPubkey(String pubkey) {
        if (pubkey == null) {
            return "";
        }
        return pubkey.length() > 8 ? pubkey.substring(0, 8) + "..." : pubkey;
    }

    @Override
    public String toString() {
        return "Profile{pubkey=" + shortPubkey(pubkey) + ", name=" + getBestName() + "}";
    }
}
