package org.nostrtv.core.protocol;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Subscription filter as sent in a {@code REQ} frame (NIP-01).
 * <p>
 * Tag predicates are kept in one map keyed by tag name and written on the wire as
 * {@code "#<name>"}, so any single-letter tag ({@code #a}, {@code #p}, {@code #d}...) can be used.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Filter {

    @JsonProperty("ids")
    private List<String> ids;

    @JsonProperty("authors")
    private List<String> authors;

    @JsonProperty("kinds")
    private List<Integer> kinds;

    @JsonProperty("since")
    private Long since;

    @JsonProperty("until")
    private Long until;

    @JsonProperty("limit")
    private Integer limit;

    private final Map<String, List<String>> tagFilters = new LinkedHashMap<>();

    /**
     * Default constructor for Jackson.
     */
    public Filter() {}

    public List<String> getIds() { return ids; }
    public List<String> getAuthors() { return authors; }
    public List<Integer> getKinds() { return kinds; }
    public Long getSince() { return since; }
    public Long getUntil() { return until; }
    public Integer getLimit() { return limit; }

    public void setIds(List<String> ids) { this.ids = ids; }
    public void setAuthors(List<String> authors) { this.authors = authors; }
    public void setKinds(List<Integer> kinds) { this.kinds = kinds; }
    public void setSince(Long since) { this.since = since; }
    public void setUntil(Long until) { this.until = until; }
    public void setLimit(Integer limit) { this.limit = limit; }

    /**
     * Values filtered for a tag, e.g. {@code getTagValues("a")}; null when the tag is not filtered.
     */
    public List<String> getTagValues(String tagName) {
        return tagFilters.get(tagName);
    }

    public void setTagValues(String tagName, List<String> values) {
        if (values == null) {
            tagFilters.remove(tagName);
        } else {
            tagFilters.put(tagName, new ArrayList<>(values));
        }
    }

    @JsonAnyGetter
    public Map<String, List<String>> wireTagFilters() {
        Map<String, List<String>> wire = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : tagFilters.entrySet()) {
            wire.put("#" + entry.getKey(), entry.getValue());
        }
        return wire;
    }

    @JsonAnySetter
    public void readTagFilter(String key, List<String> values) {
        if (key.startsWith("#") && key.length() > 1) {
            tagFilters.put(key.substring(1), values);
        }
    }

    /**
     * Create a builder for constructing filters.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Filter construction.
     */
    public static class Builder {
        private final Filter filter = new Filter();

        public Builder ids(String... ids) {
            filter.ids = Arrays.asList(ids);
            return this;
        }

        public Builder authors(String... authors) {
            filter.authors = Arrays.asList(authors);
            return this;
        }

        public Builder authors(Collection<String> authors) {
            filter.authors = new ArrayList<>(authors);
            return this;
        }

        public Builder kinds(int... kinds) {
            filter.kinds = new ArrayList<>();
            for (int kind : kinds) {
                filter.kinds.add(kind);
            }
            return this;
        }

        public Builder tag(String tagName, String... values) {
            filter.setTagValues(tagName, Arrays.asList(values));
            return this;
        }

        public Builder tag(String tagName, Collection<String> values) {
            filter.setTagValues(tagName, new ArrayList<>(values));
            return this;
        }

        public Builder aTags(String... coordinates) {
            return tag("a", coordinates);
        }

        public Builder pTags(String... pubkeys) {
            return tag("p", pubkeys);
        }

        public Builder eTags(String... eventIds) {
            return tag("e", eventIds);
        }

        public Builder dTags(String... identifiers) {
            return tag("d", identifiers);
        }

        public Builder since(long since) {
            filter.since = since;
            return this;
        }

        public Builder until(long until) {
            filter.until = until;
            return this;
        }

        public Builder limit(int limit) {
            filter.limit = limit;
            return this;
        }

        public Filter build() {
            return filter;
        }
    }

    @Override
    public String toString() {
        return "Filter{" +
                "authors=" + (authors != null ? authors.size() : 0) +
                ", kinds=" + kinds +
                ", tags=" + tagFilters.keySet() +
                ", since=" + since +
                ", limit=" + limit +
                '}';
    }
}
