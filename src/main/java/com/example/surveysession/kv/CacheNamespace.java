package com.example.surveysession.kv;

/**
 * Entity classes sharing the cache, each under its own key prefix.
 */
public enum CacheNamespace {
    SESSION("session:"),
    SURVEY("survey:"),
    ANALYTICS("analytics:"),
    RATE_LIMIT("rate_limit:"),
    TEMP("temp:");

    private final String prefix;

    CacheNamespace(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public String key(String id) {
        return prefix + id;
    }
}
