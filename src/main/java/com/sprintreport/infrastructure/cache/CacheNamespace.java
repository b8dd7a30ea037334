package com.sprintreport.infrastructure.cache;

/**
 * Top-level key namespaces. The prefix is always the first key segment.
 */
public enum CacheNamespace {

    SPRINT("sprint"),
    SPRINTS("sprints"),
    COMPREHENSIVE("comprehensive"),
    ANALYTICS("analytics");

    private final String prefix;

    CacheNamespace(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
