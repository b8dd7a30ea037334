package com.sprintreport.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Objects;

/**
 * Typed cache key: the rendered key string plus the type of the value stored under it.
 *
 * Instances come from {@link CacheKeys} only, so every key of a namespace is rendered
 * by the same code and prefix deletes always see all of its variants.
 *
 * @param <T> type of the cached value
 */
public final class CacheKey<T> {

    private final String value;
    private final CacheNamespace namespace;
    private final TypeReference<T> type;

    CacheKey(String value, CacheNamespace namespace, TypeReference<T> type) {
        this.value = Objects.requireNonNull(value, "value");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getValue() {
        return value;
    }

    public CacheNamespace getNamespace() {
        return namespace;
    }

    public TypeReference<T> getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        return value.equals(((CacheKey<?>) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
