package com.valkyrlabs.gruff.version;

import com.valkyrlabs.model.VersionedResource;

/**
 * One version of a chain with its delta against the previous version;
 * {@code diff} is {@code null} for version 1.
 */
public class VersionHistoryEntry<T extends VersionedResource> {

    private final T version;
    private final PropertyDiff diff;

    public VersionHistoryEntry(T version, PropertyDiff diff) {
        this.version = version;
        this.diff = diff;
    }

    public T getVersion() {
        return version;
    }

    public PropertyDiff getDiff() {
        return diff;
    }
}
