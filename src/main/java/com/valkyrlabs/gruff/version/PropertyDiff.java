package com.valkyrlabs.gruff.version;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Property-level delta between two consecutive versions. Values are compared by
 * their JSON form with map keys sorted, so {@code 1} and {@code 1.0} differ while
 * two equal nested maps do not, whatever their key order.
 */
public class PropertyDiff {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Map<String, Object> added;
    private final Map<String, Object> removed;
    private final Map<String, ValueChange> changed;

    public PropertyDiff(Map<String, Object> added, Map<String, Object> removed, Map<String, ValueChange> changed) {
        this.added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        this.removed = Collections.unmodifiableMap(new LinkedHashMap<>(removed));
        this.changed = Collections.unmodifiableMap(new LinkedHashMap<>(changed));
    }

    public static PropertyDiff between(Map<String, Object> oldProperties, Map<String, Object> newProperties) {
        Map<String, Object> before = oldProperties == null ? Map.of() : oldProperties;
        Map<String, Object> after = newProperties == null ? Map.of() : newProperties;

        Map<String, Object> added = new LinkedHashMap<>();
        Map<String, ValueChange> changed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : after.entrySet()) {
            if (!before.containsKey(e.getKey())) {
                added.put(e.getKey(), e.getValue());
            } else if (!serialized(before.get(e.getKey())).equals(serialized(e.getValue()))) {
                changed.put(e.getKey(), new ValueChange(before.get(e.getKey()), e.getValue()));
            }
        }
        Map<String, Object> removed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : before.entrySet()) {
            if (!after.containsKey(e.getKey())) {
                removed.put(e.getKey(), e.getValue());
            }
        }
        return new PropertyDiff(added, removed, changed);
    }

    public Map<String, Object> getAdded() {
        return added;
    }

    public Map<String, Object> getRemoved() {
        return removed;
    }

    public Map<String, ValueChange> getChanged() {
        return changed;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
    }

    private static String serialized(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Property value is not JSON-serializable: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "PropertyDiff[added=" + added.keySet() + ", removed=" + removed.keySet() + ", changed="
                + changed.keySet() + "]";
    }

    /**
     * Old and new value of a changed property.
     */
    public static class ValueChange {
        private final Object oldValue;
        private final Object newValue;

        public ValueChange(Object oldValue, Object newValue) {
            this.oldValue = oldValue;
            this.newValue = newValue;
        }

        @JsonProperty("old")
        public Object getOldValue() {
            return oldValue;
        }

        @JsonProperty("new")
        public Object getNewValue() {
            return newValue;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ValueChange other)) {
                return false;
            }
            return Objects.equals(oldValue, other.oldValue) && Objects.equals(newValue, other.newValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(oldValue, newValue);
        }

        @Override
        public String toString() {
            return oldValue + " -> " + newValue;
        }
    }
}
