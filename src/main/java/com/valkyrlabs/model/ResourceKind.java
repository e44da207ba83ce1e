package com.valkyrlabs.model;

/**
 * The protected resource kinds that ride on the version chain model.
 */
public enum ResourceKind {

    ENTITY("entity"),
    LINK("link");

    private final String value;

    ResourceKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Accepts "entity"/"link" as well as the simple or qualified class names of the
     * JPA types, which is what Spring Security hands to a permission evaluator.
     *
     * @return the kind, or {@code null} when the name is not a protected resource
     */
    public static ResourceKind fromName(String name) {
        if (name == null) {
            return null;
        }
        String s = name.trim();
        if ("entity".equalsIgnoreCase(s) || s.endsWith(GraphEntity.class.getSimpleName())) {
            return ENTITY;
        }
        if ("link".equalsIgnoreCase(s) || s.endsWith(GraphLink.class.getSimpleName())) {
            return LINK;
        }
        return null;
    }
}
