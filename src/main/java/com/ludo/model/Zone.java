package com.ludo.model;

/**
 * Board zone a square belongs to. The zone is the first segment of a square id.
 */
public enum Zone {
    INITIAL("initial"),
    ROAD("road"),
    FINAL("final");

    private final String prefix;

    Zone(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static Zone fromPrefix(String prefix) {
        for (Zone zone : values()) {
            if (zone.prefix.equals(prefix)) {
                return zone;
            }
        }
        throw new IllegalArgumentException("Unknown zone: " + prefix);
    }
}
