package com.structural.connector.connect.model;

import java.util.Locale;

/**
 * Member material as named by the authoring tool.
 */
public enum Material {
    STEEL("Steel"),
    CONCRETE("Concrete");

    private final String displayName;

    Material(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Material fromName(String name) {
        if (name == null || name.isBlank()) {
            return STEEL;
        }
        return Material.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
