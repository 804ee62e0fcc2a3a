package com.storeradar.discovery.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BusinessModel {
    PRINT_ON_DEMAND("Print on Demand"),
    DROPSHIPPING("Dropshipping"),
    BRANDED_ECOMMERCE("Branded Ecommerce"),
    MARKETPLACE("Marketplace");

    private final String label;

    BusinessModel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static BusinessModel fromLabel(String label) {
        if (label == null) return null;
        for (BusinessModel m : values()) {
            if (m.label.equalsIgnoreCase(label) || m.name().equalsIgnoreCase(label)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown business model: " + label);
    }
}
