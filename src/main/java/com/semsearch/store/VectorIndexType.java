package com.semsearch.store;

import java.util.Locale;

public enum VectorIndexType {
    NONE("none"),
    FLAT("flat"),
    BUCKETED("bucketed");

    private final String configName;

    VectorIndexType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public VectorIndex create(int dimension) {
        return switch (this) {
            case FLAT -> new FlatVectorIndex(dimension);
            case BUCKETED -> new SignatureBucketIndex(dimension);
            case NONE -> throw new IllegalStateException("No vector index for type none");
        };
    }

    public static VectorIndexType parse(String value) {
        if (value == null || value.isBlank()) {
            return FLAT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (VectorIndexType type : values()) {
            if (type.configName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown vector index type: " + value);
    }
}
