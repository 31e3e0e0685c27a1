package org.theridian.pipeline;

public enum ValueCategory {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    ValueCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ValueCategory of(long value) {
        if (value <= 100) {
            return LOW;
        }
        if (value <= 500) {
            return MEDIUM;
        }
        return HIGH;
    }
}
