package com.cardiacreport.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Patient sex as used by the sex-specific threshold tables.
 */
public enum Sex {
    MAN("Man"),
    VROUW("Vrouw");

    private final String value;

    Sex(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isMale() {
        return this == MAN;
    }

    @Override
    public String toString() {
        return value;
    }

    @JsonCreator
    public static Sex fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Sex sex : values()) {
            if (sex.value.equalsIgnoreCase(value.trim())) {
                return sex;
            }
        }
        throw new IllegalArgumentException("Unknown Sex: " + value);
    }
}
