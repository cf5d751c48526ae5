package com.cardiacreport.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Study types that can be stored as a snapshot.
 * BRIEF is the consultation letter.
 */
public enum StudyType {
    ECHO("echo"),
    FIETSTEST("fietstest"),
    ECG("ecg"),
    HOLTER("holter"),
    CIED("cied"),
    BRIEF("brief");

    private final String value;

    StudyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static StudyType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (StudyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown StudyType: " + value);
    }
}
