package com.cardiacreport.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aortic valve stenosis grade, ordered by severity.
 */
public enum StenosisGrade {
    NONE("Geen stenose"),
    MILD("Milde stenose"),
    MODERATE("Matige stenose"),
    SEVERE("Ernstige stenose"),
    VERY_SEVERE("Zeer ernstige stenose");

    private final String label;

    StenosisGrade(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isSevere() {
        return this.compareTo(SEVERE) >= 0;
    }

    @Override
    public String toString() {
        return label;
    }
}
