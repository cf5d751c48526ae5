package com.cardiacreport.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed keys of the report_texts map in a study snapshot.
 */
public enum ReportTextKey {
    FULL_ECHO("full_echo"),
    BRIEF_ECHO("brief_echo"),
    FULL_FIETSTEST("full_fietstest"),
    BRIEF_FIETSTEST("brief_fietstest"),
    FULL_ECG("full_ecg"),
    BRIEF_ECG("brief_ecg"),
    FULL_HOLTER("full_holter"),
    BRIEF_HOLTER("brief_holter"),
    FULL_CIED("full_cied"),
    BRIEF_LETTER("brief_letter"),
    BRIEF_VOORGESCHIEDENIS("brief_voorgeschiedenis"),
    BRIEF_ANAMNESE("brief_anamnese"),
    BRIEF_THUISMEDICATIE("brief_thuismedicatie"),
    BRIEF_BESPREKING("brief_bespreking");

    private final String key;

    ReportTextKey(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
