package com.cardiacreport.model.letter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * A full study report included in the letter. The label decides where the
 * section lands (ECG, cyclo-ergometry, echo, device, Holter).
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvestigationSection(
    String label,
    String text,
    String performedOn
) {
}
