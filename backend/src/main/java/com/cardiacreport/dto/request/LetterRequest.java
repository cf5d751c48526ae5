package com.cardiacreport.dto.request;

import com.cardiacreport.model.letter.ClinicalExam;
import com.cardiacreport.model.letter.InvestigationSection;
import jakarta.validation.Valid;

import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for a consultation letter. Investigations are optional; when
 * composing for a stored patient they come from the latest stored studies.
 */
public record LetterRequest(
    @Valid
    PatientRequest patient,

    LocalDate consultDate,
    String voorgeschiedenis,
    String anamnese,
    String thuismedicatie,
    ClinicalExam clinicalExam,
    List<InvestigationSection> investigations,
    String bespreking,

    boolean persist
) {
}
