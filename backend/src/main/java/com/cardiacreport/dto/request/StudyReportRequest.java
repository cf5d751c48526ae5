package com.cardiacreport.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for composing a study report.
 *
 * @param measurements study input; its own patient field is replaced by {@code patient}
 * @param performedOn  free-text study date, used in letter headings
 * @param persist      store the resulting snapshot
 */
public record StudyReportRequest<M>(
    @NotNull(message = "Patient is required")
    @Valid
    PatientRequest patient,

    @NotNull(message = "Measurements are required")
    M measurements,

    String performedOn,

    boolean persist
) {
}
