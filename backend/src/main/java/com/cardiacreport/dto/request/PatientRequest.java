package com.cardiacreport.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO for patient information. BSA is recomputed when both length
 * and weight are given.
 */
public record PatientRequest(
    @NotBlank(message = "Sex is required")
    @Pattern(regexp = "(?i)\\s*(man|vrouw)\\s*", message = "Sex must be Man or Vrouw")
    String sex,

    String patientId,
    String fullName,
    String dateOfBirth,

    @PositiveOrZero(message = "Age cannot be negative")
    Double age,

    Double bsa,
    Double weight,
    Double length
) {
}
