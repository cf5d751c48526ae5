package com.cardiacreport.dto.response;

import com.cardiacreport.model.enums.StudyType;

import java.time.Instant;

/**
 * Summary of a stored study, without the snapshot JSON.
 */
public record StudySummaryDto(
    String id,
    String patientId,
    StudyType studyType,
    String performedOn,
    Instant createdAt
) {
}
