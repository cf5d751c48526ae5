package com.cardiacreport.dto.response;

import com.cardiacreport.model.enums.StudyType;
import com.cardiacreport.model.snapshot.StudySnapshot;

import java.time.Instant;

/**
 * Stored study including the reconstructed snapshot.
 */
public record StudyDetailDto(
    String id,
    String patientId,
    StudyType studyType,
    String performedOn,
    Instant createdAt,
    StudySnapshot snapshot
) {
}
