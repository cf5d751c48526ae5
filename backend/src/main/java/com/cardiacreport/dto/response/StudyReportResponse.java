package com.cardiacreport.dto.response;

import com.cardiacreport.model.snapshot.StudySnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response DTO for a composed study report.
 *
 * @param recommendations guideline advice, echo only
 * @param studyId         set when the snapshot was stored
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StudyReportResponse<T>(
    T metrics,
    String fullReport,
    String briefReport,
    List<String> recommendations,
    StudySnapshot snapshot,
    String studyId
) {
}
