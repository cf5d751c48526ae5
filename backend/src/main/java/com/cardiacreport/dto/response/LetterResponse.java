package com.cardiacreport.dto.response;

import com.cardiacreport.model.snapshot.StudySnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LetterResponse(
    String letter,
    StudySnapshot snapshot,
    String studyId
) {
}
