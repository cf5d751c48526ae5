package com.cardiacreport.model.metrics;

import com.cardiacreport.model.enums.AorticSegment;

/**
 * One measured aortic segment with its indexed size and predicted normal range.
 * Indexed value and bounds are null when BSA or the anthropometrics are missing.
 */
public record AorticSegmentAssessment(
    AorticSegment segment,
    double diameter,
    Double indexed,
    Double predictedLower,
    Double predictedUpper,
    boolean dilated
) {
}
