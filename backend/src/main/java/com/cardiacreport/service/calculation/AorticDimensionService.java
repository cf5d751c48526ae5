package com.cardiacreport.service.calculation;

import com.cardiacreport.model.enums.AorticSegment;
import com.cardiacreport.model.metrics.AorticSegmentAssessment;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.util.BodySurfaceArea;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Aortic root and ascending aorta sizing.
 *
 * A segment is dilated when its BSA-indexed diameter (mm/m², one decimal) exceeds
 * the segment cutoff. The predicted normal range needs age, sex, length and weight.
 */
@Service
public class AorticDimensionService {

    /**
     * Assess every measured segment, in anatomical order.
     */
    public List<AorticSegmentAssessment> assessSegments(Map<AorticSegment, Double> diameters, PatientContext patient) {
        List<AorticSegmentAssessment> result = new ArrayList<>();
        Double bsa = patient != null ? patient.bsa() : null;
        for (AorticSegment segment : AorticSegment.values()) {
            Double diameter = diameters.get(segment);
            if (diameter == null) continue;

            Double indexed = BodySurfaceArea.index(diameter, bsa, 1);
            boolean dilated = indexed != null && indexed > segment.getIndexCutoff();
            Double lower = null;
            Double upper = null;
            if (hasAnthropometrics(patient)) {
                boolean male = patient.sex().isMale();
                lower = ReportFormat.round(segment.predictLower(patient.age(), male, patient.length(), patient.weight()), 2);
                upper = ReportFormat.round(segment.predictUpper(patient.age(), male, patient.length(), patient.weight()), 2);
            }
            result.add(new AorticSegmentAssessment(segment, diameter, indexed, lower, upper, dilated));
        }
        return result;
    }

    /**
     * Largest absolute diameter over the measured segments, or null when none was measured.
     */
    public Double maxDiameter(List<AorticSegmentAssessment> segments) {
        return segments.stream()
            .map(AorticSegmentAssessment::diameter)
            .max(Double::compare)
            .orElse(null);
    }

    /**
     * Largest indexed diameter, or null without BSA.
     */
    public Double maxIndexed(List<AorticSegmentAssessment> segments) {
        return segments.stream()
            .map(AorticSegmentAssessment::indexed)
            .filter(v -> v != null)
            .max(Double::compare)
            .orElse(null);
    }

    private static boolean hasAnthropometrics(PatientContext patient) {
        return patient != null && patient.sex() != null && patient.age() != null
            && patient.length() != null && patient.weight() != null;
    }
}
