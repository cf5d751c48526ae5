package com.cardiacreport.dto.mapper;

import com.cardiacreport.dto.request.PatientRequest;
import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.util.BodySurfaceArea;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Component;

/**
 * Single coercion step from request payloads to the typed patient record.
 */
@Component
public class StudyInputMapper {

    public PatientContext toPatientContext(PatientRequest request) {
        if (request == null) {
            return null;
        }

        Double bsa = request.bsa();
        if (request.length() != null && request.weight() != null) {
            Double computed = BodySurfaceArea.mosteller(request.length(), request.weight());
            if (computed != null) {
                bsa = ReportFormat.round(computed, 2);
            }
        }

        return PatientContext.builder()
            .sex(Sex.fromValue(request.sex()))
            .patientId(blankToNull(request.patientId()))
            .fullName(blankToNull(request.fullName()))
            .dateOfBirth(blankToNull(request.dateOfBirth()))
            .age(request.age())
            .bsa(bsa)
            .weight(request.weight())
            .length(request.length())
            .build();
    }

    private static String blankToNull(String value) {
        return ReportFormat.hasText(value) ? value.trim() : null;
    }
}
