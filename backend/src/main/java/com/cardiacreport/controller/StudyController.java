package com.cardiacreport.controller;

import com.cardiacreport.dto.request.LetterRequest;
import com.cardiacreport.dto.response.LetterResponse;
import com.cardiacreport.dto.response.StudyDetailDto;
import com.cardiacreport.dto.response.StudySummaryDto;
import com.cardiacreport.model.enums.StudyType;
import com.cardiacreport.model.snapshot.StudySnapshot;
import com.cardiacreport.service.StudyReportService;
import com.cardiacreport.service.StudySnapshotService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for stored studies and patient letters.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StudyController {

    private final StudySnapshotService snapshotService;
    private final StudyReportService studyReportService;

    /**
     * Store a snapshot produced elsewhere, e.g. an exported study.
     */
    @PostMapping("/studies/{studyType}/from-snapshot")
    public ResponseEntity<StudySummaryDto> saveSnapshot(
            @PathVariable String studyType,
            @RequestParam(required = false) String performedOn,
            @RequestBody StudySnapshot snapshot) {
        StudyType type = StudyType.fromValue(studyType);
        log.info("Importing {} snapshot", type.getValue());
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshotService.save(type, snapshot, performedOn));
    }

    @GetMapping("/studies/{id}")
    public ResponseEntity<StudyDetailDto> getStudy(@PathVariable String id) {
        return ResponseEntity.ok(snapshotService.getStudy(id));
    }

    @GetMapping("/patients/{patientId}/studies")
    public ResponseEntity<List<StudySummaryDto>> listStudies(@PathVariable String patientId) {
        log.info("Fetching studies for patient: {}", patientId);
        return ResponseEntity.ok(snapshotService.listStudies(patientId));
    }

    /**
     * Consultation letter using the newest stored full reports of the patient.
     */
    @PostMapping("/patients/{patientId}/letter")
    public ResponseEntity<LetterResponse> letterForPatient(
            @PathVariable String patientId,
            @Valid @RequestBody LetterRequest request) {
        return ResponseEntity.ok(studyReportService.letterForPatient(patientId, request));
    }
}
