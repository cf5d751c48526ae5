package com.cardiacreport.controller;

import com.cardiacreport.dto.request.LetterRequest;
import com.cardiacreport.dto.request.StudyReportRequest;
import com.cardiacreport.dto.response.LetterResponse;
import com.cardiacreport.dto.response.StudyReportResponse;
import com.cardiacreport.exception.StorageNotAuthorizedException;
import com.cardiacreport.model.metrics.CiedMetrics;
import com.cardiacreport.model.metrics.EcgMetrics;
import com.cardiacreport.model.metrics.EchoMetrics;
import com.cardiacreport.model.metrics.FietstestMetrics;
import com.cardiacreport.model.metrics.HolterMetrics;
import com.cardiacreport.model.study.CiedMeasurements;
import com.cardiacreport.model.study.EcgMeasurements;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.model.study.FietstestMeasurements;
import com.cardiacreport.model.study.HolterMeasurements;
import com.cardiacreport.service.StudyReportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;

/**
 * REST controller for report composition.
 * Every endpoint returns metrics and report texts; the snapshot is stored
 * only when the request sets persist. Composition is open, storing needs a
 * logged-in user while authentication is enabled.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final StudyReportService studyReportService;

    @Value("${security.auth.enabled:true}")
    private boolean authEnabled;

    @PostMapping("/echo")
    public ResponseEntity<StudyReportResponse<EchoMetrics>> echo(
            @Valid @RequestBody StudyReportRequest<EchoMeasurements> request,
            Principal principal) {
        requireUserToStore(request.persist(), principal);
        log.debug("Echo report requested");
        return ResponseEntity.ok(studyReportService.echo(request));
    }

    @PostMapping("/fietstest")
    public ResponseEntity<StudyReportResponse<FietstestMetrics>> fietstest(
            @Valid @RequestBody StudyReportRequest<FietstestMeasurements> request,
            Principal principal) {
        requireUserToStore(request.persist(), principal);
        log.debug("Fietstest report requested");
        return ResponseEntity.ok(studyReportService.fietstest(request));
    }

    @PostMapping("/ecg")
    public ResponseEntity<StudyReportResponse<EcgMetrics>> ecg(
            @Valid @RequestBody StudyReportRequest<EcgMeasurements> request,
            Principal principal) {
        requireUserToStore(request.persist(), principal);
        log.debug("ECG report requested");
        return ResponseEntity.ok(studyReportService.ecg(request));
    }

    @PostMapping("/holter")
    public ResponseEntity<StudyReportResponse<HolterMetrics>> holter(
            @Valid @RequestBody StudyReportRequest<HolterMeasurements> request,
            Principal principal) {
        requireUserToStore(request.persist(), principal);
        log.debug("Holter report requested");
        return ResponseEntity.ok(studyReportService.holter(request));
    }

    @PostMapping("/cied")
    public ResponseEntity<StudyReportResponse<CiedMetrics>> cied(
            @Valid @RequestBody StudyReportRequest<CiedMeasurements> request,
            Principal principal) {
        requireUserToStore(request.persist(), principal);
        log.debug("Device follow-up report requested");
        return ResponseEntity.ok(studyReportService.cied(request));
    }

    /**
     * Consultation letter from the sections in the request.
     */
    @PostMapping("/letter")
    public ResponseEntity<LetterResponse> letter(
            @Valid @RequestBody LetterRequest request,
            Principal principal) {
        requireUserToStore(request.persist(), principal);
        return ResponseEntity.ok(studyReportService.letter(request));
    }

    private void requireUserToStore(boolean persist, Principal principal) {
        if (persist && authEnabled && principal == null) throw new StorageNotAuthorizedException();
    }
}
