package com.cardiacreport.service;

import com.cardiacreport.dto.mapper.StudyInputMapper;
import com.cardiacreport.dto.request.LetterRequest;
import com.cardiacreport.dto.request.StudyReportRequest;
import com.cardiacreport.dto.response.LetterResponse;
import com.cardiacreport.dto.response.StudyReportResponse;
import com.cardiacreport.dto.response.StudySummaryDto;
import com.cardiacreport.model.enums.ReportTextKey;
import com.cardiacreport.model.enums.StudyType;
import com.cardiacreport.model.letter.InvestigationSection;
import com.cardiacreport.model.metrics.CiedMetrics;
import com.cardiacreport.model.metrics.EcgMetrics;
import com.cardiacreport.model.metrics.EchoMetrics;
import com.cardiacreport.model.metrics.FietstestMetrics;
import com.cardiacreport.model.metrics.HolterMetrics;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.snapshot.StudySnapshot;
import com.cardiacreport.model.study.CiedMeasurements;
import com.cardiacreport.model.study.EcgMeasurements;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.model.study.FietstestMeasurements;
import com.cardiacreport.model.study.HolterMeasurements;
import com.cardiacreport.service.metrics.CiedMetricsService;
import com.cardiacreport.service.metrics.EcgMetricsService;
import com.cardiacreport.service.metrics.EchoMetricsService;
import com.cardiacreport.service.metrics.FietstestMetricsService;
import com.cardiacreport.service.metrics.HolterMetricsService;
import com.cardiacreport.service.report.CiedReportService;
import com.cardiacreport.service.report.ConsultationLetterService;
import com.cardiacreport.service.report.EcgReportService;
import com.cardiacreport.service.report.EchoReportService;
import com.cardiacreport.service.report.FietstestReportService;
import com.cardiacreport.service.report.GuidelineRecommendationService;
import com.cardiacreport.service.report.HolterReportService;
import com.cardiacreport.util.ReportFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Study Report Service
 *
 * Entry point for the REST layer. Per request it:
 * - maps the patient once at the boundary
 * - computes metrics and composes the full and brief reports
 * - builds the snapshot and stores it when asked
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudyReportService {

    private final StudyInputMapper inputMapper;
    private final StudySnapshotService snapshotService;

    private final EchoMetricsService echoMetricsService;
    private final FietstestMetricsService fietstestMetricsService;
    private final EcgMetricsService ecgMetricsService;
    private final HolterMetricsService holterMetricsService;
    private final CiedMetricsService ciedMetricsService;

    private final EchoReportService echoReportService;
    private final FietstestReportService fietstestReportService;
    private final EcgReportService ecgReportService;
    private final HolterReportService holterReportService;
    private final CiedReportService ciedReportService;
    private final GuidelineRecommendationService guidelineService;
    private final ConsultationLetterService letterService;

    // ========================================================================
    // Study reports
    // ========================================================================

    public StudyReportResponse<EchoMetrics> echo(StudyReportRequest<EchoMeasurements> request) {
        PatientContext patient = inputMapper.toPatientContext(request.patient());
        EchoMeasurements m = request.measurements().toBuilder().patient(patient).build();

        EchoMetrics metrics = echoMetricsService.compute(m);
        String full = echoReportService.composeFullReport(m, metrics);
        String brief = echoReportService.composeBrief(m, metrics);
        List<String> recommendations = guidelineService.recommend(m, metrics);

        StudySnapshot snapshot = StudySnapshot.builder()
            .patient(patient)
            .echo(m)
            .reportTexts(texts(ReportTextKey.FULL_ECHO, full, ReportTextKey.BRIEF_ECHO, brief))
            .build();
        log.info("Composed echo report ({} recommendation(s))", recommendations.size());
        return new StudyReportResponse<>(metrics, full, brief, recommendations, snapshot,
            store(StudyType.ECHO, snapshot, request));
    }

    public StudyReportResponse<FietstestMetrics> fietstest(StudyReportRequest<FietstestMeasurements> request) {
        PatientContext patient = inputMapper.toPatientContext(request.patient());
        FietstestMeasurements m = request.measurements().toBuilder().patient(patient).build();

        FietstestMetrics metrics = fietstestMetricsService.compute(m);
        if (!ReportFormat.hasText(m.effortType())) {
            m = m.toBuilder().effortType(fietstestMetricsService.suggestEffortType(m, metrics)).build();
        }
        String full = fietstestReportService.composeFullReport(m, metrics);
        String brief = fietstestReportService.composeBrief(m, metrics);

        StudySnapshot snapshot = StudySnapshot.builder()
            .patient(patient)
            .fietstest(m)
            .reportTexts(texts(ReportTextKey.FULL_FIETSTEST, full, ReportTextKey.BRIEF_FIETSTEST, brief))
            .build();
        log.info("Composed fietstest report");
        return new StudyReportResponse<>(metrics, full, brief, null, snapshot,
            store(StudyType.FIETSTEST, snapshot, request));
    }

    public StudyReportResponse<EcgMetrics> ecg(StudyReportRequest<EcgMeasurements> request) {
        PatientContext patient = inputMapper.toPatientContext(request.patient());
        EcgMeasurements m = request.measurements().toBuilder().patient(patient).build();

        EcgMetrics metrics = ecgMetricsService.compute(m);
        String full = ecgReportService.composeFullReport(m, metrics);
        String brief = ecgReportService.composeBrief(m, metrics);

        StudySnapshot snapshot = StudySnapshot.builder()
            .patient(patient)
            .ecg(m)
            .reportTexts(texts(ReportTextKey.FULL_ECG, full, ReportTextKey.BRIEF_ECG, brief))
            .build();
        log.info("Composed ECG report");
        return new StudyReportResponse<>(metrics, full, brief, null, snapshot,
            store(StudyType.ECG, snapshot, request));
    }

    public StudyReportResponse<HolterMetrics> holter(StudyReportRequest<HolterMeasurements> request) {
        PatientContext patient = inputMapper.toPatientContext(request.patient());
        HolterMeasurements m = request.measurements().toBuilder().patient(patient).build();

        HolterMetrics metrics = holterMetricsService.compute(m);
        String full = holterReportService.composeFullReport(m, metrics);
        String brief = holterReportService.composeBrief(m, metrics);

        StudySnapshot snapshot = StudySnapshot.builder()
            .patient(patient)
            .holter(m)
            .reportTexts(texts(ReportTextKey.FULL_HOLTER, full, ReportTextKey.BRIEF_HOLTER, brief))
            .build();
        log.info("Composed Holter report");
        return new StudyReportResponse<>(metrics, full, brief, null, snapshot,
            store(StudyType.HOLTER, snapshot, request));
    }

    /**
     * Device follow-up has no brief form.
     */
    public StudyReportResponse<CiedMetrics> cied(StudyReportRequest<CiedMeasurements> request) {
        PatientContext patient = inputMapper.toPatientContext(request.patient());
        CiedMeasurements m = request.measurements().toBuilder().patient(patient).build();

        CiedMetrics metrics = ciedMetricsService.compute(m);
        String full = ciedReportService.composeFullReport(m, metrics);

        StudySnapshot snapshot = StudySnapshot.builder()
            .patient(patient)
            .cied(m)
            .reportTexts(Map.of(ReportTextKey.FULL_CIED.getKey(), full))
            .build();
        log.info("Composed device follow-up report");
        return new StudyReportResponse<>(metrics, full, null, null, snapshot,
            store(StudyType.CIED, snapshot, request));
    }

    // ========================================================================
    // Consultation letter
    // ========================================================================

    public LetterResponse letter(LetterRequest request) {
        return composeLetter(request, request.investigations(), null);
    }

    /**
     * Letter for a stored patient, using the newest stored full report of each study type.
     */
    public LetterResponse letterForPatient(String patientId, LetterRequest request) {
        StudySnapshotService.StoredReports stored = snapshotService.latestFullReports(patientId);
        if (stored.isEmpty()) {
            log.warn("No stored full reports for patient {}, letter has no investigations", patientId);
        }
        List<InvestigationSection> sections = letterService.sectionsFromReports(stored.texts(), stored.performedOn());
        return composeLetter(request, sections, patientId);
    }

    private LetterResponse composeLetter(LetterRequest request, List<InvestigationSection> sections, String patientId) {
        String letter = letterService.compose(
            request.consultDate(),
            request.voorgeschiedenis(),
            request.anamnese(),
            request.thuismedicatie(),
            request.clinicalExam(),
            sections,
            request.bespreking());

        Map<String, String> texts = new LinkedHashMap<>();
        texts.put(ReportTextKey.BRIEF_LETTER.getKey(), letter);
        putIfPresent(texts, ReportTextKey.BRIEF_VOORGESCHIEDENIS, request.voorgeschiedenis());
        putIfPresent(texts, ReportTextKey.BRIEF_ANAMNESE, request.anamnese());
        putIfPresent(texts, ReportTextKey.BRIEF_THUISMEDICATIE, request.thuismedicatie());
        putIfPresent(texts, ReportTextKey.BRIEF_BESPREKING, request.bespreking());

        PatientContext patient = inputMapper.toPatientContext(request.patient());
        if (patientId != null) {
            // letter is filed under the patient it was composed for
            patient = (patient != null ? patient.toBuilder() : PatientContext.builder()).patientId(patientId).build();
        }
        StudySnapshot snapshot = StudySnapshot.builder()
            .patient(patient)
            .reportTexts(texts)
            .build();

        String studyId = null;
        if (request.persist()) {
            String performedOn = request.consultDate() != null ? request.consultDate().toString() : null;
            studyId = snapshotService.save(StudyType.BRIEF, snapshot, performedOn).id();
        }
        log.info("Composed consultation letter with {} investigation(s)", sections != null ? sections.size() : 0);
        return new LetterResponse(letter, snapshot, studyId);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private String store(StudyType studyType, StudySnapshot snapshot, StudyReportRequest<?> request) {
        if (!request.persist()) return null;
        StudySummaryDto saved = snapshotService.save(studyType, snapshot, request.performedOn());
        return saved.id();
    }

    private static Map<String, String> texts(ReportTextKey fullKey, String full, ReportTextKey briefKey, String brief) {
        Map<String, String> texts = new LinkedHashMap<>();
        texts.put(fullKey.getKey(), full);
        texts.put(briefKey.getKey(), brief);
        return texts;
    }

    private static void putIfPresent(Map<String, String> texts, ReportTextKey key, String value) {
        if (ReportFormat.hasText(value)) texts.put(key.getKey(), value);
    }
}
