package com.cardiacreport.service;

import com.cardiacreport.dto.response.StudyDetailDto;
import com.cardiacreport.dto.response.StudySummaryDto;
import com.cardiacreport.exception.SnapshotConversionException;
import com.cardiacreport.exception.StudyNotFoundException;
import com.cardiacreport.model.enums.ReportTextKey;
import com.cardiacreport.model.enums.StudyType;
import com.cardiacreport.model.record.StudyRecord;
import com.cardiacreport.model.snapshot.StudySnapshot;
import com.cardiacreport.repository.StudyRecordRepository;
import com.cardiacreport.util.ReportFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Study Snapshot Service
 *
 * Converts snapshots between JSON and records and stores them:
 * - one StudyRecord per saved study, snapshot kept as JSON text
 * - lookups by id and by patient
 * - latest full report per study type for the consultation letter
 */
@Slf4j
@Service
public class StudySnapshotService {

    private static final Map<StudyType, ReportTextKey> FULL_REPORT_KEYS = Map.of(
        StudyType.ECG, ReportTextKey.FULL_ECG,
        StudyType.FIETSTEST, ReportTextKey.FULL_FIETSTEST,
        StudyType.ECHO, ReportTextKey.FULL_ECHO,
        StudyType.HOLTER, ReportTextKey.FULL_HOLTER,
        StudyType.CIED, ReportTextKey.FULL_CIED
    );

    /**
     * Latest stored full reports of a patient with their study dates.
     */
    public record StoredReports(Map<ReportTextKey, String> texts, Map<ReportTextKey, String> performedOn) {
        public boolean isEmpty() {
            return texts.isEmpty();
        }
    }

    private final StudyRecordRepository studyRecordRepository;
    private final ObjectMapper objectMapper;

    public StudySnapshotService(StudyRecordRepository studyRecordRepository, ObjectMapper objectMapper) {
        this.studyRecordRepository = studyRecordRepository;
        this.objectMapper = objectMapper;
    }

    // ========================================================================
    // JSON conversion
    // ========================================================================

    public String toJson(StudySnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotConversionException("Failed to serialize study snapshot", e);
        }
    }

    public StudySnapshot fromJson(String json) {
        try {
            return objectMapper.readValue(json, StudySnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotConversionException("Failed to read study snapshot: " + e.getOriginalMessage(), e);
        }
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    @Transactional
    public StudySummaryDto save(StudyType studyType, StudySnapshot snapshot, String performedOn) {
        if (studyType == null) {
            throw new IllegalArgumentException("Study type is required");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot is required");
        }

        String patientId = snapshot.patient() != null ? snapshot.patient().patientId() : null;
        StudyRecord record = new StudyRecord(
            UUID.randomUUID().toString(),
            patientId,
            studyType,
            ReportFormat.hasText(performedOn) ? performedOn.trim() : null,
            toJson(snapshot));
        StudyRecord saved = studyRecordRepository.save(record);

        log.info("Stored {} study {} for patient {}", studyType.getValue(), saved.getId(), patientId);
        return toSummary(saved);
    }

    @Transactional(readOnly = true)
    public StudyDetailDto getStudy(String id) {
        StudyRecord record = studyRecordRepository.findById(id)
            .orElseThrow(() -> new StudyNotFoundException(id));
        return new StudyDetailDto(
            record.getId(),
            record.getPatientId(),
            record.getStudyType(),
            record.getPerformedOn(),
            record.getCreatedAt(),
            fromJson(record.getSnapshotJson()));
    }

    @Transactional(readOnly = true)
    public List<StudySummaryDto> listStudies(String patientId) {
        return studyRecordRepository.findSummariesByPatientId(patientId);
    }

    /**
     * Collect the newest stored full report per study type for a patient.
     */
    @Transactional(readOnly = true)
    public StoredReports latestFullReports(String patientId) {
        Map<ReportTextKey, String> texts = new EnumMap<>(ReportTextKey.class);
        Map<ReportTextKey, String> performedOn = new EnumMap<>(ReportTextKey.class);

        FULL_REPORT_KEYS.forEach((studyType, key) ->
            studyRecordRepository.findFirstByPatientIdAndStudyTypeOrderByCreatedAtDesc(patientId, studyType)
                .ifPresent(record -> {
                    String text = fromJson(record.getSnapshotJson()).reportText(key.getKey());
                    if (!ReportFormat.hasText(text)) return;
                    texts.put(key, text);
                    if (record.getPerformedOn() != null) {
                        performedOn.put(key, record.getPerformedOn());
                    }
                }));

        log.debug("Found {} stored full report(s) for patient {}", texts.size(), patientId);
        return new StoredReports(texts, performedOn);
    }

    private static StudySummaryDto toSummary(StudyRecord record) {
        return new StudySummaryDto(
            record.getId(),
            record.getPatientId(),
            record.getStudyType(),
            record.getPerformedOn(),
            record.getCreatedAt());
    }
}
