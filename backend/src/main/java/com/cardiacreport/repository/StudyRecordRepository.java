package com.cardiacreport.repository;

import com.cardiacreport.dto.response.StudySummaryDto;
import com.cardiacreport.model.enums.StudyType;
import com.cardiacreport.model.record.StudyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for stored studies.
 */
@Repository
public interface StudyRecordRepository extends JpaRepository<StudyRecord, String> {

    /**
     * Latest study of a type for a patient, used to assemble the letter.
     */
    Optional<StudyRecord> findFirstByPatientIdAndStudyTypeOrderByCreatedAtDesc(String patientId, StudyType studyType);

    /**
     * Study summaries for a patient without the snapshot column, newest first.
     */
    @Query("""
        SELECT new com.cardiacreport.dto.response.StudySummaryDto(
            s.id, s.patientId, s.studyType, s.performedOn, s.createdAt
        )
        FROM StudyRecord s
        WHERE s.patientId = :patientId
        ORDER BY s.createdAt DESC
        """)
    List<StudySummaryDto> findSummariesByPatientId(@Param("patientId") String patientId);
}
