package com.cardiacreport.model.record;

import com.cardiacreport.model.enums.StudyType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Entity for a stored study. The snapshot is kept as JSON text; patient id and
 * study type are copied out for lookups.
 */
@Entity
@Table(name = "study_record", indexes = {
    @Index(name = "idx_study_record_patient", columnList = "patient_id")
})
@Getter
@Setter
@NoArgsConstructor
public class StudyRecord {

    @Id
    private String id;

    @Column(name = "patient_id", length = 100)
    private String patientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "study_type", nullable = false, length = 20)
    private StudyType studyType;

    @Column(name = "performed_on", length = 40)
    private String performedOn;

    @Column(name = "snapshot_json", nullable = false, columnDefinition = "TEXT")
    private String snapshotJson;

    // Audit
    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public StudyRecord(String id, String patientId, StudyType studyType, String performedOn, String snapshotJson) {
        this.id = id;
        this.patientId = patientId;
        this.studyType = studyType;
        this.performedOn = performedOn;
        this.snapshotJson = snapshotJson;
    }
}
