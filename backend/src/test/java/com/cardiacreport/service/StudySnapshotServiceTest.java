package com.cardiacreport.service;

import com.cardiacreport.config.MeasurementJsonModule;
import com.cardiacreport.dto.response.StudyDetailDto;
import com.cardiacreport.dto.response.StudySummaryDto;
import com.cardiacreport.exception.SnapshotConversionException;
import com.cardiacreport.exception.StudyNotFoundException;
import com.cardiacreport.model.enums.ReportTextKey;
import com.cardiacreport.model.enums.Sex;
import com.cardiacreport.model.enums.StudyType;
import com.cardiacreport.model.patient.PatientContext;
import com.cardiacreport.model.record.StudyRecord;
import com.cardiacreport.model.snapshot.StudySnapshot;
import com.cardiacreport.model.study.EchoMeasurements;
import com.cardiacreport.model.study.HolterMeasurements;
import com.cardiacreport.repository.StudyRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class StudySnapshotServiceTest {

    @Mock
    private StudyRecordRepository studyRecordRepository;

    private StudySnapshotService service;

    @BeforeEach
    public void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new MeasurementJsonModule());
        service = new StudySnapshotService(studyRecordRepository, objectMapper);
    }

    private static StudySnapshot echoSnapshot() {
        PatientContext patient = PatientContext.builder()
            .sex(Sex.VROUW).patientId("P-001").age(64.0).length(165.0).weight(60.0).bsa(1.66).build();
        return StudySnapshot.builder()
            .patient(patient)
            .echo(EchoMeasurements.builder().patient(patient).lvef(58.0).ivsd(9.0).cvd("3").build())
            .reportTexts(Map.of("full_echo", "LV: Normotroof.", "brief_echo", "LVEF 58%."))
            .build();
    }

    @Test
    public void testJsonRoundTrip_PreservesSnapshot() {
        StudySnapshot snapshot = echoSnapshot();

        String json = service.toJson(snapshot);
        StudySnapshot restored = service.fromJson(json);

        assertEquals(snapshot, restored);
        assertTrue(json.contains("\"report_texts\""));
        assertFalse(json.contains("\"holter\""));
    }

    @Test
    public void testFromJson_LenientNumbersAndUnknownFields() {
        String json = "{\"patient\":{\"sex\":\"vrouw\",\"age\":\"64,5\"},"
            + "\"holter\":{\"avgHr\":\"72\",\"minHr\":\"n/a\",\"extra\":1},"
            + "\"report_texts\":{\"full_holter\":\"tekst\"}}";

        StudySnapshot snapshot = service.fromJson(json);

        assertEquals(Sex.VROUW, snapshot.patient().sex());
        assertEquals(64.5, snapshot.patient().age());
        assertEquals(72, snapshot.holter().avgHr());
        assertNull(snapshot.holter().minHr());
        assertEquals("tekst", snapshot.reportText("full_holter"));
    }

    @Test
    public void testFromJson_MalformedThrows() {
        assertThrows(SnapshotConversionException.class, () -> service.fromJson("{not json"));
    }

    @Test
    public void testSave_StoresJsonAndPatientId() {
        when(studyRecordRepository.save(any(StudyRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        StudySummaryDto summary = service.save(StudyType.ECHO, echoSnapshot(), " 2024-03-01 ");

        ArgumentCaptor<StudyRecord> captor = ArgumentCaptor.forClass(StudyRecord.class);
        verify(studyRecordRepository).save(captor.capture());
        StudyRecord stored = captor.getValue();
        assertEquals("P-001", stored.getPatientId());
        assertEquals(StudyType.ECHO, stored.getStudyType());
        assertEquals("2024-03-01", stored.getPerformedOn());
        assertNotNull(stored.getId());
        assertEquals(echoSnapshot(), service.fromJson(stored.getSnapshotJson()));
        assertEquals(stored.getId(), summary.id());
    }

    @Test
    public void testSave_RequiresTypeAndSnapshot() {
        assertThrows(IllegalArgumentException.class, () -> service.save(null, echoSnapshot(), null));
        assertThrows(IllegalArgumentException.class, () -> service.save(StudyType.ECHO, null, null));
        verifyNoInteractions(studyRecordRepository);
    }

    @Test
    public void testGetStudy_NotFound() {
        when(studyRecordRepository.findById("missing")).thenReturn(Optional.empty());
        assertThrows(StudyNotFoundException.class, () -> service.getStudy("missing"));
    }

    @Test
    public void testGetStudy_ReturnsSnapshot() {
        StudyRecord record = new StudyRecord("id-1", "P-001", StudyType.ECHO, "2024-03-01", service.toJson(echoSnapshot()));
        when(studyRecordRepository.findById("id-1")).thenReturn(Optional.of(record));

        StudyDetailDto detail = service.getStudy("id-1");

        assertEquals("id-1", detail.id());
        assertEquals(StudyType.ECHO, detail.studyType());
        assertEquals(echoSnapshot(), detail.snapshot());
    }

    @Test
    public void testLatestFullReports_CollectsTextsWithDates() {
        StudyRecord echo = new StudyRecord("e", "P-001", StudyType.ECHO, "2024-03-01", service.toJson(echoSnapshot()));
        StudySnapshot holterSnapshot = StudySnapshot.builder()
            .holter(HolterMeasurements.builder().avgHr(70).build())
            .reportTexts(Map.of("brief_holter", "alleen kort"))
            .build();
        StudyRecord holter = new StudyRecord("h", "P-001", StudyType.HOLTER, null, service.toJson(holterSnapshot));

        Map<StudyType, StudyRecord> latest = Map.of(StudyType.ECHO, echo, StudyType.HOLTER, holter);
        when(studyRecordRepository.findFirstByPatientIdAndStudyTypeOrderByCreatedAtDesc(eq("P-001"), any(StudyType.class)))
            .thenAnswer(invocation -> Optional.ofNullable(latest.get(invocation.<StudyType>getArgument(1))));

        StudySnapshotService.StoredReports reports = service.latestFullReports("P-001");

        assertFalse(reports.isEmpty());
        assertEquals(Map.of(ReportTextKey.FULL_ECHO, "LV: Normotroof."), reports.texts());
        assertEquals(Map.of(ReportTextKey.FULL_ECHO, "2024-03-01"), reports.performedOn());
    }
}
