package com.cardiacreport.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class ReportControllerTest {

    private static final String PATIENT = "{\"sex\":\"man\",\"age\":60,\"length\":175,\"weight\":75}";

    @Autowired
    private MockMvc mockMvc;

    private static String request(String patient, String measurements) {
        return "{\"patient\":" + patient + ",\"measurements\":" + measurements + "}";
    }

    @Test
    public void testEcho_ComposesReportsWithoutStoring() throws Exception {
        String body = request(PATIENT,
            "{\"lvef\":\"60\",\"ivsd\":9,\"lvpw\":9,\"lvidd\":\"48,0\",\"akVmax\":4.3}");

        mockMvc.perform(post("/api/reports/echo").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullReport", startsWith("LV: ")))
            .andExpect(jsonPath("$.briefReport", containsString("AK: Ernstige stenose")))
            .andExpect(jsonPath("$.recommendations[0]").value("Ernstige aortaklepstenose vastgesteld."))
            .andExpect(jsonPath("$.metrics.bsa").value(1.91))
            .andExpect(jsonPath("$.snapshot.patient.sex").value("Man"))
            .andExpect(jsonPath("$.snapshot.report_texts.full_echo").exists())
            .andExpect(jsonPath("$.snapshot.report_texts.brief_echo").exists())
            .andExpect(jsonPath("$.studyId").doesNotExist());
    }

    @Test
    public void testEcho_MissingSexIsRejected() throws Exception {
        mockMvc.perform(post("/api/reports/echo").contentType(MediaType.APPLICATION_JSON)
                .content(request("{\"age\":60}", "{}")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Error"));
    }

    @Test
    public void testEcho_UnknownSexIsRejected() throws Exception {
        mockMvc.perform(post("/api/reports/echo").contentType(MediaType.APPLICATION_JSON)
                .content(request("{\"sex\":\"x\"}", "{}")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details", containsString("Sex must be Man or Vrouw")));
    }

    @Test
    public void testEcho_MalformedJson() throws Exception {
        mockMvc.perform(post("/api/reports/echo").contentType(MediaType.APPLICATION_JSON).content("{\"patient\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("JSON Processing Error"));
    }

    @Test
    public void testFietstest_SuggestsEffortType() throws Exception {
        mockMvc.perform(post("/api/reports/fietstest").contentType(MediaType.APPLICATION_JSON)
                .content(request(PATIENT, "{\"startWatt\":20,\"incrementWatt\":20,\"maxWatt\":160,\"maxHr\":120}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullReport", containsString("Submaximale inspanning.")))
            .andExpect(jsonPath("$.snapshot.fietstest.effortType").value("Submaximale inspanning"))
            .andExpect(jsonPath("$.recommendations").doesNotExist());
    }

    @Test
    public void testEcg() throws Exception {
        mockMvc.perform(post("/api/reports/ecg").contentType(MediaType.APPLICATION_JSON)
                .content(request(PATIENT, "{\"ventRate\":110,\"qtIntervalMs\":360,\"qrsAxisDeg\":-45}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metrics.tachycardia").value(true))
            .andExpect(jsonPath("$.briefReport", startsWith("ECG: HF 110 bpm")));
    }

    @Test
    public void testHolter() throws Exception {
        mockMvc.perform(post("/api/reports/holter").contentType(MediaType.APPLICATION_JSON)
                .content(request(PATIENT, "{\"recordingDurationHours\":24,\"avgHr\":70,\"minHr\":45,\"maxHr\":110}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullReport", endsWith("- Geen afwijkingen geregistreerd tijdens Holter-monitoring")))
            .andExpect(jsonPath("$.briefReport").value("Holter-monitoring (24u); Gem. HR: 70 bpm"));
    }

    @Test
    public void testCied_HasNoBrief() throws Exception {
        mockMvc.perform(post("/api/reports/cied").contentType(MediaType.APPLICATION_JSON)
                .content(request(PATIENT, "{\"deviceType\":\"Pacemaker\",\"lowerRate\":60,\"upperTracking\":130}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fullReport", startsWith("Conclusie:")))
            .andExpect(jsonPath("$.briefReport").doesNotExist())
            .andExpect(jsonPath("$.snapshot.report_texts.full_cied").exists())
            .andExpect(jsonPath("$.metrics.upperTrackingSuggestion").value(141));
    }

    @Test
    public void testLetter() throws Exception {
        String body = "{\"consultDate\":\"2024-03-05\",\"anamnese\":\"Geen klachten\","
            + "\"clinicalExam\":{\"pulse\":72},"
            + "\"investigations\":[{\"label\":\"ECG\",\"text\":\"Sinusritme\"}]}";

        mockMvc.perform(post("/api/reports/letter").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.letter", startsWith("Geachte collega")))
            .andExpect(jsonPath("$.letter", containsString("Elektrocardiogram in rust")))
            .andExpect(jsonPath("$.letter", endsWith("Dr. Test Cardiologie\n")))
            .andExpect(jsonPath("$.snapshot.report_texts.brief_anamnese").value("Geen klachten"))
            .andExpect(jsonPath("$.snapshot.report_texts.brief_bespreking").doesNotExist());
    }

    @Test
    public void testPersist_AnonymousCallerIsRefused() throws Exception {
        String body = "{\"patient\":" + PATIENT + ",\"measurements\":{\"lvef\":60},\"persist\":true}";

        mockMvc.perform(post("/api/reports/echo").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Unauthorized"));
        mockMvc.perform(post("/api/reports/letter").contentType(MediaType.APPLICATION_JSON)
                .content("{\"bespreking\":\"Controle\",\"persist\":true}"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser
    public void testPersist_LoggedInCallerStores() throws Exception {
        String body = "{\"patient\":" + PATIENT + ",\"measurements\":{\"lvef\":60},\"persist\":true}";

        mockMvc.perform(post("/api/reports/echo").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.studyId").exists());
    }
}
